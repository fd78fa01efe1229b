/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.correlator;

import com.linkedin.perfinsight.exception.InvalidInputException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import static com.linkedin.perfinsight.PerfInsightUnitTestUtils.CAPACITY;
import static com.linkedin.perfinsight.PerfInsightUnitTestUtils.PERFORMANCE;
import static com.linkedin.perfinsight.PerfInsightUnitTestUtils.alert;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


public class AlertCorrelatorTest {
  @Rule
  public ExpectedException _expected = ExpectedException.none();

  private AlertCorrelator _correlator;

  @Before
  public void setUp() {
    _correlator = new AlertCorrelator();
  }

  @Test
  public void testShouldGroup() {
    Alert a = alert("a", PERFORMANCE, AlertSeverity.CRITICAL, 0);
    Alert fiveMinutesLater = alert("b", PERFORMANCE, AlertSeverity.CRITICAL, 5);
    Alert tenMinutesLater = alert("c", PERFORMANCE, AlertSeverity.CRITICAL, 10);
    Alert elevenMinutesLater = alert("d", PERFORMANCE, AlertSeverity.CRITICAL, 11);

    assertTrue(_correlator.shouldGroup(a, fiveMinutesLater));
    assertTrue(_correlator.shouldGroup(a, tenMinutesLater));
    assertFalse(_correlator.shouldGroup(a, elevenMinutesLater));
    assertTrue(_correlator.shouldGroup(a, a));
  }

  @Test
  public void testShouldGroupWithExtremeTimestamps() {
    Alert latest = new Alert("a", PERFORMANCE, AlertSeverity.CRITICAL, "latest", Long.MAX_VALUE);
    Alert beforeEpoch = new Alert("b", PERFORMANCE, AlertSeverity.CRITICAL, "before epoch", -1L);
    Alert earliest = new Alert("c", PERFORMANCE, AlertSeverity.CRITICAL, "earliest", Long.MIN_VALUE);
    assertFalse(_correlator.shouldGroup(latest, beforeEpoch));
    assertFalse(_correlator.shouldGroup(beforeEpoch, latest));
    assertFalse(_correlator.shouldGroup(earliest, latest));
    assertTrue(_correlator.shouldGroup(latest, latest));
    assertTrue(_correlator.shouldGroup(earliest, new Alert("d", PERFORMANCE, AlertSeverity.CRITICAL, "d",
                                                            Long.MIN_VALUE + 60000L)));
  }

  @Test
  public void testShouldGroupRequiresSameTypeAndSeverity() {
    Alert a = alert("a", PERFORMANCE, AlertSeverity.CRITICAL, 0);
    assertFalse(_correlator.shouldGroup(a, alert("b", CAPACITY, AlertSeverity.CRITICAL, 1)));
    assertFalse(_correlator.shouldGroup(a, alert("c", PERFORMANCE, AlertSeverity.ERROR, 1)));
  }

  @Test
  public void testShouldGroupIsSymmetric() {
    List<Alert> alerts = Arrays.asList(alert("a", PERFORMANCE, AlertSeverity.CRITICAL, 0),
                                       alert("b", PERFORMANCE, AlertSeverity.CRITICAL, 7),
                                       alert("c", PERFORMANCE, AlertSeverity.CRITICAL, 20),
                                       alert("d", PERFORMANCE, AlertSeverity.WARNING, 3),
                                       alert("e", CAPACITY, AlertSeverity.CRITICAL, 2));
    for (Alert a : alerts) {
      for (Alert b : alerts) {
        assertEquals(_correlator.shouldGroup(a, b), _correlator.shouldGroup(b, a));
      }
    }
  }

  @Test
  public void testShouldGroupWithNullAlert() {
    _expected.expect(IllegalArgumentException.class);
    _correlator.shouldGroup(alert("a", PERFORMANCE, AlertSeverity.CRITICAL, 0), null);
  }

  @Test
  public void testShouldGroupWithConfiguredWindow() {
    AlertCorrelator correlator = new AlertCorrelator(new AlertCorrelatorConfig(
        Collections.singletonMap(AlertCorrelatorConfig.ALERT_GROUPING_WINDOW_MS_CONFIG, "60000")));
    assertFalse(correlator.shouldGroup(alert("a", PERFORMANCE, AlertSeverity.CRITICAL, 0),
                                       alert("b", PERFORMANCE, AlertSeverity.CRITICAL, 5)));
  }

  @Test
  public void testClusterChainsThroughMostRecentMember() {
    // c is 12 minutes after a, but only 7 minutes after b which joined the group before it.
    List<Alert> alerts = Arrays.asList(alert("a", PERFORMANCE, AlertSeverity.CRITICAL, 0),
                                       alert("b", PERFORMANCE, AlertSeverity.CRITICAL, 5),
                                       alert("c", PERFORMANCE, AlertSeverity.CRITICAL, 12));
    List<AlertGroup> groups = _correlator.clusterAlerts(alerts);
    assertEquals(1, groups.size());
    assertEquals(alerts, groups.get(0).alerts());
  }

  @Test
  public void testClusterSplitsOnGap() {
    List<Alert> alerts = Arrays.asList(alert("a", PERFORMANCE, AlertSeverity.CRITICAL, 0),
                                       alert("b", PERFORMANCE, AlertSeverity.CRITICAL, 5),
                                       alert("c", PERFORMANCE, AlertSeverity.CRITICAL, 16));
    List<AlertGroup> groups = _correlator.clusterAlerts(alerts);
    assertEquals(2, groups.size());
    assertEquals(2, groups.get(0).size());
    assertEquals("c", groups.get(1).anchor().id());
  }

  @Test
  public void testClusterSeparatesTypesAndSeverities() {
    List<Alert> alerts = Arrays.asList(alert("a", PERFORMANCE, AlertSeverity.CRITICAL, 0),
                                       alert("b", CAPACITY, AlertSeverity.CRITICAL, 1),
                                       alert("c", PERFORMANCE, AlertSeverity.WARNING, 2),
                                       alert("d", PERFORMANCE, AlertSeverity.CRITICAL, 3),
                                       alert("e", CAPACITY, AlertSeverity.CRITICAL, 4));
    List<AlertGroup> groups = _correlator.clusterAlerts(alerts);
    assertEquals(3, groups.size());
    assertEquals(Arrays.asList("a", "d"), ids(groups.get(0)));
    assertEquals(Arrays.asList("b", "e"), ids(groups.get(1)));
    assertEquals(Collections.singletonList("c"), ids(groups.get(2)));
  }

  @Test
  public void testClusterSortsByTimestampStably() {
    List<Alert> alerts = Arrays.asList(alert("late", PERFORMANCE, AlertSeverity.ERROR, 30),
                                       alert("first", PERFORMANCE, AlertSeverity.ERROR, 0),
                                       alert("tie1", PERFORMANCE, AlertSeverity.ERROR, 4),
                                       alert("tie2", PERFORMANCE, AlertSeverity.ERROR, 4));
    List<Alert> input = new ArrayList<>(alerts);
    List<AlertGroup> groups = _correlator.clusterAlerts(input);

    assertEquals(alerts, input);
    assertEquals(2, groups.size());
    assertEquals(Arrays.asList("first", "tie1", "tie2"), ids(groups.get(0)));
    assertEquals(Collections.singletonList("late"), ids(groups.get(1)));
  }

  @Test
  public void testClusterEveryAlertInExactlyOneGroup() {
    List<Alert> alerts = new ArrayList<>();
    for (int i = 0; i < 50; i++) {
      AlertSeverity severity = AlertSeverity.cachedValues().get(i % AlertSeverity.cachedValues().size());
      alerts.add(alert("alert-" + i, i % 3 == 0 ? CAPACITY : PERFORMANCE, severity, i * 2.5));
    }
    List<AlertGroup> groups = _correlator.clusterAlerts(alerts);
    List<Alert> clustered = new ArrayList<>();
    for (AlertGroup group : groups) {
      List<Alert> members = group.alerts();
      for (int i = 1; i < members.size(); i++) {
        assertTrue(_correlator.shouldGroup(members.get(i - 1), members.get(i)));
      }
      clustered.addAll(members);
    }
    assertEquals(alerts.size(), clustered.size());
    assertTrue(clustered.containsAll(alerts));
  }

  @Test
  public void testClusterEmptyAndNullStream() {
    assertTrue(_correlator.clusterAlerts(Collections.emptyList()).isEmpty());
    assertThrows(IllegalArgumentException.class, () -> _correlator.clusterAlerts(null));
  }

  @Test
  public void testSummarizeGroup() throws InvalidInputException {
    List<Alert> group = Arrays.asList(alert("a", PERFORMANCE, AlertSeverity.CRITICAL, 0),
                                      alert("b", PERFORMANCE, AlertSeverity.CRITICAL, 5));
    assertEquals("[Alert Group] 2 alerts of type performance (severity: critical) from 2021-03-05T21:01:38Z to "
                 + "2021-03-05T21:06:38Z: message of b", _correlator.summarizeGroup(group));
  }

  @Test
  public void testSummarizeSingleton() throws InvalidInputException {
    List<Alert> group = Collections.singletonList(alert("a", CAPACITY, AlertSeverity.WARNING, 0));
    assertEquals("[Alert Group] 1 alert of type capacity (severity: warning) from 2021-03-05T21:01:38Z to "
                 + "2021-03-05T21:01:38Z: message of a", _correlator.summarizeGroup(group));
  }

  @Test
  public void testSummarizeUsesLatestAlertMessage() throws InvalidInputException {
    List<Alert> group = Arrays.asList(alert("b", PERFORMANCE, AlertSeverity.ERROR, 5),
                                      alert("a", PERFORMANCE, AlertSeverity.ERROR, 0));
    String summary = _correlator.summarizeGroup(group);
    assertTrue(summary.endsWith("from 2021-03-05T21:01:38Z to 2021-03-05T21:06:38Z: message of b"));
    // Summarizing is deterministic and leaves the group untouched.
    assertEquals(summary, _correlator.summarizeGroup(group));
    assertEquals("b", group.get(0).id());
  }

  @Test
  public void testSummarizeAlertGroup() throws InvalidInputException {
    List<AlertGroup> groups = _correlator.clusterAlerts(Arrays.asList(alert("a", PERFORMANCE, AlertSeverity.INFO, 0),
                                                                      alert("b", PERFORMANCE, AlertSeverity.INFO, 1),
                                                                      alert("c", PERFORMANCE, AlertSeverity.INFO, 2)));
    assertTrue(_correlator.summarizeGroup(groups.get(0)).startsWith("[Alert Group] 3 alerts of type performance "
                                                                    + "(severity: info)"));
  }

  @Test
  public void testSummarizeEmptyGroup() throws InvalidInputException {
    _expected.expect(InvalidInputException.class);
    _correlator.summarizeGroup(Collections.<Alert>emptyList());
  }

  @Test
  public void testSummarizeGroupStartingWithNullAlert() throws InvalidInputException {
    _expected.expect(InvalidInputException.class);
    _correlator.summarizeGroup(Arrays.asList((Alert) null, alert("a", PERFORMANCE, AlertSeverity.CRITICAL, 0)));
  }

  @Test
  public void testSummarizeNullGroup() throws InvalidInputException {
    _expected.expect(InvalidInputException.class);
    _correlator.summarizeGroup((List<Alert>) null);
  }

  @Test
  public void testRequiresEscalation() {
    assertTrue(_correlator.requiresEscalation(alert("a", PERFORMANCE, AlertSeverity.CRITICAL, 0)));
    assertFalse(_correlator.requiresEscalation(alert("b", PERFORMANCE, AlertSeverity.ERROR, 0)));

    AlertCorrelator correlator = new AlertCorrelator(new AlertCorrelatorConfig(
        Collections.singletonMap(AlertCorrelatorConfig.ALERT_ESCALATION_MIN_SEVERITY_CONFIG, "Warning")));
    assertTrue(correlator.requiresEscalation(alert("c", PERFORMANCE, AlertSeverity.ERROR, 0)));
    assertTrue(correlator.requiresEscalation(alert("d", PERFORMANCE, AlertSeverity.WARNING, 0)));
    assertFalse(correlator.requiresEscalation(alert("e", PERFORMANCE, AlertSeverity.INFO, 0)));
  }

  private static List<String> ids(AlertGroup group) {
    List<String> ids = new ArrayList<>();
    group.alerts().forEach(alert -> ids.add(alert.id()));
    return ids;
  }
}
