/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.correlator;

import java.util.List;
import org.junit.Before;
import org.junit.Test;

import static com.linkedin.perfinsight.PerfInsightUnitTestUtils.CAPACITY;
import static com.linkedin.perfinsight.PerfInsightUnitTestUtils.MINUTE_MS;
import static com.linkedin.perfinsight.PerfInsightUnitTestUtils.PERFORMANCE;
import static com.linkedin.perfinsight.PerfInsightUnitTestUtils.START_MS;
import static com.linkedin.perfinsight.PerfInsightUnitTestUtils.alert;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


public class AlertClustererTest {
  private AlertClusterer _clusterer;

  @Before
  public void setUp() {
    _clusterer = new AlertCorrelator().newClusterer();
  }

  @Test
  public void testOfferAdvancesAnchor() {
    AlertGroup group = _clusterer.offer(alert("a", PERFORMANCE, AlertSeverity.CRITICAL, 0));
    assertEquals(AlertGroupState.OPEN, group.state());
    assertEquals("performance-critical-" + START_MS, group.groupId());

    for (int i = 1; i <= 5; i++) {
      // Each alert is 9 minutes after the previous one, hence the group spans 45 minutes.
      assertSame(group, _clusterer.offer(alert("a" + i, PERFORMANCE, AlertSeverity.CRITICAL, 9 * i)));
      assertEquals("a" + i, group.anchor().id());
    }
    assertEquals(6, group.size());
    assertEquals(START_MS, group.firstTimestampMs());
    assertEquals(START_MS + 45 * MINUTE_MS, group.lastTimestampMs());
    assertEquals(1, _clusterer.numOpenGroups());
  }

  @Test
  public void testFirstMatchingGroupWins() {
    AlertGroup first = _clusterer.offer(alert("a", PERFORMANCE, AlertSeverity.ERROR, 0));
    AlertGroup second = _clusterer.offer(alert("b", PERFORMANCE, AlertSeverity.ERROR, 11));
    assertEquals(2, _clusterer.numOpenGroups());
    // Within the window of both anchors, the group opened first wins.
    assertSame(first, _clusterer.offer(alert("c", PERFORMANCE, AlertSeverity.ERROR, 6)));
    assertEquals(1, second.size());
  }

  @Test
  public void testOutOfOrderAlertIsGrouped() {
    AlertGroup group = _clusterer.offer(alert("a", PERFORMANCE, AlertSeverity.WARNING, 10));
    assertSame(group, _clusterer.offer(alert("b", PERFORMANCE, AlertSeverity.WARNING, 4)));
    assertEquals(START_MS + 4 * MINUTE_MS, group.firstTimestampMs());
    assertEquals(START_MS + 10 * MINUTE_MS, group.lastTimestampMs());
    assertEquals("b", group.anchor().id());
  }

  @Test
  public void testCloseIdleGroups() {
    AlertGroup performance = _clusterer.offer(alert("a", PERFORMANCE, AlertSeverity.CRITICAL, 0));
    AlertGroup capacity = _clusterer.offer(alert("b", CAPACITY, AlertSeverity.CRITICAL, 5));

    // The anchor of the performance group is exactly one window old, hence it is not idle yet.
    assertTrue(_clusterer.closeIdleGroups(START_MS + 10 * MINUTE_MS).isEmpty());

    List<AlertGroup> closed = _clusterer.closeIdleGroups(START_MS + 10 * MINUTE_MS + 1);
    assertEquals(1, closed.size());
    assertSame(performance, closed.get(0));
    assertEquals(AlertGroupState.CLOSED, performance.state());
    assertTrue(capacity.isOpen());
    assertEquals(1, _clusterer.numOpenGroups());

    // A later alert of the same type and severity opens a new group.
    AlertGroup next = _clusterer.offer(alert("c", PERFORMANCE, AlertSeverity.CRITICAL, 11));
    assertFalse(next == performance);
    assertEquals(1, performance.size());
  }

  @Test
  public void testClosedGroupRejectsAlerts() {
    AlertGroup group = _clusterer.offer(alert("a", PERFORMANCE, AlertSeverity.CRITICAL, 0));
    assertEquals(1, _clusterer.closeAll().size());
    assertFalse(group.isOpen());
    assertThrows(IllegalStateException.class, () -> group.add(alert("b", PERFORMANCE, AlertSeverity.CRITICAL, 1)));
    assertTrue(_clusterer.openGroups().isEmpty());
  }

  @Test
  public void testEvictGroupWithOldestAnchor() {
    AlertClusterer clusterer = new AlertClusterer(new AlertCorrelator(), 2);
    AlertGroup performance = clusterer.offer(alert("a", PERFORMANCE, AlertSeverity.CRITICAL, 0));
    AlertGroup capacity = clusterer.offer(alert("b", CAPACITY, AlertSeverity.CRITICAL, 1));
    // The performance group now has the most recent anchor.
    clusterer.offer(alert("c", PERFORMANCE, AlertSeverity.CRITICAL, 2));
    assertTrue(clusterer.drainEvicted().isEmpty());

    AlertGroup warning = clusterer.offer(alert("d", PERFORMANCE, AlertSeverity.WARNING, 3));
    List<AlertGroup> evicted = clusterer.drainEvicted();
    assertEquals(1, evicted.size());
    assertSame(capacity, evicted.get(0));
    assertFalse(capacity.isOpen());
    assertEquals(List.of(performance, warning), clusterer.openGroups());
    assertTrue(clusterer.drainEvicted().isEmpty());
  }

  @Test
  public void testInvalidMaxOpenGroups() {
    assertThrows(IllegalArgumentException.class, () -> new AlertClusterer(new AlertCorrelator(), 0));
    assertThrows(IllegalArgumentException.class, () -> _clusterer.offer(null));
  }
}
