/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.correlator;

import com.linkedin.perfinsight.exception.InvalidInputException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.perfinsight.PerfInsightUtils.pluralize;
import static com.linkedin.perfinsight.PerfInsightUtils.utcDateFor;
import static com.linkedin.perfinsight.common.utils.Utils.validateNotNull;


/**
 * Groups related alerts to reduce notification noise. Two alerts are related if they have the same type and severity
 * and were raised within the grouping window of each other. Groups are built by single-linkage: an alert joins a group
 * if it is related to the most recently added member of the group, hence a group can span more than the grouping
 * window as long as consecutive members are close enough.
 */
public class AlertCorrelator {
  private static final Logger LOG = LoggerFactory.getLogger(AlertCorrelator.class);
  static final String SUMMARY_PREFIX = "[Alert Group]";
  private final long _groupingWindowMs;
  private final int _maxOpenGroups;
  private final AlertSeverity _escalationMinSeverity;

  /**
   * Create a correlator with the default configs.
   */
  public AlertCorrelator() {
    this(new AlertCorrelatorConfig(Collections.emptyMap()));
  }

  public AlertCorrelator(AlertCorrelatorConfig config) {
    _groupingWindowMs = config.getLong(AlertCorrelatorConfig.ALERT_GROUPING_WINDOW_MS_CONFIG);
    _maxOpenGroups = config.getInt(AlertCorrelatorConfig.ALERT_MAX_OPEN_GROUPS_CONFIG);
    _escalationMinSeverity = AlertSeverity.forName(config.getString(AlertCorrelatorConfig.ALERT_ESCALATION_MIN_SEVERITY_CONFIG));
  }

  public long groupingWindowMs() {
    return _groupingWindowMs;
  }

  /**
   * @param a An alert.
   * @param b Another alert.
   * @return {@code true} if the given alerts have the same type and severity, and their timestamps are at most the
   * grouping window apart, {@code false} otherwise.
   */
  public boolean shouldGroup(Alert a, Alert b) {
    validateNotNull(a, "Alert to group cannot be null.");
    validateNotNull(b, "Alert to group cannot be null.");
    return a.type().equals(b.type())
           && a.severity() == b.severity()
           && isWithinGroupingWindow(a.timestampMs(), b.timestampMs());
  }

  private boolean isWithinGroupingWindow(long timestampMs, long otherTimestampMs) {
    long timeDiffMs = Math.max(timestampMs, otherTimestampMs) - Math.min(timestampMs, otherTimestampMs);
    // The difference wraps around to a negative value if it exceeds Long.MAX_VALUE.
    return timeDiffMs >= 0 && timeDiffMs <= _groupingWindowMs;
  }

  /**
   * @return A new clusterer to group an unbounded stream of alerts incrementally.
   */
  public AlertClusterer newClusterer() {
    return new AlertClusterer(this, _maxOpenGroups);
  }

  /**
   * Cluster the given batch of alerts. The alerts are ordered by timestamp, keeping the input order of alerts with the
   * same timestamp, and each alert joins the first group, in the order groups were opened, whose most recently added
   * member it should be grouped with. If there is no such group, the alert opens a new group.
   *
   * @param alerts Alerts to cluster. The list is not modified.
   * @return All groups in the order they were opened. Each alert is in exactly one group.
   */
  public List<AlertGroup> clusterAlerts(List<Alert> alerts) {
    validateNotNull(alerts, "Alerts to cluster cannot be null.");
    List<Alert> sortedAlerts = new ArrayList<>(alerts);
    // List.sort is stable.
    sortedAlerts.sort(Comparator.comparingLong(Alert::timestampMs));

    // Eviction would split groups, hence the batch clusterer has no bound on open groups.
    AlertClusterer clusterer = new AlertClusterer(this, Integer.MAX_VALUE);
    List<AlertGroup> groups = new ArrayList<>();
    for (Alert alert : sortedAlerts) {
      AlertGroup group = clusterer.offer(alert);
      if (group.size() == 1) {
        groups.add(group);
      }
    }
    LOG.debug("Clustered {} into {}.", pluralize(alerts.size(), "alert"), pluralize(groups.size(), "group"));
    return groups;
  }

  /**
   * Summarize the given group of alerts as
   * {@code [Alert Group] <N> alert(s) of type <type> (severity: <severity>) from <first> to <last>: <latest message>}.
   * Type and severity are taken from the first alert, the time range spans the earliest and the latest timestamp, and
   * the message is that of the latest alert (the last one among alerts with the latest timestamp).
   *
   * @param group Alerts to summarize. The list is not modified.
   * @return Summary of the given group.
   * @throws InvalidInputException If the group is null or empty.
   */
  public String summarizeGroup(List<Alert> group) throws InvalidInputException {
    if (group == null || group.isEmpty()) {
      throw new InvalidInputException("Cannot summarize an empty alert group.");
    }
    for (Alert alert : group) {
      if (alert == null) {
        throw new InvalidInputException("Cannot summarize an alert group with a null alert.");
      }
    }
    Alert first = group.get(0);
    Alert latest = first;
    long firstTimestampMs = first.timestampMs();
    for (Alert alert : group) {
      firstTimestampMs = Math.min(firstTimestampMs, alert.timestampMs());
      if (alert.timestampMs() >= latest.timestampMs()) {
        latest = alert;
      }
    }
    return String.format("%s %s of type %s (severity: %s) from %s to %s: %s", SUMMARY_PREFIX,
                         pluralize(group.size(), "alert"), first.type(), first.severity(), utcDateFor(firstTimestampMs),
                         utcDateFor(latest.timestampMs()), latest.message());
  }

  /**
   * @param group Group to summarize.
   * @return Summary of the given group.
   * @throws InvalidInputException If the group is null.
   * @see #summarizeGroup(List)
   */
  public String summarizeGroup(AlertGroup group) throws InvalidInputException {
    if (group == null) {
      throw new InvalidInputException("Cannot summarize a null alert group.");
    }
    return summarizeGroup(group.alerts());
  }

  /**
   * @param alert Alert to check.
   * @return {@code true} if the given alert is at least as severe as the configured escalation severity.
   */
  public boolean requiresEscalation(Alert alert) {
    validateNotNull(alert, "Alert to check for escalation cannot be null.");
    return alert.severity().isAtLeast(_escalationMinSeverity);
  }
}
