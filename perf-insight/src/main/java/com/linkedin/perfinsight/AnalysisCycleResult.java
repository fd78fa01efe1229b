/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight;

import com.linkedin.perfinsight.analyzer.TrendReport;
import com.linkedin.perfinsight.correlator.Alert;
import com.linkedin.perfinsight.correlator.AlertGroup;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.linkedin.perfinsight.common.utils.Utils.validateNotNull;


/**
 * The outcome of a single {@link AnalysisCycle#run(com.linkedin.perfinsight.analyzer.MetricsBundle, long)}.
 */
public final class AnalysisCycleResult {
  private final TrendReport _report;
  private final List<Alert> _raisedAlerts;
  private final List<AlertGroup> _closedGroups;
  private final int _numSuppressedNotifications;

  AnalysisCycleResult(TrendReport report,
                      List<Alert> raisedAlerts,
                      List<AlertGroup> closedGroups,
                      int numSuppressedNotifications) {
    _report = validateNotNull(report, "Trend report cannot be null.");
    _raisedAlerts = Collections.unmodifiableList(new ArrayList<>(raisedAlerts));
    _closedGroups = Collections.unmodifiableList(new ArrayList<>(closedGroups));
    _numSuppressedNotifications = numSuppressedNotifications;
  }

  public TrendReport report() {
    return _report;
  }

  /**
   * @return Alerts raised for the anomalies of the report.
   */
  public List<Alert> raisedAlerts() {
    return _raisedAlerts;
  }

  /**
   * @return Groups closed during the cycle, including evicted groups.
   */
  public List<AlertGroup> closedGroups() {
    return _closedGroups;
  }

  /**
   * @return Number of closed groups whose notification was suppressed by the notification cooldown.
   */
  public int numSuppressedNotifications() {
    return _numSuppressedNotifications;
  }

  @Override
  public String toString() {
    return String.format("{%d trends, %d alerts raised, %d groups closed, %d notifications suppressed}",
                         _report.trendResultsByMetricClass().size(), _raisedAlerts.size(), _closedGroups.size(),
                         _numSuppressedNotifications);
  }
}
