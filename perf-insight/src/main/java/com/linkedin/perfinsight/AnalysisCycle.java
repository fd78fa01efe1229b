/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.linkedin.perfinsight.analyzer.MetricsBundle;
import com.linkedin.perfinsight.analyzer.TrendAnalyzer;
import com.linkedin.perfinsight.analyzer.TrendReport;
import com.linkedin.perfinsight.correlator.Alert;
import com.linkedin.perfinsight.correlator.AlertClusterer;
import com.linkedin.perfinsight.correlator.AlertCorrelator;
import com.linkedin.perfinsight.correlator.AlertCorrelatorConfig;
import com.linkedin.perfinsight.correlator.AlertGroup;
import com.linkedin.perfinsight.correlator.AnomalyAlertConverter;
import com.linkedin.perfinsight.correlator.NotificationThrottle;
import com.linkedin.perfinsight.exception.InvalidInputException;
import com.linkedin.perfinsight.exception.PerfInsightException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.perfinsight.PerfInsightUtils.pluralize;
import static com.linkedin.perfinsight.common.utils.Utils.validateNotNull;


/**
 * Wires the trend analyzer to the alert correlator. Each cycle analyzes a metrics bundle, raises alerts for its
 * anomalies, groups them with the alerts of other producers, and notifies the {@link AlertSink} about groups that
 * closed. Alerts that require escalation are passed to the sink right away.
 *
 * All public methods are synchronized, which makes this class the single owner of the clustering state for concurrent
 * producers.
 */
public class AnalysisCycle {
  private static final Logger LOG = LoggerFactory.getLogger(AnalysisCycle.class);
  static final String METRIC_REGISTRY_NAME = "PerfInsight";
  private final TrendAnalyzer _trendAnalyzer;
  private final AlertCorrelator _correlator;
  private final AlertClusterer _clusterer;
  private final NotificationThrottle _throttle;
  private final AnomalyAlertConverter _converter;
  private final AlertSink _sink;
  private final Timer _trendAnalysisTimer;
  private final Meter _alertsIngestedMeter;
  private final Meter _alertsEscalatedMeter;
  private final Meter _groupsClosedMeter;
  private final Meter _notificationsSuppressedMeter;

  /**
   * @param config The configuration.
   * @param sink The receiver of alert notifications.
   * @param dropwizardMetricRegistry The metric registry that holds all the metrics for monitoring the cycles.
   * @throws PerfInsightException If the configured trend analyzer cannot be instantiated.
   */
  public AnalysisCycle(PerfInsightConfig config, AlertSink sink, MetricRegistry dropwizardMetricRegistry)
      throws PerfInsightException {
    validateNotNull(config, "Configuration cannot be null.");
    _sink = validateNotNull(sink, "Alert sink cannot be null.");
    validateNotNull(dropwizardMetricRegistry, "Metric registry cannot be null.");
    config.logUnused();
    _trendAnalyzer = config.getConfiguredInstance(PerfInsightConfig.TREND_ANALYZER_CLASS_CONFIG, TrendAnalyzer.class);
    AlertCorrelatorConfig correlatorConfig = config.alertCorrelatorConfig();
    _correlator = new AlertCorrelator(correlatorConfig);
    _clusterer = _correlator.newClusterer();
    _throttle = new NotificationThrottle(correlatorConfig);
    _converter = new AnomalyAlertConverter(correlatorConfig);

    _trendAnalysisTimer = dropwizardMetricRegistry.timer(MetricRegistry.name(METRIC_REGISTRY_NAME, "trend-analysis-timer"));
    _alertsIngestedMeter = dropwizardMetricRegistry.meter(MetricRegistry.name(METRIC_REGISTRY_NAME, "alerts-ingested"));
    _alertsEscalatedMeter = dropwizardMetricRegistry.meter(MetricRegistry.name(METRIC_REGISTRY_NAME, "alerts-escalated"));
    _groupsClosedMeter = dropwizardMetricRegistry.meter(MetricRegistry.name(METRIC_REGISTRY_NAME, "groups-closed"));
    _notificationsSuppressedMeter =
        dropwizardMetricRegistry.meter(MetricRegistry.name(METRIC_REGISTRY_NAME, "notifications-suppressed"));
    dropwizardMetricRegistry.register(MetricRegistry.name(METRIC_REGISTRY_NAME, "open-alert-groups"),
                                      (Gauge<Integer>) this::numOpenGroups);
  }

  /**
   * Run a cycle: analyze the given bundle, ingest an alert for each anomaly, then close the idle groups and notify the
   * sink about them.
   *
   * @param bundle Metrics bundle to analyze.
   * @param nowMs The current time in epoch milliseconds.
   * @return The outcome of the cycle.
   * @throws InvalidInputException If the bundle is malformed. No alert is ingested in that case.
   */
  public synchronized AnalysisCycleResult run(MetricsBundle bundle, long nowMs) throws InvalidInputException {
    TrendReport report;
    final Timer.Context ctx = _trendAnalysisTimer.time();
    try {
      report = _trendAnalyzer.analyzeTrends(bundle);
    } finally {
      ctx.stop();
    }

    List<Alert> raisedAlerts = _converter.toAlerts(report.anomalies(), nowMs);
    raisedAlerts.forEach(this::ingestAlert);

    List<AlertGroup> closedGroups = new ArrayList<>(_clusterer.drainEvicted());
    closedGroups.addAll(_clusterer.closeIdleGroups(nowMs));
    int numSuppressed = notifyClosedGroups(closedGroups, nowMs);

    AnalysisCycleResult result = new AnalysisCycleResult(report, raisedAlerts, closedGroups, numSuppressed);
    LOG.info("Finished analysis cycle: {}.", result);
    return result;
  }

  /**
   * Ingest an alert of any producer. The alert is escalated to the sink right away if it requires escalation, and it
   * is grouped in any case. Groups evicted to admit the alert are notified to the sink.
   *
   * @param alert Alert to ingest.
   * @param nowMs The current time in epoch milliseconds.
   * @return The group the alert was added to.
   */
  public synchronized AlertGroup ingest(Alert alert, long nowMs) {
    validateNotNull(alert, "Alert to ingest cannot be null.");
    AlertGroup group = ingestAlert(alert);
    notifyClosedGroups(_clusterer.drainEvicted(), nowMs);
    return group;
  }

  /**
   * Close all open groups and notify the sink about them, such as upon shutdown.
   *
   * @param nowMs The current time in epoch milliseconds.
   * @return The closed groups, including groups evicted since the last notification.
   */
  public synchronized List<AlertGroup> flush(long nowMs) {
    List<AlertGroup> closedGroups = new ArrayList<>(_clusterer.drainEvicted());
    closedGroups.addAll(_clusterer.closeAll());
    notifyClosedGroups(closedGroups, nowMs);
    LOG.info("Flushed {}.", pluralize(closedGroups.size(), "alert group"));
    return closedGroups;
  }

  /**
   * @return A snapshot of the open groups in the order they were opened.
   */
  public synchronized List<AlertGroup> openGroups() {
    return _clusterer.openGroups();
  }

  private synchronized int numOpenGroups() {
    return _clusterer.numOpenGroups();
  }

  private AlertGroup ingestAlert(Alert alert) {
    _alertsIngestedMeter.mark();
    if (_correlator.requiresEscalation(alert)) {
      _alertsEscalatedMeter.mark();
      LOG.debug("Escalating alert {}.", alert);
      _sink.onEscalation(alert);
    }
    return _clusterer.offer(alert);
  }

  /**
   * @param closedGroups Closed groups to notify the sink about.
   * @param nowMs The current time in epoch milliseconds.
   * @return Number of groups whose notification was suppressed.
   */
  private int notifyClosedGroups(List<AlertGroup> closedGroups, long nowMs) {
    int numSuppressed = 0;
    for (AlertGroup group : closedGroups) {
      _groupsClosedMeter.mark();
      if (!_throttle.tryAcquire(group.anchor().groupKey(), nowMs)) {
        _notificationsSuppressedMeter.mark();
        numSuppressed++;
        continue;
      }
      String summary;
      try {
        summary = _correlator.summarizeGroup(group);
      } catch (InvalidInputException iie) {
        // Clustered groups always have at least one alert.
        throw new IllegalStateException("Failed to summarize alert group " + group.groupId(), iie);
      }
      _sink.onGroupSummary(group, summary);
    }
    return numSuppressed;
  }
}
