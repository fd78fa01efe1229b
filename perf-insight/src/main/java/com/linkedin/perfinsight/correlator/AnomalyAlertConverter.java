/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.correlator;

import com.linkedin.perfinsight.analyzer.AnomalySeverity;
import com.linkedin.perfinsight.analyzer.MetricAnomaly;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static com.linkedin.perfinsight.PerfInsightUtils.ensureValidString;
import static com.linkedin.perfinsight.common.utils.Utils.validateNotNull;


/**
 * Raises alerts for metric anomalies so that they are grouped like alerts of any other producer.
 */
public class AnomalyAlertConverter {
  private final String _alertType;

  public AnomalyAlertConverter(AlertCorrelatorConfig config) {
    this(config.getString(AlertCorrelatorConfig.ANOMALY_ALERT_TYPE_CONFIG));
  }

  public AnomalyAlertConverter(String alertType) {
    ensureValidString("Anomaly alert type", alertType);
    _alertType = alertType;
  }

  /**
   * @param severity Severity of a metric anomaly.
   * @return The severity of the alert for an anomaly of the given severity.
   */
  public static AlertSeverity alertSeverityFor(AnomalySeverity severity) {
    switch (severity) {
      case LOW:
        return AlertSeverity.WARNING;
      case MEDIUM:
        return AlertSeverity.ERROR;
      case HIGH:
        return AlertSeverity.CRITICAL;
      default:
        throw new IllegalArgumentException("Unsupported anomaly severity " + severity);
    }
  }

  /**
   * @param anomaly Metric anomaly.
   * @param detectionTimeMs Time of detection, used as the alert time if the anomaly has no time.
   * @return The alert for the given anomaly.
   */
  public Alert toAlert(MetricAnomaly anomaly, long detectionTimeMs) {
    validateNotNull(anomaly, "Metric anomaly cannot be null.");
    long timestampMs = anomaly.hasTime() ? anomaly.timeMs() : detectionTimeMs;
    String id = anomaly.metricClass() + "-" + anomaly.index() + "-" + timestampMs;
    return new Alert(id, _alertType, alertSeverityFor(anomaly.severity()), anomaly.description(), timestampMs);
  }

  /**
   * @param anomalies Metric anomalies.
   * @param detectionTimeMs Time of detection, used as the alert time of anomalies that have no time.
   * @return The alerts for the given anomalies, in the same order.
   */
  public List<Alert> toAlerts(Collection<MetricAnomaly> anomalies, long detectionTimeMs) {
    validateNotNull(anomalies, "Metric anomalies cannot be null.");
    List<Alert> alerts = new ArrayList<>(anomalies.size());
    anomalies.forEach(anomaly -> alerts.add(toAlert(anomaly, detectionTimeMs)));
    return alerts;
  }

  public String alertType() {
    return _alertType;
  }
}
