/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.analyzer;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static com.linkedin.perfinsight.PerfInsightUtils.utcDateFor;
import static com.linkedin.perfinsight.common.utils.Utils.validateNotNull;


/**
 * A sample that deviates from the baseline formed by the rest of its series.
 */
public final class MetricAnomaly {
  public static final long UNKNOWN_TIME_MS = -1L;
  static final String METRIC_CLASS = "metricClass";
  static final String INDEX = "index";
  static final String TIME_MS = "timeMs";
  static final String VALUE = "value";
  static final String DEVIATION = "deviation";
  static final String BASELINE_MEAN = "baselineMean";
  static final String BASELINE_STD_DEV = "baselineStdDev";
  static final String SEVERITY = "severity";
  static final String DESCRIPTION = "description";
  private final String _metricClass;
  private final int _index;
  private final long _timeMs;
  private final double _value;
  private final double _baselineMean;
  private final double _baselineStdDev;
  private final AnomalySeverity _severity;

  /**
   * @param metricClass Metric class of the series containing the anomaly.
   * @param index Position of the anomalous sample in its series.
   * @param timeMs Start time of the window of the sample, or {@link #UNKNOWN_TIME_MS}.
   * @param value The anomalous sample value.
   * @param baselineMean Mean of the series without the anomalous sample.
   * @param baselineStdDev Sample standard deviation of the series without the anomalous sample.
   * @param severity Severity of the anomaly.
   */
  public MetricAnomaly(String metricClass,
                       int index,
                       long timeMs,
                       double value,
                       double baselineMean,
                       double baselineStdDev,
                       AnomalySeverity severity) {
    _metricClass = validateNotNull(metricClass, "Metric class cannot be null.");
    _severity = validateNotNull(severity, "Anomaly severity cannot be null.");
    _index = index;
    _timeMs = timeMs;
    _value = value;
    _baselineMean = baselineMean;
    _baselineStdDev = baselineStdDev;
  }

  public String metricClass() {
    return _metricClass;
  }

  public int index() {
    return _index;
  }

  /**
   * @return Start time of the window of the anomalous sample, or {@link #UNKNOWN_TIME_MS} if the bundle had no windows.
   */
  public long timeMs() {
    return _timeMs;
  }

  public boolean hasTime() {
    return _timeMs != UNKNOWN_TIME_MS;
  }

  public double value() {
    return _value;
  }

  /**
   * @return Absolute difference between the value and the baseline mean.
   */
  public double deviation() {
    return Math.abs(_value - _baselineMean);
  }

  public double baselineMean() {
    return _baselineMean;
  }

  public double baselineStdDev() {
    return _baselineStdDev;
  }

  public AnomalySeverity severity() {
    return _severity;
  }

  /**
   * @return A human-readable description of the anomaly.
   */
  public String description() {
    return String.format("%s anomaly in %s at index %d%s: value %.3f deviates by %.3f from baseline mean %.3f "
                         + "(std dev %.3f).", _severity, _metricClass, _index,
                         hasTime() ? " (" + utcDateFor(_timeMs) + ")" : "", _value, deviation(), _baselineMean,
                         _baselineStdDev);
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> jsonStructure = new LinkedHashMap<>();
    jsonStructure.put(METRIC_CLASS, _metricClass);
    jsonStructure.put(INDEX, _index);
    jsonStructure.put(TIME_MS, _timeMs);
    jsonStructure.put(VALUE, _value);
    jsonStructure.put(DEVIATION, deviation());
    jsonStructure.put(BASELINE_MEAN, _baselineMean);
    jsonStructure.put(BASELINE_STD_DEV, _baselineStdDev);
    jsonStructure.put(SEVERITY, _severity.toString());
    jsonStructure.put(DESCRIPTION, description());
    return jsonStructure;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    MetricAnomaly that = (MetricAnomaly) o;
    return _index == that._index
           && _timeMs == that._timeMs
           && Double.compare(_value, that._value) == 0
           && Double.compare(_baselineMean, that._baselineMean) == 0
           && Double.compare(_baselineStdDev, that._baselineStdDev) == 0
           && _metricClass.equals(that._metricClass)
           && _severity == that._severity;
  }

  @Override
  public int hashCode() {
    return Objects.hash(_metricClass, _index, _timeMs, _value, _baselineMean, _baselineStdDev, _severity);
  }

  @Override
  public String toString() {
    return description();
  }
}
