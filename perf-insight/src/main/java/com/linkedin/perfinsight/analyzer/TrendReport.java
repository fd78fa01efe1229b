/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.analyzer;

import com.google.gson.Gson;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.linkedin.perfinsight.common.utils.Utils.validateNotNull;


/**
 * The outcome of analyzing one {@link MetricsBundle}: a trend per analyzed metric class, in bundle order, the
 * anomalies across all classes, and the notable correlations between classes. The JSON rendering also carries the
 * {@link PerformanceInsight}s derived from these findings.
 */
public final class TrendReport {
  static final String TRENDS = "trends";
  static final String ANOMALIES = "anomalies";
  static final String CORRELATIONS = "correlations";
  static final String INSIGHTS = "insights";
  private final Map<String, TrendResult> _trendResultsByMetricClass;
  private final List<MetricAnomaly> _anomalies;
  private final List<MetricCorrelation> _correlations;

  public TrendReport(Map<String, TrendResult> trendResultsByMetricClass,
                     List<MetricAnomaly> anomalies,
                     List<MetricCorrelation> correlations) {
    validateNotNull(trendResultsByMetricClass, "Trend results cannot be null.");
    validateNotNull(anomalies, "Anomalies cannot be null.");
    validateNotNull(correlations, "Correlations cannot be null.");
    _trendResultsByMetricClass = Collections.unmodifiableMap(new LinkedHashMap<>(trendResultsByMetricClass));
    _anomalies = Collections.unmodifiableList(new ArrayList<>(anomalies));
    _correlations = Collections.unmodifiableList(new ArrayList<>(correlations));
  }

  /**
   * @return Trend results by metric class, in the iteration order of the analyzed bundle.
   */
  public Map<String, TrendResult> trendResultsByMetricClass() {
    return _trendResultsByMetricClass;
  }

  /**
   * @param metricClass Metric class.
   * @return The trend result of the given metric class, or {@code null} if the class was not analyzed.
   */
  public TrendResult trendFor(String metricClass) {
    return _trendResultsByMetricClass.get(metricClass);
  }

  public List<MetricAnomaly> anomalies() {
    return _anomalies;
  }

  public List<MetricCorrelation> correlations() {
    return _correlations;
  }

  public boolean hasAnomalies() {
    return !_anomalies.isEmpty();
  }

  /**
   * @return Insights derived from the trends, anomalies and correlations of this report.
   */
  public List<PerformanceInsight> insights() {
    return InsightGenerator.insightsFor(this);
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    List<Map<String, Object>> trends = new ArrayList<>(_trendResultsByMetricClass.size());
    _trendResultsByMetricClass.values().forEach(result -> trends.add(result.getJsonStructure()));
    List<Map<String, Object>> anomalies = new ArrayList<>(_anomalies.size());
    _anomalies.forEach(anomaly -> anomalies.add(anomaly.getJsonStructure()));
    List<Map<String, Object>> correlations = new ArrayList<>(_correlations.size());
    _correlations.forEach(correlation -> correlations.add(correlation.getJsonStructure()));
    List<Map<String, Object>> insights = new ArrayList<>();
    insights().forEach(insight -> insights.add(insight.getJsonStructure()));

    Map<String, Object> jsonStructure = new LinkedHashMap<>();
    jsonStructure.put(TRENDS, trends);
    jsonStructure.put(ANOMALIES, anomalies);
    jsonStructure.put(CORRELATIONS, correlations);
    jsonStructure.put(INSIGHTS, insights);
    return jsonStructure;
  }

  /**
   * @return The JSON rendering of {@link #getJsonStructure()}.
   */
  public String toJson() {
    return new Gson().toJson(getJsonStructure());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    TrendReport that = (TrendReport) o;
    return _trendResultsByMetricClass.equals(that._trendResultsByMetricClass)
           && _anomalies.equals(that._anomalies)
           && _correlations.equals(that._correlations);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_trendResultsByMetricClass, _anomalies, _correlations);
  }

  @Override
  public String toString() {
    return String.format("{trends: %s, anomalies: %s, correlations: %s}", _trendResultsByMetricClass.values(),
                         _anomalies, _correlations);
  }
}
