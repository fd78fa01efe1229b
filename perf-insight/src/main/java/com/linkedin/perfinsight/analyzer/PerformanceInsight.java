/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.analyzer;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static com.linkedin.perfinsight.common.utils.Utils.validateNotNull;


/**
 * A human-readable finding about a metric class, with an optional recommendation. Insights about a correlation also
 * name the related metric class and the correlation coefficient.
 */
public final class PerformanceInsight {
  static final String TYPE = "type";
  static final String METRIC_CLASS = "metricClass";
  static final String DESCRIPTION = "description";
  static final String IMPORTANCE = "importance";
  static final String RECOMMENDATION = "recommendation";
  static final String RELATED_METRIC_CLASS = "relatedMetricClass";
  static final String CORRELATION = "correlation";
  private final InsightType _type;
  private final String _metricClass;
  private final String _description;
  private final InsightImportance _importance;
  private final String _recommendation;
  private final String _relatedMetricClass;
  private final Double _correlation;

  /**
   * @param type The finding the insight is derived from.
   * @param metricClass The metric class the insight is about.
   * @param description Description of the finding.
   * @param importance Importance of the insight.
   * @param recommendation Recommended action, or {@code null} if there is none.
   * @param relatedMetricClass The correlated metric class, or {@code null} unless the type is a correlation.
   * @param correlation The correlation coefficient, or {@code null} unless the type is a correlation.
   */
  public PerformanceInsight(InsightType type,
                            String metricClass,
                            String description,
                            InsightImportance importance,
                            String recommendation,
                            String relatedMetricClass,
                            Double correlation) {
    _type = validateNotNull(type, "Insight type cannot be null.");
    _metricClass = validateNotNull(metricClass, "Metric class cannot be null.");
    _description = validateNotNull(description, "Insight description cannot be null.");
    _importance = validateNotNull(importance, "Insight importance cannot be null.");
    if ((type == InsightType.CORRELATION) != (relatedMetricClass != null && correlation != null)) {
      throw new IllegalArgumentException(String.format("A %s insight about %s %s a related metric class and a "
                                                       + "correlation.", type, metricClass,
                                                       type == InsightType.CORRELATION ? "requires" : "cannot have"));
    }
    _recommendation = recommendation;
    _relatedMetricClass = relatedMetricClass;
    _correlation = correlation;
  }

  public InsightType type() {
    return _type;
  }

  public String metricClass() {
    return _metricClass;
  }

  public String description() {
    return _description;
  }

  public InsightImportance importance() {
    return _importance;
  }

  /**
   * @return The recommended action, or {@code null} if there is none.
   */
  public String recommendation() {
    return _recommendation;
  }

  /**
   * @return The correlated metric class, or {@code null} if this is not a correlation insight.
   */
  public String relatedMetricClass() {
    return _relatedMetricClass;
  }

  /**
   * @return The correlation coefficient, or {@code null} if this is not a correlation insight.
   */
  public Double correlation() {
    return _correlation;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> jsonStructure = new LinkedHashMap<>();
    jsonStructure.put(TYPE, _type.toString());
    jsonStructure.put(METRIC_CLASS, _metricClass);
    jsonStructure.put(DESCRIPTION, _description);
    jsonStructure.put(IMPORTANCE, _importance.toString());
    if (_recommendation != null) {
      jsonStructure.put(RECOMMENDATION, _recommendation);
    }
    if (_type == InsightType.CORRELATION) {
      jsonStructure.put(RELATED_METRIC_CLASS, _relatedMetricClass);
      jsonStructure.put(CORRELATION, _correlation);
    }
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
    PerformanceInsight that = (PerformanceInsight) o;
    return _type == that._type
           && _importance == that._importance
           && _metricClass.equals(that._metricClass)
           && _description.equals(that._description)
           && Objects.equals(_recommendation, that._recommendation)
           && Objects.equals(_relatedMetricClass, that._relatedMetricClass)
           && Objects.equals(_correlation, that._correlation);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_type, _metricClass, _description, _importance, _recommendation, _relatedMetricClass,
                        _correlation);
  }

  @Override
  public String toString() {
    return String.format("[%s] %s %s insight: %s", _importance, _metricClass, _type, _description);
  }
}
