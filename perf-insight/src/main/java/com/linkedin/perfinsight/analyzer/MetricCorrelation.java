/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.analyzer;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static com.linkedin.perfinsight.common.utils.Utils.validateNotNull;


/**
 * A linear correlation between the series of two metric classes in the same bundle.
 */
public final class MetricCorrelation {
  public static final double STRONG_CORRELATION_THRESHOLD = 0.9;
  static final String FIRST_METRIC_CLASS = "firstMetricClass";
  static final String SECOND_METRIC_CLASS = "secondMetricClass";
  static final String COEFFICIENT = "coefficient";
  static final String STRENGTH = "strength";
  static final String DIRECTION = "direction";
  private final String _firstMetricClass;
  private final String _secondMetricClass;
  private final double _coefficient;

  /**
   * @param firstMetricClass The metric class that comes first in the bundle.
   * @param secondMetricClass The metric class that comes second in the bundle.
   * @param coefficient Pearson correlation coefficient, within [-1, 1].
   */
  public MetricCorrelation(String firstMetricClass, String secondMetricClass, double coefficient) {
    _firstMetricClass = validateNotNull(firstMetricClass, "First metric class cannot be null.");
    _secondMetricClass = validateNotNull(secondMetricClass, "Second metric class cannot be null.");
    if (Double.isNaN(coefficient) || coefficient < -1.0 || coefficient > 1.0) {
      throw new IllegalArgumentException(String.format("Correlation coefficient %f between %s and %s must be within "
                                                       + "[-1, 1].", coefficient, firstMetricClass, secondMetricClass));
    }
    _coefficient = coefficient;
  }

  public String firstMetricClass() {
    return _firstMetricClass;
  }

  public String secondMetricClass() {
    return _secondMetricClass;
  }

  public double coefficient() {
    return _coefficient;
  }

  /**
   * @return {@code true} if the absolute coefficient is above {@link #STRONG_CORRELATION_THRESHOLD}.
   */
  public boolean isStrong() {
    return Math.abs(_coefficient) > STRONG_CORRELATION_THRESHOLD;
  }

  /**
   * @return {@code true} if both series move in the same direction.
   */
  public boolean isPositive() {
    return _coefficient > 0;
  }

  public String strength() {
    return isStrong() ? "strong" : "moderate";
  }

  public String correlationDirection() {
    return isPositive() ? "positive" : "negative";
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> jsonStructure = new LinkedHashMap<>();
    jsonStructure.put(FIRST_METRIC_CLASS, _firstMetricClass);
    jsonStructure.put(SECOND_METRIC_CLASS, _secondMetricClass);
    jsonStructure.put(COEFFICIENT, _coefficient);
    jsonStructure.put(STRENGTH, strength());
    jsonStructure.put(DIRECTION, correlationDirection());
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
    MetricCorrelation that = (MetricCorrelation) o;
    return Double.compare(_coefficient, that._coefficient) == 0
           && _firstMetricClass.equals(that._firstMetricClass)
           && _secondMetricClass.equals(that._secondMetricClass);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_firstMetricClass, _secondMetricClass, _coefficient);
  }

  @Override
  public String toString() {
    return String.format("%s %s correlation (%.3f) between %s and %s", strength(), correlationDirection(), _coefficient,
                         _firstMetricClass, _secondMetricClass);
  }
}
