/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.analyzer;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static com.linkedin.perfinsight.common.utils.Utils.validateNotNull;


/**
 * The trend of one metric class over a batch: its direction, stability and the regression it was derived from.
 */
public final class TrendResult {
  static final String METRIC_CLASS = "metricClass";
  static final String DIRECTION = "direction";
  static final String IS_STABLE = "isStable";
  static final String VOLATILITY = "volatility";
  static final String SLOPE = "slope";
  static final String R_SQUARED = "rSquared";
  static final String PREDICTED_NEXT_VALUE = "predictedNextValue";
  static final String RATE_OF_CHANGE_PERCENT = "rateOfChangePercent";
  static final String NUM_SAMPLES = "numSamples";
  private final String _metricClass;
  private final TrendDirection _direction;
  private final boolean _isStable;
  private final double _volatility;
  private final double _slope;
  private final double _rSquared;
  private final double _predictedNextValue;
  private final double _rateOfChangePercent;
  private final int _numSamples;

  /**
   * @param metricClass Metric class of the analyzed series.
   * @param direction Dominant direction of the series.
   * @param isStable {@code true} if the volatility is below the stability threshold.
   * @param volatility Standard deviation of the series around its fitted trend.
   * @param slope Fitted slope per sample.
   * @param rSquared Coefficient of determination of the fit, within [0, 1].
   * @param predictedNextValue Value of the fitted line at the next sample position.
   * @param rateOfChangePercent Relative change from the latest sample to the predicted next value, in percent.
   * @param numSamples Number of samples in the series.
   */
  public TrendResult(String metricClass,
                     TrendDirection direction,
                     boolean isStable,
                     double volatility,
                     double slope,
                     double rSquared,
                     double predictedNextValue,
                     double rateOfChangePercent,
                     int numSamples) {
    _metricClass = validateNotNull(metricClass, "Metric class cannot be null.");
    _direction = validateNotNull(direction, "Trend direction cannot be null.");
    if (volatility < 0.0) {
      throw new IllegalArgumentException(String.format("Volatility %f of %s cannot be negative.", volatility, metricClass));
    }
    _isStable = isStable;
    _volatility = volatility;
    _slope = slope;
    _rSquared = rSquared;
    _predictedNextValue = predictedNextValue;
    _rateOfChangePercent = rateOfChangePercent;
    _numSamples = numSamples;
  }

  public String metricClass() {
    return _metricClass;
  }

  public TrendDirection direction() {
    return _direction;
  }

  public boolean isStable() {
    return _isStable;
  }

  public double volatility() {
    return _volatility;
  }

  public double slope() {
    return _slope;
  }

  public double rSquared() {
    return _rSquared;
  }

  public double predictedNextValue() {
    return _predictedNextValue;
  }

  public double rateOfChangePercent() {
    return _rateOfChangePercent;
  }

  public int numSamples() {
    return _numSamples;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> jsonStructure = new LinkedHashMap<>();
    jsonStructure.put(METRIC_CLASS, _metricClass);
    jsonStructure.put(DIRECTION, _direction.toString());
    jsonStructure.put(IS_STABLE, _isStable);
    jsonStructure.put(VOLATILITY, _volatility);
    jsonStructure.put(SLOPE, _slope);
    jsonStructure.put(R_SQUARED, _rSquared);
    jsonStructure.put(PREDICTED_NEXT_VALUE, _predictedNextValue);
    jsonStructure.put(RATE_OF_CHANGE_PERCENT, _rateOfChangePercent);
    jsonStructure.put(NUM_SAMPLES, _numSamples);
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
    TrendResult that = (TrendResult) o;
    return _isStable == that._isStable
           && Double.compare(_volatility, that._volatility) == 0
           && Double.compare(_slope, that._slope) == 0
           && Double.compare(_rSquared, that._rSquared) == 0
           && Double.compare(_predictedNextValue, that._predictedNextValue) == 0
           && Double.compare(_rateOfChangePercent, that._rateOfChangePercent) == 0
           && _numSamples == that._numSamples
           && _metricClass.equals(that._metricClass)
           && _direction == that._direction;
  }

  @Override
  public int hashCode() {
    return Objects.hash(_metricClass, _direction, _isStable, _volatility, _slope, _rSquared, _predictedNextValue,
                        _rateOfChangePercent, _numSamples);
  }

  @Override
  public String toString() {
    return String.format("{%s: %s, stable=%s, volatility=%.4f, slope=%.4f, rSquared=%.4f, predicted=%.4f (%.2f%%)}",
                         _metricClass, _direction, _isStable, _volatility, _slope, _rSquared, _predictedNextValue,
                         _rateOfChangePercent);
  }
}
