/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.analyzer;

import java.util.Arrays;
import java.util.List;

import static com.linkedin.perfinsight.common.utils.Utils.validateNotNull;


/**
 * An immutable, ordered sequence of samples of one metric class. The position of a sample in the series is its
 * time ordering within the batch. An empty series can be created, but it is rejected by analysis.
 */
public final class MetricSeries {
  private final double[] _values;

  private MetricSeries(double[] values) {
    _values = values;
  }

  /**
   * @param values Sample values in time order.
   * @return A series holding a copy of the given values.
   */
  public static MetricSeries of(double... values) {
    validateNotNull(values, "Metric series values cannot be null.");
    return new MetricSeries(values.clone());
  }

  /**
   * @param values Sample values in time order, none of which may be {@code null}.
   * @return A series holding the given values.
   */
  public static MetricSeries of(List<? extends Number> values) {
    validateNotNull(values, "Metric series values cannot be null.");
    double[] array = new double[values.size()];
    for (int i = 0; i < array.length; i++) {
      Number value = validateNotNull(values.get(i), "Metric series cannot contain null samples.");
      array[i] = value.doubleValue();
    }
    return new MetricSeries(array);
  }

  /**
   * @return Number of samples in the series.
   */
  public int length() {
    return _values.length;
  }

  /**
   * @param index Sample index.
   * @return The sample value at the given index.
   */
  public double valueAt(int index) {
    return _values[index];
  }

  /**
   * @return The latest sample value.
   */
  public double latest() {
    if (_values.length == 0) {
      throw new IllegalStateException("An empty metric series has no latest value.");
    }
    return _values[_values.length - 1];
  }

  /**
   * @return A copy of the sample values.
   */
  public double[] doubleArray() {
    return _values.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return Arrays.equals(_values, ((MetricSeries) o)._values);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(_values);
  }

  @Override
  public String toString() {
    return Arrays.toString(_values);
  }
}
