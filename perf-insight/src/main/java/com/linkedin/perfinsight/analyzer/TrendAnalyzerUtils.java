/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.perfinsight.analyzer;

/**
 * A util class for trend analyzers.
 */
public final class TrendAnalyzerUtils {

  // Relative floating point error that is absorbed when comparing slopes and deviations.
  public static final double RELATIVE_TOLERANCE = 1e-9;

  private TrendAnalyzerUtils() {

  }

  /**
   * @param mean Mean of a series.
   * @return The floating point tolerance for a series with the given mean.
   */
  public static double tolerance(double mean) {
    return RELATIVE_TOLERANCE * Math.max(1.0, Math.abs(mean));
  }

  /**
   * @param values Sample values.
   * @return {@code true} if all values are equal, {@code false} otherwise.
   */
  public static boolean isConstant(double[] values) {
    for (int i = 1; i < values.length; i++) {
      if (Double.compare(values[i], values[0]) != 0) {
        return false;
      }
    }
    return true;
  }

  /**
   * @param value A value that may not be finite.
   * @return The given value if it is finite, {@code 0.0} otherwise.
   */
  public static double finiteOrZero(double value) {
    return Double.isFinite(value) ? value : 0.0;
  }
}
