/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.analyzer;

import java.util.Collections;
import java.util.List;


/**
 * Severity of a metric anomaly, derived from how many baseline standard deviations the value is away from the
 * baseline mean relative to the configured deviation multiplier {@code m}.
 *
 * <ul>
 *   <li>{@link #LOW}: Between {@code m} and {@code 1.5 * m} standard deviations.</li>
 *   <li>{@link #MEDIUM}: Between {@code 1.5 * m} and {@code 2 * m} standard deviations.</li>
 *   <li>{@link #HIGH}: More than {@code 2 * m} standard deviations, or any departure from a constant baseline.</li>
 * </ul>
 */
public enum AnomalySeverity {
  LOW, MEDIUM, HIGH;

  private static final List<AnomalySeverity> CACHED_VALUES = List.of(values());
  static final double MEDIUM_SCORE_RATIO = 1.5;
  static final double HIGH_SCORE_RATIO = 2.0;

  /**
   * @param deviationScore Deviation from the baseline mean in baseline standard deviations.
   * @param deviationMultiplier The deviation multiplier beyond which a value is an anomaly.
   * @return The severity for the given deviation score.
   */
  public static AnomalySeverity forScore(double deviationScore, double deviationMultiplier) {
    if (deviationScore > deviationMultiplier * HIGH_SCORE_RATIO) {
      return HIGH;
    }
    if (deviationScore > deviationMultiplier * MEDIUM_SCORE_RATIO) {
      return MEDIUM;
    }
    return LOW;
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<AnomalySeverity> cachedValues() {
    return Collections.unmodifiableList(CACHED_VALUES);
  }

  @Override
  public String toString() {
    return name().toLowerCase();
  }
}
