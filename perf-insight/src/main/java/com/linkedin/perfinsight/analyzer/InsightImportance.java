/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.analyzer;

import java.util.Collections;
import java.util.List;


/**
 * How much attention a {@link PerformanceInsight} deserves.
 */
public enum InsightImportance {
  LOW, MEDIUM, HIGH;

  private static final List<InsightImportance> CACHED_VALUES = List.of(values());

  /**
   * @param severity Severity of an anomaly.
   * @return The importance of an insight about an anomaly of the given severity.
   */
  public static InsightImportance forSeverity(AnomalySeverity severity) {
    switch (severity) {
      case HIGH:
        return HIGH;
      case MEDIUM:
        return MEDIUM;
      case LOW:
        return LOW;
      default:
        throw new IllegalArgumentException("Unsupported anomaly severity " + severity);
    }
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<InsightImportance> cachedValues() {
    return Collections.unmodifiableList(CACHED_VALUES);
  }

  @Override
  public String toString() {
    return name().toLowerCase();
  }
}
