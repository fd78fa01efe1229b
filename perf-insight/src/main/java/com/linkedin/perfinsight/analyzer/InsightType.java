/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.analyzer;

import java.util.Collections;
import java.util.List;


/**
 * The finding a {@link PerformanceInsight} is derived from.
 */
public enum InsightType {
  TREND, ANOMALY, CORRELATION;

  private static final List<InsightType> CACHED_VALUES = List.of(values());

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<InsightType> cachedValues() {
    return Collections.unmodifiableList(CACHED_VALUES);
  }

  @Override
  public String toString() {
    return name().toLowerCase();
  }
}
