/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.analyzer;

import java.util.Collections;
import java.util.List;


/**
 * The dominant direction of a metric series.
 *
 * <ul>
 *   <li>{@link #INCREASING}: The fitted slope is above the noise-scaled epsilon.</li>
 *   <li>{@link #DECREASING}: The fitted slope is below the negated noise-scaled epsilon.</li>
 *   <li>{@link #STABLE}: Neither of the above, including single-sample and constant series.</li>
 * </ul>
 */
public enum TrendDirection {
  INCREASING, DECREASING, STABLE;

  private static final List<TrendDirection> CACHED_VALUES = List.of(values());

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<TrendDirection> cachedValues() {
    return Collections.unmodifiableList(CACHED_VALUES);
  }

  @Override
  public String toString() {
    return name().toLowerCase();
  }
}
