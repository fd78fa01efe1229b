/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.correlator;

import java.util.Collections;
import java.util.List;


/**
 * Severity of an alert. Each severity has an urgency, the larger the urgency value is, the more urgent the alert.
 *
 * Supported severities are as follows (in ascending order of urgency).
 * <ul>
 *  <li>{@link #INFO}: Informational, no action needed.</li>
 *  <li>{@link #WARNING}: Degradation worth watching.</li>
 *  <li>{@link #ERROR}: Degradation that needs attention.</li>
 *  <li>{@link #CRITICAL}: Degradation that needs immediate attention.</li>
 * </ul>
 */
public enum AlertSeverity {
  INFO(0),
  WARNING(1),
  ERROR(2),
  CRITICAL(3);

  private static final List<AlertSeverity> CACHED_VALUES = List.of(values());
  private final int _urgency;

  AlertSeverity(int urgency) {
    _urgency = urgency;
  }

  public int urgency() {
    return _urgency;
  }

  /**
   * @param other Severity to compare with.
   * @return {@code true} if this severity is at least as urgent as the given severity.
   */
  public boolean isAtLeast(AlertSeverity other) {
    return _urgency >= other._urgency;
  }

  /**
   * @param name Case-insensitive name of a severity.
   * @return The severity with the given name.
   */
  public static AlertSeverity forName(String name) {
    for (AlertSeverity severity : CACHED_VALUES) {
      if (severity.name().equalsIgnoreCase(name)) {
        return severity;
      }
    }
    throw new IllegalArgumentException("Unsupported alert severity " + name + ". Supported: " + CACHED_VALUES);
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<AlertSeverity> cachedValues() {
    return Collections.unmodifiableList(CACHED_VALUES);
  }

  @Override
  public String toString() {
    return name().toLowerCase();
  }
}
