/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoUnit;

import static com.linkedin.perfinsight.common.utils.Utils.validateNotNull;

/**
 * Utils class for perf-insight
 */
public final class PerfInsightUtils {
  private static final DateTimeFormatter UTC_SECONDS_FORMATTER = new DateTimeFormatterBuilder().appendInstant(0).toFormatter();

  private PerfInsightUtils() {

  }

  /**
   * Ensure that the given String value of the given String key is not {@code null} or blank.
   *
   * @param key The key corresponding to the given String value.
   * @param value String value to be checked for being non-blank.
   */
  public static void ensureValidString(String key, String value) {
    validateNotNull(value, () -> key + " cannot be null");
    if (value.isBlank()) {
      throw new IllegalArgumentException(key + " cannot be empty");
    }
  }

  /**
   * @param timeMs Time in milliseconds.
   * @return The date for the given time in ISO 8601 format with date, hour, minute, and seconds.
   */
  public static String utcDateFor(long timeMs) {
    return UTC_SECONDS_FORMATTER.format(Instant.ofEpochMilli(timeMs).truncatedTo(ChronoUnit.SECONDS));
  }

  /**
   * @param count Number of items.
   * @param singular Singular noun describing an item.
   * @return The count followed by the noun, pluralized with a trailing "s" unless the count is exactly one.
   */
  public static String pluralize(int count, String singular) {
    return count + " " + (count == 1 ? singular : singular + "s");
  }
}
