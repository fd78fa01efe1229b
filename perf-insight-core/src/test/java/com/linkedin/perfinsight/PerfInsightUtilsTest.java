/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.perfinsight;

import java.util.Map;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;


public class PerfInsightUtilsTest {
  private static final Map<Long, String> RESPONSE_BY_TIME_MS;
  static {
    RESPONSE_BY_TIME_MS =
        Map.of(0L, "1970-01-01T00:00:00Z", -10L, "1969-12-31T23:59:59Z", 1614978098383L, "2021-03-05T21:01:38Z",
               1700000000999L, "2023-11-14T22:13:20Z");
  }

  @Test
  public void testUtcDate() {
    for (Map.Entry<Long, String> entry : RESPONSE_BY_TIME_MS.entrySet()) {
      assertEquals(entry.getValue(), PerfInsightUtils.utcDateFor(entry.getKey()));
    }
  }

  @Test
  public void testPluralize() {
    assertEquals("0 alerts", PerfInsightUtils.pluralize(0, "alert"));
    assertEquals("1 alert", PerfInsightUtils.pluralize(1, "alert"));
    assertEquals("3 alerts", PerfInsightUtils.pluralize(3, "alert"));
    assertEquals("2 alert groups", PerfInsightUtils.pluralize(2, "alert group"));
  }

  @Test
  public void testEnsureValidString() {
    PerfInsightUtils.ensureValidString("Alert type", "performance");
    assertThrows(IllegalArgumentException.class, () -> PerfInsightUtils.ensureValidString("Alert type", null));
    assertThrows(IllegalArgumentException.class, () -> PerfInsightUtils.ensureValidString("Alert type", " "));
  }
}
