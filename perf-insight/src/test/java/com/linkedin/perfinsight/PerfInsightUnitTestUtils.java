/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight;

import com.linkedin.perfinsight.analyzer.MetricSeries;
import com.linkedin.perfinsight.correlator.Alert;
import com.linkedin.perfinsight.correlator.AlertSeverity;
import java.util.Arrays;
import java.util.Random;


public final class PerfInsightUnitTestUtils {
  public static final long SEED = 3140L;
  // 2021-03-05T21:01:38Z
  public static final long START_MS = 1614978098000L;
  public static final long MINUTE_MS = 60000L;
  public static final String PERFORMANCE = "performance";
  public static final String CAPACITY = "capacity";

  private PerfInsightUnitTestUtils() {

  }

  /**
   * Generate {@code base + slope * i + noise} where the noise is uniformly distributed within
   * {@code [-noiseAmplitude, noiseAmplitude)} and seeded for reproducibility.
   *
   * @param numSamples Number of samples.
   * @param base Value of the first sample without noise.
   * @param slope Change per sample.
   * @param noiseAmplitude Maximum absolute noise.
   * @return Sample values.
   */
  public static double[] noisyValues(int numSamples, double base, double slope, double noiseAmplitude) {
    Random random = new Random(SEED);
    double[] values = new double[numSamples];
    for (int i = 0; i < numSamples; i++) {
      values[i] = base + slope * i + (random.nextDouble() * 2 - 1) * noiseAmplitude;
    }
    return values;
  }

  public static MetricSeries noisySeries(int numSamples, double base, double slope, double noiseAmplitude) {
    return MetricSeries.of(noisyValues(numSamples, base, slope, noiseAmplitude));
  }

  /**
   * @param numSamples Number of samples.
   * @param value Value of every sample.
   * @return A series with the given value at each position.
   */
  public static double[] constantValues(int numSamples, double value) {
    double[] values = new double[numSamples];
    Arrays.fill(values, value);
    return values;
  }

  /**
   * @param id Alert id.
   * @param type Alert type.
   * @param severity Alert severity.
   * @param minutesAfterStart Time of the alert in minutes after {@link #START_MS}.
   * @return An alert with a message derived from the id.
   */
  public static Alert alert(String id, String type, AlertSeverity severity, double minutesAfterStart) {
    return new Alert(id, type, severity, "message of " + id, START_MS + (long) (minutesAfterStart * MINUTE_MS));
  }
}
