/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.analyzer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.linkedin.perfinsight.common.utils.Utils.validateNotNull;


/**
 * A batch of metric series keyed by metric class, in insertion order. Sample {@code i} of every series refers to the
 * same observation window. Optionally, the bundle carries the start time of each window in epoch milliseconds.
 *
 * The bundle does not validate its content; {@link TrendAnalyzer#analyzeTrends(MetricsBundle)} rejects malformed
 * bundles.
 */
public final class MetricsBundle {
  public static final String LATENCY = "latency";
  public static final String PROCESSING_DURATION = "processing.duration";
  public static final String COMPRESSION_RATIO = "compression.ratio";
  private final Map<String, MetricSeries> _seriesByMetricClass;
  private final List<Long> _windows;

  /**
   * @param seriesByMetricClass Series by metric class, iterated in the order of the given map.
   */
  public MetricsBundle(Map<String, MetricSeries> seriesByMetricClass) {
    this(seriesByMetricClass, null);
  }

  /**
   * @param seriesByMetricClass Series by metric class, iterated in the order of the given map.
   * @param windows Window start times in epoch milliseconds, one per sample position, or {@code null} if unknown.
   */
  public MetricsBundle(Map<String, MetricSeries> seriesByMetricClass, List<Long> windows) {
    validateNotNull(seriesByMetricClass, "Series by metric class cannot be null.");
    _seriesByMetricClass = Collections.unmodifiableMap(new LinkedHashMap<>(seriesByMetricClass));
    _windows = windows == null ? null : Collections.unmodifiableList(new ArrayList<>(windows));
  }

  /**
   * @return An unmodifiable view of the series by metric class, in insertion order.
   */
  public Map<String, MetricSeries> seriesByMetricClass() {
    return _seriesByMetricClass;
  }

  /**
   * @param metricClass Metric class.
   * @return The series of the given metric class, or {@code null} if the bundle has no such class.
   */
  public MetricSeries seriesFor(String metricClass) {
    return _seriesByMetricClass.get(metricClass);
  }

  /**
   * @return The number of metric classes in the bundle.
   */
  public int numMetricClasses() {
    return _seriesByMetricClass.size();
  }

  /**
   * @return {@code true} if the bundle carries window start times, {@code false} otherwise.
   */
  public boolean hasWindows() {
    return _windows != null;
  }

  /**
   * @return Window start times in epoch milliseconds, or {@code null} if unknown.
   */
  public List<Long> windows() {
    return _windows;
  }

  @Override
  public String toString() {
    return "MetricsBundle{" + _seriesByMetricClass + (_windows == null ? "" : ", windows=" + _windows) + "}";
  }

  /**
   * A builder to assemble a bundle class by class.
   */
  public static final class Builder {
    private final Map<String, MetricSeries> _seriesByMetricClass;
    private List<Long> _windows;

    public Builder() {
      _seriesByMetricClass = new LinkedHashMap<>();
      _windows = null;
    }

    /**
     * @param metricClass Metric class.
     * @param values Sample values in time order.
     * @return This builder.
     */
    public Builder addSeries(String metricClass, double... values) {
      return addSeries(metricClass, MetricSeries.of(values));
    }

    /**
     * @param metricClass Metric class.
     * @param series Series of the metric class.
     * @return This builder.
     */
    public Builder addSeries(String metricClass, MetricSeries series) {
      _seriesByMetricClass.put(metricClass, series);
      return this;
    }

    /**
     * @param windows Window start times in epoch milliseconds, one per sample position.
     * @return This builder.
     */
    public Builder windows(List<Long> windows) {
      _windows = windows;
      return this;
    }

    /**
     * @param startMs Start time of the first window in epoch milliseconds.
     * @param windowMs Length of each window in milliseconds.
     * @param numWindows Number of windows.
     * @return This builder.
     */
    public Builder evenlySpacedWindows(long startMs, long windowMs, int numWindows) {
      List<Long> windows = new ArrayList<>(numWindows);
      for (int i = 0; i < numWindows; i++) {
        windows.add(startMs + i * windowMs);
      }
      _windows = windows;
      return this;
    }

    public MetricsBundle build() {
      return new MetricsBundle(_seriesByMetricClass, _windows);
    }
  }
}
