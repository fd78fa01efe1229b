/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.analyzer;

import com.linkedin.perfinsight.common.config.AbstractConfig;
import com.linkedin.perfinsight.common.config.ConfigDef;
import java.util.Map;

import static com.linkedin.perfinsight.common.config.ConfigDef.Range.atLeast;
import static com.linkedin.perfinsight.common.config.ConfigDef.Range.between;


public class TrendAnalyzerConfig extends AbstractConfig {
  /**
   * <code>trend.slope.epsilon</code>
   */
  public static final String TREND_SLOPE_EPSILON_CONFIG = "trend.slope.epsilon";
  public static final double DEFAULT_TREND_SLOPE_EPSILON = 0.5;
  public static final String TREND_SLOPE_EPSILON_DOC =
      "The ratio of the residual standard deviation of a series around its fitted line that the fitted slope per sample "
      + "must exceed for the series to be classified as increasing or decreasing. For example, with a ratio of 0.5 "
      + "and a residual standard deviation of 2, a series is increasing only if its slope is greater than 1 per sample.";

  /**
   * <code>trend.stability.threshold</code>
   */
  public static final String TREND_STABILITY_THRESHOLD_CONFIG = "trend.stability.threshold";
  public static final double DEFAULT_TREND_STABILITY_THRESHOLD = 2.0;
  public static final String TREND_STABILITY_THRESHOLD_DOC =
      "The volatility below which a series is considered stable. Volatility is the standard deviation of the series "
      + "around its fitted line, in the unit of the metric.";

  /**
   * <code>anomaly.deviation.multiplier</code>
   */
  public static final String ANOMALY_DEVIATION_MULTIPLIER_CONFIG = "anomaly.deviation.multiplier";
  public static final double DEFAULT_ANOMALY_DEVIATION_MULTIPLIER = 3.0;
  public static final String ANOMALY_DEVIATION_MULTIPLIER_DOC =
      "The number of standard deviations a sample must be away from the mean of the rest of its series to be "
      + "identified as a metric anomaly.";

  /**
   * <code>anomaly.min.samples</code>
   */
  public static final String ANOMALY_MIN_SAMPLES_CONFIG = "anomaly.min.samples";
  public static final int DEFAULT_ANOMALY_MIN_SAMPLES = 5;
  public static final String ANOMALY_MIN_SAMPLES_DOC =
      "The minimum number of samples a series must have for the analyzer to look for metric anomalies in it.";

  /**
   * <code>correlation.enabled</code>
   */
  public static final String CORRELATION_ENABLED_CONFIG = "correlation.enabled";
  public static final boolean DEFAULT_CORRELATION_ENABLED = true;
  public static final String CORRELATION_ENABLED_DOC =
      "True if the analyzer should report correlations between metric classes. If enabled, all series in a bundle must "
      + "have the same length.";

  /**
   * <code>correlation.threshold</code>
   */
  public static final String CORRELATION_THRESHOLD_CONFIG = "correlation.threshold";
  public static final double DEFAULT_CORRELATION_THRESHOLD = 0.7;
  public static final String CORRELATION_THRESHOLD_DOC =
      "The absolute Pearson correlation coefficient that a pair of metric classes must exceed to be reported.";

  /**
   * <code>metric.classes</code>
   */
  public static final String METRIC_CLASSES_CONFIG = "metric.classes";
  public static final String DEFAULT_METRIC_CLASSES = "";
  public static final String METRIC_CLASSES_DOC =
      "A comma separated list of metric classes to analyze. Other metric classes in a bundle are skipped. An empty "
      + "list means all metric classes are analyzed.";

  private static final ConfigDef CONFIG =
      new ConfigDef().define(TREND_SLOPE_EPSILON_CONFIG,
                             ConfigDef.Type.DOUBLE,
                             DEFAULT_TREND_SLOPE_EPSILON,
                             atLeast(0.0),
                             TREND_SLOPE_EPSILON_DOC)
                     .define(TREND_STABILITY_THRESHOLD_CONFIG,
                             ConfigDef.Type.DOUBLE,
                             DEFAULT_TREND_STABILITY_THRESHOLD,
                             atLeast(0.0),
                             TREND_STABILITY_THRESHOLD_DOC)
                     .define(ANOMALY_DEVIATION_MULTIPLIER_CONFIG,
                             ConfigDef.Type.DOUBLE,
                             DEFAULT_ANOMALY_DEVIATION_MULTIPLIER,
                             between(0.1, 100.0),
                             ANOMALY_DEVIATION_MULTIPLIER_DOC)
                     .define(ANOMALY_MIN_SAMPLES_CONFIG,
                             ConfigDef.Type.INT,
                             DEFAULT_ANOMALY_MIN_SAMPLES,
                             atLeast(3),
                             ANOMALY_MIN_SAMPLES_DOC)
                     .define(CORRELATION_ENABLED_CONFIG,
                             ConfigDef.Type.BOOLEAN,
                             DEFAULT_CORRELATION_ENABLED,
                             CORRELATION_ENABLED_DOC)
                     .define(CORRELATION_THRESHOLD_CONFIG,
                             ConfigDef.Type.DOUBLE,
                             DEFAULT_CORRELATION_THRESHOLD,
                             between(0.0, 1.0),
                             CORRELATION_THRESHOLD_DOC)
                     .define(METRIC_CLASSES_CONFIG,
                             ConfigDef.Type.LIST,
                             DEFAULT_METRIC_CLASSES,
                             METRIC_CLASSES_DOC);

  public TrendAnalyzerConfig(Map<?, ?> originals) {
    super(CONFIG, originals);
  }

  /**
   * @return A copy of the definition of the trend analyzer configs.
   */
  public static ConfigDef definition() {
    return new ConfigDef(CONFIG);
  }
}
