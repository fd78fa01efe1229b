/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight;

import com.linkedin.perfinsight.analyzer.RegressionTrendAnalyzer;
import com.linkedin.perfinsight.analyzer.TrendAnalyzerConfig;
import com.linkedin.perfinsight.common.config.AbstractConfig;
import com.linkedin.perfinsight.common.config.ConfigDef;
import com.linkedin.perfinsight.correlator.AlertCorrelatorConfig;
import java.util.Map;


/**
 * The configuration of an {@link AnalysisCycle}. It defines the pluggable trend analyzer class together with all
 * configs of {@link TrendAnalyzerConfig} and {@link AlertCorrelatorConfig}, and validates them all on construction.
 */
public class PerfInsightConfig extends AbstractConfig {
  /**
   * <code>trend.analyzer.class</code>
   */
  public static final String TREND_ANALYZER_CLASS_CONFIG = "trend.analyzer.class";
  public static final String DEFAULT_TREND_ANALYZER_CLASS = RegressionTrendAnalyzer.class.getName();
  public static final String TREND_ANALYZER_CLASS_DOC =
      "The class implementing com.linkedin.perfinsight.analyzer.TrendAnalyzer to classify trends and identify "
      + "anomalies in metric bundles.";

  private static final ConfigDef CONFIG =
      new ConfigDef().define(TREND_ANALYZER_CLASS_CONFIG,
                             ConfigDef.Type.CLASS,
                             DEFAULT_TREND_ANALYZER_CLASS,
                             TREND_ANALYZER_CLASS_DOC)
                     .withMissingKeysOf(TrendAnalyzerConfig.definition())
                     .withMissingKeysOf(AlertCorrelatorConfig.definition());

  public PerfInsightConfig(Map<?, ?> originals) {
    super(CONFIG, originals);
  }

  public PerfInsightConfig(Map<?, ?> originals, boolean doLog) {
    super(CONFIG, originals, doLog);
  }

  /**
   * @return The alert correlator configs of this configuration.
   */
  public AlertCorrelatorConfig alertCorrelatorConfig() {
    return new AlertCorrelatorConfig(originals());
  }
}
