/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.analyzer;

import com.linkedin.perfinsight.common.PerfInsightConfigurable;
import com.linkedin.perfinsight.exception.InvalidInputException;


/**
 * The interface for classifying the trend of each metric class in a bundle and finding anomalous samples.
 * Implementations must have a public no-argument constructor and are configured through
 * {@link #configure(java.util.Map)}.
 */
public interface TrendAnalyzer extends PerfInsightConfigurable {

  /**
   * Analyze the given bundle. The analysis has no side effects other than logging, hence analyzing the same bundle
   * twice yields equal reports.
   *
   * @param bundle Metric series by metric class.
   * @return The trend report of the bundle.
   * @throws InvalidInputException If the bundle is null, empty or malformed.
   */
  TrendReport analyzeTrends(MetricsBundle bundle) throws InvalidInputException;
}
