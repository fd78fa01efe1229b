/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.analyzer;

import java.util.ArrayList;
import java.util.List;

import static com.linkedin.perfinsight.common.utils.Utils.validateNotNull;


/**
 * Turns the findings of a {@link TrendReport} into {@link PerformanceInsight}s, in the following order:
 *
 * <ul>
 *   <li>A trend insight for each trend whose fit has an R-squared above {@link #MIN_TREND_CONFIDENCE}.</li>
 *   <li>An anomaly insight for each anomaly, as important as the anomaly is severe.</li>
 *   <li>A correlation insight of medium importance for each correlation, about its first metric class.</li>
 * </ul>
 */
public final class InsightGenerator {
  static final double MIN_TREND_CONFIDENCE = 0.8;
  static final double HIGH_IMPORTANCE_CONFIDENCE = 0.9;
  static final double HIGH_IMPORTANCE_RATE_PERCENT = 10.0;
  static final double MEDIUM_IMPORTANCE_RATE_PERCENT = 5.0;
  static final double RAPID_CHANGE_RATE_PERCENT = 10.0;

  private InsightGenerator() {

  }

  /**
   * @param report The report to derive insights from.
   * @return Insights of the given report.
   */
  public static List<PerformanceInsight> insightsFor(TrendReport report) {
    validateNotNull(report, "Trend report cannot be null.");
    List<PerformanceInsight> insights = new ArrayList<>();
    for (TrendResult trend : report.trendResultsByMetricClass().values()) {
      if (trend.rSquared() > MIN_TREND_CONFIDENCE) {
        insights.add(new PerformanceInsight(InsightType.TREND, trend.metricClass(), trendDescription(trend),
                                            trendImportance(trend), trendRecommendation(trend), null, null));
      }
    }
    for (MetricAnomaly anomaly : report.anomalies()) {
      insights.add(new PerformanceInsight(InsightType.ANOMALY, anomaly.metricClass(), anomaly.description(),
                                          InsightImportance.forSeverity(anomaly.severity()),
                                          anomalyRecommendation(anomaly), null, null));
    }
    for (MetricCorrelation correlation : report.correlations()) {
      insights.add(new PerformanceInsight(InsightType.CORRELATION, correlation.firstMetricClass(),
                                          correlationDescription(correlation), InsightImportance.MEDIUM, null,
                                          correlation.secondMetricClass(), correlation.coefficient()));
    }
    return insights;
  }

  static InsightImportance trendImportance(TrendResult trend) {
    double absRate = Math.abs(trend.rateOfChangePercent());
    if (trend.rSquared() > HIGH_IMPORTANCE_CONFIDENCE && absRate > HIGH_IMPORTANCE_RATE_PERCENT) {
      return InsightImportance.HIGH;
    }
    if (trend.rSquared() > MIN_TREND_CONFIDENCE && absRate > MEDIUM_IMPORTANCE_RATE_PERCENT) {
      return InsightImportance.MEDIUM;
    }
    return InsightImportance.LOW;
  }

  static String trendDescription(TrendResult trend) {
    return String.format("%s is %s at a rate of %.1f%% with %.1f%% confidence", trend.metricClass(), trend.direction(),
                         Math.abs(trend.rateOfChangePercent()), trend.rSquared() * 100);
  }

  static String trendRecommendation(TrendResult trend) {
    if (trend.direction() == TrendDirection.INCREASING && trend.rateOfChangePercent() > RAPID_CHANGE_RATE_PERCENT) {
      return String.format("Consider investigating the cause of rapid increase in %s and implement optimizations",
                           trend.metricClass());
    }
    if (trend.direction() == TrendDirection.DECREASING && trend.rateOfChangePercent() < -RAPID_CHANGE_RATE_PERCENT) {
      return String.format("Monitor %s closely as it shows significant improvement", trend.metricClass());
    }
    return String.format("Continue monitoring %s for any significant changes", trend.metricClass());
  }

  static String anomalyRecommendation(MetricAnomaly anomaly) {
    switch (anomaly.severity()) {
      case HIGH:
        return String.format("Urgent: Investigate %s as it shows significant deviation from normal behavior",
                             anomaly.metricClass());
      case MEDIUM:
        return String.format("Review recent changes that might have affected %s", anomaly.metricClass());
      default:
        return String.format("Monitor %s for continued anomalies", anomaly.metricClass());
    }
  }

  static String correlationDescription(MetricCorrelation correlation) {
    return String.format("%s %s correlation detected between %s and %s", correlation.strength(),
                         correlation.correlationDirection(), correlation.firstMetricClass(),
                         correlation.secondMetricClass());
  }
}
