/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.analyzer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;

import static com.linkedin.perfinsight.PerfInsightUnitTestUtils.START_MS;
import static com.linkedin.perfinsight.analyzer.InsightGenerator.trendImportance;
import static com.linkedin.perfinsight.analyzer.InsightGenerator.trendRecommendation;
import static com.linkedin.perfinsight.analyzer.MetricsBundle.COMPRESSION_RATIO;
import static com.linkedin.perfinsight.analyzer.MetricsBundle.LATENCY;
import static com.linkedin.perfinsight.analyzer.MetricsBundle.PROCESSING_DURATION;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


public class InsightGeneratorTest {

  private static TrendResult trend(String metricClass, TrendDirection direction, double rSquared, double ratePercent) {
    return new TrendResult(metricClass, direction, false, 3.0, 1.0, rSquared, 100.0, ratePercent, 20);
  }

  private static TrendReport reportOf(List<TrendResult> trends,
                                      List<MetricAnomaly> anomalies,
                                      List<MetricCorrelation> correlations) {
    Map<String, TrendResult> trendsByMetricClass = new LinkedHashMap<>();
    trends.forEach(trend -> trendsByMetricClass.put(trend.metricClass(), trend));
    return new TrendReport(trendsByMetricClass, anomalies, correlations);
  }

  private static MetricAnomaly anomaly(String metricClass, AnomalySeverity severity) {
    return new MetricAnomaly(metricClass, 19, START_MS, 1000.0, 100.0, 10.0, severity);
  }

  @Test
  public void testInsightsInReportOrder() {
    TrendReport report = reportOf(List.of(trend(LATENCY, TrendDirection.INCREASING, 0.95, 12.34),
                                          trend(PROCESSING_DURATION, TrendDirection.STABLE, 0.1, 0.0)),
                                  List.of(anomaly(LATENCY, AnomalySeverity.HIGH)),
                                  List.of(new MetricCorrelation(LATENCY, COMPRESSION_RATIO, -0.95)));
    List<PerformanceInsight> insights = InsightGenerator.insightsFor(report);
    assertEquals(3, insights.size());

    PerformanceInsight trendInsight = insights.get(0);
    assertEquals(InsightType.TREND, trendInsight.type());
    assertEquals(LATENCY, trendInsight.metricClass());
    assertEquals(InsightImportance.HIGH, trendInsight.importance());
    assertEquals("latency is increasing at a rate of 12.3% with 95.0% confidence", trendInsight.description());
    assertEquals("Consider investigating the cause of rapid increase in latency and implement optimizations",
                 trendInsight.recommendation());
    assertNull(trendInsight.relatedMetricClass());

    PerformanceInsight anomalyInsight = insights.get(1);
    assertEquals(InsightType.ANOMALY, anomalyInsight.type());
    assertEquals(InsightImportance.HIGH, anomalyInsight.importance());
    assertEquals(report.anomalies().get(0).description(), anomalyInsight.description());
    assertTrue(anomalyInsight.recommendation().startsWith("Urgent: Investigate latency"));

    PerformanceInsight correlationInsight = insights.get(2);
    assertEquals(InsightType.CORRELATION, correlationInsight.type());
    assertEquals(LATENCY, correlationInsight.metricClass());
    assertEquals(InsightImportance.MEDIUM, correlationInsight.importance());
    assertEquals("strong negative correlation detected between latency and compression.ratio",
                 correlationInsight.description());
    assertNull(correlationInsight.recommendation());
    assertEquals(COMPRESSION_RATIO, correlationInsight.relatedMetricClass());
    assertEquals(-0.95, correlationInsight.correlation(), 0.0);
  }

  @Test
  public void testTrendInsightRequiresConfidence() {
    TrendReport report = reportOf(List.of(trend(LATENCY, TrendDirection.INCREASING, 0.8, 50.0),
                                          trend(PROCESSING_DURATION, TrendDirection.DECREASING, 0.81, -50.0)),
                                  Collections.emptyList(), Collections.emptyList());
    List<PerformanceInsight> insights = InsightGenerator.insightsFor(report);
    assertEquals(1, insights.size());
    assertEquals(PROCESSING_DURATION, insights.get(0).metricClass());
    assertEquals("processing.duration is decreasing at a rate of 50.0% with 81.0% confidence",
                 insights.get(0).description());
    assertEquals("Monitor processing.duration closely as it shows significant improvement",
                 insights.get(0).recommendation());
  }

  @Test
  public void testTrendImportance() {
    assertEquals(InsightImportance.HIGH, trendImportance(trend(LATENCY, TrendDirection.DECREASING, 0.91, -10.5)));
    assertEquals(InsightImportance.MEDIUM, trendImportance(trend(LATENCY, TrendDirection.INCREASING, 0.91, 10.0)));
    assertEquals(InsightImportance.MEDIUM, trendImportance(trend(LATENCY, TrendDirection.INCREASING, 0.85, 20.0)));
    assertEquals(InsightImportance.LOW, trendImportance(trend(LATENCY, TrendDirection.INCREASING, 0.99, 5.0)));
    assertEquals(InsightImportance.LOW, trendImportance(trend(LATENCY, TrendDirection.STABLE, 0.85, 0.0)));
  }

  @Test
  public void testTrendRecommendationForSlowChange() {
    assertEquals("Continue monitoring latency for any significant changes",
                 trendRecommendation(trend(LATENCY, TrendDirection.INCREASING, 0.99, 10.0)));
    assertEquals("Continue monitoring latency for any significant changes",
                 trendRecommendation(trend(LATENCY, TrendDirection.DECREASING, 0.99, -10.0)));
  }

  @Test
  public void testAnomalyImportanceFollowsSeverity() {
    TrendReport report = reportOf(Collections.emptyList(),
                                  List.of(anomaly(LATENCY, AnomalySeverity.LOW),
                                          anomaly(PROCESSING_DURATION, AnomalySeverity.MEDIUM)),
                                  Collections.emptyList());
    List<PerformanceInsight> insights = InsightGenerator.insightsFor(report);
    assertEquals(InsightImportance.LOW, insights.get(0).importance());
    assertEquals("Monitor latency for continued anomalies", insights.get(0).recommendation());
    assertEquals(InsightImportance.MEDIUM, insights.get(1).importance());
    assertEquals("Review recent changes that might have affected processing.duration",
                 insights.get(1).recommendation());
  }

  @Test
  public void testCorrelationInsightRequiresRelatedMetric() {
    assertThrows(IllegalArgumentException.class,
                 () -> new PerformanceInsight(InsightType.CORRELATION, LATENCY, "d", InsightImportance.MEDIUM, null,
                                              null, 0.9));
    assertThrows(IllegalArgumentException.class,
                 () -> new PerformanceInsight(InsightType.TREND, LATENCY, "d", InsightImportance.LOW, null,
                                              PROCESSING_DURATION, 0.9));
  }
}
