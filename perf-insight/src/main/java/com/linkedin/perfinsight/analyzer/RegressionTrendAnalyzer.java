/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.perfinsight.analyzer;

import com.linkedin.perfinsight.exception.InvalidInputException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.perfinsight.analyzer.TrendAnalyzerUtils.finiteOrZero;
import static com.linkedin.perfinsight.analyzer.TrendAnalyzerUtils.isConstant;
import static com.linkedin.perfinsight.analyzer.TrendAnalyzerUtils.tolerance;


/**
 * A trend analyzer that classifies each metric class by an ordinary least-squares fit of its samples against their
 * positions, and identifies anomalies by comparing each sample to the mean and standard deviation of the other samples
 * of the same series.
 *
 * <ul>
 *   <li>Direction: The series is increasing (decreasing) if the fitted slope is above (below the negation of)
 *   {@link TrendAnalyzerConfig#TREND_SLOPE_EPSILON_CONFIG} times the residual standard deviation of the fit. Hence the
 *   noisier a series is, the steeper it must be to be classified as trending.</li>
 *   <li>Stability: The series is stable if its volatility, i.e. the standard deviation of the residuals of the fit, is
 *   below {@link TrendAnalyzerConfig#TREND_STABILITY_THRESHOLD_CONFIG}. The volatility is in the unit of the metric
 *   and does not depend on the level of the series.</li>
 *   <li>Anomalies: A sample is anomalous if it is more than {@link TrendAnalyzerConfig#ANOMALY_DEVIATION_MULTIPLIER_CONFIG}
 *   standard deviations away from the mean of the other samples.</li>
 * </ul>
 */
public class RegressionTrendAnalyzer implements TrendAnalyzer {
  private static final Logger LOG = LoggerFactory.getLogger(RegressionTrendAnalyzer.class);
  private double _slopeEpsilon;
  private double _stabilityThreshold;
  private double _deviationMultiplier;
  private int _minAnomalySamples;
  private boolean _correlationEnabled;
  private double _correlationThreshold;
  private Set<String> _interestedMetricClasses;

  /**
   * Create an analyzer with the default configs. Use {@link #configure(Map)} to override them.
   */
  public RegressionTrendAnalyzer() {
    this(new TrendAnalyzerConfig(Collections.emptyMap()));
  }

  public RegressionTrendAnalyzer(TrendAnalyzerConfig config) {
    applyConfig(config);
  }

  @Override
  public void configure(Map<String, ?> configs) {
    applyConfig(new TrendAnalyzerConfig(configs));
  }

  private void applyConfig(TrendAnalyzerConfig config) {
    _slopeEpsilon = config.getDouble(TrendAnalyzerConfig.TREND_SLOPE_EPSILON_CONFIG);
    _stabilityThreshold = config.getDouble(TrendAnalyzerConfig.TREND_STABILITY_THRESHOLD_CONFIG);
    _deviationMultiplier = config.getDouble(TrendAnalyzerConfig.ANOMALY_DEVIATION_MULTIPLIER_CONFIG);
    _minAnomalySamples = config.getInt(TrendAnalyzerConfig.ANOMALY_MIN_SAMPLES_CONFIG);
    _correlationEnabled = config.getBoolean(TrendAnalyzerConfig.CORRELATION_ENABLED_CONFIG);
    _correlationThreshold = config.getDouble(TrendAnalyzerConfig.CORRELATION_THRESHOLD_CONFIG);
    _interestedMetricClasses = new HashSet<>(config.getList(TrendAnalyzerConfig.METRIC_CLASSES_CONFIG));
    // In case there is an empty string metric class.
    _interestedMetricClasses.removeIf(String::isEmpty);
  }

  @Override
  public TrendReport analyzeTrends(MetricsBundle bundle) throws InvalidInputException {
    sanityCheckBundle(bundle);

    Map<String, TrendResult> trendResultsByMetricClass = new LinkedHashMap<>();
    Map<String, double[]> analyzedValuesByMetricClass = new LinkedHashMap<>();
    List<MetricAnomaly> anomalies = new ArrayList<>();
    for (Map.Entry<String, MetricSeries> entry : bundle.seriesByMetricClass().entrySet()) {
      String metricClass = entry.getKey();
      if (!isInterested(metricClass)) {
        LOG.debug("Skip analyzing metric class {} that is not in the interested metric classes {}.", metricClass,
                  _interestedMetricClasses);
        continue;
      }
      double[] values = entry.getValue().doubleArray();
      trendResultsByMetricClass.put(metricClass, trendFor(metricClass, values));
      anomalies.addAll(anomaliesFor(metricClass, values, bundle.windows()));
      analyzedValuesByMetricClass.put(metricClass, values);
    }

    List<MetricCorrelation> correlations = _correlationEnabled ? correlationsOf(analyzedValuesByMetricClass)
                                                               : Collections.emptyList();
    return new TrendReport(trendResultsByMetricClass, anomalies, correlations);
  }

  private boolean isInterested(String metricClass) {
    return _interestedMetricClasses.isEmpty() || _interestedMetricClasses.contains(metricClass);
  }

  /**
   * Sanity check to ensure that
   * <ul>
   *   <li>the bundle is not null and has at least one metric class,</li>
   *   <li>each metric class is non-blank and has a non-empty series of finite values,</li>
   *   <li>all series have the same length if correlations are enabled, and</li>
   *   <li>the windows, if present, are non-null and match the length of each series.</li>
   * </ul>
   *
   * @param bundle The bundle to check.
   */
  private void sanityCheckBundle(MetricsBundle bundle) throws InvalidInputException {
    if (bundle == null) {
      throw new InvalidInputException("Metrics bundle cannot be null.");
    }
    if (bundle.numMetricClasses() == 0) {
      throw new InvalidInputException("Metrics bundle must contain at least one metric class.");
    }
    int commonLength = -1;
    for (Map.Entry<String, MetricSeries> entry : bundle.seriesByMetricClass().entrySet()) {
      String metricClass = entry.getKey();
      if (metricClass == null || metricClass.isBlank()) {
        throw new InvalidInputException("Metric class in a metrics bundle cannot be null or blank.");
      }
      MetricSeries series = entry.getValue();
      if (series == null) {
        throw new InvalidInputException(String.format("Metric series of %s cannot be null.", metricClass));
      }
      if (series.length() == 0) {
        throw new InvalidInputException(String.format("Metric series of %s cannot be empty.", metricClass));
      }
      for (int i = 0; i < series.length(); i++) {
        if (!Double.isFinite(series.valueAt(i))) {
          throw new InvalidInputException(String.format("Metric series of %s has a non-finite value %f at index %d.",
                                                        metricClass, series.valueAt(i), i));
        }
      }
      if (_correlationEnabled && commonLength != -1 && commonLength != series.length()) {
        throw new InvalidInputException(String.format("Metric series of %s has %d samples, but preceding series have %d "
                                                      + "samples. Series must be aligned when correlation is enabled.",
                                                      metricClass, series.length(), commonLength));
      }
      commonLength = series.length();
      if (bundle.hasWindows()) {
        List<Long> windows = bundle.windows();
        if (windows.size() != series.length()) {
          throw new InvalidInputException(String.format("Metrics bundle has %d windows, but the series of %s has %d "
                                                        + "samples.", windows.size(), metricClass, series.length()));
        }
        if (windows.contains(null)) {
          throw new InvalidInputException("Windows of a metrics bundle cannot contain null.");
        }
      }
    }
  }

  /**
   * @param metricClass Metric class of the series.
   * @param values Non-empty sample values.
   * @return The trend of the given series.
   */
  private TrendResult trendFor(String metricClass, double[] values) {
    int numSamples = values.length;
    if (numSamples == 1) {
      return new TrendResult(metricClass, TrendDirection.STABLE, true, 0.0, 0.0, 0.0, values[0], 0.0, numSamples);
    }

    SimpleRegression regression = new SimpleRegression();
    for (int i = 0; i < numSamples; i++) {
      regression.addData(i, values[i]);
    }
    double slope = regression.getSlope();
    double intercept = regression.getIntercept();
    double mean = StatUtils.mean(values);

    double sumSquaredResiduals = 0.0;
    for (int i = 0; i < numSamples; i++) {
      double residual = values[i] - (intercept + slope * i);
      sumSquaredResiduals += residual * residual;
    }
    // Two points always fit the line, hence there is no residual dispersion to scale the epsilon with.
    double residualStdDev = numSamples > 2 ? Math.sqrt(sumSquaredResiduals / (numSamples - 2)) : 0.0;
    double slopeThreshold = _slopeEpsilon * residualStdDev + tolerance(mean);
    TrendDirection direction;
    if (slope > slopeThreshold) {
      direction = TrendDirection.INCREASING;
    } else if (slope < -slopeThreshold) {
      direction = TrendDirection.DECREASING;
    } else {
      direction = TrendDirection.STABLE;
    }

    double volatility = Math.sqrt(sumSquaredResiduals / numSamples);
    double rSquared = Math.max(0.0, Math.min(1.0, finiteOrZero(regression.getRSquare())));
    double predictedNextValue = intercept + slope * numSamples;
    double latest = values[numSamples - 1];
    double rateOfChangePercent = latest == 0.0 ? 0.0 : (predictedNextValue - latest) / Math.abs(latest) * 100.0;

    TrendResult result = new TrendResult(metricClass, direction, volatility < _stabilityThreshold, volatility, slope,
                                         rSquared, predictedNextValue, finiteOrZero(rateOfChangePercent), numSamples);
    LOG.trace("Trend of {} with {} samples: {} (slope threshold: {}).", metricClass, numSamples, result, slopeThreshold);
    return result;
  }

  /**
   * Identify the samples that deviate from the baseline formed by the other samples of the series. The baseline of
   * each sample is computed in constant time by removing the sample from sums of the deviations from the series mean.
   *
   * @param metricClass Metric class of the series.
   * @param values Non-empty sample values.
   * @param windows Window start times of the samples, or {@code null} if unknown.
   * @return Anomalies of the series in index order.
   */
  private List<MetricAnomaly> anomaliesFor(String metricClass, double[] values, List<Long> windows) {
    int numSamples = values.length;
    if (numSamples < _minAnomalySamples) {
      LOG.trace("Skip anomaly detection for {} with {} samples (minimum: {}).", metricClass, numSamples,
                _minAnomalySamples);
      return Collections.emptyList();
    }

    double mean = StatUtils.mean(values);
    double tolerance = tolerance(mean);
    double sumOfDeviations = 0.0;
    double sumOfSquaredDeviations = 0.0;
    for (double value : values) {
      double deviation = value - mean;
      sumOfDeviations += deviation;
      sumOfSquaredDeviations += deviation * deviation;
    }

    int numBaselineSamples = numSamples - 1;
    List<MetricAnomaly> anomalies = new ArrayList<>();
    for (int i = 0; i < numSamples; i++) {
      double deviationOfSample = values[i] - mean;
      double baselineSum = sumOfDeviations - deviationOfSample;
      double baselineSumOfSquares = sumOfSquaredDeviations - deviationOfSample * deviationOfSample;
      double baselineVariance = Math.max(0.0, (baselineSumOfSquares - baselineSum * baselineSum / numBaselineSamples)
                                              / (numBaselineSamples - 1));
      double baselineMean = mean + baselineSum / numBaselineSamples;
      double baselineStdDev = Math.sqrt(baselineVariance);
      double deviation = Math.abs(values[i] - baselineMean);

      boolean isAnomaly = deviation > Math.max(_deviationMultiplier * baselineStdDev, tolerance);
      LOG.trace("Sample {} of {} at index {} deviates by {} from baseline mean {} (std dev: {}), anomaly: {}.",
                values[i], metricClass, i, deviation, baselineMean, baselineStdDev, isAnomaly);
      if (isAnomaly) {
        double deviationScore = baselineStdDev > 0.0 ? deviation / baselineStdDev : Double.POSITIVE_INFINITY;
        long timeMs = windows == null ? MetricAnomaly.UNKNOWN_TIME_MS : windows.get(i);
        anomalies.add(new MetricAnomaly(metricClass, i, timeMs, values[i], baselineMean, baselineStdDev,
                                        AnomalySeverity.forScore(deviationScore, _deviationMultiplier)));
      }
    }
    return anomalies;
  }

  /**
   * @param valuesByMetricClass Aligned sample values by metric class, in bundle order.
   * @return Correlations of the metric class pairs whose absolute coefficient exceeds the correlation threshold.
   */
  private List<MetricCorrelation> correlationsOf(Map<String, double[]> valuesByMetricClass) {
    List<String> metricClasses = new ArrayList<>(valuesByMetricClass.keySet());
    if (metricClasses.size() < 2 || valuesByMetricClass.get(metricClasses.get(0)).length < 3) {
      return Collections.emptyList();
    }

    PearsonsCorrelation pearsonsCorrelation = new PearsonsCorrelation();
    List<MetricCorrelation> correlations = new ArrayList<>();
    for (int i = 0; i < metricClasses.size(); i++) {
      double[] first = valuesByMetricClass.get(metricClasses.get(i));
      if (isConstant(first)) {
        continue;
      }
      for (int j = i + 1; j < metricClasses.size(); j++) {
        double[] second = valuesByMetricClass.get(metricClasses.get(j));
        if (isConstant(second)) {
          continue;
        }
        double coefficient = pearsonsCorrelation.correlation(first, second);
        if (Double.isNaN(coefficient)) {
          continue;
        }
        coefficient = Math.max(-1.0, Math.min(1.0, coefficient));
        if (Math.abs(coefficient) > _correlationThreshold) {
          correlations.add(new MetricCorrelation(metricClasses.get(i), metricClasses.get(j), coefficient));
        }
      }
    }
    return correlations;
  }
}
