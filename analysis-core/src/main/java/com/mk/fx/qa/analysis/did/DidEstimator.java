package com.mk.fx.qa.analysis.did;

import static com.mk.fx.qa.analysis.stats.StatMath.approximatePValue;
import static com.mk.fx.qa.analysis.stats.StatMath.cohensD;
import static com.mk.fx.qa.analysis.stats.StatMath.combinedStandardError;
import static com.mk.fx.qa.analysis.stats.StatMath.confidenceInterval;
import static com.mk.fx.qa.analysis.stats.StatMath.degreesOfFreedom;
import static com.mk.fx.qa.analysis.stats.StatMath.mean;
import static com.mk.fx.qa.analysis.stats.StatMath.tStatistic;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates a single metric's paired time series and computes its {@link DidResult}.
 *
 * <p>Stateless and thread-safe.
 */
public class DidEstimator {

  public static final double DEFAULT_ALPHA = 0.05;

  /** Minimum summed subjects per arm for a series to pass validation. */
  static final long MIN_TOTAL_SAMPLES = 10;

  /**
   * Checks the series and itemises every problem found. Never throws.
   *
   * <p>Fails when the series is empty, has fewer than two points, contains a non-finite value or a
   * non-positive sample size, or when either arm sums to fewer than ten subjects.
   */
  public SeriesValidation validate(List<TimeSeriesPoint> timeSeries) {
    List<String> errors = new ArrayList<>();
    List<TimeSeriesPoint> series = timeSeries == null ? List.of() : timeSeries;

    if (series.isEmpty()) {
      errors.add("Time series data is empty");
    }
    if (series.size() < 2) {
      errors.add("Need at least 2 data points for meaningful analysis");
    }

    long totalTreatment = 0;
    long totalControl = 0;
    for (int i = 0; i < series.size(); i++) {
      TimeSeriesPoint point = series.get(i);
      if (point == null) {
        errors.add("Missing data point at time point " + i);
        continue;
      }
      if (!Double.isFinite(point.treatmentValue()) || !Double.isFinite(point.controlValue())) {
        errors.add("Invalid values at time point " + i);
      }
      if (point.treatmentSampleSize() <= 0 || point.controlSampleSize() <= 0) {
        errors.add("Invalid sample sizes at time point " + i);
      }
      totalTreatment += point.treatmentSampleSize();
      totalControl += point.controlSampleSize();
    }

    if (totalTreatment < MIN_TOTAL_SAMPLES) {
      errors.add("Treatment group sample size too small (< " + MIN_TOTAL_SAMPLES + ")");
    }
    if (totalControl < MIN_TOTAL_SAMPLES) {
      errors.add("Control group sample size too small (< " + MIN_TOTAL_SAMPLES + ")");
    }
    return new SeriesValidation(errors);
  }

  /**
   * Computes the full statistical record for one metric.
   *
   * @throws IllegalArgumentException if the series is empty
   */
  public DidResult calculate(List<TimeSeriesPoint> timeSeries, int confidenceLevel) {
    if (timeSeries == null || timeSeries.isEmpty()) {
      throw new IllegalArgumentException("Cannot perform DiD analysis on empty time series");
    }

    int n = timeSeries.size();
    double[] treatment = new double[n];
    double[] control = new double[n];
    long sampleSizeTreatment = 0;
    long sampleSizeControl = 0;
    for (int i = 0; i < n; i++) {
      TimeSeriesPoint p = timeSeries.get(i);
      treatment[i] = p.treatmentValue();
      control[i] = p.controlValue();
      sampleSizeTreatment += p.treatmentSampleSize();
      sampleSizeControl += p.controlSampleSize();
    }

    double treatmentMean = mean(treatment);
    double controlMean = mean(control);
    double absoluteDifference = treatmentMean - controlMean;
    double relativeDifference = controlMean != 0.0 ? absoluteDifference / controlMean : 0.0;

    double tStat = tStatistic(treatment, control);
    int df = degreesOfFreedom(treatment.length, control.length);
    double pValue = approximatePValue(tStat, df);

    double effectSize = cohensD(treatment, control);
    var ci =
        confidenceInterval(
            absoluteDifference, combinedStandardError(treatment, control), confidenceLevel);

    return new DidResult(
        treatmentMean,
        controlMean,
        absoluteDifference,
        relativeDifference,
        pValue,
        confidenceLevel,
        ci,
        sampleSizeControl,
        sampleSizeTreatment,
        effectSize);
  }

  public static boolean isSignificant(double pValue) {
    return isSignificant(pValue, DEFAULT_ALPHA);
  }

  public static boolean isSignificant(double pValue, double alpha) {
    return pValue < alpha;
  }

  /** Cohen's conventional magnitude label for {@code |d|}. */
  public static String interpretEffectSize(double cohensD) {
    double absD = Math.abs(cohensD);
    if (absD < 0.2) return "negligible";
    if (absD < 0.5) return "small";
    if (absD < 0.8) return "medium";
    return "large";
  }

  /**
   * Rough power estimate for detecting {@code effectSize} at alpha 0.05 with {@code sampleSize}
   * subjects, bucketed from {@code z_beta = sqrt(n)*|d| - 1.96}.
   */
  public static double estimateStatisticalPower(double effectSize, long sampleSize) {
    double zBeta = Math.sqrt(Math.max(0, sampleSize)) * Math.abs(effectSize) - 1.96;
    if (zBeta <= -3) return 0.001;
    if (zBeta <= -2) return 0.025;
    if (zBeta <= -1) return 0.16;
    if (zBeta <= 0) return 0.5;
    if (zBeta <= 1) return 0.84;
    if (zBeta <= 2) return 0.975;
    return 0.999;
  }
}
