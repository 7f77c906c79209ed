package com.mk.fx.qa.analysis.stats;

import java.util.Map;

/**
 * Numeric primitives behind the DiD estimator.
 *
 * <p>All functions are pure and total: degenerate inputs (empty arrays, a single sample, zero
 * spread) yield 0 rather than NaN. The p-value and critical-value lookups are coarse tables, not
 * distribution functions.
 */
public final class StatMath {

  /** Two-tailed p-value buckets keyed on |t|, checked in descending order. */
  private static final double[][] P_VALUE_TABLE = {
    {2.576, 0.01},
    {1.96, 0.05},
    {1.645, 0.1},
    {1.282, 0.2},
  };

  private static final double P_VALUE_FLOOR = 0.5;

  private static final Map<Integer, Double> CRITICAL_VALUES =
      Map.of(
          90, 1.645,
          95, 1.96,
          99, 2.576);

  public static final double DEFAULT_CRITICAL_VALUE = 1.96;

  private StatMath() {
    // Utility class, no instantiation
  }

  public static double mean(double[] values) {
    if (values.length == 0) return 0.0;
    double sum = 0.0;
    for (double v : values) sum += v;
    return sum / values.length;
  }

  /** Population standard deviation; 0 for fewer than two samples. */
  public static double standardDeviation(double[] values) {
    if (values.length <= 1) return 0.0;
    double avg = mean(values);
    double squaredDiffs = 0.0;
    for (double v : values) {
      double d = v - avg;
      squaredDiffs += d * d;
    }
    return Math.sqrt(squaredDiffs / values.length);
  }

  public static double standardError(double[] values) {
    if (values.length <= 1) return 0.0;
    return standardDeviation(values) / Math.sqrt(values.length);
  }

  /**
   * Cohen's d using a pooled standard deviation weighted by {@code (n1-1)+(n2-1)} degrees of
   * freedom.
   *
   * @return 0 when either group is empty or the pooled deviation is 0
   */
  public static double cohensD(double[] treatment, double[] control) {
    if (treatment.length == 0 || control.length == 0) return 0.0;

    double sdTreatment = standardDeviation(treatment);
    double sdControl = standardDeviation(control);
    double pooledVariance =
        ((treatment.length - 1) * sdTreatment * sdTreatment
                + (control.length - 1) * sdControl * sdControl)
            / (treatment.length + control.length - 2);
    double pooledSd = Math.sqrt(pooledVariance);

    if (pooledSd == 0.0 || Double.isNaN(pooledSd)) return 0.0;
    return (mean(treatment) - mean(control)) / pooledSd;
  }

  public static int degreesOfFreedom(int n1, int n2) {
    return n1 + n2 - 2;
  }

  /** Independent-samples t statistic; 0 when the combined standard error is 0. */
  public static double tStatistic(double[] treatment, double[] control) {
    if (treatment.length == 0 || control.length == 0) return 0.0;
    double se = combinedStandardError(treatment, control);
    if (se == 0.0) return 0.0;
    return (mean(treatment) - mean(control)) / se;
  }

  /** {@code sqrt(se(treatment)^2 + se(control)^2)}. */
  public static double combinedStandardError(double[] treatment, double[] control) {
    double seTreatment = standardError(treatment);
    double seControl = standardError(control);
    return Math.sqrt(seTreatment * seTreatment + seControl * seControl);
  }

  /**
   * Approximate two-tailed p-value from a fixed threshold table on {@code |t|}.
   *
   * @return 1 when {@code df <= 0}; otherwise one of 0.01, 0.05, 0.1, 0.2 or 0.5
   */
  public static double approximatePValue(double tStat, int df) {
    if (df <= 0) return 1.0;
    double absT = Math.abs(tStat);
    for (double[] bucket : P_VALUE_TABLE) {
      if (absT >= bucket[0]) return bucket[1];
    }
    return P_VALUE_FLOOR;
  }

  /** Critical value for 90, 95 or 99 percent; any other level falls back to 1.96. */
  public static double criticalValue(int confidenceLevel) {
    return CRITICAL_VALUES.getOrDefault(confidenceLevel, DEFAULT_CRITICAL_VALUE);
  }

  public static Interval confidenceInterval(double meanDiff, double standardError, int level) {
    double margin = criticalValue(level) * standardError;
    return new Interval(meanDiff - margin, meanDiff + margin);
  }
}
