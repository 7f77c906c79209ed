package com.mk.fx.qa.analysis.did;

import com.mk.fx.qa.analysis.stats.Interval;

/**
 * Statistical result of the differences-in-differences estimate for one metric.
 *
 * <p>{@code absoluteDifference} is {@code treatmentMean - controlMean}; {@code relativeDifference}
 * divides it by {@code controlMean} and is 0 when the control mean is 0. Sample sizes are sums over
 * every point of the series.
 */
public record DidResult(
    double treatmentMean,
    double controlMean,
    double absoluteDifference,
    double relativeDifference,
    double pValue,
    int confidenceLevel,
    Interval confidenceInterval,
    long sampleSizeControl,
    long sampleSizeTreatment,
    double effectSize) {

  boolean isFinite() {
    return Double.isFinite(treatmentMean)
        && Double.isFinite(controlMean)
        && Double.isFinite(absoluteDifference)
        && Double.isFinite(relativeDifference)
        && Double.isFinite(effectSize)
        && Double.isFinite(confidenceInterval.lower())
        && Double.isFinite(confidenceInterval.upper());
  }
}
