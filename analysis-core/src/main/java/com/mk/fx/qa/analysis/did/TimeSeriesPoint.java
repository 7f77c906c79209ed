package com.mk.fx.qa.analysis.did;

import java.time.Instant;

/**
 * One paired observation of a metric for the treatment and control arms.
 *
 * @param timestamp when the observation was taken, may be null for synthetic series
 * @param treatmentValue metric value in the treatment arm
 * @param controlValue metric value in the control arm
 * @param treatmentSampleSize subjects contributing to the treatment value
 * @param controlSampleSize subjects contributing to the control value
 */
public record TimeSeriesPoint(
    Instant timestamp,
    double treatmentValue,
    double controlValue,
    long treatmentSampleSize,
    long controlSampleSize) {

  public static TimeSeriesPoint of(
      double treatmentValue, double controlValue, long treatmentSampleSize, long controlSampleSize) {
    return new TimeSeriesPoint(
        null, treatmentValue, controlValue, treatmentSampleSize, controlSampleSize);
  }
}
