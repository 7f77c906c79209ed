package com.mk.fx.qa.analysis.service.model;

import com.mk.fx.qa.analysis.did.TimeSeriesPoint;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One hourly observation of a metric as delivered by the results generator. Values and sample
 * sizes are not constrained here; a bad point excludes only its own metric.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TimeSeriesSample {

  private Instant timestamp;

  private double treatmentValue;

  private double controlValue;

  private long treatmentSampleSize;

  private long controlSampleSize;

  public TimeSeriesPoint toPoint() {
    return new TimeSeriesPoint(
        timestamp, treatmentValue, controlValue, treatmentSampleSize, controlSampleSize);
  }
}
