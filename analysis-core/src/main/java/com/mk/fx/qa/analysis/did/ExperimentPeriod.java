package com.mk.fx.qa.analysis.did;

import java.time.Instant;

/**
 * Calendar span of an experiment.
 *
 * @param startDate first observation
 * @param endDate last observation
 * @param durationDays whole days covered, rounded up from the observed hours
 */
public record ExperimentPeriod(Instant startDate, Instant endDate, long durationDays) {

  public static ExperimentPeriod ofDays(long durationDays) {
    return new ExperimentPeriod(null, null, durationDays);
  }

  /** Builds a period from an hour count, rounding partial days up. */
  public static ExperimentPeriod fromHours(Instant startDate, Instant endDate, long totalHours) {
    return new ExperimentPeriod(startDate, endDate, (long) Math.ceil(totalHours / 24.0));
  }
}
