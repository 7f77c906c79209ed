package com.mk.fx.qa.analysis.service.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.mk.fx.qa.analysis.did.ExperimentPeriod;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Observed span of an experiment; {@code totalHours} is the number of hourly data points. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExperimentWindow {

  @NotNull private Instant startDate;

  @NotNull private Instant endDate;

  @Positive private long totalHours;

  @JsonIgnore
  @AssertTrue(message = "endDate must be after startDate")
  public boolean isEndAfterStart() {
    return startDate == null || endDate == null || endDate.isAfter(startDate);
  }

  /** Fractional days, used to annualize the economic impact. */
  @JsonIgnore
  public double durationDays() {
    return totalHours / 24.0;
  }

  /** Whole days rounded up, as reported alongside the analysis. */
  public ExperimentPeriod toPeriod() {
    return ExperimentPeriod.fromHours(startDate, endDate, totalHours);
  }
}
