package com.mk.fx.qa.analysis.service.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Totals precomputed by the results generator. Informational only: estimation always works from the
 * time series.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MetricSummary {

  private double treatmentMean;

  private double controlMean;

  private long totalTreatmentSamples;

  private long totalControlSamples;
}
