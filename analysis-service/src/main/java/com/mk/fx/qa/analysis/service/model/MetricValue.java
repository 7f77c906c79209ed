package com.mk.fx.qa.analysis.service.model;

import com.mk.fx.qa.analysis.economics.MetricValueSnapshot;
import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Live economic value of a metric as configured by the business. Analyses never read this
 * directly; they work on a {@link MetricValueSnapshot} taken when the run starts.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MetricValue {

  private String metricId;

  private double dollarsPerUnit;

  @NotBlank private String unit;

  private String name;

  private String description;

  private MetricCategory category = MetricCategory.OTHER;

  private Instant lastUpdated;

  private int version = 1;

  public MetricValueSnapshot snapshot(Instant capturedAt) {
    return new MetricValueSnapshot(dollarsPerUnit, description, unit, capturedAt);
  }
}
