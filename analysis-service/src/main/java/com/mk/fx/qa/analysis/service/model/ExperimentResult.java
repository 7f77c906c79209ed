package com.mk.fx.qa.analysis.service.model;

import com.mk.fx.qa.analysis.did.TimeSeriesPoint;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw output of one experiment run: paired treatment/control time series per metric. An analysis is
 * triggered for every new {@code (experimentId, generatedAt)} pair.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExperimentResult {

  @NotBlank private String experimentId;

  @NotNull private Map<String, ExperimentMetric> metrics = new LinkedHashMap<>();

  @NotNull private Instant generatedAt;

  @Valid @NotNull private ExperimentWindow experimentPeriod;

  /**
   * Time series per metric id in document order. A metric without a series maps to an empty one, so
   * the analysis excludes it on data quality.
   */
  public Map<String, List<TimeSeriesPoint>> toSeries() {
    Map<String, List<TimeSeriesPoint>> series = new LinkedHashMap<>();
    metrics.forEach(
        (metricId, metric) ->
            series.put(metricId, metric == null ? List.of() : metric.toSeries()));
    return series;
  }
}
