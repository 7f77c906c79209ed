package com.mk.fx.qa.analysis.service.model;

import com.mk.fx.qa.analysis.did.TimeSeriesPoint;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExperimentMetric {

  private List<TimeSeriesSample> timeSeries = new ArrayList<>();

  private MetricSummary summary;

  /** Core series for this metric; missing samples stay in place as {@code null} points. */
  public List<TimeSeriesPoint> toSeries() {
    if (timeSeries == null) {
      return List.of();
    }
    return timeSeries.stream().map(s -> s == null ? null : s.toPoint()).toList();
  }
}
