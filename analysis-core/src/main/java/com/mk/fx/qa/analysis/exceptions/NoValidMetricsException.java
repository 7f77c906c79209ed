package com.mk.fx.qa.analysis.exceptions;

import com.mk.fx.qa.analysis.did.MetricOutcome;
import java.util.List;
import lombok.Getter;

/**
 * Thrown when every metric of an experiment was excluded. Carries the exclusions so the caller can
 * report which metrics were dropped and why.
 */
@Getter
public class NoValidMetricsException extends AnalysisException {

  private final List<MetricOutcome.Excluded> exclusions;

  public NoValidMetricsException(List<MetricOutcome.Excluded> exclusions) {
    super(buildMessage(exclusions));
    this.exclusions = List.copyOf(exclusions);
  }

  private static String buildMessage(List<MetricOutcome.Excluded> exclusions) {
    if (exclusions.isEmpty()) {
      return "No valid metrics found for analysis: experiment contains no metrics";
    }
    StringBuilder sb = new StringBuilder("No valid metrics found for analysis: ");
    for (int i = 0; i < exclusions.size(); i++) {
      var ex = exclusions.get(i);
      if (i > 0) sb.append("; ");
      sb.append(ex.metricId()).append(" (").append(ex.reason()).append(')');
    }
    return sb.toString();
  }
}
