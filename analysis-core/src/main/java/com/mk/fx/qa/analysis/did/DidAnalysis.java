package com.mk.fx.qa.analysis.did;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of running the estimator over every metric of an experiment: the included results plus
 * the excluded metrics with their reasons. Iteration order follows the input metric order.
 */
public final class DidAnalysis {

  private final ImmutableMap<String, MetricOutcome> outcomes;
  private final ImmutableMap<String, DidResult> results;
  private final ImmutableList<MetricOutcome.Excluded> exclusions;
  private final double alpha;

  DidAnalysis(Map<String, MetricOutcome> outcomes, double alpha) {
    this.outcomes = ImmutableMap.copyOf(outcomes);
    this.alpha = alpha;
    ImmutableMap.Builder<String, DidResult> included = ImmutableMap.builder();
    ImmutableList.Builder<MetricOutcome.Excluded> excluded = ImmutableList.builder();
    for (MetricOutcome outcome : this.outcomes.values()) {
      if (outcome instanceof MetricOutcome.Included in) {
        included.put(in.metricId(), in.result());
      } else if (outcome instanceof MetricOutcome.Excluded ex) {
        excluded.add(ex);
      }
    }
    this.results = included.build();
    this.exclusions = excluded.build();
  }

  /** Every metric in input order, included or not. */
  public ImmutableMap<String, MetricOutcome> outcomes() {
    return outcomes;
  }

  /** Included results keyed by metric id. */
  public ImmutableMap<String, DidResult> results() {
    return results;
  }

  public ImmutableList<MetricOutcome.Excluded> exclusions() {
    return exclusions;
  }

  public boolean hasResults() {
    return !results.isEmpty();
  }

  /** Significance threshold the run was configured with. */
  public double alpha() {
    return alpha;
  }

  /** Whether {@code metricId} was included and its p-value is below the run's alpha. */
  public boolean isSignificant(String metricId) {
    DidResult result = results.get(metricId);
    return result != null && DidEstimator.isSignificant(result.pValue(), alpha);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof DidAnalysis other)) return false;
    return Double.compare(alpha, other.alpha) == 0 && outcomes.equals(other.outcomes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(outcomes, alpha);
  }

  @Override
  public String toString() {
    return "DidAnalysis{included=" + results.keySet() + ", excluded=" + exclusions.size() + "}";
  }
}
