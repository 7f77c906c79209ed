package com.mk.fx.qa.analysis.did;

/**
 * Cross-metric summary of a DiD run.
 *
 * @param totalMetrics number of included metrics
 * @param significantMetrics metrics with p below 0.05
 * @param averageEffectSize mean of {@code |effectSize|}
 * @param strongestEffect largest {@code |effectSize|}, first seen wins ties; null when empty
 * @param overallSignificance whether at least one metric is significant
 */
public record AggregateStatistics(
    int totalMetrics,
    int significantMetrics,
    double averageEffectSize,
    StrongestEffect strongestEffect,
    boolean overallSignificance) {

  static AggregateStatistics empty() {
    return new AggregateStatistics(0, 0, 0.0, null, false);
  }
}
