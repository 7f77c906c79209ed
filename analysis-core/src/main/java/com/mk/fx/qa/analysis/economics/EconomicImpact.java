package com.mk.fx.qa.analysis.economics;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.mk.fx.qa.analysis.stats.Interval;

/**
 * Dollar-denominated view of a DiD run.
 *
 * @param totalImpact sum of included per-metric daily impacts
 * @param annualizedImpact total scaled by {@code annualizationFactor / durationDays}
 * @param roiPercentage {@code totalImpact * 100} clamped to [-100, 1000]
 * @param metricBreakdown per-metric impact in input order
 * @param confidenceInterval dollar interval summed over included metrics, ignoring covariance
 * @param missingPricing metrics that had a result but no pricing snapshot
 */
public record EconomicImpact(
    double totalImpact,
    double annualizedImpact,
    double roiPercentage,
    ImmutableMap<String, MetricImpact> metricBreakdown,
    Interval confidenceInterval,
    ImmutableList<String> missingPricing) {}
