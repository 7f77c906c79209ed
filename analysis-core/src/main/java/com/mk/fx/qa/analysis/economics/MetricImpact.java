package com.mk.fx.qa.analysis.economics;

/**
 * Dollar impact attributed to one metric.
 *
 * @param dollarImpact daily dollar impact, {@code metricChange * metricValueUsed}
 * @param metricValueUsed dollars per unit applied
 * @param metricChange absolute treatment-minus-control difference
 */
public record MetricImpact(double dollarImpact, double metricValueUsed, double metricChange) {}
