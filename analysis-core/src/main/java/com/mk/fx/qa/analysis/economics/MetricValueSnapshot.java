package com.mk.fx.qa.analysis.economics;

import java.time.Instant;

/**
 * Economic value of one unit of a metric, copied from the live pricing configuration when an
 * analysis runs so later edits do not change historical results.
 *
 * @param dollarsPerUnit dollar value of a one-unit change
 * @param description how the value was derived
 * @param unit display unit of the metric
 * @param capturedAt when the copy was taken, null when unknown
 */
public record MetricValueSnapshot(
    double dollarsPerUnit, String description, String unit, Instant capturedAt) {

  public static MetricValueSnapshot of(double dollarsPerUnit, String description, String unit) {
    return new MetricValueSnapshot(dollarsPerUnit, description, unit, null);
  }
}
