package com.mk.fx.qa.analysis.economics;

/** Implementation complexity tier. */
public enum Complexity {
  LOW(1),
  MEDIUM(3),
  HIGH(6);

  private final int baseWeeks;

  Complexity(int baseWeeks) {
    this.baseWeeks = baseWeeks;
  }

  int baseWeeks() {
    return baseWeeks;
  }

  /**
   * Effort range for rolling out a change of this tier that touches {@code significantMetrics}
   * metrics.
   */
  public String estimatedEffort(int significantMetrics) {
    int weeks = baseWeeks + significantMetrics / 2;
    if (weeks <= 1) return "1-2 weeks";
    if (weeks <= 4) return "2-4 weeks";
    if (weeks <= 8) return "1-2 months";
    return "2+ months";
  }
}
