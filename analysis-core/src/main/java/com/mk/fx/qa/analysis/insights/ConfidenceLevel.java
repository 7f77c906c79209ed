package com.mk.fx.qa.analysis.insights;

/** Discretised confidence in an analysis' recommendation. */
public enum ConfidenceLevel {
  LOW("Low", "due to"),
  MEDIUM("Medium", "with"),
  HIGH("High", "due to");

  private final String label;
  private final String connective;

  ConfidenceLevel(String label, String connective) {
    this.label = label;
    this.connective = connective;
  }

  /** Score of 6 or more is high, 3 or more medium, anything else low. */
  static ConfidenceLevel fromScore(int score) {
    if (score >= 6) return HIGH;
    if (score >= 3) return MEDIUM;
    return LOW;
  }

  String label() {
    return label;
  }

  String connective() {
    return connective;
  }
}
