package com.mk.fx.qa.analysis.service.model;

/** Result of handling one experiment result. {@code analysisId} is null when nothing was stored. */
public record AnalysisOutcome(
    String experimentId, String analysisId, OutcomeType type, String message) {

  public enum OutcomeType {
    ANALYZED,
    SKIPPED,
    FAILED
  }

  public boolean isSuccess() {
    return type != OutcomeType.FAILED;
  }

  public static AnalysisOutcome analyzed(String experimentId, String analysisId) {
    return new AnalysisOutcome(experimentId, analysisId, OutcomeType.ANALYZED, "Analysis complete");
  }

  public static AnalysisOutcome skipped(String experimentId, String message) {
    return new AnalysisOutcome(experimentId, null, OutcomeType.SKIPPED, message);
  }

  public static AnalysisOutcome failed(String experimentId, String analysisId, String message) {
    return new AnalysisOutcome(experimentId, analysisId, OutcomeType.FAILED, message);
  }
}
