package com.mk.fx.qa.analysis.insights;

import com.mk.fx.qa.analysis.economics.Complexity;
import java.util.List;

/** Rollout guidance: complexity tier, effort range and the factors the rollout depends on. */
public record ImplementationGuidance(
    Complexity complexity, String estimatedEffort, List<String> criticalSuccessFactors) {

  public ImplementationGuidance {
    criticalSuccessFactors = List.copyOf(criticalSuccessFactors);
  }
}
