package com.mk.fx.qa.analysis.insights;

import java.util.List;

/**
 * Recommendation report for one analysis run. Built once and never mutated.
 *
 * @param summary executive summary paragraph
 * @param keyFindings statistical, economic and data-quality findings in that order
 * @param recommendations actions to take
 * @param riskFactors conditions that weaken the recommendation
 * @param implementationGuidance rollout complexity and effort
 * @param confidence discretised confidence with reasoning
 */
public record InsightAnalysis(
    String summary,
    List<String> keyFindings,
    List<String> recommendations,
    List<String> riskFactors,
    ImplementationGuidance implementationGuidance,
    ConfidenceAssessment confidence) {

  public InsightAnalysis {
    keyFindings = List.copyOf(keyFindings);
    recommendations = List.copyOf(recommendations);
    riskFactors = List.copyOf(riskFactors);
  }
}
