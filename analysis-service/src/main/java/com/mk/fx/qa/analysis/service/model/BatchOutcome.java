package com.mk.fx.qa.analysis.service.model;

import java.util.List;

/**
 * Counts for a batch of experiment results. Skipped records count as successful.
 *
 * @param results one outcome per input record, in input order
 */
public record BatchOutcome(int processed, int successful, int failed, List<AnalysisOutcome> results) {

  public static BatchOutcome of(List<AnalysisOutcome> results) {
    int ok = (int) results.stream().filter(AnalysisOutcome::isSuccess).count();
    return new BatchOutcome(results.size(), ok, results.size() - ok, List.copyOf(results));
  }
}
