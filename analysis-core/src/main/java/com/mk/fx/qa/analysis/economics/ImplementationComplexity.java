package com.mk.fx.qa.analysis.economics;

import java.util.List;

/** Complexity tier with the reasoning and the fixed recommendations for that tier. */
public record ImplementationComplexity(
    Complexity complexity, String reasoning, List<String> recommendations) {

  public ImplementationComplexity {
    recommendations = List.copyOf(recommendations);
  }
}
