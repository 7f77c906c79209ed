package com.mk.fx.qa.analysis;

import com.mk.fx.qa.analysis.did.DidAnalysis;
import com.mk.fx.qa.analysis.economics.EconomicImpact;
import com.mk.fx.qa.analysis.insights.InsightAnalysis;

/** Immutable output of one full pipeline run. */
public record AnalysisReport(
    DidAnalysis didAnalysis, EconomicImpact economicImpact, InsightAnalysis insights) {}
