package com.mk.fx.qa.analysis;

import com.mk.fx.qa.analysis.did.DidAnalysis;
import com.mk.fx.qa.analysis.did.DidAnalysisOptions;
import com.mk.fx.qa.analysis.did.DidOrchestrator;
import com.mk.fx.qa.analysis.did.DidResult;
import com.mk.fx.qa.analysis.did.ExperimentPeriod;
import com.mk.fx.qa.analysis.did.TimeSeriesPoint;
import com.mk.fx.qa.analysis.economics.EconomicImpact;
import com.mk.fx.qa.analysis.economics.EconomicImpactTranslator;
import com.mk.fx.qa.analysis.economics.EconomicOptions;
import com.mk.fx.qa.analysis.economics.MetricValueSnapshot;
import com.mk.fx.qa.analysis.exceptions.NoValidMetricsException;
import com.mk.fx.qa.analysis.insights.InsightAnalysis;
import com.mk.fx.qa.analysis.insights.InsightSynthesizer;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry points into the analysis core: DiD estimation, economic translation and insight synthesis.
 *
 * <p>Pure and synchronous. Identical inputs always produce equal outputs, so callers may skip
 * re-running an analysis for an event they have already processed.
 */
public class AnalysisPipeline {

  private final DidOrchestrator didOrchestrator;
  private final EconomicImpactTranslator translator;
  private final InsightSynthesizer synthesizer;

  public AnalysisPipeline() {
    this(new DidOrchestrator(), new EconomicImpactTranslator());
  }

  public AnalysisPipeline(DidOrchestrator didOrchestrator, EconomicImpactTranslator translator) {
    this(didOrchestrator, translator, new InsightSynthesizer(didOrchestrator, translator));
  }

  public AnalysisPipeline(
      DidOrchestrator didOrchestrator,
      EconomicImpactTranslator translator,
      InsightSynthesizer synthesizer) {
    this.didOrchestrator = Objects.requireNonNull(didOrchestrator, "didOrchestrator");
    this.translator = Objects.requireNonNull(translator, "translator");
    this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
  }

  public DidAnalysis runDidAnalysis(
      Map<String, List<TimeSeriesPoint>> experimentMetrics, DidAnalysisOptions options) {
    return didOrchestrator.runDidAnalysis(experimentMetrics, options);
  }

  public EconomicImpact computeEconomicImpact(
      Map<String, DidResult> didResults,
      Map<String, MetricValueSnapshot> metricValues,
      double durationDays,
      EconomicOptions options) {
    return translator.computeEconomicImpact(didResults, metricValues, durationDays, options);
  }

  public InsightAnalysis synthesizeInsights(
      Map<String, DidResult> didResults,
      EconomicImpact economicImpact,
      ExperimentPeriod period,
      Map<String, MetricValueSnapshot> metricValues) {
    return synthesizer.synthesizeInsights(didResults, economicImpact, period, metricValues);
  }

  /**
   * Runs all three stages.
   *
   * @param economicDurationDays fractional measured duration used for annualization
   * @throws NoValidMetricsException if every metric was excluded
   */
  public AnalysisReport analyze(
      Map<String, List<TimeSeriesPoint>> experimentMetrics,
      Map<String, MetricValueSnapshot> metricValues,
      ExperimentPeriod period,
      double economicDurationDays,
      DidAnalysisOptions didOptions,
      EconomicOptions economicOptions) {
    DidAnalysis did = runDidAnalysis(experimentMetrics, didOptions);
    if (!did.hasResults()) {
      throw new NoValidMetricsException(did.exclusions());
    }
    EconomicImpact impact =
        computeEconomicImpact(did.results(), metricValues, economicDurationDays, economicOptions);
    InsightAnalysis insights = synthesizeInsights(did.results(), impact, period, metricValues);
    return new AnalysisReport(did, impact, insights);
  }
}
