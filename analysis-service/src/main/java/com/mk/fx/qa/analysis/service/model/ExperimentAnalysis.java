package com.mk.fx.qa.analysis.service.model;

import com.mk.fx.qa.analysis.did.DidResult;
import com.mk.fx.qa.analysis.did.ExperimentPeriod;
import com.mk.fx.qa.analysis.did.MetricOutcome;
import com.mk.fx.qa.analysis.economics.EconomicImpact;
import com.mk.fx.qa.analysis.economics.MetricValueSnapshot;
import com.mk.fx.qa.analysis.insights.InsightAnalysis;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persisted analysis of one experiment result, keyed by {@code (experimentId, analysisId)}.
 *
 * <p>{@code economicImpact} and {@code insights} are null unless the status is {@link
 * AnalysisStatus#COMPLETE}. {@code metricValuesSnapshot} holds the pricing in force when the run
 * started so later pricing edits do not change the stored figures.
 */
public record ExperimentAnalysis(
    String experimentId,
    String analysisId,
    Instant resultGeneratedAt,
    Map<String, DidResult> didResults,
    EconomicImpact economicImpact,
    InsightAnalysis insights,
    Map<String, MetricValueSnapshot> metricValuesSnapshot,
    List<MetricOutcome.Excluded> exclusions,
    Instant analysisTimestamp,
    ExperimentPeriod experimentPeriod,
    AnalysisStatus status,
    String version,
    String errorMessage) {

  public ExperimentAnalysis {
    didResults = didResults == null ? Map.of() : didResults;
    metricValuesSnapshot = metricValuesSnapshot == null ? Map.of() : metricValuesSnapshot;
    exclusions = exclusions == null ? List.of() : List.copyOf(exclusions);
  }

  public static ExperimentAnalysis processing(
      String experimentId,
      String analysisId,
      Instant resultGeneratedAt,
      Map<String, MetricValueSnapshot> snapshot,
      Instant startedAt,
      ExperimentPeriod period,
      String version) {
    return new ExperimentAnalysis(
        experimentId,
        analysisId,
        resultGeneratedAt,
        Map.of(),
        null,
        null,
        snapshot,
        List.of(),
        startedAt,
        period,
        AnalysisStatus.PROCESSING,
        version,
        null);
  }

  public ExperimentAnalysis complete(
      Map<String, DidResult> results,
      EconomicImpact impact,
      InsightAnalysis insightAnalysis,
      List<MetricOutcome.Excluded> excluded) {
    return new ExperimentAnalysis(
        experimentId,
        analysisId,
        resultGeneratedAt,
        results,
        impact,
        insightAnalysis,
        metricValuesSnapshot,
        excluded,
        analysisTimestamp,
        experimentPeriod,
        AnalysisStatus.COMPLETE,
        version,
        null);
  }

  public ExperimentAnalysis failed(String message, List<MetricOutcome.Excluded> excluded) {
    return new ExperimentAnalysis(
        experimentId,
        analysisId,
        resultGeneratedAt,
        didResults,
        null,
        null,
        metricValuesSnapshot,
        excluded,
        analysisTimestamp,
        experimentPeriod,
        AnalysisStatus.FAILED,
        version,
        message);
  }
}
