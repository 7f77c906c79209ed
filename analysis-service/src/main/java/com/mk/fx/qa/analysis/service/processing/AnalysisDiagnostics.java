package com.mk.fx.qa.analysis.service.processing;

import static com.mk.fx.qa.analysis.utils.AnalysisFormat.fixed2;
import static com.mk.fx.qa.analysis.utils.AnalysisFormat.fixed4;
import static com.mk.fx.qa.analysis.utils.AnalysisFormat.grouped;

import com.mk.fx.qa.analysis.AnalysisReport;
import com.mk.fx.qa.analysis.did.DidAnalysis;
import com.mk.fx.qa.analysis.did.DidEstimator;
import com.mk.fx.qa.analysis.did.MetricOutcome;
import com.mk.fx.qa.analysis.service.exceptions.InvalidExperimentResultException;
import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns the diagnostics the analysis core returns as values into log lines. The core itself never
 * logs.
 */
@Slf4j
@Component
public class AnalysisDiagnostics {

  public void runStarted(String experimentId, String analysisId, int metricCount) {
    log.info(
        "Analysis {} started for experiment {} ({} metrics)", analysisId, experimentId, metricCount);
  }

  public void noPricing(String experimentId) {
    log.warn(
        "No metric values configured for experiment {}; economic impact will be limited",
        experimentId);
  }

  public void metricResults(String experimentId, DidAnalysis did) {
    did.results()
        .forEach(
            (metricId, r) ->
                log.info(
                    "Experiment {}: metric {} diff={} p={} significant={} (alpha={}) effect={}",
                    experimentId,
                    metricId,
                    fixed4(r.absoluteDifference()),
                    r.pValue(),
                    did.isSignificant(metricId),
                    did.alpha(),
                    DidEstimator.interpretEffectSize(r.effectSize())));
  }

  public void exclusions(String experimentId, List<MetricOutcome.Excluded> exclusions) {
    for (MetricOutcome.Excluded ex : exclusions) {
      log.warn(
          "Experiment {}: metric {} excluded ({}): {}",
          experimentId,
          ex.metricId(),
          ex.reason(),
          String.join("; ", ex.details()));
    }
  }

  public void missingPricing(String experimentId, List<String> metricIds) {
    if (!metricIds.isEmpty()) {
      log.warn(
          "Experiment {}: no economic value for {}; left out of economic totals",
          experimentId,
          metricIds);
    }
  }

  public void runCompleted(String experimentId, String analysisId, AnalysisReport report) {
    var insights = report.insights();
    var impact = report.economicImpact();
    log.info("Analysis {} completed for experiment {}", analysisId, experimentId);
    log.info("Analysis summary: {}", insights.summary());
    log.info(
        "Key findings: {}, Recommendations: {}, Confidence: {}",
        insights.keyFindings().size(),
        insights.recommendations().size(),
        insights.confidence().level());
    log.info(
        "Economic impact: ${} daily, ${} annually",
        fixed2(impact.totalImpact()),
        grouped(impact.annualizedImpact()));
  }

  public void runFailed(String experimentId, String analysisId, Exception ex) {
    log.error(
        "Analysis {} failed for experiment {}: {}", analysisId, experimentId, ex.getMessage(), ex);
  }

  public void statusNotSaved(String experimentId, String analysisId, Exception ex) {
    log.error(
        "Failed to save error status for {}/{}: {}", experimentId, analysisId, ex.getMessage(), ex);
  }

  public void skipped(String experimentId, Instant generatedAt) {
    log.info(
        "Analysis already exists for experiment {} (generatedAt={}), skipping",
        experimentId,
        generatedAt);
  }

  public void rejected(InvalidExperimentResultException ex) {
    log.warn("Rejected experiment result: {}", ex.getMessage());
  }

  public void unreadable(String experimentId, Exception ex) {
    log.error("Experiment result {} could not be read: {}", experimentId, ex.getMessage(), ex);
  }

  public void batchProcessed(int processed, int successful, int failed) {
    log.info("Processed {} records: {} successful, {} failed", processed, successful, failed);
  }
}
