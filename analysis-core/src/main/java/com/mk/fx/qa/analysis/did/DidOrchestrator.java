package com.mk.fx.qa.analysis.did;

import static com.mk.fx.qa.analysis.did.DidEstimator.interpretEffectSize;
import static com.mk.fx.qa.analysis.did.DidEstimator.isSignificant;
import static com.mk.fx.qa.analysis.utils.AnalysisFormat.fixed1;
import static com.mk.fx.qa.analysis.utils.AnalysisFormat.fixed2;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the {@link DidEstimator} over every metric of an experiment, gates each on data quality and
 * sample size, and summarises the surviving results.
 *
 * <p>A metric that fails validation, lacks power or breaks during estimation is recorded as
 * {@link MetricOutcome.Excluded} and never affects the other metrics.
 */
public class DidOrchestrator {

  private final DidEstimator estimator;

  public DidOrchestrator() {
    this(new DidEstimator());
  }

  public DidOrchestrator(DidEstimator estimator) {
    this.estimator = Objects.requireNonNull(estimator, "estimator");
  }

  /**
   * Analyses every metric in the iteration order of {@code experimentMetrics}.
   *
   * @param experimentMetrics time series keyed by metric id
   * @param options confidence level, minimum sample size and alpha
   * @return included results and exclusions, in input order
   */
  public DidAnalysis runDidAnalysis(
      Map<String, List<TimeSeriesPoint>> experimentMetrics, DidAnalysisOptions options) {
    Objects.requireNonNull(experimentMetrics, "experimentMetrics");
    Objects.requireNonNull(options, "options");

    Map<String, MetricOutcome> outcomes = new LinkedHashMap<>();
    for (Map.Entry<String, List<TimeSeriesPoint>> entry : experimentMetrics.entrySet()) {
      String metricId = entry.getKey();
      outcomes.put(metricId, analyseMetric(metricId, entry.getValue(), options));
    }
    return new DidAnalysis(outcomes, options.alpha());
  }

  private MetricOutcome analyseMetric(
      String metricId, List<TimeSeriesPoint> series, DidAnalysisOptions options) {
    try {
      SeriesValidation validation = estimator.validate(series);
      if (!validation.isValid()) {
        return new MetricOutcome.Excluded(
            metricId, ExclusionReason.DATA_QUALITY, validation.errors());
      }

      DidResult result = estimator.calculate(series, options.confidenceLevel());
      if (result.sampleSizeTreatment() < options.minimumSampleSize()
          || result.sampleSizeControl() < options.minimumSampleSize()) {
        return new MetricOutcome.Excluded(
            metricId,
            ExclusionReason.INSUFFICIENT_POWER,
            List.of(
                String.format(
                    Locale.ROOT,
                    "Insufficient sample size (treatment=%d, control=%d, minimum=%d)",
                    result.sampleSizeTreatment(),
                    result.sampleSizeControl(),
                    options.minimumSampleSize())));
      }
      if (!result.isFinite()) {
        return new MetricOutcome.Excluded(
            metricId,
            ExclusionReason.COMPUTATION_ERROR,
            List.of("Estimation produced non-finite values"));
      }
      return new MetricOutcome.Included(metricId, result);
    } catch (RuntimeException ex) {
      String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
      return new MetricOutcome.Excluded(
          metricId, ExclusionReason.COMPUTATION_ERROR, List.of(message));
    }
  }

  /** Cross-metric summary; the strongest effect keeps the first metric seen on exact ties. */
  public AggregateStatistics aggregate(Map<String, DidResult> results) {
    if (results.isEmpty()) {
      return AggregateStatistics.empty();
    }

    int significant = 0;
    double totalEffect = 0.0;
    StrongestEffect strongest = null;
    for (Map.Entry<String, DidResult> e : results.entrySet()) {
      DidResult r = e.getValue();
      if (isSignificant(r.pValue())) significant++;
      double magnitude = Math.abs(r.effectSize());
      totalEffect += magnitude;
      if (strongest == null || magnitude > Math.abs(strongest.effectSize())) {
        strongest = new StrongestEffect(e.getKey(), r.effectSize());
      }
    }
    return new AggregateStatistics(
        results.size(), significant, totalEffect / results.size(), strongest, significant > 0);
  }

  /** Human-readable findings for a run, most general first. */
  public List<String> narrate(Map<String, DidResult> results, ExperimentPeriod period) {
    List<String> insights = new ArrayList<>();
    AggregateStatistics stats = aggregate(results);

    if (stats.overallSignificance()) {
      insights.add(
          String.format(
              Locale.ROOT,
              "Experiment shows statistically significant results in %d out of %d metrics",
              stats.significantMetrics(), stats.totalMetrics()));
    } else {
      insights.add(
          String.format(
              Locale.ROOT,
              "Experiment did not achieve statistical significance in any of the %d measured metrics",
              stats.totalMetrics()));
    }

    double avg = stats.averageEffectSize();
    String avgText = fixed2(avg);
    if (avg > 0.8) {
      insights.add(
          "Large average effect size (" + avgText + ") indicates strong treatment impact");
    } else if (avg > 0.5) {
      insights.add(
          "Medium average effect size (" + avgText + ") indicates moderate treatment impact");
    } else if (avg > 0.2) {
      insights.add(
          "Small average effect size (" + avgText + ") indicates minimal treatment impact");
    } else {
      insights.add(
          "Negligible average effect size ("
              + avgText
              + ") indicates little to no treatment impact");
    }

    StrongestEffect strongest = stats.strongestEffect();
    if (strongest != null) {
      insights.add(
          String.format(
              Locale.ROOT,
              "Strongest effect observed in metric '%s' with %s effect size (%s)",
              strongest.metricId(),
              interpretEffectSize(strongest.effectSize()),
              fixed2(strongest.effectSize())));
    }

    long days = period.durationDays();
    if (days < 7) {
      insights.add(
          "Short experiment duration (" + days + " days) may limit reliability of results");
    } else if (days > 30) {
      insights.add(
          "Extended experiment duration (" + days + " days) provides robust data for analysis");
    }

    for (Map.Entry<String, DidResult> e : results.entrySet()) {
      DidResult r = e.getValue();
      if (isSignificant(r.pValue())) {
        String direction = r.absoluteDifference() > 0 ? "positive" : "negative";
        String magnitude = fixed1(Math.abs(r.relativeDifference() * 100));
        insights.add(
            String.format(
                Locale.ROOT,
                "Metric '%s' shows %s %s%% change with %d%% confidence",
                e.getKey(), direction, magnitude, r.confidenceLevel()));
      }
    }
    return insights;
  }
}
