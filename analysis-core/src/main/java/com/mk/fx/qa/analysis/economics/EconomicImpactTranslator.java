package com.mk.fx.qa.analysis.economics;

import static com.mk.fx.qa.analysis.did.DidEstimator.isSignificant;
import static com.mk.fx.qa.analysis.utils.AnalysisFormat.fixed1;
import static com.mk.fx.qa.analysis.utils.AnalysisFormat.fixed2;
import static com.mk.fx.qa.analysis.utils.AnalysisFormat.grouped;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.mk.fx.qa.analysis.did.DidResult;
import com.mk.fx.qa.analysis.stats.Interval;
import com.mk.fx.qa.analysis.stats.StatMath;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Translates per-metric DiD effects into dollars using externally supplied per-unit values.
 *
 * <p>Metrics without a pricing snapshot are left out of every total and listed in {@link
 * EconomicImpact#missingPricing()}.
 */
public class EconomicImpactTranslator {

  static final double ROI_CEILING = 1000.0;
  static final double ROI_FLOOR = -100.0;

  /**
   * Computes daily, annualized and ROI figures plus a dollar confidence interval.
   *
   * @param didResults included DiD results keyed by metric id
   * @param metricValues pricing snapshots keyed by metric id
   * @param experimentDurationDays measured duration, must be positive
   * @param options annualization factor, confidence level and significance filter
   * @throws IllegalArgumentException if the duration is not positive
   */
  public EconomicImpact computeEconomicImpact(
      Map<String, DidResult> didResults,
      Map<String, MetricValueSnapshot> metricValues,
      double experimentDurationDays,
      EconomicOptions options) {
    Objects.requireNonNull(didResults, "didResults");
    Objects.requireNonNull(metricValues, "metricValues");
    Objects.requireNonNull(options, "options");
    Preconditions.checkArgument(
        experimentDurationDays > 0, "experimentDurationDays must be > 0 but was %s",
        experimentDurationDays);

    ImmutableMap.Builder<String, MetricImpact> breakdown = ImmutableMap.builder();
    ImmutableList.Builder<String> missing = ImmutableList.builder();
    double totalImpact = 0.0;
    Interval interval = Interval.zero();

    for (Map.Entry<String, DidResult> entry : didResults.entrySet()) {
      String metricId = entry.getKey();
      DidResult result = entry.getValue();
      MetricValueSnapshot value = metricValues.get(metricId);
      if (value == null) {
        missing.add(metricId);
        continue;
      }
      if (options.includeOnlySignificant() && !isSignificant(result.pValue())) {
        continue;
      }

      double dollarsPerUnit = value.dollarsPerUnit();
      double change = result.absoluteDifference();
      double dailyImpact = change * dollarsPerUnit;
      breakdown.put(metricId, new MetricImpact(dailyImpact, dollarsPerUnit, change));
      totalImpact += dailyImpact;
      Interval metricInterval = intervalAt(result, options.confidenceLevel());
      interval = interval.plus(metricInterval.scale(dollarsPerUnit));
    }

    double annualized = totalImpact * (options.annualizationFactor() / experimentDurationDays);
    return new EconomicImpact(
        totalImpact,
        annualized,
        boundedRoi(totalImpact),
        breakdown.build(),
        interval,
        missing.build());
  }

  /**
   * Dollar interval summing each priced metric's DiD interval bounds times its dollar value. Cross
   * metric covariance is ignored.
   */
  public Interval confidenceInterval(
      Map<String, DidResult> didResults, Map<String, MetricValueSnapshot> metricValues) {
    Interval interval = Interval.zero();
    for (Map.Entry<String, DidResult> entry : didResults.entrySet()) {
      MetricValueSnapshot value = metricValues.get(entry.getKey());
      if (value == null) continue;
      interval = interval.plus(entry.getValue().confidenceInterval().scale(value.dollarsPerUnit()));
    }
    return interval;
  }

  /**
   * The metric's interval re-expressed at {@code confidenceLevel}, recovering the standard error
   * from the half width at the level it was estimated with.
   */
  static Interval intervalAt(DidResult result, int confidenceLevel) {
    if (result.confidenceLevel() == confidenceLevel) {
      return result.confidenceInterval();
    }
    Interval ci = result.confidenceInterval();
    double standardError =
        (ci.upper() - ci.lower()) / 2 / StatMath.criticalValue(result.confidenceLevel());
    return StatMath.confidenceInterval(
        result.absoluteDifference(), standardError, confidenceLevel);
  }

  static double boundedRoi(double totalImpact) {
    if (totalImpact > 0) {
      return Math.min(totalImpact * 100, ROI_CEILING);
    }
    return Math.max(totalImpact * 100, ROI_FLOOR);
  }

  /** Classifies rollout complexity by the number of significant metrics. */
  public ImplementationComplexity estimateImplementationComplexity(
      Map<String, DidResult> didResults) {
    long significant =
        didResults.values().stream().filter(r -> isSignificant(r.pValue())).count();

    if (significant == 0) {
      return new ImplementationComplexity(
          Complexity.LOW,
          "No significant effects to implement",
          List.of("Monitor results over longer period", "Consider alternative approaches"));
    }
    if (significant == 1) {
      return new ImplementationComplexity(
          Complexity.LOW,
          "Single metric optimization is straightforward to implement",
          List.of("Focus implementation on single significant metric"));
    }
    if (significant <= 3) {
      return new ImplementationComplexity(
          Complexity.MEDIUM,
          "Multiple metrics require coordinated implementation approach",
          List.of(
              "Implement changes gradually to monitor individual metric impacts",
              "Consider A/B testing individual components"));
    }
    return new ImplementationComplexity(
        Complexity.HIGH,
        "Complex multi-metric optimization requires careful orchestration",
        List.of(
            "Develop comprehensive implementation plan",
            "Consider phased rollout to manage complexity",
            "Establish monitoring for all affected metrics"));
  }

  /** Human-readable economic findings, overall direction first. */
  public List<String> narrate(EconomicImpact impact, long experimentDurationDays) {
    List<String> insights = new ArrayList<>();
    double total = impact.totalImpact();
    double annual = impact.annualizedImpact();

    if (total > 0) {
      insights.add("Positive economic impact of $" + fixed2(total) + " per day");
      if (annual > 10_000) {
        insights.add(
            "Strong annualized value of $"
                + grouped(annual)
                + " suggests high-value optimization");
      } else if (annual > 1_000) {
        insights.add(
            "Moderate annualized value of $" + grouped(annual) + " justifies implementation");
      } else {
        insights.add(
            "Limited annualized value of $"
                + grouped(annual)
                + " may not justify implementation costs");
      }
    } else if (total < 0) {
      insights.add(
          "Negative economic impact of $"
              + fixed2(Math.abs(total))
              + " per day - treatment reduces value");
      insights.add(
          "Projected annual loss of $"
              + grouped(Math.abs(annual))
              + " suggests avoiding this change");
    } else {
      insights.add("Neutral economic impact - treatment shows no significant financial effect");
    }

    double roi = impact.roiPercentage();
    String roiText = fixed1(roi);
    if (roi > 100) {
      insights.add("Exceptional ROI of " + roiText + "% indicates highly profitable optimization");
    } else if (roi > 20) {
      insights.add("Strong ROI of " + roiText + "% exceeds typical business thresholds");
    } else if (roi > 0) {
      insights.add("Positive ROI of " + roiText + "% provides business value");
    } else {
      insights.add("Negative ROI of " + roiText + "% suggests treatment reduces business value");
    }

    String topMetric = null;
    MetricImpact top = null;
    for (Map.Entry<String, MetricImpact> e : impact.metricBreakdown().entrySet()) {
      if (top == null || Math.abs(e.getValue().dollarImpact()) > Math.abs(top.dollarImpact())) {
        topMetric = e.getKey();
        top = e.getValue();
      }
    }
    if (top != null) {
      String direction = top.dollarImpact() > 0 ? "positive" : "negative";
      insights.add(
          String.format(
              Locale.ROOT,
              "Primary value driver: '%s' contributes %s $%s daily impact",
              topMetric, direction, fixed2(Math.abs(top.dollarImpact()))));
    }

    if (experimentDurationDays < 7) {
      insights.add(
          "Short experiment duration ("
              + experimentDurationDays
              + " days) limits confidence in economic projections");
    } else if (experimentDurationDays >= 30) {
      insights.add(
          "Extended experiment duration ("
              + experimentDurationDays
              + " days) provides reliable basis for economic projections");
    }
    return insights;
  }
}
