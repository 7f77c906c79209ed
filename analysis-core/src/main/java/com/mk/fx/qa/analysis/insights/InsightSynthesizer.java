package com.mk.fx.qa.analysis.insights;

import static com.mk.fx.qa.analysis.did.DidEstimator.isSignificant;
import static com.mk.fx.qa.analysis.utils.AnalysisFormat.fixed2;
import static com.mk.fx.qa.analysis.utils.AnalysisFormat.grouped;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.analysis.did.DidOrchestrator;
import com.mk.fx.qa.analysis.did.DidResult;
import com.mk.fx.qa.analysis.did.ExperimentPeriod;
import com.mk.fx.qa.analysis.economics.EconomicImpact;
import com.mk.fx.qa.analysis.economics.EconomicImpactTranslator;
import com.mk.fx.qa.analysis.economics.ImplementationComplexity;
import com.mk.fx.qa.analysis.economics.MetricValueSnapshot;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Composes DiD and economic results into an {@link InsightAnalysis}: executive summary, ranked
 * findings, recommendations, risks, rollout guidance and a confidence rating.
 */
public class InsightSynthesizer {

  private static final int DID_FINDINGS = 3;
  private static final int ECONOMIC_FINDINGS = 2;

  private final DidOrchestrator didOrchestrator;
  private final EconomicImpactTranslator translator;
  private final ConfidenceScorer confidenceScorer = new ConfidenceScorer();

  public InsightSynthesizer() {
    this(new DidOrchestrator(), new EconomicImpactTranslator());
  }

  public InsightSynthesizer(DidOrchestrator didOrchestrator, EconomicImpactTranslator translator) {
    this.didOrchestrator = Objects.requireNonNull(didOrchestrator, "didOrchestrator");
    this.translator = Objects.requireNonNull(translator, "translator");
  }

  public InsightAnalysis synthesizeInsights(
      Map<String, DidResult> didResults,
      EconomicImpact economicImpact,
      ExperimentPeriod period,
      Map<String, MetricValueSnapshot> metricValues) {

    List<String> didInsights = didOrchestrator.narrate(didResults, period);
    List<String> economicInsights = translator.narrate(economicImpact, period.durationDays());
    ImplementationComplexity complexity =
        translator.estimateImplementationComplexity(didResults);
    int significant = countSignificant(didResults);

    List<String> keyFindings = new ArrayList<>();
    keyFindings.addAll(head(didInsights, DID_FINDINGS));
    keyFindings.addAll(head(economicInsights, ECONOMIC_FINDINGS));
    keyFindings.addAll(dataQualityFindings(didResults, period, metricValues));

    var guidance =
        new ImplementationGuidance(
            complexity.complexity(),
            complexity.complexity().estimatedEffort(significant),
            successFactors(didResults, economicImpact, complexity));

    return new InsightAnalysis(
        executiveSummary(didResults, economicImpact, period),
        keyFindings,
        recommendations(didResults, economicImpact, complexity, period),
        riskFactors(didResults, economicImpact, period),
        guidance,
        confidenceScorer.assess(didResults, period.durationDays()));
  }

  @VisibleForTesting
  String executiveSummary(
      Map<String, DidResult> didResults, EconomicImpact impact, ExperimentPeriod period) {
    int total = didResults.size();
    int significant = countSignificant(didResults);
    double totalImpact = impact.totalImpact();
    String direction = totalImpact > 0 ? "positive" : totalImpact < 0 ? "negative" : "neutral";
    String magnitude = fixed2(Math.abs(totalImpact));
    String annualized = grouped(Math.abs(impact.annualizedImpact()));
    long days = period.durationDays();

    if (significant == 0) {
      return String.format(
          Locale.ROOT,
          "Experiment conducted over %d days showed no statistically significant effects across %d"
              + " measured metrics. Economic impact analysis indicates %s effect of $%s daily,"
              + " suggesting the tested treatment does not meaningfully improve user experience or"
              + " business outcomes.",
          days, total, direction, magnitude);
    }
    if (significant == total) {
      return String.format(
          Locale.ROOT,
          "Highly successful experiment over %d days achieved statistical significance across all"
              + " %d measured metrics. %s economic impact of $%s daily ($%s annualized) strongly"
              + " supports implementation of the tested treatment.",
          days, total, capitalize(direction), magnitude, annualized);
    }
    return String.format(
        Locale.ROOT,
        "Mixed-results experiment over %d days achieved statistical significance in %d of %d"
            + " measured metrics. %s economic impact of $%s daily ($%s annualized) suggests"
            + " selective implementation may be warranted.",
        days, significant, total, capitalize(direction), magnitude, annualized);
  }

  private List<String> dataQualityFindings(
      Map<String, DidResult> didResults,
      ExperimentPeriod period,
      Map<String, MetricValueSnapshot> metricValues) {
    List<String> findings = new ArrayList<>();

    if (!didResults.isEmpty()) {
      double avgControl =
          didResults.values().stream().mapToLong(DidResult::sampleSizeControl).average().orElse(0);
      double avgTreatment =
          didResults.values().stream()
              .mapToLong(DidResult::sampleSizeTreatment)
              .average()
              .orElse(0);
      String sizes =
          String.format(
              Locale.ROOT, "(avg control: %.0f, treatment: %.0f)", avgControl, avgTreatment);
      if (avgControl < 100 || avgTreatment < 100) {
        findings.add("Small sample sizes " + sizes + " may limit statistical power");
      } else if (avgControl > 1000 && avgTreatment > 1000) {
        findings.add("Large sample sizes " + sizes + " provide high statistical power");
      }
    }

    if (period.durationDays() < 7) {
      findings.add(
          "Short experiment duration ("
              + period.durationDays()
              + " days) may not capture full user behavior patterns");
    }

    List<String> unpriced =
        didResults.keySet().stream()
            .filter(id -> !metricValues.containsKey(id))
            .collect(Collectors.toList());
    if (!unpriced.isEmpty()) {
      findings.add(
          "No economic value configured for "
              + String.join(", ", unpriced)
              + "; economic totals exclude these metrics");
    }
    return findings;
  }

  private List<String> recommendations(
      Map<String, DidResult> didResults,
      EconomicImpact impact,
      ImplementationComplexity complexity,
      ExperimentPeriod period) {
    List<String> recs = new ArrayList<>();

    if (countSignificant(didResults) == 0) {
      recs.add("Do not implement the tested treatment - no significant improvements detected");
      recs.add(
          "Consider testing alternative approaches or increasing sample size for future"
              + " experiments");
      recs.add(
          "Analyze user feedback to identify potential improvements not captured by current"
              + " metrics");
    } else if (impact.totalImpact() > 0) {
      recs.add("Implement the tested treatment - positive economic impact justifies rollout");
      if (impact.roiPercentage() > 50) {
        recs.add("Prioritize immediate implementation due to high ROI potential");
      } else {
        recs.add("Plan gradual rollout to monitor real-world performance");
      }
      recs.addAll(complexity.recommendations());
    } else {
      recs.add(
          "Exercise caution - mixed or negative economic impact requires careful consideration");
      recs.add("Consider implementing only the components affecting significantly positive metrics");
      recs.add("Conduct cost-benefit analysis including implementation and maintenance costs");
    }

    if (period.durationDays() < 14) {
      recs.add("Consider running extended validation experiment before full implementation");
    }
    return recs;
  }

  private List<String> riskFactors(
      Map<String, DidResult> didResults, EconomicImpact impact, ExperimentPeriod period) {
    List<String> risks = new ArrayList<>();

    long borderline =
        didResults.values().stream().filter(r -> r.pValue() > 0.1 && r.pValue() < 0.2).count();
    if (borderline > 0) {
      risks.add(
          "Borderline significance in " + borderline + " metrics may indicate unstable effects");
    }
    if (impact.totalImpact() < 0) {
      risks.add("Negative economic impact could result in revenue loss if implemented");
    }
    if (didResults.size() > 5) {
      risks.add("Multiple metrics affected increases implementation complexity and failure risk");
    }
    if (period.durationDays() < 7) {
      risks.add("Short experiment period may not capture seasonal or cyclical effects");
    }
    long smallSamples =
        didResults.values().stream()
            .filter(r -> r.sampleSizeControl() < 30 || r.sampleSizeTreatment() < 30)
            .count();
    if (smallSamples > 0) {
      risks.add(
          "Small sample sizes in " + smallSamples + " metrics may produce unreliable results");
    }
    return risks;
  }

  private List<String> successFactors(
      Map<String, DidResult> didResults,
      EconomicImpact impact,
      ImplementationComplexity complexity) {
    List<String> factors = new ArrayList<>(complexity.recommendations());
    if (impact.totalImpact() > 0) {
      factors.add("Monitor economic metrics closely during rollout to validate projected impact");
    }
    List<String> strong =
        didResults.entrySet().stream()
            .filter(e -> Math.abs(e.getValue().effectSize()) > 0.8)
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
    if (!strong.isEmpty()) {
      factors.add("Focus on metrics with strong effects: " + String.join(", ", strong));
    }
    factors.add("Establish baseline measurements before implementation");
    factors.add("Plan rollback strategy in case of unexpected negative effects");
    return factors;
  }

  private static int countSignificant(Map<String, DidResult> didResults) {
    return (int) didResults.values().stream().filter(r -> isSignificant(r.pValue())).count();
  }

  private static List<String> head(List<String> lines, int n) {
    return lines.subList(0, Math.min(n, lines.size()));
  }

  private static String capitalize(String s) {
    return Character.toUpperCase(s.charAt(0)) + s.substring(1);
  }
}
