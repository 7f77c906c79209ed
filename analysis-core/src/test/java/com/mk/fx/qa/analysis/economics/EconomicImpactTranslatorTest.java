package com.mk.fx.qa.analysis.economics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.mk.fx.qa.analysis.did.DidResult;
import com.mk.fx.qa.analysis.stats.Interval;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class EconomicImpactTranslatorTest {

  private static final double EPS = 1e-9;

  private final EconomicImpactTranslator translator = new EconomicImpactTranslator();

  private static DidResult result(double absDiff, double pValue, Interval ci) {
    return new DidResult(1.0 + absDiff, 1.0, absDiff, absDiff, pValue, 95, ci, 500, 500, 0.5);
  }

  private static DidResult result(double absDiff, double pValue) {
    return result(absDiff, pValue, new Interval(absDiff, absDiff));
  }

  private static Map<String, DidResult> conversionAndBounce(double bouncePValue) {
    Map<String, DidResult> results = new LinkedHashMap<>();
    results.put("conversion", result(0.02, 0.01, new Interval(0.01, 0.03)));
    results.put("bounce", result(-0.01, bouncePValue, new Interval(-0.02, 0.0)));
    return results;
  }

  private static Map<String, MetricValueSnapshot> pricing() {
    return Map.of(
        "conversion", MetricValueSnapshot.of(100.0, "Revenue per conversion point", "%"),
        "bounce", MetricValueSnapshot.of(50.0, "Cost per bounce point", "%"));
  }

  @Test
  void computeEconomicImpact_sumsDailyImpactAndAnnualizes() {
    EconomicImpact impact =
        translator.computeEconomicImpact(
            conversionAndBounce(0.01), pricing(), 10, EconomicOptions.defaults());

    assertThat(impact.totalImpact()).isCloseTo(1.5, within(EPS));
    assertThat(impact.annualizedImpact()).isCloseTo(54.75, within(EPS));
    assertThat(impact.roiPercentage()).isCloseTo(150.0, within(EPS));
    assertThat(impact.metricBreakdown().keySet()).containsExactly("conversion", "bounce");

    MetricImpact conversion = impact.metricBreakdown().get("conversion");
    assertThat(conversion.dollarImpact()).isCloseTo(2.0, within(EPS));
    assertThat(conversion.metricValueUsed()).isEqualTo(100.0);
    assertThat(conversion.metricChange()).isEqualTo(0.02);
    assertThat(impact.missingPricing()).isEmpty();
  }

  @Test
  void computeEconomicImpact_intervalScalesEachMetricByItsValue() {
    EconomicImpact impact =
        translator.computeEconomicImpact(
            conversionAndBounce(0.01), pricing(), 10, EconomicOptions.defaults());

    // conversion [1, 3] plus bounce [-1, 0]
    assertThat(impact.confidenceInterval().lower()).isCloseTo(0.0, within(EPS));
    assertThat(impact.confidenceInterval().upper()).isCloseTo(3.0, within(EPS));
  }

  @Test
  void computeEconomicImpact_intervalIsReportedAtRequestedLevel() {
    Map<String, DidResult> results =
        Map.of("conversion", result(0.02, 0.01, new Interval(0.01, 0.03)));

    EconomicImpact impact =
        translator.computeEconomicImpact(results, pricing(), 10, new EconomicOptions(365, 99, false));

    // half width 1.0 dollar at 95% widens by 2.576 / 1.96
    double halfWidth = 2.576 / 1.96;
    assertThat(impact.confidenceInterval().lower()).isCloseTo(2.0 - halfWidth, within(1e-6));
    assertThat(impact.confidenceInterval().upper()).isCloseTo(2.0 + halfWidth, within(1e-6));
  }

  @Test
  void computeEconomicImpact_metricWithoutPricing_isListedAndLeftOut() {
    Map<String, DidResult> results = conversionAndBounce(0.01);
    results.put("latency", result(-5.0, 0.01));

    EconomicImpact impact =
        translator.computeEconomicImpact(results, pricing(), 10, EconomicOptions.defaults());

    assertThat(impact.missingPricing()).containsExactly("latency");
    assertThat(impact.metricBreakdown()).doesNotContainKey("latency");
    assertThat(impact.totalImpact()).isCloseTo(1.5, within(EPS));
  }

  @Test
  void computeEconomicImpact_onlySignificant_dropsNonSignificantMetrics() {
    EconomicImpact impact =
        translator.computeEconomicImpact(
            conversionAndBounce(0.2), pricing(), 10, EconomicOptions.defaults().onlySignificant());

    assertThat(impact.metricBreakdown().keySet()).containsExactly("conversion");
    assertThat(impact.totalImpact()).isCloseTo(2.0, within(EPS));
    assertThat(impact.confidenceInterval().lower()).isCloseTo(1.0, within(EPS));
    assertThat(impact.confidenceInterval().upper()).isCloseTo(3.0, within(EPS));
  }

  @Test
  void computeEconomicImpact_nonPositiveDuration_isRejected() {
    assertThatThrownBy(
            () ->
                translator.computeEconomicImpact(
                    conversionAndBounce(0.01), pricing(), 0, EconomicOptions.defaults()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("experimentDurationDays");
  }

  @Test
  void computeEconomicImpact_noResults_isNeutral() {
    EconomicImpact impact =
        translator.computeEconomicImpact(Map.of(), pricing(), 7, EconomicOptions.defaults());

    assertThat(impact.totalImpact()).isZero();
    assertThat(impact.roiPercentage()).isZero();
    assertThat(impact.confidenceInterval()).isEqualTo(Interval.zero());
  }

  @ParameterizedTest
  @CsvSource({"1.5, 150.0", "10, 1000.0", "25, 1000.0", "-0.5, -50.0", "-3, -100.0", "0, 0.0"})
  void boundedRoi_isClamped(double total, double expected) {
    assertThat(EconomicImpactTranslator.boundedRoi(total)).isCloseTo(expected, within(EPS));
  }

  @Test
  void confidenceInterval_skipsUnpricedMetrics() {
    Map<String, DidResult> results = conversionAndBounce(0.01);
    results.put("latency", result(-5.0, 0.01, new Interval(-8, -2)));

    Interval interval = translator.confidenceInterval(results, pricing());

    assertThat(interval.lower()).isCloseTo(0.0, within(EPS));
    assertThat(interval.upper()).isCloseTo(3.0, within(EPS));
  }

  @Test
  void estimateImplementationComplexity_tiersBySignificantCount() {
    assertThat(translator.estimateImplementationComplexity(Map.of()).complexity())
        .isEqualTo(Complexity.LOW);

    var single = translator.estimateImplementationComplexity(Map.of("a", result(1, 0.01)));
    assertThat(single.complexity()).isEqualTo(Complexity.LOW);
    assertThat(single.reasoning()).contains("Single metric");

    var three =
        translator.estimateImplementationComplexity(
            Map.of("a", result(1, 0.01), "b", result(1, 0.01), "c", result(1, 0.01)));
    assertThat(three.complexity()).isEqualTo(Complexity.MEDIUM);
    assertThat(three.recommendations()).hasSize(2);

    var four =
        translator.estimateImplementationComplexity(
            Map.of(
                "a", result(1, 0.01),
                "b", result(1, 0.01),
                "c", result(1, 0.01),
                "d", result(1, 0.01),
                "e", result(1, 0.9)));
    assertThat(four.complexity()).isEqualTo(Complexity.HIGH);
    assertThat(four.recommendations()).hasSize(3);
  }

  @Test
  void estimatedEffort_growsWithSignificantMetrics() {
    assertThat(Complexity.LOW.estimatedEffort(0)).isEqualTo("1-2 weeks");
    assertThat(Complexity.LOW.estimatedEffort(2)).isEqualTo("2-4 weeks");
    assertThat(Complexity.MEDIUM.estimatedEffort(3)).isEqualTo("2-4 weeks");
    assertThat(Complexity.HIGH.estimatedEffort(4)).isEqualTo("1-2 months");
    assertThat(Complexity.HIGH.estimatedEffort(6)).isEqualTo("2+ months");
  }

  @Test
  void narrate_positiveImpact() {
    EconomicImpact impact =
        translator.computeEconomicImpact(
            conversionAndBounce(0.01), pricing(), 10, EconomicOptions.defaults());

    assertThat(translator.narrate(impact, 10))
        .containsExactly(
            "Positive economic impact of $1.50 per day",
            "Limited annualized value of $54.75 may not justify implementation costs",
            "Exceptional ROI of 150.0% indicates highly profitable optimization",
            "Primary value driver: 'conversion' contributes positive $2.00 daily impact");
  }

  @Test
  void narrate_negativeImpactOverShortRun() {
    EconomicImpact impact =
        translator.computeEconomicImpact(
            Map.of("bounce", result(-0.5, 0.01)), pricing(), 5, EconomicOptions.defaults());

    assertThat(translator.narrate(impact, 5))
        .containsExactly(
            "Negative economic impact of $25.00 per day - treatment reduces value",
            "Projected annual loss of $1,825.00 suggests avoiding this change",
            "Negative ROI of -100.0% suggests treatment reduces business value",
            "Primary value driver: 'bounce' contributes negative $25.00 daily impact",
            "Short experiment duration (5 days) limits confidence in economic projections");
  }

  @Test
  void narrate_annualValueTiersUseGrouping() {
    var results = Map.of("conversion", result(1.0, 0.01));

    EconomicImpact moderate =
        translator.computeEconomicImpact(results, pricing(), 30, EconomicOptions.defaults());
    assertThat(translator.narrate(moderate, 30))
        .contains(
            "Moderate annualized value of $1,216.67 justifies implementation",
            "Extended experiment duration (30 days) provides reliable basis for economic projections");

    EconomicImpact strong =
        translator.computeEconomicImpact(results, pricing(), 3, EconomicOptions.defaults());
    assertThat(translator.narrate(strong, 3))
        .contains("Strong annualized value of $12,166.67 suggests high-value optimization");
  }
}
