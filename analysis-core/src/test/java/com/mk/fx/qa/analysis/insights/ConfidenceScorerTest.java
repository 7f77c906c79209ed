package com.mk.fx.qa.analysis.insights;

import static org.assertj.core.api.Assertions.assertThat;

import com.mk.fx.qa.analysis.did.DidResult;
import com.mk.fx.qa.analysis.stats.Interval;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ConfidenceScorerTest {

  private final ConfidenceScorer scorer = new ConfidenceScorer();

  private static DidResult result(double pValue, double effectSize, long samplesPerArm) {
    return new DidResult(
        1.1, 1.0, 0.1, 0.1, pValue, 95, new Interval(0.05, 0.15), samplesPerArm, samplesPerArm,
        effectSize);
  }

  @Test
  void assess_strongLongExperiment_isHigh() {
    Map<String, DidResult> results = new LinkedHashMap<>();
    results.put("a", result(0.01, 0.9, 500));
    results.put("b", result(0.01, 0.6, 600));

    ConfidenceAssessment assessment = scorer.assess(results, 14);

    assertThat(assessment.score()).isEqualTo(7);
    assertThat(assessment.level()).isEqualTo(ConfidenceLevel.HIGH);
    assertThat(assessment.reasoning())
        .isEqualTo("High confidence with no limiting factors identified");
  }

  @Test
  void assess_twentyDaysSixHundredPerArmAllSignificant_scoresSeven() {
    Map<String, DidResult> results = new LinkedHashMap<>();
    results.put("conversion", result(0.01, 0.9, 600));
    results.put("revenue", result(0.01, 0.7, 600));
    results.put("retention", result(0.01, 0.2, 600));

    ConfidenceAssessment assessment = scorer.assess(results, 20);

    // duration +2, samples +2, consistency +2, two of three strong effects +1
    assertThat(assessment.score()).isEqualTo(7);
    assertThat(assessment.level()).isEqualTo(ConfidenceLevel.HIGH);
  }

  @ParameterizedTest(name = "{0} days, {1} per arm -> {2}")
  @CsvSource({
    "14, 500, 7",
    "13, 500, 6",
    "7, 500, 6",
    "6, 500, 5",
    "14, 499, 6",
    "14, 100, 6",
    "14, 99, 5"
  })
  void assess_durationAndSampleSizeBoundaries(long days, long samplesPerArm, int expectedScore) {
    // one significant metric with a strong effect: consistency +2 and effect +1
    ConfidenceAssessment assessment =
        scorer.assess(Map.of("conversion", result(0.01, 0.9, samplesPerArm)), days);

    assertThat(assessment.score()).isEqualTo(expectedScore);
  }

  @Test
  void assess_emptyResults_countsZeroConsistencyAsConsistent() {
    ConfidenceAssessment assessment = scorer.assess(Map.of(), 3);

    // consistency +2 and effect +1, nothing else
    assertThat(assessment.score()).isEqualTo(3);
    assertThat(assessment.level()).isEqualTo(ConfidenceLevel.MEDIUM);
    assertThat(assessment.reasoning())
        .isEqualTo("Medium confidence with short experiment duration, small sample sizes");
  }

  @Test
  void assess_mixedResults_isLow() {
    Map<String, DidResult> results = new LinkedHashMap<>();
    results.put("a", result(0.01, 0.1, 100));
    results.put("b", result(0.5, 0.1, 100));
    results.put("c", result(0.5, 0.1, 100));

    ConfidenceAssessment assessment = scorer.assess(results, 7);

    assertThat(assessment.score()).isEqualTo(2);
    assertThat(assessment.level()).isEqualTo(ConfidenceLevel.LOW);
    assertThat(assessment.reasoning()).isEqualTo("Low confidence due to mixed results across metrics");
  }

  @Test
  void assess_halfSignificant_scoresOneForConsistency() {
    Map<String, DidResult> results = new LinkedHashMap<>();
    results.put("a", result(0.01, 0.6, 99));
    results.put("b", result(0.3, 0.1, 99));

    ConfidenceAssessment assessment = scorer.assess(results, 13);

    // duration +1, samples 0, consistency +1, effect +1
    assertThat(assessment.score()).isEqualTo(3);
    assertThat(assessment.reasoning()).isEqualTo("Medium confidence with small sample sizes");
  }

  @Test
  void averageSampleSizePerArm_averagesBothArmsOverMetrics() {
    Map<String, DidResult> results = new LinkedHashMap<>();
    results.put("a", result(0.01, 0.6, 100));
    results.put("b", result(0.01, 0.6, 300));

    assertThat(ConfidenceScorer.averageSampleSizePerArm(results)).isEqualTo(200.0);
    assertThat(ConfidenceScorer.averageSampleSizePerArm(Map.of())).isZero();
  }

  @Test
  void fromScore_thresholds() {
    assertThat(ConfidenceLevel.fromScore(2)).isEqualTo(ConfidenceLevel.LOW);
    assertThat(ConfidenceLevel.fromScore(3)).isEqualTo(ConfidenceLevel.MEDIUM);
    assertThat(ConfidenceLevel.fromScore(5)).isEqualTo(ConfidenceLevel.MEDIUM);
    assertThat(ConfidenceLevel.fromScore(6)).isEqualTo(ConfidenceLevel.HIGH);
  }
}
