package com.mk.fx.qa.analysis.insights;

import static com.mk.fx.qa.analysis.did.DidEstimator.isSignificant;

import com.mk.fx.qa.analysis.did.DidResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Additive confidence score over four independent signals.
 *
 * <ul>
 *   <li>duration: 14+ days +2, 7+ days +1
 *   <li>average per-arm sample size: 500+ +2, 100+ +1
 *   <li>consistency (significant / total): 0.8+ or exactly 0 +2, 0.5+ +1
 *   <li>effect size: at least half the metrics with {@code |d| > 0.5} +1
 * </ul>
 *
 * Only the zero-point branches of the first three signals contribute a note to the reasoning.
 */
class ConfidenceScorer {

  ConfidenceAssessment assess(Map<String, DidResult> didResults, long durationDays) {
    int totalMetrics = didResults.size();
    int score = 0;
    List<String> notes = new ArrayList<>();

    if (durationDays >= 14) {
      score += 2;
    } else if (durationDays >= 7) {
      score += 1;
    } else {
      notes.add("short experiment duration");
    }

    double avgSampleSize = averageSampleSizePerArm(didResults);
    if (avgSampleSize >= 500) {
      score += 2;
    } else if (avgSampleSize >= 100) {
      score += 1;
    } else {
      notes.add("small sample sizes");
    }

    long significant = didResults.values().stream().filter(r -> isSignificant(r.pValue())).count();
    double consistency = totalMetrics == 0 ? 0.0 : (double) significant / totalMetrics;
    if (consistency >= 0.8 || consistency == 0.0) {
      score += 2;
    } else if (consistency >= 0.5) {
      score += 1;
    } else {
      notes.add("mixed results across metrics");
    }

    long strongEffects =
        didResults.values().stream().filter(r -> Math.abs(r.effectSize()) > 0.5).count();
    if (strongEffects >= totalMetrics * 0.5) {
      score += 1;
    }

    ConfidenceLevel level = ConfidenceLevel.fromScore(score);
    return new ConfidenceAssessment(level, score, reasoning(level, notes));
  }

  static double averageSampleSizePerArm(Map<String, DidResult> didResults) {
    if (didResults.isEmpty()) return 0.0;
    double total = 0.0;
    for (DidResult r : didResults.values()) {
      total += r.sampleSizeControl() + r.sampleSizeTreatment();
    }
    return total / (didResults.size() * 2.0);
  }

  private static String reasoning(ConfidenceLevel level, List<String> notes) {
    if (notes.isEmpty()) {
      return level.label() + " confidence with no limiting factors identified";
    }
    return level.label() + " confidence " + level.connective() + " " + String.join(", ", notes);
  }
}
