package com.mk.fx.qa.analysis.did;

/**
 * Tuning for a DiD run.
 *
 * @param confidenceLevel confidence level in percent used for the per-metric intervals
 * @param minimumSampleSize minimum summed subjects required in each arm
 * @param alpha significance threshold for {@link DidAnalysis#isSignificant(String)}
 */
public record DidAnalysisOptions(int confidenceLevel, long minimumSampleSize, double alpha) {

  public static final int DEFAULT_CONFIDENCE_LEVEL = 95;
  public static final long DEFAULT_MINIMUM_SAMPLE_SIZE = 10;

  public DidAnalysisOptions {
    if (minimumSampleSize < 0) {
      throw new IllegalArgumentException("minimumSampleSize must be >= 0");
    }
    if (alpha <= 0.0 || alpha >= 1.0) {
      throw new IllegalArgumentException("alpha must be in (0, 1)");
    }
  }

  public static DidAnalysisOptions defaults() {
    return new DidAnalysisOptions(
        DEFAULT_CONFIDENCE_LEVEL, DEFAULT_MINIMUM_SAMPLE_SIZE, DidEstimator.DEFAULT_ALPHA);
  }

  public DidAnalysisOptions withMinimumSampleSize(long minimum) {
    return new DidAnalysisOptions(confidenceLevel, minimum, alpha);
  }
}
