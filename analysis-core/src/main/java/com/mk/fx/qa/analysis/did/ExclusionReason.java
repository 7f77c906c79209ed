package com.mk.fx.qa.analysis.did;

/** Why a metric was left out of a DiD run. */
public enum ExclusionReason {
  /** Series failed validation. */
  DATA_QUALITY,
  /** Series was valid but an arm's summed samples fell below the configured minimum. */
  INSUFFICIENT_POWER,
  /** Estimation failed unexpectedly or produced non-finite numbers. */
  COMPUTATION_ERROR
}
