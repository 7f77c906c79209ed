package com.mk.fx.qa.analysis.service.processing;

import com.mk.fx.qa.analysis.service.model.AnalysisHistoryEntry;
import com.mk.fx.qa.analysis.service.model.AnalysisOutcome;
import java.time.Duration;
import java.time.Instant;

/** Mutable bookkeeping for one run, from start to its final outcome. */
class AnalysisRunRecord {

  private final String experimentId;
  private final Instant startedAt;
  private volatile Instant completedAt;
  private volatile AnalysisOutcome outcome;

  AnalysisRunRecord(String experimentId, Instant startedAt) {
    this.experimentId = experimentId;
    this.startedAt = startedAt;
  }

  synchronized void markFinished(AnalysisOutcome outcome, Instant completedAt) {
    this.outcome = outcome;
    this.completedAt = completedAt;
  }

  long getProcessingDurationMillis() {
    Instant end = completedAt;
    if (end == null) {
      return 0L;
    }
    return Duration.between(startedAt, end).toMillis();
  }

  AnalysisHistoryEntry toHistoryEntry() {
    AnalysisOutcome o = outcome;
    return new AnalysisHistoryEntry(
        o != null && o.experimentId() != null ? o.experimentId() : experimentId,
        o != null ? o.analysisId() : null,
        o != null ? o.type() : null,
        startedAt,
        completedAt,
        getProcessingDurationMillis(),
        o != null ? o.message() : null);
  }
}
