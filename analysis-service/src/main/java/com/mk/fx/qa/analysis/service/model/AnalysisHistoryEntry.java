package com.mk.fx.qa.analysis.service.model;

import java.time.Instant;

public record AnalysisHistoryEntry(
    String experimentId,
    String analysisId,
    AnalysisOutcome.OutcomeType outcome,
    Instant startedAt,
    Instant completedAt,
    long processingTimeMillis,
    String message) {}
