package com.mk.fx.qa.analysis.service.model;

/** Counters across every run handled by this service instance. */
public record AnalysisMetrics(
    long totalCompleted,
    long totalFailed,
    long totalSkipped,
    double averageProcessingTimeMillis,
    double successRate,
    long totalProcessed,
    int activeRuns) {}
