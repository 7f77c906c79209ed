package com.mk.fx.qa.analysis.insights;

/**
 * Confidence rating with the additive score it was derived from.
 *
 * @param level discretised rating
 * @param score points collected across the four signals, 0 to 7
 * @param reasoning the limiting factors that held the score back
 */
public record ConfidenceAssessment(ConfidenceLevel level, int score, String reasoning) {}
