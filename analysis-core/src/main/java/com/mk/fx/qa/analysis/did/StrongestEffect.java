package com.mk.fx.qa.analysis.did;

/** The metric whose effect size has the largest magnitude, with its signed effect size. */
public record StrongestEffect(String metricId, double effectSize) {}
