package com.mk.fx.qa.analysis.service.model;

public enum MetricCategory {
  CONVERSION,
  REVENUE,
  ENGAGEMENT,
  RETENTION,
  OTHER
}
