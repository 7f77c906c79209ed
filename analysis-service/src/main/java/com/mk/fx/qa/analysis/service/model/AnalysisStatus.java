package com.mk.fx.qa.analysis.service.model;

public enum AnalysisStatus {
  PROCESSING,
  COMPLETE,
  FAILED
}
