package com.mk.fx.qa.analysis.exceptions;

/** Base type for failures that abort an entire analysis run. */
public class AnalysisException extends RuntimeException {

  public AnalysisException(String message) {
    super(message);
  }
}
