package com.mk.fx.qa.analysis.service.exceptions;

import com.mk.fx.qa.analysis.exceptions.AnalysisException;
import java.util.List;
import lombok.Getter;

/** An inbound experiment result failed bean validation and was not analysed. */
@Getter
public class InvalidExperimentResultException extends AnalysisException {

  private final String experimentId;
  private final List<String> violations;

  public InvalidExperimentResultException(String experimentId, List<String> violations) {
    super(
        "Invalid experiment result"
            + (experimentId != null ? " " + experimentId : "")
            + ": "
            + String.join("; ", violations));
    this.experimentId = experimentId;
    this.violations = List.copyOf(violations);
  }
}
