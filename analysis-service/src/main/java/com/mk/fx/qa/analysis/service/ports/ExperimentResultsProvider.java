package com.mk.fx.qa.analysis.service.ports;

import com.mk.fx.qa.analysis.service.model.ExperimentResult;
import java.util.List;
import java.util.Optional;

/** Source of raw experiment results. */
public interface ExperimentResultsProvider {

  Optional<ExperimentResult> findResult(String experimentId);

  /**
   * Ids of every result currently available, in a stable order. Listing never reads the documents,
   * so one unreadable result does not hide the others.
   */
  List<String> experimentIds();
}
