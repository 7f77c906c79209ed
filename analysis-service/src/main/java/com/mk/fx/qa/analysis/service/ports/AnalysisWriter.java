package com.mk.fx.qa.analysis.service.ports;

import com.mk.fx.qa.analysis.service.model.ExperimentAnalysis;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for analyses keyed by {@code (experimentId, analysisId)}. Saving an analysis with an
 * existing key replaces it, which is how a run moves from PROCESSING to its final status.
 */
public interface AnalysisWriter {

  void save(ExperimentAnalysis analysis);

  /** Analyses for one experiment, newest first. */
  List<ExperimentAnalysis> findByExperiment(String experimentId);

  default Optional<ExperimentAnalysis> findLatest(String experimentId) {
    return findByExperiment(experimentId).stream().findFirst();
  }
}
