package com.mk.fx.qa.analysis.service.store;

import com.mk.fx.qa.analysis.service.model.AnalysisStatus;
import com.mk.fx.qa.analysis.service.model.ExperimentAnalysis;
import com.mk.fx.qa.analysis.service.ports.AnalysisWriter;
import com.mk.fx.qa.analysis.service.ports.IdempotencyGate;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Keeps analyses in memory and answers the idempotency question from them: an experiment result
 * counts as processed once an analysis for the same {@code generatedAt} reached COMPLETE.
 */
@Slf4j
@Component
public class InMemoryAnalysisStore implements AnalysisWriter, IdempotencyGate {

  private static final Comparator<ExperimentAnalysis> NEWEST_FIRST =
      Comparator.comparing(
              ExperimentAnalysis::analysisTimestamp,
              Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
          .reversed()
          .thenComparing(ExperimentAnalysis::analysisId, Comparator.reverseOrder());

  private final Map<String, Map<String, ExperimentAnalysis>> analyses = new ConcurrentHashMap<>();

  @Override
  public void save(ExperimentAnalysis analysis) {
    Objects.requireNonNull(analysis.experimentId(), "experimentId");
    Objects.requireNonNull(analysis.analysisId(), "analysisId");
    analyses
        .computeIfAbsent(analysis.experimentId(), id -> new ConcurrentHashMap<>())
        .put(analysis.analysisId(), analysis);
    log.debug(
        "Stored analysis {}/{} status={}",
        analysis.experimentId(),
        analysis.analysisId(),
        analysis.status());
  }

  @Override
  public List<ExperimentAnalysis> findByExperiment(String experimentId) {
    var byId = analyses.get(experimentId);
    if (byId == null) {
      return List.of();
    }
    List<ExperimentAnalysis> sorted = new ArrayList<>(byId.values());
    sorted.sort(NEWEST_FIRST);
    return sorted;
  }

  @Override
  public boolean alreadyProcessed(String experimentId, Instant generatedAt) {
    var byId = analyses.get(experimentId);
    if (byId == null) {
      return false;
    }
    return byId.values().stream()
        .anyMatch(
            a ->
                a.status() == AnalysisStatus.COMPLETE
                    && Objects.equals(a.resultGeneratedAt(), generatedAt));
  }
}
