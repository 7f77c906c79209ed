package com.mk.fx.qa.analysis.service.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mk.fx.qa.analysis.did.ExperimentPeriod;
import com.mk.fx.qa.analysis.service.model.AnalysisStatus;
import com.mk.fx.qa.analysis.service.model.ExperimentAnalysis;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InMemoryAnalysisStoreTest {

  private static final Instant GENERATED = Instant.parse("2025-03-02T00:00:00Z");

  private static ExperimentAnalysis processing(String analysisId, Instant at) {
    return ExperimentAnalysis.processing(
        "exp-1", analysisId, GENERATED, Map.of(), at, ExperimentPeriod.ofDays(3), "1.0.0");
  }

  @Test
  void save_sameKey_replacesPreviousVersion() {
    InMemoryAnalysisStore store = new InMemoryAnalysisStore();
    var pending = processing("a-1", Instant.parse("2025-03-03T00:00:00Z"));

    store.save(pending);
    store.save(pending.failed("boom", List.of()));

    var stored = store.findByExperiment("exp-1");
    assertThat(stored).hasSize(1);
    assertThat(stored.get(0).status()).isEqualTo(AnalysisStatus.FAILED);
    assertThat(stored.get(0).errorMessage()).isEqualTo("boom");
  }

  @Test
  void findByExperiment_returnsNewestFirst() {
    InMemoryAnalysisStore store = new InMemoryAnalysisStore();
    store.save(processing("old", Instant.parse("2025-03-03T00:00:00Z")));
    store.save(processing("new", Instant.parse("2025-03-04T00:00:00Z")));

    assertThat(store.findByExperiment("exp-1"))
        .extracting(ExperimentAnalysis::analysisId)
        .containsExactly("new", "old");
    assertThat(store.findLatest("exp-1").orElseThrow().analysisId()).isEqualTo("new");
    assertThat(store.findByExperiment("exp-2")).isEmpty();
    assertThat(store.findLatest("exp-2")).isEmpty();
  }

  @Test
  void alreadyProcessed_onlyForCompleteAnalysisOfSameGeneration() {
    InMemoryAnalysisStore store = new InMemoryAnalysisStore();
    var pending = processing("a-1", Instant.parse("2025-03-03T00:00:00Z"));

    store.save(pending);
    assertThat(store.alreadyProcessed("exp-1", GENERATED)).isFalse();

    store.save(pending.complete(Map.of(), null, null, List.of()));
    assertThat(store.alreadyProcessed("exp-1", GENERATED)).isTrue();
    assertThat(store.alreadyProcessed("exp-1", GENERATED.plusSeconds(1))).isFalse();
    assertThat(store.alreadyProcessed("exp-2", GENERATED)).isFalse();
  }

  @Test
  void save_requiresKey() {
    InMemoryAnalysisStore store = new InMemoryAnalysisStore();
    assertThatThrownBy(() -> store.save(processing(null, Instant.now())))
        .isInstanceOf(NullPointerException.class);
  }
}
