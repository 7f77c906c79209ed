package com.mk.fx.qa.analysis.service.processing;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.mk.fx.qa.analysis.AnalysisPipeline;
import com.mk.fx.qa.analysis.AnalysisReport;
import com.mk.fx.qa.analysis.did.ExperimentPeriod;
import com.mk.fx.qa.analysis.did.MetricOutcome;
import com.mk.fx.qa.analysis.economics.MetricValueSnapshot;
import com.mk.fx.qa.analysis.exceptions.NoValidMetricsException;
import com.mk.fx.qa.analysis.service.cfg.AnalysisProcessingCfg;
import com.mk.fx.qa.analysis.service.exceptions.InvalidExperimentResultException;
import com.mk.fx.qa.analysis.service.model.AnalysisHistoryEntry;
import com.mk.fx.qa.analysis.service.model.AnalysisMetrics;
import com.mk.fx.qa.analysis.service.model.AnalysisOutcome;
import com.mk.fx.qa.analysis.service.model.BatchOutcome;
import com.mk.fx.qa.analysis.service.model.ExperimentAnalysis;
import com.mk.fx.qa.analysis.service.model.ExperimentResult;
import com.mk.fx.qa.analysis.service.model.ExperimentWindow;
import com.mk.fx.qa.analysis.service.ports.AnalysisWriter;
import com.mk.fx.qa.analysis.service.ports.ExperimentResultsProvider;
import com.mk.fx.qa.analysis.service.ports.IdempotencyGate;
import com.mk.fx.qa.analysis.service.ports.PricingProvider;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Trigger adapter around the analysis core: validates incoming experiment results, skips results
 * that were already analysed, snapshots pricing, runs the pipeline and persists the outcome.
 *
 * <p>Each run is persisted as PROCESSING first and then replaced by its COMPLETE or FAILED version
 * under the same analysis id. A failed run never affects other records of the same batch.
 *
 * <p>Thread-safety: runs may be executed concurrently on the bounded worker pool via {@link
 * #submit(ExperimentResult)}; counters and history use atomic and concurrent structures.
 */
@Slf4j
@Service
public class ExperimentAnalysisService {

  private final AnalysisProcessingCfg properties;
  private final AnalysisPipeline pipeline;
  private final PricingProvider pricingProvider;
  private final IdempotencyGate idempotencyGate;
  private final AnalysisWriter writer;
  private final ExperimentResultsProvider resultsProvider;
  private final AnalysisDiagnostics diagnostics;
  private final Validator validator;
  private final Clock clock;
  private final ThreadPoolExecutor executor;
  private final Deque<AnalysisRunRecord> history;
  private final AtomicBoolean acceptingRuns;
  private final AtomicInteger activeRuns;
  private final AtomicLong totalCompleted;
  private final AtomicLong totalFailed;
  private final AtomicLong totalSkipped;
  private final AtomicLong cumulativeProcessingTime;

  public ExperimentAnalysisService(
      AnalysisProcessingCfg properties,
      AnalysisPipeline pipeline,
      PricingProvider pricingProvider,
      IdempotencyGate idempotencyGate,
      AnalysisWriter writer,
      ExperimentResultsProvider resultsProvider,
      AnalysisDiagnostics diagnostics,
      Validator validator,
      Clock clock) {
    this.properties = properties;
    this.pipeline = pipeline;
    this.pricingProvider = pricingProvider;
    this.idempotencyGate = idempotencyGate;
    this.writer = writer;
    this.resultsProvider = resultsProvider;
    this.diagnostics = diagnostics;
    this.validator = validator;
    this.clock = clock;
    this.executor = createExecutor(properties.getConcurrency());
    this.history = new ConcurrentLinkedDeque<>();
    this.acceptingRuns = new AtomicBoolean(true);
    this.activeRuns = new AtomicInteger();
    this.totalCompleted = new AtomicLong();
    this.totalFailed = new AtomicLong();
    this.totalSkipped = new AtomicLong();
    this.cumulativeProcessingTime = new AtomicLong();
  }

  @PostConstruct
  void logConfiguration() {
    log.info(
        "ExperimentAnalysisService initialised with concurrency={} historySize={} confidenceLevel={}"
            + " minimumSampleSize={} algorithmVersion={}",
        properties.getConcurrency(),
        properties.getHistorySize(),
        properties.getConfidenceLevel(),
        properties.getMinimumSampleSize(),
        properties.getAlgorithmVersion());
  }

  private ThreadPoolExecutor createExecutor(int concurrency) {
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("analysis-worker-" + thread.getId());
          thread.setDaemon(true);
          return thread;
        };

    ThreadPoolExecutor pool = (ThreadPoolExecutor) newFixedThreadPool(concurrency, threadFactory);
    pool.setRejectedExecutionHandler(
        (runnable, exec) -> {
          throw new RejectedExecutionException("Analysis queue is full");
        });
    return pool;
  }

  /**
   * Analyses one experiment result synchronously.
   *
   * @return ANALYZED with the new analysis id, SKIPPED when this {@code (experimentId,
   *     generatedAt)} pair already has a complete analysis, or FAILED with the reason
   */
  public AnalysisOutcome process(ExperimentResult result) {
    var record = new AnalysisRunRecord(experimentIdOf(result), clock.instant());
    activeRuns.incrementAndGet();
    try {
      AnalysisOutcome outcome = analyse(result);
      record.markFinished(outcome, clock.instant());
      count(outcome, record);
      return outcome;
    } finally {
      activeRuns.decrementAndGet();
      addToHistory(record);
    }
  }

  /** Loads the result for {@code experimentId} and analyses it; empty when no result exists. */
  public Optional<AnalysisOutcome> processExperiment(String experimentId) {
    return resultsProvider.findResult(experimentId).map(this::process);
  }

  /**
   * Processes every result the results provider currently holds. Each one is loaded separately; an
   * unreadable result is reported as FAILED and the rest are still analysed.
   */
  public BatchOutcome processAll() {
    List<String> experimentIds = resultsProvider.experimentIds();
    List<AnalysisOutcome> outcomes = new ArrayList<>(experimentIds.size());
    for (String experimentId : experimentIds) {
      outcomes.add(loadAndProcess(experimentId));
    }
    return summarise(outcomes);
  }

  /** Processes each record independently; one failure never stops the rest. */
  public BatchOutcome processBatch(List<ExperimentResult> results) {
    List<AnalysisOutcome> outcomes = new ArrayList<>(results.size());
    for (ExperimentResult result : results) {
      outcomes.add(process(result));
    }
    return summarise(outcomes);
  }

  private AnalysisOutcome loadAndProcess(String experimentId) {
    Optional<ExperimentResult> result;
    try {
      result = resultsProvider.findResult(experimentId);
    } catch (RuntimeException ex) {
      diagnostics.unreadable(experimentId, ex);
      return recordUnprocessed(AnalysisOutcome.failed(experimentId, null, ex.getMessage()));
    }
    return result
        .map(this::process)
        .orElseGet(
            () ->
                recordUnprocessed(
                    AnalysisOutcome.failed(experimentId, null, "Experiment result not found")));
  }

  private AnalysisOutcome recordUnprocessed(AnalysisOutcome outcome) {
    Instant now = clock.instant();
    var record = new AnalysisRunRecord(outcome.experimentId(), now);
    record.markFinished(outcome, now);
    count(outcome, record);
    addToHistory(record);
    return outcome;
  }

  private BatchOutcome summarise(List<AnalysisOutcome> outcomes) {
    BatchOutcome batch = BatchOutcome.of(outcomes);
    diagnostics.batchProcessed(batch.processed(), batch.successful(), batch.failed());
    return batch;
  }

  /**
   * Queues a run on the worker pool.
   *
   * @return empty once the service stopped accepting runs; otherwise a future of the outcome
   */
  public Optional<CompletableFuture<AnalysisOutcome>> submit(ExperimentResult result) {
    if (!acceptingRuns.get()) {
      return Optional.empty();
    }
    try {
      return Optional.of(CompletableFuture.supplyAsync(() -> process(result), executor));
    } catch (RejectedExecutionException ex) {
      log.warn("Analysis for {} rejected: {}", experimentIdOf(result), ex.getMessage());
      totalFailed.incrementAndGet();
      return Optional.of(
          CompletableFuture.completedFuture(
              AnalysisOutcome.failed(experimentIdOf(result), null, ex.getMessage())));
    }
  }

  private AnalysisOutcome analyse(ExperimentResult result) {
    try {
      validate(result);
    } catch (InvalidExperimentResultException ex) {
      diagnostics.rejected(ex);
      return AnalysisOutcome.failed(ex.getExperimentId(), null, ex.getMessage());
    }

    String experimentId = result.getExperimentId();
    if (idempotencyGate.alreadyProcessed(experimentId, result.getGeneratedAt())) {
      diagnostics.skipped(experimentId, result.getGeneratedAt());
      return AnalysisOutcome.skipped(
          experimentId, "Analysis already exists for generatedAt " + result.getGeneratedAt());
    }

    Instant startedAt = clock.instant();
    String analysisId = startedAt.toEpochMilli() + "-" + UUID.randomUUID();
    ExperimentWindow window = result.getExperimentPeriod();
    ExperimentPeriod period = window.toPeriod();
    ExperimentAnalysis pending = null;
    try {
      Map<String, MetricValueSnapshot> snapshot = snapshotPricing(startedAt);
      pending =
          ExperimentAnalysis.processing(
              experimentId,
              analysisId,
              result.getGeneratedAt(),
              snapshot,
              startedAt,
              period,
              properties.getAlgorithmVersion());
      writer.save(pending);
      diagnostics.runStarted(experimentId, analysisId, result.getMetrics().size());
      if (snapshot.isEmpty()) {
        diagnostics.noPricing(experimentId);
      }

      AnalysisReport report =
          pipeline.analyze(
              result.toSeries(),
              snapshot,
              period,
              window.durationDays(),
              properties.toDidOptions(),
              properties.toEconomicOptions());

      var did = report.didAnalysis();
      diagnostics.metricResults(experimentId, did);
      diagnostics.exclusions(experimentId, did.exclusions());
      diagnostics.missingPricing(experimentId, report.economicImpact().missingPricing());
      writer.save(
          pending.complete(
              did.results(), report.economicImpact(), report.insights(), did.exclusions()));
      diagnostics.runCompleted(experimentId, analysisId, report);
      return AnalysisOutcome.analyzed(experimentId, analysisId);
    } catch (NoValidMetricsException ex) {
      diagnostics.exclusions(experimentId, ex.getExclusions());
      return fail(experimentId, analysisId, pending, ex, ex.getExclusions());
    } catch (RuntimeException ex) {
      return fail(experimentId, analysisId, pending, ex, List.of());
    }
  }

  private AnalysisOutcome fail(
      String experimentId,
      String analysisId,
      ExperimentAnalysis pending,
      RuntimeException cause,
      List<MetricOutcome.Excluded> exclusions) {
    diagnostics.runFailed(experimentId, analysisId, cause);
    if (pending != null) {
      try {
        writer.save(pending.failed(cause.getMessage(), exclusions));
      } catch (RuntimeException saveError) {
        diagnostics.statusNotSaved(experimentId, analysisId, saveError);
      }
    }
    return AnalysisOutcome.failed(experimentId, analysisId, cause.getMessage());
  }

  private Map<String, MetricValueSnapshot> snapshotPricing(Instant capturedAt) {
    Map<String, MetricValueSnapshot> snapshot = new LinkedHashMap<>();
    pricingProvider
        .currentValues()
        .forEach((metricId, value) -> snapshot.put(metricId, value.snapshot(capturedAt)));
    return snapshot;
  }

  private void validate(ExperimentResult result) {
    if (result == null) {
      throw new InvalidExperimentResultException(null, List.of("experiment result is missing"));
    }
    var violations = validator.validate(result);
    if (!violations.isEmpty()) {
      List<String> messages =
          violations.stream()
              .map(ExperimentAnalysisService::describe)
              .sorted()
              .toList();
      throw new InvalidExperimentResultException(result.getExperimentId(), messages);
    }
  }

  private static String describe(ConstraintViolation<ExperimentResult> violation) {
    return violation.getPropertyPath() + " " + violation.getMessage();
  }

  private void count(AnalysisOutcome outcome, AnalysisRunRecord record) {
    switch (outcome.type()) {
      case ANALYZED -> {
        totalCompleted.incrementAndGet();
        cumulativeProcessingTime.addAndGet(record.getProcessingDurationMillis());
      }
      case SKIPPED -> totalSkipped.incrementAndGet();
      case FAILED -> totalFailed.incrementAndGet();
    }
  }

  private void addToHistory(AnalysisRunRecord record) {
    history.addFirst(record);
    while (history.size() > properties.getHistorySize()) {
      history.pollLast();
    }
  }

  private static String experimentIdOf(ExperimentResult result) {
    return result == null ? null : result.getExperimentId();
  }

  /** Stored analyses for an experiment, newest first. */
  public List<ExperimentAnalysis> getAnalyses(String experimentId) {
    return writer.findByExperiment(experimentId);
  }

  public Optional<ExperimentAnalysis> getLatestAnalysis(String experimentId) {
    return writer.findLatest(experimentId);
  }

  /** Most recent runs, newest first, up to the configured history size. */
  public List<AnalysisHistoryEntry> getHistory() {
    List<AnalysisHistoryEntry> snapshot = new ArrayList<>();
    for (AnalysisRunRecord record : history) {
      snapshot.add(record.toHistoryEntry());
    }
    return snapshot;
  }

  public AnalysisMetrics getMetrics() {
    var completed = totalCompleted.get();
    var failed = totalFailed.get();
    var skipped = totalSkipped.get();
    var processedForSuccessRate = completed + failed;
    var avgProcessing = completed == 0 ? 0.0 : (double) cumulativeProcessingTime.get() / completed;
    var successRate =
        processedForSuccessRate == 0 ? 0.0 : (double) completed / processedForSuccessRate;
    return new AnalysisMetrics(
        completed,
        failed,
        skipped,
        avgProcessing,
        successRate,
        processedForSuccessRate,
        activeRuns.get());
  }

  /** Stops accepting asynchronous runs; queued and running ones are allowed to finish. */
  public void shutdown() {
    if (acceptingRuns.compareAndSet(true, false)) {
      executor.shutdown();
    }
  }

  @PreDestroy
  void onShutdown() {
    shutdown();
  }

  public boolean isHealthy() {
    return acceptingRuns.get() && !executor.isShutdown();
  }
}
