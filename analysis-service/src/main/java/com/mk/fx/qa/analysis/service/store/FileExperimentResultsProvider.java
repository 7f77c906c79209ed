package com.mk.fx.qa.analysis.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.analysis.service.cfg.AnalysisProcessingCfg;
import com.mk.fx.qa.analysis.service.model.ExperimentResult;
import com.mk.fx.qa.analysis.service.ports.ExperimentResultsProvider;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Reads experiment results from {@code <directory>/<experimentId>.json}. */
@Slf4j
@Component
public class FileExperimentResultsProvider implements ExperimentResultsProvider {

  private static final String SUFFIX = ".json";

  private final ObjectMapper objectMapper;
  private final Path directory;

  @Autowired
  public FileExperimentResultsProvider(ObjectMapper objectMapper, AnalysisProcessingCfg cfg) {
    this(objectMapper, Paths.get(cfg.getResults().getDirectory()));
  }

  public FileExperimentResultsProvider(ObjectMapper objectMapper, Path directory) {
    this.objectMapper = objectMapper;
    this.directory = directory;
  }

  @Override
  public Optional<ExperimentResult> findResult(String experimentId) {
    Path file = directory.resolve(experimentId + SUFFIX);
    if (!Files.isRegularFile(file)) {
      return Optional.empty();
    }
    return Optional.of(read(file));
  }

  @Override
  public List<String> experimentIds() {
    if (!Files.isDirectory(directory)) {
      log.warn("Results directory {} does not exist", directory.toAbsolutePath());
      return List.of();
    }
    try (Stream<Path> files = Files.list(directory)) {
      return files
          .map(f -> f.getFileName().toString())
          .filter(name -> name.endsWith(SUFFIX))
          .map(name -> name.substring(0, name.length() - SUFFIX.length()))
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list " + directory, e);
    }
  }

  private ExperimentResult read(Path file) {
    try {
      return objectMapper.readValue(file.toFile(), ExperimentResult.class);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read experiment result " + file, e);
    }
  }
}
