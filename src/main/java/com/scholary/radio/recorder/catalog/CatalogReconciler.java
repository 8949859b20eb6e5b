package com.scholary.radio.recorder.catalog;

import com.scholary.radio.recorder.config.RecorderProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Sweeps the output directory against the catalog.
 *
 * <p>Recordings on disk with no catalog entry are registered, which picks up artifacts whose
 * completion monitor never finished and files the naming rule failed to predict. Catalog entries
 * whose file is gone are reported but not removed; deletion stays an explicit user action.
 */
@Component
public class CatalogReconciler {

  private static final Logger LOGGER = LoggerFactory.getLogger(CatalogReconciler.class);

  private static final String RECORDING_SUFFIX = ".mp3";

  private final ArtifactLocator artifactLocator;
  private final CatalogRepository catalogRepository;
  private final CatalogRegistrar catalogRegistrar;
  private final TaskScheduler taskScheduler;
  private final Duration rescanInterval;

  public CatalogReconciler(
      ArtifactLocator artifactLocator,
      CatalogRepository catalogRepository,
      CatalogRegistrar catalogRegistrar,
      @Qualifier("triggerTaskScheduler") TaskScheduler taskScheduler,
      RecorderProperties properties) {
    this.artifactLocator = artifactLocator;
    this.catalogRepository = catalogRepository;
    this.catalogRegistrar = catalogRegistrar;
    this.taskScheduler = taskScheduler;
    this.rescanInterval = properties.rescanInterval();
  }

  /** Start the periodic sweep once the application is up, if an interval is configured. */
  @EventListener(ApplicationReadyEvent.class)
  public void schedulePeriodicRescan() {
    if (rescanInterval.isZero() || rescanInterval.isNegative()) {
      LOGGER.info("Periodic catalog rescan disabled");
      return;
    }
    taskScheduler.scheduleWithFixedDelay(this::rescanQuietly, rescanInterval);
    LOGGER.info("Periodic catalog rescan every {}", rescanInterval);
  }

  /**
   * Compare the output directory with the catalog and register untracked recordings.
   *
   * @throws IOException if the output directory cannot be walked
   */
  public RescanReport rescan() throws IOException {
    Path root = artifactLocator.outputRoot();
    if (!Files.isDirectory(root)) {
      LOGGER.warn("Output directory does not exist: {}", root);
      return new RescanReport(0, List.of(), catalogRepository.findAllPaths());
    }

    List<Path> files;
    try (Stream<Path> stream = Files.walk(root)) {
      files =
          stream
              .filter(Files::isRegularFile)
              .filter(path -> path.getFileName().toString().endsWith(RECORDING_SUFFIX))
              .sorted()
              .collect(Collectors.toList());
    }

    Set<String> onDisk = new HashSet<>();
    List<String> registered = new ArrayList<>();
    for (Path file : files) {
      String relativePath = artifactLocator.relativize(file);
      onDisk.add(relativePath);
      if (catalogRepository.findByPath(relativePath).isEmpty()) {
        catalogRegistrar.upsert(untrackedEntry(relativePath, file));
        registered.add(relativePath);
      }
    }

    List<String> missing =
        catalogRepository.findAllPaths().stream()
            .filter(path -> !onDisk.contains(path))
            .collect(Collectors.toList());

    LOGGER.info(
        "Catalog rescan: scanned={}, registered={}, missingFiles={}",
        files.size(),
        registered.size(),
        missing.size());
    if (!missing.isEmpty()) {
      LOGGER.warn("Catalog entries without a file: {}", missing);
    }
    return new RescanReport(files.size(), registered, missing);
  }

  private void rescanQuietly() {
    try {
      rescan();
    } catch (IOException | RuntimeException e) {
      LOGGER.error("Periodic catalog rescan failed", e);
    }
  }

  private CatalogEntry untrackedEntry(String relativePath, Path file) throws IOException {
    BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
    Optional<ArtifactNaming.ParsedName> parsed =
        artifactLocator.naming().parse(Path.of(relativePath));
    return new CatalogEntry(
        relativePath,
        file.getFileName().toString(),
        null,
        parsed.map(ArtifactNaming.ParsedName::title).orElse(null),
        null,
        null,
        parsed.map(name -> name.broadcastDate().toString()).orElse(null),
        null,
        null,
        attributes.size(),
        attributes.lastModifiedTime().toInstant(),
        null,
        null,
        null);
  }
}
