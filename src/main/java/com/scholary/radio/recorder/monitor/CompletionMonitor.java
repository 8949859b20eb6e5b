package com.scholary.radio.recorder.monitor;

import com.scholary.radio.recorder.catalog.ArtifactLocation;
import com.scholary.radio.recorder.catalog.ArtifactLocator;
import com.scholary.radio.recorder.catalog.CatalogRegistrar;
import com.scholary.radio.recorder.execution.ExecutionOutcome;
import com.scholary.radio.recorder.execution.LaunchedExecution;
import com.scholary.radio.recorder.logging.StructuredLogger;
import com.scholary.radio.recorder.schedule.ScheduleRepository;
import com.scholary.radio.recorder.trigger.TriggerScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Owns one execution from launch to catalog registration.
 *
 * <p>Runs on the monitor pool, never on a trigger or request thread, and is its own error boundary:
 * anything that goes wrong is logged and ends this run only. Nothing is retried; a recurring
 * schedule simply fires again at its next occurrence.
 *
 * <ol>
 *   <li>Wait for the recorder to exit (or be killed at the ceiling)
 *   <li>Derive the artifact path the recorder will have written
 *   <li>If the file is there, register it, even after a failed or timed-out run, since partial
 *       recordings are kept
 *   <li>If it is not, log it and write nothing to the catalog
 *   <li>For a one-time schedule, delete it from the store and drop its trigger
 * </ol>
 */
@Component
public class CompletionMonitor {

  private static final Logger LOGGER = LoggerFactory.getLogger(CompletionMonitor.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final ArtifactLocator artifactLocator;
  private final CatalogRegistrar catalogRegistrar;
  private final ScheduleRepository scheduleRepository;
  private final TriggerScheduler triggerScheduler;
  private final ExecutionRepository executionRepository;
  private final ExecutionMarkerRepository markerRepository;

  public CompletionMonitor(
      ArtifactLocator artifactLocator,
      CatalogRegistrar catalogRegistrar,
      ScheduleRepository scheduleRepository,
      TriggerScheduler triggerScheduler,
      ExecutionRepository executionRepository,
      ExecutionMarkerRepository markerRepository) {
    this.artifactLocator = artifactLocator;
    this.catalogRegistrar = catalogRegistrar;
    this.scheduleRepository = scheduleRepository;
    this.triggerScheduler = triggerScheduler;
    this.executionRepository = executionRepository;
    this.markerRepository = markerRepository;
  }

  /** Follow {@code execution} to the end. Blocks until the recorder exits; never throws. */
  public void complete(TriggeredRecording recording, LaunchedExecution execution) {
    String executionId = recording.executionId();
    StructuredLogger.setExecutionContext(executionId, recording.jobId());
    try {
      ExecutionOutcome outcome = execution.awaitOutcome();
      executionRepository.findById(executionId).ifPresent(record -> record.applyOutcome(outcome));
      structuredLogger.logExecutionFinished(
          executionId,
          outcome.status().name(),
          outcome.exitCode(),
          outcome.duration().toMillis());
      if (!outcome.isSuccessful()) {
        LOGGER.error(
            "Recording did not succeed: executionId={}, title={}, output:\n{}",
            executionId,
            recording.command().title(),
            outcome.output());
      }

      ArtifactLocation artifact =
          artifactLocator.locate(recording.command(), recording.fireDate());
      if (artifact.exists()) {
        if (!outcome.isSuccessful()) {
          LOGGER.warn(
              "Registering artifact from unsuccessful run: executionId={}, path={}",
              executionId,
              artifact.relativePath());
        }
        catalogRegistrar.registerArtifact(
            executionId,
            recording.command(),
            recording.display(),
            recording.fireDate(),
            artifact);
        executionRepository
            .findById(executionId)
            .ifPresent(record -> record.setArtifactPath(artifact.relativePath()));
      } else {
        structuredLogger.logArtifactMissing(
            executionId, artifact.relativePath(), outcome.status().name());
      }

    } catch (Exception e) {
      LOGGER.error("Completion monitor failed: executionId={}", executionId, e);
      executionRepository
          .findById(executionId)
          .ifPresent(record -> record.setError(String.valueOf(e.getMessage())));
    } finally {
      if (recording.isOneTime()) {
        retireOneTime(recording);
      }
      clearMarker(executionId);
      StructuredLogger.clearExecutionContext();
    }
  }

  private void retireOneTime(TriggeredRecording recording) {
    try {
      scheduleRepository.deleteOneTime(recording.scheduleId());
    } catch (RuntimeException e) {
      LOGGER.error(
          "Failed to delete finished one-time schedule: id={}", recording.scheduleId(), e);
    }
    try {
      triggerScheduler.deregister(recording.jobId());
    } catch (RuntimeException e) {
      LOGGER.warn("Failed to deregister trigger: jobId={}", recording.jobId(), e);
    }
  }

  private void clearMarker(String executionId) {
    try {
      markerRepository.delete(executionId);
    } catch (DataAccessException e) {
      LOGGER.warn("Failed to clear execution marker: executionId={}", executionId, e);
    }
  }
}
