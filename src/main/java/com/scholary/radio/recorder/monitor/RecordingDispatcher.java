package com.scholary.radio.recorder.monitor;

import com.scholary.radio.recorder.execution.ExecutionRunner;
import com.scholary.radio.recorder.execution.LaunchedExecution;
import com.scholary.radio.recorder.logging.StructuredLogger;
import com.scholary.radio.recorder.schedule.RecordingCommand;
import com.scholary.radio.recorder.schedule.ScheduleDisplay;
import com.scholary.radio.recorder.schedule.ScheduleKind;
import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Starts a recording and hands it to a completion monitor.
 *
 * <p>This is what a trigger (or an ad-hoc request) calls. It returns as soon as the recorder is
 * launched and the monitor is queued; the caller gets the execution id and nothing else. Outcomes
 * are observable only through the catalog, the execution status cache and the logs.
 */
@Service
public class RecordingDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(RecordingDispatcher.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final ExecutionRunner executionRunner;
  private final CompletionMonitor completionMonitor;
  private final ExecutionRepository executionRepository;
  private final ExecutionMarkerRepository markerRepository;
  private final TaskExecutor monitorExecutor;
  private final Clock clock;

  public RecordingDispatcher(
      ExecutionRunner executionRunner,
      CompletionMonitor completionMonitor,
      ExecutionRepository executionRepository,
      ExecutionMarkerRepository markerRepository,
      @Qualifier("monitorExecutor") TaskExecutor monitorExecutor,
      Clock clock) {
    this.executionRunner = executionRunner;
    this.completionMonitor = completionMonitor;
    this.executionRepository = executionRepository;
    this.markerRepository = markerRepository;
    this.monitorExecutor = monitorExecutor;
    this.clock = clock;
  }

  /**
   * Launch {@code command} now and spawn its completion monitor.
   *
   * @param kind where the request came from
   * @param scheduleId originating schedule, or null for ad-hoc runs
   * @param command the command exactly as persisted
   * @param display display fields to catalog the result under
   * @return the execution id
   */
  public String dispatch(
      ScheduleKind kind, Long scheduleId, RecordingCommand command, ScheduleDisplay display) {
    String executionId = UUID.randomUUID().toString();
    TriggeredRecording recording =
        new TriggeredRecording(
            executionId, kind, scheduleId, command, display, LocalDate.now(clock));

    StructuredLogger.setExecutionContext(executionId, recording.jobId());
    try {
      ExecutionRecord record =
          new ExecutionRecord(executionId, recording.jobId(), command.title(), clock.instant());
      executionRepository.save(record);
      writeMarker(recording);

      LaunchedExecution launched =
          executionRunner.launch(executionId, command, recording.fireDate());
      structuredLogger.logExecutionLaunched(
          executionId, recording.jobId(), command.title(), launched.spawned());
      if (launched.spawned()) {
        record.setState(ExecutionRecord.State.RUNNING);
      }

      try {
        monitorExecutor.execute(() -> completionMonitor.complete(recording, launched));
      } catch (TaskRejectedException e) {
        LOGGER.error(
            "Completion monitor pool rejected execution {}; terminating the recorder",
            executionId,
            e);
        record.setError("Completion monitor rejected: " + e.getMessage());
        // Unmonitored runs are not allowed: kill it, then settle it here.
        launched.terminate();
        completionMonitor.complete(recording, launched);
      }
      return executionId;
    } finally {
      StructuredLogger.clearExecutionContext();
    }
  }

  private void writeMarker(TriggeredRecording recording) {
    try {
      markerRepository.save(recording, clock.instant());
    } catch (DataAccessException | IllegalArgumentException e) {
      LOGGER.warn(
          "Failed to write execution marker: executionId={}", recording.executionId(), e);
    }
  }
}
