package com.scholary.radio.recorder.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each orchestration event is logged with its fields in MDC so they land as queryable keys in
 * the JSON log output.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log trigger fired event. */
  public void logTriggerFired(String jobId) {
    try {
      MDC.put("event_type", "trigger_fired");
      MDC.put("trigger_job_id", jobId);

      logger.info("Trigger fired: jobId={}", jobId);
    } finally {
      clearEventFields();
    }
  }

  /** Log execution launched event. */
  public void logExecutionLaunched(String executionId, String jobId, String title, boolean spawned) {
    try {
      MDC.put("event_type", "execution_launched");
      MDC.put("trigger_job_id", String.valueOf(jobId));
      MDC.put("spawned", String.valueOf(spawned));

      logger.info(
          "Execution launched: executionId={}, jobId={}, title={}, spawned={}",
          executionId,
          jobId,
          title,
          spawned);
    } finally {
      clearEventFields();
    }
  }

  /** Log execution finished event. */
  public void logExecutionFinished(
      String executionId, String status, Integer exitCode, long durationMs) {
    try {
      MDC.put("event_type", "execution_finished");
      MDC.put("status", status);
      MDC.put("exitCode", String.valueOf(exitCode));
      MDC.put("durationMs", String.valueOf(durationMs));

      if ("SUCCEEDED".equals(status)) {
        logger.info(
            "Execution finished: executionId={}, status={}, exitCode={}, duration={}ms",
            executionId,
            status,
            exitCode,
            durationMs);
      } else {
        logger.error(
            "Execution finished: executionId={}, status={}, exitCode={}, duration={}ms",
            executionId,
            status,
            exitCode,
            durationMs);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Log artifact registered event. */
  public void logArtifactRegistered(
      String executionId, String filePath, long fileSize, Long programId) {
    try {
      MDC.put("event_type", "artifact_registered");
      MDC.put("filePath", filePath);
      MDC.put("fileSize", String.valueOf(fileSize));
      MDC.put("programId", String.valueOf(programId));

      logger.info(
          "Artifact registered: executionId={}, path={}, size={}, programId={}",
          executionId,
          filePath,
          fileSize,
          programId);
    } finally {
      clearEventFields();
    }
  }

  /** Log artifact missing event. */
  public void logArtifactMissing(String executionId, String filePath, String status) {
    try {
      MDC.put("event_type", "artifact_missing");
      MDC.put("filePath", filePath);
      MDC.put("status", status);

      logger.warn(
          "Artifact missing: executionId={}, expectedPath={}, status={}",
          executionId,
          filePath,
          status);
    } finally {
      clearEventFields();
    }
  }

  /** Log schedule recovered event. */
  public void logScheduleRecovered(String jobId, String trigger) {
    try {
      MDC.put("event_type", "schedule_recovered");
      MDC.put("trigger_job_id", jobId);

      logger.info("Schedule recovered: jobId={}, trigger={}", jobId, trigger);
    } finally {
      clearEventFields();
    }
  }

  /** Log past-due schedule discarded event. */
  public void logScheduleDiscarded(String jobId, String fireAt, String title) {
    try {
      MDC.put("event_type", "schedule_discarded");
      MDC.put("trigger_job_id", jobId);
      MDC.put("fireAt", fireAt);

      logger.warn(
          "Past-due schedule discarded without running: jobId={}, fireAt={}, title={}",
          jobId,
          fireAt,
          title);
    } finally {
      clearEventFields();
    }
  }

  /** Set execution context in MDC. */
  public static void setExecutionContext(String executionId, String jobId) {
    MDC.put("executionId", executionId);
    if (jobId != null) {
      MDC.put("jobId", jobId);
    }
  }

  /** Clear execution context from MDC. */
  public static void clearExecutionContext() {
    MDC.remove("executionId");
    MDC.remove("jobId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("trigger_job_id");
    MDC.remove("spawned");
    MDC.remove("status");
    MDC.remove("exitCode");
    MDC.remove("durationMs");
    MDC.remove("filePath");
    MDC.remove("fileSize");
    MDC.remove("programId");
    MDC.remove("fireAt");
  }
}
