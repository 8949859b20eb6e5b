package com.scholary.radio.recorder.execution;

import java.time.Duration;

/**
 * Result of one recorder run. Never persisted on its own.
 *
 * @param status how the run ended
 * @param exitCode process exit code; null if no process ran or it had to be killed
 * @param output tail of the combined stdout/stderr
 * @param duration wall-clock time from launch to exit (or kill)
 */
public record ExecutionOutcome(
    ExecutionStatus status, Integer exitCode, String output, Duration duration) {

  public static ExecutionOutcome spawnFailed(String message) {
    return new ExecutionOutcome(ExecutionStatus.FAILED, null, message, Duration.ZERO);
  }

  public boolean isSuccessful() {
    return status == ExecutionStatus.SUCCEEDED;
  }
}
