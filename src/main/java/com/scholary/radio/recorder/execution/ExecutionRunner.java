package com.scholary.radio.recorder.execution;

import com.scholary.radio.recorder.schedule.RecordingCommand;
import java.time.LocalDate;

/**
 * Runs the external recorder.
 *
 * <p>Launching returns as soon as the process is started; waiting for it is the caller's business
 * through {@link LaunchedExecution#awaitOutcome()}.
 */
public interface ExecutionRunner {

  /**
   * Start the recorder for {@code command}. Never throws: a process that cannot be spawned yields
   * an execution whose outcome is already {@link ExecutionStatus#FAILED}.
   *
   * @param executionId identifier of this run, used to name its output log
   * @param command the command exactly as persisted
   * @param fireDate date the trigger fired on, for time-of-day start/end
   */
  LaunchedExecution launch(String executionId, RecordingCommand command, LocalDate fireDate);
}
