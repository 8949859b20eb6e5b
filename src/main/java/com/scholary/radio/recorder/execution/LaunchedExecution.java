package com.scholary.radio.recorder.execution;

/** A recorder run that has been started (or failed to start). */
public interface LaunchedExecution {

  /** True if a process was actually spawned. */
  boolean spawned();

  /**
   * Block until the run ends or hits the timeout ceiling, killing it in the latter case.
   *
   * <p>Never throws; every failure is described by the returned outcome. Calling again returns the
   * same outcome.
   */
  ExecutionOutcome awaitOutcome();

  /** Kill the run now, with its descendants. No-op if nothing is running. */
  void terminate();

  /** An execution whose process never started. */
  static LaunchedExecution failed(ExecutionOutcome outcome) {
    return new LaunchedExecution() {
      @Override
      public boolean spawned() {
        return false;
      }

      @Override
      public ExecutionOutcome awaitOutcome() {
        return outcome;
      }

      @Override
      public void terminate() {}
    };
  }
}
