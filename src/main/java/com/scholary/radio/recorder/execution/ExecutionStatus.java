package com.scholary.radio.recorder.execution;

/** How a recorder run ended. */
public enum ExecutionStatus {
  SUCCEEDED,
  FAILED,
  TIMED_OUT
}
