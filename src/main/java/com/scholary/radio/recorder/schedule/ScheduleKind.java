package com.scholary.radio.recorder.schedule;

/** Where a triggered recording came from. */
public enum ScheduleKind {
  RECURRING,
  ONE_TIME,
  MANUAL
}
