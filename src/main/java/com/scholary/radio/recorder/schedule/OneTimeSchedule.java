package com.scholary.radio.recorder.schedule;

import java.time.Instant;

/** A single recording at an absolute instant, removed after it has run. */
public record OneTimeSchedule(
    long id, Instant fireAt, RecordingCommand command, ScheduleDisplay display, Instant createdAt) {

  public static final String JOB_PREFIX = "onetime:";

  public String jobId() {
    return jobId(id);
  }

  public static String jobId(long id) {
    return JOB_PREFIX + id;
  }

  /** True once the fire time is strictly before {@code now}. */
  public boolean isPastDue(Instant now) {
    return fireAt.isBefore(now);
  }
}
