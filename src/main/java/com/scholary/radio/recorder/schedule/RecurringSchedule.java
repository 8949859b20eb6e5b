package com.scholary.radio.recorder.schedule;

import java.time.Instant;

/** A repeating recording, re-armed after every firing. */
public record RecurringSchedule(
    long id,
    RecurrenceFields recurrence,
    RecordingCommand command,
    ScheduleDisplay display,
    Instant createdAt) {

  public static final String JOB_PREFIX = "recurring:";

  /** The trigger scheduler handle for this schedule. */
  public String jobId() {
    return jobId(id);
  }

  public static String jobId(long id) {
    return JOB_PREFIX + id;
  }

  public Long folderId() {
    return command.folderId();
  }
}
