package com.scholary.radio.recorder.api;

import com.scholary.radio.recorder.schedule.OneTimeSchedule;
import com.scholary.radio.recorder.schedule.RecordingCommand;
import com.scholary.radio.recorder.schedule.RecurrenceFields;
import com.scholary.radio.recorder.schedule.RecurringSchedule;
import com.scholary.radio.recorder.schedule.ScheduleDisplay;
import java.time.Instant;

/**
 * A stored schedule as returned by the API.
 *
 * <p>Exactly one of {@code recurrence} and {@code fireAt} is set.
 */
public record ScheduleResponse(
    long id,
    String jobId,
    RecurrenceFields recurrence,
    Instant fireAt,
    RecordingCommand command,
    ScheduleDisplay display,
    Instant createdAt) {

  public static ScheduleResponse of(RecurringSchedule schedule) {
    return new ScheduleResponse(
        schedule.id(),
        schedule.jobId(),
        schedule.recurrence(),
        null,
        schedule.command(),
        schedule.display(),
        schedule.createdAt());
  }

  public static ScheduleResponse of(OneTimeSchedule schedule) {
    return new ScheduleResponse(
        schedule.id(),
        schedule.jobId(),
        null,
        schedule.fireAt(),
        schedule.command(),
        schedule.display(),
        schedule.createdAt());
  }
}
