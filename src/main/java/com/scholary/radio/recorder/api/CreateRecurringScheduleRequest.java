package com.scholary.radio.recorder.api;

import com.scholary.radio.recorder.schedule.RecurrenceFields;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/** Recurrence in five fields (day-of-week 0=Sunday..6=Saturday) plus what to record. */
public record CreateRecurringScheduleRequest(
    @NotBlank String minute,
    @NotBlank String hour,
    @NotBlank String dayOfMonth,
    @NotBlank String month,
    @NotBlank String dayOfWeek,
    @Valid @NotNull RecordingRequest recording) {

  public RecurrenceFields toRecurrence() {
    return new RecurrenceFields(minute, hour, dayOfMonth, month, dayOfWeek);
  }
}
