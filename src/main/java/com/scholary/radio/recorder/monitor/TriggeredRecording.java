package com.scholary.radio.recorder.monitor;

import com.scholary.radio.recorder.schedule.OneTimeSchedule;
import com.scholary.radio.recorder.schedule.RecordingCommand;
import com.scholary.radio.recorder.schedule.RecurringSchedule;
import com.scholary.radio.recorder.schedule.ScheduleDisplay;
import com.scholary.radio.recorder.schedule.ScheduleKind;
import java.time.LocalDate;

/**
 * One firing of a schedule (or an ad-hoc run): everything the completion monitor needs to finish
 * the job without going back to the schedule store.
 */
public record TriggeredRecording(
    String executionId,
    ScheduleKind kind,
    Long scheduleId,
    RecordingCommand command,
    ScheduleDisplay display,
    LocalDate fireDate) {

  /** Trigger scheduler id of the originating schedule, or null for ad-hoc runs. */
  public String jobId() {
    switch (kind) {
      case RECURRING:
        return RecurringSchedule.jobId(scheduleId);
      case ONE_TIME:
        return OneTimeSchedule.jobId(scheduleId);
      default:
        return null;
    }
  }

  public boolean isOneTime() {
    return kind == ScheduleKind.ONE_TIME && scheduleId != null;
  }
}
