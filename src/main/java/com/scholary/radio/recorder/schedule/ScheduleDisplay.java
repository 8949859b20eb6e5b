package com.scholary.radio.recorder.schedule;

/**
 * Denormalized display fields kept next to a schedule so listings never re-parse the command.
 */
public record ScheduleDisplay(String title, String station, String startTime, String endTime) {

  /** Display fields derived from the command itself, for ad-hoc recordings. */
  public static ScheduleDisplay of(RecordingCommand command) {
    return new ScheduleDisplay(
        command.title(), command.stationId(), command.start(), command.end());
  }
}
