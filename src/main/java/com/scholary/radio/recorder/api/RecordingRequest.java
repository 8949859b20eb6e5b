package com.scholary.radio.recorder.api;

import com.scholary.radio.recorder.schedule.RecordingCommand;
import com.scholary.radio.recorder.schedule.ScheduleDisplay;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * What to record: the recorder arguments plus the names shown in the catalog.
 *
 * <p>{@code start} and {@code end} are {@code yyyyMMddHHmm}, or {@code HHmm} for a segment that
 * repeats daily. {@code stationName} defaults to the station id.
 */
public record RecordingRequest(
    @NotBlank String title,
    @NotBlank String feedId,
    @NotBlank String stationId,
    String stationName,
    @NotBlank @Pattern(regexp = "\\d{12}|\\d{4}") String start,
    @NotBlank @Pattern(regexp = "\\d{12}|\\d{4}") String end,
    Long folderId) {

  public RecordingCommand toCommand() {
    return new RecordingCommand(title, feedId, stationId, start, end, folderId);
  }

  public ScheduleDisplay toDisplay() {
    return new ScheduleDisplay(
        title,
        stationName == null || stationName.isBlank() ? stationId : stationName,
        start,
        end);
  }
}
