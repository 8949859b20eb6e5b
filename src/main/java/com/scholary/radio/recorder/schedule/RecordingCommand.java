package com.scholary.radio.recorder.schedule;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * The fully resolved arguments needed to invoke the recorder.
 *
 * <p>Persisted as-is with every schedule and handed to the runner unmodified. {@code start} and
 * {@code end} are either absolute ({@code yyyyMMddHHmm}) or a time of day ({@code HHmm}); a time of
 * day is resolved against the date the trigger fires on, which is how a recurring schedule records
 * the current day's segment.
 */
public record RecordingCommand(
    String title, String feedId, String stationId, String start, String end, Long folderId) {

  static final DateTimeFormatter ABSOLUTE = DateTimeFormatter.ofPattern("yyyyMMddHHmm");
  private static final DateTimeFormatter TIME_OF_DAY = DateTimeFormatter.ofPattern("HHmm");
  private static final Pattern TIMESTAMP = Pattern.compile("\\d{12}|\\d{4}");

  public RecordingCommand {
    requireText(title, "title");
    requireText(feedId, "feedId");
    requireText(stationId, "stationId");
    requireTimestamp(start, "start");
    requireTimestamp(end, "end");
  }

  /** Start of the segment as it applies to a firing on {@code fireDate}. */
  public LocalDateTime resolvedStart(LocalDate fireDate) {
    return resolve(start, fireDate);
  }

  /**
   * End of the segment as it applies to a firing on {@code fireDate}.
   *
   * <p>A time-of-day end that is not after the start crosses midnight.
   */
  public LocalDateTime resolvedEnd(LocalDate fireDate) {
    LocalDateTime resolvedEnd = resolve(end, fireDate);
    if (isTimeOfDay(end) && !resolvedEnd.isAfter(resolvedStart(fireDate))) {
      return resolvedEnd.plusDays(1);
    }
    return resolvedEnd;
  }

  /**
   * Recorder argument list, excluding the executable.
   *
   * <p>Slot order: title, feed, station, start, end, skip, dir, mail, then the destination folder
   * when one is set. The skip/dir/mail slots are always passed empty.
   */
  public List<String> toArguments(LocalDate fireDate) {
    List<String> args = new ArrayList<>();
    args.add(title);
    args.add(feedId);
    args.add(stationId);
    args.add(resolvedStart(fireDate).format(ABSOLUTE));
    args.add(resolvedEnd(fireDate).format(ABSOLUTE));
    args.add("");
    args.add("");
    args.add("");
    if (folderId != null) {
      args.add(String.valueOf(folderId));
    }
    return args;
  }

  private static LocalDateTime resolve(String value, LocalDate fireDate) {
    if (isTimeOfDay(value)) {
      return fireDate.atTime(LocalTime.parse(value, TIME_OF_DAY));
    }
    return LocalDateTime.parse(value, ABSOLUTE);
  }

  private static boolean isTimeOfDay(String value) {
    return value.length() == 4;
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
  }

  private static void requireTimestamp(String value, String name) {
    if (value == null || !TIMESTAMP.matcher(value).matches()) {
      throw new IllegalArgumentException(name + " must be yyyyMMddHHmm or HHmm, got: " + value);
    }
    try {
      resolve(value, LocalDate.of(2000, 1, 1));
    } catch (RuntimeException e) {
      throw new IllegalArgumentException(name + " is not a valid time: " + value, e);
    }
  }
}
