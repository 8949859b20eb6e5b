package com.scholary.radio.recorder.trigger;

/**
 * Thrown when a recurrence field or fire time cannot be turned into a trigger.
 *
 * <p>Raised before anything is persisted, so a rejected schedule never exists.
 */
public class ScheduleConversionException extends RuntimeException {

  public ScheduleConversionException(String message) {
    super(message);
  }
}
