package com.scholary.radio.recorder.schedule;

/**
 * Exception thrown when the schedule store cannot be read or written.
 *
 * <p>Propagated to whoever creates or deletes a schedule; a failed write means the schedule was not
 * created (or not removed).
 */
public class ScheduleStoreException extends RuntimeException {

  public ScheduleStoreException(String message) {
    super(message);
  }

  public ScheduleStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
