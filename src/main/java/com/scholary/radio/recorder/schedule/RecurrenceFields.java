package com.scholary.radio.recorder.schedule;

/**
 * The five recurrence fields of a repeating schedule, exactly as the user entered them.
 *
 * <p>Day-of-week uses 0=Sunday..6=Saturday. Each field is a literal, {@code *}, or a
 * comma-separated list of literals.
 */
public record RecurrenceFields(
    String minute, String hour, String dayOfMonth, String month, String dayOfWeek) {}
