package com.scholary.radio.recorder.trigger;

import com.scholary.radio.recorder.schedule.RecurrenceFields;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

/**
 * Translates the five user-facing recurrence fields into the trigger scheduler's cron format and
 * back.
 *
 * <p>Each field is {@code *}, a literal, or a comma-separated list of literals. Ranges and steps are
 * not accepted. Day-of-week numbers (0=Sunday) become Spring's symbolic names, element-wise and in
 * the order given, so {@code 1,3,5} becomes {@code MON,WED,FRI}.
 */
@Component
public class RecurrenceConverter {

  static final String WILDCARD = "*";
  private static final String[] DAY_NAMES = {"SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT"};
  private static final Pattern LITERAL = Pattern.compile("\\d{1,2}");

  /**
   * Convert recurrence fields into a recurring trigger.
   *
   * @throws ScheduleConversionException if any field is outside its domain
   */
  public TriggerSpec toTrigger(RecurrenceFields fields) {
    if (fields == null) {
      throw new ScheduleConversionException("Recurrence fields are required");
    }
    String minute = numeric("minute", fields.minute(), 0, 59);
    String hour = numeric("hour", fields.hour(), 0, 23);
    String dayOfMonth = numeric("day-of-month", fields.dayOfMonth(), 1, 31);
    String month = numeric("month", fields.month(), 1, 12);
    String dayOfWeek = dayOfWeek(fields.dayOfWeek());

    String expression = String.join(" ", "0", minute, hour, dayOfMonth, month, dayOfWeek);
    if (!CronExpression.isValidExpression(expression)) {
      throw new ScheduleConversionException("Not a valid schedule: " + expression);
    }
    return TriggerSpec.cron(expression);
  }

  /**
   * Convert an absolute fire time into a one-time trigger.
   *
   * @throws ScheduleConversionException if the fire time is missing
   */
  public TriggerSpec toTrigger(Instant fireAt) {
    if (fireAt == null) {
      throw new ScheduleConversionException("Fire time is required");
    }
    return TriggerSpec.once(fireAt);
  }

  /**
   * Inverse display mapping of {@link #toTrigger(RecurrenceFields)}.
   *
   * @throws ScheduleConversionException if the trigger was not produced by this converter
   */
  public RecurrenceFields toFields(TriggerSpec trigger) {
    if (trigger == null || !trigger.isRecurring()) {
      throw new ScheduleConversionException("Only recurring triggers carry recurrence fields");
    }
    String[] parts = trigger.cron().trim().split("\\s+");
    if (parts.length != 6) {
      throw new ScheduleConversionException("Expected six cron fields: " + trigger.cron());
    }
    return new RecurrenceFields(parts[1], parts[2], parts[3], parts[4], dayNumbers(parts[5]));
  }

  private static String numeric(String name, String value, int min, int max) {
    List<String> elements = elements(name, value);
    if (elements == null) {
      return WILDCARD;
    }
    for (String element : elements) {
      parseLiteral(name, element, min, max);
    }
    return String.join(",", elements);
  }

  private static String dayOfWeek(String value) {
    List<String> elements = elements("day-of-week", value);
    if (elements == null) {
      return WILDCARD;
    }
    List<String> names = new ArrayList<>(elements.size());
    for (String element : elements) {
      names.add(DAY_NAMES[parseLiteral("day-of-week", element, 0, 6)]);
    }
    return String.join(",", names);
  }

  /** Split a field into its list elements, or null for the wildcard. */
  private static List<String> elements(String name, String value) {
    if (value == null || value.isBlank()) {
      throw new ScheduleConversionException(name + " is required");
    }
    String trimmed = value.trim();
    if (WILDCARD.equals(trimmed)) {
      return null;
    }
    List<String> elements = new ArrayList<>();
    for (String element : trimmed.split(",", -1)) {
      String literal = element.trim();
      if (literal.isEmpty()) {
        throw new ScheduleConversionException(name + " has an empty list element: " + value);
      }
      elements.add(literal);
    }
    return elements;
  }

  private static int parseLiteral(String name, String literal, int min, int max) {
    if (!LITERAL.matcher(literal).matches()) {
      throw new ScheduleConversionException(
          name + " must be '*', a number or a comma list of numbers, got: " + literal);
    }
    int number = Integer.parseInt(literal);
    if (number < min || number > max) {
      throw new ScheduleConversionException(
          name + " must be between " + min + " and " + max + ", got: " + literal);
    }
    return number;
  }

  private static String dayNumbers(String field) {
    if (WILDCARD.equals(field)) {
      return WILDCARD;
    }
    List<String> numbers = new ArrayList<>();
    for (String name : field.split(",")) {
      int index = indexOfDay(name);
      if (index < 0) {
        throw new ScheduleConversionException("Unknown day-of-week name: " + name);
      }
      numbers.add(String.valueOf(index));
    }
    return String.join(",", numbers);
  }

  private static int indexOfDay(String name) {
    for (int i = 0; i < DAY_NAMES.length; i++) {
      if (DAY_NAMES[i].equals(name)) {
        return i;
      }
    }
    return -1;
  }
}
