package com.scholary.radio.recorder.trigger;

import java.time.Instant;
import java.util.Objects;

/**
 * What the trigger scheduler arms: either a cron expression (recurring) or an instant (one-time).
 *
 * <p>Cron expressions use Spring's six-field format with the seconds field first.
 */
public record TriggerSpec(String cron, Instant fireAt) {

  public TriggerSpec {
    if ((cron == null) == (fireAt == null)) {
      throw new IllegalArgumentException("Exactly one of cron or fireAt must be set");
    }
  }

  public static TriggerSpec cron(String expression) {
    return new TriggerSpec(Objects.requireNonNull(expression, "expression"), null);
  }

  public static TriggerSpec once(Instant fireAt) {
    return new TriggerSpec(null, Objects.requireNonNull(fireAt, "fireAt"));
  }

  public boolean isRecurring() {
    return cron != null;
  }
}
