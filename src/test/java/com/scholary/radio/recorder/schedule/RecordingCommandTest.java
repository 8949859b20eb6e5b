package com.scholary.radio.recorder.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;

class RecordingCommandTest {

  private static final LocalDate FIRE_DATE = LocalDate.of(2026, 10, 19);

  @Test
  void testAbsoluteTimesPassThrough() {
    RecordingCommand command =
        new RecordingCommand("Morning Show", "morning", "TBS", "202610200500", "202610200630", null);

    assertThat(command.toArguments(FIRE_DATE))
        .containsExactly(
            "Morning Show", "morning", "TBS", "202610200500", "202610200630", "", "", "");
    assertThat(command.resolvedStart(FIRE_DATE)).isEqualTo(LocalDateTime.of(2026, 10, 20, 5, 0));
  }

  @Test
  void testTimeOfDayResolvesAgainstFireDate() {
    RecordingCommand command = new RecordingCommand("News", "news", "QRR", "0500", "0530", 12L);

    assertThat(command.toArguments(FIRE_DATE))
        .containsExactly(
            "News", "news", "QRR", "202610190500", "202610190530", "", "", "", "12");
  }

  @Test
  void testTimeOfDayEndCrossesMidnight() {
    RecordingCommand command = new RecordingCommand("Late", "late", "LFR", "2330", "0100", null);

    assertThat(command.resolvedEnd(FIRE_DATE)).isEqualTo(LocalDateTime.of(2026, 10, 20, 1, 0));
  }

  @Test
  void testRejectsInvalidFields() {
    assertThatThrownBy(() -> new RecordingCommand(" ", "f", "S", "0500", "0600", null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("title");
    assertThatThrownBy(() -> new RecordingCommand("t", "f", "S", "5:00", "0600", null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("start");
    assertThatThrownBy(() -> new RecordingCommand("t", "f", "S", "0500", "2561", null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("end");
    assertThatThrownBy(() -> new RecordingCommand("t", "f", "S", "202613010000", "0600", null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
