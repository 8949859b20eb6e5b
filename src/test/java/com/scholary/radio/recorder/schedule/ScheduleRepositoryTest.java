package com.scholary.radio.recorder.schedule;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.radio.recorder.TestDatabase;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;

class ScheduleRepositoryTest {

  private static final Instant NOW = Instant.parse("2026-10-19T00:00:00Z");

  @TempDir Path tempDir;

  private JdbcTemplate jdbcTemplate;
  private ScheduleRepository repository;

  @BeforeEach
  void setUp() {
    jdbcTemplate = TestDatabase.create(tempDir);
    repository =
        new ScheduleRepository(jdbcTemplate, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void testRecurringScheduleRoundTrip() {
    RecordingCommand command = new RecordingCommand("News", "news", "QRR", "0500", "0530", 7L);
    RecurrenceFields recurrence = new RecurrenceFields("0", "5", "*", "*", "1,2,3,4,5");

    RecurringSchedule saved =
        repository.saveRecurring(recurrence, command, ScheduleDisplay.of(command));

    RecurringSchedule loaded = repository.findRecurring(saved.id()).orElseThrow();
    assertThat(loaded).isEqualTo(saved);
    assertThat(loaded.command()).isEqualTo(command);
    assertThat(loaded.createdAt()).isEqualTo(NOW);
    assertThat(loaded.jobId()).isEqualTo("recurring:" + saved.id());
  }

  @Test
  void testIdsAreDistinct() {
    RecordingCommand command = new RecordingCommand("News", "news", "QRR", "0500", "0530", null);
    RecurrenceFields recurrence = new RecurrenceFields("0", "5", "*", "*", "*");

    long first = repository.saveRecurring(recurrence, command, ScheduleDisplay.of(command)).id();
    long second = repository.saveRecurring(recurrence, command, ScheduleDisplay.of(command)).id();

    assertThat(second).isNotEqualTo(first);
    assertThat(repository.findAllRecurring()).hasSize(2);
  }

  @Test
  void testOneTimeSchedulesOrderedByFireTime() {
    RecordingCommand command =
        new RecordingCommand("Special", "special", "TBS", "202611010300", "202611010400", null);
    Instant later = Instant.parse("2026-11-02T03:00:00Z");
    Instant sooner = Instant.parse("2026-11-01T03:00:00Z");

    repository.saveOneTime(later, command, ScheduleDisplay.of(command));
    repository.saveOneTime(sooner, command, ScheduleDisplay.of(command));

    List<OneTimeSchedule> all = repository.findAllOneTime();
    assertThat(all).extracting(OneTimeSchedule::fireAt).containsExactly(sooner, later);
    assertThat(all.get(0).command()).isEqualTo(command);
  }

  @Test
  void testDeleteReportsWhetherRowExisted() {
    RecordingCommand command =
        new RecordingCommand("Special", "special", "TBS", "202611010300", "202611010400", null);
    OneTimeSchedule saved =
        repository.saveOneTime(
            Instant.parse("2026-11-01T03:00:00Z"), command, ScheduleDisplay.of(command));

    assertThat(repository.deleteOneTime(saved.id())).isTrue();
    assertThat(repository.deleteOneTime(saved.id())).isFalse();
    assertThat(repository.deleteRecurring(12345L)).isFalse();
    assertThat(repository.findOneTime(saved.id())).isEmpty();
  }

  @Test
  void testUnreadableRecurringRowIsSkipped() {
    RecordingCommand command = new RecordingCommand("News", "news", "QRR", "0500", "0530", null);
    RecurringSchedule good =
        repository.saveRecurring(
            new RecurrenceFields("0", "5", "*", "*", "*"), command, ScheduleDisplay.of(command));
    jdbcTemplate.update(
        "INSERT INTO recurring_schedules (minute, hour, day_of_month, month, day_of_week, command,"
            + " created_at) VALUES ('0', '5', '*', '*', '*', 'not json', ?)",
        NOW.toString());
    jdbcTemplate.update(
        "INSERT INTO recurring_schedules (minute, hour, day_of_month, month, day_of_week, command,"
            + " created_at) VALUES ('0', '5', '*', '*', '*', '{\"title\":\"\"}', ?)",
        NOW.toString());

    assertThat(repository.findAllRecurring()).containsExactly(good);
  }

  @Test
  void testUnreadableOneTimeRowIsSkipped() {
    RecordingCommand command =
        new RecordingCommand("Special", "special", "TBS", "202611010300", "202611010400", null);
    OneTimeSchedule good =
        repository.saveOneTime(
            Instant.parse("2026-11-01T03:00:00Z"), command, ScheduleDisplay.of(command));
    jdbcTemplate.update(
        "INSERT INTO one_time_schedules (fire_at, command, created_at) VALUES ('tomorrow', ?, ?)",
        new ObjectMapper().valueToTree(command).toString(),
        NOW.toString());

    assertThat(repository.findAllOneTime()).containsExactly(good);
  }
}
