package com.scholary.radio.recorder.monitor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.radio.recorder.schedule.RecordingCommand;
import com.scholary.radio.recorder.schedule.ScheduleDisplay;
import com.scholary.radio.recorder.schedule.ScheduleKind;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Durable "execution in progress" markers.
 *
 * <p>A marker is written before the recorder is launched and removed once its completion monitor is
 * done. A marker still present at startup belongs to a run whose monitor never finished.
 */
@Repository
public class ExecutionMarkerRepository {

  private final JdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public ExecutionMarkerRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
  }

  public void save(TriggeredRecording recording, Instant startedAt) {
    String command;
    try {
      command = objectMapper.writeValueAsString(recording.command());
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Unserializable recording command", e);
    }
    jdbcTemplate.update(
        "INSERT OR REPLACE INTO execution_markers (execution_id, schedule_kind, schedule_id,"
            + " command, title, station, start_time, end_time, fire_date, started_at)"
            + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
        recording.executionId(),
        recording.kind().name(),
        recording.scheduleId(),
        command,
        recording.display().title(),
        recording.display().station(),
        recording.display().startTime(),
        recording.display().endTime(),
        recording.fireDate().toString(),
        startedAt.toEpochMilli());
  }

  public boolean delete(String executionId) {
    return jdbcTemplate.update(
            "DELETE FROM execution_markers WHERE execution_id = ?", executionId)
        > 0;
  }

  /** Markers written before {@code instant}, oldest first. */
  public List<TriggeredRecording> findStartedBefore(Instant instant) {
    return jdbcTemplate.query(
        "SELECT * FROM execution_markers WHERE started_at < ? ORDER BY started_at ASC",
        markerMapper(),
        instant.toEpochMilli());
  }

  private RowMapper<TriggeredRecording> markerMapper() {
    return (rs, rowNum) -> {
      long scheduleId = rs.getLong("schedule_id");
      Long nullableScheduleId = rs.wasNull() ? null : scheduleId;
      RecordingCommand command;
      try {
        command = objectMapper.readValue(rs.getString("command"), RecordingCommand.class);
      } catch (JsonProcessingException e) {
        throw new SQLException("Unreadable marker command: " + rs.getString("execution_id"), e);
      }
      return new TriggeredRecording(
          rs.getString("execution_id"),
          ScheduleKind.valueOf(rs.getString("schedule_kind")),
          nullableScheduleId,
          command,
          new ScheduleDisplay(
              rs.getString("title"),
              rs.getString("station"),
              rs.getString("start_time"),
              rs.getString("end_time")),
          LocalDate.parse(rs.getString("fire_date")));
    };
  }
}
