package com.scholary.radio.recorder.schedule;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Durable store of schedule definitions, the single source of truth across restarts.
 *
 * <p>Every write is a single statement. The execution command is stored as JSON and read back
 * unchanged. Listing skips rows that can no longer be read.
 */
@Repository
public class ScheduleRepository {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScheduleRepository.class);

  private static final String INSERT_RECURRING =
      "INSERT INTO recurring_schedules (minute, hour, day_of_month, month, day_of_week, command,"
          + " title, station, start_time, end_time, folder_id, created_at)"
          + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

  private static final String INSERT_ONE_TIME =
      "INSERT INTO one_time_schedules (fire_at, command, title, station, start_time, end_time,"
          + " created_at) VALUES (?, ?, ?, ?, ?, ?, ?)";

  private final JdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public ScheduleRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  public RecurringSchedule saveRecurring(
      RecurrenceFields recurrence, RecordingCommand command, ScheduleDisplay display) {
    Instant createdAt = clock.instant();
    String commandJson = writeCommand(command);
    long id =
        insert(
            INSERT_RECURRING,
            recurrence.minute(),
            recurrence.hour(),
            recurrence.dayOfMonth(),
            recurrence.month(),
            recurrence.dayOfWeek(),
            commandJson,
            display.title(),
            display.station(),
            display.startTime(),
            display.endTime(),
            command.folderId(),
            createdAt.toString());
    LOGGER.info("Recurring schedule saved: id={}, title={}", id, display.title());
    return new RecurringSchedule(id, recurrence, command, display, createdAt);
  }

  public OneTimeSchedule saveOneTime(
      Instant fireAt, RecordingCommand command, ScheduleDisplay display) {
    Instant createdAt = clock.instant();
    long id =
        insert(
            INSERT_ONE_TIME,
            fireAt.toString(),
            writeCommand(command),
            display.title(),
            display.station(),
            display.startTime(),
            display.endTime(),
            createdAt.toString());
    LOGGER.info("One-time schedule saved: id={}, fireAt={}", id, fireAt);
    return new OneTimeSchedule(id, fireAt, command, display, createdAt);
  }

  public List<RecurringSchedule> findAllRecurring() {
    try {
      return readable(
          jdbcTemplate.query(
              "SELECT * FROM recurring_schedules ORDER BY created_at DESC, id DESC",
              skippingUnreadable(recurringMapper(), "recurring")));
    } catch (DataAccessException e) {
      throw new ScheduleStoreException("Failed to load recurring schedules", e);
    }
  }

  public List<OneTimeSchedule> findAllOneTime() {
    try {
      return readable(
          jdbcTemplate.query(
              "SELECT * FROM one_time_schedules ORDER BY fire_at ASC, id ASC",
              skippingUnreadable(oneTimeMapper(), "one-time")));
    } catch (DataAccessException e) {
      throw new ScheduleStoreException("Failed to load one-time schedules", e);
    }
  }

  public Optional<RecurringSchedule> findRecurring(long id) {
    try {
      return jdbcTemplate
          .query("SELECT * FROM recurring_schedules WHERE id = ?", recurringMapper(), id)
          .stream()
          .findFirst();
    } catch (DataAccessException e) {
      throw new ScheduleStoreException("Failed to load recurring schedule " + id, e);
    }
  }

  public Optional<OneTimeSchedule> findOneTime(long id) {
    try {
      return jdbcTemplate
          .query("SELECT * FROM one_time_schedules WHERE id = ?", oneTimeMapper(), id)
          .stream()
          .findFirst();
    } catch (DataAccessException e) {
      throw new ScheduleStoreException("Failed to load one-time schedule " + id, e);
    }
  }

  /**
   * Delete a recurring schedule.
   *
   * @return true if a row was removed
   */
  public boolean deleteRecurring(long id) {
    return delete("DELETE FROM recurring_schedules WHERE id = ?", id, "recurring");
  }

  /**
   * Delete a one-time schedule.
   *
   * @return true if a row was removed
   */
  public boolean deleteOneTime(long id) {
    return delete("DELETE FROM one_time_schedules WHERE id = ?", id, "one-time");
  }

  private boolean delete(String sql, long id, String kind) {
    try {
      int affected = jdbcTemplate.update(sql, id);
      if (affected > 0) {
        LOGGER.info("Deleted {} schedule: id={}", kind, id);
        return true;
      }
      LOGGER.warn("{} schedule not found for delete: id={}", kind, id);
      return false;
    } catch (DataAccessException e) {
      throw new ScheduleStoreException("Failed to delete " + kind + " schedule " + id, e);
    }
  }

  /** Insert and return the row id, on one connection so the id belongs to this insert. */
  private long insert(String sql, Object... args) {
    try {
      Long id =
          jdbcTemplate.execute(
              (ConnectionCallback<Long>)
                  connection -> {
                    try (PreparedStatement statement = connection.prepareStatement(sql)) {
                      for (int i = 0; i < args.length; i++) {
                        if (args[i] == null) {
                          statement.setNull(i + 1, Types.NULL);
                        } else {
                          statement.setObject(i + 1, args[i]);
                        }
                      }
                      statement.executeUpdate();
                    }
                    try (Statement statement = connection.createStatement();
                        ResultSet rs = statement.executeQuery("SELECT last_insert_rowid()")) {
                      rs.next();
                      return rs.getLong(1);
                    }
                  });
      if (id == null) {
        throw new ScheduleStoreException("Insert returned no id");
      }
      return id;
    } catch (DataAccessException e) {
      throw new ScheduleStoreException("Failed to save schedule", e);
    }
  }

  private String writeCommand(RecordingCommand command) {
    try {
      return objectMapper.writeValueAsString(command);
    } catch (JsonProcessingException e) {
      throw new ScheduleStoreException("Failed to serialize recording command", e);
    }
  }

  private RecordingCommand readCommand(String json) throws SQLException {
    try {
      return objectMapper.readValue(json, RecordingCommand.class);
    } catch (JsonProcessingException e) {
      throw new SQLException("Stored recording command is unreadable: " + json, e);
    }
  }

  /** A row that cannot be read maps to null and is logged, so the rest of the table still loads. */
  private static <T> RowMapper<T> skippingUnreadable(RowMapper<T> mapper, String kind) {
    return (rs, rowNum) -> {
      try {
        return mapper.mapRow(rs, rowNum);
      } catch (SQLException | RuntimeException e) {
        LOGGER.error("Skipping unreadable {} schedule: id={}", kind, rs.getLong("id"), e);
        return null;
      }
    };
  }

  private static <T> List<T> readable(List<T> rows) {
    return rows.stream().filter(Objects::nonNull).collect(Collectors.toList());
  }

  private RowMapper<RecurringSchedule> recurringMapper() {
    return (rs, rowNum) ->
        new RecurringSchedule(
            rs.getLong("id"),
            new RecurrenceFields(
                rs.getString("minute"),
                rs.getString("hour"),
                rs.getString("day_of_month"),
                rs.getString("month"),
                rs.getString("day_of_week")),
            readCommand(rs.getString("command")),
            display(rs),
            Instant.parse(rs.getString("created_at")));
  }

  private RowMapper<OneTimeSchedule> oneTimeMapper() {
    return (rs, rowNum) ->
        new OneTimeSchedule(
            rs.getLong("id"),
            Instant.parse(rs.getString("fire_at")),
            readCommand(rs.getString("command")),
            display(rs),
            Instant.parse(rs.getString("created_at")));
  }

  private static ScheduleDisplay display(ResultSet rs) throws SQLException {
    return new ScheduleDisplay(
        rs.getString("title"),
        rs.getString("station"),
        rs.getString("start_time"),
        rs.getString("end_time"));
  }
}
