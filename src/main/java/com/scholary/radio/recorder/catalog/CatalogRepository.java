package com.scholary.radio.recorder.catalog;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Durable catalog of recorded files.
 *
 * <p>{@link #upsert} is a single {@code INSERT ... ON CONFLICT DO UPDATE}, so two writers racing on
 * the same path end with one row reflecting the later write.
 */
@Repository
public class CatalogRepository {

  private static final String UPSERT =
      "INSERT INTO recorded_files (file_path, file_name, program_id, program_title, station_id,"
          + " station_name, broadcast_date, start_time, end_time, file_size, file_modified,"
          + " virtual_folder_id, created_at, updated_at)"
          + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)"
          + " ON CONFLICT(file_path) DO UPDATE SET"
          + " file_name = excluded.file_name,"
          + " program_id = excluded.program_id,"
          + " program_title = excluded.program_title,"
          + " station_id = excluded.station_id,"
          + " station_name = excluded.station_name,"
          + " broadcast_date = excluded.broadcast_date,"
          + " start_time = excluded.start_time,"
          + " end_time = excluded.end_time,"
          + " file_size = excluded.file_size,"
          + " file_modified = excluded.file_modified,"
          + " virtual_folder_id = excluded.virtual_folder_id,"
          + " updated_at = excluded.updated_at";

  private static final RowMapper<CatalogEntry> ENTRY_MAPPER =
      (rs, rowNum) ->
          new CatalogEntry(
              rs.getString("file_path"),
              rs.getString("file_name"),
              nullableLong(rs, "program_id"),
              rs.getString("program_title"),
              rs.getString("station_id"),
              rs.getString("station_name"),
              rs.getString("broadcast_date"),
              rs.getString("start_time"),
              rs.getString("end_time"),
              nullableLong(rs, "file_size"),
              nullableInstant(rs, "file_modified"),
              nullableLong(rs, "virtual_folder_id"),
              nullableInstant(rs, "created_at"),
              nullableInstant(rs, "updated_at"));

  private final JdbcTemplate jdbcTemplate;
  private final Clock clock;

  public CatalogRepository(JdbcTemplate jdbcTemplate, Clock clock) {
    this.jdbcTemplate = jdbcTemplate;
    this.clock = clock;
  }

  public void upsert(CatalogEntry entry) {
    String now = clock.instant().toString();
    jdbcTemplate.update(
        UPSERT,
        entry.filePath(),
        entry.fileName(),
        entry.programId(),
        entry.programTitle(),
        entry.stationId(),
        entry.stationName(),
        entry.broadcastDate(),
        entry.startTime(),
        entry.endTime(),
        entry.fileSize(),
        entry.fileModified() == null ? null : entry.fileModified().toString(),
        entry.folderId(),
        now,
        now);
  }

  /** @return true if a row was removed */
  public boolean delete(String filePath) {
    return jdbcTemplate.update("DELETE FROM recorded_files WHERE file_path = ?", filePath) > 0;
  }

  public Optional<CatalogEntry> findByPath(String filePath) {
    return jdbcTemplate
        .query("SELECT * FROM recorded_files WHERE file_path = ?", ENTRY_MAPPER, filePath)
        .stream()
        .findFirst();
  }

  /** Entries newest file first. */
  public List<CatalogEntry> findAll(int limit, int offset) {
    return jdbcTemplate.query(
        "SELECT * FROM recorded_files ORDER BY file_modified DESC, id DESC LIMIT ? OFFSET ?",
        ENTRY_MAPPER,
        limit,
        offset);
  }

  public List<String> findAllPaths() {
    return jdbcTemplate.queryForList(
        "SELECT file_path FROM recorded_files ORDER BY file_path", String.class);
  }

  /**
   * Search by keyword (title or file name), station and broadcast date range. Null criteria are
   * ignored.
   */
  public List<CatalogEntry> search(
      String keyword, String stationId, String broadcastDateFrom, String broadcastDateTo, int limit) {
    StringBuilder sql = new StringBuilder("SELECT * FROM recorded_files WHERE 1=1");
    List<Object> params = new ArrayList<>();

    if (keyword != null && !keyword.isBlank()) {
      sql.append(" AND (program_title LIKE ? OR file_name LIKE ?)");
      params.add("%" + keyword + "%");
      params.add("%" + keyword + "%");
    }
    if (stationId != null && !stationId.isBlank()) {
      sql.append(" AND station_id = ?");
      params.add(stationId);
    }
    if (broadcastDateFrom != null && !broadcastDateFrom.isBlank()) {
      sql.append(" AND broadcast_date >= ?");
      params.add(broadcastDateFrom);
    }
    if (broadcastDateTo != null && !broadcastDateTo.isBlank()) {
      sql.append(" AND broadcast_date <= ?");
      params.add(broadcastDateTo);
    }
    sql.append(" ORDER BY file_modified DESC, id DESC LIMIT ?");
    params.add(limit);

    return jdbcTemplate.query(sql.toString(), ENTRY_MAPPER, params.toArray());
  }

  /** @return true if the entry exists and was moved */
  public boolean moveToFolder(String filePath, Long folderId) {
    return jdbcTemplate.update(
            "UPDATE recorded_files SET virtual_folder_id = ?, updated_at = ? WHERE file_path = ?",
            folderId,
            clock.instant().toString(),
            filePath)
        > 0;
  }

  private static Long nullableLong(ResultSet rs, String column) throws SQLException {
    long value = rs.getLong(column);
    return rs.wasNull() ? null : value;
  }

  private static Instant nullableInstant(ResultSet rs, String column) throws SQLException {
    String value = rs.getString(column);
    return value == null ? null : Instant.parse(value);
  }
}
