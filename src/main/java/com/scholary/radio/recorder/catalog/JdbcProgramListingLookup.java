package com.scholary.radio.recorder.catalog;

import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/** {@link ProgramListingLookup} over the listing cache's {@code programs} table. */
@Component
public class JdbcProgramListingLookup implements ProgramListingLookup {

  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcProgramListingLookup.class);

  private final JdbcTemplate jdbcTemplate;

  public JdbcProgramListingLookup(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public Optional<Long> findProgramId(String stationId, String startIso) {
    if (stationId == null || startIso == null) {
      return Optional.empty();
    }
    try {
      List<Long> ids =
          jdbcTemplate.queryForList(
              "SELECT id FROM programs WHERE station_id = ? AND start_time = ? LIMIT 1",
              Long.class,
              stationId,
              startIso);
      return ids.stream().findFirst();
    } catch (DataAccessException e) {
      LOGGER.warn(
          "Program lookup failed: station={}, start={}, error={}",
          stationId,
          startIso,
          e.getMessage());
      return Optional.empty();
    }
  }
}
