package com.scholary.radio.recorder.catalog;

import java.util.Optional;

/**
 * Read-only view of the program listing cache.
 *
 * <p>Best effort: a missing listing, or a listing cache that is not there at all, is an empty
 * result rather than an error.
 */
public interface ProgramListingLookup {

  /**
   * Find the listing that starts at the given time on the given station.
   *
   * @param stationId station identifier
   * @param startIso local start time, {@code yyyy-MM-dd'T'HH:mm:ss}
   * @return the listing id, or empty if none matches
   */
  Optional<Long> findProgramId(String stationId, String startIso);
}
