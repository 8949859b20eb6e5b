package com.scholary.radio.recorder.catalog;

import java.util.List;

/**
 * Result of comparing the output directory with the catalog.
 *
 * @param scanned number of recordings found on disk
 * @param registered relative paths that were on disk but not in the catalog, now registered
 * @param missingFiles catalog paths whose file no longer exists (left in place)
 */
public record RescanReport(int scanned, List<String> registered, List<String> missingFiles) {}
