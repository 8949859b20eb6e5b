package com.scholary.radio.recorder.catalog;

import java.time.Instant;

/**
 * A produced recording, keyed by its path relative to the output root.
 *
 * <p>{@code createdAt} and {@code updatedAt} are maintained by the store; values passed in on
 * upsert are ignored.
 */
public record CatalogEntry(
    String filePath,
    String fileName,
    Long programId,
    String programTitle,
    String stationId,
    String stationName,
    String broadcastDate,
    String startTime,
    String endTime,
    Long fileSize,
    Instant fileModified,
    Long folderId,
    Instant createdAt,
    Instant updatedAt) {}
