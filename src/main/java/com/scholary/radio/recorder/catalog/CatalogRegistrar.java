package com.scholary.radio.recorder.catalog;

import com.scholary.radio.recorder.logging.StructuredLogger;
import com.scholary.radio.recorder.schedule.RecordingCommand;
import com.scholary.radio.recorder.schedule.ScheduleDisplay;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Registers produced artifacts in the catalog.
 *
 * <p>Registration is an idempotent upsert keyed by the artifact's relative path. The listing link
 * is best effort: if no listing matches, the entry is written without one.
 */
@Service
public class CatalogRegistrar {

  private static final Logger LOGGER = LoggerFactory.getLogger(CatalogRegistrar.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final DateTimeFormatter LISTING_START = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");
  private static final DateTimeFormatter CLOCK_TIME = DateTimeFormatter.ofPattern("HH:mm");

  private final CatalogRepository catalogRepository;
  private final ProgramListingLookup listingLookup;

  public CatalogRegistrar(CatalogRepository catalogRepository, ProgramListingLookup listingLookup) {
    this.catalogRepository = catalogRepository;
    this.listingLookup = listingLookup;
  }

  /** Insert the entry, or update every field of the existing entry with the same path. */
  public void upsert(CatalogEntry entry) {
    catalogRepository.upsert(entry);
    LOGGER.debug("Catalog upsert: path={}, size={}", entry.filePath(), entry.fileSize());
  }

  /**
   * Remove the entry for {@code filePath}, whether or not the file still exists.
   *
   * @return true if an entry was removed
   */
  public boolean delete(String filePath) {
    boolean deleted = catalogRepository.delete(filePath);
    if (deleted) {
      LOGGER.info("Catalog entry deleted: {}", filePath);
    } else {
      LOGGER.warn("Catalog entry not found for delete: {}", filePath);
    }
    return deleted;
  }

  /** Listing id for a station and start time, or empty. Never throws. */
  public Optional<Long> resolveListing(String stationId, LocalDateTime start) {
    try {
      return listingLookup.findProgramId(stationId, start.format(LISTING_START));
    } catch (RuntimeException e) {
      LOGGER.warn("Listing lookup failed: station={}, start={}", stationId, start, e);
      return Optional.empty();
    }
  }

  /**
   * Register the artifact a recording produced.
   *
   * <p>Reads size and modification time from the file, links the listing if one matches, and
   * carries the command's destination folder.
   *
   * @param executionId execution the artifact came from, for logging
   * @param command the command that was run
   * @param display display fields of the schedule that ran it
   * @param fireDate date the recording was fired on
   * @param artifact where the artifact is
   * @return the entry as written
   * @throws IOException if the file cannot be read
   */
  public CatalogEntry registerArtifact(
      String executionId,
      RecordingCommand command,
      ScheduleDisplay display,
      LocalDate fireDate,
      ArtifactLocation artifact)
      throws IOException {

    BasicFileAttributes attributes =
        Files.readAttributes(artifact.absolutePath(), BasicFileAttributes.class);
    LocalDateTime start = command.resolvedStart(fireDate);
    LocalDateTime end = command.resolvedEnd(fireDate);
    Long programId = resolveListing(command.stationId(), start).orElse(null);

    CatalogEntry entry =
        new CatalogEntry(
            artifact.relativePath(),
            artifact.fileName(),
            programId,
            display.title(),
            command.stationId(),
            display.station(),
            start.toLocalDate().toString(),
            start.format(CLOCK_TIME),
            end.format(CLOCK_TIME),
            attributes.size(),
            attributes.lastModifiedTime().toInstant(),
            command.folderId(),
            null,
            null);
    upsert(entry);
    structuredLogger.logArtifactRegistered(
        executionId, entry.filePath(), attributes.size(), programId);
    return entry;
  }
}
