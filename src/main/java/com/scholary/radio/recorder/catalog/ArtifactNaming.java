package com.scholary.radio.recorder.catalog;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Where the recorder writes its output, by naming version.
 *
 * <p>The recorder computes this name itself and reports nothing back, so the rule here must match
 * the recorder's exactly. A new recorder naming rule gets a new constant; existing files keep
 * parsing under the version that produced them.
 */
public enum ArtifactNaming {

  /** {@code <feedId>/<title>(yyyy.MM.dd).mp3}, dated by the broadcast start. */
  V1 {
    private final DateTimeFormatter dateFormat = DateTimeFormatter.ofPattern("yyyy.MM.dd");
    private final Pattern fileNamePattern =
        Pattern.compile("^(.+)\\((\\d{4}\\.\\d{2}\\.\\d{2})\\)\\.mp3$");

    @Override
    public String relativePath(String title, String feedId, LocalDate broadcastDate) {
      return feedId + "/" + title + "(" + broadcastDate.format(dateFormat) + ").mp3";
    }

    @Override
    public Optional<ParsedName> parse(Path relativePath) {
      if (relativePath.getNameCount() != 2) {
        return Optional.empty();
      }
      Matcher matcher = fileNamePattern.matcher(relativePath.getFileName().toString());
      if (!matcher.matches()) {
        return Optional.empty();
      }
      try {
        LocalDate date = LocalDate.parse(matcher.group(2), dateFormat);
        return Optional.of(
            new ParsedName(matcher.group(1), relativePath.getName(0).toString(), date));
      } catch (DateTimeParseException e) {
        return Optional.empty();
      }
    }
  };

  /**
   * Path of the artifact relative to the output root, with {@code /} separators.
   *
   * @param title program title as passed to the recorder
   * @param feedId feed identifier as passed to the recorder
   * @param broadcastDate local date of the segment start
   */
  public abstract String relativePath(String title, String feedId, LocalDate broadcastDate);

  /** Recover title, feed and date from a relative path, if it follows this naming rule. */
  public abstract Optional<ParsedName> parse(Path relativePath);

  /** Components recovered from an artifact name. */
  public record ParsedName(String title, String feedId, LocalDate broadcastDate) {}
}
