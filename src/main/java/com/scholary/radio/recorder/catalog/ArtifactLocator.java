package com.scholary.radio.recorder.catalog;

import com.scholary.radio.recorder.config.RecorderProperties;
import com.scholary.radio.recorder.schedule.RecordingCommand;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import org.springframework.stereotype.Component;

/** Derives artifact locations under the configured output root. */
@Component
public class ArtifactLocator {

  private final Path outputRoot;
  private final ArtifactNaming naming;

  public ArtifactLocator(RecorderProperties properties) {
    this.outputRoot = Paths.get(properties.outputDir()).toAbsolutePath().normalize();
    this.naming = properties.naming();
  }

  /** Expected artifact for {@code command} fired on {@code fireDate}. */
  public ArtifactLocation locate(RecordingCommand command, LocalDate fireDate) {
    return locate(command.title(), command.feedId(), command.resolvedStart(fireDate).toLocalDate());
  }

  public ArtifactLocation locate(String title, String feedId, LocalDate broadcastDate) {
    String relativePath = naming.relativePath(title, feedId, broadcastDate);
    return new ArtifactLocation(relativePath, resolve(relativePath));
  }

  /**
   * Resolve a catalog key against the output root.
   *
   * @throws IllegalArgumentException if the key escapes the output root
   */
  public Path resolve(String relativePath) {
    Path resolved = outputRoot.resolve(relativePath).normalize();
    if (!resolved.startsWith(outputRoot)) {
      throw new IllegalArgumentException("Path escapes the output directory: " + relativePath);
    }
    return resolved;
  }

  /** Catalog key for a file under the output root. */
  public String relativize(Path file) {
    return outputRoot.relativize(file.toAbsolutePath().normalize()).toString().replace('\\', '/');
  }

  public Path outputRoot() {
    return outputRoot;
  }

  public ArtifactNaming naming() {
    return naming;
  }
}
