package com.scholary.radio.recorder.catalog;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Where an artifact is expected: the catalog key (relative, {@code /}-separated) and the absolute
 * file.
 */
public record ArtifactLocation(String relativePath, Path absolutePath) {

  public String fileName() {
    return absolutePath.getFileName().toString();
  }

  public boolean exists() {
    return Files.isRegularFile(absolutePath);
  }
}
