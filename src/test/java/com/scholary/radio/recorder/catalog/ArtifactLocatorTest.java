package com.scholary.radio.recorder.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.radio.recorder.TestProperties;
import com.scholary.radio.recorder.schedule.RecordingCommand;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArtifactLocatorTest {

  @TempDir Path tempDir;

  private ArtifactLocator locator;

  @BeforeEach
  void setUp() {
    locator = new ArtifactLocator(TestProperties.under(tempDir));
  }

  @Test
  void testLocateUsesSegmentStartDate() throws Exception {
    RecordingCommand command =
        new RecordingCommand("Late", "late", "LFR", "202610192330", "202610200100", null);

    ArtifactLocation location = locator.locate(command, LocalDate.of(2026, 10, 19));

    assertThat(location.relativePath()).isEqualTo("late/Late(2026.10.19).mp3");
    assertThat(location.absolutePath())
        .isEqualTo(tempDir.resolve("output/late/Late(2026.10.19).mp3").toAbsolutePath());
    assertThat(location.exists()).isFalse();

    Files.createDirectories(location.absolutePath().getParent());
    Files.writeString(location.absolutePath(), "mp3");
    assertThat(location.exists()).isTrue();
  }

  @Test
  void testRelativizeMatchesCatalogKey() {
    Path file = tempDir.resolve("output").resolve("late").resolve("Late(2026.10.19).mp3");

    assertThat(locator.relativize(file)).isEqualTo("late/Late(2026.10.19).mp3");
  }

  @Test
  void testResolveRejectsEscapingPath() {
    assertThatThrownBy(() -> locator.resolve("../recorder.db"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
