package com.scholary.radio.recorder.config;

import com.scholary.radio.recorder.catalog.ArtifactNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the recorder and the orchestration around it.
 *
 * <p>{@code timeout} is the wall-clock ceiling for one recording (2 hours by default); a process
 * still running at the ceiling is killed, waiting {@code killGrace} between the polite and the
 * forced kill.
 */
@ConfigurationProperties(prefix = "recorder")
@Validated
public record RecorderProperties(
    @NotBlank String executable,
    @NotBlank String outputDir,
    @NotBlank String logDir,
    @NotBlank String database,
    @NotNull Duration timeout,
    @NotNull Duration killGrace,
    @Positive int outputTailBytes,
    @NotBlank String zone,
    @NotNull ArtifactNaming naming,
    @Positive int monitorThreads,
    @Positive int monitorQueueSize,
    @Positive int schedulerPoolSize,
    @NotNull Duration rescanInterval) {

  public ZoneId zoneId() {
    return ZoneId.of(zone);
  }
}
