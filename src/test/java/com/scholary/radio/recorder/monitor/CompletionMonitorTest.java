package com.scholary.radio.recorder.monitor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.radio.recorder.TestProperties;
import com.scholary.radio.recorder.catalog.ArtifactLocation;
import com.scholary.radio.recorder.catalog.ArtifactLocator;
import com.scholary.radio.recorder.catalog.CatalogRegistrar;
import com.scholary.radio.recorder.execution.ExecutionOutcome;
import com.scholary.radio.recorder.execution.ExecutionStatus;
import com.scholary.radio.recorder.execution.LaunchedExecution;
import com.scholary.radio.recorder.schedule.RecordingCommand;
import com.scholary.radio.recorder.schedule.ScheduleDisplay;
import com.scholary.radio.recorder.schedule.ScheduleKind;
import com.scholary.radio.recorder.schedule.ScheduleRepository;
import com.scholary.radio.recorder.trigger.TriggerScheduler;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CompletionMonitorTest {

  private static final LocalDate FIRE_DATE = LocalDate.of(2026, 10, 19);
  private static final RecordingCommand COMMAND =
      new RecordingCommand("News", "news", "QRR", "0500", "0530", null);
  private static final ScheduleDisplay DISPLAY = new ScheduleDisplay("News", "Bunka", "0500", "0530");

  @Mock private CatalogRegistrar catalogRegistrar;
  @Mock private ScheduleRepository scheduleRepository;
  @Mock private TriggerScheduler triggerScheduler;
  @Mock private ExecutionMarkerRepository markerRepository;

  @TempDir Path tempDir;

  private ArtifactLocator artifactLocator;
  private ExecutionRepository executionRepository;
  private CompletionMonitor monitor;

  @BeforeEach
  void setUp() {
    artifactLocator = new ArtifactLocator(TestProperties.under(tempDir));
    executionRepository = new ExecutionRepository(100, 60);
    monitor =
        new CompletionMonitor(
            artifactLocator,
            catalogRegistrar,
            scheduleRepository,
            triggerScheduler,
            executionRepository,
            markerRepository);
  }

  @Test
  void testSuccessWithArtifactRegistersOnce() throws Exception {
    TriggeredRecording recording = recording("exec-1", ScheduleKind.RECURRING, 4L);
    ArtifactLocation artifact = writeArtifact();

    monitor.complete(recording, finished(ExecutionStatus.SUCCEEDED, 0));

    verify(catalogRegistrar)
        .registerArtifact(eq("exec-1"), eq(COMMAND), eq(DISPLAY), eq(FIRE_DATE), eq(artifact));
    verify(scheduleRepository, never()).deleteOneTime(anyLong());
    verify(markerRepository).delete("exec-1");
    ExecutionRecord record = executionRepository.findById("exec-1").orElseThrow();
    assertThat(record.getState()).isEqualTo(ExecutionRecord.State.SUCCEEDED);
    assertThat(record.getArtifactPath()).isEqualTo("news/News(2026.10.19).mp3");
  }

  @Test
  void testSuccessWithoutArtifactWritesNothingButRetiresOneTime() throws Exception {
    TriggeredRecording recording = recording("exec-2", ScheduleKind.ONE_TIME, 9L);

    monitor.complete(recording, finished(ExecutionStatus.SUCCEEDED, 0));

    verify(catalogRegistrar, never())
        .registerArtifact(anyString(), any(), any(), any(), any());
    verify(scheduleRepository).deleteOneTime(9L);
    verify(triggerScheduler).deregister("onetime:9");
    verify(markerRepository).delete("exec-2");
  }

  @Test
  void testFailedRunWithArtifactStillRegisters() throws Exception {
    TriggeredRecording recording = recording("exec-3", ScheduleKind.ONE_TIME, 2L);
    writeArtifact();

    monitor.complete(recording, finished(ExecutionStatus.FAILED, 1));

    verify(catalogRegistrar)
        .registerArtifact(eq("exec-3"), eq(COMMAND), eq(DISPLAY), eq(FIRE_DATE), any());
    verify(scheduleRepository).deleteOneTime(2L);
    assertThat(executionRepository.findById("exec-3").orElseThrow().getState())
        .isEqualTo(ExecutionRecord.State.FAILED);
  }

  @Test
  void testSpawnFailureRetiresOneTime() {
    TriggeredRecording recording = recording("exec-4", ScheduleKind.ONE_TIME, 5L);

    monitor.complete(
        recording, LaunchedExecution.failed(ExecutionOutcome.spawnFailed("no such file")));

    verify(scheduleRepository).deleteOneTime(5L);
    verify(triggerScheduler).deregister("onetime:5");
    assertThat(executionRepository.findById("exec-4").orElseThrow().getOutput())
        .isEqualTo("no such file");
  }

  @Test
  void testRegistrationFailureIsContained() throws Exception {
    TriggeredRecording recording = recording("exec-5", ScheduleKind.ONE_TIME, 6L);
    writeArtifact();
    when(catalogRegistrar.registerArtifact(anyString(), any(), any(), any(), any()))
        .thenThrow(new IOException("disk gone"));

    monitor.complete(recording, finished(ExecutionStatus.SUCCEEDED, 0));

    verify(scheduleRepository).deleteOneTime(6L);
    verify(markerRepository).delete("exec-5");
    assertThat(executionRepository.findById("exec-5").orElseThrow().getError())
        .isEqualTo("disk gone");
  }

  @Test
  void testScheduleDeleteFailureStillDeregisters() {
    TriggeredRecording recording = recording("exec-6", ScheduleKind.ONE_TIME, 8L);
    when(scheduleRepository.deleteOneTime(8L)).thenThrow(new IllegalStateException("locked"));

    monitor.complete(recording, finished(ExecutionStatus.SUCCEEDED, 0));

    verify(triggerScheduler).deregister("onetime:8");
    verify(markerRepository).delete("exec-6");
  }

  private TriggeredRecording recording(String executionId, ScheduleKind kind, Long scheduleId) {
    executionRepository.save(
        new ExecutionRecord(executionId, null, COMMAND.title(), Instant.now()));
    return new TriggeredRecording(executionId, kind, scheduleId, COMMAND, DISPLAY, FIRE_DATE);
  }

  private ArtifactLocation writeArtifact() throws IOException {
    ArtifactLocation artifact = artifactLocator.locate(COMMAND, FIRE_DATE);
    Files.createDirectories(artifact.absolutePath().getParent());
    Files.write(artifact.absolutePath(), new byte[] {1, 2, 3});
    return artifact;
  }

  private static LaunchedExecution finished(ExecutionStatus status, int exitCode) {
    ExecutionOutcome outcome = new ExecutionOutcome(status, exitCode, "", Duration.ofSeconds(3));
    return new LaunchedExecution() {
      @Override
      public boolean spawned() {
        return true;
      }

      @Override
      public ExecutionOutcome awaitOutcome() {
        return outcome;
      }

      @Override
      public void terminate() {}
    };
  }
}
