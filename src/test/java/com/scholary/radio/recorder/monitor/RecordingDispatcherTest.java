package com.scholary.radio.recorder.monitor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.radio.recorder.execution.ExecutionOutcome;
import com.scholary.radio.recorder.execution.ExecutionRunner;
import com.scholary.radio.recorder.execution.LaunchedExecution;
import com.scholary.radio.recorder.schedule.RecordingCommand;
import com.scholary.radio.recorder.schedule.ScheduleDisplay;
import com.scholary.radio.recorder.schedule.ScheduleKind;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class RecordingDispatcherTest {

  private static final RecordingCommand COMMAND =
      new RecordingCommand("Morning Show", "morning", "TBS", "0500", "0630", 3L);
  private static final ScheduleDisplay DISPLAY = ScheduleDisplay.of(COMMAND);

  // 2026-10-19T20:30Z is already the 20th in Tokyo
  private final Clock clock =
      Clock.fixed(Instant.parse("2026-10-19T20:30:00Z"), ZoneId.of("Asia/Tokyo"));

  @Mock private ExecutionRunner executionRunner;
  @Mock private CompletionMonitor completionMonitor;
  @Mock private ExecutionMarkerRepository markerRepository;

  private ExecutionRepository executionRepository;

  @BeforeEach
  void setUp() {
    executionRepository = new ExecutionRepository(100, 60);
  }

  @Test
  void testRunnerReceivesPersistedCommandUnchanged() {
    LaunchedExecution launched = spawned();
    when(executionRunner.launch(anyString(), same(COMMAND), any())).thenReturn(launched);

    String executionId =
        dispatcher(new SyncTaskExecutor()).dispatch(ScheduleKind.RECURRING, 4L, COMMAND, DISPLAY);

    verify(executionRunner).launch(eq(executionId), same(COMMAND), eq(LocalDate.of(2026, 10, 20)));
    ArgumentCaptor<TriggeredRecording> recording = ArgumentCaptor.forClass(TriggeredRecording.class);
    verify(completionMonitor).complete(recording.capture(), same(launched));
    assertThat(recording.getValue().jobId()).isEqualTo("recurring:4");
    assertThat(recording.getValue().fireDate()).isEqualTo(LocalDate.of(2026, 10, 20));
    verify(markerRepository).save(recording.getValue(), clock.instant());

    ExecutionRecord record = executionRepository.findById(executionId).orElseThrow();
    assertThat(record.getState()).isEqualTo(ExecutionRecord.State.RUNNING);
    assertThat(record.getJobId()).isEqualTo("recurring:4");
  }

  @Test
  void testSpawnFailureStillHandsOffToMonitor() {
    LaunchedExecution failed = LaunchedExecution.failed(ExecutionOutcome.spawnFailed("missing"));
    when(executionRunner.launch(anyString(), any(), any())).thenReturn(failed);

    String executionId =
        dispatcher(new SyncTaskExecutor()).dispatch(ScheduleKind.ONE_TIME, 2L, COMMAND, DISPLAY);

    verify(completionMonitor).complete(any(TriggeredRecording.class), same(failed));
    assertThat(executionRepository.findById(executionId).orElseThrow().getState())
        .isEqualTo(ExecutionRecord.State.PENDING);
  }

  @Test
  void testMarkerFailureDoesNotBlockLaunch() {
    doThrow(new DataAccessResourceFailureException("locked"))
        .when(markerRepository)
        .save(any(), any());
    LaunchedExecution launched = spawned();
    when(executionRunner.launch(anyString(), any(), any())).thenReturn(launched);

    dispatcher(new SyncTaskExecutor()).dispatch(ScheduleKind.MANUAL, null, COMMAND, DISPLAY);

    verify(completionMonitor).complete(any(), any());
  }

  @Test
  void testRejectedMonitorTerminatesAndSettlesRecording() {
    LaunchedExecution launched = spawned();
    when(executionRunner.launch(anyString(), any(), any())).thenReturn(launched);
    TaskExecutor rejecting = mock(TaskExecutor.class);
    doThrow(new TaskRejectedException("full")).when(rejecting).execute(any(Runnable.class));

    String executionId =
        dispatcher(rejecting).dispatch(ScheduleKind.ONE_TIME, 9L, COMMAND, DISPLAY);

    assertThat(executionRepository.findById(executionId).orElseThrow().getError())
        .contains("full");
    ArgumentCaptor<TriggeredRecording> recording = ArgumentCaptor.forClass(TriggeredRecording.class);
    InOrder order = inOrder(launched, completionMonitor);
    order.verify(launched).terminate();
    order.verify(completionMonitor).complete(recording.capture(), same(launched));
    assertThat(recording.getValue().isOneTime()).isTrue();
    assertThat(recording.getValue().scheduleId()).isEqualTo(9L);
  }

  private RecordingDispatcher dispatcher(TaskExecutor executor) {
    return new RecordingDispatcher(
        executionRunner, completionMonitor, executionRepository, markerRepository, executor, clock);
  }

  private static LaunchedExecution spawned() {
    LaunchedExecution launched = mock(LaunchedExecution.class);
    when(launched.spawned()).thenReturn(true);
    return launched;
  }
}
