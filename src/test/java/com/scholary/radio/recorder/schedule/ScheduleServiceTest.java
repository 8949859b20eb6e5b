package com.scholary.radio.recorder.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.radio.recorder.monitor.RecordingDispatcher;
import com.scholary.radio.recorder.trigger.RecurrenceConverter;
import com.scholary.radio.recorder.trigger.ScheduleConversionException;
import com.scholary.radio.recorder.trigger.TriggerScheduler;
import com.scholary.radio.recorder.trigger.TriggerSpec;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ScheduleServiceTest {

  private static final Instant NOW = Instant.parse("2026-10-19T00:00:00Z");
  private static final RecordingCommand COMMAND =
      new RecordingCommand("News", "news", "QRR", "0500", "0530", null);
  private static final ScheduleDisplay DISPLAY = ScheduleDisplay.of(COMMAND);

  @Mock private ScheduleRepository scheduleRepository;
  @Mock private TriggerScheduler triggerScheduler;
  @Mock private RecordingDispatcher dispatcher;

  private ScheduleService service;

  @BeforeEach
  void setUp() {
    service =
        new ScheduleService(
            scheduleRepository,
            new RecurrenceConverter(),
            triggerScheduler,
            dispatcher,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void testCreateRecurringPersistsThenArms() {
    RecurrenceFields fields = new RecurrenceFields("0", "5", "*", "*", "1,2,3,4,5");
    RecurringSchedule stored = new RecurringSchedule(11L, fields, COMMAND, DISPLAY, NOW);
    when(scheduleRepository.saveRecurring(fields, COMMAND, DISPLAY)).thenReturn(stored);

    RecurringSchedule created = service.createRecurring(fields, COMMAND, DISPLAY);

    assertThat(created).isSameAs(stored);
    verify(triggerScheduler)
        .register(
            eq("recurring:11"), eq(TriggerSpec.cron("0 0 5 * * MON,TUE,WED,THU,FRI")), any());
  }

  @Test
  void testInvalidRecurrenceIsNeverStored() {
    RecurrenceFields fields = new RecurrenceFields("0", "25", "*", "*", "*");

    assertThatThrownBy(() -> service.createRecurring(fields, COMMAND, DISPLAY))
        .isInstanceOf(ScheduleConversionException.class);
    verifyNoInteractions(scheduleRepository, triggerScheduler);
  }

  @Test
  void testPastOneTimeIsRejected() {
    assertThatThrownBy(
            () -> service.createOneTime(NOW.minusSeconds(60), COMMAND, DISPLAY))
        .isInstanceOf(ScheduleConversionException.class);
    verifyNoInteractions(scheduleRepository, triggerScheduler);
  }

  @Test
  void testArmedCallbackDispatchesStoredCommand() {
    Instant fireAt = NOW.plusSeconds(3600);
    OneTimeSchedule stored = new OneTimeSchedule(4L, fireAt, COMMAND, DISPLAY, NOW);
    when(scheduleRepository.saveOneTime(fireAt, COMMAND, DISPLAY)).thenReturn(stored);

    service.createOneTime(fireAt, COMMAND, DISPLAY);

    ArgumentCaptor<Runnable> callback = ArgumentCaptor.forClass(Runnable.class);
    verify(triggerScheduler)
        .register(eq("onetime:4"), eq(TriggerSpec.once(fireAt)), callback.capture());
    callback.getValue().run();
    verify(dispatcher).dispatch(ScheduleKind.ONE_TIME, 4L, COMMAND, DISPLAY);
  }

  @Test
  void testDeleteDisarmsEvenWhenScheduleIsGone() {
    when(scheduleRepository.deleteRecurring(3L)).thenReturn(false);

    assertThat(service.deleteRecurring(3L)).isFalse();
    verify(triggerScheduler).deregister("recurring:3");
  }

  @Test
  void testDisarmFailureDoesNotFailDelete() {
    when(scheduleRepository.deleteOneTime(8L)).thenReturn(true);
    doThrow(new IllegalStateException("stopped")).when(triggerScheduler).deregister("onetime:8");

    assertThat(service.deleteOneTime(8L)).isTrue();
  }

  @Test
  void testStoreFailureOnDeletePropagates() {
    when(scheduleRepository.deleteOneTime(8L)).thenThrow(new ScheduleStoreException("locked"));

    assertThatThrownBy(() -> service.deleteOneTime(8L)).isInstanceOf(ScheduleStoreException.class);
    verifyNoInteractions(triggerScheduler);
  }

  @Test
  void testRunNowDispatchesManually() {
    when(dispatcher.dispatch(ScheduleKind.MANUAL, null, COMMAND, DISPLAY)).thenReturn("exec-9");

    assertThat(service.runNow(COMMAND, DISPLAY)).isEqualTo("exec-9");
  }
}
