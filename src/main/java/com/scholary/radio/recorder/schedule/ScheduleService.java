package com.scholary.radio.recorder.schedule;

import com.scholary.radio.recorder.monitor.RecordingDispatcher;
import com.scholary.radio.recorder.trigger.RecurrenceConverter;
import com.scholary.radio.recorder.trigger.ScheduleConversionException;
import com.scholary.radio.recorder.trigger.TriggerScheduler;
import com.scholary.radio.recorder.trigger.TriggerSpec;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Creates, removes and arms schedules.
 *
 * <p>Creation converts first, persists second and arms last, so a schedule that cannot be converted
 * is never stored. Store failures on create and delete propagate to the caller; disarming a
 * deleted schedule is best effort.
 */
@Service
public class ScheduleService {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScheduleService.class);

  private final ScheduleRepository scheduleRepository;
  private final RecurrenceConverter converter;
  private final TriggerScheduler triggerScheduler;
  private final RecordingDispatcher dispatcher;
  private final Clock clock;

  public ScheduleService(
      ScheduleRepository scheduleRepository,
      RecurrenceConverter converter,
      TriggerScheduler triggerScheduler,
      RecordingDispatcher dispatcher,
      Clock clock) {
    this.scheduleRepository = scheduleRepository;
    this.converter = converter;
    this.triggerScheduler = triggerScheduler;
    this.dispatcher = dispatcher;
    this.clock = clock;
  }

  /**
   * Create and arm a recurring schedule.
   *
   * @throws ScheduleConversionException if the recurrence fields are invalid
   * @throws ScheduleStoreException if the schedule cannot be persisted
   */
  public RecurringSchedule createRecurring(
      RecurrenceFields recurrence, RecordingCommand command, ScheduleDisplay display) {
    TriggerSpec trigger = converter.toTrigger(recurrence);
    RecurringSchedule schedule = scheduleRepository.saveRecurring(recurrence, command, display);
    arm(schedule, trigger);
    return schedule;
  }

  /**
   * Create and arm a one-time schedule.
   *
   * @throws ScheduleConversionException if the fire time is missing or already past
   * @throws ScheduleStoreException if the schedule cannot be persisted
   */
  public OneTimeSchedule createOneTime(
      Instant fireAt, RecordingCommand command, ScheduleDisplay display) {
    TriggerSpec trigger = converter.toTrigger(fireAt);
    if (fireAt.isBefore(clock.instant())) {
      throw new ScheduleConversionException("Fire time is in the past: " + fireAt);
    }
    OneTimeSchedule schedule = scheduleRepository.saveOneTime(fireAt, command, display);
    arm(schedule, trigger);
    return schedule;
  }

  /**
   * Delete a recurring schedule and disarm its trigger.
   *
   * @return true if the schedule existed
   * @throws ScheduleStoreException if the store delete fails
   */
  public boolean deleteRecurring(long id) {
    boolean deleted = scheduleRepository.deleteRecurring(id);
    disarm(RecurringSchedule.jobId(id));
    return deleted;
  }

  /**
   * Delete a one-time schedule and disarm its trigger. A recording already running is not stopped.
   *
   * @return true if the schedule existed
   * @throws ScheduleStoreException if the store delete fails
   */
  public boolean deleteOneTime(long id) {
    boolean deleted = scheduleRepository.deleteOneTime(id);
    disarm(OneTimeSchedule.jobId(id));
    return deleted;
  }

  public List<RecurringSchedule> listRecurring() {
    return scheduleRepository.findAllRecurring();
  }

  public List<OneTimeSchedule> listOneTime() {
    return scheduleRepository.findAllOneTime();
  }

  public List<String> armedTriggers() {
    return triggerScheduler.list();
  }

  /**
   * Convert and register a stored recurring schedule.
   *
   * @throws ScheduleConversionException if the stored fields no longer convert
   */
  public void arm(RecurringSchedule schedule) {
    arm(schedule, converter.toTrigger(schedule.recurrence()));
  }

  /** Register a stored one-time schedule. */
  public void arm(OneTimeSchedule schedule) {
    arm(schedule, converter.toTrigger(schedule.fireAt()));
  }

  /** Record {@code command} right now, outside any schedule. */
  public String runNow(RecordingCommand command, ScheduleDisplay display) {
    return dispatcher.dispatch(ScheduleKind.MANUAL, null, command, display);
  }

  private void arm(RecurringSchedule schedule, TriggerSpec trigger) {
    triggerScheduler.register(
        schedule.jobId(),
        trigger,
        () ->
            dispatcher.dispatch(
                ScheduleKind.RECURRING, schedule.id(), schedule.command(), schedule.display()));
  }

  private void arm(OneTimeSchedule schedule, TriggerSpec trigger) {
    triggerScheduler.register(
        schedule.jobId(),
        trigger,
        () ->
            dispatcher.dispatch(
                ScheduleKind.ONE_TIME, schedule.id(), schedule.command(), schedule.display()));
  }

  private void disarm(String jobId) {
    try {
      triggerScheduler.deregister(jobId);
    } catch (RuntimeException e) {
      LOGGER.warn("Failed to disarm trigger: jobId={}", jobId, e);
    }
  }
}
