package com.scholary.radio.recorder.recovery;

import com.scholary.radio.recorder.catalog.ArtifactLocation;
import com.scholary.radio.recorder.catalog.ArtifactLocator;
import com.scholary.radio.recorder.catalog.CatalogRegistrar;
import com.scholary.radio.recorder.logging.StructuredLogger;
import com.scholary.radio.recorder.monitor.ExecutionMarkerRepository;
import com.scholary.radio.recorder.monitor.TriggeredRecording;
import com.scholary.radio.recorder.schedule.OneTimeSchedule;
import com.scholary.radio.recorder.schedule.RecurringSchedule;
import com.scholary.radio.recorder.schedule.ScheduleRepository;
import com.scholary.radio.recorder.schedule.ScheduleService;
import com.scholary.radio.recorder.schedule.ScheduleStoreException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Rebuilds the trigger scheduler from the schedule store when the process starts.
 *
 * <p>The only place schedules are bulk-loaded. Safe to run more than once: registering an id that
 * is already armed replaces it, and a discarded schedule is simply gone on the second pass.
 *
 * <ul>
 *   <li>Executions left marked in progress by the previous process are reconciled first. Their
 *       recorder processes are orphaned and not resumed; an artifact they left behind is
 *       cataloged.
 *   <li>Every recurring schedule is converted and armed. One that fails is logged and skipped.
 *   <li>One-time schedules whose fire time has passed are deleted without running; the rest are
 *       armed.
 * </ul>
 */
@Component
public class StartupRecovery {

  private static final Logger LOGGER = LoggerFactory.getLogger(StartupRecovery.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final ScheduleRepository scheduleRepository;
  private final ScheduleService scheduleService;
  private final ExecutionMarkerRepository markerRepository;
  private final ArtifactLocator artifactLocator;
  private final CatalogRegistrar catalogRegistrar;
  private final Clock clock;
  private final Instant processStartedAt;

  public StartupRecovery(
      ScheduleRepository scheduleRepository,
      ScheduleService scheduleService,
      ExecutionMarkerRepository markerRepository,
      ArtifactLocator artifactLocator,
      CatalogRegistrar catalogRegistrar,
      Clock clock) {
    this.scheduleRepository = scheduleRepository;
    this.scheduleService = scheduleService;
    this.markerRepository = markerRepository;
    this.artifactLocator = artifactLocator;
    this.catalogRegistrar = catalogRegistrar;
    this.clock = clock;
    this.processStartedAt = clock.instant();
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    recover();
  }

  public RecoveryReport recover() {
    LOGGER.info("Startup recovery started");
    int interrupted = reconcileInterruptedExecutions();

    int recurringArmed = 0;
    int recurringSkipped = 0;
    for (RecurringSchedule schedule : loadRecurring()) {
      try {
        scheduleService.arm(schedule);
        structuredLogger.logScheduleRecovered(schedule.jobId(), describe(schedule));
        recurringArmed++;
      } catch (RuntimeException e) {
        LOGGER.error("Skipping recurring schedule that cannot be armed: jobId={}", schedule.jobId(), e);
        recurringSkipped++;
      }
    }

    Instant now = clock.instant();
    int oneTimeArmed = 0;
    int oneTimeDiscarded = 0;
    for (OneTimeSchedule schedule : loadOneTime()) {
      if (schedule.isPastDue(now)) {
        discard(schedule);
        oneTimeDiscarded++;
        continue;
      }
      try {
        scheduleService.arm(schedule);
        structuredLogger.logScheduleRecovered(schedule.jobId(), schedule.fireAt().toString());
        oneTimeArmed++;
      } catch (RuntimeException e) {
        LOGGER.error("Skipping one-time schedule that cannot be armed: jobId={}", schedule.jobId(), e);
      }
    }

    RecoveryReport report =
        new RecoveryReport(
            recurringArmed, recurringSkipped, oneTimeArmed, oneTimeDiscarded, interrupted);
    LOGGER.info("Startup recovery finished: {}", report);
    return report;
  }

  private List<RecurringSchedule> loadRecurring() {
    try {
      return scheduleRepository.findAllRecurring();
    } catch (ScheduleStoreException e) {
      LOGGER.error("Recurring schedules could not be loaded, none armed", e);
      return List.of();
    }
  }

  private List<OneTimeSchedule> loadOneTime() {
    try {
      return scheduleRepository.findAllOneTime();
    } catch (ScheduleStoreException e) {
      LOGGER.error("One-time schedules could not be loaded, none armed", e);
      return List.of();
    }
  }

  private void discard(OneTimeSchedule schedule) {
    try {
      scheduleRepository.deleteOneTime(schedule.id());
      structuredLogger.logScheduleDiscarded(
          schedule.jobId(), schedule.fireAt().toString(), schedule.display().title());
    } catch (RuntimeException e) {
      LOGGER.error("Failed to discard past-due schedule: jobId={}", schedule.jobId(), e);
    }
  }

  private int reconcileInterruptedExecutions() {
    List<TriggeredRecording> interrupted = markerRepository.findStartedBefore(processStartedAt);
    for (TriggeredRecording recording : interrupted) {
      LOGGER.warn(
          "Execution did not finish before the last shutdown, recorder process not resumed:"
              + " executionId={}, jobId={}, title={}",
          recording.executionId(),
          recording.jobId(),
          recording.command().title());
      try {
        ArtifactLocation artifact =
            artifactLocator.locate(recording.command(), recording.fireDate());
        if (artifact.exists()) {
          catalogRegistrar.registerArtifact(
              recording.executionId(),
              recording.command(),
              recording.display(),
              recording.fireDate(),
              artifact);
        } else {
          structuredLogger.logArtifactMissing(
              recording.executionId(), artifact.relativePath(), "INTERRUPTED");
        }
        markerRepository.delete(recording.executionId());
      } catch (Exception e) {
        LOGGER.error(
            "Failed to reconcile interrupted execution: executionId={}",
            recording.executionId(),
            e);
      }
    }
    return interrupted.size();
  }

  private static String describe(RecurringSchedule schedule) {
    return String.join(
        " ",
        schedule.recurrence().minute(),
        schedule.recurrence().hour(),
        schedule.recurrence().dayOfMonth(),
        schedule.recurrence().month(),
        schedule.recurrence().dayOfWeek());
  }
}
