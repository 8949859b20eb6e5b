package com.scholary.radio.recorder.trigger;

import com.scholary.radio.recorder.logging.StructuredLogger;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

/**
 * {@link TriggerScheduler} backed by Spring's {@link TaskScheduler}.
 *
 * <p>Armed triggers live in a map keyed by job id; every mutation for an id goes through {@link
 * ConcurrentHashMap#compute}, which makes replace-or-remove atomic per id. A one-time trigger takes
 * itself out of the map as it fires.
 *
 * <p>Started and stopped with the application context, before startup recovery runs.
 */
@Component
public class TaskSchedulerTriggerScheduler implements TriggerScheduler, SmartLifecycle {

  private static final Logger LOGGER = LoggerFactory.getLogger(TaskSchedulerTriggerScheduler.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final TaskScheduler taskScheduler;
  private final ZoneId zone;
  private final Map<String, Registration> armed = new ConcurrentHashMap<>();

  private volatile boolean running;

  public TaskSchedulerTriggerScheduler(
      @Qualifier("triggerTaskScheduler") TaskScheduler taskScheduler, ZoneId recorderZone) {
    this.taskScheduler = taskScheduler;
    this.zone = recorderZone;
  }

  @Override
  public void start() {
    running = true;
    LOGGER.info("Trigger scheduler started (zone={})", zone);
  }

  @Override
  public void stop() {
    running = false;
    List<String> jobIds = new ArrayList<>(armed.keySet());
    for (String jobId : jobIds) {
      armed.computeIfPresent(
          jobId,
          (id, registration) -> {
            registration.cancel();
            return null;
          });
    }
    LOGGER.info("Trigger scheduler stopped, {} triggers disarmed", jobIds.size());
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public void register(String jobId, TriggerSpec trigger, Runnable callback) {
    if (!running) {
      throw new IllegalStateException("Trigger scheduler is not running");
    }
    armed.compute(
        jobId,
        (id, existing) -> {
          if (existing != null) {
            existing.cancel();
            LOGGER.info("Replacing trigger: jobId={}", id);
          }
          Registration registration = new Registration(trigger);
          registration.future = schedule(id, trigger, callback, registration);
          return registration;
        });
    LOGGER.info(
        "Trigger armed: jobId={}, {}",
        jobId,
        trigger.isRecurring() ? "cron=" + trigger.cron() : "fireAt=" + trigger.fireAt());
  }

  @Override
  public boolean deregister(String jobId) {
    boolean[] removed = new boolean[1];
    armed.computeIfPresent(
        jobId,
        (id, registration) -> {
          registration.cancel();
          removed[0] = true;
          return null;
        });
    if (removed[0]) {
      LOGGER.info("Trigger disarmed: jobId={}", jobId);
    } else {
      LOGGER.warn("No armed trigger to remove: jobId={}", jobId);
    }
    return removed[0];
  }

  @Override
  public List<String> list() {
    List<String> jobIds = new ArrayList<>(armed.keySet());
    Collections.sort(jobIds);
    return jobIds;
  }

  private ScheduledFuture<?> schedule(
      String jobId, TriggerSpec trigger, Runnable callback, Registration registration) {
    if (trigger.isRecurring()) {
      return taskScheduler.schedule(
          () -> fire(jobId, callback), new CronTrigger(trigger.cron(), zone));
    }
    return taskScheduler.schedule(
        () -> {
          armed.remove(jobId, registration);
          fire(jobId, callback);
        },
        trigger.fireAt());
  }

  private void fire(String jobId, Runnable callback) {
    structuredLogger.logTriggerFired(jobId);
    try {
      callback.run();
    } catch (RuntimeException e) {
      LOGGER.error("Trigger callback failed: jobId={}", jobId, e);
    }
  }

  /** An armed trigger and its pending future. */
  private static final class Registration {

    private final TriggerSpec trigger;
    private volatile ScheduledFuture<?> future;

    private Registration(TriggerSpec trigger) {
      this.trigger = trigger;
    }

    private void cancel() {
      ScheduledFuture<?> pending = future;
      if (pending != null) {
        pending.cancel(false);
      }
    }

    @Override
    public String toString() {
      return "Registration[" + trigger + "]";
    }
  }
}
