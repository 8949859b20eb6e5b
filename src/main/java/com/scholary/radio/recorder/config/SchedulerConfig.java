package com.scholary.radio.recorder.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configuration for the timer pool that fires recording triggers.
 *
 * <p>Cancelled triggers are removed from the work queue immediately, and shutdown does not wait
 * for queued triggers.
 */
@Configuration
public class SchedulerConfig {

  @Bean(name = "triggerTaskScheduler")
  public TaskScheduler triggerTaskScheduler(RecorderProperties properties) {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.schedulerPoolSize());
    scheduler.setThreadNamePrefix("recording-trigger-");
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    scheduler.initialize();
    return scheduler;
  }
}
