package com.scholary.radio.recorder.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for completion monitor execution.
 *
 * <p>Sets up a bounded thread pool, separate from the trigger scheduler and from request threads,
 * on which each monitor blocks until its recording exits. The pool must be large enough for the
 * number of recordings expected to overlap.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "monitorExecutor")
  public TaskExecutor monitorExecutor(RecorderProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.monitorThreads());
    executor.setMaxPoolSize(properties.monitorThreads());
    executor.setQueueCapacity(properties.monitorQueueSize());
    executor.setThreadNamePrefix("recording-monitor-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }
}
