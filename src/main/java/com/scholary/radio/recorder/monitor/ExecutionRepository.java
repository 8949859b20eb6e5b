package com.scholary.radio.recorder.monitor;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository of recent executions.
 *
 * <p>Uses Caffeine cache for automatic eviction of old executions, so status stays pollable for a
 * while after a recording finishes without accumulating forever.
 */
@Repository
public class ExecutionRepository {

  private final Cache<String, ExecutionRecord> cache;

  public ExecutionRepository(
      @Value("${executions.maxSize:1000}") int maxSize,
      @Value("${executions.expireAfterMinutes:1440}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(ExecutionRecord record) {
    cache.put(record.getExecutionId(), record);
  }

  public Optional<ExecutionRecord> findById(String executionId) {
    return Optional.ofNullable(cache.getIfPresent(executionId));
  }
}
