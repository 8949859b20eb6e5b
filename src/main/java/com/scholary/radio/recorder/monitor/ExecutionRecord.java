package com.scholary.radio.recorder.monitor;

import com.scholary.radio.recorder.execution.ExecutionOutcome;
import java.time.Instant;

/**
 * Represents one recorder execution for status polling.
 *
 * <p>Tracks the execution's state and result. Stored in memory using Caffeine cache; the durable
 * result of a recording is its catalog entry.
 */
public class ExecutionRecord {

  /** Lifecycle of an execution as seen by a poller. */
  public enum State {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    TIMED_OUT
  }

  private final String executionId;
  private final String jobId;
  private final String title;
  private final Instant createdAt;

  private State state;
  private Integer exitCode;
  private Long durationMs;
  private String output;
  private String artifactPath;
  private String error;

  public ExecutionRecord(String executionId, String jobId, String title, Instant createdAt) {
    this.executionId = executionId;
    this.jobId = jobId;
    this.title = title;
    this.createdAt = createdAt;
    this.state = State.PENDING;
  }

  public synchronized void applyOutcome(ExecutionOutcome outcome) {
    this.state = State.valueOf(outcome.status().name());
    this.exitCode = outcome.exitCode();
    this.durationMs = outcome.duration().toMillis();
    this.output = outcome.output();
  }

  public String getExecutionId() {
    return executionId;
  }

  public String getJobId() {
    return jobId;
  }

  public String getTitle() {
    return title;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public synchronized State getState() {
    return state;
  }

  public synchronized void setState(State state) {
    this.state = state;
  }

  public synchronized Integer getExitCode() {
    return exitCode;
  }

  public synchronized Long getDurationMs() {
    return durationMs;
  }

  public synchronized String getOutput() {
    return output;
  }

  public synchronized String getArtifactPath() {
    return artifactPath;
  }

  public synchronized void setArtifactPath(String artifactPath) {
    this.artifactPath = artifactPath;
  }

  public synchronized String getError() {
    return error;
  }

  public synchronized void setError(String error) {
    this.error = error;
  }
}
