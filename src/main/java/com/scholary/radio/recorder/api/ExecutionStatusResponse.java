package com.scholary.radio.recorder.api;

import com.scholary.radio.recorder.monitor.ExecutionRecord;
import java.time.Instant;

public record ExecutionStatusResponse(
    String executionId,
    String jobId,
    String title,
    ExecutionRecord.State state,
    Integer exitCode,
    Long durationMs,
    String artifactPath,
    String error,
    String output,
    Instant createdAt) {

  public static ExecutionStatusResponse of(ExecutionRecord record) {
    return new ExecutionStatusResponse(
        record.getExecutionId(),
        record.getJobId(),
        record.getTitle(),
        record.getState(),
        record.getExitCode(),
        record.getDurationMs(),
        record.getArtifactPath(),
        record.getError(),
        record.getOutput(),
        record.getCreatedAt());
  }
}
