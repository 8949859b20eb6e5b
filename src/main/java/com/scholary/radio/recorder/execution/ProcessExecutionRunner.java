package com.scholary.radio.recorder.execution;

import com.scholary.radio.recorder.config.RecorderProperties;
import com.scholary.radio.recorder.schedule.RecordingCommand;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs the recorder as a child process.
 *
 * <p>Standard output and error are merged and written to {@code <logDir>/<executionId>.log}, which
 * keeps the child from blocking on a full pipe without a reader thread and leaves the full output
 * on disk for diagnostics. The outcome carries only the tail of it.
 *
 * <p>A run still going at the timeout ceiling, counted from launch, is killed together with its
 * descendants: first politely, then forcibly after the kill grace period.
 */
@Component
public class ProcessExecutionRunner implements ExecutionRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessExecutionRunner.class);

  private final String executable;
  private final Path logDir;
  private final Duration timeout;
  private final Duration killGrace;
  private final int outputTailBytes;

  public ProcessExecutionRunner(RecorderProperties properties) {
    this.executable = properties.executable();
    this.logDir = Paths.get(properties.logDir());
    this.timeout = properties.timeout();
    this.killGrace = properties.killGrace();
    this.outputTailBytes = properties.outputTailBytes();
  }

  @Override
  public LaunchedExecution launch(
      String executionId, RecordingCommand command, LocalDate fireDate) {
    List<String> argv = new ArrayList<>();
    argv.add(executable);
    argv.addAll(command.toArguments(fireDate));
    Path logFile = logDir.resolve(executionId + ".log");

    LOGGER.info("Executing: {}", argv);

    long startNanos = System.nanoTime();
    try {
      Files.createDirectories(logDir);
      ProcessBuilder pb = new ProcessBuilder(argv);
      pb.redirectErrorStream(true);
      pb.redirectOutput(logFile.toFile());
      Process process = pb.start();
      LOGGER.info("Recorder started: executionId={}, pid={}", executionId, process.pid());
      return new ProcessExecution(executionId, process, logFile, startNanos);
    } catch (IOException | RuntimeException e) {
      LOGGER.error("Failed to start recorder: executionId={}, executable={}", executionId, executable, e);
      return LaunchedExecution.failed(
          ExecutionOutcome.spawnFailed("Failed to start " + executable + ": " + e.getMessage()));
    }
  }

  /** Read the last {@code outputTailBytes} of the log. */
  String readTail(Path logFile) {
    if (!Files.exists(logFile)) {
      return "";
    }
    try (RandomAccessFile file = new RandomAccessFile(logFile.toFile(), "r")) {
      long length = file.length();
      long from = Math.max(0, length - outputTailBytes);
      byte[] buffer = new byte[(int) (length - from)];
      file.seek(from);
      file.readFully(buffer);
      int start = 0;
      if (from > 0) {
        // UTF-8 continuation bytes: 10xxxxxx
        while (start < buffer.length && (buffer[start] & 0xC0) == 0x80) {
          start++;
        }
      }
      return new String(buffer, start, buffer.length - start, StandardCharsets.UTF_8);
    } catch (IOException e) {
      LOGGER.warn("Failed to read recorder output: {}", logFile, e);
      return "";
    }
  }

  private final class ProcessExecution implements LaunchedExecution {

    private final String executionId;
    private final Process process;
    private final Path logFile;
    private final long startNanos;
    private ExecutionOutcome outcome;

    private ProcessExecution(String executionId, Process process, Path logFile, long startNanos) {
      this.executionId = executionId;
      this.process = process;
      this.logFile = logFile;
      this.startNanos = startNanos;
    }

    @Override
    public boolean spawned() {
      return true;
    }

    @Override
    public synchronized ExecutionOutcome awaitOutcome() {
      if (outcome == null) {
        outcome = waitForExit();
      }
      return outcome;
    }

    @Override
    public void terminate() {
      if (!process.isAlive()) {
        return;
      }
      LOGGER.warn("Terminating recorder: executionId={}, pid={}", executionId, process.pid());
      try {
        kill();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        LOGGER.warn("Interrupted while terminating recorder: executionId={}", executionId);
      }
    }

    private ExecutionOutcome waitForExit() {
      try {
        long remainingMillis = Math.max(0, timeout.minus(elapsed()).toMillis());
        if (!process.waitFor(remainingMillis, TimeUnit.MILLISECONDS)) {
          LOGGER.error(
              "Recorder exceeded {} ceiling, killing: executionId={}, pid={}",
              timeout,
              executionId,
              process.pid());
          kill();
          return new ExecutionOutcome(
              ExecutionStatus.TIMED_OUT, null, readTail(logFile), elapsed());
        }

        int exitCode = process.exitValue();
        ExecutionStatus status =
            exitCode == 0 ? ExecutionStatus.SUCCEEDED : ExecutionStatus.FAILED;
        if (exitCode != 0) {
          LOGGER.warn("Recorder exited with code {}: executionId={}", exitCode, executionId);
        }
        return new ExecutionOutcome(status, exitCode, readTail(logFile), elapsed());

      } catch (InterruptedException e) {
        // The recording itself is left running; only our wait is abandoned.
        Thread.currentThread().interrupt();
        LOGGER.warn("Interrupted while waiting for recorder: executionId={}", executionId);
        return new ExecutionOutcome(
            ExecutionStatus.FAILED, null, "Interrupted while waiting for recorder", elapsed());
      }
    }

    private void kill() throws InterruptedException {
      process.descendants().forEach(ProcessHandle::destroy);
      process.destroy();
      if (!process.waitFor(killGrace.toMillis(), TimeUnit.MILLISECONDS)) {
        LOGGER.warn("Recorder ignored termination, forcing: executionId={}", executionId);
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        process.waitFor(killGrace.toMillis(), TimeUnit.MILLISECONDS);
      }
    }

    private Duration elapsed() {
      return Duration.ofNanos(System.nanoTime() - startNanos);
    }
  }
}
