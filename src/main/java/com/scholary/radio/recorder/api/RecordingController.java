package com.scholary.radio.recorder.api;

import com.scholary.radio.recorder.catalog.ArtifactLocation;
import com.scholary.radio.recorder.catalog.ArtifactLocator;
import com.scholary.radio.recorder.monitor.ExecutionRepository;
import com.scholary.radio.recorder.schedule.ScheduleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Ad-hoc recordings and execution status. */
@RestController
@RequestMapping("/api/recordings")
@Tag(name = "Recordings", description = "Start recordings now and poll their status")
public class RecordingController {

  private static final Logger LOGGER = LoggerFactory.getLogger(RecordingController.class);

  private final ScheduleService scheduleService;
  private final ExecutionRepository executionRepository;
  private final ArtifactLocator artifactLocator;

  public RecordingController(
      ScheduleService scheduleService,
      ExecutionRepository executionRepository,
      ArtifactLocator artifactLocator) {
    this.scheduleService = scheduleService;
    this.executionRepository = executionRepository;
    this.artifactLocator = artifactLocator;
  }

  /**
   * Launch a recording immediately.
   *
   * <p>Returns once the recorder is launched. A recorder that could not be spawned still gets an
   * execution id; its status shows the failure.
   */
  @PostMapping
  @Operation(summary = "Record now", description = "Launch the recorder and return an execution id")
  public ResponseEntity<?> recordNow(@Valid @RequestBody RecordingRequest request) {
    try {
      String executionId = scheduleService.runNow(request.toCommand(), request.toDisplay());
      return ResponseEntity.accepted().body(new ExecutionAcceptedResponse(executionId));
    } catch (IllegalArgumentException e) {
      return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
    } catch (Exception e) {
      LOGGER.error("Failed to start recording", e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }
  }

  @GetMapping("/executions/{id}")
  @Operation(summary = "Get execution status")
  public ResponseEntity<ExecutionStatusResponse> getExecution(@PathVariable String id) {
    return executionRepository
        .findById(id)
        .map(record -> ResponseEntity.ok(ExecutionStatusResponse.of(record)))
        .orElse(ResponseEntity.notFound().build());
  }

  @GetMapping("/artifact")
  @Operation(
      summary = "Check artifact",
      description = "Whether the recording for a title, feed and broadcast date is on disk")
  public ResponseEntity<?> checkArtifact(
      @RequestParam String title,
      @RequestParam String feedId,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
    try {
      ArtifactLocation location = artifactLocator.locate(title, feedId, date);
      return ResponseEntity.ok(
          new ArtifactCheckResponse(location.relativePath(), location.exists()));
    } catch (IllegalArgumentException e) {
      return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
    }
  }
}
