package com.scholary.radio.recorder.api;

import com.scholary.radio.recorder.schedule.OneTimeSchedule;
import com.scholary.radio.recorder.schedule.RecurringSchedule;
import com.scholary.radio.recorder.schedule.ScheduleService;
import com.scholary.radio.recorder.schedule.ScheduleStoreException;
import com.scholary.radio.recorder.trigger.ScheduleConversionException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for recording schedules.
 *
 * <p>Creating a schedule persists it and arms its trigger in one call. Invalid recurrence fields
 * or a fire time in the past are rejected with 400 and nothing is stored.
 */
@RestController
@RequestMapping("/api/schedules")
@Tag(name = "Schedules", description = "Recurring and one-time recording schedules")
public class ScheduleController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScheduleController.class);

  private final ScheduleService scheduleService;

  public ScheduleController(ScheduleService scheduleService) {
    this.scheduleService = scheduleService;
  }

  @PostMapping("/recurring")
  @Operation(summary = "Create recurring schedule")
  public ResponseEntity<?> createRecurring(
      @Valid @RequestBody CreateRecurringScheduleRequest request) {
    try {
      RecurringSchedule schedule =
          scheduleService.createRecurring(
              request.toRecurrence(),
              request.recording().toCommand(),
              request.recording().toDisplay());
      LOGGER.info("Created recurring schedule: {}", schedule.jobId());
      return ResponseEntity.status(HttpStatus.CREATED).body(ScheduleResponse.of(schedule));
    } catch (ScheduleConversionException | IllegalArgumentException e) {
      LOGGER.warn("Rejected recurring schedule: {}", e.getMessage());
      return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
    } catch (ScheduleStoreException e) {
      LOGGER.error("Failed to store recurring schedule", e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
          .body(new ErrorResponse(e.getMessage()));
    }
  }

  @PostMapping("/one-time")
  @Operation(summary = "Create one-time schedule")
  public ResponseEntity<?> createOneTime(@Valid @RequestBody CreateOneTimeScheduleRequest request) {
    try {
      OneTimeSchedule schedule =
          scheduleService.createOneTime(
              request.fireAt(), request.recording().toCommand(), request.recording().toDisplay());
      LOGGER.info("Created one-time schedule: {} at {}", schedule.jobId(), schedule.fireAt());
      return ResponseEntity.status(HttpStatus.CREATED).body(ScheduleResponse.of(schedule));
    } catch (ScheduleConversionException | IllegalArgumentException e) {
      LOGGER.warn("Rejected one-time schedule: {}", e.getMessage());
      return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
    } catch (ScheduleStoreException e) {
      LOGGER.error("Failed to store one-time schedule", e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
          .body(new ErrorResponse(e.getMessage()));
    }
  }

  @GetMapping
  @Operation(summary = "List schedules")
  public ResponseEntity<ScheduleListResponse> list() {
    List<ScheduleResponse> recurring =
        scheduleService.listRecurring().stream()
            .map(ScheduleResponse::of)
            .collect(Collectors.toList());
    List<ScheduleResponse> oneTime =
        scheduleService.listOneTime().stream()
            .map(ScheduleResponse::of)
            .collect(Collectors.toList());
    return ResponseEntity.ok(new ScheduleListResponse(recurring, oneTime));
  }

  @GetMapping("/triggers")
  @Operation(summary = "List armed triggers", description = "Job ids currently registered")
  public ResponseEntity<List<String>> triggers() {
    return ResponseEntity.ok(scheduleService.armedTriggers());
  }

  @DeleteMapping("/recurring/{id}")
  @Operation(summary = "Delete recurring schedule")
  public ResponseEntity<?> deleteRecurring(@PathVariable long id) {
    try {
      return scheduleService.deleteRecurring(id)
          ? ResponseEntity.noContent().build()
          : ResponseEntity.notFound().build();
    } catch (ScheduleStoreException e) {
      LOGGER.error("Failed to delete recurring schedule {}", id, e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
          .body(new ErrorResponse(e.getMessage()));
    }
  }

  @DeleteMapping("/one-time/{id}")
  @Operation(
      summary = "Delete one-time schedule",
      description = "A recording already running for this schedule is not stopped")
  public ResponseEntity<?> deleteOneTime(@PathVariable long id) {
    try {
      return scheduleService.deleteOneTime(id)
          ? ResponseEntity.noContent().build()
          : ResponseEntity.notFound().build();
    } catch (ScheduleStoreException e) {
      LOGGER.error("Failed to delete one-time schedule {}", id, e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
          .body(new ErrorResponse(e.getMessage()));
    }
  }
}
