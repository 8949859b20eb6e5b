package com.scholary.radio.recorder.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

public record CreateOneTimeScheduleRequest(
    @NotNull Instant fireAt, @Valid @NotNull RecordingRequest recording) {}
