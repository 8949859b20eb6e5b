package com.scholary.radio.recorder.api;

import java.util.List;

public record ScheduleListResponse(
    List<ScheduleResponse> recurring, List<ScheduleResponse> oneTime) {}
