package com.scholary.radio.recorder.api;

/** Returned as soon as a recording is launched; poll the status endpoint with the id. */
public record ExecutionAcceptedResponse(String executionId) {}
