package com.scholary.radio.recorder.api;

public record ErrorResponse(String error) {}
