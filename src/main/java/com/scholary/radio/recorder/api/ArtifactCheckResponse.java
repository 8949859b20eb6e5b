package com.scholary.radio.recorder.api;

public record ArtifactCheckResponse(String filePath, boolean exists) {}
