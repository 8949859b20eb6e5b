package com.scholary.radio.recorder.api;

import jakarta.validation.constraints.NotBlank;

/** Move a catalog entry to a virtual folder; a null folder moves it to the root. */
public record MoveToFolderRequest(@NotBlank String filePath, Long folderId) {}
