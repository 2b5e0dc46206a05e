package com.scholary.langtag.api;

import jakarta.validation.constraints.NotBlank;

/** Request for classifying a single file synchronously. */
public record ClassifyFileRequest(@NotBlank String path, Boolean dryRun) {}
