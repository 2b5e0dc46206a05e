package com.scholary.langtag.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/**
 * Request for scanning files and directories.
 *
 * <p>Directories are searched recursively for {@code .mkv} files. {@code dryRun} overrides the
 * configured setting when present.
 */
public record ScanRequest(@NotEmpty List<@NotBlank String> paths, Boolean dryRun) {

  public ScanRequest {
    paths = paths == null ? List.of() : List.copyOf(paths);
  }
}
