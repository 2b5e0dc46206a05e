package com.scholary.langtag.media;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Commits classification results into the container's track headers.
 *
 * <p>With {@code dryRun} set, implementations only report the change they would make.
 */
public interface MetadataWriter {

  void writeAudioLanguage(Path file, MediaTrack track, String languageCode, boolean dryRun)
      throws IOException;

  void writeSubtitleMetadata(
      Path file,
      MediaTrack track,
      String languageCode,
      String title,
      boolean forced,
      boolean dryRun)
      throws IOException;
}
