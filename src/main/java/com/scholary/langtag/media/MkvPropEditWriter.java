package com.scholary.langtag.media;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes track headers in place with {@code mkvpropedit}.
 *
 * <p>mkvpropedit numbers tracks from 1 within each type ({@code track:a1} is the first audio
 * track). In dry-run mode the intended edit is logged and nothing is executed.
 */
@Component
public class MkvPropEditWriter implements MetadataWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(MkvPropEditWriter.class);

  private final FfmpegProperties ffmpegProperties;
  private final ProcessRunner processRunner;

  public MkvPropEditWriter(FfmpegProperties ffmpegProperties, ProcessRunner processRunner) {
    this.ffmpegProperties = ffmpegProperties;
    this.processRunner = processRunner;
  }

  @Override
  public void writeAudioLanguage(
      Path file, MediaTrack track, String languageCode, boolean dryRun) throws IOException {
    if (dryRun) {
      LOGGER.info(
          "[DRY RUN] Would set {} of {} to language={}", trackSpec(track), file, languageCode);
      return;
    }
    execute(
        file,
        List.of(
            ffmpegProperties.mkvpropeditBinary(),
            file.toString(),
            "--edit",
            trackSpec(track),
            "--set",
            "language=" + languageCode));
    LOGGER.info("Set {} of {} to language={}", trackSpec(track), file.getFileName(), languageCode);
  }

  @Override
  public void writeSubtitleMetadata(
      Path file,
      MediaTrack track,
      String languageCode,
      String title,
      boolean forced,
      boolean dryRun)
      throws IOException {
    if (dryRun) {
      LOGGER.info(
          "[DRY RUN] Would set {} of {} to language={}, name='{}', forced={}",
          trackSpec(track),
          file,
          languageCode,
          title,
          forced);
      return;
    }
    execute(
        file,
        List.of(
            ffmpegProperties.mkvpropeditBinary(),
            file.toString(),
            "--edit",
            trackSpec(track),
            "--set",
            "language=" + languageCode,
            "--set",
            "name=" + title,
            "--set",
            "flag-forced=" + (forced ? "1" : "0")));
    LOGGER.info(
        "Set {} of {} to language={}, name='{}', forced={}",
        trackSpec(track),
        file.getFileName(),
        languageCode,
        title,
        forced);
  }

  private void execute(Path file, List<String> command) throws IOException {
    ProcessResult result =
        processRunner.run(command, Duration.ofSeconds(ffmpegProperties.probeTimeoutSeconds()));
    if (!result.succeeded()) {
      throw new IOException(
          String.format(
              "mkvpropedit exited with code %d for %s: %s",
              result.exitCode(),
              file,
              result.stderr().isBlank() ? result.stdout() : result.stderr()));
    }
  }

  static String trackSpec(MediaTrack track) {
    return "track:" + track.type().selector() + (track.trackIndex() + 1);
  }
}
