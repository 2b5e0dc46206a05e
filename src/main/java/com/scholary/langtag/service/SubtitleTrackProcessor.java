package com.scholary.langtag.service;

import com.scholary.langtag.config.DetectionProperties;
import com.scholary.langtag.config.SubtitleProperties;
import com.scholary.langtag.logging.StructuredLogger;
import com.scholary.langtag.media.MediaExtractor;
import com.scholary.langtag.media.MediaTrack;
import com.scholary.langtag.media.MetadataWriter;
import com.scholary.langtag.media.TrackType;
import com.scholary.langtag.service.TrackFailure.Kind;
import com.scholary.langtag.subtitle.ForcedSubtitleDetector;
import com.scholary.langtag.subtitle.ForcedVerdict;
import com.scholary.langtag.subtitle.LanguageGuess;
import com.scholary.langtag.subtitle.SdhDetector;
import com.scholary.langtag.subtitle.SrtParser;
import com.scholary.langtag.subtitle.SubtitleEntry;
import com.scholary.langtag.subtitle.SubtitleLanguageDetector;
import com.scholary.langtag.subtitle.TrackTitle;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Classifies each selected subtitle track of a file: language, forced flag and SDH flag.
 *
 * <p>The payload is extracted once per track and shared by all three analyses. A language guess
 * below the subtitle confidence threshold leaves the track untouched and is reported as skipped,
 * not failed.
 */
@Component
public class SubtitleTrackProcessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubtitleTrackProcessor.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final String BELOW_THRESHOLD = "confidence_below_threshold";

  private final MediaExtractor mediaExtractor;
  private final SubtitleLanguageDetector languageDetector;
  private final ForcedSubtitleDetector forcedDetector;
  private final SdhDetector sdhDetector;
  private final MetadataWriter metadataWriter;
  private final SubtitleProperties properties;
  private final DetectionProperties detectionProperties;

  public SubtitleTrackProcessor(
      MediaExtractor mediaExtractor,
      SubtitleLanguageDetector languageDetector,
      ForcedSubtitleDetector forcedDetector,
      SdhDetector sdhDetector,
      MetadataWriter metadataWriter,
      SubtitleProperties properties,
      DetectionProperties detectionProperties) {
    this.mediaExtractor = mediaExtractor;
    this.languageDetector = languageDetector;
    this.forcedDetector = forcedDetector;
    this.sdhDetector = sdhDetector;
    this.metadataWriter = metadataWriter;
    this.properties = properties;
    this.detectionProperties = detectionProperties;
  }

  /**
   * Process subtitle tracks.
   *
   * @param file the container
   * @param tracks subtitle tracks to classify
   * @param audioTrack audio track used for speech-overlap analysis, empty if the file has none
   * @param durationSeconds container runtime, 0 when unknown
   * @param dryRun report instead of writing
   */
  public TrackBatch<SubtitleTrackResult> process(
      Path file,
      List<MediaTrack> tracks,
      Optional<MediaTrack> audioTrack,
      double durationSeconds,
      boolean dryRun) {
    List<SubtitleTrackResult> updated = new ArrayList<>();
    List<SkippedTrack> skipped = new ArrayList<>();
    List<TrackFailure> failures = new ArrayList<>();

    for (MediaTrack track : tracks) {
      LOGGER.info("Processing subtitle track {} ({})", track.trackIndex(), track.codec());
      Optional<Path> payload = Optional.empty();
      try {
        payload = mediaExtractor.extractSubtitle(file, track, workDir());
        if (payload.isEmpty()) {
          failures.add(failure(track, Kind.EXTRACTION, "Failed to extract subtitle track"));
          continue;
        }

        List<SubtitleEntry> entries =
            track.isImageSubtitle() ? List.of() : SrtParser.parse(payload.get());
        Optional<LanguageGuess> language =
            track.isImageSubtitle()
                ? languageDetector.detectImage(file, track)
                : languageDetector.detectText(entries);
        if (language.isEmpty()) {
          failures.add(failure(track, Kind.INFERENCE, "Failed to detect subtitle language"));
          continue;
        }

        LanguageGuess guess = language.get();
        if (guess.confidence() < properties.confidenceThreshold()) {
          LOGGER.warn(
              "Subtitle track {} confidence ({}) below threshold ({}) - skipping",
              track.trackIndex(),
              String.format("%.2f", guess.confidence()),
              properties.confidenceThreshold());
          skipped.add(
              new SkippedTrack(
                  TrackType.SUBTITLE,
                  track.trackIndex(),
                  guess.languageCode(),
                  guess.confidence(),
                  BELOW_THRESHOLD));
          continue;
        }

        ForcedVerdict forced =
            forcedDetector.detect(file, track, entries, audioTrack, durationSeconds);
        boolean sdh = properties.detectSdh() && sdhDetector.isSdh(entries);
        String title = TrackTitle.of(guess.languageCode(), forced.forced(), sdh);

        try {
          metadataWriter.writeSubtitleMetadata(
              file, track, guess.languageCode(), title, forced.forced(), dryRun);
        } catch (IOException e) {
          failures.add(failure(track, Kind.WRITE, e.getMessage()));
          continue;
        }
        updated.add(
            new SubtitleTrackResult(
                track.trackIndex(),
                track.language(),
                guess.languageCode(),
                guess.confidence(),
                forced.forced(),
                sdh,
                title));
      } catch (IOException e) {
        failures.add(failure(track, Kind.EXTRACTION, e.getMessage()));
      } catch (RuntimeException e) {
        LOGGER.error("Error processing subtitle track {}", track.trackIndex(), e);
        failures.add(failure(track, Kind.UNEXPECTED, String.valueOf(e.getMessage())));
      } finally {
        payload.ifPresent(SubtitleTrackProcessor::deleteQuietly);
      }
    }
    return new TrackBatch<>(updated, skipped, failures);
  }

  private Path workDir() throws IOException {
    return Files.createDirectories(Path.of(detectionProperties.tempDir()));
  }

  private static TrackFailure failure(MediaTrack track, Kind kind, String message) {
    STRUCTURED_LOGGER.logTrackFailed(track.selector(), kind.name(), message);
    return new TrackFailure(TrackType.SUBTITLE, track.trackIndex(), kind, message);
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete temp file: {}", path, e);
    }
  }
}
