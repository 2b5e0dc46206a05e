package com.scholary.langtag.service;

import com.scholary.langtag.detection.AudioLanguageDetector;
import com.scholary.langtag.detection.LanguageVerdict;
import com.scholary.langtag.logging.StructuredLogger;
import com.scholary.langtag.media.MediaTrack;
import com.scholary.langtag.media.MetadataWriter;
import com.scholary.langtag.media.TrackType;
import com.scholary.langtag.service.TrackFailure.Kind;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Detects and writes the language of each selected audio track of a file, one at a time. */
@Component
public class AudioTrackProcessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioTrackProcessor.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final AudioLanguageDetector detector;
  private final MetadataWriter metadataWriter;

  public AudioTrackProcessor(AudioLanguageDetector detector, MetadataWriter metadataWriter) {
    this.detector = detector;
    this.metadataWriter = metadataWriter;
  }

  public TrackBatch<AudioTrackResult> process(
      Path file, List<MediaTrack> tracks, double durationSeconds, boolean dryRun) {
    List<AudioTrackResult> updated = new ArrayList<>();
    List<TrackFailure> failures = new ArrayList<>();

    for (MediaTrack track : tracks) {
      LOGGER.info("Detecting language of audio track {} ({})", track.trackIndex(), track.codec());
      try {
        Optional<LanguageVerdict> verdict = detector.detect(file, track, durationSeconds);
        if (verdict.isEmpty()) {
          failures.add(
              failure(track, Kind.LOW_CONFIDENCE, "Failed to detect language for audio track"));
          continue;
        }

        LanguageVerdict result = verdict.get();
        try {
          metadataWriter.writeAudioLanguage(file, track, result.languageCode(), dryRun);
        } catch (IOException e) {
          failures.add(failure(track, Kind.WRITE, e.getMessage()));
          continue;
        }
        updated.add(
            new AudioTrackResult(
                track.trackIndex(),
                track.language(),
                result.languageCode(),
                result.confidence(),
                result.method()));
      } catch (IOException e) {
        failures.add(failure(track, Kind.EXTRACTION, e.getMessage()));
      } catch (RuntimeException e) {
        LOGGER.error("Error processing audio track {}", track.trackIndex(), e);
        failures.add(failure(track, Kind.UNEXPECTED, String.valueOf(e.getMessage())));
      }
    }
    return new TrackBatch<>(updated, List.of(), failures);
  }

  private static TrackFailure failure(MediaTrack track, Kind kind, String message) {
    STRUCTURED_LOGGER.logTrackFailed(track.selector(), kind.name(), message);
    return new TrackFailure(TrackType.AUDIO, track.trackIndex(), kind, message);
  }
}
