package com.scholary.langtag.subtitle;

import com.scholary.langtag.config.DetectionProperties;
import com.scholary.langtag.media.MediaExtractor;
import com.scholary.langtag.media.MediaTrack;
import com.scholary.langtag.media.TimeRange;
import com.scholary.langtag.whisper.TranscriptSegment;
import com.scholary.langtag.whisper.TranscriptionOptions;
import com.scholary.langtag.whisper.WhisperException;
import com.scholary.langtag.whisper.WhisperResponse;
import com.scholary.langtag.whisper.WhisperService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Settles ambiguous forced-subtitle cases by comparing subtitle display time with detected speech.
 *
 * <p>A full subtitle track is on screen during most speech. A forced track covers only a small part
 * of it, so little overlap or a subtitle coverage far below the speech coverage means forced.
 */
@Component
public class SpeechOverlapAnalyzer {

  private static final Logger LOGGER = LoggerFactory.getLogger(SpeechOverlapAnalyzer.class);

  private final MediaExtractor mediaExtractor;
  private final WhisperService whisperService;
  private final DetectionProperties detectionProperties;

  public SpeechOverlapAnalyzer(
      MediaExtractor mediaExtractor,
      WhisperService whisperService,
      DetectionProperties detectionProperties) {
    this.mediaExtractor = mediaExtractor;
    this.whisperService = whisperService;
    this.detectionProperties = detectionProperties;
  }

  /**
   * Decode the audio track, locate speech and decide from the overlap.
   *
   * @return the verdict, or empty when audio extraction or speech detection failed
   */
  public Optional<ForcedVerdict> analyze(
      Path file, MediaTrack audioTrack, SubtitleStatistics stats, double durationSeconds) {
    Path workDir;
    try {
      workDir = Files.createDirectories(Path.of(detectionProperties.tempDir()));
    } catch (IOException e) {
      LOGGER.warn("Cannot create temp directory for speech analysis: {}", e.getMessage());
      return Optional.empty();
    }

    Duration timeout = Duration.ofSeconds(detectionProperties.operationTimeoutSeconds());
    Optional<Path> audio = mediaExtractor.extractFullAudio(file, audioTrack, workDir, timeout);
    if (audio.isEmpty()) {
      LOGGER.warn("Could not extract audio for speech analysis of {}", file.getFileName());
      return Optional.empty();
    }

    try {
      WhisperResponse response =
          whisperService.transcribe(audio.get(), TranscriptionOptions.speechTiming());
      List<TimeRange> speech = new ArrayList<>();
      for (TranscriptSegment segment : response.segments()) {
        if (segment.start() >= 0 && segment.end() >= segment.start()) {
          speech.add(new TimeRange(segment.start(), segment.end()));
        }
      }
      return Optional.of(decide(stats, speech, durationSeconds));
    } catch (WhisperException e) {
      LOGGER.warn("Speech detection failed: {}", e.getMessage());
      return Optional.empty();
    } finally {
      try {
        Files.deleteIfExists(audio.get());
      } catch (IOException e) {
        LOGGER.warn("Failed to delete temp file: {}", audio.get(), e);
      }
    }
  }

  static ForcedVerdict decide(
      SubtitleStatistics stats, List<TimeRange> speech, double durationSeconds) {
    if (speech.isEmpty()) {
      return ForcedVerdict.forced("No speech detected in audio", ConfidenceTier.LOW);
    }

    double totalSpeech = speech.stream().mapToDouble(TimeRange::duration).sum();
    double speechCoverage = durationSeconds > 0 ? totalSpeech / durationSeconds * 100.0 : 0.0;

    double overlap = 0.0;
    for (TimeRange subtitle : stats.intervals()) {
      for (TimeRange segment : speech) {
        overlap += subtitle.overlapSeconds(segment);
      }
    }

    double speechWithSubtitles = totalSpeech > 0 ? overlap / totalSpeech * 100.0 : 0.0;
    double coverageRatio = speechCoverage > 0 ? stats.coveragePercent() / speechCoverage : 0.0;

    String metrics =
        String.format(
            Locale.ROOT,
            "speech coverage=%.1f%%, speech with subtitles=%.1f%%, coverage ratio=%.2f",
            speechCoverage,
            speechWithSubtitles,
            coverageRatio);
    LOGGER.info("Audio analysis: {}", metrics);

    boolean forced =
        speechWithSubtitles < 50.0
            || coverageRatio < 0.4
            || (stats.coveragePercent() < 25.0 && stats.density() < 5.0);
    if (speechWithSubtitles > 80.0) {
      forced = false;
    }
    return new ForcedVerdict(forced, "Audio analysis: " + metrics, ConfidenceTier.LOW, false);
  }
}
