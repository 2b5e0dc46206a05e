package com.scholary.langtag.detection;

import com.scholary.langtag.config.DetectionProperties;
import com.scholary.langtag.language.LanguageCodes;
import com.scholary.langtag.logging.StructuredLogger;
import com.scholary.langtag.media.MediaExtractor;
import com.scholary.langtag.media.MediaTrack;
import com.scholary.langtag.media.TimeRange;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reaches one language verdict for an audio track from repeated, unreliable transcriptions.
 *
 * <p>The search escalates in three steps:
 *
 * <ol>
 *   <li>Up to {@code maxRetries} sampled segments, each from a different window set. A real
 *       language at or above the confidence threshold is returned at once.
 *   <li>The whole track, bounded by the operation timeout. A confident language is returned; a
 *       "no linguistic content" result is trusted whatever its confidence, since clean full-track
 *       silence is stronger evidence than any sample.
 *   <li>Aggregation over the sampled verdicts: the most frequent real language wins, unanimous
 *       {@code zxx} yields {@code zxx}, anything else is a failure.
 * </ol>
 *
 * <p>Temporary audio is deleted after every attempt, including failed ones.
 */
@Component
public class AudioLanguageDetector {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioLanguageDetector.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final MediaExtractor mediaExtractor;
  private final AudioSampleAnalyzer sampleAnalyzer;
  private final SampleWindowPlanner windowPlanner;
  private final DetectionProperties properties;

  public AudioLanguageDetector(
      MediaExtractor mediaExtractor,
      AudioSampleAnalyzer sampleAnalyzer,
      SampleWindowPlanner windowPlanner,
      DetectionProperties properties) {
    this.mediaExtractor = mediaExtractor;
    this.sampleAnalyzer = sampleAnalyzer;
    this.windowPlanner = windowPlanner;
    this.properties = properties;
  }

  /**
   * Detect the spoken language of an audio track.
   *
   * @param file the container
   * @param track the audio track
   * @param durationSeconds container runtime, 0 when unknown
   * @return the verdict, or empty when no attempt produced usable evidence
   */
  public Optional<LanguageVerdict> detect(Path file, MediaTrack track, double durationSeconds)
      throws IOException {
    Path workDir = Files.createDirectories(Path.of(properties.tempDir()));
    double threshold = properties.confidenceThreshold();
    int maxRetries = properties.maxRetries();

    List<SampleVerdict> sampled = new ArrayList<>();
    SampleVerdict best = null;

    for (int retry = 0; retry < maxRetries; retry++) {
      Optional<SampleVerdict> result = analyzeRetry(file, track, durationSeconds, retry, workDir);
      if (result.isEmpty()) {
        LOGGER.debug("Retry {}: no usable sample for {}", retry + 1, track.selector());
        continue;
      }
      SampleVerdict verdict = result.get();
      STRUCTURED_LOGGER.logRetryAttempt(
          track.selector(), retry + 1, maxRetries, verdict.languageCode(), verdict.confidence());

      sampled.add(verdict);
      if (best == null || verdict.confidence() > best.confidence()) {
        best = verdict;
      }
      if (!verdict.isNoLinguisticContent() && verdict.confidence() >= threshold) {
        return Optional.of(
            verdict(
                track,
                verdict.languageCode(),
                verdict.confidence(),
                VerdictMethod.SAMPLED_SEGMENT));
      }
    }

    if (best != null && !best.isNoLinguisticContent() && best.confidence() >= threshold) {
      return Optional.of(
          verdict(track, best.languageCode(), best.confidence(), VerdictMethod.SAMPLED_SEGMENT));
    }

    LOGGER.info(
        "Best sampled confidence for {} is {} (threshold {}), analyzing full track",
        track.selector(),
        best == null ? "n/a" : String.format("%.3f", best.confidence()),
        threshold);

    Optional<SampleVerdict> full = analyzeFullTrack(file, track, workDir);
    if (full.isPresent()) {
      SampleVerdict verdict = full.get();
      if (verdict.isNoLinguisticContent()) {
        return Optional.of(
            verdict(track, verdict.languageCode(), verdict.confidence(), VerdictMethod.FULL_TRACK));
      }
      if (verdict.confidence() >= threshold) {
        return Optional.of(
            verdict(track, verdict.languageCode(), verdict.confidence(), VerdictMethod.FULL_TRACK));
      }
      LOGGER.info(
          "Full track result '{}' below threshold ({}), falling back to sampled verdicts",
          verdict.languageCode(),
          String.format("%.3f", verdict.confidence()));
    }

    return aggregate(track, sampled);
  }

  private Optional<SampleVerdict> analyzeRetry(
      Path file, MediaTrack track, double durationSeconds, int retry, Path workDir) {
    for (TimeRange window : windowPlanner.windowsFor(durationSeconds, retry)) {
      Optional<Path> sample = mediaExtractor.extractAudioSample(file, track, window, workDir);
      if (sample.isPresent()) {
        try {
          return sampleAnalyzer.analyze(sample.get());
        } finally {
          deleteQuietly(sample.get());
        }
      }
    }
    return Optional.empty();
  }

  private Optional<SampleVerdict> analyzeFullTrack(Path file, MediaTrack track, Path workDir) {
    Duration timeout = Duration.ofSeconds(properties.operationTimeoutSeconds());
    Optional<Path> audio = mediaExtractor.extractFullAudio(file, track, workDir, timeout);
    if (audio.isEmpty()) {
      return Optional.empty();
    }
    try {
      return sampleAnalyzer.analyze(audio.get());
    } finally {
      deleteQuietly(audio.get());
    }
  }

  private Optional<LanguageVerdict> aggregate(MediaTrack track, List<SampleVerdict> sampled) {
    if (sampled.isEmpty()) {
      LOGGER.warn("All language detection attempts failed for {}", track.selector());
      return Optional.empty();
    }

    // insertion order keeps the earliest code on count ties
    Map<String, Integer> counts = new LinkedHashMap<>();
    Map<String, Double> bestConfidence = new LinkedHashMap<>();
    for (SampleVerdict verdict : sampled) {
      if (verdict.isNoLinguisticContent()) {
        continue;
      }
      counts.merge(verdict.languageCode(), 1, Integer::sum);
      bestConfidence.merge(verdict.languageCode(), verdict.confidence(), Math::max);
    }

    if (!counts.isEmpty()) {
      String winner = null;
      int winnerCount = 0;
      for (Map.Entry<String, Integer> entry : counts.entrySet()) {
        if (entry.getValue() > winnerCount) {
          winner = entry.getKey();
          winnerCount = entry.getValue();
        }
      }
      LOGGER.info("Sampled attempts found {}, using most frequent '{}'", counts, winner);
      return Optional.of(
          verdict(
              track, winner, bestConfidence.get(winner), VerdictMethod.AGGREGATED_MAJORITY));
    }

    double zxxConfidence =
        sampled.stream().mapToDouble(SampleVerdict::confidence).max().orElse(0.0);
    LOGGER.info("All {} sampled attempts found no linguistic content", sampled.size());
    return Optional.of(
        verdict(
            track,
            LanguageCodes.NO_LINGUISTIC_CONTENT,
            zxxConfidence,
            VerdictMethod.AGGREGATED_MAJORITY));
  }

  private LanguageVerdict verdict(
      MediaTrack track, String code, double confidence, VerdictMethod method) {
    LanguageVerdict verdict = new LanguageVerdict(code, confidence, method);
    STRUCTURED_LOGGER.logLanguageVerdict(track.selector(), code, confidence, method.name());
    return verdict;
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete temp file: {}", path, e);
    }
  }
}
