package com.scholary.langtag.detection;

import com.scholary.langtag.config.DetectionProperties;
import com.scholary.langtag.whisper.WhisperProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sample-level flow: filtered attempt first, unfiltered when voice filtering found nothing.
 *
 * <p>The filtered attempt only runs when voice filtering is enabled and the speech service
 * supports it; that capability is fixed at start-up. An unfiltered attempt that follows an empty
 * filtered one is classified under the stricter speech test.
 */
@Component
public class AudioSampleAnalyzer {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioSampleAnalyzer.class);

  static final long MIN_SAMPLE_BYTES = 1000;

  private final TranscriptionAttemptEvaluator evaluator;
  private final VerdictClassifier classifier;
  private final boolean useVoiceFilter;

  public AudioSampleAnalyzer(
      TranscriptionAttemptEvaluator evaluator,
      VerdictClassifier classifier,
      DetectionProperties detectionProperties,
      WhisperProperties whisperProperties) {
    this.evaluator = evaluator;
    this.classifier = classifier;
    this.useVoiceFilter = detectionProperties.vadFilter() && whisperProperties.vadSupported();
    if (detectionProperties.vadFilter() && !whisperProperties.vadSupported()) {
      LOGGER.warn("Voice activity filtering requested but not supported by the speech service");
    }
  }

  /**
   * Classify one audio sample.
   *
   * @return the verdict, or empty when the sample is unusable or every attempt failed
   */
  public Optional<SampleVerdict> analyze(Path sample) {
    long size;
    try {
      size = Files.size(sample);
    } catch (IOException e) {
      LOGGER.error("Audio sample is not readable: {}", sample);
      return Optional.empty();
    }
    if (size < MIN_SAMPLE_BYTES) {
      LOGGER.error("Audio sample is too small ({} bytes): {}", size, sample);
      return Optional.empty();
    }

    boolean vadRemovedAll = false;
    if (useVoiceFilter) {
      Optional<TranscriptionEvidence> filtered =
          evaluator.attempt(sample, AttemptVariant.FILTERED);
      if (filtered.isPresent()) {
        if (filtered.get().segmentCount() > 0) {
          return Optional.of(verdictFor(filtered.get()));
        }
        vadRemovedAll = true;
        LOGGER.debug("Voice filter removed all audio, trying without it");
      }
    }

    Optional<TranscriptionEvidence> unfiltered =
        evaluator.attempt(sample, AttemptVariant.UNFILTERED);
    if (unfiltered.isEmpty()) {
      LOGGER.warn("All transcription attempts failed for {}", sample.getFileName());
      return Optional.empty();
    }
    TranscriptionEvidence evidence =
        vadRemovedAll ? unfiltered.get().afterVadRemovedAll() : unfiltered.get();
    return Optional.of(verdictFor(evidence));
  }

  private SampleVerdict verdictFor(TranscriptionEvidence evidence) {
    return new SampleVerdict(
        classifier.classify(evidence), evidence.confidence(), evidence.variant());
  }
}
