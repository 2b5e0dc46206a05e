package com.scholary.langtag.detection;

import com.scholary.langtag.whisper.TranscriptSegment;
import com.scholary.langtag.whisper.WhisperException;
import com.scholary.langtag.whisper.WhisperResponse;
import com.scholary.langtag.whisper.WhisperService;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs one transcription of an audio sample and turns the response into evidence.
 *
 * <p>Confidence starts from the model's language probability and is raised to the mean segment
 * confidence when that is higher. A failed call yields no evidence; the caller treats it as an
 * inconclusive attempt.
 */
@Component
public class TranscriptionAttemptEvaluator {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionAttemptEvaluator.class);

  private final WhisperService whisperService;

  public TranscriptionAttemptEvaluator(WhisperService whisperService) {
    this.whisperService = whisperService;
  }

  public Optional<TranscriptionEvidence> attempt(Path sample, AttemptVariant variant) {
    WhisperResponse response;
    try {
      response = whisperService.transcribe(sample, variant.options());
    } catch (WhisperException e) {
      LOGGER.debug("Transcription attempt {} failed: {}", variant, e.getMessage());
      return Optional.empty();
    }

    String text =
        response.segments().stream()
            .map(TranscriptSegment::text)
            .filter(Objects::nonNull)
            .collect(Collectors.joining(" "))
            .strip();
    int segmentCount = response.segments().size();
    boolean vadRemovedAll = variant == AttemptVariant.FILTERED && segmentCount == 0;

    double confidence = response.languageProbability();
    OptionalDouble segmentMean =
        response.segments().stream()
            .map(TranscriptSegment::confidence)
            .filter(Objects::nonNull)
            .mapToDouble(Double::doubleValue)
            .average();
    if (segmentMean.isPresent()) {
      confidence = Math.max(confidence, segmentMean.getAsDouble());
    }

    TranscriptionEvidence evidence =
        new TranscriptionEvidence(
            response.language() == null ? "" : response.language(),
            confidence,
            text,
            text.length(),
            text.isEmpty() ? 0 : text.split("\\s+").length,
            segmentCount,
            vadRemovedAll,
            variant);

    LOGGER.debug(
        "Attempt {}: language={}, confidence={}, segments={}, text='{}'",
        variant,
        evidence.languageName(),
        String.format("%.2f", confidence),
        segmentCount,
        text.length() > 150 ? text.substring(0, 150) : text);
    return Optional.of(evidence);
  }
}
