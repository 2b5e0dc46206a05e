package com.scholary.langtag.detection;

/**
 * Structured outcome of one transcription attempt on an audio sample.
 *
 * @param languageName language reported by the model, a name ("french") or a code ("fr")
 * @param confidence blended confidence in [0, 1]
 * @param text joined transcript text, trimmed
 * @param textLength length of {@code text}
 * @param wordCount whitespace-separated words in {@code text}
 * @param segmentCount speech segments returned by the model
 * @param vadRemovedAll a filtered attempt on the same sample returned no segments
 * @param variant decoding setup used
 */
public record TranscriptionEvidence(
    String languageName,
    double confidence,
    String text,
    int textLength,
    int wordCount,
    int segmentCount,
    boolean vadRemovedAll,
    AttemptVariant variant) {

  /** Copy flagged as following a filtered attempt that removed all audio. */
  public TranscriptionEvidence afterVadRemovedAll() {
    return new TranscriptionEvidence(
        languageName, confidence, text, textLength, wordCount, segmentCount, true, variant);
  }
}
