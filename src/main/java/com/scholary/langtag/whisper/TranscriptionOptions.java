package com.scholary.langtag.whisper;

/**
 * Decoding parameters for one transcription request.
 *
 * @param vadFilter drop non-speech audio before decoding
 * @param temperature sampling temperature, 0 for greedy decoding
 * @param beamSize beam search width
 * @param bestOf candidates when sampling with non-zero temperature
 * @param wordTimestamps request word-level timing
 */
public record TranscriptionOptions(
    boolean vadFilter, double temperature, int beamSize, int bestOf, boolean wordTimestamps) {

  /** Language detection with voice-activity filtering. */
  public static TranscriptionOptions filtered() {
    return new TranscriptionOptions(true, 0.0, 3, 2, false);
  }

  /** Language detection on raw audio; the higher temperature curbs repetitive output. */
  public static TranscriptionOptions unfiltered() {
    return new TranscriptionOptions(false, 0.2, 3, 2, false);
  }

  /** Cheap pass whose only purpose is locating speech in time. */
  public static TranscriptionOptions speechTiming() {
    return new TranscriptionOptions(true, 0.0, 1, 1, true);
  }
}
