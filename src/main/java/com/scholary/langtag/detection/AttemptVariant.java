package com.scholary.langtag.detection;

import com.scholary.langtag.whisper.TranscriptionOptions;

/** Which decoding setup produced a piece of evidence. */
public enum AttemptVariant {
  /** Voice-activity filtering on, greedy decoding. */
  FILTERED(TranscriptionOptions.filtered()),
  /** Raw audio, slightly raised temperature. */
  UNFILTERED(TranscriptionOptions.unfiltered());

  private final TranscriptionOptions options;

  AttemptVariant(TranscriptionOptions options) {
    this.options = options;
  }

  public TranscriptionOptions options() {
    return options;
  }
}
