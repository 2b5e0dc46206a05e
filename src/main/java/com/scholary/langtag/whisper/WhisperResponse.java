package com.scholary.langtag.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Response from the Whisper transcription API.
 *
 * <p>Contains the segments, the detected language name or code, and the model's probability for
 * that language.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperResponse(
    List<TranscriptSegment> segments,
    String language,
    @JsonProperty("language_probability") double languageProbability) {

  public WhisperResponse {
    segments = segments == null ? List.of() : List.copyOf(segments);
  }
}
