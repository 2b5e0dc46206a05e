package com.scholary.langtag.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Represents a single segment of transcribed audio.
 *
 * <p>Times are in seconds from the start of the submitted file. {@code avgLogprob} is the mean
 * token log-probability, absent when the service does not report it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranscriptSegment(
    double start, double end, String text, @JsonProperty("avg_logprob") Double avgLogprob) {

  /** Segment confidence derived from the log-probability, clamped to [0, 1]. */
  public Double confidence() {
    if (avgLogprob == null) {
      return null;
    }
    return Math.min(1.0, Math.max(0.0, avgLogprob + 1.0));
  }
}
