package com.scholary.langtag.service;

import com.scholary.langtag.media.TrackType;

/**
 * A track whose language was left unchanged because classification or the write failed.
 *
 * @param type audio or subtitle
 * @param trackIndex index within its type
 * @param kind what went wrong
 * @param message detail for the operator
 */
public record TrackFailure(TrackType type, int trackIndex, Kind kind, String message) {

  public enum Kind {
    EXTRACTION,
    INFERENCE,
    LOW_CONFIDENCE,
    TIMEOUT,
    WRITE,
    UNEXPECTED
  }
}
