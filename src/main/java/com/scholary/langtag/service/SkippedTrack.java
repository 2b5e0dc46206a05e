package com.scholary.langtag.service;

import com.scholary.langtag.media.TrackType;

/**
 * A track that was classified but deliberately left untouched.
 *
 * @param type audio or subtitle
 * @param trackIndex index within its type
 * @param detectedLanguage the rejected guess
 * @param confidence its confidence
 * @param reason why it was not written
 */
public record SkippedTrack(
    TrackType type, int trackIndex, String detectedLanguage, double confidence, String reason) {}
