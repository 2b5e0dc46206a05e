package com.scholary.langtag.service;

import com.scholary.langtag.detection.VerdictMethod;

/** Language written to an audio track. */
public record AudioTrackResult(
    int trackIndex,
    String previousLanguage,
    String detectedLanguage,
    double confidence,
    VerdictMethod method) {}
