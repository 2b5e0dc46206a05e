package com.scholary.langtag.service;

/** Language, title and flags written to a subtitle track. */
public record SubtitleTrackResult(
    int trackIndex,
    String previousLanguage,
    String detectedLanguage,
    double confidence,
    boolean forced,
    boolean sdh,
    String title) {}
