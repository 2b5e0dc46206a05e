package com.scholary.langtag.media;

/** Kind of stream inside a media container that this service classifies. */
public enum TrackType {
  AUDIO("a"),
  SUBTITLE("s");

  private final String selector;

  TrackType(String selector) {
    this.selector = selector;
  }

  /** Stream selector letter shared by ffmpeg maps and mkvpropedit track specs. */
  public String selector() {
    return selector;
  }
}
