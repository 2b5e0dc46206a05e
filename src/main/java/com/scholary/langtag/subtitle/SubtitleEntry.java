package com.scholary.langtag.subtitle;

/**
 * One cue of a text subtitle track.
 *
 * @param index the cue number from the file
 * @param start display start in seconds
 * @param end display end in seconds
 * @param text cue text with line breaks kept
 */
public record SubtitleEntry(int index, double start, double end, String text) {

  public SubtitleEntry {
    text = text == null ? "" : text;
  }

  public double duration() {
    return end - start;
  }
}
