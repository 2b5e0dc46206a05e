package com.scholary.langtag.tracking;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What is known about a processed file.
 *
 * @param size file size in bytes when it was marked
 * @param mtime modification time in epoch seconds when it was marked
 * @param audioProcessed all audio tracks were settled
 * @param subtitleProcessed all subtitle tracks were settled
 * @param processedDate when the entry was written, in epoch seconds
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrackingEntry(
    long size,
    double mtime,
    @JsonProperty("audio_processed") boolean audioProcessed,
    @JsonProperty("subtitle_processed") boolean subtitleProcessed,
    @JsonProperty("processed_date") double processedDate) {

  static final double MTIME_TOLERANCE_SECONDS = 1.0;

  /** True while the file still has the recorded size and (within a second) mtime. */
  public boolean matches(long currentSize, double currentMtime) {
    return size == currentSize && Math.abs(mtime - currentMtime) <= MTIME_TOLERANCE_SECONDS;
  }
}
