package com.scholary.langtag.service;

import java.util.List;

/**
 * Outcome of processing all selected tracks of one type in a file.
 *
 * @param updated tracks whose metadata was written (or would be, in a dry run)
 * @param skipped tracks classified below the acceptance threshold
 * @param failures tracks that could not be classified or written
 * @param <T> the per-track result type
 */
public record TrackBatch<T>(
    List<T> updated, List<SkippedTrack> skipped, List<TrackFailure> failures) {

  public TrackBatch {
    updated = List.copyOf(updated);
    skipped = List.copyOf(skipped);
    failures = List.copyOf(failures);
  }

  public static <T> TrackBatch<T> empty() {
    return new TrackBatch<>(List.of(), List.of(), List.of());
  }

  /** A batch settles its track type when nothing failed; skipped tracks do not count. */
  public boolean settled() {
    return failures.isEmpty();
  }
}
