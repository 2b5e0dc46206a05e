package com.scholary.langtag.tracking;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Remembers which files already have confirmed verdicts so re-runs can skip them.
 *
 * <p>Entries are keyed by absolute path and are only valid while the file keeps the size and
 * modification time it had when marked. A stale entry is dropped the first time it is looked up.
 */
public interface ProcessingTracker {

  /**
   * Look up the valid entry for a file.
   *
   * @return the entry, or empty when the file is untracked, missing or changed since it was marked
   */
  Optional<TrackingEntry> find(Path file);

  default boolean isProcessed(Path file) {
    return find(file).isPresent();
  }

  /**
   * Record the outcome for a file. Nothing is written unless at least one track type succeeded.
   */
  void markProcessed(Path file, boolean audioProcessed, boolean subtitleProcessed);

  void clearEntry(Path file);

  void clearAll();

  TrackerStats stats();
}
