package com.scholary.langtag.service;

import java.time.Duration;
import java.util.List;

/**
 * Totals over a scan, plus the per-file reports they were computed from.
 *
 * @param filesScanned files found
 * @param filesSkipped files skipped by the processing tracker
 * @param filesProcessed files that were classified
 * @param filesFailed files that could not be processed at all
 * @param tracksUpdated tracks whose metadata was written
 * @param tracksFailed tracks left unchanged because of a failure
 * @param tracksSkipped tracks left unchanged because of low confidence
 * @param runtimeMillis wall-clock time of the scan
 * @param files one report per file, in scan order
 */
public record ScanSummary(
    int filesScanned,
    int filesSkipped,
    int filesProcessed,
    int filesFailed,
    int tracksUpdated,
    int tracksFailed,
    int tracksSkipped,
    long runtimeMillis,
    List<FileReport> files) {

  public ScanSummary {
    files = List.copyOf(files);
  }

  public static ScanSummary of(List<FileReport> reports, Duration runtime) {
    int skipped = 0;
    int failed = 0;
    int updated = 0;
    int trackFailures = 0;
    int trackSkips = 0;
    for (FileReport report : reports) {
      if (report.skippedByTracker()) {
        skipped++;
      } else if (report.error() != null) {
        failed++;
      }
      updated += report.updatedTrackCount();
      trackFailures += report.failures().size();
      trackSkips += report.skippedTracks().size();
    }
    return new ScanSummary(
        reports.size(),
        skipped,
        reports.size() - skipped - failed,
        failed,
        updated,
        trackFailures,
        trackSkips,
        runtime.toMillis(),
        reports);
  }
}
