package com.scholary.langtag.api;

import com.scholary.langtag.service.ScanSummary;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of a scan job and includes the summary once it has completed.
 */
public record JobStatusResponse(
    String jobId, Status status, Integer progress, ScanSummary summary, String error) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
  }
}
