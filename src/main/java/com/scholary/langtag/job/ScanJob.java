package com.scholary.langtag.job;

import com.scholary.langtag.api.JobStatusResponse.Status;
import com.scholary.langtag.api.ScanRequest;
import com.scholary.langtag.service.ScanSummary;
import java.time.Instant;

/**
 * Represents an async scan job.
 *
 * <p>Tracks the job's state, progress, and summary. Stored in memory using Caffeine cache.
 */
public class ScanJob {

  private final String jobId;
  private final ScanRequest request;
  private final Instant createdAt;

  private volatile Status status;
  private volatile Integer progress; // 0-100
  private volatile ScanSummary summary;
  private volatile String error;

  public ScanJob(String jobId, ScanRequest request) {
    this.jobId = jobId;
    this.request = request;
    this.createdAt = Instant.now();
    this.status = Status.PENDING;
    this.progress = 0;
  }

  public String getJobId() {
    return jobId;
  }

  public ScanRequest getRequest() {
    return request;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public Integer getProgress() {
    return progress;
  }

  public void setProgress(Integer progress) {
    this.progress = progress;
  }

  public ScanSummary getSummary() {
    return summary;
  }

  public void setSummary(ScanSummary summary) {
    this.summary = summary;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }
}
