package com.scholary.langtag.job;

import com.scholary.langtag.api.JobStatusResponse.Status;
import com.scholary.langtag.config.DetectionProperties;
import com.scholary.langtag.service.LibraryScanService;
import com.scholary.langtag.service.ScanSummary;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Executes scan jobs on the single-thread task executor.
 *
 * <p>Lives in its own bean so calls from the controller go through the async proxy.
 */
@Component
public class ScanJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScanJobRunner.class);

  private final LibraryScanService scanService;
  private final JobRepository jobRepository;
  private final DetectionProperties detectionProperties;

  public ScanJobRunner(
      LibraryScanService scanService,
      JobRepository jobRepository,
      DetectionProperties detectionProperties) {
    this.scanService = scanService;
    this.jobRepository = jobRepository;
    this.detectionProperties = detectionProperties;
  }

  @Async
  public void run(ScanJob job) {
    LOGGER.info("Starting scan job: {}", job.getJobId());

    try {
      job.setStatus(Status.PROCESSING);
      jobRepository.save(job);

      List<Path> roots = job.getRequest().paths().stream().map(Path::of).toList();
      Boolean requestedDryRun = job.getRequest().dryRun();
      boolean dryRun = requestedDryRun != null ? requestedDryRun : detectionProperties.dryRun();

      ScanSummary summary = scanService.scan(roots, dryRun, job::setProgress);

      job.setStatus(Status.COMPLETED);
      job.setProgress(100);
      job.setSummary(summary);
      jobRepository.save(job);

      LOGGER.info("Completed scan job: {}", job.getJobId());

    } catch (Exception e) {
      LOGGER.error("Scan job failed: {}", job.getJobId(), e);
      job.setStatus(Status.FAILED);
      job.setError(e.getMessage());
      jobRepository.save(job);
    }
  }
}
