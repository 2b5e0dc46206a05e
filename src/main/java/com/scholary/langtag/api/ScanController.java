package com.scholary.langtag.api;

import com.scholary.langtag.api.JobStatusResponse.Status;
import com.scholary.langtag.job.JobRepository;
import com.scholary.langtag.job.ScanJob;
import com.scholary.langtag.job.ScanJobRunner;
import com.scholary.langtag.service.FileClassificationService;
import com.scholary.langtag.service.FileReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for track language classification.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Asynchronous library scans (returns job ID immediately)
 *   <li>Job status polling
 *   <li>Synchronous classification of a single file
 * </ul>
 */
@RestController
@Tag(name = "Classification", description = "Audio and subtitle track language tagging API")
public class ScanController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScanController.class);

  private final FileClassificationService classificationService;
  private final ScanJobRunner scanJobRunner;
  private final JobRepository jobRepository;

  public ScanController(
      FileClassificationService classificationService,
      ScanJobRunner scanJobRunner,
      JobRepository jobRepository) {
    this.classificationService = classificationService;
    this.scanJobRunner = scanJobRunner;
    this.jobRepository = jobRepository;
  }

  /** Start an asynchronous scan job. */
  @PostMapping("/api/scans")
  @Operation(
      summary = "Start scan",
      description = "Queue a scan of files and directories and return a job ID for status polling")
  public ResponseEntity<AsyncJobResponse> startScan(@Valid @RequestBody ScanRequest request) {
    String jobId = UUID.randomUUID().toString();
    LOGGER.info("Scan request: paths={}, dryRun={}", request.paths(), request.dryRun());

    ScanJob job = new ScanJob(jobId, request);
    jobRepository.save(job);
    LOGGER.info("Created scan job: {}", jobId);

    try {
      scanJobRunner.run(job);
      return ResponseEntity.accepted().body(new AsyncJobResponse(jobId));
    } catch (Exception e) {
      LOGGER.error("Failed to start scan job: {}", jobId, e);
      job.setStatus(Status.FAILED);
      job.setError("Scan could not be queued: " + e.getMessage());
      jobRepository.save(job);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }
  }

  /**
   * Get job status.
   *
   * <p>Returns the current state of a scan job. Completed jobs include the full summary.
   */
  @GetMapping("/api/scans/{id}")
  @Operation(summary = "Get scan status", description = "Check the status of an async scan job")
  public ResponseEntity<JobStatusResponse> getScanStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(
            job ->
                ResponseEntity.ok(
                    new JobStatusResponse(
                        job.getJobId(),
                        job.getStatus(),
                        job.getProgress(),
                        job.getSummary(),
                        job.getError())))
        .orElse(ResponseEntity.notFound().build());
  }

  /** Classify one file and wait for the result. */
  @PostMapping("/api/files/classify")
  @Operation(
      summary = "Classify file",
      description = "Synchronously classify the unlabeled tracks of a single file")
  public ResponseEntity<FileReport> classifyFile(@Valid @RequestBody ClassifyFileRequest request) {
    Path file = Path.of(request.path());
    if (!Files.isRegularFile(file)) {
      return ResponseEntity.notFound().build();
    }
    FileReport report =
        request.dryRun() != null
            ? classificationService.classify(file, request.dryRun())
            : classificationService.classify(file);
    return ResponseEntity.ok(report);
  }
}
