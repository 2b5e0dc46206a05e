package com.scholary.langtag.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.notNullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.langtag.api.JobStatusResponse.Status;
import com.scholary.langtag.job.JobRepository;
import com.scholary.langtag.job.ScanJob;
import com.scholary.langtag.job.ScanJobRunner;
import com.scholary.langtag.service.FileClassificationService;
import com.scholary.langtag.service.FileReport;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class ScanControllerTest {

  @Mock private FileClassificationService classificationService;
  @Mock private ScanJobRunner scanJobRunner;

  @TempDir Path tempDir;

  private final JobRepository jobRepository = new JobRepository(10, 60);
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new ScanController(classificationService, scanJobRunner, jobRepository))
            .build();
  }

  @Test
  void startScan_shouldQueueJob() throws Exception {
    mockMvc
        .perform(
            post("/api/scans")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"paths\": [\"/media/movies\"], \"dryRun\": true}"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId", notNullValue()));

    verify(scanJobRunner).run(any(ScanJob.class));
  }

  @Test
  void startScan_shouldRejectEmptyPaths() throws Exception {
    mockMvc
        .perform(
            post("/api/scans").contentType(MediaType.APPLICATION_JSON).content("{\"paths\": []}"))
        .andExpect(status().isBadRequest());

    verify(scanJobRunner, never()).run(any(ScanJob.class));
  }

  @Test
  void startScan_shouldFailJobWhenQueueIsFull() throws Exception {
    doThrow(new TaskRejectedException("Executor queue is full"))
        .when(scanJobRunner)
        .run(any(ScanJob.class));

    mockMvc
        .perform(
            post("/api/scans")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"paths\": [\"/media/movies\"]}"))
        .andExpect(status().isInternalServerError());

    ArgumentCaptor<ScanJob> submitted = ArgumentCaptor.forClass(ScanJob.class);
    verify(scanJobRunner).run(submitted.capture());
    ScanJob stored = jobRepository.findById(submitted.getValue().getJobId()).orElseThrow();
    assertThat(stored.getStatus()).isEqualTo(Status.FAILED);
    assertThat(stored.getError()).contains("Executor queue is full");

    mockMvc
        .perform(get("/api/scans/" + stored.getJobId()))
        .andExpect(jsonPath("$.status").value("FAILED"));
  }

  @Test
  void getScanStatus_shouldReportStoredJob() throws Exception {
    jobRepository.save(new ScanJob("job-1", new ScanRequest(List.of("/media"), null)));

    mockMvc
        .perform(get("/api/scans/job-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.jobId").value("job-1"))
        .andExpect(jsonPath("$.status").value("PENDING"))
        .andExpect(jsonPath("$.progress").value(0));
  }

  @Test
  void getScanStatus_shouldReturnNotFoundForUnknownJob() throws Exception {
    mockMvc.perform(get("/api/scans/unknown")).andExpect(status().isNotFound());
  }

  @Test
  void classifyFile_shouldReturnReport() throws Exception {
    Path movie = Files.createFile(tempDir.resolve("movie.mkv"));
    when(classificationService.classify(movie, true))
        .thenReturn(FileReport.skipped(movie.toString()));

    mockMvc
        .perform(
            post("/api/files/classify")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\": \"" + movie + "\", \"dryRun\": true}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.skippedByTracker").value(true))
        .andExpect(jsonPath("$.failures", hasSize(0)));
  }

  @Test
  void classifyFile_shouldReturnNotFoundForMissingFile() throws Exception {
    mockMvc
        .perform(
            post("/api/files/classify")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\": \"" + tempDir.resolve("missing.mkv") + "\"}"))
        .andExpect(status().isNotFound());
  }
}
