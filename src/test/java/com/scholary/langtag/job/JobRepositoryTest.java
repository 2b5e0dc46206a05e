package com.scholary.langtag.job;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.langtag.api.JobStatusResponse.Status;
import com.scholary.langtag.api.ScanRequest;
import java.util.List;
import org.junit.jupiter.api.Test;

class JobRepositoryTest {

  private final JobRepository repository = new JobRepository(100, 60);

  @Test
  void findById_shouldReturnSavedJob() {
    ScanJob job = new ScanJob("job-1", new ScanRequest(List.of("/media"), null));
    repository.save(job);

    assertThat(repository.findById("job-1")).containsSame(job);
    assertThat(job.getStatus()).isEqualTo(Status.PENDING);
    assertThat(job.getProgress()).isZero();
  }

  @Test
  void findById_shouldBeEmptyForUnknownOrDeletedJob() {
    repository.save(new ScanJob("job-1", new ScanRequest(List.of("/media"), true)));
    repository.delete("job-1");

    assertThat(repository.findById("job-1")).isEmpty();
    assertThat(repository.findById("missing")).isEmpty();
  }
}
