package com.aiadvent.codegraph.job;

import static com.aiadvent.codegraph.support.TestSymbols.REPOSITORY_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.aiadvent.codegraph.config.CodeGraphProperties;
import com.aiadvent.codegraph.config.IndexWorkerProperties;
import com.aiadvent.codegraph.job.domain.IndexJob;
import com.aiadvent.codegraph.job.domain.JobStatus;
import com.aiadvent.codegraph.job.domain.JobType;
import com.aiadvent.codegraph.job.persistence.IndexJobRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class PostgresJobQueueAdapterTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
  private static final String WORKER = "worker-1";

  @Mock private IndexJobRepository jobRepository;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private PostgresJobQueueAdapter jobQueue;

  @BeforeEach
  void setUp() {
    jobQueue =
        new PostgresJobQueueAdapter(
            jobRepository, objectMapper, new CodeGraphProperties(), new IndexWorkerProperties());
  }

  @Test
  void queuesNewJobWhenNothingIsPending() {
    when(jobRepository.findFirstByRepositoryIdAndTypeAndStatusInOrderByIdAsc(
            REPOSITORY_ID, JobType.PARSE, EnumSet.of(JobStatus.PENDING)))
        .thenReturn(Optional.empty());
    when(jobRepository.save(any(IndexJob.class)))
        .thenAnswer(
            invocation -> {
              IndexJob saved = invocation.getArgument(0);
              ReflectionTestUtils.setField(saved, "id", 8L);
              return saved;
            });

    IndexJob queued = jobQueue.enqueueUnique(REPOSITORY_ID, JobType.PARSE, null);

    assertThat(queued.getId()).isEqualTo(8L);
    assertThat(queued.getStatus()).isEqualTo(JobStatus.PENDING);
    assertThat(queued.getRepositoryId()).isEqualTo(REPOSITORY_ID);
  }

  @Test
  void runningParseIsNeverReturnedForReparse() {
    IndexJob running = job(7L, JobStatus.IN_PROGRESS);
    when(jobRepository.findFirstByRepositoryIdAndTypeAndStatusInOrderByIdAsc(
            eq(REPOSITORY_ID), eq(JobType.PARSE), any()))
        .thenAnswer(
            invocation ->
                invocation.<Collection<JobStatus>>getArgument(2)
                        .contains(JobStatus.IN_PROGRESS)
                    ? Optional.of(running)
                    : Optional.empty());
    when(jobRepository.save(any(IndexJob.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));

    IndexJob queued = jobQueue.enqueueUnique(REPOSITORY_ID, JobType.PARSE, null);

    assertThat(queued).isNotSameAs(running);
    assertThat(queued.getStatus()).isEqualTo(JobStatus.PENDING);
    verify(jobRepository).save(queued);
  }

  @Test
  void pendingParseIsReused() {
    IndexJob pending = job(9L, JobStatus.PENDING);
    when(jobRepository.findFirstByRepositoryIdAndTypeAndStatusInOrderByIdAsc(
            REPOSITORY_ID, JobType.PARSE, EnumSet.of(JobStatus.PENDING)))
        .thenReturn(Optional.of(pending));

    IndexJob queued = jobQueue.enqueueUnique(REPOSITORY_ID, JobType.PARSE, null);

    assertThat(queued).isSameAs(pending);
    verify(jobRepository, never()).save(any());
  }

  @Test
  void retryIsDroppedWhenNewerJobIsQueued() {
    IndexJob running = job(7L, JobStatus.IN_PROGRESS);
    when(jobRepository.findFirstByRepositoryIdAndTypeAndStatusInOrderByIdAsc(
            REPOSITORY_ID, JobType.PARSE, EnumSet.of(JobStatus.PENDING)))
        .thenReturn(Optional.of(job(9L, JobStatus.PENDING)));
    when(jobRepository.markFailed(eq(7L), eq(WORKER), anyString(), eq(NOW))).thenReturn(1);

    boolean updated =
        jobQueue.retry(
            running,
            WORKER,
            NOW.plusSeconds(5),
            objectMapper.createObjectNode().put("message", "disk busy"),
            NOW);

    assertThat(updated).isTrue();
    verify(jobRepository, never()).markForRetry(any(), any(), any(), any(), any());
  }

  @Test
  void retryReschedulesWhenNothingElseIsQueued() {
    IndexJob running = job(7L, JobStatus.IN_PROGRESS);
    when(jobRepository.findFirstByRepositoryIdAndTypeAndStatusInOrderByIdAsc(
            REPOSITORY_ID, JobType.PARSE, EnumSet.of(JobStatus.PENDING)))
        .thenReturn(Optional.empty());
    Instant nextAttempt = NOW.plusSeconds(5);
    when(jobRepository.markForRetry(eq(7L), eq(WORKER), eq(nextAttempt), anyString(), eq(NOW)))
        .thenReturn(1);

    boolean updated =
        jobQueue.retry(
            running,
            WORKER,
            nextAttempt,
            objectMapper.createObjectNode().put("message", "disk busy"),
            NOW);

    assertThat(updated).isTrue();
    ArgumentCaptor<String> error = ArgumentCaptor.forClass(String.class);
    verify(jobRepository)
        .markForRetry(eq(7L), eq(WORKER), eq(nextAttempt), error.capture(), eq(NOW));
    assertThat(error.getValue()).contains("disk busy");
    verify(jobRepository, never()).markFailed(any(), any(), any(), any());
  }

  private static IndexJob job(Long id, JobStatus status) {
    IndexJob job = new IndexJob(REPOSITORY_ID, JobType.PARSE, null, 3);
    ReflectionTestUtils.setField(job, "id", id);
    job.setStatus(status);
    return job;
  }
}
