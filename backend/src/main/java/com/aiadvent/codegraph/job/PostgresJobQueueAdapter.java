package com.aiadvent.codegraph.job;

import com.aiadvent.codegraph.config.CodeGraphProperties;
import com.aiadvent.codegraph.config.IndexWorkerProperties;
import com.aiadvent.codegraph.job.domain.IndexJob;
import com.aiadvent.codegraph.job.domain.JobStatus;
import com.aiadvent.codegraph.job.domain.JobType;
import com.aiadvent.codegraph.job.persistence.IndexJobRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class PostgresJobQueueAdapter implements JobQueuePort {

  private static final Logger log = LoggerFactory.getLogger(PostgresJobQueueAdapter.class);

  private final IndexJobRepository jobRepository;
  private final ObjectMapper objectMapper;
  private final CodeGraphProperties properties;
  private final IndexWorkerProperties workerProperties;

  public PostgresJobQueueAdapter(
      IndexJobRepository jobRepository,
      ObjectMapper objectMapper,
      CodeGraphProperties properties,
      IndexWorkerProperties workerProperties) {
    this.jobRepository = jobRepository;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.workerProperties = workerProperties;
  }

  @Override
  @Transactional
  public IndexJob enqueue(UUID repositoryId, JobType type, JsonNode payload) {
    IndexJob job =
        new IndexJob(
            repositoryId,
            type,
            payload != null ? payload : objectMapper.createObjectNode(),
            properties.getRetry().getMaxAttempts());
    IndexJob saved = jobRepository.save(job);
    log.info(
        "Job enqueued (jobId={}, repositoryId={}, type={})", saved.getId(), repositoryId, type);
    return saved;
  }

  /**
   * Reuses a job that has not started yet. A running job is never returned: it may already have
   * read the state the caller wants reprocessed, so a fresh pending job is queued behind it.
   */
  @Override
  @Transactional
  public IndexJob enqueueUnique(UUID repositoryId, JobType type, JsonNode payload) {
    Optional<IndexJob> queued = findPending(repositoryId, type);
    if (queued.isPresent()) {
      log.debug(
          "Job already queued (jobId={}, repositoryId={}, type={})",
          queued.get().getId(),
          repositoryId,
          type);
      return queued.get();
    }
    return enqueue(repositoryId, type, payload);
  }

  @Override
  @Transactional
  public Optional<IndexJob> lockNextPending(String workerId, Instant now) {
    Instant staleBefore = now.minus(workerProperties.getLockTimeout());
    Optional<IndexJob> jobOptional = jobRepository.lockNextJob(now, staleBefore);
    jobOptional.ifPresent(
        job -> {
          if (job.getStatus() == JobStatus.IN_PROGRESS) {
            log.warn(
                "Reclaiming stale job (jobId={}, previousOwner={}, lockedAt={})",
                job.getId(),
                job.getLockedBy(),
                job.getLockedAt());
          }
          job.setStatus(JobStatus.IN_PROGRESS);
          job.setLockedAt(now);
          job.setLockedBy(workerId);
          job.setAttempts(job.getAttempts() + 1);
          jobRepository.save(job);
        });
    return jobOptional;
  }

  @Override
  @Transactional
  public boolean complete(IndexJob job, String workerId, JsonNode result, Instant now) {
    return jobRepository.markCompleted(job.getId(), workerId, toJson(result), now) == 1;
  }

  /**
   * Puts a failed attempt back in the queue. When a newer job of the same type is already pending
   * for the repository, that job covers the retry and this one is marked failed instead.
   */
  @Override
  @Transactional
  public boolean retry(
      IndexJob job, String workerId, Instant scheduledAt, JsonNode error, Instant now) {
    Optional<IndexJob> queued = findPending(job.getRepositoryId(), job.getType());
    if (queued.isPresent()) {
      log.info(
          "Retry superseded by queued job (jobId={}, queuedJobId={})",
          job.getId(),
          queued.get().getId());
      return jobRepository.markFailed(job.getId(), workerId, toJson(error), now) == 1;
    }
    return jobRepository.markForRetry(job.getId(), workerId, scheduledAt, toJson(error), now) == 1;
  }

  @Override
  @Transactional
  public boolean fail(IndexJob job, String workerId, JsonNode error, Instant now) {
    return jobRepository.markFailed(job.getId(), workerId, toJson(error), now) == 1;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<IndexJob> find(Long jobId) {
    return jobRepository.findById(jobId);
  }

  private Optional<IndexJob> findPending(UUID repositoryId, JobType type) {
    return jobRepository.findFirstByRepositoryIdAndTypeAndStatusInOrderByIdAsc(
        repositoryId, type, EnumSet.of(JobStatus.PENDING));
  }

  private String toJson(JsonNode node) {
    if (node == null) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize job payload", ex);
    }
  }
}
