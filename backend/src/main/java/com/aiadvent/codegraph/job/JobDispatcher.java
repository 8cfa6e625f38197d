package com.aiadvent.codegraph.job;

import com.aiadvent.codegraph.config.CodeGraphProperties;
import com.aiadvent.codegraph.job.domain.IndexJob;
import com.aiadvent.codegraph.job.domain.JobType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Claims one job and drives it through its handler. Completion and failure are conditional on
 * still owning the lock, so a worker whose lock was reaped never overwrites the new owner.
 */
@Service
public class JobDispatcher {

  private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

  private final JobQueuePort jobQueue;
  private final Map<JobType, JobHandler> handlers = new EnumMap<>(JobType.class);
  private final CodeGraphProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @Autowired
  public JobDispatcher(
      JobQueuePort jobQueue,
      List<JobHandler> handlers,
      CodeGraphProperties properties,
      ObjectMapper objectMapper) {
    this(jobQueue, handlers, properties, objectMapper, Clock.systemUTC());
  }

  JobDispatcher(
      JobQueuePort jobQueue,
      List<JobHandler> handlers,
      CodeGraphProperties properties,
      ObjectMapper objectMapper,
      Clock clock) {
    this.jobQueue = jobQueue;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.clock = clock;
    for (JobHandler handler : handlers) {
      if (this.handlers.put(handler.type(), handler) != null) {
        throw new IllegalStateException("Duplicate job handler for " + handler.type());
      }
    }
  }

  public Optional<IndexJob> processNextJob(String workerId) {
    Optional<IndexJob> claimed = jobQueue.lockNextPending(workerId, clock.instant());
    if (claimed.isEmpty()) {
      return Optional.empty();
    }
    IndexJob job = claimed.get();
    JobHandler handler = handlers.get(job.getType());
    if (handler == null) {
      failPermanently(job, workerId, null, "No handler for job type " + job.getType(), "Config");
      return claimed;
    }
    if (job.getAttempts() > job.getMaxAttempts()) {
      log.error(
          "Reclaimed job is past its attempt limit (jobId={}, attempts={})",
          job.getId(),
          job.getAttempts());
      failPermanently(
          job,
          workerId,
          handler,
          "Attempt limit " + job.getMaxAttempts() + " exceeded",
          "AttemptsExhausted");
      return claimed;
    }

    log.info(
        "Job started (jobId={}, type={}, repositoryId={}, attempt={}/{})",
        job.getId(),
        job.getType(),
        job.getRepositoryId(),
        job.getAttempts(),
        job.getMaxAttempts());
    JsonNode result;
    try {
      result = handler.handle(job);
    } catch (RuntimeException ex) {
      handleFailure(job, workerId, handler, ex);
      return claimed;
    }
    if (jobQueue.complete(job, workerId, result, clock.instant())) {
      log.info("Job completed (jobId={}, type={})", job.getId(), job.getType());
    } else {
      log.warn("Job lock lost before completion (jobId={}, workerId={})", job.getId(), workerId);
    }
    return claimed;
  }

  private void handleFailure(
      IndexJob job, String workerId, JobHandler handler, RuntimeException ex) {
    String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    if (job.getAttempts() < job.getMaxAttempts()) {
      Instant now = clock.instant();
      Instant nextAttempt = now.plus(properties.getRetry().backoffFor(job.getAttempts()));
      boolean updated =
          jobQueue.retry(
              job, workerId, nextAttempt, error(message, ex.getClass().getSimpleName()), now);
      log.warn(
          "Job attempt failed, retry scheduled (jobId={}, attempt={}/{}, nextAttemptAt={},"
              + " lockHeld={}): {}",
          job.getId(),
          job.getAttempts(),
          job.getMaxAttempts(),
          nextAttempt,
          updated,
          message);
      return;
    }
    log.error(
        "Job failed permanently (jobId={}, type={}, attempts={})",
        job.getId(),
        job.getType(),
        job.getAttempts(),
        ex);
    failPermanently(job, workerId, handler, message, ex.getClass().getSimpleName());
  }

  private void failPermanently(
      IndexJob job, String workerId, JobHandler handler, String message, String type) {
    boolean updated = jobQueue.fail(job, workerId, error(message, type), clock.instant());
    if (!updated) {
      log.warn("Job lock lost before failure (jobId={}, workerId={})", job.getId(), workerId);
      return;
    }
    if (handler != null) {
      handler.onPermanentFailure(job, message);
    }
  }

  private ObjectNode error(String message, String type) {
    ObjectNode error = objectMapper.createObjectNode();
    error.put("message", message);
    error.put("type", type);
    return error;
  }
}
