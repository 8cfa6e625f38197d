package com.aiadvent.codegraph.job;

import com.aiadvent.codegraph.job.domain.IndexJob;
import com.aiadvent.codegraph.job.domain.JobType;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface JobQueuePort {

  IndexJob enqueue(UUID repositoryId, JobType type, JsonNode payload);

  /** Enqueues unless a pending or running job of the same type exists for the repository. */
  IndexJob enqueueUnique(UUID repositoryId, JobType type, JsonNode payload);

  Optional<IndexJob> lockNextPending(String workerId, Instant now);

  boolean complete(IndexJob job, String workerId, JsonNode result, Instant now);

  boolean retry(IndexJob job, String workerId, Instant scheduledAt, JsonNode error, Instant now);

  boolean fail(IndexJob job, String workerId, JsonNode error, Instant now);

  Optional<IndexJob> find(Long jobId);
}
