package com.aiadvent.codegraph.job;

import com.aiadvent.codegraph.job.domain.IndexJob;
import com.aiadvent.codegraph.job.domain.JobType;
import com.fasterxml.jackson.databind.JsonNode;

/** Type-specific body run by the shared claim, complete and retry skeleton. */
public interface JobHandler {

  JobType type();

  /**
   * Runs the job. Any runtime exception counts as a failed attempt.
   *
   * @return result stored on the completed job, may be {@code null}
   */
  JsonNode handle(IndexJob job);

  /** Called once when the job fails for the last time. */
  default void onPermanentFailure(IndexJob job, String errorMessage) {}
}
