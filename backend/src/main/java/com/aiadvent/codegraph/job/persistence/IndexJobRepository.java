package com.aiadvent.codegraph.job.persistence;

import com.aiadvent.codegraph.job.domain.IndexJob;
import com.aiadvent.codegraph.job.domain.JobStatus;
import com.aiadvent.codegraph.job.domain.JobType;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface IndexJobRepository extends JpaRepository<IndexJob, Long> {

  Optional<IndexJob> findFirstByRepositoryIdAndTypeAndStatusInOrderByIdAsc(
      UUID repositoryId, JobType type, Collection<JobStatus> statuses);

  List<IndexJob> findByRepositoryIdOrderByIdDesc(UUID repositoryId);

  /**
   * Claims the next runnable job: a pending job whose time has come, or a running job whose lock
   * is older than {@code staleBefore}. Rows locked by other claimers are skipped, and so is a
   * pending parse or entry-point detection while the same repository already runs one of that
   * type.
   */
  @Query(
      value =
          """
          SELECT j.*
          FROM index_job j
          WHERE (j.status = 'PENDING'
                 AND (j.scheduled_at IS NULL OR j.scheduled_at <= :now)
                 AND NOT (j.job_type IN ('PARSE', 'DETECT_ENTRY_POINTS')
                          AND EXISTS (SELECT 1
                                      FROM index_job r
                                      WHERE r.repository_id = j.repository_id
                                        AND r.job_type = j.job_type
                                        AND r.status = 'IN_PROGRESS')))
             OR (j.status = 'IN_PROGRESS' AND j.locked_at < :staleBefore)
          ORDER BY j.scheduled_at NULLS FIRST, j.id
          FOR UPDATE SKIP LOCKED
          LIMIT 1
          """,
      nativeQuery = true)
  Optional<IndexJob> lockNextJob(
      @Param("now") Instant now, @Param("staleBefore") Instant staleBefore);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      value =
          """
          UPDATE index_job
          SET status = 'COMPLETED', result = CAST(:result AS jsonb), completed_at = :now,
              updated_at = :now, locked_at = NULL, locked_by = NULL
          WHERE id = :id AND locked_by = :workerId AND status = 'IN_PROGRESS'
          """,
      nativeQuery = true)
  int markCompleted(
      @Param("id") Long id,
      @Param("workerId") String workerId,
      @Param("result") String result,
      @Param("now") Instant now);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      value =
          """
          UPDATE index_job
          SET status = 'PENDING', scheduled_at = :scheduledAt, last_error = CAST(:error AS jsonb),
              updated_at = :now, locked_at = NULL, locked_by = NULL
          WHERE id = :id AND locked_by = :workerId AND status = 'IN_PROGRESS'
          """,
      nativeQuery = true)
  int markForRetry(
      @Param("id") Long id,
      @Param("workerId") String workerId,
      @Param("scheduledAt") Instant scheduledAt,
      @Param("error") String error,
      @Param("now") Instant now);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      value =
          """
          UPDATE index_job
          SET status = 'FAILED', last_error = CAST(:error AS jsonb), completed_at = :now,
              updated_at = :now, locked_at = NULL, locked_by = NULL
          WHERE id = :id AND locked_by = :workerId AND status = 'IN_PROGRESS'
          """,
      nativeQuery = true)
  int markFailed(
      @Param("id") Long id,
      @Param("workerId") String workerId,
      @Param("error") String error,
      @Param("now") Instant now);
}
