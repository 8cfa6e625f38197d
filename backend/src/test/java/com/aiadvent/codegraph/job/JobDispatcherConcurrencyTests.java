package com.aiadvent.codegraph.job;

import static org.assertj.core.api.Assertions.assertThat;

import com.aiadvent.codegraph.job.domain.IndexJob;
import com.aiadvent.codegraph.job.domain.JobStatus;
import com.aiadvent.codegraph.job.domain.JobType;
import com.aiadvent.codegraph.job.persistence.IndexJobRepository;
import com.aiadvent.codegraph.query.CodeGraphQueryService;
import com.aiadvent.codegraph.repo.RepositoryRegistrationService.Registration;
import com.aiadvent.codegraph.repo.domain.RepositoryStatus;
import com.aiadvent.codegraph.support.PostgresTestContainer;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class JobDispatcherConcurrencyTests extends PostgresTestContainer {

  private static final int WORKERS = 3;
  private static final int REPOSITORIES = 6;

  @Autowired private CodeGraphQueryService queryService;

  @Autowired private JobDispatcher jobDispatcher;

  @Autowired private IndexJobRepository jobRepository;

  @Autowired private JobQueuePort jobQueue;

  @Autowired private ObjectMapper objectMapper;

  @TempDir Path checkouts;

  @Test
  void concurrentWorkersClaimEachJobOnce() throws Exception {
    List<UUID> repositoryIds = new ArrayList<>();
    List<Long> jobIds = new ArrayList<>();
    for (int i = 0; i < REPOSITORIES; i++) {
      Path root = checkouts.resolve("repo-" + i);
      write(root, "src/main/java/shop/Service" + i + ".java", service(i));
      Registration registration = queryService.registerRepository("shop-" + i, root.toString());
      repositoryIds.add(registration.repository().getId());
      jobIds.add(registration.job().getId());
    }

    ConcurrentLinkedQueue<Long> claimed = new ConcurrentLinkedQueue<>();
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(WORKERS);
    try {
      List<Future<Integer>> results = new ArrayList<>();
      for (int w = 0; w < WORKERS; w++) {
        String workerId = "drain-" + w;
        Callable<Integer> drain =
            () -> {
              start.await();
              int processed = 0;
              Optional<IndexJob> job;
              while ((job = jobDispatcher.processNextJob(workerId)).isPresent()) {
                claimed.add(job.get().getId());
                processed++;
              }
              return processed;
            };
        results.add(executor.submit(drain));
      }
      start.countDown();
      for (Future<Integer> result : results) {
        result.get(2, TimeUnit.MINUTES);
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(claimed).doesNotHaveDuplicates().containsAll(jobIds);
    for (int i = 0; i < REPOSITORIES; i++) {
      UUID repositoryId = repositoryIds.get(i);
      List<IndexJob> jobs = jobRepository.findByRepositoryIdOrderByIdDesc(repositoryId);
      assertThat(jobs).hasSize(1);
      IndexJob job = jobs.get(0);
      assertThat(job.getId()).isEqualTo(jobIds.get(i));
      assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
      assertThat(job.getAttempts()).isEqualTo(1);
      assertThat(job.getCompletedAt()).isNotNull();
      assertThat(queryService.getRepository(repositoryId).getStatus())
          .isEqualTo(RepositoryStatus.COMPLETED);
    }
  }

  @Test
  void pendingReparseWaitsForRunningParse() throws IOException {
    Path root = checkouts.resolve("busy");
    write(root, "src/main/java/shop/Busy.java", service(99));
    Registration registration = queryService.registerRepository("busy", root.toString());
    UUID repositoryId = registration.repository().getId();
    Long firstId = registration.job().getId();

    Instant now = Instant.now();
    IndexJob running = claimUntil(firstId, "parse-1", now);
    IndexJob reparse = queryService.requestReparse(repositoryId);

    assertThat(reparse.getId()).isNotEqualTo(running.getId());
    assertThat(reparse.getStatus()).isEqualTo(JobStatus.PENDING);
    assertThat(queryService.requestReparse(repositoryId).getId()).isEqualTo(reparse.getId());

    Optional<IndexJob> next;
    while ((next = jobQueue.lockNextPending("parse-2", now)).isPresent()) {
      assertThat(next.get().getId()).isNotEqualTo(reparse.getId());
      jobQueue.complete(next.get(), "parse-2", objectMapper.createObjectNode(), now);
    }
    assertThat(jobRepository.findById(reparse.getId()))
        .get()
        .extracting(IndexJob::getStatus)
        .isEqualTo(JobStatus.PENDING);

    jobQueue.complete(running, "parse-1", objectMapper.createObjectNode(), now);
    IndexJob claimed = claimUntil(reparse.getId(), "parse-3", now);
    assertThat(claimed.getType()).isEqualTo(JobType.PARSE);
    assertThat(claimed.getRepositoryId()).isEqualTo(repositoryId);
  }

  private IndexJob claimUntil(Long jobId, String workerId, Instant now) {
    Optional<IndexJob> next;
    while ((next = jobQueue.lockNextPending(workerId, now)).isPresent()) {
      if (next.get().getId().equals(jobId)) {
        return next.get();
      }
      jobQueue.complete(next.get(), workerId, objectMapper.createObjectNode(), now);
    }
    throw new AssertionError("Job " + jobId + " was never claimed");
  }

  private static String service(int index) {
    return "package shop;\n\npublic class Service"
        + index
        + " {\n  public String run() {\n    return helper();\n  }\n\n"
        + "  private String helper() {\n    return \"ok\";\n  }\n}\n";
  }

  private static void write(Path root, String relativePath, String content) throws IOException {
    Path file = root.resolve(relativePath);
    Files.createDirectories(file.getParent());
    Files.writeString(file, content, StandardCharsets.UTF_8);
  }
}
