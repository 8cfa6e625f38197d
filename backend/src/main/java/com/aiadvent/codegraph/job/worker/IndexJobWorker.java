package com.aiadvent.codegraph.job.worker;

import com.aiadvent.codegraph.config.IndexWorkerProperties;
import com.aiadvent.codegraph.job.JobDispatcher;
import com.aiadvent.codegraph.job.domain.IndexJob;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Tops the pool up to {@code worker-count} pull loops on every poll. Each loop claims and
 * processes jobs until the queue reports nothing runnable, then exits.
 */
@Component
@ConditionalOnProperty(
    prefix = "app.code-graph.worker",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class IndexJobWorker {

  private static final Logger log = LoggerFactory.getLogger(IndexJobWorker.class);

  private final JobDispatcher dispatcher;
  private final IndexWorkerProperties properties;
  private final MeterRegistry meterRegistry;
  private final ExecutorService executorService;
  private final String workerIdPrefix;
  private final AtomicInteger activeLoops = new AtomicInteger();

  public IndexJobWorker(
      JobDispatcher dispatcher,
      IndexWorkerProperties properties,
      MeterRegistry meterRegistry,
      @Qualifier("indexWorkerExecutor") ExecutorService executorService) {
    this.dispatcher = dispatcher;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
    this.executorService = executorService;
    this.workerIdPrefix =
        StringUtils.hasText(properties.getWorkerIdPrefix())
            ? properties.getWorkerIdPrefix()
            : resolveDefaultWorkerId();
  }

  @Scheduled(fixedDelayString = "${app.code-graph.worker.poll-delay:PT1S}")
  public void pollQueue() {
    if (!properties.isEnabled()) {
      return;
    }
    int missing = properties.getWorkerCount() - activeLoops.get();
    for (int i = 0; i < missing; i++) {
      activeLoops.incrementAndGet();
      try {
        executorService.submit(this::drainQueue);
      } catch (RejectedExecutionException ex) {
        activeLoops.decrementAndGet();
        log.debug("Worker pool rejected a pull loop: {}", ex.getMessage());
        return;
      }
    }
  }

  int activeLoops() {
    return activeLoops.get();
  }

  void drainQueue() {
    try {
      while (!Thread.currentThread().isInterrupted() && processSafely()) {
        // keep pulling while jobs are available
      }
    } finally {
      activeLoops.decrementAndGet();
    }
  }

  /** Returns whether a job was processed. */
  private boolean processSafely() {
    String workerId = workerIdPrefix + "-" + Thread.currentThread().getName();
    long start = System.nanoTime();
    String result = "empty";
    try {
      Optional<IndexJob> jobOptional = dispatcher.processNextJob(workerId);
      if (jobOptional.isPresent()) {
        result = "processed";
        log.debug("Worker {} processed job {}", workerId, jobOptional.get().getId());
        return true;
      }
      log.trace("Worker {} polled queue: no pending jobs", workerId);
      return false;
    } catch (Exception ex) {
      result = "error";
      log.error("Worker {} failed to process job", workerId, ex);
      return false;
    } finally {
      long elapsed = System.nanoTime() - start;
      meterRegistry.counter("code_graph.job.poll.count", "result", result).increment();
      meterRegistry
          .timer("code_graph.job.poll.duration", "result", result)
          .record(Duration.ofNanos(elapsed));
    }
  }

  private String resolveDefaultWorkerId() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.warn("Unable to resolve hostname for worker id, falling back to default", ex);
      return "index-worker";
    }
  }

  @PreDestroy
  public void shutdown() {
    executorService.shutdown();
    try {
      if (!executorService.awaitTermination(2, TimeUnit.SECONDS)) {
        executorService.shutdownNow();
      }
    } catch (InterruptedException interruptedException) {
      Thread.currentThread().interrupt();
      executorService.shutdownNow();
    }
  }
}
