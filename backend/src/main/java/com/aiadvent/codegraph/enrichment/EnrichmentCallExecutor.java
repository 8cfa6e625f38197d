package com.aiadvent.codegraph.enrichment;

import com.aiadvent.codegraph.config.CodeGraphProperties;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

/**
 * Runs collaborator calls (entry-point confirmation, flow narration) under a timeout and the
 * enrichment retry policy. Failures that survive the retries propagate to the calling job.
 */
@Component
public class EnrichmentCallExecutor {

  private static final Logger log = LoggerFactory.getLogger(EnrichmentCallExecutor.class);

  private final ExecutorService executorService;
  private final RetryTemplate retryTemplate;
  private final Duration timeout;

  public EnrichmentCallExecutor(
      @Qualifier("enrichmentExecutor") ExecutorService executorService,
      @Qualifier("enrichmentRetryTemplate") RetryTemplate retryTemplate,
      CodeGraphProperties properties) {
    this.executorService = executorService;
    this.retryTemplate = retryTemplate;
    this.timeout = properties.getEnrichment().getTimeout();
  }

  public <T> T call(String operation, Supplier<T> call) {
    return retryTemplate.execute(
        context -> {
          if (context.getRetryCount() > 0) {
            log.warn(
                "Retrying enrichment call (operation={}, attempt={}, lastError={})",
                operation,
                context.getRetryCount() + 1,
                context.getLastThrowable() != null
                    ? context.getLastThrowable().getMessage()
                    : null);
          }
          return invokeWithTimeout(operation, call);
        });
  }

  private <T> T invokeWithTimeout(String operation, Supplier<T> call) {
    Future<T> future = executorService.submit(call::get);
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      throw new EnrichmentTimeoutException(operation, timeout);
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for " + operation, ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException("Enrichment call '" + operation + "' failed", cause);
    }
  }
}
