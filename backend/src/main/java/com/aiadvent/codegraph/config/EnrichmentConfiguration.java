package com.aiadvent.codegraph.config;

import com.aiadvent.codegraph.enrichment.HeuristicEntryPointConfirmer;
import com.aiadvent.codegraph.enrichment.HeuristicFlowNarrator;
import com.aiadvent.codegraph.entrypoint.EntryPointConfirmer;
import com.aiadvent.codegraph.flow.FlowNarrator;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

/**
 * Wiring for the confirmation and narration collaborators. The heuristic implementations are
 * fallbacks; any other bean of the same type replaces them.
 */
@Configuration
public class EnrichmentConfiguration {

  private static final int ENRICHMENT_THREADS = 4;

  @Bean(name = "enrichmentExecutor", destroyMethod = "shutdownNow")
  public ExecutorService enrichmentExecutor() {
    return Executors.newFixedThreadPool(
        ENRICHMENT_THREADS, IndexWorkerConfiguration.daemonThreads("enrichment-"));
  }

  @Bean(name = "enrichmentRetryTemplate")
  public RetryTemplate enrichmentRetryTemplate(CodeGraphProperties properties) {
    CodeGraphProperties.CallRetry retry = properties.getEnrichment().getRetry();
    long initialInterval = Math.max(1L, retry.getInitialInterval().toMillis());
    return RetryTemplate.builder()
        .maxAttempts(retry.getMaxAttempts())
        .exponentialBackoff(initialInterval, 2.0, initialInterval * 8)
        .retryOn(RuntimeException.class)
        .traversingCauses()
        .build();
  }

  @Bean
  @ConditionalOnMissingBean(EntryPointConfirmer.class)
  public EntryPointConfirmer heuristicEntryPointConfirmer() {
    return new HeuristicEntryPointConfirmer();
  }

  @Bean
  @ConditionalOnMissingBean(FlowNarrator.class)
  public FlowNarrator heuristicFlowNarrator() {
    return new HeuristicFlowNarrator();
  }
}
