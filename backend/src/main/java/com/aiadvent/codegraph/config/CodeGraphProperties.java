package com.aiadvent.codegraph.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.code-graph")
public class CodeGraphProperties {

  @Valid private final Retry retry = new Retry();
  @Valid private final Parsing parsing = new Parsing();
  @Valid private final Graph graph = new Graph();
  @Valid private final EntryPoints entryPoints = new EntryPoints();
  @Valid private final Flow flow = new Flow();
  @Valid private final Enrichment enrichment = new Enrichment();

  public Retry getRetry() {
    return retry;
  }

  public Parsing getParsing() {
    return parsing;
  }

  public Graph getGraph() {
    return graph;
  }

  public EntryPoints getEntryPoints() {
    return entryPoints;
  }

  public Flow getFlow() {
    return flow;
  }

  public Enrichment getEnrichment() {
    return enrichment;
  }

  /** Job retry policy. */
  public static class Retry {

    @Min(1)
    private int maxAttempts = 3;

    private Duration initialBackoff = Duration.ofSeconds(5);

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getInitialBackoff() {
      return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
      if (initialBackoff != null && !initialBackoff.isNegative()) {
        this.initialBackoff = initialBackoff;
      }
    }

    /** Delay before retry number {@code attempt}: {@code initialBackoff * 2^(attempt-1)}. */
    public Duration backoffFor(int attempt) {
      int exponent = Math.max(0, Math.min(attempt - 1, 20));
      return initialBackoff.multipliedBy(1L << exponent);
    }
  }

  public static class Parsing {

    @Min(1)
    private int maxFilesPerBatch = 100;

    @Min(1)
    private long maxFileSizeBytes = 1_000_000L;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double maxFailedFileRatio = 0.5d;

    private List<String> ignoredDirectories =
        new ArrayList<>(
            List.of(
                ".git", "node_modules", "build", "target", "dist", ".idea", "venv",
                "__pycache__"));

    public int getMaxFilesPerBatch() {
      return maxFilesPerBatch;
    }

    public void setMaxFilesPerBatch(int maxFilesPerBatch) {
      this.maxFilesPerBatch = maxFilesPerBatch;
    }

    public long getMaxFileSizeBytes() {
      return maxFileSizeBytes;
    }

    public void setMaxFileSizeBytes(long maxFileSizeBytes) {
      this.maxFileSizeBytes = maxFileSizeBytes;
    }

    public double getMaxFailedFileRatio() {
      return maxFailedFileRatio;
    }

    public void setMaxFailedFileRatio(double maxFailedFileRatio) {
      this.maxFailedFileRatio = maxFailedFileRatio;
    }

    public List<String> getIgnoredDirectories() {
      return ignoredDirectories;
    }

    public void setIgnoredDirectories(List<String> ignoredDirectories) {
      this.ignoredDirectories =
          ignoredDirectories != null ? new ArrayList<>(ignoredDirectories) : new ArrayList<>();
    }
  }

  public static class Graph {

    @Min(1)
    private int defaultMaxDepth = 5;

    @Min(1)
    private int maxAllowedDepth = 20;

    public int getDefaultMaxDepth() {
      return defaultMaxDepth;
    }

    public void setDefaultMaxDepth(int defaultMaxDepth) {
      this.defaultMaxDepth = defaultMaxDepth;
    }

    public int getMaxAllowedDepth() {
      return maxAllowedDepth;
    }

    public void setMaxAllowedDepth(int maxAllowedDepth) {
      this.maxAllowedDepth = maxAllowedDepth;
    }

    /** Applies the default to absent or non-positive depths and clamps to the allowed maximum. */
    public int effectiveDepth(Integer requested) {
      int depth = requested == null || requested <= 0 ? defaultMaxDepth : requested;
      return Math.min(depth, maxAllowedDepth);
    }
  }

  public static class EntryPoints {

    @Min(1)
    private int confirmationBatchSize = 5;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minConfidence = 0.7d;

    public int getConfirmationBatchSize() {
      return confirmationBatchSize;
    }

    public void setConfirmationBatchSize(int confirmationBatchSize) {
      this.confirmationBatchSize = confirmationBatchSize;
    }

    public double getMinConfidence() {
      return minConfidence;
    }

    public void setMinConfidence(double minConfidence) {
      this.minConfidence = minConfidence;
    }
  }

  public static class Flow {

    @Min(1)
    private int depthPerIteration = 3;

    @Min(1)
    private int maxIterations = 4;

    @Min(1)
    private int maxDepth = 12;

    @Min(1)
    private int maxSnippetLines = 80;

    public int getDepthPerIteration() {
      return depthPerIteration;
    }

    public void setDepthPerIteration(int depthPerIteration) {
      this.depthPerIteration = depthPerIteration;
    }

    public int getMaxIterations() {
      return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
      this.maxIterations = maxIterations;
    }

    public int getMaxDepth() {
      return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
      this.maxDepth = maxDepth;
    }

    public int getMaxSnippetLines() {
      return maxSnippetLines;
    }

    public void setMaxSnippetLines(int maxSnippetLines) {
      this.maxSnippetLines = maxSnippetLines;
    }
  }

  /** Limits applied to calls into the confirmation and narration collaborators. */
  public static class Enrichment {

    private Duration timeout = Duration.ofSeconds(60);
    @Valid private final CallRetry retry = new CallRetry();

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      if (timeout != null && !timeout.isNegative() && !timeout.isZero()) {
        this.timeout = timeout;
      }
    }

    public CallRetry getRetry() {
      return retry;
    }
  }

  public static class CallRetry {

    @Min(1)
    private int maxAttempts = 2;

    private Duration initialInterval = Duration.ofMillis(500);

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getInitialInterval() {
      return initialInterval;
    }

    public void setInitialInterval(Duration initialInterval) {
      if (initialInterval != null && !initialInterval.isNegative()) {
        this.initialInterval = initialInterval;
      }
    }
  }
}
