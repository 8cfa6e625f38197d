package com.aiadvent.codegraph.config;

import jakarta.validation.constraints.Min;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.code-graph.worker")
public class IndexWorkerProperties {

  private boolean enabled = true;
  private Duration pollDelay = Duration.ofSeconds(1);

  @Min(1)
  private int workerCount = 4;

  private String workerIdPrefix;

  /** IN_PROGRESS jobs locked longer than this are reclaimed by the next poll. */
  private Duration lockTimeout = Duration.ofMinutes(10);

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public Duration getPollDelay() {
    return pollDelay;
  }

  public void setPollDelay(Duration pollDelay) {
    if (pollDelay != null && !pollDelay.isNegative() && !pollDelay.isZero()) {
      this.pollDelay = pollDelay;
    }
  }

  public int getWorkerCount() {
    return Math.max(1, workerCount);
  }

  public void setWorkerCount(int workerCount) {
    this.workerCount = Math.max(1, workerCount);
  }

  public String getWorkerIdPrefix() {
    return workerIdPrefix;
  }

  public void setWorkerIdPrefix(String workerIdPrefix) {
    this.workerIdPrefix = workerIdPrefix;
  }

  public Duration getLockTimeout() {
    return lockTimeout;
  }

  public void setLockTimeout(Duration lockTimeout) {
    if (lockTimeout != null && !lockTimeout.isNegative() && !lockTimeout.isZero()) {
      this.lockTimeout = lockTimeout;
    }
  }
}
