package com.aiadvent.codegraph.job.domain;

public enum JobStatus {
  PENDING,
  IN_PROGRESS,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
