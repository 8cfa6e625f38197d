package com.aiadvent.codegraph.repo.domain;

public enum RepositoryStatus {
  PENDING,
  PARSING,
  COMPLETED,
  FAILED
}
