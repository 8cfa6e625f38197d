package com.aiadvent.codegraph.index;

import com.aiadvent.codegraph.repo.domain.RepositoryStatus;
import java.util.UUID;

public record IndexReport(
    UUID repositoryId,
    RepositoryStatus status,
    int totalFiles,
    int parsedFiles,
    int failedFiles,
    int unchangedFiles,
    int changedFiles,
    int addedFiles,
    int deletedFiles,
    int symbolsWritten,
    int edgesWritten) {

  public boolean noChanges() {
    return changedFiles == 0 && addedFiles == 0 && deletedFiles == 0;
  }
}
