package com.aiadvent.codegraph.repo;

import com.aiadvent.codegraph.config.CodeGraphProperties;
import com.aiadvent.codegraph.repo.domain.CodeRepository;
import com.aiadvent.codegraph.repo.domain.RepositoryStatus;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import org.springframework.stereotype.Component;

/** Derives repository status and counters from file outcomes. */
@Component
public class RepositoryStatusCalculator {

  private final CodeGraphProperties properties;

  public RepositoryStatusCalculator(CodeGraphProperties properties) {
    this.properties = properties;
  }

  public RepositoryStatus statusFor(int totalFiles, int failedFiles) {
    if (totalFiles <= 0) {
      return RepositoryStatus.COMPLETED;
    }
    double ratio = (double) failedFiles / totalFiles;
    return ratio > properties.getParsing().getMaxFailedFileRatio()
        ? RepositoryStatus.FAILED
        : RepositoryStatus.COMPLETED;
  }

  public void apply(
      CodeRepository repository, int totalFiles, int failedFiles, Collection<String> languages) {
    RepositoryStatus status = statusFor(totalFiles, failedFiles);
    repository.setTotalFiles(totalFiles);
    repository.setFailedFiles(failedFiles);
    repository.setParsedFiles(totalFiles - failedFiles);
    repository.setLanguages(List.copyOf(languages));
    repository.setStatus(status);
    repository.setLastIndexedAt(Instant.now());
    repository.setLastError(
        status == RepositoryStatus.FAILED
            ? failedFiles + " of " + totalFiles + " files failed to parse"
            : null);
  }
}
