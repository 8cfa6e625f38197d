package com.aiadvent.codegraph.repo;

import com.aiadvent.codegraph.common.exception.CodeGraphNotFoundException;
import com.aiadvent.codegraph.job.JobQueuePort;
import com.aiadvent.codegraph.job.domain.IndexJob;
import com.aiadvent.codegraph.job.domain.JobType;
import com.aiadvent.codegraph.repo.domain.CodeRepository;
import com.aiadvent.codegraph.repo.persistence.CodeRepositoryRepository;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/** Registers checkouts and queues their parse jobs, reusing a parse job that has not started. */
@Service
public class RepositoryRegistrationService {

  private static final Logger log = LoggerFactory.getLogger(RepositoryRegistrationService.class);

  private final CodeRepositoryRepository repositoryRepository;
  private final JobQueuePort jobQueue;

  public RepositoryRegistrationService(
      CodeRepositoryRepository repositoryRepository, JobQueuePort jobQueue) {
    this.repositoryRepository = repositoryRepository;
    this.jobQueue = jobQueue;
  }

  @Transactional
  public Registration register(String name, String rootPath) {
    if (!StringUtils.hasText(name)) {
      throw new IllegalArgumentException("Repository name must not be blank");
    }
    if (!StringUtils.hasText(rootPath)) {
      throw new IllegalArgumentException("Repository root path must not be blank");
    }
    Path root = Path.of(rootPath.trim()).toAbsolutePath().normalize();
    if (!Files.isDirectory(root)) {
      throw new IllegalArgumentException("Repository root is not a directory: " + root);
    }
    CodeRepository repository =
        repositoryRepository
            .findByRootPath(root.toString())
            .orElseGet(
                () -> {
                  CodeRepository created =
                      repositoryRepository.save(new CodeRepository(name.trim(), root.toString()));
                  log.info(
                      "Repository registered (repositoryId={}, name={}, root={})",
                      created.getId(),
                      created.getName(),
                      root);
                  return created;
                });
    IndexJob job = jobQueue.enqueueUnique(repository.getId(), JobType.PARSE, null);
    return new Registration(repository, job);
  }

  @Transactional
  public IndexJob requestReparse(UUID repositoryId) {
    CodeRepository repository =
        repositoryRepository
            .findById(repositoryId)
            .orElseThrow(() -> CodeGraphNotFoundException.of("Repository", repositoryId));
    log.info("Reparse requested (repositoryId={})", repository.getId());
    return jobQueue.enqueueUnique(repository.getId(), JobType.PARSE, null);
  }

  public record Registration(CodeRepository repository, IndexJob job) {}
}
