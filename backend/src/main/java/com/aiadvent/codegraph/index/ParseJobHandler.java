package com.aiadvent.codegraph.index;

import com.aiadvent.codegraph.job.JobHandler;
import com.aiadvent.codegraph.job.domain.IndexJob;
import com.aiadvent.codegraph.job.domain.JobType;
import com.aiadvent.codegraph.repo.domain.RepositoryStatus;
import com.aiadvent.codegraph.repo.persistence.CodeRepositoryRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ParseJobHandler implements JobHandler {

  private static final Logger log = LoggerFactory.getLogger(ParseJobHandler.class);

  private final RepositoryIndexService indexService;
  private final CodeRepositoryRepository repositoryRepository;
  private final ObjectMapper objectMapper;

  public ParseJobHandler(
      RepositoryIndexService indexService,
      CodeRepositoryRepository repositoryRepository,
      ObjectMapper objectMapper) {
    this.indexService = indexService;
    this.repositoryRepository = repositoryRepository;
    this.objectMapper = objectMapper;
  }

  @Override
  public JobType type() {
    return JobType.PARSE;
  }

  @Override
  public JsonNode handle(IndexJob job) {
    IndexReport report = indexService.index(job.getRepositoryId());
    return objectMapper.valueToTree(report);
  }

  @Override
  public void onPermanentFailure(IndexJob job, String errorMessage) {
    repositoryRepository
        .findById(job.getRepositoryId())
        .ifPresent(
            repository -> {
              repository.setStatus(RepositoryStatus.FAILED);
              repository.setLastError(errorMessage);
              repositoryRepository.save(repository);
              log.warn(
                  "Repository marked failed after parse job {} (repositoryId={})",
                  job.getId(),
                  repository.getId());
            });
  }
}
