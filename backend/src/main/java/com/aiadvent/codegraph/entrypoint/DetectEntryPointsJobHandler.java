package com.aiadvent.codegraph.entrypoint;

import com.aiadvent.codegraph.job.JobHandler;
import com.aiadvent.codegraph.job.domain.IndexJob;
import com.aiadvent.codegraph.job.domain.JobType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

@Component
public class DetectEntryPointsJobHandler implements JobHandler {

  private final EntryPointService entryPointService;
  private final ObjectMapper objectMapper;

  public DetectEntryPointsJobHandler(
      EntryPointService entryPointService, ObjectMapper objectMapper) {
    this.entryPointService = entryPointService;
    this.objectMapper = objectMapper;
  }

  @Override
  public JobType type() {
    return JobType.DETECT_ENTRY_POINTS;
  }

  @Override
  public JsonNode handle(IndexJob job) {
    JsonNode payload = job.getPayload();
    boolean force = payload != null && payload.path("force").asBoolean(false);
    return objectMapper.valueToTree(entryPointService.detect(job.getRepositoryId(), force));
  }
}
