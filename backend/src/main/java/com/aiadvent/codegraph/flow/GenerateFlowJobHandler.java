package com.aiadvent.codegraph.flow;

import com.aiadvent.codegraph.flow.domain.EntryPointFlow;
import com.aiadvent.codegraph.job.JobHandler;
import com.aiadvent.codegraph.job.domain.IndexJob;
import com.aiadvent.codegraph.job.domain.JobType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

@Component
public class GenerateFlowJobHandler implements JobHandler {

  private final FlowService flowService;
  private final ObjectMapper objectMapper;

  public GenerateFlowJobHandler(FlowService flowService, ObjectMapper objectMapper) {
    this.flowService = flowService;
    this.objectMapper = objectMapper;
  }

  @Override
  public JobType type() {
    return JobType.GENERATE_FLOW;
  }

  @Override
  public JsonNode handle(IndexJob job) {
    JsonNode entryPointId = job.getPayload() != null ? job.getPayload().get("entryPointId") : null;
    if (entryPointId == null || !entryPointId.canConvertToLong()) {
      throw new IllegalArgumentException("GENERATE_FLOW payload lacks entryPointId");
    }
    EntryPointFlow flow = flowService.buildFlow(job.getRepositoryId(), entryPointId.asLong());
    ObjectNode result = objectMapper.createObjectNode();
    result.put("flowId", flow.getId());
    result.put("entryPointId", flow.getEntryPointId());
    result.put("steps", flow.getSteps().size());
    result.put("symbolsAnalyzed", flow.getSymbolIdsAnalyzed().size());
    result.put("iterationsCompleted", flow.getIterationsCompleted());
    return result;
  }
}
