package com.aiadvent.codegraph.flow;

import com.aiadvent.codegraph.flow.domain.EntryPointFlow;
import com.aiadvent.codegraph.flow.persistence.EntryPointFlowRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class FlowStore {

  private final EntryPointFlowRepository flowRepository;

  public FlowStore(EntryPointFlowRepository flowRepository) {
    this.flowRepository = flowRepository;
  }

  @Transactional
  public EntryPointFlow replace(EntryPointFlow flow) {
    flowRepository.deleteByEntryPointId(flow.getEntryPointId());
    return flowRepository.save(flow);
  }
}
