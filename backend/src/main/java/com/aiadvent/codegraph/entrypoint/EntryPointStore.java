package com.aiadvent.codegraph.entrypoint;

import com.aiadvent.codegraph.entrypoint.domain.EntryPoint;
import com.aiadvent.codegraph.entrypoint.persistence.EntryPointRepository;
import com.aiadvent.codegraph.flow.persistence.EntryPointFlowRepository;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class EntryPointStore {

  private static final Logger log = LoggerFactory.getLogger(EntryPointStore.class);

  private final EntryPointRepository entryPointRepository;
  private final EntryPointFlowRepository flowRepository;

  public EntryPointStore(
      EntryPointRepository entryPointRepository, EntryPointFlowRepository flowRepository) {
    this.entryPointRepository = entryPointRepository;
    this.flowRepository = flowRepository;
  }

  /** Swaps the repository's entry points, and drops their flows, in one transaction. */
  @Transactional
  public List<EntryPoint> replace(UUID repositoryId, List<EntryPoint> entryPoints) {
    int flows = flowRepository.deleteByRepositoryId(repositoryId);
    int removed = entryPointRepository.deleteByRepositoryId(repositoryId);
    List<EntryPoint> saved = entryPointRepository.saveAll(entryPoints);
    log.info(
        "Entry points replaced (repositoryId={}, removed={}, removedFlows={}, saved={})",
        repositoryId,
        removed,
        flows,
        saved.size());
    return saved;
  }
}
