package com.aiadvent.codegraph.entrypoint.persistence;

import com.aiadvent.codegraph.entrypoint.domain.EntryPointCandidate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EntryPointCandidateRepository extends JpaRepository<EntryPointCandidate, Long> {

  Optional<EntryPointCandidate> findFirstByRepositoryIdOrderByIdDesc(UUID repositoryId);

  List<EntryPointCandidate> findByRepositoryIdAndDetectionRunIdOrderByIdAsc(
      UUID repositoryId, UUID detectionRunId);
}
