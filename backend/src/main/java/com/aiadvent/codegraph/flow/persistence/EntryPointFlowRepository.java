package com.aiadvent.codegraph.flow.persistence;

import com.aiadvent.codegraph.flow.domain.EntryPointFlow;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EntryPointFlowRepository extends JpaRepository<EntryPointFlow, Long> {

  Optional<EntryPointFlow> findByRepositoryIdAndEntryPointId(UUID repositoryId, Long entryPointId);

  @Modifying
  @Query("delete from EntryPointFlow f where f.entryPointId = :entryPointId")
  int deleteByEntryPointId(@Param("entryPointId") Long entryPointId);

  @Modifying
  @Query("delete from EntryPointFlow f where f.repositoryId = :repositoryId")
  int deleteByRepositoryId(@Param("repositoryId") UUID repositoryId);
}
