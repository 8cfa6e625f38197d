package com.aiadvent.codegraph.entrypoint.persistence;

import com.aiadvent.codegraph.entrypoint.domain.EntryPoint;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EntryPointRepository extends JpaRepository<EntryPoint, Long> {

  List<EntryPoint> findByRepositoryIdOrderByIdAsc(UUID repositoryId);

  Optional<EntryPoint> findByIdAndRepositoryId(Long id, UUID repositoryId);

  boolean existsByRepositoryId(UUID repositoryId);

  @Modifying
  @Query("delete from EntryPoint e where e.repositoryId = :repositoryId")
  int deleteByRepositoryId(@Param("repositoryId") UUID repositoryId);
}
