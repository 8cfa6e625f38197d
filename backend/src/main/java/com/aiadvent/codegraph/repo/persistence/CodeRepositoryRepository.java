package com.aiadvent.codegraph.repo.persistence;

import com.aiadvent.codegraph.repo.domain.CodeRepository;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CodeRepositoryRepository extends JpaRepository<CodeRepository, UUID> {

  Optional<CodeRepository> findByRootPath(String rootPath);
}
