package com.aiadvent.codegraph.index.persistence;

import com.aiadvent.codegraph.index.domain.FileParseStatus;
import com.aiadvent.codegraph.index.domain.SourceFile;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SourceFileRepository extends JpaRepository<SourceFile, Long> {

  List<SourceFile> findByRepositoryId(UUID repositoryId);

  List<SourceFile> findByRepositoryIdAndDeletedFalseOrderByRelativePathAsc(UUID repositoryId);

  List<SourceFile> findByRepositoryIdAndDeletedFalseAndParseStatusOrderByRelativePathAsc(
      UUID repositoryId, FileParseStatus parseStatus);

  Optional<SourceFile> findByRepositoryIdAndRelativePath(UUID repositoryId, String relativePath);
}
