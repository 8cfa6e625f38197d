package com.aiadvent.codegraph.graph.persistence;

import com.aiadvent.codegraph.graph.domain.ReferenceType;
import com.aiadvent.codegraph.graph.domain.SymbolReference;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SymbolReferenceRepository extends JpaRepository<SymbolReference, Long> {

  List<SymbolReference> findBySourceSymbolIdInOrderByIdAsc(Collection<Long> sourceSymbolIds);

  List<SymbolReference> findByRepositoryIdAndTargetQualifiedNameInOrderByIdAsc(
      UUID repositoryId, Collection<String> targetQualifiedNames);

  List<SymbolReference> findBySourceFileId(Long sourceFileId);

  List<SymbolReference> findByRepositoryIdAndReferenceType(
      UUID repositoryId, ReferenceType referenceType);

  @Modifying
  @Query("delete from SymbolReference r where r.sourceFileId = :fileId")
  int deleteBySourceFileId(@Param("fileId") Long fileId);
}
