package com.aiadvent.codegraph.graph.persistence;

import com.aiadvent.codegraph.graph.domain.CodeSymbol;
import com.aiadvent.codegraph.parser.model.SymbolKind;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CodeSymbolRepository extends JpaRepository<CodeSymbol, Long> {

  List<CodeSymbol> findByRepositoryId(UUID repositoryId);

  List<CodeSymbol> findByFileIdOrderByIdAsc(Long fileId);

  Optional<CodeSymbol> findByIdAndRepositoryId(Long id, UUID repositoryId);

  List<CodeSymbol> findByRepositoryIdAndQualifiedNameIn(
      UUID repositoryId, Collection<String> qualifiedNames);

  List<CodeSymbol> findByRepositoryIdAndNameOrderByQualifiedNameAsc(UUID repositoryId, String name);

  List<CodeSymbol> findByRepositoryIdOrderByQualifiedNameAsc(UUID repositoryId, Pageable pageable);

  List<CodeSymbol> findByRepositoryIdAndKindOrderByQualifiedNameAsc(
      UUID repositoryId, SymbolKind kind, Pageable pageable);

  /** Substring match; {@code query} must already have LIKE wildcards escaped with a backslash. */
  @Query(
      """
      select s from CodeSymbol s
      where s.repositoryId = :repositoryId
        and (lower(s.name) like lower(concat('%', :query, '%')) escape '\\'
          or lower(s.qualifiedName) like lower(concat('%', :query, '%')) escape '\\')
      order by s.qualifiedName
      """)
  List<CodeSymbol> search(
      @Param("repositoryId") UUID repositoryId, @Param("query") String query, Pageable pageable);

  @Modifying
  @Query("delete from CodeSymbol s where s.fileId = :fileId")
  int deleteByFileId(@Param("fileId") Long fileId);
}
