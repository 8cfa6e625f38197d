package com.aiadvent.codegraph.index;

import static com.aiadvent.codegraph.support.TestSymbols.REPOSITORY_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.aiadvent.codegraph.config.CodeGraphProperties;
import com.aiadvent.codegraph.graph.GraphWriter;
import com.aiadvent.codegraph.graph.GraphWriter.WriteSummary;
import com.aiadvent.codegraph.graph.persistence.CodeSymbolRepository;
import com.aiadvent.codegraph.index.domain.FileParseStatus;
import com.aiadvent.codegraph.index.domain.SourceFile;
import com.aiadvent.codegraph.index.persistence.SourceFileRepository;
import com.aiadvent.codegraph.parser.model.Language;
import com.aiadvent.codegraph.repo.RepositoryStatusCalculator;
import com.aiadvent.codegraph.repo.domain.CodeRepository;
import com.aiadvent.codegraph.repo.domain.RepositoryStatus;
import com.aiadvent.codegraph.repo.persistence.CodeRepositoryRepository;
import com.aiadvent.codegraph.resolve.ResolvedFile;
import com.aiadvent.codegraph.resolve.SymbolResolver;
import com.aiadvent.codegraph.support.TestParsers;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RepositoryIndexServiceTest {

  @Mock private CodeRepositoryRepository repositoryRepository;
  @Mock private SourceFileRepository sourceFileRepository;
  @Mock private CodeSymbolRepository symbolRepository;
  @Mock private FileDiscoveryService discoveryService;
  @Mock private GraphWriter graphWriter;

  private CodeGraphProperties properties;
  private SimpleMeterRegistry meterRegistry;
  private CodeRepository repository;
  private RepositoryIndexService indexService;

  @BeforeEach
  void setUp() {
    properties = new CodeGraphProperties();
    properties.getParsing().setMaxFilesPerBatch(30);
    meterRegistry = new SimpleMeterRegistry();
    repository = new CodeRepository("shop", "/srv/shop");
    repository.setStatus(RepositoryStatus.PENDING);
    indexService =
        new RepositoryIndexService(
            repositoryRepository,
            sourceFileRepository,
            symbolRepository,
            discoveryService,
            new ChangeDetector(),
            TestParsers.sourceParser(),
            new SymbolResolver(),
            graphWriter,
            new RepositoryStatusCalculator(properties),
            properties,
            meterRegistry);
    when(repositoryRepository.findById(REPOSITORY_ID)).thenReturn(Optional.of(repository));
  }

  @Test
  void hundredFilesWithThreeFailuresStillComplete() {
    when(discoveryService.discover(Path.of("/srv/shop"))).thenReturn(pythonFiles(100, 3));
    when(sourceFileRepository.findByRepositoryId(REPOSITORY_ID)).thenReturn(List.of());
    givenGraphWriterAcceptsFiles();

    IndexReport report = indexService.index(REPOSITORY_ID);

    assertThat(report.status()).isEqualTo(RepositoryStatus.COMPLETED);
    assertThat(report.totalFiles()).isEqualTo(100);
    assertThat(report.parsedFiles()).isEqualTo(97);
    assertThat(report.failedFiles()).isEqualTo(3);
    assertThat(report.addedFiles()).isEqualTo(100);
    assertThat(report.symbolsWritten()).isGreaterThan(0);
    assertThat(repository.getLanguages()).containsExactly("python");
    assertThat(repository.getLastError()).isNull();

    ArgumentCaptor<SourceFile> written = ArgumentCaptor.forClass(SourceFile.class);
    verify(graphWriter, times(100)).replaceFile(written.capture(), any());
    assertThat(written.getAllValues())
        .filteredOn(file -> file.getParseStatus() == FileParseStatus.FAILED)
        .extracting(SourceFile::getRelativePath)
        .containsExactly("pkg/module_000.py", "pkg/module_001.py", "pkg/module_002.py");
    assertThat(written.getAllValues())
        .filteredOn(file -> file.getParseStatus() == FileParseStatus.FAILED)
        .allSatisfy(file -> assertThat(file.getParseError()).isNotBlank());
    assertThat(meterRegistry.counter("code_graph_files_failed_total").count()).isEqualTo(3.0d);
  }

  @Test
  void failureRatioAboveThresholdFailsRepository() {
    properties.getParsing().setMaxFailedFileRatio(0.02d);
    when(discoveryService.discover(Path.of("/srv/shop"))).thenReturn(pythonFiles(100, 3));
    when(sourceFileRepository.findByRepositoryId(REPOSITORY_ID)).thenReturn(List.of());
    givenGraphWriterAcceptsFiles();

    IndexReport report = indexService.index(REPOSITORY_ID);

    assertThat(report.status()).isEqualTo(RepositoryStatus.FAILED);
    assertThat(repository.getLastError()).isEqualTo("3 of 100 files failed to parse");
  }

  @Test
  void unchangedTreeSkipsParsingAndWriting() {
    List<DiscoveredFile> files = pythonFiles(2, 0);
    List<SourceFile> stored = new ArrayList<>();
    for (DiscoveredFile file : files) {
      SourceFile row = new SourceFile(REPOSITORY_ID, file.relativePath(), "python");
      row.setContentHash(file.contentHash());
      row.setParseStatus(FileParseStatus.PARSED);
      stored.add(row);
    }
    when(discoveryService.discover(Path.of("/srv/shop"))).thenReturn(files);
    when(sourceFileRepository.findByRepositoryId(REPOSITORY_ID)).thenReturn(stored);

    IndexReport report = indexService.index(REPOSITORY_ID);

    assertThat(report.noChanges()).isTrue();
    assertThat(report.unchangedFiles()).isEqualTo(2);
    assertThat(report.status()).isEqualTo(RepositoryStatus.COMPLETED);
    verify(graphWriter, never()).replaceFile(any(), any());
    verify(repositoryRepository, atLeastOnce()).save(repository);
  }

  @Test
  void deletedFilesAreReleased() {
    SourceFile gone = new SourceFile(REPOSITORY_ID, "pkg/old.py", "python");
    gone.setContentHash("old");
    when(discoveryService.discover(Path.of("/srv/shop"))).thenReturn(List.of());
    when(sourceFileRepository.findByRepositoryId(REPOSITORY_ID)).thenReturn(List.of(gone));

    IndexReport report = indexService.index(REPOSITORY_ID);

    assertThat(report.deletedFiles()).isEqualTo(1);
    assertThat(report.totalFiles()).isZero();
    verify(graphWriter).releaseFile(gone, true);
  }

  @Test
  void changedFileIsReplacedWithoutSeparateRelease() {
    List<DiscoveredFile> files = pythonFiles(1, 0);
    SourceFile stored = new SourceFile(REPOSITORY_ID, files.get(0).relativePath(), "python");
    stored.setContentHash("stale");
    stored.setParseStatus(FileParseStatus.PARSED);
    when(discoveryService.discover(Path.of("/srv/shop"))).thenReturn(files);
    when(sourceFileRepository.findByRepositoryId(REPOSITORY_ID)).thenReturn(List.of(stored));
    givenGraphWriterAcceptsFiles();

    IndexReport report = indexService.index(REPOSITORY_ID);

    assertThat(report.changedFiles()).isEqualTo(1);
    verify(graphWriter, never()).releaseFile(any(), anyBoolean());
    ArgumentCaptor<SourceFile> written = ArgumentCaptor.forClass(SourceFile.class);
    verify(graphWriter).replaceFile(written.capture(), any());
    assertThat(written.getValue()).isSameAs(stored);
    assertThat(written.getValue().getContentHash()).isEqualTo(files.get(0).contentHash());
  }

  private void givenGraphWriterAcceptsFiles() {
    when(graphWriter.replaceFile(any(SourceFile.class), any()))
        .thenAnswer(
            invocation -> {
              ResolvedFile resolved = invocation.getArgument(1);
              return resolved == null
                  ? new WriteSummary(1L, 0, 0)
                  : new WriteSummary(
                      1L, resolved.symbols().size(), resolved.references().size());
            });
  }

  private static List<DiscoveredFile> pythonFiles(int count, int broken) {
    List<DiscoveredFile> files = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      String path = String.format("pkg/module_%03d.py", i);
      String content =
          i < broken
              ? "def broken(:\n    pass\n"
              : "def handler_" + i + "():\n    return helper_" + i + "()\n";
      files.add(
          new DiscoveredFile(
              path,
              Language.PYTHON,
              content,
              FileDiscoveryService.hashBytes(content.getBytes()),
              content.length()));
    }
    return files;
  }
}
