package com.aiadvent.codegraph.index;

import static com.aiadvent.codegraph.support.TestSymbols.REPOSITORY_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.aiadvent.codegraph.job.domain.IndexJob;
import com.aiadvent.codegraph.job.domain.JobType;
import com.aiadvent.codegraph.repo.domain.CodeRepository;
import com.aiadvent.codegraph.repo.domain.RepositoryStatus;
import com.aiadvent.codegraph.repo.persistence.CodeRepositoryRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ParseJobHandlerTest {

  @Mock private RepositoryIndexService indexService;
  @Mock private CodeRepositoryRepository repositoryRepository;

  private ParseJobHandler handler;
  private IndexJob job;

  @BeforeEach
  void setUp() {
    handler = new ParseJobHandler(indexService, repositoryRepository, new ObjectMapper());
    job = new IndexJob(REPOSITORY_ID, JobType.PARSE, null, 3);
  }

  @Test
  void storesIndexReportAsJobResult() {
    when(indexService.index(REPOSITORY_ID))
        .thenReturn(
            new IndexReport(
                REPOSITORY_ID, RepositoryStatus.COMPLETED, 100, 97, 3, 0, 0, 100, 0, 420, 910));

    JsonNode result = handler.handle(job);

    assertThat(handler.type()).isEqualTo(JobType.PARSE);
    assertThat(result.get("status").asText()).isEqualTo("COMPLETED");
    assertThat(result.get("parsedFiles").asInt()).isEqualTo(97);
    assertThat(result.get("edgesWritten").asInt()).isEqualTo(910);
  }

  @Test
  void permanentFailureMarksRepositoryFailed() {
    CodeRepository repository = new CodeRepository("shop", "/srv/shop");
    repository.setStatus(RepositoryStatus.PARSING);
    when(repositoryRepository.findById(REPOSITORY_ID)).thenReturn(Optional.of(repository));

    handler.onPermanentFailure(job, "disk unreadable");

    assertThat(repository.getStatus()).isEqualTo(RepositoryStatus.FAILED);
    assertThat(repository.getLastError()).isEqualTo("disk unreadable");
    verify(repositoryRepository).save(repository);
  }
}
