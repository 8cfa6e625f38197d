package com.aiadvent.codegraph.repo;

import static com.aiadvent.codegraph.support.TestSymbols.REPOSITORY_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.aiadvent.codegraph.common.exception.CodeGraphNotFoundException;
import com.aiadvent.codegraph.job.JobQueuePort;
import com.aiadvent.codegraph.job.domain.IndexJob;
import com.aiadvent.codegraph.job.domain.JobType;
import com.aiadvent.codegraph.repo.RepositoryRegistrationService.Registration;
import com.aiadvent.codegraph.repo.domain.CodeRepository;
import com.aiadvent.codegraph.repo.persistence.CodeRepositoryRepository;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class RepositoryRegistrationServiceTest {

  @Mock private CodeRepositoryRepository repositoryRepository;
  @Mock private JobQueuePort jobQueue;

  @TempDir Path checkout;

  private RepositoryRegistrationService registrationService;

  @BeforeEach
  void setUp() {
    registrationService = new RepositoryRegistrationService(repositoryRepository, jobQueue);
  }

  @Test
  void registersNewCheckoutAndQueuesParse() {
    String root = checkout.toAbsolutePath().normalize().toString();
    IndexJob job = new IndexJob(REPOSITORY_ID, JobType.PARSE, null, 3);
    when(repositoryRepository.findByRootPath(root)).thenReturn(Optional.empty());
    when(repositoryRepository.save(any(CodeRepository.class)))
        .thenAnswer(
            invocation -> {
              CodeRepository saved = invocation.getArgument(0);
              ReflectionTestUtils.setField(saved, "id", REPOSITORY_ID);
              return saved;
            });
    when(jobQueue.enqueueUnique(REPOSITORY_ID, JobType.PARSE, null)).thenReturn(job);

    Registration registration = registrationService.register("  shop ", checkout.toString());

    assertThat(registration.repository().getName()).isEqualTo("shop");
    assertThat(registration.repository().getRootPath()).isEqualTo(root);
    assertThat(registration.job()).isSameAs(job);
  }

  @Test
  void reusesRepositoryRegisteredForSameRoot() {
    String root = checkout.toAbsolutePath().normalize().toString();
    CodeRepository existing = new CodeRepository("shop", root);
    ReflectionTestUtils.setField(existing, "id", REPOSITORY_ID);
    when(repositoryRepository.findByRootPath(root)).thenReturn(Optional.of(existing));

    Registration registration = registrationService.register("renamed", root);

    assertThat(registration.repository()).isSameAs(existing);
    verify(repositoryRepository, never()).save(any());
    verify(jobQueue).enqueueUnique(REPOSITORY_ID, JobType.PARSE, null);
  }

  @Test
  void rejectsMissingDirectoryAndBlankInput() {
    assertThatThrownBy(
            () -> registrationService.register("shop", checkout.resolve("absent").toString()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageStartingWith("Repository root is not a directory");
    assertThatThrownBy(() -> registrationService.register(" ", checkout.toString()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> registrationService.register("shop", ""))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(repositoryRepository, jobQueue);
  }

  @Test
  void reparseOfUnknownRepositoryIsNotFound() {
    when(repositoryRepository.findById(REPOSITORY_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> registrationService.requestReparse(REPOSITORY_ID))
        .isInstanceOf(CodeGraphNotFoundException.class);
    verifyNoInteractions(jobQueue);
  }
}
