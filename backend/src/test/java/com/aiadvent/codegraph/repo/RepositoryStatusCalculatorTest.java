package com.aiadvent.codegraph.repo;

import static org.assertj.core.api.Assertions.assertThat;

import com.aiadvent.codegraph.config.CodeGraphProperties;
import com.aiadvent.codegraph.repo.domain.CodeRepository;
import com.aiadvent.codegraph.repo.domain.RepositoryStatus;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RepositoryStatusCalculatorTest {

  private RepositoryStatusCalculator calculator;

  @BeforeEach
  void setUp() {
    calculator = new RepositoryStatusCalculator(new CodeGraphProperties());
  }

  @Test
  void failureRatioAtThresholdStillCompletes() {
    assertThat(calculator.statusFor(10, 5)).isEqualTo(RepositoryStatus.COMPLETED);
    assertThat(calculator.statusFor(10, 6)).isEqualTo(RepositoryStatus.FAILED);
  }

  @Test
  void emptyRepositoryIsCompleted() {
    assertThat(calculator.statusFor(0, 0)).isEqualTo(RepositoryStatus.COMPLETED);
  }

  @Test
  void applyFillsCountersAndError() {
    CodeRepository repository = new CodeRepository("shop", "/tmp/shop");

    calculator.apply(repository, 4, 3, List.of("python", "rust"));

    assertThat(repository.getStatus()).isEqualTo(RepositoryStatus.FAILED);
    assertThat(repository.getParsedFiles()).isEqualTo(1);
    assertThat(repository.getFailedFiles()).isEqualTo(3);
    assertThat(repository.getLanguages()).containsExactly("python", "rust");
    assertThat(repository.getLastError()).isEqualTo("3 of 4 files failed to parse");
    assertThat(repository.getLastIndexedAt()).isNotNull();

    calculator.apply(repository, 4, 0, List.of("python"));

    assertThat(repository.getStatus()).isEqualTo(RepositoryStatus.COMPLETED);
    assertThat(repository.getLastError()).isNull();
  }
}
