package com.aiadvent.codegraph;

import static org.assertj.core.api.Assertions.assertThat;

import com.aiadvent.codegraph.entrypoint.DetectionSummary;
import com.aiadvent.codegraph.graph.GraphNode;
import com.aiadvent.codegraph.graph.GraphQueryResult;
import com.aiadvent.codegraph.graph.domain.CodeSymbol;
import com.aiadvent.codegraph.job.JobDispatcher;
import com.aiadvent.codegraph.query.CodeGraphQueryService;
import com.aiadvent.codegraph.repo.RepositoryRegistrationService.Registration;
import com.aiadvent.codegraph.repo.domain.CodeRepository;
import com.aiadvent.codegraph.repo.domain.RepositoryStatus;
import com.aiadvent.codegraph.support.PostgresTestContainer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class CodeGraphApplicationTests extends PostgresTestContainer {

  private static final String WORKER_ID = "integration-test";

  @Autowired private CodeGraphQueryService queryService;

  @Autowired private JobDispatcher jobDispatcher;

  @TempDir Path checkout;

  @Test
  void indexesRepositoryAndDetectsRequestMapping() throws IOException {
    write(
        "src/main/java/shop/OrderController.java",
        """
        package shop;

        import org.springframework.web.bind.annotation.GetMapping;

        public class OrderController {
          private final OrderService service = new OrderService();

          @GetMapping("/orders")
          public String list() {
            return service.findAll();
          }
        }
        """);
    write(
        "src/main/java/shop/OrderService.java",
        """
        package shop;

        public class OrderService {
          public String findAll() {
            return "all";
          }
        }
        """);

    Registration registration =
        queryService.registerRepository("shop", checkout.toString());
    UUID repositoryId = registration.repository().getId();
    drainJobs();

    CodeRepository repository = queryService.getRepository(repositoryId);
    assertThat(repository.getStatus()).isEqualTo(RepositoryStatus.COMPLETED);
    assertThat(repository.getParsedFiles()).isEqualTo(2);
    assertThat(repository.getFailedFiles()).isZero();
    assertThat(repository.getLanguages()).containsExactly("java");

    List<CodeSymbol> matches = queryService.searchSymbols(repositoryId, "list", 10);
    assertThat(matches)
        .extracting(CodeSymbol::getQualifiedName)
        .contains("shop.OrderController.list");
    CodeSymbol list =
        matches.stream()
            .filter(symbol -> symbol.getQualifiedName().equals("shop.OrderController.list"))
            .findFirst()
            .orElseThrow();

    GraphQueryResult downstream = queryService.downstream(repositoryId, list.getId(), null);
    assertThat(downstream.maxDepth()).isEqualTo(5);
    assertThat(downstream.nodes()).extracting(GraphNode::name).contains("findAll");

    DetectionSummary summary = queryService.detectEntryPoints(repositoryId, false);
    assertThat(summary.candidatesDetected()).isPositive();
    assertThat(summary.reusedExisting()).isFalse();

    DetectionSummary again = queryService.detectEntryPoints(repositoryId, false);
    if (summary.entryPointsConfirmed() > 0) {
      assertThat(again.reusedExisting()).isTrue();
    }
  }

  private void drainJobs() {
    for (int i = 0; i < 10; i++) {
      if (jobDispatcher.processNextJob(WORKER_ID).isEmpty()) {
        return;
      }
    }
  }

  private void write(String relativePath, String content) throws IOException {
    Path file = checkout.resolve(relativePath);
    Files.createDirectories(file.getParent());
    Files.writeString(file, content, StandardCharsets.UTF_8);
  }
}
