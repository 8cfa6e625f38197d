package com.aiadvent.codegraph.support;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

/**
 * Base class for tests that need the real schema. The container starts on first property lookup,
 * so classes skipped for a missing Docker daemon never touch it.
 */
public abstract class PostgresTestContainer {

  private static String jdbcUrlWithSslDisabled() {
    String url = SingletonPostgresContainer.getInstance().getJdbcUrl();
    if (url.contains("sslmode=")) {
      return url;
    }
    String separator = url.contains("?") ? "&" : "?";
    return url + separator + "sslmode=disable";
  }

  private static String username() {
    return SingletonPostgresContainer.getInstance().getUsername();
  }

  private static String password() {
    return SingletonPostgresContainer.getInstance().getPassword();
  }

  @DynamicPropertySource
  static void configure(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", PostgresTestContainer::jdbcUrlWithSslDisabled);
    registry.add("spring.datasource.username", PostgresTestContainer::username);
    registry.add("spring.datasource.password", PostgresTestContainer::password);
    registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
    registry.add("spring.liquibase.url", PostgresTestContainer::jdbcUrlWithSslDisabled);
    registry.add("spring.liquibase.user", PostgresTestContainer::username);
    registry.add("spring.liquibase.password", PostgresTestContainer::password);
    registry.add("spring.datasource.hikari.maximum-pool-size", () -> "4");
    registry.add("spring.datasource.hikari.minimum-idle", () -> "1");
    registry.add("app.code-graph.worker.enabled", () -> "false");
  }
}
