package com.aiadvent.codegraph.flow;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LogLineScannerTest {

  private final LogLineScanner scanner = new LogLineScanner();

  @Test
  void findsLoggerCallsAcrossLanguages() {
    String source =
        String.join(
            "\n",
            "def handle(order):",
            "    logger.info('received %s', order.id)",
            "    total = order.total()",
            "    console.warn(`slow ${total}`)",
            "    info!(\"shipped {}\", id);",
            "    println!(\"done\");",
            "    Timber.d(\"android\")");

    assertThat(scanner.scan(source, 10))
        .containsExactly(
            "11: logger.info('received %s', order.id)",
            "13: console.warn(`slow ${total}`)",
            "14: info!(\"shipped {}\", id);",
            "15: println!(\"done\");",
            "16: Timber.d(\"android\")");
  }

  @Test
  void ignoresLookalikeIdentifiers() {
    String source = "catalog.info()\nblog.post(x)\nlogin(user)";

    assertThat(scanner.scan(source, 1)).isEmpty();
    assertThat(scanner.scan(null, 1)).isEmpty();
  }
}
