package com.aiadvent.codegraph.parser.javascript;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.groups.Tuple.tuple;

import com.aiadvent.codegraph.parser.model.CallKind;
import com.aiadvent.codegraph.parser.model.CallSite;
import com.aiadvent.codegraph.parser.model.ImportDirective;
import com.aiadvent.codegraph.parser.model.ParsedFile;
import com.aiadvent.codegraph.parser.model.SymbolDescriptor;
import com.aiadvent.codegraph.parser.model.SymbolKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JavaScriptLanguageAdapterTest {

  private static final String SOURCE =
      """
      const express = require('express');
      import { save as persist } from './store';

      const app = express();

      app.post('/orders', async (req, res) => {
        const order = new Order(req.body);
        await persist(order);
      });

      class OrderService extends BaseService {
        create(input) {
          return this.repo.insert(input);
        }
      }

      export function helper() {}

      const total = (items) => items.length;
      """;

  private ParsedFile parsed;

  @BeforeEach
  void setUp() {
    parsed = new JavaScriptLanguageAdapter().parse("src/api/orders.js", SOURCE);
  }

  @Test
  void readsRequireAndEsModuleImports() {
    assertThat(parsed.packageName()).isEqualTo("api.orders");
    assertThat(parsed.imports())
        .extracting(ImportDirective::path, ImportDirective::visibleName)
        .containsExactlyInAnyOrder(
            tuple("express", "express"), tuple("api.store.save", "persist"));
  }

  @Test
  void extractsClassesMethodsAndFunctionBindings() {
    assertThat(parsed.symbols())
        .extracting(SymbolDescriptor::qualifiedName, SymbolDescriptor::kind)
        .containsExactly(
            tuple("api.orders", SymbolKind.MODULE),
            tuple("api.orders.OrderService", SymbolKind.CLASS),
            tuple("api.orders.OrderService.create", SymbolKind.METHOD),
            tuple("api.orders.helper", SymbolKind.FUNCTION),
            tuple("api.orders.total", SymbolKind.FUNCTION));
    assertThat(parsed.symbols().get(1).superTypes()).containsExactly("BaseService");
    assertThat(parsed.symbols().get(4).parameters()).containsExactly("items");
  }

  @Test
  void attributesCallsToEnclosingSymbols() {
    assertThat(parsed.callSites())
        .extracting(CallSite::ownerIndex, CallSite::name, CallSite::receiver, CallSite::kind)
        .contains(
            tuple(0, "post", "app", CallKind.INVOCATION),
            tuple(0, "Order", null, CallKind.CONSTRUCTION),
            tuple(0, "persist", null, CallKind.INVOCATION),
            tuple(2, "insert", "repo", CallKind.INVOCATION),
            tuple(2, "input", null, CallKind.ARGUMENT));
  }

  @Test
  void callsInsideTemplateSubstitutionsAreCallSites() {
    ParsedFile file =
        new JavaScriptLanguageAdapter()
            .parse("src/templates.js", "const s = `t ${b(`inner`)} }`;\nc();\n");

    assertThat(file.isFailed()).isFalse();
    assertThat(file.callSites())
        .extracting(CallSite::ownerIndex, CallSite::name, CallSite::line)
        .contains(tuple(0, "b", 1), tuple(0, "c", 2));
  }

  @Test
  void resolvesRelativeSpecifiers() {
    assertThat(JavaScriptLanguageAdapter.resolveSpecifier("src/api/orders.js", "../lib/db"))
        .isEqualTo("lib.db");
    assertThat(JavaScriptLanguageAdapter.resolveSpecifier("src/api/orders.js", "@scope/pkg"))
        .isEqualTo("scope.pkg");
    assertThat(JavaScriptLanguageAdapter.moduleName("src/routes/index.js")).isEqualTo("routes");
  }
}
