package com.aiadvent.codegraph.resolve;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.groups.Tuple.tuple;

import com.aiadvent.codegraph.graph.domain.ReferenceType;
import com.aiadvent.codegraph.parser.SourceParser;
import com.aiadvent.codegraph.parser.model.Language;
import com.aiadvent.codegraph.parser.model.ParsedFile;
import com.aiadvent.codegraph.parser.model.SymbolKind;
import com.aiadvent.codegraph.support.TestParsers;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SymbolResolverTest {

  private final SourceParser parser = TestParsers.sourceParser();
  private final SymbolResolver resolver = new SymbolResolver();

  @Test
  void argumentTypedByImportedFieldBecomesUsageAndChainedCallStaysExternal() {
    ParsedFile pipeline =
        parser.parse(
            "a/A.kt",
            Language.KOTLIN,
            """
            package a

            import b.FraudProcessor

            class Pipeline {
                private val fraudProcessor: FraudProcessor = FraudProcessor()

                fun configure(builder: Builder) {
                    builder.route().process(fraudProcessor)
                }
            }
            """);
    ParsedFile processor =
        parser.parse(
            "b/FraudProcessor.kt",
            Language.KOTLIN,
            """
            package b

            class FraudProcessor {
                fun process(input: String) {
                    validate(input)
                }

                fun validate(input: String) {}
            }
            """);

    List<ResolvedFile> resolved = resolver.resolve(List.of(processor, pipeline), List.of());

    ResolvedFile a = resolved.get(0);
    assertThat(a.relativePath()).isEqualTo("a/A.kt");
    assertThat(a.symbols())
        .extracting(IndexedSymbol::qualifiedName)
        .containsExactly("a.AKt", "a.Pipeline", "a.Pipeline.configure");
    assertThat(a.references())
        .extracting(
            ResolvedReference::sourceIndex,
            ResolvedReference::type,
            ResolvedReference::targetName,
            ResolvedReference::targetQualifiedName,
            ResolvedReference::external)
        .contains(
            tuple(0, ReferenceType.IMPORT, "b.FraudProcessor", "b.FraudProcessor", false),
            tuple(1, ReferenceType.CALL, "FraudProcessor", "b.FraudProcessor", false),
            tuple(2, ReferenceType.USAGE, "fraudProcessor", "b.FraudProcessor", false),
            tuple(2, ReferenceType.CALL, "route", null, true),
            tuple(2, ReferenceType.CALL, "process", null, true));

    ResolvedFile b = resolved.get(1);
    assertThat(b.references())
        .filteredOn(reference -> reference.type() == ReferenceType.CALL)
        .extracting(ResolvedReference::sourceIndex, ResolvedReference::targetQualifiedName)
        .containsExactly(tuple(2, "b.FraudProcessor.validate"));
    assertThat(b.references())
        .filteredOn(reference -> reference.type() == ReferenceType.USAGE)
        .isEmpty();
  }

  @Test
  void overloadsGetSuffixesAndBareCallBindsToAllOfThem() {
    ParsedFile file =
        parser.parse(
            "src/main/java/a/B.java",
            Language.JAVA,
            """
            package a;

            public class B {
              void m(int x) {}

              void m(String s) {}

              void run() {
                m(1);
              }
            }
            """);

    ResolvedFile resolved = resolver.resolve(List.of(file), List.of()).get(0);

    assertThat(resolved.symbols())
        .extracting(IndexedSymbol::qualifiedName)
        .containsExactly("a.B", "a.B.m", "a.B.m#2", "a.B.run");
    assertThat(resolved.symbols().get(2).parentQualifiedName()).isEqualTo("a.B");
    assertThat(resolved.references())
        .extracting(
            ResolvedReference::sourceIndex,
            ResolvedReference::targetQualifiedName,
            ResolvedReference::ambiguous)
        .containsExactlyInAnyOrder(tuple(3, "a.B.m", true), tuple(3, "a.B.m#2", true));
  }

  @Test
  void importedFunctionBindsToSymbolRetainedFromUnchangedFile() {
    ParsedFile handlers =
        parser.parse(
            "shop/handlers.py",
            Language.PYTHON,
            """
            from shop.services import place_order


            def create(payload):
                return place_order(payload)
            """);
    IndexedSymbol retained =
        new IndexedSymbol(
            "shop.services.place_order",
            "place_order",
            SymbolKind.FUNCTION,
            "shop/services.py",
            "shop.services",
            Map.of(),
            List.of());

    ResolvedFile resolved = resolver.resolve(List.of(handlers), List.of(retained)).get(0);

    assertThat(resolved.references())
        .extracting(
            ResolvedReference::sourceIndex,
            ResolvedReference::type,
            ResolvedReference::targetQualifiedName,
            ResolvedReference::targetFilePath)
        .containsExactlyInAnyOrder(
            tuple(0, ReferenceType.IMPORT, "shop.services.place_order", "shop/services.py"),
            tuple(1, ReferenceType.CALL, "shop.services.place_order", "shop/services.py"));
  }

  @Test
  void nameTakenByRetainedSymbolGetsSuffix() {
    ParsedFile copy =
        parser.parse("shop/util.py", Language.PYTHON, "def helper():\n    pass\n");
    IndexedSymbol retained =
        new IndexedSymbol(
            "shop.util.helper",
            "helper",
            SymbolKind.FUNCTION,
            "legacy/shop/util.py",
            null,
            Map.of(),
            List.of());

    ResolvedFile resolved = resolver.resolve(List.of(copy), List.of(retained)).get(0);

    assertThat(resolved.symbols())
        .extracting(IndexedSymbol::qualifiedName)
        .containsExactly("shop.util", "shop.util.helper#2");
  }

  @Test
  void failedFileKeepsNoSymbolsOrEdges() {
    ParsedFile broken = parser.parse("shop/broken.py", Language.PYTHON, "def broken(:\n");

    ResolvedFile resolved = resolver.resolve(List.of(broken), List.of()).get(0);

    assertThat(resolved.parsedFile().isFailed()).isTrue();
    assertThat(resolved.symbols()).isEmpty();
    assertThat(resolved.references()).isEmpty();
  }

  @Test
  void rustSelfCallResolvesThroughImplBlock() {
    ParsedFile file =
        parser.parse(
            "src/repo.rs",
            Language.RUST,
            """
            pub struct Repo {}

            impl Repo {
                pub fn save(&self) {
                    self.validate();
                }

                fn validate(&self) {}
            }
            """);

    ResolvedFile resolved = resolver.resolve(List.of(file), List.of()).get(0);

    assertThat(resolved.symbols())
        .extracting(IndexedSymbol::qualifiedName)
        .containsExactly(
            "crate.repo", "crate.repo.Repo", "crate.repo.Repo$impl", "crate.repo.Repo.save",
            "crate.repo.Repo.validate");
    assertThat(resolved.references())
        .extracting(ResolvedReference::sourceIndex, ResolvedReference::targetQualifiedName)
        .containsExactly(tuple(3, "crate.repo.Repo.validate"));
  }
}
