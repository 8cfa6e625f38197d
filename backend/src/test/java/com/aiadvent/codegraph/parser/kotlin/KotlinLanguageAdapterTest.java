package com.aiadvent.codegraph.parser.kotlin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.groups.Tuple.tuple;

import com.aiadvent.codegraph.parser.model.AnnotationUsage;
import com.aiadvent.codegraph.parser.model.CallKind;
import com.aiadvent.codegraph.parser.model.CallSite;
import com.aiadvent.codegraph.parser.model.ImportDirective;
import com.aiadvent.codegraph.parser.model.ParsedFile;
import com.aiadvent.codegraph.parser.model.SymbolDescriptor;
import com.aiadvent.codegraph.parser.model.SymbolKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class KotlinLanguageAdapterTest {

  private static final String SOURCE =
      """
      package com.shop

      import com.shop.fraud.FraudProcessor
      import com.shop.util.Clock as ShopClock

      @RestController
      class OrderController(private val service: OrderService) : BaseController() {
          private val processor: FraudProcessor = FraudProcessor()

          @GetMapping("/orders")
          fun list(): List<Order> {
              return service.findAll()
          }
      }

      fun helper() = println("x")
      """;

  private ParsedFile parsed;

  @BeforeEach
  void setUp() {
    parsed =
        new KotlinLanguageAdapter()
            .parse("src/main/kotlin/com/shop/OrderController.kt", SOURCE);
  }

  @Test
  void extractsPackageAndAliasedImports() {
    assertThat(parsed.isFailed()).isFalse();
    assertThat(parsed.packageName()).isEqualTo("com.shop");
    assertThat(parsed.imports())
        .extracting(ImportDirective::path, ImportDirective::visibleName)
        .containsExactly(
            tuple("com.shop.fraud.FraudProcessor", "FraudProcessor"),
            tuple("com.shop.util.Clock", "ShopClock"));
  }

  @Test
  void extractsFileFacadeClassesAndFunctions() {
    assertThat(parsed.symbols())
        .extracting(SymbolDescriptor::qualifiedName, SymbolDescriptor::kind)
        .containsExactly(
            tuple("com.shop.OrderControllerKt", SymbolKind.MODULE),
            tuple("com.shop.OrderController", SymbolKind.CLASS),
            tuple("com.shop.OrderController.list", SymbolKind.METHOD),
            tuple("com.shop.helper", SymbolKind.FUNCTION));

    SymbolDescriptor controller = parsed.symbols().get(1);
    assertThat(controller.annotations())
        .extracting(AnnotationUsage::name)
        .containsExactly("RestController");
    assertThat(controller.superTypes()).containsExactly("BaseController");
    assertThat(controller.declaredTypes())
        .containsEntry("service", "OrderService")
        .containsEntry("processor", "FraudProcessor");

    SymbolDescriptor list = parsed.symbols().get(2);
    assertThat(list.parentIndex()).isEqualTo(1);
    assertThat(list.annotations().get(0).argument("_0")).isEqualTo("/orders");
  }

  @Test
  void recordsCallsOnPropertiesAndConstructions() {
    assertThat(parsed.callSites())
        .extracting(CallSite::ownerIndex, CallSite::name, CallSite::receiver, CallSite::kind)
        .contains(
            tuple(1, "FraudProcessor", null, CallKind.CONSTRUCTION),
            tuple(2, "findAll", "service", CallKind.INVOCATION),
            tuple(3, "println", null, CallKind.INVOCATION));
  }

  @Test
  void callsInsideStringTemplatesAreCallSites() {
    ParsedFile file =
        new KotlinLanguageAdapter()
            .parse("src/Templates.kt", "fun f() { val s = \"a ${g(\"x\")} b\"; h() }\n");

    assertThat(file.isFailed()).isFalse();
    assertThat(file.callSites())
        .extracting(CallSite::ownerIndex, CallSite::name, CallSite::kind)
        .contains(tuple(1, "g", CallKind.INVOCATION), tuple(1, "h", CallKind.INVOCATION));
  }

  @Test
  void facadeNameCapitalizesFileName() {
    assertThat(KotlinLanguageAdapter.facadeName("src/app/routing.kt")).isEqualTo("RoutingKt");
    assertThat(KotlinLanguageAdapter.facadeName("build.gradle.kts")).isEqualTo("BuildKt");
  }
}
