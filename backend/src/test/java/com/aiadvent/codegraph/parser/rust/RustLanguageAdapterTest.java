package com.aiadvent.codegraph.parser.rust;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.groups.Tuple.tuple;

import com.aiadvent.codegraph.parser.model.CallSite;
import com.aiadvent.codegraph.parser.model.ImportDirective;
import com.aiadvent.codegraph.parser.model.ParsedFile;
import com.aiadvent.codegraph.parser.model.SymbolDescriptor;
import com.aiadvent.codegraph.parser.model.SymbolKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RustLanguageAdapterTest {

  private static final String SOURCE =
      """
      use crate::db::{Pool, models::User as DbUser};
      use super::config;

      #[get("/users/{id}")]
      pub async fn get_user(pool: Pool) -> String {
          let repo = UserRepo::new(pool);
          repo.find(1)
      }

      pub struct UserRepo {
          pool: Pool,
      }

      impl UserRepo {
          pub fn new(pool: Pool) -> Self {
              UserRepo { pool }
          }

          fn find(&self, id: i64) -> String {
              self.pool.query(id)
          }
      }
      """;

  private ParsedFile parsed;

  @BeforeEach
  void setUp() {
    parsed = new RustLanguageAdapter().parse("src/handlers/user.rs", SOURCE);
  }

  @Test
  void expandsUseTreesAgainstTheCrate() {
    assertThat(parsed.packageName()).isEqualTo("crate.handlers.user");
    assertThat(parsed.imports())
        .extracting(ImportDirective::path, ImportDirective::visibleName)
        .containsExactly(
            tuple("crate.db.Pool", "Pool"),
            tuple("crate.db.models.User", "DbUser"),
            tuple("crate.handlers.config", "config"));
  }

  @Test
  void qualifiesImplMethodsByTheirType() {
    assertThat(parsed.symbols())
        .extracting(SymbolDescriptor::qualifiedName, SymbolDescriptor::kind)
        .containsExactly(
            tuple("crate.handlers.user", SymbolKind.MODULE),
            tuple("crate.handlers.user.get_user", SymbolKind.FUNCTION),
            tuple("crate.handlers.user.UserRepo", SymbolKind.STRUCT),
            tuple("crate.handlers.user.UserRepo$impl", SymbolKind.IMPL),
            tuple("crate.handlers.user.UserRepo.new", SymbolKind.METHOD),
            tuple("crate.handlers.user.UserRepo.find", SymbolKind.METHOD));

    SymbolDescriptor handler = parsed.symbols().get(1);
    assertThat(handler.annotations()).hasSize(1);
    assertThat(handler.annotations().get(0).name()).isEqualTo("get");
    assertThat(handler.annotations().get(0).argument("_0")).isEqualTo("/users/{id}");
    assertThat(handler.modifiers()).containsExactly("pub", "async");
    assertThat(handler.declaredTypes())
        .containsEntry("pool", "Pool")
        .containsEntry("repo", "UserRepo");
    assertThat(parsed.symbols().get(2).declaredTypes()).containsEntry("pool", "Pool");
    assertThat(parsed.symbols().get(4).parentIndex()).isEqualTo(3);
  }

  @Test
  void recordsPathAndMethodCalls() {
    assertThat(parsed.callSites())
        .extracting(CallSite::ownerIndex, CallSite::name, CallSite::receiver)
        .contains(
            tuple(1, "new", "UserRepo"),
            tuple(1, "find", "repo"),
            tuple(5, "query", "pool"));
  }

  @Test
  void modulePathDropsEntryFiles() {
    assertThat(RustLanguageAdapter.modulePath("src/lib.rs")).isEqualTo("crate");
    assertThat(RustLanguageAdapter.modulePath("src/api/mod.rs")).isEqualTo("crate.api");
    assertThat(RustLanguageAdapter.absolutePath("crate.api.users", "super.db.Pool"))
        .isEqualTo("crate.api.db.Pool");
  }
}
