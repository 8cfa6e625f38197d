package com.aiadvent.codegraph.parser;

import static org.assertj.core.api.Assertions.assertThat;

import com.aiadvent.codegraph.parser.java.JavaLanguageAdapter;
import com.aiadvent.codegraph.parser.model.Language;
import com.aiadvent.codegraph.parser.model.ParsedFile;
import com.aiadvent.codegraph.support.TestParsers;
import java.util.List;
import org.junit.jupiter.api.Test;

class SourceParserTest {

  private final SourceParser parser = TestParsers.sourceParser();

  @Test
  void brokenJavaBecomesFailedFile() {
    ParsedFile parsed = parser.parse("src/Broken.java", Language.JAVA, "class { void x( }");

    assertThat(parsed.isFailed()).isTrue();
    assertThat(parsed.error()).isNotBlank();
    assertThat(parsed.symbols()).isEmpty();
    assertThat(parsed.callSites()).isEmpty();
  }

  @Test
  void syntaxErrorFailsPythonWithLine() {
    ParsedFile parsed =
        parser.parse("pkg/broken.py", Language.PYTHON, "def broken(:\n    pass\n");

    assertThat(parsed.isFailed()).isTrue();
    assertThat(parsed.error()).matches("(Syntax error|Missing '.+') at line \\d+");
    assertThat(parsed.symbols()).isEmpty();
  }

  @Test
  void unterminatedStringFailsKotlin() {
    ParsedFile parsed =
        parser.parse("src/A.kt", Language.KOTLIN, "fun a() {\n  val s = \"open\n}\n");

    assertThat(parsed.isFailed()).isTrue();
    assertThat(parsed.error()).contains("at line");
  }

  @Test
  void unterminatedBlockCommentFailsJavaScript() {
    ParsedFile parsed =
        parser.parse("src/a.js", Language.JAVASCRIPT, "/* never closed\nfunction a() {}\n");

    assertThat(parsed.isFailed()).isTrue();
    assertThat(parsed.callSites()).isEmpty();
  }

  @Test
  void missingBraceFailsRust() {
    ParsedFile parsed = parser.parse("src/lib.rs", Language.RUST, "fn main() {\n  run();\n");

    assertThat(parsed.isFailed()).isTrue();
    assertThat(parsed.error()).isNotBlank();
  }

  @Test
  void languageWithoutAdapterIsReportedAsFailure() {
    SourceParser javaOnly =
        new SourceParser(new LanguageAdapterRegistry(List.of(new JavaLanguageAdapter())));

    ParsedFile parsed = javaOnly.parse("src/lib.rs", Language.RUST, "fn main() {}");

    assertThat(javaOnly.supports(Language.RUST)).isFalse();
    assertThat(parsed.error()).isEqualTo("Unsupported language rust");
  }

  @Test
  void emptyFileParsesToModuleOnly() {
    ParsedFile parsed = parser.parse("pkg/empty.py", Language.PYTHON, "");

    assertThat(parsed.isFailed()).isFalse();
    assertThat(parsed.symbols()).hasSize(1);
    assertThat(parsed.symbols().get(0).qualifiedName()).isEqualTo("pkg.empty");
  }
}
