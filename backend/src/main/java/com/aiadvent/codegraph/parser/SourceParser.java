package com.aiadvent.codegraph.parser;

import com.aiadvent.codegraph.parser.model.Language;
import com.aiadvent.codegraph.parser.model.ParsedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Entry point of phase one. Failures never escape: a broken file becomes a failed result. */
@Component
public class SourceParser {

  private static final Logger log = LoggerFactory.getLogger(SourceParser.class);

  private final LanguageAdapterRegistry registry;

  public SourceParser(LanguageAdapterRegistry registry) {
    this.registry = registry;
  }

  public boolean supports(Language language) {
    return registry.find(language).isPresent();
  }

  public ParsedFile parse(String relativePath, Language language, String content) {
    LanguageAdapter<?> adapter = registry.find(language).orElse(null);
    if (adapter == null) {
      return ParsedFile.failed(relativePath, language, "Unsupported language " + language.id());
    }
    try {
      return adapter.parse(relativePath, content);
    } catch (SourceParseException ex) {
      log.warn("Failed to parse {}: {}", relativePath, ex.getMessage());
      return ParsedFile.failed(relativePath, language, ex.getMessage());
    } catch (RuntimeException | StackOverflowError ex) {
      log.warn("Adapter {} crashed on {}", language.id(), relativePath, ex);
      return ParsedFile.failed(
          relativePath, language, ex.getClass().getSimpleName() + ": " + ex.getMessage());
    }
  }
}
