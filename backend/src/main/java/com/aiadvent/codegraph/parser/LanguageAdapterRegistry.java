package com.aiadvent.codegraph.parser;

import com.aiadvent.codegraph.parser.model.Language;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class LanguageAdapterRegistry {

  private final Map<Language, LanguageAdapter<?>> adapters = new EnumMap<>(Language.class);

  public LanguageAdapterRegistry(List<LanguageAdapter<?>> adapters) {
    for (LanguageAdapter<?> adapter : adapters) {
      LanguageAdapter<?> previous = this.adapters.put(adapter.language(), adapter);
      if (previous != null) {
        throw new IllegalStateException(
            "Duplicate language adapter for " + adapter.language().id());
      }
    }
  }

  public Optional<LanguageAdapter<?>> find(Language language) {
    return Optional.ofNullable(adapters.get(language));
  }

  public Set<Language> supportedLanguages() {
    return Collections.unmodifiableSet(adapters.keySet());
  }
}
