package com.aiadvent.codegraph.parser;

import com.aiadvent.codegraph.parser.model.Language;

/** Language-specific syntax tree produced by a {@link LanguageAdapter}. */
public interface SyntaxTree {

  String relativePath();

  Language language();

  String content();
}
