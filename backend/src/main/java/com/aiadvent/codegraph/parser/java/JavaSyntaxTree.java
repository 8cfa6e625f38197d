package com.aiadvent.codegraph.parser.java;

import com.aiadvent.codegraph.parser.SyntaxTree;
import com.aiadvent.codegraph.parser.model.Language;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import java.util.IdentityHashMap;
import java.util.Map;

public final class JavaSyntaxTree implements SyntaxTree {

  private final String relativePath;
  private final String content;
  private final CompilationUnit compilationUnit;
  private final String[] lines;
  private final Map<Node, Integer> declarationIndex = new IdentityHashMap<>();
  private boolean symbolsExtracted;

  JavaSyntaxTree(String relativePath, String content, CompilationUnit compilationUnit) {
    this.relativePath = relativePath;
    this.content = content;
    this.compilationUnit = compilationUnit;
    this.lines = content.split("\\R", -1);
  }

  @Override
  public String relativePath() {
    return relativePath;
  }

  @Override
  public Language language() {
    return Language.JAVA;
  }

  @Override
  public String content() {
    return content;
  }

  CompilationUnit compilationUnit() {
    return compilationUnit;
  }

  String[] lines() {
    return lines;
  }

  Map<Node, Integer> declarationIndex() {
    return declarationIndex;
  }

  boolean symbolsExtracted() {
    return symbolsExtracted;
  }

  void markSymbolsExtracted() {
    symbolsExtracted = true;
  }
}
