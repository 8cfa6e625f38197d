package com.aiadvent.codegraph.flow.domain;

public record CodeSnippet(
    String symbolName,
    String qualifiedName,
    String filePath,
    int startLine,
    int endLine,
    String code) {}
