package com.aiadvent.codegraph.parser.treesitter;

import com.aiadvent.codegraph.parser.SyntaxTree;
import com.aiadvent.codegraph.parser.model.Language;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

/**
 * Concrete syntax tree of one file together with the byte scopes of the symbols extracted from
 * it. Node offsets are UTF-8 byte offsets, so text is always sliced from the encoded content.
 */
public final class TreeSitterSyntaxTree implements SyntaxTree {

  private final String relativePath;
  private final Language language;
  private final String content;
  private final byte[] bytes;
  // Nodes point into the native tree, which must stay reachable while they are read.
  private final TSTree tree;
  private final TSNode root;
  private final String[] lines;
  private final List<Scope> scopes = new ArrayList<>();
  private boolean symbolsExtracted;

  TreeSitterSyntaxTree(String relativePath, Language language, String content, TSTree tree) {
    this.relativePath = relativePath;
    this.language = language;
    this.content = content;
    this.bytes = content.getBytes(StandardCharsets.UTF_8);
    this.tree = tree;
    this.root = tree.getRootNode();
    this.lines = content.split("\\R", -1);
  }

  @Override
  public String relativePath() {
    return relativePath;
  }

  @Override
  public Language language() {
    return language;
  }

  @Override
  public String content() {
    return content;
  }

  public TSNode root() {
    return root;
  }

  public String text(TSNode node) {
    if (node == null || node.isNull()) {
      return "";
    }
    return text(node.getStartByte(), node.getEndByte());
  }

  public String text(int startByte, int endByte) {
    int from = Math.max(0, Math.min(startByte, bytes.length));
    int to = Math.max(from, Math.min(endByte, bytes.length));
    return new String(bytes, from, to - from, StandardCharsets.UTF_8);
  }

  /** One-based line of the node start. */
  public int line(TSNode node) {
    return node.getStartPoint().getRow() + 1;
  }

  /** Full source lines {@code startLine..endLine}, one-based and inclusive. */
  public String lines(int startLine, int endLine) {
    int from = Math.max(1, startLine);
    int to = Math.min(lines.length, endLine);
    if (from > to) {
      return "";
    }
    return String.join("\n", Arrays.copyOfRange(lines, from - 1, to));
  }

  int lineCount() {
    return lines.length;
  }

  String lastLine() {
    return lines[lines.length - 1];
  }

  void addScope(int symbolIndex, int startByte, int endByte) {
    scopes.add(new Scope(symbolIndex, startByte, endByte));
  }

  List<Scope> scopes() {
    return scopes;
  }

  void resetScopes() {
    scopes.clear();
    symbolsExtracted = false;
  }

  boolean symbolsExtracted() {
    return symbolsExtracted;
  }

  void markSymbolsExtracted() {
    symbolsExtracted = true;
  }

  record Scope(int symbolIndex, int startByte, int endByte) {

    boolean contains(int offset) {
      return offset >= startByte && offset < endByte;
    }

    int width() {
      return endByte - startByte;
    }
  }
}
