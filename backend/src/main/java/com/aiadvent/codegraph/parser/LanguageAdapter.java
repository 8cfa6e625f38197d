package com.aiadvent.codegraph.parser;

import com.aiadvent.codegraph.parser.model.CallSite;
import com.aiadvent.codegraph.parser.model.ImportDirective;
import com.aiadvent.codegraph.parser.model.Language;
import com.aiadvent.codegraph.parser.model.ParsedFile;
import com.aiadvent.codegraph.parser.model.SymbolDescriptor;
import java.util.List;

/**
 * Per-language extraction of symbols and raw call sites.
 *
 * <p>Call sites reference their owner by index into the list returned from {@link
 * #extractSymbols(SyntaxTree)} for the same tree, so implementations must return the symbols in a
 * stable order.
 */
public interface LanguageAdapter<T extends SyntaxTree> {

  Language language();

  T parseTree(String relativePath, String content);

  String extractPackage(T tree);

  List<ImportDirective> extractImports(T tree);

  List<SymbolDescriptor> extractSymbols(T tree);

  List<CallSite> extractCalls(T tree);

  default ParsedFile parse(String relativePath, String content) {
    T tree = parseTree(relativePath, content);
    String packageName = extractPackage(tree);
    List<ImportDirective> imports = extractImports(tree);
    List<SymbolDescriptor> symbols = extractSymbols(tree);
    List<CallSite> calls = extractCalls(tree);
    return new ParsedFile(relativePath, language(), packageName, imports, symbols, calls, null);
  }
}
