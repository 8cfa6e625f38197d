package com.aiadvent.codegraph.parser.treesitter;

import com.aiadvent.codegraph.parser.CanonicalNodeKind;
import com.aiadvent.codegraph.parser.LanguageAdapter;
import com.aiadvent.codegraph.parser.SourceParseException;
import com.aiadvent.codegraph.parser.model.CallKind;
import com.aiadvent.codegraph.parser.model.CallSite;
import com.aiadvent.codegraph.parser.model.SymbolDescriptor;
import com.aiadvent.codegraph.parser.model.SymbolKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

/**
 * Base for adapters backed by a tree-sitter grammar. Subclasses map raw node types onto {@link
 * CanonicalNodeKind}, walk their declarations and describe how a call node names its target;
 * call-site and argument extraction is shared.
 *
 * <p>Parsers are not thread-safe, so each thread gets its own.
 */
public abstract class TreeSitterLanguageAdapter
    implements LanguageAdapter<TreeSitterSyntaxTree> {

  protected static final Set<String> SKIPPED_ARGUMENT_IDENTIFIERS =
      Set.of(
          "true", "false", "null", "this", "it", "super", "self", "None", "True", "False",
          "undefined", "nil");

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final ThreadLocal<TSParser> parsers = ThreadLocal.withInitial(this::newParser);

  /** Grammar of the adapter's language. Called once per parsing thread. */
  protected abstract TSLanguage grammar();

  /** Node types that declare a symbol. */
  protected abstract Set<String> definitionTypes();

  /** Node types that invoke or construct something. */
  protected abstract Set<String> callTypes();

  /** Node types of a bare name reference. */
  protected abstract Set<String> identifierTypes();

  protected abstract Set<String> stringTypes();

  /** Subtrees never searched for calls, such as annotations and decorators. */
  protected Set<String> skippedTypes() {
    return Set.of();
  }

  /**
   * Collects declarations in a stable order, registering each symbol's byte scope on the tree.
   */
  protected abstract List<SymbolDescriptor.Builder> collectSymbols(TreeSitterSyntaxTree tree);

  /** Target of a call node, or {@code null} when the callee is not a name. */
  protected abstract Callee callee(TreeSitterSyntaxTree tree, TSNode call);

  /** Argument list of a call node, or {@code null} when it has none. */
  protected abstract TSNode argumentList(TSNode call);

  /** Expression carried by one entry of an argument list. */
  protected TSNode argumentValue(TSNode argument) {
    return argument;
  }

  /**
   * Segments of a plain name chain such as {@code a.b.c}; {@code null} for any other expression.
   */
  protected abstract List<String> pathSegments(TreeSitterSyntaxTree tree, TSNode node);

  protected boolean constructsByCapitalizedCall() {
    return false;
  }

  protected String normalizeReceiver(TreeSitterSyntaxTree tree, String receiver) {
    return receiver;
  }

  @Override
  public TreeSitterSyntaxTree parseTree(String relativePath, String content) {
    TSTree tree = parsers.get().parseString(null, content);
    TSNode root = tree.getRootNode();
    if (root.hasError()) {
      throw new SourceParseException(describeError(root));
    }
    return new TreeSitterSyntaxTree(relativePath, language(), content, tree);
  }

  @Override
  public List<SymbolDescriptor> extractSymbols(TreeSitterSyntaxTree tree) {
    tree.resetScopes();
    List<SymbolDescriptor.Builder> builders = collectSymbols(tree);
    tree.markSymbolsExtracted();
    return builders.stream().map(SymbolDescriptor.Builder::build).collect(Collectors.toList());
  }

  @Override
  public List<CallSite> extractCalls(TreeSitterSyntaxTree tree) {
    if (!tree.symbolsExtracted()) {
      extractSymbols(tree);
    }
    List<TreeSitterSyntaxTree.Scope> scopes = new ArrayList<>(tree.scopes());
    scopes.sort(Comparator.comparingInt(TreeSitterSyntaxTree.Scope::width));
    List<CallSite> calls = new ArrayList<>();
    Deque<TSNode> pending = new ArrayDeque<>();
    pending.push(tree.root());
    while (!pending.isEmpty()) {
      TSNode node = pending.pop();
      if (skippedTypes().contains(node.getType())) {
        continue;
      }
      if (classify(node) == CanonicalNodeKind.CALL_SITE) {
        int owner = ownerOf(scopes, node.getStartByte());
        if (owner >= 0) {
          recordCall(tree, node, owner, calls);
        }
      }
      for (int i = node.getNamedChildCount() - 1; i >= 0; i--) {
        pending.push(node.getNamedChild(i));
      }
    }
    return calls;
  }

  /** Maps a raw node onto the canonical node roles. */
  protected CanonicalNodeKind classify(TSNode node) {
    String type = node.getType();
    if (definitionTypes().contains(type)) {
      return CanonicalNodeKind.SYMBOL_DEFINITION;
    }
    if (callTypes().contains(type)) {
      return CanonicalNodeKind.CALL_SITE;
    }
    if (identifierTypes().contains(type)) {
      return CanonicalNodeKind.IDENTIFIER_LEAF;
    }
    return CanonicalNodeKind.OTHER;
  }

  private void recordCall(
      TreeSitterSyntaxTree tree, TSNode node, int owner, List<CallSite> calls) {
    Callee callee = callee(tree, node);
    if (callee == null || isAbsent(callee.name())) {
      return;
    }
    String name = tree.text(callee.name()).strip();
    if (name.isEmpty()) {
      return;
    }
    Receiver receiver = receiverOf(tree, callee.receiver());
    CallKind kind = callee.kind();
    if (kind == CallKind.INVOCATION
        && constructsByCapitalizedCall()
        && receiver.path() == null
        && !receiver.chained()
        && Character.isUpperCase(name.charAt(0))) {
      kind = CallKind.CONSTRUCTION;
    }
    calls.add(
        new CallSite(
            owner, name, receiver.path(), kind, receiver.chained(), tree.line(callee.name())));
    collectArguments(tree, argumentList(node), owner, calls);
  }

  private void collectArguments(
      TreeSitterSyntaxTree tree, TSNode arguments, int owner, List<CallSite> calls) {
    if (isAbsent(arguments)) {
      return;
    }
    for (int i = 0; i < arguments.getNamedChildCount(); i++) {
      TSNode value = argumentValue(arguments.getNamedChild(i));
      if (isAbsent(value)) {
        continue;
      }
      String name = argumentName(tree, value);
      if (name != null && !SKIPPED_ARGUMENT_IDENTIFIERS.contains(name)) {
        calls.add(new CallSite(owner, name, null, CallKind.ARGUMENT, false, tree.line(value)));
      }
    }
  }

  private String argumentName(TreeSitterSyntaxTree tree, TSNode value) {
    if (classify(value) == CanonicalNodeKind.IDENTIFIER_LEAF) {
      return tree.text(value);
    }
    List<String> segments = pathSegments(tree, value);
    if (segments != null && segments.size() == 2 && isSelf(segments.get(0))) {
      return segments.get(1);
    }
    return null;
  }

  private Receiver receiverOf(TreeSitterSyntaxTree tree, TSNode node) {
    if (isAbsent(node)) {
      return new Receiver(null, false);
    }
    List<String> segments = pathSegments(tree, node);
    if (segments == null || segments.isEmpty()) {
      return new Receiver(null, true);
    }
    if (isSelf(segments.get(0))) {
      if (segments.size() == 1) {
        return new Receiver(CallSite.SELF_RECEIVER, false);
      }
      segments = segments.subList(1, segments.size());
    }
    return new Receiver(normalizeReceiver(tree, String.join(".", segments)), false);
  }

  private static int ownerOf(List<TreeSitterSyntaxTree.Scope> narrowestFirst, int offset) {
    for (TreeSitterSyntaxTree.Scope scope : narrowestFirst) {
      if (scope.contains(offset)) {
        return scope.symbolIndex();
      }
    }
    return -1;
  }

  private String describeError(TSNode root) {
    Deque<TSNode> pending = new ArrayDeque<>();
    pending.push(root);
    while (!pending.isEmpty()) {
      TSNode node = pending.pop();
      int line = node.getStartPoint().getRow() + 1;
      if (node.isMissing()) {
        return "Missing '" + node.getType() + "' at line " + line;
      }
      if ("ERROR".equals(node.getType())) {
        return "Syntax error at line " + line;
      }
      for (int i = node.getChildCount() - 1; i >= 0; i--) {
        TSNode child = node.getChild(i);
        if (child.hasError()) {
          pending.push(child);
        }
      }
    }
    return "Syntax error in " + language().id() + " source";
  }

  private TSParser newParser() {
    TSParser parser = new TSParser();
    if (!parser.setLanguage(grammar())) {
      throw new IllegalStateException("Cannot load the " + language().id() + " grammar");
    }
    return parser;
  }

  // Helpers shared by the language adapters.

  protected static boolean isAbsent(TSNode node) {
    return node == null || node.isNull();
  }

  protected static TSNode field(TSNode node, String name) {
    if (isAbsent(node)) {
      return null;
    }
    TSNode child = node.getChildByFieldName(name);
    return isAbsent(child) ? null : child;
  }

  /** First direct named child whose type is one of {@code types}. */
  protected static TSNode childOfType(TSNode node, Set<String> types) {
    if (isAbsent(node)) {
      return null;
    }
    for (int i = 0; i < node.getNamedChildCount(); i++) {
      TSNode child = node.getNamedChild(i);
      if (types.contains(child.getType())) {
        return child;
      }
    }
    return null;
  }

  protected static TSNode childOfType(TSNode node, String type) {
    return childOfType(node, Set.of(type));
  }

  protected static List<TSNode> childrenOfType(TSNode node, Set<String> types) {
    List<TSNode> children = new ArrayList<>();
    if (isAbsent(node)) {
      return children;
    }
    for (int i = 0; i < node.getNamedChildCount(); i++) {
      TSNode child = node.getNamedChild(i);
      if (types.contains(child.getType())) {
        children.add(child);
      }
    }
    return children;
  }

  protected static List<TSNode> namedChildren(TSNode node) {
    List<TSNode> children = new ArrayList<>();
    if (isAbsent(node)) {
      return children;
    }
    for (int i = 0; i < node.getNamedChildCount(); i++) {
      children.add(node.getNamedChild(i));
    }
    return children;
  }

  /** Whether a direct child, named or not, is the token {@code token}. */
  protected static boolean hasToken(TSNode node, String token) {
    if (isAbsent(node)) {
      return false;
    }
    for (int i = 0; i < node.getChildCount(); i++) {
      if (token.equals(node.getChild(i).getType())) {
        return true;
      }
    }
    return false;
  }

  protected static boolean isSelf(String word) {
    return "this".equals(word) || "self".equals(word);
  }

  /** Registers a symbol spanning {@code first..last} and returns its index. */
  protected int register(
      TreeSitterSyntaxTree tree,
      List<SymbolDescriptor.Builder> symbols,
      SymbolDescriptor.Builder builder,
      TSNode first,
      TSNode last) {
    int index = symbols.size();
    symbols.add(builder);
    tree.addScope(index, first.getStartByte(), last.getEndByte());
    int startLine = first.getStartPoint().getRow() + 1;
    int endLine = last.getEndPoint().getRow() + 1;
    builder
        .span(
            startLine,
            first.getStartPoint().getColumn(),
            endLine,
            last.getEndPoint().getColumn())
        .sourceText(tree.lines(startLine, endLine));
    return index;
  }

  protected SymbolDescriptor.Builder moduleSymbol(
      TreeSitterSyntaxTree tree, String name, String qualifiedName) {
    SymbolDescriptor.Builder module =
        SymbolDescriptor.builder(name, SymbolKind.MODULE)
            .qualifiedName(qualifiedName)
            .signature("module " + qualifiedName);
    module
        .span(1, 0, tree.lineCount(), tree.lastLine().length())
        .sourceText(tree.content());
    tree.addScope(0, 0, Integer.MAX_VALUE);
    return module;
  }

  /** Declaration header between two byte offsets collapsed onto one line, without a body opener. */
  protected String signature(TreeSitterSyntaxTree tree, int startByte, int endByte) {
    String header = WHITESPACE.matcher(tree.text(startByte, endByte)).replaceAll(" ").strip();
    while (header.endsWith(":") || header.endsWith("=") || header.endsWith("{")) {
      header = header.substring(0, header.length() - 1).stripTrailing();
    }
    return header;
  }

  /**
   * Text of an annotation or decorator argument: the unquoted string literals it contains joined
   * with commas, otherwise its source text.
   */
  protected String valueText(TreeSitterSyntaxTree tree, TSNode value) {
    List<String> strings = new ArrayList<>();
    Deque<TSNode> pending = new ArrayDeque<>();
    pending.push(value);
    while (!pending.isEmpty()) {
      TSNode node = pending.pop();
      if (stringTypes().contains(node.getType())) {
        strings.add(unquote(tree.text(node)));
        continue;
      }
      for (int i = node.getNamedChildCount() - 1; i >= 0; i--) {
        pending.push(node.getNamedChild(i));
      }
    }
    if (!strings.isEmpty()) {
      return String.join(",", strings);
    }
    return WHITESPACE.matcher(tree.text(value)).replaceAll(" ").strip();
  }

  /** Strips prefixes, raw-string hashes and quotes from a string literal. */
  protected static String unquote(String literal) {
    String text = literal.strip();
    int open = 0;
    while (open < text.length() && "\"'`".indexOf(text.charAt(open)) < 0) {
      open++;
    }
    if (open == text.length()) {
      return text;
    }
    char quote = text.charAt(open);
    int close = text.lastIndexOf(quote);
    if (close <= open) {
      return text.substring(open + 1);
    }
    String triple = String.valueOf(quote).repeat(3);
    if (text.startsWith(triple, open) && close - 2 > open + 2) {
      return text.substring(open + 3, close - 2);
    }
    return text.substring(open + 1, close);
  }

  /**
   * Type constructed by a callee path such as {@code Foo}, {@code pkg.Foo} or {@code Foo.new};
   * {@code null} when neither of the last two segments is capitalized.
   */
  protected static String constructedType(List<String> calleePath) {
    if (calleePath == null || calleePath.isEmpty()) {
      return null;
    }
    String last = calleePath.get(calleePath.size() - 1);
    if (!last.isEmpty() && Character.isUpperCase(last.charAt(0))) {
      return last;
    }
    if (calleePath.size() > 1) {
      String beforeLast = calleePath.get(calleePath.size() - 2);
      if (!beforeLast.isEmpty() && Character.isUpperCase(beforeLast.charAt(0))) {
        return beforeLast;
      }
    }
    return null;
  }

  /** Dotted module path derived from a file path. */
  protected static String modulePath(String relativePath, List<String> strippedPrefixes) {
    String path = relativePath.replace('\\', '/');
    for (String prefix : strippedPrefixes) {
      if (path.startsWith(prefix)) {
        path = path.substring(prefix.length());
        break;
      }
    }
    int dot = path.lastIndexOf('.');
    int slash = path.lastIndexOf('/');
    if (dot > slash) {
      path = path.substring(0, dot);
    }
    return path.replace('/', '.').replace('-', '_');
  }

  protected static String qualify(String prefix, String name) {
    return prefix == null || prefix.isEmpty() ? name : prefix + "." + name;
  }

  /**
   * Target of a call.
   *
   * @param name node holding the invoked or constructed name
   * @param receiver expression the call is made on, {@code null} for a bare call
   */
  public record Callee(TSNode name, TSNode receiver, CallKind kind) {}

  private record Receiver(String path, boolean chained) {}
}
