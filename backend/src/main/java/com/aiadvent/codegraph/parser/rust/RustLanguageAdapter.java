package com.aiadvent.codegraph.parser.rust;

import com.aiadvent.codegraph.parser.model.AnnotationUsage;
import com.aiadvent.codegraph.parser.model.CallKind;
import com.aiadvent.codegraph.parser.model.ImportDirective;
import com.aiadvent.codegraph.parser.model.Language;
import com.aiadvent.codegraph.parser.model.SymbolDescriptor;
import com.aiadvent.codegraph.parser.model.SymbolKind;
import com.aiadvent.codegraph.parser.treesitter.TreeSitterLanguageAdapter;
import com.aiadvent.codegraph.parser.treesitter.TreeSitterSyntaxTree;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TreeSitterRust;

/**
 * Rust adapter. Module paths start at {@code crate} and use dots; methods declared in an {@code
 * impl} block are qualified by the implemented type, the block itself by {@code Type$impl}.
 */
@Component
public class RustLanguageAdapter extends TreeSitterLanguageAdapter {

  private static final Set<String> DEFINITIONS =
      Set.of(
          "function_item", "function_signature_item", "struct_item", "union_item", "enum_item",
          "trait_item", "impl_item", "mod_item");

  private static final Set<String> CALLS = Set.of("call_expression");

  private static final Set<String> IDENTIFIERS = Set.of("identifier");

  private static final Set<String> STRINGS = Set.of("string_literal", "raw_string_literal");

  private static final Set<String> COMMENTS = Set.of("line_comment", "block_comment");

  private static final Set<String> PATH_ROOTS = Set.of("identifier", "self", "crate", "super");

  private static final Set<String> FUNCTION_MODIFIERS =
      Set.of("async", "unsafe", "const", "default");

  // Variant constructors of the prelude enums are not calls of interest.
  private static final Set<String> PRELUDE_VARIANTS = Set.of("Some", "Ok", "Err");

  private static final String CRATE = "crate";

  @Override
  public Language language() {
    return Language.RUST;
  }

  @Override
  protected TSLanguage grammar() {
    return new TreeSitterRust();
  }

  @Override
  protected Set<String> definitionTypes() {
    return DEFINITIONS;
  }

  @Override
  protected Set<String> callTypes() {
    return CALLS;
  }

  @Override
  protected Set<String> identifierTypes() {
    return IDENTIFIERS;
  }

  @Override
  protected Set<String> stringTypes() {
    return STRINGS;
  }

  @Override
  protected Set<String> skippedTypes() {
    return Set.of("attribute_item", "inner_attribute_item");
  }

  @Override
  protected String normalizeReceiver(TreeSitterSyntaxTree tree, String receiver) {
    if (receiver.equals("super") || receiver.startsWith("super.")) {
      return absolutePath(modulePath(tree.relativePath()), receiver);
    }
    return receiver;
  }

  @Override
  public String extractPackage(TreeSitterSyntaxTree tree) {
    return modulePath(tree.relativePath());
  }

  @Override
  public List<ImportDirective> extractImports(TreeSitterSyntaxTree tree) {
    List<ImportDirective> imports = new ArrayList<>();
    String module = modulePath(tree.relativePath());
    Deque<TSNode> pending = new ArrayDeque<>();
    pending.push(tree.root());
    while (!pending.isEmpty()) {
      TSNode node = pending.pop();
      if ("use_declaration".equals(node.getType())) {
        TSNode argument = field(node, "argument");
        if (argument != null) {
          readUseTree(tree, argument, "", module, tree.line(node), imports);
        }
        continue;
      }
      for (int i = node.getNamedChildCount() - 1; i >= 0; i--) {
        pending.push(node.getNamedChild(i));
      }
    }
    return imports;
  }

  /** Expands one use-tree below the dotted {@code prefix}. */
  private void readUseTree(
      TreeSitterSyntaxTree tree,
      TSNode node,
      String prefix,
      String module,
      int line,
      List<ImportDirective> imports) {
    switch (node.getType()) {
      case "use_as_clause" -> {
        TSNode alias = field(node, "alias");
        String name = alias != null ? tree.text(alias) : null;
        addUse(prefix, flatten(tree, field(node, "path")), "_".equals(name) ? null : name,
            false, module, line, imports);
      }
      case "use_wildcard" -> {
        String path = node.getNamedChildCount() > 0 ? flatten(tree, node.getNamedChild(0)) : "";
        if (!prefix.isEmpty() || !path.isEmpty()) {
          addUse(prefix, path, null, true, module, line, imports);
        }
      }
      case "scoped_use_list" -> {
        String base = join(prefix, flatten(tree, field(node, "path")));
        for (TSNode child : namedChildren(field(node, "list"))) {
          readUseTree(tree, child, base, module, line, imports);
        }
      }
      case "use_list" -> {
        for (TSNode child : namedChildren(node)) {
          readUseTree(tree, child, prefix, module, line, imports);
        }
      }
      default -> {
        if (PATH_ROOTS.contains(node.getType()) || "scoped_identifier".equals(node.getType())) {
          addUse(prefix, flatten(tree, node), null, false, module, line, imports);
        }
      }
    }
  }

  private static void addUse(
      String prefix,
      String path,
      String alias,
      boolean wildcard,
      String module,
      int line,
      List<ImportDirective> imports) {
    String full = join(prefix, path);
    if (full.equals("self") || full.endsWith(".self")) {
      full = full.substring(0, Math.max(0, full.length() - ".self".length()));
    }
    if (!full.isEmpty()) {
      imports.add(new ImportDirective(absolutePath(module, full), alias, wildcard, line));
    }
  }

  private String flatten(TreeSitterSyntaxTree tree, TSNode node) {
    if (isAbsent(node)) {
      return "";
    }
    if ("scoped_identifier".equals(node.getType())) {
      return join(flatten(tree, field(node, "path")), tree.text(field(node, "name")));
    }
    return tree.text(node);
  }

  private static String join(String prefix, String path) {
    if (prefix.isEmpty()) {
      return path;
    }
    return path.isEmpty() ? prefix : prefix + "." + path;
  }

  @Override
  protected List<SymbolDescriptor.Builder> collectSymbols(TreeSitterSyntaxTree tree) {
    List<SymbolDescriptor.Builder> symbols = new ArrayList<>();
    String module = modulePath(tree.relativePath());
    symbols.add(moduleSymbol(tree, module.substring(module.lastIndexOf('.') + 1), module));
    scan(tree, tree.root(), new Context(0, module, module, false), symbols);
    return symbols;
  }

  /** Scans items and statements; outer attributes attach to the item that follows them. */
  private void scan(
      TreeSitterSyntaxTree tree,
      TSNode container,
      Context context,
      List<SymbolDescriptor.Builder> symbols) {
    List<AnnotationUsage> attributes = new ArrayList<>();
    TSNode firstAttribute = null;
    for (TSNode child : namedChildren(container)) {
      String type = child.getType();
      if ("attribute_item".equals(type)) {
        readAttribute(tree, child, attributes);
        firstAttribute = firstAttribute != null ? firstAttribute : child;
        continue;
      }
      if (COMMENTS.contains(type)) {
        continue;
      }
      Item item = new Item(child, firstAttribute != null ? firstAttribute : child, attributes);
      switch (type) {
        case "function_item", "function_signature_item" ->
            readFunction(tree, item, context, symbols);
        case "struct_item", "union_item", "enum_item" -> readStruct(tree, item, context, symbols);
        case "trait_item" -> readTrait(tree, item, context, symbols);
        case "impl_item" -> readImpl(tree, item, context, symbols);
        case "mod_item" -> readModule(tree, item, context, symbols);
        case "let_declaration" -> {
          recordLocal(tree, child, symbols.get(context.parentIndex()));
          scan(tree, child, context, symbols);
        }
        default -> scan(tree, child, context, symbols);
      }
      attributes = new ArrayList<>();
      firstAttribute = null;
    }
  }

  private void readFunction(
      TreeSitterSyntaxTree tree,
      Item item,
      Context context,
      List<SymbolDescriptor.Builder> symbols) {
    TSNode node = item.node();
    TSNode nameNode = field(node, "name");
    if (nameNode == null) {
      return;
    }
    String name = tree.text(nameNode);
    String qualifiedName = qualify(context.prefix(), name);
    SymbolKind kind = context.member() ? SymbolKind.METHOD : SymbolKind.FUNCTION;
    SymbolDescriptor.Builder builder =
        SymbolDescriptor.builder(name, kind)
            .qualifiedName(qualifiedName)
            .parentIndex(context.parentIndex())
            .annotations(item.attributes());
    for (TSNode child : namedChildren(node)) {
      if ("visibility_modifier".equals(child.getType())) {
        builder.modifier("pub");
      } else if ("function_modifiers".equals(child.getType())) {
        readFunctionModifiers(child, builder);
      }
    }
    readParameters(tree, field(node, "parameters"), builder);
    TSNode body = field(node, "body");
    builder.signature(
        signature(tree, node.getStartByte(), body != null ? body.getStartByte() : node.getEndByte())
            .replaceAll(";$", ""));
    int index = register(tree, symbols, builder, item.first(), node);
    if (body != null) {
      scan(tree, body, new Context(index, qualifiedName, context.module(), false), symbols);
    }
  }

  private static void readFunctionModifiers(TSNode modifiers, SymbolDescriptor.Builder builder) {
    for (int i = 0; i < modifiers.getChildCount(); i++) {
      String type = modifiers.getChild(i).getType();
      if (FUNCTION_MODIFIERS.contains(type)) {
        builder.modifier(type);
      } else if ("extern_modifier".equals(type)) {
        builder.modifier("extern");
      }
    }
  }

  private void readParameters(
      TreeSitterSyntaxTree tree, TSNode parameters, SymbolDescriptor.Builder builder) {
    for (TSNode parameter : childrenOfType(parameters, Set.of("parameter"))) {
      builder.parameter(tree.text(parameter));
      TSNode pattern = field(parameter, "pattern");
      if (pattern != null && "identifier".equals(pattern.getType())) {
        builder.declaredType(tree.text(pattern), typeName(tree, field(parameter, "type")));
      }
    }
  }

  private void readStruct(
      TreeSitterSyntaxTree tree,
      Item item,
      Context context,
      List<SymbolDescriptor.Builder> symbols) {
    TSNode node = item.node();
    TSNode nameNode = field(node, "name");
    if (nameNode == null) {
      return;
    }
    String name = tree.text(nameNode);
    SymbolKind kind = "enum_item".equals(node.getType()) ? SymbolKind.ENUM : SymbolKind.STRUCT;
    SymbolDescriptor.Builder builder =
        SymbolDescriptor.builder(name, kind)
            .qualifiedName(qualify(context.prefix(), name))
            .parentIndex(context.parentIndex())
            .annotations(item.attributes());
    TSNode body = field(node, "body");
    if (body != null && "field_declaration_list".equals(body.getType())) {
      for (TSNode declaration : childrenOfType(body, Set.of("field_declaration"))) {
        TSNode fieldName = field(declaration, "name");
        if (fieldName != null) {
          builder.declaredType(tree.text(fieldName), typeName(tree, field(declaration, "type")));
        }
      }
    }
    builder.signature(
        signature(tree, node.getStartByte(), body != null ? body.getStartByte() : node.getEndByte())
            .replaceAll(";$", ""));
    register(tree, symbols, builder, item.first(), node);
  }

  private void readTrait(
      TreeSitterSyntaxTree tree,
      Item item,
      Context context,
      List<SymbolDescriptor.Builder> symbols) {
    TSNode node = item.node();
    TSNode nameNode = field(node, "name");
    TSNode body = field(node, "body");
    if (nameNode == null || body == null) {
      return;
    }
    String name = tree.text(nameNode);
    String qualifiedName = qualify(context.prefix(), name);
    SymbolDescriptor.Builder builder =
        SymbolDescriptor.builder(name, SymbolKind.TRAIT)
            .qualifiedName(qualifiedName)
            .parentIndex(context.parentIndex())
            .annotations(item.attributes());
    for (TSNode bound : namedChildren(field(node, "bounds"))) {
      String superTrait = typeName(tree, bound);
      if (superTrait != null) {
        builder.superType(superTrait);
      }
    }
    builder.signature(signature(tree, node.getStartByte(), body.getStartByte()));
    int index = register(tree, symbols, builder, item.first(), node);
    scan(tree, body, new Context(index, qualifiedName, context.module(), true), symbols);
  }

  private void readImpl(
      TreeSitterSyntaxTree tree,
      Item item,
      Context context,
      List<SymbolDescriptor.Builder> symbols) {
    TSNode node = item.node();
    TSNode body = field(node, "body");
    String typeName = typeName(tree, field(node, "type"));
    if (body == null || typeName == null) {
      return;
    }
    String traitName = typeName(tree, field(node, "trait"));
    String module = context.module();
    String qualifiedName =
        qualify(module, typeName) + "$impl" + (traitName != null ? "$" + traitName : "");
    SymbolDescriptor.Builder builder =
        SymbolDescriptor.builder(typeName, SymbolKind.IMPL)
            .qualifiedName(qualifiedName)
            .parentIndex(context.parentIndex())
            .annotations(item.attributes())
            .declaredType("self", typeName);
    if (traitName != null) {
      builder.superType(traitName);
    }
    builder.signature(signature(tree, node.getStartByte(), body.getStartByte()));
    int index = register(tree, symbols, builder, item.first(), node);
    scan(tree, body, new Context(index, qualify(module, typeName), module, true), symbols);
  }

  private void readModule(
      TreeSitterSyntaxTree tree,
      Item item,
      Context context,
      List<SymbolDescriptor.Builder> symbols) {
    TSNode node = item.node();
    TSNode nameNode = field(node, "name");
    TSNode body = field(node, "body");
    if (nameNode == null || body == null) {
      return;
    }
    String name = tree.text(nameNode);
    String qualifiedName = qualify(context.module(), name);
    SymbolDescriptor.Builder builder =
        SymbolDescriptor.builder(name, SymbolKind.MODULE)
            .qualifiedName(qualifiedName)
            .parentIndex(context.parentIndex())
            .annotations(item.attributes())
            .signature("mod " + name);
    int index = register(tree, symbols, builder, item.first(), node);
    scan(tree, body, new Context(index, qualifiedName, qualifiedName, false), symbols);
  }

  private void recordLocal(
      TreeSitterSyntaxTree tree, TSNode declaration, SymbolDescriptor.Builder owner) {
    TSNode pattern = field(declaration, "pattern");
    if (pattern == null || !"identifier".equals(pattern.getType())) {
      return;
    }
    TSNode type = field(declaration, "type");
    if (type != null) {
      owner.declaredType(tree.text(pattern), typeName(tree, type));
      return;
    }
    TSNode value = field(declaration, "value");
    if (value == null) {
      return;
    }
    if ("call_expression".equals(value.getType())) {
      owner.declaredType(
          tree.text(pattern), constructedType(pathSegments(tree, field(value, "function"))));
    } else if ("struct_expression".equals(value.getType())) {
      owner.declaredType(tree.text(pattern), typeName(tree, field(value, "name")));
    }
  }

  /** {@code #[name(args)]}: positional arguments keyed {@code _0.._n}, {@code k = v} by key. */
  private void readAttribute(
      TreeSitterSyntaxTree tree, TSNode item, List<AnnotationUsage> sink) {
    TSNode attribute = childOfType(item, "attribute");
    if (attribute == null || attribute.getNamedChildCount() == 0) {
      return;
    }
    String name = tree.text(attribute.getNamedChild(0)).replaceAll("\\s+", "");
    Map<String, String> arguments = new LinkedHashMap<>();
    TSNode tokens = field(attribute, "arguments");
    if (tokens != null) {
      List<TSNode> segment = new ArrayList<>();
      for (int i = 1; i < tokens.getChildCount() - 1; i++) {
        TSNode token = tokens.getChild(i);
        if (",".equals(token.getType())) {
          addArgument(tree, segment, arguments);
          segment = new ArrayList<>();
        } else {
          segment.add(token);
        }
      }
      addArgument(tree, segment, arguments);
    }
    sink.add(new AnnotationUsage(name, arguments));
  }

  private void addArgument(
      TreeSitterSyntaxTree tree, List<TSNode> segment, Map<String, String> arguments) {
    if (segment.isEmpty()) {
      return;
    }
    String key = "_" + arguments.size();
    List<TSNode> value = segment;
    if (segment.size() > 2
        && "identifier".equals(segment.get(0).getType())
        && "=".equals(segment.get(1).getType())) {
      key = tree.text(segment.get(0));
      value = segment.subList(2, segment.size());
    }
    TSNode first = value.get(0);
    TSNode last = value.get(value.size() - 1);
    String text =
        value.size() == 1 && STRINGS.contains(first.getType())
            ? unquote(tree.text(first))
            : tree.text(first.getStartByte(), last.getEndByte()).strip();
    arguments.put(key, text);
  }

  private String typeName(TreeSitterSyntaxTree tree, TSNode type) {
    if (isAbsent(type)) {
      return null;
    }
    return switch (type.getType()) {
      case "type_identifier", "identifier", "primitive_type" -> tree.text(type);
      case "generic_type", "reference_type", "pointer_type" -> typeName(tree, field(type, "type"));
      case "scoped_type_identifier" -> typeName(tree, field(type, "name"));
      default -> null;
    };
  }

  @Override
  protected Callee callee(TreeSitterSyntaxTree tree, TSNode call) {
    TSNode function = field(call, "function");
    if (function != null && "generic_function".equals(function.getType())) {
      function = field(function, "function");
    }
    if (function == null) {
      return null;
    }
    return switch (function.getType()) {
      case "identifier" -> PRELUDE_VARIANTS.contains(tree.text(function))
          ? null
          : new Callee(function, null, CallKind.INVOCATION);
      case "scoped_identifier" ->
          new Callee(field(function, "name"), field(function, "path"), CallKind.INVOCATION);
      case "field_expression" ->
          new Callee(field(function, "field"), field(function, "value"), CallKind.INVOCATION);
      default -> null;
    };
  }

  @Override
  protected TSNode argumentList(TSNode call) {
    return field(call, "arguments");
  }

  @Override
  protected TSNode argumentValue(TSNode argument) {
    if ("reference_expression".equals(argument.getType())) {
      return field(argument, "value");
    }
    return argument;
  }

  @Override
  protected List<String> pathSegments(TreeSitterSyntaxTree tree, TSNode node) {
    if (isAbsent(node)) {
      return null;
    }
    if (PATH_ROOTS.contains(node.getType())) {
      return List.of(tree.text(node));
    }
    TSNode head;
    TSNode tail;
    if ("field_expression".equals(node.getType())) {
      head = field(node, "value");
      tail = field(node, "field");
    } else if ("scoped_identifier".equals(node.getType())) {
      head = field(node, "path");
      tail = field(node, "name");
    } else {
      return null;
    }
    if (tail == null) {
      return null;
    }
    List<String> segments = new ArrayList<>();
    if (head != null) {
      List<String> prefix = pathSegments(tree, head);
      if (prefix == null) {
        return null;
      }
      segments.addAll(prefix);
    }
    segments.add(tree.text(tail));
    return segments;
  }

  /** Module path of a file: {@code src/handlers/user.rs} becomes {@code crate.handlers.user}. */
  static String modulePath(String relativePath) {
    String path = relativePath.replace('\\', '/');
    int src = path.lastIndexOf("src/");
    if (src == 0 || (src > 0 && path.charAt(src - 1) == '/')) {
      path = path.substring(src + "src/".length());
    }
    if (path.endsWith(".rs")) {
      path = path.substring(0, path.length() - ".rs".length());
    }
    List<String> segments = new ArrayList<>(Arrays.asList(path.split("/")));
    String last = segments.get(segments.size() - 1);
    if (last.equals("mod") || last.equals("lib") || last.equals("main")) {
      segments.remove(segments.size() - 1);
    }
    segments.removeIf(String::isEmpty);
    segments.add(0, CRATE);
    return String.join(".", segments).replace('-', '_');
  }

  /** Resolves a leading {@code self}/{@code super} against {@code module}. */
  static String absolutePath(String module, String path) {
    List<String> base = new ArrayList<>(Arrays.asList(module.split("\\.")));
    List<String> segments = new ArrayList<>(Arrays.asList(path.split("\\.")));
    if (segments.get(0).equals("self")) {
      segments.remove(0);
      base.addAll(segments);
      return String.join(".", base);
    }
    if (!segments.get(0).equals("super")) {
      return path;
    }
    while (!segments.isEmpty() && segments.get(0).equals("super")) {
      segments.remove(0);
      if (base.size() > 1) {
        base.remove(base.size() - 1);
      }
    }
    base.addAll(segments);
    return String.join(".", base);
  }

  /** An item with the outer attributes written above it. */
  private record Item(TSNode node, TSNode first, List<AnnotationUsage> attributes) {}

  /**
   * Where an item sits.
   *
   * @param module enclosing module path, which qualifies {@code impl} blocks
   * @param member whether functions declared here are methods
   */
  private record Context(int parentIndex, String prefix, String module, boolean member) {}
}
