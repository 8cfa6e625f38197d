package com.aiadvent.codegraph.parser.kotlin;

import com.aiadvent.codegraph.parser.CanonicalNodeKind;
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
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TreeSitterKotlin;

/**
 * Kotlin adapter. Top-level functions live in the file facade ({@code RoutingKt} for {@code
 * routing.kt}) but are qualified by the package alone.
 */
@Component
public class KotlinLanguageAdapter extends TreeSitterLanguageAdapter {

  private static final Set<String> DEFINITIONS =
      Set.of("class_declaration", "object_declaration", "companion_object", "function_declaration");

  private static final Set<String> CALLS = Set.of("call_expression", "constructor_invocation");

  private static final Set<String> IDENTIFIERS = Set.of("simple_identifier");

  private static final Set<String> STRINGS =
      Set.of("string_literal", "line_string_literal", "multi_line_string_literal");

  private static final Set<String> ANNOTATIONS = Set.of("annotation", "file_annotation");

  private static final Set<String> TYPE_BODIES = Set.of("class_body", "enum_class_body");

  private static final Set<String> NAMES =
      Set.of("type_identifier", "simple_identifier", "identifier");

  private static final Set<String> TYPES =
      Set.of(
          "user_type", "nullable_type", "non_nullable_type", "parenthesized_type",
          "function_type", "type");

  private static final Set<String> PATHS = Set.of("identifier", "qualified_identifier");

  @Override
  public Language language() {
    return Language.KOTLIN;
  }

  @Override
  protected TSLanguage grammar() {
    return new TreeSitterKotlin();
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
    return ANNOTATIONS;
  }

  @Override
  protected boolean constructsByCapitalizedCall() {
    return true;
  }

  @Override
  public String extractPackage(TreeSitterSyntaxTree tree) {
    TSNode header = childOfType(tree.root(), "package_header");
    TSNode path = childOfType(header, PATHS);
    return path != null ? dotted(tree, path) : "";
  }

  @Override
  public List<ImportDirective> extractImports(TreeSitterSyntaxTree tree) {
    List<ImportDirective> imports = new ArrayList<>();
    List<TSNode> headers = new ArrayList<>();
    for (TSNode child : namedChildren(tree.root())) {
      if ("import_list".equals(child.getType())) {
        headers.addAll(childrenOfType(child, Set.of("import_header")));
      } else if ("import_header".equals(child.getType())) {
        headers.add(child);
      }
    }
    for (TSNode header : headers) {
      TSNode path = childOfType(header, PATHS);
      if (path == null) {
        continue;
      }
      boolean wildcard =
          childOfType(header, "wildcard_import") != null || hasToken(header, "*");
      TSNode alias = childOfType(header, "import_alias");
      TSNode aliasName = alias != null ? childOfType(alias, NAMES) : null;
      imports.add(
          new ImportDirective(
              dotted(tree, path),
              aliasName != null ? tree.text(aliasName) : null,
              wildcard,
              tree.line(header)));
    }
    return imports;
  }

  @Override
  protected List<SymbolDescriptor.Builder> collectSymbols(TreeSitterSyntaxTree tree) {
    List<SymbolDescriptor.Builder> symbols = new ArrayList<>();
    String packageName = extractPackage(tree);
    String facade = facadeName(tree.relativePath());
    symbols.add(moduleSymbol(tree, facade, qualify(packageName, facade)));
    scan(tree, tree.root(), 0, packageName, false, symbols);
    return symbols;
  }

  private void scan(
      TreeSitterSyntaxTree tree,
      TSNode container,
      int parentIndex,
      String prefix,
      boolean typeBody,
      List<SymbolDescriptor.Builder> symbols) {
    for (TSNode child : namedChildren(container)) {
      if (classify(child) != CanonicalNodeKind.SYMBOL_DEFINITION) {
        if ("property_declaration".equals(child.getType())) {
          recordProperty(tree, child, symbols.get(parentIndex));
        }
      } else if ("function_declaration".equals(child.getType())) {
        readFunction(tree, child, parentIndex, prefix, typeBody, symbols);
      } else {
        readType(tree, child, parentIndex, prefix, symbols);
      }
    }
  }

  private void readType(
      TreeSitterSyntaxTree tree,
      TSNode node,
      int parentIndex,
      String prefix,
      List<SymbolDescriptor.Builder> symbols) {
    TSNode nameNode = childOfType(node, NAMES);
    boolean companion = "companion_object".equals(node.getType());
    String name;
    if (nameNode != null) {
      name = tree.text(nameNode);
    } else if (companion) {
      name = "Companion";
    } else {
      return;
    }
    TSNode body = childOfType(node, TYPE_BODIES);
    boolean enumType =
        hasToken(node, "enum") || (body != null && "enum_class_body".equals(body.getType()));
    SymbolKind kind =
        hasToken(node, "interface")
            ? SymbolKind.INTERFACE
            : enumType ? SymbolKind.ENUM : SymbolKind.CLASS;
    String qualifiedName = qualify(prefix, name);
    SymbolDescriptor.Builder builder =
        SymbolDescriptor.builder(name, kind).qualifiedName(qualifiedName).parentIndex(parentIndex);
    readModifiers(tree, node, builder);
    if (hasToken(node, "enum")) {
      builder.modifier("enum");
    }
    if (companion) {
      builder.modifier("companion");
    }
    TSNode constructor = childOfType(node, "primary_constructor");
    List<TSNode> parameters = childrenOfType(constructor, Set.of("class_parameter"));
    parameters.addAll(
        childrenOfType(childOfType(constructor, "class_parameters"), Set.of("class_parameter")));
    for (TSNode parameter : parameters) {
      readParameter(tree, parameter, builder);
    }
    for (TSNode specifier : delegationSpecifiers(node)) {
      TSNode target = specifier.getNamedChildCount() > 0 ? specifier.getNamedChild(0) : null;
      if (target != null && !TYPES.contains(target.getType())) {
        target = childOfType(target, TYPES);
      }
      builder.superType(typeName(tree, target));
    }
    builder.signature(
        signature(
            tree, declarationStart(node), body != null ? body.getStartByte() : node.getEndByte()));
    int index = register(tree, symbols, builder, node, node);
    if (body != null) {
      scan(tree, body, index, qualifiedName, true, symbols);
    }
  }

  private List<TSNode> delegationSpecifiers(TSNode node) {
    List<TSNode> specifiers = new ArrayList<>();
    for (TSNode child : namedChildren(node)) {
      if ("delegation_specifier".equals(child.getType())) {
        specifiers.add(child);
      } else if ("delegation_specifiers".equals(child.getType())) {
        specifiers.addAll(childrenOfType(child, Set.of("delegation_specifier")));
      }
    }
    return specifiers;
  }

  private void readFunction(
      TreeSitterSyntaxTree tree,
      TSNode node,
      int parentIndex,
      String prefix,
      boolean typeBody,
      List<SymbolDescriptor.Builder> symbols) {
    TSNode nameNode = field(node, "name");
    if (nameNode == null) {
      nameNode = childOfType(node, "simple_identifier");
    }
    if (nameNode == null) {
      return;
    }
    String name = tree.text(nameNode);
    SymbolDescriptor.Builder builder =
        SymbolDescriptor.builder(name, typeBody ? SymbolKind.METHOD : SymbolKind.FUNCTION)
            .qualifiedName(qualify(prefix, name))
            .parentIndex(parentIndex);
    readModifiers(tree, node, builder);
    TSNode parameters = childOfType(node, "function_value_parameters");
    for (TSNode parameter : childrenOfType(parameters, Set.of("parameter"))) {
      readParameter(tree, parameter, builder);
    }
    TSNode body = childOfType(node, "function_body");
    builder.signature(
        signature(
            tree, declarationStart(node), body != null ? body.getStartByte() : node.getEndByte()));
    if (body != null) {
      collectLocals(tree, body, builder);
    }
    register(tree, symbols, builder, node, node);
  }

  private void readParameter(
      TreeSitterSyntaxTree tree, TSNode parameter, SymbolDescriptor.Builder builder) {
    TSNode nameNode = childOfType(parameter, Set.of("simple_identifier", "identifier"));
    if (nameNode == null) {
      return;
    }
    String name = tree.text(nameNode);
    builder.parameter(tree.text(nameNode.getStartByte(), parameter.getEndByte()).strip());
    builder.declaredType(name, typeName(tree, childOfType(parameter, TYPES)));
  }

  private void readModifiers(
      TreeSitterSyntaxTree tree, TSNode declaration, SymbolDescriptor.Builder builder) {
    for (TSNode modifier : namedChildren(childOfType(declaration, "modifiers"))) {
      if (ANNOTATIONS.contains(modifier.getType())) {
        AnnotationUsage annotation = readAnnotation(tree, modifier);
        if (annotation != null) {
          builder.annotation(annotation);
        }
      } else {
        builder.modifier(tree.text(modifier).strip());
      }
    }
  }

  /** Start of a declaration past its leading annotations. */
  private int declarationStart(TSNode node) {
    for (int i = 0; i < node.getChildCount(); i++) {
      TSNode child = node.getChild(i);
      if (!"modifiers".equals(child.getType())) {
        return child.getStartByte();
      }
      for (TSNode modifier : namedChildren(child)) {
        if (!ANNOTATIONS.contains(modifier.getType())) {
          return modifier.getStartByte();
        }
      }
    }
    return node.getStartByte();
  }

  private void recordProperty(
      TreeSitterSyntaxTree tree, TSNode property, SymbolDescriptor.Builder target) {
    TSNode variable = childOfType(property, "variable_declaration");
    TSNode nameNode = childOfType(variable, Set.of("simple_identifier", "identifier"));
    if (nameNode == null) {
      return;
    }
    String name = tree.text(nameNode);
    TSNode type = childOfType(variable, TYPES);
    if (type != null) {
      target.declaredType(name, typeName(tree, type));
      return;
    }
    TSNode initializer = initializerOf(property);
    if (initializer != null && "call_expression".equals(initializer.getType())) {
      target.declaredType(
          name, constructedType(pathSegments(tree, initializer.getNamedChild(0))));
    }
  }

  private TSNode initializerOf(TSNode property) {
    boolean assigned = false;
    for (int i = 0; i < property.getChildCount(); i++) {
      TSNode child = property.getChild(i);
      if ("=".equals(child.getType())) {
        assigned = true;
      } else if (assigned && child.isNamed()) {
        return child;
      }
    }
    return null;
  }

  private void collectLocals(
      TreeSitterSyntaxTree tree, TSNode body, SymbolDescriptor.Builder builder) {
    Deque<TSNode> pending = new ArrayDeque<>();
    pending.push(body);
    while (!pending.isEmpty()) {
      TSNode node = pending.pop();
      if ("property_declaration".equals(node.getType())) {
        recordProperty(tree, node, builder);
      }
      for (int i = node.getNamedChildCount() - 1; i >= 0; i--) {
        pending.push(node.getNamedChild(i));
      }
    }
  }

  private AnnotationUsage readAnnotation(TreeSitterSyntaxTree tree, TSNode annotation) {
    TSNode invocation = childOfType(annotation, "constructor_invocation");
    TSNode type = childOfType(invocation != null ? invocation : annotation, "user_type");
    if (type == null) {
      return null;
    }
    Map<String, String> arguments = new LinkedHashMap<>();
    int position = 0;
    TSNode values = childOfType(invocation, "value_arguments");
    for (TSNode argument : childrenOfType(values, Set.of("value_argument"))) {
      if (argument.getNamedChildCount() == 0) {
        continue;
      }
      TSNode value = argument.getNamedChild(argument.getNamedChildCount() - 1);
      if (hasToken(argument, "=") && argument.getNamedChildCount() > 1) {
        arguments.put(tree.text(argument.getNamedChild(0)), valueText(tree, value));
      } else {
        arguments.put("_" + position++, valueText(tree, value));
      }
    }
    return new AnnotationUsage(userTypePath(tree, type), arguments);
  }

  @Override
  protected Callee callee(TreeSitterSyntaxTree tree, TSNode call) {
    if ("constructor_invocation".equals(call.getType())) {
      TSNode type = childOfType(call, "user_type");
      TSNode name = type != null ? lastTypeIdentifier(type) : null;
      return name != null ? new Callee(name, null, CallKind.CONSTRUCTION) : null;
    }
    TSNode target = call.getNamedChildCount() > 0 ? call.getNamedChild(0) : null;
    if (isAbsent(target)) {
      return null;
    }
    if ("simple_identifier".equals(target.getType())) {
      return new Callee(target, null, CallKind.INVOCATION);
    }
    if ("navigation_expression".equals(target.getType())) {
      TSNode suffix = childOfType(target, "navigation_suffix");
      TSNode name = childOfType(suffix, "simple_identifier");
      if (name == null) {
        return null;
      }
      return new Callee(name, target.getNamedChild(0), CallKind.INVOCATION);
    }
    return null;
  }

  @Override
  protected TSNode argumentList(TSNode call) {
    if ("constructor_invocation".equals(call.getType())) {
      return childOfType(call, "value_arguments");
    }
    return childOfType(childOfType(call, "call_suffix"), "value_arguments");
  }

  @Override
  protected TSNode argumentValue(TSNode argument) {
    if (!"value_argument".equals(argument.getType()) || argument.getNamedChildCount() == 0) {
      return argument;
    }
    TSNode value = argument.getNamedChild(argument.getNamedChildCount() - 1);
    if ("callable_reference".equals(value.getType()) && value.getNamedChildCount() == 1) {
      return value.getNamedChild(0);
    }
    return value;
  }

  @Override
  protected List<String> pathSegments(TreeSitterSyntaxTree tree, TSNode node) {
    if (isAbsent(node)) {
      return null;
    }
    return switch (node.getType()) {
      case "simple_identifier" -> List.of(tree.text(node));
      case "this_expression" -> List.of("this");
      case "super_expression" -> List.of("super");
      case "postfix_expression" ->
          hasToken(node, "!!") ? pathSegments(tree, node.getNamedChild(0)) : null;
      case "navigation_expression" -> navigationPath(tree, node);
      default -> null;
    };
  }

  private List<String> navigationPath(TreeSitterSyntaxTree tree, TSNode node) {
    List<String> object = pathSegments(tree, node.getNamedChild(0));
    TSNode name = childOfType(childOfType(node, "navigation_suffix"), "simple_identifier");
    if (object == null || name == null) {
      return null;
    }
    List<String> segments = new ArrayList<>(object);
    segments.add(tree.text(name));
    return segments;
  }

  /** Simple name of a type: {@code List<Order>?} gives {@code List}. */
  private String typeName(TreeSitterSyntaxTree tree, TSNode type) {
    if (isAbsent(type)) {
      return null;
    }
    return switch (type.getType()) {
      case "user_type" -> {
        TSNode last = lastTypeIdentifier(type);
        yield last != null ? tree.text(last) : null;
      }
      case "type_identifier", "simple_identifier" -> tree.text(type);
      case "nullable_type", "non_nullable_type", "parenthesized_type", "type" ->
          type.getNamedChildCount() > 0 ? typeName(tree, type.getNamedChild(0)) : null;
      default -> null;
    };
  }

  private TSNode lastTypeIdentifier(TSNode userType) {
    TSNode last = null;
    for (TSNode child : namedChildren(userType)) {
      if ("type_identifier".equals(child.getType())) {
        last = child;
      } else if ("simple_user_type".equals(child.getType())) {
        TSNode name = childOfType(child, NAMES);
        last = name != null ? name : last;
      }
    }
    return last;
  }

  private String userTypePath(TreeSitterSyntaxTree tree, TSNode userType) {
    List<String> segments = new ArrayList<>();
    for (TSNode child : namedChildren(userType)) {
      if ("type_identifier".equals(child.getType())) {
        segments.add(tree.text(child));
      } else if ("simple_user_type".equals(child.getType())) {
        TSNode name = childOfType(child, NAMES);
        if (name != null) {
          segments.add(tree.text(name));
        }
      }
    }
    return segments.isEmpty() ? dotted(tree, userType) : String.join(".", segments);
  }

  private static String dotted(TreeSitterSyntaxTree tree, TSNode node) {
    return tree.text(node).replaceAll("\\s+", "");
  }

  static String facadeName(String relativePath) {
    String path = relativePath.replace('\\', '/');
    String fileName = path.substring(path.lastIndexOf('/') + 1);
    int dot = fileName.indexOf('.');
    String base = dot > 0 ? fileName.substring(0, dot) : fileName;
    if (base.isEmpty()) {
      return "FileKt";
    }
    return Character.toUpperCase(base.charAt(0)) + base.substring(1) + "Kt";
  }
}
