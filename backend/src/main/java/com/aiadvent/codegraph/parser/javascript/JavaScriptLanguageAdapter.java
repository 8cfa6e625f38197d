package com.aiadvent.codegraph.parser.javascript;

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
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TreeSitterJavascript;

/**
 * JavaScript adapter for CommonJS and ES modules. Function-valued bindings ({@code const f = () =>
 * ...}, {@code exports.f = function ...}) are symbols; anonymous callbacks belong to their
 * enclosing symbol.
 */
@Component
public class JavaScriptLanguageAdapter extends TreeSitterLanguageAdapter {

  private static final Set<String> DEFINITIONS =
      Set.of(
          "function_declaration", "generator_function_declaration", "class_declaration",
          "method_definition");

  private static final Set<String> CALLS = Set.of("call_expression", "new_expression");

  private static final Set<String> IDENTIFIERS = Set.of("identifier");

  private static final Set<String> STRINGS = Set.of("string", "template_string");

  private static final Set<String> FUNCTION_VALUES =
      Set.of("arrow_function", "function_expression", "function", "generator_function");

  private static final Set<String> DECLARATIONS =
      Set.of("lexical_declaration", "variable_declaration");

  private static final Set<String> METHOD_MODIFIERS = Set.of("static", "async", "get", "set");

  private static final List<String> SOURCE_ROOTS = List.of("src/");

  private static final List<String> EXTENSIONS = List.of(".js", ".mjs", ".cjs", ".jsx");

  @Override
  public Language language() {
    return Language.JAVASCRIPT;
  }

  @Override
  protected TSLanguage grammar() {
    return new TreeSitterJavascript();
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
    return Set.of("decorator");
  }

  @Override
  public String extractPackage(TreeSitterSyntaxTree tree) {
    return moduleName(tree.relativePath());
  }

  @Override
  public List<ImportDirective> extractImports(TreeSitterSyntaxTree tree) {
    List<ImportDirective> imports = new ArrayList<>();
    Deque<TSNode> pending = new ArrayDeque<>();
    pending.push(tree.root());
    while (!pending.isEmpty()) {
      TSNode node = pending.pop();
      if ("import_statement".equals(node.getType())) {
        readImport(tree, node, imports);
        continue;
      }
      if ("variable_declarator".equals(node.getType())) {
        readRequire(tree, node, imports);
      }
      for (int i = node.getNamedChildCount() - 1; i >= 0; i--) {
        pending.push(node.getNamedChild(i));
      }
    }
    return imports;
  }

  private void readImport(TreeSitterSyntaxTree tree, TSNode node, List<ImportDirective> imports) {
    TSNode clause = childOfType(node, "import_clause");
    TSNode source = field(node, "source");
    if (clause == null || source == null) {
      return;
    }
    String module = resolveSpecifier(tree.relativePath(), unquote(tree.text(source)));
    if (module.isEmpty()) {
      return;
    }
    int line = tree.line(node);
    for (TSNode part : namedChildren(clause)) {
      if ("identifier".equals(part.getType())) {
        imports.add(new ImportDirective(module, tree.text(part), false, line));
      } else if ("namespace_import".equals(part.getType())) {
        TSNode alias = childOfType(part, "identifier");
        if (alias != null) {
          imports.add(new ImportDirective(module, tree.text(alias), false, line));
        }
      } else if ("named_imports".equals(part.getType())) {
        for (TSNode specifier : childrenOfType(part, Set.of("import_specifier"))) {
          TSNode name = field(specifier, "name");
          TSNode alias = field(specifier, "alias");
          if (name != null) {
            imports.add(
                new ImportDirective(
                    qualify(module, unquote(tree.text(name))),
                    alias != null ? tree.text(alias) : null,
                    false,
                    line));
          }
        }
      }
    }
  }

  /** {@code const x = require('m')} and {@code const { a, b: c } = require('m')}. */
  private void readRequire(
      TreeSitterSyntaxTree tree, TSNode declarator, List<ImportDirective> imports) {
    TSNode value = field(declarator, "value");
    TSNode target = field(declarator, "name");
    if (value == null || target == null || !"call_expression".equals(value.getType())) {
      return;
    }
    TSNode function = field(value, "function");
    TSNode arguments = field(value, "arguments");
    if (function == null || !"require".equals(tree.text(function)) || arguments == null) {
      return;
    }
    TSNode specifier = childOfType(arguments, "string");
    if (specifier == null) {
      return;
    }
    String module = resolveSpecifier(tree.relativePath(), unquote(tree.text(specifier)));
    if (module.isEmpty()) {
      return;
    }
    int line = tree.line(declarator);
    if ("identifier".equals(target.getType())) {
      imports.add(new ImportDirective(module, tree.text(target), false, line));
      return;
    }
    if (!"object_pattern".equals(target.getType())) {
      return;
    }
    for (TSNode property : namedChildren(target)) {
      if ("shorthand_property_identifier_pattern".equals(property.getType())) {
        imports.add(new ImportDirective(qualify(module, tree.text(property)), null, false, line));
      } else if ("pair_pattern".equals(property.getType())) {
        TSNode key = field(property, "key");
        TSNode alias = field(property, "value");
        if (key != null) {
          imports.add(
              new ImportDirective(
                  qualify(module, tree.text(key)),
                  alias != null ? tree.text(alias) : null,
                  false,
                  line));
        }
      }
    }
  }

  @Override
  protected List<SymbolDescriptor.Builder> collectSymbols(TreeSitterSyntaxTree tree) {
    List<SymbolDescriptor.Builder> symbols = new ArrayList<>();
    String module = moduleName(tree.relativePath());
    symbols.add(moduleSymbol(tree, module.substring(module.lastIndexOf('.') + 1), module));
    scan(tree, tree.root(), new Context(0, module, -1, false), symbols);
    return symbols;
  }

  private void scan(
      TreeSitterSyntaxTree tree,
      TSNode node,
      Context context,
      List<SymbolDescriptor.Builder> symbols) {
    for (TSNode child : namedChildren(node)) {
      visit(tree, child, child, context, symbols);
    }
  }

  /**
   * Handles one node.
   *
   * @param outer node whose range the resulting symbol spans, an enclosing {@code export}
   *     statement included
   */
  private void visit(
      TreeSitterSyntaxTree tree,
      TSNode node,
      TSNode outer,
      Context context,
      List<SymbolDescriptor.Builder> symbols) {
    String type = node.getType();
    if ("export_statement".equals(type)) {
      for (TSNode child : namedChildren(node)) {
        visit(tree, child, node, context, symbols);
      }
    } else if ("function_declaration".equals(type)
        || "generator_function_declaration".equals(type)) {
      readFunction(tree, node, outer, context, symbols);
    } else if ("class_declaration".equals(type)) {
      readClass(tree, node, outer, context, symbols);
    } else if (DECLARATIONS.contains(type)) {
      List<TSNode> declarators = childrenOfType(node, Set.of("variable_declarator"));
      for (TSNode declarator : declarators) {
        TSNode name = field(declarator, "name");
        TSNode value = field(declarator, "value");
        if (name != null && value != null && "identifier".equals(name.getType())) {
          readBinding(
              tree, name, value, declarators.size() == 1 ? outer : declarator, context, symbols);
        } else if (value != null) {
          scan(tree, value, context, symbols);
        }
      }
    } else if ("expression_statement".equals(type)) {
      TSNode expression = node.getNamedChildCount() > 0 ? node.getNamedChild(0) : null;
      if (expression != null && "assignment_expression".equals(expression.getType())) {
        readAssignment(tree, expression, outer, context, symbols);
      } else {
        scan(tree, node, context, symbols);
      }
    } else {
      scan(tree, node, context, symbols);
    }
  }

  private void readAssignment(
      TreeSitterSyntaxTree tree,
      TSNode assignment,
      TSNode outer,
      Context context,
      List<SymbolDescriptor.Builder> symbols) {
    TSNode left = field(assignment, "left");
    TSNode right = field(assignment, "right");
    if (left == null || right == null) {
      return;
    }
    List<String> target = pathSegments(tree, left);
    boolean exported =
        target != null
            && ((target.size() == 2 && "exports".equals(target.get(0)))
                || (target.size() == 3
                    && "module".equals(target.get(0))
                    && "exports".equals(target.get(1))));
    if (exported) {
      readBinding(tree, field(left, "property"), right, outer, context, symbols);
      return;
    }
    if (target != null
        && target.size() == 2
        && "this".equals(target.get(0))
        && context.classIndex() >= 0) {
      symbols.get(context.classIndex()).declaredType(target.get(1), constructedType(tree, right));
    }
    scan(tree, right, context, symbols);
  }

  /**
   * Handles {@code name = <initializer>}. Function initializers become symbols; constructions are
   * recorded as the declared type of {@code name} on the enclosing symbol.
   */
  private void readBinding(
      TreeSitterSyntaxTree tree,
      TSNode nameNode,
      TSNode value,
      TSNode outer,
      Context context,
      List<SymbolDescriptor.Builder> symbols) {
    String name = tree.text(nameNode);
    if (!FUNCTION_VALUES.contains(value.getType())) {
      symbols.get(context.parentIndex()).declaredType(name, constructedType(tree, value));
      scan(tree, value, context, symbols);
      return;
    }
    String qualifiedName = qualify(context.prefix(), name);
    SymbolKind kind = context.classBody() ? SymbolKind.METHOD : SymbolKind.FUNCTION;
    SymbolDescriptor.Builder builder =
        SymbolDescriptor.builder(name, kind)
            .qualifiedName(qualifiedName)
            .parentIndex(context.parentIndex());
    if (hasToken(value, "async")) {
      builder.modifier("async");
    }
    readParameters(tree, value, builder);
    registerCallable(tree, builder, qualifiedName, outer, value, context, symbols);
  }

  private void readFunction(
      TreeSitterSyntaxTree tree,
      TSNode node,
      TSNode outer,
      Context context,
      List<SymbolDescriptor.Builder> symbols) {
    TSNode nameNode = field(node, "name");
    if (nameNode == null) {
      scan(tree, node, context, symbols);
      return;
    }
    String name = tree.text(nameNode);
    String qualifiedName = qualify(context.prefix(), name);
    SymbolDescriptor.Builder builder =
        SymbolDescriptor.builder(name, SymbolKind.FUNCTION)
            .qualifiedName(qualifiedName)
            .parentIndex(context.parentIndex());
    if (hasToken(node, "async")) {
      builder.modifier("async");
    }
    readParameters(tree, node, builder);
    registerCallable(tree, builder, qualifiedName, outer, node, context, symbols);
  }

  private void readClass(
      TreeSitterSyntaxTree tree,
      TSNode node,
      TSNode outer,
      Context context,
      List<SymbolDescriptor.Builder> symbols) {
    TSNode nameNode = field(node, "name");
    TSNode body = field(node, "body");
    if (nameNode == null || body == null) {
      scan(tree, node, context, symbols);
      return;
    }
    String name = tree.text(nameNode);
    String qualifiedName = qualify(context.prefix(), name);
    SymbolDescriptor.Builder builder =
        SymbolDescriptor.builder(name, SymbolKind.CLASS)
            .qualifiedName(qualifiedName)
            .parentIndex(context.parentIndex());
    TSNode heritage = childOfType(node, "class_heritage");
    if (heritage != null && heritage.getNamedChildCount() > 0) {
      List<String> superType = pathSegments(tree, heritage.getNamedChild(0));
      if (superType != null) {
        builder.superType(superType.get(superType.size() - 1));
      }
    }
    builder.signature(signature(tree, node.getStartByte(), body.getStartByte()));
    int index = register(tree, symbols, builder, outer, outer);
    Context members = new Context(index, qualifiedName, index, true);
    for (TSNode member : namedChildren(body)) {
      if ("method_definition".equals(member.getType())) {
        readMethod(tree, member, members, symbols);
      } else if ("field_definition".equals(member.getType())) {
        TSNode property = field(member, "property");
        TSNode value = field(member, "value");
        if (property != null && value != null) {
          readBinding(tree, property, value, member, members, symbols);
        }
      } else {
        scan(tree, member, members, symbols);
      }
    }
  }

  private void readMethod(
      TreeSitterSyntaxTree tree,
      TSNode method,
      Context members,
      List<SymbolDescriptor.Builder> symbols) {
    TSNode nameNode = field(method, "name");
    if (nameNode == null) {
      return;
    }
    String name = tree.text(nameNode);
    String qualifiedName = qualify(members.prefix(), name);
    SymbolDescriptor.Builder builder =
        SymbolDescriptor.builder(name, SymbolKind.METHOD)
            .qualifiedName(qualifiedName)
            .parentIndex(members.parentIndex());
    for (int i = 0; i < method.getChildCount(); i++) {
      TSNode child = method.getChild(i);
      if (child.getStartByte() >= nameNode.getStartByte()) {
        break;
      }
      if (METHOD_MODIFIERS.contains(child.getType())) {
        builder.modifier(child.getType());
      }
    }
    readParameters(tree, method, builder);
    registerCallable(tree, builder, qualifiedName, method, method, members, symbols);
  }

  /** Registers a callable and scans its body as the new enclosing symbol. */
  private void registerCallable(
      TreeSitterSyntaxTree tree,
      SymbolDescriptor.Builder builder,
      String qualifiedName,
      TSNode outer,
      TSNode callable,
      Context context,
      List<SymbolDescriptor.Builder> symbols) {
    TSNode body = field(callable, "body");
    builder.signature(
        signature(
            tree,
            outer.getStartByte(),
            body != null ? body.getStartByte() : callable.getEndByte()));
    int index = register(tree, symbols, builder, outer, outer);
    if (body != null) {
      Context inner = new Context(index, qualifiedName, context.classIndex(), false);
      if ("statement_block".equals(body.getType())) {
        scan(tree, body, inner, symbols);
      } else {
        visit(tree, body, body, inner, symbols);
      }
    }
  }

  private void readParameters(
      TreeSitterSyntaxTree tree, TSNode callable, SymbolDescriptor.Builder builder) {
    TSNode single = field(callable, "parameter");
    if (single != null) {
      builder.parameter(tree.text(single));
      return;
    }
    for (TSNode parameter : namedChildren(field(callable, "parameters"))) {
      if (!"comment".equals(parameter.getType())) {
        builder.parameter(tree.text(parameter));
      }
    }
  }

  private String constructedType(TreeSitterSyntaxTree tree, TSNode value) {
    if ("new_expression".equals(value.getType())) {
      return constructedType(pathSegments(tree, field(value, "constructor")));
    }
    if ("call_expression".equals(value.getType())) {
      return constructedType(pathSegments(tree, field(value, "function")));
    }
    return null;
  }

  @Override
  protected Callee callee(TreeSitterSyntaxTree tree, TSNode call) {
    boolean construction = "new_expression".equals(call.getType());
    TSNode target = field(call, construction ? "constructor" : "function");
    if (target == null) {
      return null;
    }
    CallKind kind = construction ? CallKind.CONSTRUCTION : CallKind.INVOCATION;
    if ("identifier".equals(target.getType())) {
      return new Callee(target, null, kind);
    }
    if ("member_expression".equals(target.getType())) {
      return new Callee(field(target, "property"), field(target, "object"), kind);
    }
    return null;
  }

  @Override
  protected TSNode argumentList(TSNode call) {
    TSNode arguments = field(call, "arguments");
    return arguments != null && "arguments".equals(arguments.getType()) ? arguments : null;
  }

  @Override
  protected TSNode argumentValue(TSNode argument) {
    if ("spread_element".equals(argument.getType())) {
      return argument.getNamedChildCount() > 0 ? argument.getNamedChild(0) : null;
    }
    return argument;
  }

  @Override
  protected List<String> pathSegments(TreeSitterSyntaxTree tree, TSNode node) {
    if (isAbsent(node)) {
      return null;
    }
    return switch (node.getType()) {
      case "identifier" -> List.of(tree.text(node));
      case "this" -> List.of("this");
      case "super" -> List.of("super");
      case "member_expression" -> memberPath(tree, node);
      default -> null;
    };
  }

  private List<String> memberPath(TreeSitterSyntaxTree tree, TSNode node) {
    List<String> object = pathSegments(tree, field(node, "object"));
    TSNode property = field(node, "property");
    if (object == null || property == null) {
      return null;
    }
    List<String> segments = new ArrayList<>(object);
    segments.add(tree.text(property));
    return segments;
  }

  static String moduleName(String relativePath) {
    String path = relativePath.replace('\\', '/');
    for (String root : SOURCE_ROOTS) {
      if (path.startsWith(root)) {
        path = path.substring(root.length());
        break;
      }
    }
    return dotted(stripExtension(path));
  }

  /**
   * Dotted module path for an import specifier. Relative specifiers are resolved against the
   * importing file's directory; package specifiers keep their segments ({@code @scope/pkg} becomes
   * {@code scope.pkg}).
   */
  static String resolveSpecifier(String relativePath, String specifier) {
    if (specifier == null || specifier.isBlank()) {
      return "";
    }
    if (!specifier.startsWith(".")) {
      String path = specifier.startsWith("@") ? specifier.substring(1) : specifier;
      return dotted(path);
    }
    String path = relativePath.replace('\\', '/');
    List<String> segments = new ArrayList<>(Arrays.asList(path.split("/")));
    segments.remove(segments.size() - 1);
    for (String part : specifier.split("/")) {
      if (part.isEmpty() || part.equals(".")) {
        continue;
      }
      if (part.equals("..")) {
        if (!segments.isEmpty()) {
          segments.remove(segments.size() - 1);
        }
      } else {
        segments.add(part);
      }
    }
    return moduleName(String.join("/", segments));
  }

  private static String stripExtension(String path) {
    for (String extension : EXTENSIONS) {
      if (path.endsWith(extension)) {
        return path.substring(0, path.length() - extension.length());
      }
    }
    return path;
  }

  private static String dotted(String path) {
    String module = path.replace('/', '.').replace('-', '_');
    if (module.endsWith(".index")) {
      module = module.substring(0, module.length() - ".index".length());
    }
    return module;
  }

  /**
   * Where a declaration sits.
   *
   * @param classIndex innermost enclosing class, the target of {@code this.x} assignments
   * @param classBody whether function-valued bindings declared here are methods
   */
  private record Context(int parentIndex, String prefix, int classIndex, boolean classBody) {}
}
