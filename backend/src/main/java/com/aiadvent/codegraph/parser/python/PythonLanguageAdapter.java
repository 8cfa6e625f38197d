package com.aiadvent.codegraph.parser.python;

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
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TreeSitterPython;

/** Python adapter. Module names follow the file path below {@code src/}. */
@Component
public class PythonLanguageAdapter extends TreeSitterLanguageAdapter {

  private static final Set<String> DEFINITIONS =
      Set.of("function_definition", "class_definition", "decorated_definition");

  private static final Set<String> CALLS = Set.of("call");

  private static final Set<String> IDENTIFIERS = Set.of("identifier");

  private static final Set<String> STRINGS = Set.of("string");

  private static final Set<String> DECORATORS = Set.of("decorator");

  private static final List<String> SOURCE_ROOTS = List.of("src/");

  @Override
  public Language language() {
    return Language.PYTHON;
  }

  @Override
  protected TSLanguage grammar() {
    return new TreeSitterPython();
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
    return DECORATORS;
  }

  @Override
  protected boolean constructsByCapitalizedCall() {
    return true;
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
      } else if ("import_from_statement".equals(node.getType())) {
        readFromImport(tree, node, imports);
      } else {
        for (int i = node.getNamedChildCount() - 1; i >= 0; i--) {
          pending.push(node.getNamedChild(i));
        }
      }
    }
    return imports;
  }

  private void readImport(TreeSitterSyntaxTree tree, TSNode node, List<ImportDirective> imports) {
    int line = tree.line(node);
    for (TSNode child : namedChildren(node)) {
      if ("dotted_name".equals(child.getType())) {
        imports.add(new ImportDirective(dotted(tree, child), null, false, line));
      } else if ("aliased_import".equals(child.getType())) {
        TSNode alias = field(child, "alias");
        imports.add(
            new ImportDirective(
                dotted(tree, field(child, "name")),
                alias != null ? tree.text(alias) : null,
                false,
                line));
      }
    }
  }

  private void readFromImport(
      TreeSitterSyntaxTree tree, TSNode node, List<ImportDirective> imports) {
    TSNode module = field(node, "module_name");
    if (module == null) {
      return;
    }
    String modulePath;
    if ("relative_import".equals(module.getType())) {
      TSNode prefix = childOfType(module, "import_prefix");
      int level = prefix != null ? tree.text(prefix).strip().length() : 0;
      TSNode name = childOfType(module, "dotted_name");
      modulePath =
          qualify(relativeBase(tree.relativePath(), level), name != null ? dotted(tree, name) : "");
    } else {
      modulePath = dotted(tree, module);
    }
    int line = tree.line(node);
    boolean names = false;
    for (int i = 0; i < node.getChildCount(); i++) {
      TSNode child = node.getChild(i);
      String type = child.getType();
      if ("import".equals(type)) {
        names = true;
      } else if (!names) {
        continue;
      } else if ("wildcard_import".equals(type)) {
        if (!modulePath.isEmpty()) {
          imports.add(new ImportDirective(modulePath, null, true, line));
        }
      } else if ("dotted_name".equals(type)) {
        imports.add(
            new ImportDirective(qualify(modulePath, dotted(tree, child)), null, false, line));
      } else if ("aliased_import".equals(type)) {
        TSNode alias = field(child, "alias");
        imports.add(
            new ImportDirective(
                qualify(modulePath, dotted(tree, field(child, "name"))),
                alias != null ? tree.text(alias) : null,
                false,
                line));
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
      if (classify(child) == CanonicalNodeKind.SYMBOL_DEFINITION) {
        readDefinition(tree, child, context, symbols);
      } else if ("assignment".equals(child.getType())) {
        recordAssignment(tree, child, context, symbols);
      } else {
        scan(tree, child, context, symbols);
      }
    }
  }

  private void readDefinition(
      TreeSitterSyntaxTree tree,
      TSNode node,
      Context context,
      List<SymbolDescriptor.Builder> symbols) {
    TSNode definition = node;
    List<AnnotationUsage> decorators = new ArrayList<>();
    if ("decorated_definition".equals(node.getType())) {
      for (TSNode decorator : childrenOfType(node, DECORATORS)) {
        AnnotationUsage usage = readDecorator(tree, decorator);
        if (usage != null) {
          decorators.add(usage);
        }
      }
      definition = field(node, "definition");
      if (definition == null) {
        return;
      }
    }
    TSNode nameNode = field(definition, "name");
    if (nameNode == null) {
      return;
    }
    if ("class_definition".equals(definition.getType())) {
      readClass(tree, node, definition, tree.text(nameNode), decorators, context, symbols);
    } else if ("function_definition".equals(definition.getType())) {
      readFunction(tree, node, definition, tree.text(nameNode), decorators, context, symbols);
    }
  }

  private void readFunction(
      TreeSitterSyntaxTree tree,
      TSNode node,
      TSNode definition,
      String name,
      List<AnnotationUsage> decorators,
      Context context,
      List<SymbolDescriptor.Builder> symbols) {
    String qualifiedName = qualify(context.prefix(), name);
    SymbolKind kind = context.classBody() ? SymbolKind.METHOD : SymbolKind.FUNCTION;
    SymbolDescriptor.Builder builder =
        SymbolDescriptor.builder(name, kind)
            .qualifiedName(qualifiedName)
            .parentIndex(context.parentIndex())
            .annotations(decorators);
    if (hasToken(definition, "async")) {
      builder.modifier("async");
    }
    readParameters(tree, field(definition, "parameters"), builder);
    TSNode body = field(definition, "body");
    builder.signature(
        signature(
            tree,
            definition.getStartByte(),
            body != null ? body.getStartByte() : definition.getEndByte()));
    int index = register(tree, symbols, builder, node, node);
    if (body != null) {
      int classIndex = context.classBody() ? context.parentIndex() : context.classIndex();
      scan(tree, body, new Context(index, qualifiedName, classIndex, false), symbols);
    }
  }

  private void readClass(
      TreeSitterSyntaxTree tree,
      TSNode node,
      TSNode definition,
      String name,
      List<AnnotationUsage> decorators,
      Context context,
      List<SymbolDescriptor.Builder> symbols) {
    String qualifiedName = qualify(context.prefix(), name);
    SymbolDescriptor.Builder builder =
        SymbolDescriptor.builder(name, SymbolKind.CLASS)
            .qualifiedName(qualifiedName)
            .parentIndex(context.parentIndex())
            .annotations(decorators);
    for (TSNode base : namedChildren(field(definition, "superclasses"))) {
      if (!"keyword_argument".equals(base.getType())) {
        builder.superType(typeName(tree, base));
      }
    }
    TSNode body = field(definition, "body");
    builder.signature(
        signature(
            tree,
            definition.getStartByte(),
            body != null ? body.getStartByte() : definition.getEndByte()));
    int index = register(tree, symbols, builder, node, node);
    if (body != null) {
      scan(tree, body, new Context(index, qualifiedName, index, true), symbols);
    }
  }

  private void readParameters(
      TreeSitterSyntaxTree tree, TSNode parameters, SymbolDescriptor.Builder builder) {
    for (TSNode parameter : namedChildren(parameters)) {
      TSNode nameNode = parameterName(parameter);
      if (nameNode == null) {
        continue;
      }
      String name = tree.text(nameNode);
      builder.parameter(tree.text(parameter));
      TSNode type = field(parameter, "type");
      if (type != null && !"self".equals(name) && !"cls".equals(name)) {
        builder.declaredType(name, typeName(tree, type));
      }
    }
  }

  private TSNode parameterName(TSNode parameter) {
    return switch (parameter.getType()) {
      case "identifier" -> parameter;
      case "default_parameter", "typed_default_parameter" -> field(parameter, "name");
      case "typed_parameter", "list_splat_pattern", "dictionary_splat_pattern" ->
          parameter.getNamedChildCount() > 0 ? parameterName(parameter.getNamedChild(0)) : null;
      default -> null;
    };
  }

  private void recordAssignment(
      TreeSitterSyntaxTree tree,
      TSNode assignment,
      Context context,
      List<SymbolDescriptor.Builder> symbols) {
    TSNode left = field(assignment, "left");
    if (left == null) {
      return;
    }
    SymbolDescriptor.Builder target = symbols.get(context.parentIndex());
    TSNode nameNode = left;
    if ("attribute".equals(left.getType())) {
      String object = tree.text(field(left, "object"));
      if (context.classIndex() < 0 || !("self".equals(object) || "cls".equals(object))) {
        return;
      }
      target = symbols.get(context.classIndex());
      nameNode = field(left, "attribute");
    }
    if (nameNode == null || !"identifier".equals(nameNode.getType())) {
      return;
    }
    String name = tree.text(nameNode);
    TSNode type = field(assignment, "type");
    if (type != null) {
      target.declaredType(name, typeName(tree, type));
      return;
    }
    TSNode right = field(assignment, "right");
    if (right != null && "call".equals(right.getType())) {
      target.declaredType(name, constructedType(pathSegments(tree, field(right, "function"))));
    }
  }

  private AnnotationUsage readDecorator(TreeSitterSyntaxTree tree, TSNode decorator) {
    TSNode expression = decorator.getNamedChildCount() > 0 ? decorator.getNamedChild(0) : null;
    if (expression == null) {
      return null;
    }
    Map<String, String> arguments = new LinkedHashMap<>();
    TSNode target = expression;
    if ("call".equals(expression.getType())) {
      target = field(expression, "function");
      int position = 0;
      for (TSNode argument : namedChildren(field(expression, "arguments"))) {
        if ("keyword_argument".equals(argument.getType())) {
          TSNode value = field(argument, "value");
          if (value != null) {
            arguments.put(tree.text(field(argument, "name")), valueText(tree, value));
          }
        } else if (!"comment".equals(argument.getType())) {
          arguments.put("_" + position++, valueText(tree, argument));
        }
      }
    }
    List<String> name = pathSegments(tree, target);
    if (name == null) {
      return null;
    }
    return new AnnotationUsage(String.join(".", name), arguments);
  }

  @Override
  protected Callee callee(TreeSitterSyntaxTree tree, TSNode call) {
    TSNode function = field(call, "function");
    if (function == null) {
      return null;
    }
    if ("identifier".equals(function.getType())) {
      return new Callee(function, null, CallKind.INVOCATION);
    }
    if ("attribute".equals(function.getType())) {
      return new Callee(
          field(function, "attribute"), field(function, "object"), CallKind.INVOCATION);
    }
    return null;
  }

  @Override
  protected TSNode argumentList(TSNode call) {
    TSNode arguments = field(call, "arguments");
    return arguments != null && "argument_list".equals(arguments.getType()) ? arguments : null;
  }

  @Override
  protected TSNode argumentValue(TSNode argument) {
    return switch (argument.getType()) {
      case "keyword_argument" -> field(argument, "value");
      case "list_splat", "dictionary_splat" ->
          argument.getNamedChildCount() > 0 ? argument.getNamedChild(0) : null;
      default -> argument;
    };
  }

  @Override
  protected List<String> pathSegments(TreeSitterSyntaxTree tree, TSNode node) {
    if (isAbsent(node)) {
      return null;
    }
    if ("identifier".equals(node.getType())) {
      return List.of(tree.text(node));
    }
    if ("attribute".equals(node.getType())) {
      List<String> object = pathSegments(tree, field(node, "object"));
      TSNode attribute = field(node, "attribute");
      if (object == null || attribute == null) {
        return null;
      }
      List<String> segments = new ArrayList<>(object);
      segments.add(tree.text(attribute));
      return segments;
    }
    return null;
  }

  /** Simple name of a type annotation: {@code Optional[Order]} gives {@code Optional}. */
  private String typeName(TreeSitterSyntaxTree tree, TSNode node) {
    if (isAbsent(node)) {
      return null;
    }
    return switch (node.getType()) {
      case "identifier" -> tree.text(node);
      case "attribute" -> tree.text(field(node, "attribute"));
      case "string" -> {
        String quoted = unquote(tree.text(node));
        yield quoted.substring(quoted.lastIndexOf('.') + 1);
      }
      case "subscript" -> typeName(tree, field(node, "value"));
      case "type", "generic_type" ->
          node.getNamedChildCount() > 0 ? typeName(tree, node.getNamedChild(0)) : null;
      default -> null;
    };
  }

  private static String dotted(TreeSitterSyntaxTree tree, TSNode node) {
    return tree.text(node).replaceAll("\\s+", "");
  }

  static String moduleName(String relativePath) {
    String module = modulePath(relativePath, SOURCE_ROOTS);
    if (module.endsWith(".__init__")) {
      module = module.substring(0, module.length() - ".__init__".length());
    }
    return module;
  }

  /** Package that a relative import with {@code level} leading dots starts from. */
  static String relativeBase(String relativePath, int level) {
    String module = moduleName(relativePath);
    boolean packageInit = relativePath.replace('\\', '/').endsWith("__init__.py");
    List<String> segments = new ArrayList<>(Arrays.asList(module.split("\\.")));
    if (!packageInit && !segments.isEmpty()) {
      segments.remove(segments.size() - 1);
    }
    for (int i = 1; i < level && !segments.isEmpty(); i++) {
      segments.remove(segments.size() - 1);
    }
    return String.join(".", segments);
  }

  /**
   * Where a declaration sits.
   *
   * @param classIndex innermost enclosing class, the target of {@code self.x} assignments
   * @param classBody whether functions declared here are methods
   */
  private record Context(int parentIndex, String prefix, int classIndex, boolean classBody) {}
}
