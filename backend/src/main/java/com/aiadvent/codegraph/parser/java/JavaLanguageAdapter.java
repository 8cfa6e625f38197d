package com.aiadvent.codegraph.parser.java;

import com.aiadvent.codegraph.parser.CanonicalNodeKind;
import com.aiadvent.codegraph.parser.LanguageAdapter;
import com.aiadvent.codegraph.parser.SourceParseException;
import com.aiadvent.codegraph.parser.model.AnnotationUsage;
import com.aiadvent.codegraph.parser.model.CallKind;
import com.aiadvent.codegraph.parser.model.CallSite;
import com.aiadvent.codegraph.parser.model.ImportDirective;
import com.aiadvent.codegraph.parser.model.Language;
import com.aiadvent.codegraph.parser.model.SymbolDescriptor;
import com.aiadvent.codegraph.parser.model.SymbolKind;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.expr.NormalAnnotationExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SingleMemberAnnotationExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

@Component
public class JavaLanguageAdapter implements LanguageAdapter<JavaSyntaxTree> {

  static final String CONSTRUCTOR_NAME = "<init>";

  @Override
  public Language language() {
    return Language.JAVA;
  }

  @Override
  public JavaSyntaxTree parseTree(String relativePath, String content) {
    JavaParser parser =
        new JavaParser(
            new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    ParseResult<CompilationUnit> result = parser.parse(content);
    if (!result.isSuccessful() || result.getResult().isEmpty()) {
      String message =
          result.getProblems().stream()
              .findFirst()
              .map(Problem::getVerboseMessage)
              .orElse("Unparseable Java source");
      throw new SourceParseException(message);
    }
    return new JavaSyntaxTree(relativePath, content, result.getResult().get());
  }

  @Override
  public String extractPackage(JavaSyntaxTree tree) {
    return tree.compilationUnit()
        .getPackageDeclaration()
        .map(declaration -> declaration.getNameAsString())
        .orElse("");
  }

  @Override
  public List<ImportDirective> extractImports(JavaSyntaxTree tree) {
    return tree.compilationUnit().getImports().stream()
        .map(
            declaration ->
                new ImportDirective(
                    declaration.getNameAsString(),
                    null,
                    declaration.isAsterisk(),
                    lineOf(declaration)))
        .collect(Collectors.toList());
  }

  @Override
  public List<SymbolDescriptor> extractSymbols(JavaSyntaxTree tree) {
    List<SymbolDescriptor> symbols = new ArrayList<>();
    tree.declarationIndex().clear();
    String packageName = extractPackage(tree);
    for (TypeDeclaration<?> type : tree.compilationUnit().getTypes()) {
      collectType(tree, type, packageName, -1, symbols);
    }
    tree.markSymbolsExtracted();
    return symbols;
  }

  @Override
  public List<CallSite> extractCalls(JavaSyntaxTree tree) {
    if (!tree.symbolsExtracted()) {
      extractSymbols(tree);
    }
    List<CallSite> calls = new ArrayList<>();
    tree.compilationUnit()
        .walk(
            node -> {
              if (JavaNodeKinds.classify(node) != CanonicalNodeKind.CALL_SITE) {
                return;
              }
              int owner = ownerIndex(tree, node);
              if (owner < 0) {
                return;
              }
              if (node instanceof MethodCallExpr call) {
                addInvocation(calls, owner, call);
                addArguments(calls, owner, call.getArguments());
              } else if (node instanceof ObjectCreationExpr creation) {
                calls.add(
                    new CallSite(
                        owner,
                        creation.getType().getNameAsString(),
                        creation.getType().getScope().map(Node::toString).orElse(null),
                        CallKind.CONSTRUCTION,
                        false,
                        lineOf(creation)));
                addArguments(calls, owner, creation.getArguments());
              } else if (node instanceof MethodReferenceExpr reference) {
                Receiver receiver = receiverOf(Optional.of(reference.getScope()));
                calls.add(
                    new CallSite(
                        owner,
                        reference.getIdentifier(),
                        receiver.path(),
                        CallKind.INVOCATION,
                        receiver.chained(),
                        lineOf(reference)));
              }
            });
    return calls;
  }

  private void collectType(
      JavaSyntaxTree tree,
      TypeDeclaration<?> type,
      String prefix,
      int parentIndex,
      List<SymbolDescriptor> symbols) {
    String qualifiedName = qualify(prefix, type.getNameAsString());
    SymbolDescriptor.Builder builder =
        SymbolDescriptor.builder(type.getNameAsString(), kindOf(type))
            .qualifiedName(qualifiedName)
            .parentIndex(parentIndex)
            .signature(typeSignature(type))
            .sourceText(slice(tree, type))
            .annotations(annotationsOf(type.getAnnotations()));
    applySpan(builder, type);
    type.getModifiers().forEach(modifier -> builder.modifier(modifier.getKeyword().asString()));
    superTypesOf(type).forEach(builder::superType);
    for (BodyDeclaration<?> member : type.getMembers()) {
      if (member instanceof FieldDeclaration field) {
        for (VariableDeclarator variable : field.getVariables()) {
          builder.declaredType(variable.getNameAsString(), simpleTypeName(variable.getType()));
        }
      }
    }
    if (type instanceof RecordDeclaration record) {
      for (Parameter component : record.getParameters()) {
        builder.declaredType(component.getNameAsString(), simpleTypeName(component.getType()));
      }
    }
    int index = symbols.size();
    symbols.add(builder.build());
    tree.declarationIndex().put(type, index);

    for (BodyDeclaration<?> member : type.getMembers()) {
      if (member instanceof TypeDeclaration<?> nested) {
        collectType(tree, nested, qualifiedName, index, symbols);
      } else if (member instanceof CallableDeclaration<?> callable) {
        collectCallable(tree, callable, qualifiedName, index, symbols);
      }
    }
  }

  private void collectCallable(
      JavaSyntaxTree tree,
      CallableDeclaration<?> callable,
      String prefix,
      int parentIndex,
      List<SymbolDescriptor> symbols) {
    String name =
        callable instanceof ConstructorDeclaration ? CONSTRUCTOR_NAME : callable.getNameAsString();
    SymbolDescriptor.Builder builder =
        SymbolDescriptor.builder(name, SymbolKind.METHOD)
            .qualifiedName(qualify(prefix, name))
            .parentIndex(parentIndex)
            .signature(callable.getDeclarationAsString(true, false, true))
            .sourceText(slice(tree, callable))
            .annotations(annotationsOf(callable.getAnnotations()));
    applySpan(builder, callable);
    callable.getModifiers().forEach(modifier -> builder.modifier(modifier.getKeyword().asString()));
    for (Parameter parameter : callable.getParameters()) {
      builder.parameter(parameter.getType().asString() + " " + parameter.getNameAsString());
      builder.declaredType(parameter.getNameAsString(), simpleTypeName(parameter.getType()));
    }
    for (VariableDeclarationExpr local : callable.findAll(VariableDeclarationExpr.class)) {
      for (VariableDeclarator variable : local.getVariables()) {
        String typeName = simpleTypeName(variable.getType());
        if (typeName == null) {
          typeName =
              variable
                  .getInitializer()
                  .filter(Expression::isObjectCreationExpr)
                  .map(init -> init.asObjectCreationExpr().getType().getNameAsString())
                  .orElse(null);
        }
        builder.declaredType(variable.getNameAsString(), typeName);
      }
    }
    int index = symbols.size();
    symbols.add(builder.build());
    tree.declarationIndex().put(callable, index);
  }

  private void addInvocation(List<CallSite> calls, int owner, MethodCallExpr call) {
    Receiver receiver = receiverOf(call.getScope());
    calls.add(
        new CallSite(
            owner,
            call.getNameAsString(),
            receiver.path(),
            CallKind.INVOCATION,
            receiver.chained(),
            lineOf(call)));
  }

  private void addArguments(List<CallSite> calls, int owner, NodeList<Expression> arguments) {
    for (Expression argument : arguments) {
      String name = null;
      if (argument.isNameExpr()) {
        name = argument.asNameExpr().getNameAsString();
      } else if (argument.isFieldAccessExpr()
          && argument.asFieldAccessExpr().getScope().isThisExpr()) {
        name = argument.asFieldAccessExpr().getNameAsString();
      }
      if (name != null) {
        calls.add(new CallSite(owner, name, null, CallKind.ARGUMENT, false, lineOf(argument)));
      }
    }
  }

  private Receiver receiverOf(Optional<Expression> scope) {
    if (scope.isEmpty()) {
      return new Receiver(null, false);
    }
    Expression expression = scope.get();
    if (expression.isThisExpr()) {
      return new Receiver(CallSite.SELF_RECEIVER, false);
    }
    if (expression.isSuperExpr()) {
      return new Receiver("super", false);
    }
    if (expression.isTypeExpr()) {
      return new Receiver(expression.asTypeExpr().getType().asString(), false);
    }
    if (isSimplePath(expression)) {
      String path = expression.toString();
      if (path.startsWith("this.")) {
        path = path.substring("this.".length());
      }
      return new Receiver(path, false);
    }
    return new Receiver(null, true);
  }

  private boolean isSimplePath(Expression expression) {
    if (expression.isNameExpr()) {
      return true;
    }
    if (expression.isFieldAccessExpr()) {
      Expression scope = expression.asFieldAccessExpr().getScope();
      return scope.isThisExpr() || isSimplePath(scope);
    }
    return false;
  }

  private int ownerIndex(JavaSyntaxTree tree, Node node) {
    Optional<Node> current = node.getParentNode();
    while (current.isPresent()) {
      Integer index = tree.declarationIndex().get(current.get());
      if (index != null) {
        return index;
      }
      current = current.get().getParentNode();
    }
    return -1;
  }

  private SymbolKind kindOf(TypeDeclaration<?> type) {
    if (type instanceof ClassOrInterfaceDeclaration declaration) {
      return declaration.isInterface() ? SymbolKind.INTERFACE : SymbolKind.CLASS;
    }
    if (type instanceof EnumDeclaration) {
      return SymbolKind.ENUM;
    }
    if (type.isAnnotationDeclaration()) {
      return SymbolKind.INTERFACE;
    }
    return SymbolKind.CLASS;
  }

  private List<String> superTypesOf(TypeDeclaration<?> type) {
    List<ClassOrInterfaceType> types = new ArrayList<>();
    if (type instanceof ClassOrInterfaceDeclaration declaration) {
      types.addAll(declaration.getExtendedTypes());
      types.addAll(declaration.getImplementedTypes());
    } else if (type instanceof EnumDeclaration declaration) {
      types.addAll(declaration.getImplementedTypes());
    } else if (type instanceof RecordDeclaration declaration) {
      types.addAll(declaration.getImplementedTypes());
    }
    return types.stream().map(ClassOrInterfaceType::getNameAsString).collect(Collectors.toList());
  }

  private String typeSignature(TypeDeclaration<?> type) {
    String keyword =
        switch (kindOf(type)) {
          case INTERFACE -> type.isAnnotationDeclaration() ? "@interface" : "interface";
          case ENUM -> "enum";
          default -> type.isRecordDeclaration() ? "record" : "class";
        };
    StringBuilder signature = new StringBuilder(keyword).append(' ').append(type.getNameAsString());
    List<String> superTypes = superTypesOf(type);
    if (!superTypes.isEmpty()) {
      signature.append(" : ").append(String.join(", ", superTypes));
    }
    return signature.toString();
  }

  private List<AnnotationUsage> annotationsOf(NodeList<AnnotationExpr> annotations) {
    List<AnnotationUsage> usages = new ArrayList<>();
    for (AnnotationExpr annotation : annotations) {
      Map<String, String> arguments = new LinkedHashMap<>();
      if (annotation instanceof SingleMemberAnnotationExpr single) {
        String value = literalValue(single.getMemberValue());
        arguments.put("_0", value);
        arguments.put("value", value);
      } else if (annotation instanceof NormalAnnotationExpr normal) {
        for (MemberValuePair pair : normal.getPairs()) {
          arguments.put(pair.getNameAsString(), literalValue(pair.getValue()));
        }
      }
      usages.add(new AnnotationUsage(annotation.getNameAsString(), arguments));
    }
    return usages;
  }

  private String literalValue(Expression expression) {
    if (expression.isStringLiteralExpr()) {
      return expression.asStringLiteralExpr().asString();
    }
    if (expression.isArrayInitializerExpr()) {
      return expression.asArrayInitializerExpr().getValues().stream()
          .map(this::literalValue)
          .collect(Collectors.joining(","));
    }
    return expression.toString();
  }

  private String simpleTypeName(Type type) {
    if (type == null || type.isVarType()) {
      return null;
    }
    Type element = type.getElementType();
    if (element.isClassOrInterfaceType()) {
      return element.asClassOrInterfaceType().getNameAsString();
    }
    return null;
  }

  private void applySpan(SymbolDescriptor.Builder builder, Node node) {
    node.getRange()
        .ifPresent(
            range ->
                builder.span(
                    range.begin.line, range.begin.column, range.end.line, range.end.column));
  }

  private String slice(JavaSyntaxTree tree, Node node) {
    return node.getRange()
        .map(
            range -> {
              String[] lines = tree.lines();
              int from = Math.max(0, range.begin.line - 1);
              int to = Math.min(lines.length, range.end.line);
              StringBuilder text = new StringBuilder();
              for (int i = from; i < to; i++) {
                if (i > from) {
                  text.append('\n');
                }
                text.append(lines[i]);
              }
              return text.toString();
            })
        .orElse(node.toString());
  }

  private static int lineOf(Node node) {
    return node.getBegin().map(position -> position.line).orElse(0);
  }

  private static String qualify(String prefix, String name) {
    return prefix == null || prefix.isEmpty() ? name : prefix + "." + name;
  }

  private record Receiver(String path, boolean chained) {}
}
