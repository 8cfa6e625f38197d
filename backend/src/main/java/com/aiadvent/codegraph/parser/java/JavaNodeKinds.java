package com.aiadvent.codegraph.parser.java;

import com.aiadvent.codegraph.parser.CanonicalNodeKind;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;

final class JavaNodeKinds {

  private JavaNodeKinds() {}

  static CanonicalNodeKind classify(Node node) {
    if (node instanceof TypeDeclaration<?> || node instanceof CallableDeclaration<?>) {
      return CanonicalNodeKind.SYMBOL_DEFINITION;
    }
    if (node instanceof MethodCallExpr
        || node instanceof ObjectCreationExpr
        || node instanceof MethodReferenceExpr) {
      return CanonicalNodeKind.CALL_SITE;
    }
    if (node instanceof NameExpr) {
      return CanonicalNodeKind.IDENTIFIER_LEAF;
    }
    return CanonicalNodeKind.OTHER;
  }
}
