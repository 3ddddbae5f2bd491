/*
 * Copyright 2026 The StepScript Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.stepscript.compiler;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import dev.stepscript.compiler.parsing.trees.ExpressionTree;
import dev.stepscript.compiler.parsing.trees.Literals;
import dev.stepscript.compiler.parsing.trees.SourcePosition;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders expression trees as text of the runtime's expression language.
 *
 * <p>Identifiers must be store paths. Other identifiers are reported and passed through; arrow
 * functions, function expressions and unsupported constructs abort the enclosing statement with a
 * {@link ConversionException}.
 */
final class ExpressionConverter implements ExpressionTree.Visitor<String> {

  private static final ImmutableMap<String, String> OPERATOR_MAP =
      ImmutableMap.of(
          "===", "=",
          "==", "=",
          "!==", "!=",
          "!=", "!=");

  private final ErrorManager errorManager;

  ExpressionConverter(ErrorManager errorManager) {
    this.errorManager = checkNotNull(errorManager);
  }

  String convert(ExpressionTree expression) {
    return expression.accept(this);
  }

  /** Maps a script comparison operator to the runtime's spelling. */
  static String mapOperator(String operator) {
    return OPERATOR_MAP.getOrDefault(operator, operator);
  }

  @Override
  public String visitIdentifier(ExpressionTree.Identifier tree) {
    String name = tree.name();
    if (StorePaths.ROOTS.contains(name)) {
      return name;
    }
    if (name.equals("undefined")) {
      return "null";
    }
    warn(tree.position(), ConversionDiagnostics.UNKNOWN_IDENTIFIER, name);
    return name;
  }

  @Override
  public String visitStringLiteral(ExpressionTree.StringLiteral tree) {
    return StorePaths.quote(tree.value());
  }

  @Override
  public String visitNumberLiteral(ExpressionTree.NumberLiteral tree) {
    return Literals.formatNumber(tree.value());
  }

  @Override
  public String visitBooleanLiteral(ExpressionTree.BooleanLiteral tree) {
    return tree.value() ? "true" : "false";
  }

  @Override
  public String visitNullLiteral(ExpressionTree.NullLiteral tree) {
    return "null";
  }

  @Override
  public String visitTemplateLiteral(ExpressionTree.TemplateLiteral tree) {
    List<String> parts = new ArrayList<>();
    for (int i = 0; i < tree.quasis().size(); i++) {
      String quasi = tree.quasis().get(i);
      if (!quasi.isEmpty()) {
        parts.add(StorePaths.quote(quasi));
      }
      if (i < tree.expressions().size()) {
        parts.add(convert(tree.expressions().get(i)));
      }
    }
    if (parts.isEmpty()) {
      return "\"\"";
    }
    if (parts.size() == 1) {
      return parts.get(0);
    }
    return "(" + String.join(" + ", parts) + ")";
  }

  @Override
  public String visitMember(ExpressionTree.Member tree) {
    String object = convert(tree.object());
    if (tree.computed()) {
      return object + "[" + convert(tree.property()) + "]";
    }
    return object + "." + ((ExpressionTree.Identifier) tree.property()).name();
  }

  @Override
  public String visitBinary(ExpressionTree.Binary tree) {
    return "("
        + convert(tree.left())
        + " "
        + mapOperator(tree.operator())
        + " "
        + convert(tree.right())
        + ")";
  }

  @Override
  public String visitLogical(ExpressionTree.Logical tree) {
    return "(" + convert(tree.left()) + " " + tree.operator() + " " + convert(tree.right()) + ")";
  }

  @Override
  public String visitUnary(ExpressionTree.Unary tree) {
    String operator = tree.operator();
    String argument = convert(tree.argument());
    if (Character.isLetter(operator.charAt(0))) {
      return operator + " " + argument;
    }
    return operator + argument;
  }

  @Override
  public String visitUpdate(ExpressionTree.Update tree) {
    String operator = tree.operator().equals("++") ? "+" : "-";
    return "(" + convert(tree.argument()) + " " + operator + " 1)";
  }

  @Override
  public String visitAssignment(ExpressionTree.Assignment tree) {
    return convert(tree.value());
  }

  @Override
  public String visitConditional(ExpressionTree.Conditional tree) {
    return "("
        + convert(tree.test())
        + " ? "
        + convert(tree.consequent())
        + " : "
        + convert(tree.alternate())
        + ")";
  }

  @Override
  public String visitCall(ExpressionTree.Call tree) {
    return convert(tree.callee()) + "(" + convertAll(tree.arguments()) + ")";
  }

  @Override
  public String visitArrayLiteral(ExpressionTree.ArrayLiteral tree) {
    return "[" + convertAll(tree.elements()) + "]";
  }

  @Override
  public String visitObjectLiteral(ExpressionTree.ObjectLiteral tree) {
    List<String> entries = new ArrayList<>();
    for (ExpressionTree.Property property : tree.properties()) {
      String name = property.keyName();
      String key = name != null ? StorePaths.quote(name) : convert(property.key());
      entries.add(key + ": " + convert(property.value()));
    }
    return "{" + String.join(", ", entries) + "}";
  }

  @Override
  public String visitSequence(ExpressionTree.Sequence tree) {
    return convert(tree.expressions().get(tree.expressions().size() - 1));
  }

  @Override
  public String visitSpread(ExpressionTree.Spread tree) {
    String spread = "..." + convert(tree.argument());
    warn(tree.position(), ConversionDiagnostics.PARTIAL_SPREAD, spread);
    return spread;
  }

  @Override
  public String visitArrowFunction(ExpressionTree.ArrowFunction tree) {
    throw fail(tree.position(), ConversionDiagnostics.ARROW_FUNCTION_UNSUPPORTED);
  }

  @Override
  public String visitFunctionExpression(ExpressionTree.FunctionExpression tree) {
    throw fail(tree.position(), ConversionDiagnostics.FUNCTION_EXPRESSION_UNSUPPORTED);
  }

  @Override
  public String visitUnsupported(ExpressionTree.Unsupported tree) {
    throw fail(tree.position(), ConversionDiagnostics.UNSUPPORTED_EXPRESSION, tree.kind());
  }

  private String convertAll(List<ExpressionTree> expressions) {
    List<String> converted = new ArrayList<>(expressions.size());
    for (ExpressionTree expression : expressions) {
      converted.add(convert(expression));
    }
    return String.join(", ", converted);
  }

  private void warn(SourcePosition position, DiagnosticType type, String... arguments) {
    errorManager.report(ConversionError.make(position, type, arguments));
  }

  private static ConversionException fail(
      SourcePosition position, DiagnosticType type, String... arguments) {
    return new ConversionException(ConversionError.make(position, type, arguments));
  }
}
