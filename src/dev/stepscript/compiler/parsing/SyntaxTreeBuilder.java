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
package dev.stepscript.compiler.parsing;

import com.google.common.collect.ImmutableList;
import dev.stepscript.compiler.parsing.trees.ExpressionTree;
import dev.stepscript.compiler.parsing.trees.ProgramTree;
import dev.stepscript.compiler.parsing.trees.SourcePosition;
import dev.stepscript.compiler.parsing.trees.StatementTree;
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.mozilla.javascript.Node;
import org.mozilla.javascript.Token;
import org.mozilla.javascript.ast.ArrayLiteral;
import org.mozilla.javascript.ast.Assignment;
import org.mozilla.javascript.ast.AstNode;
import org.mozilla.javascript.ast.Block;
import org.mozilla.javascript.ast.BreakStatement;
import org.mozilla.javascript.ast.ConditionalExpression;
import org.mozilla.javascript.ast.ContinueStatement;
import org.mozilla.javascript.ast.DoLoop;
import org.mozilla.javascript.ast.ElementGet;
import org.mozilla.javascript.ast.EmptyExpression;
import org.mozilla.javascript.ast.EmptyStatement;
import org.mozilla.javascript.ast.ExpressionStatement;
import org.mozilla.javascript.ast.ForInLoop;
import org.mozilla.javascript.ast.ForLoop;
import org.mozilla.javascript.ast.FunctionCall;
import org.mozilla.javascript.ast.FunctionNode;
import org.mozilla.javascript.ast.IfStatement;
import org.mozilla.javascript.ast.InfixExpression;
import org.mozilla.javascript.ast.KeywordLiteral;
import org.mozilla.javascript.ast.LabeledStatement;
import org.mozilla.javascript.ast.Name;
import org.mozilla.javascript.ast.NewExpression;
import org.mozilla.javascript.ast.NumberLiteral;
import org.mozilla.javascript.ast.ObjectLiteral;
import org.mozilla.javascript.ast.ObjectProperty;
import org.mozilla.javascript.ast.ParenthesizedExpression;
import org.mozilla.javascript.ast.PropertyGet;
import org.mozilla.javascript.ast.RegExpLiteral;
import org.mozilla.javascript.ast.ReturnStatement;
import org.mozilla.javascript.ast.Scope;
import org.mozilla.javascript.ast.Spread;
import org.mozilla.javascript.ast.StringLiteral;
import org.mozilla.javascript.ast.SwitchStatement;
import org.mozilla.javascript.ast.TemplateCharacters;
import org.mozilla.javascript.ast.TemplateLiteral;
import org.mozilla.javascript.ast.ThrowStatement;
import org.mozilla.javascript.ast.TryStatement;
import org.mozilla.javascript.ast.UnaryExpression;
import org.mozilla.javascript.ast.UpdateExpression;
import org.mozilla.javascript.ast.VariableDeclaration;
import org.mozilla.javascript.ast.VariableInitializer;
import org.mozilla.javascript.ast.WhileLoop;
import org.mozilla.javascript.ast.WithStatement;

/**
 * Converts Rhino syntax trees into the ESTree-shaped {@link ProgramTree}.
 *
 * <p>Rhino node kinds the dialect has no use for are kept as {@code Unsupported} trees so that the
 * converter can report them where they occur.
 */
final class SyntaxTreeBuilder {
  private final int[] lineStarts;
  private final int offset;

  /**
   * @param source the script the positions refer to
   * @param offset where {@code source} starts in the text Rhino parsed
   */
  SyntaxTreeBuilder(String source, int offset) {
    this.lineStarts = computeLineStarts(source);
    this.offset = offset;
  }

  /** Builds a program from the statements of {@code body}. */
  ProgramTree buildProgram(AstNode body) {
    return new ProgramTree(buildChildren(body));
  }

  private ImmutableList<StatementTree> buildChildren(AstNode parent) {
    ImmutableList.Builder<StatementTree> body = ImmutableList.builder();
    for (Node child : parent) {
      body.add(buildStatement((AstNode) child));
    }
    return body.build();
  }

  private StatementTree buildStatement(AstNode node) {
    SourcePosition position = positionOf(node);
    if (node instanceof ExpressionStatement expressionStatement) {
      AstNode expression = expressionStatement.getExpression();
      if (expression instanceof VariableDeclaration declaration) {
        return buildVariableDeclaration(declaration);
      }
      if (expression instanceof KeywordLiteral keyword && keyword.getType() == Token.DEBUGGER) {
        return new StatementTree.Unsupported("DebuggerStatement", position);
      }
      return new StatementTree.ExpressionStatement(buildExpression(expression), position);
    }
    if (node instanceof VariableDeclaration declaration) {
      return buildVariableDeclaration(declaration);
    }
    if (node instanceof IfStatement ifStatement) {
      AstNode elsePart = ifStatement.getElsePart();
      return new StatementTree.If(
          buildExpression(ifStatement.getCondition()),
          buildStatement(ifStatement.getThenPart()),
          elsePart == null ? null : buildStatement(elsePart),
          position);
    }
    if (node instanceof ForInLoop forIn) {
      StatementTree left = buildForHead(forIn.getIterator());
      ExpressionTree right = buildExpression(forIn.getIteratedObject());
      StatementTree body = buildStatement(forIn.getBody());
      if (forIn.isForEach()) {
        return new StatementTree.Unsupported("ForEachStatement", position);
      }
      return forIn.isForOf()
          ? new StatementTree.ForOf(left, right, body, position)
          : new StatementTree.ForIn(left, right, body, position);
    }
    if (node instanceof ForLoop forLoop) {
      return new StatementTree.For(
          isAbsent(forLoop.getInitializer()) ? null : buildForHead(forLoop.getInitializer()),
          isAbsent(forLoop.getCondition()) ? null : buildExpression(forLoop.getCondition()),
          isAbsent(forLoop.getIncrement()) ? null : buildExpression(forLoop.getIncrement()),
          buildStatement(forLoop.getBody()),
          position);
    }
    if (node instanceof WhileLoop whileLoop) {
      return new StatementTree.While(
          buildExpression(whileLoop.getCondition()), buildStatement(whileLoop.getBody()), position);
    }
    if (node instanceof DoLoop doLoop) {
      return new StatementTree.DoWhile(
          buildStatement(doLoop.getBody()), buildExpression(doLoop.getCondition()), position);
    }
    if (node instanceof ReturnStatement returnStatement) {
      AstNode value = returnStatement.getReturnValue();
      return new StatementTree.Return(value == null ? null : buildExpression(value), position);
    }
    if (node instanceof FunctionNode function) {
      Name name = function.getFunctionName();
      return new StatementTree.FunctionDeclaration(
          name == null ? "" : name.getIdentifier(),
          buildExpressions(function.getParams()),
          buildBlock(function.getBody()),
          position);
    }
    if (node instanceof Block || node instanceof Scope) {
      return new StatementTree.Block(buildChildren(node), position);
    }
    if (node instanceof EmptyStatement || node instanceof EmptyExpression) {
      return new StatementTree.Empty(position);
    }
    if (node instanceof BreakStatement) {
      return new StatementTree.Break(position);
    }
    if (node instanceof ContinueStatement) {
      return new StatementTree.Continue(position);
    }
    return new StatementTree.Unsupported(unsupportedStatementKind(node), position);
  }

  private static String unsupportedStatementKind(AstNode node) {
    if (node instanceof SwitchStatement) {
      return "SwitchStatement";
    } else if (node instanceof TryStatement) {
      return "TryStatement";
    } else if (node instanceof ThrowStatement) {
      return "ThrowStatement";
    } else if (node instanceof LabeledStatement) {
      return "LabeledStatement";
    } else if (node instanceof WithStatement) {
      return "WithStatement";
    }
    return node.shortName();
  }

  /** Builds the left side of a for-in/for-of loop or the initializer of a classic for loop. */
  private StatementTree buildForHead(AstNode node) {
    if (node instanceof VariableDeclaration declaration) {
      return buildVariableDeclaration(declaration);
    }
    return new StatementTree.ExpressionStatement(buildExpression(node), positionOf(node));
  }

  private StatementTree.VariableDeclaration buildVariableDeclaration(
      VariableDeclaration declaration) {
    ImmutableList.Builder<StatementTree.VariableDeclarator> declarators = ImmutableList.builder();
    for (VariableInitializer initializer : declaration.getVariables()) {
      AstNode init = initializer.getInitializer();
      declarators.add(
          new StatementTree.VariableDeclarator(
              buildExpression(initializer.getTarget()),
              init == null ? null : buildExpression(init)));
    }
    String kind =
        switch (declaration.getType()) {
          case Token.LET -> "let";
          case Token.CONST -> "const";
          default -> "var";
        };
    return new StatementTree.VariableDeclaration(
        kind, declarators.build(), positionOf(declaration));
  }

  private StatementTree.Block buildBlock(AstNode node) {
    if (node instanceof Block || node instanceof Scope) {
      return new StatementTree.Block(buildChildren(node), positionOf(node));
    }
    return new StatementTree.Block(ImmutableList.of(buildStatement(node)), positionOf(node));
  }

  private ImmutableList<ExpressionTree> buildExpressions(List<AstNode> nodes) {
    ImmutableList.Builder<ExpressionTree> expressions = ImmutableList.builder();
    for (AstNode node : nodes) {
      expressions.add(buildExpression(node));
    }
    return expressions.build();
  }

  private ExpressionTree buildExpression(AstNode node) {
    SourcePosition position = positionOf(node);
    if (node instanceof ParenthesizedExpression parenthesized) {
      return buildExpression(parenthesized.getExpression());
    }
    if (node instanceof Name name) {
      return new ExpressionTree.Identifier(name.getIdentifier(), position);
    }
    if (node instanceof StringLiteral string) {
      return new ExpressionTree.StringLiteral(string.getValue(), position);
    }
    if (node instanceof NumberLiteral number) {
      return new ExpressionTree.NumberLiteral(number.getNumber(), position);
    }
    if (node instanceof KeywordLiteral keyword) {
      return switch (keyword.getType()) {
        case Token.TRUE -> new ExpressionTree.BooleanLiteral(true, position);
        case Token.FALSE -> new ExpressionTree.BooleanLiteral(false, position);
        case Token.NULL -> new ExpressionTree.NullLiteral(position);
        case Token.THIS -> new ExpressionTree.Unsupported("ThisExpression", position);
        default -> new ExpressionTree.Unsupported("Keyword", position);
      };
    }
    if (node instanceof TemplateLiteral template) {
      return buildTemplateLiteral(template, position);
    }
    if (node instanceof PropertyGet propertyGet) {
      Name property = propertyGet.getProperty();
      return new ExpressionTree.Member(
          buildExpression(propertyGet.getTarget()),
          new ExpressionTree.Identifier(property.getIdentifier(), positionOf(property)),
          false,
          position);
    }
    if (node instanceof ElementGet elementGet) {
      return new ExpressionTree.Member(
          buildExpression(elementGet.getTarget()),
          buildExpression(elementGet.getElement()),
          true,
          position);
    }
    if (node instanceof Assignment assignment) {
      String operator = operatorToString(assignment.getOperator());
      if (operator == null) {
        return new ExpressionTree.Unsupported("AssignmentExpression", position);
      }
      return new ExpressionTree.Assignment(
          operator,
          buildExpression(assignment.getLeft()),
          buildExpression(assignment.getRight()),
          position);
    }
    if (node instanceof InfixExpression infix) {
      return buildInfix(infix, position);
    }
    if (node instanceof UpdateExpression update) {
      return new ExpressionTree.Update(
          update.getOperator() == Token.INC ? "++" : "--",
          buildExpression(update.getOperand()),
          !update.isPostfix(),
          position);
    }
    if (node instanceof UnaryExpression unary) {
      String text = operatorToString(unary.getOperator());
      if (text == null) {
        return new ExpressionTree.Unsupported("UnaryExpression", position);
      }
      return new ExpressionTree.Unary(text, buildExpression(unary.getOperand()), position);
    }
    if (node instanceof Spread spread) {
      return new ExpressionTree.Spread(buildExpression(spread.getExpression()), position);
    }
    if (node instanceof ConditionalExpression conditional) {
      return new ExpressionTree.Conditional(
          buildExpression(conditional.getTestExpression()),
          buildExpression(conditional.getTrueExpression()),
          buildExpression(conditional.getFalseExpression()),
          position);
    }
    if (node instanceof NewExpression) {
      return new ExpressionTree.Unsupported("NewExpression", position);
    }
    if (node instanceof FunctionCall call) {
      return new ExpressionTree.Call(
          buildExpression(call.getTarget()), buildExpressions(call.getArguments()), position);
    }
    if (node instanceof ArrayLiteral array) {
      if (array.isDestructuring()) {
        return new ExpressionTree.Unsupported("ArrayPattern", position);
      }
      ImmutableList.Builder<ExpressionTree> elements = ImmutableList.builder();
      for (AstNode element : array.getElements()) {
        elements.add(
            element instanceof EmptyExpression
                ? new ExpressionTree.Unsupported("ArrayHole", positionOf(element))
                : buildExpression(element));
      }
      return new ExpressionTree.ArrayLiteral(elements.build(), position);
    }
    if (node instanceof ObjectLiteral object) {
      if (object.isDestructuring()) {
        return new ExpressionTree.Unsupported("ObjectPattern", position);
      }
      ImmutableList.Builder<ExpressionTree.Property> properties = ImmutableList.builder();
      for (AstNode element : object.getElements()) {
        if (!(element instanceof ObjectProperty property)) {
          return new ExpressionTree.Unsupported("ObjectExpression", position);
        }
        properties.add(buildProperty(property));
      }
      return new ExpressionTree.ObjectLiteral(properties.build(), position);
    }
    if (node instanceof FunctionNode function) {
      ImmutableList<ExpressionTree> params = buildExpressions(function.getParams());
      StatementTree.Block body = buildBlock(function.getBody());
      if (function.getFunctionType() == FunctionNode.ARROW_FUNCTION) {
        return new ExpressionTree.ArrowFunction(params, body, position);
      }
      Name name = function.getFunctionName();
      return new ExpressionTree.FunctionExpression(
          name == null ? null : name.getIdentifier(), params, body, position);
    }
    if (node instanceof RegExpLiteral) {
      return new ExpressionTree.Unsupported("RegExpLiteral", position);
    }
    return new ExpressionTree.Unsupported(node.shortName(), position);
  }

  private ExpressionTree buildInfix(InfixExpression infix, SourcePosition position) {
    int operator = infix.getOperator();
    if (operator == Token.COMMA) {
      ImmutableList.Builder<ExpressionTree> expressions = ImmutableList.builder();
      flattenComma(infix, expressions);
      return new ExpressionTree.Sequence(expressions.build(), position);
    }
    ExpressionTree left = buildExpression(infix.getLeft());
    ExpressionTree right = buildExpression(infix.getRight());
    if (operator == Token.AND || operator == Token.OR) {
      return new ExpressionTree.Logical(
          operator == Token.AND ? "&&" : "||", left, right, position);
    }
    String text = operatorToString(operator);
    if (text == null) {
      return new ExpressionTree.Unsupported("BinaryExpression", position);
    }
    return new ExpressionTree.Binary(text, left, right, position);
  }

  private void flattenComma(AstNode node, ImmutableList.Builder<ExpressionTree> expressions) {
    if (node instanceof InfixExpression infix && infix.getOperator() == Token.COMMA) {
      flattenComma(infix.getLeft(), expressions);
      flattenComma(infix.getRight(), expressions);
    } else {
      expressions.add(buildExpression(node));
    }
  }

  private ExpressionTree.Property buildProperty(ObjectProperty property) {
    AstNode key = property.getKey();
    AstNode value = property.getValue() == null ? key : property.getValue();
    boolean computed =
        !(key instanceof Name || key instanceof StringLiteral || key instanceof NumberLiteral);
    return new ExpressionTree.Property(buildExpression(key), buildExpression(value), computed);
  }

  private ExpressionTree buildTemplateLiteral(TemplateLiteral template, SourcePosition position) {
    ImmutableList.Builder<String> quasis = ImmutableList.builder();
    ImmutableList.Builder<ExpressionTree> expressions = ImmutableList.builder();
    StringBuilder segment = new StringBuilder();
    for (AstNode element : template.getElements()) {
      if (element instanceof TemplateCharacters characters) {
        String cooked = characters.getValue();
        segment.append(cooked != null ? cooked : characters.getRawValue());
      } else {
        quasis.add(segment.toString());
        segment.setLength(0);
        expressions.add(buildExpression(element));
      }
    }
    quasis.add(segment.toString());
    return new ExpressionTree.TemplateLiteral(quasis.build(), expressions.build(), position);
  }

  private static boolean isAbsent(@Nullable AstNode node) {
    return node == null || node instanceof EmptyExpression;
  }

  /** Returns the source text of an operator token, or null when Rhino has no name for it. */
  private static @Nullable String operatorToString(int operator) {
    // AstNode.operatorToString has no entry for void
    if (operator == Token.VOID) {
      return "void";
    }
    try {
      return AstNode.operatorToString(operator);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  private SourcePosition positionOf(AstNode node) {
    int position = Math.max(node.getAbsolutePosition() - offset, 0);
    int index = Arrays.binarySearch(lineStarts, position);
    int line = index >= 0 ? index : -index - 2;
    return new SourcePosition(line + 1, position - lineStarts[Math.max(line, 0)]);
  }

  private static int[] computeLineStarts(String source) {
    int count = 1;
    for (int i = 0; i < source.length(); i++) {
      if (source.charAt(i) == '\n') {
        count++;
      }
    }
    int[] starts = new int[count];
    int line = 1;
    for (int i = 0; i < source.length(); i++) {
      if (source.charAt(i) == '\n') {
        starts[line++] = i + 1;
      }
    }
    return starts;
  }
}
