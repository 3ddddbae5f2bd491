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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import dev.stepscript.compiler.parsing.trees.ExpressionTree;
import dev.stepscript.compiler.parsing.trees.Literals;
import dev.stepscript.compiler.parsing.trees.ProgramTree;
import dev.stepscript.compiler.parsing.trees.SourcePosition;
import dev.stepscript.compiler.parsing.trees.StatementTree;
import dev.stepscript.ir.DependencyPath;
import dev.stepscript.ir.ParameterReference;
import dev.stepscript.ir.Statement;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Matches script statements against the known patterns and creates the corresponding step graph
 * statements.
 *
 * <p>Nested bodies are flattened: every statement created for the body of an {@code if} or a loop
 * carries a dependency on the branch of its enclosing statement ({@code Steps.if1.true}, {@code
 * Steps.rangeLoop1.iteration}). A {@link ConversionException} drops the statement it was raised
 * for and is reported; matching continues with the next statement.
 *
 * <p>An instance belongs to a single conversion.
 */
final class PatternMatcher implements StatementTree.Visitor<ImmutableList<Statement>> {

  /** An {@code if} on a step outcome, with no further condition, is a branch of that step. */
  private static final Pattern BRANCH_CONDITION =
      Pattern.compile("^Steps\\.(\\w+)\\.(output|error)$");

  private final ErrorManager errorManager;
  private final StatementFactory factory;
  private final ExpressionConverter expressions;
  private final CallMatcher calls;
  private final Map<String, Integer> originLines = new LinkedHashMap<>();
  private final SetMultimap<String, String> bodyDependencies = LinkedHashMultimap.create();
  private int currentLine = -1;

  PatternMatcher(ErrorManager errorManager, StatementFactory factory) {
    this.errorManager = checkNotNull(errorManager);
    this.factory = checkNotNull(factory);
    this.expressions = new ExpressionConverter(errorManager);
    this.calls = new CallMatcher(this, factory, expressions, errorManager);
  }

  /** Converts every statement of {@code program}, in source order. */
  ImmutableList<Statement> match(ProgramTree program) {
    ImmutableList.Builder<Statement> statements = ImmutableList.builder();
    for (StatementTree statement : program.body()) {
      statements.addAll(matchStatement(statement));
    }
    ImmutableList<Statement> result = statements.build();
    // nested statements are recorded before the statement enclosing them
    Map<String, Integer> lines = new LinkedHashMap<>();
    for (Statement statement : result) {
      Integer line = originLines.get(statement.statementName());
      if (line != null) {
        lines.put(statement.statementName(), line);
      }
    }
    originLines.clear();
    originLines.putAll(lines);
    return result;
  }

  /**
   * Returns the source line each created statement was matched from, keyed by statement name.
   * Statements created for a nested body map to the line of the innermost source statement.
   */
  ImmutableMap<String, Integer> getOriginLines() {
    return ImmutableMap.copyOf(originLines);
  }

  /**
   * Returns the dependencies this matcher added to put statements into the body of an {@code if}
   * or a loop it created, keyed by the name of the dependent statement. These refer to generated
   * step names; a step outcome written in the script is not among them.
   */
  ImmutableSetMultimap<String, String> getBodyDependencies() {
    return ImmutableSetMultimap.copyOf(bodyDependencies);
  }

  /** Converts one statement, reporting and dropping it if it cannot be converted. */
  ImmutableList<Statement> matchStatement(StatementTree statement) {
    int enclosingLine = currentLine;
    currentLine = statement.position().line();
    try {
      ImmutableList<Statement> result = statement.accept(this);
      for (Statement created : result) {
        originLines.putIfAbsent(created.statementName(), currentLine);
      }
      return result;
    } catch (ConversionException e) {
      errorManager.report(e.getError());
      return ImmutableList.of();
    } finally {
      currentLine = enclosingLine;
    }
  }

  /** Converts {@code body} and makes every resulting statement depend on {@code branch}. */
  private ImmutableList<Statement> matchBranch(StatementTree body, DependencyPath branch) {
    return withDependency(matchStatement(body), branch);
  }

  /** Converts {@code body} as the {@code branch} of {@code owner}, a statement created here. */
  private ImmutableList<Statement> matchBody(StatementTree body, Statement owner, String branch) {
    DependencyPath path = DependencyPath.of(owner.statementName(), branch);
    ImmutableList<Statement> statements = matchBranch(body, path);
    for (Statement statement : statements) {
      bodyDependencies.put(statement.statementName(), path.toString());
    }
    return statements;
  }

  private static ImmutableList<Statement> withDependency(
      List<Statement> statements, DependencyPath branch) {
    String path = branch.toString();
    ImmutableList.Builder<Statement> tagged = ImmutableList.builder();
    for (Statement statement : statements) {
      tagged.add(statement.withDependency(path));
    }
    return tagged.build();
  }

  @Override
  public ImmutableList<Statement> visitExpressionStatement(
      StatementTree.ExpressionStatement tree) {
    return matchExpression(tree.expression(), tree.position());
  }

  private ImmutableList<Statement> matchExpression(
      ExpressionTree expression, SourcePosition position) {
    if (expression instanceof ExpressionTree.Assignment assignment) {
      return matchAssignment(assignment);
    }
    if (expression instanceof ExpressionTree.Update update) {
      return matchUpdate(update);
    }
    if (expression instanceof ExpressionTree.Call call) {
      return calls.match(call);
    }
    if (expression instanceof ExpressionTree.Sequence sequence) {
      ImmutableList.Builder<Statement> statements = ImmutableList.builder();
      for (ExpressionTree element : sequence.expressions()) {
        statements.addAll(matchExpression(element, position));
      }
      return statements.build();
    }
    report(
        position,
        ConversionDiagnostics.UNSUPPORTED_STATEMENT,
        "ExpressionStatement(" + expression.getClass().getSimpleName() + ")");
    return ImmutableList.of();
  }

  private ImmutableList<Statement> matchAssignment(ExpressionTree.Assignment assignment) {
    ExpressionTree target = assignment.target();
    if (!StorePaths.isWritableStorePath(target)) {
      report(
          assignment.position(), ConversionDiagnostics.NON_STORE_ASSIGNMENT, describe(target));
      return ImmutableList.of();
    }
    String path = expressions.convert(target);
    String operator = assignment.operator();
    ParameterReference value;
    if (operator.equals("=")) {
      value = literalOrExpression(assignment.value());
    } else {
      String binary = operator.substring(0, operator.length() - 1);
      value =
          factory.expression(
              "(" + path + " " + binary + " " + expressions.convert(assignment.value()) + ")");
    }
    return ImmutableList.of(factory.createSetStore(path, value));
  }

  private ImmutableList<Statement> matchUpdate(ExpressionTree.Update update) {
    ExpressionTree target = update.argument();
    if (!StorePaths.isWritableStorePath(target)) {
      report(update.position(), ConversionDiagnostics.NON_STORE_UPDATE, describe(target));
      return ImmutableList.of();
    }
    String path = expressions.convert(target);
    return ImmutableList.of(
        factory.createSetStore(path, factory.expression(expressions.convert(update))));
  }

  /** Scalar literals become values, everything else an expression. */
  ParameterReference literalOrExpression(ExpressionTree expression) {
    if (Literals.isScalar(expression)) {
      return factory.value(Literals.toJson(expression));
    }
    return factory.expression(expressions.convert(expression));
  }

  @Override
  public ImmutableList<Statement> visitBlock(StatementTree.Block tree) {
    ImmutableList.Builder<Statement> statements = ImmutableList.builder();
    for (StatementTree statement : tree.body()) {
      statements.addAll(matchStatement(statement));
    }
    return statements.build();
  }

  @Override
  public ImmutableList<Statement> visitIf(StatementTree.If tree) {
    String condition = expressions.convert(tree.test());
    Matcher branch = BRANCH_CONDITION.matcher(condition);
    if (tree.alternate() == null && branch.matches()) {
      return matchBranch(
          tree.consequent(), DependencyPath.of(branch.group(1), branch.group(2)));
    }
    Statement ifStatement = factory.createIf(condition);
    ImmutableList.Builder<Statement> statements = ImmutableList.builder();
    statements.add(ifStatement);
    statements.addAll(matchBody(tree.consequent(), ifStatement, DependencyPath.TRUE));
    if (tree.alternate() != null) {
      statements.addAll(matchBody(tree.alternate(), ifStatement, DependencyPath.FALSE));
    }
    return statements.build();
  }

  @Override
  public ImmutableList<Statement> visitFor(StatementTree.For tree) {
    ParameterReference to = upperBound(tree.test());
    if (to == null) {
      report(tree.position(), ConversionDiagnostics.LOOP_BOUNDS_UNDETECTED);
      return ImmutableList.of();
    }
    ParameterReference from = lowerBound(tree.init());
    return loop(factory.createRangeLoop(from, to), tree.body());
  }

  private @Nullable ParameterReference upperBound(@Nullable ExpressionTree test) {
    if (!(test instanceof ExpressionTree.Binary binary)) {
      return null;
    }
    String bound = expressions.convert(binary.right());
    return switch (binary.operator()) {
      case "<" -> factory.expression(bound);
      case "<=" -> factory.expression("(" + bound + " + 1)");
      default -> null;
    };
  }

  private ParameterReference lowerBound(@Nullable StatementTree init) {
    ExpressionTree start = null;
    if (init instanceof StatementTree.VariableDeclaration declaration
        && !declaration.declarations().isEmpty()) {
      start = declaration.declarations().get(0).init();
    } else if (init instanceof StatementTree.ExpressionStatement statement
        && statement.expression() instanceof ExpressionTree.Assignment assignment) {
      start = assignment.value();
    }
    if (start == null) {
      return factory.value(0);
    }
    return literalOrExpression(start);
  }

  @Override
  public ImmutableList<Statement> visitForIn(StatementTree.ForIn tree) {
    return loop(factory.createForEachLoop(expressions.convert(tree.right())), tree.body());
  }

  @Override
  public ImmutableList<Statement> visitForOf(StatementTree.ForOf tree) {
    return loop(factory.createForEachLoop(expressions.convert(tree.right())), tree.body());
  }

  /** Returns {@code loop} followed by its body, each body statement bound to the iteration. */
  ImmutableList<Statement> loop(Statement loop, StatementTree body) {
    return ImmutableList.<Statement>builder()
        .add(loop)
        .addAll(matchBody(body, loop, DependencyPath.ITERATION))
        .build();
  }

  @Override
  public ImmutableList<Statement> visitWhile(StatementTree.While tree) {
    report(tree.position(), ConversionDiagnostics.UNBOUNDED_LOOP, "while");
    return ImmutableList.of();
  }

  @Override
  public ImmutableList<Statement> visitDoWhile(StatementTree.DoWhile tree) {
    report(tree.position(), ConversionDiagnostics.UNBOUNDED_LOOP, "do-while");
    return ImmutableList.of();
  }

  @Override
  public ImmutableList<Statement> visitVariableDeclaration(
      StatementTree.VariableDeclaration tree) {
    ImmutableList.Builder<Statement> statements = ImmutableList.builder();
    for (StatementTree.VariableDeclarator declarator : tree.declarations()) {
      if (declarator.init() instanceof ExpressionTree.Call call) {
        statements.addAll(calls.match(call));
      } else {
        report(tree.position(), ConversionDiagnostics.LOCAL_VARIABLE, declarator.name());
      }
    }
    return statements.build();
  }

  @Override
  public ImmutableList<Statement> visitReturn(StatementTree.Return tree) {
    if (tree.argument() == null) {
      return ImmutableList.of();
    }
    return ImmutableList.of(factory.createReturn(expressions.convert(tree.argument())));
  }

  @Override
  public ImmutableList<Statement> visitEmpty(StatementTree.Empty tree) {
    return ImmutableList.of();
  }

  @Override
  public ImmutableList<Statement> visitBreak(StatementTree.Break tree) {
    return unsupported(tree.position(), "BreakStatement");
  }

  @Override
  public ImmutableList<Statement> visitContinue(StatementTree.Continue tree) {
    return unsupported(tree.position(), "ContinueStatement");
  }

  @Override
  public ImmutableList<Statement> visitFunctionDeclaration(
      StatementTree.FunctionDeclaration tree) {
    return unsupported(tree.position(), "FunctionDeclaration");
  }

  @Override
  public ImmutableList<Statement> visitUnsupported(StatementTree.Unsupported tree) {
    return unsupported(tree.position(), tree.kind());
  }

  private ImmutableList<Statement> unsupported(SourcePosition position, String kind) {
    report(position, ConversionDiagnostics.UNSUPPORTED_STATEMENT, kind);
    return ImmutableList.of();
  }

  /** Names {@code expression} in a diagnostic without converting it. */
  static String describe(ExpressionTree expression) {
    String name = StorePaths.qualifiedName(expression);
    return name != null ? name : expression.getClass().getSimpleName();
  }

  private void report(SourcePosition position, DiagnosticType type, String... arguments) {
    errorManager.report(ConversionError.make(position, type, arguments));
  }
}
