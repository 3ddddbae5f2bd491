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
import dev.stepscript.ir.DependencyPath;
import dev.stepscript.ir.ParameterReference;
import dev.stepscript.ir.Statement;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves the dependencies between the statements of a converted function.
 *
 * <p>{@link #annotate} turns step outcomes read by an expression into explicit dependencies and
 * removes dependencies on steps that do not exist. {@link #executionOrder} sorts the statements
 * topologically.
 */
final class DependencyAnalyzer {
  private static final Logger logger = Logger.getLogger(DependencyAnalyzer.class.getName());

  private static final Pattern STEP_FIELD_REFERENCE = Pattern.compile("Steps\\.(\\w+)\\.(\\w+)");

  private final ErrorManager errorManager;

  DependencyAnalyzer(ErrorManager errorManager) {
    this.errorManager = checkNotNull(errorManager);
  }

  /**
   * Adds a dependency on {@code Steps.<step>.<field>} to every statement whose expressions read
   * it, and drops explicit dependencies on unknown steps. Unknown steps are reported once per
   * statement.
   */
  ImmutableList<Statement> annotate(List<Statement> statements) {
    Set<String> names = new HashSet<>();
    for (Statement statement : statements) {
      names.add(statement.statementName());
    }
    ImmutableList.Builder<Statement> annotated = ImmutableList.builder();
    for (Statement statement : statements) {
      annotated.add(annotate(statement, names));
    }
    return annotated.build();
  }

  private Statement annotate(Statement statement, Set<String> names) {
    String self = statement.statementName();
    Set<String> unknown = new HashSet<>();
    Map<String, Boolean> dependencies = new LinkedHashMap<>();
    for (Map.Entry<String, Boolean> entry : statement.dependentStatements().entrySet()) {
      DependencyPath path = DependencyPath.parse(entry.getKey());
      if (path != null && !names.contains(path.stepName())) {
        reportUnknown(self, path.stepName(), unknown);
        continue;
      }
      dependencies.put(entry.getKey(), entry.getValue());
    }
    for (ParameterReference reference : statement.allReferences()) {
      if (!(reference instanceof ParameterReference.Expression expression)) {
        continue;
      }
      Matcher matcher = STEP_FIELD_REFERENCE.matcher(expression.expression());
      while (matcher.find()) {
        String step = matcher.group(1);
        if (step.equals(self)) {
          continue;
        }
        if (!names.contains(step)) {
          reportUnknown(self, step, unknown);
          continue;
        }
        dependencies.putIfAbsent(DependencyPath.of(step, matcher.group(2)).toString(), true);
      }
    }
    if (dependencies.equals(statement.dependentStatements())) {
      return statement;
    }
    return statement.withDependentStatements(dependencies);
  }

  private void reportUnknown(String statement, String step, Set<String> reported) {
    if (reported.add(step)) {
      errorManager.report(
          ConversionError.make(ConversionDiagnostics.UNKNOWN_STEP_REFERENCE, statement, step));
    }
  }

  /**
   * Returns the statements in execution order. A cyclic dependency relation has no such order;
   * the statements are then returned as given.
   */
  static ImmutableList<Statement> executionOrder(List<Statement> statements) {
    ImmutableList<String> order = DependencyGraph.create(statements).topologicalOrder();
    if (order == null) {
      logger.fine("Dependency cycle between statements, keeping insertion order");
      return ImmutableList.copyOf(statements);
    }
    Map<String, Statement> byName = new LinkedHashMap<>();
    for (Statement statement : statements) {
      byName.put(statement.statementName(), statement);
    }
    ImmutableList.Builder<Statement> sorted = ImmutableList.builder();
    for (String name : order) {
      sorted.add(byName.get(name));
    }
    return sorted.build();
  }

  /** Returns the statement names of {@code steps} in execution order. */
  static ImmutableList<String> executionOrder(ImmutableMap<String, Statement> steps) {
    ImmutableList<String> order = DependencyGraph.create(steps.values()).topologicalOrder();
    return order != null ? order : steps.keySet().asList();
  }
}
