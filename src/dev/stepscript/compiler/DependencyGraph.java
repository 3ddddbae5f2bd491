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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;
import dev.stepscript.ir.DependencyPath;
import dev.stepscript.ir.ParameterReference;
import dev.stepscript.ir.Statement;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * The "runs after" relation between the statements of a function.
 *
 * <p>A statement depends on every step named in its explicit dependency paths and on every step
 * its expressions or string values refer to as {@code Steps.<name>}. Self references and
 * references to steps outside the function are ignored.
 */
final class DependencyGraph {
  private static final Pattern STEP_REFERENCE = Pattern.compile("Steps\\.(\\w+)");

  private final ImmutableList<String> nodes;
  // Statement name to the names of the statements it depends on.
  private final ImmutableSetMultimap<String, String> dependencies;

  private DependencyGraph(
      ImmutableList<String> nodes, ImmutableSetMultimap<String, String> dependencies) {
    this.nodes = nodes;
    this.dependencies = dependencies;
  }

  static DependencyGraph create(Iterable<Statement> statements) {
    Set<String> names = new LinkedHashSet<>();
    for (Statement statement : statements) {
      names.add(statement.statementName());
    }
    SetMultimap<String, String> edges = LinkedHashMultimap.create();
    for (Statement statement : statements) {
      String name = statement.statementName();
      for (String step : referencedSteps(statement)) {
        if (!step.equals(name) && names.contains(step)) {
          edges.put(name, step);
        }
      }
    }
    return new DependencyGraph(ImmutableList.copyOf(names), ImmutableSetMultimap.copyOf(edges));
  }

  /** Returns every step named by the statement, explicitly or inside a parameter. */
  static ImmutableSet<String> referencedSteps(Statement statement) {
    ImmutableSet.Builder<String> steps = ImmutableSet.builder();
    for (String path : statement.dependentStatements().keySet()) {
      DependencyPath dependency = DependencyPath.parse(path);
      if (dependency != null) {
        steps.add(dependency.stepName());
      }
    }
    for (ParameterReference reference : statement.allReferences()) {
      if (reference instanceof ParameterReference.Expression expression) {
        addStepReferences(expression.expression(), steps);
      } else if (reference instanceof ParameterReference.Value value) {
        addStepReferences(value.value(), steps);
      }
    }
    return steps.build();
  }

  private static void addStepReferences(JsonElement value, ImmutableSet.Builder<String> steps) {
    if (value.isJsonPrimitive()) {
      JsonPrimitive primitive = value.getAsJsonPrimitive();
      if (primitive.isString()) {
        addStepReferences(primitive.getAsString(), steps);
      }
    } else if (value.isJsonArray()) {
      for (JsonElement element : value.getAsJsonArray()) {
        addStepReferences(element, steps);
      }
    } else if (value.isJsonObject()) {
      for (Map.Entry<String, JsonElement> entry : value.getAsJsonObject().entrySet()) {
        addStepReferences(entry.getValue(), steps);
      }
    }
  }

  private static void addStepReferences(String text, ImmutableSet.Builder<String> steps) {
    Matcher matcher = STEP_REFERENCE.matcher(text);
    while (matcher.find()) {
      steps.add(matcher.group(1));
    }
  }

  ImmutableList<String> getNodes() {
    return nodes;
  }

  ImmutableSet<String> getDependencies(String name) {
    return dependencies.get(name);
  }

  /**
   * Orders the statements so that each comes after everything it depends on. Statements whose
   * dependencies are satisfied at the same time keep their relative insertion order.
   *
   * @return the order, or null if the graph has a cycle
   */
  @Nullable ImmutableList<String> topologicalOrder() {
    ImmutableSetMultimap<String, String> dependents = dependencies.inverse();
    Map<String, Integer> inDegree = new HashMap<>();
    Queue<String> ready = new ArrayDeque<>();
    for (String node : nodes) {
      int degree = dependencies.get(node).size();
      inDegree.put(node, degree);
      if (degree == 0) {
        ready.add(node);
      }
    }
    ImmutableList.Builder<String> order = ImmutableList.builder();
    int visited = 0;
    while (!ready.isEmpty()) {
      String current = ready.remove();
      order.add(current);
      visited++;
      for (String dependent : dependents.get(current)) {
        int degree = inDegree.merge(dependent, -1, Integer::sum);
        if (degree == 0) {
          ready.add(dependent);
        }
      }
    }
    return visited == nodes.size() ? order.build() : null;
  }
}
