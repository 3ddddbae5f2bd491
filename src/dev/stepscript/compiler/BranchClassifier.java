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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import dev.stepscript.ir.DependencyPath;
import dev.stepscript.ir.ParameterReference;
import dev.stepscript.ir.Statement;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Groups the statements of a function under the branches of the statements they depend on.
 *
 * <p>Explicit dependencies on a {@code true}, {@code false}, {@code output}, {@code error} or
 * {@code iteration} branch always decide the group. A statement without any such dependency is
 * grouped by the {@code Steps.<step>.output} and {@code Steps.<step>.error} outcomes its
 * expressions read. Each group lists its statements in the order they were given.
 */
final class BranchClassifier {
  static final ImmutableSet<String> BRANCHES =
      ImmutableSet.of(
          DependencyPath.TRUE,
          DependencyPath.FALSE,
          DependencyPath.OUTPUT,
          DependencyPath.ERROR,
          DependencyPath.ITERATION);

  private static final Pattern OUTCOME_REFERENCE =
      Pattern.compile("Steps\\.(\\w+)\\.(output|error)");

  private final ImmutableSetMultimap<DependencyPath, String> children;
  private final ImmutableSet<String> nested;

  private BranchClassifier(ImmutableSetMultimap<DependencyPath, String> children) {
    this.children = children;
    this.nested = ImmutableSet.copyOf(children.values());
  }

  /**
   * @param steps the statements of the function
   * @param order the statement names in the order groups list them
   */
  static BranchClassifier classify(Map<String, Statement> steps, List<String> order) {
    SetMultimap<DependencyPath, String> children = LinkedHashMultimap.create();
    Set<String> explicit = new HashSet<>();
    for (String name : order) {
      for (String path : steps.get(name).dependentStatements().keySet()) {
        DependencyPath dependency = DependencyPath.parse(path);
        if (dependency != null && isBranchOf(dependency, name, steps)) {
          children.put(dependency, name);
          explicit.add(name);
        }
      }
    }
    for (String name : order) {
      if (explicit.contains(name)) {
        continue;
      }
      for (ParameterReference reference : steps.get(name).allReferences()) {
        if (!(reference instanceof ParameterReference.Expression expression)) {
          continue;
        }
        Matcher matcher = OUTCOME_REFERENCE.matcher(expression.expression());
        while (matcher.find()) {
          DependencyPath dependency = DependencyPath.of(matcher.group(1), matcher.group(2));
          if (isBranchOf(dependency, name, steps)) {
            children.put(dependency, name);
          }
        }
      }
    }
    return new BranchClassifier(ImmutableSetMultimap.copyOf(children));
  }

  private static boolean isBranchOf(
      DependencyPath dependency, String child, Map<String, Statement> steps) {
    return BRANCHES.contains(dependency.branch())
        && !dependency.stepName().equals(child)
        && steps.containsKey(dependency.stepName());
  }

  /** Returns the statements on {@code branch} of {@code step}. */
  ImmutableSet<String> getChildren(String step, String branch) {
    return children.get(DependencyPath.of(step, branch));
  }

  boolean hasChildren(String step, String branch) {
    return !getChildren(step, branch).isEmpty();
  }

  /** Whether {@code step} belongs to a branch of another statement. */
  boolean isNested(String step) {
    return nested.contains(step);
  }
}
