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
package dev.stepscript.ir;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonElement;
import java.util.Map;

/**
 * A function of the step graph runtime: a set of named statements whose execution order is
 * given by their dependencies.
 *
 * @param name Function name.
 * @param namespace Function namespace, possibly empty.
 * @param version Format version, 1 unless read otherwise.
 * @param steps Statements keyed by statement name, in execution order when produced by the
 *     forward converter.
 * @param parameters Parameter schemas of the function, carried verbatim.
 * @param events Event schemas of the function, carried verbatim.
 */
public record FunctionDefinition(
    String name,
    String namespace,
    int version,
    ImmutableMap<String, Statement> steps,
    ImmutableMap<String, JsonElement> parameters,
    ImmutableMap<String, JsonElement> events) {

  public static final int DEFAULT_VERSION = 1;

  public FunctionDefinition {
    requireNonNull(name, "name");
    requireNonNull(namespace, "namespace");
    requireNonNull(steps, "steps");
    requireNonNull(parameters, "parameters");
    requireNonNull(events, "events");
    for (Map.Entry<String, Statement> entry : steps.entrySet()) {
      checkArgument(
          entry.getKey().equals(entry.getValue().statementName()),
          "step %s is keyed as %s",
          entry.getValue().statementName(),
          entry.getKey());
    }
  }

  /** Creates a function without parameter or event schemas. */
  public static FunctionDefinition of(
      String name, String namespace, Iterable<Statement> statements) {
    return new FunctionDefinition(
        name, namespace, DEFAULT_VERSION, index(statements), ImmutableMap.of(), ImmutableMap.of());
  }

  public FunctionDefinition withSteps(Iterable<Statement> statements) {
    return new FunctionDefinition(name, namespace, version, index(statements), parameters, events);
  }

  private static ImmutableMap<String, Statement> index(Iterable<Statement> statements) {
    ImmutableMap.Builder<String, Statement> steps = ImmutableMap.builder();
    for (Statement statement : statements) {
      steps.put(statement.statementName(), statement);
    }
    return steps.buildOrThrow();
  }
}
