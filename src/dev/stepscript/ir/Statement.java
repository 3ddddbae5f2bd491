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
import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * One instruction of a {@link FunctionDefinition}.
 *
 * <p>Statements are immutable. Operations that annotate a statement, such as {@link
 * #withDependency}, return a modified copy.
 *
 * @param statementName Unique camelCase name of the statement within its function.
 * @param namespace Namespace of the invoked operation, e.g. {@code UIEngine}.
 * @param name Name of the invoked operation, e.g. {@code SetStore}.
 * @param parameterMap Parameter name to its references, keyed by reference key.
 * @param dependentStatements Dependency paths ({@code Steps.<step>.<branch>}) that must fire
 *     before this statement runs.
 * @param executeIftrue Conditions the runtime evaluates before running the statement. Carried
 *     verbatim.
 * @param comment Editor comment, carried verbatim.
 * @param description Editor description, carried verbatim.
 * @param position Editor position, carried verbatim.
 */
public record Statement(
    String statementName,
    String namespace,
    String name,
    ImmutableMap<String, ImmutableMap<String, ParameterReference>> parameterMap,
    ImmutableMap<String, Boolean> dependentStatements,
    ImmutableMap<String, Boolean> executeIftrue,
    @Nullable String comment,
    @Nullable String description,
    @Nullable Position position) {

  private static final Comparator<ParameterReference> BY_ORDER =
      Comparator.comparingInt(ParameterReference::order);

  public Statement {
    requireNonNull(statementName, "statementName");
    requireNonNull(namespace, "namespace");
    requireNonNull(name, "name");
    requireNonNull(parameterMap, "parameterMap");
    requireNonNull(dependentStatements, "dependentStatements");
    requireNonNull(executeIftrue, "executeIftrue");
  }

  public InstructionId instruction() {
    return InstructionId.of(namespace, name);
  }

  public boolean is(InstructionId instruction) {
    return namespace.equals(instruction.namespace()) && name.equals(instruction.name());
  }

  /** Returns the references of {@code parameterName} sorted by order, or an empty list. */
  public ImmutableList<ParameterReference> references(String parameterName) {
    ImmutableMap<String, ParameterReference> references = parameterMap.get(parameterName);
    if (references == null) {
      return ImmutableList.of();
    }
    return ImmutableList.sortedCopyOf(BY_ORDER, references.values());
  }

  /** Returns the first reference of {@code parameterName}, or null if it has none. */
  public @Nullable ParameterReference reference(String parameterName) {
    ImmutableList<ParameterReference> references = references(parameterName);
    return references.isEmpty() ? null : references.get(0);
  }

  /** Returns every reference of every parameter, in map order. */
  public ImmutableList<ParameterReference> allReferences() {
    ImmutableList.Builder<ParameterReference> all = ImmutableList.builder();
    for (ImmutableMap<String, ParameterReference> references : parameterMap.values()) {
      all.addAll(references.values());
    }
    return all.build();
  }

  public Statement withDependency(String path) {
    if (Boolean.TRUE.equals(dependentStatements.get(path))) {
      return this;
    }
    return toBuilder().putDependency(path).build();
  }

  public Statement withDependentStatements(Map<String, Boolean> dependencies) {
    return toBuilder().setDependentStatements(dependencies).build();
  }

  public Statement withStatementName(String newName) {
    return toBuilder().setStatementName(newName).build();
  }

  public Statement withParameterMap(
      Map<String, ? extends Map<String, ParameterReference>> newParameterMap) {
    return toBuilder().setParameterMap(newParameterMap).build();
  }

  public Builder toBuilder() {
    return new Builder(namespace, name)
        .setStatementName(statementName)
        .setParameterMap(parameterMap)
        .setDependentStatements(dependentStatements)
        .setExecuteIftrue(executeIftrue)
        .setComment(comment)
        .setDescription(description)
        .setPosition(position);
  }

  public static Builder builder(InstructionId instruction) {
    return new Builder(instruction.namespace(), instruction.name());
  }

  public static Builder builder(String namespace, String name) {
    return new Builder(namespace, name);
  }

  /** Builder for {@link Statement}. */
  public static final class Builder {
    private final String namespace;
    private final String name;
    private String statementName;
    private final Map<String, Map<String, ParameterReference>> parameterMap =
        new LinkedHashMap<>();
    private final Map<String, Boolean> dependentStatements = new LinkedHashMap<>();
    private final Map<String, Boolean> executeIftrue = new LinkedHashMap<>();
    private @Nullable String comment;
    private @Nullable String description;
    private @Nullable Position position;

    private Builder(String namespace, String name) {
      this.namespace = checkNotNull(namespace);
      this.name = checkNotNull(name);
    }

    @CanIgnoreReturnValue
    public Builder setStatementName(String statementName) {
      checkArgument(!statementName.isEmpty(), "empty statement name");
      this.statementName = statementName;
      return this;
    }

    /** Adds a reference under {@code parameterName}, keeping earlier references. */
    @CanIgnoreReturnValue
    public Builder addParameter(String parameterName, ParameterReference reference) {
      Map<String, ParameterReference> references =
          parameterMap.computeIfAbsent(parameterName, k -> new LinkedHashMap<>());
      checkArgument(
          !references.containsKey(reference.key()),
          "duplicate parameter reference key %s",
          reference.key());
      references.put(reference.key(), reference);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setParameterMap(
        Map<String, ? extends Map<String, ParameterReference>> newParameterMap) {
      parameterMap.clear();
      for (Map.Entry<String, ? extends Map<String, ParameterReference>> entry :
          newParameterMap.entrySet()) {
        parameterMap.put(entry.getKey(), new LinkedHashMap<>(entry.getValue()));
      }
      return this;
    }

    @CanIgnoreReturnValue
    public Builder putDependency(String path) {
      dependentStatements.put(path, true);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setDependentStatements(Map<String, Boolean> dependencies) {
      dependentStatements.clear();
      dependentStatements.putAll(dependencies);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setExecuteIftrue(Map<String, Boolean> conditions) {
      executeIftrue.clear();
      executeIftrue.putAll(conditions);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setComment(@Nullable String comment) {
      this.comment = comment;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setDescription(@Nullable String description) {
      this.description = description;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setPosition(@Nullable Position position) {
      this.position = position;
      return this;
    }

    public Statement build() {
      checkNotNull(statementName, "statement name not set");
      ImmutableMap.Builder<String, ImmutableMap<String, ParameterReference>> parameters =
          ImmutableMap.builder();
      for (Map.Entry<String, Map<String, ParameterReference>> entry : parameterMap.entrySet()) {
        parameters.put(entry.getKey(), ImmutableMap.copyOf(entry.getValue()));
      }
      return new Statement(
          statementName,
          namespace,
          name,
          parameters.buildOrThrow(),
          ImmutableMap.copyOf(dependentStatements),
          ImmutableMap.copyOf(executeIftrue),
          comment,
          description,
          position);
    }
  }
}
