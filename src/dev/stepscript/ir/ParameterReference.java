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

import static java.util.Objects.requireNonNull;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonPrimitive;
import org.jspecify.annotations.Nullable;

/**
 * One argument bound to a statement parameter: either a literal JSON value or an expression
 * evaluated by the runtime.
 *
 * <p>A parameter may hold several references; together they form an array argument ordered by
 * {@link #order()}.
 */
public sealed interface ParameterReference {

  String VALUE = "VALUE";
  String EXPRESSION = "EXPRESSION";

  /** Unique key of this reference within its function. */
  String key();

  /**
   * Position among the references of the same parameter. Only the relative order is meaningful;
   * references created here start at 1.
   */
  int order();

  /** Wire type tag, {@value #VALUE} or {@value #EXPRESSION}. */
  String type();

  ParameterReference withOrder(int order);

  /** A literal argument. */
  record Value(String key, int order, JsonElement value) implements ParameterReference {
    public Value {
      requireNonNull(key, "key");
      value = value == null ? JsonNull.INSTANCE : value.deepCopy();
    }

    /** Returns a copy of the value; JSON elements are mutable. */
    @Override
    public JsonElement value() {
      return value.deepCopy();
    }

    @Override
    public String type() {
      return VALUE;
    }

    @Override
    public Value withOrder(int order) {
      return new Value(key, order, value);
    }

    /** Returns the string value, or null when the value is not a JSON string. */
    public @Nullable String stringValue() {
      return value.isJsonPrimitive() && value.getAsJsonPrimitive().isString()
          ? value.getAsString()
          : null;
    }
  }

  /** An argument computed from an expression in the runtime's expression language. */
  record Expression(String key, int order, String expression) implements ParameterReference {
    public Expression {
      requireNonNull(key, "key");
      requireNonNull(expression, "expression");
    }

    @Override
    public String type() {
      return EXPRESSION;
    }

    @Override
    public Expression withOrder(int order) {
      return new Expression(key, order, expression);
    }
  }

  static Value value(String key, JsonElement value) {
    return new Value(key, 1, value);
  }

  static Value value(String key, String value) {
    return new Value(key, 1, new JsonPrimitive(value));
  }

  static Expression expression(String key, String expression) {
    return new Expression(key, 1, expression);
  }
}
