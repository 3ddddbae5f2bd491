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

import com.google.common.base.Ascii;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import dev.stepscript.ir.InstructionId;
import dev.stepscript.ir.Instructions;
import dev.stepscript.ir.ParameterReference;
import dev.stepscript.ir.Statement;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Creates the statements and parameter references of one conversion.
 *
 * <p>Every created statement gets a fresh name from the conversion's {@link
 * StatementNameGenerator} and every reference a fresh key from its {@link ParameterKeySupplier}.
 */
final class StatementFactory {
  private final StatementNameGenerator nameGenerator;
  private final ParameterKeySupplier keySupplier;

  StatementFactory(StatementNameGenerator nameGenerator, ParameterKeySupplier keySupplier) {
    this.nameGenerator = checkNotNull(nameGenerator);
    this.keySupplier = checkNotNull(keySupplier);
  }

  StatementFactory() {
    this(new StatementNameGenerator(), new ParameterKeySupplier());
  }

  ParameterReference.Value value(JsonElement value) {
    return new ParameterReference.Value(keySupplier.nextKey(), 1, value);
  }

  ParameterReference.Value value(String value) {
    return value(new JsonPrimitive(value));
  }

  ParameterReference.Value value(Number value) {
    return value(new JsonPrimitive(value));
  }

  ParameterReference.Expression expression(String expression) {
    return new ParameterReference.Expression(keySupplier.nextKey(), 1, expression);
  }

  ParameterReference.Expression expression(String expression, int order) {
    return new ParameterReference.Expression(keySupplier.nextKey(), order, expression);
  }

  Statement createSetStore(String path, ParameterReference value) {
    return builder(Instructions.SET_STORE, "setStore")
        .addParameter("path", value(path))
        .addParameter("value", value)
        .build();
  }

  Statement createFetchData(
      ParameterReference url,
      @Nullable JsonObject queryParams,
      @Nullable JsonObject pathParams,
      @Nullable JsonObject headers) {
    Statement.Builder builder =
        builder(Instructions.FETCH_DATA, "fetchData").addParameter("url", url);
    addRequestParameters(builder, queryParams, pathParams, headers);
    return builder.build();
  }

  Statement createSendData(
      ParameterReference url,
      String method,
      @Nullable ParameterReference payload,
      @Nullable JsonObject queryParams,
      @Nullable JsonObject pathParams,
      @Nullable JsonObject headers) {
    Statement.Builder builder =
        builder(Instructions.SEND_DATA, "sendData")
            .addParameter("url", url)
            .addParameter("method", value(Ascii.toUpperCase(method)));
    if (payload != null) {
      builder.addParameter("payload", payload);
    }
    addRequestParameters(builder, queryParams, pathParams, headers);
    return builder.build();
  }

  private void addRequestParameters(
      Statement.Builder builder,
      @Nullable JsonObject queryParams,
      @Nullable JsonObject pathParams,
      @Nullable JsonObject headers) {
    if (queryParams != null) {
      builder.addParameter("queryParams", value(queryParams));
    }
    if (pathParams != null) {
      builder.addParameter("pathParams", value(pathParams));
    }
    if (headers != null) {
      builder.addParameter("headers", value(headers));
    }
  }

  Statement createNavigate(ParameterReference linkPath, @Nullable ParameterReference target) {
    Statement.Builder builder =
        builder(Instructions.NAVIGATE, "navigate").addParameter("linkPath", linkPath);
    if (target != null) {
      builder.addParameter("target", target);
    }
    return builder.build();
  }

  Statement createWait(ParameterReference millis) {
    return builder(Instructions.WAIT, "wait").addParameter("millis", millis).build();
  }

  Statement createMessage(ParameterReference message, String type) {
    return builder(Instructions.MESSAGE, "message")
        .addParameter("msg", message)
        .addParameter("type", value(type))
        .build();
  }

  Statement createIf(String condition) {
    return builder(Instructions.IF, "if").addParameter("condition", expression(condition)).build();
  }

  Statement createRangeLoop(ParameterReference from, ParameterReference to) {
    return builder(Instructions.RANGE_LOOP, "rangeLoop")
        .addParameter("from", from)
        .addParameter("to", to)
        .build();
  }

  Statement createForEachLoop(String source) {
    return builder(Instructions.FOR_EACH_LOOP, "forEachLoop")
        .addParameter("source", expression(source))
        .build();
  }

  /** Creates a {@code System.Array} operation on {@code source} with ordered elements. */
  Statement createArrayOperation(InstructionId operation, String source, List<String> elements) {
    Statement.Builder builder =
        builder(operation, operation.name()).addParameter("source", expression(source));
    for (int i = 0; i < elements.size(); i++) {
      builder.addParameter("element", expression(elements.get(i), i + 1));
    }
    return builder.build();
  }

  /** Creates a filter whose {@code condition} reads the element as {@code iteratorKey}. */
  Statement createFilter(String source, String iteratorKey, String condition) {
    return builder(Instructions.ARRAY_FILTER, "filter")
        .addParameter("source", expression(source))
        .addParameter("iteratorKey", value(iteratorKey))
        .addParameter("condition", expression(condition))
        .build();
  }

  Statement createPrint(List<String> values) {
    Statement.Builder builder = builder(Instructions.PRINT, "print");
    for (int i = 0; i < values.size(); i++) {
      builder.addParameter("values", expression(values.get(i), i + 1));
    }
    return builder.build();
  }

  Statement createGenerateEvent(ParameterReference eventName, ParameterReference results) {
    return builder(Instructions.GENERATE_EVENT, "generateEvent")
        .addParameter("eventName", eventName)
        .addParameter("results", results)
        .build();
  }

  /** Creates the event that hands {@code expression} back to the caller as the return value. */
  Statement createReturn(String expression) {
    JsonObject inner = new JsonObject();
    inner.addProperty("isExpression", true);
    inner.addProperty("value", expression);
    JsonObject results = new JsonObject();
    results.addProperty("name", "returnValue");
    results.add("value", inner);
    return createGenerateEvent(value("output"), value(results));
  }

  /** Creates a call to an operation the converter has no dedicated pattern for. */
  Statement createGenericCall(String namespace, String name, List<String> arguments) {
    Statement.Builder builder = builder(InstructionId.of(namespace, name), name);
    for (int i = 0; i < arguments.size(); i++) {
      builder.addParameter("arg" + i, expression(arguments.get(i), i + 1));
    }
    return builder.build();
  }

  private Statement.Builder builder(InstructionId instruction, String namePrefix) {
    return Statement.builder(instruction).setStatementName(nameGenerator.generate(namePrefix));
  }
}
