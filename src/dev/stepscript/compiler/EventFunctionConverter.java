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
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableMap;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.google.gson.JsonObject;
import dev.stepscript.ir.FunctionDefinition;
import dev.stepscript.ir.IrJson;
import java.util.Map;

/**
 * Converts the event handlers of a page to event functions.
 *
 * <p>An event function is a step graph function without parameter or event schemas. A page
 * keeps its event functions in a map under opaque keys; {@link #convertMultiple} derives the keys
 * from the handler name and source, so converting the same handlers again yields the same keys.
 */
public final class EventFunctionConverter {
  static final int KEY_LENGTH = 20;

  private final ForwardConverter converter;

  public EventFunctionConverter() {
    this(new ForwardConverter());
  }

  EventFunctionConverter(ForwardConverter converter) {
    this.converter = checkNotNull(converter);
  }

  /** Converts one handler. Statements that fail to convert are dropped. */
  public FunctionDefinition convert(String source, String eventName) {
    ConversionOptions options = ConversionOptions.builder().setFunctionName(eventName).build();
    FunctionDefinition function = converter.convert(source, options).functionDefinition();
    return FunctionDefinition.of(eventName, function.namespace(), function.steps().values());
  }

  /** Converts handlers given as event name to source, keyed by {@link #keyOf}. */
  public ImmutableMap<String, FunctionDefinition> convertMultiple(Map<String, String> handlers) {
    ImmutableMap.Builder<String, FunctionDefinition> functions = ImmutableMap.builder();
    for (Map.Entry<String, String> handler : handlers.entrySet()) {
      functions.put(
          keyOf(handler.getKey(), handler.getValue()),
          convert(handler.getValue(), handler.getKey()));
    }
    return functions.buildKeepingLast();
  }

  /** Returns the lowercase hex key of a handler: a prefix of its SHA-256 hash. */
  static String keyOf(String eventName, String source) {
    Hasher hasher = Hashing.sha256().newHasher();
    hasher.putString(eventName, UTF_8).putByte((byte) 0).putString(source, UTF_8);
    return hasher.hash().toString().substring(0, KEY_LENGTH);
  }

  /** Writes event functions in the page format: {@code {key: {name, namespace, steps}}}. */
  public static JsonObject toJsonTree(Map<String, FunctionDefinition> functions) {
    JsonObject root = new JsonObject();
    for (Map.Entry<String, FunctionDefinition> entry : functions.entrySet()) {
      JsonObject function = IrJson.toJsonTree(entry.getValue());
      JsonObject eventFunction = new JsonObject();
      eventFunction.add("name", function.get("name"));
      eventFunction.add("namespace", function.get("namespace"));
      eventFunction.add("steps", function.get("steps"));
      root.add(entry.getKey(), eventFunction);
    }
    return root;
  }
}
