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

import com.google.common.collect.ImmutableMap;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Reads and writes the JSON form of {@link FunctionDefinition}s consumed by the runtime.
 *
 * <p>The field names are a wire contract: {@code name}, {@code namespace}, {@code version}, {@code
 * steps}, and per step {@code statementName}, {@code namespace}, {@code name}, {@code
 * parameterMap}, {@code dependentStatements}. Optional fields are left out when absent.
 */
public final class IrJson {
  private static final Gson PRETTY =
      new GsonBuilder().serializeNulls().setPrettyPrinting().create();
  private static final Gson COMPACT = new GsonBuilder().serializeNulls().create();

  private IrJson() {}

  public static String toJson(FunctionDefinition function) {
    return PRETTY.toJson(toJsonTree(function));
  }

  public static String toCompactJson(FunctionDefinition function) {
    return COMPACT.toJson(toJsonTree(function));
  }

  public static JsonObject toJsonTree(FunctionDefinition function) {
    JsonObject root = new JsonObject();
    root.addProperty("name", function.name());
    root.addProperty("namespace", function.namespace());
    root.addProperty("version", function.version());
    JsonObject steps = new JsonObject();
    for (Statement statement : function.steps().values()) {
      steps.add(statement.statementName(), toJsonTree(statement));
    }
    root.add("steps", steps);
    if (!function.parameters().isEmpty()) {
      root.add("parameters", toJsonObject(function.parameters()));
    }
    if (!function.events().isEmpty()) {
      root.add("events", toJsonObject(function.events()));
    }
    return root;
  }

  public static JsonObject toJsonTree(Statement statement) {
    JsonObject json = new JsonObject();
    json.addProperty("statementName", statement.statementName());
    json.addProperty("namespace", statement.namespace());
    json.addProperty("name", statement.name());
    JsonObject parameterMap = new JsonObject();
    for (Map.Entry<String, ImmutableMap<String, ParameterReference>> parameter :
        statement.parameterMap().entrySet()) {
      JsonObject references = new JsonObject();
      for (ParameterReference reference : parameter.getValue().values()) {
        references.add(reference.key(), toJsonTree(reference));
      }
      parameterMap.add(parameter.getKey(), references);
    }
    json.add("parameterMap", parameterMap);
    json.add("dependentStatements", toBooleanObject(statement.dependentStatements()));
    if (!statement.executeIftrue().isEmpty()) {
      json.add("executeIftrue", toBooleanObject(statement.executeIftrue()));
    }
    if (statement.comment() != null) {
      json.addProperty("comment", statement.comment());
    }
    if (statement.description() != null) {
      json.addProperty("description", statement.description());
    }
    Position position = statement.position();
    if (position != null) {
      JsonObject positionJson = new JsonObject();
      positionJson.add("left", number(position.left()));
      positionJson.add("top", number(position.top()));
      json.add("position", positionJson);
    }
    return json;
  }

  public static JsonObject toJsonTree(ParameterReference reference) {
    JsonObject json = new JsonObject();
    json.addProperty("key", reference.key());
    json.addProperty("type", reference.type());
    if (reference instanceof ParameterReference.Value value) {
      json.add("value", value.value());
    } else if (reference instanceof ParameterReference.Expression expression) {
      json.addProperty("expression", expression.expression());
    }
    json.addProperty("order", reference.order());
    return json;
  }

  /**
   * Parses a function definition.
   *
   * @throws IrFormatException if the text is not JSON or lacks required fields
   */
  public static FunctionDefinition parse(String contents) {
    JsonObject root;
    try {
      root = COMPACT.fromJson(contents, JsonObject.class);
    } catch (JsonParseException e) {
      throw new IrFormatException("JSON parse exception: " + e.getMessage(), e);
    }
    if (root == null) {
      throw new IrFormatException("empty function definition");
    }
    return fromJsonTree(root);
  }

  public static FunctionDefinition fromJsonTree(JsonObject root) {
    try {
      String name = getStringOrDefault(root, "name", "");
      String namespace = getStringOrDefault(root, "namespace", "");
      int version =
          root.has("version") && !root.get("version").isJsonNull()
              ? root.get("version").getAsInt()
              : FunctionDefinition.DEFAULT_VERSION;
      ImmutableMap.Builder<String, Statement> steps = ImmutableMap.builder();
      JsonObject stepsJson = getObjectOrNull(root, "steps");
      if (stepsJson != null) {
        for (Map.Entry<String, JsonElement> entry : stepsJson.entrySet()) {
          Statement statement =
              statementFromJson(entry.getKey(), entry.getValue().getAsJsonObject());
          steps.put(statement.statementName(), statement);
        }
      }
      return new FunctionDefinition(
          name,
          namespace,
          version,
          steps.buildOrThrow(),
          fromJsonObject(getObjectOrNull(root, "parameters")),
          fromJsonObject(getObjectOrNull(root, "events")));
    } catch (IllegalStateException | IllegalArgumentException | UnsupportedOperationException e) {
      throw new IrFormatException("Invalid function definition: " + e.getMessage(), e);
    }
  }

  private static Statement statementFromJson(String stepKey, JsonObject json) {
    String statementName = getStringOrDefault(json, "statementName", stepKey);
    Statement.Builder builder =
        Statement.builder(
                getStringOrDefault(json, "namespace", ""), getStringOrDefault(json, "name", ""))
            .setStatementName(statementName);
    JsonObject parameterMap = getObjectOrNull(json, "parameterMap");
    if (parameterMap != null) {
      for (Map.Entry<String, JsonElement> parameter : parameterMap.entrySet()) {
        for (Map.Entry<String, JsonElement> reference :
            parameter.getValue().getAsJsonObject().entrySet()) {
          builder.addParameter(
              parameter.getKey(),
              referenceFromJson(reference.getKey(), reference.getValue().getAsJsonObject()));
        }
      }
    }
    builder.setDependentStatements(booleanMap(getObjectOrNull(json, "dependentStatements")));
    builder.setExecuteIftrue(booleanMap(getObjectOrNull(json, "executeIftrue")));
    builder.setComment(getStringOrNull(json, "comment"));
    builder.setDescription(getStringOrNull(json, "description"));
    JsonObject position = getObjectOrNull(json, "position");
    if (position != null) {
      builder.setPosition(
          new Position(getDoubleOrZero(position, "left"), getDoubleOrZero(position, "top")));
    }
    return builder.build();
  }

  private static ParameterReference referenceFromJson(String mapKey, JsonObject json) {
    String key = getStringOrDefault(json, "key", mapKey);
    int order =
        json.has("order") && !json.get("order").isJsonNull() ? json.get("order").getAsInt() : 1;
    String type = getStringOrDefault(json, "type", ParameterReference.VALUE);
    if (type.equals(ParameterReference.EXPRESSION)) {
      return new ParameterReference.Expression(
          key, order, getStringOrDefault(json, "expression", ""));
    }
    if (!type.equals(ParameterReference.VALUE)) {
      throw new IrFormatException("Unknown parameter reference type: " + type);
    }
    return new ParameterReference.Value(key, order, json.get("value"));
  }

  private static JsonObject toBooleanObject(Map<String, Boolean> map) {
    JsonObject json = new JsonObject();
    for (Map.Entry<String, Boolean> entry : map.entrySet()) {
      json.addProperty(entry.getKey(), entry.getValue());
    }
    return json;
  }

  private static Map<String, Boolean> booleanMap(@Nullable JsonObject json) {
    Map<String, Boolean> map = new LinkedHashMap<>();
    if (json != null) {
      for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
        map.put(entry.getKey(), entry.getValue().getAsBoolean());
      }
    }
    return map;
  }

  private static JsonObject toJsonObject(Map<String, JsonElement> map) {
    JsonObject json = new JsonObject();
    for (Map.Entry<String, JsonElement> entry : map.entrySet()) {
      json.add(entry.getKey(), entry.getValue().deepCopy());
    }
    return json;
  }

  private static ImmutableMap<String, JsonElement> fromJsonObject(@Nullable JsonObject json) {
    if (json == null) {
      return ImmutableMap.of();
    }
    ImmutableMap.Builder<String, JsonElement> map = ImmutableMap.builder();
    for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
      map.put(entry.getKey(), entry.getValue().deepCopy());
    }
    return map.buildOrThrow();
  }

  private static JsonPrimitive number(double value) {
    if (value == Math.rint(value) && !Double.isInfinite(value)) {
      return new JsonPrimitive((long) value);
    }
    return new JsonPrimitive(value);
  }

  private static @Nullable JsonObject getObjectOrNull(JsonObject object, String key) {
    JsonElement element = object.get(key);
    return element != null && element.isJsonObject() ? element.getAsJsonObject() : null;
  }

  private static @Nullable String getStringOrNull(JsonObject object, String key) {
    JsonElement element = object.get(key);
    return element != null && !element.isJsonNull() ? element.getAsString() : null;
  }

  private static String getStringOrDefault(JsonObject object, String key, String defaultValue) {
    String value = getStringOrNull(object, key);
    return value != null ? value : defaultValue;
  }

  private static double getDoubleOrZero(JsonObject object, String key) {
    JsonElement element = object.get(key);
    return element != null && !element.isJsonNull() ? element.getAsDouble() : 0;
  }
}
