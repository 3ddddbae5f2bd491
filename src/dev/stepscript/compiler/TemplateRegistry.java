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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import dev.stepscript.ir.InstructionId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The instruction templates known to the {@link Decompiler}, keyed by instruction.
 *
 * <p>The default registry is read from the {@code instruction-templates.json} resource:
 *
 * <pre>
 * {"templates": [
 *   {"namespace": "System", "name": "Wait", "template": "wait({millis});", "extract": ["millis"],
 *    "identifiers": [], "spread": [], "defaults": {}, "inline": false, "controlFlow": false}]}
 * </pre>
 *
 * Only {@code namespace}, {@code name} and {@code template} are required.
 */
public final class TemplateRegistry {
  private static final String DEFAULT_RESOURCE = "instruction-templates.json";

  private final ImmutableMap<InstructionId, InstructionTemplate> templates;

  private TemplateRegistry(ImmutableMap<InstructionId, InstructionTemplate> templates) {
    this.templates = templates;
  }

  private static final class DefaultHolder {
    static final TemplateRegistry INSTANCE =
        fromJson(ResourceLoader.loadTextResource(TemplateRegistry.class, DEFAULT_RESOURCE));
  }

  /** Returns the registry of the bundled templates. */
  public static TemplateRegistry getDefault() {
    return DefaultHolder.INSTANCE;
  }

  /**
   * Reads a registry in the format of the bundled resource.
   *
   * @throws IllegalArgumentException if the document is malformed
   */
  public static TemplateRegistry fromJson(String json) {
    try {
      JsonObject root = JsonParser.parseString(json).getAsJsonObject();
      Map<InstructionId, InstructionTemplate> templates = new LinkedHashMap<>();
      for (JsonElement element : root.getAsJsonArray("templates")) {
        InstructionTemplate template = templateFromJson(element.getAsJsonObject());
        templates.put(template.getInstruction(), template);
      }
      return new TemplateRegistry(ImmutableMap.copyOf(templates));
    } catch (JsonParseException
        | IllegalStateException
        | ClassCastException
        | UnsupportedOperationException
        | NullPointerException e) {
      throw new IllegalArgumentException("Malformed instruction templates: " + e.getMessage(), e);
    }
  }

  private static InstructionTemplate templateFromJson(JsonObject json) {
    InstructionId instruction =
        InstructionId.of(json.get("namespace").getAsString(), json.get("name").getAsString());
    InstructionTemplate.Builder builder =
        InstructionTemplate.builder(instruction)
            .setTemplate(json.get("template").getAsString())
            .setExtract(strings(json.getAsJsonArray("extract")))
            .setIdentifiers(strings(json.getAsJsonArray("identifiers")))
            .setSpread(strings(json.getAsJsonArray("spread")))
            .setInline(json.has("inline") && json.get("inline").getAsBoolean())
            .setControlFlow(json.has("controlFlow") && json.get("controlFlow").getAsBoolean());
    JsonObject defaults = json.getAsJsonObject("defaults");
    if (defaults != null) {
      Map<String, String> values = new LinkedHashMap<>();
      for (Map.Entry<String, JsonElement> entry : defaults.entrySet()) {
        values.put(entry.getKey(), entry.getValue().getAsString());
      }
      builder.setDefaults(values);
    }
    return builder.build();
  }

  private static List<String> strings(@Nullable JsonArray array) {
    List<String> strings = new ArrayList<>();
    if (array != null) {
      for (JsonElement element : array) {
        strings.add(element.getAsString());
      }
    }
    return strings;
  }

  public @Nullable InstructionTemplate get(InstructionId instruction) {
    return templates.get(instruction);
  }

  public ImmutableSet<InstructionId> getSupportedInstructions() {
    return templates.keySet();
  }

  /** Returns a registry with {@code template} added, replacing any template of its instruction. */
  public TemplateRegistry withTemplate(InstructionTemplate template) {
    checkNotNull(template);
    Map<InstructionId, InstructionTemplate> copy = new LinkedHashMap<>(templates);
    copy.put(template.getInstruction(), template);
    return new TemplateRegistry(ImmutableMap.copyOf(copy));
  }
}
