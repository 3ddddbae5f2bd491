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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import dev.stepscript.ir.InstructionId;
import java.util.Map;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * How one instruction is written as script source.
 *
 * <p>The template is text with {@code {param}} placeholders; <code>{{</code> and <code>}}</code>
 * stand for literal braces. Placeholders are filled with the rendered values of the {@link
 * #getExtract extracted} parameters.
 */
@AutoValue
public abstract class InstructionTemplate {

  public abstract InstructionId getInstruction();

  public abstract String getTemplate();

  /** Parameters rendered for the placeholders. */
  public abstract ImmutableList<String> getExtract();

  /** Parameters whose string values are written as names, never quoted. */
  public abstract ImmutableSet<String> getIdentifiers();

  /** Parameters whose references are written as an argument list rather than an array. */
  public abstract ImmutableSet<String> getSpread();

  /** Text used for parameters the statement does not set. */
  public abstract ImmutableMap<String, String> getDefaults();

  /** Whether the template is an expression that needs a semicolon to stand as a statement. */
  public abstract boolean isInline();

  /** Whether the template is the header of a block holding the branch statements. */
  public abstract boolean isControlFlow();

  public static Builder builder(InstructionId instruction) {
    return new AutoValue_InstructionTemplate.Builder()
        .setInstruction(instruction)
        .setExtract(ImmutableList.of())
        .setIdentifiers(ImmutableSet.of())
        .setSpread(ImmutableSet.of())
        .setDefaults(ImmutableMap.of())
        .setInline(false)
        .setControlFlow(false);
  }

  /** Returns the placeholder names of the template, in order of appearance. */
  public ImmutableList<String> placeholders() {
    ImmutableList.Builder<String> placeholders = ImmutableList.builder();
    expand(
        getTemplate(),
        name -> {
          placeholders.add(name);
          return "";
        });
    return placeholders.build();
  }

  /** Returns the first placeholder {@code values} has no text for, or null. */
  public @Nullable String findMissingPlaceholder(Map<String, String> values) {
    for (String placeholder : placeholders()) {
      if (!values.containsKey(placeholder)) {
        return placeholder;
      }
    }
    return null;
  }

  /**
   * Fills the placeholders.
   *
   * @throws IllegalArgumentException if a placeholder has no value
   */
  public String fill(Map<String, String> values) {
    return expand(
        getTemplate(),
        name -> {
          String value = values.get(name);
          checkArgument(value != null, "no value for placeholder {%s}", name);
          return value;
        });
  }

  private static String expand(String template, Function<String, String> placeholderValue) {
    StringBuilder sb = new StringBuilder(template.length());
    int i = 0;
    while (i < template.length()) {
      char c = template.charAt(i);
      if (c == '{' && template.startsWith("{{", i)) {
        sb.append('{');
        i += 2;
      } else if (c == '}' && template.startsWith("}}", i)) {
        sb.append('}');
        i += 2;
      } else if (c == '{') {
        int end = template.indexOf('}', i);
        checkArgument(end > i + 1, "unterminated placeholder in template: %s", template);
        sb.append(placeholderValue.apply(template.substring(i + 1, end)));
        i = end + 1;
      } else {
        checkArgument(c != '}', "unbalanced '}' in template: %s", template);
        sb.append(c);
        i++;
      }
    }
    return sb.toString();
  }

  /** Builder for {@link InstructionTemplate}. */
  @AutoValue.Builder
  public abstract static class Builder {
    abstract Builder setInstruction(InstructionId instruction);

    public abstract Builder setTemplate(String template);

    public abstract Builder setExtract(Iterable<String> extract);

    public abstract Builder setIdentifiers(Iterable<String> identifiers);

    public abstract Builder setSpread(Iterable<String> spread);

    public abstract Builder setDefaults(Map<String, String> defaults);

    public abstract Builder setInline(boolean inline);

    public abstract Builder setControlFlow(boolean controlFlow);

    abstract InstructionTemplate autoBuild();

    public InstructionTemplate build() {
      InstructionTemplate template = autoBuild();
      // Rejects malformed templates.
      template.placeholders();
      return template;
    }
  }
}
