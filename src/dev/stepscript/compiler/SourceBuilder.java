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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Strings;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;

/** Accumulates indented lines of script source. */
final class SourceBuilder {
  private final String indentUnit;
  private final List<String> lines = new ArrayList<>();
  private int depth = 0;

  SourceBuilder(String indentUnit) {
    this.indentUnit = indentUnit;
  }

  /** Appends a line at the current indentation. Empty lines are not indented. */
  @CanIgnoreReturnValue
  SourceBuilder appendLine(String text) {
    lines.add(text.isEmpty() ? "" : Strings.repeat(indentUnit, depth) + text);
    return this;
  }

  /** Appends {@code header}, which opens a block, and indents the lines that follow. */
  @CanIgnoreReturnValue
  SourceBuilder appendBlockStart(String header) {
    appendLine(header);
    depth++;
    return this;
  }

  /** Closes the innermost block with {@code footer}, typically a closing brace. */
  @CanIgnoreReturnValue
  SourceBuilder appendBlockEnd(String footer) {
    checkState(depth > 0, "no open block");
    depth--;
    appendLine(footer);
    return this;
  }

  /** Writes a line such as <code>} else {</code> between two blocks at the same level. */
  @CanIgnoreReturnValue
  SourceBuilder appendBlockSeparator(String separator) {
    checkState(depth > 0, "no open block");
    lines.add(Strings.repeat(indentUnit, depth - 1) + separator);
    return this;
  }

  /** Returns the lines joined by newlines, without a trailing newline. */
  String build() {
    checkState(depth == 0, "%s unclosed block(s)", depth);
    return String.join("\n", lines);
  }
}
