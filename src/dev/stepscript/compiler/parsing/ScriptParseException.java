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
package dev.stepscript.compiler.parsing;

import org.jspecify.annotations.Nullable;

/** Thrown when script source is not syntactically valid. */
public final class ScriptParseException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String description;
  private final int line;
  private final int column;

  public ScriptParseException(
      String description, int line, int column, @Nullable Throwable cause) {
    super(description + " at line " + line + ", column " + column, cause);
    this.description = description;
    this.line = line;
    this.column = column;
  }

  /** The parser's message, without location. */
  public String getDescription() {
    return description;
  }

  /** One-indexed line of the error. */
  public int getLine() {
    return line;
  }

  /** Column of the error within its line. */
  public int getColumn() {
    return column;
  }
}
