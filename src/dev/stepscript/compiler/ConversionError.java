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

import static java.util.Objects.requireNonNull;

import dev.stepscript.compiler.parsing.trees.SourcePosition;

/**
 * A diagnostic raised while converting a script.
 *
 * @param type The type of the diagnostic.
 * @param description Formatted message.
 * @param lineno One-indexed line number, or -1 when unknown.
 * @param charno Zero-indexed column, or -1 when unknown.
 * @param defaultLevel The level the diagnostic is reported at.
 */
public record ConversionError(
    DiagnosticType type, String description, int lineno, int charno, CheckLevel defaultLevel) {
  private static final int DEFAULT_LINENO = -1;
  private static final int DEFAULT_CHARNO = -1;

  public ConversionError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  /**
   * Creates a ConversionError with no source information
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static ConversionError make(DiagnosticType type, String... arguments) {
    return new ConversionError(
        type, type.format(arguments), DEFAULT_LINENO, DEFAULT_CHARNO, type.level);
  }

  /**
   * Creates a ConversionError at a given source location
   *
   * @param lineno Line number, or -1 if unknown
   * @param charno Column number within line, or -1 for whole line.
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static ConversionError make(
      int lineno, int charno, DiagnosticType type, String... arguments) {
    return new ConversionError(type, type.format(arguments), lineno, charno, type.level);
  }

  /** Creates a ConversionError located at a syntax tree. */
  public static ConversionError make(
      SourcePosition position, DiagnosticType type, String... arguments) {
    return make(position.line(), position.column(), type, arguments);
  }

  public boolean hasLocation() {
    return lineno != DEFAULT_LINENO;
  }

  /** @return the default rendering of a diagnostic as text. */
  @Override
  public String toString() {
    String lineno = this.lineno != DEFAULT_LINENO ? String.valueOf(this.lineno) : "(unknown line)";
    String charno =
        this.charno != DEFAULT_CHARNO ? String.valueOf(this.charno) : "(unknown column)";
    return type.key + ". " + description + " at line " + lineno + " : " + charno;
  }
}
