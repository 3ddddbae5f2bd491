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

import com.google.common.collect.ImmutableList;
import dev.stepscript.ir.FunctionDefinition;

/**
 * The outcome of converting a script. The function is always present; it holds every statement
 * that could be converted.
 */
public record ConversionResult(
    FunctionDefinition functionDefinition,
    ImmutableList<ConversionError> errors,
    ImmutableList<ConversionError> warnings) {

  public ConversionResult {
    requireNonNull(functionDefinition, "functionDefinition");
    requireNonNull(errors, "errors");
    requireNonNull(warnings, "warnings");
  }

  /** Whether the script converted without errors. Warnings do not count. */
  public boolean success() {
    return errors.isEmpty();
  }
}
