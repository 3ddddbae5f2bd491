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

import com.google.common.collect.ImmutableList;

/** Collects the diagnostics of one conversion. */
public interface ErrorManager {

  /**
   * @param level the reporting level
   * @param error the diagnostic to report
   */
  void report(CheckLevel level, ConversionError error);

  /** Reports {@code error} at its default level. */
  default void report(ConversionError error) {
    report(error.defaultLevel(), error);
  }

  /** Writes the collected diagnostics to whatever output the manager was created for. */
  void generateReport();

  int getErrorCount();

  int getWarningCount();

  /** Errors in report order. */
  ImmutableList<ConversionError> getErrors();

  /** Warnings in report order. */
  ImmutableList<ConversionError> getWarnings();
}
