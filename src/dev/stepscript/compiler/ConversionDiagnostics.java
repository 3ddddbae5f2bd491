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

/** Diagnostics reported while converting between scripts and step graph functions. */
public final class ConversionDiagnostics {

  static final DiagnosticType PARSE_ERROR =
      DiagnosticType.error("SSC_PARSE_ERROR", "Parse error: {0} at line {1}, column {2}");

  // Expressions

  static final DiagnosticType UNKNOWN_IDENTIFIER =
      DiagnosticType.warning(
          "SSC_UNKNOWN_IDENTIFIER",
          "Unknown identifier ''{0}'' - should be a store path (Page.*, Store.*, etc.)");

  static final DiagnosticType UNSUPPORTED_EXPRESSION =
      DiagnosticType.error("SSC_UNSUPPORTED_EXPRESSION", "Unsupported expression type: {0}");

  static final DiagnosticType ARROW_FUNCTION_UNSUPPORTED =
      DiagnosticType.error(
          "SSC_ARROW_FUNCTION_UNSUPPORTED", "Arrow functions are not supported in expressions");

  static final DiagnosticType FUNCTION_EXPRESSION_UNSUPPORTED =
      DiagnosticType.error(
          "SSC_FUNCTION_EXPRESSION_UNSUPPORTED",
          "Function expressions are not supported in expressions");

  static final DiagnosticType PARTIAL_SPREAD =
      DiagnosticType.warning(
          "SSC_PARTIAL_SPREAD", "Spread element may not be fully supported: {0}");

  // Statements

  static final DiagnosticType NON_STORE_ASSIGNMENT =
      DiagnosticType.warning(
          "SSC_NON_STORE_ASSIGNMENT",
          "Assignment to non-store path ''{0}'' - local variables not supported");

  static final DiagnosticType NON_STORE_UPDATE =
      DiagnosticType.warning(
          "SSC_NON_STORE_UPDATE",
          "Update of non-store path ''{0}'' - local variables not supported");

  static final DiagnosticType MISSING_ARGUMENT =
      DiagnosticType.error("SSC_MISSING_ARGUMENT", "{0}() requires {1}");

  static final DiagnosticType UNSUPPORTED_CALL_TARGET =
      DiagnosticType.warning(
          "SSC_UNSUPPORTED_CALL_TARGET", "Cannot convert a call to ''{0}'' - callee is not a name");

  static final DiagnosticType ARRAY_MAP_UNSUPPORTED =
      DiagnosticType.warning(
          "SSC_ARRAY_MAP_UNSUPPORTED",
          "array.map() is not directly supported - use forEach or for-of instead");

  static final DiagnosticType FILTER_CALLBACK_REQUIRED =
      DiagnosticType.warning(
          "SSC_FILTER_CALLBACK_REQUIRED", "array.filter() requires an arrow function callback");

  static final DiagnosticType FILTER_CONDITION =
      DiagnosticType.warning(
          "SSC_FILTER_CONDITION", "Filter condition may need adjustment: {0}");

  static final DiagnosticType FOR_EACH_CALLBACK =
      DiagnosticType.warning(
          "SSC_FOR_EACH_CALLBACK",
          "forEach callback is not a function literal - its body was not converted");

  static final DiagnosticType UNBOUNDED_LOOP =
      DiagnosticType.warning(
          "SSC_UNBOUNDED_LOOP", "{0} loops are not supported - use a bounded for or for-of loop");

  static final DiagnosticType LOOP_BOUNDS_UNDETECTED =
      DiagnosticType.warning("SSC_LOOP_BOUNDS_UNDETECTED", "Could not determine loop bounds");

  static final DiagnosticType LOCAL_VARIABLE =
      DiagnosticType.warning(
          "SSC_LOCAL_VARIABLE",
          "Variable declaration ''{0}'' - local variables not supported."
              + " Use Page.{0} or Store.{0} instead.");

  static final DiagnosticType UNSUPPORTED_STATEMENT =
      DiagnosticType.warning("SSC_UNSUPPORTED_STATEMENT", "Unhandled statement type: {0}");

  // Dependencies

  static final DiagnosticType UNKNOWN_STEP_REFERENCE =
      DiagnosticType.warning(
          "SSC_UNKNOWN_STEP_REFERENCE", "Statement ''{0}'' references unknown step ''{1}''");

  private ConversionDiagnostics() {}
}
