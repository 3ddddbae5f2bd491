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

/**
 * Aborts the conversion of one statement. The pattern matcher reports the carried error and drops
 * the statement; the rest of the script is still converted.
 */
final class ConversionException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ConversionError error;

  ConversionException(ConversionError error) {
    super(error.description());
    this.error = requireNonNull(error);
  }

  ConversionError getError() {
    return error;
  }
}
