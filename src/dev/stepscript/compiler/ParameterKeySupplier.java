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

/**
 * Generates parameter reference keys for one conversion.
 *
 * <p>Keys are deterministic: the n-th key of a conversion is always {@code ref<n>}, so repeated
 * conversions of the same script produce identical output.
 */
final class ParameterKeySupplier {
  private static final String PREFIX = "ref";

  private int counter = 0;

  String nextKey() {
    return PREFIX + ++counter;
  }
}
