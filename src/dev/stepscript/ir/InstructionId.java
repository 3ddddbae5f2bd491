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
package dev.stepscript.ir;

import static java.util.Objects.requireNonNull;

import com.google.errorprone.annotations.Immutable;

/** Identifies the runtime operation a statement invokes, e.g. {@code UIEngine.SetStore}. */
@Immutable
public record InstructionId(String namespace, String name) {
  public InstructionId {
    requireNonNull(namespace, "namespace");
    requireNonNull(name, "name");
  }

  public static InstructionId of(String namespace, String name) {
    return new InstructionId(namespace, name);
  }

  @Override
  public String toString() {
    return namespace.isEmpty() ? name : namespace + "." + name;
  }
}
