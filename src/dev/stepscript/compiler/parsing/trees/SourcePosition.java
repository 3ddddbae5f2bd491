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
package dev.stepscript.compiler.parsing.trees;

/**
 * Location of a syntax tree in its source text.
 *
 * @param line One-indexed line number.
 * @param column Zero-indexed column within the line.
 */
public record SourcePosition(int line, int column) {

  /** Position used for trees synthesized without a source location. */
  public static final SourcePosition UNKNOWN = new SourcePosition(-1, -1);

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
