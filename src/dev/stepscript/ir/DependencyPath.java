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

import com.google.common.base.Splitter;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A reference to a named outcome of another statement, written {@code Steps.<step>.<branch>}.
 *
 * <p>Only the step and branch are kept; any trailing fields ({@code Steps.a.output.data}) are
 * dropped by {@link #parse}.
 */
public record DependencyPath(String stepName, String branch) {
  public static final String STEPS = "Steps";

  public static final String TRUE = "true";
  public static final String FALSE = "false";
  public static final String OUTPUT = "output";
  public static final String ERROR = "error";
  public static final String ITERATION = "iteration";

  private static final Splitter DOT_SPLITTER = Splitter.on('.');

  public DependencyPath {
    requireNonNull(stepName, "stepName");
    requireNonNull(branch, "branch");
  }

  public static DependencyPath of(String stepName, String branch) {
    return new DependencyPath(stepName, branch);
  }

  /** Parses {@code Steps.<step>.<branch>...}, returning null for anything else. */
  public static @Nullable DependencyPath parse(String path) {
    List<String> parts = DOT_SPLITTER.splitToList(path);
    if (parts.size() < 3 || !parts.get(0).equals(STEPS)) {
      return null;
    }
    if (parts.get(1).isEmpty() || parts.get(2).isEmpty()) {
      return null;
    }
    return new DependencyPath(parts.get(1), parts.get(2));
  }

  @Override
  public String toString() {
    return STEPS + "." + stepName + "." + branch;
  }
}
