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

import com.google.auto.value.AutoValue;
import dev.stepscript.ir.FunctionDefinition;
import java.util.Optional;

/** Options of a script to step graph conversion. */
@AutoValue
public abstract class ConversionOptions {
  public static final String DEFAULT_FUNCTION_NAME = "eventHandler";

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_ConversionOptions.Builder()
        .setFunctionName(DEFAULT_FUNCTION_NAME)
        .setNamespace("");
  }

  public static ConversionOptions defaults() {
    return builder().build();
  }

  /** Name of the produced function. */
  public abstract String getFunctionName();

  /** Namespace of the produced function. */
  public abstract String getNamespace();

  /**
   * The function the script was decompiled from, if any. Statements whose source line carries a
   * {@code // Step: <name>} comment get that name back, together with the editor data of the
   * original statement.
   */
  public abstract Optional<FunctionDefinition> getOriginalFunction();

  /** Builder for {@link ConversionOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setFunctionName(String functionName);

    public abstract Builder setNamespace(String namespace);

    public abstract Builder setOriginalFunction(FunctionDefinition originalFunction);

    public abstract ConversionOptions build();
  }
}
