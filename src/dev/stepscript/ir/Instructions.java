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

import com.google.common.collect.ImmutableSet;

/** The instructions the converters produce or treat specially. */
public final class Instructions {
  public static final String UI_ENGINE = "UIEngine";
  public static final String SYSTEM = "System";
  public static final String SYSTEM_LOOP = "System.Loop";
  public static final String SYSTEM_ARRAY = "System.Array";

  public static final InstructionId SET_STORE = InstructionId.of(UI_ENGINE, "SetStore");
  public static final InstructionId NAVIGATE = InstructionId.of(UI_ENGINE, "Navigate");
  public static final InstructionId FETCH_DATA = InstructionId.of(UI_ENGINE, "FetchData");
  public static final InstructionId SEND_DATA = InstructionId.of(UI_ENGINE, "SendData");
  public static final InstructionId MESSAGE = InstructionId.of(UI_ENGINE, "Message");

  public static final InstructionId WAIT = InstructionId.of(SYSTEM, "Wait");
  public static final InstructionId IF = InstructionId.of(SYSTEM, "If");
  public static final InstructionId PRINT = InstructionId.of(SYSTEM, "Print");
  public static final InstructionId GENERATE_EVENT = InstructionId.of(SYSTEM, "GenerateEvent");

  public static final InstructionId FOR_EACH_LOOP = InstructionId.of(SYSTEM_LOOP, "ForEachLoop");
  public static final InstructionId COUNT_LOOP = InstructionId.of(SYSTEM_LOOP, "CountLoop");
  public static final InstructionId RANGE_LOOP = InstructionId.of(SYSTEM_LOOP, "RangeLoop");

  public static final InstructionId ARRAY_INSERT_LAST =
      InstructionId.of(SYSTEM_ARRAY, "InsertLast");
  public static final InstructionId ARRAY_ADD_FIRST = InstructionId.of(SYSTEM_ARRAY, "AddFirst");
  public static final InstructionId ARRAY_DELETE_FIRST =
      InstructionId.of(SYSTEM_ARRAY, "DeleteFirst");
  public static final InstructionId ARRAY_DELETE_LAST =
      InstructionId.of(SYSTEM_ARRAY, "DeleteLast");
  public static final InstructionId ARRAY_FILTER = InstructionId.of(SYSTEM_ARRAY, "Filter");

  /** Functions that live in the UIEngine namespace when called by bare name. */
  public static final ImmutableSet<String> UI_ENGINE_FUNCTIONS =
      ImmutableSet.of(
          "SetStore",
          "GetStoreData",
          "Navigate",
          "NavigateBack",
          "FetchData",
          "SendData",
          "DeleteData",
          "Message",
          "Login",
          "Logout",
          "Refresh",
          "ScrollTo",
          "ScrollToGrid");

  /** Loops whose {@code iteration} branch renders as a nested block. */
  public static final ImmutableSet<InstructionId> LOOPS =
      ImmutableSet.of(FOR_EACH_LOOP, COUNT_LOOP, RANGE_LOOP);

  private Instructions() {}
}
