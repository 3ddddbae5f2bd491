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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonPrimitive;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class StatementTest {

  @Test
  public void testReferencesAreSortedByOrder() throws Exception {
    Statement statement =
        Statement.builder(Instructions.PRINT)
            .setStatementName("print1")
            .addParameter("values", new ParameterReference.Value("b", 2, new JsonPrimitive("y")))
            .addParameter("values", new ParameterReference.Value("a", 1, new JsonPrimitive("x")))
            .build();

    assertThat(statement.references("values").get(0).key()).isEqualTo("a");
    assertThat(statement.reference("values").key()).isEqualTo("a");
    assertThat(statement.references("missing")).isEmpty();
    assertThat(statement.reference("missing")).isNull();
    assertThat(statement.allReferences()).hasSize(2);
  }

  @Test
  public void testDuplicateReferenceKey() throws Exception {
    Statement.Builder builder =
        Statement.builder(Instructions.PRINT)
            .setStatementName("print1")
            .addParameter("values", ParameterReference.value("ref1", "x"));

    assertThrows(
        IllegalArgumentException.class,
        () -> builder.addParameter("values", ParameterReference.value("ref1", "y")));
  }

  @Test
  public void testWithDependency() throws Exception {
    Statement statement = Statement.builder(Instructions.WAIT).setStatementName("wait1").build();

    Statement dependent = statement.withDependency("Steps.if1.true");

    assertThat(dependent.dependentStatements()).containsExactly("Steps.if1.true", true);
    assertThat(dependent.withDependency("Steps.if1.true")).isSameInstanceAs(dependent);
    assertThat(statement.dependentStatements()).isEmpty();
    assertThat(dependent.is(Instructions.WAIT)).isTrue();
    assertThat(dependent.instruction()).isEqualTo(Instructions.WAIT);
  }

  @Test
  public void testNullValueIsJsonNull() throws Exception {
    ParameterReference.Value value = new ParameterReference.Value("ref1", 1, null);

    assertThat(value.value()).isEqualTo(JsonNull.INSTANCE);
  }

  @Test
  public void testValueIsCopiedOnAccess() throws Exception {
    JsonArray items = new JsonArray();
    items.add("a");
    ParameterReference.Value value = new ParameterReference.Value("ref1", 1, items);

    items.add("b");
    value.value().getAsJsonArray().add("c");

    assertThat(value.value().getAsJsonArray()).hasSize(1);
  }

  @Test
  public void testOrderNeedNotBePositive() throws Exception {
    Statement statement =
        Statement.builder(Instructions.PRINT)
            .setStatementName("print1")
            .addParameter("values", new ParameterReference.Expression("ref1", 1, "Page.b"))
            .addParameter("values", new ParameterReference.Expression("ref2", 0, "Page.a"))
            .addParameter("values", new ParameterReference.Expression("ref3", -4, "Page.z"))
            .build();

    assertThat(statement.references("values"))
        .containsExactly(
            new ParameterReference.Expression("ref3", -4, "Page.z"),
            new ParameterReference.Expression("ref2", 0, "Page.a"),
            new ParameterReference.Expression("ref1", 1, "Page.b"))
        .inOrder();
  }

  @Test
  public void testDependencyPath() throws Exception {
    assertThat(DependencyPath.parse("Steps.fetch1.output.data"))
        .isEqualTo(DependencyPath.of("fetch1", DependencyPath.OUTPUT));
    assertThat(DependencyPath.parse("Steps.if1")).isNull();
    assertThat(DependencyPath.parse("Page.if1.true")).isNull();
    assertThat(DependencyPath.parse("Steps..true")).isNull();
    assertThat(DependencyPath.of("if1", DependencyPath.TRUE).toString())
        .isEqualTo("Steps.if1.true");
  }

  @Test
  public void testFunctionStepsAreKeyedByName() throws Exception {
    Statement wait = Statement.builder(Instructions.WAIT).setStatementName("wait1").build();

    FunctionDefinition function = FunctionDefinition.of("f", "", ImmutableList.of(wait));

    assertThat(function.steps()).containsExactly("wait1", wait);
    assertThat(function.version()).isEqualTo(FunctionDefinition.DEFAULT_VERSION);
    assertThrows(
        IllegalArgumentException.class,
        () -> FunctionDefinition.of("f", "", ImmutableList.of(wait, wait.toBuilder().build())));
  }
}
