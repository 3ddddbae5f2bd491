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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import dev.stepscript.compiler.parsing.ScriptParser;
import dev.stepscript.ir.Instructions;
import dev.stepscript.ir.ParameterReference;
import dev.stepscript.ir.Statement;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class PatternMatcherTest {

  private SortingErrorManager errorManager;
  private PatternMatcher matcher;

  @Before
  public void setUp() {
    errorManager = new SortingErrorManager();
    matcher = new PatternMatcher(errorManager, new StatementFactory());
  }

  @Test
  public void testAssignment() throws Exception {
    ImmutableList<Statement> statements = match("Page.x = Page.x + 1;");

    assertThat(statements).hasSize(1);
    Statement setStore = statements.get(0);
    assertThat(setStore.statementName()).isEqualTo("setStore1");
    assertThat(setStore.instruction()).isEqualTo(Instructions.SET_STORE);
    assertValue(setStore.reference("path"), new JsonPrimitive("Page.x"));
    assertExpression(setStore.reference("value"), "(Page.x + 1)");
  }

  @Test
  public void testLiteralAssignmentIsValue() throws Exception {
    Statement setStore = match("Store.name = 'Ada';").get(0);

    assertValue(setStore.reference("value"), new JsonPrimitive("Ada"));
  }

  @Test
  public void testCompoundAssignment() throws Exception {
    Statement setStore = match("Store.count -= Page.step;").get(0);

    assertExpression(setStore.reference("value"), "(Store.count - Page.step)");
  }

  @Test
  public void testUpdate() throws Exception {
    Statement setStore = match("Store.count++;").get(0);

    assertValue(setStore.reference("path"), new JsonPrimitive("Store.count"));
    assertExpression(setStore.reference("value"), "(Store.count + 1)");
  }

  @Test
  public void testAssignmentToLocalVariableWarns() throws Exception {
    assertThat(match("count = 1;")).isEmpty();
    assertThat(match("Steps.a.output = 1;")).isEmpty();

    assertThat(errorManager.getWarnings()).hasSize(2);
    assertThat(errorManager.getWarnings().get(0).type())
        .isSameInstanceAs(ConversionDiagnostics.NON_STORE_ASSIGNMENT);
  }

  @Test
  public void testSequence() throws Exception {
    ImmutableList<Statement> statements = match("Store.a = 1, Store.b = 2;");

    assertThat(names(statements)).containsExactly("setStore1", "setStore2").inOrder();
  }

  @Test
  public void testIfElse() throws Exception {
    ImmutableList<Statement> statements =
        match(
            "if (Page.isLoggedIn) { navigate('/dashboard'); } else { navigate('/login'); }");

    assertThat(names(statements)).containsExactly("if1", "navigate1", "navigate2").inOrder();
    assertExpression(statements.get(0).reference("condition"), "Page.isLoggedIn");
    assertThat(statements.get(0).dependentStatements()).isEmpty();
    assertThat(statements.get(1).dependentStatements()).containsExactly("Steps.if1.true", true);
    assertValue(statements.get(1).reference("linkPath"), new JsonPrimitive("/dashboard"));
    assertThat(statements.get(2).dependentStatements()).containsExactly("Steps.if1.false", true);
  }

  @Test
  public void testComparisonCondition() throws Exception {
    Statement ifStatement = match("if (Store.count === 0) { Store.empty = true; }").get(0);

    assertExpression(ifStatement.reference("condition"), "(Store.count = 0)");
  }

  @Test
  public void testNestedIfCarriesEnclosingBranches() throws Exception {
    ImmutableList<Statement> statements =
        match("if (Store.a) { if (Store.b) { Store.c = 1; } }");

    assertThat(names(statements)).containsExactly("if1", "if2", "setStore1").inOrder();
    assertThat(statements.get(1).dependentStatements()).containsExactly("Steps.if1.true", true);
    assertThat(statements.get(2).dependentStatements()).containsKey("Steps.if2.true");
    assertThat(statements.get(2).dependentStatements()).containsKey("Steps.if1.true");
  }

  @Test
  public void testOutcomeConditionIsBranch() throws Exception {
    ImmutableList<Statement> statements =
        match(
            "fetch('/api/users');",
            "if (Steps.fetchData1.output) { Store.users = Steps.fetchData1.output.data; }",
            "if (Steps.fetchData1.error) { alert('failed'); }");

    assertThat(names(statements)).containsExactly("fetchData1", "setStore1", "message1").inOrder();
    assertThat(statements.get(1).dependentStatements())
        .containsExactly("Steps.fetchData1.output", true);
    assertThat(statements.get(2).dependentStatements())
        .containsExactly("Steps.fetchData1.error", true);
  }

  @Test
  public void testOutcomeConditionWithElseIsIf() throws Exception {
    ImmutableList<Statement> statements =
        match(
            "if (Steps.fetchData1.output) { Store.a = 1; } else { Store.a = 2; }");

    assertThat(names(statements)).containsExactly("if1", "setStore1", "setStore2").inOrder();
  }

  @Test
  public void testCombinedOutcomeConditionIsIf() throws Exception {
    ImmutableList<Statement> statements =
        match("if (Steps.fetchData1.output && Page.ready) { Store.a = 1; }");

    assertThat(names(statements)).containsExactly("if1", "setStore1").inOrder();
    assertExpression(
        statements.get(0).reference("condition"), "(Steps.fetchData1.output && Page.ready)");
  }

  @Test
  public void testRangeLoop() throws Exception {
    ImmutableList<Statement> statements =
        match("for (let i = 0; i < 10; i++) { Store.total += 1; }");

    assertThat(names(statements)).containsExactly("rangeLoop1", "setStore1").inOrder();
    Statement loop = statements.get(0);
    assertThat(loop.instruction()).isEqualTo(Instructions.RANGE_LOOP);
    assertValue(loop.reference("from"), new JsonPrimitive(0));
    assertExpression(loop.reference("to"), "10");
    assertThat(statements.get(1).dependentStatements())
        .containsExactly("Steps.rangeLoop1.iteration", true);
  }

  @Test
  public void testInclusiveRangeLoop() throws Exception {
    Statement loop = match("for (let i = 1; i <= Store.count; i++) { Store.n = 1; }").get(0);

    assertValue(loop.reference("from"), new JsonPrimitive(1));
    assertExpression(loop.reference("to"), "(Store.count + 1)");
  }

  @Test
  public void testLoopWithoutBoundsWarns() throws Exception {
    assertThat(match("for (let i = 10; i > 0; i--) { Store.n = 1; }")).isEmpty();

    assertThat(errorManager.getWarnings()).hasSize(1);
    assertThat(errorManager.getWarnings().get(0).type())
        .isSameInstanceAs(ConversionDiagnostics.LOOP_BOUNDS_UNDETECTED);
  }

  @Test
  public void testForOfLoop() throws Exception {
    ImmutableList<Statement> statements =
        match("for (let item of Store.items) { console.log(item); }");

    assertThat(names(statements)).containsExactly("forEachLoop1", "print1").inOrder();
    assertExpression(statements.get(0).reference("source"), "Store.items");
    assertThat(statements.get(1).dependentStatements())
        .containsExactly("Steps.forEachLoop1.iteration", true);
  }

  @Test
  public void testWhileLoopWarns() throws Exception {
    assertThat(match("while (Store.running) { Store.n++; }")).isEmpty();

    assertThat(errorManager.getWarnings().get(0).type())
        .isSameInstanceAs(ConversionDiagnostics.UNBOUNDED_LOOP);
  }

  @Test
  public void testLocalVariableWarns() throws Exception {
    assertThat(match("let total = 1;")).isEmpty();

    assertThat(errorManager.getWarnings()).hasSize(1);
    assertThat(errorManager.getWarnings().get(0).type())
        .isSameInstanceAs(ConversionDiagnostics.LOCAL_VARIABLE);
    assertThat(errorManager.getWarnings().get(0).description()).contains("total");
  }

  @Test
  public void testDeclarationWithCallIsConverted() throws Exception {
    ImmutableList<Statement> statements = match("const response = fetch('/api/users');");

    assertThat(names(statements)).containsExactly("fetchData1");
    assertThat(errorManager.getWarningCount()).isEqualTo(0);
  }

  @Test
  public void testReturn() throws Exception {
    Statement event = match("return Store.total;").get(0);

    assertThat(event.instruction()).isEqualTo(Instructions.GENERATE_EVENT);
    assertValue(event.reference("eventName"), new JsonPrimitive("output"));
    assertValue(
        event.reference("results"),
        JsonParser.parseString(
            "{\"name\": \"returnValue\","
                + " \"value\": {\"isExpression\": true, \"value\": \"Store.total\"}}"));
  }

  @Test
  public void testFailingStatementIsDropped() throws Exception {
    ImmutableList<Statement> statements =
        match("Store.a = 1;", "Store.f = x => x;", "Store.b = 2;");

    assertThat(names(statements)).containsExactly("setStore1", "setStore2").inOrder();
    assertThat(errorManager.getErrors()).hasSize(1);
    assertThat(errorManager.getErrors().get(0).type())
        .isSameInstanceAs(ConversionDiagnostics.ARROW_FUNCTION_UNSUPPORTED);
    assertThat(errorManager.getErrors().get(0).lineno()).isEqualTo(2);
  }

  @Test
  public void testUnsupportedStatementWarns() throws Exception {
    assertThat(match("function helper() { Store.a = 1; }")).isEmpty();

    assertThat(errorManager.getWarnings().get(0).description()).contains("FunctionDeclaration");
  }

  @Test
  public void testOriginLines() throws Exception {
    match("Store.a = 1;", "if (Store.b) {", "  Store.c = 2;", "}");

    assertThat(matcher.getOriginLines())
        .containsExactly("setStore1", 1, "if1", 2, "setStore2", 3)
        .inOrder();
  }

  @Test
  public void testOriginLinesFollowNestedOrder() throws Exception {
    match(
        "for (let user of Store.users) {",
        "  if (user.active) {",
        "    Store.count = 1;",
        "  }",
        "}",
        "Store.done = true;");

    assertThat(matcher.getOriginLines())
        .containsExactly("forEachLoop1", 1, "if1", 2, "setStore1", 3, "setStore2", 6)
        .inOrder();
  }

  @Test
  public void testBodyDependenciesExcludeOutcomeBranches() throws Exception {
    match(
        "fetch('/api/users');",
        "if (Steps.fetchData1.output) { Store.users = 1; }",
        "if (Page.ready) { Store.a = 1; } else { Store.b = 2; }");

    assertThat(matcher.getBodyDependencies())
        .containsExactly("setStore2", "Steps.if1.true", "setStore3", "Steps.if1.false");
  }

  private ImmutableList<Statement> match(String... lines) throws Exception {
    return matcher.match(new ScriptParser().parse(String.join("\n", lines)));
  }

  static ImmutableList<String> names(Iterable<Statement> statements) {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Statement statement : statements) {
      names.add(statement.statementName());
    }
    return names.build();
  }

  static void assertValue(ParameterReference reference, JsonElement expected) {
    assertThat(reference).isInstanceOf(ParameterReference.Value.class);
    assertThat(((ParameterReference.Value) reference).value()).isEqualTo(expected);
  }

  static void assertExpression(ParameterReference reference, String expected) {
    assertThat(reference).isInstanceOf(ParameterReference.Expression.class);
    assertThat(((ParameterReference.Expression) reference).expression()).isEqualTo(expected);
  }
}
