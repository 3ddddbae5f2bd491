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
import static dev.stepscript.compiler.PatternMatcherTest.assertExpression;
import static dev.stepscript.compiler.PatternMatcherTest.assertValue;
import static dev.stepscript.compiler.PatternMatcherTest.names;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import dev.stepscript.compiler.parsing.ScriptParser;
import dev.stepscript.ir.InstructionId;
import dev.stepscript.ir.Instructions;
import dev.stepscript.ir.ParameterReference;
import dev.stepscript.ir.Statement;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CallMatcherTest {

  private SortingErrorManager errorManager;

  @Before
  public void setUp() {
    errorManager = new SortingErrorManager();
  }

  @Test
  public void testFetchWithoutOptions() throws Exception {
    Statement fetch = matchOne("fetch(\"/api/users\");");

    assertThat(fetch.instruction()).isEqualTo(Instructions.FETCH_DATA);
    assertValue(fetch.reference("url"), new JsonPrimitive("/api/users"));
    assertThat(fetch.parameterMap()).doesNotContainKey("method");
  }

  @Test
  public void testFetchWithComputedUrl() throws Exception {
    Statement fetch = matchOne("fetch(Store.baseUrl + '/users');");

    assertExpression(fetch.reference("url"), "(Store.baseUrl + \"/users\")");
  }

  @Test
  public void testPostIsSendData() throws Exception {
    Statement send =
        matchOne("fetch('/api/login', { method: 'POST', body: Page.credentials });");

    assertThat(send.instruction()).isEqualTo(Instructions.SEND_DATA);
    assertValue(send.reference("method"), new JsonPrimitive("POST"));
    assertExpression(send.reference("payload"), "Page.credentials");
  }

  @Test
  public void testRequestParameters() throws Exception {
    Statement send =
        matchOne(
            "fetch('/api/items', {",
            "  method: 'put',",
            "  headers: { Authorization: Store.token, 'X-Id': 1 },",
            "  queryParams: { page: 2 }",
            "});");

    assertValue(send.reference("method"), new JsonPrimitive("PUT"));
    assertThat(send.reference("payload")).isNull();
    assertValue(
        send.reference("headers"),
        JsonParser.parseString(
            "{\"Authorization\": {\"location\": {\"type\": \"EXPRESSION\","
                + " \"expression\": \"Store.token\"}}, \"X-Id\": {\"value\": 1}}"));
    assertValue(
        send.reference("queryParams"), JsonParser.parseString("{\"page\": {\"value\": 2}}"));
  }

  @Test
  public void testGetWithHeadersIsFetchData() throws Exception {
    Statement fetch = matchOne("fetch('/api', { method: 'GET', headers: { Accept: 'json' } });");

    assertThat(fetch.instruction()).isEqualTo(Instructions.FETCH_DATA);
    assertThat(fetch.parameterMap()).containsKey("headers");
  }

  @Test
  public void testFetchWithoutArgumentsIsError() throws Exception {
    assertThat(match("fetch();")).isEmpty();

    assertThat(errorManager.getErrors()).hasSize(1);
    assertThat(errorManager.getErrors().get(0).type())
        .isSameInstanceAs(ConversionDiagnostics.MISSING_ARGUMENT);
    assertThat(errorManager.getErrors().get(0).description())
        .isEqualTo("fetch() requires at least one argument (url)");
  }

  @Test
  public void testNavigate() throws Exception {
    Statement navigate = matchOne("navigate('/home', '_blank');");

    assertThat(navigate.instruction()).isEqualTo(Instructions.NAVIGATE);
    assertValue(navigate.reference("linkPath"), new JsonPrimitive("/home"));
    assertValue(navigate.reference("target"), new JsonPrimitive("_blank"));
  }

  @Test
  public void testRouterAndLocationNavigate() throws Exception {
    ImmutableList<Statement> statements =
        match("router.push('/home');", "window.location.assign(Store.url);");

    assertThat(names(statements)).containsExactly("navigate1", "navigate2").inOrder();
    assertExpression(statements.get(1).reference("linkPath"), "Store.url");
  }

  @Test
  public void testWait() throws Exception {
    ImmutableList<Statement> statements = match("wait(500);", "delay(Store.ms);", "sleep(1);");

    assertThat(names(statements)).containsExactly("wait1", "wait2", "wait3").inOrder();
    assertValue(statements.get(0).reference("millis"), new JsonPrimitive(500));
    assertExpression(statements.get(1).reference("millis"), "Store.ms");
  }

  @Test
  public void testMessage() throws Exception {
    ImmutableList<Statement> statements =
        match("alert('Saved');", "showMessage(Store.message, 'error');");

    assertThat(statements.get(0).instruction()).isEqualTo(Instructions.MESSAGE);
    assertValue(statements.get(0).reference("msg"), new JsonPrimitive("Saved"));
    assertValue(statements.get(0).reference("type"), new JsonPrimitive("INFO"));
    assertExpression(statements.get(1).reference("msg"), "Store.message");
    assertValue(statements.get(1).reference("type"), new JsonPrimitive("ERROR"));
  }

  @Test
  public void testSetStoreCall() throws Exception {
    Statement setStore = matchOne("setStore('Store.user', Page.user);");

    assertThat(setStore.instruction()).isEqualTo(Instructions.SET_STORE);
    assertValue(setStore.reference("path"), new JsonPrimitive("Store.user"));
    assertExpression(setStore.reference("value"), "Page.user");
  }

  @Test
  public void testGenerateEvent() throws Exception {
    Statement event = matchOne("generateEvent('saved', { id: 1, tags: ['a'] });");

    assertThat(event.instruction()).isEqualTo(Instructions.GENERATE_EVENT);
    assertValue(event.reference("eventName"), new JsonPrimitive("saved"));
    assertValue(
        event.reference("results"), JsonParser.parseString("{\"id\": 1, \"tags\": [\"a\"]}"));
  }

  @Test
  public void testConsoleLog() throws Exception {
    Statement print = matchOne("console.log('Total:', Store.total);");

    assertThat(print.instruction()).isEqualTo(Instructions.PRINT);
    ImmutableList<ParameterReference> values = print.references("values");
    assertThat(values).hasSize(2);
    assertExpression(values.get(0), "\"Total:\"");
    assertExpression(values.get(1), "Store.total");
    assertThat(values.get(1).order()).isEqualTo(2);
  }

  @Test
  public void testArrayMethods() throws Exception {
    ImmutableList<Statement> statements =
        match(
            "Store.items.push(Page.item, 2);",
            "Store.items.unshift(1);",
            "Store.items.pop();",
            "Store.items.shift();");

    assertThat(names(statements))
        .containsExactly("insertLast1", "addFirst1", "deleteLast1", "deleteFirst1")
        .inOrder();
    Statement push = statements.get(0);
    assertThat(push.instruction()).isEqualTo(Instructions.ARRAY_INSERT_LAST);
    assertExpression(push.reference("source"), "Store.items");
    assertThat(push.references("element")).hasSize(2);
    assertExpression(push.references("element").get(0), "Page.item");
    assertThat(statements.get(2).parameterMap()).doesNotContainKey("element");
  }

  @Test
  public void testForEach() throws Exception {
    ImmutableList<Statement> statements =
        match("Store.items.forEach(item => { Store.last = item; });");

    assertThat(names(statements)).containsExactly("forEachLoop1", "setStore1").inOrder();
    assertExpression(statements.get(0).reference("source"), "Store.items");
    assertThat(statements.get(1).dependentStatements())
        .containsExactly("Steps.forEachLoop1.iteration", true);
  }

  @Test
  public void testForEachWithoutInlineCallback() throws Exception {
    assertThat(names(match("Store.items.forEach(Store.handler);")))
        .containsExactly("forEachLoop1");

    assertThat(errorManager.getWarnings().get(0).type())
        .isSameInstanceAs(ConversionDiagnostics.FOR_EACH_CALLBACK);
  }

  @Test
  public void testFilter() throws Exception {
    Statement filter = matchOne("Store.items.filter(item => item.done);");

    assertThat(filter.instruction()).isEqualTo(Instructions.ARRAY_FILTER);
    assertExpression(filter.reference("condition"), "item.done");
    assertThat(types(errorManager.getWarnings()))
        .contains(ConversionDiagnostics.FILTER_CONDITION);
  }

  @Test
  public void testFilterKeepsCallbackParameter() throws Exception {
    Statement filter = matchOne("Page.users.filter(u => u.active);");

    assertValue(filter.reference("iteratorKey"), new JsonPrimitive("u"));
    assertExpression(filter.reference("condition"), "u.active");
  }

  @Test
  public void testFilterNeedsArrowFunction() throws Exception {
    assertThat(match("Store.items.filter(Store.predicate);")).isEmpty();

    assertThat(errorManager.getWarnings().get(0).type())
        .isSameInstanceAs(ConversionDiagnostics.FILTER_CALLBACK_REQUIRED);
  }

  @Test
  public void testMapIsUnsupported() throws Exception {
    assertThat(match("Store.items.map(x => x * 2);")).isEmpty();

    assertThat(errorManager.getWarnings().get(0).type())
        .isSameInstanceAs(ConversionDiagnostics.ARRAY_MAP_UNSUPPORTED);
  }

  @Test
  public void testGenericCall() throws Exception {
    Statement call = matchOne("customAction(Store.a, 2);");

    assertThat(call.instruction()).isEqualTo(InstructionId.of("", "customAction"));
    assertThat(call.statementName()).isEqualTo("customAction1");
    assertExpression(call.reference("arg0"), "Store.a");
    assertExpression(call.reference("arg1"), "2");
  }

  @Test
  public void testUiEngineFunction() throws Exception {
    Statement call = matchOne("NavigateBack();");

    assertThat(call.instruction())
        .isEqualTo(InstructionId.of(Instructions.UI_ENGINE, "NavigateBack"));
    assertThat(call.statementName()).isEqualTo("navigateBack1");
  }

  @Test
  public void testMethodCallKeepsReceiverAsNamespace() throws Exception {
    Statement call = matchOne("Math.max(Store.a, 3);");

    assertThat(call.instruction()).isEqualTo(InstructionId.of("Math", "max"));
    assertThat(errorManager.getWarningCount()).isEqualTo(0);
  }

  @Test
  public void testUnsupportedCallTarget() throws Exception {
    assertThat(match("getHandler()();", "Store.items[0].reset();")).isEmpty();

    assertThat(types(errorManager.getWarnings()))
        .containsExactly(
            ConversionDiagnostics.UNSUPPORTED_CALL_TARGET,
            ConversionDiagnostics.UNSUPPORTED_CALL_TARGET);
  }

  private Statement matchOne(String... lines) throws Exception {
    ImmutableList<Statement> statements = match(lines);
    assertThat(statements).hasSize(1);
    return statements.get(0);
  }

  private ImmutableList<Statement> match(String... lines) throws Exception {
    PatternMatcher matcher = new PatternMatcher(errorManager, new StatementFactory());
    return matcher.match(new ScriptParser().parse(String.join("\n", lines)));
  }

  private static ImmutableList<DiagnosticType> types(Iterable<ConversionError> errors) {
    ImmutableList.Builder<DiagnosticType> types = ImmutableList.builder();
    for (ConversionError error : errors) {
      types.add(error.type());
    }
    return types.build();
  }
}
