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
import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonPrimitive;
import dev.stepscript.ir.FunctionDefinition;
import dev.stepscript.ir.InstructionId;
import dev.stepscript.ir.Instructions;
import dev.stepscript.ir.IrJson;
import dev.stepscript.ir.ParameterReference;
import dev.stepscript.ir.Statement;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DecompilerTest {

  private final Decompiler decompiler = new Decompiler();

  @Test
  public void testEmptyFunction() throws Exception {
    FunctionDefinition function = FunctionDefinition.of("onLoad", "App", ImmutableList.of());

    assertThat(decompiler.decompile(function))
        .isEqualTo("// Function: onLoad\n// (empty function)");
  }

  @Test
  public void testAssignment() throws Exception {
    Statement setStore =
        Statement.builder(Instructions.SET_STORE)
            .setStatementName("setStore1")
            .addParameter("path", ParameterReference.value("ref1", "Page.x"))
            .addParameter("value", ParameterReference.expression("ref2", "(Page.x + 1)"))
            .build();

    assertThat(decompile(setStore))
        .isEqualTo(lines("// Function: f", "", "Page.x = Page.x + 1;  // Step: setStore1"));
  }

  @Test
  public void testIfElse() throws Exception {
    String source =
        decompile(
            ifStatement("if1", "(Store.count = 0)"),
            navigate("navigate1", "/empty", "Steps.if1.true"),
            navigate("navigate2", "/list", "Steps.if1.false"));

    assertThat(source)
        .isEqualTo(
            lines(
                "// Function: f",
                "",
                "if (Store.count == 0) {  // Step: if1",
                "  navigate(\"/empty\");  // Step: navigate1",
                "} else {",
                "  navigate(\"/list\");  // Step: navigate2",
                "}"));
  }

  @Test
  public void testIfWithoutElse() throws Exception {
    String source =
        decompile(
            ifStatement("if1", "Page.ready"), navigate("navigate1", "/home", "Steps.if1.true"));

    assertThat(source)
        .isEqualTo(
            lines(
                "// Function: f",
                "",
                "if (Page.ready) {  // Step: if1",
                "  navigate(\"/home\");  // Step: navigate1",
                "}"));
  }

  @Test
  public void testNestedIf() throws Exception {
    Statement setStore =
        Statement.builder(Instructions.SET_STORE)
            .setStatementName("setStore1")
            .addParameter("path", ParameterReference.value("ref1", "Store.c"))
            .addParameter("value", ParameterReference.value("ref2", new JsonPrimitive(1)))
            .putDependency("Steps.if2.true")
            .putDependency("Steps.if1.true")
            .build();
    Statement inner =
        ifStatement("if2", "Store.b").toBuilder().putDependency("Steps.if1.true").build();

    String source = decompile(ifStatement("if1", "Store.a"), inner, setStore);

    assertThat(source)
        .isEqualTo(
            lines(
                "// Function: f",
                "",
                "if (Store.a) {  // Step: if1",
                "  if (Store.b) {  // Step: if2",
                "    Store.c = 1;  // Step: setStore1",
                "  }",
                "}"));
  }

  @Test
  public void testOutcomeBranches() throws Exception {
    Statement fetch =
        Statement.builder(Instructions.FETCH_DATA)
            .setStatementName("fetchData1")
            .addParameter("url", ParameterReference.value("ref1", "/api/users"))
            .build();
    Statement setStore =
        Statement.builder(Instructions.SET_STORE)
            .setStatementName("setStore1")
            .addParameter("path", ParameterReference.value("ref1", "Store.users"))
            .addParameter(
                "value", ParameterReference.expression("ref2", "Steps.fetchData1.output.data"))
            .build();
    Statement print =
        Statement.builder(Instructions.PRINT)
            .setStatementName("print1")
            .addParameter("values", ParameterReference.value("ref1", "failed"))
            .putDependency("Steps.fetchData1.error")
            .build();

    assertThat(decompile(fetch, setStore, print))
        .isEqualTo(
            lines(
                "// Function: f",
                "",
                "fetch(\"/api/users\");  // Step: fetchData1",
                "if (Steps.fetchData1.output) {",
                "  Store.users = Steps.fetchData1.output.data;  // Step: setStore1",
                "}",
                "if (Steps.fetchData1.error) {",
                "  console.log(\"failed\");  // Step: print1",
                "}"));
  }

  @Test
  public void testLoops() throws Exception {
    Statement forEach =
        Statement.builder(Instructions.FOR_EACH_LOOP)
            .setStatementName("forEachLoop1")
            .addParameter("source", ParameterReference.expression("ref1", "Store.items"))
            .build();
    Statement print =
        Statement.builder(Instructions.PRINT)
            .setStatementName("print1")
            .addParameter("values", ParameterReference.expression("ref1", "item"))
            .putDependency("Steps.forEachLoop1.iteration")
            .build();
    Statement range =
        Statement.builder(Instructions.RANGE_LOOP)
            .setStatementName("rangeLoop1")
            .addParameter("from", ParameterReference.value("ref1", new JsonPrimitive(0)))
            .addParameter("to", ParameterReference.expression("ref2", "10"))
            .build();

    assertThat(decompile(forEach, print, range))
        .isEqualTo(
            lines(
                "// Function: f",
                "",
                "for (let item of Store.items) {  // Step: forEachLoop1",
                "  console.log(item);  // Step: print1",
                "}",
                "for (let i = 0; i < 10; i++) {  // Step: rangeLoop1",
                "}"));
  }

  @Test
  public void testStatementsFollowExecutionOrder() throws Exception {
    Statement setStore =
        Statement.builder(Instructions.SET_STORE)
            .setStatementName("setStore1")
            .addParameter("path", ParameterReference.value("ref1", "Store.a"))
            .addParameter("value", ParameterReference.expression("ref2", "Steps.wait1.done"))
            .build();
    Statement wait =
        Statement.builder(Instructions.WAIT)
            .setStatementName("wait1")
            .addParameter("millis", ParameterReference.value("ref1", new JsonPrimitive(100)))
            .build();

    assertThat(decompile(setStore, wait))
        .isEqualTo(
            lines(
                "// Function: f",
                "",
                "wait(100);  // Step: wait1",
                "Store.a = Steps.wait1.done;  // Step: setStore1"));
  }

  @Test
  public void testUnknownInstructionIsComment() throws Exception {
    Statement statement =
        Statement.builder("Vendor.Charts", "Render")
            .setStatementName("render1")
            .addParameter("target", ParameterReference.value("ref1", "chart"))
            .addParameter("data", ParameterReference.expression("ref1", "Store.points"))
            .build();

    assertThat(decompiler.decompileStatement(statement))
        .isEqualTo("// Vendor.Charts.Render(target=\"chart\", data=Store.points)");
  }

  @Test
  public void testPassthroughCall() throws Exception {
    Statement statement =
        Statement.builder("analytics", "track")
            .setStatementName("track1")
            .addParameter("arg1", ParameterReference.value("ref1", "click"))
            .addParameter("arg0", ParameterReference.expression("ref1", "Page.user"))
            .build();

    assertThat(decompiler.decompileStatement(statement))
        .isEqualTo("analytics.track(Page.user, \"click\");");
  }

  @Test
  public void testMissingParameter() throws Exception {
    TemplateRegistry templates =
        TemplateRegistry.getDefault()
            .withTemplate(
                InstructionTemplate.builder(Instructions.WAIT)
                    .setTemplate("wait({millis}, {unit});")
                    .setExtract(ImmutableList.of("millis"))
                    .build());
    Statement wait =
        Statement.builder(Instructions.WAIT)
            .setStatementName("wait1")
            .addParameter("millis", ParameterReference.value("ref1", new JsonPrimitive(100)))
            .build();

    assertThat(new Decompiler(templates).decompileStatement(wait))
        .isEqualTo("// System.Wait(...) - missing param: unit");
  }

  @Test
  public void testCycleIsRendered() throws Exception {
    Statement first =
        navigate("navigate1", "/a", null)
            .toBuilder()
            .putDependency("Steps.navigate2.output")
            .build();
    Statement second =
        navigate("navigate2", "/b", null)
            .toBuilder()
            .putDependency("Steps.navigate1.output")
            .build();

    String source = decompile(first, second);

    assertThat(source).contains("// Step: navigate1");
    assertThat(source).contains("// Step: navigate2");
  }

  @Test
  public void testStoredFunctionWithZeroOrder() throws Exception {
    FunctionDefinition function =
        IrJson.parse(
            lines(
                "{\"name\": \"f\", \"steps\": {\"print1\": {",
                "  \"statementName\": \"print1\", \"namespace\": \"System\",",
                "  \"name\": \"Print\", \"parameterMap\": {\"values\": {",
                "    \"ref1\": {\"key\": \"ref1\", \"type\": \"EXPRESSION\",",
                "      \"expression\": \"Page.b\", \"order\": 1},",
                "    \"ref2\": {\"key\": \"ref2\", \"type\": \"EXPRESSION\",",
                "      \"expression\": \"Page.a\", \"order\": 0}}}}}}"));

    assertThat(decompiler.decompile(function))
        .isEqualTo(lines("// Function: f", "", "console.log(Page.a, Page.b);  // Step: print1"));
  }

  @Test
  public void testStringValueLookingLikeStorePathIsQuoted() throws Exception {
    Statement setStore =
        Statement.builder(Instructions.SET_STORE)
            .setStatementName("setStore1")
            .addParameter("path", ParameterReference.value("ref1", "Page.t"))
            .addParameter("value", ParameterReference.value("ref2", "Page. title"))
            .build();

    assertThat(decompile(setStore))
        .isEqualTo(lines("// Function: f", "", "Page.t = \"Page. title\";  // Step: setStore1"));
  }

  @Test
  public void testFilterWithoutCallbackParameterUsesItem() throws Exception {
    Statement filter =
        Statement.builder(Instructions.ARRAY_FILTER)
            .setStatementName("filter1")
            .addParameter("source", ParameterReference.expression("ref1", "Page.users"))
            .addParameter("condition", ParameterReference.expression("ref2", "item.active"))
            .build();

    assertThat(decompile(filter))
        .isEqualTo(
            lines(
                "// Function: f",
                "",
                "Page.users.filter(item => item.active);  // Step: filter1"));
  }

  @Test
  public void testRoundTripKeepsFilterParameter() throws Exception {
    ForwardConverter converter = new ForwardConverter();
    FunctionDefinition first =
        converter.convert("Page.users.filter(u => u.active);").functionDefinition();

    String decompiled = decompiler.decompile(first);
    FunctionDefinition second = converter.convert(decompiled).functionDefinition();

    assertThat(decompiled).contains("Page.users.filter(u => u.active);  // Step: filter1");
    assertThat(second.steps().get("filter1").parameterMap())
        .isEqualTo(first.steps().get("filter1").parameterMap());
  }

  @Test
  public void testRoundTripKeepsBranchStructure() throws Exception {
    String script =
        lines(
            "if (Store.count === 0) {",
            "  Store.empty = true;",
            "  navigate('/empty');",
            "} else {",
            "  Store.empty = false;",
            "}");
    ForwardConverter converter = new ForwardConverter();
    FunctionDefinition first = converter.convert(script).functionDefinition();

    String decompiled = decompiler.decompile(first);
    ConversionResult second = converter.convert(decompiled);

    assertThat(second.success()).isTrue();
    assertThat(branchStructure(second.functionDefinition()))
        .isEqualTo(branchStructure(first));
    assertThat(branchStructure(first))
        .containsExactly(
            "if1", ImmutableSet.of(),
            "setStore1", ImmutableSet.of("Steps.if1.true"),
            "navigate1", ImmutableSet.of("Steps.if1.true"),
            "setStore2", ImmutableSet.of("Steps.if1.false"));
  }

  @Test
  public void testRoundTripPreservesStepNames() throws Exception {
    FunctionDefinition original =
        FunctionDefinition.of(
            "f",
            ConversionOptions.defaults().getNamespace(),
            ImmutableList.of(
                ifStatement("check", "Page.ready"),
                navigate("goHome", "/home", "Steps.check.true"),
                navigate("goBack", "/back", "Steps.check.false")));

    String decompiled = decompiler.decompile(original);
    FunctionDefinition converted =
        new ForwardConverter()
            .convert(
                decompiled,
                ConversionOptions.builder()
                    .setFunctionName("f")
                    .setOriginalFunction(original)
                    .build())
            .functionDefinition();

    assertThat(converted.steps().keySet()).containsExactly("check", "goHome", "goBack").inOrder();
    assertThat(converted.steps().get("goBack").dependentStatements())
        .containsExactly("Steps.check.false", true);
  }

  @Test
  public void testRoundTripKeepsReferencesWhenNamesSwap() throws Exception {
    Statement setStore =
        Statement.builder(Instructions.SET_STORE)
            .setStatementName("setStore1")
            .addParameter("path", ParameterReference.value("ref1", "Store.data"))
            .addParameter(
                "value", ParameterReference.expression("ref2", "Steps.fetchData1.output.data"))
            .putDependency("Steps.fetchData1.output")
            .build();
    FunctionDefinition original =
        FunctionDefinition.of(
            "f",
            ConversionOptions.defaults().getNamespace(),
            ImmutableList.of(fetch("fetchData2", "/a"), fetch("fetchData1", "/b"), setStore));

    String decompiled = decompiler.decompile(original);
    FunctionDefinition converted =
        new ForwardConverter()
            .convert(
                decompiled,
                ConversionOptions.builder()
                    .setFunctionName("f")
                    .setOriginalFunction(original)
                    .build())
            .functionDefinition();

    assertThat(converted.steps().keySet())
        .containsExactly("fetchData2", "fetchData1", "setStore1")
        .inOrder();
    ParameterReference url = converted.steps().get("fetchData1").reference("url");
    assertThat(((ParameterReference.Value) url).value()).isEqualTo(new JsonPrimitive("/b"));
    Statement converted1 = converted.steps().get("setStore1");
    assertThat(((ParameterReference.Expression) converted1.reference("value")).expression())
        .isEqualTo("Steps.fetchData1.output.data");
    assertThat(converted1.dependentStatements()).containsExactly("Steps.fetchData1.output", true);
  }

  private static Map<String, ImmutableSet<String>> branchStructure(FunctionDefinition function) {
    ImmutableSet<InstructionId> targets = ImmutableSet.of(Instructions.IF, Instructions.NAVIGATE);
    Map<String, ImmutableSet<String>> structure = new LinkedHashMap<>();
    for (Statement statement : function.steps().values()) {
      if (targets.contains(statement.instruction())
          || statement.is(Instructions.SET_STORE)) {
        structure.put(statement.statementName(), statement.dependentStatements().keySet());
      }
    }
    return structure;
  }

  private static Statement ifStatement(String name, String condition) {
    return Statement.builder(Instructions.IF)
        .setStatementName(name)
        .addParameter("condition", ParameterReference.expression("ref1", condition))
        .build();
  }

  private static Statement fetch(String name, String url) {
    return Statement.builder(Instructions.FETCH_DATA)
        .setStatementName(name)
        .addParameter("url", ParameterReference.value("ref1", url))
        .build();
  }

  private static Statement navigate(String name, String path, @Nullable String dependency) {
    Statement.Builder builder =
        Statement.builder(Instructions.NAVIGATE)
            .setStatementName(name)
            .addParameter("linkPath", ParameterReference.value("ref1", path));
    if (dependency != null) {
      builder.putDependency(dependency);
    }
    return builder.build();
  }

  private String decompile(Statement... statements) {
    return decompiler.decompile(
        FunctionDefinition.of("f", "Test", ImmutableList.copyOf(statements)));
  }

  private static String lines(String... lines) {
    return String.join("\n", lines);
  }
}
