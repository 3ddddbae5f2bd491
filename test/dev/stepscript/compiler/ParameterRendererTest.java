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
import com.google.gson.JsonNull;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import dev.stepscript.ir.Instructions;
import dev.stepscript.ir.ParameterReference;
import dev.stepscript.ir.Statement;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ParameterRendererTest {

  private static final ImmutableList<String> EXPRESSIONS =
      ImmutableList.of(
          "",
          "a",
          "(a)",
          "((a + b))",
          "(a) + (b)",
          "(a, b)",
          "f(a, b)",
          "(f(a, b))",
          "((a, b))",
          "(\"(\")",
          "(\")\" + a)",
          "([1, 2])",
          "(",
          ")(");

  @Test
  public void testStripOuterParens() throws Exception {
    assertThat(ParameterRenderer.stripOuterParens("(Page.x + 1)")).isEqualTo("Page.x + 1");
    assertThat(ParameterRenderer.stripOuterParens("((a + b))")).isEqualTo("a + b");
    assertThat(ParameterRenderer.stripOuterParens(" ( a ) ")).isEqualTo("a");
    assertThat(ParameterRenderer.stripOuterParens("(a) + (b)")).isEqualTo("(a) + (b)");
    assertThat(ParameterRenderer.stripOuterParens("(\")\" + a)")).isEqualTo("\")\" + a");
  }

  @Test
  public void testStripOuterParensKeepsArgumentLists() throws Exception {
    assertThat(ParameterRenderer.stripOuterParens("(a, b)")).isEqualTo("(a, b)");
    assertThat(ParameterRenderer.stripOuterParens("f(a, b)")).isEqualTo("f(a, b)");
    assertThat(ParameterRenderer.stripOuterParens("(f(a, b))")).isEqualTo("f(a, b)");
    assertThat(ParameterRenderer.stripOuterParens("((a, b))")).isEqualTo("(a, b)");
  }

  @Test
  public void testStripOuterParensIsIdempotent() throws Exception {
    for (String expression : EXPRESSIONS) {
      String once = ParameterRenderer.stripOuterParens(expression);
      assertThat(ParameterRenderer.stripOuterParens(once)).isEqualTo(once);
    }
  }

  @Test
  public void testToScriptOperators() throws Exception {
    assertThat(ParameterRenderer.toScriptOperators("Store.a = 1")).isEqualTo("Store.a == 1");
    assertThat(ParameterRenderer.toScriptOperators("a == 1")).isEqualTo("a == 1");
    assertThat(ParameterRenderer.toScriptOperators("a != 1")).isEqualTo("a != 1");
    assertThat(ParameterRenderer.toScriptOperators("a <= 1 && b >= 2"))
        .isEqualTo("a <= 1 && b >= 2");
    assertThat(ParameterRenderer.toScriptOperators("a = \"x = y\""))
        .isEqualTo("a == \"x = y\"");
  }

  @Test
  public void testRenderExpression() throws Exception {
    assertThat(ParameterRenderer.renderExpression("(Page.count = 0)"))
        .isEqualTo("Page.count == 0");
    assertThat(ParameterRenderer.renderExpression("{{Store.user.name}}"))
        .isEqualTo("Store.user.name");
  }

  @Test
  public void testRenderValue() throws Exception {
    assertThat(render(ParameterReference.value("ref1", "/login"), false)).isEqualTo("\"/login\"");
    assertThat(render(ParameterReference.value("ref1", "Store.user"), false))
        .isEqualTo("\"Store.user\"");
    assertThat(render(ParameterReference.value("ref1", "Store.user"), true))
        .isEqualTo("Store.user");
    assertThat(render(ParameterReference.value("ref1", "item"), true)).isEqualTo("item");
    assertThat(render(ParameterReference.value("ref1", new JsonPrimitive(3)), false))
        .isEqualTo("3");
    assertThat(render(ParameterReference.value("ref1", new JsonPrimitive(1.5)), false))
        .isEqualTo("1.5");
    assertThat(render(ParameterReference.value("ref1", new JsonPrimitive(true)), false))
        .isEqualTo("true");
    assertThat(render(ParameterReference.value("ref1", JsonNull.INSTANCE), false))
        .isEqualTo("null");
    assertThat(render(ParameterReference.value("ref1", JsonParser.parseString("{\"a\":1}")), false))
        .isEqualTo("{\"a\":1}");
  }

  @Test
  public void testRenderParameter() throws Exception {
    Statement statement =
        Statement.builder(Instructions.PRINT)
            .setStatementName("print1")
            .addParameter("values", new ParameterReference.Value("b", 2, new JsonPrimitive("y")))
            .addParameter("values", new ParameterReference.Expression("a", 1, "Page.x"))
            .build();

    assertThat(ParameterRenderer.render(statement, "values", false, false))
        .isEqualTo("[Page.x, \"y\"]");
    assertThat(ParameterRenderer.render(statement, "values", false, true))
        .isEqualTo("Page.x, \"y\"");
    assertThat(ParameterRenderer.render(statement, "missing", false, false))
        .isEqualTo(ParameterRenderer.ABSENT);
  }

  private static String render(ParameterReference reference, boolean asIdentifier) {
    return ParameterRenderer.render(reference, asIdentifier);
  }
}
