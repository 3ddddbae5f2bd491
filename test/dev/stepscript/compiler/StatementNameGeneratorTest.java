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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class StatementNameGeneratorTest {

  @Test
  public void testCountersArePerPrefix() {
    StatementNameGenerator generator = new StatementNameGenerator();

    assertThat(generator.generate("setStore")).isEqualTo("setStore1");
    assertThat(generator.generate("if")).isEqualTo("if1");
    assertThat(generator.generate("setStore")).isEqualTo("setStore2");
    assertThat(generator.generate("SetStore")).isEqualTo("setStore3");
  }

  @Test
  public void testReservedNamesAreSkipped() {
    StatementNameGenerator generator = new StatementNameGenerator();
    generator.reserve("wait1");
    generator.reserve("wait2");

    assertThat(generator.generate("wait")).isEqualTo("wait3");
    assertThat(generator.generate("wait")).isEqualTo("wait4");
  }

  @Test
  public void testGeneratorsAreIndependent() {
    StatementNameGenerator first = new StatementNameGenerator();
    first.generate("print");

    assertThat(new StatementNameGenerator().generate("print")).isEqualTo("print1");
  }

  @Test
  public void testToCamelCase() {
    assertThat(StatementNameGenerator.toCamelCase("set_store")).isEqualTo("setStore");
    assertThat(StatementNameGenerator.toCamelCase("set-store")).isEqualTo("setStore");
    assertThat(StatementNameGenerator.toCamelCase("Set Store")).isEqualTo("setStore");
    assertThat(StatementNameGenerator.toCamelCase("SetStore")).isEqualTo("setStore");
    assertThat(StatementNameGenerator.toCamelCase("fetchData")).isEqualTo("fetchData");
  }

  @Test
  public void testToCamelCaseNeedsALeadingLetter() {
    assertThat(StatementNameGenerator.toCamelCase("")).isEqualTo("step");
    assertThat(StatementNameGenerator.toCamelCase("$")).isEqualTo("step");
    assertThat(StatementNameGenerator.toCamelCase("2fa")).isEqualTo("step2fa");
  }

  @Test
  public void testParameterKeys() {
    ParameterKeySupplier keys = new ParameterKeySupplier();

    assertThat(keys.nextKey()).isEqualTo("ref1");
    assertThat(keys.nextKey()).isEqualTo("ref2");
  }
}
