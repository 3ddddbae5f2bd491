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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.SetMultimap;
import dev.stepscript.ir.FunctionDefinition;
import dev.stepscript.ir.Statement;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Gives statements converted from a decompiled and edited script their original identity back.
 *
 * <p>The decompiler ends every statement line with {@code // Step: <name>}. A statement matched
 * from such a line is renamed to {@code <name>} and the position, comment and description of the
 * original statement are copied over. Statements on lines without a step comment are new and keep
 * their generated names.
 *
 * <p>{@code Steps.<name>} references written in the script already use the original names and are
 * left alone. Only the body dependencies the converter added for an {@code if} or a loop refer to
 * generated names, so only those are renamed.
 */
final class StepNamePreserver {
  private static final Logger logger = Logger.getLogger(StepNamePreserver.class.getName());

  private static final Pattern STEP_COMMENT = Pattern.compile("//\\s*Step:\\s*(\\w+)");
  private static final Pattern STEP_REFERENCE = Pattern.compile("\\bSteps\\.(\\w+)");
  private static final Pattern TRAILING_DIGITS = Pattern.compile("\\d+$");
  private static final Splitter LINE_SPLITTER = Splitter.onPattern("\r?\n");

  private final FunctionDefinition original;

  StepNamePreserver(FunctionDefinition original) {
    this.original = checkNotNull(original);
  }

  /**
   * @param source the script the statements were converted from
   * @param statements the converted statements
   * @param originLines source line of each statement, keyed by statement name
   * @param bodyDependencies dependencies on generated names, keyed by statement name
   */
  ImmutableList<Statement> preserve(
      String source,
      List<Statement> statements,
      Map<String, Integer> originLines,
      SetMultimap<String, String> bodyDependencies) {
    Map<Integer, String> stepComments = findStepComments(source);
    Map<String, String> renames = new LinkedHashMap<>();
    Set<String> claimed = new HashSet<>();
    for (Statement statement : statements) {
      Integer line = originLines.get(statement.statementName());
      String preserved = line != null ? stepComments.get(line) : null;
      if (preserved != null && claimed.add(preserved)) {
        renames.put(statement.statementName(), preserved);
      }
    }
    resolveCollisions(statements, renames, claimed);
    logger.fine("Preserving " + renames.size() + " step name(s)");

    ImmutableList.Builder<Statement> result = ImmutableList.builder();
    for (Statement statement : statements) {
      String name = renames.getOrDefault(statement.statementName(), statement.statementName());
      Statement.Builder builder =
          statement.toBuilder()
              .setStatementName(name)
              .setDependentStatements(
                  rewriteDependencies(
                      statement, bodyDependencies.get(statement.statementName()), renames));
      Statement originalStatement = original.steps().get(name);
      if (originalStatement != null) {
        builder
            .setPosition(originalStatement.position())
            .setComment(originalStatement.comment())
            .setDescription(originalStatement.description());
      }
      result.add(builder.build());
    }
    return result.build();
  }

  /** Maps each one-based line number with a step comment to the named step. */
  static Map<Integer, String> findStepComments(String source) {
    Map<Integer, String> comments = new HashMap<>();
    int lineNumber = 0;
    for (String line : LINE_SPLITTER.split(source)) {
      lineNumber++;
      Matcher matcher = STEP_COMMENT.matcher(line);
      if (matcher.find()) {
        comments.put(lineNumber, matcher.group(1));
      }
    }
    return comments;
  }

  /**
   * Renames statements that keep their generated name but would clash with a preserved name,
   * such as a new {@code setStore2} next to a preserved {@code setStore2}.
   */
  private static void resolveCollisions(
      List<Statement> statements, Map<String, String> renames, Set<String> claimed) {
    StatementNameGenerator nameGenerator = new StatementNameGenerator();
    for (Statement statement : statements) {
      nameGenerator.reserve(statement.statementName());
    }
    for (String name : claimed) {
      nameGenerator.reserve(name);
    }
    for (Statement statement : statements) {
      String name = statement.statementName();
      if (!renames.containsKey(name) && claimed.contains(name)) {
        renames.put(name, nameGenerator.generate(TRAILING_DIGITS.matcher(name).replaceAll("")));
      }
    }
  }

  private static Map<String, Boolean> rewriteDependencies(
      Statement statement, Set<String> generated, Map<String, String> renames) {
    Map<String, Boolean> dependencies = new LinkedHashMap<>();
    statement
        .dependentStatements()
        .forEach(
            (path, enabled) ->
                dependencies.put(
                    generated.contains(path) ? rewrite(path, renames) : path, enabled));
    return dependencies;
  }

  /** Rewrites every {@code Steps.<old>} in {@code text} in a single pass. */
  static String rewrite(String text, Map<String, String> renames) {
    if (renames.isEmpty()) {
      return text;
    }
    Matcher matcher = STEP_REFERENCE.matcher(text);
    StringBuilder sb = new StringBuilder();
    while (matcher.find()) {
      String renamed = renames.get(matcher.group(1));
      String replacement = renamed != null ? "Steps." + renamed : matcher.group();
      matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(sb);
    return sb.toString();
  }
}
