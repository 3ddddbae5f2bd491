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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import dev.stepscript.ir.DependencyPath;
import dev.stepscript.ir.FunctionDefinition;
import dev.stepscript.ir.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Renders a {@link FunctionDefinition} back to script source.
 *
 * <p>Statements are emitted in execution order. Statements on the {@code true}, {@code false} or
 * {@code iteration} branch of a control-flow statement are nested inside its block, and
 * statements on the {@code output} or {@code error} branch of any other statement are wrapped in
 * {@code if (Steps.<step>.output) { ... }} and {@code if (Steps.<step>.error) { ... }}. Every
 * emitted statement carries a trailing {@code // Step: <statementName>} comment, which {@link
 * StepNamePreserver} reads when the source is converted again.
 *
 * <p>Instructions without a template are written as comments, so decompiling never fails.
 */
public final class Decompiler {
  private static final Logger logger = Logger.getLogger(Decompiler.class.getName());

  static final String INDENT = "  ";
  static final String STEP_COMMENT = "  // Step: ";

  private static final Pattern PASSTHROUGH_ARGUMENT = Pattern.compile("arg\\d{1,9}");
  private static final Pattern QUALIFIED_NAME =
      Pattern.compile("[A-Za-z_$][\\w$]*(\\.[A-Za-z_$][\\w$]*)*");
  private static final Comparator<String> BY_ARGUMENT_INDEX =
      Comparator.comparingInt(argument -> Integer.parseInt(argument.substring(3)));

  private final TemplateRegistry templates;

  public Decompiler() {
    this(TemplateRegistry.getDefault());
  }

  public Decompiler(TemplateRegistry templates) {
    this.templates = checkNotNull(templates);
  }

  public String decompile(FunctionDefinition function) {
    String header = "// Function: " + function.name();
    if (function.steps().isEmpty()) {
      return header + "\n// (empty function)";
    }
    ImmutableList<String> order = DependencyAnalyzer.executionOrder(function.steps());
    Rendering rendering =
        new Rendering(function.steps(), BranchClassifier.classify(function.steps(), order));

    SourceBuilder out = new SourceBuilder(INDENT);
    out.appendLine(header).appendLine("");
    ImmutableSet<String> emitted = ImmutableSet.of();
    for (String name : order) {
      if (!rendering.branches.isNested(name) && !emitted.contains(name)) {
        emitted = rendering.render(name, out, emitted);
      }
    }
    // Statements only reachable through a dependency cycle.
    for (String name : order) {
      if (!emitted.contains(name)) {
        logger.fine("Rendering unreachable statement " + name + " at top level");
        emitted = rendering.render(name, out, emitted);
      }
    }
    return out.build();
  }

  /** Renders a single statement as one line of source, without its step comment. */
  public String decompileStatement(Statement statement) {
    InstructionTemplate template = templates.get(statement.instruction());
    if (template == null) {
      return renderUnknown(statement);
    }
    String line = renderLine(statement, template);
    return line != null ? line : renderMissing(statement, template);
  }

  /** The state of one {@link #decompile} call. */
  private final class Rendering {
    final ImmutableMap<String, Statement> steps;
    final BranchClassifier branches;

    Rendering(ImmutableMap<String, Statement> steps, BranchClassifier branches) {
      this.steps = steps;
      this.branches = branches;
    }

    /** Renders {@code name} and its branches, returning {@code emitted} plus what was written. */
    ImmutableSet<String> render(String name, SourceBuilder out, ImmutableSet<String> emitted) {
      emitted = plus(emitted, name);
      Statement statement = steps.get(name);
      InstructionTemplate template = templates.get(statement.instruction());
      @Nullable String blockHeader = null;
      if (template != null && template.isControlFlow()) {
        blockHeader = renderLine(statement, template);
        if (blockHeader == null) {
          out.appendLine(renderMissing(statement, template) + STEP_COMMENT + name);
        }
      } else {
        out.appendLine(decompileStatement(statement) + STEP_COMMENT + name);
      }

      if (blockHeader != null) {
        out.appendBlockStart(blockHeader + " {" + STEP_COMMENT + name);
        emitted = renderAll(name, DependencyPath.TRUE, out, emitted);
        emitted = renderAll(name, DependencyPath.ITERATION, out, emitted);
        if (branches.hasChildren(name, DependencyPath.FALSE)) {
          out.appendBlockSeparator("} else {");
          emitted = renderAll(name, DependencyPath.FALSE, out, emitted);
        }
        out.appendBlockEnd("}");
      } else {
        // Best effort without a header: the branch contents follow the comment unnested.
        emitted = renderAll(name, DependencyPath.TRUE, out, emitted);
        emitted = renderAll(name, DependencyPath.ITERATION, out, emitted);
        emitted = renderAll(name, DependencyPath.FALSE, out, emitted);
      }

      emitted = renderOutcome(name, DependencyPath.OUTPUT, out, emitted);
      return renderOutcome(name, DependencyPath.ERROR, out, emitted);
    }

    private ImmutableSet<String> renderOutcome(
        String name, String branch, SourceBuilder out, ImmutableSet<String> emitted) {
      if (!hasPending(name, branch, emitted)) {
        return emitted;
      }
      out.appendBlockStart("if (" + DependencyPath.of(name, branch) + ") {");
      emitted = renderAll(name, branch, out, emitted);
      out.appendBlockEnd("}");
      return emitted;
    }

    private ImmutableSet<String> renderAll(
        String parent, String branch, SourceBuilder out, ImmutableSet<String> emitted) {
      for (String child : branches.getChildren(parent, branch)) {
        if (!emitted.contains(child)) {
          emitted = render(child, out, emitted);
        }
      }
      return emitted;
    }

    private boolean hasPending(String parent, String branch, ImmutableSet<String> emitted) {
      for (String child : branches.getChildren(parent, branch)) {
        if (!emitted.contains(child)) {
          return true;
        }
      }
      return false;
    }
  }

  private static ImmutableSet<String> plus(ImmutableSet<String> set, String element) {
    return Sets.union(set, ImmutableSet.of(element)).immutableCopy();
  }

  /** Fills {@code template} from the statement's parameters, or returns null if it can't. */
  private static @Nullable String renderLine(Statement statement, InstructionTemplate template) {
    Map<String, String> values = new LinkedHashMap<>();
    for (String parameter : template.getExtract()) {
      values.put(parameter, renderParameter(statement, template, parameter));
    }
    if (template.findMissingPlaceholder(values) != null) {
      return null;
    }
    String line = template.fill(values);
    return template.isInline() ? line + ";" : line;
  }

  private static String renderParameter(
      Statement statement, InstructionTemplate template, String parameter) {
    if (statement.references(parameter).isEmpty()
        && template.getDefaults().containsKey(parameter)) {
      return template.getDefaults().get(parameter);
    }
    return ParameterRenderer.render(
        statement,
        parameter,
        template.getIdentifiers().contains(parameter),
        template.getSpread().contains(parameter));
  }

  private static String renderMissing(Statement statement, InstructionTemplate template) {
    Map<String, String> values = new LinkedHashMap<>();
    for (String parameter : template.getExtract()) {
      values.put(parameter, renderParameter(statement, template, parameter));
    }
    return "// "
        + statement.namespace()
        + "."
        + statement.name()
        + "(...) - missing param: "
        + template.findMissingPlaceholder(values);
  }

  /**
   * Writes an instruction without a template. Calls that were carried through verbatim, with
   * positional {@code argN} parameters, are written as calls again; anything else becomes a
   * comment listing its parameters.
   */
  private static String renderUnknown(Statement statement) {
    ImmutableSet<String> parameters = statement.parameterMap().keySet();
    if (isPassthrough(statement)) {
      List<String> arguments = new ArrayList<>();
      for (String parameter : ImmutableList.sortedCopyOf(BY_ARGUMENT_INDEX, parameters)) {
        arguments.add(ParameterRenderer.render(statement, parameter, false, false));
      }
      return statement.instruction() + "(" + String.join(", ", arguments) + ");";
    }
    List<String> rendered = new ArrayList<>();
    for (String parameter : parameters) {
      rendered.add(parameter + "=" + ParameterRenderer.render(statement, parameter, false, false));
    }
    return "// "
        + statement.namespace()
        + "."
        + statement.name()
        + "("
        + String.join(", ", rendered)
        + ")";
  }

  private static boolean isPassthrough(Statement statement) {
    if (!QUALIFIED_NAME.matcher(statement.instruction().toString()).matches()) {
      return false;
    }
    for (String parameter : statement.parameterMap().keySet()) {
      if (!PASSTHROUGH_ARGUMENT.matcher(parameter).matches()) {
        return false;
      }
    }
    return true;
  }
}
