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
import dev.stepscript.compiler.parsing.ScriptParseException;
import dev.stepscript.compiler.parsing.ScriptParser;
import dev.stepscript.compiler.parsing.trees.ProgramTree;
import dev.stepscript.ir.FunctionDefinition;
import dev.stepscript.ir.IrJson;
import dev.stepscript.ir.Statement;
import java.util.logging.Logger;

/**
 * Converts scripts to step graph functions.
 *
 * <p>The conversion runs in four phases: parsing, pattern matching, dependency annotation and
 * ordering. Scripts are never rejected as a whole, except for syntax errors: statements that
 * cannot be converted are dropped and reported, and the function holds the rest. Instances are
 * stateless and may be shared between threads.
 */
public final class ForwardConverter {
  private static final Logger logger = Logger.getLogger(ForwardConverter.class.getName());

  public ConversionResult convert(String source) {
    return convert(source, ConversionOptions.defaults());
  }

  public ConversionResult convert(String source, ConversionOptions options) {
    checkNotNull(source);
    ErrorManager errorManager = new LoggerErrorManager(logger);
    FunctionDefinition function = convert(source, options, errorManager);
    errorManager.generateReport();
    return new ConversionResult(function, errorManager.getErrors(), errorManager.getWarnings());
  }

  private static FunctionDefinition convert(
      String source, ConversionOptions options, ErrorManager errorManager) {
    ProgramTree program;
    try {
      program = new ScriptParser().parse(source);
    } catch (ScriptParseException e) {
      errorManager.report(
          ConversionError.make(
              e.getLine(),
              e.getColumn(),
              ConversionDiagnostics.PARSE_ERROR,
              e.getDescription(),
              String.valueOf(e.getLine()),
              String.valueOf(e.getColumn())));
      return FunctionDefinition.of(
          options.getFunctionName(), options.getNamespace(), ImmutableList.of());
    }
    logger.fine("Parsed " + program.body().size() + " top-level statement(s)");

    PatternMatcher matcher = new PatternMatcher(errorManager, new StatementFactory());
    ImmutableList<Statement> statements = matcher.match(program);
    logger.fine("Matched " + statements.size() + " statement(s)");

    if (options.getOriginalFunction().isPresent()) {
      statements =
          new StepNamePreserver(options.getOriginalFunction().get())
              .preserve(
                  source, statements, matcher.getOriginLines(), matcher.getBodyDependencies());
    }

    statements = new DependencyAnalyzer(errorManager).annotate(statements);
    statements = DependencyAnalyzer.executionOrder(statements);
    return FunctionDefinition.of(options.getFunctionName(), options.getNamespace(), statements);
  }

  /** Converts {@code source} and returns the function as pretty-printed JSON. */
  public String convertToJson(String source, ConversionOptions options) {
    return IrJson.toJson(convert(source, options).functionDefinition());
  }

  /** Checks whether {@code source} converts without errors. */
  public ValidationResult validate(String source) {
    ConversionResult result = convert(source);
    return new ValidationResult(result.success(), result.errors(), result.warnings());
  }
}
