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
package dev.stepscript.compiler.parsing;

import static com.google.common.base.Preconditions.checkNotNull;

import dev.stepscript.compiler.parsing.trees.ProgramTree;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;
import org.mozilla.javascript.CompilerEnvirons;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.ErrorReporter;
import org.mozilla.javascript.EvaluatorException;
import org.mozilla.javascript.Node;
import org.mozilla.javascript.Parser;
import org.mozilla.javascript.ast.AstRoot;
import org.mozilla.javascript.ast.ExpressionStatement;
import org.mozilla.javascript.ast.FunctionNode;
import org.mozilla.javascript.ast.ParenthesizedExpression;

/**
 * Parses script source with Rhino and normalizes the result into {@link ProgramTree}s.
 *
 * <p>A script is the body of an event handler, so it is parsed as a function body: a top-level
 * {@code return} is allowed. Positions are reported relative to the script itself.
 *
 * <p>Instances hold no per-parse state and may be shared between threads; every call to {@link
 * #parse} creates its own Rhino parser.
 */
public final class ScriptParser {
  private static final Logger logger = Logger.getLogger(ScriptParser.class.getName());

  private static final String DEFAULT_SOURCE_NAME = "script.js";

  // The prefix holds no line break, so only the columns of the first line shift.
  private static final String BODY_PREFIX = "(function () {";
  private static final String BODY_SUFFIX = "\n})";

  private final String sourceName;

  public ScriptParser() {
    this(DEFAULT_SOURCE_NAME);
  }

  public ScriptParser(String sourceName) {
    this.sourceName = checkNotNull(sourceName);
  }

  /**
   * Parses {@code source}.
   *
   * @throws ScriptParseException at the first syntax error
   */
  public ProgramTree parse(String source) throws ScriptParseException {
    checkNotNull(source);
    ThrowingErrorReporter reporter = new ThrowingErrorReporter();
    Parser parser = new Parser(createEnvironment(reporter), reporter);
    AstRoot root;
    try {
      root = parser.parse(BODY_PREFIX + source + BODY_SUFFIX, sourceName, 1);
    } catch (EvaluatorException e) {
      int line = Math.min(e.lineNumber(), lineCount(source));
      int column = Math.max(e.columnNumber(), 0);
      if (line == 1) {
        column = Math.max(column - BODY_PREFIX.length(), 0);
      }
      throw new ScriptParseException(e.details(), line, column, e);
    }
    FunctionNode handler = getHandler(root);
    if (handler == null) {
      throw new ScriptParseException("unbalanced braces", 1, 0, null);
    }
    return new SyntaxTreeBuilder(source, BODY_PREFIX.length()).buildProgram(handler.getBody());
  }

  /** Returns the wrapping function, or null if the script closed it early. */
  private static @Nullable FunctionNode getHandler(AstRoot root) {
    Node statement = root.getFirstChild();
    if (statement == null
        || statement.getNext() != null
        || !(statement instanceof ExpressionStatement expressionStatement)
        || !(expressionStatement.getExpression() instanceof ParenthesizedExpression wrapped)) {
      return null;
    }
    return wrapped.getExpression() instanceof FunctionNode function ? function : null;
  }

  private static int lineCount(String source) {
    int lines = 1;
    for (int i = 0; i < source.length(); i++) {
      if (source.charAt(i) == '\n') {
        lines++;
      }
    }
    return lines;
  }

  private static CompilerEnvirons createEnvironment(ErrorReporter reporter) {
    CompilerEnvirons environment = new CompilerEnvirons();
    environment.setLanguageVersion(Context.VERSION_ES6);
    environment.setRecordingComments(false);
    environment.setRecordingLocalJsDocComments(false);
    environment.setRecoverFromErrors(false);
    environment.setStrictMode(false);
    environment.setErrorReporter(reporter);
    return environment;
  }

  /** Fails the parse on the first error Rhino reports. */
  private static final class ThrowingErrorReporter implements ErrorReporter {
    @Override
    public void warning(
        String message, String sourceName, int line, String lineSource, int lineOffset) {
      logger.log(Level.FINE, "{0}:{1}: {2}", new Object[] {sourceName, line, message});
    }

    @Override
    public void error(
        String message, String sourceName, int line, String lineSource, int lineOffset) {
      throw runtimeError(message, sourceName, line, lineSource, lineOffset);
    }

    @Override
    public EvaluatorException runtimeError(
        String message, String sourceName, int line, String lineSource, int lineOffset) {
      return new EvaluatorException(message, sourceName, line, lineSource, lineOffset);
    }
  }
}
