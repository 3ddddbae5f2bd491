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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableSet;
import com.google.common.io.CharStreams;
import com.google.common.io.Files;
import dev.stepscript.ir.FunctionDefinition;
import dev.stepscript.ir.IrFormatException;
import dev.stepscript.ir.IrJson;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.spi.BooleanOptionHandler;

/**
 * Command line entry point.
 *
 * <pre>
 * stepscript --mode forward --function_name onSubmit handler.js
 * stepscript --mode reverse function.json
 * </pre>
 *
 * <p>The input is read from standard input when no file is given. Diagnostics go to standard
 * error; the exit status is 0 without errors, 1 with conversion errors and 2 for bad usage or
 * unreadable input.
 */
public final class CommandLineRunner {
  static final int EXIT_OK = 0;
  static final int EXIT_ERRORS = 1;
  static final int EXIT_USAGE = 2;

  /** What to do with the input. */
  enum Mode {
    /** Script to step graph JSON. */
    FORWARD,
    /** Step graph JSON to script. */
    REVERSE,
    /** Report the diagnostics of a script without writing a function. */
    VALIDATE
  }

  /** How diagnostics are written. */
  enum ErrorFormat {
    TEXT,
    JSON
  }

  @Option(
      name = "--help",
      hidden = true,
      handler = BooleanOptionHandler.class,
      usage = "Displays this message")
  private boolean displayHelp = false;

  @Option(name = "--mode", usage = "One of FORWARD, REVERSE or VALIDATE. Defaults to FORWARD.")
  private Mode mode = Mode.FORWARD;

  @Option(
      name = "--function_name",
      usage = "Name of the function produced by forward conversion.")
  private String functionName = ConversionOptions.DEFAULT_FUNCTION_NAME;

  @Option(name = "--namespace", usage = "Namespace of the function produced by forward conversion.")
  private String namespace = "";

  @Option(
      name = "--original",
      usage =
          "Function JSON the script was decompiled from. Statements annotated with "
              + "'// Step: <name>' comments keep their original names and positions.")
  private @Nullable File original = null;

  @Option(name = "--error_format", usage = "Diagnostic format, TEXT or JSON. Defaults to TEXT.")
  private ErrorFormat errorFormat = ErrorFormat.TEXT;

  @Option(name = "--output", usage = "File to write the result to. Defaults to standard output.")
  private @Nullable File output = null;

  @Option(name = "--verbose", usage = "Logs the progress of the conversion.")
  private boolean verbose = false;

  @Argument(usage = "Input file. Defaults to standard input.")
  private @Nullable File input = null;

  private final InputStream in;
  private final PrintStream out;
  private final PrintStream err;

  CommandLineRunner(InputStream in, PrintStream out, PrintStream err) {
    this.in = in;
    this.out = out;
    this.err = err;
  }

  /** Runs the command line {@code args} and returns the exit status. */
  int run(String[] args) {
    CmdLineParser parser = new CmdLineParser(this);
    try {
      parser.parseArgument(args);
    } catch (CmdLineException e) {
      err.println(e.getMessage());
      parser.printUsage(err);
      return EXIT_USAGE;
    }
    if (displayHelp) {
      parser.printUsage(out);
      return EXIT_OK;
    }
    if (!verbose) {
      Logger.getLogger("dev.stepscript").setLevel(Level.OFF);
    }

    try {
      String contents = input != null ? Files.asCharSource(input, UTF_8).read() : readStdin();
      switch (mode) {
        case FORWARD:
          return forward(contents);
        case REVERSE:
          write(new Decompiler().decompile(IrJson.parse(contents)));
          return EXIT_OK;
        case VALIDATE:
          ValidationResult validation = new ForwardConverter().validate(contents);
          report(validation.errors(), validation.warnings());
          return validation.valid() ? EXIT_OK : EXIT_ERRORS;
      }
      throw new AssertionError(mode);
    } catch (IOException e) {
      err.println("ERROR - " + e.getMessage());
      return EXIT_USAGE;
    } catch (IrFormatException e) {
      err.println("ERROR - invalid function definition: " + e.getMessage());
      return EXIT_USAGE;
    }
  }

  private int forward(String source) throws IOException {
    ConversionOptions.Builder options =
        ConversionOptions.builder().setFunctionName(functionName).setNamespace(namespace);
    if (original != null) {
      FunctionDefinition originalFunction =
          IrJson.parse(Files.asCharSource(original, UTF_8).read());
      options.setOriginalFunction(originalFunction);
    }
    ConversionResult result = new ForwardConverter().convert(source, options.build());
    write(IrJson.toJson(result.functionDefinition()));
    report(result.errors(), result.warnings());
    return result.success() ? EXIT_OK : EXIT_ERRORS;
  }

  private String readStdin() throws IOException {
    return CharStreams.toString(new InputStreamReader(in, UTF_8));
  }

  private void write(String result) throws IOException {
    if (output != null) {
      Files.asCharSink(output, UTF_8).write(result + "\n");
    } else {
      out.println(result);
    }
  }

  /** Writes the diagnostics of a conversion to standard error in the requested format. */
  private void report(Iterable<ConversionError> errors, Iterable<ConversionError> warnings) {
    SortingErrorManager.ErrorReportGenerator generator =
        errorFormat == ErrorFormat.JSON
            ? new JsonErrorReportGenerator(err)
            : new PrintStreamErrorReportGenerator(err);
    ErrorManager errorManager = new SortingErrorManager(ImmutableSet.of(generator));
    for (ConversionError error : errors) {
      errorManager.report(CheckLevel.ERROR, error);
    }
    for (ConversionError warning : warnings) {
      errorManager.report(CheckLevel.WARNING, warning);
    }
    errorManager.generateReport();
  }

  public static void main(String[] args) {
    System.exit(new CommandLineRunner(System.in, System.out, System.err).run(args));
  }
}
