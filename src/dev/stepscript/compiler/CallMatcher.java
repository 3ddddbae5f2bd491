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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import dev.stepscript.compiler.parsing.trees.ExpressionTree;
import dev.stepscript.compiler.parsing.trees.Literals;
import dev.stepscript.compiler.parsing.trees.StatementTree;
import dev.stepscript.ir.InstructionId;
import dev.stepscript.ir.Instructions;
import dev.stepscript.ir.ParameterReference;
import dev.stepscript.ir.Statement;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Converts call expressions: the built-in functions ({@code fetch}, {@code navigate}, {@code
 * wait}...), method calls with a known meaning ({@code console.log}, array methods on store
 * paths), and a generic passthrough for every other call.
 */
final class CallMatcher {
  private static final String DEFAULT_METHOD = "GET";
  private static final String DEFAULT_MESSAGE_TYPE = "INFO";
  private static final String DEFAULT_ITERATOR_KEY = "item";

  private final PatternMatcher statements;
  private final StatementFactory factory;
  private final ExpressionConverter expressions;
  private final ErrorManager errorManager;

  CallMatcher(
      PatternMatcher statements,
      StatementFactory factory,
      ExpressionConverter expressions,
      ErrorManager errorManager) {
    this.statements = checkNotNull(statements);
    this.factory = checkNotNull(factory);
    this.expressions = checkNotNull(expressions);
    this.errorManager = checkNotNull(errorManager);
  }

  ImmutableList<Statement> match(ExpressionTree.Call call) {
    ExpressionTree callee = call.callee();
    if (callee instanceof ExpressionTree.Identifier identifier) {
      return matchFunction(identifier.name(), call);
    }
    if (callee instanceof ExpressionTree.Member member
        && !member.computed()
        && member.property() instanceof ExpressionTree.Identifier method) {
      return matchMethod(member.object(), method.name(), call);
    }
    report(call, ConversionDiagnostics.UNSUPPORTED_CALL_TARGET, PatternMatcher.describe(callee));
    return ImmutableList.of();
  }

  private ImmutableList<Statement> matchFunction(String name, ExpressionTree.Call call) {
    switch (name) {
      case "fetch":
        return ImmutableList.of(fetch(call));
      case "navigate":
        return ImmutableList.of(navigate(name, call));
      case "wait":
      case "delay":
      case "sleep":
        requireArguments(call, 1, name, "a milliseconds argument");
        return ImmutableList.of(
            factory.createWait(statements.literalOrExpression(call.arguments().get(0))));
      case "alert":
      case "showMessage":
        return ImmutableList.of(message(name, call));
      case "setStore":
        return ImmutableList.of(setStore(call));
      case "generateEvent":
        return ImmutableList.of(generateEvent(call));
      default:
        String namespace =
            Instructions.UI_ENGINE_FUNCTIONS.contains(name) ? Instructions.UI_ENGINE : "";
        return ImmutableList.of(generic(namespace, name, call));
    }
  }

  private ImmutableList<Statement> matchMethod(
      ExpressionTree receiver, String method, ExpressionTree.Call call) {
    String receiverName = StorePaths.qualifiedName(receiver);
    if ("router".equals(receiverName) && (method.equals("push") || method.equals("replace"))) {
      return ImmutableList.of(navigate(receiverName + "." + method, call));
    }
    if (receiverName != null
        && (receiverName.equals("location") || receiverName.endsWith(".location"))
        && (method.equals("assign") || method.equals("replace"))) {
      return ImmutableList.of(navigate(receiverName + "." + method, call));
    }
    if ("console".equals(receiverName) && method.equals("log")) {
      return ImmutableList.of(factory.createPrint(convertAll(call.arguments())));
    }
    if (receiver instanceof ExpressionTree.Member && StorePaths.isStorePath(receiver)) {
      ImmutableList<Statement> arrayOperation = matchArrayMethod(receiver, method, call);
      if (arrayOperation != null) {
        return arrayOperation;
      }
    }
    if (receiverName == null) {
      report(
          call,
          ConversionDiagnostics.UNSUPPORTED_CALL_TARGET,
          PatternMatcher.describe(call.callee()));
      return ImmutableList.of();
    }
    return ImmutableList.of(generic(receiverName, method, call));
  }

  /** Returns the statements for an array method on a store path, or null for other methods. */
  private @Nullable ImmutableList<Statement> matchArrayMethod(
      ExpressionTree array, String method, ExpressionTree.Call call) {
    String source = expressions.convert(array);
    switch (method) {
      case "push":
        return arrayOperation(Instructions.ARRAY_INSERT_LAST, source, call);
      case "unshift":
        return arrayOperation(Instructions.ARRAY_ADD_FIRST, source, call);
      case "pop":
        return arrayOperation(Instructions.ARRAY_DELETE_LAST, source, call);
      case "shift":
        return arrayOperation(Instructions.ARRAY_DELETE_FIRST, source, call);
      case "forEach":
        return forEach(source, call);
      case "filter":
        return filter(source, call);
      case "map":
        report(call, ConversionDiagnostics.ARRAY_MAP_UNSUPPORTED);
        return ImmutableList.of();
      default:
        return null;
    }
  }

  private ImmutableList<Statement> arrayOperation(
      InstructionId operation, String source, ExpressionTree.Call call) {
    return ImmutableList.of(
        factory.createArrayOperation(operation, source, convertAll(call.arguments())));
  }

  private ImmutableList<Statement> forEach(String source, ExpressionTree.Call call) {
    Statement loop = factory.createForEachLoop(source);
    StatementTree.Block body = callbackBody(call);
    if (body == null) {
      report(call, ConversionDiagnostics.FOR_EACH_CALLBACK);
      return ImmutableList.of(loop);
    }
    return statements.loop(loop, body);
  }

  private static StatementTree.@Nullable Block callbackBody(ExpressionTree.Call call) {
    if (call.arguments().isEmpty()) {
      return null;
    }
    ExpressionTree callback = call.arguments().get(0);
    if (callback instanceof ExpressionTree.ArrowFunction arrow) {
      return arrow.body();
    }
    if (callback instanceof ExpressionTree.FunctionExpression function) {
      return function.body();
    }
    return null;
  }

  private ImmutableList<Statement> filter(String source, ExpressionTree.Call call) {
    ExpressionTree predicate = null;
    String iteratorKey = DEFAULT_ITERATOR_KEY;
    if (!call.arguments().isEmpty()
        && call.arguments().get(0) instanceof ExpressionTree.ArrowFunction arrow
        && arrow.body().body().size() == 1
        && arrow.body().body().get(0) instanceof StatementTree.Return result) {
      predicate = result.argument();
      if (!arrow.params().isEmpty()
          && arrow.params().get(0) instanceof ExpressionTree.Identifier parameter) {
        iteratorKey = parameter.name();
      }
    }
    if (predicate == null) {
      report(call, ConversionDiagnostics.FILTER_CALLBACK_REQUIRED);
      return ImmutableList.of();
    }
    String condition = expressions.convert(predicate);
    report(call, ConversionDiagnostics.FILTER_CONDITION, condition);
    return ImmutableList.of(factory.createFilter(source, iteratorKey, condition));
  }

  private Statement fetch(ExpressionTree.Call call) {
    requireArguments(call, 1, "fetch", "at least one argument (url)");
    ParameterReference url = statements.literalOrExpression(call.arguments().get(0));
    String method = DEFAULT_METHOD;
    ParameterReference payload = null;
    JsonObject headers = null;
    JsonObject queryParams = null;
    JsonObject pathParams = null;
    if (call.arguments().size() > 1
        && call.arguments().get(1) instanceof ExpressionTree.ObjectLiteral options) {
      for (ExpressionTree.Property option : options.properties()) {
        String key = option.keyName();
        if (key == null) {
          continue;
        }
        switch (key) {
          case "method" -> {
            if (option.value() instanceof ExpressionTree.StringLiteral literal) {
              method = Ascii.toUpperCase(literal.value());
            }
          }
          case "body" -> payload = factory.expression(expressions.convert(option.value()));
          case "headers" -> headers = requestParameters(option.value());
          case "queryParams" -> queryParams = requestParameters(option.value());
          case "pathParams" -> pathParams = requestParameters(option.value());
          default -> {}
        }
      }
    }
    if (method.equals(DEFAULT_METHOD)) {
      return factory.createFetchData(url, queryParams, pathParams, headers);
    }
    return factory.createSendData(url, method, payload, queryParams, pathParams, headers);
  }

  /**
   * Converts an object literal of request headers or parameters to the runtime's form: literal
   * entries as {@code {"value": v}}, the rest as expression locations.
   */
  private @Nullable JsonObject requestParameters(ExpressionTree expression) {
    if (!(expression instanceof ExpressionTree.ObjectLiteral object)) {
      return null;
    }
    JsonObject result = new JsonObject();
    for (ExpressionTree.Property property : object.properties()) {
      String name = property.keyName();
      if (name == null) {
        continue;
      }
      JsonObject entry = new JsonObject();
      JsonElement literal =
          Literals.isScalar(property.value()) ? Literals.toJson(property.value()) : null;
      if (literal != null) {
        entry.add("value", literal);
      } else {
        JsonObject location = new JsonObject();
        location.addProperty("type", ParameterReference.EXPRESSION);
        location.addProperty("expression", expressions.convert(property.value()));
        entry.add("location", location);
      }
      result.add(name, entry);
    }
    return result;
  }

  private Statement navigate(String name, ExpressionTree.Call call) {
    requireArguments(call, 1, name, "a path argument");
    ParameterReference target =
        call.arguments().size() > 1
            ? statements.literalOrExpression(call.arguments().get(1))
            : null;
    return factory.createNavigate(statements.literalOrExpression(call.arguments().get(0)), target);
  }

  private Statement message(String name, ExpressionTree.Call call) {
    requireArguments(call, 1, name, "a message argument");
    String type = DEFAULT_MESSAGE_TYPE;
    if (call.arguments().size() > 1
        && call.arguments().get(1) instanceof ExpressionTree.StringLiteral literal) {
      type = Ascii.toUpperCase(literal.value());
    }
    return factory.createMessage(statements.literalOrExpression(call.arguments().get(0)), type);
  }

  private Statement setStore(ExpressionTree.Call call) {
    requireArguments(call, 2, "setStore", "path and value arguments");
    ExpressionTree pathArgument = call.arguments().get(0);
    String path =
        pathArgument instanceof ExpressionTree.StringLiteral literal
            ? literal.value()
            : expressions.convert(pathArgument);
    return factory.createSetStore(path, statements.literalOrExpression(call.arguments().get(1)));
  }

  private Statement generateEvent(ExpressionTree.Call call) {
    requireArguments(call, 2, "generateEvent", "event name and results arguments");
    ParameterReference eventName = statements.literalOrExpression(call.arguments().get(0));
    ExpressionTree resultsArgument = call.arguments().get(1);
    JsonElement literal = Literals.toJson(resultsArgument);
    ParameterReference results =
        literal != null
            ? factory.value(literal)
            : factory.expression(expressions.convert(resultsArgument));
    return factory.createGenerateEvent(eventName, results);
  }

  private Statement generic(String namespace, String name, ExpressionTree.Call call) {
    return factory.createGenericCall(namespace, name, convertAll(call.arguments()));
  }

  private List<String> convertAll(List<ExpressionTree> arguments) {
    List<String> converted = new ArrayList<>(arguments.size());
    for (ExpressionTree argument : arguments) {
      converted.add(expressions.convert(argument));
    }
    return converted;
  }

  private static void requireArguments(
      ExpressionTree.Call call, int count, String function, String requirement) {
    if (call.arguments().size() < count) {
      throw new ConversionException(
          ConversionError.make(
              call.position(), ConversionDiagnostics.MISSING_ARGUMENT, function, requirement));
    }
  }

  private void report(ExpressionTree.Call call, DiagnosticType type, String... arguments) {
    errorManager.report(ConversionError.make(call.position(), type, arguments));
  }
}
