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
package dev.stepscript.compiler.parsing.trees;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * An expression of the script dialect. The shapes follow the ESTree format; parentheses
 * are not represented.
 *
 * <p>Every implementation is one of the nested records, and every consumer goes through {@link
 * Visitor}, so adding a node kind is a compile error in each place that handles expressions.
 */
public sealed interface ExpressionTree {

  SourcePosition position();

  <R> R accept(Visitor<R> visitor);

  /** Exhaustive dispatch over expression kinds. */
  interface Visitor<R> {
    R visitIdentifier(Identifier tree);

    R visitStringLiteral(StringLiteral tree);

    R visitNumberLiteral(NumberLiteral tree);

    R visitBooleanLiteral(BooleanLiteral tree);

    R visitNullLiteral(NullLiteral tree);

    R visitTemplateLiteral(TemplateLiteral tree);

    R visitMember(Member tree);

    R visitBinary(Binary tree);

    R visitLogical(Logical tree);

    R visitUnary(Unary tree);

    R visitUpdate(Update tree);

    R visitAssignment(Assignment tree);

    R visitConditional(Conditional tree);

    R visitCall(Call tree);

    R visitArrayLiteral(ArrayLiteral tree);

    R visitObjectLiteral(ObjectLiteral tree);

    R visitSequence(Sequence tree);

    R visitSpread(Spread tree);

    R visitArrowFunction(ArrowFunction tree);

    R visitFunctionExpression(FunctionExpression tree);

    R visitUnsupported(Unsupported tree);
  }

  record Identifier(String name, SourcePosition position) implements ExpressionTree {
    public Identifier {
      requireNonNull(name, "name");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitIdentifier(this);
    }
  }

  /** A string literal; {@code value} is the decoded text, without quotes. */
  record StringLiteral(String value, SourcePosition position) implements ExpressionTree {
    public StringLiteral {
      requireNonNull(value, "value");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitStringLiteral(this);
    }
  }

  record NumberLiteral(double value, SourcePosition position) implements ExpressionTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNumberLiteral(this);
    }
  }

  record BooleanLiteral(boolean value, SourcePosition position) implements ExpressionTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBooleanLiteral(this);
    }
  }

  record NullLiteral(SourcePosition position) implements ExpressionTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNullLiteral(this);
    }
  }

  /**
   * A template literal. There is always one more cooked string segment in {@code quasis} than
   * there are {@code expressions}; segment {@code i} precedes expression {@code i}.
   */
  record TemplateLiteral(
      ImmutableList<String> quasis,
      ImmutableList<ExpressionTree> expressions,
      SourcePosition position)
      implements ExpressionTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTemplateLiteral(this);
    }
  }

  /**
   * Property access. When {@code computed} is false the property is an {@link Identifier} naming
   * the property ({@code a.b}); otherwise it is an arbitrary expression ({@code a[b]}).
   */
  record Member(
      ExpressionTree object, ExpressionTree property, boolean computed, SourcePosition position)
      implements ExpressionTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitMember(this);
    }
  }

  record Binary(
      String operator, ExpressionTree left, ExpressionTree right, SourcePosition position)
      implements ExpressionTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBinary(this);
    }
  }

  /** {@code &&} and {@code ||}. */
  record Logical(
      String operator, ExpressionTree left, ExpressionTree right, SourcePosition position)
      implements ExpressionTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLogical(this);
    }
  }

  /** A prefix operator other than {@code ++} and {@code --}. */
  record Unary(String operator, ExpressionTree argument, SourcePosition position)
      implements ExpressionTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitUnary(this);
    }
  }

  record Update(String operator, ExpressionTree argument, boolean prefix, SourcePosition position)
      implements ExpressionTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitUpdate(this);
    }
  }

  /** Plain or compound assignment; {@code operator} is {@code "="}, {@code "+="} and so on. */
  record Assignment(
      String operator, ExpressionTree target, ExpressionTree value, SourcePosition position)
      implements ExpressionTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAssignment(this);
    }
  }

  record Conditional(
      ExpressionTree test,
      ExpressionTree consequent,
      ExpressionTree alternate,
      SourcePosition position)
      implements ExpressionTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitConditional(this);
    }
  }

  record Call(
      ExpressionTree callee, ImmutableList<ExpressionTree> arguments, SourcePosition position)
      implements ExpressionTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCall(this);
    }
  }

  record ArrayLiteral(ImmutableList<ExpressionTree> elements, SourcePosition position)
      implements ExpressionTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitArrayLiteral(this);
    }
  }

  record ObjectLiteral(ImmutableList<Property> properties, SourcePosition position)
      implements ExpressionTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitObjectLiteral(this);
    }
  }

  /** One {@code key: value} entry of an {@link ObjectLiteral}. */
  record Property(ExpressionTree key, ExpressionTree value, boolean computed) {

    /**
     * Returns the property name for identifier, string and number keys, or null for computed
     * keys.
     */
    public @Nullable String keyName() {
      if (computed) {
        return null;
      }
      if (key instanceof Identifier identifier) {
        return identifier.name();
      }
      if (key instanceof StringLiteral string) {
        return string.value();
      }
      if (key instanceof NumberLiteral number) {
        return Literals.formatNumber(number.value());
      }
      return null;
    }
  }

  /** Comma expression. */
  record Sequence(ImmutableList<ExpressionTree> expressions, SourcePosition position)
      implements ExpressionTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSequence(this);
    }
  }

  record Spread(ExpressionTree argument, SourcePosition position) implements ExpressionTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSpread(this);
    }
  }

  /**
   * An arrow function. A concise body ({@code x => x.done}) is represented as a block holding a
   * single {@link StatementTree.Return}.
   */
  record ArrowFunction(
      ImmutableList<ExpressionTree> params, StatementTree.Block body, SourcePosition position)
      implements ExpressionTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitArrowFunction(this);
    }
  }

  record FunctionExpression(
      @Nullable String name,
      ImmutableList<ExpressionTree> params,
      StatementTree.Block body,
      SourcePosition position)
      implements ExpressionTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitFunctionExpression(this);
    }
  }

  /**
   * A construct the parser accepts but the dialect does not model, such as {@code new}, {@code
   * this} or a regular expression. {@code kind} is the ESTree node type name.
   */
  record Unsupported(String kind, SourcePosition position) implements ExpressionTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitUnsupported(this);
    }
  }
}
