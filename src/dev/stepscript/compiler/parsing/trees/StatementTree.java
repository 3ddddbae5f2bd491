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

/** A statement of the script dialect, shaped after ESTree. */
public sealed interface StatementTree {

  SourcePosition position();

  <R> R accept(Visitor<R> visitor);

  /** Exhaustive dispatch over statement kinds. */
  interface Visitor<R> {
    R visitExpressionStatement(ExpressionStatement tree);

    R visitBlock(Block tree);

    R visitIf(If tree);

    R visitFor(For tree);

    R visitForIn(ForIn tree);

    R visitForOf(ForOf tree);

    R visitWhile(While tree);

    R visitDoWhile(DoWhile tree);

    R visitVariableDeclaration(VariableDeclaration tree);

    R visitReturn(Return tree);

    R visitEmpty(Empty tree);

    R visitBreak(Break tree);

    R visitContinue(Continue tree);

    R visitFunctionDeclaration(FunctionDeclaration tree);

    R visitUnsupported(Unsupported tree);
  }

  record ExpressionStatement(ExpressionTree expression, SourcePosition position)
      implements StatementTree {
    public ExpressionStatement {
      requireNonNull(expression, "expression");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitExpressionStatement(this);
    }
  }

  record Block(ImmutableList<StatementTree> body, SourcePosition position)
      implements StatementTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBlock(this);
    }
  }

  record If(
      ExpressionTree test,
      StatementTree consequent,
      @Nullable StatementTree alternate,
      SourcePosition position)
      implements StatementTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitIf(this);
    }
  }

  /**
   * A classic {@code for} loop. {@code init} is either a {@link VariableDeclaration} or an {@link
   * ExpressionStatement}; any of the three header parts may be absent.
   */
  record For(
      @Nullable StatementTree init,
      @Nullable ExpressionTree test,
      @Nullable ExpressionTree update,
      StatementTree body,
      SourcePosition position)
      implements StatementTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitFor(this);
    }
  }

  /** {@code left} is a {@link VariableDeclaration} or an {@link ExpressionStatement}. */
  record ForIn(
      StatementTree left, ExpressionTree right, StatementTree body, SourcePosition position)
      implements StatementTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitForIn(this);
    }
  }

  /** {@code left} is a {@link VariableDeclaration} or an {@link ExpressionStatement}. */
  record ForOf(
      StatementTree left, ExpressionTree right, StatementTree body, SourcePosition position)
      implements StatementTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitForOf(this);
    }
  }

  record While(ExpressionTree test, StatementTree body, SourcePosition position)
      implements StatementTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitWhile(this);
    }
  }

  record DoWhile(StatementTree body, ExpressionTree test, SourcePosition position)
      implements StatementTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitDoWhile(this);
    }
  }

  /** {@code kind} is {@code "var"}, {@code "let"} or {@code "const"}. */
  record VariableDeclaration(
      String kind, ImmutableList<VariableDeclarator> declarations, SourcePosition position)
      implements StatementTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitVariableDeclaration(this);
    }
  }

  /** One binding of a {@link VariableDeclaration}. */
  record VariableDeclarator(ExpressionTree target, @Nullable ExpressionTree init) {

    /** Returns the bound name, or a placeholder for destructuring patterns. */
    public String name() {
      return target instanceof ExpressionTree.Identifier identifier
          ? identifier.name()
          : "<pattern>";
    }
  }

  record Return(@Nullable ExpressionTree argument, SourcePosition position)
      implements StatementTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitReturn(this);
    }
  }

  record Empty(SourcePosition position) implements StatementTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitEmpty(this);
    }
  }

  record Break(SourcePosition position) implements StatementTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBreak(this);
    }
  }

  record Continue(SourcePosition position) implements StatementTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitContinue(this);
    }
  }

  record FunctionDeclaration(
      String name, ImmutableList<ExpressionTree> params, Block body, SourcePosition position)
      implements StatementTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitFunctionDeclaration(this);
    }
  }

  /** A statement kind outside the dialect, such as {@code switch} or {@code try}. */
  record Unsupported(String kind, SourcePosition position) implements StatementTree {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitUnsupported(this);
    }
  }
}
