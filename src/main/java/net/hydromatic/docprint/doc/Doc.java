/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.docprint.doc;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.docprint.doc.DocBuilder.doc;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.docprint.print.DocPrinter;
import net.hydromatic.docprint.python.PythonDocRules;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Node of a program document.
 *
 * <p>A document is a tree of expressions and statements that is independent
 * of any concrete syntax. Nodes are immutable and own their children. Create
 * them using {@link DocBuilder#doc}; the set of variants is closed, and each
 * variant is identified by its {@link #op}.
 */
public abstract class Doc {
  public final Op op;

  Doc(Op op) {
    this.op = requireNonNull(op);
  }

  /**
   * Converts this node into a Python-like string.
   *
   * <p>The purpose of this string is debugging. To generate text in a
   * particular syntax, use a {@link DocPrinter} with the rules of that
   * syntax.
   */
  @Override
  public final String toString() {
    final DocPrinter printer = new DocPrinter(PythonDocRules.INSTANCE, 4);
    printer.append(this);
    return printer.rawString();
  }

  /** Base class for an expression. */
  public abstract static class Expr extends Doc {
    Expr(Op op) {
      super(op);
    }

    /** Creates an expression that accesses an attribute of this one. */
    public AttrAccess attr(String name) {
      return doc.attrAccess(this, name);
    }

    /** Creates an expression that indexes this one. */
    public Index index(List<? extends Expr> indices) {
      return doc.index(this, indices);
    }

    /** Creates an expression that calls this one. */
    public Call call(List<? extends Expr> args) {
      return doc.call(this, args, ImmutableMap.of());
    }

    /** Creates an expression that calls this one with keyword arguments. */
    public Call call(List<? extends Expr> args,
        Map<String, ? extends Expr> kwargs) {
      return doc.call(this, args, kwargs);
    }
  }

  /** Base class for a statement.
   *
   * <p>Every statement may carry a comment. How the comment is rendered is up
   * to the syntax. */
  public abstract static class Stmt extends Doc {
    public final @Nullable String comment;

    Stmt(Op op, @Nullable String comment) {
      super(op);
      this.comment = comment;
    }

    /** Returns a copy of this statement with the given comment,
     * or {@code this} if the comment is the same. */
    public final Stmt withComment(@Nullable String comment) {
      return Objects.equals(this.comment, comment)
          ? this
          : copyWithComment(comment);
    }

    abstract Stmt copyWithComment(@Nullable String comment);
  }

  /** Literal: none, a boolean, a number or a string. */
  public static class Literal extends Expr {
    public final @Nullable Object value;

    Literal(@Nullable Object value) {
      super(Op.LITERAL);
      checkArgument(value == null
              || value instanceof Boolean
              || value instanceof Number
              || value instanceof String,
          "invalid literal value %s", value);
      this.value = value;
    }

    /** Returns whether this is the "none" literal. */
    public boolean isNone() {
      return value == null;
    }
  }

  /** Reference to a name. */
  public static class Id extends Expr {
    public final String name;

    Id(String name) {
      super(Op.ID);
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty(), "empty identifier");
    }
  }

  /** Access to an attribute; for example "a.b". */
  public static class AttrAccess extends Expr {
    public final Expr value;
    public final String name;

    AttrAccess(Expr value, String name) {
      super(Op.ATTR_ACCESS);
      this.value = requireNonNull(value);
      this.name = requireNonNull(name);
    }
  }

  /** Indexed access; for example "a[i, j]". */
  public static class Index extends Expr {
    public final Expr value;
    public final List<Expr> indices;

    Index(Expr value, ImmutableList<Expr> indices) {
      super(Op.INDEX);
      this.value = requireNonNull(value);
      this.indices = requireNonNull(indices);
    }
  }

  /** Application of an operator to operands.
   *
   * <p>The number of operands is determined by the {@link #kind}. */
  public static class Operation extends Expr {
    public final Kind kind;
    public final List<Expr> operands;

    Operation(Kind kind, ImmutableList<Expr> operands) {
      super(Op.OPERATION);
      this.kind = requireNonNull(kind);
      this.operands = requireNonNull(operands);
      checkArgument(operands.size() == kind.arity.operandCount,
          "operator %s requires %s operands, got %s", kind,
          kind.arity.operandCount, operands.size());
    }

    /** Number of operands an operator takes. */
    public enum Arity {
      UNARY(1),
      BINARY(2),
      /** Operators with their own syntax, such as "a if c else b". */
      SPECIAL(3);

      public final int operandCount;

      Arity(int operandCount) {
        this.operandCount = operandCount;
      }
    }

    /** Operator. */
    public enum Kind {
      // unary
      USUB(Arity.UNARY),
      INVERT(Arity.UNARY),
      NOT(Arity.UNARY),

      // binary
      ADD(Arity.BINARY),
      SUB(Arity.BINARY),
      MULT(Arity.BINARY),
      DIV(Arity.BINARY),
      FLOOR_DIV(Arity.BINARY),
      MOD(Arity.BINARY),
      POW(Arity.BINARY),
      LSHIFT(Arity.BINARY),
      RSHIFT(Arity.BINARY),
      BIT_AND(Arity.BINARY),
      BIT_OR(Arity.BINARY),
      BIT_XOR(Arity.BINARY),
      LT(Arity.BINARY),
      LT_E(Arity.BINARY),
      EQ(Arity.BINARY),
      NOT_EQ(Arity.BINARY),
      GT(Arity.BINARY),
      GT_E(Arity.BINARY),
      AND(Arity.BINARY),
      OR(Arity.BINARY),

      /** Conditional; operands are condition, value if true, value if
       * false. */
      IF_THEN_ELSE(Arity.SPECIAL);

      public final Arity arity;

      Kind(Arity arity) {
        this.arity = arity;
      }
    }
  }

  /** Call of a function, with positional and keyword arguments. */
  public static class Call extends Expr {
    public final Expr callee;
    public final List<Expr> args;
    /** Keyword arguments, in order. */
    public final Map<String, Expr> kwargs;

    Call(Expr callee, ImmutableList<Expr> args,
        ImmutableMap<String, Expr> kwargs) {
      super(Op.CALL);
      this.callee = requireNonNull(callee);
      this.args = requireNonNull(args);
      this.kwargs = requireNonNull(kwargs);
    }
  }

  /** Anonymous function; for example "lambda x, y: x + y". */
  public static class Lambda extends Expr {
    public final List<Id> params;
    public final Expr body;

    Lambda(ImmutableList<Id> params, Expr body) {
      super(Op.LAMBDA);
      this.params = requireNonNull(params);
      this.body = requireNonNull(body);
    }
  }

  /** List; for example "[a, b]". */
  public static class ListDoc extends Expr {
    public final List<Expr> elements;

    ListDoc(ImmutableList<Expr> elements) {
      super(Op.LIST);
      this.elements = requireNonNull(elements);
    }
  }

  /** Tuple; for example "(a, b)". */
  public static class Tuple extends Expr {
    public final List<Expr> elements;

    Tuple(ImmutableList<Expr> elements) {
      super(Op.TUPLE);
      this.elements = requireNonNull(elements);
    }
  }

  /** Dictionary; for example "{k: v}".
   *
   * <p>{@link #keys} and {@link #values} have the same length. */
  public static class Dict extends Expr {
    public final List<Expr> keys;
    public final List<Expr> values;

    Dict(ImmutableList<Expr> keys, ImmutableList<Expr> values) {
      super(Op.DICT);
      this.keys = requireNonNull(keys);
      this.values = requireNonNull(values);
      checkArgument(keys.size() == values.size(),
          "dict has %s keys but %s values", keys.size(), values.size());
    }
  }

  /** Slice; for example "1:n:2". Each part is optional. */
  public static class Slice extends Expr {
    public final @Nullable Expr start;
    public final @Nullable Expr stop;
    public final @Nullable Expr step;

    Slice(@Nullable Expr start, @Nullable Expr stop, @Nullable Expr step) {
      super(Op.SLICE);
      this.start = start;
      this.stop = stop;
      this.step = step;
    }
  }

  /** Sequence of statements. Does not introduce a scope. */
  public static class StmtBlock extends Stmt {
    public final List<Stmt> stmts;

    StmtBlock(ImmutableList<Stmt> stmts, @Nullable String comment) {
      super(Op.STMT_BLOCK, comment);
      this.stmts = requireNonNull(stmts);
    }

    @Override StmtBlock copyWithComment(@Nullable String comment) {
      return new StmtBlock(ImmutableList.copyOf(stmts), comment);
    }
  }

  /** Assignment, or declaration if there is no value.
   *
   * <p>For example, "x: int = 1", "a, b = f()", "y: float". */
  public static class Assign extends Stmt {
    public final Expr lhs;
    public final @Nullable Expr rhs;
    public final @Nullable Expr annotation;

    Assign(Expr lhs, @Nullable Expr rhs, @Nullable Expr annotation,
        @Nullable String comment) {
      super(Op.ASSIGN, comment);
      this.lhs = requireNonNull(lhs);
      this.rhs = rhs;
      this.annotation = annotation;
    }

    @Override Assign copyWithComment(@Nullable String comment) {
      return new Assign(lhs, rhs, annotation, comment);
    }
  }

  /** Conditional statement. Either branch may be empty. */
  public static class If extends Stmt {
    public final Expr condition;
    public final List<Stmt> thenBranch;
    public final List<Stmt> elseBranch;

    If(Expr condition, ImmutableList<Stmt> thenBranch,
        ImmutableList<Stmt> elseBranch, @Nullable String comment) {
      super(Op.IF, comment);
      this.condition = requireNonNull(condition);
      this.thenBranch = requireNonNull(thenBranch);
      this.elseBranch = requireNonNull(elseBranch);
    }

    @Override If copyWithComment(@Nullable String comment) {
      return new If(condition, ImmutableList.copyOf(thenBranch),
          ImmutableList.copyOf(elseBranch), comment);
    }
  }

  /** Loop that runs while a condition holds. */
  public static class While extends Stmt {
    public final Expr condition;
    public final List<Stmt> body;

    While(Expr condition, ImmutableList<Stmt> body, @Nullable String comment) {
      super(Op.WHILE, comment);
      this.condition = requireNonNull(condition);
      this.body = requireNonNull(body);
    }

    @Override While copyWithComment(@Nullable String comment) {
      return new While(condition, ImmutableList.copyOf(body), comment);
    }
  }

  /** Loop over the elements of an iterable; for example
   * "for x in xs: ...". */
  public static class For extends Stmt {
    public final Expr lhs;
    public final Expr rhs;
    public final List<Stmt> body;

    For(Expr lhs, Expr rhs, ImmutableList<Stmt> body,
        @Nullable String comment) {
      super(Op.FOR, comment);
      this.lhs = requireNonNull(lhs);
      this.rhs = requireNonNull(rhs);
      this.body = requireNonNull(body);
    }

    @Override For copyWithComment(@Nullable String comment) {
      return new For(lhs, rhs, ImmutableList.copyOf(body), comment);
    }
  }

  /** Block entered through a context manager; for example
   * "with open(f) as x: ...".
   *
   * <p>The bound variable {@link #lhs} is optional. */
  public static class Scope extends Stmt {
    public final @Nullable Expr lhs;
    public final Expr rhs;
    public final List<Stmt> body;

    Scope(@Nullable Expr lhs, Expr rhs, ImmutableList<Stmt> body,
        @Nullable String comment) {
      super(Op.SCOPE, comment);
      this.lhs = lhs;
      this.rhs = requireNonNull(rhs);
      this.body = requireNonNull(body);
    }

    @Override Scope copyWithComment(@Nullable String comment) {
      return new Scope(lhs, rhs, ImmutableList.copyOf(body), comment);
    }
  }

  /** Expression evaluated for its effect. */
  public static class ExprStmt extends Stmt {
    public final Expr expr;

    ExprStmt(Expr expr, @Nullable String comment) {
      super(Op.EXPR_STMT, comment);
      this.expr = requireNonNull(expr);
    }

    @Override ExprStmt copyWithComment(@Nullable String comment) {
      return new ExprStmt(expr, comment);
    }
  }

  /** Assertion, with an optional message. */
  public static class Assert extends Stmt {
    public final Expr test;
    public final @Nullable Expr msg;

    Assert(Expr test, @Nullable Expr msg, @Nullable String comment) {
      super(Op.ASSERT, comment);
      this.test = requireNonNull(test);
      this.msg = msg;
    }

    @Override Assert copyWithComment(@Nullable String comment) {
      return new Assert(test, msg, comment);
    }
  }

  /** Return from a function, with an optional value. */
  public static class Return extends Stmt {
    public final @Nullable Expr value;

    Return(@Nullable Expr value, @Nullable String comment) {
      super(Op.RETURN, comment);
      this.value = value;
    }

    @Override Return copyWithComment(@Nullable String comment) {
      return new Return(value, comment);
    }
  }

  /** Function definition.
   *
   * <p>Each parameter is an {@link Assign} whose left side is an {@link Id};
   * its annotation is the parameter type, and its right side, if present, is
   * the default value. */
  public static class Function extends Stmt {
    public final Id name;
    public final List<Assign> params;
    public final List<Expr> decorators;
    public final @Nullable Expr returnType;
    public final List<Stmt> body;

    Function(Id name, ImmutableList<Assign> params,
        ImmutableList<Expr> decorators, @Nullable Expr returnType,
        ImmutableList<Stmt> body, @Nullable String comment) {
      super(Op.FUNCTION, comment);
      this.name = requireNonNull(name);
      this.params = requireNonNull(params);
      this.decorators = requireNonNull(decorators);
      this.returnType = returnType;
      this.body = requireNonNull(body);
      params.forEach(param ->
          checkArgument(param.lhs instanceof Id,
              "parameter must be an identifier: %s", param.lhs.op));
    }

    @Override Function copyWithComment(@Nullable String comment) {
      return new Function(name, ImmutableList.copyOf(params),
          ImmutableList.copyOf(decorators), returnType,
          ImmutableList.copyOf(body), comment);
    }
  }

  /** Class definition. */
  public static class ClassDoc extends Stmt {
    public final Id name;
    public final List<Expr> bases;
    public final List<Expr> decorators;
    public final List<Stmt> body;

    ClassDoc(Id name, ImmutableList<Expr> bases,
        ImmutableList<Expr> decorators, ImmutableList<Stmt> body,
        @Nullable String comment) {
      super(Op.CLASS, comment);
      this.name = requireNonNull(name);
      this.bases = requireNonNull(bases);
      this.decorators = requireNonNull(decorators);
      this.body = requireNonNull(body);
    }

    @Override ClassDoc copyWithComment(@Nullable String comment) {
      return new ClassDoc(name, ImmutableList.copyOf(bases),
          ImmutableList.copyOf(decorators), ImmutableList.copyOf(body),
          comment);
    }
  }
}

// End Doc.java
