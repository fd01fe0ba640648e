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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds document nodes. */
public enum DocBuilder {
  /**
   * The singleton instance of the document builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  doc;

  private static final Doc.Literal NONE = new Doc.Literal(null);
  private static final Doc.Literal TRUE = new Doc.Literal(true);
  private static final Doc.Literal FALSE = new Doc.Literal(false);

  // expressions

  /** Creates a literal. The value must be null, a {@link Boolean}, a
   * {@link Number} or a {@link String}. */
  public Doc.Literal literal(@Nullable Object value) {
    if (value == null) {
      return NONE;
    }
    if (value instanceof Boolean) {
      return (Boolean) value ? TRUE : FALSE;
    }
    return new Doc.Literal(value);
  }

  /** Creates the "none" literal. */
  public Doc.Literal none() {
    return NONE;
  }

  public Doc.Id id(String name) {
    return new Doc.Id(name);
  }

  /** Creates a list of identifiers. */
  public List<Doc.Id> ids(String... names) {
    final ImmutableList.Builder<Doc.Id> b = ImmutableList.builder();
    for (String name : names) {
      b.add(id(name));
    }
    return b.build();
  }

  public Doc.AttrAccess attrAccess(Doc.Expr value, String name) {
    return new Doc.AttrAccess(value, name);
  }

  public Doc.Index index(Doc.Expr value, List<? extends Doc.Expr> indices) {
    return new Doc.Index(value, ImmutableList.copyOf(indices));
  }

  public Doc.Operation operation(Doc.Operation.Kind kind,
      List<? extends Doc.Expr> operands) {
    return new Doc.Operation(kind, ImmutableList.copyOf(operands));
  }

  /** Creates a call to a unary operator, such as "-a" or "not a". */
  public Doc.Operation unary(Doc.Operation.Kind kind, Doc.Expr operand) {
    checkArgument(kind.arity == Doc.Operation.Arity.UNARY,
        "not a unary operator: %s", kind);
    return operation(kind, ImmutableList.of(operand));
  }

  /** Creates a call to a binary operator, such as "a + b". */
  public Doc.Operation binary(Doc.Operation.Kind kind, Doc.Expr left,
      Doc.Expr right) {
    checkArgument(kind.arity == Doc.Operation.Arity.BINARY,
        "not a binary operator: %s", kind);
    return operation(kind, ImmutableList.of(left, right));
  }

  /** Creates a conditional expression. */
  public Doc.Operation ifThenElse(Doc.Expr condition, Doc.Expr ifTrue,
      Doc.Expr ifFalse) {
    return operation(Doc.Operation.Kind.IF_THEN_ELSE,
        ImmutableList.of(condition, ifTrue, ifFalse));
  }

  public Doc.Call call(Doc.Expr callee, List<? extends Doc.Expr> args,
      Map<String, ? extends Doc.Expr> kwargs) {
    return new Doc.Call(callee, ImmutableList.copyOf(args),
        ImmutableMap.copyOf(kwargs));
  }

  public Doc.Call call(Doc.Expr callee, Doc.Expr... args) {
    return call(callee, ImmutableList.copyOf(args), ImmutableMap.of());
  }

  public Doc.Lambda lambda(List<Doc.Id> params, Doc.Expr body) {
    return new Doc.Lambda(ImmutableList.copyOf(params), body);
  }

  public Doc.ListDoc list(List<? extends Doc.Expr> elements) {
    return new Doc.ListDoc(ImmutableList.copyOf(elements));
  }

  public Doc.Tuple tuple(List<? extends Doc.Expr> elements) {
    return new Doc.Tuple(ImmutableList.copyOf(elements));
  }

  public Doc.Tuple tuple(Doc.Expr... elements) {
    return tuple(ImmutableList.copyOf(elements));
  }

  public Doc.Dict dict(List<? extends Doc.Expr> keys,
      List<? extends Doc.Expr> values) {
    return new Doc.Dict(ImmutableList.copyOf(keys),
        ImmutableList.copyOf(values));
  }

  public Doc.Slice slice(Doc.@Nullable Expr start, Doc.@Nullable Expr stop,
      Doc.@Nullable Expr step) {
    return new Doc.Slice(start, stop, step);
  }

  // statements

  public Doc.StmtBlock stmtBlock(List<? extends Doc.Stmt> stmts) {
    return new Doc.StmtBlock(ImmutableList.copyOf(stmts), null);
  }

  public Doc.StmtBlock stmtBlock(Doc.Stmt... stmts) {
    return stmtBlock(ImmutableList.copyOf(stmts));
  }

  /** Creates an assignment; if {@code rhs} is null, a declaration. */
  public Doc.Assign assign(Doc.Expr lhs, Doc.@Nullable Expr rhs,
      Doc.@Nullable Expr annotation) {
    return new Doc.Assign(lhs, rhs, annotation, null);
  }

  public Doc.If ifStmt(Doc.Expr condition, List<? extends Doc.Stmt> thenBranch,
      List<? extends Doc.Stmt> elseBranch) {
    return new Doc.If(condition, ImmutableList.copyOf(thenBranch),
        ImmutableList.copyOf(elseBranch), null);
  }

  public Doc.While whileStmt(Doc.Expr condition,
      List<? extends Doc.Stmt> body) {
    return new Doc.While(condition, ImmutableList.copyOf(body), null);
  }

  public Doc.For forStmt(Doc.Expr lhs, Doc.Expr rhs,
      List<? extends Doc.Stmt> body) {
    return new Doc.For(lhs, rhs, ImmutableList.copyOf(body), null);
  }

  public Doc.Scope scope(Doc.@Nullable Expr lhs, Doc.Expr rhs,
      List<? extends Doc.Stmt> body) {
    return new Doc.Scope(lhs, rhs, ImmutableList.copyOf(body), null);
  }

  public Doc.ExprStmt exprStmt(Doc.Expr expr) {
    return new Doc.ExprStmt(expr, null);
  }

  public Doc.Assert assertStmt(Doc.Expr test, Doc.@Nullable Expr msg) {
    return new Doc.Assert(test, msg, null);
  }

  public Doc.Return returnStmt(Doc.@Nullable Expr value) {
    return new Doc.Return(value, null);
  }

  /** Creates a function parameter, with optional type and default value. */
  public Doc.Assign param(String name, Doc.@Nullable Expr annotation,
      Doc.@Nullable Expr defaultValue) {
    return assign(id(name), defaultValue, annotation);
  }

  public Doc.Function function(Doc.Id name, List<Doc.Assign> params,
      List<? extends Doc.Expr> decorators, Doc.@Nullable Expr returnType,
      List<? extends Doc.Stmt> body) {
    return new Doc.Function(name, ImmutableList.copyOf(params),
        ImmutableList.copyOf(decorators), returnType,
        ImmutableList.copyOf(body), null);
  }

  public Doc.ClassDoc classDoc(Doc.Id name, List<? extends Doc.Expr> bases,
      List<? extends Doc.Expr> decorators, List<? extends Doc.Stmt> body) {
    return new Doc.ClassDoc(name, ImmutableList.copyOf(bases),
        ImmutableList.copyOf(decorators), ImmutableList.copyOf(body), null);
  }
}

// End DocBuilder.java
