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
package net.hydromatic.docprint.python;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import net.hydromatic.docprint.doc.Doc;
import net.hydromatic.docprint.doc.Doc.Operation.Kind;
import net.hydromatic.docprint.print.DocRules;
import net.hydromatic.docprint.print.DocWriter;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rules that print documents in Python syntax.
 *
 * <p>Inserts parentheses only where operator precedence requires them.
 * Statements in a block are separated by newlines; the bodies of compound
 * statements are indented one level; an empty body is printed as
 * "{@code pass}".
 */
public class PythonDocRules implements DocRules {
  public static final PythonDocRules INSTANCE = new PythonDocRules();

  private static final Escaper STRING_ESCAPER =
      Escapers.builder()
          .addEscape('\\', "\\\\")
          .addEscape('"', "\\\"")
          .addEscape('\n', "\\n")
          .addEscape('\r', "\\r")
          .addEscape('\t', "\\t")
          .build();

  private static final Splitter LINE_SPLITTER = Splitter.on('\n');

  /** Spelling of each operator. Unary operators include their trailing
   * space, if any; binary operators are padded. */
  private static final ImmutableMap<Kind, String> SYMBOLS =
      ImmutableMap.<Kind, String>builder()
          .put(Kind.USUB, "-")
          .put(Kind.INVERT, "~")
          .put(Kind.NOT, "not ")
          .put(Kind.ADD, " + ")
          .put(Kind.SUB, " - ")
          .put(Kind.MULT, " * ")
          .put(Kind.DIV, " / ")
          .put(Kind.FLOOR_DIV, " // ")
          .put(Kind.MOD, " % ")
          .put(Kind.POW, " ** ")
          .put(Kind.LSHIFT, " << ")
          .put(Kind.RSHIFT, " >> ")
          .put(Kind.BIT_AND, " & ")
          .put(Kind.BIT_OR, " | ")
          .put(Kind.BIT_XOR, " ^ ")
          .put(Kind.LT, " < ")
          .put(Kind.LT_E, " <= ")
          .put(Kind.EQ, " == ")
          .put(Kind.NOT_EQ, " != ")
          .put(Kind.GT, " > ")
          .put(Kind.GT_E, " >= ")
          .put(Kind.AND, " and ")
          .put(Kind.OR, " or ")
          .build();

  protected PythonDocRules() {
  }

  /** Precedence of Python expressions, loosest binding first. */
  enum Precedence {
    LAMBDA,
    IF_THEN_ELSE,
    OR,
    AND,
    NOT,
    COMPARISON,
    BIT_OR,
    BIT_XOR,
    BIT_AND,
    SHIFT,
    ADD,
    MULT,
    UNARY,
    POW,
    /** Call, index and attribute access. */
    POSTFIX,
    ATOM
  }

  static Precedence precedence(Doc.Expr expr) {
    switch (expr.op) {
    case LAMBDA:
      return Precedence.LAMBDA;
    case OPERATION:
      return precedence(((Doc.Operation) expr).kind);
    case CALL:
    case INDEX:
    case ATTR_ACCESS:
      return Precedence.POSTFIX;
    case LITERAL:
      // "-1" binds like a unary minus, so "(-1) ** 2" keeps its parentheses
      final Object value = ((Doc.Literal) expr).value;
      return value instanceof Number
          && literalText(value).startsWith("-")
          ? Precedence.UNARY
          : Precedence.ATOM;
    default:
      return Precedence.ATOM;
    }
  }

  static Precedence precedence(Kind kind) {
    switch (kind) {
    case USUB:
    case INVERT:
      return Precedence.UNARY;
    case NOT:
      return Precedence.NOT;
    case POW:
      return Precedence.POW;
    case MULT:
    case DIV:
    case FLOOR_DIV:
    case MOD:
      return Precedence.MULT;
    case ADD:
    case SUB:
      return Precedence.ADD;
    case LSHIFT:
    case RSHIFT:
      return Precedence.SHIFT;
    case BIT_AND:
      return Precedence.BIT_AND;
    case BIT_XOR:
      return Precedence.BIT_XOR;
    case BIT_OR:
      return Precedence.BIT_OR;
    case LT:
    case LT_E:
    case EQ:
    case NOT_EQ:
    case GT:
    case GT_E:
      return Precedence.COMPARISON;
    case AND:
      return Precedence.AND;
    case OR:
      return Precedence.OR;
    case IF_THEN_ELSE:
      return Precedence.IF_THEN_ELSE;
    default:
      throw new AssertionError("unknown operator " + kind);
    }
  }

  /** Converts a literal value to Python source text. */
  static String literalText(@Nullable Object value) {
    if (value == null) {
      return "None";
    }
    if (value instanceof Boolean) {
      return (Boolean) value ? "True" : "False";
    }
    if (value instanceof String) {
      return '"' + STRING_ESCAPER.escape((String) value) + '"';
    }
    if (value instanceof Double || value instanceof Float) {
      final double d = ((Number) value).doubleValue();
      if (Double.isNaN(d)) {
        return "float(\"nan\")";
      }
      if (Double.isInfinite(d)) {
        return d > 0 ? "float(\"inf\")" : "-float(\"inf\")";
      }
      // Java writes "1.0E-5" where Python writes "1e-05"; both parse
      final String s =
          value instanceof Float ? value.toString() : Double.toString(d);
      return s.replace('E', 'e');
    }
    if (value instanceof BigDecimal) {
      final String s = ((BigDecimal) value).toString().replace('E', 'e');
      return s.indexOf('.') >= 0 || s.indexOf('e') >= 0 ? s : s + ".0";
    }
    return value.toString();
  }

  /** Prints an operand, with parentheses if its precedence is lower than
   * the context's, or equal and {@code parenthesizeEqual}. */
  void printChild(DocWriter w, Doc.Expr child, Precedence context,
      boolean parenthesizeEqual) {
    final int c = precedence(child).compareTo(context);
    if (c < 0 || c == 0 && parenthesizeEqual) {
      w.append('(').print(child).append(')');
    } else {
      w.print(child);
    }
  }

  /** Prints the target of an assignment or loop. A tuple target is printed
   * without parentheses. */
  private void printTarget(DocWriter w, Doc.Expr target) {
    if (target instanceof Doc.Tuple) {
      final List<Doc.Expr> elements = ((Doc.Tuple) target).elements;
      if (elements.size() == 1) {
        w.print(elements.get(0)).append(',');
        return;
      }
      if (!elements.isEmpty()) {
        w.printJoined(elements, ", ");
        return;
      }
    }
    w.print(target);
  }

  /** Returns whether a list of statements prints no code: every statement
   * is an empty block without a comment. */
  static boolean isEmptyBody(List<? extends Doc.Stmt> body) {
    for (Doc.Stmt stmt : body) {
      if (!(stmt instanceof Doc.StmtBlock)
          || stmt.comment != null
          || !isEmptyBody(((Doc.StmtBlock) stmt).stmts)) {
        return false;
      }
    }
    return true;
  }

  /** Prints the body of a compound statement. A body with no code prints
   * "pass". */
  private void printBody(DocWriter w, List<Doc.Stmt> body) {
    if (isEmptyBody(body)) {
      w.indent().newLine().append("pass").dedent();
    } else {
      w.printIndentedBlock(body);
    }
  }

  /** Prints each line of a comment, the lines separated by newlines. */
  private static void printComment(DocWriter w, String comment) {
    boolean first = true;
    for (String line : LINE_SPLITTER.split(comment)) {
      if (!first) {
        w.newLine();
      }
      first = false;
      w.append(line.isEmpty() ? "#" : "# " + line);
    }
  }

  /** Prints a comment, if present, on the lines before a statement. */
  private static void printLeadingComment(DocWriter w,
      @Nullable String comment) {
    if (comment != null) {
      printComment(w, comment);
      w.newLine();
    }
  }

  /** Prints a simple statement with its comment. A one-line comment goes at
   * the end of the statement; a longer one goes before it. */
  private void printSimple(DocWriter w, Doc.Stmt stmt, Runnable body) {
    final String comment = stmt.comment;
    final boolean multiLine = comment != null && comment.indexOf('\n') >= 0;
    if (multiLine) {
      printLeadingComment(w, comment);
    }
    body.run();
    if (comment != null && !multiLine) {
      w.append("  # ").append(comment);
    }
  }

  private void printDecorators(DocWriter w, List<Doc.Expr> decorators) {
    for (Doc.Expr decorator : decorators) {
      w.append('@').print(decorator).newLine();
    }
  }

  // expressions

  @Override public void printLiteral(DocWriter w, Doc.Literal literal) {
    w.append(literalText(literal.value));
  }

  @Override public void printId(DocWriter w, Doc.Id id) {
    w.append(id.name);
  }

  @Override public void printAttrAccess(DocWriter w,
      Doc.AttrAccess attrAccess) {
    if (isIntegerLiteral(attrAccess.value)) {
      // "1.real" would lex as the float "1." followed by a name
      w.append('(').print(attrAccess.value).append(')');
    } else {
      printChild(w, attrAccess.value, Precedence.POSTFIX, false);
    }
    w.append('.').append(attrAccess.name);
  }

  private static boolean isIntegerLiteral(Doc.Expr expr) {
    if (!(expr instanceof Doc.Literal)) {
      return false;
    }
    final Object value = ((Doc.Literal) expr).value;
    return value instanceof Number
        && !(value instanceof Double
            || value instanceof Float
            || value instanceof BigDecimal);
  }

  @Override public void printIndex(DocWriter w, Doc.Index index) {
    printChild(w, index.value, Precedence.POSTFIX, false);
    w.append('[');
    if (index.indices.isEmpty()) {
      w.append("()");
    } else {
      w.printJoined(index.indices, ", ");
    }
    w.append(']');
  }

  @Override public void printOperation(DocWriter w,
      Doc.Operation operation) {
    final Kind kind = operation.kind;
    final Precedence precedence = precedence(kind);
    final List<Doc.Expr> operands = operation.operands;
    switch (kind.arity) {
    case UNARY:
      w.append(SYMBOLS.get(kind));
      printChild(w, operands.get(0), precedence, false);
      return;

    case BINARY:
      // "**" associates to the right; comparisons chain, so never leave an
      // equal-precedence comparison unparenthesized
      final boolean comparison = precedence == Precedence.COMPARISON;
      final boolean rightAssoc = kind == Kind.POW;
      printChild(w, operands.get(0), precedence, rightAssoc || comparison);
      w.append(SYMBOLS.get(kind));
      printChild(w, operands.get(1), precedence, !rightAssoc || comparison);
      return;

    case SPECIAL:
      // operands are condition, value if true, value if false
      printChild(w, operands.get(1), precedence, true);
      w.append(" if ");
      printChild(w, operands.get(0), precedence, true);
      w.append(" else ");
      printChild(w, operands.get(2), precedence, false);
      return;

    default:
      throw new AssertionError("unknown arity " + kind.arity);
    }
  }

  @Override public void printCall(DocWriter w, Doc.Call call) {
    printChild(w, call.callee, Precedence.POSTFIX, false);
    w.append('(');
    w.printJoined(call.args, ", ");
    boolean first = call.args.isEmpty();
    for (Map.Entry<String, Doc.Expr> kwarg : call.kwargs.entrySet()) {
      if (!first) {
        w.append(", ");
      }
      first = false;
      w.append(kwarg.getKey()).append('=').print(kwarg.getValue());
    }
    w.append(')');
  }

  @Override public void printLambda(DocWriter w, Doc.Lambda lambda) {
    w.append("lambda");
    if (!lambda.params.isEmpty()) {
      w.append(' ').printJoined(lambda.params, ", ");
    }
    w.append(": ").print(lambda.body);
  }

  @Override public void printList(DocWriter w, Doc.ListDoc list) {
    w.append('[').printJoined(list.elements, ", ").append(']');
  }

  @Override public void printTuple(DocWriter w, Doc.Tuple tuple) {
    w.append('(').printJoined(tuple.elements, ", ");
    if (tuple.elements.size() == 1) {
      w.append(',');
    }
    w.append(')');
  }

  @Override public void printDict(DocWriter w, Doc.Dict dict) {
    w.append('{');
    for (int i = 0; i < dict.keys.size(); i++) {
      if (i > 0) {
        w.append(", ");
      }
      w.print(dict.keys.get(i)).append(": ").print(dict.values.get(i));
    }
    w.append('}');
  }

  @Override public void printSlice(DocWriter w, Doc.Slice slice) {
    if (slice.start != null) {
      w.print(slice.start);
    }
    w.append(':');
    if (slice.stop != null) {
      w.print(slice.stop);
    }
    if (slice.step != null) {
      w.append(':').print(slice.step);
    }
  }

  // statements

  @Override public void printStmtBlock(DocWriter w,
      Doc.StmtBlock stmtBlock) {
    if (stmtBlock.comment != null) {
      printComment(w, stmtBlock.comment);
      if (!stmtBlock.stmts.isEmpty()) {
        w.newLine();
      }
    }
    for (int i = 0; i < stmtBlock.stmts.size(); i++) {
      if (i > 0) {
        w.newLine();
      }
      w.print(stmtBlock.stmts.get(i));
    }
  }

  @Override public void printAssign(DocWriter w, Doc.Assign assign) {
    printSimple(w, assign, () -> {
      printTarget(w, assign.lhs);
      if (assign.annotation != null) {
        w.append(": ").print(assign.annotation);
      }
      if (assign.rhs != null) {
        w.append(" = ").print(assign.rhs);
      }
    });
  }

  @Override public void printIf(DocWriter w, Doc.If anIf) {
    printLeadingComment(w, anIf.comment);
    w.append("if ").print(anIf.condition).append(':');
    printBody(w, anIf.thenBranch);
    final List<Doc.Stmt> elseBranch = anIf.elseBranch;
    if (elseBranch.size() == 1
        && elseBranch.get(0) instanceof Doc.If
        && elseBranch.get(0).comment == null) {
      // "else: if c: ..." becomes "elif c: ..."
      w.newLine().append("el").print(elseBranch.get(0));
    } else if (!elseBranch.isEmpty()) {
      w.newLine().append("else:");
      printBody(w, elseBranch);
    }
  }

  @Override public void printWhile(DocWriter w, Doc.While aWhile) {
    printLeadingComment(w, aWhile.comment);
    w.append("while ").print(aWhile.condition).append(':');
    printBody(w, aWhile.body);
  }

  @Override public void printFor(DocWriter w, Doc.For aFor) {
    printLeadingComment(w, aFor.comment);
    w.append("for ");
    printTarget(w, aFor.lhs);
    w.append(" in ").print(aFor.rhs).append(':');
    printBody(w, aFor.body);
  }

  @Override public void printScope(DocWriter w, Doc.Scope scope) {
    printLeadingComment(w, scope.comment);
    w.append("with ").print(scope.rhs);
    if (scope.lhs != null) {
      // unlike a loop target, a tuple keeps its parentheses;
      // "with c as a, b:" would be two context managers
      w.append(" as ").print(scope.lhs);
    }
    w.append(':');
    printBody(w, scope.body);
  }

  @Override public void printExprStmt(DocWriter w, Doc.ExprStmt exprStmt) {
    printSimple(w, exprStmt, () -> w.print(exprStmt.expr));
  }

  @Override public void printAssert(DocWriter w, Doc.Assert anAssert) {
    printSimple(w, anAssert, () -> {
      w.append("assert ").print(anAssert.test);
      if (anAssert.msg != null) {
        w.append(", ").print(anAssert.msg);
      }
    });
  }

  @Override public void printReturn(DocWriter w, Doc.Return aReturn) {
    printSimple(w, aReturn, () -> {
      w.append("return");
      if (aReturn.value != null) {
        w.append(' ').print(aReturn.value);
      }
    });
  }

  @Override public void printFunction(DocWriter w, Doc.Function function) {
    printLeadingComment(w, function.comment);
    printDecorators(w, function.decorators);
    w.append("def ").print(function.name).append('(');
    for (int i = 0; i < function.params.size(); i++) {
      final Doc.Assign param = function.params.get(i);
      if (i > 0) {
        w.append(", ");
      }
      w.print(param.lhs);
      if (param.annotation != null) {
        w.append(": ").print(param.annotation);
        if (param.rhs != null) {
          w.append(" = ").print(param.rhs);
        }
      } else if (param.rhs != null) {
        w.append('=').print(param.rhs);
      }
    }
    w.append(')');
    if (function.returnType != null) {
      w.append(" -> ").print(function.returnType);
    }
    w.append(':');
    printBody(w, function.body);
  }

  @Override public void printClass(DocWriter w, Doc.ClassDoc classDoc) {
    printLeadingComment(w, classDoc.comment);
    printDecorators(w, classDoc.decorators);
    w.append("class ").print(classDoc.name);
    if (!classDoc.bases.isEmpty()) {
      w.append('(').printJoined(classDoc.bases, ", ").append(')');
    }
    w.append(':');
    printBody(w, classDoc.body);
  }
}

// End PythonDocRules.java
