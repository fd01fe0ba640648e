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
package net.hydromatic.docprint.print;

import static net.hydromatic.docprint.doc.DocBuilder.doc;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.docprint.doc.Doc;
import net.hydromatic.docprint.doc.Op;
import net.hydromatic.docprint.doc.SampleDocs;
import net.hydromatic.docprint.python.PythonDocRules;
import org.junit.jupiter.api.Test;

/** Tests for {@link DocPrinter}, the dispatcher, and {@link DocWriter}. */
class DocPrinterTest {
  private static final Doc.Id A = doc.id("a");
  private static final Doc.Id B = doc.id("b");

  /** Every variant reaches its rule, and no variant is reported as
   * unknown. */
  @Test
  void testEveryVariantIsDispatched() {
    for (Op op : Op.values()) {
      final RecordingRules rules = new RecordingRules();
      final DocPrinter printer = new DocPrinter(rules, 2);
      printer.append(SampleDocs.minimal(op));
      assertThat(rules.ops, is(ImmutableList.of(op)));
      assertThat(printer.getString(), is(op.lowerName() + "\n"));
    }
  }

  /** The dispatcher is re-entered for every child. */
  @Test
  void testChildrenAreDispatched() {
    final List<Op> ops = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnPrint(Tracers.empty(), d -> ops.add(d.op));
    final DocPrinter printer =
        new DocPrinter(PythonDocRules.INSTANCE, ImmutableMap.of(), tracer);
    printer.append(function());
    assertThat(ops,
        is(ImmutableList.of(Op.FUNCTION, Op.ID, Op.ID, Op.RETURN, Op.ID)));
  }

  @Test
  void testEmpty() {
    final DocPrinter printer = new DocPrinter(PythonDocRules.INSTANCE, 2);
    assertThat(printer.getString(), is(""));
    printer.append(doc.stmtBlock());
    assertThat(printer.getString(), is(""));
  }

  /** A newline is added to the result, but not to the output. */
  @Test
  void testTrailingNewline() {
    final DocPrinter printer = new DocPrinter(PythonDocRules.INSTANCE, 2);
    printer.append(A);
    assertThat(printer.getString(), is("a\n"));
    assertThat(printer.getString(), is("a\n"));
    assertThat(printer.rawString(), is("a"));
    assertThat(printer.writer().length(), is(1));
  }

  /** If the rules already ended the text with a newline, no second newline
   * is added. */
  @Test
  void testNoExtraNewline() {
    final DocRules rules = new PythonDocRules() {
      @Override public void printId(DocWriter w, Doc.Id id) {
        w.append(id.name).append('\n');
      }
    };
    final DocPrinter printer = new DocPrinter(rules, 2);
    printer.append(A);
    assertThat(printer.getString(), is("a\n"));
    assertThat(printer.getString(), is("a\n"));
  }

  /** The dispatcher inserts nothing between two appends. */
  @Test
  void testSequentialAppends() {
    final DocPrinter printer = new DocPrinter(PythonDocRules.INSTANCE, 2);
    printer.append(A);
    printer.append(B);
    assertThat(printer.getString(), is("ab\n"));
  }

  /** With rules that terminate each statement, rather than separate them,
   * two appends give the same text as one block. */
  @Test
  void testAppendsEqualBlock() {
    final Doc.Stmt s0 = doc.exprStmt(A);
    final Doc.Stmt s1 = doc.assign(B, doc.literal(1), null);
    final DocRules rules = new TerminatedRules();

    final DocPrinter printer = new DocPrinter(rules, 4);
    printer.append(s0);
    printer.append(s1);

    final DocPrinter printer2 = new DocPrinter(rules, 4);
    printer2.append(doc.stmtBlock(s0, s1));
    assertThat(printer.getString(), is("a;\nb = 1;\n"));
    assertThat(printer2.getString(), is(printer.getString()));
  }

  /** A function "f" with parameter "x" whose body returns "x", printed with
   * two-space indentation. */
  @Test
  void testFunction() {
    final DocPrinter printer = new DocPrinter(PythonDocRules.INSTANCE, 2);
    printer.append(function());
    assertThat(printer.getString(), is("def f(x):\n  return x\n"));
    assertThat(DocPrinter.render(PythonDocRules.INSTANCE, 4, function()),
        is("def f(x):\n    return x\n"));
  }

  /** The same tree, printed by two backends that differ only in the rule for
   * calls. */
  @Test
  void testBackends() {
    final Doc.Stmt stmt =
        doc.exprStmt(doc.call(doc.id("f"), doc.id("x"), doc.id("y")));
    assertThat(DocPrinter.render(PythonDocRules.INSTANCE, 4, stmt),
        is("f(x, y)\n"));
    assertThat(DocPrinter.render(new ApplyRules(), 4, stmt),
        is("apply(f, x, y)\n"));
  }

  @Test
  void testIndentFromProperties() {
    final Map<Prop, Object> map =
        Prop.parse(ImmutableMap.of("indentSpaces", "3"));
    final DocPrinter printer =
        new DocPrinter(PythonDocRules.INSTANCE, map, Tracers.empty());
    printer.append(function());
    assertThat(printer.getString(), is("def f(x):\n   return x\n"));
    assertThat(printer.writer().indentSpaces(), is(3));
  }

  @Test
  void testNegativeIndent() {
    assertThrows(IllegalArgumentException.class,
        () -> new DocPrinter(PythonDocRules.INSTANCE, -1));
  }

  @Test
  void testWriterIndent() {
    final DocPrinter printer = new DocPrinter(PythonDocRules.INSTANCE, 2);
    final DocWriter w = printer.writer();
    w.append("a").indent().indent().newLine().append("b");
    assertThat(w.level(), is(2));
    w.dedent().newLine().append("c").dedent().newLine();
    assertThat(printer.getString(), is("a\n    b\n  c\n"));
    assertThrows(IllegalStateException.class, w::dedent);
  }

  /** By default, a node that is not one of the known variants is fatal. */
  @Test
  void testUnknownFails() {
    final Doc.Expr unknown = SampleDocs.unknownExpr();
    final DocPrinter printer = new DocPrinter(PythonDocRules.INSTANCE, 2);
    final AssertionError e =
        assertThrows(AssertionError.class, () -> printer.append(unknown));
    assertThat(e.getMessage(),
        is("Do not know how to print " + unknown.getClass().getName()));
    assertThat(e.getCause(), instanceOf(UnknownDocException.class));
  }

  /** An unknown node deep inside a tree is not skipped. */
  @Test
  void testUnknownNested() {
    final Doc.Stmt unknown = SampleDocs.unknownStmt();
    final Doc.Function function =
        doc.function(doc.id("f"), ImmutableList.of(), ImmutableList.of(),
            null, ImmutableList.of(doc.returnStmt(null), unknown));
    final AssertionError e =
        assertThrows(AssertionError.class,
            () -> DocPrinter.render(PythonDocRules.INSTANCE, 2, function));
    assertThat(e.getMessage(), containsString(unknown.getClass().getName()));
  }

  /** With property "unknownDoc" set to "throw", the printer throws an
   * exception that a caller can handle. */
  @Test
  void testUnknownThrows() {
    final Doc.Expr unknown = SampleDocs.unknownExpr();
    final List<UnknownDocException> unknowns = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnUnknownDoc(Tracers.empty(), unknowns::add);
    final Map<Prop, Object> map =
        Prop.parse(ImmutableMap.of("unknownDoc", "throw"));
    final DocPrinter printer =
        new DocPrinter(PythonDocRules.INSTANCE, map, tracer);
    final UnknownDocException e =
        assertThrows(UnknownDocException.class,
            () -> printer.append(doc.list(ImmutableList.of(A, unknown))));
    assertThat(e.docClass(), sameInstance(unknown.getClass()));
    assertThat(e.op(), is(Op.ID));
    assertThat(e, instanceOf(DocPrintException.class));
    assertThat(unknowns, hasSize(1));
    assertThat(unknowns.get(0), sameInstance(e));
  }

  /** Rendering does not modify the tree, so it can be rendered again, by the
   * same rules or by others. */
  @Test
  void testRenderTwice() {
    final Doc.Function function = function();
    final String s = DocPrinter.render(PythonDocRules.INSTANCE, 2, function);
    assertThat(DocPrinter.render(PythonDocRules.INSTANCE, 2, function), is(s));

    final RecordingRules rules = new RecordingRules();
    DocPrinter.render(rules, 2, function);
    assertThat(rules.ops, hasItems(Op.FUNCTION));
    assertThat(DocPrinter.render(PythonDocRules.INSTANCE, 2, function), is(s));
  }

  /** Returns "def f(x): return x". */
  private static Doc.Function function() {
    return doc.function(doc.id("f"),
        ImmutableList.of(doc.param("x", null, null)), ImmutableList.of(), null,
        ImmutableList.of(doc.returnStmt(doc.id("x"))));
  }

  /** Python rules, except that statements are terminated with ";" and a
   * newline rather than separated by newlines. */
  private static class TerminatedRules extends PythonDocRules {
    @Override public void printStmtBlock(DocWriter w,
        Doc.StmtBlock stmtBlock) {
      stmtBlock.stmts.forEach(w::print);
    }

    @Override public void printExprStmt(DocWriter w, Doc.ExprStmt exprStmt) {
      super.printExprStmt(w, exprStmt);
      w.append(';').newLine();
    }

    @Override public void printAssign(DocWriter w, Doc.Assign assign) {
      super.printAssign(w, assign);
      w.append(';').newLine();
    }
  }

  /** Python rules, except that a call is printed as an application of
   * "apply". */
  private static class ApplyRules extends PythonDocRules {
    @Override public void printCall(DocWriter w, Doc.Call call) {
      w.append("apply(").print(call.callee);
      for (Doc.Expr arg : call.args) {
        w.append(", ").print(arg);
      }
      w.append(')');
    }
  }
}

// End DocPrinterTest.java
