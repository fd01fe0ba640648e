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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.docprint.doc.Doc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints documents as text.
 *
 * <p>The printer is the dispatcher: it routes each node to the method of its
 * {@link DocRules} that handles that node's variant. The rules, and thus the
 * concrete syntax, are fixed when the printer is created; the traversal is
 * the same for every syntax.
 *
 * <p>Call {@link #append} once for each top-level node, then {@link
 * #getString()}. A printer is a single render session: it is not
 * thread-safe, and after a failed {@code append} its output is invalid.
 */
public class DocPrinter {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(DocPrinter.class);

  private final DocRules rules;
  private final Tracer tracer;
  private final Prop.UnknownDoc unknownDoc;
  private final DocWriter writer;

  /** Creates a printer with a given number of spaces per indentation
   * level. */
  public DocPrinter(DocRules rules, int indentSpaces) {
    this(rules,
        ImmutableMap.<Prop, Object>of(Prop.INDENT_SPACES, indentSpaces),
        Tracers.empty());
  }

  /** Creates a printer whose settings come from a property map. */
  public DocPrinter(DocRules rules, Map<Prop, Object> map, Tracer tracer) {
    this.rules = requireNonNull(rules);
    this.tracer = requireNonNull(tracer);
    this.unknownDoc =
        Prop.UNKNOWN_DOC.enumValue(map, Prop.UnknownDoc.class);
    this.writer = new DocWriter(this, Prop.INDENT_SPACES.intValue(map));
  }

  /** Prints a document and appends it to the output.
   *
   * <p>Does not insert a separator between calls. */
  public void append(Doc doc) {
    LOGGER.debug("append {}", doc.op);
    print(doc);
  }

  /**
   * Returns the text printed so far.
   *
   * <p>If the text is not empty and does not end in a newline, the result
   * has one newline appended. Does not modify the output; calling this method
   * twice gives the same result.
   */
  public String getString() {
    final String text = writer.toString();
    if (!text.isEmpty() && text.charAt(text.length() - 1) != '\n') {
      return text + '\n';
    }
    return text;
  }

  /** Returns the text printed so far, without the trailing newline that
   * {@link #getString()} adds. */
  public String rawString() {
    return writer.toString();
  }

  /** Returns the writer that accumulates this printer's output. */
  DocWriter writer() {
    return writer;
  }

  /** Prints a document, dispatching on its variant. */
  void print(Doc doc) {
    tracer.onPrint(doc);
    if (!doc.op.docClass.isInstance(doc)) {
      unknown(doc);
      return;
    }
    switch (doc.op) {
    case LITERAL:
      rules.printLiteral(writer, (Doc.Literal) doc);
      break;
    case ID:
      rules.printId(writer, (Doc.Id) doc);
      break;
    case ATTR_ACCESS:
      rules.printAttrAccess(writer, (Doc.AttrAccess) doc);
      break;
    case INDEX:
      rules.printIndex(writer, (Doc.Index) doc);
      break;
    case OPERATION:
      rules.printOperation(writer, (Doc.Operation) doc);
      break;
    case CALL:
      rules.printCall(writer, (Doc.Call) doc);
      break;
    case LAMBDA:
      rules.printLambda(writer, (Doc.Lambda) doc);
      break;
    case LIST:
      rules.printList(writer, (Doc.ListDoc) doc);
      break;
    case TUPLE:
      rules.printTuple(writer, (Doc.Tuple) doc);
      break;
    case DICT:
      rules.printDict(writer, (Doc.Dict) doc);
      break;
    case SLICE:
      rules.printSlice(writer, (Doc.Slice) doc);
      break;
    case STMT_BLOCK:
      rules.printStmtBlock(writer, (Doc.StmtBlock) doc);
      break;
    case ASSIGN:
      rules.printAssign(writer, (Doc.Assign) doc);
      break;
    case IF:
      rules.printIf(writer, (Doc.If) doc);
      break;
    case WHILE:
      rules.printWhile(writer, (Doc.While) doc);
      break;
    case FOR:
      rules.printFor(writer, (Doc.For) doc);
      break;
    case SCOPE:
      rules.printScope(writer, (Doc.Scope) doc);
      break;
    case EXPR_STMT:
      rules.printExprStmt(writer, (Doc.ExprStmt) doc);
      break;
    case ASSERT:
      rules.printAssert(writer, (Doc.Assert) doc);
      break;
    case RETURN:
      rules.printReturn(writer, (Doc.Return) doc);
      break;
    case FUNCTION:
      rules.printFunction(writer, (Doc.Function) doc);
      break;
    case CLASS:
      rules.printClass(writer, (Doc.ClassDoc) doc);
      break;
    default:
      unknown(doc);
    }
  }

  /** Reports a node that is not one of the known variants. Never returns
   * normally. */
  private void unknown(Doc doc) {
    final UnknownDocException e = new UnknownDocException(doc);
    LOGGER.error("{}; printer and document model are out of step",
        e.getMessage());
    tracer.onUnknownDoc(e);
    switch (unknownDoc) {
    case THROW:
      throw e;
    case FAIL:
    default:
      throw new AssertionError(e.getMessage(), e);
    }
  }

  /** Prints a document with the given rules and returns the text. */
  public static String render(DocRules rules, int indentSpaces, Doc doc) {
    final DocPrinter printer = new DocPrinter(rules, indentSpaces);
    printer.append(doc);
    return printer.getString();
  }
}

// End DocPrinter.java
