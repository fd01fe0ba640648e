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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.util.List;
import net.hydromatic.docprint.doc.Doc;

/**
 * Context for writing a document out as a string.
 *
 * <p>A writer accumulates the text of one render session. It belongs to a
 * {@link DocPrinter}, which passes it to every rule; rules append text, move
 * the indentation level, and print child nodes through {@link #print}, which
 * goes back through the printer's dispatcher.
 *
 * <p>Not thread-safe.
 */
public class DocWriter {
  private final StringBuilder b = new StringBuilder();
  private final DocPrinter printer;
  private final int indentSpaces;
  private int level;

  DocWriter(DocPrinter printer, int indentSpaces) {
    checkArgument(indentSpaces >= 0, "negative indent: %s", indentSpaces);
    this.printer = requireNonNull(printer);
    this.indentSpaces = indentSpaces;
  }

  /** Appends a string to the output. */
  public DocWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a character to the output. */
  public DocWriter append(char c) {
    b.append(c);
    return this;
  }

  /** Prints a child node, using the rules of the printer that owns this
   * writer. */
  public DocWriter print(Doc doc) {
    printer.print(doc);
    return this;
  }

  /** Prints a list of nodes, with a separator between each. */
  public DocWriter printJoined(List<? extends Doc> docs, String separator) {
    for (int i = 0; i < docs.size(); i++) {
      if (i > 0) {
        append(separator);
      }
      print(docs.get(i));
    }
    return this;
  }

  /** Increases the indentation level. It takes effect at the next
   * {@link #newLine()}. */
  public DocWriter indent() {
    ++level;
    return this;
  }

  /** Decreases the indentation level. */
  public DocWriter dedent() {
    checkState(level > 0, "cannot dedent below level 0");
    --level;
    return this;
  }

  /** Starts a new line, indented to the current level. */
  public DocWriter newLine() {
    b.append('\n');
    for (int i = 0, n = level * indentSpaces; i < n; i++) {
      b.append(' ');
    }
    return this;
  }

  /** Prints statements on their own lines, one level deeper than the
   * current line. */
  public DocWriter printIndentedBlock(List<? extends Doc.Stmt> stmts) {
    indent();
    for (Doc.Stmt stmt : stmts) {
      newLine();
      print(stmt);
    }
    return dedent();
  }

  /** Returns the current indentation level. */
  public int level() {
    return level;
  }

  /** Returns the number of spaces per indentation level. */
  public int indentSpaces() {
    return indentSpaces;
  }

  /** Returns the number of characters written so far. */
  public int length() {
    return b.length();
  }

  /** Returns the text written so far, without normalization. */
  @Override public String toString() {
    return b.toString();
  }
}

// End DocWriter.java
