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

import net.hydromatic.docprint.doc.Doc;
import net.hydromatic.docprint.doc.Op;

/**
 * Thrown when a printer is asked to print a document node that is not one of
 * the variants it knows.
 *
 * <p>This is never a data error. It means that the document model and the
 * printer are out of step, for instance a node class that was created outside
 * the closed set of variants.
 */
public class UnknownDocException extends RuntimeException
    implements DocPrintException {
  private final Class<? extends Doc> docClass;
  private final Op op;

  public UnknownDocException(Doc doc) {
    super("Do not know how to print " + doc.getClass().getName());
    this.docClass = doc.getClass();
    this.op = requireNonNull(doc.op);
  }

  /** Returns the class of the node that could not be printed. */
  public Class<? extends Doc> docClass() {
    return docClass;
  }

  /** Returns the tag that the node claimed to have. */
  public Op op() {
    return op;
  }

  @Override public String toString() {
    return super.toString() + " (op " + op + ")";
  }
}

// End UnknownDocException.java
