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

import net.hydromatic.docprint.doc.Doc;

/**
 * Rendering rules of a concrete syntax.
 *
 * <p>A backend implements one method per variant of {@link Doc}. The
 * {@link DocPrinter} decides which method to call; each method writes its
 * node to the {@link DocWriter} and calls {@link DocWriter#print} for the
 * node's children.
 *
 * <p>Rules should hold no state of their own; everything that belongs to a
 * render session lives in the writer. A rule must not modify the node.
 */
public interface DocRules {
  // expressions

  void printLiteral(DocWriter w, Doc.Literal literal);

  void printId(DocWriter w, Doc.Id id);

  void printAttrAccess(DocWriter w, Doc.AttrAccess attrAccess);

  void printIndex(DocWriter w, Doc.Index index);

  void printOperation(DocWriter w, Doc.Operation operation);

  void printCall(DocWriter w, Doc.Call call);

  void printLambda(DocWriter w, Doc.Lambda lambda);

  void printList(DocWriter w, Doc.ListDoc list);

  void printTuple(DocWriter w, Doc.Tuple tuple);

  void printDict(DocWriter w, Doc.Dict dict);

  void printSlice(DocWriter w, Doc.Slice slice);

  // statements

  /** Prints a block of statements. The rule is responsible for separating
   * the statements. */
  void printStmtBlock(DocWriter w, Doc.StmtBlock stmtBlock);

  void printAssign(DocWriter w, Doc.Assign assign);

  void printIf(DocWriter w, Doc.If anIf);

  void printWhile(DocWriter w, Doc.While aWhile);

  void printFor(DocWriter w, Doc.For aFor);

  void printScope(DocWriter w, Doc.Scope scope);

  void printExprStmt(DocWriter w, Doc.ExprStmt exprStmt);

  void printAssert(DocWriter w, Doc.Assert anAssert);

  void printReturn(DocWriter w, Doc.Return aReturn);

  void printFunction(DocWriter w, Doc.Function function);

  void printClass(DocWriter w, Doc.ClassDoc classDoc);
}

// End DocRules.java
