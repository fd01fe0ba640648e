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

import com.google.common.base.CaseFormat;

/**
 * Sub-types of {@link Doc}.
 *
 * <p>Each value corresponds to exactly one variant class, given by {@link
 * #docClass}. The set is closed; a printer must handle every value.
 */
public enum Op {
  // expressions
  LITERAL(Doc.Literal.class),
  ID(Doc.Id.class),
  ATTR_ACCESS(Doc.AttrAccess.class),
  INDEX(Doc.Index.class),
  OPERATION(Doc.Operation.class),
  CALL(Doc.Call.class),
  LAMBDA(Doc.Lambda.class),
  LIST(Doc.ListDoc.class),
  TUPLE(Doc.Tuple.class),
  DICT(Doc.Dict.class),
  SLICE(Doc.Slice.class),

  // statements
  STMT_BLOCK(Doc.StmtBlock.class),
  ASSIGN(Doc.Assign.class),
  IF(Doc.If.class),
  WHILE(Doc.While.class),
  FOR(Doc.For.class),
  SCOPE(Doc.Scope.class),
  EXPR_STMT(Doc.ExprStmt.class),
  ASSERT(Doc.Assert.class),
  RETURN(Doc.Return.class),
  FUNCTION(Doc.Function.class),
  CLASS(Doc.ClassDoc.class);

  /** The variant class whose instances carry this tag. */
  public final Class<? extends Doc> docClass;

  Op(Class<? extends Doc> docClass) {
    this.docClass = docClass;
  }

  /** Returns whether this is the tag of a statement. */
  public boolean isStmt() {
    return Doc.Stmt.class.isAssignableFrom(docClass);
  }

  /** Converts the name to lower camel case; e.g. "attrAccess". */
  public String lowerName() {
    return CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.LOWER_CAMEL, name());
  }
}

// End Op.java
