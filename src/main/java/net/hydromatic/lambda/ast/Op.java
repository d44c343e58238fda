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
package net.hydromatic.lambda.ast;

import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link Lambda.Exp}. */
public enum Op {
  // leaves
  VAR,
  CONST,

  // functions
  APPLY("apply"),
  FUNCTION("function"),

  // bindings
  LET("let"),
  LETREC("letrec"),

  PRIM,

  // pattern dispatch
  SWITCH("switch"),
  STRING_SWITCH("stringswitch"),

  // non-local exits
  STATIC_RAISE("exit"),
  STATIC_CATCH("catch"),
  TRY_WITH("try"),

  // control
  IF_THEN_ELSE("if"),
  SEQUENCE("seq"),
  WHILE("while"),
  FOR("for"),
  ASSIGN("assign"),
  SEND("send"),

  // annotations
  EVENT,
  IF_USED("ifused");

  /** Word that follows the opening parenthesis when this kind of expression
   * is printed, for example "let"; null if the word depends on the
   * expression's contents, or if the expression has no parentheses. */
  public final @Nullable String keyword;

  Op() {
    this(null);
  }

  Op(@Nullable String keyword) {
    this.keyword = keyword;
  }

  /** Returns the keyword; throws if this kind of expression has no fixed
   * keyword. */
  public String keyword() {
    if (keyword == null) {
      throw new AssertionError("no keyword for " + this);
    }
    return keyword;
  }
}

// End Op.java
