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

/**
 * Small closed enumerations that parameterize primitives and expressions.
 *
 * <p>This class functions as a namespace. The tokens that represent each
 * value in printed output are not here; see
 * {@link net.hydromatic.lambda.print.Descriptors}.
 */
public class Kinds {
  private Kinds() {}

  /** Width of a boxed integer. */
  public enum BoxedInteger {
    NATIVEINT,
    INT32,
    INT64
  }

  /** Comparison between two tagged integers. */
  public enum IntComparison {
    EQ,
    NE,
    LT,
    LE,
    GT,
    GE
  }

  /** Comparison between two floats.
   *
   * <p>The negated forms ({@code NLT} etc.) are true if either argument is
   * NaN, so they are not equivalent to the opposite comparison. */
  public enum FloatComparison {
    EQ,
    NEQ,
    LT,
    NLT,
    LE,
    NLE,
    GT,
    NGT,
    GE,
    NGE
  }

  /** Element representation of an array. */
  public enum ArrayKind {
    /** Not known statically; may hold floats. */
    GENERIC,
    /** Pointers, never floats. */
    ADDR,
    INT,
    FLOAT
  }

  /** Element kind of a bigarray. */
  public enum BigarrayKind {
    UNKNOWN,
    FLOAT32,
    FLOAT64,
    SINT8,
    UINT8,
    SINT16,
    UINT16,
    INT32,
    INT64,
    CAML_INT,
    NATIVE_INT,
    COMPLEX32,
    COMPLEX64
  }

  /** Memory layout of a bigarray. */
  public enum BigarrayLayout {
    UNKNOWN,
    /** Row-major. */
    C,
    /** Column-major. */
    FORTRAN
  }

  /** Whether a block or array may be updated after it is created. */
  public enum Mutability {
    IMMUTABLE,
    MUTABLE
  }

  /** Whether a value is known to be an immediate (unboxed) value. */
  public enum ImmediateOrPointer {
    IMMEDIATE,
    POINTER
  }

  /** How a field store relates to the garbage collector. */
  public enum Initialization {
    HEAP_INITIALIZATION,
    ROOT_INITIALIZATION,
    ASSIGNMENT
  }

  /** Whether an operation checks its arguments (for example, for division
   * by zero). */
  public enum Safety {
    SAFE,
    UNSAFE
  }

  /** Values that are constant for a given target, known at compile time. */
  public enum CompileTimeConstant {
    BIG_ENDIAN,
    WORD_SIZE,
    INT_SIZE,
    MAX_WOSIZE,
    OSTYPE_UNIX,
    OSTYPE_WIN32,
    OSTYPE_CYGWIN,
    BACKEND_TYPE
  }

  /** Flavor of exception raise. */
  public enum RaiseKind {
    REGULAR,
    RERAISE,
    NOTRACE
  }

  /** Evaluation strategy of a non-recursive binding. */
  public enum LetKind {
    /** The bound expression is pure and may be substituted. */
    ALIAS,
    STRICT,
    /** Strict, but may be removed if the variable is unused. */
    STRICT_OPT,
    /** The variable is mutable, via
     * {@link net.hydromatic.lambda.ast.Lambda.Assign}. */
    VARIABLE
  }

  /** Calling convention of a function. */
  public enum FunctionKind {
    CURRIED,
    TUPLED
  }

  /** Direction of a {@code for} loop. */
  public enum Direction {
    UPTO,
    DOWNTO
  }

  /** Kind of method dispatch. */
  public enum MethKind {
    SELF,
    PUBLIC,
    CACHED
  }

  /** Whether to specialize a function at its call sites. */
  public enum SpecialiseAttribute {
    DEFAULT,
    ALWAYS,
    NEVER
  }

  /** Whether to compile a function as a local jump target. */
  public enum LocalAttribute {
    DEFAULT,
    ALWAYS,
    NEVER
  }
}

// End Kinds.java
