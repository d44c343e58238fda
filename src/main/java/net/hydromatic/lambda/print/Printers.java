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
package net.hydromatic.lambda.print;

import net.hydromatic.lambda.ast.Constant;
import net.hydromatic.lambda.ast.Lambda;
import net.hydromatic.lambda.ast.Primitive;
import net.hydromatic.lambda.util.BoxWriter;

/**
 * Utilities for printing constants, primitives and lambda expressions.
 *
 * <p>Each method that takes a {@link BoxWriter} writes to it and returns it;
 * call {@link BoxWriter#toString()} to lay out the text. The other methods
 * return the text laid out without a limit on line width.
 *
 * <p>The methods hold no state, and may be called from several threads at
 * once, provided that each thread uses its own writer.
 */
public class Printers {
  private Printers() {}

  /** Prints a structured constant. */
  public static BoxWriter structuredConstant(BoxWriter w,
      Constant constant) {
    return ConstantPrinter.print(w, constant);
  }

  /** Converts a structured constant to text, for example "[0: 1 2]". */
  public static String structuredConstant(Constant constant) {
    return structuredConstant(new BoxWriter(), constant).toString();
  }

  /** Prints the display token of a primitive. */
  public static BoxWriter primitive(BoxWriter w, Primitive primitive) {
    return PrimitivePrinter.print(w, primitive);
  }

  /** Returns the display token of a primitive, for example
   * "makeblock 0". */
  public static String primitive(Primitive primitive) {
    return PrimitivePrinter.token(primitive);
  }

  /** Prints the canonical name of a primitive. */
  public static BoxWriter nameOfPrimitive(BoxWriter w, Primitive primitive) {
    return w.append(PrimitivePrinter.canonicalName(primitive));
  }

  /** Returns the canonical name of a primitive, for example "Pmakeblock".
   * Primitives with the same tag and different parameters have the same
   * canonical name. */
  public static String nameOfPrimitive(Primitive primitive) {
    return PrimitivePrinter.canonicalName(primitive);
  }

  /** Prints a lambda expression. */
  public static BoxWriter lambda(BoxWriter w, Lambda.Exp exp) {
    return new LambdaPrinter(w).print(exp);
  }

  /** Converts a lambda expression to text. */
  public static String lambda(Lambda.Exp exp) {
    return lambda(new BoxWriter(), exp).toString();
  }

  /** Prints a program. The output is the same as for the program's code. */
  public static BoxWriter program(BoxWriter w, Lambda.Program program) {
    return lambda(w, program.code);
  }

  /** Converts a program to text. */
  public static String program(Lambda.Program program) {
    return program(new BoxWriter(), program).toString();
  }
}

// End Printers.java
