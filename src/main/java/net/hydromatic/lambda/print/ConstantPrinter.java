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

import static net.hydromatic.lambda.util.Escapes.escapeChar;
import static net.hydromatic.lambda.util.Escapes.escapeString;

import net.hydromatic.lambda.ast.Constant;
import net.hydromatic.lambda.util.BoxWriter;

/** Prints structured constants. */
class ConstantPrinter {
  private ConstantPrinter() {}

  /** Prints a constant. */
  static BoxWriter print(BoxWriter w, Constant constant) {
    switch (constant.kind) {
    case INT:
    case INT32:
    case INT64:
    case NATIVEINT:
    case CHAR:
    case STRING:
    case IMMSTRING:
    case FLOAT:
      return w.append(literal((Constant.Literal) constant));

    case POINTER:
      final Constant.Pointer pointer = (Constant.Pointer) constant;
      return w.append(pointer.value)
          .append("a")
          .append(Descriptors.pointerInfo(pointer.info));

    case BLOCK:
      final Constant.Block block = (Constant.Block) constant;
      if (block.fields.isEmpty()) {
        return w.append("[")
            .append(block.tag)
            .append(Descriptors.tagInfo(block.info))
            .append("]");
      }
      w.box(1)
          .append("[")
          .append(block.tag)
          .append(Descriptors.tagInfo(block.info))
          .append(":")
          .space()
          .box(0);
      for (int i = 0; i < block.fields.size(); i++) {
        if (i > 0) {
          w.space();
        }
        print(w, block.fields.get(i));
      }
      return w.close().append("]").close();

    case FLOAT_ARRAY:
      final Constant.FloatArray floatArray = (Constant.FloatArray) constant;
      if (floatArray.values.isEmpty()) {
        return w.append("[| |]");
      }
      w.box(1).append("[|").box(0);
      for (int i = 0; i < floatArray.values.size(); i++) {
        if (i > 0) {
          w.space();
        }
        w.append(floatArray.values.get(i));
      }
      return w.close().append("|]").close();

    default:
      throw new AssertionError("unknown constant kind " + constant.kind);
    }
  }

  /** Converts a scalar constant to its literal text. */
  static String literal(Constant.Literal literal) {
    switch (literal.kind) {
    case INT:
      return literal.value.toString();
    case INT32:
      return literal.value + "l";
    case INT64:
      return literal.value + "L";
    case NATIVEINT:
      return literal.value + "n";
    case CHAR:
      return "'" + escapeChar((Character) literal.value) + "'";
    case STRING:
      return "\"" + escapeString(literal.stringValue()) + "\"";
    case IMMSTRING:
      return "#\"" + escapeString(literal.stringValue()) + "\"";
    case FLOAT:
      return literal.stringValue();
    default:
      throw new AssertionError("not a literal: " + literal.kind);
    }
  }
}

// End ConstantPrinter.java
