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

import static net.hydromatic.lambda.ast.LambdaBuilder.lambda;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.lambda.ast.Constant;
import net.hydromatic.lambda.ast.Info.PointerInfo;
import net.hydromatic.lambda.ast.Info.TagInfo;
import net.hydromatic.lambda.util.BoxWriter;
import org.junit.jupiter.api.Test;

/** Tests for {@link ConstantPrinter}, via
 * {@link Printers#structuredConstant}. */
public class ConstantPrinterTest {
  private static String print(Constant c) {
    return Printers.structuredConstant(c);
  }

  @Test void testIntegers() {
    assertThat(print(lambda.intConst(42)), is("42"));
    assertThat(print(lambda.intConst(-7)), is("-7"));
    assertThat(print(lambda.int32Const(5)), is("5l"));
    assertThat(print(lambda.int64Const(-3)), is("-3L"));
    assertThat(print(lambda.nativeIntConst(7)), is("7n"));
  }

  @Test void testCharsAndStrings() {
    assertThat(print(lambda.charConst('a')), is("'a'"));
    assertThat(print(lambda.charConst('\'')), is("'\\''"));
    assertThat(print(lambda.charConst('\n')), is("'\\n'"));
    assertThat(print(lambda.stringConst("hi")), is("\"hi\""));
    assertThat(print(lambda.stringConst("say \"hi\"")),
        is("\"say \\\"hi\\\"\""));
    assertThat(print(lambda.immString("a")), is("#\"a\""));
  }

  /** A character constant is one byte, and prints as one escape; the same
   * character in a string prints as its UTF-8 bytes. */
  @Test void testNonAsciiChar() {
    assertThat(print(lambda.charConst((char) 0xe9)), is("'\\233'"));
    assertThat(print(lambda.charConst((char) 0xff)), is("'\\255'"));
    assertThat(print(lambda.stringConst(String.valueOf((char) 0xe9))),
        is("\"\\195\\169\""));
    assertThrows(IllegalArgumentException.class,
        () -> lambda.charConst((char) 0x100));
  }

  /** The delimiter of a quoted string does not appear in the output. */
  @Test void testQuotedString() {
    assertThat(print(lambda.stringConst("x|y", "id")), is("\"x|y\""));
  }

  /** A float is printed as the text it was written as. */
  @Test void testFloat() {
    assertThat(print(lambda.floatConst("1.5e3")), is("1.5e3"));
    assertThat(print(lambda.floatConst("0x1p-3")), is("0x1p-3"));
  }

  @Test void testPointers() {
    assertThat(print(lambda.pointer(3)), is("3a"));
    assertThat(print(lambda.unit()), is("0a:unit"));
    assertThat(print(lambda.bool(true)), is("1a:bool"));
    assertThat(print(lambda.bool(false)), is("0a:bool"));
    assertThat(print(lambda.pointer(0, PointerInfo.NIL)), is("0a:nil"));
    assertThat(print(lambda.pointer(0, PointerInfo.con("None"))),
        is("0a:None"));
  }

  /** Hints affect printing but not equality. */
  @Test void testHintsDoNotAffectEquality() {
    assertThat(lambda.pointer(1, PointerInfo.BOOL).equals(lambda.pointer(1)),
        is(true));
    assertThat(
        lambda.block(0, ImmutableList.<Constant>of(), TagInfo.RECORD)
            .equals(lambda.block(0)),
        is(true));
    assertThat(lambda.pointer(1).equals(lambda.pointer(2)), is(false));
  }

  @Test void testBlocks() {
    assertThat(print(lambda.block(0)), is("[0]"));
    assertThat(print(lambda.block(0, lambda.intConst(1), lambda.intConst(2))),
        is("[0: 1 2]"));
    assertThat(
        print(lambda.block(1, ImmutableList.<Constant>of(), TagInfo.RECORD)),
        is("[1:record]"));
    assertThat(
        print(
            lambda.block(0, ImmutableList.of(lambda.stringConst("x")),
                TagInfo.con("Some"))),
        is("[0:con'Some': \"x\"]"));
    assertThat(
        print(
            lambda.block(0, lambda.intConst(1),
                lambda.block(1, lambda.intConst(2)))),
        is("[0: 1 [1: 2]]"));
  }

  @Test void testFloatArrays() {
    assertThat(print(lambda.floatArray(ImmutableList.of())), is("[| |]"));
    assertThat(print(lambda.floatArray(ImmutableList.of("1.", "2.5"))),
        is("[|1. 2.5|]"));
  }

  /** A block that does not fit wraps its fields, indented by one. */
  @Test void testWrap() {
    final Constant c =
        lambda.block(0, lambda.intConst(111), lambda.intConst(222),
            lambda.intConst(333), lambda.intConst(444));
    final BoxWriter w = Printers.structuredConstant(new BoxWriter(10), c);
    assertThat(w, hasToString("[0:\n"
        + " 111 222\n"
        + " 333 444]"));
  }

  @Test void testToString() {
    assertThat(lambda.intConst(1), hasToString("1"));
    assertThat(lambda.block(2, lambda.unit()), hasToString("[2: 0a:unit]"));
  }
}

// End ConstantPrinterTest.java
