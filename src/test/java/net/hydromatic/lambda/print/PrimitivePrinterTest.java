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

import static net.hydromatic.lambda.Fixtures.STDLIB;
import static net.hydromatic.lambda.Fixtures.samplePrimitive;
import static net.hydromatic.lambda.ast.LambdaBuilder.lambda;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.emptyString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.Set;
import net.hydromatic.lambda.ast.Info.FieldInfo;
import net.hydromatic.lambda.ast.Kinds.ArrayKind;
import net.hydromatic.lambda.ast.Kinds.BigarrayKind;
import net.hydromatic.lambda.ast.Kinds.BigarrayLayout;
import net.hydromatic.lambda.ast.Kinds.BoxedInteger;
import net.hydromatic.lambda.ast.Kinds.ImmediateOrPointer;
import net.hydromatic.lambda.ast.Kinds.Initialization;
import net.hydromatic.lambda.ast.Kinds.IntComparison;
import net.hydromatic.lambda.ast.Kinds.Mutability;
import net.hydromatic.lambda.ast.Kinds.RaiseKind;
import net.hydromatic.lambda.ast.Kinds.Safety;
import net.hydromatic.lambda.ast.Prim;
import net.hydromatic.lambda.ast.Primitive;
import net.hydromatic.lambda.ast.RecordRepresentation;
import net.hydromatic.lambda.ast.ValueKind;
import net.hydromatic.lambda.util.BoxWriter;
import org.junit.jupiter.api.Test;

/** Tests for {@link PrimitivePrinter}. */
public class PrimitivePrinterTest {
  private static String token(Primitive p) {
    return Printers.primitive(p);
  }

  /** Every tag has a non-empty token and a canonical name. */
  @Test void testEveryPrim() {
    for (Prim prim : Prim.values()) {
      final Primitive p = samplePrimitive(prim);
      assertThat(p.prim, is(prim));
      assertThat(token(p), not(emptyString()));
      assertThat(Printers.nameOfPrimitive(p), is(prim.canonicalName));
      assertThat(Printers.nameOfPrimitive(p), startsWith("P"));
    }
  }

  @Test void testCanonicalNamesAreDistinct() {
    final Set<String> names = new HashSet<>();
    for (Prim prim : Prim.values()) {
      names.add(Printers.nameOfPrimitive(samplePrimitive(prim)));
    }
    assertThat(names, hasSize(Prim.values().length));
    assertThat(Prim.BY_CANONICAL_NAME.size(), is(Prim.values().length));
  }

  /** The canonical name depends on the tag, not the parameters, whereas
   * the display token depends on both. */
  @Test void testCanonicalNameIgnoresParameters() {
    final Primitive f0 = lambda.field(0);
    final Primitive f1 =
        lambda.field(5, ImmediateOrPointer.IMMEDIATE, Mutability.MUTABLE,
            FieldInfo.record("x"));
    assertThat(Printers.nameOfPrimitive(f0), is("Pfield"));
    assertThat(Printers.nameOfPrimitive(f1), is("Pfield"));
    assertThat(token(f0), not(is(token(f1))));

    assertThat(Printers.nameOfPrimitive(lambda.makeBlock(0)),
        is("Pmakeblock"));
    assertThat(
        Printers.nameOfPrimitive(
            lambda.makeBlock(3, Mutability.MUTABLE, null)),
        is("Pmakeblock"));
    assertThat(
        Printers.nameOfPrimitive(
            lambda.atomicLoad(ImmediateOrPointer.IMMEDIATE)),
        is("Patomic_load"));
  }

  @Test void testSimple() {
    assertThat(token(lambda.simple(Prim.ADDINT)), is("+"));
    assertThat(token(lambda.simple(Prim.ADDFLOAT)), is("+."));
    assertThat(token(lambda.simple(Prim.STRINGREFU)),
        is("string.unsafe_get"));
    assertThat(token(lambda.simple(Prim.ATOMIC_CAS)), is("atomic_cas"));
    assertThat(token(lambda.simple(Prim.POLL)), is("poll"));
    assertThat(token(lambda.simple(Prim.SEQUAND)), is("&&"));
    assertThat(token(lambda.intComp(IntComparison.LT)), is("<"));
  }

  @Test void testBlocks() {
    assertThat(token(lambda.makeBlock(0)), is("makeblock 0"));
    assertThat(
        token(
            lambda.makeBlock(1, Mutability.MUTABLE,
                ImmutableList.of(ValueKind.INT, ValueKind.GENERIC))),
        is("makemutable 1 (int,*)"));
    assertThat(
        token(
            lambda.makeBlock(0, Mutability.IMMUTABLE,
                ImmutableList.of(ValueKind.GENERIC))),
        is("makeblock 0"));
    assertThat(
        token(
            lambda.field(2, ImmediateOrPointer.IMMEDIATE,
                Mutability.IMMUTABLE, FieldInfo.NONE)),
        is("field_int 2"));
    assertThat(
        token(
            lambda.field(3, ImmediateOrPointer.POINTER, Mutability.MUTABLE,
                FieldInfo.record("x"))),
        is("field_mut:record(x) 3"));
    assertThat(
        token(
            lambda.field(0, ImmediateOrPointer.POINTER, Mutability.IMMUTABLE,
                FieldInfo.CONS)),
        is("field_imm:cons0"));
    assertThat(
        token(
            lambda.field(1, ImmediateOrPointer.POINTER, Mutability.IMMUTABLE,
                FieldInfo.CON)),
        is("field_imm:con1"));
    assertThat(
        token(
            lambda.setField(0, ImmediateOrPointer.IMMEDIATE,
                Initialization.HEAP_INITIALIZATION)),
        is("setfield_imm(heap-init) 0"));
    assertThat(
        token(
            lambda.setFieldComputed(ImmediateOrPointer.POINTER,
                Initialization.ROOT_INITIALIZATION)),
        is("setfield_ptr(root-init)_computed"));
    assertThat(
        token(lambda.setFloatField(2, Initialization.HEAP_INITIALIZATION)),
        is("setfloatfield(heap-init) 2"));
    assertThat(token(lambda.floatField(4)), is("floatfield 4"));
    assertThat(
        token(lambda.dupRecord(RecordRepresentation.inlined(3), 4)),
        is("duprecord inlined(3) 4"));
    assertThat(token(lambda.getGlobal(STDLIB)),
        is("global Stdlib!"));
  }

  @Test void testSafety() {
    assertThat(token(lambda.checked(Prim.DIVINT, Safety.SAFE)), is("/"));
    assertThat(token(lambda.checked(Prim.DIVINT, Safety.UNSAFE)), is("/u"));
    assertThat(token(lambda.checked(Prim.MODINT, Safety.UNSAFE)),
        is("mod_unsafe"));
    assertThat(
        token(
            lambda.boxedIntOp(Prim.DIVBINT, BoxedInteger.NATIVEINT,
                Safety.UNSAFE)),
        is("Nativeint.div_unsafe"));
    assertThat(
        token(lambda.boxedIntOp(Prim.MODBINT, BoxedInteger.INT64)),
        is("Int64.mod"));
    assertThrows(IllegalArgumentException.class,
        () -> lambda.boxedIntOp(Prim.ADDBINT, BoxedInteger.INT64,
            Safety.UNSAFE));
  }

  @Test void testArrays() {
    assertThat(
        token(
            lambda.makeArray(Prim.MAKEARRAY, ArrayKind.FLOAT,
                Mutability.IMMUTABLE)),
        is("makearray_imm[float]"));
    assertThat(
        token(
            lambda.makeArray(Prim.DUPARRAY, ArrayKind.INT,
                Mutability.MUTABLE)),
        is("duparray[int]"));
    assertThat(token(lambda.arrayOp(Prim.ARRAYREFS, ArrayKind.ADDR)),
        is("array.get[addr]"));
    assertThat(token(lambda.arrayOp(Prim.ARRAYLENGTH, ArrayKind.INT)),
        is("array.length[int]"));
  }

  @Test void testBoxedIntegers() {
    assertThat(token(lambda.boxedIntOp(Prim.ADDBINT, BoxedInteger.INT32)),
        is("Int32.add"));
    assertThat(token(lambda.boxedIntOp(Prim.BBSWAP, BoxedInteger.INT64)),
        is("Int64.bswap"));
    assertThat(
        token(lambda.cvtBint(BoxedInteger.NATIVEINT, BoxedInteger.INT32)),
        is("int32_of_nativeint"));
    assertThat(
        token(lambda.bintComp(BoxedInteger.INT32, IntComparison.GE)),
        is("Int32.>="));
  }

  @Test void testBigarraysAndUnaligned() {
    assertThat(
        token(
            lambda.bigarray(Prim.BIGARRAYREF, true, 2, BigarrayKind.UNKNOWN,
                BigarrayLayout.UNKNOWN)),
        is("Bigarray.unsafe_get[generic,unknown]"));
    assertThat(
        token(
            lambda.bigarray(Prim.BIGARRAYSET, false, 1, BigarrayKind.UINT8,
                BigarrayLayout.FORTRAN)),
        is("Bigarray.set[uint8,Fortran]"));
    assertThat(token(lambda.indexed(Prim.BIGARRAYDIM, 2)),
        is("Bigarray.dim_2"));
    assertThat(token(lambda.unaligned(Prim.BIGSTRING_SET_64, true)),
        is("bigarray.array1.unsafe_set64"));
    assertThat(token(lambda.unaligned(Prim.STRING_LOAD_16, false)),
        is("string.get16"));
  }

  @Test void testMiscellaneous() {
    assertThat(token(lambda.raise(RaiseKind.RERAISE)), is("reraise"));
    assertThat(token(lambda.atomicLoad(ImmediateOrPointer.IMMEDIATE)),
        is("atomic_load_imm"));
    assertThat(token(lambda.cCall("caml_add", 2, false, "caml_add_native")),
        is("caml_add"));
    assertThat(token(lambda.indexed(Prim.OFFSETINT, -1)), is("-1+"));
    assertThat(token(lambda.indexed(Prim.OFFSETREF, 2)), is("+:=2"));
  }

  /** A primitive's constructor rejects a tag whose parameters have another
   * shape. */
  @Test void testWrongShape() {
    assertThrows(IllegalArgumentException.class,
        () -> lambda.simple(Prim.FIELD));
    assertThrows(IllegalArgumentException.class,
        () -> lambda.indexed(Prim.ADDINT, 1));
    assertThrows(IllegalArgumentException.class,
        () -> lambda.checked(Prim.ADDINT, Safety.SAFE));
    assertThrows(IllegalArgumentException.class,
        () -> lambda.arrayOp(Prim.MAKEARRAY, ArrayKind.GENERIC));
  }

  @Test void testWriter() {
    final BoxWriter w = new BoxWriter();
    Printers.primitive(w, lambda.makeBlock(0)).append(" ");
    Printers.nameOfPrimitive(w, lambda.makeBlock(0));
    assertThat(w, hasToString("makeblock 0 Pmakeblock"));
    assertThat(lambda.simple(Prim.NOT), hasToString("not"));
  }
}

// End PrimitivePrinterTest.java
