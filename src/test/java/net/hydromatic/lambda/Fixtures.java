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
package net.hydromatic.lambda;

import static net.hydromatic.lambda.ast.LambdaBuilder.lambda;

import com.google.common.collect.ImmutableList;
import net.hydromatic.lambda.ast.Ident;
import net.hydromatic.lambda.ast.Kinds.ArrayKind;
import net.hydromatic.lambda.ast.Kinds.BigarrayKind;
import net.hydromatic.lambda.ast.Kinds.BigarrayLayout;
import net.hydromatic.lambda.ast.Kinds.BoxedInteger;
import net.hydromatic.lambda.ast.Kinds.CompileTimeConstant;
import net.hydromatic.lambda.ast.Kinds.Direction;
import net.hydromatic.lambda.ast.Kinds.FloatComparison;
import net.hydromatic.lambda.ast.Kinds.ImmediateOrPointer;
import net.hydromatic.lambda.ast.Kinds.Initialization;
import net.hydromatic.lambda.ast.Kinds.IntComparison;
import net.hydromatic.lambda.ast.Kinds.MethKind;
import net.hydromatic.lambda.ast.Kinds.Mutability;
import net.hydromatic.lambda.ast.Kinds.RaiseKind;
import net.hydromatic.lambda.ast.Kinds.Safety;
import net.hydromatic.lambda.ast.Lambda;
import net.hydromatic.lambda.ast.Location;
import net.hydromatic.lambda.ast.Op;
import net.hydromatic.lambda.ast.Prim;
import net.hydromatic.lambda.ast.Primitive;
import net.hydromatic.lambda.ast.RecordRepresentation;
import net.hydromatic.lambda.ast.ValueKind;

/** Sample primitives and expressions for tests. */
public class Fixtures {
  private Fixtures() {}

  /** The "Stdlib" compilation unit. */
  public static final Ident STDLIB = Ident.global("Stdlib");

  /** Returns a primitive with a given tag and fixed, simple parameters.
   *
   * <p>For example, every array operation has element kind "gen", every
   * boxed integer operation has width "int32", and every field access has
   * index 0 or 1. */
  public static Primitive samplePrimitive(Prim prim) {
    final Class<? extends Primitive> shape = prim.shape;
    if (shape == Primitive.Simple.class) {
      return lambda.simple(prim);
    } else if (shape == Primitive.Global.class) {
      return prim == Prim.GETGLOBAL
          ? lambda.getGlobal(STDLIB)
          : lambda.setGlobal(STDLIB);
    } else if (shape == Primitive.MakeBlock.class) {
      return lambda.makeBlock(0);
    } else if (shape == Primitive.Field.class) {
      return lambda.field(0);
    } else if (shape == Primitive.SetField.class) {
      return lambda.setField(1, ImmediateOrPointer.POINTER,
          Initialization.ASSIGNMENT);
    } else if (shape == Primitive.SetFieldComputed.class) {
      return lambda.setFieldComputed(ImmediateOrPointer.IMMEDIATE,
          Initialization.ASSIGNMENT);
    } else if (shape == Primitive.Indexed.class) {
      return lambda.indexed(prim, 1);
    } else if (shape == Primitive.SetFloatField.class) {
      return lambda.setFloatField(0, Initialization.ASSIGNMENT);
    } else if (shape == Primitive.DupRecord.class) {
      return lambda.dupRecord(RecordRepresentation.REGULAR, 2);
    } else if (shape == Primitive.CCall.class) {
      return lambda.cCall("caml_foo", 1, true, null);
    } else if (shape == Primitive.Raise.class) {
      return lambda.raise(RaiseKind.REGULAR);
    } else if (shape == Primitive.Checked.class) {
      return lambda.checked(prim, Safety.SAFE);
    } else if (shape == Primitive.IntComp.class) {
      return lambda.intComp(IntComparison.LT);
    } else if (shape == Primitive.FloatComp.class) {
      return lambda.floatComp(FloatComparison.LT);
    } else if (shape == Primitive.ArrayOp.class) {
      return lambda.arrayOp(prim, ArrayKind.GENERIC);
    } else if (shape == Primitive.MakeArray.class) {
      return lambda.makeArray(prim, ArrayKind.GENERIC, Mutability.MUTABLE);
    } else if (shape == Primitive.CtConst.class) {
      return lambda.ctConst(CompileTimeConstant.WORD_SIZE);
    } else if (shape == Primitive.BoxedIntOp.class) {
      return lambda.boxedIntOp(prim, BoxedInteger.INT32);
    } else if (shape == Primitive.CvtBint.class) {
      return lambda.cvtBint(BoxedInteger.INT32, BoxedInteger.INT64);
    } else if (shape == Primitive.BintComp.class) {
      return lambda.bintComp(BoxedInteger.INT64, IntComparison.EQ);
    } else if (shape == Primitive.Bigarray.class) {
      return lambda.bigarray(prim, false, 1, BigarrayKind.FLOAT64,
          BigarrayLayout.C);
    } else if (shape == Primitive.Unaligned.class) {
      return lambda.unaligned(prim, false);
    } else if (shape == Primitive.AtomicLoad.class) {
      return lambda.atomicLoad(ImmediateOrPointer.POINTER);
    } else {
      throw new AssertionError("unknown shape " + shape);
    }
  }

  /** Returns a small expression of a given kind, whose sub-expressions are
   * variables "x" and "f" and the constant 1. */
  public static Lambda.Exp sampleExp(Op op) {
    final Ident x = Ident.of("x");
    final Ident f = Ident.of("f");
    final Lambda.Exp xVar = lambda.var(x);
    final Lambda.Exp one = lambda.constant(lambda.intConst(1));
    switch (op) {
    case VAR:
      return xVar;
    case CONST:
      return one;
    case APPLY:
      return lambda.apply(lambda.var(f), xVar);
    case FUNCTION:
      return lambda.function(ImmutableList.of(x), xVar);
    case LET:
      return lambda.let(x, one, xVar);
    case LETREC:
      return lambda.letRec(
          ImmutableList.of(
              lambda.binding(f,
                  lambda.function(ImmutableList.of(x), xVar))),
          lambda.apply(lambda.var(f), one));
    case PRIM:
      return lambda.prim(lambda.simple(Prim.ADDINT), xVar, one);
    case SWITCH:
      return lambda.switch_(xVar, ImmutableList.of(lambda.intCase(0, one)),
          ImmutableList.of(), null);
    case STRING_SWITCH:
      return lambda.stringSwitch(xVar,
          ImmutableList.of(lambda.stringCase("a", one)), null);
    case STATIC_RAISE:
      return lambda.staticRaise(1, ImmutableList.of(xVar));
    case STATIC_CATCH:
      return lambda.staticCatch(lambda.staticRaise(1, ImmutableList.of(one)),
          1, ImmutableList.of(lambda.param(x, ValueKind.INT)), xVar);
    case TRY_WITH:
      return lambda.tryWith(lambda.apply(lambda.var(f), one), x, xVar);
    case IF_THEN_ELSE:
      return lambda.ifThenElse(xVar, one, xVar);
    case SEQUENCE:
      return lambda.seq(xVar, one);
    case WHILE:
      return lambda.while_(xVar, one);
    case FOR:
      return lambda.for_(x, one, one, Direction.UPTO, one);
    case ASSIGN:
      return lambda.assign(x, one);
    case SEND:
      return lambda.send(MethKind.PUBLIC, xVar, lambda.var(f),
          ImmutableList.of(one));
    case EVENT:
      return lambda.event(xVar, Lambda.EventKind.AFTER,
          Location.of("a.ml", 1, 0, 5));
    case IF_USED:
      return lambda.ifUsed(x, one);
    default:
      throw new AssertionError("unknown op " + op);
    }
  }
}

// End Fixtures.java
