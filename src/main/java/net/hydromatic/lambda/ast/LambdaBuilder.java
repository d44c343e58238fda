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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.List;
import net.hydromatic.lambda.ast.Info.FieldInfo;
import net.hydromatic.lambda.ast.Info.MatchInfo;
import net.hydromatic.lambda.ast.Info.PointerInfo;
import net.hydromatic.lambda.ast.Info.TagInfo;
import net.hydromatic.lambda.ast.Kinds.ArrayKind;
import net.hydromatic.lambda.ast.Kinds.BigarrayKind;
import net.hydromatic.lambda.ast.Kinds.BigarrayLayout;
import net.hydromatic.lambda.ast.Kinds.BoxedInteger;
import net.hydromatic.lambda.ast.Kinds.CompileTimeConstant;
import net.hydromatic.lambda.ast.Kinds.Direction;
import net.hydromatic.lambda.ast.Kinds.FloatComparison;
import net.hydromatic.lambda.ast.Kinds.FunctionKind;
import net.hydromatic.lambda.ast.Kinds.ImmediateOrPointer;
import net.hydromatic.lambda.ast.Kinds.Initialization;
import net.hydromatic.lambda.ast.Kinds.IntComparison;
import net.hydromatic.lambda.ast.Kinds.LetKind;
import net.hydromatic.lambda.ast.Kinds.MethKind;
import net.hydromatic.lambda.ast.Kinds.Mutability;
import net.hydromatic.lambda.ast.Kinds.RaiseKind;
import net.hydromatic.lambda.ast.Kinds.Safety;
import net.hydromatic.lambda.ast.Kinds.SpecialiseAttribute;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds lambda expressions, constants and primitives. */
public enum LambdaBuilder {
  /** The singleton instance of the lambda builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  lambda;

  private final Constant.Pointer unitPointer =
      new Constant.Pointer(0, PointerInfo.UNIT);

  // Constants

  /** Creates an {@code int} constant. */
  public Constant.Literal intConst(long value) {
    return new Constant.Literal(Constant.Kind.INT, value, null);
  }

  /** Creates a {@code char} constant. The character must be in the range 0
   * to 255. */
  public Constant.Literal charConst(char value) {
    return new Constant.Literal(Constant.Kind.CHAR, value, null);
  }

  /** Creates a string constant. */
  public Constant.Literal stringConst(String value) {
    return new Constant.Literal(Constant.Kind.STRING, value, null);
  }

  /** Creates a quoted string constant, such as {@code {id|text|id}}. */
  public Constant.Literal stringConst(String value, String delimiter) {
    return new Constant.Literal(Constant.Kind.STRING, value, delimiter);
  }

  /** Creates an immutable, shared string constant. */
  public Constant.Literal immString(String value) {
    return new Constant.Literal(Constant.Kind.IMMSTRING, value, null);
  }

  /** Creates a float constant from its source text. */
  public Constant.Literal floatConst(String text) {
    return new Constant.Literal(Constant.Kind.FLOAT, text, null);
  }

  /** Creates an {@code int32} constant. */
  public Constant.Literal int32Const(int value) {
    return new Constant.Literal(Constant.Kind.INT32, value, null);
  }

  /** Creates an {@code int64} constant. */
  public Constant.Literal int64Const(long value) {
    return new Constant.Literal(Constant.Kind.INT64, value, null);
  }

  /** Creates a {@code nativeint} constant. */
  public Constant.Literal nativeIntConst(long value) {
    return new Constant.Literal(Constant.Kind.NATIVEINT, value, null);
  }

  /** Creates a pointer-like immediate without a hint. */
  public Constant.Pointer pointer(int value) {
    return new Constant.Pointer(value, PointerInfo.NONE);
  }

  /** Creates a pointer-like immediate. */
  public Constant.Pointer pointer(int value, PointerInfo info) {
    return new Constant.Pointer(value, info);
  }

  /** Creates the unit value, {@code 0a:unit}. */
  public Constant.Pointer unit() {
    return unitPointer;
  }

  /** Creates a boolean, {@code 0a:bool} or {@code 1a:bool}. */
  public Constant.Pointer bool(boolean b) {
    return new Constant.Pointer(b ? 1 : 0, PointerInfo.BOOL);
  }

  /** Creates a block constant without a hint. */
  public Constant.Block block(int tag, Iterable<? extends Constant> fields) {
    return block(tag, fields, TagInfo.NONE);
  }

  /** Creates a block constant without a hint. */
  public Constant.Block block(int tag, Constant... fields) {
    return block(tag, ImmutableList.copyOf(fields), TagInfo.NONE);
  }

  /** Creates a block constant. */
  public Constant.Block block(int tag, Iterable<? extends Constant> fields,
      TagInfo info) {
    return new Constant.Block(tag, ImmutableList.copyOf(fields), info);
  }

  /** Creates an array of unboxed floats, each given as source text. */
  public Constant.FloatArray floatArray(Iterable<String> values) {
    return new Constant.FloatArray(ImmutableList.copyOf(values));
  }

  // Primitives

  /** Creates a primitive that has no parameters. */
  public Primitive.Simple simple(Prim prim) {
    return new Primitive.Simple(prim);
  }

  /** Creates a read of the slot of a global. */
  public Primitive.Global getGlobal(Ident id) {
    return new Primitive.Global(Prim.GETGLOBAL, id);
  }

  /** Creates a write of the slot of a global. */
  public Primitive.Global setGlobal(Ident id) {
    return new Primitive.Global(Prim.SETGLOBAL, id);
  }

  /** Creates an allocation of an immutable block whose field kinds are
   * not known. */
  public Primitive.MakeBlock makeBlock(int tag) {
    return new Primitive.MakeBlock(tag, Mutability.IMMUTABLE, null);
  }

  /** Creates an allocation of a block. */
  public Primitive.MakeBlock makeBlock(int tag, Mutability mutability,
      @Nullable Iterable<ValueKind> shape) {
    return new Primitive.MakeBlock(tag, mutability,
        shape == null ? null : ImmutableList.copyOf(shape));
  }

  /** Creates a read of an immutable pointer field. */
  public Primitive.Field field(int index) {
    return new Primitive.Field(index, ImmediateOrPointer.POINTER,
        Mutability.IMMUTABLE, FieldInfo.NONE);
  }

  /** Creates a read of a field. */
  public Primitive.Field field(int index,
      ImmediateOrPointer immediateOrPointer, Mutability mutability,
      FieldInfo info) {
    return new Primitive.Field(index, immediateOrPointer, mutability, info);
  }

  /** Creates a write of a field. */
  public Primitive.SetField setField(int index,
      ImmediateOrPointer immediateOrPointer, Initialization initialization) {
    return new Primitive.SetField(index, immediateOrPointer, initialization);
  }

  /** Creates a write of a field whose index is an argument. */
  public Primitive.SetFieldComputed setFieldComputed(
      ImmediateOrPointer immediateOrPointer, Initialization initialization) {
    return new Primitive.SetFieldComputed(immediateOrPointer,
        initialization);
  }

  /** Creates a read of an unboxed float field. */
  public Primitive.Indexed floatField(int index) {
    return new Primitive.Indexed(Prim.FLOATFIELD, index);
  }

  /** Creates a write of an unboxed float field. */
  public Primitive.SetFloatField setFloatField(int index,
      Initialization initialization) {
    return new Primitive.SetFloatField(index, initialization);
  }

  /** Creates a shallow copy of a record. */
  public Primitive.DupRecord dupRecord(RecordRepresentation representation,
      int size) {
    return new Primitive.DupRecord(representation, size);
  }

  /** Creates a call to an external function. */
  public Primitive.CCall cCall(String name, int arity, boolean alloc,
      @Nullable String nativeName) {
    return new Primitive.CCall(name, arity, alloc, nativeName);
  }

  /** Creates a raise of an exception. */
  public Primitive.Raise raise(RaiseKind raiseKind) {
    return new Primitive.Raise(raiseKind);
  }

  /** Creates an integer division or modulo. */
  public Primitive.Checked checked(Prim prim, Safety safety) {
    return new Primitive.Checked(prim, safety);
  }

  /** Creates a comparison of tagged integers. */
  public Primitive.IntComp intComp(IntComparison comparison) {
    return new Primitive.IntComp(comparison);
  }

  /** Creates a comparison of floats. */
  public Primitive.FloatComp floatComp(FloatComparison comparison) {
    return new Primitive.FloatComp(comparison);
  }

  /** Creates a primitive with one integer parameter, such as
   * {@link Prim#OFFSETINT}. */
  public Primitive.Indexed indexed(Prim prim, int n) {
    return new Primitive.Indexed(prim, n);
  }

  /** Creates an array operation. */
  public Primitive.ArrayOp arrayOp(Prim prim, ArrayKind arrayKind) {
    return new Primitive.ArrayOp(prim, arrayKind);
  }

  /** Creates an array creation ({@link Prim#MAKEARRAY}) or copy
   * ({@link Prim#DUPARRAY}). */
  public Primitive.MakeArray makeArray(Prim prim, ArrayKind arrayKind,
      Mutability mutability) {
    return new Primitive.MakeArray(prim, arrayKind, mutability);
  }

  /** Creates a query of a property of the target. */
  public Primitive.CtConst ctConst(CompileTimeConstant constant) {
    return new Primitive.CtConst(constant);
  }

  /** Creates a safe boxed integer operation. */
  public Primitive.BoxedIntOp boxedIntOp(Prim prim, BoxedInteger size) {
    return new Primitive.BoxedIntOp(prim, size, Safety.SAFE);
  }

  /** Creates a boxed integer operation. */
  public Primitive.BoxedIntOp boxedIntOp(Prim prim, BoxedInteger size,
      Safety safety) {
    return new Primitive.BoxedIntOp(prim, size, safety);
  }

  /** Creates a conversion between boxed integer widths. */
  public Primitive.CvtBint cvtBint(BoxedInteger from, BoxedInteger to) {
    return new Primitive.CvtBint(from, to);
  }

  /** Creates a comparison of boxed integers. */
  public Primitive.BintComp bintComp(BoxedInteger size,
      IntComparison comparison) {
    return new Primitive.BintComp(size, comparison);
  }

  /** Creates an element access to a bigarray. */
  public Primitive.Bigarray bigarray(Prim prim, boolean unsafe,
      int dimensions, BigarrayKind kind, BigarrayLayout layout) {
    return new Primitive.Bigarray(prim, unsafe, dimensions, kind, layout);
  }

  /** Creates an unaligned load or store. */
  public Primitive.Unaligned unaligned(Prim prim, boolean unsafe) {
    return new Primitive.Unaligned(prim, unsafe);
  }

  /** Creates an atomic read. */
  public Primitive.AtomicLoad atomicLoad(
      ImmediateOrPointer immediateOrPointer) {
    return new Primitive.AtomicLoad(immediateOrPointer);
  }

  // Expressions

  /** Creates a reference to a variable. */
  public Lambda.Var var(Ident id) {
    return new Lambda.Var(id);
  }

  /** Creates a constant expression. */
  public Lambda.Const constant(Constant constant) {
    return new Lambda.Const(constant);
  }

  /** Creates an application that has no attributes. */
  public Lambda.Apply apply(Lambda.Exp fn, Lambda.Exp... args) {
    return apply(fn, ImmutableList.copyOf(args), false,
        FunctionAttribute.Inline.DEFAULT, SpecialiseAttribute.DEFAULT);
  }

  /** Creates an application. */
  public Lambda.Apply apply(Lambda.Exp fn, Iterable<? extends Lambda.Exp> args,
      boolean tailCall, FunctionAttribute.Inline inlined,
      SpecialiseAttribute specialised) {
    return new Lambda.Apply(fn, ImmutableList.copyOf(args), tailCall, inlined,
        specialised);
  }

  /** Creates a parameter. */
  public Lambda.Param param(Ident id, ValueKind kind) {
    return new Lambda.Param(id, kind);
  }

  /** Creates a curried function of generic parameters that has no
   * attributes. */
  public Lambda.Function function(List<Ident> params, Lambda.Exp body) {
    final ImmutableList.Builder<Lambda.Param> b = ImmutableList.builder();
    for (Ident param : params) {
      b.add(param(param, ValueKind.GENERIC));
    }
    return function(FunctionKind.CURRIED, b.build(), ValueKind.GENERIC, body,
        FunctionAttribute.DEFAULT);
  }

  /** Creates a function. */
  public Lambda.Function function(FunctionKind kind,
      Iterable<Lambda.Param> params, ValueKind returnKind, Lambda.Exp body,
      FunctionAttribute attribute) {
    return new Lambda.Function(kind, ImmutableList.copyOf(params), returnKind,
        body, attribute);
  }

  /** Creates a strict binding of a generic value. */
  public Lambda.Let let(Ident id, Lambda.Exp arg, Lambda.Exp body) {
    return let(LetKind.STRICT, ValueKind.GENERIC, id, arg, body);
  }

  /** Creates a non-recursive binding. */
  public Lambda.Let let(LetKind letKind, ValueKind valueKind, Ident id,
      Lambda.Exp arg, Lambda.Exp body) {
    return new Lambda.Let(letKind, valueKind, id, arg, body);
  }

  /** Creates a binding in a recursive group. */
  public Lambda.Binding binding(Ident id, Lambda.Exp exp) {
    return new Lambda.Binding(id, exp);
  }

  /** Creates a group of mutually recursive bindings. */
  public Lambda.LetRec letRec(Iterable<Lambda.Binding> bindings,
      Lambda.Exp body) {
    return new Lambda.LetRec(ImmutableList.copyOf(bindings), body);
  }

  /** Creates a call to a primitive. */
  public Lambda.PrimCall prim(Primitive primitive, Lambda.Exp... args) {
    return prim(primitive, ImmutableList.copyOf(args));
  }

  /** Creates a call to a primitive. */
  public Lambda.PrimCall prim(Primitive primitive,
      Iterable<? extends Lambda.Exp> args) {
    return new Lambda.PrimCall(primitive, ImmutableList.copyOf(args));
  }

  /** Creates an arm of a switch. */
  public Lambda.IntCase intCase(int key, Lambda.Exp exp) {
    return new Lambda.IntCase(key, exp);
  }

  /** Creates a switch whose counts of immediates and block tags are the
   * numbers of arms. */
  public Lambda.Switch switch_(Lambda.Exp arg,
      Iterable<Lambda.IntCase> consts, Iterable<Lambda.IntCase> blocks,
      Lambda.@Nullable Exp failAction) {
    final ImmutableList<Lambda.IntCase> constList =
        ImmutableList.copyOf(consts);
    final ImmutableList<Lambda.IntCase> blockList =
        ImmutableList.copyOf(blocks);
    return new Lambda.Switch(arg, constList.size(), constList,
        blockList.size(), blockList, failAction);
  }

  /** Creates a switch. */
  public Lambda.Switch switch_(Lambda.Exp arg, int numConsts,
      Iterable<Lambda.IntCase> consts, int numBlocks,
      Iterable<Lambda.IntCase> blocks, Lambda.@Nullable Exp failAction) {
    return new Lambda.Switch(arg, numConsts, ImmutableList.copyOf(consts),
        numBlocks, ImmutableList.copyOf(blocks), failAction);
  }

  /** Creates an arm of a string switch. */
  public Lambda.StringCase stringCase(String key, Lambda.Exp exp) {
    return new Lambda.StringCase(key, exp);
  }

  /** Creates a string switch. */
  public Lambda.StringSwitch stringSwitch(Lambda.Exp arg,
      Iterable<Lambda.StringCase> cases, Lambda.@Nullable Exp defaultExp) {
    return new Lambda.StringSwitch(arg, ImmutableList.copyOf(cases),
        defaultExp);
  }

  /** Creates a jump to a static handler. */
  public Lambda.StaticRaise staticRaise(int label,
      Iterable<? extends Lambda.Exp> args) {
    return new Lambda.StaticRaise(label, ImmutableList.copyOf(args));
  }

  /** Creates a static handler. */
  public Lambda.StaticCatch staticCatch(Lambda.Exp body, int label,
      Iterable<Lambda.Param> vars, Lambda.Exp handler) {
    return new Lambda.StaticCatch(body, label, ImmutableList.copyOf(vars),
        handler);
  }

  /** Creates an exception handler. */
  public Lambda.TryWith tryWith(Lambda.Exp body, Ident id,
      Lambda.Exp handler) {
    return new Lambda.TryWith(body, id, handler);
  }

  /** Creates a conditional. */
  public Lambda.IfThenElse ifThenElse(Lambda.Exp condition,
      Lambda.Exp ifTrue, Lambda.Exp ifFalse) {
    return ifThenElse(condition, ifTrue, ifFalse, MatchInfo.NONE);
  }

  /** Creates a conditional with a hint of the pattern it tests for. */
  public Lambda.IfThenElse ifThenElse(Lambda.Exp condition,
      Lambda.Exp ifTrue, Lambda.Exp ifFalse, MatchInfo info) {
    return new Lambda.IfThenElse(condition, ifTrue, ifFalse, info);
  }

  /** Creates a sequence of two expressions. */
  public Lambda.Sequence seq(Lambda.Exp first, Lambda.Exp second) {
    return new Lambda.Sequence(first, second);
  }

  /** Creates a while loop. */
  public Lambda.While while_(Lambda.Exp condition, Lambda.Exp body) {
    return new Lambda.While(condition, body);
  }

  /** Creates a counted loop. */
  public Lambda.For for_(Ident id, Lambda.Exp lo, Lambda.Exp hi,
      Direction direction, Lambda.Exp body) {
    return new Lambda.For(id, lo, hi, direction, body);
  }

  /** Creates an assignment. */
  public Lambda.Assign assign(Ident id, Lambda.Exp exp) {
    return new Lambda.Assign(id, exp);
  }

  /** Creates a method call. */
  public Lambda.Send send(MethKind kind, Lambda.Exp method, Lambda.Exp obj,
      Iterable<? extends Lambda.Exp> args) {
    return new Lambda.Send(kind, method, obj, ImmutableList.copyOf(args));
  }

  /** Wraps an expression in a debug event. */
  public Lambda.Event event(Lambda.Exp exp, Lambda.EventKind kind,
      Location location) {
    return new Lambda.Event(exp, kind, location);
  }

  /** Creates an expression that is needed only if a variable is used. */
  public Lambda.IfUsed ifUsed(Ident id, Lambda.Exp exp) {
    return new Lambda.IfUsed(id, exp);
  }

  /** Creates a program. */
  public Lambda.Program program(Ident compilationUnit,
      int mainModuleBlockSize, Iterable<Ident> requiredGlobals,
      Lambda.Exp code) {
    return new Lambda.Program(compilationUnit, mainModuleBlockSize,
        ImmutableSortedSet.copyOf(requiredGlobals), code);
  }
}

// End LambdaBuilder.java
