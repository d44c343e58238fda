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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.lambda.ast.Info.FieldInfo;
import net.hydromatic.lambda.ast.Kinds.ArrayKind;
import net.hydromatic.lambda.ast.Kinds.BigarrayKind;
import net.hydromatic.lambda.ast.Kinds.BigarrayLayout;
import net.hydromatic.lambda.ast.Kinds.BoxedInteger;
import net.hydromatic.lambda.ast.Kinds.CompileTimeConstant;
import net.hydromatic.lambda.ast.Kinds.FloatComparison;
import net.hydromatic.lambda.ast.Kinds.ImmediateOrPointer;
import net.hydromatic.lambda.ast.Kinds.Initialization;
import net.hydromatic.lambda.ast.Kinds.IntComparison;
import net.hydromatic.lambda.ast.Kinds.Mutability;
import net.hydromatic.lambda.ast.Kinds.RaiseKind;
import net.hydromatic.lambda.ast.Kinds.Safety;
import net.hydromatic.lambda.print.Printers;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Primitive operation.
 *
 * <p>Consists of a {@link Prim tag} and the parameters that the tag needs.
 * Each tag declares, in {@link Prim#shape}, which sub-class holds its
 * parameters; the constructor of each sub-class rejects other tags.
 *
 * <p>Create instances via {@link LambdaBuilder}.
 */
public abstract class Primitive {
  public final Prim prim;

  Primitive(Prim prim) {
    this.prim = requireNonNull(prim, "prim");
    checkArgument(prim.shape == getClass(),
        "primitive %s has shape %s, not %s", prim, prim.shape.getSimpleName(),
        getClass().getSimpleName());
  }

  /** Converts this primitive into its display token. */
  @Override public final String toString() {
    return Printers.primitive(this);
  }

  /** Primitive that has no parameters, such as {@link Prim#ADDINT}. */
  public static class Simple extends Primitive {
    Simple(Prim prim) {
      super(prim);
    }
  }

  /** Access to the global slot of a compilation unit
   * ({@link Prim#GETGLOBAL}, {@link Prim#SETGLOBAL}). */
  public static class Global extends Primitive {
    public final Ident id;

    Global(Prim prim, Ident id) {
      super(prim);
      this.id = requireNonNull(id);
    }
  }

  /** Allocation of a block ({@link Prim#MAKEBLOCK}). */
  public static class MakeBlock extends Primitive {
    public final int tag;
    public final Mutability mutability;
    /** Kinds of the fields, or null if not known. */
    public final @Nullable List<ValueKind> shape;

    MakeBlock(int tag, Mutability mutability,
        @Nullable ImmutableList<ValueKind> shape) {
      super(Prim.MAKEBLOCK);
      this.tag = tag;
      this.mutability = requireNonNull(mutability);
      this.shape = shape;
      checkArgument(tag >= 0, "negative tag %s", tag);
    }
  }

  /** Read of a block field at a constant index ({@link Prim#FIELD}). */
  public static class Field extends Primitive {
    public final int index;
    public final ImmediateOrPointer immediateOrPointer;
    public final Mutability mutability;
    public final FieldInfo info;

    Field(int index, ImmediateOrPointer immediateOrPointer,
        Mutability mutability, FieldInfo info) {
      super(Prim.FIELD);
      this.index = index;
      this.immediateOrPointer = requireNonNull(immediateOrPointer);
      this.mutability = requireNonNull(mutability);
      this.info = requireNonNull(info);
      checkArgument(index >= 0, "negative index %s", index);
    }
  }

  /** Write of a block field at a constant index ({@link Prim#SETFIELD}). */
  public static class SetField extends Primitive {
    public final int index;
    public final ImmediateOrPointer immediateOrPointer;
    public final Initialization initialization;

    SetField(int index, ImmediateOrPointer immediateOrPointer,
        Initialization initialization) {
      super(Prim.SETFIELD);
      this.index = index;
      this.immediateOrPointer = requireNonNull(immediateOrPointer);
      this.initialization = requireNonNull(initialization);
      checkArgument(index >= 0, "negative index %s", index);
    }
  }

  /** Write of a block field whose index is an argument
   * ({@link Prim#SETFIELD_COMPUTED}). */
  public static class SetFieldComputed extends Primitive {
    public final ImmediateOrPointer immediateOrPointer;
    public final Initialization initialization;

    SetFieldComputed(ImmediateOrPointer immediateOrPointer,
        Initialization initialization) {
      super(Prim.SETFIELD_COMPUTED);
      this.immediateOrPointer = requireNonNull(immediateOrPointer);
      this.initialization = requireNonNull(initialization);
    }
  }

  /** Write of an unboxed float field ({@link Prim#SETFLOATFIELD}). */
  public static class SetFloatField extends Primitive {
    public final int index;
    public final Initialization initialization;

    SetFloatField(int index, Initialization initialization) {
      super(Prim.SETFLOATFIELD);
      this.index = index;
      this.initialization = requireNonNull(initialization);
      checkArgument(index >= 0, "negative index %s", index);
    }
  }

  /** Primitive with a single integer parameter: a field index
   * ({@link Prim#FLOATFIELD}), an increment ({@link Prim#OFFSETINT},
   * {@link Prim#OFFSETREF}) or a dimension ({@link Prim#BIGARRAYDIM}). */
  public static class Indexed extends Primitive {
    public final int n;

    Indexed(Prim prim, int n) {
      super(prim);
      this.n = n;
    }
  }

  /** Shallow copy of a record ({@link Prim#DUPRECORD}). */
  public static class DupRecord extends Primitive {
    public final RecordRepresentation representation;
    public final int size;

    DupRecord(RecordRepresentation representation, int size) {
      super(Prim.DUPRECORD);
      this.representation = requireNonNull(representation);
      this.size = size;
      checkArgument(size >= 0, "negative size %s", size);
    }
  }

  /** Call to an external function ({@link Prim#CCALL}). */
  public static class CCall extends Primitive {
    /** Name of the external symbol. */
    public final String name;
    public final int arity;
    /** Whether the function may allocate on the heap. */
    public final boolean alloc;
    /** Name of the unboxed variant of the function, or null. */
    public final @Nullable String nativeName;

    CCall(String name, int arity, boolean alloc, @Nullable String nativeName) {
      super(Prim.CCALL);
      this.name = requireNonNull(name, "name");
      this.arity = arity;
      this.alloc = alloc;
      this.nativeName = nativeName;
      checkArgument(!name.isEmpty(), "empty name");
    }
  }

  /** Raise of an exception ({@link Prim#RAISE}). */
  public static class Raise extends Primitive {
    public final RaiseKind raiseKind;

    Raise(RaiseKind raiseKind) {
      super(Prim.RAISE);
      this.raiseKind = requireNonNull(raiseKind);
    }
  }

  /** Integer operation that may check its divisor
   * ({@link Prim#DIVINT}, {@link Prim#MODINT}). */
  public static class Checked extends Primitive {
    public final Safety safety;

    Checked(Prim prim, Safety safety) {
      super(prim);
      this.safety = requireNonNull(safety);
    }
  }

  /** Comparison of tagged integers ({@link Prim#INTCOMP}). */
  public static class IntComp extends Primitive {
    public final IntComparison comparison;

    IntComp(IntComparison comparison) {
      super(Prim.INTCOMP);
      this.comparison = requireNonNull(comparison);
    }
  }

  /** Comparison of floats ({@link Prim#FLOATCOMP}). */
  public static class FloatComp extends Primitive {
    public final FloatComparison comparison;

    FloatComp(FloatComparison comparison) {
      super(Prim.FLOATCOMP);
      this.comparison = requireNonNull(comparison);
    }
  }

  /** Array operation that depends on the kind of the elements
   * ({@link Prim#ARRAYLENGTH}, {@link Prim#ARRAYREFU} etc.). */
  public static class ArrayOp extends Primitive {
    public final ArrayKind arrayKind;

    ArrayOp(Prim prim, ArrayKind arrayKind) {
      super(prim);
      this.arrayKind = requireNonNull(arrayKind);
    }
  }

  /** Creation or copy of an array
   * ({@link Prim#MAKEARRAY}, {@link Prim#DUPARRAY}). */
  public static class MakeArray extends Primitive {
    public final ArrayKind arrayKind;
    public final Mutability mutability;

    MakeArray(Prim prim, ArrayKind arrayKind, Mutability mutability) {
      super(prim);
      this.arrayKind = requireNonNull(arrayKind);
      this.mutability = requireNonNull(mutability);
    }
  }

  /** Query of a property of the target ({@link Prim#CTCONST}). */
  public static class CtConst extends Primitive {
    public final CompileTimeConstant constant;

    CtConst(CompileTimeConstant constant) {
      super(Prim.CTCONST);
      this.constant = requireNonNull(constant);
    }
  }

  /** Operation on boxed integers of a given width.
   *
   * <p>Only {@link Prim#DIVBINT} and {@link Prim#MODBINT} may be
   * {@link Safety#UNSAFE}. */
  public static class BoxedIntOp extends Primitive {
    public final BoxedInteger size;
    public final Safety safety;

    BoxedIntOp(Prim prim, BoxedInteger size, Safety safety) {
      super(prim);
      this.size = requireNonNull(size);
      this.safety = requireNonNull(safety);
      checkArgument(safety == Safety.SAFE
          || prim == Prim.DIVBINT
          || prim == Prim.MODBINT, "primitive %s cannot be unsafe", prim);
    }
  }

  /** Conversion between boxed integer widths ({@link Prim#CVTBINT}). */
  public static class CvtBint extends Primitive {
    public final BoxedInteger from;
    public final BoxedInteger to;

    CvtBint(BoxedInteger from, BoxedInteger to) {
      super(Prim.CVTBINT);
      this.from = requireNonNull(from);
      this.to = requireNonNull(to);
    }
  }

  /** Comparison of boxed integers ({@link Prim#BINTCOMP}). */
  public static class BintComp extends Primitive {
    public final BoxedInteger size;
    public final IntComparison comparison;

    BintComp(BoxedInteger size, IntComparison comparison) {
      super(Prim.BINTCOMP);
      this.size = requireNonNull(size);
      this.comparison = requireNonNull(comparison);
    }
  }

  /** Element access to a bigarray
   * ({@link Prim#BIGARRAYREF}, {@link Prim#BIGARRAYSET}). */
  public static class Bigarray extends Primitive {
    public final boolean unsafe;
    public final int dimensions;
    public final BigarrayKind kind;
    public final BigarrayLayout layout;

    Bigarray(Prim prim, boolean unsafe, int dimensions, BigarrayKind kind,
        BigarrayLayout layout) {
      super(prim);
      this.unsafe = unsafe;
      this.dimensions = dimensions;
      this.kind = requireNonNull(kind);
      this.layout = requireNonNull(layout);
      checkArgument(dimensions >= 1, "bad dimension count %s", dimensions);
    }
  }

  /** Unaligned multi-byte load or store, such as
   * {@link Prim#STRING_LOAD_16}. The width is part of the tag. */
  public static class Unaligned extends Primitive {
    public final boolean unsafe;

    Unaligned(Prim prim, boolean unsafe) {
      super(prim);
      this.unsafe = unsafe;
    }
  }

  /** Atomic read ({@link Prim#ATOMIC_LOAD}). */
  public static class AtomicLoad extends Primitive {
    public final ImmediateOrPointer immediateOrPointer;

    AtomicLoad(ImmediateOrPointer immediateOrPointer) {
      super(Prim.ATOMIC_LOAD);
      this.immediateOrPointer = requireNonNull(immediateOrPointer);
    }
  }
}

// End Primitive.java
