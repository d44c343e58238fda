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

import static net.hydromatic.lambda.print.Descriptors.arrayKind;
import static net.hydromatic.lambda.print.Descriptors.boxedIntegerMark;

import net.hydromatic.lambda.ast.Kinds.ImmediateOrPointer;
import net.hydromatic.lambda.ast.Kinds.Mutability;
import net.hydromatic.lambda.ast.Kinds.Safety;
import net.hydromatic.lambda.ast.Prim;
import net.hydromatic.lambda.ast.Primitive;
import net.hydromatic.lambda.util.BoxWriter;

/**
 * Prints primitive operations.
 *
 * <p>There are two mappings. The display token, returned by
 * {@link #token(Primitive)}, includes the primitive's parameters, and is what
 * appears in printed expressions. The canonical name, returned by
 * {@link #canonicalName(Primitive)}, depends only on the tag, and is stable.
 */
class PrimitivePrinter {
  private PrimitivePrinter() {}

  /** Prints the display token of a primitive. */
  static BoxWriter print(BoxWriter w, Primitive p) {
    return w.append(token(p));
  }

  /** Returns the canonical name of a primitive, for example "Pfield". */
  static String canonicalName(Primitive p) {
    return p.prim.canonicalName;
  }

  /** Returns the display token of a primitive, for example
   * "field_imm 0". */
  static String token(Primitive p) {
    switch (p.prim) {
    case IDENTITY:
      return "id";
    case BYTES_TO_STRING:
      return "bytes_to_string";
    case BYTES_OF_STRING:
      return "bytes_of_string";
    case IGNORE:
      return "ignore";
    case REVAPPLY:
      return "revapply";
    case DIRAPPLY:
      return "dirapply";

    case GETGLOBAL:
      return "global " + ((Primitive.Global) p).id;
    case SETGLOBAL:
      return "setglobal " + ((Primitive.Global) p).id;

    case MAKEBLOCK:
      final Primitive.MakeBlock makeBlock = (Primitive.MakeBlock) p;
      return (makeBlock.mutability == Mutability.MUTABLE
          ? "makemutable " : "makeblock ")
          + makeBlock.tag
          + Descriptors.blockShape(makeBlock.shape);
    case FIELD:
      final Primitive.Field field = (Primitive.Field) p;
      return fieldInstruction(field)
          + Descriptors.fieldInfo(field.info)
          + field.index;
    case FIELD_COMPUTED:
      return "field_computed";
    case SETFIELD:
      final Primitive.SetField setField = (Primitive.SetField) p;
      return "setfield_"
          + Descriptors.immediateOrPointer(setField.immediateOrPointer)
          + Descriptors.initialization(setField.initialization)
          + " " + setField.index;
    case SETFIELD_COMPUTED:
      final Primitive.SetFieldComputed setFieldComputed =
          (Primitive.SetFieldComputed) p;
      return "setfield_"
          + Descriptors.immediateOrPointer(setFieldComputed.immediateOrPointer)
          + Descriptors.initialization(setFieldComputed.initialization)
          + "_computed";
    case FLOATFIELD:
      return "floatfield " + ((Primitive.Indexed) p).n;
    case SETFLOATFIELD:
      final Primitive.SetFloatField setFloatField =
          (Primitive.SetFloatField) p;
      return "setfloatfield"
          + Descriptors.initialization(setFloatField.initialization)
          + " " + setFloatField.index;
    case DUPRECORD:
      final Primitive.DupRecord dupRecord = (Primitive.DupRecord) p;
      return "duprecord "
          + Descriptors.recordRepresentation(dupRecord.representation)
          + " " + dupRecord.size;

    case RUNSTACK:
      return "runstack";
    case PERFORM:
      return "perform";
    case RESUME:
      return "resume";
    case REPERFORM:
      return "reperform";

    case CCALL:
      return ((Primitive.CCall) p).name;
    case RAISE:
      return Descriptors.raiseKind(((Primitive.Raise) p).raiseKind);

    case SEQUAND:
      return "&&";
    case SEQUOR:
      return "||";
    case NOT:
      return "not";
    case NEGINT:
      return "~";
    case ADDINT:
      return "+";
    case SUBINT:
      return "-";
    case MULINT:
      return "*";
    case DIVINT:
      return isSafe(p) ? "/" : "/u";
    case MODINT:
      return isSafe(p) ? "mod" : "mod_unsafe";
    case ANDINT:
      return "and";
    case ORINT:
      return "or";
    case XORINT:
      return "xor";
    case LSLINT:
      return "lsl";
    case LSRINT:
      return "lsr";
    case ASRINT:
      return "asr";
    case INTCOMP:
      return Descriptors.intComparison(((Primitive.IntComp) p).comparison);
    case OFFSETINT:
      return ((Primitive.Indexed) p).n + "+";
    case OFFSETREF:
      return "+:=" + ((Primitive.Indexed) p).n;

    case INTOFFLOAT:
      return "int_of_float";
    case FLOATOFINT:
      return "float_of_int";
    case NEGFLOAT:
      return "~.";
    case ABSFLOAT:
      return "abs.";
    case ADDFLOAT:
      return "+.";
    case SUBFLOAT:
      return "-.";
    case MULFLOAT:
      return "*.";
    case DIVFLOAT:
      return "/.";
    case FLOATCOMP:
      return Descriptors.floatComparison(
          ((Primitive.FloatComp) p).comparison);

    case STRINGLENGTH:
      return "string.length";
    case STRINGREFU:
      return "string.unsafe_get";
    case STRINGREFS:
      return "string.get";
    case BYTESLENGTH:
      return "bytes.length";
    case BYTESREFU:
      return "bytes.unsafe_get";
    case BYTESSETU:
      return "bytes.unsafe_set";
    case BYTESREFS:
      return "bytes.get";
    case BYTESSETS:
      return "bytes.set";

    case ARRAYLENGTH:
      return "array.length" + arrayKindSuffix(p);
    case MAKEARRAY:
    case DUPARRAY:
      final Primitive.MakeArray makeArray = (Primitive.MakeArray) p;
      return (makeArray.prim == Prim.MAKEARRAY
          ? "makearray" : "duparray")
          + (makeArray.mutability == Mutability.MUTABLE ? "" : "_imm")
          + "[" + arrayKind(makeArray.arrayKind) + "]";
    case ARRAYREFU:
      return "array.unsafe_get" + arrayKindSuffix(p);
    case ARRAYSETU:
      return "array.unsafe_set" + arrayKindSuffix(p);
    case ARRAYREFS:
      return "array.get" + arrayKindSuffix(p);
    case ARRAYSETS:
      return "array.set" + arrayKindSuffix(p);

    case CTCONST:
      return "sys.constant_"
          + Descriptors.compileTimeConstant(((Primitive.CtConst) p).constant);
    case ISINT:
      return "isint";
    case ISOUT:
      return "isout";

    case BINTOFINT:
      return boxedInt("of_int", p);
    case INTOFBINT:
      return boxedInt("to_int", p);
    case CVTBINT:
      final Primitive.CvtBint cvtBint = (Primitive.CvtBint) p;
      return Descriptors.boxedIntegerConversion(cvtBint.from, cvtBint.to);
    case NEGBINT:
      return boxedInt("neg", p);
    case ADDBINT:
      return boxedInt("add", p);
    case SUBBINT:
      return boxedInt("sub", p);
    case MULBINT:
      return boxedInt("mul", p);
    case DIVBINT:
      return boxedInt(isBoxedSafe(p) ? "div" : "div_unsafe", p);
    case MODBINT:
      return boxedInt(isBoxedSafe(p) ? "mod" : "mod_unsafe", p);
    case ANDBINT:
      return boxedInt("and", p);
    case ORBINT:
      return boxedInt("or", p);
    case XORBINT:
      return boxedInt("xor", p);
    case LSLBINT:
      return boxedInt("lsl", p);
    case LSRBINT:
      return boxedInt("lsr", p);
    case ASRBINT:
      return boxedInt("asr", p);
    case BINTCOMP:
      final Primitive.BintComp bintComp = (Primitive.BintComp) p;
      return boxedIntegerMark(Descriptors.intComparison(bintComp.comparison),
          bintComp.size);

    case BIGARRAYREF:
      return bigarray("get", (Primitive.Bigarray) p);
    case BIGARRAYSET:
      return bigarray("set", (Primitive.Bigarray) p);
    case BIGARRAYDIM:
      return "Bigarray.dim_" + ((Primitive.Indexed) p).n;

    case STRING_LOAD_16:
      return unaligned("string.", "get16", p);
    case STRING_LOAD_32:
      return unaligned("string.", "get32", p);
    case STRING_LOAD_64:
      return unaligned("string.", "get64", p);
    case BYTES_LOAD_16:
      return unaligned("bytes.", "get16", p);
    case BYTES_LOAD_32:
      return unaligned("bytes.", "get32", p);
    case BYTES_LOAD_64:
      return unaligned("bytes.", "get64", p);
    case BYTES_SET_16:
      return unaligned("bytes.", "set16", p);
    case BYTES_SET_32:
      return unaligned("bytes.", "set32", p);
    case BYTES_SET_64:
      return unaligned("bytes.", "set64", p);
    case BIGSTRING_LOAD_16:
      return unaligned("bigarray.array1.", "get16", p);
    case BIGSTRING_LOAD_32:
      return unaligned("bigarray.array1.", "get32", p);
    case BIGSTRING_LOAD_64:
      return unaligned("bigarray.array1.", "get64", p);
    case BIGSTRING_SET_16:
      return unaligned("bigarray.array1.", "set16", p);
    case BIGSTRING_SET_32:
      return unaligned("bigarray.array1.", "set32", p);
    case BIGSTRING_SET_64:
      return unaligned("bigarray.array1.", "set64", p);

    case BSWAP16:
      return "bswap16";
    case BBSWAP:
      return boxedInt("bswap", p);
    case INT_AS_POINTER:
      return "int_as_pointer";

    case ATOMIC_LOAD:
      return ((Primitive.AtomicLoad) p).immediateOrPointer
          == ImmediateOrPointer.IMMEDIATE
          ? "atomic_load_imm"
          : "atomic_load_ptr";
    case ATOMIC_EXCHANGE:
      return "atomic_exchange";
    case ATOMIC_CAS:
      return "atomic_cas";
    case ATOMIC_FETCH_ADD:
      return "atomic_fetch_add";

    case OPAQUE:
      return "opaque";
    case POLL:
      return "poll";
    case NOP:
      return "nop";

    default:
      throw new AssertionError("unknown primitive " + p.prim);
    }
  }

  private static String fieldInstruction(Primitive.Field field) {
    if (field.immediateOrPointer == ImmediateOrPointer.IMMEDIATE) {
      return "field_int";
    }
    return field.mutability == Mutability.MUTABLE ? "field_mut" : "field_imm";
  }

  private static boolean isSafe(Primitive p) {
    return ((Primitive.Checked) p).safety == Safety.SAFE;
  }

  private static boolean isBoxedSafe(Primitive p) {
    return ((Primitive.BoxedIntOp) p).safety == Safety.SAFE;
  }

  private static String arrayKindSuffix(Primitive p) {
    return "[" + arrayKind(((Primitive.ArrayOp) p).arrayKind) + "]";
  }

  private static String boxedInt(String name, Primitive p) {
    return boxedIntegerMark(name, ((Primitive.BoxedIntOp) p).size);
  }

  private static String bigarray(String name, Primitive.Bigarray p) {
    return "Bigarray." + (p.unsafe ? "unsafe_" : "") + name
        + "[" + Descriptors.bigarrayKind(p.kind)
        + "," + Descriptors.bigarrayLayout(p.layout) + "]";
  }

  private static String unaligned(String prefix, String name, Primitive p) {
    return prefix + (((Primitive.Unaligned) p).unsafe ? "unsafe_" : "")
        + name;
  }
}

// End PrimitivePrinter.java
