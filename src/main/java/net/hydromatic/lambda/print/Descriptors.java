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

import java.util.List;
import net.hydromatic.lambda.ast.FunctionAttribute;
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
import net.hydromatic.lambda.ast.Kinds.ImmediateOrPointer;
import net.hydromatic.lambda.ast.Kinds.Initialization;
import net.hydromatic.lambda.ast.Kinds.IntComparison;
import net.hydromatic.lambda.ast.Kinds.LetKind;
import net.hydromatic.lambda.ast.Kinds.LocalAttribute;
import net.hydromatic.lambda.ast.Kinds.MethKind;
import net.hydromatic.lambda.ast.Kinds.RaiseKind;
import net.hydromatic.lambda.ast.Kinds.SpecialiseAttribute;
import net.hydromatic.lambda.ast.Lambda;
import net.hydromatic.lambda.ast.RecordRepresentation;
import net.hydromatic.lambda.ast.ValueKind;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Tokens for the small enumerations that parameterize primitives and
 * expressions.
 *
 * <p>Every method is a total function over a closed set of values. If a new
 * value is added to one of the sets in {@link net.hydromatic.lambda.ast.Kinds}
 * or {@link net.hydromatic.lambda.ast.Info} and not here, the method throws
 * {@link AssertionError}.
 */
public class Descriptors {
  private Descriptors() {}

  /** Returns the suffix that describes the shape of a block constant,
   * for example ":record"; empty if there is no hint. */
  public static String tagInfo(TagInfo info) {
    switch (info.flavor) {
    case NONE:
      return "";
    case RECORD:
      return ":record";
    case CON:
      return ":con'" + info.name() + "'";
    case TUPLE:
      return ":tuple";
    default:
      throw new AssertionError("unknown tag info " + info);
    }
  }

  /** Returns the suffix that describes a pointer-like immediate,
   * for example ":bool"; empty if there is no hint. */
  public static String pointerInfo(PointerInfo info) {
    switch (info.flavor) {
    case NONE:
      return "";
    case BOOL:
      return ":bool";
    case NIL:
      return ":nil";
    case UNIT:
      return ":unit";
    case CON:
      return ":" + info.name();
    default:
      throw new AssertionError("unknown pointer info " + info);
    }
  }

  /** Returns the text between the name of a field access and its index,
   * for example ":record(x) "; a single space if there is no hint. The
   * constructor hints ":con" and ":cons" have no trailing space, so the
   * index follows them directly, as in "field_imm:con0". */
  public static String fieldInfo(FieldInfo info) {
    switch (info.flavor) {
    case NONE:
      return " ";
    case MODULE:
      return ":module(" + info.name() + ") ";
    case RECORD:
      return ":record(" + info.name() + ") ";
    case RECORD_INLINE:
      return ":record_inline(" + info.name() + ") ";
    case CON:
      return ":con";
    case TUPLE:
      return ":tuple ";
    case CONS:
      return ":cons";
    default:
      throw new AssertionError("unknown field info " + info);
    }
  }

  /** Returns the suffix of the condition of an {@code if}, for example
   * ":[]"; empty if there is no hint. */
  public static String matchInfo(MatchInfo info) {
    switch (info.flavor) {
    case NONE:
      return "";
    case NIL:
      return ":[]";
    case CON:
      return ":" + info.name();
    default:
      throw new AssertionError("unknown match info " + info);
    }
  }

  public static String arrayKind(ArrayKind kind) {
    switch (kind) {
    case GENERIC:
      return "gen";
    case ADDR:
      return "addr";
    case INT:
      return "int";
    case FLOAT:
      return "float";
    default:
      throw new AssertionError("unknown array kind " + kind);
    }
  }

  /** Returns the name of a boxed integer type, for example "int32". */
  public static String boxedIntegerName(BoxedInteger bi) {
    switch (bi) {
    case NATIVEINT:
      return "nativeint";
    case INT32:
      return "int32";
    case INT64:
      return "int64";
    default:
      throw new AssertionError("unknown boxed integer " + bi);
    }
  }

  /** Returns the name of an operation on a boxed integer type, qualified by
   * the module that defines it, for example "Int32.add". */
  public static String boxedIntegerMark(String name, BoxedInteger bi) {
    switch (bi) {
    case NATIVEINT:
      return "Nativeint." + name;
    case INT32:
      return "Int32." + name;
    case INT64:
      return "Int64." + name;
    default:
      throw new AssertionError("unknown boxed integer " + bi);
    }
  }

  /** Returns the name of a conversion between boxed integer types, for
   * example "int64_of_int32". */
  public static String boxedIntegerConversion(BoxedInteger from,
      BoxedInteger to) {
    return boxedIntegerName(to) + "_of_" + boxedIntegerName(from);
  }

  /** Returns the suffix of a parameter or bound variable, for example
   * "[int]"; empty for a generic value. */
  public static String valueKind(ValueKind kind) {
    switch (kind.flavor) {
    case GENERIC:
      return "";
    case INT:
      return "[int]";
    case FLOAT:
      return "[float]";
    case BOXED_INTEGER:
      return "[" + boxedIntegerName(kind.boxedInteger()) + "]";
    default:
      throw new AssertionError("unknown value kind " + kind);
    }
  }

  /** Returns the annotation of the result of a function, for example
   * ": int"; empty for a generic value. */
  public static String returnKind(ValueKind kind) {
    switch (kind.flavor) {
    case GENERIC:
      return "";
    case INT:
      return ": int";
    case FLOAT:
      return ": float";
    case BOXED_INTEGER:
      return ": " + boxedIntegerName(kind.boxedInteger());
    default:
      throw new AssertionError("unknown value kind " + kind);
    }
  }

  /** Returns the name of the kind of a field of a block, for example "*"
   * for a generic value. */
  public static String fieldKind(ValueKind kind) {
    switch (kind.flavor) {
    case GENERIC:
      return "*";
    case INT:
      return "int";
    case FLOAT:
      return "float";
    case BOXED_INTEGER:
      return boxedIntegerName(kind.boxedInteger());
    default:
      throw new AssertionError("unknown value kind " + kind);
    }
  }

  /** Returns the description of the fields of a new block, for example
   * " (int,*)".
   *
   * <p>Empty if the shape is not known, has no fields, or all fields are
   * generic. */
  public static String blockShape(@Nullable List<ValueKind> shape) {
    if (shape == null || allGeneric(shape)) {
      return "";
    }
    final StringBuilder b = new StringBuilder(" (");
    for (ValueKind kind : shape) {
      if (b.length() > 2) {
        b.append(',');
      }
      b.append(fieldKind(kind));
    }
    return b.append(')').toString();
  }

  private static boolean allGeneric(List<ValueKind> shape) {
    for (ValueKind kind : shape) {
      if (kind.flavor != ValueKind.Flavor.GENERIC) {
        return false;
      }
    }
    return true;
  }

  public static String intComparison(IntComparison comparison) {
    switch (comparison) {
    case EQ:
      return "==";
    case NE:
      return "!=";
    case LT:
      return "<";
    case LE:
      return "<=";
    case GT:
      return ">";
    case GE:
      return ">=";
    default:
      throw new AssertionError("unknown comparison " + comparison);
    }
  }

  public static String floatComparison(FloatComparison comparison) {
    switch (comparison) {
    case EQ:
      return "==.";
    case NEQ:
      return "!=.";
    case LT:
      return "<.";
    case NLT:
      return "!<.";
    case LE:
      return "<=.";
    case NLE:
      return "!<=.";
    case GT:
      return ">.";
    case NGT:
      return "!>.";
    case GE:
      return ">=.";
    case NGE:
      return "!>=.";
    default:
      throw new AssertionError("unknown comparison " + comparison);
    }
  }

  public static String bigarrayKind(BigarrayKind kind) {
    switch (kind) {
    case UNKNOWN:
      return "generic";
    case FLOAT32:
      return "float32";
    case FLOAT64:
      return "float64";
    case SINT8:
      return "sint8";
    case UINT8:
      return "uint8";
    case SINT16:
      return "sint16";
    case UINT16:
      return "uint16";
    case INT32:
      return "int32";
    case INT64:
      return "int64";
    case CAML_INT:
      return "camlint";
    case NATIVE_INT:
      return "nativeint";
    case COMPLEX32:
      return "complex32";
    case COMPLEX64:
      return "complex64";
    default:
      throw new AssertionError("unknown bigarray kind " + kind);
    }
  }

  public static String bigarrayLayout(BigarrayLayout layout) {
    switch (layout) {
    case UNKNOWN:
      return "unknown";
    case C:
      return "C";
    case FORTRAN:
      return "Fortran";
    default:
      throw new AssertionError("unknown bigarray layout " + layout);
    }
  }

  /** Returns the description of how a record is laid out, for example
   * "inlined(2)". */
  public static String recordRepresentation(RecordRepresentation rep) {
    switch (rep.flavor) {
    case REGULAR:
      return "regular";
    case INLINED:
      return "inlined(" + rep.tag + ")";
    case UNBOXED:
      return rep.inlined ? "inlined(unboxed)" : "unboxed";
    case FLOAT:
      return "float";
    case EXTENSION:
      return "ext(" + rep.path + ")";
    default:
      throw new AssertionError("unknown record representation " + rep);
    }
  }

  /** Returns the token that says how a field write initializes the field,
   * for example "(heap-init)"; empty for an assignment. */
  public static String initialization(Initialization initialization) {
    switch (initialization) {
    case HEAP_INITIALIZATION:
      return "(heap-init)";
    case ROOT_INITIALIZATION:
      return "(root-init)";
    case ASSIGNMENT:
      return "";
    default:
      throw new AssertionError("unknown initialization " + initialization);
    }
  }

  /** Returns "imm" or "ptr". */
  public static String immediateOrPointer(ImmediateOrPointer iop) {
    switch (iop) {
    case IMMEDIATE:
      return "imm";
    case POINTER:
      return "ptr";
    default:
      throw new AssertionError("unknown immediate-or-pointer " + iop);
    }
  }

  /** Returns the name of a property of the target, for example
   * "word_size". */
  public static String compileTimeConstant(CompileTimeConstant constant) {
    switch (constant) {
    case BIG_ENDIAN:
      return "big_endian";
    case WORD_SIZE:
      return "word_size";
    case INT_SIZE:
      return "int_size";
    case MAX_WOSIZE:
      return "max_wosize";
    case OSTYPE_UNIX:
      return "ostype_unix";
    case OSTYPE_WIN32:
      return "ostype_win32";
    case OSTYPE_CYGWIN:
      return "ostype_cygwin";
    case BACKEND_TYPE:
      return "backend_type";
    default:
      throw new AssertionError("unknown constant " + constant);
    }
  }

  public static String raiseKind(RaiseKind kind) {
    switch (kind) {
    case REGULAR:
      return "raise";
    case RERAISE:
      return "reraise";
    case NOTRACE:
      return "raise_notrace";
    default:
      throw new AssertionError("unknown raise kind " + kind);
    }
  }

  /** Returns the mark that follows "=" in a binding; empty for a strict
   * binding. */
  public static String letKind(LetKind kind) {
    switch (kind) {
    case ALIAS:
      return "a";
    case STRICT:
      return "";
    case STRICT_OPT:
      return "o";
    case VARIABLE:
      return "v";
    default:
      throw new AssertionError("unknown let kind " + kind);
    }
  }

  public static String direction(Direction direction) {
    switch (direction) {
    case UPTO:
      return "to";
    case DOWNTO:
      return "downto";
    default:
      throw new AssertionError("unknown direction " + direction);
    }
  }

  /** Returns the suffix of "send"; empty for a public method. */
  public static String methKind(MethKind kind) {
    switch (kind) {
    case SELF:
      return "self";
    case PUBLIC:
      return "";
    case CACHED:
      return "cache";
    default:
      throw new AssertionError("unknown method kind " + kind);
    }
  }

  /** Returns the token of a debug event, for example "funct-body". */
  public static String eventKind(Lambda.EventKind kind) {
    switch (kind.flavor) {
    case BEFORE:
      return "before";
    case AFTER:
      return "after";
    case FUNCTION:
      return "funct-body";
    case PSEUDO:
      return "pseudo";
    case MODULE_DEFINITION:
      return "module-defn(" + kind.module + ")";
    default:
      throw new AssertionError("unknown event kind " + kind.flavor);
    }
  }

  /** Returns the attribute of a call site that requests inlining, with a
   * leading space, for example " always_inline"; empty by default. */
  public static String applyInlined(FunctionAttribute.Inline inline) {
    switch (inline.flavor) {
    case DEFAULT:
      return "";
    case ALWAYS:
      return " always_inline";
    case NEVER:
      return " never_inline";
    case UNROLL:
      return " never_inline(" + inline.count + ")";
    default:
      throw new AssertionError("unknown inline attribute " + inline.flavor);
    }
  }

  /** Returns the attribute of a call site that requests specialisation,
   * with a leading space; empty by default. */
  public static String applySpecialised(SpecialiseAttribute specialise) {
    switch (specialise) {
    case DEFAULT:
      return "";
    case ALWAYS:
      return " always_specialise";
    case NEVER:
      return " never_specialise";
    default:
      throw new AssertionError("unknown specialise attribute " + specialise);
    }
  }

  /** Returns the inline attribute of a function, for example
   * "unroll(3)"; empty by default. */
  public static String functionInline(FunctionAttribute.Inline inline) {
    switch (inline.flavor) {
    case DEFAULT:
      return "";
    case ALWAYS:
      return "always_inline";
    case NEVER:
      return "never_inline";
    case UNROLL:
      return "unroll(" + inline.count + ")";
    default:
      throw new AssertionError("unknown inline attribute " + inline.flavor);
    }
  }

  /** Returns the specialise attribute of a function; empty by default. */
  public static String functionSpecialise(SpecialiseAttribute specialise) {
    switch (specialise) {
    case DEFAULT:
      return "";
    case ALWAYS:
      return "always_specialise";
    case NEVER:
      return "never_specialise";
    default:
      throw new AssertionError("unknown specialise attribute " + specialise);
    }
  }

  /** Returns the local attribute of a function; empty by default. */
  public static String functionLocal(LocalAttribute local) {
    switch (local) {
    case DEFAULT:
      return "";
    case ALWAYS:
      return "always_local";
    case NEVER:
      return "never_local";
    default:
      throw new AssertionError("unknown local attribute " + local);
    }
  }
}

// End Descriptors.java
