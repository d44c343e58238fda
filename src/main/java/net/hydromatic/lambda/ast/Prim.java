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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;

/**
 * Tag of a primitive operation.
 *
 * <p>Each tag has a canonical name, which is stable across releases and does
 * not depend on the operation's parameters, and a shape, the sub-class of
 * {@link Primitive} that holds those parameters.
 *
 * <p>Never change or reuse a canonical name. A new tag needs a new name.
 */
public enum Prim {
  IDENTITY("Pidentity", Primitive.Simple.class),
  BYTES_TO_STRING("Pbytes_to_string", Primitive.Simple.class),
  BYTES_OF_STRING("Pbytes_of_string", Primitive.Simple.class),
  IGNORE("Pignore", Primitive.Simple.class),
  REVAPPLY("Prevapply", Primitive.Simple.class),
  DIRAPPLY("Pdirapply", Primitive.Simple.class),

  // globals
  GETGLOBAL("Pgetglobal", Primitive.Global.class),
  SETGLOBAL("Psetglobal", Primitive.Global.class),

  // blocks
  MAKEBLOCK("Pmakeblock", Primitive.MakeBlock.class),
  FIELD("Pfield", Primitive.Field.class),
  FIELD_COMPUTED("Pfield_computed", Primitive.Simple.class),
  SETFIELD("Psetfield", Primitive.SetField.class),
  SETFIELD_COMPUTED("Psetfield_computed", Primitive.SetFieldComputed.class),
  FLOATFIELD("Pfloatfield", Primitive.Indexed.class),
  SETFLOATFIELD("Psetfloatfield", Primitive.SetFloatField.class),
  DUPRECORD("Pduprecord", Primitive.DupRecord.class),

  // effect handlers
  RUNSTACK("Prunstack", Primitive.Simple.class),
  PERFORM("Pperform", Primitive.Simple.class),
  RESUME("Presume", Primitive.Simple.class),
  REPERFORM("Preperform", Primitive.Simple.class),

  // external call
  CCALL("Pccall", Primitive.CCall.class),

  // exceptions
  RAISE("Praise", Primitive.Raise.class),

  // boolean operations
  SEQUAND("Psequand", Primitive.Simple.class),
  SEQUOR("Psequor", Primitive.Simple.class),
  NOT("Pnot", Primitive.Simple.class),

  // integer operations
  NEGINT("Pnegint", Primitive.Simple.class),
  ADDINT("Paddint", Primitive.Simple.class),
  SUBINT("Psubint", Primitive.Simple.class),
  MULINT("Pmulint", Primitive.Simple.class),
  DIVINT("Pdivint", Primitive.Checked.class),
  MODINT("Pmodint", Primitive.Checked.class),
  ANDINT("Pandint", Primitive.Simple.class),
  ORINT("Porint", Primitive.Simple.class),
  XORINT("Pxorint", Primitive.Simple.class),
  LSLINT("Plslint", Primitive.Simple.class),
  LSRINT("Plsrint", Primitive.Simple.class),
  ASRINT("Pasrint", Primitive.Simple.class),
  INTCOMP("Pintcomp", Primitive.IntComp.class),
  OFFSETINT("Poffsetint", Primitive.Indexed.class),
  OFFSETREF("Poffsetref", Primitive.Indexed.class),

  // float operations
  INTOFFLOAT("Pintoffloat", Primitive.Simple.class),
  FLOATOFINT("Pfloatofint", Primitive.Simple.class),
  NEGFLOAT("Pnegfloat", Primitive.Simple.class),
  ABSFLOAT("Pabsfloat", Primitive.Simple.class),
  ADDFLOAT("Paddfloat", Primitive.Simple.class),
  SUBFLOAT("Psubfloat", Primitive.Simple.class),
  MULFLOAT("Pmulfloat", Primitive.Simple.class),
  DIVFLOAT("Pdivfloat", Primitive.Simple.class),
  FLOATCOMP("Pfloatcomp", Primitive.FloatComp.class),

  // string and bytes operations
  STRINGLENGTH("Pstringlength", Primitive.Simple.class),
  STRINGREFU("Pstringrefu", Primitive.Simple.class),
  STRINGREFS("Pstringrefs", Primitive.Simple.class),
  BYTESLENGTH("Pbyteslength", Primitive.Simple.class),
  BYTESREFU("Pbytesrefu", Primitive.Simple.class),
  BYTESSETU("Pbytessetu", Primitive.Simple.class),
  BYTESREFS("Pbytesrefs", Primitive.Simple.class),
  BYTESSETS("Pbytessets", Primitive.Simple.class),

  // array operations
  ARRAYLENGTH("Parraylength", Primitive.ArrayOp.class),
  MAKEARRAY("Pmakearray", Primitive.MakeArray.class),
  DUPARRAY("Pduparray", Primitive.MakeArray.class),
  ARRAYREFU("Parrayrefu", Primitive.ArrayOp.class),
  ARRAYSETU("Parraysetu", Primitive.ArrayOp.class),
  ARRAYREFS("Parrayrefs", Primitive.ArrayOp.class),
  ARRAYSETS("Parraysets", Primitive.ArrayOp.class),

  // compile-time constants
  CTCONST("Pctconst", Primitive.CtConst.class),

  // tag tests
  ISINT("Pisint", Primitive.Simple.class),
  ISOUT("Pisout", Primitive.Simple.class),

  // boxed integer operations
  BINTOFINT("Pbintofint", Primitive.BoxedIntOp.class),
  INTOFBINT("Pintofbint", Primitive.BoxedIntOp.class),
  CVTBINT("Pcvtbint", Primitive.CvtBint.class),
  NEGBINT("Pnegbint", Primitive.BoxedIntOp.class),
  ADDBINT("Paddbint", Primitive.BoxedIntOp.class),
  SUBBINT("Psubbint", Primitive.BoxedIntOp.class),
  MULBINT("Pmulbint", Primitive.BoxedIntOp.class),
  DIVBINT("Pdivbint", Primitive.BoxedIntOp.class),
  MODBINT("Pmodbint", Primitive.BoxedIntOp.class),
  ANDBINT("Pandbint", Primitive.BoxedIntOp.class),
  ORBINT("Porbint", Primitive.BoxedIntOp.class),
  XORBINT("Pxorbint", Primitive.BoxedIntOp.class),
  LSLBINT("Plslbint", Primitive.BoxedIntOp.class),
  LSRBINT("Plsrbint", Primitive.BoxedIntOp.class),
  ASRBINT("Pasrbint", Primitive.BoxedIntOp.class),
  BINTCOMP("Pbintcomp", Primitive.BintComp.class),

  // bigarrays
  BIGARRAYREF("Pbigarrayref", Primitive.Bigarray.class),
  BIGARRAYSET("Pbigarrayset", Primitive.Bigarray.class),
  BIGARRAYDIM("Pbigarraydim", Primitive.Indexed.class),

  // unaligned loads and stores
  STRING_LOAD_16("Pstring_load_16", Primitive.Unaligned.class),
  STRING_LOAD_32("Pstring_load_32", Primitive.Unaligned.class),
  STRING_LOAD_64("Pstring_load_64", Primitive.Unaligned.class),
  BYTES_LOAD_16("Pbytes_load_16", Primitive.Unaligned.class),
  BYTES_LOAD_32("Pbytes_load_32", Primitive.Unaligned.class),
  BYTES_LOAD_64("Pbytes_load_64", Primitive.Unaligned.class),
  BYTES_SET_16("Pbytes_set_16", Primitive.Unaligned.class),
  BYTES_SET_32("Pbytes_set_32", Primitive.Unaligned.class),
  BYTES_SET_64("Pbytes_set_64", Primitive.Unaligned.class),
  BIGSTRING_LOAD_16("Pbigstring_load_16", Primitive.Unaligned.class),
  BIGSTRING_LOAD_32("Pbigstring_load_32", Primitive.Unaligned.class),
  BIGSTRING_LOAD_64("Pbigstring_load_64", Primitive.Unaligned.class),
  BIGSTRING_SET_16("Pbigstring_set_16", Primitive.Unaligned.class),
  BIGSTRING_SET_32("Pbigstring_set_32", Primitive.Unaligned.class),
  BIGSTRING_SET_64("Pbigstring_set_64", Primitive.Unaligned.class),

  // byte swap
  BSWAP16("Pbswap16", Primitive.Simple.class),
  BBSWAP("Pbbswap", Primitive.BoxedIntOp.class),

  INT_AS_POINTER("Pint_as_pointer", Primitive.Simple.class),

  // atomics
  ATOMIC_LOAD("Patomic_load", Primitive.AtomicLoad.class),
  ATOMIC_EXCHANGE("Patomic_exchange", Primitive.Simple.class),
  ATOMIC_CAS("Patomic_cas", Primitive.Simple.class),
  ATOMIC_FETCH_ADD("Patomic_fetch_add", Primitive.Simple.class),

  // markers
  OPAQUE("Popaque", Primitive.Simple.class),
  POLL("Ppoll", Primitive.Simple.class),
  NOP("Pnop", Primitive.Simple.class);

  /** Stable name of this tag, for example "Pfield". */
  public final String canonicalName;

  /** Class of {@link Primitive} that holds this tag's parameters. */
  public final Class<? extends Primitive> shape;

  /** Map of all tags, keyed by {@link #canonicalName}. */
  public static final ImmutableMap<String, Prim> BY_CANONICAL_NAME;

  static {
    final ImmutableMap.Builder<String, Prim> b = ImmutableMap.builder();
    for (Prim prim : values()) {
      b.put(prim.canonicalName, prim);
    }
    // Throws if two tags have the same canonical name
    BY_CANONICAL_NAME = b.build();
  }

  Prim(String canonicalName, Class<? extends Primitive> shape) {
    this.canonicalName = requireNonNull(canonicalName);
    this.shape = requireNonNull(shape);
  }
}

// End Prim.java
