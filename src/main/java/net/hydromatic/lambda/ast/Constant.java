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
import java.util.Objects;
import net.hydromatic.lambda.ast.Info.PointerInfo;
import net.hydromatic.lambda.ast.Info.TagInfo;
import net.hydromatic.lambda.print.Printers;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Structured constant.
 *
 * <p>A value that is known at compile time and has a fixed literal form. A
 * {@link Block} may contain other constants.
 *
 * <p>Create instances via {@link LambdaBuilder}.
 */
public abstract class Constant {
  public final Kind kind;

  Constant(Kind kind) {
    this.kind = requireNonNull(kind);
  }

  /** Converts this constant into its literal text. */
  @Override public final String toString() {
    return Printers.structuredConstant(this);
  }

  /** Scalar constant: an integer, character, string or float. */
  public static class Literal extends Constant {
    /** The value: a {@link Long} for {@link Kind#INT} and
     * {@link Kind#NATIVEINT}, {@link Integer} for {@link Kind#INT32},
     * {@link Long} for {@link Kind#INT64}, {@link Character} for
     * {@link Kind#CHAR}, and {@link String} for the others. A float is held
     * as the text that appeared in the source. */
    public final Comparable<?> value;
    /** Delimiter of a quoted string literal, such as "id" in
     * {@code {id|...|id}}; null for other literals. */
    public final @Nullable String delimiter;

    Literal(Kind kind, Comparable<?> value, @Nullable String delimiter) {
      super(kind);
      this.value = requireNonNull(value);
      this.delimiter = delimiter;
      checkArgument(kind == Kind.INT
          || kind == Kind.CHAR
          || kind == Kind.STRING
          || kind == Kind.IMMSTRING
          || kind == Kind.FLOAT
          || kind == Kind.INT32
          || kind == Kind.INT64
          || kind == Kind.NATIVEINT, "not a literal kind: %s", kind);
      checkArgument(delimiter == null || kind == Kind.STRING,
          "only a string literal may have a delimiter");
      checkArgument(kind != Kind.CHAR || (Character) value <= 0xff,
          "character literal %s is not a single byte", value);
    }

    /** Returns the value as a string; throws if it is not one. */
    public String stringValue() {
      return (String) value;
    }

    @Override public int hashCode() {
      return Objects.hash(kind, value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
          && kind == ((Literal) o).kind
          && value.equals(((Literal) o).value);
    }
  }

  /** Immediate value that the runtime treats like a pointer-sized word,
   * such as a constant constructor, {@code true} or {@code []}. */
  public static class Pointer extends Constant {
    public final int value;
    public final PointerInfo info;

    Pointer(int value, PointerInfo info) {
      super(Kind.POINTER);
      this.value = value;
      this.info = requireNonNull(info);
    }

    @Override public int hashCode() {
      return value;
    }

    /** {@inheritDoc}
     *
     * <p>The hint does not take part in comparison. */
    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Pointer
          && value == ((Pointer) o).value;
    }
  }

  /** Block with a tag and zero or more fields. */
  public static class Block extends Constant {
    public final int tag;
    public final List<Constant> fields;
    public final TagInfo info;

    Block(int tag, ImmutableList<Constant> fields, TagInfo info) {
      super(Kind.BLOCK);
      this.tag = tag;
      this.fields = requireNonNull(fields);
      this.info = requireNonNull(info);
      checkArgument(tag >= 0, "negative tag %s", tag);
    }

    @Override public int hashCode() {
      return Objects.hash(tag, fields);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Block
          && tag == ((Block) o).tag
          && fields.equals(((Block) o).fields);
    }
  }

  /** Array of unboxed floats, each held as source text. */
  public static class FloatArray extends Constant {
    public final List<String> values;

    FloatArray(ImmutableList<String> values) {
      super(Kind.FLOAT_ARRAY);
      this.values = requireNonNull(values);
    }

    @Override public int hashCode() {
      return values.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof FloatArray
          && values.equals(((FloatArray) o).values);
    }
  }

  /** Sub-types of {@link Constant}. */
  public enum Kind {
    INT,
    CHAR,
    STRING,
    /** Immutable string that is shared between all uses. */
    IMMSTRING,
    FLOAT,
    INT32,
    INT64,
    NATIVEINT,
    POINTER,
    BLOCK,
    FLOAT_ARRAY
  }
}

// End Constant.java
