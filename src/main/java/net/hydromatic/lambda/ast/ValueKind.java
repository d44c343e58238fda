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
import java.util.EnumMap;
import java.util.Map;
import net.hydromatic.lambda.ast.Kinds.BoxedInteger;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Representation of a value, as known to the compiler.
 *
 * <p>Annotates parameters, bound variables and function results. Also
 * describes the fields of a block in
 * {@link Primitive.MakeBlock#shape}.
 */
public class ValueKind {
  /** Any value. */
  public static final ValueKind GENERIC = new ValueKind(Flavor.GENERIC, null);

  /** A tagged integer. */
  public static final ValueKind INT = new ValueKind(Flavor.INT, null);

  /** A boxed float. */
  public static final ValueKind FLOAT = new ValueKind(Flavor.FLOAT, null);

  private static final ImmutableMap<BoxedInteger, ValueKind> BOXED;

  static {
    final Map<BoxedInteger, ValueKind> map = new EnumMap<>(BoxedInteger.class);
    for (BoxedInteger bi : BoxedInteger.values()) {
      map.put(bi, new ValueKind(Flavor.BOXED_INTEGER, bi));
    }
    BOXED = ImmutableMap.copyOf(map);
  }

  public final Flavor flavor;
  /** Width of the integer; not null if and only if
   * {@code flavor} is {@link Flavor#BOXED_INTEGER}. */
  public final @Nullable BoxedInteger boxedInteger;

  private ValueKind(Flavor flavor, @Nullable BoxedInteger boxedInteger) {
    this.flavor = requireNonNull(flavor);
    this.boxedInteger = boxedInteger;
  }

  /** Returns the value kind of a boxed integer of a given width. */
  public static ValueKind boxed(BoxedInteger boxedInteger) {
    return requireNonNull(BOXED.get(requireNonNull(boxedInteger)));
  }

  /** Returns the width of a boxed integer; throws if this kind is not a
   * boxed integer. */
  public BoxedInteger boxedInteger() {
    if (boxedInteger == null) {
      throw new IllegalStateException("not a boxed integer: " + this);
    }
    return boxedInteger;
  }

  @Override public String toString() {
    return boxedInteger == null ? flavor.name()
        : flavor.name() + "(" + boxedInteger + ")";
  }

  /** Sub-types of {@link ValueKind}. */
  public enum Flavor {
    GENERIC,
    INT,
    FLOAT,
    BOXED_INTEGER
  }
}

// End ValueKind.java
