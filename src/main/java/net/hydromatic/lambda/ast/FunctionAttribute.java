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

import java.util.Objects;
import net.hydromatic.lambda.ast.Kinds.LocalAttribute;
import net.hydromatic.lambda.ast.Kinds.SpecialiseAttribute;

/** Attributes of a function definition. */
public class FunctionAttribute {
  /** Attributes of a function that has no annotations. */
  public static final FunctionAttribute DEFAULT =
      new FunctionAttribute(Inline.DEFAULT, SpecialiseAttribute.DEFAULT,
          LocalAttribute.DEFAULT, false, false);

  public final Inline inline;
  public final SpecialiseAttribute specialise;
  public final LocalAttribute local;
  public final boolean isAFunctor;
  /** Whether the function is a wrapper generated by the compiler. */
  public final boolean stub;

  /** Creates a FunctionAttribute. */
  public FunctionAttribute(Inline inline, SpecialiseAttribute specialise,
      LocalAttribute local, boolean isAFunctor, boolean stub) {
    this.inline = requireNonNull(inline);
    this.specialise = requireNonNull(specialise);
    this.local = requireNonNull(local);
    this.isAFunctor = isAFunctor;
    this.stub = stub;
  }

  /** Returns a copy with a given inline attribute. */
  public FunctionAttribute withInline(Inline inline) {
    return new FunctionAttribute(inline, specialise, local, isAFunctor, stub);
  }

  /** Returns a copy with a given specialise attribute. */
  public FunctionAttribute withSpecialise(SpecialiseAttribute specialise) {
    return new FunctionAttribute(inline, specialise, local, isAFunctor, stub);
  }

  /** Returns a copy with a given local attribute. */
  public FunctionAttribute withLocal(LocalAttribute local) {
    return new FunctionAttribute(inline, specialise, local, isAFunctor, stub);
  }

  /** Returns a copy with given functor and stub flags. */
  public FunctionAttribute withFlags(boolean isAFunctor, boolean stub) {
    return new FunctionAttribute(inline, specialise, local, isAFunctor, stub);
  }

  @Override public int hashCode() {
    return Objects.hash(inline, specialise, local, isAFunctor, stub);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof FunctionAttribute
        && inline.equals(((FunctionAttribute) o).inline)
        && specialise == ((FunctionAttribute) o).specialise
        && local == ((FunctionAttribute) o).local
        && isAFunctor == ((FunctionAttribute) o).isAFunctor
        && stub == ((FunctionAttribute) o).stub;
  }

  /** Inlining directive, on a function or at a call site. */
  public static class Inline {
    public static final Inline DEFAULT = new Inline(Flavor.DEFAULT, 0);
    public static final Inline ALWAYS = new Inline(Flavor.ALWAYS, 0);
    public static final Inline NEVER = new Inline(Flavor.NEVER, 0);

    public final Flavor flavor;
    /** Number of times to unroll, if {@link Flavor#UNROLL}. */
    public final int count;

    private Inline(Flavor flavor, int count) {
      this.flavor = requireNonNull(flavor);
      this.count = count;
    }

    /** Creates a directive to unroll a recursive function a given number of
     * times. */
    public static Inline unroll(int count) {
      checkArgument(count >= 0, "negative unroll count %s", count);
      return new Inline(Flavor.UNROLL, count);
    }

    @Override public int hashCode() {
      return flavor.hashCode() * 31 + count;
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Inline
          && flavor == ((Inline) o).flavor
          && count == ((Inline) o).count;
    }

    /** Sub-types of {@link Inline}. */
    public enum Flavor {
      DEFAULT,
      ALWAYS,
      NEVER,
      UNROLL
    }
  }
}

// End FunctionAttribute.java
