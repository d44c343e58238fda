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

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Hints that describe where a value came from in the source program.
 *
 * <p>Hints are for display only. Two nodes that differ only in their hints
 * have the same meaning.
 *
 * <p>This class functions as a namespace, so that we can keep the class
 * names short.
 */
public class Info {
  private Info() {}

  /** Base class for a hint that is one of a few flavors, some of which
   * carry a name.
   *
   * @param <F> Flavor enum */
  abstract static class NamedHint<F extends Enum<F>> {
    public final F flavor;
    public final @Nullable String name;

    NamedHint(F flavor, @Nullable String name) {
      this.flavor = requireNonNull(flavor);
      this.name = name;
    }

    /** Returns the name; throws if this hint has no name. */
    public String name() {
      if (name == null) {
        throw new IllegalStateException("hint " + flavor + " has no name");
      }
      return name;
    }

    @Override public int hashCode() {
      return Objects.hash(flavor, name);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o != null
          && o.getClass() == getClass()
          && flavor == ((NamedHint) o).flavor
          && Objects.equals(name, ((NamedHint) o).name);
    }

    @Override public String toString() {
      return name == null ? flavor.name() : flavor.name() + "(" + name + ")";
    }
  }

  /** Shape of a structured block constant. */
  public static class TagInfo extends NamedHint<TagInfo.Flavor> {
    public static final TagInfo NONE = new TagInfo(Flavor.NONE, null);
    public static final TagInfo RECORD = new TagInfo(Flavor.RECORD, null);
    public static final TagInfo TUPLE = new TagInfo(Flavor.TUPLE, null);

    private TagInfo(Flavor flavor, @Nullable String name) {
      super(flavor, name);
    }

    /** Creates a hint that a block is built by a named constructor. */
    public static TagInfo con(String name) {
      return new TagInfo(Flavor.CON, requireNonNull(name));
    }

    /** Flavors of {@link TagInfo}. */
    public enum Flavor {
      NONE,
      RECORD,
      CON,
      TUPLE
    }
  }

  /** Meaning of a pointer-like immediate constant. */
  public static class PointerInfo extends NamedHint<PointerInfo.Flavor> {
    public static final PointerInfo NONE = new PointerInfo(Flavor.NONE, null);
    public static final PointerInfo BOOL = new PointerInfo(Flavor.BOOL, null);
    public static final PointerInfo NIL = new PointerInfo(Flavor.NIL, null);
    public static final PointerInfo UNIT = new PointerInfo(Flavor.UNIT, null);

    private PointerInfo(Flavor flavor, @Nullable String name) {
      super(flavor, name);
    }

    /** Creates a hint that an immediate is a constant constructor. */
    public static PointerInfo con(String name) {
      return new PointerInfo(Flavor.CON, requireNonNull(name));
    }

    /** Flavors of {@link PointerInfo}. */
    public enum Flavor {
      NONE,
      BOOL,
      NIL,
      UNIT,
      CON
    }
  }

  /** Role of the field that a field access reads. */
  public static class FieldInfo extends NamedHint<FieldInfo.Flavor> {
    public static final FieldInfo NONE = new FieldInfo(Flavor.NONE, null);
    public static final FieldInfo CON = new FieldInfo(Flavor.CON, null);
    public static final FieldInfo TUPLE = new FieldInfo(Flavor.TUPLE, null);
    public static final FieldInfo CONS = new FieldInfo(Flavor.CONS, null);

    private FieldInfo(Flavor flavor, @Nullable String name) {
      super(flavor, name);
    }

    /** Creates a hint that a field is a component of a module. */
    public static FieldInfo module(String name) {
      return new FieldInfo(Flavor.MODULE, requireNonNull(name));
    }

    /** Creates a hint that a field is a labeled field of a record. */
    public static FieldInfo record(String name) {
      return new FieldInfo(Flavor.RECORD, requireNonNull(name));
    }

    /** Creates a hint that a field is a labeled field of the inline record
     * argument of a constructor. */
    public static FieldInfo recordInline(String name) {
      return new FieldInfo(Flavor.RECORD_INLINE, requireNonNull(name));
    }

    /** Flavors of {@link FieldInfo}. */
    public enum Flavor {
      NONE,
      MODULE,
      RECORD,
      RECORD_INLINE,
      CON,
      TUPLE,
      CONS
    }
  }

  /** Pattern that the condition of an {@code if} tests for. */
  public static class MatchInfo extends NamedHint<MatchInfo.Flavor> {
    public static final MatchInfo NONE = new MatchInfo(Flavor.NONE, null);
    public static final MatchInfo NIL = new MatchInfo(Flavor.NIL, null);

    private MatchInfo(Flavor flavor, @Nullable String name) {
      super(flavor, name);
    }

    /** Creates a hint that a condition tests for a named constructor. */
    public static MatchInfo con(String name) {
      return new MatchInfo(Flavor.CON, requireNonNull(name));
    }

    /** Flavors of {@link MatchInfo}. */
    public enum Flavor {
      NONE,
      NIL,
      CON
    }
  }
}

// End Info.java
