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
import org.checkerframework.checker.nullness.qual.Nullable;

/** How the fields of a record are laid out in memory. */
public class RecordRepresentation {
  /** All fields are boxed, in a block with tag 0. */
  public static final RecordRepresentation REGULAR =
      new RecordRepresentation(Flavor.REGULAR, 0, false, null);

  /** A record with a single field, represented as that field. */
  public static final RecordRepresentation UNBOXED =
      new RecordRepresentation(Flavor.UNBOXED, 0, false, null);

  /** A record with a single field, the inline argument of a constructor,
   * represented as that field. */
  public static final RecordRepresentation INLINED_UNBOXED =
      new RecordRepresentation(Flavor.UNBOXED, 0, true, null);

  /** All fields are unboxed floats, in a float array. */
  public static final RecordRepresentation FLOAT =
      new RecordRepresentation(Flavor.FLOAT, 0, false, null);

  public final Flavor flavor;
  /** Block tag, if {@link Flavor#INLINED}. */
  public final int tag;
  /** Whether an {@link Flavor#UNBOXED} record is a constructor argument. */
  public final boolean inlined;
  /** Path of the extension constructor, if {@link Flavor#EXTENSION}. */
  public final @Nullable String path;

  private RecordRepresentation(Flavor flavor, int tag, boolean inlined,
      @Nullable String path) {
    this.flavor = requireNonNull(flavor);
    this.tag = tag;
    this.inlined = inlined;
    this.path = path;
    checkArgument((path != null) == (flavor == Flavor.EXTENSION));
  }

  /** Creates the representation of the inline record argument of the
   * constructor whose block has a given tag. */
  public static RecordRepresentation inlined(int tag) {
    checkArgument(tag >= 0, "negative tag %s", tag);
    return new RecordRepresentation(Flavor.INLINED, tag, false, null);
  }

  /** Creates the representation of the inline record argument of an
   * extension constructor. */
  public static RecordRepresentation extension(String path) {
    return new RecordRepresentation(Flavor.EXTENSION, 0, false,
        requireNonNull(path, "path"));
  }

  @Override public int hashCode() {
    return Objects.hash(flavor, tag, inlined, path);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof RecordRepresentation
        && flavor == ((RecordRepresentation) o).flavor
        && tag == ((RecordRepresentation) o).tag
        && inlined == ((RecordRepresentation) o).inlined
        && Objects.equals(path, ((RecordRepresentation) o).path);
  }

  /** Sub-types of {@link RecordRepresentation}. */
  public enum Flavor {
    REGULAR,
    INLINED,
    UNBOXED,
    FLOAT,
    EXTENSION
  }
}

// End RecordRepresentation.java
