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

/**
 * Identifier.
 *
 * <p>Two identifiers with the same name are distinct if their stamps differ,
 * so "x/1" and "x/2" are different variables. A stamp of 0 means that the
 * identifier was created without a stamp, and it prints as just its name.
 *
 * <p>Global identifiers (compilation units and predefined exceptions) print
 * with a trailing "!", for example "Stdlib!".
 */
public class Ident implements Comparable<Ident> {
  public final String name;
  public final int stamp;
  public final boolean global;

  private Ident(String name, int stamp, boolean global) {
    this.name = requireNonNull(name, "name");
    this.stamp = stamp;
    this.global = global;
    checkArgument(!name.isEmpty(), "empty name");
    checkArgument(stamp >= 0, "negative stamp %s", stamp);
  }

  /** Creates a local identifier with a given stamp. */
  public static Ident of(String name, int stamp) {
    return new Ident(name, stamp, false);
  }

  /** Creates a local identifier without a stamp. */
  public static Ident of(String name) {
    return new Ident(name, 0, false);
  }

  /** Creates a global identifier. */
  public static Ident global(String name) {
    return new Ident(name, 0, true);
  }

  @Override public int hashCode() {
    return name.hashCode() * 31 + stamp + (global ? 1 : 0);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Ident
        && ((Ident) o).name.equals(name)
        && ((Ident) o).stamp == stamp
        && ((Ident) o).global == global;
  }

  /** Collates first on name, then on stamp. */
  @Override public int compareTo(Ident o) {
    int c = name.compareTo(o.name);
    if (c != 0) {
      return c;
    }
    c = Integer.compare(stamp, o.stamp);
    if (c != 0) {
      return c;
    }
    return Boolean.compare(global, o.global);
  }

  @Override public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  /** Appends the printed form of this identifier to a builder. */
  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(name);
    if (stamp != 0) {
      buf.append('/').append(stamp);
    }
    if (global) {
      buf.append('!');
    }
    return buf;
  }
}

// End Ident.java
