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

/**
 * Source location attached to a debug event.
 *
 * <p>Offsets are character offsets from the start of the file, not columns.
 * A ghost location is one that the compiler synthesized and that does not
 * correspond exactly to source text.
 */
public class Location {
  /** Location of code that has no source. */
  public static final Location NONE = new Location("_none_", 0, -1, -1, true);

  public final String file;
  public final int line;
  public final int startOffset;
  public final int endOffset;
  public final boolean ghost;

  /** Creates a Location. */
  public Location(String file, int line, int startOffset, int endOffset,
      boolean ghost) {
    this.file = requireNonNull(file, "file");
    this.line = line;
    this.startOffset = startOffset;
    this.endOffset = endOffset;
    this.ghost = ghost;
    checkArgument(endOffset >= startOffset,
        "end offset %s precedes start offset %s", endOffset, startOffset);
  }

  /** Creates a non-ghost location. */
  public static Location of(String file, int line, int startOffset,
      int endOffset) {
    return new Location(file, line, startOffset, endOffset, false);
  }

  @Override public int hashCode() {
    return Objects.hash(file, line, startOffset, endOffset, ghost);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Location
        && this.file.equals(((Location) o).file)
        && this.line == ((Location) o).line
        && this.startOffset == ((Location) o).startOffset
        && this.endOffset == ((Location) o).endOffset
        && this.ghost == ((Location) o).ghost;
  }

  @Override public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  /** Appends a location in the form "file(line)[&lt;ghost&gt;]:start-end". */
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append(file)
        .append('(')
        .append(line)
        .append(')')
        .append(ghost ? "<ghost>" : "")
        .append(':')
        .append(startOffset)
        .append('-')
        .append(endOffset);
  }
}

// End Location.java
