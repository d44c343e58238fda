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
package net.hydromatic.lambda.util;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Sink for text that is laid out in nested boxes.
 *
 * <p>A printer appends text, opens and closes boxes, and marks the places
 * where a line may break. Nothing is laid out until {@link #toString()} is
 * called; then each break becomes either spaces or a newline followed by
 * indentation, depending on the kind of the enclosing box and on whether
 * the material fits in the line width.
 *
 * <p>There are three kinds of box:
 *
 * <ul>
 * <li>A structural box ({@link #box(int)}) breaks a line only where the
 *     material up to its next break would not fit, or where the current
 *     line is indented further than the new line would be;
 * <li>A horizontal-vertical box ({@link #hvBox(int)}) is either entirely on
 *     one line, or breaks at every break;
 * <li>A vertical box ({@link #vBox(int)}) breaks at every break.
 * </ul>
 *
 * <p>A vertical box that contains a break never fits on one line, and
 * neither does any box that contains it.
 *
 * <p>The text that follows a box up to the next break, such as closing
 * parentheses, counts towards whether the box fits.
 *
 * <p>After a line break, the next line is indented to the column at which
 * the box opened, plus the box's indent, plus the break's offset.
 *
 * <p>A writer is intended for a single print call; it is not thread-safe.
 */
public class BoxWriter {
  /** Width of material that contains a forced line break. */
  private static final int INFINITE = Integer.MAX_VALUE;

  private final int lineWidth;
  private final Box root = new Box(Kind.HOV, 0, null);
  private Box current = root;

  /** Creates a BoxWriter with a given line width. A negative width means
   * that lines are never broken, except in vertical boxes. */
  public BoxWriter(int lineWidth) {
    this.lineWidth = lineWidth;
  }

  /** Creates a BoxWriter that does not limit the line width. */
  public BoxWriter() {
    this(-1);
  }

  /** Returns the line width; negative if unlimited. */
  public int lineWidth() {
    return lineWidth;
  }

  /** Appends text. The text must not contain a newline. */
  public BoxWriter append(String s) {
    checkArgument(s.indexOf('\n') < 0, "text contains newline: %s", s);
    if (!s.isEmpty()) {
      current.items.add(new Text(s));
    }
    return this;
  }

  /** Appends an integer. */
  public BoxWriter append(long i) {
    return append(Long.toString(i));
  }

  /** Opens a structural box. */
  public BoxWriter box(int indent) {
    return open(Kind.HOV, indent);
  }

  /** Opens a horizontal-vertical box. */
  public BoxWriter hvBox(int indent) {
    return open(Kind.HV, indent);
  }

  /** Opens a vertical box. */
  public BoxWriter vBox(int indent) {
    return open(Kind.V, indent);
  }

  private BoxWriter open(Kind kind, int indent) {
    final Box box = new Box(kind, indent, current);
    current.items.add(box);
    current = box;
    return this;
  }

  /** Closes the innermost open box. */
  public BoxWriter close() {
    checkState(current.parent != null, "no box is open");
    current = current.parent;
    return this;
  }

  /** Appends a break that is one space if the line is not broken. */
  public BoxWriter space() {
    return brk(1, 0);
  }

  /** Appends a break that is {@code spaces} spaces if the line is not
   * broken, and that adds {@code offset} to the indentation if it is. */
  public BoxWriter brk(int spaces, int offset) {
    checkArgument(spaces >= 0, "negative spaces %s", spaces);
    current.items.add(new Break(spaces, offset));
    return this;
  }

  /** Lays out the text and returns it.
   *
   * <p>Throws if a box is still open. */
  @Override public String toString() {
    checkState(current == root, "box is not closed");
    final Renderer renderer = new Renderer();
    renderer.render(root, 0);
    return renderer.buf.toString();
  }

  /** Adds two widths, either of which may be {@link #INFINITE}. */
  private static int add(int w0, int w1) {
    return w0 >= INFINITE - w1 ? INFINITE : w0 + w1;
  }

  /** Kind of box. */
  private enum Kind {
    HOV,
    HV,
    V
  }

  /** Element of a box. */
  private abstract static class Item {
  }

  /** Text item. */
  private static class Text extends Item {
    final String s;

    Text(String s) {
      this.s = requireNonNull(s);
    }
  }

  /** Break hint. */
  private static class Break extends Item {
    final int spaces;
    final int offset;

    Break(int spaces, int offset) {
      this.spaces = spaces;
      this.offset = offset;
    }
  }

  /** Box, containing text, breaks and other boxes. */
  private static class Box extends Item {
    final Kind kind;
    final int indent;
    final @Nullable Box parent;
    final List<Item> items = new ArrayList<>();

    Box(Kind kind, int indent, @Nullable Box parent) {
      this.kind = requireNonNull(kind);
      this.indent = indent;
      this.parent = parent;
    }
  }

  /** Lays out a tree of boxes. */
  private class Renderer {
    final StringBuilder buf = new StringBuilder();
    final Map<Box, Integer> widths = new IdentityHashMap<>();
    int column = 0;
    /** Indentation of the current line. */
    int lineIndent = 0;

    /** Returns the width of an item if laid out on one line, or
     * {@link #INFINITE} if it contains a forced line break.
     *
     * <p>Caches the width of boxes, which would otherwise be computed once
     * per enclosing box. */
    int width(Item item) {
      if (item instanceof Text) {
        return ((Text) item).s.length();
      }
      if (item instanceof Break) {
        return ((Break) item).spaces;
      }
      final Box box = (Box) item;
      final Integer cached = widths.get(box);
      if (cached != null) {
        return cached;
      }
      int w = 0;
      for (Item child : box.items) {
        if (box.kind == Kind.V && child instanceof Break) {
          w = INFINITE;
          break;
        }
        w = add(w, width(child));
      }
      widths.put(box, w);
      return w;
    }

    /** Returns the width of the items of a box from {@code i} up to, but
     * not including, the next break. If the box has no further break, adds
     * {@code trailer}, the width of the text that follows the box on the
     * same line. */
    int widthToBreak(Box box, int i, int trailer) {
      int w = 0;
      for (; i < box.items.size(); i++) {
        final Item item = box.items.get(i);
        if (item instanceof Break) {
          return w;
        }
        w = add(w, width(item));
      }
      return add(w, trailer);
    }

    /** Renders a box; {@code trailer} is the width of the text that
     * follows the box up to the next break in an enclosing box, such as
     * closing parentheses. */
    void render(Box box, int trailer) {
      final int openColumn = column;
      final int width = add(width(box), trailer);
      final boolean fits = width < INFINITE
          && (lineWidth < 0 || column + width <= lineWidth);
      for (int i = 0; i < box.items.size(); i++) {
        final Item item = box.items.get(i);
        if (item instanceof Text) {
          buf.append(((Text) item).s);
          column += ((Text) item).s.length();
        } else if (item instanceof Box) {
          render((Box) item, widthToBreak(box, i + 1, trailer));
        } else {
          final Break brk = (Break) item;
          final int indent =
              Math.max(0, openColumn + box.indent + brk.offset);
          if (breaks(box, fits, brk, i, indent, trailer)) {
            newline(indent);
          } else {
            spaces(brk.spaces);
          }
        }
      }
    }

    private boolean breaks(Box box, boolean fits, Break brk, int i,
        int indent, int trailer) {
      switch (box.kind) {
      case V:
        return true;
      case HV:
        return !fits;
      case HOV:
        if (fits) {
          return false;
        }
        final int next = widthToBreak(box, i + 1, trailer);
        return next >= INFINITE
            || lineWidth >= 0 && column + brk.spaces + next > lineWidth
            || lineIndent > indent;
      default:
        throw new AssertionError("unknown box kind " + box.kind);
      }
    }

    private void newline(int indent) {
      // Remove trailing spaces, then start a new line
      while (buf.length() > 0 && buf.charAt(buf.length() - 1) == ' ') {
        buf.setLength(buf.length() - 1);
      }
      buf.append('\n');
      column = 0;
      lineIndent = indent;
      spaces(indent);
    }

    private void spaces(int n) {
      for (int i = 0; i < n; i++) {
        buf.append(' ');
      }
      column += n;
    }
  }
}

// End BoxWriter.java
