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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests for {@link BoxWriter}. */
public class BoxWriterTest {
  @Test void testFlat() {
    final BoxWriter w = new BoxWriter();
    w.append("a").space().append("b").append(42);
    assertThat(w, hasToString("a b42"));
    assertThat(w.lineWidth(), is(-1));
    assertThat(new BoxWriter(), hasToString(""));
  }

  @Test void testEmptyTextIsIgnored() {
    final BoxWriter w = new BoxWriter(4);
    w.box(0).append("").append("abcd").append("").close();
    assertThat(w, hasToString("abcd"));
  }

  @Test void testInvalid() {
    assertThrows(IllegalArgumentException.class,
        () -> new BoxWriter().append("a\nb"));
    assertThrows(IllegalArgumentException.class,
        () -> new BoxWriter().brk(-1, 0));
    assertThrows(IllegalStateException.class,
        () -> new BoxWriter().close());
    final BoxWriter w = new BoxWriter().box(2).append("x");
    assertThrows(IllegalStateException.class, w::toString);
  }

  /** A structural box fills each line and breaks only where the next
   * piece would not fit. */
  @Test void testHovBox() {
    final BoxWriter w = new BoxWriter(10);
    w.box(2).append("(f")
        .space().append("aaaa")
        .space().append("bbbb")
        .space().append("cccc")
        .append(")")
        .close();
    assertThat(w, hasToString("(f aaaa\n"
        + "  bbbb\n"
        + "  cccc)"));
  }

  @Test void testHovBoxFits() {
    final BoxWriter w = new BoxWriter(18);
    w.box(2).append("(f")
        .space().append("aaaa")
        .space().append("bbbb")
        .space().append("cccc")
        .append(")")
        .close();
    assertThat(w, hasToString("(f aaaa bbbb cccc)"));
  }

  /** A horizontal-vertical box breaks everywhere or nowhere. */
  @Test void testHvBox() {
    final BoxWriter w = new BoxWriter(10);
    w.hvBox(1).append("a")
        .space().append("bbbbbbbbbb")
        .space().append("c")
        .close();
    assertThat(w, hasToString("a\n"
        + " bbbbbbbbbb\n"
        + " c"));

    final BoxWriter w2 = new BoxWriter(10);
    w2.hvBox(1).append("a").space().append("b").close();
    assertThat(w2, hasToString("a b"));
  }

  @Test void testVBox() {
    final BoxWriter w = new BoxWriter();
    w.vBox(0).append("a").space().append("b").close();
    assertThat(w, hasToString("a\nb"));
  }

  /** A vertical box that breaks forces a break before it in the enclosing
   * box, even if the line width is unlimited. */
  @Test void testVBoxForcesEnclosingBreak() {
    final BoxWriter w = new BoxWriter();
    w.box(1).append("(s x")
        .space()
        .vBox(0).append("p").space().append("q").close()
        .append(")")
        .close();
    assertThat(w, hasToString("(s x\n"
        + " p\n"
        + " q)"));

    // A vertical box with no breaks is measured like any other
    final BoxWriter w2 = new BoxWriter();
    w2.box(1).append("(s x")
        .space()
        .vBox(0).append("p").close()
        .append(")")
        .close();
    assertThat(w2, hasToString("(s x p)"));
  }

  /** Text after a box, up to the next break, must fit on the same line as
   * the end of the box. */
  @Test void testTextAfterBoxCountsTowardsFit() {
    final BoxWriter w = new BoxWriter(10);
    w.box(2).append("(f")
        .space()
        .box(0).append("aaaa").space().append("bbb").close()
        .append(")))")
        .close();
    assertThat(w, hasToString("(f\n"
        + "  aaaa\n"
        + "  bbb)))"));
  }

  @Test void testTrailingSpacesRemoved() {
    final BoxWriter w = new BoxWriter();
    w.vBox(0).append("a  ").space().append("b").close();
    assertThat(w, hasToString("a\nb"));
  }

  @Test void testBreakOffset() {
    final BoxWriter w = new BoxWriter(5);
    w.box(2).append("try")
        .space().append("body")
        .brk(1, -1).append("with")
        .close();
    assertThat(w, hasToString("try\n"
        + "  body\n"
        + " with"));
  }

  @Test void testIndentIsNeverNegative() {
    final BoxWriter w = new BoxWriter(5);
    w.box(0).append("aaaaaa").brk(1, -5).append("bbbbbb").close();
    assertThat(w, hasToString("aaaaaa\nbbbbbb"));
  }

  /** Indentation is relative to the column where the box opened. */
  @Test void testIndentRelativeToOpenColumn() {
    final BoxWriter w = new BoxWriter(8);
    w.append("xx")
        .box(2).append("(a").space().append("bbbbbbbbbb").close();
    assertThat(w, hasToString("xx(a\n"
        + "    bbbbbbbbbb"));
  }

  /** Deeply nested boxes lay out in time linear in their size. */
  @Test void testDeepNesting() {
    final int n = 2_000;
    final BoxWriter w = new BoxWriter(40);
    for (int i = 0; i < n; i++) {
      w.box(0).append("(").space();
    }
    for (int i = 0; i < n; i++) {
      w.append(")").close();
    }
    final String s = w.toString();
    int open = 0;
    int close = 0;
    for (int i = 0; i < s.length(); i++) {
      if (s.charAt(i) == '(') {
        ++open;
      } else if (s.charAt(i) == ')') {
        ++close;
      }
    }
    assertThat(open, is(n));
    assertThat(close, is(n));
  }
}

// End BoxWriterTest.java
