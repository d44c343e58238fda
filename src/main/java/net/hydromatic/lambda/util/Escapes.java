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
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Escapes characters and strings in the syntax of the source language.
 *
 * <p>Printable ASCII characters are unchanged, except for backslash and the
 * quote character of the literal. Newline, tab, carriage return and
 * backspace have short escapes. Any other byte becomes a backslash and three
 * decimal digits. A non-ASCII character in a string is first encoded as
 * UTF-8; a character literal holds one byte, so it is escaped as that byte.
 */
public class Escapes {
  private Escapes() {}

  /** Converts a character to the body of a character literal.
   * For example, {@code escapeChar('\'')} returns "\\'", and
   * {@code escapeChar((char) 233)} returns "\\233".
   *
   * @throws IllegalArgumentException if the character is not in the range
   * 0 to 255 */
  public static String escapeChar(char c) {
    checkArgument(c <= 0xff, "character %s is not a single byte", (int) c);
    final StringBuilder b = new StringBuilder();
    escape(b, new byte[] {(byte) c}, '\'');
    return b.toString();
  }

  /** Converts a string to the body of a string literal.
   * For example, {@code escapeString("a\"b")} returns "a\\\"b". */
  public static String escapeString(String s) {
    if (!requiresEscape(s)) {
      return s;
    }
    final StringBuilder b = new StringBuilder();
    escape(b, s.getBytes(UTF_8), '"');
    return b.toString();
  }

  private static boolean requiresEscape(String s) {
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c < 32 || c == '"' || c == '\\' || c > 126) {
        return true;
      }
    }
    return false;
  }

  private static void escape(StringBuilder b, byte[] bytes, char quote) {
    for (byte x : bytes) {
      final int c = x & 0xff;
      switch (c) {
      case '\\':
        b.append("\\\\");
        break;
      case '\n':
        b.append("\\n");
        break;
      case '\t':
        b.append("\\t");
        break;
      case '\r':
        b.append("\\r");
        break;
      case '\b':
        b.append("\\b");
        break;
      default:
        if (c == quote) {
          b.append('\\').append((char) c);
        } else if (c >= ' ' && c <= '~') {
          b.append((char) c);
        } else {
          b.append('\\');
          if (c < 100) {
            b.append('0');
          }
          if (c < 10) {
            b.append('0');
          }
          b.append(c);
        }
      }
    }
  }
}

// End Escapes.java
