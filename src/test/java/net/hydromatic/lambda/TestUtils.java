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
package net.hydromatic.lambda;

import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.LineNumberReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.incava.diff.Diff;
import org.incava.diff.Difference;

/** Utility methods for testing. */
public class TestUtils {
  private TestUtils() {}

  /** Converts a URL to a file, or returns null if it is not a "file:" URL. */
  public static @Nullable File urlToFile(URL url) {
    if (!"file".equals(url.getProtocol())) {
      return null;
    }
    URI uri;
    try {
      uri = url.toURI();
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException(
          "Unable to convert URL " + url + " to URI", e);
    }
    if (uri.isOpaque()) {
      // For example "file:test%20file.ref"
      return new File(uri.getSchemeSpecificPart());
    }
    return Paths.get(uri).toFile();
  }

  /** Returns the file of a test resource, for example
   * "target/test-classes/golden/primitives.ref" for path
   * "golden/primitives.ref". */
  public static File findResource(String path) {
    final URL url = TestUtils.class.getResource("/" + path);
    assertThat("resource " + path, url, notNullValue());
    final File file = urlToFile(url);
    assertThat("file of " + url, file, notNullValue());
    return file;
  }

  @SuppressWarnings("unused")
  public static void discard(boolean value) {}

  /**
   * Creates a {@link PrintWriter} to a given output stream using UTF-8
   * character set.
   *
   * <p>Does not use the default character set.
   */
  public static PrintWriter printWriter(OutputStream out) {
    return new PrintWriter(
        new BufferedWriter(
            new OutputStreamWriter(out, StandardCharsets.UTF_8)));
  }

  /** Creates a {@link PrintWriter} to a given file using UTF-8 character
   * set. */
  public static PrintWriter printWriter(File file)
      throws FileNotFoundException {
    return printWriter(new FileOutputStream(file));
  }

  /**
   * Creates a {@link BufferedReader} to a given input stream using UTF-8
   * character set.
   *
   * <p>Does not use the default character set.
   */
  public static BufferedReader reader(InputStream in) {
    return new BufferedReader(
        new InputStreamReader(in, StandardCharsets.UTF_8));
  }

  /** Creates a {@link BufferedReader} to read a given file using UTF-8
   * character set. */
  public static BufferedReader reader(File file) throws FileNotFoundException {
    return reader(new FileInputStream(file));
  }

  /**
   * Returns a string containing the difference between the contents of two
   * files. The string has a similar format to the UNIX 'diff' utility.
   */
  public static String diff(File file1, File file2) {
    List<String> lines1 = fileLines(file1);
    List<String> lines2 = fileLines(file2);
    return diffLines(lines1, lines2);
  }

  /**
   * Returns a string containing the difference between the two lists of
   * lines, or the empty string if they are the same.
   */
  public static String diffLines(List<String> lines1, List<String> lines2) {
    final Diff<String> diff = new Diff<>(lines1, lines2);
    final List<Difference> differences = diff.execute();
    StringWriter sw = new StringWriter();
    for (Difference d : differences) {
      final int as = d.getAddedStart() + 1;
      final int ae = d.getAddedEnd() + 1;
      final int ds = d.getDeletedStart() + 1;
      final int de = d.getDeletedEnd() + 1;
      if (ae == 0) {
        if (de != 0) {
          // a deletion: "<ds>,<de>d<as>"
          range(sw, ds, de).append("d").append(String.valueOf(as - 1))
              .append('\n');
          lines(sw, "< ", lines1, ds, de);
        }
      } else if (de == 0) {
        // an addition: "<ds>a<as>,<ae>"
        sw.append(String.valueOf(ds - 1)).append("a");
        range(sw, as, ae).append('\n');
        lines(sw, "> ", lines2, as, ae);
      } else {
        // a change: "<ds>,<de>c<as>,<ae>"
        range(sw, ds, de).append("c");
        range(sw, as, ae).append('\n');
        lines(sw, "< ", lines1, ds, de);
        sw.append("---\n");
        lines(sw, "> ", lines2, as, ae);
      }
    }
    return sw.toString();
  }

  private static StringWriter range(StringWriter sw, int start, int end) {
    sw.append(String.valueOf(start));
    if (end > start) {
      sw.append(",").append(String.valueOf(end));
    }
    return sw;
  }

  private static void lines(StringWriter sw, String prefix,
      List<String> lines, int start, int end) {
    for (int i = start - 1; i < end; ++i) {
      sw.append(prefix).append(lines.get(i)).append('\n');
    }
  }

  /**
   * Returns a list of the lines in a given file, or an empty list if the file
   * does not exist.
   */
  static List<String> fileLines(File file) {
    List<String> lines = new ArrayList<>();
    if (!file.exists()) {
      return lines;
    }
    try (LineNumberReader r = new LineNumberReader(reader(file))) {
      String line;
      while ((line = r.readLine()) != null) {
        lines.add(line);
      }
      return lines;
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }
}

// End TestUtils.java
