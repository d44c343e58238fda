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
package net.hydromatic.lambda.dump;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.EnumMap;
import java.util.Map;
import net.hydromatic.lambda.ast.Lambda;
import net.hydromatic.lambda.print.Printers;
import net.hydromatic.lambda.util.BoxWriter;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dumps the lambda code of compiled programs, if the {@link Prop#DUMP_LAMBDA}
 * property is set.
 *
 * <p>The text is written to the log at level INFO and passed to the
 * {@link Tracer}.
 */
public class LambdaDumper {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(LambdaDumper.class);

  private final ImmutableMap<Prop, Object> map;
  private final Tracer tracer;

  /** Creates a LambdaDumper. The properties are copied. */
  public LambdaDumper(Map<Prop, Object> map, Tracer tracer) {
    this.map = ImmutableMap.copyOf(map);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a LambdaDumper whose properties come from system properties
   * such as "lambda.dumpLambda" and "lambda.lineWidth". */
  public static LambdaDumper fromSystemProperties(Tracer tracer) {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    for (Prop prop : Prop.BY_CAMEL_NAME) {
      final String value = System.getProperty("lambda." + prop.camelName);
      if (value != null) {
        prop.setLenient(map, value);
      }
    }
    return new LambdaDumper(map, tracer);
  }

  /** Returns whether this dumper prints programs. */
  public boolean enabled() {
    return Prop.DUMP_LAMBDA.booleanValue(map);
  }

  /** Dumps a program, if enabled; returns its text, or null if not
   * enabled. */
  public @Nullable String dump(Lambda.Program program) {
    if (!enabled()) {
      LOGGER.debug("Not dumping lambda code of {}", program.compilationUnit);
      tracer.onSkip(program);
      return null;
    }
    final BoxWriter w = new BoxWriter(Prop.LINE_WIDTH.intValue(map));
    final String text = Printers.program(w, program).toString();
    LOGGER.info("Lambda code of {}:\n{}", program.compilationUnit, text);
    tracer.onDump(program, text);
    return text;
  }
}

// End LambdaDumper.java
