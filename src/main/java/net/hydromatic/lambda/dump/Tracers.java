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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.lambda.ast.Lambda;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on the text of a
   * dumped program, then calls the underlying tracer. */
  public static Tracer withOnDump(Tracer tracer,
      BiConsumer<Lambda.Program, String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onDump(Lambda.Program program, String text) {
        consumer.accept(program, text);
        super.onDump(program, text);
      }
    };
  }

  /** Returns a tracer that performs the given action on a program that is
   * not dumped, then calls the underlying tracer. */
  public static Tracer withOnSkip(Tracer tracer,
      Consumer<Lambda.Program> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onSkip(Lambda.Program program) {
        consumer.accept(program);
        super.onSkip(program);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onDump(Lambda.Program program, String text) {
    }

    @Override public void onSkip(Lambda.Program program) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onDump(Lambda.Program program, String text) {
      tracer.onDump(program, text);
    }

    @Override public void onSkip(Lambda.Program program) {
      tracer.onSkip(program);
    }
  }
}

// End Tracers.java
