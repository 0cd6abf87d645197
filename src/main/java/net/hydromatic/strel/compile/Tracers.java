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
package net.hydromatic.strel.compile;

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.strel.ast.Ast;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on a parsed formula, then
   * calls the underlying tracer.
   */
  public static Tracer withOnParse(Tracer tracer, Consumer<Ast.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onParse(Ast.Exp e) {
        consumer.accept(e);
        super.onParse(e);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on a formula and its
   * expansion, then calls the underlying tracer.
   */
  public static Tracer withOnExpand(
      Tracer tracer, BiConsumer<Ast.Exp, Ast.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onExpand(Ast.Exp e, Ast.Exp expanded) {
        consumer.accept(e, expanded);
        super.onExpand(e, expanded);
      }
    };
  }

  /**
   * Returns a tracer that handles compile exceptions by passing them to the
   * given action.
   */
  public static Tracer withOnCompileException(
      Tracer tracer, Consumer<CompileException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean handleCompileException(CompileException e) {
        consumer.accept(e);
        super.handleCompileException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onParse(Ast.Exp e) {}

    @Override
    public void onExpand(Ast.Exp e, Ast.Exp expanded) {}

    @Override
    public boolean handleCompileException(CompileException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onParse(Ast.Exp e) {
      tracer.onParse(e);
    }

    @Override
    public void onExpand(Ast.Exp e, Ast.Exp expanded) {
      tracer.onExpand(e, expanded);
    }

    @Override
    public boolean handleCompileException(CompileException e) {
      return tracer.handleCompileException(e);
    }
  }
}

// End Tracers.java
