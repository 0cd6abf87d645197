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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.strel.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.strel.Prop;
import net.hydromatic.strel.ast.Ast;
import net.hydromatic.strel.ast.Op;
import net.hydromatic.strel.ast.Pos;
import net.hydromatic.strel.ast.Shuttle;
import net.hydromatic.strel.ast.TimeInterval;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rewrites a formula so that it contains no {@link Ast.Globally}, and no
 * {@link Ast.Eventually} or {@link Ast.Until} with an interval.
 *
 * <p>Bounded operators are unrolled into chains of single-step {@link
 * Ast.Next}, so the size of the result is proportional to the bounds, and
 * nested bounded operators multiply. Boolean, spatial and unbounded temporal
 * operators are kept, with their arguments expanded.
 *
 * <p>Expanded sub-trees may be shared between several parents.
 */
public class IntervalExpander extends Shuttle {
  private final @Nullable Integer maxUnroll;

  /** Creates an IntervalExpander. */
  protected IntervalExpander(@Nullable Integer maxUnroll) {
    this.maxUnroll = maxUnroll;
  }

  /** Expands a formula with default settings. */
  public static Ast.Exp expand(Ast.Exp exp) {
    return expand(exp, ImmutableMap.of(), Tracers.empty());
  }

  /**
   * Expands a formula.
   *
   * <p>If expansion fails with a {@link CompileException} that the tracer
   * handles, returns the formula unchanged.
   */
  public static Ast.Exp expand(
      Ast.Exp exp, Map<Prop, Object> propMap, Tracer tracer) {
    final IntervalExpander expander =
        new IntervalExpander(Prop.MAX_UNROLL.intValueOrNull(propMap));
    final Ast.Exp expanded;
    try {
      expanded = exp.accept(expander);
    } catch (CompileException e) {
      if (!tracer.handleCompileException(e)) {
        throw e;
      }
      return exp;
    }
    tracer.onExpand(exp, expanded);
    return expanded;
  }

  /** Throws if a step count or window bound is too large to unroll. */
  private void checkUnroll(Ast.Exp exp, int bound) {
    if (maxUnroll != null && bound > maxUnroll) {
      throw new CompileException(
          "cannot unroll " + exp.op.lowerName() + " with bound " + bound
              + "; limit is " + maxUnroll,
          exp.pos);
    }
  }

  /** Wraps a formula in {@code k} single-step {@link Ast.Next} operators. */
  private static Ast.Exp shift(Pos pos, int k, Ast.Exp arg) {
    Ast.Exp e = arg;
    for (int i = 0; i < k; i++) {
      e = ast.next(pos, null, e);
    }
    return e;
  }

  @Override
  protected Ast.Exp visit(Ast.Not not) {
    final Ast.Exp arg = not.arg.accept(this);
    if (arg.op == Op.NOT) {
      return arg;
    }
    return not.copy(arg);
  }

  @Override
  protected Ast.Exp visit(Ast.Next next) {
    checkUnroll(next, next.stepCount());
    final Ast.Exp arg = next.arg.accept(this);
    if (next.steps == null) {
      return next.copy(arg);
    }
    return shift(next.pos, next.steps, arg);
  }

  @Override
  protected Ast.Exp visit(Ast.Globally globally) {
    // "G[i] a" is "! F[i] ! a"
    final Pos pos = globally.pos;
    return ast.not(
            pos,
            ast.eventually(pos, globally.interval, ast.not(pos, globally.arg)))
        .accept(this);
  }

  @Override
  protected Ast.Exp visit(Ast.Eventually eventually) {
    final TimeInterval interval = eventually.interval;
    if (interval == null) {
      return eventually.copy(null, eventually.arg.accept(this));
    }
    final Pos pos = eventually.pos;
    final int start = interval.startOrZero();
    if (interval.end == null) {
      // "F[t1,] a" is "X[t1] F a"
      return ast.next(pos, start, ast.eventually(pos, null, eventually.arg))
          .accept(this);
    }
    final int end = interval.end;
    checkUnroll(eventually, end);
    if (start > 0) {
      // "F[t1,t2] a" is "X[t1] F[0,t2-t1] a"
      return ast.next(
              pos,
              start,
              ast.eventually(
                  pos, TimeInterval.of(0, end - start), eventually.arg))
          .accept(this);
    }
    // "F[0,t2] a" is "a | X a | X X a | ... "
    final Ast.Exp arg = eventually.arg.accept(this);
    Ast.Exp e = arg;
    Ast.Exp term = arg;
    for (int k = 1; k <= end; k++) {
      term = ast.next(pos, null, term);
      e = ast.or(pos, e, term);
    }
    return e;
  }

  @Override
  protected Ast.Exp visit(Ast.Until until) {
    final Ast.Exp lhs = until.lhs.accept(this);
    final Ast.Exp rhs = until.rhs.accept(this);
    final TimeInterval interval = until.interval;
    if (interval == null) {
      return until.copy(lhs, null, rhs);
    }
    final Pos pos = until.pos;
    if (interval.end == null) {
      // "a U[t1,] b" is "G[0,t1] (a U b)"
      final int start = requireNonNull(interval.start);
      return ast.globally(
              pos, TimeInterval.of(0, start), ast.until(pos, lhs, null, rhs))
          .accept(this);
    }
    checkUnroll(until, interval.end);
    // "a U[t1,t2] b" is "F[t1,t2] a & a U[t1,] b"
    return ast.and(
        pos,
        ast.eventually(pos, interval, until.lhs).accept(this),
        ast.until(pos, lhs, TimeInterval.of(interval.start, null), rhs)
            .accept(this));
  }
}

// End IntervalExpander.java
