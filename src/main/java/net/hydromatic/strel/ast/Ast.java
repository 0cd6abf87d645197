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
package net.hydromatic.strel.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.strel.ast.AstBuilder.ast;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.function.ObjIntConsumer;
import net.hydromatic.strel.compile.IntervalExpander;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Returns null if an interval is equivalent to {@code [0, ∞)}. */
  private static @Nullable TimeInterval normalize(
      @Nullable TimeInterval interval) {
    return interval == null || interval.isUntimed() ? null : interval;
  }

  /** Base class of formula ASTs. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }

    public void forEachArg(ObjIntConsumer<Exp> action) {
      // no args
    }

    @Override
    public abstract Exp accept(Shuttle shuttle);

    /** Returns a list of all arguments. */
    public final List<Exp> args() {
      final ImmutableList.Builder<Exp> args = ImmutableList.builder();
      forEachArg((exp, i) -> args.add(exp));
      return args.build();
    }

    /**
     * Returns an equivalent formula that contains no {@link Globally}, and no
     * {@link Eventually} or {@link Until} with an interval.
     *
     * @see IntervalExpander
     */
    public Exp expandIntervals() {
      return IntervalExpander.expand(this);
    }
  }

  /** Parse tree node of a boolean literal, "true" or "false". */
  public static class Constant extends Exp {
    public final boolean value;

    Constant(Pos pos, boolean value) {
      super(pos, Op.BOOL_LITERAL);
      this.value = value;
    }

    @Override
    public int hashCode() {
      return Boolean.hashCode(value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Constant && this.value == ((Constant) o).value;
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(value ? "true" : "false");
    }
  }

  /** Parse tree node of an identifier, i.e. a reference to a predicate. */
  public static class Identifier extends Exp {
    public final String name;

    Identifier(Pos pos, String name) {
      super(pos, Op.ID);
      this.name = requireNonNull(name);
      checkArgument(
          !name.isEmpty(), "Identifier has to have a non-empty value");
      checkArgument(
          !CharMatcher.whitespace().matchesAllOf(name),
          "Identifier cannot have only whitespace characters");
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Identifier && this.name.equals(((Identifier) o).name);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.id(name);
    }
  }

  /** Negation, "! a". */
  public static class Not extends Exp {
    public final Exp arg;

    Not(Pos pos, Exp arg) {
      super(pos, Op.NOT);
      this.arg = requireNonNull(arg);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, arg);
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Not && arg.equals(((Not) o).arg);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(arg, 0);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(op.padded).append(arg);
    }

    /**
     * Creates a copy of this {@code Not} with given contents, or {@code this}
     * if the contents are the same.
     */
    public Not copy(Exp arg) {
      return this.arg.equals(arg) ? this : ast.not(pos, arg);
    }
  }

  /** Base class for a call to a binary boolean operator. */
  public abstract static class BinaryCall extends Exp {
    public final Exp lhs;
    public final Exp rhs;

    BinaryCall(Pos pos, Op op, Exp lhs, Exp rhs) {
      super(pos, op);
      this.lhs = requireNonNull(lhs);
      this.rhs = requireNonNull(rhs);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, lhs, rhs);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof BinaryCall
              && op == ((BinaryCall) o).op
              && lhs.equals(((BinaryCall) o).lhs)
              && rhs.equals(((BinaryCall) o).rhs);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(lhs, 0);
      action.accept(rhs, 1);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.infix(lhs, op, null, rhs);
    }
  }

  /** Conjunction, "a &amp; b". */
  public static class And extends BinaryCall {
    And(Pos pos, Exp lhs, Exp rhs) {
      super(pos, Op.AND, lhs, rhs);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /**
     * Creates a copy of this {@code And} with given contents, or {@code this}
     * if the contents are the same.
     */
    public And copy(Exp lhs, Exp rhs) {
      return this.lhs.equals(lhs) && this.rhs.equals(rhs)
          ? this
          : ast.and(pos, lhs, rhs);
    }
  }

  /** Disjunction, "a | b". */
  public static class Or extends BinaryCall {
    Or(Pos pos, Exp lhs, Exp rhs) {
      super(pos, Op.OR, lhs, rhs);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /**
     * Creates a copy of this {@code Or} with given contents, or {@code this} if
     * the contents are the same.
     */
    public Or copy(Exp lhs, Exp rhs) {
      return this.lhs.equals(lhs) && this.rhs.equals(rhs)
          ? this
          : ast.or(pos, lhs, rhs);
    }
  }

  /**
   * Base class for a unary spatial operator: {@link Everywhere}, {@link
   * Somewhere}, {@link Escape}.
   */
  public abstract static class SpatialUnary extends Exp {
    public final DistanceInterval interval;
    public final Exp arg;

    SpatialUnary(Pos pos, Op op, DistanceInterval interval, Exp arg) {
      super(pos, op);
      this.interval = requireNonNull(interval);
      this.arg = requireNonNull(arg);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, interval, arg);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof SpatialUnary
              && op == ((SpatialUnary) o).op
              && interval.equals(((SpatialUnary) o).interval)
              && arg.equals(((SpatialUnary) o).arg);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(arg, 0);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.prefix(op, interval, arg);
    }

    /**
     * Creates a copy of this spatial operator with given argument and the same
     * operator and interval, or {@code this} if the argument is the same.
     */
    public SpatialUnary copy(Exp arg) {
      return this.arg.equals(arg) ? this : ast.spatial(pos, op, interval, arg);
    }
  }

  /** Spatial universal, "everywhere[d1,d2] a". */
  public static class Everywhere extends SpatialUnary {
    Everywhere(Pos pos, DistanceInterval interval, Exp arg) {
      super(pos, Op.EVERYWHERE, interval, arg);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Spatial existential, "somewhere[d1,d2] a". */
  public static class Somewhere extends SpatialUnary {
    Somewhere(Pos pos, DistanceInterval interval, Exp arg) {
      super(pos, Op.SOMEWHERE, interval, arg);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Spatial escape, "escape[d1,d2] a". */
  public static class Escape extends SpatialUnary {
    Escape(Pos pos, DistanceInterval interval, Exp arg) {
      super(pos, Op.ESCAPE, interval, arg);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Spatial reach, "a reach[d1,d2] b". */
  public static class Reach extends Exp {
    public final Exp lhs;
    public final DistanceInterval interval;
    public final Exp rhs;

    Reach(Pos pos, Exp lhs, DistanceInterval interval, Exp rhs) {
      super(pos, Op.REACH);
      this.lhs = requireNonNull(lhs);
      this.interval = requireNonNull(interval);
      this.rhs = requireNonNull(rhs);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, lhs, interval, rhs);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Reach
              && lhs.equals(((Reach) o).lhs)
              && interval.equals(((Reach) o).interval)
              && rhs.equals(((Reach) o).rhs);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(lhs, 0);
      action.accept(rhs, 1);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.infix(lhs, op, interval, rhs);
    }

    /**
     * Creates a copy of this {@code Reach} with given contents and the same
     * interval, or {@code this} if the contents are the same.
     */
    public Reach copy(Exp lhs, Exp rhs) {
      return this.lhs.equals(lhs) && this.rhs.equals(rhs)
          ? this
          : ast.reach(pos, lhs, interval, rhs);
    }
  }

  /**
   * Discrete step shift, "X a" or "X[n] a".
   *
   * <p>A step count of 1 is stored as null.
   */
  public static class Next extends Exp {
    public final @Nullable Integer steps;
    public final Exp arg;

    Next(Pos pos, @Nullable Integer steps, Exp arg) {
      super(pos, Op.NEXT);
      checkArgument(
          steps == null || steps > 0,
          "Next operator cannot have non-positive steps: %s",
          steps);
      this.steps = steps == null || steps == 1 ? null : steps;
      this.arg = requireNonNull(arg);
    }

    /** Returns the number of steps; 1 if {@link #steps} is null. */
    public int stepCount() {
      return steps == null ? 1 : steps;
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, steps, arg);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Next
              && Objects.equals(steps, ((Next) o).steps)
              && arg.equals(((Next) o).arg);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(arg, 0);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.prefix(op, steps == null ? null : "[" + steps + "]", arg);
    }

    /**
     * Creates a copy of this {@code Next} with given argument and the same
     * step count, or {@code this} if the argument is the same.
     */
    public Next copy(Exp arg) {
      return this.arg.equals(arg) ? this : ast.next(pos, steps, arg);
    }
  }

  /**
   * Base class for a unary temporal operator with an optional interval: {@link
   * Globally}, {@link Eventually}.
   *
   * <p>An interval equivalent to {@code [0, ∞)} is stored as null.
   */
  public abstract static class TemporalUnary extends Exp {
    public final @Nullable TimeInterval interval;
    public final Exp arg;

    TemporalUnary(Pos pos, Op op, @Nullable TimeInterval interval, Exp arg) {
      super(pos, op);
      this.interval = normalize(interval);
      this.arg = requireNonNull(arg);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, interval, arg);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof TemporalUnary
              && op == ((TemporalUnary) o).op
              && Objects.equals(interval, ((TemporalUnary) o).interval)
              && arg.equals(((TemporalUnary) o).arg);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(arg, 0);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.prefix(op, interval, arg);
    }
  }

  /** Temporal "always", "G a" or "G[t1,t2] a". */
  public static class Globally extends TemporalUnary {
    Globally(Pos pos, @Nullable TimeInterval interval, Exp arg) {
      super(pos, Op.GLOBALLY, interval, arg);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /**
     * Creates a copy of this {@code Globally} with given argument and the same
     * interval, or {@code this} if the argument is the same.
     */
    public Globally copy(Exp arg) {
      return this.arg.equals(arg) ? this : ast.globally(pos, interval, arg);
    }
  }

  /** Temporal "eventually", "F a" or "F[t1,t2] a". */
  public static class Eventually extends TemporalUnary {
    Eventually(Pos pos, @Nullable TimeInterval interval, Exp arg) {
      super(pos, Op.EVENTUALLY, interval, arg);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /**
     * Creates a copy of this {@code Eventually} with given contents, or {@code
     * this} if the contents are the same.
     */
    public Eventually copy(@Nullable TimeInterval interval, Exp arg) {
      return Objects.equals(this.interval, normalize(interval))
              && this.arg.equals(arg)
          ? this
          : ast.eventually(pos, interval, arg);
    }
  }

  /**
   * Temporal "until", "a U b" or "a U[t1,t2] b".
   *
   * <p>An interval equivalent to {@code [0, ∞)} is stored as null.
   */
  public static class Until extends Exp {
    public final Exp lhs;
    public final @Nullable TimeInterval interval;
    public final Exp rhs;

    Until(Pos pos, Exp lhs, @Nullable TimeInterval interval, Exp rhs) {
      super(pos, Op.UNTIL);
      this.lhs = requireNonNull(lhs);
      this.interval = normalize(interval);
      this.rhs = requireNonNull(rhs);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, lhs, interval, rhs);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Until
              && lhs.equals(((Until) o).lhs)
              && Objects.equals(interval, ((Until) o).interval)
              && rhs.equals(((Until) o).rhs);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(lhs, 0);
      action.accept(rhs, 1);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.infix(lhs, op, interval, rhs);
    }

    /**
     * Creates a copy of this {@code Until} with given contents, or {@code this}
     * if the contents are the same.
     */
    public Until copy(Exp lhs, @Nullable TimeInterval interval, Exp rhs) {
      return this.lhs.equals(lhs)
              && Objects.equals(this.interval, normalize(interval))
              && this.rhs.equals(rhs)
          ? this
          : ast.until(pos, lhs, interval, rhs);
    }
  }
}

// End Ast.java
