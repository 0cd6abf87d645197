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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds parse tree nodes.
 *
 * <p>Every factory method has a variant that takes a {@link Pos}, used by the
 * parser and by rewrites, and a variant without, which uses {@link Pos#ZERO}.
 */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  // atoms

  public Ast.Constant constant(Pos pos, boolean value) {
    return new Ast.Constant(pos, value);
  }

  public Ast.Constant constant(boolean value) {
    return constant(Pos.ZERO, value);
  }

  public Ast.Identifier identifier(Pos pos, String name) {
    return new Ast.Identifier(pos, name);
  }

  public Ast.Identifier identifier(String name) {
    return identifier(Pos.ZERO, name);
  }

  // boolean

  /** Creates a negation. Unlike {@link #logicalNot}, never simplifies. */
  public Ast.Not not(Pos pos, Ast.Exp arg) {
    return new Ast.Not(pos, arg);
  }

  public Ast.Not not(Ast.Exp arg) {
    return not(Pos.ZERO, arg);
  }

  public Ast.And and(Pos pos, Ast.Exp lhs, Ast.Exp rhs) {
    return new Ast.And(pos, lhs, rhs);
  }

  public Ast.And and(Ast.Exp lhs, Ast.Exp rhs) {
    return and(Pos.ZERO, lhs, rhs);
  }

  public Ast.Or or(Pos pos, Ast.Exp lhs, Ast.Exp rhs) {
    return new Ast.Or(pos, lhs, rhs);
  }

  public Ast.Or or(Ast.Exp lhs, Ast.Exp rhs) {
    return or(Pos.ZERO, lhs, rhs);
  }

  /**
   * Negates a formula, removing one level of negation if the formula is already
   * a negation.
   *
   * <p>For example, {@code logicalNot(p)} returns "! p" and {@code
   * logicalNot(! p)} returns "p". Only the outermost negation of the argument
   * is considered; this is not general double-negation elimination. To build
   * "! ! p" literally, use {@link #not}.
   */
  public Ast.Exp logicalNot(Ast.Exp arg) {
    if (arg.op == Op.NOT) {
      return ((Ast.Not) arg).arg;
    }
    return not(arg.pos, arg);
  }

  /** Conjunction of two formulas; equivalent to {@link #and}. */
  public Ast.Exp logicalAnd(Ast.Exp lhs, Ast.Exp rhs) {
    return and(lhs, rhs);
  }

  /** Disjunction of two formulas; equivalent to {@link #or}. */
  public Ast.Exp logicalOr(Ast.Exp lhs, Ast.Exp rhs) {
    return or(lhs, rhs);
  }

  // spatial

  public Ast.Everywhere everywhere(
      Pos pos, DistanceInterval interval, Ast.Exp arg) {
    return new Ast.Everywhere(pos, interval, arg);
  }

  public Ast.Everywhere everywhere(DistanceInterval interval, Ast.Exp arg) {
    return everywhere(Pos.ZERO, interval, arg);
  }

  public Ast.Somewhere somewhere(
      Pos pos, DistanceInterval interval, Ast.Exp arg) {
    return new Ast.Somewhere(pos, interval, arg);
  }

  public Ast.Somewhere somewhere(DistanceInterval interval, Ast.Exp arg) {
    return somewhere(Pos.ZERO, interval, arg);
  }

  public Ast.Escape escape(Pos pos, DistanceInterval interval, Ast.Exp arg) {
    return new Ast.Escape(pos, interval, arg);
  }

  public Ast.Escape escape(DistanceInterval interval, Ast.Exp arg) {
    return escape(Pos.ZERO, interval, arg);
  }

  /**
   * Creates a unary spatial operator: {@link Op#EVERYWHERE}, {@link
   * Op#SOMEWHERE} or {@link Op#ESCAPE}.
   */
  public Ast.SpatialUnary spatial(
      Pos pos, Op op, DistanceInterval interval, Ast.Exp arg) {
    switch (op) {
      case EVERYWHERE:
        return everywhere(pos, interval, arg);
      case SOMEWHERE:
        return somewhere(pos, interval, arg);
      case ESCAPE:
        return escape(pos, interval, arg);
      default:
        throw new IllegalArgumentException(
            "not a unary spatial operator: " + op);
    }
  }

  public Ast.Reach reach(
      Pos pos, Ast.Exp lhs, DistanceInterval interval, Ast.Exp rhs) {
    return new Ast.Reach(pos, lhs, interval, rhs);
  }

  public Ast.Reach reach(Ast.Exp lhs, DistanceInterval interval, Ast.Exp rhs) {
    return reach(Pos.ZERO, lhs, interval, rhs);
  }

  // temporal

  public Ast.Next next(Pos pos, @Nullable Integer steps, Ast.Exp arg) {
    return new Ast.Next(pos, steps, arg);
  }

  public Ast.Next next(@Nullable Integer steps, Ast.Exp arg) {
    return next(Pos.ZERO, steps, arg);
  }

  public Ast.Globally globally(
      Pos pos, @Nullable TimeInterval interval, Ast.Exp arg) {
    return new Ast.Globally(pos, interval, arg);
  }

  public Ast.Globally globally(@Nullable TimeInterval interval, Ast.Exp arg) {
    return globally(Pos.ZERO, interval, arg);
  }

  public Ast.Eventually eventually(
      Pos pos, @Nullable TimeInterval interval, Ast.Exp arg) {
    return new Ast.Eventually(pos, interval, arg);
  }

  public Ast.Eventually eventually(
      @Nullable TimeInterval interval, Ast.Exp arg) {
    return eventually(Pos.ZERO, interval, arg);
  }

  public Ast.Until until(
      Pos pos, Ast.Exp lhs, @Nullable TimeInterval interval, Ast.Exp rhs) {
    return new Ast.Until(pos, lhs, interval, rhs);
  }

  public Ast.Until until(
      Ast.Exp lhs, @Nullable TimeInterval interval, Ast.Exp rhs) {
    return until(Pos.ZERO, lhs, interval, rhs);
  }
}

// End AstBuilder.java
