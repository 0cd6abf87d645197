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

/**
 * Visits and transforms syntax trees.
 *
 * <p>Each {@code visit} method rebuilds its node from the transformed
 * arguments, and returns the original node if no argument changed. Sub-classes
 * override the methods for the nodes they rewrite.
 */
public class Shuttle {
  /** Creates a Shuttle. */
  public Shuttle() {}

  // atoms

  protected Ast.Exp visit(Ast.Constant constant) {
    return constant; // leaf
  }

  protected Ast.Exp visit(Ast.Identifier identifier) {
    return identifier; // leaf
  }

  // boolean

  protected Ast.Exp visit(Ast.Not not) {
    return not.copy(not.arg.accept(this));
  }

  protected Ast.Exp visit(Ast.And and) {
    return and.copy(and.lhs.accept(this), and.rhs.accept(this));
  }

  protected Ast.Exp visit(Ast.Or or) {
    return or.copy(or.lhs.accept(this), or.rhs.accept(this));
  }

  // spatial

  protected Ast.Exp visit(Ast.Everywhere everywhere) {
    return everywhere.copy(everywhere.arg.accept(this));
  }

  protected Ast.Exp visit(Ast.Somewhere somewhere) {
    return somewhere.copy(somewhere.arg.accept(this));
  }

  protected Ast.Exp visit(Ast.Escape escape) {
    return escape.copy(escape.arg.accept(this));
  }

  protected Ast.Exp visit(Ast.Reach reach) {
    return reach.copy(reach.lhs.accept(this), reach.rhs.accept(this));
  }

  // temporal

  protected Ast.Exp visit(Ast.Next next) {
    return next.copy(next.arg.accept(this));
  }

  protected Ast.Exp visit(Ast.Globally globally) {
    return globally.copy(globally.arg.accept(this));
  }

  protected Ast.Exp visit(Ast.Eventually eventually) {
    return eventually.copy(eventually.interval, eventually.arg.accept(this));
  }

  protected Ast.Exp visit(Ast.Until until) {
    return until.copy(
        until.lhs.accept(this), until.interval, until.rhs.accept(this));
  }
}

// End Shuttle.java
