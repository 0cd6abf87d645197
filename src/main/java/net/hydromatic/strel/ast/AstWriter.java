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

import net.hydromatic.strel.parse.Parsers;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Context for writing an AST out as a string. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node to the output. */
  public AstWriter append(AstNode node) {
    return node.unparse(this);
  }

  /** Appends an identifier, quoting it if necessary. */
  public AstWriter id(String name) {
    Parsers.appendId(b, name);
    return this;
  }

  /**
   * Appends a call to a binary operator, e.g. "(a &amp; b)", or with an
   * interval, e.g. "(a U[1, 3] b)".
   */
  public AstWriter infix(
      AstNode a0, Op op, @Nullable Object interval, AstNode a1) {
    append("(").append(a0).append(op.padded);
    if (interval != null) {
      append(interval.toString());
    }
    if (op != Op.AND && op != Op.OR) {
      append(" ");
    }
    return append(a1).append(")");
  }

  /**
   * Appends a call to a prefix operator with an optional parameter, e.g.
   * "(G[, 5] a)" or "(X a)".
   */
  public AstWriter prefix(Op op, @Nullable Object param, AstNode a) {
    append("(").append(op.padded);
    if (param != null) {
      append(param.toString());
    }
    return append(" ").append(a).append(")");
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End AstWriter.java
