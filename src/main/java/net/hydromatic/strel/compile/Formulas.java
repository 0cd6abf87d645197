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

import net.hydromatic.strel.ast.Ast;
import net.hydromatic.strel.ast.Visitor;

/** Utilities for formulas. */
public abstract class Formulas {
  private Formulas() {}

  /**
   * Returns whether a formula is in the canonical form produced by {@link
   * IntervalExpander}: no {@link Ast.Globally}, and no {@link Ast.Eventually}
   * or {@link Ast.Until} with an interval.
   */
  public static boolean isCanonical(Ast.Exp exp) {
    final CanonicalChecker checker = new CanonicalChecker();
    exp.accept(checker);
    return checker.canonical;
  }

  /** Returns the number of nodes in a formula. */
  public static int size(Ast.Exp exp) {
    final NodeCounter counter = new NodeCounter();
    exp.accept(counter);
    return counter.count;
  }

  /** Visitor that looks for operators that expansion removes. */
  private static class CanonicalChecker extends Visitor {
    boolean canonical = true;

    @Override
    protected void visit(Ast.Globally globally) {
      canonical = false;
    }

    @Override
    protected void visit(Ast.Eventually eventually) {
      if (eventually.interval != null) {
        canonical = false;
      } else {
        super.visit(eventually);
      }
    }

    @Override
    protected void visit(Ast.Until until) {
      if (until.interval != null) {
        canonical = false;
      } else {
        super.visit(until);
      }
    }
  }

  /** Visitor that counts nodes. */
  private static class NodeCounter extends Visitor {
    int count;

    @Override
    protected void visit(Ast.Constant constant) {
      ++count;
    }

    @Override
    protected void visit(Ast.Identifier identifier) {
      ++count;
    }

    @Override
    protected void visit(Ast.Not not) {
      ++count;
      super.visit(not);
    }

    @Override
    protected void visit(Ast.And and) {
      ++count;
      super.visit(and);
    }

    @Override
    protected void visit(Ast.Or or) {
      ++count;
      super.visit(or);
    }

    @Override
    protected void visit(Ast.Everywhere everywhere) {
      ++count;
      super.visit(everywhere);
    }

    @Override
    protected void visit(Ast.Somewhere somewhere) {
      ++count;
      super.visit(somewhere);
    }

    @Override
    protected void visit(Ast.Escape escape) {
      ++count;
      super.visit(escape);
    }

    @Override
    protected void visit(Ast.Reach reach) {
      ++count;
      super.visit(reach);
    }

    @Override
    protected void visit(Ast.Next next) {
      ++count;
      super.visit(next);
    }

    @Override
    protected void visit(Ast.Globally globally) {
      ++count;
      super.visit(globally);
    }

    @Override
    protected void visit(Ast.Eventually eventually) {
      ++count;
      super.visit(eventually);
    }

    @Override
    protected void visit(Ast.Until until) {
      ++count;
      super.visit(until);
    }
  }
}

// End Formulas.java
