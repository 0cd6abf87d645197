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

/** Visits syntax trees. */
public class Visitor {
  // atoms

  protected void visit(Ast.Constant constant) {}

  protected void visit(Ast.Identifier identifier) {}

  // boolean

  protected void visit(Ast.Not not) {
    not.arg.accept(this);
  }

  protected void visit(Ast.And and) {
    and.lhs.accept(this);
    and.rhs.accept(this);
  }

  protected void visit(Ast.Or or) {
    or.lhs.accept(this);
    or.rhs.accept(this);
  }

  // spatial

  protected void visit(Ast.Everywhere everywhere) {
    everywhere.arg.accept(this);
  }

  protected void visit(Ast.Somewhere somewhere) {
    somewhere.arg.accept(this);
  }

  protected void visit(Ast.Escape escape) {
    escape.arg.accept(this);
  }

  protected void visit(Ast.Reach reach) {
    reach.lhs.accept(this);
    reach.rhs.accept(this);
  }

  // temporal

  protected void visit(Ast.Next next) {
    next.arg.accept(this);
  }

  protected void visit(Ast.Globally globally) {
    globally.arg.accept(this);
  }

  protected void visit(Ast.Eventually eventually) {
    eventually.arg.accept(this);
  }

  protected void visit(Ast.Until until) {
    until.lhs.accept(this);
    until.rhs.accept(this);
  }
}

// End Visitor.java
