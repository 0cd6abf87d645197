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
package net.hydromatic.strel;

import static net.hydromatic.strel.Fs.f;
import static net.hydromatic.strel.Matchers.throwsA;
import static net.hydromatic.strel.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.strel.ast.Ast;
import net.hydromatic.strel.ast.Pos;
import net.hydromatic.strel.compile.CompileException;
import net.hydromatic.strel.compile.Tracer;
import net.hydromatic.strel.compile.Tracers;
import net.hydromatic.strel.parse.StrelParseException;
import org.junit.jupiter.api.Test;

/** Tests parsing and expanding formulas from text. */
public class StrelTest {
  @Test
  void testExpandBoundedEventually() {
    f("F[0,2] p").assertExpand("((p | (X p)) | (X (X p)))");
    f("F[,2] p").assertExpand("((p | (X p)) | (X (X p)))");
    f("F[1,3] p").assertExpand("(X ((p | (X p)) | (X (X p))))");
    f("F[2,] p").assertExpand("(X (X (F p)))");
    f("F p").assertExpand("(F p)");
  }

  @Test
  void testExpandGlobally() {
    f("G[0,1] a").assertExpand("! (! a | (X ! a))");
    f("G a").assertExpand("! (F ! a)");
    f("G ! a").assertExpand("! (F ! a)");

    final Ast.Identifier a = ast.identifier("a");
    f("G[0,1] a")
        .assertExpand(ast.not(ast.or(ast.not(a), ast.next(null, ast.not(a)))));
  }

  @Test
  void testExpandNext() {
    f("X[3] a").assertExpand("(X (X (X a)))");
    f("X a").assertExpand("(X a)");
    f("X[2] F[0,1] a").assertExpand("(X (X (a | (X a))))");
  }

  @Test
  void testExpandUntil() {
    f("p U q").assertExpand("(p U q)");
    f("p U[0,2] q").assertExpand("(((p | (X p)) | (X (X p))) & (p U q))");
    f("p U[1,2] q")
        .assertExpand("((X (p | (X p))) & ! (! (p U q) | (X ! (p U q))))");
  }

  @Test
  void testExpandKeepsBooleanAndSpatial() {
    f("!!p").assertExpand("! p");
    f("a & b | true").assertExpand("((a & b) | true)");
    f("somewhere[1,2] F[0,1] p")
        .assertExpand("(somewhere[1.0, 2.0] (p | (X p)))");
    f("a reach X[2] b").assertExpand("(a reach[, inf] (X (X b)))");
    f("escape[, 3] G[0,1] a")
        .assertExpand("(escape[, 3.0] ! (! a | (X ! a)))");
  }

  @Test
  void testExpandMatchesExpandIntervals() {
    final String[] formulas = {
      "G[1,3] (a U[0,2] b)",
      "F[0,4] X[2] p & everywhere G[2,] q",
      "(p reach[1, 2] F[1,2] q) U[2,] r",
    };
    for (String formula : formulas) {
      final Ast.Exp exp = Strel.parse(formula);
      assertThat(Strel.expand(formula), is(exp.expandIntervals()));
    }
  }

  @Test
  void testMaxUnroll() {
    f("F[0,3] p")
        .withProp(Prop.MAX_UNROLL, 3)
        .assertExpand("(((p | (X p)) | (X (X p))) | (X (X (X p))))");
    f("F[0,5] p")
        .withProp(Prop.MAX_UNROLL, 3)
        .assertExpandThrows(
            throwsA(
                CompileException.class,
                "limit is 3",
                new Pos("", 1, 1, 1, 9)));
    f("a & X[4] b")
        .withProp(Prop.MAX_UNROLL, 3)
        .assertExpandThrows(
            throwsA(
                CompileException.class,
                "cannot unroll",
                new Pos("", 1, 5, 1, 11)));
    // Parsing is not affected by the limit
    f("F[0,5] p").withProp(Prop.MAX_UNROLL, 3).assertParse("(F[, 5] p)");
    // Unbounded operators are never limited
    f("G a U b").withProp(Prop.MAX_UNROLL, 0).assertExpand("(! (F ! a) U b)");
  }

  @Test
  void testFileInPosition() {
    final Ast.Exp exp = f("a & b").withProp(Prop.FILE, "formula.strel").parse();
    assertThat(exp.pos.file, is("formula.strel"));
    assertThat(exp.pos.toString(), is("formula.strel:1.1-1.6"));

    final StrelParseException e =
        assertThrows(
            StrelParseException.class,
            () -> f("a &").withProp(Prop.FILE, "formula.strel").parse());
    assertThat(e.pos().file, is("formula.strel"));
    assertThat(
        e.describeTo(new StringBuilder()).toString(),
        containsString("formula.strel:"));

    final CompileException e2 =
        assertThrows(
            CompileException.class,
            () ->
                f("X[9] a")
                    .withProp(Prop.FILE, "formula.strel")
                    .withProp(Prop.MAX_UNROLL, 2)
                    .expand());
    assertThat(e2.toString(), containsString("at formula.strel:1.1-1.7"));
  }

  @Test
  void testTracer() {
    final List<String> parsed = new ArrayList<>();
    final List<String> expanded = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnExpand(
            Tracers.withOnParse(Tracers.empty(), e -> parsed.add(e.toString())),
            (e, e2) -> expanded.add(e2.toString()));
    f("F[0,1] p").withTracer(tracer).assertExpand("(p | (X p))");
    assertThat(parsed, is(ImmutableList.of("(F[, 1] p)")));
    assertThat(expanded, is(ImmutableList.of("(p | (X p))")));

    // Parsing alone does not expand
    f("G a").withTracer(tracer).assertParse("(G a)");
    assertThat(parsed.size(), is(2));
    assertThat(expanded.size(), is(1));
  }

  @Test
  void testTracerHandlesCompileException() {
    final List<CompileException> exceptions = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnCompileException(Tracers.empty(), exceptions::add);
    // The handled error leaves the formula unexpanded
    final Ast.Exp exp =
        f("X[5] p").withProp(Prop.MAX_UNROLL, 2).withTracer(tracer).expand();
    assertThat(exp, is(ast.next(5, ast.identifier("p"))));
    assertThat(exceptions.size(), is(1));
    assertThat(exceptions.get(0).getMessage(), containsString("limit is 2"));
  }
}

// End StrelTest.java
