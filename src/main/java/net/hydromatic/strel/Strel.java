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

import com.google.common.collect.ImmutableMap;
import java.io.StringReader;
import java.util.Map;
import net.hydromatic.strel.ast.Ast;
import net.hydromatic.strel.compile.IntervalExpander;
import net.hydromatic.strel.compile.Tracer;
import net.hydromatic.strel.compile.Tracers;
import net.hydromatic.strel.parse.StrelParseException;
import net.hydromatic.strel.parse.StrelParserImpl;

/**
 * Entry point for parsing and expanding STREL formulas.
 *
 * <p>For example,
 *
 * <blockquote>
 *
 * <pre>{@code
 * Ast.Exp e = Strel.parse("G[0, 2] (p & everywhere[, 3] q)");
 * Ast.Exp e2 = e.expandIntervals();
 * }</pre>
 *
 * </blockquote>
 */
public abstract class Strel {
  private Strel() {}

  /**
   * Parses a formula.
   *
   * @throws StrelParseException if the text is not syntactically valid
   * @throws IllegalArgumentException if an interval, step count or identifier
   *     is not valid
   */
  public static Ast.Exp parse(String text) {
    return parse(text, ImmutableMap.of(), Tracers.empty());
  }

  /** Parses a formula, with properties. */
  public static Ast.Exp parse(String text, Map<Prop, Object> propMap) {
    return parse(text, propMap, Tracers.empty());
  }

  /** Parses a formula, with properties and a tracer. */
  public static Ast.Exp parse(
      String text, Map<Prop, Object> propMap, Tracer tracer) {
    final StrelParserImpl parser = new StrelParserImpl(new StringReader(text));
    parser.zero(Prop.FILE.stringValue(propMap));
    final Ast.Exp exp = parser.formulaEofSafe();
    tracer.onParse(exp);
    return exp;
  }

  /** Parses a formula and expands its intervals. */
  public static Ast.Exp expand(String text) {
    return expand(text, ImmutableMap.of(), Tracers.empty());
  }

  /** Parses a formula and expands its intervals, with properties. */
  public static Ast.Exp expand(
      String text, Map<Prop, Object> propMap, Tracer tracer) {
    final Ast.Exp exp = parse(text, propMap, tracer);
    return IntervalExpander.expand(exp, propMap, tracer);
  }
}

// End Strel.java
