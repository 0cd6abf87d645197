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

import java.util.Locale;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // atoms
  BOOL_LITERAL(""),
  ID(""),

  // boolean
  NOT("! "),
  AND(" & "),
  OR(" | "),

  // spatial
  EVERYWHERE("everywhere"),
  SOMEWHERE("somewhere"),
  ESCAPE("escape"),
  REACH(" reach"),

  // temporal
  NEXT("X"),
  GLOBALLY("G"),
  EVENTUALLY("F"),
  UNTIL(" U");

  /**
   * Text of the operator as written by {@link AstWriter}, padded with the
   * spaces that surround it; e.g. " &amp; " for {@link #AND}, "G" for {@link
   * #GLOBALLY}. Empty for atoms.
   */
  public final String padded;

  Op(String padded) {
    this.padded = padded;
  }

  /** Returns the name of this operator in lower-case, e.g. "everywhere". */
  public String lowerName() {
    return name().toLowerCase(Locale.ROOT);
  }
}

// End Op.java
