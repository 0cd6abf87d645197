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

/** Called on various events while parsing and compiling a formula. */
public interface Tracer {
  /** Called when a formula has been parsed. */
  void onParse(Ast.Exp e);

  /** Called when a formula has been expanded. */
  void onExpand(Ast.Exp e, Ast.Exp expanded);

  /**
   * Called with the exception thrown during expansion. Returns whether a
   * handler was found; if not, the caller rethrows.
   */
  boolean handleCompileException(CompileException e);
}

// End Tracer.java
