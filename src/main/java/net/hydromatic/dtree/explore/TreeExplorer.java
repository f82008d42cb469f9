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
package net.hydromatic.dtree.explore;

import net.hydromatic.dtree.expr.Expr;

import org.checkerframework.checker.nullness.qual.Nullable;

/** Policy that decides which way a symbolic condition goes, and whether
 * the other way still needs to be explored.
 *
 * <p>A {@link net.hydromatic.dtree.eval.RepeatedRunTreeGen} owns one
 * explorer and calls it as each run proceeds. Along a path, the explorer
 * sees a sequence of {@link #decideIf} (at the frontier) and
 * {@link #noteIf} (while replaying) calls, ending with one call to
 * {@link #noteReturn}. Per-path state must be reset in {@code noteReturn};
 * state that is valid for every path may persist.
 *
 * @see TreeExplorers */
public interface TreeExplorer {
  /** Decides a condition that has not been decided before on the current
   * path.
   *
   * @throws InfeasiblePathException if the path constraints are
   *   contradictory
   * @throws UnsupportedExpressionFormException if the explorer cannot
   *   interpret the condition */
  Decision decideIf(Expr expr);

  /** Informs the explorer that, on the current path, a condition has the
   * given value. Called while replaying a previously recorded decision. */
  void noteIf(Expr expr, boolean value);

  /** Informs the explorer that the current path has ended, and returns a
   * snapshot of what it knew on that path, or null. */
  @Nullable Object noteReturn(@Nullable Object returnValue);
}

// End TreeExplorer.java
