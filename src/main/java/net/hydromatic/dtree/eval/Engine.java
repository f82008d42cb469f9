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
package net.hydromatic.dtree.eval;

import net.hydromatic.dtree.expr.Expr;

import org.checkerframework.checker.nullness.qual.Nullable;

/** Receives the events of a target function as it runs: each time it
 * forces a symbolic condition to a boolean, and each value it reports.
 *
 * @see Session#install(Engine) */
public interface Engine {
  /** Returns the value of a symbolic condition on the current run. */
  boolean decideIf(Expr expr);

  /** Records a value reported by the target function. Does not affect
   * decisions. */
  void noteInfo(@Nullable Object value);
}

// End Engine.java
