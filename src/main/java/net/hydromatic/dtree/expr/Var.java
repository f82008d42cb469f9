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
package net.hydromatic.dtree.expr;

import com.google.common.collect.ImmutableList;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/** Symbolic variable.
 *
 * <p>Variables are created by, and interned in, a {@link VarTable}. */
public class Var extends Expr {
  public final String name;

  Var(String name) {
    super(Op.VAR);
    this.name = requireNonNull(name, "name");
    checkArgument(!name.isEmpty(), "empty name");
  }

  @Override protected ImmutableList<Object> computeKey() {
    return ImmutableList.of("Var", name);
  }

  @Override ExprWriter unparse(ExprWriter w, int left, int right) {
    return w.append(name);
  }
}

// End Var.java
