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
package net.hydromatic.dtree.tree;

import net.hydromatic.dtree.expr.Expr;

import org.checkerframework.checker.nullness.qual.Nullable;

/** Decision whose outcome is forced.
 *
 * <p>The explorer proved that the condition always evaluates to {@link #b}
 * on this path, so the node is an assertion rather than a branch, and has a
 * single slot. */
public class FrozenIfNode extends DecisionNode {
  /** The value the condition is forced to. */
  public final boolean b;

  public FrozenIfNode(Expr expr, @Nullable Expr simplified, boolean b,
      @Nullable InternalNode parent) {
    super(Kind.FROZEN_IF, expr, simplified, parent, 1);
    this.b = b;
  }

  @Override public String label(boolean simplify) {
    final Expr e = displayExpr(simplify);
    return b ? "assert " + e : "assert not(" + e + ")";
  }

  @Override public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visit(this);
  }
}

// End FrozenIfNode.java
