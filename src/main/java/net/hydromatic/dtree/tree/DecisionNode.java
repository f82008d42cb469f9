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

import static java.util.Objects.requireNonNull;

/** Internal node created where the target function forced a symbolic
 * condition to a boolean. */
public abstract class DecisionNode extends InternalNode {
  /** The condition. */
  public final Expr expr;
  /** Simplified form of the condition supplied by the explorer, or null. */
  public final @Nullable Expr simplified;

  DecisionNode(Kind kind, Expr expr, @Nullable Expr simplified,
      @Nullable InternalNode parent, int slotCount) {
    super(kind, parent, slotCount);
    this.expr = requireNonNull(expr, "expr");
    this.simplified = simplified;
  }

  /** Returns the condition to display. */
  public Expr displayExpr(boolean simplify) {
    return simplify && simplified != null ? simplified : expr;
  }
}

// End DecisionNode.java
