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

/** Decision whose two outcomes are both possible.
 *
 * <p>Slot 0 holds the subtree where the condition is false, slot 1 the
 * subtree where it is true. */
public class IfNode extends DecisionNode {
  public IfNode(Expr expr, @Nullable Expr simplified,
      @Nullable InternalNode parent) {
    super(Kind.IF, expr, simplified, parent, 2);
  }

  /** Returns the slot index of a branch outcome. */
  public static int slot(boolean value) {
    return value ? 1 : 0;
  }

  @Override public String label(boolean simplify) {
    return "if " + displayExpr(simplify);
  }

  @Override public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visit(this);
  }
}

// End IfNode.java
