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

/** Expression that applies a binary operator (arithmetic, bitwise or
 * comparison) to two operands.
 *
 * <p>Each operand is either an {@link Expr} or a literal value. */
public class BinExpr extends Expr {
  public final Object left;
  public final Object right;

  BinExpr(Op op, Object left, Object right) {
    super(op);
    this.left = requireNonNull(left, "left");
    this.right = requireNonNull(right, "right");
    checkArgument(op.kind == Op.Kind.BINARY
        || op.kind == Op.Kind.COMPARISON, "not a binary operator: %s", op);
  }

  @Override protected ImmutableList<Object> computeKey() {
    return ImmutableList.of("BinExpr", op, operandKey(left),
        operandKey(right));
  }

  @Override ExprWriter unparse(ExprWriter w, int left, int right) {
    return w.infix(left, this.left, op, this.right, right);
  }
}

// End BinExpr.java
