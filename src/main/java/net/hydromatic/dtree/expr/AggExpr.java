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

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/** Expression that applies an associative operator to a list of operands;
 * for example "a + b + c" or "p and q and r".
 *
 * @see Exprs#flatten(Object, Op) */
public class AggExpr extends Expr {
  public final ImmutableList<Object> args;

  AggExpr(Op op, List<?> args) {
    super(op);
    this.args = ImmutableList.copyOf(args);
    checkArgument(op == Op.AND || op == Op.OR || op == Op.PLUS
        || op == Op.TIMES, "not an associative operator: %s", op);
  }

  @Override protected ImmutableList<Object> computeKey() {
    final ImmutableList.Builder<Object> argKeys = ImmutableList.builder();
    for (Object arg : args) {
      argKeys.add(operandKey(arg));
    }
    return ImmutableList.of("AggExpr", op, argKeys.build());
  }

  @Override ExprWriter unparse(ExprWriter w, int left, int right) {
    return w.infix(left, args, op, right);
  }
}

// End AggExpr.java
