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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.util.List;

/** Context for writing an expression out as a string.
 *
 * <p>Each call carries the precedence of the operators to the left and
 * right of the operand being written; an operand that binds more loosely
 * than its neighbors is wrapped in parentheses. */
public class ExprWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public ExprWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an operand, which is either an expression or a literal. */
  public ExprWriter append(@Nullable Object operand, int left, int right) {
    if (operand instanceof Expr) {
      return ((Expr) operand).unparse(this, left, right);
    }
    return literal(operand);
  }

  /** Appends a literal value. */
  public ExprWriter literal(@Nullable Object value) {
    if (value instanceof String) {
      return append("'").append((String) value).append("'");
    }
    if (value instanceof BigDecimal) {
      return append(((BigDecimal) value).toPlainString());
    }
    return append(String.valueOf(value));
  }

  /** Appends a call to an infix operator. */
  public ExprWriter infix(int left, @Nullable Object a0, Op op,
      @Nullable Object a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    append(a0, left, op.left);
    append(op.padded);
    append(a1, op.right, right);
    return this;
  }

  /** Appends an infix operator applied to a list of operands, such as
   * "a + b + c". */
  public ExprWriter infix(int left, List<?> args, Op op, int right) {
    switch (args.size()) {
    case 0:
      // an empty aggregate prints as the identity of its operator
      switch (op) {
      case AND:
        return append("true");
      case OR:
        return append("false");
      case TIMES:
        return append("1");
      default:
        return append("0");
      }
    case 1:
      return append(args.get(0), left, right);
    }
    if (left > op.left || op.right < right) {
      return append("(").infix(0, args, op, 0).append(")");
    }
    for (int i = 0; i < args.size(); i++) {
      if (i > 0) {
        append(op.padded);
      }
      append(args.get(i),
          i == 0 ? left : op.right,
          i == args.size() - 1 ? right : op.left);
    }
    return this;
  }

  /** Appends a call to a prefix operator, such as "-x". */
  public ExprWriter prefix(int left, Op op, @Nullable Object a0, int right) {
    if (left > op.left || op.right < right) {
      return append("(").prefix(0, op, a0, 0).append(")");
    }
    append(op.padded);
    return append(a0, op.right, right);
  }

  /** Appends a call to a function-style operator, such as "abs(x)". */
  public ExprWriter function(Op op, @Nullable Object a0) {
    return append(op.padded).append("(").append(a0, 0, 0).append(")");
  }

  @Override public String toString() {
    return b.toString();
  }
}

// End ExprWriter.java
