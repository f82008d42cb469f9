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
import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;

import static java.util.Objects.requireNonNull;

/** Symbolic expression.
 *
 * <p>An expression stands for an unknown value and is tracked only through
 * its algebraic relationships. Expressions are immutable and acyclic.
 * The variants are {@link Var}, {@link BinExpr}, {@link UnExpr},
 * {@link AggExpr} and {@link LinCmpExpr}.
 *
 * <p>Equality is structural: two expressions are equal if and only if their
 * {@link #key() keys} are equal, regardless of object identity.
 *
 * <p>A target function cannot use an expression in an {@code if}
 * statement directly; it must ask for a decision via
 * {@link net.hydromatic.dtree.eval.Session#test(Expr)}. */
public abstract class Expr {
  public final Op op;

  private @Nullable ImmutableList<Object> key;

  Expr(Op op) {
    this.op = requireNonNull(op, "op");
  }

  /** Returns the canonical structural key of this expression.
   *
   * <p>The key is an immutable list whose first element names the variant.
   * Numeric literals are normalized, so {@code x + 2} and {@code x + 2.0}
   * have the same key. */
  public final ImmutableList<Object> key() {
    ImmutableList<Object> key = this.key;
    if (key == null) {
      this.key = key = computeKey();
    }
    return key;
  }

  protected abstract ImmutableList<Object> computeKey();

  /** Writes this expression, parenthesized if its operator binds less tightly
   * than the given left and right precedences. */
  abstract ExprWriter unparse(ExprWriter w, int left, int right);

  @Override public int hashCode() {
    return key().hashCode();
  }

  @Override public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Expr
        && key().equals(((Expr) obj).key());
  }

  @Override public String toString() {
    return unparse(new ExprWriter(), 0, 0).toString();
  }

  /** Returns the key of an operand; for an expression, its key; for a
   * number, the number as a normalized {@link BigDecimal}; otherwise the
   * value itself. */
  static Object operandKey(Object operand) {
    if (operand instanceof Expr) {
      return ((Expr) operand).key();
    }
    if (operand instanceof Number) {
      final @Nullable BigDecimal d = toDecimalOrNull((Number) operand);
      if (d != null) {
        return d;
      }
    }
    return operand;
  }

  /** Converts a number to a normalized {@link BigDecimal}, or returns null if
   * it is not finite or not a standard numeric type. */
  public static @Nullable BigDecimal toDecimalOrNull(Number n) {
    final BigDecimal d;
    if (n instanceof BigDecimal) {
      d = (BigDecimal) n;
    } else if (n instanceof BigInteger) {
      d = new BigDecimal((BigInteger) n);
    } else if (n instanceof Integer
        || n instanceof Long
        || n instanceof Short
        || n instanceof Byte) {
      d = BigDecimal.valueOf(n.longValue());
    } else if (n instanceof Double || n instanceof Float) {
      final double v = n.doubleValue();
      if (Double.isNaN(v) || Double.isInfinite(v)) {
        return null;
      }
      d = BigDecimal.valueOf(v);
    } else {
      return null;
    }
    return d.signum() == 0 ? BigDecimal.ZERO : d.stripTrailingZeros();
  }

  // Builder methods. Each creates a new expression with this expression as
  // its first operand.

  public BinExpr plus(Object o) {
    return new BinExpr(Op.PLUS, this, o);
  }

  public BinExpr minus(Object o) {
    return new BinExpr(Op.MINUS, this, o);
  }

  public BinExpr times(Object o) {
    return new BinExpr(Op.TIMES, this, o);
  }

  public BinExpr divide(Object o) {
    return new BinExpr(Op.DIVIDE, this, o);
  }

  public BinExpr floorDivide(Object o) {
    return new BinExpr(Op.FLOOR_DIVIDE, this, o);
  }

  public BinExpr mod(Object o) {
    return new BinExpr(Op.MOD, this, o);
  }

  public BinExpr power(Object o) {
    return new BinExpr(Op.POWER, this, o);
  }

  public BinExpr lt(Object o) {
    return new BinExpr(Op.LT, this, o);
  }

  public BinExpr le(Object o) {
    return new BinExpr(Op.LE, this, o);
  }

  public BinExpr gt(Object o) {
    return new BinExpr(Op.GT, this, o);
  }

  public BinExpr ge(Object o) {
    return new BinExpr(Op.GE, this, o);
  }

  public BinExpr eq(Object o) {
    return new BinExpr(Op.EQ, this, o);
  }

  public BinExpr ne(Object o) {
    return new BinExpr(Op.NE, this, o);
  }

  public UnExpr negate() {
    return new UnExpr(Op.NEGATE, this);
  }

  public UnExpr abs() {
    return new UnExpr(Op.ABS, this);
  }

  public UnExpr floor() {
    return new UnExpr(Op.FLOOR, this);
  }

  public UnExpr ceil() {
    return new UnExpr(Op.CEIL, this);
  }

  public UnExpr round() {
    return new UnExpr(Op.ROUND, this);
  }
}

// End Expr.java
