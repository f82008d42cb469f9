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

import net.hydromatic.dtree.expr.AggExpr;
import net.hydromatic.dtree.expr.BinExpr;
import net.hydromatic.dtree.expr.Expr;
import net.hydromatic.dtree.expr.Exprs;
import net.hydromatic.dtree.expr.LinCmpExpr;
import net.hydromatic.dtree.expr.UnExpr;
import net.hydromatic.dtree.expr.Var;
import net.hydromatic.dtree.expr.VarOrder;

import com.google.common.collect.ImmutableSortedMap;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.util.Map;
import java.util.TreeMap;

import static java.util.Objects.requireNonNull;

/** Converts expressions to linear form.
 *
 * <p>A linear (affine) expression is a sum of variables multiplied by
 * constants, plus a constant; for example "2x - y + 3". The operators
 * understood are "+", "-", "*" where at least one side is constant, "/" by
 * a non-zero constant whose quotient is exact, unary "-" and "+", and
 * "+" and "*" aggregates. */
public abstract class LinearForms {
  private LinearForms() {}

  /** Converts an arithmetic expression or a number to linear form.
   *
   * @throws UnsupportedExpressionFormException if the expression is not
   *   linear */
  public static Affine affine(Object operand) {
    if (operand instanceof Number) {
      final @Nullable BigDecimal d = Expr.toDecimalOrNull((Number) operand);
      if (d == null) {
        throw new UnsupportedExpressionFormException("not a finite number: "
            + operand);
      }
      return Affine.constant(d);
    }
    if (!(operand instanceof Expr)) {
      throw new UnsupportedExpressionFormException("not an arithmetic "
          + "operand: " + Exprs.pretty(operand));
    }
    final Expr e = (Expr) operand;
    switch (e.op) {
    case VAR:
      return Affine.var(((Var) e).name);

    case NEGATE:
      return affine(((UnExpr) e).arg).negate();

    case POSITIVE:
      return affine(((UnExpr) e).arg);

    case PLUS:
      if (e instanceof AggExpr) {
        Affine sum = Affine.constant(BigDecimal.ZERO);
        for (Object arg : ((AggExpr) e).args) {
          sum = sum.plus(affine(arg));
        }
        return sum;
      }
      return affine(((BinExpr) e).left).plus(affine(((BinExpr) e).right));

    case MINUS:
      return affine(((BinExpr) e).left)
          .plus(affine(((BinExpr) e).right).negate());

    case TIMES:
      if (e instanceof AggExpr) {
        Affine product = Affine.constant(BigDecimal.ONE);
        for (Object arg : ((AggExpr) e).args) {
          product = times(product, affine(arg), e);
        }
        return product;
      }
      return times(affine(((BinExpr) e).left), affine(((BinExpr) e).right),
          e);

    case DIVIDE:
      final Affine divisor = affine(((BinExpr) e).right);
      if (!divisor.isConstant()) {
        throw new UnsupportedExpressionFormException("division by a "
            + "symbolic operand in " + e);
      }
      if (divisor.constant.signum() == 0) {
        throw new UnsupportedExpressionFormException("division by zero in "
            + e);
      }
      try {
        return affine(((BinExpr) e).left).divide(divisor.constant);
      } catch (ArithmeticException ex) {
        throw new UnsupportedExpressionFormException("inexact division in "
            + e, ex);
      }

    default:
      throw new UnsupportedExpressionFormException("operator " + e.op
          + " is not linear, in " + e);
    }
  }

  private static Affine times(Affine a, Affine b, Expr e) {
    if (a.isConstant()) {
      return b.scale(a.constant);
    }
    if (b.isConstant()) {
      return a.scale(b.constant);
    }
    throw new UnsupportedExpressionFormException("product of two symbolic "
        + "operands in " + e);
  }

  /** Converts a comparison to a linear comparison, moving every variable to
   * the left and every constant to the right. The result is not
   * canonical.
   *
   * @throws UnsupportedExpressionFormException if the condition is not a
   *   comparison of linear expressions */
  public static LinCmpExpr parse(Object condition) {
    if (condition instanceof LinCmpExpr) {
      return (LinCmpExpr) condition;
    }
    if (!(condition instanceof BinExpr)
        || !((BinExpr) condition).op.isComparison()) {
      throw new UnsupportedExpressionFormException("not a comparison: "
          + Exprs.pretty(condition));
    }
    final BinExpr cmp = (BinExpr) condition;
    final Affine diff =
        affine(cmp.left).plus(affine(cmp.right).negate());
    return LinCmpExpr.of(diff.coefficients, cmp.op, diff.constant.negate());
  }

  /** Returns the canonical form of a linear comparison.
   *
   * <p>Variables are sorted by {@link VarOrder} and zero coefficients are
   * dropped (both already true of any {@link LinCmpExpr}); and if the first
   * coefficient is negative, both sides are multiplied by -1, which reverses
   * the comparison. Thus "x - y ≥ 2" and "y - x ≤ -2" have the same
   * canonical form. */
  public static LinCmpExpr canonical(LinCmpExpr e) {
    if (e.coefficients.isEmpty()
        || e.coefficients.firstEntry().getValue().signum() > 0) {
      return e;
    }
    final Map<String, BigDecimal> negated = new TreeMap<>(VarOrder.INSTANCE);
    e.coefficients.forEach((name, c) -> negated.put(name, c.negate()));
    return LinCmpExpr.of(negated, e.cmp.reverse(), e.rhs.negate());
  }

  /** Parses a condition and returns its canonical form. */
  public static LinCmpExpr parseCanonical(Object condition) {
    return canonical(parse(condition));
  }

  /** Affine expression: a linear combination of variables plus a
   * constant. Immutable. */
  public static class Affine {
    /** Coefficients, sorted by {@link VarOrder}, none zero. */
    public final ImmutableSortedMap<String, BigDecimal> coefficients;
    public final BigDecimal constant;

    private Affine(Map<String, BigDecimal> coefficients,
        BigDecimal constant) {
      final ImmutableSortedMap.Builder<String, BigDecimal> b =
          ImmutableSortedMap.orderedBy(VarOrder.INSTANCE);
      coefficients.forEach((name, c) -> {
        if (c.signum() != 0) {
          b.put(name, c);
        }
      });
      this.coefficients = b.build();
      this.constant = requireNonNull(constant, "constant");
    }

    static Affine constant(BigDecimal c) {
      return new Affine(ImmutableSortedMap.of(), c);
    }

    static Affine var(String name) {
      return new Affine(ImmutableSortedMap.of(name, BigDecimal.ONE),
          BigDecimal.ZERO);
    }

    /** Returns whether this expression has no variables. */
    public boolean isConstant() {
      return coefficients.isEmpty();
    }

    Affine plus(Affine o) {
      final Map<String, BigDecimal> map = new TreeMap<>(VarOrder.INSTANCE);
      map.putAll(coefficients);
      o.coefficients.forEach((name, c) -> map.merge(name, c, BigDecimal::add));
      return new Affine(map, constant.add(o.constant));
    }

    Affine negate() {
      return scale(BigDecimal.ONE.negate());
    }

    Affine scale(BigDecimal k) {
      final Map<String, BigDecimal> map = new TreeMap<>(VarOrder.INSTANCE);
      coefficients.forEach((name, c) -> map.put(name, c.multiply(k)));
      return new Affine(map, constant.multiply(k));
    }

    /** Divides by a constant.
     *
     * @throws ArithmeticException if a quotient has no exact decimal
     *   representation */
    Affine divide(BigDecimal k) {
      final Map<String, BigDecimal> map = new TreeMap<>(VarOrder.INSTANCE);
      coefficients.forEach((name, c) -> map.put(name, c.divide(k)));
      return new Affine(map, constant.divide(k));
    }

    @Override public String toString() {
      final String sum = LinCmpExpr.sumToString(coefficients);
      if (isConstant()) {
        return constant.toPlainString();
      }
      switch (constant.signum()) {
      case 0:
        return sum;
      case 1:
        return sum + " + " + constant.toPlainString();
      default:
        return sum + " - " + constant.negate().toPlainString();
      }
    }
  }
}

// End LinearForms.java
