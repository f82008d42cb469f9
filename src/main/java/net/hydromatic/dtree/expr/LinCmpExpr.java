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
import com.google.common.collect.ImmutableSortedMap;

import java.math.BigDecimal;
import java.util.Map;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/** Affine comparison, "c<sub>1</sub>v<sub>1</sub> + ... +
 * c<sub>n</sub>v<sub>n</sub> op rhs".
 *
 * <p>The coefficient map is keyed by variable name, sorted by
 * {@link VarOrder}, and never contains a zero coefficient. Coefficients and
 * the right-hand side are normalized {@link BigDecimal} values, so that
 * structurally equal comparisons have equal keys.
 *
 * <p>This class does not normalize sign; "x - y &ge; 2" and
 * "-x + y &le; -2" are distinct values until passed through
 * {@link net.hydromatic.dtree.explore.LinearForms#canonical}. */
public class LinCmpExpr extends Expr {
  public final ImmutableSortedMap<String, BigDecimal> coefficients;
  /** Comparison operator, such as {@link Op#LE}. */
  public final Op cmp;
  public final BigDecimal rhs;

  private LinCmpExpr(ImmutableSortedMap<String, BigDecimal> coefficients,
      Op cmp, BigDecimal rhs) {
    super(Op.LIN_CMP);
    this.coefficients = requireNonNull(coefficients, "coefficients");
    this.cmp = requireNonNull(cmp, "cmp");
    this.rhs = requireNonNull(rhs, "rhs");
    checkArgument(cmp.isComparison(), "not a comparison: %s", cmp);
  }

  /** Creates a comparison, dropping zero coefficients and normalizing
   * numbers. */
  public static LinCmpExpr of(Map<String, BigDecimal> coefficients, Op cmp,
      BigDecimal rhs) {
    final ImmutableSortedMap.Builder<String, BigDecimal> b =
        ImmutableSortedMap.orderedBy(VarOrder.INSTANCE);
    coefficients.forEach((name, c) -> {
      if (c.signum() != 0) {
        b.put(name, normalize(c));
      }
    });
    return new LinCmpExpr(b.build(), cmp, normalize(rhs));
  }

  private static BigDecimal normalize(BigDecimal d) {
    return d.signum() == 0 ? BigDecimal.ZERO : d.stripTrailingZeros();
  }

  /** Returns the comparison that holds exactly when this one does not. */
  public LinCmpExpr negateCmp() {
    return new LinCmpExpr(coefficients, cmp.negate(), rhs);
  }

  /** Evaluates the comparison given a value for each variable. */
  public boolean evaluate(Function<String, BigDecimal> env) {
    BigDecimal sum = BigDecimal.ZERO;
    for (Map.Entry<String, BigDecimal> e : coefficients.entrySet()) {
      sum = sum.add(e.getValue().multiply(env.apply(e.getKey())));
    }
    return cmp.test(sum, rhs);
  }

  @Override protected ImmutableList<Object> computeKey() {
    return ImmutableList.of("LinCmpExpr", cmp, rhs, coefficients);
  }

  @Override ExprWriter unparse(ExprWriter w, int left, int right) {
    if (left > cmp.left || cmp.right < right) {
      return unparse(w.append("("), 0, 0).append(")");
    }
    sum(w, coefficients);
    return w.append(cmp.padded).literal(rhs);
  }

  /** Converts a linear combination to a string, such as "x - 2y". */
  public static String sumToString(Map<String, BigDecimal> coefficients) {
    return sum(new ExprWriter(), coefficients).toString();
  }

  private static ExprWriter sum(ExprWriter w,
      Map<String, BigDecimal> coefficients) {
    if (coefficients.isEmpty()) {
      return w.append("0");
    }
    int i = 0;
    for (Map.Entry<String, BigDecimal> e : coefficients.entrySet()) {
      BigDecimal c = e.getValue();
      if (c.signum() < 0) {
        w.append(i == 0 ? "-" : " - ");
        c = c.negate();
      } else if (i > 0) {
        w.append(" + ");
      }
      if (c.compareTo(BigDecimal.ONE) != 0) {
        w.literal(c);
      }
      w.append(e.getKey());
      ++i;
    }
    return w;
  }
}

// End LinCmpExpr.java
