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
package net.hydromatic.dtree;

import net.hydromatic.dtree.explore.LinearForms;
import net.hydromatic.dtree.explore.UnsupportedExpressionFormException;
import net.hydromatic.dtree.expr.Exprs;
import net.hydromatic.dtree.expr.LinCmpExpr;
import net.hydromatic.dtree.expr.Op;
import net.hydromatic.dtree.expr.Var;
import net.hydromatic.dtree.expr.VarTable;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests for {@link LinearForms}. */
public class LinearFormTest {
  private final VarTable vars = new VarTable();
  private final Var x = vars.get("x");
  private final Var y = vars.get("y");

  @Test void testParse() {
    assertThat(LinearForms.parse(x.minus(y).ge(2)), hasToString("x - y ≥ 2"));
    assertThat(LinearForms.parse(y.minus(x).le(-2)),
        hasToString("-x + y ≤ -2"));
    assertThat(LinearForms.parse(x.plus(y).times(2).lt(x.plus(4))),
        hasToString("x + 2y < 4"));
    assertThat(LinearForms.parse(Exprs.binary(Op.MINUS, 1, x.times(2)).gt(y)),
        hasToString("-2x - y > -1"));
    assertThat(LinearForms.parse(x.negate().plus(3).eq(y.times(-1))),
        hasToString("-x + y == -3"));
    assertThat(LinearForms.parse(x.divide(4).le(1)), hasToString("0.25x ≤ 1"));
    assertThat(
        LinearForms.parse(Exprs.flatten(x.plus(y).plus(x), Op.PLUS).le(3)),
        hasToString("2x + y ≤ 3"));
    assertThat(LinearForms.parse(x.minus(x).plus(y).ne(0)),
        hasToString("y ≠ 0"));
  }

  /** Tests that a comparison and its mirror image have the same canonical
   * form. */
  @Test void testCanonical() {
    final LinCmpExpr e1 = LinearForms.parseCanonical(x.minus(y).ge(2));
    final LinCmpExpr e2 = LinearForms.parseCanonical(y.minus(x).le(-2));
    final LinCmpExpr e3 = LinearForms.parseCanonical(x.ge(y.plus(2)));
    assertThat(e1, hasToString("x - y ≥ 2"));
    assertThat(e2, is(e1));
    assertThat(e3, is(e1));
    assertThat(e2.key(), is(e1.key()));

    // canonical is idempotent
    assertThat(LinearForms.canonical(e1), is(e1));

    // variables sort numerically
    final Var x2 = vars.get("x2");
    final Var x10 = vars.get("x10");
    assertThat(LinearForms.parse(x10.minus(x2).ge(0)),
        hasToString("-x2 + x10 ≥ 0"));
    assertThat(LinearForms.parseCanonical(x10.minus(x2).ge(0)),
        hasToString("x2 - x10 ≤ 0"));
  }

  @Test void testConstant() {
    final LinCmpExpr e = LinearForms.parseCanonical(x.gt(x));
    assertThat(e.coefficients.isEmpty(), is(true));
    assertThat(e, hasToString("0 > 0"));
    assertThat(LinearForms.parseCanonical(x.plus(1).gt(x)),
        hasToString("0 > -1"));
  }

  @Test void testAffine() {
    assertThat(LinearForms.affine(x.times(2).minus(3)), hasToString("2x - 3"));
    assertThat(LinearForms.affine(y.minus(x).plus(1)), hasToString("-x + y + 1"));
    assertThat(LinearForms.affine(Exprs.binary(Op.TIMES, 3, 4)),
        hasToString("12"));
    assertThat(LinearForms.affine(x.times(0)).isConstant(), is(true));
  }

  @Test void testUnsupported() {
    assertThrows(UnsupportedExpressionFormException.class,
        () -> LinearForms.parse(x.times(y).le(1)));
    assertThrows(UnsupportedExpressionFormException.class,
        () -> LinearForms.parse(x.divide(y).le(1)));
    assertThrows(UnsupportedExpressionFormException.class,
        () -> LinearForms.parse(x.divide(3).le(1)));
    assertThrows(UnsupportedExpressionFormException.class,
        () -> LinearForms.parse(x.divide(0).le(1)));
    assertThrows(UnsupportedExpressionFormException.class,
        () -> LinearForms.parse(x.mod(2).le(1)));
    assertThrows(UnsupportedExpressionFormException.class,
        () -> LinearForms.parse(x.abs().le(1)));
    assertThrows(UnsupportedExpressionFormException.class,
        () -> LinearForms.parse(x.plus(1)));
    assertThrows(UnsupportedExpressionFormException.class,
        () -> LinearForms.parse(x.eq("a")));
    assertThrows(UnsupportedExpressionFormException.class,
        () -> LinearForms.parse(x.plus(Double.NaN).le(1)));
  }
}

// End LinearFormTest.java
