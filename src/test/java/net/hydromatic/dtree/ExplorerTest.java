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

import net.hydromatic.dtree.eval.RepeatedRunTreeGen;
import net.hydromatic.dtree.eval.Session;
import net.hydromatic.dtree.eval.Target;
import net.hydromatic.dtree.explore.CachedTreeExplorer;
import net.hydromatic.dtree.explore.Decision;
import net.hydromatic.dtree.explore.InfeasiblePathException;
import net.hydromatic.dtree.explore.Intervals;
import net.hydromatic.dtree.explore.LinConstrTreeExplorer;
import net.hydromatic.dtree.explore.LinearForms;
import net.hydromatic.dtree.explore.TreeExplorer;
import net.hydromatic.dtree.explore.TreeExplorers;
import net.hydromatic.dtree.explore.UnsupportedExpressionFormException;
import net.hydromatic.dtree.expr.Expr;
import net.hydromatic.dtree.expr.Exprs;
import net.hydromatic.dtree.expr.Op;
import net.hydromatic.dtree.expr.Var;
import net.hydromatic.dtree.expr.VarTable;
import net.hydromatic.dtree.tree.Node;
import net.hydromatic.dtree.tree.Nodes;
import net.hydromatic.dtree.tree.ReturnNode;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests for {@link TreeExplorer} and its implementations. */
public class ExplorerTest {
  private final VarTable vars = new VarTable();
  private final Var x = vars.get("x");
  private final Var y = vars.get("y");

  @Test void testDecision() {
    assertThat(Decision.branch(false), hasToString("branch(false)"));
    assertThat(Decision.forced(true), hasToString("forced(true)"));
    assertThat(Decision.forced(true).withSimplified(x.gt(0)),
        hasToString("forced(true, x > 0)"));
    assertThat(Decision.branch(true).withSimplified(null),
        sameInstance(Decision.branch(true)));
    assertThat(Decision.forced(false).withSimplified(x.gt(0)),
        is(Decision.forced(false).withSimplified(x.gt(0))));
    assertThat(Decision.forced(false).value, is(false));
    assertThat(Decision.forced(false).exploreOtherSide, is(false));
    assertThat(Decision.branch(false).exploreOtherSide, is(true));
  }

  @Test void testTrivial() {
    final TreeExplorer te = TreeExplorers.trivial();
    assertThat(te.decideIf(x.gt(0)), is(Decision.branch(false)));
    assertThat(te.decideIf(x.gt(0)), is(Decision.branch(false)));
    te.noteIf(x.gt(0), true);
    assertThat(te.decideIf(x.gt(0)), is(Decision.branch(false)));
    assertThat(te.noteReturn(1) == null, is(true));
    assertThat(TreeExplorers.trivial(), sameInstance(te));
  }

  @Test void testCached() {
    final CachedTreeExplorer te = TreeExplorers.cached();
    assertThat(te.decideIf(x.gt(0)), is(Decision.branch(false)));
    assertThat(te.decideIf(x.gt(0)), is(Decision.forced(false)));
    // structurally equal, different object
    assertThat(te.decideIf(x.gt(0.0)), is(Decision.forced(false)));
    assertThat(te.decideIf(x.ge(0)), is(Decision.branch(false)));
    te.noteIf(y.lt(1), true);
    assertThat(te.decideIf(y.lt(1)), is(Decision.forced(true)));
    assertThat(te.size(), is(3));
    assertThat(te.noteReturn("done") == null, is(true));
    assertThat(te.size(), is(0));
    assertThat(te.decideIf(x.gt(0)), is(Decision.branch(false)));
  }

  @Test void testLinearBranch() {
    final LinConstrTreeExplorer te =
        LinConstrTreeExplorer.create(Collections.singletonList(x.gt(0)));
    assertThat(te.decideIf(x.le(2)).exploreOtherSide, is(true));
    assertThat(te.decideIf(x.plus(y).le(2)).exploreOtherSide, is(true));
  }

  @Test void testLinearForced() {
    final LinConstrTreeExplorer te =
        LinConstrTreeExplorer.create(Collections.singletonList(x.gt(0)));
    final Decision d = te.decideIf(x.le(-2));
    assertThat(d.value, is(false));
    assertThat(d.exploreOtherSide, is(false));
    assertThat(d.simplified, hasToString("x ≤ -2"));

    final Decision d2 = te.decideIf(x.gt(x));
    assertThat(d2.value, is(false));
    assertThat(d2.exploreOtherSide, is(false));

    final Decision d3 = te.decideIf(x.ge(x));
    assertThat(d3.value, is(true));
    assertThat(d3.exploreOtherSide, is(false));

    final Decision d4 = te.decideIf(x.negate().lt(0));
    assertThat(d4.value, is(true));
    assertThat(d4.exploreOtherSide, is(false));
    assertThat(d4.simplified, hasToString("x > 0"));
  }

  /** Tests that taking the false side of a branch narrows the constraints
   * on the path. */
  @Test void testLinearNarrow() {
    final LinConstrTreeExplorer te = TreeExplorers.linear().build();
    final Decision d = te.decideIf(x.gt(0));
    assertThat(d,
        is(Decision.branch(false)
            .withSimplified(LinearForms.parseCanonical(x.gt(0)))));
    assertThat(LinConstrTreeExplorer.describe(te.constraints()),
        hasToString("[x ∈ (-∞, 0]]"));
    assertThat(te.decideIf(x.gt(0)).exploreOtherSide, is(false));
    assertThat(te.decideIf(x.gt(-1)), is(Decision.branch(false)
        .withSimplified(LinearForms.parseCanonical(x.gt(-1)))));
    assertThat(LinConstrTreeExplorer.describe(te.constraints()),
        hasToString("[x ∈ (-∞, -1]]"));
    final Decision d2 = te.decideIf(x.lt(5));
    assertThat(d2.value, is(true));
    assertThat(d2.exploreOtherSide, is(false));

    // the end of a path restores the base constraints, which are empty
    te.noteReturn(null);
    assertThat(te.constraints().isEmpty(), is(true));
    assertThat(te.decideIf(x.gt(0)).exploreOtherSide, is(true));
  }

  @Test void testLinearNoteIf() {
    final LinConstrTreeExplorer te = TreeExplorers.linear().build();
    te.noteIf(x.gt(0), true);
    te.noteIf(y.minus(x).le(3), false);
    assertThat(LinConstrTreeExplorer.describe(te.constraints()),
        hasToString("[x ∈ (0, ∞), x - y ∈ (-∞, -3)]"));
    assertThrows(InfeasiblePathException.class,
        () -> te.noteIf(x.lt(0), true));
    assertThrows(InfeasiblePathException.class,
        () -> te.noteIf(x.gt(x), true));
    te.noteIf(x.gt(x), false);
  }

  /** Tests that opposite constraints on the same combination are stored
   * together. */
  @Test void testLinearOpposite() {
    final LinConstrTreeExplorer te = TreeExplorers.linear()
        .assume(x.minus(y).ge(2))
        .assume(x.minus(y).le(2))
        .assume(y.minus(x).le(-1))
        .build();
    assertThat(te.constraints().size(), is(1));
    assertThat(LinConstrTreeExplorer.describe(te.constraints()),
        hasToString("[x - y ∈ [2, 2]]"));
    assertThat(te.decideIf(x.eq(y.plus(2))), is(Decision.forced(true)
        .withSimplified(LinearForms.parseCanonical(x.eq(y.plus(2))))));
  }

  @Test void testLinearAssumeEmpty() {
    final LinConstrTreeExplorer te = TreeExplorers.linear()
        .assume(x.ge(x))
        .assume(true)
        .build();
    assertThat(te.constraints().isEmpty(), is(true));
    assertThrows(InfeasiblePathException.class,
        () -> TreeExplorers.linear().assume(false));
    assertThrows(InfeasiblePathException.class,
        () -> TreeExplorers.linear().assume(x.gt(x)));
    assertThrows(InfeasiblePathException.class,
        () -> TreeExplorers.linear().assume(x.gt(1)).assume(x.lt(0)));
    assertThrows(UnsupportedExpressionFormException.class,
        () -> TreeExplorers.linear().assume(x.times(y).gt(1)));
  }

  @Test void testLinearBound() {
    final LinConstrTreeExplorer te = TreeExplorers.linear()
        .bound(x, "[0, 10]")
        .bound(y.minus(x), "[1, 2]")
        .build();
    assertThat(LinConstrTreeExplorer.describe(te.constraints()),
        hasToString("[x ∈ [0, 10], x - y ∈ [-2, -1]]"));
    assertThat(te.decideIf(x.ge(y)).value, is(false));
    assertThat(te.decideIf(x.ge(y)).exploreOtherSide, is(false));
    assertThat(te.decideIf(x.le(10)), is(Decision.forced(true)
        .withSimplified(LinearForms.parseCanonical(x.le(10)))));

    te.noteIf(x.gt(5), true);
    assertThat(te.noteReturn("r").describe(),
        hasToString("[x ∈ (5, 10], x - y ∈ [-2, -1]]"));
    assertThat(te.noteReturn("r2").describe(),
        hasToString("[x ∈ [0, 10], x - y ∈ [-2, -1]]"));

    assertThrows(InfeasiblePathException.class,
        () -> TreeExplorers.linear().bound(x, "[0, 1]").bound(x, "[2, 3]"));
    assertThrows(InfeasiblePathException.class,
        () -> TreeExplorers.linear().bound(3, "[0, 1]"));
    TreeExplorers.linear().bound(Exprs.binary(Op.PLUS, 1, 2), "[3, 3]");
  }

  /** Tests the sign inference for descending chains of non-negative
   * variables. */
  @Test void testLinearChain() {
    final List<Var> p = vars.list("p", 3);
    final LinConstrTreeExplorer te = TreeExplorers.linear().chain(p).build();
    assertThat(LinConstrTreeExplorer.describe(te.constraints()),
        hasToString("[p0 - p1 ∈ [0, ∞), p1 - p2 ∈ [0, ∞), p2 ∈ [0, ∞)]"));

    // p0 - p1 - p2: prefix sums 1, 0, -1; no inference
    assertThat(
        te.decideIf(p.get(0).ge(p.get(1).plus(p.get(2)))).exploreOtherSide,
        is(true));
    te.noteReturn(null);

    // p0 - p1 + p2: prefix sums 1, 0, 1; non-negative
    final Decision d = te.decideIf(p.get(0).plus(p.get(2)).ge(p.get(1)));
    assertThat(d.value, is(true));
    assertThat(d.exploreOtherSide, is(false));

    // canonical form is p0 - p1 < 0; p0 - p1 is known non-negative
    final Decision d2 = te.decideIf(p.get(1).gt(p.get(0)));
    assertThat(d2.value, is(false));
    assertThat(d2.exploreOtherSide, is(false));

    // 2p0 - 3p2: prefix sums 2, -1; no inference
    assertThat(
        te.decideIf(p.get(0).times(2).ge(p.get(2).times(3))).exploreOtherSide,
        is(true));

    // x is not in the chain
    assertThat(te.decideIf(p.get(0).ge(x)).exploreOtherSide, is(true));
    assertThat(te.decideIf(p.get(2).lt(0)).exploreOtherSide, is(false));
    assertThat(te.stored(
            LinearForms.parseCanonical(p.get(0).plus(p.get(1)).ge(0))
                .coefficients),
        is(Intervals.parse("[0, ∞)")));
  }

  /** Tests that chains may not share variables. */
  @Test void testLinearChainsDisjoint() {
    final Var a = vars.get("a");
    final Var b = vars.get("b");
    final Var c = vars.get("c");
    final Var d = vars.get("d");
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> TreeExplorers.linear()
                .chain(Arrays.asList(a, b))
                .chain(Arrays.asList(a, c)));
    assertThat(e.getMessage(), is("variable a is already in a chain"));
    assertThrows(IllegalArgumentException.class,
        () -> TreeExplorers.linear().chain(Arrays.asList(a, b, a)));

    final LinConstrTreeExplorer te = TreeExplorers.linear()
        .chain(Arrays.asList(a, b))
        .chain(Arrays.asList(c, d))
        .build();
    // a - b - c + d: prefix sums 1, 0 and -1, 0; no inference
    assertThat(te.decideIf(a.plus(d).ge(b.plus(c))).exploreOtherSide,
        is(true));
    // a - b + c - d: prefix sums 1, 0 and 1, 0; non-negative
    assertThat(te.decideIf(a.plus(c).ge(b.plus(d))),
        is(
            Decision.forced(true)
                .withSimplified(
                    LinearForms.parseCanonical(a.plus(c).ge(b.plus(d))))));
    // z is in no chain, so nothing is known about a - z
    final Var z = vars.get("z");
    assertThat(te.decideIf(a.ge(z)).exploreOtherSide, is(true));
  }

  /** Tests that the linear explorer never prunes a feasible outcome.
   * Builds a tree of a function that tests a fixed sequence of conditions,
   * then checks that for every assignment of small integers to the
   * variables, the outcomes of the conditions are a path in the tree. */
  @Test void testLinearPruningIsSound() {
    final List<Expr> conditions =
        Arrays.asList(x.gt(0),
            y.le(x),
            x.plus(y).ge(1),
            x.gt(1),
            y.lt(x),
            x.le(0),
            x.minus(y).ge(-1),
            y.times(2).gt(x.plus(1)));
    final Set<Object> leafValues =
        leafValues(TreeExplorers.linear().build(), conditions);
    assertThat(leafValues.size(), lessThan(1 << conditions.size()));

    for (int i = -3; i <= 3; i++) {
      for (int j = -3; j <= 3; j++) {
        final BigDecimal xValue = BigDecimal.valueOf(i);
        final BigDecimal yValue = BigDecimal.valueOf(j);
        assertThat(leafValues,
            hasItem(
                outcomes(conditions,
                    name -> name.equals("x") ? xValue : yValue)));
      }
    }
  }

  /** As {@link #testLinearPruningIsSound()}, but with a chain and an
   * assumption, checking only the assignments that satisfy them. */
  @Test void testLinearPruningIsSoundWithBaseConstraints() {
    final Var a = vars.get("a");
    final Var b = vars.get("b");
    final Var c = vars.get("c");
    final List<Expr> conditions =
        Arrays.asList(a.ge(b),
            a.plus(b).ge(0),
            a.ge(b.times(2)),
            c.le(a),
            c.ge(b),
            a.ge(b.plus(c)),
            a.minus(c).ge(1),
            b.times(3).gt(a),
            c.plus(b).lt(a.times(2)));
    final Supplier<LinConstrTreeExplorer> explorer = () ->
        TreeExplorers.linear()
            .chain(Arrays.asList(a, b))
            .assume(c.le(a))
            .build();
    final Set<Object> leafValues = leafValues(explorer.get(), conditions);

    // a ≥ b, a + b ≥ 0 and c ≤ a are forced
    final Node root =
        RepeatedRunTreeGen.explore(new Session(), explorer.get(),
            target(conditions));
    assertThat(Nodes.count(root).count(Node.Kind.FROZEN_IF),
        greaterThan(0));
    assertThat(leafValues.size(), lessThan(1 << 7));

    final List<Expr> base = Arrays.asList(a.ge(b), b.ge(0), c.le(a));
    int checked = 0;
    for (int i = -2; i <= 3; i++) {
      for (int j = -2; j <= 3; j++) {
        for (int k = -2; k <= 3; k++) {
          final Map<String, BigDecimal> values =
              ImmutableMap.of("a", BigDecimal.valueOf(i),
                  "b", BigDecimal.valueOf(j),
                  "c", BigDecimal.valueOf(k));
          if (!outcomes(base, values::get)
              .equals(Collections.nCopies(base.size(), true))) {
            continue;
          }
          ++checked;
          assertThat(values.toString(), leafValues,
              hasItem(outcomes(conditions, values::get)));
        }
      }
    }
    assertThat(checked, greaterThan(0));
  }

  /** Returns a target that tests each condition in turn and returns the
   * outcomes. */
  private static Target target(List<Expr> conditions) {
    return s -> {
      final ImmutableList.Builder<Boolean> outcomes = ImmutableList.builder();
      for (Expr condition : conditions) {
        outcomes.add(s.test(condition));
      }
      return outcomes.build();
    };
  }

  /** Builds the tree of {@link #target(List)} and returns the distinct
   * values of its leaves. */
  private static Set<Object> leafValues(TreeExplorer explorer,
      List<Expr> conditions) {
    final Node root =
        RepeatedRunTreeGen.explore(new Session(), explorer,
            target(conditions));
    final Set<Object> leafValues = new HashSet<>();
    for (ReturnNode leaf : Nodes.leaves(root)) {
      leafValues.add(leaf.value);
    }
    // every path is distinct
    assertThat(leafValues, hasSize(Nodes.leaves(root).size()));
    return leafValues;
  }

  /** Evaluates each condition, given a value for each variable. */
  private static ImmutableList<Boolean> outcomes(List<Expr> conditions,
      Function<String, BigDecimal> env) {
    final ImmutableList.Builder<Boolean> outcomes = ImmutableList.builder();
    for (Expr condition : conditions) {
      outcomes.add((Boolean) Exprs.evaluate(condition, env));
    }
    return outcomes.build();
  }
}

// End ExplorerTest.java
