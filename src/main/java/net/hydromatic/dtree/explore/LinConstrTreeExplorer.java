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

import net.hydromatic.dtree.expr.Expr;
import net.hydromatic.dtree.expr.Exprs;
import net.hydromatic.dtree.expr.LinCmpExpr;
import net.hydromatic.dtree.expr.Var;
import net.hydromatic.dtree.tree.ReturnNode;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableRangeSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Range;
import com.google.common.collect.RangeSet;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

/** Explorer that tracks linear constraints along a path and uses them to
 * prove that some conditions are forced.
 *
 * <p>Each condition is converted to canonical linear form
 * "c<sub>1</sub>v<sub>1</sub> + ... + c<sub>n</sub>v<sub>n</sub> op k"
 * (see {@link LinearForms}). For each distinct linear combination, the
 * explorer keeps the set of values that the combination may take on the
 * current path. A condition is forced if the set lies entirely on one side
 * of it.
 *
 * <p>The combinations are tracked independently; the explorer does not
 * combine constraints on different combinations, except for descending
 * chains of non-negative variables declared via
 * {@link Builder#chain(List)}. It therefore never prunes a feasible
 * outcome, but may fail to prune an infeasible one.
 *
 * <p>Base constraints, declared via the {@link Builder}, hold on every path.
 * They are in force when the explorer is created and are restored at the
 * end of each path. */
public class LinConstrTreeExplorer implements TreeExplorer {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(LinConstrTreeExplorer.class);

  private final ImmutableMap<ImmutableSortedMap<String, BigDecimal>,
      ImmutableRangeSet<BigDecimal>> base;
  private final ImmutableList<ImmutableList<String>> chains;

  /** Constraints on the current path. */
  private final Map<ImmutableSortedMap<String, BigDecimal>,
      ImmutableRangeSet<BigDecimal>> constraints = new LinkedHashMap<>();

  private LinConstrTreeExplorer(
      ImmutableMap<ImmutableSortedMap<String, BigDecimal>,
          ImmutableRangeSet<BigDecimal>> base,
      ImmutableList<ImmutableList<String>> chains) {
    this.base = base;
    this.chains = chains;
    constraints.putAll(base);
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Creates an explorer whose base constraints are that each of the given
   * conditions is true. */
  public static LinConstrTreeExplorer create(Iterable<?> assumptions) {
    final Builder b = builder();
    for (Object assumption : assumptions) {
      b.assume(assumption);
    }
    return b.build();
  }

  @Override public Decision decideIf(Expr expr) {
    final LinCmpExpr lin = LinearForms.parseCanonical(expr);
    if (lin.coefficients.isEmpty()) {
      return Decision.forced(lin.cmp.test(BigDecimal.ZERO, lin.rhs))
          .withSimplified(lin);
    }
    final ImmutableRangeSet<BigDecimal> stored = stored(lin.coefficients);
    final ImmutableRangeSet<BigDecimal> trueSet =
        stored.intersection(Intervals.of(lin.cmp, lin.rhs));
    final ImmutableRangeSet<BigDecimal> falseSet =
        stored.intersection(Intervals.of(lin.cmp.negate(), lin.rhs));
    if (trueSet.isEmpty() && falseSet.isEmpty()) {
      throw new InfeasiblePathException("no value of "
          + LinCmpExpr.sumToString(lin.coefficients) + " is feasible; "
          + "known to be in " + Intervals.toString(stored));
    }
    if (falseSet.isEmpty()) {
      LOGGER.debug("{} is forced true", lin);
      return Decision.forced(true).withSimplified(lin);
    }
    if (trueSet.isEmpty()) {
      LOGGER.debug("{} is forced false", lin);
      return Decision.forced(false).withSimplified(lin);
    }
    constraints.put(lin.coefficients, falseSet);
    return Decision.branch(false).withSimplified(lin);
  }

  @Override public void noteIf(Expr expr, boolean value) {
    final LinCmpExpr lin = LinearForms.parseCanonical(expr);
    if (lin.coefficients.isEmpty()) {
      if (lin.cmp.test(BigDecimal.ZERO, lin.rhs) != value) {
        throw new InfeasiblePathException("constant condition " + lin
            + " cannot be " + value);
      }
      return;
    }
    narrow(constraints, lin, value, stored(lin.coefficients));
  }

  /** {@inheritDoc}
   *
   * <p>Returns the constraints on the path that just ended. */
  @Override public Snapshot noteReturn(@Nullable Object returnValue) {
    final Snapshot snapshot = new Snapshot(ImmutableMap.copyOf(constraints));
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("path returned {} with constraints {}",
          Exprs.pretty(returnValue), snapshot.describe());
    }
    constraints.clear();
    constraints.putAll(base);
    return snapshot;
  }

  /** Returns the constraints on the current path. */
  public ImmutableMap<ImmutableSortedMap<String, BigDecimal>,
      ImmutableRangeSet<BigDecimal>> constraints() {
    return ImmutableMap.copyOf(constraints);
  }

  /** Returns the set of values that a linear combination may take on the
   * current path. */
  public ImmutableRangeSet<BigDecimal> stored(
      ImmutableSortedMap<String, BigDecimal> combination) {
    ImmutableRangeSet<BigDecimal> set = constraints.get(combination);
    if (set == null) {
      set = Intervals.all();
    }
    final @Nullable Range<BigDecimal> bound = chainBound(combination);
    return bound == null ? set : set.intersection(ImmutableRangeSet.of(bound));
  }

  /** Returns the sign that a linear combination is known to have from the
   * declared chains, or null.
   *
   * <p>If v<sub>1</sub> &ge; v<sub>2</sub> &ge; ... &ge; v<sub>k</sub> &ge; 0,
   * then the sum c<sub>1</sub>v<sub>1</sub> + ... + c<sub>k</sub>v<sub>k</sub>
   * equals the sum over i of (c<sub>1</sub> + ... + c<sub>i</sub>) times
   * (v<sub>i</sub> - v<sub>i+1</sub>), where v<sub>k+1</sub> = 0. Every
   * difference is non-negative, so if every prefix sum of coefficients is
   * non-negative, so is the combination; likewise non-positive.
   *
   * <p>Chains are disjoint, so each variable of the combination is counted
   * once; a variable outside every chain leaves the sign unknown. */
  private @Nullable Range<BigDecimal> chainBound(
      ImmutableSortedMap<String, BigDecimal> combination) {
    if (chains.isEmpty()) {
      return null;
    }
    int covered = 0;
    boolean nonNegative = true;
    boolean nonPositive = true;
    for (ImmutableList<String> chain : chains) {
      BigDecimal prefix = BigDecimal.ZERO;
      for (String name : chain) {
        final @Nullable BigDecimal c = combination.get(name);
        if (c == null) {
          continue;
        }
        ++covered;
        prefix = prefix.add(c);
        nonNegative &= prefix.signum() >= 0;
        nonPositive &= prefix.signum() <= 0;
      }
    }
    if (covered < combination.size()) {
      return null;
    }
    if (nonNegative) {
      return Range.atLeast(BigDecimal.ZERO);
    }
    if (nonPositive) {
      return Range.atMost(BigDecimal.ZERO);
    }
    return null;
  }

  private static void narrow(
      Map<ImmutableSortedMap<String, BigDecimal>,
          ImmutableRangeSet<BigDecimal>> constraints,
      LinCmpExpr lin, boolean value, ImmutableRangeSet<BigDecimal> stored) {
    final ImmutableRangeSet<BigDecimal> set =
        stored.intersection(
            Intervals.of(value ? lin.cmp : lin.cmp.negate(), lin.rhs));
    if (set.isEmpty()) {
      throw new InfeasiblePathException(lin + " cannot be " + value
          + "; " + LinCmpExpr.sumToString(lin.coefficients)
          + " is known to be in " + Intervals.toString(stored));
    }
    constraints.put(lin.coefficients, set);
  }

  /** Describes a set of constraints, one line per linear combination, such
   * as "x - y ∈ [2, ∞)". */
  public static ImmutableList<String> describe(
      Map<ImmutableSortedMap<String, BigDecimal>,
          ? extends RangeSet<BigDecimal>> constraints) {
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    constraints.forEach((combination, set) ->
        b.add(LinCmpExpr.sumToString(combination) + " ∈ "
            + Intervals.toString(set)));
    return b.build();
  }

  /** Constraints on a path, recorded at its leaf. */
  public static final class Snapshot {
    /** Map from linear combination to the set of values it may take. */
    public final ImmutableMap<ImmutableSortedMap<String, BigDecimal>,
        ImmutableRangeSet<BigDecimal>> constraints;

    Snapshot(ImmutableMap<ImmutableSortedMap<String, BigDecimal>,
        ImmutableRangeSet<BigDecimal>> constraints) {
      this.constraints = constraints;
    }

    /** Returns the snapshot stored on a leaf.
     *
     * @throws IllegalArgumentException if the leaf was not created by a
     *   run that used a {@link LinConstrTreeExplorer} */
    public static Snapshot of(ReturnNode leaf) {
      checkArgument(leaf.snapshot instanceof Snapshot,
          "leaf has no linear constraints: %s", leaf);
      return (Snapshot) leaf.snapshot;
    }

    /** Describes the constraints, one line per linear combination.
     *
     * @see LinConstrTreeExplorer#describe(Map) */
    public ImmutableList<String> describe() {
      return LinConstrTreeExplorer.describe(constraints);
    }

    @Override public int hashCode() {
      return constraints.hashCode();
    }

    @Override public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Snapshot
          && constraints.equals(((Snapshot) obj).constraints);
    }

    @Override public String toString() {
      return describe().toString();
    }
  }

  /** Builder for {@link LinConstrTreeExplorer}. */
  public static class Builder {
    private final Map<ImmutableSortedMap<String, BigDecimal>,
        ImmutableRangeSet<BigDecimal>> base = new LinkedHashMap<>();
    private final List<ImmutableList<String>> chains = new ArrayList<>();
    /** Names of variables in any chain. */
    private final Set<String> chained = new HashSet<>();

    private Builder() {
    }

    /** Adds a condition that holds on every path. The condition is a
     * linear comparison or a {@link Boolean}.
     *
     * @throws InfeasiblePathException if the condition contradicts base
     *   constraints added earlier */
    public Builder assume(Object condition) {
      if (condition instanceof Boolean) {
        if (!(Boolean) condition) {
          throw new InfeasiblePathException("assumption is false");
        }
        return this;
      }
      final LinCmpExpr lin = LinearForms.parseCanonical(condition);
      if (lin.coefficients.isEmpty()) {
        if (!lin.cmp.test(BigDecimal.ZERO, lin.rhs)) {
          throw new InfeasiblePathException("assumption " + condition
              + " is false");
        }
        return this;
      }
      narrow(base, lin, true, stored(lin.coefficients));
      return this;
    }

    /** Adds a constraint that a linear expression lies in a set, given in
     * interval notation such as "[0, ∞)".
     *
     * @throws MalformedIntervalException if the interval is not valid
     * @throws InfeasiblePathException if the constraint contradicts base
     *   constraints added earlier */
    public Builder bound(Object expr, String interval) {
      return bound(expr, Intervals.parse(interval));
    }

    /** Adds a constraint that a linear expression lies in a set. */
    public Builder bound(Object expr, RangeSet<BigDecimal> set) {
      final LinearForms.Affine affine = LinearForms.affine(expr);
      if (affine.isConstant()) {
        if (!set.contains(affine.constant)) {
          throw new InfeasiblePathException("constant " + affine
              + " is not in " + Intervals.toString(set));
        }
        return this;
      }
      // Move the constant to the right, then make the first coefficient
      // positive.
      final boolean negate =
          affine.coefficients.firstEntry().getValue().signum() < 0;
      final BigDecimal scale = negate ? BigDecimal.ONE.negate() : BigDecimal.ONE;
      final ImmutableRangeSet<BigDecimal> mapped =
          Intervals.map(set, scale, affine.constant.negate().multiply(scale));
      final ImmutableSortedMap<String, BigDecimal> combination =
          negate ? affine.scale(scale).coefficients : affine.coefficients;
      final ImmutableRangeSet<BigDecimal> stored = stored(combination);
      final ImmutableRangeSet<BigDecimal> narrowed =
          stored.intersection(mapped);
      if (narrowed.isEmpty()) {
        throw new InfeasiblePathException(affine + " cannot be in "
            + Intervals.toString(set));
      }
      base.put(combination, narrowed);
      return this;
    }

    /** Declares that some variables are non-negative and in descending
     * order: v<sub>1</sub> &ge; v<sub>2</sub> &ge; ... &ge; v<sub>k</sub>
     * &ge; 0.
     *
     * <p>Adds the constraint on each adjacent pair and on the last
     * variable, and lets the explorer infer the sign of any combination of
     * chain variables whose prefix sums of coefficients all have the same
     * sign.
     *
     * <p>Chains must be disjoint: a variable may appear at most once, in
     * at most one chain.
     *
     * @throws IllegalArgumentException if the chain is empty or shares a
     *   variable with itself or with an earlier chain */
    public Builder chain(List<Var> vars) {
      checkArgument(!vars.isEmpty(), "empty chain");
      final Set<String> nameSet = new HashSet<>();
      for (Var v : vars) {
        checkArgument(nameSet.add(v.name) && !chained.contains(v.name),
            "variable %s is already in a chain", v.name);
      }
      chained.addAll(nameSet);
      final ImmutableList.Builder<String> names = ImmutableList.builder();
      for (int i = 0; i < vars.size(); i++) {
        names.add(vars.get(i).name);
        if (i > 0) {
          assume(vars.get(i - 1).ge(vars.get(i)));
        }
      }
      assume(vars.get(vars.size() - 1).ge(0));
      chains.add(names.build());
      return this;
    }

    private ImmutableRangeSet<BigDecimal> stored(
        ImmutableSortedMap<String, BigDecimal> combination) {
      final ImmutableRangeSet<BigDecimal> set = base.get(combination);
      return set == null ? Intervals.all() : set;
    }

    public LinConstrTreeExplorer build() {
      return new LinConstrTreeExplorer(ImmutableMap.copyOf(base),
          ImmutableList.copyOf(chains));
    }
  }
}

// End LinConstrTreeExplorer.java
