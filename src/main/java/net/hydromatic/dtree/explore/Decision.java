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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/** Answer of {@link TreeExplorer#decideIf(Expr)}.
 *
 * <p>{@link #value} is the outcome to take on the current run. If
 * {@link #exploreOtherSide} is true, the opposite outcome is also feasible
 * and will be explored by a later run; otherwise the outcome is forced.
 * {@link #simplified} is an optional equivalent form of the condition, for
 * display. */
public final class Decision {
  private static final Decision FALSE_BRANCH = new Decision(false, true, null);
  private static final Decision TRUE_BRANCH = new Decision(true, true, null);
  private static final Decision FALSE_FORCED =
      new Decision(false, false, null);
  private static final Decision TRUE_FORCED = new Decision(true, false, null);

  public final boolean value;
  public final boolean exploreOtherSide;
  public final @Nullable Expr simplified;

  private Decision(boolean value, boolean exploreOtherSide,
      @Nullable Expr simplified) {
    this.value = value;
    this.exploreOtherSide = exploreOtherSide;
    this.simplified = simplified;
  }

  /** Creates a decision to take {@code value} now and explore the other
   * outcome later. */
  public static Decision branch(boolean value) {
    return value ? TRUE_BRANCH : FALSE_BRANCH;
  }

  /** Creates a decision whose outcome is always {@code value}. */
  public static Decision forced(boolean value) {
    return value ? TRUE_FORCED : FALSE_FORCED;
  }

  /** Returns a copy of this decision with a given simplified
   * condition. */
  public Decision withSimplified(@Nullable Expr simplified) {
    if (Objects.equals(simplified, this.simplified)) {
      return this;
    }
    return new Decision(value, exploreOtherSide, simplified);
  }

  @Override public int hashCode() {
    return Objects.hash(value, exploreOtherSide, simplified);
  }

  @Override public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Decision
        && value == ((Decision) obj).value
        && exploreOtherSide == ((Decision) obj).exploreOtherSide
        && Objects.equals(simplified, ((Decision) obj).simplified);
  }

  @Override public String toString() {
    final StringBuilder b = new StringBuilder()
        .append(exploreOtherSide ? "branch(" : "forced(")
        .append(value);
    if (simplified != null) {
      b.append(", ").append(simplified);
    }
    return b.append(")").toString();
  }
}

// End Decision.java
