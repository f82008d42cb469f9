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

import net.hydromatic.dtree.expr.Op;

import com.google.common.base.Splitter;
import com.google.common.collect.BoundType;
import com.google.common.collect.ImmutableRangeSet;
import com.google.common.collect.Range;
import com.google.common.collect.RangeSet;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkArgument;

/** Utilities for sets of {@link BigDecimal} values represented as Guava
 * {@link RangeSet}s.
 *
 * <p>The text notation is the usual one: "[2, 3)" is the set of x such that
 * 2 &le; x &lt; 3, "(-∞, 0]" is the set of x &le; 0, and several intervals
 * may be joined with "∪". The empty set is "∅". */
public abstract class Intervals {
  private Intervals() {}

  static final String INFINITY = "∞";
  static final String NEGATIVE_INFINITY = "-∞";
  static final String EMPTY = "∅";
  static final String UNION = " ∪ ";

  private static final Pattern INTERVAL_PATTERN =
      Pattern.compile("([\\[(])\\s*([^,\\s]+)\\s*,\\s*([^,\\s]+)\\s*([\\])])");

  /** Parses a set of intervals.
   *
   * <p>An endpoint may be a decimal number, "∞", "+∞", "-∞", "inf", "+inf"
   * or "-inf". An interval whose lower endpoint is greater than its upper
   * endpoint, or equal to it with either end open, is empty.
   *
   * @throws MalformedIntervalException if the string is not valid */
  public static ImmutableRangeSet<BigDecimal> parse(String s) {
    final String trimmed = s.trim();
    if (trimmed.equals(EMPTY) || trimmed.equals("{}")) {
      return ImmutableRangeSet.of();
    }
    final ImmutableRangeSet.Builder<BigDecimal> b = ImmutableRangeSet.builder();
    for (String piece : Splitter.on('∪').trimResults().split(trimmed)) {
      final Matcher matcher = INTERVAL_PATTERN.matcher(piece);
      if (!matcher.matches()) {
        throw new MalformedIntervalException("invalid interval '" + piece
            + "' in '" + s + "'");
      }
      final @Nullable Range<BigDecimal> range =
          range(endpoint(matcher.group(2), -1, s),
              matcher.group(1).equals("["),
              endpoint(matcher.group(3), 1, s),
              matcher.group(4).equals("]"));
      if (range != null) {
        b.add(range);
      }
    }
    try {
      return b.build();
    } catch (IllegalArgumentException e) {
      throw new MalformedIntervalException("overlapping intervals in '" + s
          + "'", e);
    }
  }

  /** Parses an endpoint. Returns null for an infinity whose sign matches
   * {@code side} (-1 for a lower endpoint, 1 for an upper endpoint). */
  private static @Nullable BigDecimal endpoint(String s, int side,
      String interval) {
    switch (s) {
    case "∞":
    case "+∞":
    case "inf":
    case "+inf":
      if (side < 0) {
        throw new MalformedIntervalException("lower endpoint is +∞ in '"
            + interval + "'");
      }
      return null;
    case "-∞":
    case "-inf":
      if (side > 0) {
        throw new MalformedIntervalException("upper endpoint is -∞ in '"
            + interval + "'");
      }
      return null;
    default:
      try {
        return new BigDecimal(s);
      } catch (NumberFormatException e) {
        throw new MalformedIntervalException("invalid endpoint '" + s
            + "' in '" + interval + "'", e);
      }
    }
  }

  /** Creates a range, or returns null if it is empty. A null endpoint is
   * unbounded. */
  private static @Nullable Range<BigDecimal> range(@Nullable BigDecimal lower,
      boolean lowerClosed, @Nullable BigDecimal upper, boolean upperClosed) {
    if (lower != null && upper != null) {
      final int c = lower.compareTo(upper);
      if (c > 0 || c == 0 && !(lowerClosed && upperClosed)) {
        return null;
      }
    }
    final BoundType lowerType = lowerClosed ? BoundType.CLOSED : BoundType.OPEN;
    final BoundType upperType = upperClosed ? BoundType.CLOSED : BoundType.OPEN;
    if (lower == null) {
      return upper == null
          ? Range.all()
          : Range.upTo(upper, upperType);
    }
    return upper == null
        ? Range.downTo(lower, lowerType)
        : Range.range(lower, lowerType, upper, upperType);
  }

  /** Returns the set of values x such that "x op rhs" holds. */
  public static ImmutableRangeSet<BigDecimal> of(Op op, BigDecimal rhs) {
    switch (op) {
    case LT:
      return ImmutableRangeSet.of(Range.lessThan(rhs));
    case LE:
      return ImmutableRangeSet.of(Range.atMost(rhs));
    case GT:
      return ImmutableRangeSet.of(Range.greaterThan(rhs));
    case GE:
      return ImmutableRangeSet.of(Range.atLeast(rhs));
    case EQ:
      return ImmutableRangeSet.of(Range.singleton(rhs));
    case NE:
      return ImmutableRangeSet.of(Range.singleton(rhs)).complement();
    default:
      throw new IllegalArgumentException("not a comparison: " + op);
    }
  }

  /** Returns the set of all values. */
  public static ImmutableRangeSet<BigDecimal> all() {
    return ImmutableRangeSet.of(Range.all());
  }

  /** Returns whether a set contains exactly the same values as another. */
  public static boolean sameValues(RangeSet<BigDecimal> a,
      RangeSet<BigDecimal> b) {
    return a.enclosesAll(b) && b.enclosesAll(a);
  }

  /** Returns the image of a set under the map x &rarr; a &middot; x + b,
   * where a is not zero. */
  public static ImmutableRangeSet<BigDecimal> map(RangeSet<BigDecimal> set,
      BigDecimal a, BigDecimal b) {
    checkArgument(a.signum() != 0, "scale must not be zero");
    final ImmutableRangeSet.Builder<BigDecimal> builder =
        ImmutableRangeSet.builder();
    for (Range<BigDecimal> r : set.asRanges()) {
      final @Nullable BigDecimal lower =
          r.hasLowerBound() ? r.lowerEndpoint().multiply(a).add(b) : null;
      final boolean lowerClosed =
          r.hasLowerBound() && r.lowerBoundType() == BoundType.CLOSED;
      final @Nullable BigDecimal upper =
          r.hasUpperBound() ? r.upperEndpoint().multiply(a).add(b) : null;
      final boolean upperClosed =
          r.hasUpperBound() && r.upperBoundType() == BoundType.CLOSED;
      final @Nullable Range<BigDecimal> image = a.signum() > 0
          ? range(lower, lowerClosed, upper, upperClosed)
          : range(upper, upperClosed, lower, lowerClosed);
      if (image != null) {
        builder.add(image);
      }
    }
    return builder.build();
  }

  /** Converts a set to a string, such as "[2, 3) ∪ (4, ∞)". */
  public static String toString(RangeSet<BigDecimal> set) {
    if (set.isEmpty()) {
      return EMPTY;
    }
    final StringBuilder b = new StringBuilder();
    for (Range<BigDecimal> r : set.asRanges()) {
      if (b.length() > 0) {
        b.append(UNION);
      }
      if (r.hasLowerBound()) {
        b.append(r.lowerBoundType() == BoundType.CLOSED ? '[' : '(')
            .append(r.lowerEndpoint().toPlainString());
      } else {
        b.append('(').append(NEGATIVE_INFINITY);
      }
      b.append(", ");
      if (r.hasUpperBound()) {
        b.append(r.upperEndpoint().toPlainString())
            .append(r.upperBoundType() == BoundType.CLOSED ? ']' : ')');
      } else {
        b.append(INFINITY).append(')');
      }
    }
    return b.toString();
  }
}

// End Intervals.java
