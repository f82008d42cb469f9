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

import java.math.BigDecimal;

import static com.google.common.base.Preconditions.checkArgument;

/** Operators of {@link Expr}.
 *
 * <p>The set is closed: every expression constructor is resolved against a
 * constant of this enum at compile time.
 *
 * <p>Precedence follows the conventions of most infix languages: "or" binds
 * loosest, then "and", comparisons, bitwise operators, shifts, additive,
 * multiplicative, prefix operators and finally exponentiation. */
public enum Op {
  /** Variable. */
  VAR(Kind.ATOM),
  /** Canonical linear comparison. Printed as a comparison. */
  LIN_CMP(Kind.ATOM),

  OR(" or ", 1, Kind.AGGREGATE),
  AND(" and ", 2, Kind.AGGREGATE),

  LT(" < ", 4, Kind.COMPARISON),
  LE(" ≤ ", 4, Kind.COMPARISON),
  GT(" > ", 4, Kind.COMPARISON),
  GE(" ≥ ", 4, Kind.COMPARISON),
  EQ(" == ", 4, Kind.COMPARISON),
  NE(" ≠ ", 4, Kind.COMPARISON),

  BIT_OR(" | ", 5, Kind.BINARY),
  BIT_XOR(" ^ ", 6, Kind.BINARY),
  BIT_AND(" & ", 7, Kind.BINARY),
  LSHIFT(" << ", 8, Kind.BINARY),
  RSHIFT(" >> ", 8, Kind.BINARY),
  PLUS(" + ", 9, Kind.BINARY),
  MINUS(" - ", 9, Kind.BINARY),
  TIMES(" * ", 10, Kind.BINARY),
  MATMUL(" @ ", 10, Kind.BINARY),
  DIVIDE(" / ", 10, Kind.BINARY),
  FLOOR_DIVIDE(" // ", 10, Kind.BINARY),
  MOD(" % ", 10, Kind.BINARY),

  NEGATE("-", 11, Kind.PREFIX),
  POSITIVE("+", 11, Kind.PREFIX),
  POWER(" ** ", 12, false, Kind.BINARY),

  ABS("abs", Kind.FUNCTION),
  FLOOR("floor", Kind.FUNCTION),
  CEIL("ceil", Kind.FUNCTION),
  ROUND("round", Kind.FUNCTION);

  /** Padded symbol, e.g. " + ", or function name, e.g. "abs". */
  public final String padded;
  /** Left precedence. */
  public final int left;
  /** Right precedence. */
  public final int right;
  public final Kind kind;

  Op(Kind kind) {
    this("", 99, 99, kind);
  }

  Op(String padded, Kind kind) {
    this(padded, 99, 99, kind);
  }

  Op(String padded, int precedence, Kind kind) {
    this(padded, precedence, true, kind);
  }

  Op(String padded, int precedence, boolean leftAssociative, Kind kind) {
    this(padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0),
        kind);
  }

  Op(String padded, int left, int right, Kind kind) {
    this.padded = padded;
    this.left = left;
    this.right = right;
    this.kind = kind;
  }

  /** Returns the symbol without padding, e.g. "+". */
  public String symbol() {
    return padded.trim();
  }

  public boolean isComparison() {
    return kind == Kind.COMPARISON;
  }

  /** Returns the comparison that holds exactly when this one does not;
   * for example, {@code LT.negate()} is {@code GE}. */
  public Op negate() {
    switch (this) {
    case LT:
      return GE;
    case LE:
      return GT;
    case GT:
      return LE;
    case GE:
      return LT;
    case EQ:
      return NE;
    case NE:
      return EQ;
    default:
      throw new AssertionError("not a comparison: " + this);
    }
  }

  /** Returns the comparison that holds when both sides are multiplied by -1
   * (equivalently, when the operands are swapped); for example,
   * {@code LT.reverse()} is {@code GT}. */
  public Op reverse() {
    switch (this) {
    case LT:
      return GT;
    case LE:
      return GE;
    case GT:
      return LT;
    case GE:
      return LE;
    case EQ:
    case NE:
      return this;
    default:
      throw new AssertionError("not a comparison: " + this);
    }
  }

  /** Evaluates this comparison on two numbers. */
  public boolean test(BigDecimal left, BigDecimal right) {
    checkArgument(isComparison(), "not a comparison: %s", this);
    final int c = left.compareTo(right);
    switch (this) {
    case LT:
      return c < 0;
    case LE:
      return c <= 0;
    case GT:
      return c > 0;
    case GE:
      return c >= 0;
    case EQ:
      return c == 0;
    default:
      return c != 0;
    }
  }

  /** Syntactic category of an operator. */
  public enum Kind {
    /** Leaf expression, such as a variable. */
    ATOM,
    /** Infix operator with two operands. */
    BINARY,
    /** Infix comparison with two operands and a boolean result. */
    COMPARISON,
    /** Prefix operator with one operand, such as "-". */
    PREFIX,
    /** Function-style operator with one operand, such as "abs". */
    FUNCTION,
    /** Operator applied to a list of operands, such as "and". */
    AGGREGATE
  }
}

// End Op.java
