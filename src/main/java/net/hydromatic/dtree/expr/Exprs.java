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

import net.hydromatic.dtree.explore.UnsupportedExpressionFormException;

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkArgument;

/** Utilities for {@link Expr}. */
public abstract class Exprs {
  private Exprs() {}

  /** Creates an expression that applies a binary operator. Use this when
   * the left operand is a literal, for example {@code 1 - x}. */
  public static BinExpr binary(Op op, Object left, Object right) {
    return new BinExpr(op, left, right);
  }

  /** Creates an expression that applies a unary operator. */
  public static UnExpr unary(Op op, Object arg) {
    return new UnExpr(op, arg);
  }

  /** Creates an aggregate expression. */
  public static AggExpr aggregate(Op op, List<?> args) {
    return new AggExpr(op, args);
  }

  /** Flattens a chain of applications of an associative operator.
   *
   * <p>For example, flattening "(a + b) + (c + d)" with {@link Op#PLUS}
   * gives "a + b + c + d". Operands that use a different operator are kept
   * whole. */
  public static AggExpr flatten(Object expr, Op op) {
    final List<Object> terms = new ArrayList<>();
    flatten(expr, op, terms);
    return new AggExpr(op, terms);
  }

  private static void flatten(Object expr, Op op, List<Object> terms) {
    if (expr instanceof BinExpr && ((BinExpr) expr).op == op) {
      flatten(((BinExpr) expr).left, op, terms);
      flatten(((BinExpr) expr).right, op, terms);
    } else if (expr instanceof AggExpr && ((AggExpr) expr).op == op) {
      for (Object arg : ((AggExpr) expr).args) {
        flatten(arg, op, terms);
      }
    } else {
      terms.add(expr);
    }
  }

  /** Returns the conjunction of some conditions.
   *
   * <p>Each condition is either an {@link Expr} or a {@link Boolean}. If a
   * concrete condition is false, returns {@link Boolean#FALSE} without
   * looking further; otherwise returns an "and" {@link AggExpr} of the
   * symbolic conditions, or {@link Boolean#TRUE} if there are none. */
  public static Object all(Iterable<?> conditions) {
    final List<Expr> terms = new ArrayList<>();
    for (Object condition : conditions) {
      if (condition instanceof Expr) {
        terms.add((Expr) condition);
      } else if (!toBoolean(condition)) {
        return Boolean.FALSE;
      }
    }
    return terms.isEmpty() ? Boolean.TRUE : new AggExpr(Op.AND, terms);
  }

  /** Returns the disjunction of some conditions.
   *
   * @see #all(Iterable) */
  public static Object any(Iterable<?> conditions) {
    final List<Expr> terms = new ArrayList<>();
    for (Object condition : conditions) {
      if (condition instanceof Expr) {
        terms.add((Expr) condition);
      } else if (toBoolean(condition)) {
        return Boolean.TRUE;
      }
    }
    return terms.isEmpty() ? Boolean.FALSE : new AggExpr(Op.OR, terms);
  }

  private static boolean toBoolean(@Nullable Object o) {
    checkArgument(o instanceof Boolean, "expected Expr or Boolean, got %s", o);
    return (Boolean) o;
  }

  /** Converts a value to a string.
   *
   * <p>Unlike {@link Object#toString()}, writes strings in quotes, prints
   * expressions without enclosing parentheses, and recurses into lists,
   * sets, maps and arrays. */
  public static String pretty(@Nullable Object o) {
    return pretty(new StringBuilder(), o).toString();
  }

  private static StringBuilder pretty(StringBuilder b, @Nullable Object o) {
    if (o == null) {
      return b.append("null");
    } else if (o instanceof String) {
      return b.append('\'').append(o).append('\'');
    } else if (o instanceof Expr) {
      return b.append(o);
    } else if (o instanceof BigDecimal) {
      return b.append(((BigDecimal) o).toPlainString());
    } else if (o instanceof Object[]) {
      return prettyList(b, "[", ImmutableList.copyOf((Object[]) o), "]");
    } else if (o instanceof List) {
      return prettyList(b, "[", (List<?>) o, "]");
    } else if (o instanceof Set) {
      return prettyList(b, "{", (Set<?>) o, "}");
    } else if (o instanceof Map) {
      b.append('{');
      int i = 0;
      for (Map.Entry<?, ?> e : ((Map<?, ?>) o).entrySet()) {
        if (i++ > 0) {
          b.append(", ");
        }
        pretty(b, e.getKey()).append(": ");
        pretty(b, e.getValue());
      }
      return b.append('}');
    } else {
      return b.append(o);
    }
  }

  private static StringBuilder prettyList(StringBuilder b, String open,
      Collection<?> list, String close) {
    b.append(open);
    int i = 0;
    for (Object o : list) {
      if (i++ > 0) {
        b.append(", ");
      }
      pretty(b, o);
    }
    return b.append(close);
  }

  /** Evaluates an expression, given a value for each variable.
   *
   * <p>Supports arithmetic ({@code + - * /}, negation, {@code abs},
   * {@code floor}, {@code ceil}, {@code round}),
   * comparisons, "and" and "or". Returns a {@link BigDecimal} or a
   * {@link Boolean}.
   *
   * @throws UnsupportedExpressionFormException if the expression uses an
   * operator that cannot be evaluated */
  public static Object evaluate(Object expr,
      Function<String, BigDecimal> env) {
    if (!(expr instanceof Expr)) {
      return literal(expr);
    }
    final Expr e = (Expr) expr;
    switch (e.op) {
    case VAR:
      return env.apply(((Var) e).name);

    case LIN_CMP:
      return ((LinCmpExpr) e).evaluate(env);

    case PLUS:
    case MINUS:
    case TIMES:
    case DIVIDE:
      if (e instanceof AggExpr) {
        final AggExpr agg = (AggExpr) e;
        BigDecimal v = e.op == Op.TIMES ? BigDecimal.ONE : BigDecimal.ZERO;
        for (Object arg : agg.args) {
          final BigDecimal x = number(evaluate(arg, env));
          v = e.op == Op.TIMES ? v.multiply(x) : v.add(x);
        }
        return v;
      }
      final BinExpr bin = (BinExpr) e;
      final BigDecimal a = number(evaluate(bin.left, env));
      final BigDecimal b = number(evaluate(bin.right, env));
      switch (e.op) {
      case PLUS:
        return a.add(b);
      case MINUS:
        return a.subtract(b);
      case TIMES:
        return a.multiply(b);
      default:
        if (b.signum() == 0) {
          throw new UnsupportedExpressionFormException("division by zero in "
              + e);
        }
        return a.divide(b, MathContext.DECIMAL128);
      }

    case LT:
    case LE:
    case GT:
    case GE:
    case EQ:
    case NE:
      final BinExpr cmp = (BinExpr) e;
      return e.op.test(number(evaluate(cmp.left, env)),
          number(evaluate(cmp.right, env)));

    case NEGATE:
      return number(evaluate(((UnExpr) e).arg, env)).negate();
    case POSITIVE:
      return number(evaluate(((UnExpr) e).arg, env));
    case ABS:
      return number(evaluate(((UnExpr) e).arg, env)).abs();
    case FLOOR:
      return number(evaluate(((UnExpr) e).arg, env))
          .setScale(0, RoundingMode.FLOOR);
    case CEIL:
      return number(evaluate(((UnExpr) e).arg, env))
          .setScale(0, RoundingMode.CEILING);
    case ROUND:
      // Halves round to even.
      return number(evaluate(((UnExpr) e).arg, env))
          .setScale(0, RoundingMode.HALF_EVEN);

    case AND:
      for (Object arg : ((AggExpr) e).args) {
        if (!bool(evaluate(arg, env))) {
          return false;
        }
      }
      return true;

    case OR:
      for (Object arg : ((AggExpr) e).args) {
        if (bool(evaluate(arg, env))) {
          return true;
        }
      }
      return false;

    default:
      throw new UnsupportedExpressionFormException("cannot evaluate "
          + e.op + " in " + e);
    }
  }

  private static Object literal(Object o) {
    if (o instanceof Boolean) {
      return o;
    }
    if (o instanceof Number) {
      final @Nullable BigDecimal d = Expr.toDecimalOrNull((Number) o);
      if (d != null) {
        return d;
      }
    }
    throw new UnsupportedExpressionFormException("cannot evaluate literal "
        + pretty(o));
  }

  private static BigDecimal number(Object o) {
    if (!(o instanceof BigDecimal)) {
      throw new UnsupportedExpressionFormException("expected number, got "
          + pretty(o));
    }
    return (BigDecimal) o;
  }

  private static boolean bool(Object o) {
    if (!(o instanceof Boolean)) {
      throw new UnsupportedExpressionFormException("expected boolean, got "
          + pretty(o));
    }
    return (Boolean) o;
  }
}

// End Exprs.java
