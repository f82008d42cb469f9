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
package net.hydromatic.dtree.eval;

import net.hydromatic.dtree.expr.Expr;
import net.hydromatic.dtree.expr.Exprs;
import net.hydromatic.dtree.expr.Var;
import net.hydromatic.dtree.expr.VarTable;
import net.hydromatic.dtree.tree.TreePrinter;

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/** Context in which target functions run.
 *
 * <p>A session owns a table of variables, a map of properties, and the
 * engine that is currently recording decisions, if any. A target function
 * receives the session as its argument and calls {@link #test(Expr)} where
 * ordinary code would evaluate a condition.
 *
 * <p>Not thread-safe. */
public class Session {
  /** Property values. */
  public final Map<Prop, Object> map = new LinkedHashMap<>();

  private final VarTable vars = new VarTable();

  /** Engine of the current run, or null if no run is in progress. */
  private @Nullable Engine engine;

  public VarTable vars() {
    return vars;
  }

  /** Returns the variable with a given name, creating it if necessary. */
  public Var var(String name) {
    return vars.get(name);
  }

  /** Returns variables {@code prefix0} ... {@code prefix(n-1)}. */
  public ImmutableList<Var> varList(String prefix, int n) {
    return vars.list(prefix, n);
  }

  /** Returns the value of a symbolic condition on the current run.
   *
   * @throws UnsupportedBooleanForcingException if no run is in progress */
  public boolean test(Expr condition) {
    final @Nullable Engine engine = this.engine;
    if (engine == null) {
      throw new UnsupportedBooleanForcingException("cannot convert '"
          + condition + "' to boolean outside a tree-generating run");
    }
    return engine.decideIf(condition);
  }

  /** Returns the value of a condition that is either a {@link Boolean} or a
   * symbolic {@link Expr}, such as the result of
   * {@link Exprs#all(Iterable)}. */
  public boolean test(Object condition) {
    if (condition instanceof Boolean) {
      return (Boolean) condition;
    }
    if (condition instanceof Expr) {
      return test((Expr) condition);
    }
    throw new IllegalArgumentException("not a condition: "
        + Exprs.pretty(condition));
  }

  /** Reports a value, which becomes an
   * {@link net.hydromatic.dtree.tree.InfoNode} on the current path. Outside
   * a run, does nothing. */
  public void checkpoint(@Nullable Object value) {
    final @Nullable Engine engine = this.engine;
    if (engine != null) {
      engine.noteInfo(value);
    }
  }

  /** Returns whether a run is in progress. */
  public boolean isActive() {
    return engine != null;
  }

  /** Makes an engine active until the returned scope is closed, at which
   * point the previous engine, if any, becomes active again.
   *
   * <p>Use in a try-with-resources statement, so that the engine is
   * removed however the run ends. */
  public Scope install(Engine engine) {
    final @Nullable Engine previous = this.engine;
    this.engine = engine;
    return () -> this.engine = previous;
  }

  /** Returns a printer configured by this session's properties. */
  public TreePrinter printer() {
    return new TreePrinter(map);
  }

  /** Period during which an engine is active. */
  @FunctionalInterface
  public interface Scope extends AutoCloseable {
    @Override void close();
  }
}

// End Session.java
