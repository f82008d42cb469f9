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
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/** Table of symbolic variables, keyed by name.
 *
 * <p>Within a table, each name maps to exactly one {@link Var}. Tables are
 * owned by a caller (usually via a
 * {@link net.hydromatic.dtree.eval.Session}); two tables never share
 * variable objects, even for the same name. */
public class VarTable {
  private final Map<String, Var> vars = new LinkedHashMap<>();

  /** Returns the variable with a given name, creating it if it does not
   * exist. */
  public Var get(String name) {
    return vars.computeIfAbsent(name, Var::new);
  }

  /** Creates a variable; throws if a variable with that name already
   * exists. */
  public Var create(String name) {
    checkArgument(!vars.containsKey(name), "Var(%s) already exists", name);
    return get(name);
  }

  /** Returns the variable with a given name, or null. */
  public @Nullable Var lookup(String name) {
    return vars.get(name);
  }

  /** Returns a list of variables named {@code prefix0}, {@code prefix1},
   * ... {@code prefix(n-1)}. */
  public ImmutableList<Var> list(String prefix, int n) {
    checkArgument(n >= 0, "negative count %s", n);
    final ImmutableList.Builder<Var> b = ImmutableList.builder();
    for (int i = 0; i < n; i++) {
      b.add(get(prefix + i));
    }
    return b.build();
  }

  /** Returns all variables, in order of creation. */
  public Collection<Var> vars() {
    return Collections.unmodifiableCollection(vars.values());
  }

  @Override public String toString() {
    return vars.keySet().toString();
  }
}

// End VarTable.java
