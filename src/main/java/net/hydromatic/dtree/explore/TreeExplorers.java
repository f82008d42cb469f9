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

/** Utilities for {@link TreeExplorer}. */
public abstract class TreeExplorers {
  private TreeExplorers() {}

  /** Returns an explorer that knows nothing. Every condition is a branch,
   * and the false outcome is taken first. Stateless. */
  public static TreeExplorer trivial() {
    return TrivialTreeExplorer.INSTANCE;
  }

  /** Returns an explorer that forces repeated conditions on a path. */
  public static CachedTreeExplorer cached() {
    return new CachedTreeExplorer();
  }

  /** Returns a builder for an explorer that reasons about linear
   * constraints. */
  public static LinConstrTreeExplorer.Builder linear() {
    return LinConstrTreeExplorer.builder();
  }

  /** Explorer that always branches, false first. */
  private enum TrivialTreeExplorer implements TreeExplorer {
    INSTANCE;

    @Override public Decision decideIf(Expr expr) {
      return Decision.branch(false);
    }

    @Override public void noteIf(Expr expr, boolean value) {
    }

    @Override public @Nullable Object noteReturn(
        @Nullable Object returnValue) {
      return null;
    }
  }
}

// End TreeExplorers.java
