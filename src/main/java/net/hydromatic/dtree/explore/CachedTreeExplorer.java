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

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.HashMap;
import java.util.Map;

/** Explorer that remembers the outcome of each condition on the current
 * path.
 *
 * <p>If a condition that is structurally equal to one already decided on
 * this path comes up again, its outcome is forced to the same value.
 * Otherwise the explorer takes the false outcome first and asks for the
 * true outcome to be explored later. The memory is cleared at the end of
 * each path. */
public class CachedTreeExplorer implements TreeExplorer {
  private final Map<ImmutableList<Object>, Boolean> cache = new HashMap<>();

  @Override public Decision decideIf(Expr expr) {
    final @Nullable Boolean b = cache.get(expr.key());
    if (b != null) {
      return Decision.forced(b);
    }
    cache.put(expr.key(), false);
    return Decision.branch(false);
  }

  @Override public void noteIf(Expr expr, boolean value) {
    cache.put(expr.key(), value);
  }

  @Override public @Nullable Object noteReturn(@Nullable Object returnValue) {
    cache.clear();
    return null;
  }

  /** Returns the number of conditions decided on the current path. */
  public int size() {
    return cache.size();
  }
}

// End CachedTreeExplorer.java
