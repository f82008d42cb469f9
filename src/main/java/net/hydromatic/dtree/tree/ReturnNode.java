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
package net.hydromatic.dtree.tree;

import net.hydromatic.dtree.expr.Exprs;

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/** Leaf that records the value returned by the target function at the end
 * of a path. */
public class ReturnNode extends Node {
  public final @Nullable Object value;
  /** What the explorer knew at the end of the path, or null. */
  public final @Nullable Object snapshot;

  public ReturnNode(@Nullable Object value, @Nullable Object snapshot,
      @Nullable InternalNode parent) {
    super(Kind.RETURN, parent, true);
    this.value = value;
    this.snapshot = snapshot;
  }

  @Override public List<@Nullable Node> kids() {
    return ImmutableList.of();
  }

  @Override public String label(boolean simplify) {
    return "return " + Exprs.pretty(value);
  }

  @Override public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visit(this);
  }
}

// End ReturnNode.java
