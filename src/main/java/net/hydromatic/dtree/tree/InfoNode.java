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

import org.checkerframework.checker.nullness.qual.Nullable;

/** Non-branching node that records a value the target function reported
 * along the way, via a checkpoint or by yielding it. */
public class InfoNode extends InternalNode {
  public final @Nullable Object value;

  public InfoNode(@Nullable Object value, @Nullable InternalNode parent) {
    super(Kind.INFO, parent, 1);
    this.value = value;
  }

  @Override public String label(boolean simplify) {
    return "print: " + Exprs.pretty(value);
  }

  @Override public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visit(this);
  }
}

// End InfoNode.java
