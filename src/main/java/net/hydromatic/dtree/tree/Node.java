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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/** Node in a decision tree.
 *
 * <p>A node is either a leaf ({@link ReturnNode}) or an
 * {@link InternalNode} that owns a fixed number of child slots. A slot is
 * empty ("unfinished") until some run reaches it.
 *
 * <p>A node is <em>explored</em> when every path through it has been
 * enumerated. Leaves are explored when created; an internal node becomes
 * explored when all of its slots are filled with explored nodes, and never
 * becomes unexplored again. */
public abstract class Node {
  public final Kind kind;
  /** Parent, or null if this is the root. Used only to walk upward. */
  final @Nullable InternalNode parent;
  boolean explored;

  Node(Kind kind, @Nullable InternalNode parent, boolean explored) {
    this.kind = requireNonNull(kind, "kind");
    this.parent = parent;
    this.explored = explored;
  }

  public @Nullable InternalNode parent() {
    return parent;
  }

  public boolean isExplored() {
    return explored;
  }

  /** Returns the child slots, in order. An empty slot is null. */
  public abstract List<@Nullable Node> kids();

  /** Returns a one-line description of this node, such as "if x &gt; y". */
  public String label() {
    return label(false);
  }

  /** Returns a one-line description of this node, using the simplified form
   * of the deciding expression if {@code simplify} and there is one. */
  public abstract String label(boolean simplify);

  public abstract <R> R accept(NodeVisitor<R> visitor);

  @Override public String toString() {
    return kind + "(" + label() + ", explored=" + explored + ")";
  }

  /** Kind of node. */
  public enum Kind {
    RETURN,
    IF,
    FROZEN_IF,
    INFO
  }
}

// End Node.java
