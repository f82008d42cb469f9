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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/** Utilities for {@link Node}. */
public abstract class Nodes {
  private Nodes() {}

  /** Calls an action on each node of a tree, parents before children,
   * slots in order. Empty slots are skipped. */
  public static void forEach(@Nullable Node root, Consumer<Node> action) {
    if (root == null) {
      return;
    }
    action.accept(root);
    for (@Nullable Node kid : root.kids()) {
      forEach(kid, action);
    }
  }

  /** Returns the leaves of a tree, in slot order. */
  public static ImmutableList<ReturnNode> leaves(@Nullable Node root) {
    final ImmutableList.Builder<ReturnNode> b = ImmutableList.builder();
    forEach(root, node -> {
      if (node instanceof ReturnNode) {
        b.add((ReturnNode) node);
      }
    });
    return b.build();
  }

  /** Returns the number of nodes of each kind in a tree. */
  public static ImmutableMultiset<Node.Kind> count(@Nullable Node root) {
    final ImmutableMultiset.Builder<Node.Kind> b = ImmutableMultiset.builder();
    forEach(root, node -> b.add(node.kind));
    return b.build();
  }

  /** Returns the sequence of decisions on the path from the root to a node.
   *
   * <p>Each {@link IfNode} on the path contributes the branch taken, each
   * {@link FrozenIfNode} its forced value; {@link InfoNode}s contribute
   * nothing. */
  public static ImmutableList<Boolean> decisions(Node node) {
    final List<Boolean> list = new ArrayList<>();
    Node child = node;
    for (@Nullable InternalNode p = node.parent; p != null; p = p.parent) {
      if (p instanceof IfNode) {
        list.add(p.kid(1) == child);
      } else if (p instanceof FrozenIfNode) {
        list.add(((FrozenIfNode) p).b);
      }
      child = p;
    }
    return ImmutableList.copyOf(list).reverse();
  }

  /** Returns the decision sequence of each leaf, in slot order. */
  public static ImmutableList<ImmutableList<Boolean>> paths(
      @Nullable Node root) {
    final ImmutableList.Builder<ImmutableList<Boolean>> b =
        ImmutableList.builder();
    for (ReturnNode leaf : leaves(root)) {
      b.add(decisions(leaf));
    }
    return b.build();
  }

  /** Returns whether two trees have the same shape: the same kinds of node
   * in the same arrangement, with equal conditions, forced values, info
   * values and return values. */
  public static boolean sameShape(@Nullable Node a, @Nullable Node b) {
    if (a == null || b == null) {
      return a == b;
    }
    if (a.kind != b.kind) {
      return false;
    }
    switch (a.kind) {
    case RETURN:
      return Objects.equals(((ReturnNode) a).value, ((ReturnNode) b).value);
    case INFO:
      if (!Objects.equals(((InfoNode) a).value, ((InfoNode) b).value)) {
        return false;
      }
      break;
    case FROZEN_IF:
      if (((FrozenIfNode) a).b != ((FrozenIfNode) b).b) {
        return false;
      }
      // fall through
    case IF:
      if (!((DecisionNode) a).expr.equals(((DecisionNode) b).expr)) {
        return false;
      }
      break;
    default:
      throw new AssertionError(a.kind);
    }
    final List<@Nullable Node> aKids = a.kids();
    final List<@Nullable Node> bKids = b.kids();
    for (int i = 0; i < aKids.size(); i++) {
      if (!sameShape(aKids.get(i), bKids.get(i))) {
        return false;
      }
    }
    return true;
  }
}

// End Nodes.java
