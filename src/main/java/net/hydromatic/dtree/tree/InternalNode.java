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

import net.hydromatic.dtree.eval.EngineInvariantViolationException;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/** Node that owns a fixed number of child slots.
 *
 * <p>The number of slots is set at creation and never changes. A slot is
 * filled at most once, by {@link #attach(int, Node)}. */
public abstract class InternalNode extends Node {
  private final @Nullable Node[] kids;

  InternalNode(Kind kind, @Nullable InternalNode parent, int slotCount) {
    super(kind, parent, false);
    checkArgument(slotCount > 0, "slot count must be positive");
    this.kids = new Node[slotCount];
  }

  public int slotCount() {
    return kids.length;
  }

  /** Returns the child in slot {@code i}, or null if the slot is empty. */
  public @Nullable Node kid(int i) {
    return kids[i];
  }

  @Override public List<@Nullable Node> kids() {
    return Collections.unmodifiableList(Arrays.asList(kids));
  }

  /** Returns whether slot {@code i} holds an explored node. */
  public boolean isSlotExplored(int i) {
    final @Nullable Node kid = kids[i];
    return kid != null && kid.explored;
  }

  /** Returns the number of slots that are empty or hold an unexplored
   * node. */
  public int unexploredCount() {
    int n = 0;
    for (int i = 0; i < kids.length; i++) {
      if (!isSlotExplored(i)) {
        ++n;
      }
    }
    return n;
  }

  /** Fills an empty slot with a node whose parent is this node.
   *
   * @throws EngineInvariantViolationException if the slot is not empty */
  public void attach(int i, Node node) {
    checkArgument(node.parent == this, "node has a different parent");
    if (kids[i] != null) {
      throw new EngineInvariantViolationException("slot " + i + " of "
          + label() + " is already filled");
    }
    kids[i] = node;
  }

  /** Marks this node explored if all of its slots are explored, then does
   * the same for its parent, and so on up the tree. Stops at the first node
   * that still has an unexplored slot.
   *
   * <p>Call after attaching a leaf below this node. */
  public void propagateExplored() {
    for (@Nullable InternalNode node = this;
         node != null && !node.explored && node.unexploredCount() == 0;
         node = node.parent) {
      node.explored = true;
    }
  }
}

// End InternalNode.java
