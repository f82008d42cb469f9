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

import net.hydromatic.dtree.explore.Decision;
import net.hydromatic.dtree.explore.TreeExplorer;
import net.hydromatic.dtree.expr.Expr;
import net.hydromatic.dtree.tree.DecisionNode;
import net.hydromatic.dtree.tree.FrozenIfNode;
import net.hydromatic.dtree.tree.IfNode;
import net.hydromatic.dtree.tree.InfoNode;
import net.hydromatic.dtree.tree.InternalNode;
import net.hydromatic.dtree.tree.Node;
import net.hydromatic.dtree.tree.ReturnNode;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/** Builds a decision tree by running a target function repeatedly.
 *
 * <p>Each run replays the decisions recorded by earlier runs until it
 * reaches a slot that no run has filled (the <em>frontier</em>). From there
 * it asks the {@link TreeExplorer} for each new decision, adding a node for
 * each, and finally adds a {@link ReturnNode} leaf. Every run therefore adds
 * exactly one leaf, and the tree is finished when its root is explored.
 *
 * <p>While replaying, a run always descends into an unexplored slot. If an
 * {@link IfNode} has one unexplored slot, the run takes it. If both are
 * unexplored, the run is continuing a partly-built subtree; the explorer
 * is asked again and must choose the slot that the earlier run took.
 *
 * <p>A generator is not reusable after a run fails; later runs throw
 * {@link EngineInvariantViolationException}. */
public class RepeatedRunTreeGen implements Engine {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(RepeatedRunTreeGen.class);

  private final Session session;
  private final TreeExplorer explorer;
  private final Tracer tracer;
  private final @Nullable Integer maxRuns;

  private @Nullable Node root;
  private int runs;
  private boolean broken;

  /** Node whose slot the run will enter next; null at the root. */
  private @Nullable InternalNode parent;
  /** Node in that slot; null at the frontier. */
  private @Nullable Node current;
  /** Index of the slot in {@link #parent}. */
  private int kidIndex;

  public RepeatedRunTreeGen(Session session, TreeExplorer explorer) {
    this(session, explorer, Tracers.empty());
  }

  public RepeatedRunTreeGen(Session session, TreeExplorer explorer,
      Tracer tracer) {
    this.session = requireNonNull(session, "session");
    this.explorer = requireNonNull(explorer, "explorer");
    this.tracer = requireNonNull(tracer, "tracer");
    this.maxRuns = Prop.MAX_RUNS.optionalIntValue(session.map);
  }

  /** Builds the complete tree of a target function and returns its
   * root. */
  public static Node explore(Session session, TreeExplorer explorer,
      Target target) {
    return new RepeatedRunTreeGen(session, explorer).run(target);
  }

  /** Returns the root of the tree, or null if no run has started. */
  public @Nullable Node root() {
    return root;
  }

  public TreeExplorer explorer() {
    return explorer;
  }

  /** Returns the number of runs started so far. */
  public int runs() {
    return runs;
  }

  /** Returns whether every path has been explored. */
  public boolean finished() {
    return root != null && root.isExplored();
  }

  /** Runs a target function until the tree is finished, and returns its
   * root. */
  public Node run(Target target) {
    while (!finished()) {
      runOnce(target);
    }
    LOGGER.info("finished tree after {} runs", runs);
    return requireNonNull(root);
  }

  /** Runs a target function once, adding one path to the tree. */
  public void runOnce(Target target) {
    startRun();
    try (Session.Scope scope = session.install(this)) {
      final @Nullable Object result = target.apply(session);
      reportEnd(result);
    } catch (RuntimeException | Error e) {
      broken = true;
      LOGGER.debug("run {} failed", runs, e);
      throw e;
    }
    tracer.onRunEnd(runs);
  }

  /** Runs a cooperative target function until the tree is finished, and
   * returns its root. The factory is called once per run, and must return
   * a new coroutine each time. */
  public Node runCoroutine(
      Function<Session, ? extends Coroutine<?>> factory) {
    return run(session -> drain(factory.apply(session)));
  }

  /** Runs a cooperative target function once. */
  public void runCoroutineOnce(
      Function<Session, ? extends Coroutine<?>> factory) {
    runOnce(session -> drain(factory.apply(session)));
  }

  /** Records each value yielded by a coroutine, and returns its result. */
  private @Nullable Object drain(Coroutine<?> coroutine) {
    while (coroutine.hasNext()) {
      noteInfo(coroutine.next());
    }
    return coroutine.result();
  }

  private void startRun() {
    if (broken) {
      throw new EngineInvariantViolationException("generator is unusable "
          + "after a failed run");
    }
    if (finished()) {
      throw new EngineInvariantViolationException("tree is finished");
    }
    if (maxRuns != null && runs >= maxRuns) {
      broken = true;
      throw new RunLimitExceededException(runs);
    }
    ++runs;
    parent = null;
    current = root;
    kidIndex = 0;
    LOGGER.debug("run {}", runs);
  }

  @Override public boolean decideIf(Expr expr) {
    final @Nullable Node current = this.current;
    if (current == null) {
      return decideAtFrontier(expr);
    }
    switch (current.kind) {
    case IF:
      final IfNode ifNode = (IfNode) current;
      checkSameCondition(ifNode, expr);
      final boolean value;
      switch (ifNode.unexploredCount()) {
      case 0:
        throw new EngineInvariantViolationException("run entered '"
            + ifNode.label() + "', which is already explored");
      case 1:
        // Take the true side once the false side is done.
        value = ifNode.isSlotExplored(IfNode.slot(false));
        explorer.noteIf(expr, value);
        break;
      default:
        final Decision decision = explorer.decideIf(expr);
        final int slot = IfNode.slot(decision.value);
        if (!decision.exploreOtherSide
            || ifNode.kid(slot) == null && ifNode.kid(1 - slot) != null) {
          throw new EngineInvariantViolationException("explorer decided "
              + decision + " for '" + expr + "', contradicting an earlier "
              + "run");
        }
        value = decision.value;
      }
      descend(ifNode, IfNode.slot(value));
      return value;

    case FROZEN_IF:
      final FrozenIfNode frozenIfNode = (FrozenIfNode) current;
      checkSameCondition(frozenIfNode, expr);
      if (frozenIfNode.isSlotExplored(0)) {
        throw new EngineInvariantViolationException("run entered '"
            + frozenIfNode.label() + "', which is already explored");
      }
      explorer.noteIf(expr, frozenIfNode.b);
      descend(frozenIfNode, 0);
      return frozenIfNode.b;

    default:
      throw new EngineInvariantViolationException("expected a decision on '"
          + expr + "' but found " + current
          + "; target function is not deterministic");
    }
  }

  private boolean decideAtFrontier(Expr expr) {
    final Decision decision = explorer.decideIf(expr);
    final DecisionNode node;
    final int slot;
    if (decision.exploreOtherSide) {
      node = new IfNode(expr, decision.simplified, parent);
      slot = IfNode.slot(decision.value);
    } else {
      node = new FrozenIfNode(expr, decision.simplified, decision.value,
          parent);
      slot = 0;
    }
    attach(node);
    tracer.onDecision(node);
    descend(node, slot);
    return decision.value;
  }

  private static void checkSameCondition(DecisionNode node, Expr expr) {
    if (!node.expr.equals(expr)) {
      throw new EngineInvariantViolationException("expected condition '"
          + node.expr + "' but got '" + expr
          + "'; target function is not deterministic");
    }
  }

  @Override public void noteInfo(@Nullable Object value) {
    final @Nullable Node current = this.current;
    if (current == null) {
      final InfoNode node = new InfoNode(value, parent);
      attach(node);
      descend(node, 0);
    } else if (current instanceof InfoNode) {
      descend((InfoNode) current, 0);
    } else {
      throw new EngineInvariantViolationException("expected '"
          + current.label() + "' but target reported "
          + value + "; target function is not deterministic");
    }
  }

  /** Ends the current run: adds a leaf, propagates explored status, and
   * returns to the root. */
  private void reportEnd(@Nullable Object returnValue) {
    if (current != null) {
      throw new EngineInvariantViolationException("run returned at "
          + current + "; target function is not deterministic");
    }
    final @Nullable Object snapshot = explorer.noteReturn(returnValue);
    final ReturnNode leaf = new ReturnNode(returnValue, snapshot, parent);
    attach(leaf);
    final @Nullable InternalNode parent = this.parent;
    if (parent != null) {
      parent.propagateExplored();
    }
    tracer.onLeaf(leaf);
    this.parent = null;
    this.current = root;
    this.kidIndex = 0;
  }

  /** Adds a node at the frontier. */
  private void attach(Node node) {
    final @Nullable InternalNode parent = this.parent;
    if (parent == null) {
      if (root != null) {
        throw new EngineInvariantViolationException("tree already has a "
            + "root");
      }
      root = node;
    } else {
      parent.attach(kidIndex, node);
    }
  }

  private void descend(InternalNode node, int slot) {
    parent = node;
    kidIndex = slot;
    current = node.kid(slot);
  }
}

// End RepeatedRunTreeGen.java
