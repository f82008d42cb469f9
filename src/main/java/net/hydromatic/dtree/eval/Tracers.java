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

import net.hydromatic.dtree.tree.DecisionNode;
import net.hydromatic.dtree.tree.ReturnNode;

import java.util.function.Consumer;
import java.util.function.IntConsumer;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each new decision
   * node, then calls the underlying tracer. */
  public static Tracer withOnDecision(Tracer tracer,
      Consumer<DecisionNode> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onDecision(DecisionNode node) {
        consumer.accept(node);
        super.onDecision(node);
      }
    };
  }

  /** Returns a tracer that performs the given action on each new leaf,
   * then calls the underlying tracer. */
  public static Tracer withOnLeaf(Tracer tracer,
      Consumer<ReturnNode> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onLeaf(ReturnNode leaf) {
        consumer.accept(leaf);
        super.onLeaf(leaf);
      }
    };
  }

  public static Tracer withOnRunEnd(Tracer tracer, IntConsumer consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onRunEnd(int runs) {
        consumer.accept(runs);
        super.onRunEnd(runs);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onDecision(DecisionNode node) {
    }

    @Override public void onLeaf(ReturnNode leaf) {
    }

    @Override public void onRunEnd(int runs) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onDecision(DecisionNode node) {
      tracer.onDecision(node);
    }

    @Override public void onLeaf(ReturnNode leaf) {
      tracer.onLeaf(leaf);
    }

    @Override public void onRunEnd(int runs) {
      tracer.onRunEnd(runs);
    }
  }
}

// End Tracers.java
