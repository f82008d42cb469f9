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
package net.hydromatic.dtree;

import net.hydromatic.dtree.eval.EngineInvariantViolationException;
import net.hydromatic.dtree.eval.Session;
import net.hydromatic.dtree.expr.Var;
import net.hydromatic.dtree.tree.FrozenIfNode;
import net.hydromatic.dtree.tree.IfNode;
import net.hydromatic.dtree.tree.InfoNode;
import net.hydromatic.dtree.tree.Node;
import net.hydromatic.dtree.tree.Nodes;
import net.hydromatic.dtree.tree.ReturnNode;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests for {@link Node} and {@link Nodes}. */
public class NodeTest {
  private final Session session = new Session();
  private final Var x = session.var("x");
  private final Var y = session.var("y");

  /** Builds "if x &gt; 0" with an info node and a forced decision on its
   * true side, and a leaf on its false side. */
  @Test void testExplored() {
    final IfNode root = new IfNode(x.gt(0), null, null);
    assertThat(root.isExplored(), is(false));
    assertThat(root.slotCount(), is(2));
    assertThat(root.unexploredCount(), is(2));

    final ReturnNode no = new ReturnNode("no", null, root);
    root.attach(IfNode.slot(false), no);
    root.propagateExplored();
    assertThat(no.isExplored(), is(true));
    assertThat(root.isExplored(), is(false));
    assertThat(root.unexploredCount(), is(1));
    assertThat(root.isSlotExplored(0), is(true));

    final InfoNode info = new InfoNode("checkpoint", root);
    root.attach(IfNode.slot(true), info);
    final FrozenIfNode frozen = new FrozenIfNode(y.lt(x), null, true, info);
    info.attach(0, frozen);
    root.propagateExplored();
    assertThat(root.isExplored(), is(false));
    assertThat(root.unexploredCount(), is(1));

    final ReturnNode yes = new ReturnNode("yes", null, frozen);
    frozen.attach(0, yes);
    frozen.propagateExplored();
    assertThat(frozen.isExplored(), is(true));
    assertThat(info.isExplored(), is(true));
    assertThat(root.isExplored(), is(true));
    assertThat(root.unexploredCount(), is(0));

    assertThat(Nodes.leaves(root).size(), is(2));
    assertThat(Nodes.count(root).count(Node.Kind.INFO), is(1));
    assertThat(Nodes.count(root).size(), is(5));
    assertThat(Nodes.decisions(yes), hasToString("[true, true]"));
    assertThat(Nodes.decisions(no), hasToString("[false]"));
    assertThat(Nodes.paths(root), hasToString("[[false], [true, true]]"));
    assertThat(yes.parent(), is(frozen));
    assertThat(root.parent() == null, is(true));
    assertThat(frozen.label(), is("assert y < x"));
    assertThat(root,
        hasToString("IF(if x > 0, explored=true)"));
  }

  @Test void testAttach() {
    final IfNode root = new IfNode(x.gt(0), null, null);
    final IfNode other = new IfNode(x.gt(1), null, null);
    final ReturnNode leaf = new ReturnNode(1, null, root);
    root.attach(0, leaf);

    final EngineInvariantViolationException e =
        assertThrows(EngineInvariantViolationException.class,
            () -> root.attach(0, new ReturnNode(2, null, root)));
    assertThat(e.getMessage(), is("slot 0 of if x > 0 is already filled"));

    // the node must already believe that root is its parent
    assertThrows(IllegalArgumentException.class,
        () -> root.attach(1, new ReturnNode(3, null, other)));
  }

  @Test void testSameShape() {
    final IfNode a = new IfNode(x.gt(0), null, null);
    a.attach(0, new ReturnNode(1, null, a));
    final IfNode b = new IfNode(x.gt(0), null, null);
    b.attach(0, new ReturnNode(1, null, b));
    assertThat(Nodes.sameShape(a, b), is(true));
    assertThat(Nodes.sameShape(null, null), is(true));
    assertThat(Nodes.sameShape(a, null), is(false));

    b.attach(1, new ReturnNode(2, null, b));
    assertThat(Nodes.sameShape(a, b), is(false));

    final IfNode c = new IfNode(x.ge(0), null, null);
    c.attach(0, new ReturnNode(1, null, c));
    assertThat(Nodes.sameShape(a, c), is(false));

    final FrozenIfNode d = new FrozenIfNode(x.gt(0), null, true, null);
    final FrozenIfNode e = new FrozenIfNode(x.gt(0), null, false, null);
    assertThat(Nodes.sameShape(d, e), is(false));
  }
}

// End NodeTest.java
