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

import net.hydromatic.dtree.eval.Prop;
import net.hydromatic.dtree.eval.RepeatedRunTreeGen;
import net.hydromatic.dtree.eval.Session;
import net.hydromatic.dtree.explore.TreeExplorers;
import net.hydromatic.dtree.expr.Var;
import net.hydromatic.dtree.tree.FrozenIfNode;
import net.hydromatic.dtree.tree.Node;
import net.hydromatic.dtree.tree.TreePrinter;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;

/** Tests for {@link TreePrinter}. */
public class TreePrinterTest {
  private final Session session = new Session();
  private final Var x = session.var("x");
  private final Var y = session.var("y");

  @Test void testPrint() {
    final Node root =
        RepeatedRunTreeGen.explore(session, TreeExplorers.cached(),
            s -> s.test(x.gt(y)) ? "yes" : "no");
    final StringBuilder buf = new StringBuilder();
    final TreePrinter.Status status = session.printer().print(root, buf);
    final String expected = "if x > y:\n"
        + "  return 'yes'\n"
        + "else:\n"
        + "  return 'no'\n";
    assertThat(buf.toString(), is(expected));
    assertThat(status, hasToString("nodes: 3, leaves: 2, lines: 4"));
  }

  /** Tests printing a tree that is not finished. */
  @Test void testUnfinished() {
    final RepeatedRunTreeGen gen =
        new RepeatedRunTreeGen(session, TreeExplorers.trivial());
    gen.runOnce(s -> ImmutableList.of(s.test(x.gt(0)), s.test(y.gt(0))));
    final String expected = "if x > 0:\n"
        + "  (unfinished)\n"
        + "else:\n"
        + "  if y > 0:\n"
        + "    (unfinished)\n"
        + "  else:\n"
        + "    return [false, false]\n";
    assertThat(session.printer().toString(gen.root()), is(expected));
    assertThat(session.printer().toString(null), is("(unfinished)\n"));
  }

  @Test void testOptions() {
    final Node root =
        RepeatedRunTreeGen.explore(session, TreeExplorers.cached(), s -> {
          s.checkpoint(1);
          return ImmutableList.of(s.test(x.gt(0)), s.test(x.gt(0)));
        });
    final String expected = "print: 1\n"
        + "if x > 0:\n"
        + "  assert x > 0\n"
        + "  return [true, true]\n"
        + "else:\n"
        + "  assert not(x > 0)\n"
        + "  return [false, false]\n";
    assertThat(session.printer().toString(root), is(expected));

    Prop.SHOW_FROZEN_IF.set(session.map, false);
    Prop.INDENT.set(session.map, "    ");
    Prop.LINE_NUMBER_COLUMNS.set(session.map, 2);
    final String expected2 = " 1|print: 1\n"
        + " 2|if x > 0:\n"
        + " 3|    return [true, true]\n"
        + " 4|else:\n"
        + " 5|    return [false, false]\n";
    final StringBuilder buf = new StringBuilder();
    final TreePrinter.Status status = session.printer().print(root, buf);
    assertThat(buf.toString(), is(expected2));
    assertThat(status.nodes, is(4));
    assertThat(status.leaves, is(2));
    assertThat(status.lines, is(5));
  }

  /** Tests that a forced decision with an empty slot is printed even if
   * forced decisions are hidden. */
  @Test void testFrozenUnfinished() {
    Prop.SHOW_FROZEN_IF.set(session.map, false);
    final Node node = new FrozenIfNode(x.gt(0), null, false, null);
    assertThat(session.printer().toString(node),
        is("assert not(x > 0)\n  (unfinished)\n"));
  }
}

// End TreePrinterTest.java
