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

import net.hydromatic.dtree.eval.Prop;

import com.google.common.base.Strings;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

/** Writes a decision tree as indented text.
 *
 * <p>For example,
 *
 * <blockquote><pre>
 * if a0 &gt; a1:
 *   return [a1, a0]
 * else:
 *   return [a0, a1]
 * </pre></blockquote>
 *
 * <p>Forced decisions print as "assert e" or "assert not(e)" at the same
 * indentation as the code that follows them; empty slots print as
 * "(unfinished)". Options come from {@link Prop#INDENT},
 * {@link Prop#SHOW_FROZEN_IF}, {@link Prop#SIMPLIFY} and
 * {@link Prop#LINE_NUMBER_COLUMNS}. */
public class TreePrinter {
  static final String UNFINISHED = "(unfinished)";

  private final String indent;
  private final boolean showFrozenIf;
  private final boolean simplify;
  private final int lineNumberColumns;

  /** Creates a TreePrinter with options from a property map. */
  public TreePrinter(Map<Prop, Object> map) {
    this.indent = Prop.INDENT.stringValue(map);
    this.showFrozenIf = Prop.SHOW_FROZEN_IF.booleanValue(map);
    this.simplify = Prop.SIMPLIFY.booleanValue(map);
    this.lineNumberColumns = Prop.LINE_NUMBER_COLUMNS.intValue(map);
  }

  /** Writes a tree to a string. */
  public String toString(@Nullable Node root) {
    final StringBuilder buf = new StringBuilder();
    print(root, buf);
    return buf.toString();
  }

  /** Writes a tree to a buffer and returns statistics. */
  public Status print(@Nullable Node root, StringBuilder buf) {
    final Writer writer = new Writer(buf);
    writer.slot(root);
    return writer.status;
  }

  /** Counts of what was printed. */
  public static class Status {
    /** Number of nodes printed. */
    public int nodes;
    /** Number of leaves printed. */
    public int leaves;
    /** Number of lines printed. */
    public int lines;

    @Override public String toString() {
      return "nodes: " + nodes + ", leaves: " + leaves + ", lines: " + lines;
    }
  }

  /** Visitor that writes each node and recurses into its slots. */
  private class Writer implements NodeVisitor<Void> {
    final StringBuilder buf;
    final Status status = new Status();
    int depth;

    Writer(StringBuilder buf) {
      this.buf = buf;
    }

    void line(String s) {
      ++status.lines;
      if (lineNumberColumns > 0) {
        buf.append(
            Strings.padStart(Integer.toString(status.lines),
                lineNumberColumns, ' '))
            .append('|');
      }
      buf.append(Strings.repeat(indent, depth)).append(s).append('\n');
    }

    void slot(@Nullable Node node) {
      if (node == null) {
        line(UNFINISHED);
      } else {
        node.accept(this);
      }
    }

    void nested(@Nullable Node node) {
      ++depth;
      slot(node);
      --depth;
    }

    @Override public Void visit(ReturnNode node) {
      line(node.label(simplify));
      ++status.nodes;
      ++status.leaves;
      return null;
    }

    @Override public Void visit(IfNode node) {
      line(node.label(simplify) + ":");
      ++status.nodes;
      nested(node.kid(1));
      line("else:");
      nested(node.kid(0));
      return null;
    }

    @Override public Void visit(FrozenIfNode node) {
      final @Nullable Node kid = node.kid(0);
      if (showFrozenIf || kid == null) {
        line(node.label(simplify));
        ++status.nodes;
      }
      if (kid == null) {
        nested(null);
      } else {
        kid.accept(this);
      }
      return null;
    }

    @Override public Void visit(InfoNode node) {
      line(node.label(simplify));
      ++status.nodes;
      slot(node.kid(0));
      return null;
    }
  }
}

// End TreePrinter.java
