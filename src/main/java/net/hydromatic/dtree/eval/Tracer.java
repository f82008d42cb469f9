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

/** Called on various events while a {@link RepeatedRunTreeGen} builds a
 * tree.
 *
 * @see Tracers */
public interface Tracer {
  /** Called when a decision node is added at the frontier. */
  void onDecision(DecisionNode node);

  /** Called when a run ends and its leaf has been attached. */
  void onLeaf(ReturnNode leaf);

  /** Called after each successful run with the number of runs so far. */
  void onRunEnd(int runs);
}

// End Tracer.java
