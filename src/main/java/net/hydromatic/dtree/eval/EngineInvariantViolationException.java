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

import net.hydromatic.dtree.util.DtreeException;

/** Thrown when the replay protocol of {@link RepeatedRunTreeGen} is broken.
 *
 * <p>Causes include: replay reaching a node that has no unexplored slot;
 * a target function that asks for a different sequence of decisions than it
 * did in an earlier run (it is not deterministic); an explorer that
 * contradicts a commitment it made at the same frontier position.
 *
 * <p>After this exception the generator's tree is inconsistent and the
 * generator must be discarded. */
public class EngineInvariantViolationException extends IllegalStateException
    implements DtreeException {
  public EngineInvariantViolationException(String message) {
    super(message);
  }
}

// End EngineInvariantViolationException.java
