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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Iterator;

/** Target function that yields values as it goes, and finally returns a
 * result.
 *
 * <p>Each yielded value becomes an {@link net.hydromatic.dtree.tree.InfoNode}
 * in the tree; the result becomes the value of the
 * {@link net.hydromatic.dtree.tree.ReturnNode}.
 *
 * @param <Y> Type of yielded values
 *
 * @see AbstractCoroutine
 * @see RepeatedRunTreeGen#runCoroutine */
public interface Coroutine<Y> extends Iterator<Y> {
  /** Returns the result. Valid only after {@link #hasNext()} has returned
   * false. */
  @Nullable Object result();
}

// End Coroutine.java
