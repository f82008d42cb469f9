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

import com.google.common.collect.AbstractIterator;
import org.checkerframework.checker.nullness.qual.Nullable;

import static com.google.common.base.Preconditions.checkState;

/** Skeletal implementation of {@link Coroutine}.
 *
 * <p>A subclass implements {@link #computeNext()} as a state machine. Each
 * call returns the next value to yield, or, when the function is done,
 * returns {@link #finish(Object) finish(result)}.
 *
 * @param <Y> Type of yielded values */
public abstract class AbstractCoroutine<Y> extends AbstractIterator<Y>
    implements Coroutine<Y> {
  private boolean finished;
  private @Nullable Object result;

  /** Records the result and signals that there are no more values. Call
   * from {@link #computeNext()}, and return its value. */
  protected final @Nullable Y finish(@Nullable Object result) {
    this.result = result;
    this.finished = true;
    return endOfData();
  }

  @Override public @Nullable Object result() {
    checkState(finished, "coroutine has not finished");
    return result;
  }
}

// End AbstractCoroutine.java
