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

/** Function whose execution paths are to be enumerated.
 *
 * <p>The function must be deterministic: given the same outcomes of the
 * conditions it tests via {@link Session#test(net.hydromatic.dtree.expr.Expr)},
 * it must test the same conditions in the same order and return the same
 * value. It is called once per path. */
@FunctionalInterface
public interface Target {
  @Nullable Object apply(Session session);
}

// End Target.java
