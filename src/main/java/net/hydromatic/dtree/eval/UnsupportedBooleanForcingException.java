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

/** Thrown when a symbolic condition is forced to a boolean but no engine is
 * active.
 *
 * <p>Only a {@link RepeatedRunTreeGen} that is executing a run can decide the
 * truth value of a symbolic condition.
 *
 * @see Session#test(net.hydromatic.dtree.expr.Expr) */
public class UnsupportedBooleanForcingException
    extends UnsupportedOperationException implements DtreeException {
  public UnsupportedBooleanForcingException(String message) {
    super(message);
  }
}

// End UnsupportedBooleanForcingException.java
