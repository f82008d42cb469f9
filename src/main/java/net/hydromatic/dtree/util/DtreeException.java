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
package net.hydromatic.dtree.util;

/** Exception thrown by the decision-tree engine.
 *
 * <p>Implementations extend a standard unchecked exception
 * ({@link UnsupportedOperationException}, {@link IllegalStateException},
 * {@link IllegalArgumentException}) and implement this interface so that
 * callers can catch them as a family.
 *
 * <p>All of these errors denote misuse or a broken invariant. The protocol
 * is deterministic, so a run that failed would fail the same way again;
 * nothing retries. */
public interface DtreeException {
  /** Returns the message. */
  String getMessage();

  /** Appends a description of this exception to a buffer. */
  default StringBuilder describeTo(StringBuilder buf) {
    return buf.append(getClass().getSimpleName())
        .append(": ")
        .append(getMessage());
  }
}

// End DtreeException.java
