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
package net.hydromatic.dtree.explore;

import net.hydromatic.dtree.util.DtreeException;

/** Thrown by {@link Intervals#parse(String)} when a string is not valid
 * interval notation. */
public class MalformedIntervalException extends IllegalArgumentException
    implements DtreeException {
  public MalformedIntervalException(String message) {
    super(message);
  }

  public MalformedIntervalException(String message, Throwable cause) {
    super(message, cause);
  }
}

// End MalformedIntervalException.java
