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
package net.hydromatic.dtree.expr;

import java.math.BigInteger;
import java.util.Comparator;

/**
 * Total order on variable names.
 *
 * <p>Names are split into runs of decimal digits and runs of other
 * characters. Runs are compared pairwise: two digit runs by numeric value,
 * any other pair by {@link String#compareTo}. So "x2" sorts before "x10",
 * and "a9b" before "a10a". If all runs compare equal (for example "x01" and
 * "x1"), the names are compared by {@link String#compareTo}, which makes the
 * order total and consistent with {@link String#equals}.
 *
 * <p>Canonical linear forms depend on this order, so it must not change.
 * It is immutable, thread-safe, and has the same behavior in all locales.
 */
public enum VarOrder implements Comparator<String> {
  INSTANCE;

  @Override public int compare(String o1, String o2) {
    int i1 = 0;
    int i2 = 0;
    while (i1 < o1.length() && i2 < o2.length()) {
      final int end1 = runEnd(o1, i1);
      final int end2 = runEnd(o2, i2);
      final String run1 = o1.substring(i1, end1);
      final String run2 = o2.substring(i2, end2);
      final int c;
      if (isDigit(o1.charAt(i1)) && isDigit(o2.charAt(i2))) {
        c = new BigInteger(run1).compareTo(new BigInteger(run2));
      } else {
        c = run1.compareTo(run2);
      }
      if (c != 0) {
        return c;
      }
      i1 = end1;
      i2 = end2;
    }
    if (i1 < o1.length()) {
      return 1;
    }
    if (i2 < o2.length()) {
      return -1;
    }
    return o1.compareTo(o2);
  }

  /** Returns the end of the run that starts at position {@code i}. */
  private static int runEnd(String s, int i) {
    final boolean digit = isDigit(s.charAt(i));
    int j = i + 1;
    while (j < s.length() && isDigit(s.charAt(j)) == digit) {
      ++j;
    }
    return j;
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}

// End VarOrder.java
