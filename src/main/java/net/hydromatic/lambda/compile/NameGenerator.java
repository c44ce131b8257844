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
package net.hydromatic.lambda.compile;

import java.util.Set;

/**
 * Generates fresh names for bound variables.
 *
 * <p>Generation is deterministic: the result depends only on the arguments,
 * not on names generated previously.
 */
public class NameGenerator {
  private NameGenerator() {}

  /**
   * Generates a name based on {@code base} that is not in {@code avoid}.
   *
   * <p>Trailing digits are removed from the base name, then the smallest
   * positive suffix is appended that gives a name not in {@code avoid}. For
   * example, if "x1" is to be avoided, {@code fresh("x", avoid)} returns
   * "x2", and so does {@code fresh("x1", avoid)}.
   */
  public static String fresh(String base, Set<String> avoid) {
    final String stem = stem(base);
    for (int i = 1; ; i++) {
      final String name = stem + i;
      if (!avoid.contains(name)) {
        return name;
      }
    }
  }

  /** Removes trailing digits from a name, unless the name is all digits. */
  static String stem(String name) {
    int end = name.length();
    while (end > 0 && Character.isDigit(name.charAt(end - 1))) {
      --end;
    }
    return end == 0 ? name + "_" : name.substring(0, end);
  }
}

// End NameGenerator.java
