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
package net.hydromatic.lambda.type;

import static java.util.Objects.requireNonNull;

import net.hydromatic.lambda.ast.Op;
import net.hydromatic.lambda.ast.TermWriter;

/** Abstract implementation of Type. */
abstract class BaseType implements Type {
  final Op op;

  protected BaseType(Op op) {
    this.op = requireNonNull(op);
  }

  @Override
  public Op op() {
    return op;
  }

  /** Returns a description of this type, e.g. "{@code A -> B}". */
  @Override
  public String toString() {
    return unparse(new TermWriter(), 0, 0).toString();
  }

  @Override
  public boolean equals(Object o) {
    return this == o
        || o instanceof BaseType
            && op == ((BaseType) o).op
            && toString().equals(o.toString());
  }

  @Override
  public int hashCode() {
    return toString().hashCode();
  }
}

// End BaseType.java
