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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;
import net.hydromatic.lambda.ast.Op;
import net.hydromatic.lambda.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Nameless representation of a term.
 *
 * <p>Each bound variable is replaced by its De Bruijn index, the number of
 * abstractions between the variable and its binder. Free variables keep their
 * names. Two terms are alpha-equivalent if and only if their De Bruijn terms
 * are equal.
 *
 * @see DeBruijn
 */
public abstract class DeBruijnTerm {
  public final Op op;

  DeBruijnTerm(Op op) {
    this.op = requireNonNull(op);
  }

  @Override
  public String toString() {
    return describe(new StringBuilder(), 0, 0).toString();
  }

  abstract StringBuilder describe(StringBuilder buf, int left, int right);

  /** Bound variable, identified by its distance to its binder. */
  public static class Index extends DeBruijnTerm {
    public final int index;

    Index(int index) {
      super(Op.ID);
      checkArgument(index >= 0);
      this.index = index;
    }

    @Override
    public int hashCode() {
      return index;
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Index && index == ((Index) o).index;
    }

    @Override
    StringBuilder describe(StringBuilder buf, int left, int right) {
      return buf.append(index);
    }
  }

  /** Free variable. */
  public static class Free extends DeBruijnTerm {
    public final String name;

    Free(String name) {
      super(Op.ID);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode() + 17;
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Free && name.equals(((Free) o).name);
    }

    @Override
    StringBuilder describe(StringBuilder buf, int left, int right) {
      return buf.append(name);
    }
  }

  /** Abstraction; it has a body and an optional type, but no name. */
  public static class Fn extends DeBruijnTerm {
    public final @Nullable Type type;
    public final DeBruijnTerm body;

    Fn(@Nullable Type type, DeBruijnTerm body) {
      super(Op.FN);
      this.type = type;
      this.body = requireNonNull(body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(type, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Fn
              && Objects.equals(type, ((Fn) o).type)
              && body.equals(((Fn) o).body);
    }

    @Override
    StringBuilder describe(StringBuilder buf, int left, int right) {
      if (left > op.left || op.right < right) {
        return describe(buf.append("("), 0, 0).append(")");
      }
      buf.append("λ");
      if (type != null) {
        buf.append(":").append(type);
      }
      return body.describe(buf.append(op.padded), op.right, right);
    }
  }

  /** Application. */
  public static class Apply extends DeBruijnTerm {
    public final DeBruijnTerm fn;
    public final DeBruijnTerm arg;

    Apply(DeBruijnTerm fn, DeBruijnTerm arg) {
      super(Op.APPLY);
      this.fn = requireNonNull(fn);
      this.arg = requireNonNull(arg);
    }

    @Override
    public int hashCode() {
      return Objects.hash(fn, arg);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Apply
              && fn.equals(((Apply) o).fn)
              && arg.equals(((Apply) o).arg);
    }

    @Override
    StringBuilder describe(StringBuilder buf, int left, int right) {
      if (left > op.left || op.right < right) {
        return describe(buf.append("("), 0, 0).append(")");
      }
      fn.describe(buf, left, op.left);
      buf.append(op.padded);
      return arg.describe(buf, op.right, right);
    }
  }
}

// End DeBruijnTerm.java
