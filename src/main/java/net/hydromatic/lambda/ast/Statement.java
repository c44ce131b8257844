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
package net.hydromatic.lambda.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;

/**
 * Statement: a term to evaluate, or the definition of a name.
 *
 * <p>This class functions as a namespace for {@link Eval} and {@link
 * Assign}.
 */
public abstract class Statement {
  public final Pos pos;

  Statement(Pos pos) {
    this.pos = requireNonNull(pos);
  }

  /** Returns the term in this statement. */
  public abstract Term term();

  /** Creates a statement that evaluates a term. */
  public static Eval eval(Pos pos, Term term) {
    return new Eval(pos, term);
  }

  /** Creates a statement that defines a name. */
  public static Assign assign(Pos pos, String name, Term term) {
    return new Assign(pos, name, term);
  }

  /** Statement that evaluates a term, "{@code term}". */
  public static class Eval extends Statement {
    public final Term term;

    Eval(Pos pos, Term term) {
      super(pos);
      this.term = requireNonNull(term);
    }

    @Override
    public Term term() {
      return term;
    }

    @Override
    public int hashCode() {
      return term.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Eval && term.equals(((Eval) o).term);
    }

    @Override
    public String toString() {
      return term.toString();
    }
  }

  /** Statement that defines a name, "{@code name = term}". */
  public static class Assign extends Statement {
    public final String name;
    public final Term term;

    Assign(Pos pos, String name, Term term) {
      super(pos);
      this.name = requireNonNull(name);
      this.term = requireNonNull(term);
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    public Term term() {
      return term;
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, term);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Assign
              && name.equals(((Assign) o).name)
              && term.equals(((Assign) o).term);
    }

    @Override
    public String toString() {
      return name + " = " + term;
    }
  }
}

// End Statement.java
