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

import static java.util.Objects.requireNonNull;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Function;
import net.hydromatic.lambda.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Context for writing a term or a type out as a string.
 *
 * <p>If the writer has an alias function, every sub-term (including the
 * top-level term) for which the function returns a name is written as that
 * name; except a sub-term that refers to a variable bound by an enclosing
 * abstraction, because the alias would not mean the same thing there.
 */
public class TermWriter {
  private final StringBuilder b = new StringBuilder();
  private final Function<Term, @Nullable String> aliasFn;
  /** Names bound by the abstractions enclosing the current sub-term. */
  private final Deque<String> binders = new ArrayDeque<>();

  /** Creates a writer that does not use aliases. */
  public TermWriter() {
    this(term -> null);
  }

  /** Creates a writer with a given alias function. */
  public TermWriter(Function<Term, @Nullable String> aliasFn) {
    this.aliasFn = requireNonNull(aliasFn);
  }

  /** Appends a string to the output. */
  public TermWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a term, or its alias. */
  public TermWriter append(Term term, int left, int right) {
    final String alias = aliasFn.apply(term);
    if (alias != null && !refersToBinder(term)) {
      return append(alias);
    }
    return term.unparse(this, left, right);
  }

  /** Appends the body of an abstraction that binds {@code name}. */
  TermWriter appendBody(String name, Term body, int left, int right) {
    binders.push(name);
    try {
      return append(body, left, right);
    } finally {
      binders.pop();
    }
  }

  /**
   * Returns whether a term has a free occurrence of a name bound by an
   * enclosing abstraction.
   */
  private boolean refersToBinder(Term term) {
    if (binders.isEmpty()) {
      return false;
    }
    final Deque<String> bound = new ArrayDeque<>();
    return term.accept(
        new TermVisitor<Boolean>() {
          @Override
          public Boolean visit(Term.Variable variable) {
            return !bound.contains(variable.name)
                && binders.contains(variable.name);
          }

          @Override
          public Boolean visit(Term.Abstraction abstraction) {
            bound.push(abstraction.name);
            try {
              return abstraction.body.accept(this);
            } finally {
              bound.pop();
            }
          }

          @Override
          public Boolean visit(Term.Application application) {
            return application.fn.accept(this)
                || application.arg.accept(this);
          }
        });
  }

  /** Appends a type. */
  public TermWriter append(Type type, int left, int right) {
    return type.unparse(this, left, right);
  }

  /** Appends a call to an infix operator, such as application. */
  public TermWriter infix(int left, Term a0, Op op, Term a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    append(a0, left, op.left);
    append(op.padded);
    append(a1, op.right, right);
    return this;
  }

  /** Appends a call to an infix type operator, such as "{@code ->}". */
  public TermWriter infix(int left, Type a0, Op op, Type a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    append(a0, left, op.left);
    append(op.padded);
    append(a1, op.right, right);
    return this;
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End TermWriter.java
