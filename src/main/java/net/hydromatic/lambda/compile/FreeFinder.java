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

import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.lambda.ast.Term;
import net.hydromatic.lambda.ast.TermVisitor;

/** Finds free variables in a term. */
public class FreeFinder implements TermVisitor<Void> {
  private final Deque<String> boundNames = new ArrayDeque<>();
  private final Consumer<String> consumer;

  private FreeFinder(Consumer<String> consumer) {
    this.consumer = consumer;
  }

  /**
   * Finds the free variables in a term, in the order that they first occur.
   */
  public static Set<String> freeVars(Term term) {
    final ImmutableSet.Builder<String> set = ImmutableSet.builder();
    term.accept(new FreeFinder(set::add));
    return set.build();
  }

  /** Returns whether {@code name} occurs free in a term. */
  public static boolean isFree(String name, Term term) {
    return freeVars(term).contains(name);
  }

  /** Finds the names of all binders in a term. */
  public static Set<String> boundVars(Term term) {
    final ImmutableSet.Builder<String> set = ImmutableSet.builder();
    term.accept(
        new TermVisitor<Void>() {
          @Override
          public Void visit(Term.Variable variable) {
            return null;
          }

          @Override
          public Void visit(Term.Abstraction abstraction) {
            set.add(abstraction.name);
            return abstraction.body.accept(this);
          }

          @Override
          public Void visit(Term.Application application) {
            application.fn.accept(this);
            return application.arg.accept(this);
          }
        });
    return set.build();
  }

  @Override
  public Void visit(Term.Variable variable) {
    if (!boundNames.contains(variable.name)) {
      consumer.accept(variable.name);
    }
    return null;
  }

  @Override
  public Void visit(Term.Abstraction abstraction) {
    boundNames.push(abstraction.name);
    try {
      return abstraction.body.accept(this);
    } finally {
      boundNames.pop();
    }
  }

  @Override
  public Void visit(Term.Application application) {
    application.fn.accept(this);
    return application.arg.accept(this);
  }
}

// End FreeFinder.java
