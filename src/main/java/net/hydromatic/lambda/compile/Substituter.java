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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.lambda.ast.TermBuilder.lambda;

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import net.hydromatic.lambda.ast.Term;
import net.hydromatic.lambda.ast.TermVisitor;

/**
 * Capture-avoiding substitution.
 *
 * <p>{@code substitute(t, x, r)} replaces each free occurrence of {@code x}
 * in {@code t} with {@code r}. If an abstraction in {@code t} binds a name
 * that is free in {@code r}, and {@code x} occurs free in the abstraction's
 * body, the abstraction is first renamed to a fresh name (see {@link
 * NameGenerator#fresh}), so that no free variable of {@code r} is captured.
 */
public class Substituter implements TermVisitor<Term> {
  private final String name;
  private final Term replacement;
  private final Set<String> replacementFreeVars;

  private Substituter(String name, Term replacement) {
    this.name = requireNonNull(name, "name");
    this.replacement = requireNonNull(replacement, "replacement");
    this.replacementFreeVars = FreeFinder.freeVars(replacement);
  }

  /** Substitutes {@code replacement} for free {@code name} in a term. */
  public static Term substitute(Term target, String name, Term replacement) {
    return target.accept(new Substituter(name, replacement));
  }

  /**
   * Renames the bound variable of an abstraction, rewriting its body. The new
   * name must not occur in the body.
   */
  static Term.Abstraction rename(Term.Abstraction abstraction, String newName) {
    final Term body =
        substitute(abstraction.body, abstraction.name, lambda.var(newName));
    return abstraction.copy(newName, body);
  }

  @Override
  public Term visit(Term.Variable variable) {
    return variable.name.equals(name) ? replacement : variable;
  }

  @Override
  public Term visit(Term.Abstraction abstraction) {
    if (abstraction.name.equals(name)) {
      // The binder shadows the name; nothing to substitute.
      return abstraction;
    }
    if (!FreeFinder.isFree(name, abstraction.body)) {
      return abstraction;
    }
    Term.Abstraction fn = abstraction;
    if (replacementFreeVars.contains(fn.name)) {
      final Set<String> avoid =
          ImmutableSet.<String>builder()
              .addAll(replacementFreeVars)
              .addAll(FreeFinder.freeVars(fn.body))
              .addAll(FreeFinder.boundVars(fn.body))
              .add(name)
              .build();
      fn = rename(fn, NameGenerator.fresh(fn.name, avoid));
    }
    return fn.copy(fn.name, fn.body.accept(this));
  }

  @Override
  public Term visit(Term.Application application) {
    return application.copy(
        application.fn.accept(this), application.arg.accept(this));
  }
}

// End Substituter.java
