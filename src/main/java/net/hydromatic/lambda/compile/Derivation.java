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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import net.hydromatic.lambda.ast.Term;
import net.hydromatic.lambda.ast.TermWriter;
import net.hydromatic.lambda.type.Type;

/**
 * Typing derivation.
 *
 * <p>Each node records a judgment "{@code context ⊢ term : type}", the rule
 * that was used to reach it, and the derivations of the rule's premises.
 * The tree has the same shape as the recursion of {@link TypeChecker}: one
 * node per sub-term that was checked.
 *
 * <p>If the type is an error, the premises are those that were checked
 * before the error was detected; the last premise, if any, may itself have
 * an error type.
 */
public class Derivation {
  /** Context; the most recently bound variable is last. */
  public final ImmutableMap<String, Type> context;
  public final Term term;
  public final Type type;
  public final Rule rule;
  public final ImmutableList<Derivation> premises;

  Derivation(
      Map<String, Type> context,
      Term term,
      Type type,
      Rule rule,
      List<Derivation> premises) {
    this.context = ImmutableMap.copyOf(context);
    this.term = requireNonNull(term);
    this.type = requireNonNull(type);
    this.rule = requireNonNull(rule);
    this.premises = ImmutableList.copyOf(premises);
  }

  /**
   * Returns a copy of this derivation with a transform applied to every
   * type. The transform is applied to this node's type first, then to the
   * types in its context, then to its premises from left to right.
   */
  public Derivation copy(UnaryOperator<Type> transform) {
    final Type type2 = transform.apply(type);
    final ImmutableMap.Builder<String, Type> context2 = ImmutableMap.builder();
    context.forEach((name, t) -> context2.put(name, transform.apply(t)));
    final ImmutableList.Builder<Derivation> premises2 = ImmutableList.builder();
    premises.forEach(p -> premises2.add(p.copy(transform)));
    return new Derivation(
        context2.build(), term, type2, rule, premises2.build());
  }

  /** Returns the judgment, e.g. "{@code x : A ⊢ x : A}". */
  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    context.forEach(
        (name, t) ->
            buf.append(buf.length() == 0 ? "" : ", ")
                .append(name)
                .append(" : ")
                .append(t));
    if (buf.length() > 0) {
      buf.append(' ');
    }
    return buf.append("⊢ ")
        .append(term.unparse(new TermWriter()))
        .append(" : ")
        .append(type)
        .toString();
  }

  /** Typing rule. */
  public enum Rule {
    /** Variable: {@code x : A ∈ Γ} implies {@code Γ ⊢ x : A}. */
    VAR,
    /**
     * Abstraction: {@code Γ, x : A ⊢ t : B} implies
     * {@code Γ ⊢ λx:A. t : A -> B}.
     */
    ABS,
    /**
     * Application: {@code Γ ⊢ f : A -> B} and {@code Γ ⊢ a : A} imply
     * {@code Γ ⊢ f a : B}.
     */
    APP
  }
}

// End Derivation.java
