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
package net.hydromatic.lambda.eval;

import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import net.hydromatic.lambda.ast.Term;
import net.hydromatic.lambda.ast.TermVisitor;
import net.hydromatic.lambda.compile.Substituter;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Reduction strategy.
 *
 * <p>Each strategy performs at most one beta-reduction per call to {@link
 * #step}. A variable or an abstraction is never itself a redex.
 */
public enum Strategy {
  /**
   * Leftmost-outermost reduction, including under abstractions. Reaches the
   * normal form of a term whenever it has one.
   */
  NORMAL_ORDER("normal-order", new NormalOrder()),

  /**
   * Reduces the function position until it is an abstraction, then
   * substitutes the unevaluated argument. Does not reduce arguments or
   * bodies of abstractions.
   */
  CALL_BY_NAME("call-by-name", new CallByName()),

  /**
   * Reduces the function position, then the argument, to a value before
   * substituting. Does not reduce bodies of abstractions.
   */
  CALL_BY_VALUE("call-by-value", new CallByValue());

  /** Identifier, e.g. "call-by-value". */
  public final String id;

  private final TermVisitor<@Nullable Term> stepper;

  private static final ImmutableMap<String, Strategy> BY_ID;

  static {
    final ImmutableMap.Builder<String, Strategy> b = ImmutableMap.builder();
    for (Strategy strategy : values()) {
      b.put(strategy.id, strategy);
    }
    BY_ID = b.build();
  }

  Strategy(String id, TermVisitor<@Nullable Term> stepper) {
    this.id = id;
    this.stepper = stepper;
  }

  /**
   * Looks up a strategy by its identifier (e.g. "call-by-name") or its name
   * (e.g. "CALL_BY_NAME"), ignoring case. Never returns null.
   *
   * @throws IllegalArgumentException if there is no such strategy
   */
  public static Strategy of(String s) {
    final String id = s.toLowerCase(Locale.ROOT).replace('_', '-');
    final Strategy strategy = BY_ID.get(id);
    if (strategy == null) {
      throw new IllegalArgumentException("unknown strategy '" + s
          + "'; expected one of " + BY_ID.keySet());
    }
    return strategy;
  }

  /**
   * Performs one reduction step, or returns null if the term is in normal
   * form with respect to this strategy.
   */
  public @Nullable Term step(Term term) {
    return term.accept(stepper);
  }

  @Override
  public String toString() {
    return id;
  }

  /** Beta-reduction: {@code (λx. b) a} becomes {@code b[x := a]}. */
  static Term beta(Term.Abstraction fn, Term arg) {
    return Substituter.substitute(fn.body, fn.name, arg);
  }

  /** Steps shared by the strategies that do not reduce under binders. */
  private abstract static class WeakStepper
      implements TermVisitor<@Nullable Term> {
    @Override
    public @Nullable Term visit(Term.Variable variable) {
      return null;
    }

    @Override
    public @Nullable Term visit(Term.Abstraction abstraction) {
      return null;
    }
  }

  /** Stepper for {@link #CALL_BY_VALUE}. */
  private static class CallByValue extends WeakStepper {
    @Override
    public @Nullable Term visit(Term.Application application) {
      if (application.fn instanceof Term.Abstraction) {
        final Term arg = application.arg.accept(this);
        if (arg != null) {
          return application.copy(application.fn, arg);
        }
        return beta((Term.Abstraction) application.fn, application.arg);
      }
      final Term fn = application.fn.accept(this);
      if (fn != null) {
        return application.copy(fn, application.arg);
      }
      // The function is stuck (say, a free variable); evaluate the argument.
      final Term arg = application.arg.accept(this);
      return arg == null ? null : application.copy(application.fn, arg);
    }
  }

  /** Stepper for {@link #CALL_BY_NAME}. */
  private static class CallByName extends WeakStepper {
    @Override
    public @Nullable Term visit(Term.Application application) {
      if (application.fn instanceof Term.Abstraction) {
        return beta((Term.Abstraction) application.fn, application.arg);
      }
      final Term fn = application.fn.accept(this);
      return fn == null ? null : application.copy(fn, application.arg);
    }
  }

  /** Stepper for {@link #NORMAL_ORDER}. */
  private static class NormalOrder implements TermVisitor<@Nullable Term> {
    @Override
    public @Nullable Term visit(Term.Variable variable) {
      return null;
    }

    @Override
    public @Nullable Term visit(Term.Abstraction abstraction) {
      final Term body = abstraction.body.accept(this);
      return body == null ? null : abstraction.copy(abstraction.name, body);
    }

    @Override
    public @Nullable Term visit(Term.Application application) {
      if (application.fn instanceof Term.Abstraction) {
        return beta((Term.Abstraction) application.fn, application.arg);
      }
      final Term fn = application.fn.accept(this);
      if (fn != null) {
        return application.copy(fn, application.arg);
      }
      final Term arg = application.arg.accept(this);
      return arg == null ? null : application.copy(application.fn, arg);
    }
  }
}

// End Strategy.java
