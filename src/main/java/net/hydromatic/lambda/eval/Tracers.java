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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.lambda.ast.Term;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on the result of each
   * step, then calls the underlying tracer.
   */
  public static Tracer withOnStep(Tracer tracer, Consumer<Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onStep(int i, Term from, Term to) {
        consumer.accept(to);
        super.onStep(i, from, to);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on a normal form, then
   * calls the underlying tracer.
   */
  public static Tracer withOnNormalForm(
      Tracer tracer, Consumer<Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onNormalForm(Term term, int stepCount) {
        consumer.accept(term);
        super.onNormalForm(term, stepCount);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action when evaluation
   * diverges, then calls the underlying tracer.
   */
  public static Tracer withOnDiverge(
      Tracer tracer, BiConsumer<Term, Strategy> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onDiverge(Term term, Strategy strategy) {
        consumer.accept(term, strategy);
        super.onDiverge(term, strategy);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action when the step limit is
   * reached, then calls the underlying tracer.
   */
  public static Tracer withOnStepLimit(
      Tracer tracer, BiConsumer<Term, Integer> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onStepLimit(Term term, int stepLimit) {
        consumer.accept(term, stepLimit);
        super.onStepLimit(term, stepLimit);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onStep(int i, Term from, Term to) {}

    @Override
    public void onNormalForm(Term term, int stepCount) {}

    @Override
    public void onDiverge(Term term, Strategy strategy) {}

    @Override
    public void onStepLimit(Term term, int stepLimit) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onStep(int i, Term from, Term to) {
      tracer.onStep(i, from, to);
    }

    @Override
    public void onNormalForm(Term term, int stepCount) {
      tracer.onNormalForm(term, stepCount);
    }

    @Override
    public void onDiverge(Term term, Strategy strategy) {
      tracer.onDiverge(term, strategy);
    }

    @Override
    public void onStepLimit(Term term, int stepLimit) {
      tracer.onStepLimit(term, stepLimit);
    }
  }
}

// End Tracers.java
