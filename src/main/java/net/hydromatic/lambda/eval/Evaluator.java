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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.AbstractIterator;
import java.util.Iterator;
import net.hydromatic.lambda.ast.Term;
import net.hydromatic.lambda.compile.DeBruijn;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluates a term by applying a strategy repeatedly.
 *
 * <p>Evaluation stops when the term is in normal form, or when a step
 * produces a term that is alpha-equivalent to the term before it (for
 * example {@code (λx. x x) (λx. x x)}). That check only catches a term that
 * reproduces itself in one step; a term that grows forever, or that cycles
 * with a longer period, is evaluated forever unless the caller sets a step
 * limit.
 */
public class Evaluator {
  private final Strategy strategy;
  private final Tracer tracer;

  /** Creates an Evaluator. */
  public Evaluator(Strategy strategy, Tracer tracer) {
    this.strategy = requireNonNull(strategy, "strategy");
    this.tracer = requireNonNull(tracer, "tracer");
  }

  /** Creates an Evaluator that does not trace. */
  public Evaluator(Strategy strategy) {
    this(strategy, Tracers.empty());
  }

  /**
   * Returns the sequence of terms {@code t0, t1, ...} where {@code t0} is the
   * given term and each term is one step from the previous. The sequence is
   * computed lazily; it ends at a normal form, or at the term that
   * reproduces itself (the reproduced term is not returned). It may be
   * infinite.
   *
   * <p>The tracer is not called.
   */
  public Iterator<Term> steps(Term term) {
    return new StepIterator(term);
  }

  /** Evaluates a term with no step limit. */
  public EvalResult evaluate(Term term) {
    return evaluate(term, 0);
  }

  /**
   * Evaluates a term.
   *
   * @param term Term
   * @param stepLimit Maximum number of steps; zero or negative means no limit
   */
  public EvalResult evaluate(Term term, int stepLimit) {
    final StepIterator iterator = new StepIterator(term);
    Term current = iterator.next();
    int stepCount = 0;
    while (iterator.hasNext()) {
      if (stepLimit > 0 && stepCount >= stepLimit) {
        tracer.onStepLimit(current, stepLimit);
        return new EvalResult(
            EvalResult.Outcome.STEP_LIMIT, current, stepCount, strategy);
      }
      final Term next = iterator.next();
      tracer.onStep(++stepCount, current, next);
      current = next;
    }
    if (iterator.outcome == EvalResult.Outcome.DIVERGES) {
      tracer.onDiverge(current, strategy);
      return new EvalResult(
          EvalResult.Outcome.DIVERGES, current, stepCount + 1, strategy);
    }
    tracer.onNormalForm(current, stepCount);
    return new EvalResult(
        EvalResult.Outcome.NORMAL_FORM, current, stepCount, strategy);
  }

  /** Iterator over the terms produced by successive steps. */
  private class StepIterator extends AbstractIterator<Term> {
    private @Nullable Term previous;
    private @Nullable Term pending;
    /** Set when the iterator is exhausted. */
    EvalResult.@Nullable Outcome outcome;

    StepIterator(Term term) {
      this.pending = term;
    }

    @Override
    protected @Nullable Term computeNext() {
      if (pending != null) {
        previous = pending;
        pending = null;
        return previous;
      }
      final Term next = strategy.step(requireNonNull(previous));
      if (next == null) {
        outcome = EvalResult.Outcome.NORMAL_FORM;
        return endOfData();
      }
      if (DeBruijn.alphaEquivalent(previous, next)) {
        outcome = EvalResult.Outcome.DIVERGES;
        return endOfData();
      }
      previous = next;
      return next;
    }
  }
}

// End Evaluator.java
