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

import net.hydromatic.lambda.ast.Term;

/** Result of evaluating a term. */
public class EvalResult {
  public final Outcome outcome;
  /**
   * The final term: the normal form, the term that reproduced itself, or the
   * term reached when the step limit ran out.
   */
  public final Term term;
  /**
   * Number of steps taken. If the outcome is {@link Outcome#DIVERGES},
   * includes the step that reproduced the term.
   */
  public final int stepCount;
  public final Strategy strategy;

  EvalResult(Outcome outcome, Term term, int stepCount, Strategy strategy) {
    this.outcome = requireNonNull(outcome);
    this.term = requireNonNull(term);
    this.stepCount = stepCount;
    this.strategy = requireNonNull(strategy);
  }

  @Override
  public String toString() {
    return outcome + " " + term + " after " + stepCount + " step(s) using "
        + strategy;
  }

  /** How evaluation ended. */
  public enum Outcome {
    /** The term has no redex under the strategy. */
    NORMAL_FORM,
    /** A step produced a term alpha-equivalent to the previous term. */
    DIVERGES,
    /** Evaluation stopped after the caller's maximum number of steps. */
    STEP_LIMIT
  }
}

// End EvalResult.java
