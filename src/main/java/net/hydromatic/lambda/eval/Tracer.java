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

import net.hydromatic.lambda.ast.Term;

/** Called on various events during evaluation. */
public interface Tracer {
  /**
   * Called after each reduction step.
   *
   * @param i Ordinal of the step, starting at 1
   * @param from Term before the step
   * @param to Term after the step
   */
  void onStep(int i, Term from, Term to);

  /** Called when evaluation reaches a term that is in normal form. */
  void onNormalForm(Term term, int stepCount);

  /**
   * Called when a step produces a term that is alpha-equivalent to the
   * term before it.
   */
  void onDiverge(Term term, Strategy strategy);

  /** Called when evaluation stops because it has taken too many steps. */
  void onStepLimit(Term term, int stepLimit);
}

// End Tracer.java
