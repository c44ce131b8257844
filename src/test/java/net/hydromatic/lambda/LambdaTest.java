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
package net.hydromatic.lambda;

import static net.hydromatic.lambda.Lc.lc;
import static net.hydromatic.lambda.Matchers.diverges;
import static net.hydromatic.lambda.Matchers.hasOutcome;
import static net.hydromatic.lambda.Matchers.isNormalForm;
import static net.hydromatic.lambda.Matchers.throwsA;
import static org.hamcrest.CoreMatchers.is;

import net.hydromatic.lambda.eval.EvalResult;
import net.hydromatic.lambda.eval.Prop;
import net.hydromatic.lambda.eval.Strategy;
import net.hydromatic.lambda.parse.LambdaParseException;
import org.junit.jupiter.api.Test;

/** Kick the tires. */
public class LambdaTest {
  static final String OMEGA = "(λx. x x) (λx. x x)";

  @Test
  void testParse() {
    lc("x").assertParseSame();
    lc("λx. x").assertParseSame();
    lc("\\x. x").assertParse("λx. x");
    lc("\\x y. x").assertParse("λx. λy. x");
    lc("f a b").assertParseSame();
    lc("(f a) b").assertParse("f a b");
    lc("f (a b)").assertParseSame();
    lc("(λx. x) y").assertParseSame();
    lc("λx. x y").assertParseSame();
    lc("(λx. x y)").assertParse("λx. x y");
    lc("(λx. x) λy. y").assertParse("(λx. x) (λy. y)");
    lc("f λy. y z").assertParse("f (λy. y z)");
    lc("x;").assertParse("x");
    lc("x1' _y").assertParseSame();
    lc("# a comment\nx").assertParse("x");

    // type annotations
    lc("λx:A. x").assertParseSame();
    lc("λx:A -> B. x").assertParseSame();
    lc("λf:(A -> B) -> C. f").assertParseSame();
    lc("λf:A -> (B -> C). f").assertParse("λf:A -> B -> C. f");
    lc("\\(x:A -> B) y. x y").assertParse("λx:A -> B. λy. x y");
    lc("\\x:A y:B. x").assertParse("λx:A. λy:B. x");
  }

  @Test
  void testParseError() {
    lc("λx x")
        .assertParseThrows(
            throwsA(LambdaParseException.class,
                is("Encountered end of input. Was expecting: name")));
    lc("f )")
        .assertParseThrows(
            throwsA(LambdaParseException.class,
                is("Encountered \")\". Was expecting: end of input")));
    lc("λx:. x")
        .assertParseThrows(
            throwsA(LambdaParseException.class,
                is("Encountered \".\". Was expecting: type")));
    lc("x $").assertParseThrows(throwsA("Lexical error: unexpected '$'"));
    lc("").assertParseThrows(throwsA("Was expecting: term"));
  }

  @Test
  void testAlphaEquivalence() {
    lc("λx. x").assertAlphaEquivalent("λy. y", true);
    lc("λx. λy. x").assertAlphaEquivalent("λy. λx. y", true);
    lc("λx. λy. x").assertAlphaEquivalent("λx. λy. y", false);
    lc("λx. y").assertAlphaEquivalent("λx. z", false);
    lc("λx. y").assertAlphaEquivalent("λz. y", true);
    lc("λx:A. x").assertAlphaEquivalent("λy:A. y", true);
    lc("λx:A. x").assertAlphaEquivalent("λx:B. x", false);
    lc("(λx. x) y").assertAlphaEquivalent("y", false);
  }

  @Test
  void testDeBruijn() {
    lc("λx. λy. x y").assertDeBruijn("λ. λ. 1 0");
    lc("λx. y x").assertDeBruijn("λ. y 0");
    lc("λx:A. x").assertDeBruijn("λ:A. 0");
    lc("(λx. x) (λy. y)").assertDeBruijn("(λ. 0) (λ. 0)");
    lc("λx. λx. x").assertDeBruijn("λ. λ. 0");
  }

  @Test
  void testEval() {
    lc("(λx. x) y")
        .assertEval(hasOutcome(EvalResult.Outcome.NORMAL_FORM, "y", 1));
    lc("x").assertEval(hasOutcome(EvalResult.Outcome.NORMAL_FORM, "x", 0));
    lc("(λx. λy. x) a b")
        .assertSteps("(λx. λy. x) a b", "(λy. a) b", "a");

    // The bound "y" is renamed so that it does not capture the free "y".
    lc("(λx. λy. x) y").assertEval(isNormalForm("λy1. y"));
    lc("(λx. λy. x y1) y")
        .withProp(Prop.STRATEGY, Strategy.NORMAL_ORDER)
        .assertEval(isNormalForm("λy2. y y1"));
  }

  /** Omega reproduces itself in one step, under every strategy. */
  @Test
  void testOmegaDiverges() {
    for (Strategy strategy : Strategy.values()) {
      lc(OMEGA)
          .withProp(Prop.STRATEGY, strategy)
          .assertEval(hasOutcome(EvalResult.Outcome.DIVERGES, OMEGA, 1));
    }
  }

  /**
   * Call-by-name (and normal order) discard an argument that is not used;
   * call-by-value evaluates it first, and so diverges.
   */
  @Test
  void testStrategiesDiffer() {
    final String term = "(λx. y) (" + OMEGA + ")";
    lc(term)
        .withProp(Prop.STRATEGY, Strategy.CALL_BY_VALUE)
        .assertEval(diverges());
    lc(term)
        .withProp(Prop.STRATEGY, Strategy.CALL_BY_NAME)
        .assertEval(hasOutcome(EvalResult.Outcome.NORMAL_FORM, "y", 1));
    lc(term)
        .withProp(Prop.STRATEGY, Strategy.NORMAL_ORDER)
        .assertEval(hasOutcome(EvalResult.Outcome.NORMAL_FORM, "y", 1));

    // Only normal order reduces under a binder.
    lc("λx. (λy. y) x")
        .withProp(Prop.STRATEGY, Strategy.CALL_BY_NAME)
        .assertEval(isNormalForm("λx. (λy. y) x"));
    lc("λx. (λy. y) x")
        .withProp(Prop.STRATEGY, Strategy.NORMAL_ORDER)
        .assertEval(isNormalForm("λx. x"));
  }

  @Test
  void testChurch() {
    final Lc and =
        lc("and true false")
            .withDefinition("true", "λx y. x")
            .withDefinition("false", "λx y. y")
            .withDefinition("and", "λp q. p q p");
    for (Strategy strategy : Strategy.values()) {
      and.withProp(Prop.STRATEGY, strategy)
          .assertEval(isNormalForm("λx. λy. y"));
    }

    final Lc succ =
        lc("succ zero")
            .withDefinition("zero", "λf x. x")
            .withDefinition("succ", "λn f x. f (n f x)");
    succ.withProp(Prop.STRATEGY, Strategy.NORMAL_ORDER)
        .assertEval(
            hasOutcome(EvalResult.Outcome.NORMAL_FORM, "λf. λx. f x", 3));
    succ.assertEval(
        hasOutcome(EvalResult.Outcome.NORMAL_FORM,
            "λf. λx. f ((λf. λx. x) f x)", 1));
  }

  @Test
  void testStepLimit() {
    final String w = "(λx. x x x)";
    lc(w + " " + w)
        .withProp(Prop.STEP_LIMIT, 2)
        .assertEval(
            hasOutcome(EvalResult.Outcome.STEP_LIMIT,
                w + " " + w + " " + w + " " + w, 2));
  }

  @Test
  void testType() {
    lc("λx:A. x").assertType("A -> A");
    lc("λx. x").assertType("'a -> 'a");
    lc("λx. λy. x").assertType("'a -> 'b -> 'a");
    lc("λx:A. λf. f x").assertType("A -> (A -> 'a) -> 'a");
    lc("λf:A -> B. λx:A. f x").assertType("(A -> B) -> A -> B");
    lc("λx. x x").assertType("type error: argument type mismatch");
    lc("y").assertType("type error: unbound variable y");
    lc("(λx:A. x) y").assertType("type error: unbound variable y");
    lc("λx:A. λy:B. x y")
        .assertType("type error: application of non-function");
    lc("λf:A -> B. λx:B. f x")
        .assertType("type error: argument type mismatch");
    lc("id").withDefinition("id", "λx:A. x").assertType("A -> A");
  }
}

// End LambdaTest.java
