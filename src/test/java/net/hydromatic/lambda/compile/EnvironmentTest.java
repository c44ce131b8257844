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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import net.hydromatic.lambda.ast.Term;
import net.hydromatic.lambda.parse.LambdaParser;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Matcher;
import org.junit.jupiter.api.Test;

/** Tests for {@link net.hydromatic.lambda.compile.Environment}. */
public class EnvironmentTest {
  private static Term parse(String s) {
    return LambdaParser.parseTerm(s);
  }

  private static Environment env(String... namesAndTerms) {
    final Environment env = new Environment();
    for (int i = 0; i < namesAndTerms.length; i += 2) {
      env.bind(namesAndTerms[i], parse(namesAndTerms[i + 1]));
    }
    return env;
  }

  @Test
  void testBind() {
    final Environment env = env("id", "λx. x", "k", "λx y. x");
    assertThat(env.size(), is(2));
    assertThat(env.getOpt("id"), is(parse("λx. x")));
    assertThat(env.lookup("k"), is(Optional.of(parse("λx. λy. x"))));
    assertThat(env.getOpt("z"), nullValue());
    assertThat(env.lookup("z"), is(Optional.empty()));
    assertThat(env, hasNames("id", "k"));

    // Binding the same term twice is idempotent.
    env.bind("id", parse("λx. x"));
    assertThat(env.size(), is(2));
    assertThat(env, hasNames("id", "k"));

    // Re-binding a name replaces its term, but keeps its position.
    env.bind("id", parse("λy. y"));
    assertThat(env, hasNames("id", "k"));
    assertThat(env.getOpt("id"), is(parse("λy. y")));

    env.bind("a", parse("a"));
    assertThat(env, hasNames("id", "k", "a"));
  }

  @Test
  void testUnbind() {
    final Environment env = env("id", "λx. x", "k", "λx y. x");
    env.unbind("id");
    assertThat(env, hasNames("k"));
    assertThat(env.containsExpr(parse("λz. z")), is(false));

    // Unbinding a name that is not bound does nothing.
    env.unbind("nosuch");
    assertThat(env, hasNames("k"));

    env.clear();
    assertThat(env.size(), is(0));
    assertThat(env.nameOf(parse("λx y. x")), nullValue());
  }

  /** Aliases are found up to alpha-equivalence, but not up to reduction. */
  @Test
  void testAliases() {
    final Environment env =
        env("id", "λx. x", "false", "λx y. y", "zero", "λf x. x");
    assertThat(env.containsExpr(parse("λz. z")), is(true));
    assertThat(env.containsExpr(parse("(λx. x) (λx. x)")), is(false));
    assertThat(env.nameOf(parse("λz. z")), is("id"));
    assertThat(env.nameOf(parse("y")), nullValue());

    // If two definitions are equivalent, the earliest is the alias.
    assertThat(env.nameOf(parse("λa b. b")), is("false"));
    env.unbind("false");
    assertThat(env.nameOf(parse("λa b. b")), is("zero"));
  }

  /**
   * After a name is re-bound, the alias for a term is still the earliest
   * definition in order of first binding.
   */
  @Test
  void testAliasesAfterRebind() {
    final Environment env =
        env("id", "λx. x", "k", "λx y. x", "idToo", "λy. y");
    assertThat(env.nameOf(parse("λz. z")), is("id"));

    env.bind("id", parse("λx y. y"));
    assertThat(env.nameOf(parse("λz. z")), is("idToo"));
    assertThat(env.nameOf(parse("λa b. b")), is("id"));

    // "id" keeps its position, so it is again the earliest alias.
    env.bind("id", parse("λx. x"));
    assertThat(env.nameOf(parse("λz. z")), is("id"));
    assertThat(env.nameOf(parse("λa b. b")), nullValue());

    // A new name does not displace an existing alias.
    env.bind("kToo", parse("λa b. a"));
    assertThat(env.nameOf(parse("λa b. a")), is("k"));
    env.unbind("k");
    assertThat(env.nameOf(parse("λa b. a")), is("kToo"));
  }

  @Test
  void testExpand() {
    final Environment env =
        env("id", "λx. x", "twice", "λf x. f (f x)", "twiceId", "twice id");
    assertThat(env.expand(parse("twiceId y")).toString(),
        is("(λf. λx. f (f x)) (λx. x) y"));
    assertThat(env.expand(parse("λid. id")).toString(), is("λid. id"));
    assertThat(env.expand(parse("z")).toString(), is("z"));

    // Expansion avoids capturing the free "x" of the argument.
    env.bind("const", parse("λy. z"));
    env.bind("z", parse("x"));
    assertThat(env.expand(parse("λx. const")).toString(), is("λx1. λy. x"));
  }

  /** A definition that refers to itself is expanded once. */
  @Test
  void testExpandSelfReference() {
    final Environment env = env("loop", "λx. loop x");
    assertThat(env.expand(parse("loop")).toString(), is("λx. loop x"));

    final Environment env2 = env("even", "λn. odd n", "odd", "λn. even n");
    assertThat(env2.expand(parse("even")).toString(),
        is("λn. (λn. even n) n"));
  }

  private static Matcher<Environment> hasNames(String... names) {
    final List<String> expected = ImmutableList.copyOf(names);
    return new CustomTypeSafeMatcher<Environment>("environment " + expected) {
      @Override
      protected boolean matchesSafely(Environment env) {
        return env.definitions().stream()
            .map(Map.Entry::getKey)
            .collect(Collectors.toList())
            .equals(expected);
      }
    };
  }
}

// End EnvironmentTest.java
