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
package net.hydromatic.lambda.ast;

import com.google.common.collect.Lists;
import java.util.List;
import net.hydromatic.lambda.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds terms. */
public enum TermBuilder {
  /**
   * The singleton instance of the term builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  lambda;

  /** Creates a variable. */
  public Term.Variable var(String name) {
    return new Term.Variable(name);
  }

  /** Creates an abstraction with no type annotation. */
  public Term.Abstraction fn(String name, Term body) {
    return new Term.Abstraction(name, null, body);
  }

  /** Creates an abstraction whose bound variable has a declared type. */
  public Term.Abstraction fn(String name, @Nullable Type type, Term body) {
    return new Term.Abstraction(name, type, body);
  }

  /**
   * Creates nested abstractions; {@code fn(["x", "y"], b)} is {@code
   * λx. λy. b}.
   */
  public Term fn(List<String> names, Term body) {
    Term t = body;
    for (String name : Lists.reverse(names)) {
      t = fn(name, t);
    }
    return t;
  }

  /** Creates an application. */
  public Term.Application apply(Term fn, Term arg) {
    return new Term.Application(fn, arg);
  }

  /**
   * Creates a left-associative chain of applications; {@code apply(f, a, b)}
   * is {@code (f a) b}.
   */
  public Term.Application apply(Term fn, Term arg, Term... moreArgs) {
    Term.Application t = apply(fn, arg);
    for (Term moreArg : moreArgs) {
      t = apply(t, moreArg);
    }
    return t;
  }
}

// End TermBuilder.java
