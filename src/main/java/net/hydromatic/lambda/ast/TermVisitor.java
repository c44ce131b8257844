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

/**
 * Visitor over {@link Term} objects.
 *
 * <p>There is one method per kind of term, and no default implementation;
 * so a class that implements this interface handles every kind of term.
 *
 * @param <R> return type from {@code visit} methods
 * @see Term#accept(TermVisitor)
 */
public interface TermVisitor<R> {
  /** Visits a {@link Term.Variable}. */
  R visit(Term.Variable variable);

  /** Visits a {@link Term.Abstraction}. */
  R visit(Term.Abstraction abstraction);

  /** Visits a {@link Term.Application}. */
  R visit(Term.Application application);
}

// End TermVisitor.java
