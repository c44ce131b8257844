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

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import net.hydromatic.lambda.ast.Term;
import net.hydromatic.lambda.ast.TermVisitor;

/**
 * Converts terms to De Bruijn form.
 *
 * @see DeBruijnTerm
 */
public abstract class DeBruijn {
  private DeBruijn() {}

  /** Converts a term to De Bruijn form in the empty naming context. */
  public static DeBruijnTerm toDeBruijn(Term term) {
    return toDeBruijn(term, ImmutableList.of());
  }

  /**
   * Converts a term to De Bruijn form.
   *
   * @param term Term
   * @param context Names of enclosing binders, innermost first; a variable
   *     whose name is the {@code i}th element (and not an earlier element)
   *     becomes index {@code i}
   */
  public static DeBruijnTerm toDeBruijn(Term term, List<String> context) {
    return term.accept(new Converter(context));
  }

  /**
   * Returns whether two terms are equal up to consistent renaming of bound
   * variables.
   */
  public static boolean alphaEquivalent(Term term0, Term term1) {
    return term0 == term1 || toDeBruijn(term0).equals(toDeBruijn(term1));
  }

  /** Visitor that converts a term, maintaining a stack of bound names. */
  private static class Converter implements TermVisitor<DeBruijnTerm> {
    final Deque<String> names = new ArrayDeque<>();

    Converter(List<String> context) {
      // The deque's head is the innermost binder, as is the list's.
      names.addAll(context);
    }

    @Override
    public DeBruijnTerm visit(Term.Variable variable) {
      int i = 0;
      for (Iterator<String> iterator = names.iterator(); iterator.hasNext(); ) {
        if (iterator.next().equals(variable.name)) {
          return new DeBruijnTerm.Index(i);
        }
        ++i;
      }
      return new DeBruijnTerm.Free(variable.name);
    }

    @Override
    public DeBruijnTerm visit(Term.Abstraction abstraction) {
      names.push(abstraction.name);
      try {
        return new DeBruijnTerm.Fn(
            abstraction.type, abstraction.body.accept(this));
      } finally {
        names.pop();
      }
    }

    @Override
    public DeBruijnTerm visit(Term.Application application) {
      return new DeBruijnTerm.Apply(
          application.fn.accept(this), application.arg.accept(this));
    }
  }
}

// End DeBruijn.java
