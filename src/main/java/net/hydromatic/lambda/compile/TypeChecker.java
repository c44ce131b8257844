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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import net.hydromatic.lambda.ast.Term;
import net.hydromatic.lambda.ast.TermVisitor;
import net.hydromatic.lambda.type.FnType;
import net.hydromatic.lambda.type.Type;
import net.hydromatic.lambda.type.TypeSystem;
import net.hydromatic.lambda.type.TypeVar;
import net.hydromatic.lambda.type.TypeVisitor;

/**
 * Simple type checker.
 *
 * <p>Computes the type of a term, or an
 * {@link net.hydromatic.lambda.type.ErrorType} if the term is not
 * well-typed. A binder with a type annotation has that type; a binder
 * without an annotation is given a type variable, which is solved by
 * unification (Curry-style, monomorphic; there is no
 * generalization, so {@code λf. f f} has no type).
 *
 * <p>Errors are values, not exceptions. Once a sub-term has an error type,
 * the enclosing terms have the same error.
 *
 * <p>A type checker holds the state of one check (the solutions of type
 * variables); use the static methods, which create a new checker for each
 * call.
 */
public class TypeChecker {
  private final TypeSystem typeSystem;
  private final Map<TypeVar, Type> solutions = new HashMap<>();

  private TypeChecker(TypeSystem typeSystem) {
    this.typeSystem = requireNonNull(typeSystem);
  }

  /** Computes the type of a term in the empty context. */
  public static Type typeOf(Term term) {
    return typeOf(new TypeSystem(), ImmutableMap.of(), term);
  }

  /** Computes the type of a term in a given context. */
  public static Type typeOf(
      TypeSystem typeSystem, Map<String, Type> context, Term term) {
    return derive(typeSystem, context, term).type;
  }

  /** Computes the derivation of the type of a term in the empty context. */
  public static Derivation derive(Term term) {
    return derive(new TypeSystem(), ImmutableMap.of(), term);
  }

  /**
   * Computes the derivation of the type of a term in a given context.
   *
   * <p>The type of the root of the derivation is the type of the term. Type
   * variables are solved throughout the tree, and the remaining ones are
   * renumbered from {@code 'a} in the order they appear.
   */
  public static Derivation derive(
      TypeSystem typeSystem, Map<String, Type> context, Term term) {
    final TypeChecker checker = new TypeChecker(typeSystem);
    final Derivation derivation = checker.deriveTerm(context, term);
    final TypeSystem.Renumbering renumbering = typeSystem.renumbering();
    return derivation.copy(t -> renumbering.apply(checker.resolve(t)));
  }

  private Derivation deriveTerm(Map<String, Type> context, Term term) {
    return term.accept(
        new TermVisitor<Derivation>() {
          @Override
          public Derivation visit(Term.Variable variable) {
            return deriveVariable(context, variable);
          }

          @Override
          public Derivation visit(Term.Abstraction abstraction) {
            return deriveAbstraction(context, abstraction);
          }

          @Override
          public Derivation visit(Term.Application application) {
            return deriveApplication(context, application);
          }
        });
  }

  private Derivation deriveVariable(
      Map<String, Type> context, Term.Variable variable) {
    final Type type = context.get(variable.name);
    return new Derivation(
        context,
        variable,
        type != null
            ? type
            : typeSystem.error("unbound variable " + variable.name),
        Derivation.Rule.VAR,
        ImmutableList.of());
  }

  private Derivation deriveAbstraction(
      Map<String, Type> context, Term.Abstraction abstraction) {
    final Type paramType =
        abstraction.type != null ? abstraction.type : typeSystem.newTypeVar();
    final Derivation body =
        deriveTerm(
            plus(context, abstraction.name, paramType), abstraction.body);
    final Type type =
        body.type.isError()
            ? body.type
            : typeSystem.fnType(paramType, body.type);
    return new Derivation(
        context, abstraction, type, Derivation.Rule.ABS,
        ImmutableList.of(body));
  }

  private Derivation deriveApplication(
      Map<String, Type> context, Term.Application application) {
    final Derivation fn = deriveTerm(context, application.fn);
    if (fn.type.isError()) {
      return new Derivation(
          context, application, fn.type, Derivation.Rule.APP,
          ImmutableList.of(fn));
    }
    Type fnType = walk(fn.type);
    if (fnType instanceof TypeVar) {
      final FnType fnType2 =
          typeSystem.fnType(typeSystem.newTypeVar(), typeSystem.newTypeVar());
      unify(fnType, fnType2);
      fnType = fnType2;
    }
    if (!(fnType instanceof FnType)) {
      return new Derivation(
          context, application,
          typeSystem.error("application of non-function"),
          Derivation.Rule.APP, ImmutableList.of(fn));
    }
    final Derivation arg = deriveTerm(context, application.arg);
    final Type type;
    if (arg.type.isError()) {
      type = arg.type;
    } else if (!unify(((FnType) fnType).paramType, arg.type)) {
      type = typeSystem.error("argument type mismatch");
    } else {
      type = ((FnType) fnType).resultType;
    }
    return new Derivation(
        context, application, type, Derivation.Rule.APP,
        ImmutableList.of(fn, arg));
  }

  /**
   * Returns a context that is the same as a given context plus one variable.
   * The new variable obscures, and replaces, any variable of the same name.
   */
  private static Map<String, Type> plus(
      Map<String, Type> context, String name, Type type) {
    final Map<String, Type> map = new LinkedHashMap<>(context);
    map.remove(name);
    map.put(name, type);
    return map;
  }

  /** Follows solutions of a type variable until it reaches an unsolved type. */
  private Type walk(Type type) {
    Type t = type;
    while (t instanceof TypeVar && solutions.containsKey(t)) {
      t = solutions.get(t);
    }
    return t;
  }

  /** Replaces all solved type variables in a type. */
  Type resolve(Type type) {
    return type.copy(typeSystem, t -> {
      final Type t2 = walk(t);
      return t2 == t ? t : resolve(t2);
    });
  }

  /**
   * Unifies two types, recording solutions of type variables. Returns false
   * if the types cannot be unified.
   */
  private boolean unify(Type type0, Type type1) {
    final Type t0 = walk(type0);
    final Type t1 = walk(type1);
    if (t0.equals(t1)) {
      return true;
    }
    if (t0 instanceof TypeVar) {
      return solve((TypeVar) t0, t1);
    }
    if (t1 instanceof TypeVar) {
      return solve((TypeVar) t1, t0);
    }
    if (t0 instanceof FnType && t1 instanceof FnType) {
      return unify(((FnType) t0).paramType, ((FnType) t1).paramType)
          && unify(((FnType) t0).resultType, ((FnType) t1).resultType);
    }
    return false;
  }

  private boolean solve(TypeVar typeVar, Type type) {
    if (occurs(typeVar, resolve(type))) {
      return false;
    }
    solutions.put(typeVar, type);
    return true;
  }

  /** Returns whether a type variable occurs in a type. */
  private static boolean occurs(TypeVar typeVar, Type type) {
    final AtomicBoolean found = new AtomicBoolean();
    type.accept(
        new TypeVisitor<Void>() {
          @Override
          public Void visit(TypeVar typeVar2) {
            if (typeVar2.equals(typeVar)) {
              found.set(true);
            }
            return null;
          }
        });
    return found.get();
  }
}

// End TypeChecker.java
