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
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import net.hydromatic.lambda.ast.Term;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Environment of named terms (aliases).
 *
 * <p>Unlike the environment of most interpreters, this environment is
 * mutable: {@link #bind} adds or replaces a definition, {@link #unbind}
 * removes one. Definitions are listed in the order that their names were
 * first bound; re-binding a name replaces its term but keeps its position.
 *
 * <p>Definitions are not expanded when they are bound; a definition may
 * refer to names that are bound later, or to itself. Call {@link #expand} to
 * replace names in a term by their definitions.
 *
 * <p>Not thread-safe. The owner of the environment (usually a {@link
 * net.hydromatic.lambda.eval.Session}) must not modify it while a term that
 * was expanded from it is being evaluated.
 */
public class Environment {
  private final Map<String, Term> map = new LinkedHashMap<>();

  /**
   * Name of the earliest binding for each distinct De Bruijn form; used to
   * find aliases. A new name only adds an entry; re-binding or removing a
   * name rebuilds the map.
   */
  private final Map<DeBruijnTerm, String> aliasMap = new HashMap<>();

  /** Creates an empty environment. */
  public Environment() {}

  /** Binds a name to a term, replacing any previous definition. */
  public void bind(String name, Term term) {
    final Term previous =
        map.put(requireNonNull(name, "name"), requireNonNull(term, "term"));
    if (previous == null) {
      // New names come last, so an existing alias for the term wins.
      aliasMap.putIfAbsent(DeBruijn.toDeBruijn(term), name);
    } else {
      rebuildAliases();
    }
  }

  /**
   * Removes the definition of a name. Does nothing if the name is not bound.
   */
  public void unbind(String name) {
    if (map.remove(name) != null) {
      rebuildAliases();
    }
  }

  /** Removes all definitions. */
  public void clear() {
    map.clear();
    aliasMap.clear();
  }

  /** Returns the definition of {@code name} if bound, null if not. */
  public @Nullable Term getOpt(String name) {
    return map.get(name);
  }

  /** Returns the definition of {@code name}, if bound. */
  public Optional<Term> lookup(String name) {
    return Optional.ofNullable(map.get(name));
  }

  /** Returns the number of definitions. */
  public int size() {
    return map.size();
  }

  /**
   * Returns whether some definition is alpha-equivalent to a term.
   *
   * <p>Terms are not normalized before comparison: {@code (λx. x) y} is not
   * the same expression as {@code y}.
   */
  public boolean containsExpr(Term term) {
    return !aliasMap.isEmpty()
        && aliasMap.containsKey(DeBruijn.toDeBruijn(term));
  }

  /**
   * Returns the name of the earliest definition that is alpha-equivalent to
   * a term, or null if there is none.
   */
  public @Nullable String nameOf(Term term) {
    if (aliasMap.isEmpty()) {
      return null;
    }
    return aliasMap.get(DeBruijn.toDeBruijn(term));
  }

  /** Returns the definitions, in the order that they were first bound. */
  public List<Map.Entry<String, Term>> definitions() {
    final ImmutableList.Builder<Map.Entry<String, Term>> list =
        ImmutableList.builder();
    map.forEach((name, term) -> list.add(Maps.immutableEntry(name, term)));
    return list.build();
  }

  /**
   * Replaces each free variable in a term that names a definition by that
   * definition, recursively.
   *
   * <p>Substitution is capture-avoiding. A definition that refers to itself
   * (directly, or via other definitions) is expanded once; within that
   * expansion, the self-reference remains a free variable.
   */
  public Term expand(Term term) {
    return expand(term, ImmutableSet.of());
  }

  private Term expand(Term term, Set<String> active) {
    Term t = term;
    for (String name : FreeFinder.freeVars(term)) {
      final Term definition = map.get(name);
      if (definition == null || active.contains(name)) {
        continue;
      }
      final Set<String> active2 = new HashSet<>(active);
      active2.add(name);
      t = Substituter.substitute(t, name, expand(definition, active2));
    }
    return t;
  }

  private void rebuildAliases() {
    aliasMap.clear();
    map.forEach(
        (name, term) -> aliasMap.putIfAbsent(DeBruijn.toDeBruijn(term), name));
  }
}

// End Environment.java
