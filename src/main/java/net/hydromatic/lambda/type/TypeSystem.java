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
package net.hydromatic.lambda.type;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A collection of types.
 *
 * <p>Atomic types are interned, so that each name has one instance. The
 * type system also hands out fresh type variables; ordinals are never
 * re-used within a type system.
 */
public class TypeSystem {
  private final Map<String, AtomicType> atomicTypeByName = new HashMap<>();
  private int typeVarCount = 0;

  /** Returns the atomic type with a given name, creating it if necessary. */
  public AtomicType atomicType(String name) {
    return atomicTypeByName.computeIfAbsent(name, AtomicType::new);
  }

  /** Creates a function type. */
  public FnType fnType(Type paramType, Type resultType) {
    checkArgument(!paramType.isError() && !resultType.isError(),
        "error type cannot be a component of a function type");
    return new FnType(paramType, resultType);
  }

  /**
   * Creates a multi-step function type.
   *
   * <p>For example, {@code fnType(a, b, c)} returns {@code a -> b -> c}.
   */
  public Type fnType(Type paramType, Type type1, Type... moreTypes) {
    if (moreTypes.length == 0) {
      return fnType(paramType, type1);
    }
    Type t = moreTypes[moreTypes.length - 1];
    for (int i = moreTypes.length - 2; i >= 0; i--) {
      t = fnType(moreTypes[i], t);
    }
    return fnType(paramType, fnType(type1, t));
  }

  /** Creates a type variable that has not been used in this type system. */
  public TypeVar newTypeVar() {
    return new TypeVar(typeVarCount++);
  }

  /** Creates an error type. */
  public ErrorType error(String message) {
    return new ErrorType(message);
  }

  /**
   * Returns a transform that renumbers type variables in the order they are
   * first seen, starting from 0; so that a type such as {@code 'd -> 'c -> 'd}
   * becomes {@code 'a -> 'b -> 'a}.
   *
   * <p>The transform is stateful: apply it to several types to renumber them
   * consistently.
   */
  public Renumbering renumbering() {
    return new Renumbering(this);
  }

  /** Renames type variables consistently across several types. */
  public static class Renumbering {
    private final TypeSystem typeSystem;
    private final Map<TypeVar, TypeVar> map = new LinkedHashMap<>();

    Renumbering(TypeSystem typeSystem) {
      this.typeSystem = typeSystem;
    }

    public Type apply(Type type) {
      return type.copy(typeSystem, t -> {
        if (t instanceof TypeVar) {
          return map.computeIfAbsent((TypeVar) t, v -> new TypeVar(map.size()));
        }
        return t;
      });
    }
  }
}

// End TypeSystem.java
