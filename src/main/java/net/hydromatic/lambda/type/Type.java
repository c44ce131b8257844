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

import java.util.function.UnaryOperator;
import net.hydromatic.lambda.ast.Op;
import net.hydromatic.lambda.ast.TermWriter;

/** Type. */
public interface Type {
  /** Type operator. */
  Op op();

  /**
   * Copies this type, applying a given transform to component types, and
   * returning the original type if the component types are unchanged.
   */
  Type copy(TypeSystem typeSystem, UnaryOperator<Type> transform);

  <R> R accept(TypeVisitor<R> typeVisitor);

  /**
   * Writes this type to a writer, parenthesizing if the operators on either
   * side bind more tightly than this type's operator.
   */
  TermWriter unparse(TermWriter w, int left, int right);

  /**
   * Whether this type is an {@link ErrorType}. An error absorbs every type
   * that it would otherwise be combined with.
   */
  default boolean isError() {
    return false;
  }
}

// End Type.java
