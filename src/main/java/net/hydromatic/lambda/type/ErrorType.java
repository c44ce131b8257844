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

import static java.util.Objects.requireNonNull;

import java.util.function.UnaryOperator;
import net.hydromatic.lambda.ast.Op;
import net.hydromatic.lambda.ast.TermWriter;

/**
 * The result of type-checking a term that has no type.
 *
 * <p>An error type is a value, not an exception. It is never a component of
 * another type; a rule that would combine it with another type returns the
 * error unchanged.
 */
public class ErrorType extends BaseType {
  /** Human-readable diagnostic, e.g. "unbound variable y". */
  public final String message;

  ErrorType(String message) {
    super(Op.ERROR_TYPE);
    this.message = requireNonNull(message, "message");
  }

  @Override
  public boolean isError() {
    return true;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public ErrorType copy(TypeSystem typeSystem, UnaryOperator<Type> transform) {
    return this;
  }

  @Override
  public TermWriter unparse(TermWriter w, int left, int right) {
    return w.append("type error: ").append(message);
  }
}

// End ErrorType.java
