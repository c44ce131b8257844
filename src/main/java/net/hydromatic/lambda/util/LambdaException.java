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
package net.hydromatic.lambda.util;

import net.hydromatic.lambda.ast.Pos;

/**
 * Exception that can be reported to the user of the interpreter.
 *
 * <p>Implementations extend {@link RuntimeException}; the shell catches
 * them, describes them, and carries on reading statements.
 */
public interface LambdaException {
  /** Writes a user-facing description of this exception to a buffer. */
  StringBuilder describeTo(StringBuilder buf);

  /** Returns the position where the error occurred. */
  Pos pos();
}

// End LambdaException.java
