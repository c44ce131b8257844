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
package net.hydromatic.lambda.eval;

import static java.util.Objects.requireNonNull;

import java.io.IOException;
import net.hydromatic.lambda.ast.Pos;
import net.hydromatic.lambda.util.LambdaException;

/** Exception that occurs while reading or writing a library file. */
public class LibraryException extends RuntimeException
    implements LambdaException {
  private final String libraryName;

  LibraryException(String message, String libraryName, IOException cause) {
    super(message, cause);
    this.libraryName = requireNonNull(libraryName);
  }

  /** Returns the name of the library, such as "church". */
  public String libraryName() {
    return libraryName;
  }

  @Override
  public Pos pos() {
    return new Pos(libraryName, 0, 0, 0, 0);
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(getMessage());
    final Throwable cause = getCause();
    if (cause != null && cause.getMessage() != null) {
      buf.append("\n").append(cause.getMessage());
    }
    return buf;
  }
}

// End LibraryException.java
