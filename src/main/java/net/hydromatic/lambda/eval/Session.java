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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.lambda.compile.Environment;
import net.hydromatic.lambda.type.TypeSystem;
import net.hydromatic.lambda.util.LambdaException;

/**
 * Session.
 *
 * <p>Holds the state that lives from one statement to the next: the
 * environment of definitions and the property values. Sessions are
 * independent of each other; two sessions do not share definitions.
 */
public class Session {
  /** Definitions. */
  public final Environment env;
  /** Property values. */
  public final Map<Prop, Object> map;
  /** Type system, used to create types while parsing and checking. */
  public final TypeSystem typeSystem = new TypeSystem();

  /** Implementation of error handling. */
  private Shell shell = Shells.INSTANCE;

  /**
   * Creates a Session.
   *
   * <p>The {@code map} parameter, that becomes the property map, is used as
   * is, not copied. It should probably be a {@link LinkedHashMap} to provide
   * deterministic iteration order.
   *
   * @param env Environment of definitions
   * @param map Map that contains property values
   */
  public Session(Environment env, Map<Prop, Object> map) {
    this.env = requireNonNull(env, "env");
    this.map = requireNonNull(map, "map");
  }

  /** Creates a Session with an empty environment and default properties. */
  public Session() {
    this(new Environment(), new LinkedHashMap<>());
  }

  /** Returns the current strategy. */
  public Strategy strategy() {
    return Prop.STRATEGY.enumValue(map, Strategy.class);
  }

  /** Creates an evaluator for the current strategy. */
  public Evaluator evaluator(Tracer tracer) {
    return new Evaluator(strategy(), tracer);
  }

  /** Calls some code with a new value of {@link Shell}. */
  public void withShell(
      Shell shell, Consumer<String> outLines, Consumer<Session> consumer) {
    final Shell prevShell = this.shell;
    try {
      this.shell = requireNonNull(shell, "shell");
      consumer.accept(this);
    } catch (RuntimeException e) {
      final StringBuilder buf = new StringBuilder();
      prevShell.handle(e, buf);
      outLines.accept(buf.toString());
    } finally {
      this.shell = prevShell;
    }
  }

  /** Calls some code with a {@link Shell} that does not handle errors. */
  public void withoutHandlingExceptions(Consumer<Session> consumer) {
    final Shell prevShell = this.shell;
    try {
      this.shell = Shells.BARF;
      consumer.accept(this);
    } finally {
      this.shell = prevShell;
    }
  }

  /** Formats an exception to a buffer, or re-throws it. */
  public void handle(RuntimeException e, StringBuilder buf) {
    shell.handle(e, buf);
  }

  /** Callback to handle errors. */
  public interface Shell {
    /**
     * Handles an exception. Particular implementations may re-throw the
     * exception, or may format the exception to a buffer that will be added
     * to the output.
     */
    void handle(RuntimeException e, StringBuilder buf);
  }

  /** Various implementations of {@link Shell}. */
  private enum Shells implements Shell {
    /** Default instance of Shell. */
    INSTANCE {
      @Override
      public void handle(RuntimeException e, StringBuilder buf) {
        if (e instanceof LambdaException) {
          ((LambdaException) e).describeTo(buf);
        } else if (e instanceof IllegalArgumentException) {
          buf.append(e.getMessage());
        } else {
          buf.append(e);
        }
      }
    },

    /** Instance of Shell that does not handle exceptions. */
    BARF {
      @Override
      public void handle(RuntimeException e, StringBuilder buf) {
        throw e;
      }
    }
  }
}

// End Session.java
