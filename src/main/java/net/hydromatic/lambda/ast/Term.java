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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;
import net.hydromatic.lambda.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Lambda term.
 *
 * <p>A term is one of {@link Variable}, {@link Abstraction} and {@link
 * Application}. This class functions as a namespace, so that we can keep the
 * class names short.
 *
 * <p>Terms are immutable. Methods that transform a term return a new term,
 * or the same term if nothing changed.
 *
 * <p>{@link #equals} is syntactic: {@code λx. x} and {@code λy. y} are not
 * equal. Use {@link net.hydromatic.lambda.compile.DeBruijn#alphaEquivalent}
 * to compare terms up to renaming of bound variables.
 */
public abstract class Term {
  public final Op op;

  Term(Op op) {
    this.op = requireNonNull(op);
  }

  /**
   * Converts this term into a string.
   *
   * <p>The string never contains aliases. If you want aliases, call {@link
   * #unparse(TermWriter)} with a writer that has an alias function.
   */
  @Override
  public final String toString() {
    return unparse(new TermWriter());
  }

  /** Converts this term into a string, with a given writer. */
  public final String unparse(TermWriter w) {
    return w.append(this, 0, 0).toString();
  }

  abstract TermWriter unparse(TermWriter w, int left, int right);

  /**
   * Accepts a visitor, calling the {@link TermVisitor#visit} method
   * appropriate to the type of this term, and returning the result.
   */
  public abstract <R> R accept(TermVisitor<R> visitor);

  /** Reference to a bound variable or to a free (global) name. */
  public static class Variable extends Term {
    public final String name;

    Variable(String name) {
      super(Op.ID);
      this.name = requireNonNull(name, "name");
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Variable && name.equals(((Variable) o).name);
    }

    @Override
    TermWriter unparse(TermWriter w, int left, int right) {
      return w.append(name);
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /**
   * Function, "{@code λname. body}" or "{@code λname:type. body}".
   *
   * <p>The type annotation is optional, and is only used by the type checker.
   */
  public static class Abstraction extends Term {
    public final String name;
    public final @Nullable Type type;
    public final Term body;

    Abstraction(String name, @Nullable Type type, Term body) {
      super(Op.FN);
      this.name = requireNonNull(name, "name");
      this.type = type;
      this.body = requireNonNull(body, "body");
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, type, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Abstraction
              && name.equals(((Abstraction) o).name)
              && Objects.equals(type, ((Abstraction) o).type)
              && body.equals(((Abstraction) o).body);
    }

    @Override
    TermWriter unparse(TermWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      w.append("λ").append(name);
      if (type != null) {
        w.append(":").append(type, 0, 0);
      }
      return w.append(op.padded).appendBody(name, body, op.right, right);
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visit(this);
    }

    /**
     * Creates a copy of this abstraction with a given bound name and body,
     * or returns this abstraction if they are the same.
     */
    public Abstraction copy(String name, Term body) {
      return name.equals(this.name) && body == this.body
          ? this
          : new Abstraction(name, type, body);
    }
  }

  /** Application of a function to an argument, "{@code fn arg}". */
  public static class Application extends Term {
    public final Term fn;
    public final Term arg;

    Application(Term fn, Term arg) {
      super(Op.APPLY);
      this.fn = requireNonNull(fn, "fn");
      this.arg = requireNonNull(arg, "arg");
    }

    @Override
    public int hashCode() {
      return Objects.hash(fn, arg);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Application
              && fn.equals(((Application) o).fn)
              && arg.equals(((Application) o).arg);
    }

    @Override
    TermWriter unparse(TermWriter w, int left, int right) {
      return w.infix(left, fn, op, arg, right);
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visit(this);
    }

    /**
     * Creates a copy of this application with given function and argument,
     * or returns this application if they are the same.
     */
    public Application copy(Term fn, Term arg) {
      return fn == this.fn && arg == this.arg
          ? this
          : new Application(fn, arg);
    }
  }
}

// End Term.java
