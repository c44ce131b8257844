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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.lambda.ast.Term;
import net.hydromatic.lambda.type.AtomicType;
import net.hydromatic.lambda.type.ErrorType;
import net.hydromatic.lambda.type.FnType;
import net.hydromatic.lambda.type.Type;
import net.hydromatic.lambda.type.TypeVar;
import net.hydromatic.lambda.type.TypeVisitor;

/** Renders {@link Derivation} trees as text and as LaTeX. */
public abstract class Derivations {
  /** Names of the first few type variables in LaTeX. */
  private static final List<String> GREEK =
      ImmutableList.of(
          "\\alpha", "\\beta", "\\gamma", "\\delta", "\\epsilon",
          "\\zeta", "\\eta", "\\theta");

  private Derivations() {}

  /**
   * Renders a derivation as an indented tree, conclusion first, one
   * judgment per line. For example,
   *
   * <pre>{@code
   * ⊢ λx:A. x : A -> A (ABS)
   *   x : A ⊢ x : A (VAR)
   * }</pre>
   */
  public static String toText(Derivation derivation) {
    final StringBuilder buf = new StringBuilder();
    text(buf, derivation, 0);
    return buf.toString();
  }

  private static void text(StringBuilder buf, Derivation derivation,
      int indent) {
    if (buf.length() > 0) {
      buf.append('\n');
    }
    buf.append(Strings.repeat("  ", indent))
        .append(derivation)
        .append(" (")
        .append(derivation.rule)
        .append(')');
    for (Derivation premise : derivation.premises) {
      text(buf, premise, indent + 1);
    }
  }

  /**
   * Renders a derivation as a LaTeX proof tree, using the macros of the
   * "bussproofs" package.
   */
  public static String toLatex(Derivation derivation) {
    final StringBuilder buf = new StringBuilder();
    buf.append("\\begin{prooftree}\n");
    latex(buf, derivation);
    buf.append("\\end{prooftree}");
    return buf.toString();
  }

  private static void latex(StringBuilder buf, Derivation derivation) {
    derivation.premises.forEach(premise -> latex(buf, premise));
    final String inference;
    switch (derivation.premises.size()) {
    case 0:
      buf.append("\\AxiomC{}\n");
      inference = "\\UnaryInfC";
      break;
    case 1:
      inference = "\\UnaryInfC";
      break;
    case 2:
      inference = "\\BinaryInfC";
      break;
    default:
      throw new AssertionError("too many premises: " + derivation);
    }
    buf.append("\\RightLabel{\\scriptsize(")
        .append(ruleLabel(derivation.rule))
        .append(")}\n")
        .append(inference)
        .append("{$");
    judgment(buf, derivation);
    buf.append("$}\n");
  }

  private static String ruleLabel(Derivation.Rule rule) {
    switch (rule) {
    case VAR:
      return "Var";
    case ABS:
      return "Abs";
    case APP:
      return "App";
    default:
      throw new AssertionError(rule);
    }
  }

  private static void judgment(StringBuilder buf, Derivation derivation) {
    final int length = buf.length();
    derivation.context.forEach((name, type) -> {
      if (buf.length() > length) {
        buf.append(", ");
      }
      buf.append(escape(name)).append(" : ");
      latex(buf, type, false);
    });
    if (buf.length() > length) {
      buf.append(' ');
    }
    buf.append("\\vdash ");
    latex(buf, derivation.term);
    buf.append(" : ");
    latex(buf, derivation.type, false);
  }

  private static void latex(StringBuilder buf, Term term) {
    buf.append(
        escape(term.toString())
            .replace("λ", "\\lambda ")
            .replace("->", "\\rightarrow"));
  }

  private static void latex(StringBuilder buf, Type type, boolean paren) {
    type.accept(
        new TypeVisitor<Void>() {
          @Override
          public Void visit(TypeVar typeVar) {
            buf.append(
                typeVar.ordinal < GREEK.size()
                    ? GREEK.get(typeVar.ordinal)
                    : "\\tau_{" + typeVar.ordinal + "}");
            return null;
          }

          @Override
          public Void visit(FnType fnType) {
            if (paren) {
              buf.append('(');
            }
            latex(buf, fnType.paramType, fnType.paramType instanceof FnType);
            buf.append(" \\rightarrow ");
            latex(buf, fnType.resultType, false);
            if (paren) {
              buf.append(')');
            }
            return null;
          }

          @Override
          public Void visit(AtomicType atomicType) {
            buf.append(escape(atomicType.name));
            return null;
          }

          @Override
          public Void visit(ErrorType errorType) {
            buf.append("\\textsf{")
                .append(escape(errorType.toString()))
                .append('}');
            return null;
          }
        });
  }

  /** Escapes characters that are special in LaTeX math mode. */
  private static String escape(String s) {
    return s.replace("_", "\\_");
  }
}

// End Derivations.java
