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
package net.hydromatic.lambda.parse;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.lambda.ast.TermBuilder.lambda;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.lambda.ast.Pos;
import net.hydromatic.lambda.ast.Statement;
import net.hydromatic.lambda.ast.Term;
import net.hydromatic.lambda.type.Type;
import net.hydromatic.lambda.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parser for lambda terms, types, statements and libraries.
 *
 * <p>The grammar is small enough that the parser is hand-written: a
 * tokenizer produces a list of {@link Token}s, and recursive-descent
 * methods consume them.
 *
 * <pre>{@code
 * statement   := name "=" term [";"] | term [";"]
 * term        := ("\" | "λ") binder+ "." term | application
 * binder      := name [":" type] | "(" name ":" type ")"
 * application := atom atom* [lambda]
 * atom        := name | "(" term ")"
 * type        := typeAtom ["->" type]
 * typeAtom    := name | "(" type ")"
 * library     := (name "=" term ";")*
 * }</pre>
 *
 * <p>"{@code #}" starts a comment that runs to the end of the line.
 */
public class LambdaParser {
  private final String text;
  private final String file;
  private final TypeSystem typeSystem;
  private final List<Token> tokens;
  private int i;

  /** Creates a parser. */
  public LambdaParser(TypeSystem typeSystem, String file, String text) {
    this.typeSystem = requireNonNull(typeSystem);
    this.file = requireNonNull(file);
    this.text = requireNonNull(text);
    this.tokens = tokenize();
  }

  /** Creates a parser for a piece of text that has no file name. */
  public LambdaParser(TypeSystem typeSystem, String text) {
    this(typeSystem, "", text);
  }

  /** Parses a string as a term. */
  public static Term parseTerm(String text) {
    return new LambdaParser(new TypeSystem(), text).termEof();
  }

  /** Parses a string as a type. */
  public static Type parseType(TypeSystem typeSystem, String text) {
    final LambdaParser parser = new LambdaParser(typeSystem, text);
    final Type type = parser.type();
    parser.expect(TokenType.EOF, "end of input");
    return type;
  }

  /** Returns whether all input has been consumed. */
  public boolean atEnd() {
    return peek().type == TokenType.EOF;
  }

  /** Parses one statement, with an optional trailing semicolon. */
  public Statement statement() {
    final Token start = peek();
    final Statement statement;
    if (start.type == TokenType.NAME && peek(1).type == TokenType.EQ) {
      i += 2;
      final Term term = term();
      statement = Statement.assign(pos(start, previous()), start.text, term);
    } else {
      final Term term = term();
      statement = Statement.eval(pos(start, previous()), term);
    }
    accept(TokenType.SEMICOLON);
    return statement;
  }

  /** Parses a single statement, and checks that it uses all input. */
  public Statement statementEof() {
    final Statement statement = statement();
    expect(TokenType.EOF, "end of input");
    return statement;
  }

  /**
   * Parses a single term, with an optional trailing semicolon, and checks
   * that it uses all input.
   */
  public Term termEof() {
    final Term term = term();
    accept(TokenType.SEMICOLON);
    expect(TokenType.EOF, "end of input");
    return term;
  }

  /** Parses a library: a list of definitions, each ending in ";". */
  public List<Statement.Assign> library() {
    final ImmutableList.Builder<Statement.Assign> list =
        ImmutableList.builder();
    while (!atEnd()) {
      final Token name = expect(TokenType.NAME, "name");
      expect(TokenType.EQ, "'='");
      final Term term = term();
      final Token semi = expect(TokenType.SEMICOLON, "';'");
      list.add(Statement.assign(pos(name, semi), name.text, term));
    }
    return list.build();
  }

  /** Parses a term. */
  public Term term() {
    if (peek().type == TokenType.LAMBDA) {
      return abstraction();
    }
    Term term = atom();
    for (;;) {
      switch (peek().type) {
      case NAME:
      case LPAREN:
        term = lambda.apply(term, atom());
        break;
      case LAMBDA:
        // A lambda in argument position extends to the right, so it is
        // the last argument.
        return lambda.apply(term, abstraction());
      default:
        return term;
      }
    }
  }

  private Term abstraction() {
    expect(TokenType.LAMBDA, "'λ'");
    final List<Token> names = new ArrayList<>();
    final List<@Nullable Type> types = new ArrayList<>();
    do {
      if (accept(TokenType.LPAREN) != null) {
        names.add(expect(TokenType.NAME, "name"));
        expect(TokenType.COLON, "':'");
        types.add(type());
        expect(TokenType.RPAREN, "')'");
      } else {
        names.add(expect(TokenType.NAME, "name"));
        types.add(accept(TokenType.COLON) != null ? type() : null);
      }
    } while (peek().type != TokenType.DOT);
    expect(TokenType.DOT, "'.'");
    Term term = term();
    for (int j = names.size() - 1; j >= 0; j--) {
      term = lambda.fn(names.get(j).text, types.get(j), term);
    }
    return term;
  }

  private Term atom() {
    final Token token = next();
    switch (token.type) {
    case NAME:
      return lambda.var(token.text);
    case LPAREN:
      final Term term = term();
      expect(TokenType.RPAREN, "')'");
      return term;
    default:
      throw error(token, "term");
    }
  }

  /** Parses a type. The "->" operator is right-associative. */
  public Type type() {
    final Type type = typeAtom();
    if (accept(TokenType.ARROW) != null) {
      return typeSystem.fnType(type, type());
    }
    return type;
  }

  private Type typeAtom() {
    final Token token = next();
    switch (token.type) {
    case NAME:
      return typeSystem.atomicType(token.text);
    case LPAREN:
      final Type type = type();
      expect(TokenType.RPAREN, "')'");
      return type;
    default:
      throw error(token, "type");
    }
  }

  // Token stream

  private Token peek() {
    return peek(0);
  }

  private Token peek(int offset) {
    return tokens.get(Math.min(i + offset, tokens.size() - 1));
  }

  private Token next() {
    final Token token = peek();
    if (token.type != TokenType.EOF) {
      ++i;
    }
    return token;
  }

  private Token previous() {
    return tokens.get(Math.max(i - 1, 0));
  }

  private @Nullable Token accept(TokenType type) {
    if (peek().type == type) {
      return next();
    }
    return null;
  }

  private Token expect(TokenType type, String description) {
    final Token token = peek();
    if (token.type != type) {
      throw error(token, description);
    }
    return next();
  }

  private LambdaParseException error(Token token, String expected) {
    final String found =
        token.type == TokenType.EOF ? "end of input" : "\"" + token.text + "\"";
    return new LambdaParseException(
        "Encountered " + found + ". Was expecting: " + expected,
        pos(token, token));
  }

  private Pos pos(Token start, Token end) {
    return Pos.of(text, file, start.start, Math.max(end.end, start.start + 1));
  }

  // Tokenizer

  private List<Token> tokenize() {
    final ImmutableList.Builder<Token> list = ImmutableList.builder();
    int p = 0;
    final int n = text.length();
    while (p < n) {
      final char c = text.charAt(p);
      if (Character.isWhitespace(c)) {
        ++p;
      } else if (c == '#') {
        while (p < n && text.charAt(p) != '\n') {
          ++p;
        }
      } else if (c == '\\' || c == 'λ') {
        list.add(new Token(TokenType.LAMBDA, p, p + 1));
        ++p;
      } else if (c == '-' && p + 1 < n && text.charAt(p + 1) == '>') {
        list.add(new Token(TokenType.ARROW, p, p + 2));
        p += 2;
      } else if (isNameChar(c) && c != '\'') {
        final int start = p;
        while (p < n && isNameChar(text.charAt(p))) {
          ++p;
        }
        list.add(new Token(TokenType.NAME, start, p));
      } else {
        final TokenType type = TokenType.of(c);
        if (type == null) {
          throw new LambdaParseException("Lexical error: unexpected '" + c
              + "'", Pos.of(text, file, p, p + 1));
        }
        list.add(new Token(type, p, p + 1));
        ++p;
      }
    }
    list.add(new Token(TokenType.EOF, n, n));
    return list.build();
  }

  /**
   * Returns whether a character may occur in a name. The Greek letter
   * lambda is reserved.
   */
  static boolean isNameChar(char c) {
    return Character.isLetterOrDigit(c) && c != 'λ' || c == '_' || c == '\'';
  }

  /** Kind of token. */
  private enum TokenType {
    NAME, LAMBDA, ARROW, LPAREN, RPAREN, DOT, COLON, EQ, SEMICOLON, EOF;

    static @Nullable TokenType of(char c) {
      switch (c) {
      case '(':
        return LPAREN;
      case ')':
        return RPAREN;
      case '.':
        return DOT;
      case ':':
        return COLON;
      case '=':
        return EQ;
      case ';':
        return SEMICOLON;
      default:
        return null;
      }
    }
  }

  /** Token: a type and its span in the source text. */
  private class Token {
    final TokenType type;
    final int start;
    final int end;
    final String text;

    Token(TokenType type, int start, int end) {
      this.type = type;
      this.start = start;
      this.end = end;
      this.text = LambdaParser.this.text.substring(start, end);
    }

    @Override
    public String toString() {
      return type + "(" + text + ")";
    }
  }
}

// End LambdaParser.java
