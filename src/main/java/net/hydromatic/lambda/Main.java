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
package net.hydromatic.lambda;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;
import net.hydromatic.lambda.ast.Statement;
import net.hydromatic.lambda.ast.Term;
import net.hydromatic.lambda.ast.TermWriter;
import net.hydromatic.lambda.compile.DeBruijn;
import net.hydromatic.lambda.compile.Environment;
import net.hydromatic.lambda.compile.Derivations;
import net.hydromatic.lambda.compile.FreeFinder;
import net.hydromatic.lambda.compile.TypeChecker;
import net.hydromatic.lambda.eval.Library;
import net.hydromatic.lambda.eval.Prop;
import net.hydromatic.lambda.eval.Session;
import net.hydromatic.lambda.eval.Strategy;
import net.hydromatic.lambda.eval.Tracer;
import net.hydromatic.lambda.eval.Tracers;
import net.hydromatic.lambda.parse.LambdaParseException;
import net.hydromatic.lambda.parse.LambdaParser;
import net.hydromatic.lambda.type.Type;
import net.hydromatic.lambda.util.LambdaException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Lambda-calculus REPL. */
public class Main {
  static final String BANNER =
      "λ Interpreter\ntype :help for help and :quit to quit";
  static final String PROMPT = "λ > ";

  static final String HELP =
      "Available commands:\n"
          + " :help               Display this help\n"
          + " :quit               Quit the λ Interpreter\n"
          + " :normal-order       Use normal order strategy to reduce the"
          + " terms\n"
          + " :call-by-name       Use call by name strategy to reduce the"
          + " terms\n"
          + " :call-by-value      Use call by value strategy to reduce the"
          + " terms (default)\n"
          + " :show-steps         Show the steps when reducing"
          + " (enabled by default)\n"
          + " :hide-steps         Do not show steps when reducing\n"
          + " :env                Show the current environment\n"
          + " :rm <n1> [<n2> ...] Removes the given names from the"
          + " environment\n"
          + " :load <name>        Load the definitions from the given library"
          + " to environment\n"
          + " :save <name>        Save the current environment to the given"
          + " library\n"
          + " :show-aliases       Display alias when an expression is known as"
          + " an alias (default)\n"
          + " :hide-aliases       Do not display aliases\n"
          + " :de-bruijn <expr>   Show the De Bruijn representation of the"
          + " given lambda term\n"
          + " :enable-typing      Enable type checking of lambda terms\n"
          + " :disable-typing     Disable type checking of lambda terms"
          + " (default)\n"
          + " :type <expr>        Display the type of the expression\n"
          + " :derivation <expr>  Creates a LaTeX representation of the typing"
          + " derivation tree\n"
          + " :set <prop> <value> Set a property\n"
          + " :show [<prop>]      Show the value of one or all properties";

  private final BufferedReader in;
  private final PrintWriter out;
  private final boolean echo;
  private final boolean prompt;
  private final List<String> libraries;
  private final Supplier<Date> clock;
  final Session session;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final List<String> argList = ImmutableList.copyOf(args);
    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    final Main main =
        new Main(argList, System.in, System.out, propMap,
            System.console() != null);
    try {
      main.run();
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
    }
  }

  /** Creates a Main. */
  public Main(
      List<String> args,
      InputStream in,
      PrintStream out,
      Map<Prop, Object> propMap,
      boolean prompt) {
    this(
        args,
        new InputStreamReader(in),
        new OutputStreamWriter(out),
        propMap,
        prompt,
        Date::new);
  }

  /**
   * Creates a Main.
   *
   * @param argList Command-line arguments: "--echo" to echo each input line,
   *     and the names of libraries to load before reading input
   * @param in Input
   * @param out Output
   * @param propMap Initial property values
   * @param prompt Whether to print a banner and a prompt before each line
   * @param clock Supplies the date written at the top of saved libraries
   */
  public Main(
      List<String> argList,
      Reader in,
      Writer out,
      Map<Prop, Object> propMap,
      boolean prompt,
      Supplier<Date> clock) {
    this.in = buffer(in);
    this.out = buffer(out);
    this.echo = argList.contains("--echo");
    this.prompt = prompt;
    this.libraries = argList.stream()
        .filter(arg -> !arg.startsWith("--"))
        .collect(ImmutableList.toImmutableList());
    this.clock = clock;
    this.session = new Session(new Environment(), propMap);
  }

  private static PrintWriter buffer(Writer out) {
    if (out instanceof PrintWriter) {
      return (PrintWriter) out;
    } else {
      if (!(out instanceof BufferedWriter)) {
        out = new BufferedWriter(out);
      }
      return new PrintWriter(out);
    }
  }

  private static BufferedReader buffer(Reader in) {
    if (in instanceof BufferedReader) {
      return (BufferedReader) in;
    } else {
      return new BufferedReader(in);
    }
  }

  public void run() {
    final Consumer<String> outLines = out::println;
    final Shell shell = new Shell(this, outLines);
    session.withShell(shell, outLines, session1 -> shell.run(session1));
    out.flush();
  }

  /** Reads a line of input, or returns null at end of input. */
  @Nullable String readLine() {
    try {
      return in.readLine();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Shell that reads statements and commands, and handles errors. */
  static class Shell implements Session.Shell {
    private final Main main;
    private final Consumer<String> outLines;
    private boolean done;

    Shell(Main main, Consumer<String> outLines) {
      this.main = main;
      this.outLines = outLines;
    }

    void run(Session session) {
      for (String library : main.libraries) {
        session.withShell(this, outLines, session1 -> load(library));
      }
      if (main.prompt) {
        outLines.accept(BANNER);
      }
      while (!done) {
        if (main.prompt) {
          main.out.print(PROMPT);
        }
        main.out.flush();
        final String line = main.readLine();
        if (line == null) {
          break;
        }
        if (main.echo) {
          outLines.accept(line);
        }
        if (line.trim().isEmpty()) {
          continue;
        }
        session.withShell(this, outLines, session1 -> command(line.trim()));
      }
    }

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

    /** Executes a line of input: a command, a definition or a term. */
    void command(String line) {
      if (!line.startsWith(":")) {
        statement(parser(line).statementEof());
        return;
      }
      final int space = line.indexOf(' ');
      final String command = space < 0 ? line : line.substring(0, space);
      final String rest = space < 0 ? "" : line.substring(space + 1).trim();
      final Map<Prop, Object> map = main.session.map;
      switch (command) {
      case ":help":
        outLines.accept(HELP);
        break;
      case ":quit":
        done = true;
        break;
      case ":normal-order":
        Prop.STRATEGY.set(map, Strategy.NORMAL_ORDER);
        break;
      case ":call-by-name":
        Prop.STRATEGY.set(map, Strategy.CALL_BY_NAME);
        break;
      case ":call-by-value":
        Prop.STRATEGY.set(map, Strategy.CALL_BY_VALUE);
        break;
      case ":show-steps":
        Prop.SHOW_STEPS.set(map, true);
        break;
      case ":hide-steps":
        Prop.SHOW_STEPS.set(map, false);
        break;
      case ":show-aliases":
        Prop.SHOW_ALIASES.set(map, true);
        break;
      case ":hide-aliases":
        Prop.SHOW_ALIASES.set(map, false);
        break;
      case ":enable-typing":
        Prop.CHECK_TYPES.set(map, true);
        break;
      case ":disable-typing":
        Prop.CHECK_TYPES.set(map, false);
        break;
      case ":env":
        main.session.env.definitions()
            .forEach(e -> outLines.accept(e.getKey() + " = " + e.getValue()));
        break;
      case ":rm":
        final List<String> names = words(rest);
        names.forEach(main.session.env::unbind);
        outLines.accept(names + " removed from the environment");
        break;
      case ":load":
        load(argument(command, rest));
        break;
      case ":save":
        save(argument(command, rest));
        break;
      case ":type":
        outLines.accept(
            TypeChecker.typeOf(main.session.typeSystem, ImmutableMap.of(),
                expand(rest)).toString());
        break;
      case ":derivation":
        outLines.accept(
            Derivations.toLatex(
                TypeChecker.derive(main.session.typeSystem,
                    ImmutableMap.of(),
                    expand(rest))));
        break;
      case ":de-bruijn":
        outLines.accept(DeBruijn.toDeBruijn(expand(rest)).toString());
        break;
      case ":set":
        final List<String> words = words(rest);
        if (words.size() != 2) {
          throw new IllegalArgumentException("usage: :set <prop> <value>");
        }
        Prop.lookup(words.get(0)).setLenient(map, words.get(1));
        break;
      case ":show":
        final List<Prop> props = rest.isEmpty()
            ? Prop.BY_CAMEL_NAME
            : ImmutableList.of(Prop.lookup(rest));
        props.forEach(prop ->
            outLines.accept(prop.camelName + " = " + prop.get(map)));
        break;
      default:
        throw new IllegalArgumentException("Unknown command " + command
            + "; type :help for help");
      }
    }

    private void statement(Statement statement) {
      if (statement instanceof Statement.Assign) {
        final Statement.Assign assign = (Statement.Assign) statement;
        main.session.env.bind(assign.name, assign.term);
        outLines.accept(assign.name + " added to the environment.");
        return;
      }
      final Term term = statement.term();
      final Map<Prop, Object> map = main.session.map;
      final boolean showAliases = Prop.SHOW_ALIASES.booleanValue(map);
      final boolean showSteps = Prop.SHOW_STEPS.booleanValue(map);
      outLines.accept("   "
          + (showAliases && !main.session.env.containsExpr(term)
              ? show(term)
              : term.toString()));
      final Term expanded = main.session.env.expand(term);
      if (Prop.REQUIRE_CLOSED.booleanValue(map)) {
        final Set<String> freeVars = FreeFinder.freeVars(expanded);
        if (!freeVars.isEmpty()) {
          outLines.accept("free variable(s) "
              + Joiner.on(", ").join(freeVars));
          return;
        }
      }
      if (Prop.CHECK_TYPES.booleanValue(map)) {
        final Type type =
            TypeChecker.typeOf(main.session.typeSystem,
                ImmutableMap.of(), expanded);
        if (type.isError()) {
          outLines.accept(type.toString());
          return;
        }
      }
      final Consumer<Term> printStep = t -> outLines.accept(" → " + show(t));
      Tracer tracer =
          Tracers.withOnNormalForm(Tracers.empty(), t -> outLines.accept(" ⇸"));
      if (showSteps) {
        tracer = Tracers.withOnStep(tracer, printStep);
      } else {
        // Print only the normal form.
        tracer = Tracers.withOnNormalForm(tracer, printStep);
      }
      tracer =
          Tracers.withOnDiverge(
              tracer,
              (t, strategy) ->
                  outLines.accept("The term '" + t + "' diverges using the "
                      + strategy + " strategy."));
      tracer =
          Tracers.withOnStepLimit(
              tracer,
              (t, stepLimit) ->
                  outLines.accept("Step limit " + stepLimit + " reached."));
      main.session.evaluator(tracer)
          .evaluate(expanded, Prop.STEP_LIMIT.intValue(map));
    }

    /** Writes a term, using aliases if they are enabled. */
    private String show(Term term) {
      if (!Prop.SHOW_ALIASES.booleanValue(main.session.map)) {
        return term.toString();
      }
      return term.unparse(new TermWriter(main.session.env::nameOf));
    }

    private LambdaParser parser(String text) {
      return new LambdaParser(main.session.typeSystem, "stdIn", text);
    }

    /** Parses a term and expands the definitions it refers to. */
    private Term expand(String text) {
      return main.session.env.expand(parser(text).termEof());
    }

    private void load(String name) {
      try {
        Library.load(main.session, name);
        outLines.accept("Library " + name + " loaded in the environment");
      } catch (LambdaParseException e) {
        outLines.accept(
            e.describeTo(new StringBuilder("File corrupted: ")).toString());
      }
    }

    private void save(String name) {
      final File directory = Prop.DIRECTORY.fileValue(main.session.map);
      if (Library.file(directory, name).exists()) {
        outLines.accept("A library with this name already exists.");
        String answer = "";
        while (!answer.equals("y") && !answer.equals("n")) {
          outLines.accept("Do you want to overwrite it? (y/n)");
          main.out.flush();
          final String line = main.readLine();
          if (line == null) {
            break;
          }
          answer = line.trim();
        }
        if (!answer.equals("y")) {
          outLines.accept("Save Aborted");
          return;
        }
      }
      Library.save(main.session.env, directory, name, main.clock.get());
      outLines.accept("Environment saved to library " + name);
    }

    private static String argument(String command, String rest) {
      if (rest.isEmpty()) {
        throw new IllegalArgumentException("usage: " + command + " <name>");
      }
      return rest;
    }

    private static List<String> words(String s) {
      final List<String> list = new ArrayList<>();
      for (String word : s.split("\\s+")) {
        if (!word.isEmpty()) {
          list.add(word);
        }
      }
      return list;
    }
  }
}

// End Main.java
