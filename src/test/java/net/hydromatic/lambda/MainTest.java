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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.lambda.eval.Prop;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests the REPL. */
public class MainTest {
  private static String run(
      Map<Prop, Object> propMap, boolean prompt, String input,
      String... args) {
    final StringWriter out = new StringWriter();
    new Main(ImmutableList.copyOf(args), new StringReader(input), out,
        propMap, prompt, () -> new Date(0L)).run();
    return out.toString();
  }

  private static String run(String input, String... args) {
    return run(new LinkedHashMap<>(), false, input, args);
  }

  private static String lines(String... lines) {
    final StringBuilder b = new StringBuilder();
    for (String line : lines) {
      b.append(line).append(System.lineSeparator());
    }
    return b.toString();
  }

  /** Returns the directory that contains the test libraries. */
  private static File libraryDirectory() throws URISyntaxException {
    final URL url = MainTest.class.getResource("/church.lbd");
    return new File(url.toURI()).getParentFile();
  }

  @Test
  void testEmptyRepl() {
    assertThat(run(""), is(""));
  }

  @Test
  void testPrompt() {
    final String expected = lines(Main.BANNER) + Main.PROMPT;
    assertThat(run(new LinkedHashMap<>(), true, ":quit\nx\n"), is(expected));
  }

  @Test
  void testEcho() {
    assertThat(run("x\n", "--echo"), is(lines("x", "   x", " ⇸")));
  }

  @Test
  void testRepl() {
    final String input = "id = \\x. x\n"
        + "id y\n"
        + "\n"
        + ":hide-steps\n"
        + "(\\x. \\y. x) a b\n"
        + ":show-steps\n"
        + "(\\x. \\y. x) a b\n";
    final String expected = lines(
        "id added to the environment.",
        "   id y",
        " → y",
        " ⇸",
        "   (λx. λy. x) a b",
        " → a",
        " ⇸",
        "   (λx. λy. x) a b",
        " → (λy. a) b",
        " → a",
        " ⇸");
    assertThat(run(input), is(expected));
  }

  @Test
  void testAliases() {
    final String input = "true = \\x y. x\n"
        + "false = \\x y. y\n"
        + "not = \\b. b false true\n"
        + "not true\n"
        + "\\a b. a\n"
        + ":hide-aliases\n"
        + "not true\n";
    final String expected = lines(
        "true added to the environment.",
        "false added to the environment.",
        "not added to the environment.",
        "   not true",
        " → true false true",
        " → (λy. false) true",
        " → false",
        " ⇸",
        // A term that is itself an alias is printed in full.
        "   λa. λb. a",
        " ⇸",
        "   not true",
        " → (λx. λy. x) (λx. λy. y) (λx. λy. x)",
        " → (λy. λx. λy. y) (λx. λy. x)",
        " → λx. λy. y",
        " ⇸");
    assertThat(run(input), is(expected));
  }

  /**
   * A definition that has free variables is not used as an alias for a
   * sub-term whose variables are bound by an enclosing abstraction.
   */
  @Test
  void testAliasUnderBinder() {
    final String input = "y = x\n"
        + "\\x. x\n"
        + "\\z. x z\n"
        + "(\\x. x) x\n";
    final String expected = lines(
        "y added to the environment.",
        "   λx. x",
        " ⇸",
        "   λz. y z",
        " ⇸",
        "   (λx. x) y",
        " → y",
        " ⇸");
    assertThat(run(input), is(expected));
  }

  @Test
  void testDiverge() {
    final String omega = "(\\x. x x) (\\x. x x)";
    final String input = omega + "\n"
        + ":normal-order\n"
        + "(\\x. y) (" + omega + ")\n"
        + ":call-by-name\n"
        + omega + "\n";
    final String expected = lines(
        "   (λx. x x) (λx. x x)",
        "The term '(λx. x x) (λx. x x)' diverges using the call-by-value"
            + " strategy.",
        "   (λx. y) ((λx. x x) (λx. x x))",
        " → y",
        " ⇸",
        "   (λx. x x) (λx. x x)",
        "The term '(λx. x x) (λx. x x)' diverges using the call-by-name"
            + " strategy.");
    assertThat(run(input), is(expected));
  }

  @Test
  void testStepLimit() {
    final String input = ":set stepLimit 2\n"
        + ":hide-steps\n"
        + "(\\x. x x x) (\\x. x x x)\n";
    final String expected = lines(
        "   (λx. x x x) (λx. x x x)",
        "Step limit 2 reached.");
    assertThat(run(input), is(expected));
  }

  @Test
  void testCommands() {
    final String input = "id = \\x. x\n"
        + "k = \\x y. x\n"
        + ":env\n"
        + ":rm k nosuch\n"
        + ":env\n"
        + ":type id\n"
        + ":type \\x:A. \\y:B. x\n"
        + ":type y\n"
        + ":de-bruijn id\n"
        + ":de-bruijn \\x y. x y z\n"
        + ":show strategy\n"
        + ":set strategy normal-order\n"
        + ":show strategy\n"
        + ":set showSteps off\n"
        + ":show showSteps\n";
    final String expected = lines(
        "id added to the environment.",
        "k added to the environment.",
        "id = λx. x",
        "k = λx. λy. x",
        "[k, nosuch] removed from the environment",
        "id = λx. x",
        "'a -> 'a",
        "A -> B -> A",
        "type error: unbound variable y",
        "λ. 0",
        "λ. λ. 1 0 z",
        "strategy = call-by-value",
        "strategy = normal-order",
        "showSteps = false");
    assertThat(run(input), is(expected));
  }

  @Test
  void testHelpAndDerivation() {
    assertThat(run(":help\n"), is(lines(Main.HELP)));
    final String out = run(":derivation \\x:A. x\n");
    assertThat(out, startsWith("\\begin{prooftree}"));
    assertThat(out, containsString("\\UnaryInfC{$\\vdash \\lambda x:A. x"));
  }

  @Test
  void testErrors() {
    final String input = ":foo\n"
        + "(\\x. x\n"
        + ":set stepLimit lots\n"
        + ":set nosuch 1\n"
        + ":set strategy lazy\n"
        + ":load\n"
        + "x\n";
    final String expected = lines(
        "Unknown command :foo; type :help for help",
        "stdIn:1.7 Error: Encountered end of input. Was expecting: ')'",
        "value for property stepLimit must be an integer",
        "property nosuch not found",
        "unknown strategy 'lazy'; expected one of"
            + " [normal-order, call-by-name, call-by-value]",
        "usage: :load <name>",
        "   x",
        " ⇸");
    assertThat(run(input), is(expected));
  }

  @Test
  void testRequireClosedAndTyping() {
    final String input = ":set requireClosed true\n"
        + "f x\n"
        + "\\x. x\n"
        + ":set requireClosed false\n"
        + ":enable-typing\n"
        + "\\x. x x\n"
        + "\\x:A. x\n"
        + ":disable-typing\n"
        + "f x\n";
    final String expected = lines(
        "   f x",
        "free variable(s) f, x",
        "   λx. x",
        " ⇸",
        "   λx. x x",
        "type error: argument type mismatch",
        "   λx:A. x",
        " ⇸",
        "   f x",
        " ⇸");
    assertThat(run(input), is(expected));
  }

  @Test
  void testLibrary() throws URISyntaxException {
    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    Prop.DIRECTORY.set(propMap, libraryDirectory());
    final String input = "not true\n"
        + ":hide-steps\n"
        + "and true false\n"
        + ":show-steps\n"
        + ":normal-order\n"
        + "succ one\n";
    final String expected = lines(
        "Library church loaded in the environment",
        "   not true",
        " → true false true",
        " → (λy. false) true",
        " → false",
        " ⇸",
        "   and true false",
        " → false",
        " ⇸",
        "   succ one",
        " → λf. λx. f (one f x)",
        " → λf. λx. f ((λx. f x) x)",
        " → two",
        " ⇸");
    assertThat(run(propMap, false, input, "church"), is(expected));
  }

  @Test
  void testSaveAndLoad(@TempDir File dir) throws IOException {
    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    Prop.DIRECTORY.set(propMap, dir);
    final String input = "id = \\x. x\n"
        + "k = \\x y. x\n"
        + ":save mylib\n";
    assertThat(run(propMap, false, input),
        is(
            lines(
                "id added to the environment.",
                "k added to the environment.",
                "Environment saved to library mylib")));

    final File file = new File(dir, "mylib.lbd");
    final List<String> fileLines = Files.readLines(file, UTF_8);
    assertThat(fileLines.size(), is(3));
    assertThat(fileLines.get(0), startsWith("# saved on "));
    assertThat(fileLines.get(1), is("id=λx. x;"));
    assertThat(fileLines.get(2), is("k=λx. λy. x;"));

    // Load the library in a new session.
    assertThat(run(propMap, false, ":env\n", "mylib"),
        is(
            lines(
                "Library mylib loaded in the environment",
                "id = λx. x",
                "k = λx. λy. x")));
    assertThat(run(propMap, false, ":load mylib.lbd\nk a b\n"),
        is(
            lines(
                "Library mylib.lbd loaded in the environment",
                "   k a b",
                " → (λy. a) b",
                " → a",
                " ⇸")));

    // Saving over an existing library asks for confirmation.
    final String input2 = ":save mylib\n"
        + "n\n"
        + ":save mylib\n"
        + "maybe\n"
        + "y\n";
    assertThat(run(propMap, false, input2),
        is(
            lines(
                "A library with this name already exists.",
                "Do you want to overwrite it? (y/n)",
                "Save Aborted",
                "A library with this name already exists.",
                "Do you want to overwrite it? (y/n)",
                "Do you want to overwrite it? (y/n)",
                "Environment saved to library mylib")));
    assertThat(Files.readLines(file, UTF_8).size(), is(1));
  }

  @Test
  void testLoadErrors(@TempDir File dir) throws IOException {
    Files.asCharSink(new File(dir, "bad.lbd"), UTF_8).write("x = ;\n");
    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    Prop.DIRECTORY.set(propMap, dir);
    assertThat(run(propMap, false, ":load bad\n"),
        is(
            lines(
                "File corrupted: bad.lbd:1.5 Error: Encountered \";\"."
                    + " Was expecting: term")));
    assertThat(run(propMap, false, ":load nosuch\n"),
        startsWith("Unable to load nosuch."));
  }
}

// End MainTest.java
