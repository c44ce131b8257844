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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.util.Date;
import java.util.List;
import net.hydromatic.lambda.ast.Statement;
import net.hydromatic.lambda.parse.LambdaParseException;
import net.hydromatic.lambda.parse.LambdaParser;
import net.hydromatic.lambda.type.TypeSystem;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link Library}. */
public class LibraryTest {
  @Test
  void testFile() {
    final File dir = new File("/lib");
    assertThat(Library.file(dir, "church"), is(new File(dir, "church.lbd")));
    assertThat(Library.file(dir, "church.lbd"),
        is(new File(dir, "church.lbd")));
  }

  @Test
  void testRead(@TempDir File dir) throws IOException {
    Files.asCharSink(new File(dir, "bools.lbd"), UTF_8)
        .write("# booleans\n"
            + "true = \\x y. x;\n"
            + "false=λx y. y; # trailing comment\n"
            + "\n"
            + "not = \\b. b false true;\n");
    final List<Statement.Assign> assigns =
        Library.read(new TypeSystem(), dir, "bools");
    assertThat(assigns.size(), is(3));
    assertThat(assigns.get(0).toString(), is("true = λx. λy. x"));
    assertThat(assigns.get(1).name, is("false"));
    assertThat(assigns.get(2).pos.toString(), is("bools.lbd:5.1-5.24"));

    final Session session = new Session();
    Prop.DIRECTORY.set(session.map, dir);
    assertThat(Library.load(session, "bools.lbd"), is(3));
    assertThat(session.env.size(), is(3));
    assertThat(session.env.nameOf(LambdaParser.parseTerm("λa b. b")),
        is("false"));
  }

  @Test
  void testReadErrors(@TempDir File dir) throws IOException {
    final LibraryException e =
        assertThrows(LibraryException.class,
            () -> Library.read(new TypeSystem(), dir, "missing"));
    assertThat(e.getMessage(), is("Unable to load missing."));
    assertThat(e.libraryName(), is("missing"));

    // A library with an error binds nothing.
    Files.asCharSink(new File(dir, "bad.lbd"), UTF_8)
        .write("id = λx. x;\nk = λx y. x\n");
    final Session session = new Session();
    Prop.DIRECTORY.set(session.map, dir);
    final LambdaParseException e2 =
        assertThrows(LambdaParseException.class,
            () -> Library.load(session, "bad"));
    assertThat(e2.getMessage(),
        is("Encountered end of input. Was expecting: ';'"));
    assertThat(e2.describeTo(new StringBuilder()).toString(),
        containsString("bad.lbd:3.1"));
    assertThat(session.env.size(), is(0));
  }

  @Test
  void testSave(@TempDir File dir) throws IOException {
    final Session session = new Session();
    session.env.bind("id", LambdaParser.parseTerm("λx. x"));
    session.env.bind("app", LambdaParser.parseTerm("λf x:A -> B. f x"));
    Library.save(session.env, dir, "saved", new Date(0L));
    final List<String> lines =
        Files.readLines(new File(dir, "saved.lbd"), UTF_8);
    assertThat(lines.size(), is(3));
    assertThat(lines.get(0), is("# saved on " + new Date(0L)));
    assertThat(lines.get(1), is("id=λx. x;"));
    assertThat(lines.get(2), is("app=λf. λx:A -> B. f x;"));

    // What was saved can be read back.
    final List<Statement.Assign> assigns =
        Library.read(new TypeSystem(), dir, "saved");
    assertThat(assigns.get(1).term, is(session.env.getOpt("app")));
  }
}

// End LibraryTest.java
