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

import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.util.Date;
import java.util.List;
import java.util.Map;
import net.hydromatic.lambda.ast.Statement;
import net.hydromatic.lambda.ast.Term;
import net.hydromatic.lambda.compile.Environment;
import net.hydromatic.lambda.parse.LambdaParser;
import net.hydromatic.lambda.type.TypeSystem;

/**
 * Library: a file of definitions.
 *
 * <p>A library called "church" is stored in the file "church.lbd". Each
 * definition has the form "{@code name = term;}", and "{@code #}" starts a
 * comment.
 */
public abstract class Library {
  /** File extension of library files. */
  public static final String EXTENSION = ".lbd";

  private Library() {}

  /**
   * Returns the file that holds a library. The name may omit the
   * "{@code .lbd}" extension.
   */
  public static File file(File directory, String name) {
    return new File(
        directory, name.endsWith(EXTENSION) ? name : name + EXTENSION);
  }

  /**
   * Reads the definitions in a library.
   *
   * @throws LibraryException if the file cannot be read
   * @throws net.hydromatic.lambda.parse.LambdaParseException if the file is
   *     not a valid library
   */
  public static List<Statement.Assign> read(
      TypeSystem typeSystem, File directory, String name) {
    final File file = file(directory, name);
    final String text;
    try {
      text = Files.asCharSource(file, UTF_8).read();
    } catch (IOException e) {
      throw new LibraryException("Unable to load " + name + ".", name, e);
    }
    return new LambdaParser(typeSystem, file.getName(), text).library();
  }

  /**
   * Reads a library and binds its definitions in the session's environment,
   * in the order that they occur in the file. If the file is not valid, no
   * definitions are bound.
   *
   * <p>The library is read from the directory given by
   * {@link Prop#DIRECTORY}.
   *
   * @return Number of definitions
   */
  public static int load(Session session, String name) {
    final File directory = Prop.DIRECTORY.fileValue(session.map);
    final List<Statement.Assign> assigns =
        read(session.typeSystem, directory, name);
    assigns.forEach(assign -> session.env.bind(assign.name, assign.term));
    return assigns.size();
  }

  /**
   * Writes the definitions in an environment to a library, replacing the
   * file if it exists.
   */
  public static void save(
      Environment env, File directory, String name, Date date) {
    final StringBuilder buf = new StringBuilder();
    buf.append("# saved on ").append(date).append('\n');
    for (Map.Entry<String, Term> entry : env.definitions()) {
      buf.append(entry.getKey())
          .append('=')
          .append(entry.getValue())
          .append(";\n");
    }
    try {
      Files.asCharSink(file(directory, name), UTF_8).write(buf);
    } catch (IOException e) {
      throw new LibraryException("Unable to save " + name + ".", name, e);
    }
  }
}

// End Library.java
