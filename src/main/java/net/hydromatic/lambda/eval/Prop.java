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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.io.File;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property.
 *
 * @see Session#map
 */
public enum Prop {
  /**
   * Enum property "strategy" is the reduction strategy used to evaluate
   * terms. Default is "call-by-value".
   */
  STRATEGY("strategy", Strategy.class, Strategy.CALL_BY_VALUE),

  /**
   * Boolean property "showSteps" controls whether the shell prints every
   * intermediate term, or just the final one. Default is true.
   */
  SHOW_STEPS("showSteps", Boolean.class, true),

  /**
   * Boolean property "showAliases" controls whether the shell prints a
   * sub-term that is equivalent to a definition in the environment using the
   * name of that definition. Default is true.
   */
  SHOW_ALIASES("showAliases", Boolean.class, true),

  /**
   * Boolean property "checkTypes" controls whether the shell type-checks a
   * term before evaluating it, and refuses to evaluate a term that has no
   * type. Default is false.
   */
  CHECK_TYPES("checkTypes", Boolean.class, false),

  /**
   * Boolean property "requireClosed" controls whether the shell refuses to
   * evaluate a term that, after definitions have been expanded, still has
   * free variables. Default is false.
   */
  REQUIRE_CLOSED("requireClosed", Boolean.class, false),

  /**
   * Integer property "stepLimit" is the maximum number of steps that the
   * shell will take to evaluate a term; zero or negative means no limit.
   * Default is 0.
   */
  STEP_LIMIT("stepLimit", Integer.class, 0),

  /**
   * File property "directory" is the directory where the shell loads and
   * saves libraries. Default is the value of the "defs.path" system property,
   * or the current directory if that is not set.
   */
  DIRECTORY(
      "directory",
      File.class,
      new File(System.getProperty("defs.path", ".")));

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /**
   * Looks up a property by name. Throws if not found; never returns null.
   *
   * @throws IllegalArgumentException if there is no such property
   */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return this.<Boolean>typeValue(map.get(this));
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return this.<Integer>typeValue(map.get(this));
  }

  /** Returns the value of a file property. */
  public File fileValue(Map<Prop, Object> map) {
    checkType(File.class);
    return this.typeValue(map.get(this));
  }

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map, Class<E> type) {
    checkType(type);
    return this.typeValue(map.get(this));
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    return (T) (o == null ? defaultValue : o);
  }

  /**
   * Sets the value of a property from a string, converting it to the
   * property's type.
   *
   * <p>Booleans accept "true"/"false" and "on"/"off"; strategies accept
   * identifiers such as "call-by-name".
   *
   * @throws IllegalArgumentException if the value is not valid
   */
  public void setLenient(Map<Prop, Object> map, String value) {
    if (type == Boolean.class) {
      switch (value.toLowerCase(Locale.ROOT)) {
      case "true":
      case "on":
        set(map, true);
        return;
      case "false":
      case "off":
        set(map, false);
        return;
      default:
        throw new IllegalArgumentException("value for property "
            + camelName + " must be true or false");
      }
    } else if (type == Integer.class) {
      try {
        set(map, Integer.valueOf(value));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("value for property "
            + camelName + " must be an integer", e);
      }
    } else if (type == File.class) {
      set(map, new File(value));
    } else if (type == Strategy.class) {
      set(map, Strategy.of(value));
    } else {
      throw new AssertionError("unknown type " + type);
    }
  }

  /**
   * Sets the value of a property. Checks that its type is valid. A null value
   * restores the default.
   */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException("value for property " + camelName
            + " must have type " + type.getSimpleName());
      }
      map.put(this, value);
    }
  }

  /**
   * Removes the value of this property from a map, returning the previous
   * value or null.
   */
  public @Nullable Object remove(Map<Prop, Object> map) {
    return map.remove(this);
  }
}

// End Prop.java
