/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.wfst.semiring;


import java.util.Objects;

/**
 * Separator and optional parentheses used to print and parse composite
 * weights (pairs, tuples, and composites of those).
 *
 * <p>The process-wide default is resolved once from the system properties
 * {@value #SEPARATOR_SYSPROP} (default {@code ","}) and
 * {@value #PARENTHESES_SYSPROP} (default empty, i.e. no parentheses).
 * Explicit configurations built with {@link #of} or {@link #fromStrings}
 * override it per semiring.</p>
 *
 * <p>An invalid configuration is not rejected: it is recorded
 * ({@link #isValid()}, {@link #problem()}) and every
 * {@link CompositeWeightWriter} or {@link CompositeWeightReader} built on it
 * fails its stream up front.</p>
 *
 * <p><b>NOTE</b>: without parentheses, composites of composites cannot be
 * parsed back unambiguously; configure parentheses if you nest.</p>
 *
 * @lucene.experimental
 */
public final class CompositeWeightConfig {

  /** System property holding the default separator; must be a single character. */
  public static final String SEPARATOR_SYSPROP = "wfst.weight.separator";

  /** System property holding the default parentheses; empty or exactly two characters. */
  public static final String PARENTHESES_SYSPROP = "wfst.weight.parentheses";

  /** Marks an absent separator or parenthesis. */
  public static final char NONE = 0;

  private static final class Holder {
    static final CompositeWeightConfig DEFAULT;

    static {
      String separator = ",";
      String parentheses = "";
      try {
        separator = System.getProperty(SEPARATOR_SYSPROP, separator);
        parentheses = System.getProperty(PARENTHESES_SYSPROP, parentheses);
      } catch (SecurityException ignored) {
      }
      DEFAULT = fromStrings(separator, parentheses);
    }
  }

  private final char separator;
  private final char openParen;
  private final char closeParen;
  // null when valid
  private final String problem;

  private CompositeWeightConfig(char separator, char openParen, char closeParen, String problem) {
    this.separator = separator;
    this.openParen = openParen;
    this.closeParen = closeParen;
    this.problem = problem;
  }

  /** The configuration resolved from the system properties at first use. */
  public static CompositeWeightConfig getDefault() {
    return Holder.DEFAULT;
  }

  /** Separator only, no parentheses. */
  public static CompositeWeightConfig of(char separator) {
    return of(separator, NONE, NONE);
  }

  /**
   * Separator plus parentheses; pass {@link #NONE} for both parentheses to
   * disable them.  Giving only one of the two is invalid.
   */
  public static CompositeWeightConfig of(char separator, char openParen, char closeParen) {
    String problem = null;
    if (separator == NONE) {
      problem = "separator is missing";
    } else if ((openParen == NONE || closeParen == NONE) && openParen != closeParen) {
      problem = "invalid configuration of weight parentheses: " + (int) openParen + " " + (int) closeParen;
    }
    return new CompositeWeightConfig(separator, openParen, closeParen, problem);
  }

  /**
   * Builds a configuration from the string form used by the system
   * properties: the separator must have exactly one character, the
   * parentheses either none or exactly two.
   */
  public static CompositeWeightConfig fromStrings(String separator, String parentheses) {
    Objects.requireNonNull(separator, "separator");
    Objects.requireNonNull(parentheses, "parentheses");
    final char sep = separator.isEmpty() ? NONE : separator.charAt(0);
    final char open = parentheses.isEmpty() ? NONE : parentheses.charAt(0);
    final char close = parentheses.length() < 2 ? NONE : parentheses.charAt(1);
    CompositeWeightConfig config = of(sep, open, close);
    if (separator.length() != 1) {
      config = new CompositeWeightConfig(sep, open, close, "separator \"" + separator + "\" must be a single character");
    } else if (parentheses.isEmpty() == false && parentheses.length() != 2) {
      config = new CompositeWeightConfig(sep, open, close, "parentheses \"" + parentheses + "\" must have size 0 or 2");
    }
    return config;
  }

  public char separator() {
    return separator;
  }

  public char openParen() {
    return openParen;
  }

  public char closeParen() {
    return closeParen;
  }

  public boolean hasParentheses() {
    return openParen != NONE;
  }

  public boolean isValid() {
    return problem == null;
  }

  /** Why this configuration is invalid, or null. */
  public String problem() {
    return problem;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other == null || getClass() != other.getClass()) {
      return false;
    }
    CompositeWeightConfig that = (CompositeWeightConfig) other;
    return separator == that.separator && openParen == that.openParen && closeParen == that.closeParen
        && Objects.equals(problem, that.problem);
  }

  @Override
  public int hashCode() {
    return Objects.hash(separator, openParen, closeParen, problem);
  }

  @Override
  public String toString() {
    return "CompositeWeightConfig(separator='" + separator + "'"
        + (hasParentheses() ? ",parentheses='" + openParen + closeParen + "'" : "")
        + (problem == null ? "" : ",problem=" + problem) + ")";
  }
}
