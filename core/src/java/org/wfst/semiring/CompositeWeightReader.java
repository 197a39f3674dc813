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


import java.io.StringReader;

import org.apache.lucene.util.InfoStream;

/**
 * Parses the text form written by {@link CompositeWeightWriter}:
 * <pre>
 *   reader.readBegin();
 *   T1 w1 = reader.readElement(first, false);
 *   T2 w2 = reader.readElement(second, true);
 *   reader.readEnd();
 *   if (in.checkError()) ... // malformed
 * </pre>
 * Nothing is thrown on malformed text: the input is marked failed and the
 * remaining calls become no-ops returning null.
 *
 * @lucene.experimental
 */
public final class CompositeWeightReader {

  private final WeightTextInput in;
  private final CompositeWeightConfig config;
  // lookahead character
  private int c = WeightTextInput.EOF;
  // 括号嵌套深度 readBegin 消费左括号后为1
  private int depth;

  public CompositeWeightReader(WeightTextInput in) {
    this(in, CompositeWeightConfig.getDefault());
  }

  public CompositeWeightReader(WeightTextInput in, CompositeWeightConfig config) {
    this.in = in;
    this.config = config;
    if (config.isValid() == false) {
      fail(config.problem());
    }
  }

  /** Skips leading whitespace and consumes the open parenthesis, if configured. */
  public void readBegin() {
    do {
      c = in.read();
    } while (WeightTextInput.isSpace(c));
    if (config.hasParentheses()) {
      if (c != config.openParen()) {
        fail("open paren missing: parentheses configured correctly?");
        return;
      }
      ++depth;
      c = in.read();
    }
  }

  /**
   * Reads one element and skips the separator or close parenthesis
   * following it.  Pass {@code last == true} for the final element: the
   * separator is then not a delimiter.
   *
   * @return the element, or null if the input failed
   */
  public <T> T readElement(Semiring<T> semiring, boolean last) {
    if (in.checkError()) {
      return null;
    }
    final boolean hasParens = config.hasParentheses();
    final StringBuilder element = new StringBuilder();
    while (c != WeightTextInput.EOF && WeightTextInput.isSpace(c) == false
        && (c != config.separator() || depth > 1 || last)
        && (hasParens == false || c != config.closeParen() || depth != 1)) {
      element.append((char) c);
      // parentheses met before the separator must be matched
      if (hasParens && c == config.openParen()) {
        ++depth;
      } else if (hasParens && c == config.closeParen()) {
        if (depth == 0) {
          fail("unmatched close paren: parentheses configured correctly?");
          return null;
        }
        --depth;
      }
      c = in.read();
    }
    if (element.length() == 0) {
      fail("empty element: parentheses configured correctly?");
      return null;
    }
    final WeightTextInput elementIn = new WeightTextInput(new StringReader(element.toString()));
    final T weight = semiring.scan(elementIn);
    if (weight == null || elementIn.checkError() || elementIn.read() != WeightTextInput.EOF) {
      fail("cannot parse element \"" + element + "\" as a " + semiring.type() + " weight");
      return null;
    }
    // skips separator or close paren
    if (c != WeightTextInput.EOF && WeightTextInput.isSpace(c) == false) {
      if (hasParens && c == config.closeParen()) {
        --depth;
      }
      c = in.read();
    }
    return weight;
  }

  /** Rejects trailing garbage and, with parentheses, a missing close paren. */
  public void readEnd() {
    if (in.checkError()) {
      return;
    }
    if (c != WeightTextInput.EOF && WeightTextInput.isSpace(c) == false) {
      fail("excess character: '" + (char) c + "': parentheses configured correctly?");
    } else if (depth != 0) {
      fail("close paren missing: parentheses configured correctly?");
    }
  }

  private void fail(String message) {
    InfoStream infoStream = InfoStream.getDefault();
    if (infoStream.isEnabled(CompositeWeightWriter.INFO_COMPONENT)) {
      infoStream.message(CompositeWeightWriter.INFO_COMPONENT, "CompositeWeightReader: " + message);
    }
    in.setError();
  }
}
