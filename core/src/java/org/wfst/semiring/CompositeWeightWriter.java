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


import org.apache.lucene.util.InfoStream;

/**
 * Writes the text form of a composite weight:
 * <pre>
 *   writer.writeBegin();
 *   writer.writeElement(first, w1);
 *   writer.writeElement(second, w2);
 *   writer.writeEnd();
 * </pre>
 * produces {@code w1,w2}, or {@code (w1,w2)} when parentheses are
 * configured.  Each element prints its own text form, so nested
 * composites recurse through their own writers on the same output.
 *
 * @lucene.experimental
 */
public final class CompositeWeightWriter {

  static final String INFO_COMPONENT = "CW";

  private final WeightTextOutput out;
  private final CompositeWeightConfig config;
  // 已写入的元素个数 第一个元素前不写分隔符
  private int elements;

  public CompositeWeightWriter(WeightTextOutput out) {
    this(out, CompositeWeightConfig.getDefault());
  }

  public CompositeWeightWriter(WeightTextOutput out, CompositeWeightConfig config) {
    this.out = out;
    this.config = config;
    if (config.isValid() == false) {
      InfoStream infoStream = InfoStream.getDefault();
      if (infoStream.isEnabled(INFO_COMPONENT)) {
        infoStream.message(INFO_COMPONENT, "CompositeWeightWriter: " + config.problem());
      }
      out.setError();
    }
  }

  /** Emits the open parenthesis, if configured. */
  public void writeBegin() {
    if (config.hasParentheses()) {
      out.write(config.openParen());
    }
  }

  /** Emits the separator (except before the first element) then the element. */
  public <T> void writeElement(Semiring<T> semiring, T weight) {
    if (elements > 0) {
      out.write(config.separator());
    }
    semiring.print(weight, out);
    elements++;
  }

  /** Emits the close parenthesis, if configured. */
  public void writeEnd() {
    if (config.hasParentheses()) {
      out.write(config.closeParen());
    }
  }
}
