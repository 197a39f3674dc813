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


import java.io.IOException;
import java.io.StringReader;

import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.DataOutput;

/**
 * Represents the weight algebra of an automaton: a semiring with two
 * operations ({@link #plus}, {@link #times}) and their identities
 * ({@link #zero}, {@link #one}).  Implementations must satisfy
 * associativity of plus and times, distributivity of times over plus
 * and absorption of times by zero.
 *
 * <p>Weights are plain values compared with {@link Object#equals}; a
 * semiring never mutates the weights it is handed.</p>
 *
 * <p>Besides the algebra, a semiring knows how to write its weights in a
 * binary form ({@link #write}/{@link #read}) used when saving automata and
 * in a text form ({@link #print}/{@link #scan}) that composite semirings
 * nest through {@link CompositeWeightWriter} and {@link CompositeWeightReader}.</p>
 *
 * @lucene.experimental
 */
public abstract class Semiring<W> {

  /** Times distributes over plus on the left. */
  public static final int LEFT_SEMIRING = 0x01;

  /** Times distributes over plus on the right. */
  public static final int RIGHT_SEMIRING = 0x02;

  /** Both left and right distributive. */
  public static final int SEMIRING = LEFT_SEMIRING | RIGHT_SEMIRING;

  /** Times is commutative. */
  public static final int COMMUTATIVE = 0x04;

  /** plus(a, a) == a. */
  public static final int IDEMPOTENT = 0x08;

  /** plus(a, b) is always either a or b. */
  public static final int PATH = 0x10;

  /** Identity of {@link #plus}; also marks a non-final state. */
  public abstract W zero();

  /** Identity of {@link #times}. */
  public abstract W one();

  /** Combines alternative paths. */
  public abstract W plus(W w1, W w2);

  /** Combines consecutive path segments. */
  public abstract W times(W w1, W w2);

  /** Algebraic property flags, e.g. {@link #IDEMPOTENT} | {@link #PATH}. */
  public abstract int properties();

  /** Name recorded in serialized automata, must be stable across releases. */
  public abstract String type();

  public boolean isZero(W weight) {
    return zero().equals(weight);
  }

  public boolean isOne(W weight) {
    return one().equals(weight);
  }

  /** Returns false for values outside the carrier set (e.g. NaN). */
  public boolean isMember(W weight) {
    return weight != null;
  }

  public abstract void write(W weight, DataOutput out) throws IOException;

  public abstract W read(DataInput in) throws IOException;

  /** Prints the text form of the weight; a no-op if the output already failed. */
  public abstract void print(W weight, WeightTextOutput out);

  /**
   * Scans one weight from the input.  On malformed text the input is marked
   * as failed and null is returned; nothing is thrown.
   */
  public abstract W scan(WeightTextInput in);

  /** Text form of a weight, as written by {@link #print}. */
  public final String weightToString(W weight) {
    final StringBuilder sb = new StringBuilder();
    print(weight, new WeightTextOutput(sb));
    return sb.toString();
  }

  /**
   * Parses the text form of a weight.
   * @throws IllegalArgumentException if the text is not a valid weight
   */
  public final W parse(String text) {
    final WeightTextInput in = new WeightTextInput(new StringReader(text));
    final W weight = scan(in);
    int c;
    do {
      c = in.read();
    } while (WeightTextInput.isSpace(c));
    if (weight == null || c != WeightTextInput.EOF || in.checkError()) {
      throw new IllegalArgumentException("cannot parse \"" + text + "\" as a " + type() + " weight");
    }
    return weight;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + type() + ")";
  }
}
