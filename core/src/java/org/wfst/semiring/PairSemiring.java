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

import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.DataOutput;

/**
 * The product of two semirings: weights are {@link Pair}s and every
 * operation is applied component-wise.  The text form is
 * {@code first<sep>second}, enclosed in parentheses when the
 * {@link CompositeWeightConfig} has them.
 *
 * @lucene.experimental
 */
public final class PairSemiring<A, B> extends Semiring<Pair<A, B>> {

  private final Semiring<A> first;
  private final Semiring<B> second;
  private final CompositeWeightConfig config;
  private final Pair<A, B> zero;
  private final Pair<A, B> one;

  public PairSemiring(Semiring<A> first, Semiring<B> second) {
    this(first, second, CompositeWeightConfig.getDefault());
  }

  public PairSemiring(Semiring<A> first, Semiring<B> second, CompositeWeightConfig config) {
    this.first = first;
    this.second = second;
    this.config = config;
    this.zero = new Pair<>(first.zero(), second.zero());
    this.one = new Pair<>(first.one(), second.one());
  }

  public Semiring<A> first() {
    return first;
  }

  public Semiring<B> second() {
    return second;
  }

  public CompositeWeightConfig config() {
    return config;
  }

  @Override
  public Pair<A, B> zero() {
    return zero;
  }

  @Override
  public Pair<A, B> one() {
    return one;
  }

  @Override
  public Pair<A, B> plus(Pair<A, B> w1, Pair<A, B> w2) {
    return new Pair<>(first.plus(w1.first, w2.first), second.plus(w1.second, w2.second));
  }

  @Override
  public Pair<A, B> times(Pair<A, B> w1, Pair<A, B> w2) {
    return new Pair<>(first.times(w1.first, w2.first), second.times(w1.second, w2.second));
  }

  @Override
  public int properties() {
    // PATH is lost: min of each component may come from different pairs
    return first.properties() & second.properties() & (SEMIRING | COMMUTATIVE | IDEMPOTENT);
  }

  @Override
  public String type() {
    return first.type() + "X" + second.type();
  }

  @Override
  public boolean isMember(Pair<A, B> weight) {
    return weight != null && first.isMember(weight.first) && second.isMember(weight.second);
  }

  @Override
  public void write(Pair<A, B> weight, DataOutput out) throws IOException {
    first.write(weight.first, out);
    second.write(weight.second, out);
  }

  @Override
  public Pair<A, B> read(DataInput in) throws IOException {
    A a = first.read(in);
    B b = second.read(in);
    return new Pair<>(a, b);
  }

  @Override
  public void print(Pair<A, B> weight, WeightTextOutput out) {
    CompositeWeightWriter writer = new CompositeWeightWriter(out, config);
    writer.writeBegin();
    writer.writeElement(first, weight.first);
    writer.writeElement(second, weight.second);
    writer.writeEnd();
  }

  @Override
  public Pair<A, B> scan(WeightTextInput in) {
    CompositeWeightReader reader = new CompositeWeightReader(in, config);
    reader.readBegin();
    A a = reader.readElement(first, false);
    B b = reader.readElement(second, true);
    reader.readEnd();
    if (a == null || b == null || in.checkError()) {
      return null;
    }
    return new Pair<>(a, b);
  }
}
