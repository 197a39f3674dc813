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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.DataOutput;

/**
 * The n-th power of a semiring: weights are {@link TupleWeight}s of
 * length n and every operation is applied component-wise.  The text form
 * is {@code w1<sep>w2<sep>...<sep>wn}, enclosed in parentheses when the
 * {@link CompositeWeightConfig} has them.
 *
 * @lucene.experimental
 */
public final class PowerSemiring<W> extends Semiring<TupleWeight<W>> {

  private final Semiring<W> component;
  private final int size;
  private final CompositeWeightConfig config;
  private final TupleWeight<W> zero;
  private final TupleWeight<W> one;

  public PowerSemiring(Semiring<W> component, int size) {
    this(component, size, CompositeWeightConfig.getDefault());
  }

  public PowerSemiring(Semiring<W> component, int size, CompositeWeightConfig config) {
    if (size < 1) {
      throw new IllegalArgumentException("size must be >= 1; got " + size);
    }
    this.component = component;
    this.size = size;
    this.config = config;
    this.zero = new TupleWeight<>(Collections.nCopies(size, component.zero()));
    this.one = new TupleWeight<>(Collections.nCopies(size, component.one()));
  }

  public int size() {
    return size;
  }

  @Override
  public TupleWeight<W> zero() {
    return zero;
  }

  @Override
  public TupleWeight<W> one() {
    return one;
  }

  @Override
  public TupleWeight<W> plus(TupleWeight<W> w1, TupleWeight<W> w2) {
    List<W> values = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      values.add(component.plus(w1.get(i), w2.get(i)));
    }
    return new TupleWeight<>(values);
  }

  @Override
  public TupleWeight<W> times(TupleWeight<W> w1, TupleWeight<W> w2) {
    List<W> values = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      values.add(component.times(w1.get(i), w2.get(i)));
    }
    return new TupleWeight<>(values);
  }

  @Override
  public int properties() {
    return component.properties() & (SEMIRING | COMMUTATIVE | IDEMPOTENT);
  }

  @Override
  public String type() {
    return component.type() + "^" + size;
  }

  @Override
  public boolean isMember(TupleWeight<W> weight) {
    if (weight == null || weight.size() != size) {
      return false;
    }
    for (W value : weight.values()) {
      if (component.isMember(value) == false) {
        return false;
      }
    }
    return true;
  }

  @Override
  public void write(TupleWeight<W> weight, DataOutput out) throws IOException {
    for (int i = 0; i < size; i++) {
      component.write(weight.get(i), out);
    }
  }

  @Override
  public TupleWeight<W> read(DataInput in) throws IOException {
    List<W> values = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      values.add(component.read(in));
    }
    return new TupleWeight<>(values);
  }

  @Override
  public void print(TupleWeight<W> weight, WeightTextOutput out) {
    CompositeWeightWriter writer = new CompositeWeightWriter(out, config);
    writer.writeBegin();
    for (W value : weight.values()) {
      writer.writeElement(component, value);
    }
    writer.writeEnd();
  }

  @Override
  public TupleWeight<W> scan(WeightTextInput in) {
    CompositeWeightReader reader = new CompositeWeightReader(in, config);
    reader.readBegin();
    List<W> values = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      W value = reader.readElement(component, i == size - 1);
      if (value == null) {
        return null;
      }
      values.add(value);
    }
    reader.readEnd();
    if (in.checkError()) {
      return null;
    }
    return new TupleWeight<>(values);
  }
}
