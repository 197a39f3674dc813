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


import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An immutable fixed-length tuple of weights, the values of a
 * {@link PowerSemiring}.
 *
 * @lucene.experimental
 */
public final class TupleWeight<W> {

  private final List<W> values;

  @SafeVarargs
  public TupleWeight(W... values) {
    this(Arrays.asList(values.clone()));
  }

  public TupleWeight(List<W> values) {
    for (W value : values) {
      if (value == null) {
        throw new IllegalArgumentException("tuple components must not be null");
      }
    }
    this.values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  public int size() {
    return values.size();
  }

  public W get(int index) {
    return values.get(index);
  }

  public List<W> values() {
    return values;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof TupleWeight && values.equals(((TupleWeight<?>) other).values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "TupleWeight" + values;
  }
}
