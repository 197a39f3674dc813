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
 * Shared binary and text handling for semirings whose weights are
 * {@code float} values.
 *
 * @lucene.experimental
 */
public abstract class FloatSemiring extends Semiring<Float> {

  protected static final Float POSITIVE_INFINITY = Float.POSITIVE_INFINITY;
  protected static final Float ZERO_VALUE = 0f;

  @Override
  public boolean isMember(Float weight) {
    return weight != null && Float.isNaN(weight) == false && weight != Float.NEGATIVE_INFINITY;
  }

  // 按原始值比较 -0.0f 与 0.0f 视为相同
  @Override
  public boolean isZero(Float weight) {
    return weight != null && weight.floatValue() == zero().floatValue();
  }

  @Override
  public boolean isOne(Float weight) {
    return weight != null && weight.floatValue() == one().floatValue();
  }

  @Override
  public void write(Float weight, DataOutput out) throws IOException {
    out.writeInt(Float.floatToIntBits(weight));
  }

  @Override
  public Float read(DataInput in) throws IOException {
    return Float.intBitsToFloat(in.readInt());
  }

  @Override
  public void print(Float weight, WeightTextOutput out) {
    out.write(Float.toString(weight));
  }

  @Override
  public Float scan(WeightTextInput in) {
    int c;
    do {
      c = in.read();
    } while (WeightTextInput.isSpace(c));
    final StringBuilder token = new StringBuilder();
    while (c != WeightTextInput.EOF && WeightTextInput.isSpace(c) == false) {
      token.append((char) c);
      c = in.read();
    }
    if (token.length() == 0) {
      in.setError();
      return null;
    }
    try {
      return Float.parseFloat(token.toString());
    } catch (NumberFormatException e) {
      in.setError();
      return null;
    }
  }
}
