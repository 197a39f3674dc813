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


/**
 * The log semiring over floats: plus is {@code -log(e^-a + e^-b)}, times
 * is addition.  Sums the probabilities of alternative paths when weights
 * are negative log probabilities.
 *
 * @lucene.experimental
 */
public final class LogSemiring extends FloatSemiring {

  public static final LogSemiring INSTANCE = new LogSemiring();

  private LogSemiring() {
  }

  @Override
  public Float zero() {
    return POSITIVE_INFINITY;
  }

  @Override
  public Float one() {
    return ZERO_VALUE;
  }

  @Override
  public Float plus(Float w1, Float w2) {
    final float f1 = w1;
    final float f2 = w2;
    if (f1 == Float.POSITIVE_INFINITY) {
      return w2;
    } else if (f2 == Float.POSITIVE_INFINITY) {
      return w1;
    } else if (f1 > f2) {
      return (float) (f2 - Math.log1p(Math.exp(f2 - f1)));
    } else {
      return (float) (f1 - Math.log1p(Math.exp(f1 - f2)));
    }
  }

  @Override
  public Float times(Float w1, Float w2) {
    if (w1 == Float.POSITIVE_INFINITY || w2 == Float.POSITIVE_INFINITY) {
      return POSITIVE_INFINITY;
    }
    return w1 + w2;
  }

  @Override
  public int properties() {
    return SEMIRING | COMMUTATIVE;
  }

  @Override
  public String type() {
    return "log";
  }
}
