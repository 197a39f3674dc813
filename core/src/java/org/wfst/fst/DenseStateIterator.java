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
package org.wfst.fst;


/**
 * Visits {@code 0..numStates-1}.
 *
 * @lucene.internal
 */
final class DenseStateIterator implements StateIterator {

  private final int numStates;
  private int s;

  DenseStateIterator(int numStates) {
    this.numStates = numStates;
  }

  @Override
  public boolean done() {
    return s >= numStates;
  }

  @Override
  public int value() {
    return s;
  }

  @Override
  public void next() {
    ++s;
  }

  @Override
  public void reset() {
    s = 0;
  }
}
