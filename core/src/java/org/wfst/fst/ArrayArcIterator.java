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
 * {@link ArcIterator} over the first {@code numArcs} entries of an arc
 * array.  The array is read in place, not copied.
 *
 * @lucene.internal
 */
public class ArrayArcIterator<W> implements ArcIterator<W> {

  protected final Arc<W>[] arcs;
  protected final int numArcs;
  protected int pos;

  public ArrayArcIterator(Arc<W>[] arcs, int numArcs) {
    this.arcs = arcs;
    this.numArcs = numArcs;
  }

  @Override
  public boolean done() {
    return pos >= numArcs;
  }

  @Override
  public Arc<W> value() {
    assert pos < numArcs : "pos=" + pos + " numArcs=" + numArcs;
    return arcs[pos];
  }

  @Override
  public void next() {
    ++pos;
  }

  @Override
  public int position() {
    return pos;
  }

  @Override
  public void reset() {
    pos = 0;
  }

  @Override
  public void seek(int position) {
    pos = position;
  }
}
