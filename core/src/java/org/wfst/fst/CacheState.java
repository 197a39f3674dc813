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


import org.apache.lucene.util.ArrayUtil;

/**
 * Final weight and arcs of one state of a lazy automaton, filled in by
 * {@link CacheImpl#expand} the first time the state is visited.
 *
 * @lucene.internal
 */
public final class CacheState<W> {

  private final W finalWeight;
  private Arc<W>[] arcs;
  private int numArcs;
  private int numInputEpsilons;
  private int numOutputEpsilons;

  @SuppressWarnings("unchecked")
  CacheState(W finalWeight) {
    this.finalWeight = finalWeight;
    this.arcs = (Arc<W>[]) new Arc[0];
  }

  /** Appends an arc leaving this state. */
  public void addArc(Arc<W> arc) {
    arcs = ArrayUtil.grow(arcs, numArcs + 1);
    arcs[numArcs++] = arc;
    if (arc.ilabel == Arc.EPSILON) {
      numInputEpsilons++;
    }
    if (arc.olabel == Arc.EPSILON) {
      numOutputEpsilons++;
    }
  }

  W finalWeight() {
    return finalWeight;
  }

  int numArcs() {
    return numArcs;
  }

  int numInputEpsilons() {
    return numInputEpsilons;
  }

  int numOutputEpsilons() {
    return numOutputEpsilons;
  }

  ArcIterator<W> arcIterator() {
    return new ArrayArcIterator<>(arcs, numArcs);
  }
}
