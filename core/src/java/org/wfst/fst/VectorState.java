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

/** One state of a {@link VectorFstImpl}: final weight and arcs in insertion order. */
final class VectorState<W> {

  W finalWeight;
  Arc<W>[] arcs;
  int numArcs;
  int numInputEpsilons;
  int numOutputEpsilons;

  @SuppressWarnings("unchecked")
  VectorState(W finalWeight) {
    this.finalWeight = finalWeight;
    this.arcs = (Arc<W>[]) new Arc[0];
  }

  VectorState<W> copy() {
    final VectorState<W> copy = new VectorState<>(finalWeight);
    copy.arcs = ArrayUtil.copyOfSubArray(arcs, 0, numArcs);
    copy.numArcs = numArcs;
    copy.numInputEpsilons = numInputEpsilons;
    copy.numOutputEpsilons = numOutputEpsilons;
    return copy;
  }

  void reserveArcs(int n) {
    arcs = ArrayUtil.grow(arcs, n);
  }

  void addArc(Arc<W> arc) {
    arcs = ArrayUtil.grow(arcs, numArcs + 1);
    arcs[numArcs++] = arc;
    countEpsilons(arc, 1);
  }

  void setArc(int pos, Arc<W> arc) {
    assert pos < numArcs : "pos=" + pos + " numArcs=" + numArcs;
    countEpsilons(arcs[pos], -1);
    arcs[pos] = arc;
    countEpsilons(arc, 1);
  }

  /** Removes the first {@code n} arcs. */
  void deleteArcs(int n) {
    assert n <= numArcs : "n=" + n + " numArcs=" + numArcs;
    for (int i = 0; i < n; i++) {
      countEpsilons(arcs[i], -1);
    }
    System.arraycopy(arcs, n, arcs, 0, numArcs - n);
    for (int i = numArcs - n; i < numArcs; i++) {
      arcs[i] = null;
    }
    numArcs -= n;
  }

  void deleteArcs() {
    for (int i = 0; i < numArcs; i++) {
      arcs[i] = null;
    }
    numArcs = 0;
    numInputEpsilons = 0;
    numOutputEpsilons = 0;
  }

  /** Keeps only the arcs whose destination maps to a live id, renumbering them. */
  void remapArcs(int[] newId) {
    int upto = 0;
    numInputEpsilons = 0;
    numOutputEpsilons = 0;
    for (int i = 0; i < numArcs; i++) {
      final Arc<W> arc = arcs[i];
      final int next = newId[arc.nextState];
      if (next == Fst.NO_STATE_ID) {
        continue;
      }
      arcs[upto] = next == arc.nextState ? arc : arc.withNextState(next);
      countEpsilons(arcs[upto], 1);
      upto++;
    }
    for (int i = upto; i < numArcs; i++) {
      arcs[i] = null;
    }
    numArcs = upto;
  }

  private void countEpsilons(Arc<W> arc, int delta) {
    if (arc.ilabel == Arc.EPSILON) {
      numInputEpsilons += delta;
    }
    if (arc.olabel == Arc.EPSILON) {
      numOutputEpsilons += delta;
    }
  }
}
