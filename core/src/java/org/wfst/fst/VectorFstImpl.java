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
import org.wfst.semiring.Semiring;

/**
 * Dense in-memory store: an array of {@link VectorState}s indexed by state
 * id.  Mutators update the cached properties incrementally.
 *
 * @lucene.internal
 */
public final class VectorFstImpl<W> extends MutableFstImpl<W> {

  private VectorState<W>[] states;
  private int numStates;
  private int start = Fst.NO_STATE_ID;

  @SuppressWarnings("unchecked")
  public VectorFstImpl(Semiring<W> semiring) {
    super(semiring, VectorFst.TYPE);
    states = (VectorState<W>[]) new VectorState[0];
    setProperties(FstProperties.NULL_PROPERTIES | FstProperties.STATIC_PROPERTIES);
  }

  private int appendState(W finalWeight) {
    states = ArrayUtil.grow(states, numStates + 1);
    states[numStates] = new VectorState<>(finalWeight);
    return numStates++;
  }

  @Override
  public int start() {
    return start;
  }

  @Override
  public W finalWeight(int s) {
    return states[s].finalWeight;
  }

  @Override
  public int numStates() {
    return numStates;
  }

  @Override
  public int numArcs(int s) {
    return states[s].numArcs;
  }

  @Override
  public int numInputEpsilons(int s) {
    return states[s].numInputEpsilons;
  }

  @Override
  public int numOutputEpsilons(int s) {
    return states[s].numOutputEpsilons;
  }

  @Override
  public ArcIterator<W> arcIterator(int s) {
    final VectorState<W> state = states[s];
    return new ArrayArcIterator<>(state.arcs, state.numArcs);
  }

  @Override
  public Arc<W> arc(int s, int pos) {
    final VectorState<W> state = states[s];
    assert pos < state.numArcs : "pos=" + pos + " numArcs=" + state.numArcs;
    return state.arcs[pos];
  }

  @Override
  public void setStart(int s) {
    assert s == Fst.NO_STATE_ID || s < numStates : "s=" + s + " numStates=" + numStates;
    start = s;
    setProperties(FstProperties.setStartProperties(properties()));
  }

  @Override
  public void setFinal(int s, W weight) {
    final VectorState<W> state = states[s];
    final W old = state.finalWeight;
    state.finalWeight = weight;
    setProperties(FstProperties.setFinalProperties(properties(), old, weight, semiring));
  }

  @Override
  public int addState() {
    final int s = appendState(semiring.zero());
    setProperties(FstProperties.addStateProperties(properties()));
    return s;
  }

  @Override
  public void addArc(int s, Arc<W> arc) {
    final VectorState<W> state = states[s];
    final Arc<W> prev = state.numArcs == 0 ? null : state.arcs[state.numArcs - 1];
    state.addArc(arc);
    setProperties(FstProperties.addArcProperties(properties(), s, arc, prev, semiring));
  }

  @Override
  public void setArc(int s, int pos, Arc<W> arc) {
    final VectorState<W> state = states[s];
    final Arc<W> old = state.arcs[pos];
    state.setArc(pos, arc);
    setProperties(FstProperties.setArcProperties(properties(), old, arc, semiring));
  }

  @Override
  public void deleteStates(int[] dstates) {
    final int[] newId = new int[numStates];
    for (int s : dstates) {
      newId[s] = Fst.NO_STATE_ID;
    }
    int upto = 0;
    for (int s = 0; s < numStates; s++) {
      if (newId[s] != Fst.NO_STATE_ID) {
        newId[s] = upto;
        states[upto++] = states[s];
      }
    }
    for (int s = upto; s < numStates; s++) {
      states[s] = null;
    }
    numStates = upto;
    for (int s = 0; s < numStates; s++) {
      states[s].remapArcs(newId);
    }
    if (start != Fst.NO_STATE_ID) {
      start = newId[start];
    }
    setProperties(FstProperties.deleteStatesProperties(properties()));
  }

  @Override
  public void deleteStates() {
    for (int s = 0; s < numStates; s++) {
      states[s] = null;
    }
    numStates = 0;
    start = Fst.NO_STATE_ID;
    setProperties(FstProperties.deleteAllStatesProperties(properties(), FstProperties.STATIC_PROPERTIES));
  }

  @Override
  public void deleteArcs(int s, int n) {
    states[s].deleteArcs(n);
    setProperties(FstProperties.deleteArcsProperties(properties()));
  }

  @Override
  public void deleteArcs(int s) {
    states[s].deleteArcs();
    setProperties(FstProperties.deleteArcsProperties(properties()));
  }

  @Override
  public void reserveStates(int n) {
    states = ArrayUtil.grow(states, numStates + n);
  }

  @Override
  public void reserveArcs(int s, int n) {
    states[s].reserveArcs(states[s].numArcs + n);
  }

  @Override
  public VectorFstImpl<W> copy() {
    final VectorFstImpl<W> copy = new VectorFstImpl<>(semiring);
    copy.states = ArrayUtil.grow(copy.states, numStates);
    for (int s = 0; s < numStates; s++) {
      copy.states[s] = states[s].copy();
    }
    copy.numStates = numStates;
    copy.start = start;
    copy.isymbols = isymbols == null ? null : isymbols.copy();
    copy.osymbols = osymbols == null ? null : osymbols.copy();
    copy.setProperties(properties());
    return copy;
  }

  @Override
  public VectorFstImpl<W> emptyCopy() {
    final VectorFstImpl<W> copy = new VectorFstImpl<>(semiring);
    copy.isymbols = isymbols == null ? null : isymbols.copy();
    copy.osymbols = osymbols == null ? null : osymbols.copy();
    copy.setProperties(FstProperties.deleteAllStatesProperties(properties(), FstProperties.STATIC_PROPERTIES));
    return copy;
  }
}
