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


import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.wfst.semiring.Semiring;

/**
 * Immutable weighted string transducer: states {@code 0 .. n} on a single
 * path, state {@code i < n} having one arc to {@code i+1} and state
 * {@code n} being the only final state.  Stored as parallel label and
 * weight arrays rather than as states.
 *
 * <p>Useful as a compact, read-only encoding of a single input/output pair.
 * An automaton with no states (the empty language) is represented too.</p>
 *
 * @lucene.experimental
 */
public final class CompactStringFst<W> implements ExpandedFst<W> {

  /** Type tag of this kind. */
  public static final String TYPE = "compactstring";

  private final Semiring<W> semiring;
  private final int[] ilabels;
  private final int[] olabels;
  private final List<W> weights;
  private final W finalWeight;
  // false for the automaton without states
  private final boolean hasStates;
  private final SymbolTable isymbols;
  private final SymbolTable osymbols;
  private final long properties;

  /**
   * Builds the string {@code ilabels[i]:olabels[i]/weights[i]} followed by
   * {@code finalWeight}.  The label arrays and weight list must have the
   * same length; {@code finalWeight} must not be zero.
   */
  public CompactStringFst(Semiring<W> semiring, int[] ilabels, int[] olabels, List<W> weights, W finalWeight) {
    this(semiring, ilabels, olabels, weights, finalWeight, true, null, null);
  }

  /** The automaton without states, which accepts nothing. */
  public static <W> CompactStringFst<W> empty(Semiring<W> semiring) {
    return new CompactStringFst<>(semiring, new int[0], new int[0], Collections.emptyList(), semiring.zero(), false, null, null);
  }

  CompactStringFst(Semiring<W> semiring, int[] ilabels, int[] olabels, List<W> weights, W finalWeight,
                   boolean hasStates, SymbolTable isymbols, SymbolTable osymbols) {
    if (ilabels.length != olabels.length || ilabels.length != weights.size()) {
      throw new IllegalArgumentException("ilabels, olabels and weights must have the same length: "
          + ilabels.length + ", " + olabels.length + ", " + weights.size());
    }
    if (hasStates && semiring.isZero(finalWeight)) {
      throw new IllegalArgumentException("the last state must be final");
    }
    this.semiring = semiring;
    this.ilabels = ilabels.clone();
    this.olabels = olabels.clone();
    this.weights = Collections.unmodifiableList(new ArrayList<>(weights));
    this.finalWeight = Objects.requireNonNull(finalWeight);
    this.hasStates = hasStates;
    this.isymbols = isymbols == null ? null : isymbols.copy();
    this.osymbols = osymbols == null ? null : osymbols.copy();
    this.properties = FstProperties.EXPANDED
        | FstProperties.computeProperties(this, FstProperties.TRINARY_PROPERTIES);
  }

  /**
   * Copies a string automaton.
   *
   * @throws IllegalArgumentException if {@code fst} is not a string, i.e.
   *         does not have the {@link FstProperties#STRING} property
   */
  public static <W> CompactStringFst<W> fromFst(Fst<W> fst) {
    if (fst.properties(FstProperties.STRING, true) == 0) {
      throw new IllegalArgumentException("automaton is not a string: " + fst);
    }
    final Semiring<W> semiring = fst.semiring();
    final int start = fst.start();
    if (start == Fst.NO_STATE_ID) {
      return new CompactStringFst<>(semiring, new int[0], new int[0], Collections.emptyList(), semiring.zero(),
          false, fst.inputSymbols(), fst.outputSymbols());
    }
    int[] ilabels = new int[4];
    int[] olabels = new int[4];
    final List<W> weights = new ArrayList<>();
    int s = start;
    while (fst.numArcs(s) == 1) {
      final Arc<W> arc = fst.arcIterator(s).value();
      final int i = weights.size();
      if (i == ilabels.length) {
        ilabels = Arrays.copyOf(ilabels, i * 2);
        olabels = Arrays.copyOf(olabels, i * 2);
      }
      ilabels[i] = arc.ilabel;
      olabels[i] = arc.olabel;
      weights.add(arc.weight);
      s = arc.nextState;
    }
    final int n = weights.size();
    return new CompactStringFst<>(semiring, Arrays.copyOf(ilabels, n), Arrays.copyOf(olabels, n), weights,
        fst.finalWeight(s), true, fst.inputSymbols(), fst.outputSymbols());
  }

  /** Number of arcs on the path. */
  public int length() {
    return weights.size();
  }

  @Override
  public int start() {
    return hasStates ? 0 : NO_STATE_ID;
  }

  @Override
  public W finalWeight(int s) {
    checkState(s);
    return s == weights.size() ? finalWeight : semiring.zero();
  }

  @Override
  public int numStates() {
    return hasStates ? weights.size() + 1 : 0;
  }

  @Override
  public int numArcs(int s) {
    checkState(s);
    return s < weights.size() ? 1 : 0;
  }

  @Override
  public int numInputEpsilons(int s) {
    return numArcs(s) == 1 && ilabels[s] == Arc.EPSILON ? 1 : 0;
  }

  @Override
  public int numOutputEpsilons(int s) {
    return numArcs(s) == 1 && olabels[s] == Arc.EPSILON ? 1 : 0;
  }

  @Override
  @SuppressWarnings("unchecked")
  public ArcIterator<W> arcIterator(int s) {
    final Arc<W>[] arcs = (Arc<W>[]) new Arc[numArcs(s)];
    if (arcs.length == 1) {
      arcs[0] = new Arc<>(ilabels[s], olabels[s], weights.get(s), s + 1);
    }
    return new ArrayArcIterator<>(arcs, arcs.length);
  }

  @Override
  public StateIterator stateIterator() {
    return new DenseStateIterator(numStates());
  }

  @Override
  public long properties(long mask, boolean test) {
    return properties & mask;
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public Semiring<W> semiring() {
    return semiring;
  }

  @Override
  public SymbolTable inputSymbols() {
    return isymbols;
  }

  @Override
  public SymbolTable outputSymbols() {
    return osymbols;
  }

  /** Immutable, so every copy is this instance. */
  @Override
  public CompactStringFst<W> copy(boolean safe) {
    return this;
  }

  int ilabel(int i) {
    return ilabels[i];
  }

  int olabel(int i) {
    return olabels[i];
  }

  W weight(int i) {
    return weights.get(i);
  }

  W pathFinalWeight() {
    return finalWeight;
  }

  private void checkState(int s) {
    assert s >= 0 && s < numStates() : "s=" + s + " numStates=" + numStates();
  }

  @Override
  public String toString() {
    return "CompactStringFst(semiring=" + semiring.type() + ", length=" + (hasStates ? length() : -1) + ")";
  }
}
