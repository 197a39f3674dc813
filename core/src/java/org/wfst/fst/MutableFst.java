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


import org.apache.lucene.store.DataInput;
import org.wfst.semiring.Semiring;

/**
 * An expanded automaton that can be changed in place.
 *
 * <p>Implementations may share their storage with other handles (see
 * {@link #copy(boolean)}); every mutating method first makes sure the
 * storage is private, so a change through one handle is never visible
 * through another.</p>
 *
 * @lucene.experimental
 */
public interface MutableFst<W> extends ExpandedFst<W> {

  /** Sets the start state; {@code s} must exist (or be {@link #NO_STATE_ID}). */
  void setStart(int s);

  /** Makes {@code s} final with weight one. */
  default void setFinal(int s) {
    setFinal(s, semiring().one());
  }

  /** Sets the final weight of {@code s}; zero makes it non-final. */
  void setFinal(int s, W weight);

  /**
   * Merges the bits of {@code props} selected by {@code mask} into the
   * cached properties.  If that changes an
   * {@link FstProperties#EXTRINSIC_PROPERTIES extrinsic} bit, shared
   * storage is privatized first.
   */
  void setProperties(long props, long mask);

  /** Appends a state; returns its id, which equals the previous number of states. */
  int addState();

  /** Appends {@code n} states. */
  default void addStates(int n) {
    for (int i = 0; i < n; i++) {
      addState();
    }
  }

  /** Appends an arc to {@code s}. */
  void addArc(int s, Arc<W> arc);

  /**
   * Deletes the given states and every arc into them.  Survivors keep
   * their relative order and are renumbered {@code 0 .. n-1}.  If the start
   * state is deleted the start becomes {@link #NO_STATE_ID}.
   */
  void deleteStates(int[] states);

  /** Deletes every state.  Symbol tables are kept. */
  void deleteStates();

  /** Deletes the first {@code n} arcs leaving {@code s}. */
  void deleteArcs(int s, int n);

  /** Deletes every arc leaving {@code s}. */
  void deleteArcs(int s);

  /** Capacity hint before adding {@code n} states; never required. */
  default void reserveStates(int n) {
  }

  /** Capacity hint before adding {@code n} arcs to {@code s}; never required. */
  default void reserveArcs(int s, int n) {
  }

  /** Input symbol table, writable; privatizes shared storage. */
  SymbolTable mutableInputSymbols();

  /** Output symbol table, writable; privatizes shared storage. */
  SymbolTable mutableOutputSymbols();

  /** Sets a deep copy of {@code symbols} as input table; null removes it. */
  void setInputSymbols(SymbolTable symbols);

  /** Sets a deep copy of {@code symbols} as output table; null removes it. */
  void setOutputSymbols(SymbolTable symbols);

  /**
   * Returns a cursor that can replace the arcs of {@code s}.  Shared storage
   * is privatized when the cursor is created, and again on a write if a
   * cheap copy was taken in between.
   */
  MutableArcIterator<W> mutableArcIterator(int s);

  @Override
  MutableFst<W> copy(boolean safe);

  /**
   * Reads an automaton whose header claims it supports mutation.  Returns
   * null, after logging why, when the header cannot be parsed, the
   * {@link FstProperties#MUTABLE} bit is not set, the type tag is unknown
   * or the body is malformed.
   */
  static <W> MutableFst<W> read(DataInput in, FstReadOptions opts, Semiring<W> semiring) {
    return (MutableFst<W>) FstReader.read(in, opts, semiring, true);
  }

  /**
   * Reads a mutable automaton from the named binary file, or from standard
   * input when {@code source} is null or empty.  With {@code convert} an
   * automaton of an immutable kind is read and converted to the kind
   * registered as {@code convertType}.
   */
  static <W> MutableFst<W> read(String source, Semiring<W> semiring, boolean convert, String convertType) {
    return (MutableFst<W>) FstReader.read(source, semiring, true, convert, convertType);
  }

  /** Same as {@code read(source, semiring, false, null)}. */
  static <W> MutableFst<W> read(String source, Semiring<W> semiring) {
    return read(source, semiring, false, null);
  }
}
