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


import java.io.IOException;

import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.DataOutput;
import org.wfst.semiring.Semiring;

/**
 * Read-only view of a weighted finite-state transducer.
 *
 * <p>States are non-negative ints; {@link #NO_STATE_ID} stands for "no
 * state".  A state is final when its {@link #finalWeight} is not the
 * semiring's zero.  Arcs are visited with {@link #arcIterator}.</p>
 *
 * <p>Nothing here validates state ids: querying a state that does not
 * exist is a caller bug and fails with an {@link ArrayIndexOutOfBoundsException}
 * or an assertion error.</p>
 *
 * @lucene.experimental
 */
public interface Fst<W> {

  /** "No state", e.g. the start of an automaton without states. */
  int NO_STATE_ID = -1;

  /** {@link org.apache.lucene.util.InfoStream} component for diagnostics. */
  String INFO_COMPONENT = "FST";

  /** The start state, or {@link #NO_STATE_ID}. */
  int start();

  /** Final weight of {@code s}; zero when {@code s} is not final. */
  W finalWeight(int s);

  int numArcs(int s);

  /** Number of arcs leaving {@code s} with an epsilon input label. */
  int numInputEpsilons(int s);

  /** Number of arcs leaving {@code s} with an epsilon output label. */
  int numOutputEpsilons(int s);

  ArcIterator<W> arcIterator(int s);

  StateIterator stateIterator();

  /**
   * Returns the property bits in {@code mask}.  When {@code test} is false
   * only the cached bits are returned, so some properties may come back
   * unknown; when true, unknown properties in the mask are computed (and
   * cached where the automaton caches them).
   *
   * @see FstProperties
   */
  long properties(long mask, boolean test);

  /** Type tag under which this automaton kind is serialized. */
  String type();

  Semiring<W> semiring();

  /** The input symbol table, or null.  Borrowed: do not modify it. */
  SymbolTable inputSymbols();

  /** The output symbol table, or null.  Borrowed: do not modify it. */
  SymbolTable outputSymbols();

  /**
   * Returns another handle on this automaton.  If {@code safe} is false the
   * copy may share state with this one and neither may then be used
   * concurrently with the other; if true the copy is independent.
   */
  Fst<W> copy(boolean safe);

  /**
   * Reads an automaton of any registered kind.  Returns null, after logging
   * why to the default {@link org.apache.lucene.util.InfoStream}, when the
   * header cannot be parsed, the semiring does not match, the type tag is
   * unknown or the body is malformed.
   */
  static <W> Fst<W> read(DataInput in, FstReadOptions opts, Semiring<W> semiring) {
    return FstReader.read(in, opts, semiring, false);
  }

  /** Reads an automaton of any registered kind from the named file, or standard input for a null or empty name. */
  static <W> Fst<W> read(String source, Semiring<W> semiring) {
    return FstReader.read(source, semiring, false, false, null);
  }

  /** Writes {@code fst} with the format registered under its type. */
  static <W> void write(Fst<W> fst, DataOutput out) throws IOException {
    FstFormat.forName(fst.type()).write(fst, out);
  }
}
