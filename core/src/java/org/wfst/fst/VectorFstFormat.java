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
 * Format of {@link VectorFst}.  After the header and symbol tables, each
 * state in id order: final weight, arc count, then per arc input label,
 * output label, weight and destination.
 *
 * @lucene.experimental
 */
public final class VectorFstFormat extends FstFormat {

  static final int VERSION_START = 0;
  static final int VERSION_CURRENT = VERSION_START;

  public VectorFstFormat() {
    super(VectorFst.TYPE);
  }

  @Override
  public <W> VectorFst<W> read(DataInput in, FstHeader header, FstReadOptions opts, Semiring<W> semiring) throws IOException {
    checkHeader(header, VERSION_START, VERSION_CURRENT);
    final SymbolTable isymbols = header.hasInputSymbols() ? SymbolTable.read(in) : null;
    final SymbolTable osymbols = header.hasOutputSymbols() ? SymbolTable.read(in) : null;
    final int numStates = (int) header.numStates();
    final VectorFst<W> fst = new VectorFst<>(semiring);
    // grow with the data actually read, never trust the declared counts for allocation
    fst.reserveStates(Math.min(numStates, MAX_RESERVE));
    long numArcs = 0;
    for (int s = 0; s < numStates; s++) {
      fst.addState();
      fst.setFinal(s, readWeight(in, semiring));
      final int count = in.readVInt();
      if (count < 0 || count > header.numArcs() - numArcs) {
        throw new IOException("invalid arc count " + count + " for state " + s + " in " + opts.source());
      }
      fst.reserveArcs(s, Math.min(count, MAX_RESERVE));
      for (int i = 0; i < count; i++) {
        final int ilabel = in.readVInt();
        final int olabel = in.readVInt();
        final W weight = readWeight(in, semiring);
        final int nextState = in.readVInt();
        if (nextState < 0 || nextState >= numStates) {
          throw new IOException("arc from state " + s + " to invalid state " + nextState + " in " + opts.source());
        }
        fst.addArc(s, new Arc<>(ilabel, olabel, weight, nextState));
      }
      numArcs += count;
    }
    if (numArcs != header.numArcs()) {
      throw new IOException("read " + numArcs + " arcs but header says " + header.numArcs() + " in " + opts.source());
    }
    fst.setStart(header.start());
    fst.setInputSymbols(isymbols);
    fst.setOutputSymbols(osymbols);
    // the stored bits were valid for exactly this structure
    fst.setProperties(header.properties(), FstProperties.TRINARY_PROPERTIES | FstProperties.ERROR);
    return fst;
  }

  private static <W> W readWeight(DataInput in, Semiring<W> semiring) throws IOException {
    final W weight = semiring.read(in);
    if (semiring.isMember(weight) == false) {
      throw new IOException("invalid weight " + weight + " for semiring " + semiring.type());
    }
    return weight;
  }

  @Override
  public <W> void write(Fst<W> fst, DataOutput out) throws IOException {
    if (fst instanceof ExpandedFst == false) {
      throw new IllegalArgumentException("cannot write a lazy " + fst.type() + " automaton; copy it into a VectorFst first");
    }
    final ExpandedFst<W> efst = (ExpandedFst<W>) fst;
    final int numStates = efst.numStates();
    long numArcs = 0;
    for (int s = 0; s < numStates; s++) {
      numArcs += efst.numArcs(s);
    }
    final long properties = (efst.properties(FstProperties.FST_PROPERTIES, false) & ~FstProperties.STATIC_PROPERTIES)
        | FstProperties.STATIC_PROPERTIES;
    writeHeader(efst, out, VectorFst.TYPE, VERSION_CURRENT, properties, numStates, numArcs);
    final Semiring<W> semiring = efst.semiring();
    for (int s = 0; s < numStates; s++) {
      semiring.write(efst.finalWeight(s), out);
      out.writeVInt(efst.numArcs(s));
      for (ArcIterator<W> it = efst.arcIterator(s); !it.done(); it.next()) {
        final Arc<W> arc = it.value();
        out.writeVInt(arc.ilabel);
        out.writeVInt(arc.olabel);
        semiring.write(arc.weight, out);
        out.writeVInt(arc.nextState);
      }
    }
  }

  @Override
  public <W> VectorFst<W> convert(Fst<W> fst) {
    return new VectorFst<>(fst);
  }
}
