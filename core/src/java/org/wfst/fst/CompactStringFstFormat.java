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
import java.util.ArrayList;
import java.util.List;

import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.DataOutput;
import org.apache.lucene.util.ArrayUtil;
import org.wfst.semiring.Semiring;

/**
 * Format of {@link CompactStringFst}: after the header and symbol tables,
 * input label, output label and weight of each arc on the path, then the
 * final weight if there are states.
 *
 * @lucene.experimental
 */
public final class CompactStringFstFormat extends FstFormat {

  static final int VERSION_START = 0;
  static final int VERSION_CURRENT = VERSION_START;

  public CompactStringFstFormat() {
    super(CompactStringFst.TYPE);
  }

  @Override
  public <W> CompactStringFst<W> read(DataInput in, FstHeader header, FstReadOptions opts, Semiring<W> semiring) throws IOException {
    checkHeader(header, VERSION_START, VERSION_CURRENT);
    final boolean hasStates = header.numStates() > 0;
    if ((hasStates && header.numArcs() != header.numStates() - 1) || (hasStates == false && header.numArcs() != 0)) {
      throw new IOException("not a string: " + header + " in " + opts.source());
    }
    if (header.start() != (hasStates ? 0 : Fst.NO_STATE_ID)) {
      throw new IOException("invalid start state: " + header + " in " + opts.source());
    }
    final SymbolTable isymbols = header.hasInputSymbols() ? SymbolTable.read(in) : null;
    final SymbolTable osymbols = header.hasOutputSymbols() ? SymbolTable.read(in) : null;
    final int length = (int) header.numArcs();
    final int reserve = Math.min(length, MAX_RESERVE);
    int[] ilabels = new int[reserve];
    int[] olabels = new int[reserve];
    final List<W> weights = new ArrayList<>(reserve);
    for (int i = 0; i < length; i++) {
      if (i == ilabels.length) {
        ilabels = ArrayUtil.grow(ilabels, i + 1);
        olabels = ArrayUtil.grow(olabels, i + 1);
      }
      ilabels[i] = in.readVInt();
      olabels[i] = in.readVInt();
      weights.add(semiring.read(in));
    }
    if (ilabels.length != length) {
      ilabels = ArrayUtil.copyOfSubArray(ilabels, 0, length);
      olabels = ArrayUtil.copyOfSubArray(olabels, 0, length);
    }
    final W finalWeight = hasStates ? semiring.read(in) : semiring.zero();
    if (hasStates && semiring.isZero(finalWeight)) {
      throw new IOException("last state of a string must be final in " + opts.source());
    }
    return new CompactStringFst<>(semiring, ilabels, olabels, weights, finalWeight, hasStates, isymbols, osymbols);
  }

  @Override
  public <W> void write(Fst<W> fst, DataOutput out) throws IOException {
    final CompactStringFst<W> cfst = fst instanceof CompactStringFst ? (CompactStringFst<W>) fst : convert(fst);
    final int numStates = cfst.numStates();
    writeHeader(cfst, out, CompactStringFst.TYPE, VERSION_CURRENT, cfst.properties(FstProperties.FST_PROPERTIES, false),
        numStates, cfst.length());
    final Semiring<W> semiring = cfst.semiring();
    for (int i = 0; i < cfst.length(); i++) {
      out.writeVInt(cfst.ilabel(i));
      out.writeVInt(cfst.olabel(i));
      semiring.write(cfst.weight(i), out);
    }
    if (numStates > 0) {
      semiring.write(cfst.pathFinalWeight(), out);
    }
  }

  @Override
  public <W> CompactStringFst<W> convert(Fst<W> fst) {
    return CompactStringFst.fromFst(fst);
  }
}
