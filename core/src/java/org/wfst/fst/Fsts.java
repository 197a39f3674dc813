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


import java.util.HashMap;
import java.util.Map;
import java.util.function.IntUnaryOperator;

/**
 * Static helpers for copying automata into mutable ones.
 *
 * @lucene.experimental
 */
public final class Fsts {

  private Fsts() {
  }

  /**
   * Replaces the contents of {@code dst} with a copy of {@code src},
   * symbol tables and known properties included.  States of an expanded
   * {@code src} keep their ids; those of a lazy one are renumbered in
   * discovery order from its start, which becomes state 0.
   */
  public static <W> void copy(Fst<W> src, MutableFst<W> dst) {
    dst.deleteStates();
    dst.setInputSymbols(src.inputSymbols());
    dst.setOutputSymbols(src.outputSymbols());
    final long mask = FstProperties.FST_PROPERTIES & ~FstProperties.STATIC_PROPERTIES;
    long props = src.properties(mask, false);
    final IntUnaryOperator newId = append(src, dst);
    if (src.start() != Fst.NO_STATE_ID) {
      dst.setStart(newId.applyAsInt(src.start()));
    }
    if (src instanceof ExpandedFst == false) {
      // renumbering can change whether arcs go forward
      props &= ~(FstProperties.TOP_SORTED | FstProperties.NOT_TOP_SORTED | FstProperties.NOT_ACCESSIBLE);
    }
    // bits src does not know keep the values maintained while building dst
    dst.setProperties(props, FstProperties.knownProperties(props) & mask);
  }

  /**
   * Appends every state of {@code src} and their arcs to {@code dst},
   * without touching its start.  Returns the mapping from {@code src}
   * state ids to the ids they got in {@code dst}.
   */
  public static <W> IntUnaryOperator append(Fst<W> src, MutableFst<W> dst) {
    final int offset = dst.numStates();
    if (src instanceof ExpandedFst) {
      final int n = ((ExpandedFst<W>) src).numStates();
      dst.reserveStates(n);
      for (int s = 0; s < n; s++) {
        dst.addState();
        dst.setFinal(offset + s, src.finalWeight(s));
      }
      for (int s = 0; s < n; s++) {
        dst.reserveArcs(offset + s, src.numArcs(s));
        for (ArcIterator<W> it = src.arcIterator(s); !it.done(); it.next()) {
          final Arc<W> arc = it.value();
          dst.addArc(offset + s, arc.withNextState(arc.nextState + offset));
        }
      }
      return s -> s + offset;
    }
    final Map<Integer, Integer> newId = new HashMap<>();
    for (StateIterator it = src.stateIterator(); !it.done(); it.next()) {
      final int s = it.value();
      final int t = dst.addState();
      dst.setFinal(t, src.finalWeight(s));
      newId.put(s, t);
    }
    for (Map.Entry<Integer, Integer> entry : newId.entrySet()) {
      final int t = entry.getValue();
      for (ArcIterator<W> it = src.arcIterator(entry.getKey()); !it.done(); it.next()) {
        final Arc<W> arc = it.value();
        dst.addArc(t, arc.withNextState(newId.get(arc.nextState)));
      }
    }
    return s -> newId.get(s);
  }
}
