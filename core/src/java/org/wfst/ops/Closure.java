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
package org.wfst.ops;


import org.wfst.fst.Arc;
import org.wfst.fst.Fst;
import org.wfst.fst.FstProperties;
import org.wfst.fst.MutableFst;
import org.wfst.fst.StateIterator;
import org.wfst.semiring.Semiring;

/**
 * Kleene closure computed in place.
 *
 * <p>Every final state gets an epsilon arc back to the start, weighted by
 * its final weight.  For {@link ClosureType#STAR} a new start state is
 * added, final with weight one, with an epsilon arc to the old start.  If
 * the automaton is {@code T}, its closure accepts {@code T*} resp.
 * {@code T+}.</p>
 *
 * @lucene.experimental
 * @see ClosureFst
 */
public final class Closure {

  private Closure() {
  }

  public static <W> void closure(MutableFst<W> fst, ClosureType closureType) {
    final Semiring<W> semiring = fst.semiring();
    final long props = fst.properties(FstProperties.FST_PROPERTIES, false);
    final int start = fst.start();
    if (start != Fst.NO_STATE_ID) {
      for (StateIterator it = fst.stateIterator(); !it.done(); it.next()) {
        final int s = it.value();
        final W weight = fst.finalWeight(s);
        if (semiring.isZero(weight) == false) {
          fst.addArc(s, new Arc<>(Arc.EPSILON, Arc.EPSILON, weight, start));
        }
      }
    }
    if (closureType == ClosureType.STAR) {
      final int newStart = fst.addState();
      fst.setFinal(newStart, semiring.one());
      if (start != Fst.NO_STATE_ID) {
        fst.addArc(newStart, new Arc<>(Arc.EPSILON, Arc.EPSILON, semiring.one(), start));
      }
      fst.setStart(newStart);
    }
    fst.setProperties(FstProperties.closureProperties(props, closureType == ClosureType.STAR, false),
        FstProperties.FST_PROPERTIES);
  }
}
