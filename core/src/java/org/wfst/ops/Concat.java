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


import java.util.function.IntUnaryOperator;

import org.wfst.fst.Arc;
import org.wfst.fst.Fst;
import org.wfst.fst.FstProperties;
import org.wfst.fst.Fsts;
import org.wfst.fst.MutableFst;
import org.wfst.semiring.Semiring;

/**
 * Concatenation computed in place: {@code fst1} afterwards accepts a string
 * of {@code fst1} followed by a string of {@code fst2}, with the product of
 * their weights.  The states of {@code fst2} are appended and every final
 * state of {@code fst1} becomes non-final, with an epsilon arc carrying its
 * final weight to the start of {@code fst2}.
 *
 * @lucene.experimental
 * @see ConcatFst
 */
public final class Concat {

  private Concat() {
  }

  public static <W> void concat(MutableFst<W> fst1, Fst<W> fst2) {
    final Semiring<W> semiring = fst1.semiring();
    final long props1 = fst1.properties(FstProperties.FST_PROPERTIES, false);
    final long props2 = fst2.properties(FstProperties.FST_PROPERTIES, false);
    if (fst1.start() == Fst.NO_STATE_ID) {
      // fst1 accepts nothing, neither does the concatenation
      if ((props2 & FstProperties.ERROR) != 0) {
        fst1.setProperties(FstProperties.ERROR, FstProperties.ERROR);
      }
      return;
    }
    final int numStates1 = fst1.numStates();
    final IntUnaryOperator newId = Fsts.append(fst2, fst1);
    final int start2 = fst2.start();
    for (int s = 0; s < numStates1; s++) {
      final W weight = fst1.finalWeight(s);
      if (semiring.isZero(weight) == false) {
        fst1.setFinal(s, semiring.zero());
        if (start2 != Fst.NO_STATE_ID) {
          fst1.addArc(s, new Arc<>(Arc.EPSILON, Arc.EPSILON, weight, newId.applyAsInt(start2)));
        }
      }
    }
    long props = FstProperties.concatProperties(props1, props2, false);
    if (start2 == Fst.NO_STATE_ID) {
      // the final weights of fst1 were dropped rather than moved onto arcs
      props &= ~FstProperties.WEIGHTED;
    }
    fst1.setProperties(props, FstProperties.FST_PROPERTIES);
  }
}
