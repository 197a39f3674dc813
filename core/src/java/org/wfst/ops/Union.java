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
 * Union computed in place: {@code fst1} afterwards accepts what either
 * automaton accepted.  The states of {@code fst2} are appended to
 * {@code fst1} and the two starts are joined by epsilon arcs.
 *
 * @lucene.experimental
 * @see UnionFst
 */
public final class Union {

  private Union() {
  }

  public static <W> void union(MutableFst<W> fst1, Fst<W> fst2) {
    final Semiring<W> semiring = fst1.semiring();
    final long props1 = fst1.properties(FstProperties.FST_PROPERTIES, false);
    final long props2 = fst2.properties(FstProperties.FST_PROPERTIES, false);
    final int start1 = fst1.start();
    final int start2 = fst2.start();
    if (start2 == Fst.NO_STATE_ID) {
      // fst2 accepts nothing
      if ((props2 & FstProperties.ERROR) != 0) {
        fst1.setProperties(FstProperties.ERROR, FstProperties.ERROR);
      }
      return;
    }
    final IntUnaryOperator newId = Fsts.append(fst2, fst1);
    final int newStart2 = newId.applyAsInt(start2);
    if (start1 == Fst.NO_STATE_ID) {
      fst1.setStart(newStart2);
    } else if ((props1 & FstProperties.INITIAL_ACYCLIC) != 0) {
      // nothing leads back to start1, so it can serve both
      fst1.addArc(start1, new Arc<>(Arc.EPSILON, Arc.EPSILON, semiring.one(), newStart2));
    } else {
      final int start = fst1.addState();
      fst1.addArc(start, new Arc<>(Arc.EPSILON, Arc.EPSILON, semiring.one(), start1));
      fst1.addArc(start, new Arc<>(Arc.EPSILON, Arc.EPSILON, semiring.one(), newStart2));
      fst1.setStart(start);
    }
    fst1.setProperties(FstProperties.unionProperties(props1, props2, false), FstProperties.FST_PROPERTIES);
  }
}
