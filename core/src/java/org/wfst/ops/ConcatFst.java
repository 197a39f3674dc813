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
import org.wfst.fst.ArcIterator;
import org.wfst.fst.CacheFst;
import org.wfst.fst.CacheImpl;
import org.wfst.fst.CacheState;
import org.wfst.fst.Fst;
import org.wfst.fst.FstProperties;

/**
 * Concatenation computed on demand.  State {@code s} of the first automaton
 * becomes {@code 2s} and state {@code s} of the second {@code 2s+1}.
 *
 * <p>The inputs must not change while this automaton is in use.</p>
 *
 * @lucene.experimental
 * @see Concat
 */
public final class ConcatFst<W> extends CacheFst<W, ConcatFst.ConcatFstImpl<W>> {

  /** Type tag. */
  public static final String TYPE = "concat";

  public ConcatFst(Fst<W> fst1, Fst<W> fst2) {
    super(new ConcatFstImpl<>(fst1, fst2));
  }

  private ConcatFst(ConcatFstImpl<W> impl) {
    super(impl);
  }

  @Override
  public ConcatFst<W> copy(boolean safe) {
    return new ConcatFst<>(safe ? getImpl().copy() : getImpl());
  }

  /** @lucene.internal */
  public static final class ConcatFstImpl<W> extends CacheImpl<W> {
    private final Fst<W> fst1;
    private final Fst<W> fst2;

    ConcatFstImpl(Fst<W> fst1, Fst<W> fst2) {
      super(fst1.semiring(), TYPE);
      this.fst1 = fst1;
      this.fst2 = fst2;
      setProperties(FstProperties.concatProperties(fst1.properties(FstProperties.FST_PROPERTIES, false),
          fst2.properties(FstProperties.FST_PROPERTIES, false), true));
      setInputSymbols(fst1.inputSymbols() == null ? null : fst1.inputSymbols().copy());
      setOutputSymbols(fst1.outputSymbols() == null ? null : fst1.outputSymbols().copy());
    }

    @Override
    protected int computeStart() {
      final int start1 = fst1.start();
      return start1 == Fst.NO_STATE_ID ? Fst.NO_STATE_ID : 2 * start1;
    }

    @Override
    protected W computeFinal(int s) {
      if ((s & 1) == 0) {
        // finals of fst1 continue into fst2 through an epsilon arc
        return semiring.zero();
      }
      return fst2.finalWeight(s >> 1);
    }

    @Override
    protected void expand(int s, CacheState<W> state) {
      if ((s & 1) == 1) {
        for (ArcIterator<W> it = fst2.arcIterator(s >> 1); !it.done(); it.next()) {
          final Arc<W> arc = it.value();
          state.addArc(arc.withNextState(2 * arc.nextState + 1));
        }
        return;
      }
      final int src = s >> 1;
      for (ArcIterator<W> it = fst1.arcIterator(src); !it.done(); it.next()) {
        final Arc<W> arc = it.value();
        state.addArc(arc.withNextState(2 * arc.nextState));
      }
      final W weight = fst1.finalWeight(src);
      final int start2 = fst2.start();
      if (semiring.isZero(weight) == false && start2 != Fst.NO_STATE_ID) {
        state.addArc(new Arc<>(Arc.EPSILON, Arc.EPSILON, weight, 2 * start2 + 1));
      }
    }

    @Override
    public ConcatFstImpl<W> copy() {
      return new ConcatFstImpl<>(fst1.copy(true), fst2.copy(true));
    }
  }
}
