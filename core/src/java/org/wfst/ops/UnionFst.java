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
 * Union computed on demand.  State 0 is a new start with epsilon arcs to
 * both starts; state {@code s} of the first automaton becomes
 * {@code 2s+1} and state {@code s} of the second {@code 2s+2}.
 *
 * <p>The inputs must not change while this automaton is in use.</p>
 *
 * @lucene.experimental
 * @see Union
 */
public final class UnionFst<W> extends CacheFst<W, UnionFst.UnionFstImpl<W>> {

  /** Type tag. */
  public static final String TYPE = "union";

  public UnionFst(Fst<W> fst1, Fst<W> fst2) {
    super(new UnionFstImpl<>(fst1, fst2));
  }

  private UnionFst(UnionFstImpl<W> impl) {
    super(impl);
  }

  @Override
  public UnionFst<W> copy(boolean safe) {
    return new UnionFst<>(safe ? getImpl().copy() : getImpl());
  }

  /** @lucene.internal */
  public static final class UnionFstImpl<W> extends CacheImpl<W> {
    private final Fst<W> fst1;
    private final Fst<W> fst2;

    UnionFstImpl(Fst<W> fst1, Fst<W> fst2) {
      super(fst1.semiring(), TYPE);
      this.fst1 = fst1;
      this.fst2 = fst2;
      setProperties(FstProperties.unionProperties(fst1.properties(FstProperties.FST_PROPERTIES, false),
          fst2.properties(FstProperties.FST_PROPERTIES, false), true));
      setInputSymbols(fst1.inputSymbols() == null ? null : fst1.inputSymbols().copy());
      setOutputSymbols(fst1.outputSymbols() == null ? null : fst1.outputSymbols().copy());
    }

    @Override
    protected int computeStart() {
      if (fst1.start() == Fst.NO_STATE_ID && fst2.start() == Fst.NO_STATE_ID) {
        return Fst.NO_STATE_ID;
      }
      return 0;
    }

    @Override
    protected W computeFinal(int s) {
      if (s == 0) {
        return semiring.zero();
      }
      return (s & 1) == 1 ? fst1.finalWeight((s - 1) >> 1) : fst2.finalWeight((s - 2) >> 1);
    }

    @Override
    protected void expand(int s, CacheState<W> state) {
      if (s == 0) {
        if (fst1.start() != Fst.NO_STATE_ID) {
          state.addArc(new Arc<>(Arc.EPSILON, Arc.EPSILON, semiring.one(), 2 * fst1.start() + 1));
        }
        if (fst2.start() != Fst.NO_STATE_ID) {
          state.addArc(new Arc<>(Arc.EPSILON, Arc.EPSILON, semiring.one(), 2 * fst2.start() + 2));
        }
        return;
      }
      final boolean first = (s & 1) == 1;
      final Fst<W> fst = first ? fst1 : fst2;
      final int src = first ? (s - 1) >> 1 : (s - 2) >> 1;
      final int shift = first ? 1 : 2;
      for (ArcIterator<W> it = fst.arcIterator(src); !it.done(); it.next()) {
        final Arc<W> arc = it.value();
        state.addArc(arc.withNextState(2 * arc.nextState + shift));
      }
    }

    @Override
    public UnionFstImpl<W> copy() {
      return new UnionFstImpl<>(fst1.copy(true), fst2.copy(true));
    }
  }
}
