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
import org.wfst.semiring.Semiring;

/**
 * Kleene closure computed on demand.  For {@link ClosureType#STAR} the new
 * start state is 0 and state {@code s} of the source becomes {@code s + 1};
 * for {@link ClosureType#PLUS} state ids are the source's.
 *
 * <p>The source must not change while this automaton is in use.</p>
 *
 * @lucene.experimental
 * @see Closure
 */
public final class ClosureFst<W> extends CacheFst<W, ClosureFst.ClosureFstImpl<W>> {

  /** Type tag. */
  public static final String TYPE = "closure";

  public ClosureFst(Fst<W> fst, ClosureType closureType) {
    super(new ClosureFstImpl<>(fst, closureType));
  }

  private ClosureFst(ClosureFstImpl<W> impl) {
    super(impl);
  }

  @Override
  public ClosureFst<W> copy(boolean safe) {
    return new ClosureFst<>(safe ? getImpl().copy() : getImpl());
  }

  /** @lucene.internal */
  public static final class ClosureFstImpl<W> extends CacheImpl<W> {
    private final Fst<W> fst;
    private final ClosureType closureType;
    // 源状态编号的偏移量 STAR时为1
    private final int offset;

    ClosureFstImpl(Fst<W> fst, ClosureType closureType) {
      super(fst.semiring(), TYPE);
      this.fst = fst;
      this.closureType = closureType;
      this.offset = closureType == ClosureType.STAR ? 1 : 0;
      setProperties(FstProperties.closureProperties(fst.properties(FstProperties.FST_PROPERTIES, false),
          closureType == ClosureType.STAR, true));
      setInputSymbols(fst.inputSymbols() == null ? null : fst.inputSymbols().copy());
      setOutputSymbols(fst.outputSymbols() == null ? null : fst.outputSymbols().copy());
    }

    @Override
    protected int computeStart() {
      if (closureType == ClosureType.STAR) {
        return 0;
      }
      return fst.start();
    }

    private boolean isNewStart(int s) {
      return closureType == ClosureType.STAR && s == 0;
    }

    @Override
    protected W computeFinal(int s) {
      if (isNewStart(s)) {
        return semiring.one();
      }
      return fst.finalWeight(s - offset);
    }

    @Override
    protected void expand(int s, CacheState<W> state) {
      final int srcStart = fst.start();
      if (isNewStart(s)) {
        if (srcStart != Fst.NO_STATE_ID) {
          state.addArc(new Arc<>(Arc.EPSILON, Arc.EPSILON, semiring.one(), srcStart + offset));
        }
        return;
      }
      final int src = s - offset;
      for (ArcIterator<W> it = fst.arcIterator(src); !it.done(); it.next()) {
        final Arc<W> arc = it.value();
        state.addArc(offset == 0 ? arc : arc.withNextState(arc.nextState + offset));
      }
      final W weight = fst.finalWeight(src);
      if (semiring.isZero(weight) == false && srcStart != Fst.NO_STATE_ID) {
        state.addArc(new Arc<>(Arc.EPSILON, Arc.EPSILON, weight, srcStart + offset));
      }
    }

    @Override
    public ClosureFstImpl<W> copy() {
      return new ClosureFstImpl<>(fst.copy(true), closureType);
    }
  }
}
