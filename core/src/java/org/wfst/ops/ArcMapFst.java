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


import org.wfst.fst.ArcIterator;
import org.wfst.fst.CacheFst;
import org.wfst.fst.CacheImpl;
import org.wfst.fst.CacheState;
import org.wfst.fst.Fst;
import org.wfst.fst.FstProperties;
import org.wfst.fst.StateIterator;
import org.wfst.fst.SymbolTable;

/**
 * Applies an {@link ArcMapper} on demand.  States keep the source's ids and
 * the state iterator is the source's.
 *
 * <p>The source must not change while this automaton is in use.</p>
 *
 * @lucene.experimental
 * @see ArcMap
 */
public class ArcMapFst<W> extends CacheFst<W, ArcMapFst.ArcMapFstImpl<W>> {

  /** Type tag. */
  public static final String TYPE = "map";

  /** Maps {@code fst}; symbol tables are copied unchanged. */
  public ArcMapFst(Fst<W> fst, ArcMapper<W> mapper) {
    this(new ArcMapFstImpl<>(fst, mapper, TYPE, fst.inputSymbols(), fst.outputSymbols()));
  }

  protected ArcMapFst(ArcMapFstImpl<W> impl) {
    super(impl);
  }

  @Override
  public StateIterator stateIterator() {
    return getImpl().fst.stateIterator();
  }

  @Override
  public ArcMapFst<W> copy(boolean safe) {
    return new ArcMapFst<>(safe ? getImpl().copy() : getImpl());
  }

  /** @lucene.internal */
  public static final class ArcMapFstImpl<W> extends CacheImpl<W> {
    private final Fst<W> fst;
    private final ArcMapper<W> mapper;

    ArcMapFstImpl(Fst<W> fst, ArcMapper<W> mapper, String type, SymbolTable isymbols, SymbolTable osymbols) {
      super(fst.semiring(), type);
      this.fst = fst;
      this.mapper = mapper;
      setProperties(mapper.properties(fst.properties(FstProperties.FST_PROPERTIES, false))
          & ~FstProperties.STATIC_PROPERTIES);
      setInputSymbols(isymbols == null ? null : isymbols.copy());
      setOutputSymbols(osymbols == null ? null : osymbols.copy());
    }

    @Override
    protected int computeStart() {
      return fst.start();
    }

    @Override
    protected W computeFinal(int s) {
      return mapper.mapFinal(fst.finalWeight(s));
    }

    @Override
    protected void expand(int s, CacheState<W> state) {
      for (ArcIterator<W> it = fst.arcIterator(s); !it.done(); it.next()) {
        state.addArc(mapper.map(it.value()));
      }
    }

    @Override
    public ArcMapFstImpl<W> copy() {
      return new ArcMapFstImpl<>(fst.copy(true), mapper, type, inputSymbols(), outputSymbols());
    }
  }
}
