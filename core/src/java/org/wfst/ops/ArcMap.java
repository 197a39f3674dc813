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


import org.wfst.fst.Fst;
import org.wfst.fst.FstProperties;
import org.wfst.fst.Fsts;
import org.wfst.fst.MutableArcIterator;
import org.wfst.fst.MutableFst;
import org.wfst.fst.StateIterator;

/**
 * Applies an {@link ArcMapper} to every arc and final weight of an
 * automaton, in place or into another automaton.
 *
 * @lucene.experimental
 * @see ArcMapFst
 */
public final class ArcMap {

  private ArcMap() {
  }

  /** Maps {@code fst} in place. */
  public static <W> void map(MutableFst<W> fst, ArcMapper<W> mapper) {
    final long props = fst.properties(FstProperties.FST_PROPERTIES, false);
    for (StateIterator siter = fst.stateIterator(); !siter.done(); siter.next()) {
      final int s = siter.value();
      for (MutableArcIterator<W> aiter = fst.mutableArcIterator(s); !aiter.done(); aiter.next()) {
        aiter.setValue(mapper.map(aiter.value()));
      }
      final W weight = fst.finalWeight(s);
      final W mapped = mapper.mapFinal(weight);
      if (mapped.equals(weight) == false) {
        fst.setFinal(s, mapped);
      }
    }
    fst.setProperties(mapper.properties(props), FstProperties.FST_PROPERTIES);
  }

  /**
   * Replaces the contents of {@code ofst} with {@code ifst} mapped.  Symbol
   * tables are copied unchanged.
   */
  public static <W> void map(Fst<W> ifst, MutableFst<W> ofst, ArcMapper<W> mapper) {
    Fsts.copy(ifst, ofst);
    map(ofst, mapper);
  }
}
