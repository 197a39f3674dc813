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


import org.apache.lucene.util.LuceneTestCase;
import org.wfst.fst.Arc;
import org.wfst.fst.FstProperties;
import org.wfst.fst.FstTestUtil;
import org.wfst.fst.VectorFst;

public class TestArcMap extends LuceneTestCase {

  /** Doubles every tropical weight, finals included. */
  private static final class DoubleWeightMapper implements ArcMapper<Float> {
    @Override
    public Arc<Float> map(Arc<Float> arc) {
      return new Arc<>(arc.ilabel, arc.olabel, arc.weight * 2, arc.nextState);
    }

    @Override
    public Float mapFinal(Float weight) {
      return weight * 2;
    }

    @Override
    public long properties(long inprops) {
      return inprops;
    }
  }

  public void testInPlace() {
    VectorFst<Float> fst = FstTestUtil.linear(1f, 1, 2);
    fst.addArc(0, new Arc<>(3, 3, 0.5f, 2));
    ArcMap.map(fst, new DoubleWeightMapper());
    assertEquals(2f, FstTestUtil.acceptWeight(fst, 1, 2), 0f);
    assertEquals(3f, FstTestUtil.acceptWeight(fst, 3), 0f);
    assertEquals(Float.POSITIVE_INFINITY, fst.finalWeight(0), 0f);
    OpsTestUtil.assertPropertiesHold(fst);
  }

  public void testIntoOtherAutomatonKeepsSource() {
    VectorFst<Float> fst = FstTestUtil.linear(1f, 1);
    fst.setInputSymbols(FstTestUtil.symbols("in", "a"));
    VectorFst<Float> out = FstTestUtil.linear(0f, 4, 4);
    ArcMap.map(fst, out, new DoubleWeightMapper());
    assertEquals(2, out.numStates());
    assertEquals(2f, FstTestUtil.acceptWeight(out, 1), 0f);
    assertEquals(1f, FstTestUtil.acceptWeight(fst, 1), 0f);
    assertEquals(fst.inputSymbols(), out.inputSymbols());
  }

  public void testLazyKeepsStateIds() {
    VectorFst<Float> fst = FstTestUtil.randomFst(random(), 1 + random().nextInt(8), 3);
    ArcMapFst<Float> lazy = new ArcMapFst<>(fst, new DoubleWeightMapper());
    VectorFst<Float> eager = new VectorFst<>(fst);
    ArcMap.map(eager, new DoubleWeightMapper());
    FstTestUtil.assertSameFst(eager, new VectorFst<>(lazy));
    assertEquals(ArcMapFst.TYPE, lazy.type());
    assertEquals(0, lazy.properties(FstProperties.EXPANDED | FstProperties.MUTABLE, false));
    OpsTestUtil.assertPropertiesHold(lazy);
  }
}
