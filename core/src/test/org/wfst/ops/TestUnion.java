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
import org.wfst.fst.Fst;
import org.wfst.fst.FstProperties;
import org.wfst.fst.FstTestUtil;
import org.wfst.fst.VectorFst;
import org.wfst.semiring.TropicalSemiring;

public class TestUnion extends LuceneTestCase {

  public void testLanguage() {
    VectorFst<Float> fst = FstTestUtil.linear(1f, 1, 2);
    Union.union(fst, FstTestUtil.linear(2f, 3));
    assertEquals(1f, FstTestUtil.acceptWeight(fst, 1, 2), 0f);
    assertEquals(2f, FstTestUtil.acceptWeight(fst, 3), 0f);
    assertEquals(Float.POSITIVE_INFINITY, FstTestUtil.acceptWeight(fst, 1), 0f);

    // both accept the same string: the better weight wins
    Union.union(fst, FstTestUtil.linear(0.5f, 1, 2));
    assertEquals(0.5f, FstTestUtil.acceptWeight(fst, 1, 2), 0f);
  }

  public void testReusesAcyclicStart() {
    VectorFst<Float> fst = FstTestUtil.linear(0f, 1);
    Union.union(fst, FstTestUtil.linear(0f, 2));
    assertEquals(4, fst.numStates());
    assertEquals(0, fst.start());
    assertEquals(new Arc<>(0, 0, 0f, 2), FstTestUtil.arcs(fst, 0).get(1));
  }

  public void testNewStartWhenStartIsOnCycle() {
    VectorFst<Float> fst = FstTestUtil.linear(0f, 1);
    fst.addArc(1, new Arc<>(2, 2, 0f, 0));
    Union.union(fst, FstTestUtil.linear(0f, 3));
    assertEquals(5, fst.numStates());
    assertEquals(4, fst.start());
    assertEquals(2, fst.numArcs(4));
    assertEquals(Float.POSITIVE_INFINITY, FstTestUtil.acceptWeight(fst, 1, 2, 3), 0f);
    assertEquals(0f, FstTestUtil.acceptWeight(fst, 1, 2, 1), 0f);
    assertEquals(0f, FstTestUtil.acceptWeight(fst, 3), 0f);
  }

  public void testEmptyOperands() {
    VectorFst<Float> fst = FstTestUtil.linear(0f, 1);
    Union.union(fst, new VectorFst<>(TropicalSemiring.INSTANCE));
    assertEquals(2, fst.numStates());

    VectorFst<Float> empty = new VectorFst<>(TropicalSemiring.INSTANCE);
    Union.union(empty, FstTestUtil.linear(0f, 1));
    assertEquals(0, empty.start());
    assertEquals(0f, FstTestUtil.acceptWeight(empty, 1), 0f);

    UnionFst<Float> lazy = new UnionFst<>(new VectorFst<>(TropicalSemiring.INSTANCE),
        new VectorFst<>(TropicalSemiring.INSTANCE));
    assertEquals(Fst.NO_STATE_ID, lazy.start());
  }

  public void testErrorFromEmptyOperand() {
    VectorFst<Float> broken = new VectorFst<>(TropicalSemiring.INSTANCE);
    broken.setProperties(FstProperties.ERROR, FstProperties.ERROR);
    VectorFst<Float> fst = FstTestUtil.linear(0f, 1);
    Union.union(fst, broken);
    assertEquals(FstProperties.ERROR, fst.properties(FstProperties.ERROR, false));
  }

  public void testLazyNumbering() {
    UnionFst<Float> lazy = new UnionFst<>(FstTestUtil.linear(0f, 1), FstTestUtil.linear(0f, 2));
    assertEquals(0, lazy.start());
    assertEquals(2, lazy.numArcs(0));
    assertEquals(new Arc<>(0, 0, 0f, 1), FstTestUtil.arcs(lazy, 0).get(0));
    assertEquals(new Arc<>(0, 0, 0f, 2), FstTestUtil.arcs(lazy, 0).get(1));
    assertEquals(new Arc<>(1, 1, 0f, 3), FstTestUtil.arcs(lazy, 1).get(0));
    assertEquals(new Arc<>(2, 2, 0f, 4), FstTestUtil.arcs(lazy, 2).get(0));
    assertEquals(0f, lazy.finalWeight(3), 0f);
    assertEquals(0f, lazy.finalWeight(4), 0f);
    assertEquals(UnionFst.TYPE, lazy.type());
  }

  public void testLazyAgreesWithEager() {
    for (int iter = 0; iter < atLeast(20); iter++) {
      VectorFst<Float> fst1 = FstTestUtil.randomFst(random(), random().nextInt(6), 2);
      VectorFst<Float> fst2 = FstTestUtil.randomFst(random(), random().nextInt(6), 2);
      UnionFst<Float> lazy = new UnionFst<>(fst1, fst2);
      VectorFst<Float> eager = new VectorFst<>(fst1);
      Union.union(eager, fst2);
      for (int i = 0; i < 10; i++) {
        int[] labels = OpsTestUtil.randomLabels(random(), 4);
        float expected = Math.min(FstTestUtil.acceptWeight(fst1, labels), FstTestUtil.acceptWeight(fst2, labels));
        assertEquals(expected, FstTestUtil.acceptWeight(eager, labels), 0f);
        assertEquals(expected, FstTestUtil.acceptWeight(lazy, labels), 0f);
      }
      OpsTestUtil.assertPropertiesHold(eager);
      OpsTestUtil.assertPropertiesHold(lazy);
    }
  }

  public void testSymbolTablesOfFirst() {
    VectorFst<Float> fst1 = FstTestUtil.linear(0f, 1);
    fst1.setInputSymbols(FstTestUtil.symbols("in", "a"));
    UnionFst<Float> lazy = new UnionFst<>(fst1, FstTestUtil.linear(0f, 2));
    assertEquals(fst1.inputSymbols(), lazy.inputSymbols());
    Union.union(fst1, FstTestUtil.linear(0f, 2));
    assertEquals(FstTestUtil.symbols("in", "a"), fst1.inputSymbols());
  }
}
