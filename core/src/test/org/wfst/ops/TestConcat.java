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


import java.util.Arrays;

import org.apache.lucene.util.LuceneTestCase;
import org.wfst.fst.Arc;
import org.wfst.fst.Fst;
import org.wfst.fst.FstProperties;
import org.wfst.fst.FstTestUtil;
import org.wfst.fst.VectorFst;
import org.wfst.semiring.TropicalSemiring;

public class TestConcat extends LuceneTestCase {

  public void testLanguage() {
    VectorFst<Float> fst = FstTestUtil.linear(1f, 1, 2);
    Concat.concat(fst, FstTestUtil.linear(2f, 3));
    assertEquals(3f, FstTestUtil.acceptWeight(fst, 1, 2, 3), 0f);
    assertEquals(Float.POSITIVE_INFINITY, FstTestUtil.acceptWeight(fst, 1, 2), 0f);
    assertEquals(Float.POSITIVE_INFINITY, FstTestUtil.acceptWeight(fst, 3), 0f);
    assertEquals(5, fst.numStates());
    assertEquals(Float.POSITIVE_INFINITY, fst.finalWeight(2), 0f);
    assertEquals(new Arc<>(0, 0, 1f, 3), FstTestUtil.arcs(fst, 2).get(0));
  }

  public void testEmptyOperands() {
    VectorFst<Float> empty = new VectorFst<>(TropicalSemiring.INSTANCE);
    Concat.concat(empty, FstTestUtil.linear(0f, 1));
    assertEquals(0, empty.numStates());

    // fst2 accepts nothing: fst1 loses its final states
    VectorFst<Float> fst = FstTestUtil.linear(0.5f, 1);
    Concat.concat(fst, new VectorFst<>(TropicalSemiring.INSTANCE));
    assertEquals(2, fst.numStates());
    assertEquals(Float.POSITIVE_INFINITY, FstTestUtil.acceptWeight(fst, 1), 0f);
    OpsTestUtil.assertPropertiesHold(fst);

    ConcatFst<Float> lazy = new ConcatFst<>(new VectorFst<>(TropicalSemiring.INSTANCE), FstTestUtil.linear(0f, 1));
    assertEquals(Fst.NO_STATE_ID, lazy.start());
  }

  public void testErrorFromEmptyOperand() {
    VectorFst<Float> broken = FstTestUtil.linear(0f, 2);
    broken.setProperties(FstProperties.ERROR, FstProperties.ERROR);
    VectorFst<Float> empty = new VectorFst<>(TropicalSemiring.INSTANCE);
    Concat.concat(empty, broken);
    assertEquals(FstProperties.ERROR, empty.properties(FstProperties.ERROR, false));
  }

  public void testLazyNumbering() {
    ConcatFst<Float> lazy = new ConcatFst<>(FstTestUtil.linear(0.5f, 1), FstTestUtil.linear(0f, 2));
    assertEquals(0, lazy.start());
    assertEquals(Arrays.asList(new Arc<>(1, 1, 0f, 2)), FstTestUtil.arcs(lazy, 0));
    assertEquals(Float.POSITIVE_INFINITY, lazy.finalWeight(2), 0f);
    assertEquals(Arrays.asList(new Arc<>(0, 0, 0.5f, 1)), FstTestUtil.arcs(lazy, 2));
    assertEquals(Arrays.asList(new Arc<>(2, 2, 0f, 3)), FstTestUtil.arcs(lazy, 1));
    assertEquals(0f, lazy.finalWeight(3), 0f);
    assertEquals(0.5f, FstTestUtil.acceptWeight(lazy, 1, 2), 0f);
    assertEquals(ConcatFst.TYPE, lazy.type());
  }

  public void testLazyAgreesWithEager() {
    for (int iter = 0; iter < atLeast(20); iter++) {
      VectorFst<Float> fst1 = FstTestUtil.randomFst(random(), random().nextInt(6), 2);
      VectorFst<Float> fst2 = FstTestUtil.randomFst(random(), random().nextInt(6), 2);
      ConcatFst<Float> lazy = new ConcatFst<>(fst1, fst2);
      VectorFst<Float> eager = new VectorFst<>(fst1);
      Concat.concat(eager, fst2);
      for (int i = 0; i < 10; i++) {
        int[] labels = OpsTestUtil.randomLabels(random(), 4);
        float expected = FstTestUtil.acceptWeight(eager, labels);
        assertEquals(expected, FstTestUtil.acceptWeight(lazy, labels), 0f);
      }
      // a single split point is enough to bound the weight
      int[] left = OpsTestUtil.randomLabels(random(), 2);
      int[] right = OpsTestUtil.randomLabels(random(), 2);
      int[] both = Arrays.copyOf(left, left.length + right.length);
      System.arraycopy(right, 0, both, left.length, right.length);
      float split = FstTestUtil.acceptWeight(fst1, left) + FstTestUtil.acceptWeight(fst2, right);
      assertTrue(FstTestUtil.acceptWeight(eager, both) <= split);
      OpsTestUtil.assertPropertiesHold(eager);
      OpsTestUtil.assertPropertiesHold(lazy);
    }
  }

  public void testStarThenConcat() {
    // (1 2)* 3
    VectorFst<Float> fst = FstTestUtil.linear(0f, 1, 2);
    Closure.closure(fst, ClosureType.STAR);
    Concat.concat(fst, FstTestUtil.linear(0.25f, 3));
    assertEquals(0.25f, FstTestUtil.acceptWeight(fst, 3), 0f);
    assertEquals(0.25f, FstTestUtil.acceptWeight(fst, 1, 2, 1, 2, 3), 0f);
    assertEquals(Float.POSITIVE_INFINITY, FstTestUtil.acceptWeight(fst, 1, 3), 0f);
    OpsTestUtil.assertPropertiesHold(fst);
  }
}
