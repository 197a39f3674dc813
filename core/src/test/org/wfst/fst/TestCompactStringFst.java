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
package org.wfst.fst;


import java.util.Arrays;

import org.apache.lucene.util.LuceneTestCase;
import org.wfst.semiring.TropicalSemiring;

public class TestCompactStringFst extends LuceneTestCase {

  public void testFromLinear() {
    VectorFst<Float> linear = FstTestUtil.linear(2f, 5, 6, 7);
    linear.setOutputSymbols(FstTestUtil.symbols("out", "x"));
    CompactStringFst<Float> fst = CompactStringFst.fromFst(linear);
    assertEquals(3, fst.length());
    assertEquals(4, fst.numStates());
    assertEquals(0, fst.start());
    assertEquals(CompactStringFst.TYPE, fst.type());
    FstTestUtil.assertSameFst(linear, fst);
    assertEquals(2f, FstTestUtil.acceptWeight(fst, 5, 6, 7), 0f);
    assertEquals(Float.POSITIVE_INFINITY, FstTestUtil.acceptWeight(fst, 5, 6), 0f);
  }

  public void testProperties() {
    CompactStringFst<Float> fst = CompactStringFst.fromFst(FstTestUtil.linear(0f, 1, 2));
    long props = fst.properties(FstProperties.FST_PROPERTIES, false);
    assertEquals(FstProperties.EXPANDED, props & FstProperties.BINARY_PROPERTIES);
    assertEquals(FstProperties.STRING | FstProperties.ACYCLIC | FstProperties.ACCEPTOR,
        props & (FstProperties.STRING | FstProperties.ACYCLIC | FstProperties.ACCEPTOR));
    assertSame(fst, fst.copy(true));
  }

  public void testWithEpsilons() {
    CompactStringFst<Float> fst = new CompactStringFst<>(TropicalSemiring.INSTANCE,
        new int[] {0, 3}, new int[] {4, 0}, Arrays.asList(1f, 0f), 0.5f);
    assertEquals(1, fst.numInputEpsilons(0));
    assertEquals(0, fst.numOutputEpsilons(0));
    assertEquals(1, fst.numOutputEpsilons(1));
    assertEquals(0, fst.numArcs(2));
    assertEquals(1.5f, FstTestUtil.acceptWeight(fst, 3), 0f);
    assertEquals(FstProperties.NOT_ACCEPTOR, fst.properties(FstProperties.ACCEPTOR | FstProperties.NOT_ACCEPTOR, false));
  }

  public void testNotAString() {
    VectorFst<Float> branching = FstTestUtil.linear(0f, 1, 2);
    branching.addArc(0, new Arc<>(3, 3, 0f, 2));
    expectThrows(IllegalArgumentException.class, () -> CompactStringFst.fromFst(branching));

    VectorFst<Float> finalInside = FstTestUtil.linear(0f, 1, 2);
    finalInside.setFinal(1, 0f);
    expectThrows(IllegalArgumentException.class, () -> CompactStringFst.fromFst(finalInside));
  }

  public void testEmpty() {
    CompactStringFst<Float> empty = CompactStringFst.empty(TropicalSemiring.INSTANCE);
    assertEquals(Fst.NO_STATE_ID, empty.start());
    assertEquals(0, empty.numStates());
    assertTrue(empty.stateIterator().done());
    assertEquals(0, CompactStringFst.fromFst(new VectorFst<>(TropicalSemiring.INSTANCE)).numStates());
    assertEquals(Float.POSITIVE_INFINITY, FstTestUtil.acceptWeight(empty), 0f);
  }

  public void testInvalidArguments() {
    expectThrows(IllegalArgumentException.class, () -> new CompactStringFst<>(TropicalSemiring.INSTANCE,
        new int[] {1}, new int[0], Arrays.asList(0f), 0f));
    // the last state must be final
    expectThrows(IllegalArgumentException.class, () -> new CompactStringFst<>(TropicalSemiring.INSTANCE,
        new int[] {1}, new int[] {1}, Arrays.asList(0f), Float.POSITIVE_INFINITY));
  }

  public void testConvertedToMutable() {
    CompactStringFst<Float> fst = CompactStringFst.fromFst(FstTestUtil.linear(1f, 1, 2));
    VectorFst<Float> vector = new VectorFst<>(fst);
    FstTestUtil.assertSameFst(fst, vector);
    vector.addArc(2, new Arc<>(1, 1, 0f, 0));
    assertEquals(2, fst.length());
  }
}
