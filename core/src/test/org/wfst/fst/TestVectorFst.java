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


import java.util.List;

import org.apache.lucene.util.LuceneTestCase;
import org.wfst.semiring.TropicalSemiring;

public class TestVectorFst extends LuceneTestCase {

  public void testEmpty() {
    VectorFst<Float> fst = new VectorFst<>(TropicalSemiring.INSTANCE);
    assertEquals(0, fst.numStates());
    assertEquals(Fst.NO_STATE_ID, fst.start());
    assertEquals(VectorFst.TYPE, fst.type());
    assertNull(fst.inputSymbols());
    assertNull(fst.outputSymbols());
    assertTrue(fst.stateIterator().done());
  }

  public void testAddStatesAndArcs() {
    VectorFst<Float> fst = new VectorFst<>(TropicalSemiring.INSTANCE);
    assertEquals(0, fst.addState());
    assertEquals(1, fst.addState());
    assertEquals(2, fst.addState());
    fst.setStart(0);
    fst.addArc(0, new Arc<>(1, 2, 0.5f, 1));
    fst.addArc(0, new Arc<>(0, 3, 1f, 2));
    fst.addArc(0, new Arc<>(0, 0, 0f, 2));
    fst.addArc(1, new Arc<>(4, 0, 0f, 2));
    fst.setFinal(2);
    assertEquals(0f, fst.finalWeight(2), 0f);
    assertTrue(TropicalSemiring.INSTANCE.isZero(fst.finalWeight(1)));
    assertEquals(3, fst.numArcs(0));
    assertEquals(2, fst.numInputEpsilons(0));
    assertEquals(1, fst.numOutputEpsilons(0));
    assertEquals(0, fst.numInputEpsilons(1));
    assertEquals(1, fst.numOutputEpsilons(1));

    List<Arc<Float>> arcs = FstTestUtil.arcs(fst, 0);
    assertEquals(new Arc<>(1, 2, 0.5f, 1), arcs.get(0));
    assertEquals(new Arc<>(0, 0, 0f, 2), arcs.get(2));

    ArcIterator<Float> it = fst.arcIterator(0);
    it.seek(1);
    assertEquals(1, it.position());
    assertEquals(new Arc<>(0, 3, 1f, 2), it.value());
    it.next();
    it.next();
    assertTrue(it.done());
    it.reset();
    assertEquals(0, it.position());
    assertFalse(it.done());
  }

  public void testAddStates() {
    VectorFst<Float> fst = new VectorFst<>(TropicalSemiring.INSTANCE);
    fst.reserveStates(10);
    fst.addStates(5);
    assertEquals(5, fst.numStates());
    fst.reserveArcs(4, 3);
    assertEquals(0, fst.numArcs(4));
    assertEquals(5, fst.addState());
  }

  /** Chain 0 -> 1 -> 2 -> 3 -> 4, final weights identify the states. */
  private static VectorFst<Float> chain() {
    VectorFst<Float> fst = new VectorFst<>(TropicalSemiring.INSTANCE);
    fst.addStates(5);
    fst.setStart(0);
    for (int s = 0; s < 5; s++) {
      fst.setFinal(s, 10f + s);
      if (s < 4) {
        fst.addArc(s, new Arc<>(s + 1, s + 1, 0f, s + 1));
      }
    }
    // back arc into the state that gets deleted
    fst.addArc(4, new Arc<>(0, 0, 0f, 2));
    fst.addArc(4, new Arc<>(9, 9, 0f, 0));
    return fst;
  }

  public void testDeleteStatesCompacts() {
    VectorFst<Float> fst = chain();
    fst.deleteStates(new int[] {2});
    assertEquals(4, fst.numStates());
    assertEquals(0, fst.start());
    // survivors keep their order
    assertEquals(10f, fst.finalWeight(0), 0f);
    assertEquals(11f, fst.finalWeight(1), 0f);
    assertEquals(13f, fst.finalWeight(2), 0f);
    assertEquals(14f, fst.finalWeight(3), 0f);
    // the arc 1 -> 2 is gone, 3 -> 4 became 2 -> 3
    assertEquals(0, fst.numArcs(1));
    assertEquals(new Arc<>(4, 4, 0f, 3), FstTestUtil.arcs(fst, 2).get(0));
    // the epsilon arc into the deleted state is gone
    assertEquals(1, fst.numArcs(3));
    assertEquals(0, fst.numInputEpsilons(3));
    assertEquals(new Arc<>(9, 9, 0f, 0), FstTestUtil.arcs(fst, 3).get(0));
    for (int s = 0; s < fst.numStates(); s++) {
      for (Arc<Float> arc : FstTestUtil.arcs(fst, s)) {
        assertTrue(arc.nextState < fst.numStates());
      }
    }
  }

  public void testDeleteStartState() {
    VectorFst<Float> fst = chain();
    fst.deleteStates(new int[] {0, 3});
    assertEquals(3, fst.numStates());
    assertEquals(Fst.NO_STATE_ID, fst.start());
    assertEquals(11f, fst.finalWeight(0), 0f);
    assertEquals(12f, fst.finalWeight(1), 0f);
    assertEquals(14f, fst.finalWeight(2), 0f);
  }

  public void testStartIsRenumbered() {
    VectorFst<Float> fst = chain();
    fst.setStart(3);
    fst.deleteStates(new int[] {1});
    assertEquals(2, fst.start());
    assertEquals(13f, fst.finalWeight(fst.start()), 0f);
  }

  public void testDeleteAllStatesKeepsSymbols() {
    VectorFst<Float> fst = chain();
    fst.setInputSymbols(FstTestUtil.symbols("in", "a", "b"));
    fst.deleteStates();
    assertEquals(0, fst.numStates());
    assertEquals(Fst.NO_STATE_ID, fst.start());
    assertEquals(FstTestUtil.symbols("in", "a", "b"), fst.inputSymbols());
    assertNull(fst.outputSymbols());
  }

  public void testDeleteArcsRemovesLeadingArcs() {
    VectorFst<Float> fst = new VectorFst<>(TropicalSemiring.INSTANCE);
    fst.addStates(2);
    fst.addArc(0, new Arc<>(0, 0, 0f, 1));
    fst.addArc(0, new Arc<>(1, 0, 0f, 1));
    fst.addArc(0, new Arc<>(2, 2, 0f, 1));
    assertEquals(2, fst.numInputEpsilons(0));
    assertEquals(2, fst.numOutputEpsilons(0));
    fst.deleteArcs(0, 2);
    assertEquals(1, fst.numArcs(0));
    assertEquals(new Arc<>(2, 2, 0f, 1), FstTestUtil.arcs(fst, 0).get(0));
    assertEquals(0, fst.numInputEpsilons(0));
    assertEquals(0, fst.numOutputEpsilons(0));
    fst.deleteArcs(0);
    assertEquals(0, fst.numArcs(0));
  }

  public void testSymbolTablesAreCopied() {
    VectorFst<Float> fst = new VectorFst<>(TropicalSemiring.INSTANCE);
    SymbolTable table = FstTestUtil.symbols("in", "a");
    fst.setInputSymbols(table);
    table.addSymbol("b");
    assertEquals(2, fst.inputSymbols().numSymbols());
    assertNotSame(table, fst.inputSymbols());

    fst.mutableInputSymbols().addSymbol("c");
    assertEquals(2, fst.inputSymbols().find("c"));
    fst.setInputSymbols(null);
    assertNull(fst.inputSymbols());
  }

  public void testCopyConstructor() {
    VectorFst<Float> source = FstTestUtil.linear(1f, 1, 2);
    VectorFst<Float> copy = new VectorFst<>(source);
    FstTestUtil.assertSameFst(source, copy);
    assertEquals(1f, FstTestUtil.acceptWeight(copy, 1, 2), 0f);
  }

  public void testStateIterator() {
    VectorFst<Float> fst = chain();
    int expected = 0;
    for (StateIterator it = fst.stateIterator(); !it.done(); it.next()) {
      assertEquals(expected++, it.value());
    }
    assertEquals(5, expected);
  }
}
