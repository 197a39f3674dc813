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


import org.apache.lucene.util.LuceneTestCase;
import org.wfst.semiring.TropicalSemiring;

import static org.wfst.fst.FstProperties.*;

public class TestFstProperties extends LuceneTestCase {

  public void testEmptyAutomaton() {
    VectorFst<Float> fst = new VectorFst<>(TropicalSemiring.INSTANCE);
    assertEquals(NULL_PROPERTIES | EXPANDED | MUTABLE, fst.properties(FST_PROPERTIES, false));
    assertEquals(NULL_PROPERTIES, computeProperties(fst, TRINARY_PROPERTIES));
  }

  public void testKnownProperties() {
    long known = knownProperties(ACCEPTOR | NOT_STRING);
    assertEquals(BINARY_PROPERTIES | ACCEPTOR | NOT_ACCEPTOR | STRING | NOT_STRING, known);
    assertEquals(BINARY_PROPERTIES, knownProperties(0));
    assertTrue(compatProperties(ACCEPTOR | CYCLIC, ACCEPTOR | STRING));
    assertFalse(compatProperties(ACCEPTOR, NOT_ACCEPTOR));
    assertFalse(compatProperties(ERROR, 0));
  }

  public void testComputedPropertiesAreComplete() {
    for (int iter = 0; iter < atLeast(20); iter++) {
      VectorFst<Float> fst = FstTestUtil.randomFst(random(), random().nextInt(8), 3);
      long props = computeProperties(fst, TRINARY_PROPERTIES);
      assertEquals(TRINARY_PROPERTIES, knownProperties(props) & TRINARY_PROPERTIES);
    }
  }

  /** The incrementally maintained bits never contradict a full recomputation. */
  public void testIncrementalPropertiesAreSound() {
    for (int iter = 0; iter < atLeast(50); iter++) {
      VectorFst<Float> fst = FstTestUtil.randomFst(random(), 1 + random().nextInt(8), 3);
      assertCompatible(fst);
      switch (random().nextInt(5)) {
        case 0:
          fst.deleteStates(new int[] {random().nextInt(fst.numStates())});
          break;
        case 1:
          fst.deleteArcs(random().nextInt(fst.numStates()));
          break;
        case 2:
          fst.setFinal(random().nextInt(fst.numStates()), 3f);
          break;
        case 3:
          fst.setStart(random().nextInt(fst.numStates()));
          break;
        default:
          int s = fst.addState();
          fst.addArc(random().nextInt(s), new Arc<>(1, 2, 0f, s));
          break;
      }
      assertCompatible(fst);
    }
  }

  private static void assertCompatible(VectorFst<Float> fst) {
    long stored = fst.properties(FST_PROPERTIES, false);
    long computed = computeProperties(fst, TRINARY_PROPERTIES);
    assertTrue("stored=0x" + Long.toHexString(stored) + " computed=0x" + Long.toHexString(computed),
        compatProperties(stored, computed | EXPANDED | MUTABLE));
  }

  public void testTestComputesAndCaches() {
    VectorFst<Float> fst = FstTestUtil.linear(0f, 1, 2, 3);
    // a string built front to back
    fst.setProperties(0, CYCLIC | ACYCLIC | STRING | NOT_STRING);
    assertEquals(0, fst.properties(STRING | NOT_STRING, false));
    assertEquals(STRING, fst.properties(STRING | NOT_STRING, true));
    assertEquals(STRING, fst.properties(STRING | NOT_STRING, false));
    assertEquals(ACYCLIC, fst.properties(CYCLIC | ACYCLIC, true));
  }

  public void testCyclic() {
    VectorFst<Float> fst = FstTestUtil.linear(0f, 1, 2);
    fst.addArc(2, new Arc<>(3, 3, 0f, 1));
    long props = computeProperties(fst, TRINARY_PROPERTIES);
    assertEquals(CYCLIC, props & (CYCLIC | ACYCLIC));
    assertEquals(INITIAL_ACYCLIC, props & (INITIAL_CYCLIC | INITIAL_ACYCLIC));
    assertEquals(NOT_TOP_SORTED, props & (TOP_SORTED | NOT_TOP_SORTED));
    assertEquals(UNWEIGHTED_CYCLES, props & (WEIGHTED_CYCLES | UNWEIGHTED_CYCLES));
    assertEquals(NOT_STRING, props & (STRING | NOT_STRING));

    fst.addArc(1, new Arc<>(4, 4, 1f, 0));
    props = computeProperties(fst, TRINARY_PROPERTIES);
    assertEquals(INITIAL_CYCLIC, props & (INITIAL_CYCLIC | INITIAL_ACYCLIC));
    assertEquals(WEIGHTED_CYCLES, props & (WEIGHTED_CYCLES | UNWEIGHTED_CYCLES));
  }

  public void testSelfLoop() {
    VectorFst<Float> fst = FstTestUtil.linear(0f, 1);
    fst.addArc(0, new Arc<>(2, 2, 0f, 0));
    long props = computeProperties(fst, TRINARY_PROPERTIES);
    assertEquals(CYCLIC | INITIAL_CYCLIC, props & (CYCLIC | ACYCLIC | INITIAL_CYCLIC | INITIAL_ACYCLIC));
  }

  public void testAccessibility() {
    VectorFst<Float> fst = FstTestUtil.linear(0f, 1);
    int unreachable = fst.addState();
    fst.addArc(unreachable, new Arc<>(1, 1, 0f, 1));
    int dead = fst.addState();
    fst.addArc(0, new Arc<>(2, 2, 0f, dead));
    long props = computeProperties(fst, TRINARY_PROPERTIES);
    assertEquals(NOT_ACCESSIBLE, props & (ACCESSIBLE | NOT_ACCESSIBLE));
    assertEquals(NOT_COACCESSIBLE, props & (COACCESSIBLE | NOT_COACCESSIBLE));

    fst.deleteStates(new int[] {unreachable, dead});
    props = computeProperties(fst, TRINARY_PROPERTIES);
    assertEquals(ACCESSIBLE | COACCESSIBLE,
        props & (ACCESSIBLE | NOT_ACCESSIBLE | COACCESSIBLE | NOT_COACCESSIBLE));
  }

  public void testLabelsAndWeights() {
    VectorFst<Float> fst = new VectorFst<>(TropicalSemiring.INSTANCE);
    fst.addStates(2);
    fst.setStart(0);
    fst.setFinal(1);
    fst.addArc(0, new Arc<>(2, 0, 0f, 1));
    fst.addArc(0, new Arc<>(1, 3, 0.5f, 1));
    long props = computeProperties(fst, TRINARY_PROPERTIES);
    assertEquals(NOT_ACCEPTOR, props & (ACCEPTOR | NOT_ACCEPTOR));
    assertEquals(NOT_I_LABEL_SORTED, props & (I_LABEL_SORTED | NOT_I_LABEL_SORTED));
    assertEquals(O_LABEL_SORTED, props & (O_LABEL_SORTED | NOT_O_LABEL_SORTED));
    assertEquals(NO_I_EPSILONS | O_EPSILONS,
        props & (I_EPSILONS | NO_I_EPSILONS | O_EPSILONS | NO_O_EPSILONS));
    assertEquals(NO_EPSILONS, props & (EPSILONS | NO_EPSILONS));
    assertEquals(WEIGHTED, props & (WEIGHTED | UNWEIGHTED));
    assertEquals(I_DETERMINISTIC | O_DETERMINISTIC,
        props & (I_DETERMINISTIC | NON_I_DETERMINISTIC | O_DETERMINISTIC | NON_O_DETERMINISTIC));
    assertEquals(NOT_STRING, props & (STRING | NOT_STRING));
    // the incremental bits agree
    assertTrue(compatProperties(fst.properties(FST_PROPERTIES, false), props | EXPANDED | MUTABLE));
  }

  public void testNegativeZeroWeightIsUnweighted() {
    VectorFst<Float> fst = new VectorFst<>(TropicalSemiring.INSTANCE);
    fst.addStates(2);
    fst.setStart(0);
    fst.setFinal(1, -0f);
    fst.addArc(0, new Arc<>(1, 1, -0f, 1));
    assertEquals(0, fst.properties(WEIGHTED, false));
    long props = computeProperties(fst, TRINARY_PROPERTIES);
    assertEquals(UNWEIGHTED, props & (WEIGHTED | UNWEIGHTED));
    assertTrue(compatProperties(fst.properties(FST_PROPERTIES, false), props | EXPANDED | MUTABLE));
  }

  public void testInvertProperties() {
    long props = ACCEPTOR | I_DETERMINISTIC | NON_O_DETERMINISTIC | I_EPSILONS | NO_O_EPSILONS
        | NOT_I_LABEL_SORTED | CYCLIC | ERROR;
    long inverted = invertProperties(props);
    assertEquals(ACCEPTOR | O_DETERMINISTIC | NON_I_DETERMINISTIC | O_EPSILONS | NO_I_EPSILONS
        | NOT_O_LABEL_SORTED | CYCLIC | ERROR, inverted);
    assertEquals(props, invertProperties(inverted));
  }

  public void testClosureProperties() {
    long props = EXPANDED | MUTABLE | ACCEPTOR | UNWEIGHTED | ACCESSIBLE | COACCESSIBLE | ACYCLIC | STRING;
    long star = closureProperties(props, true, false);
    assertEquals(INITIAL_ACYCLIC, star & INITIAL_ACYCLIC);
    assertEquals(0, star & (ACYCLIC | STRING));
    assertEquals(ACCEPTOR | UNWEIGHTED | UNWEIGHTED_CYCLES, star & (ACCEPTOR | UNWEIGHTED | UNWEIGHTED_CYCLES));
    assertEquals(EXPANDED | MUTABLE, star & (EXPANDED | MUTABLE));
    assertEquals(0, closureProperties(props, false, true) & (EXPANDED | MUTABLE | INITIAL_ACYCLIC));
  }

  public void testErrorPropagates() {
    assertEquals(ERROR, unionProperties(ERROR, 0, false) & ERROR);
    assertEquals(ERROR, concatProperties(0, ERROR, true) & ERROR);
    assertEquals(ERROR, closureProperties(ERROR, true, true) & ERROR);
    assertEquals(ERROR, deleteAllStatesProperties(ERROR | CYCLIC, STATIC_PROPERTIES) & ERROR);
  }
}
