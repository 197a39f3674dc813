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


import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.lucene.util.ArrayUtil;
import org.wfst.semiring.Semiring;

/**
 * Computes property bits by visiting every state.  Local properties (labels,
 * weights, numbering) come from one pass over the arcs; cycle and
 * accessibility properties from an iterative Tarjan SCC traversal rooted at
 * the start state; the string property from walking the chain that leaves
 * the start state.
 */
final class PropertiesComputer<W> {

  private final Fst<W> fst;
  private final Semiring<W> semiring;

  // states in iteration order; ids may be sparse for lazy automata
  private int[] states = new int[16];
  private int numStates;
  private int maxState = -1;

  PropertiesComputer(Fst<W> fst) {
    this.fst = fst;
    this.semiring = fst.semiring();
  }

  long compute(long mask) {
    for (StateIterator it = fst.stateIterator(); !it.done(); it.next()) {
      final int s = it.value();
      states = ArrayUtil.grow(states, numStates + 1);
      states[numStates++] = s;
      maxState = Math.max(maxState, s);
    }
    if (numStates == 0) {
      return FstProperties.NULL_PROPERTIES;
    }
    long props = computeLocal();
    if ((mask & FstProperties.DFS_PROPERTIES) != 0) {
      props |= computeDfs();
    }
    if ((mask & (FstProperties.STRING | FstProperties.NOT_STRING)) != 0) {
      props |= isString() ? FstProperties.STRING : FstProperties.NOT_STRING;
    }
    return props;
  }

  private boolean isWeighted(W weight) {
    return semiring.isZero(weight) == false && semiring.isOne(weight) == false;
  }

  private long computeLocal() {
    boolean acceptor = true;
    boolean iDeterministic = true;
    boolean oDeterministic = true;
    boolean epsilons = false;
    boolean iEpsilons = false;
    boolean oEpsilons = false;
    boolean iSorted = true;
    boolean oSorted = true;
    boolean weighted = false;
    boolean topSorted = true;
    int[] ilabels = new int[8];
    int[] olabels = new int[8];
    for (int i = 0; i < numStates; i++) {
      final int s = states[i];
      int count = 0;
      Arc<W> prev = null;
      for (ArcIterator<W> it = fst.arcIterator(s); !it.done(); it.next()) {
        final Arc<W> arc = it.value();
        if (arc.ilabel != arc.olabel) {
          acceptor = false;
        }
        if (arc.ilabel == Arc.EPSILON) {
          iEpsilons = true;
          if (arc.olabel == Arc.EPSILON) {
            epsilons = true;
          }
        }
        if (arc.olabel == Arc.EPSILON) {
          oEpsilons = true;
        }
        if (prev != null) {
          if (prev.ilabel > arc.ilabel) {
            iSorted = false;
          }
          if (prev.olabel > arc.olabel) {
            oSorted = false;
          }
        }
        if (isWeighted(arc.weight)) {
          weighted = true;
        }
        if (arc.nextState <= s) {
          topSorted = false;
        }
        ilabels = ArrayUtil.grow(ilabels, count + 1);
        olabels = ArrayUtil.grow(olabels, count + 1);
        ilabels[count] = arc.ilabel;
        olabels[count] = arc.olabel;
        count++;
        prev = arc;
      }
      if (hasDuplicate(ilabels, count)) {
        iDeterministic = false;
      }
      if (hasDuplicate(olabels, count)) {
        oDeterministic = false;
      }
      if (isWeighted(fst.finalWeight(s))) {
        weighted = true;
      }
    }
    long props = 0;
    props |= acceptor ? FstProperties.ACCEPTOR : FstProperties.NOT_ACCEPTOR;
    props |= iDeterministic ? FstProperties.I_DETERMINISTIC : FstProperties.NON_I_DETERMINISTIC;
    props |= oDeterministic ? FstProperties.O_DETERMINISTIC : FstProperties.NON_O_DETERMINISTIC;
    props |= epsilons ? FstProperties.EPSILONS : FstProperties.NO_EPSILONS;
    props |= iEpsilons ? FstProperties.I_EPSILONS : FstProperties.NO_I_EPSILONS;
    props |= oEpsilons ? FstProperties.O_EPSILONS : FstProperties.NO_O_EPSILONS;
    props |= iSorted ? FstProperties.I_LABEL_SORTED : FstProperties.NOT_I_LABEL_SORTED;
    props |= oSorted ? FstProperties.O_LABEL_SORTED : FstProperties.NOT_O_LABEL_SORTED;
    props |= weighted ? FstProperties.WEIGHTED : FstProperties.UNWEIGHTED;
    props |= topSorted ? FstProperties.TOP_SORTED : FstProperties.NOT_TOP_SORTED;
    return props;
  }

  private static boolean hasDuplicate(int[] labels, int count) {
    if (count < 2) {
      return false;
    }
    Arrays.sort(labels, 0, count);
    for (int i = 1; i < count; i++) {
      if (labels[i] == labels[i - 1]) {
        return true;
      }
    }
    return false;
  }

  /** One frame of the explicit DFS stack. */
  private static final class Frame<W> {
    final int state;
    final ArcIterator<W> arcs;

    Frame(int state, ArcIterator<W> arcs) {
      this.state = state;
      this.arcs = arcs;
    }
  }

  private long computeDfs() {
    final int size = maxState + 1;
    final int[] index = new int[size];
    final int[] lowlink = new int[size];
    final boolean[] onStack = new boolean[size];
    final boolean[] coaccessible = new boolean[size];
    final int[] scc = new int[size];
    Arrays.fill(index, -1);
    Arrays.fill(scc, -1);

    int[] sccStack = new int[16];
    int sccStackSize = 0;
    final List<Frame<W>> dfs = new ArrayList<>();
    int nextIndex = 0;
    int nextScc = 0;

    boolean cyclic = false;
    boolean weightedCycles = false;
    boolean accessible = true;

    final int start = fst.start();
    for (int i = -1; i < numStates; i++) {
      final int root = i == -1 ? start : states[i];
      if (root == Fst.NO_STATE_ID || index[root] != -1) {
        continue;
      }
      if (i >= 0) {
        // not reached from the start state
        accessible = false;
      }
      index[root] = lowlink[root] = nextIndex++;
      sccStack = ArrayUtil.grow(sccStack, sccStackSize + 1);
      sccStack[sccStackSize++] = root;
      onStack[root] = true;
      dfs.add(new Frame<>(root, fst.arcIterator(root)));

      while (dfs.isEmpty() == false) {
        final Frame<W> frame = dfs.get(dfs.size() - 1);
        final int s = frame.state;
        if (frame.arcs.done() == false) {
          final Arc<W> arc = frame.arcs.value();
          frame.arcs.next();
          final int t = arc.nextState;
          if (t == s) {
            cyclic = true;
          }
          if (index[t] == -1) {
            index[t] = lowlink[t] = nextIndex++;
            sccStack = ArrayUtil.grow(sccStack, sccStackSize + 1);
            sccStack[sccStackSize++] = t;
            onStack[t] = true;
            dfs.add(new Frame<>(t, fst.arcIterator(t)));
          } else if (onStack[t]) {
            lowlink[s] = Math.min(lowlink[s], index[t]);
          } else if (coaccessible[t]) {
            coaccessible[s] = true;
          }
          continue;
        }

        // all arcs of s visited
        dfs.remove(dfs.size() - 1);
        if (semiring.isZero(fst.finalWeight(s)) == false) {
          coaccessible[s] = true;
        }
        if (dfs.isEmpty() == false) {
          final int parent = dfs.get(dfs.size() - 1).state;
          lowlink[parent] = Math.min(lowlink[parent], lowlink[s]);
          if (coaccessible[s]) {
            coaccessible[parent] = true;
          }
        }
        if (lowlink[s] == index[s]) {
          // s is the root of a strongly connected component
          boolean sccCoaccessible = false;
          int first = sccStackSize - 1;
          while (sccStack[first] != s) {
            first--;
          }
          if (sccStackSize - first > 1) {
            cyclic = true;
          }
          for (int k = first; k < sccStackSize; k++) {
            sccCoaccessible |= coaccessible[sccStack[k]];
          }
          for (int k = first; k < sccStackSize; k++) {
            final int member = sccStack[k];
            onStack[member] = false;
            scc[member] = nextScc;
            coaccessible[member] = sccCoaccessible;
          }
          sccStackSize = first;
          nextScc++;
        }
      }
    }

    boolean allCoaccessible = true;
    for (int i = 0; i < numStates; i++) {
      final int s = states[i];
      if (coaccessible[s] == false) {
        allCoaccessible = false;
      }
      for (ArcIterator<W> it = fst.arcIterator(s); !it.done(); it.next()) {
        final Arc<W> arc = it.value();
        if (scc[arc.nextState] == scc[s] && semiring.isOne(arc.weight) == false) {
          weightedCycles = true;
        }
      }
    }

    boolean initialCyclic = false;
    if (start != Fst.NO_STATE_ID) {
      for (int i = 0; i < numStates && initialCyclic == false; i++) {
        final int s = states[i];
        if (scc[s] != scc[start]) {
          continue;
        }
        for (ArcIterator<W> it = fst.arcIterator(s); !it.done(); it.next()) {
          if (scc[it.value().nextState] == scc[start]) {
            initialCyclic = true;
            break;
          }
        }
      }
    } else {
      accessible = numStates == 0;
    }

    long props = 0;
    props |= cyclic ? FstProperties.CYCLIC : FstProperties.ACYCLIC;
    props |= initialCyclic ? FstProperties.INITIAL_CYCLIC : FstProperties.INITIAL_ACYCLIC;
    props |= accessible ? FstProperties.ACCESSIBLE : FstProperties.NOT_ACCESSIBLE;
    props |= allCoaccessible ? FstProperties.COACCESSIBLE : FstProperties.NOT_COACCESSIBLE;
    props |= weightedCycles ? FstProperties.WEIGHTED_CYCLES : FstProperties.UNWEIGHTED_CYCLES;
    return props;
  }

  private boolean isString() {
    int s = fst.start();
    if (s == Fst.NO_STATE_ID) {
      return false;
    }
    int length = 1;
    while (length <= numStates) {
      final int numArcs = fst.numArcs(s);
      final boolean isFinal = semiring.isZero(fst.finalWeight(s)) == false;
      if (numArcs == 0) {
        return isFinal && length == numStates;
      }
      if (numArcs > 1 || isFinal) {
        return false;
      }
      final ArcIterator<W> it = fst.arcIterator(s);
      s = it.value().nextState;
      length++;
    }
    // walked into a cycle
    return false;
  }
}
