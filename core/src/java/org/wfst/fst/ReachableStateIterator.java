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
import java.util.BitSet;
import java.util.List;

/**
 * Breadth-first discovery of the states reachable from the start.  Each
 * state's arcs are read once, when the iterator first reaches it, which for
 * a lazily computed automaton is when the state gets expanded.
 *
 * @lucene.internal
 */
final class ReachableStateIterator<W> implements StateIterator {

  private final Fst<W> fst;
  private final BitSet seen = new BitSet();
  // 已发现的状态 按发现顺序排列
  private final List<Integer> order = new ArrayList<>();
  private int pos;
  // how many entries of order had their arcs scanned
  private int scanned;

  ReachableStateIterator(Fst<W> fst) {
    this.fst = fst;
    final int start = fst.start();
    if (start != Fst.NO_STATE_ID) {
      seen.set(start);
      order.add(start);
    }
  }

  @Override
  public boolean done() {
    // 只有在已发现的状态都被访问过 且没有新的后继时才算结束
    while (pos >= order.size() && scanned < order.size()) {
      scan(order.get(scanned++));
    }
    return pos >= order.size();
  }

  @Override
  public int value() {
    return order.get(pos);
  }

  @Override
  public void next() {
    if (scanned <= pos) {
      scan(order.get(scanned++));
    }
    ++pos;
  }

  @Override
  public void reset() {
    pos = 0;
  }

  private void scan(int s) {
    for (ArcIterator<W> it = fst.arcIterator(s); !it.done(); it.next()) {
      final int next = it.value().nextState;
      if (seen.get(next) == false) {
        seen.set(next);
        order.add(next);
      }
    }
  }
}
