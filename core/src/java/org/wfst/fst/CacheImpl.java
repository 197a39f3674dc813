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


import org.apache.lucene.util.ArrayUtil;
import org.wfst.semiring.Semiring;

/**
 * Computes the states of a lazy automaton on demand and memoizes them.  A
 * state goes from "not computed" to "cached" the first time its final
 * weight or arcs are asked for, and never back; the automata it is
 * computed from must therefore not change while this instance is in use.
 *
 * <p>Not thread safe.</p>
 *
 * @lucene.internal
 */
public abstract class CacheImpl<W> extends FstImpl<W> {

  private CacheState<W>[] cache;
  private boolean hasStart;
  private int start;
  private int numCached;

  @SuppressWarnings("unchecked")
  protected CacheImpl(Semiring<W> semiring, String type) {
    super(semiring, type);
    cache = (CacheState<W>[]) new CacheState[0];
  }

  /** Computes the start state. */
  protected abstract int computeStart();

  /** Computes the final weight of {@code s}. */
  protected abstract W computeFinal(int s);

  /** Adds the arcs leaving {@code s} to {@code state}. */
  protected abstract void expand(int s, CacheState<W> state);

  /** A new instance with an empty cache, computing from independent copies of its inputs. */
  public abstract CacheImpl<W> copy();

  public final int start() {
    if (hasStart == false) {
      start = computeStart();
      hasStart = true;
    }
    return start;
  }

  private CacheState<W> state(int s) {
    assert s >= 0 : "s=" + s;
    if (s >= cache.length) {
      cache = ArrayUtil.grow(cache, s + 1);
    }
    CacheState<W> state = cache[s];
    if (state == null) {
      state = new CacheState<>(computeFinal(s));
      expand(s, state);
      cache[s] = state;
      numCached++;
    }
    return state;
  }

  public final W finalWeight(int s) {
    return state(s).finalWeight();
  }

  public final int numArcs(int s) {
    return state(s).numArcs();
  }

  public final int numInputEpsilons(int s) {
    return state(s).numInputEpsilons();
  }

  public final int numOutputEpsilons(int s) {
    return state(s).numOutputEpsilons();
  }

  public final ArcIterator<W> arcIterator(int s) {
    return state(s).arcIterator();
  }

  /** Number of states computed so far. */
  public final int numCachedStates() {
    return numCached;
  }
}
