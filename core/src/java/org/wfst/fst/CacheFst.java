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


import org.wfst.semiring.Semiring;

/**
 * Read-only automaton whose states are computed on demand by a
 * {@link CacheImpl}.  Its states are those reachable from the start, and
 * {@link #stateIterator()} visits them in discovery order, expanding them
 * as it goes.
 *
 * <p>{@code copy(false)} shares the cache; {@code copy(true)} starts a new
 * cache over independent copies of the inputs.</p>
 *
 * @lucene.experimental
 */
public abstract class CacheFst<W, I extends CacheImpl<W>> implements Fst<W> {

  private final I impl;

  protected CacheFst(I impl) {
    this.impl = impl;
  }

  protected final I getImpl() {
    return impl;
  }

  @Override
  public int start() {
    return impl.start();
  }

  @Override
  public W finalWeight(int s) {
    return impl.finalWeight(s);
  }

  @Override
  public int numArcs(int s) {
    return impl.numArcs(s);
  }

  @Override
  public int numInputEpsilons(int s) {
    return impl.numInputEpsilons(s);
  }

  @Override
  public int numOutputEpsilons(int s) {
    return impl.numOutputEpsilons(s);
  }

  @Override
  public ArcIterator<W> arcIterator(int s) {
    return impl.arcIterator(s);
  }

  @Override
  public StateIterator stateIterator() {
    return new ReachableStateIterator<>(this);
  }

  @Override
  public long properties(long mask, boolean test) {
    if (test) {
      final long stored = impl.properties();
      final long updated = FstProperties.testProperties(this, stored, mask);
      if (updated != stored) {
        impl.setProperties(updated);
      }
    }
    return impl.properties(mask);
  }

  @Override
  public String type() {
    return impl.type();
  }

  @Override
  public Semiring<W> semiring() {
    return impl.semiring();
  }

  @Override
  public SymbolTable inputSymbols() {
    return impl.inputSymbols();
  }

  @Override
  public SymbolTable outputSymbols() {
    return impl.outputSymbols();
  }

  /** Number of states computed so far; shared by copies made with {@code safe == false}. */
  public int numCachedStates() {
    return impl.numCachedStates();
  }

  @Override
  public abstract CacheFst<W, I> copy(boolean safe);

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(type=" + type() + ", semiring=" + semiring().type() + ")";
  }
}
