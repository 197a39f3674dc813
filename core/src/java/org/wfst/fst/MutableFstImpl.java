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


import java.util.concurrent.atomic.AtomicInteger;

import org.wfst.semiring.Semiring;

/**
 * Backing store of a mutable automaton, reference counted so that several
 * {@link ImplToMutableFst} handles can share it until one of them writes.
 * Every mutator keeps the cached properties up to date.
 *
 * @lucene.internal
 */
public abstract class MutableFstImpl<W> extends FstImpl<W> {

  private final AtomicInteger ref = new AtomicInteger(1);

  protected MutableFstImpl(Semiring<W> semiring, String type) {
    super(semiring, type);
  }

  /** Number of handles sharing this store. */
  public final int refCount() {
    return ref.get();
  }

  final void incRef() {
    int count;
    while ((count = ref.get()) > 0) {
      if (ref.compareAndSet(count, count + 1)) {
        return;
      }
    }
    throw new IllegalStateException("store is already released");
  }

  final void decRef() {
    final int count = ref.decrementAndGet();
    assert count >= 0 : "refCount=" + count;
  }

  public abstract int start();

  public abstract W finalWeight(int s);

  public abstract int numStates();

  public abstract int numArcs(int s);

  public abstract int numInputEpsilons(int s);

  public abstract int numOutputEpsilons(int s);

  public abstract ArcIterator<W> arcIterator(int s);

  /** The {@code pos}-th arc leaving {@code s}. */
  public abstract Arc<W> arc(int s, int pos);

  public abstract void setStart(int s);

  public abstract void setFinal(int s, W weight);

  public abstract int addState();

  public abstract void addArc(int s, Arc<W> arc);

  /** Replaces the {@code pos}-th arc leaving {@code s}. */
  public abstract void setArc(int s, int pos, Arc<W> arc);

  public abstract void deleteStates(int[] states);

  public abstract void deleteStates();

  public abstract void deleteArcs(int s, int n);

  public abstract void deleteArcs(int s);

  public void reserveStates(int n) {
  }

  public void reserveArcs(int s, int n) {
  }

  /** Deep copy, with a reference count of one. */
  public abstract MutableFstImpl<W> copy();

  /** An empty store with copies of this store's symbol tables, and its error bit. */
  public abstract MutableFstImpl<W> emptyCopy();
}
