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
 * Handle on a reference-counted {@link MutableFstImpl}.  Cheap copies share
 * the store; every mutator first checks that this handle is the only one
 * holding the store and, if it is not, switches to a private deep copy.
 *
 * <p>A handle dropped without mutating keeps its reference, which can at
 * worst cause one extra copy in another handle.</p>
 *
 * @lucene.internal
 */
public abstract class ImplToMutableFst<W, I extends MutableFstImpl<W>> implements MutableFst<W> {

  private I impl;

  protected ImplToMutableFst(I impl) {
    this.impl = impl;
  }

  /** Shares {@code other}'s store, or deep-copies it if {@code safe}. */
  protected ImplToMutableFst(ImplToMutableFst<W, I> other, boolean safe) {
    if (safe) {
      this.impl = copyImpl(other.impl);
    } else {
      other.impl.incRef();
      this.impl = other.impl;
    }
  }

  /** Deep copy of {@code impl}. */
  protected abstract I copyImpl(I impl);

  /** Empty store carrying {@code impl}'s symbol tables. */
  protected abstract I emptyImpl(I impl);

  protected final I getImpl() {
    return impl;
  }

  private void setImpl(I newImpl) {
    if (newImpl != impl) {
      impl.decRef();
      impl = newImpl;
    }
  }

  /** Privatizes the store if another handle shares it. */
  protected final void mutateCheck() {
    if (impl.refCount() != 1) {
      setImpl(copyImpl(impl));
    }
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
  public int numStates() {
    return impl.numStates();
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
    return new DenseStateIterator(impl.numStates());
  }

  @Override
  public long properties(long mask, boolean test) {
    if (test) {
      final long stored = impl.properties();
      final long updated = FstProperties.testProperties(this, stored, mask);
      if (updated != stored) {
        // only intrinsic bits were added, which hold for every handle on the store
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

  @Override
  public void setStart(int s) {
    mutateCheck();
    impl.setStart(s);
  }

  @Override
  public void setFinal(int s, W weight) {
    mutateCheck();
    impl.setFinal(s, weight);
  }

  @Override
  public void setProperties(long props, long mask) {
    final long exprops = FstProperties.EXTRINSIC_PROPERTIES & mask;
    if (impl.properties(exprops) != (props & exprops)) {
      mutateCheck();
    }
    impl.setProperties(props, mask);
  }

  @Override
  public int addState() {
    mutateCheck();
    return impl.addState();
  }

  @Override
  public void addArc(int s, Arc<W> arc) {
    mutateCheck();
    impl.addArc(s, arc);
  }

  @Override
  public void deleteStates(int[] states) {
    mutateCheck();
    impl.deleteStates(states);
  }

  @Override
  public void deleteStates() {
    if (impl.refCount() != 1) {
      // nothing to keep but the symbol tables
      setImpl(emptyImpl(impl));
    } else {
      impl.deleteStates();
    }
  }

  @Override
  public void deleteArcs(int s, int n) {
    mutateCheck();
    impl.deleteArcs(s, n);
  }

  @Override
  public void deleteArcs(int s) {
    mutateCheck();
    impl.deleteArcs(s);
  }

  @Override
  public void reserveStates(int n) {
    mutateCheck();
    impl.reserveStates(n);
  }

  @Override
  public void reserveArcs(int s, int n) {
    mutateCheck();
    impl.reserveArcs(s, n);
  }

  @Override
  public SymbolTable mutableInputSymbols() {
    mutateCheck();
    return impl.inputSymbols();
  }

  @Override
  public SymbolTable mutableOutputSymbols() {
    mutateCheck();
    return impl.outputSymbols();
  }

  @Override
  public void setInputSymbols(SymbolTable symbols) {
    mutateCheck();
    impl.setInputSymbols(symbols == null ? null : symbols.copy());
  }

  @Override
  public void setOutputSymbols(SymbolTable symbols) {
    mutateCheck();
    impl.setOutputSymbols(symbols == null ? null : symbols.copy());
  }

  @Override
  public MutableArcIterator<W> mutableArcIterator(int s) {
    mutateCheck();
    return new StoreArcIterator(s);
  }

  /**
   * Cursor over the arcs of one state of this handle.  It always goes
   * through the handle's current store, so a cheap copy taken while the
   * cursor is open never sees its writes.
   */
  private final class StoreArcIterator implements MutableArcIterator<W> {
    private final int state;
    private int pos;

    StoreArcIterator(int state) {
      this.state = state;
    }

    @Override
    public boolean done() {
      return pos >= impl.numArcs(state);
    }

    @Override
    public Arc<W> value() {
      return impl.arc(state, pos);
    }

    @Override
    public void next() {
      ++pos;
    }

    @Override
    public int position() {
      return pos;
    }

    @Override
    public void reset() {
      pos = 0;
    }

    @Override
    public void seek(int position) {
      pos = position;
    }

    @Override
    public void setValue(Arc<W> arc) {
      // no copy unless a handle started sharing the store after the cursor was opened
      mutateCheck();
      impl.setArc(state, pos, arc);
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(type=" + type() + ", semiring=" + semiring().type()
        + ", numStates=" + numStates() + ", start=" + start() + ")";
  }
}
