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
 * The general purpose mutable automaton: states and arcs held in arrays,
 * storage shared copy-on-write between {@link #copy(boolean) copies}.
 *
 * <pre class="prettyprint">
 *   VectorFst&lt;Float&gt; fst = new VectorFst&lt;&gt;(TropicalSemiring.INSTANCE);
 *   int s0 = fst.addState();
 *   int s1 = fst.addState();
 *   fst.setStart(s0);
 *   fst.addArc(s0, new Arc&lt;&gt;(1, 1, 0.5f, s1));
 *   fst.setFinal(s1);
 * </pre>
 *
 * @lucene.experimental
 */
public class VectorFst<W> extends ImplToMutableFst<W, VectorFstImpl<W>> {

  /** Type tag of this kind. */
  public static final String TYPE = "vector";

  /** Empty automaton. */
  public VectorFst(Semiring<W> semiring) {
    super(new VectorFstImpl<>(semiring));
  }

  /** Copies any automaton, expanding it if it is lazy. */
  public VectorFst(Fst<W> fst) {
    this(fst.semiring());
    Fsts.copy(fst, this);
  }

  private VectorFst(VectorFst<W> other, boolean safe) {
    super(other, safe);
  }

  @Override
  public VectorFst<W> copy(boolean safe) {
    return new VectorFst<>(this, safe);
  }

  @Override
  protected VectorFstImpl<W> copyImpl(VectorFstImpl<W> impl) {
    return impl.copy();
  }

  @Override
  protected VectorFstImpl<W> emptyImpl(VectorFstImpl<W> impl) {
    return impl.emptyCopy();
  }
}
