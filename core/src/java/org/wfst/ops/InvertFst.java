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
package org.wfst.ops;


import org.wfst.fst.Fst;

/**
 * Inversion computed on demand: input and output labels of every arc are
 * swapped, and so are the symbol tables.  The tables are captured when
 * the automaton is created.
 *
 * @lucene.experimental
 * @see Invert
 */
public final class InvertFst<W> extends ArcMapFst<W> {

  /** Type tag. */
  public static final String TYPE = "invert";

  public InvertFst(Fst<W> fst) {
    super(new ArcMapFstImpl<>(fst, new InvertMapper<>(), TYPE, fst.outputSymbols(), fst.inputSymbols()));
  }

  private InvertFst(ArcMapFstImpl<W> impl) {
    super(impl);
  }

  @Override
  public InvertFst<W> copy(boolean safe) {
    return new InvertFst<>(safe ? getImpl().copy() : getImpl());
  }
}
