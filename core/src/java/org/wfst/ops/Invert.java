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
import org.wfst.fst.MutableFst;
import org.wfst.fst.SymbolTable;

/**
 * Inversion computed eagerly: input and output labels of every arc are
 * swapped, and so are the input and output symbol tables.  No state, arc
 * or weight is added, removed or changed otherwise, so inverting twice
 * gives back the original.
 *
 * @lucene.experimental
 * @see InvertFst
 */
public final class Invert {

  private Invert() {
  }

  /** Inverts {@code fst} in place. */
  public static <W> void invert(MutableFst<W> fst) {
    final SymbolTable isymbols = fst.inputSymbols();
    final SymbolTable osymbols = fst.outputSymbols();
    ArcMap.map(fst, new InvertMapper<>());
    fst.setInputSymbols(osymbols);
    fst.setOutputSymbols(isymbols);
  }

  /** Replaces the contents of {@code ofst} with the inversion of {@code ifst}. */
  public static <W> void invert(Fst<W> ifst, MutableFst<W> ofst) {
    ArcMap.map(ifst, ofst, new InvertMapper<>());
    ofst.setInputSymbols(ifst.outputSymbols());
    ofst.setOutputSymbols(ifst.inputSymbols());
  }
}
