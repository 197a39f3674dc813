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
 * State shared by every automaton implementation: type tag, semiring,
 * cached properties and symbol tables.
 *
 * @lucene.internal
 */
public abstract class FstImpl<W> {

  protected final Semiring<W> semiring;
  protected final String type;
  private long properties;
  protected SymbolTable isymbols;
  protected SymbolTable osymbols;

  protected FstImpl(Semiring<W> semiring, String type) {
    this.semiring = semiring;
    this.type = type;
  }

  public final Semiring<W> semiring() {
    return semiring;
  }

  public final String type() {
    return type;
  }

  public final long properties() {
    return properties;
  }

  public final long properties(long mask) {
    return properties & mask;
  }

  /** Replaces all property bits, except that {@link FstProperties#ERROR} stays set once set. */
  public final void setProperties(long props) {
    properties = props | (properties & FstProperties.ERROR);
  }

  /** Replaces the property bits in {@code mask}; {@link FstProperties#ERROR} stays set once set. */
  public final void setProperties(long props, long mask) {
    final long error = properties & FstProperties.ERROR;
    properties = (properties & ~mask) | (props & mask) | error;
  }

  public final SymbolTable inputSymbols() {
    return isymbols;
  }

  public final SymbolTable outputSymbols() {
    return osymbols;
  }

  /** Stores {@code symbols} as is; callers pass a copy they own. */
  public final void setInputSymbols(SymbolTable symbols) {
    isymbols = symbols;
  }

  /** Stores {@code symbols} as is; callers pass a copy they own. */
  public final void setOutputSymbols(SymbolTable symbols) {
    osymbols = symbols;
  }
}
