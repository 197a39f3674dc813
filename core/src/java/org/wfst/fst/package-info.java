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

/**
 * Weighted finite-state transducers.
 *
 * <p>{@link org.wfst.fst.Fst} is the read-only view every automaton
 * offers; {@link org.wfst.fst.ExpandedFst} adds the state count and
 * {@link org.wfst.fst.MutableFst} the mutators.  {@link org.wfst.fst.VectorFst}
 * is the general purpose mutable kind, sharing its storage copy-on-write;
 * {@link org.wfst.fst.CompactStringFst} an immutable encoding of a single
 * path; {@link org.wfst.fst.CacheFst} the base of lazily computed automata.</p>
 *
 * <p>Automata are serialized through the {@link org.wfst.fst.FstFormat}
 * registry, keyed by {@link org.wfst.fst.Fst#type()}.</p>
 */
package org.wfst.fst;
