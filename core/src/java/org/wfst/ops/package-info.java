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
 * Rational operations on automata.  Each comes in two forms: a static
 * method changing a {@link org.wfst.fst.MutableFst} in place
 * ({@link org.wfst.ops.Closure}, {@link org.wfst.ops.Invert},
 * {@link org.wfst.ops.Union}, {@link org.wfst.ops.Concat}) and a lazy
 * automaton computing its states on first visit
 * ({@link org.wfst.ops.ClosureFst}, {@link org.wfst.ops.InvertFst},
 * {@link org.wfst.ops.UnionFst}, {@link org.wfst.ops.ConcatFst}).
 */
package org.wfst.ops;
