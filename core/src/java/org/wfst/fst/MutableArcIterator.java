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


/**
 * Arc cursor that can also replace the current arc.  Obtaining one from a
 * {@link MutableFst} privatizes the automaton's storage once; replacing
 * arcs afterwards costs no further copies.
 *
 * <p><b>NOTE</b>: do not take a shallow {@link MutableFst#copy(boolean)
 * copy} of the automaton while a mutable cursor is in use: the cursor
 * writes straight to the storage it privatized.</p>
 *
 * @lucene.experimental
 */
public interface MutableArcIterator<W> extends ArcIterator<W> {

  /** Replaces the current arc. */
  void setValue(Arc<W> arc);
}
