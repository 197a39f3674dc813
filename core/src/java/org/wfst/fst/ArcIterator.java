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
 * Cursor over the arcs leaving one state:
 * <pre>
 *   for (ArcIterator&lt;W&gt; it = fst.arcIterator(s); !it.done(); it.next()) {
 *     Arc&lt;W&gt; arc = it.value();
 *     ...
 *   }
 * </pre>
 *
 * @lucene.experimental
 */
public interface ArcIterator<W> {

  /** True once the cursor moved past the last arc. */
  boolean done();

  /** The current arc; only valid while {@link #done()} is false. */
  Arc<W> value();

  void next();

  /** Index of the current arc in the state's arc list. */
  int position();

  /** Moves back to the first arc. */
  void reset();

  /** Moves to the given arc index. */
  void seek(int position);
}
