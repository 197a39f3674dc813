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


import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.lucene.store.DataOutput;
import org.apache.lucene.store.OutputStreamDataOutput;

/**
 * An automaton that knows how many states it has.  Its states are exactly
 * {@code 0 .. numStates()-1}.
 *
 * @lucene.experimental
 */
public interface ExpandedFst<W> extends Fst<W> {

  int numStates();

  @Override
  ExpandedFst<W> copy(boolean safe);

  /** Writes this automaton in the format registered for its {@link #type()}. */
  default void save(DataOutput out) throws IOException {
    FstFormat.forName(type()).write(this, out);
  }

  /** Writes this automaton to a file, replacing it if it exists. */
  default void save(Path path) throws IOException {
    try (OutputStream os = new BufferedOutputStream(Files.newOutputStream(path))) {
      save(new OutputStreamDataOutput(os));
    }
  }
}
