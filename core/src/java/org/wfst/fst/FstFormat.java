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


import java.io.IOException;
import java.util.Set;

import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.DataOutput;
import org.apache.lucene.util.ArrayUtil;
import org.apache.lucene.util.NamedSPILoader;
import org.wfst.semiring.Semiring;

/**
 * Encodes and decodes one kind of automaton, identified by its type tag.
 *
 * <p>Formats are registered with the Java service provider mechanism under
 * {@code META-INF/services/org.wfst.fst.FstFormat} and looked up by
 * {@link #forName(String)}.  Subclasses must have a public no-arg
 * constructor.</p>
 *
 * @lucene.experimental
 */
public abstract class FstFormat implements NamedSPILoader.NamedSPI {

  /**
   * This static holder class prevents classloading deadlock by delaying
   * init of the loader until needed.
   */
  private static final class Holder {
    private static final NamedSPILoader<FstFormat> LOADER = new NamedSPILoader<>(FstFormat.class);

    private Holder() {
    }

    static NamedSPILoader<FstFormat> getLoader() {
      if (LOADER == null) {
        throw new IllegalStateException("You tried to lookup an FstFormat by name before all formats could be initialized. "
            + "This likely happens if you call FstFormat#forName from an FstFormat's ctor.");
      }
      return LOADER;
    }
  }

  private final String name;

  /**
   * Creates a new format.  The name must be the type tag of the automata
   * it reads and writes.
   */
  protected FstFormat(String name) {
    NamedSPILoader.checkServiceName(name);
    this.name = name;
  }

  @Override
  public final String getName() {
    return name;
  }

  /**
   * Decodes the body that follows {@code header}.
   *
   * @throws IOException if the body is malformed
   */
  public abstract <W> Fst<W> read(DataInput in, FstHeader header, FstReadOptions opts, Semiring<W> semiring) throws IOException;

  /**
   * Encodes {@code fst}, header included.
   *
   * @throws IllegalArgumentException if this format cannot encode {@code fst}
   */
  public abstract <W> void write(Fst<W> fst, DataOutput out) throws IOException;

  /**
   * Returns an automaton of this kind equivalent to {@code fst}.
   *
   * @throws IllegalArgumentException if {@code fst} cannot be represented by this kind
   */
  public abstract <W> Fst<W> convert(Fst<W> fst);

  /** Writes the header and symbol tables of {@code fst}. */
  protected static <W> void writeHeader(Fst<W> fst, DataOutput out, String type, int version, long properties,
                                        long numStates, long numArcs) throws IOException {
    int flags = 0;
    if (fst.inputSymbols() != null) {
      flags |= FstHeader.HAS_ISYMBOLS;
    }
    if (fst.outputSymbols() != null) {
      flags |= FstHeader.HAS_OSYMBOLS;
    }
    new FstHeader(type, fst.semiring().type(), version, flags, properties, fst.start(), numStates, numArcs).write(out);
    if (fst.inputSymbols() != null) {
      fst.inputSymbols().write(out);
    }
    if (fst.outputSymbols() != null) {
      fst.outputSymbols().write(out);
    }
  }

  /** Upper bound on storage reserved from counts a stream declares, before the data behind them is read. */
  protected static final int MAX_RESERVE = 1 << 12;

  /** Checks the body version and count fields of {@code header}. */
  protected static void checkHeader(FstHeader header, int minVersion, int maxVersion) throws IOException {
    if (header.version() < minVersion || header.version() > maxVersion) {
      throw new IOException("unsupported " + header.fstType() + " version " + header.version()
          + " (must be between " + minVersion + " and " + maxVersion + ")");
    }
    if (header.numStates() < 0 || header.numStates() > ArrayUtil.MAX_ARRAY_LENGTH
        || header.numArcs() < 0 || header.numArcs() > ArrayUtil.MAX_ARRAY_LENGTH) {
      throw new IOException("invalid counts: " + header);
    }
    if (header.start() < Fst.NO_STATE_ID || header.start() >= header.numStates()) {
      throw new IOException("invalid start state: " + header);
    }
  }

  /** looks up a format by name */
  public static FstFormat forName(String name) {
    return Holder.getLoader().lookup(name);
  }

  /** returns a list of all available format names */
  public static Set<String> availableFstFormats() {
    return Holder.getLoader().availableServices();
  }

  /**
   * Reloads the format list from the given {@link ClassLoader}.
   * Changes to the formats are visible after the method ends, all
   * iterators ({@link #availableFstFormats()},...) stay consistent.
   *
   * <p><b>NOTE:</b> Only new formats are added, existing ones are
   * never removed or replaced.</p>
   */
  public static void reloadFstFormats(ClassLoader classloader) {
    Holder.getLoader().reload(classloader);
  }

  @Override
  public String toString() {
    return name;
  }
}
