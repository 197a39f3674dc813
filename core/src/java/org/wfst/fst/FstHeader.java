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

import org.apache.lucene.codecs.CodecUtil;
import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.DataOutput;

/**
 * Header written in front of every serialized automaton, after a
 * {@link CodecUtil} header.  It tells the reader which {@link FstFormat}
 * can decode the body and whether the encoded kind supports mutation
 * ({@link FstProperties#MUTABLE} in {@link #properties()}).
 *
 * @lucene.experimental
 */
public final class FstHeader {

  static final String CODEC_NAME = "wfst";
  static final int VERSION_START = 0;
  static final int VERSION_CURRENT = VERSION_START;

  /** An input symbol table follows the header. */
  public static final int HAS_ISYMBOLS = 0x1;
  /** An output symbol table follows the header. */
  public static final int HAS_OSYMBOLS = 0x2;

  private final String fstType;
  private final String semiringType;
  private final int version;
  private final int flags;
  private final long properties;
  private final int start;
  private final long numStates;
  private final long numArcs;

  public FstHeader(String fstType, String semiringType, int version, int flags, long properties,
                   int start, long numStates, long numArcs) {
    this.fstType = fstType;
    this.semiringType = semiringType;
    this.version = version;
    this.flags = flags;
    this.properties = properties;
    this.start = start;
    this.numStates = numStates;
    this.numArcs = numArcs;
  }

  /** Type tag of the encoded kind. */
  public String fstType() {
    return fstType;
  }

  public String semiringType() {
    return semiringType;
  }

  /** Version of the kind-specific body. */
  public int version() {
    return version;
  }

  public int flags() {
    return flags;
  }

  public long properties() {
    return properties;
  }

  public int start() {
    return start;
  }

  public long numStates() {
    return numStates;
  }

  public long numArcs() {
    return numArcs;
  }

  public boolean hasInputSymbols() {
    return (flags & HAS_ISYMBOLS) != 0;
  }

  public boolean hasOutputSymbols() {
    return (flags & HAS_OSYMBOLS) != 0;
  }

  public void write(DataOutput out) throws IOException {
    CodecUtil.writeHeader(out, CODEC_NAME, VERSION_CURRENT);
    out.writeString(fstType);
    out.writeString(semiringType);
    out.writeVInt(version);
    out.writeVInt(flags);
    out.writeLong(properties);
    out.writeInt(start);
    out.writeLong(numStates);
    out.writeLong(numArcs);
  }

  /**
   * Reads a header.
   *
   * @throws IOException if the stream does not start with a valid header
   */
  public static FstHeader read(DataInput in) throws IOException {
    CodecUtil.checkHeader(in, CODEC_NAME, VERSION_START, VERSION_CURRENT);
    final String fstType = in.readString();
    final String semiringType = in.readString();
    final int version = in.readVInt();
    final int flags = in.readVInt();
    final long properties = in.readLong();
    final int start = in.readInt();
    final long numStates = in.readLong();
    final long numArcs = in.readLong();
    return new FstHeader(fstType, semiringType, version, flags, properties, start, numStates, numArcs);
  }

  @Override
  public String toString() {
    return "FstHeader(type=" + fstType + ", semiring=" + semiringType + ", version=" + version
        + ", flags=" + flags + ", properties=0x" + Long.toHexString(properties) + ", start=" + start
        + ", numStates=" + numStates + ", numArcs=" + numArcs + ")";
  }
}
