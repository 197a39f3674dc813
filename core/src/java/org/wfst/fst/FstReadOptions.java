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
 * Options for {@link Fst#read}: a name for the source, used in diagnostics,
 * and optionally a header that was already consumed from the stream.
 *
 * @lucene.experimental
 */
public final class FstReadOptions {

  private final String source;
  private final FstHeader header;

  public FstReadOptions(String source) {
    this(source, null);
  }

  public FstReadOptions(String source, FstHeader header) {
    this.source = source;
    this.header = header;
  }

  public String source() {
    return source;
  }

  /** The header already read from the stream, or null to read it. */
  public FstHeader header() {
    return header;
  }

  public FstReadOptions withHeader(FstHeader header) {
    return new FstReadOptions(source, header);
  }

  @Override
  public String toString() {
    return "FstReadOptions(source=" + source + ", header=" + header + ")";
  }
}
