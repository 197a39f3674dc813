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


import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Paths;

import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.InputStreamDataInput;
import org.apache.lucene.util.InfoStream;
import org.wfst.semiring.Semiring;

/**
 * Reads serialized automata through the {@link FstFormat} registry.
 * Failures are reported as a null result and a message on the default
 * {@link InfoStream}, never as an exception.
 */
final class FstReader {

  private static final String STDIN = "standard input";

  private FstReader() {
  }

  static <W> Fst<W> read(DataInput in, FstReadOptions opts, Semiring<W> semiring, boolean mutable) {
    FstHeader header = opts.header();
    if (header == null) {
      try {
        header = FstHeader.read(in);
      } catch (IOException e) {
        message("error reading header from " + opts.source() + ": " + e);
        return null;
      }
    }
    if (mutable && (header.properties() & FstProperties.MUTABLE) == 0) {
      message(opts.source() + " is not a mutable automaton (type " + header.fstType() + ")");
      return null;
    }
    if (header.semiringType().equals(semiring.type()) == false) {
      message(opts.source() + " has semiring " + header.semiringType() + ", expected " + semiring.type());
      return null;
    }
    final FstFormat format;
    try {
      format = FstFormat.forName(header.fstType());
    } catch (IllegalArgumentException e) {
      message("unknown automaton type " + header.fstType() + " in " + opts.source()
          + "; available types: " + FstFormat.availableFstFormats());
      return null;
    }
    final Fst<W> fst;
    try {
      fst = format.read(in, header, opts.withHeader(header), semiring);
    } catch (IOException e) {
      message("malformed " + header.fstType() + " automaton in " + opts.source() + ": " + e);
      return null;
    }
    if (mutable && fst instanceof MutableFst == false) {
      message(opts.source() + ": format " + format.getName() + " did not produce a mutable automaton");
      return null;
    }
    return fst;
  }

  static <W> Fst<W> read(String source, Semiring<W> semiring, boolean mutable, boolean convert, String convertType) {
    if (source == null || source.isEmpty()) {
      // standard input belongs to the process, leave it open
      return read(new InputStreamDataInput(System.in), new FstReadOptions(STDIN), semiring, mutable, convert, convertType);
    }
    try (InputStream is = new BufferedInputStream(Files.newInputStream(Paths.get(source)))) {
      return read(new InputStreamDataInput(is), new FstReadOptions(source), semiring, mutable, convert, convertType);
    } catch (IOException | InvalidPathException e) {
      message("can't open " + source + ": " + e);
      return null;
    }
  }

  private static <W> Fst<W> read(DataInput in, FstReadOptions opts, Semiring<W> semiring, boolean mutable,
                                 boolean convert, String convertType) {
    if (mutable == false || convert == false) {
      return read(in, opts, semiring, mutable);
    }
    final Fst<W> fst = read(in, opts, semiring, false);
    if (fst == null || fst instanceof MutableFst) {
      return fst;
    }
    final String type = convertType == null || convertType.isEmpty() ? VectorFst.TYPE : convertType;
    final Fst<W> converted;
    try {
      converted = FstFormat.forName(type).convert(fst);
    } catch (IllegalArgumentException e) {
      message("can't convert " + fst.type() + " automaton from " + opts.source() + " to " + type + ": " + e.getMessage());
      return null;
    }
    if (converted instanceof MutableFst == false) {
      message("conversion type " + type + " is not a mutable automaton type");
      return null;
    }
    return converted;
  }

  private static void message(String msg) {
    final InfoStream infoStream = InfoStream.getDefault();
    if (infoStream.isEnabled(Fst.INFO_COMPONENT)) {
      infoStream.message(Fst.INFO_COMPONENT, msg);
    }
  }
}
