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
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.DataOutput;

/**
 * Bidirectional mapping between labels and the strings they display as.
 * A table belongs to one automaton; automata store deep copies of the
 * tables they are given.
 *
 * @lucene.experimental
 */
public final class SymbolTable implements Iterable<Map.Entry<Long, String>> {

  /** Returned by {@link #find(String)} for an unknown symbol. */
  public static final long NO_SYMBOL = -1;

  private final String name;
  // 保持插入顺序 便于序列化后顺序一致
  private final Map<Long, String> keyToSymbol = new LinkedHashMap<>();
  private final Map<String, Long> symbolToKey = new HashMap<>();
  private long availableKey;

  public SymbolTable(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  public String name() {
    return name;
  }

  /** Adds {@code symbol} under the next free key, or returns its existing key. */
  public long addSymbol(String symbol) {
    final Long key = symbolToKey.get(symbol);
    if (key != null) {
      return key;
    }
    return addSymbol(symbol, availableKey);
  }

  /** Adds {@code symbol} under {@code key}, unless the symbol already has a key, which is returned. */
  public long addSymbol(String symbol, long key) {
    Objects.requireNonNull(symbol, "symbol");
    if (key < 0) {
      throw new IllegalArgumentException("key must be >= 0, got " + key);
    }
    final Long existing = symbolToKey.get(symbol);
    if (existing != null) {
      return existing;
    }
    if (keyToSymbol.containsKey(key)) {
      throw new IllegalArgumentException("key " + key + " is already mapped to '" + keyToSymbol.get(key) + "'");
    }
    keyToSymbol.put(key, symbol);
    symbolToKey.put(symbol, key);
    if (key >= availableKey) {
      availableKey = key + 1;
    }
    return key;
  }

  /** Key of {@code symbol}, or {@link #NO_SYMBOL}. */
  public long find(String symbol) {
    final Long key = symbolToKey.get(symbol);
    return key == null ? NO_SYMBOL : key;
  }

  /** Symbol for {@code key}, or null. */
  public String find(long key) {
    return keyToSymbol.get(key);
  }

  public int numSymbols() {
    return keyToSymbol.size();
  }

  /** The key {@link #addSymbol(String)} would assign next. */
  public long availableKey() {
    return availableKey;
  }

  public SymbolTable copy() {
    final SymbolTable copy = new SymbolTable(name);
    copy.keyToSymbol.putAll(keyToSymbol);
    copy.symbolToKey.putAll(symbolToKey);
    copy.availableKey = availableKey;
    return copy;
  }

  /** Entries in insertion order. */
  @Override
  public Iterator<Map.Entry<Long, String>> iterator() {
    return Collections.unmodifiableMap(keyToSymbol).entrySet().iterator();
  }

  public void write(DataOutput out) throws IOException {
    out.writeString(name);
    out.writeVLong(availableKey);
    out.writeVInt(keyToSymbol.size());
    for (Map.Entry<Long, String> entry : keyToSymbol.entrySet()) {
      out.writeVLong(entry.getKey());
      out.writeString(entry.getValue());
    }
  }

  public static SymbolTable read(DataInput in) throws IOException {
    final SymbolTable table = new SymbolTable(in.readString());
    final long availableKey = in.readVLong();
    final int size = in.readVInt();
    if (size < 0) {
      throw new IOException("invalid symbol count: " + size);
    }
    long maxKey = -1;
    for (int i = 0; i < size; i++) {
      final long key = in.readVLong();
      final String symbol = in.readString();
      if (table.symbolToKey.containsKey(symbol) || table.keyToSymbol.containsKey(key)) {
        throw new IOException("duplicate symbol table entry: " + key + " '" + symbol + "'");
      }
      table.keyToSymbol.put(key, symbol);
      table.symbolToKey.put(symbol, key);
      maxKey = Math.max(maxKey, key);
    }
    // a stale stored value must not hand out a key that is already taken
    table.availableKey = Math.max(availableKey, maxKey + 1);
    return table;
  }

  /** Same name and same key/symbol pairs. */
  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other instanceof SymbolTable == false) {
      return false;
    }
    final SymbolTable that = (SymbolTable) other;
    return name.equals(that.name) && keyToSymbol.equals(that.keyToSymbol);
  }

  @Override
  public int hashCode() {
    return 31 * name.hashCode() + keyToSymbol.hashCode();
  }

  @Override
  public String toString() {
    return "SymbolTable(" + name + ", " + numSymbols() + " symbols)";
  }
}
