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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.lucene.store.ByteArrayDataInput;
import org.apache.lucene.store.ByteBuffersDataOutput;
import org.apache.lucene.util.LuceneTestCase;
import org.apache.lucene.util.TestUtil;

public class TestSymbolTable extends LuceneTestCase {

  public void testAddAndFind() {
    SymbolTable table = new SymbolTable("words");
    assertEquals(0, table.addSymbol("<eps>"));
    assertEquals(1, table.addSymbol("hello"));
    assertEquals(1, table.addSymbol("hello"));
    assertEquals(10, table.addSymbol("world", 10));
    assertEquals(11, table.availableKey());
    assertEquals(11, table.addSymbol("again"));
    assertEquals(4, table.numSymbols());

    assertEquals(10, table.find("world"));
    assertEquals("hello", table.find(1L));
    assertEquals(SymbolTable.NO_SYMBOL, table.find("missing"));
    assertNull(table.find(5L));
  }

  public void testKeyAlreadyTaken() {
    SymbolTable table = new SymbolTable("t");
    table.addSymbol("a", 3);
    IllegalArgumentException expected = expectThrows(IllegalArgumentException.class, () -> table.addSymbol("b", 3));
    assertTrue(expected.getMessage().contains("already mapped"));
    expectThrows(IllegalArgumentException.class, () -> table.addSymbol("c", -1));
  }

  public void testIterationOrder() {
    SymbolTable table = new SymbolTable("t");
    table.addSymbol("z", 7);
    table.addSymbol("a", 2);
    table.addSymbol("m");
    List<String> symbols = new ArrayList<>();
    for (Map.Entry<Long, String> entry : table) {
      symbols.add(entry.getValue());
    }
    assertEquals(List.of("z", "a", "m"), symbols);
    assertEquals(8, table.find("m"));
  }

  public void testCopyIsIndependent() {
    SymbolTable table = FstTestUtil.symbols("t", "a", "b");
    SymbolTable copy = table.copy();
    assertEquals(table, copy);
    assertEquals(table.hashCode(), copy.hashCode());
    copy.addSymbol("c");
    assertFalse(table.equals(copy));
    assertEquals(SymbolTable.NO_SYMBOL, table.find("c"));
    assertFalse(table.equals(new SymbolTable("other")));
  }

  public void testWriteRead() throws IOException {
    SymbolTable table = new SymbolTable("名字");
    for (int i = 0; i < atLeast(20); i++) {
      table.addSymbol(TestUtil.randomUnicodeString(random()) + "#" + i);
    }
    table.addSymbol("big", 1L << 40);
    ByteBuffersDataOutput out = new ByteBuffersDataOutput();
    table.write(out);
    SymbolTable read = SymbolTable.read(new ByteArrayDataInput(out.toArrayCopy()));
    assertEquals(table, read);
    assertEquals(table.availableKey(), read.availableKey());
    assertEquals((1L << 40) + 1, read.addSymbol("next"));
  }

  public void testReadRejectsDuplicates() throws IOException {
    ByteBuffersDataOutput out = new ByteBuffersDataOutput();
    out.writeString("t");
    out.writeVLong(2);
    out.writeVInt(2);
    out.writeVLong(0);
    out.writeString("a");
    out.writeVLong(1);
    out.writeString("a");
    expectThrows(IOException.class, () -> SymbolTable.read(new ByteArrayDataInput(out.toArrayCopy())));
  }

  public void testReadRepairsStaleAvailableKey() throws IOException {
    ByteBuffersDataOutput out = new ByteBuffersDataOutput();
    out.writeString("t");
    // stored next key lies below the keys in use
    out.writeVLong(1);
    out.writeVInt(2);
    out.writeVLong(0);
    out.writeString("a");
    out.writeVLong(5);
    out.writeString("b");
    SymbolTable read = SymbolTable.read(new ByteArrayDataInput(out.toArrayCopy()));
    assertEquals(6, read.availableKey());
    assertEquals(6, read.addSymbol("c"));
    assertEquals(2, read.addSymbol("d", 2));
    assertEquals(7, read.addSymbol("e"));
  }
}
