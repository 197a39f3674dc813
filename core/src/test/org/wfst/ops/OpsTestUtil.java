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
package org.wfst.ops;


import java.util.Random;

import org.wfst.fst.Fst;
import org.wfst.fst.FstProperties;

import static org.junit.Assert.assertTrue;

/** Checks shared by the operation tests. */
final class OpsTestUtil {

  private OpsTestUtil() {
  }

  /** Up to {@code maxLength} non-epsilon labels from the alphabet of {@code FstTestUtil.randomFst}. */
  static int[] randomLabels(Random random, int maxLength) {
    final int[] labels = new int[random.nextInt(maxLength + 1)];
    for (int i = 0; i < labels.length; i++) {
      labels[i] = 1 + random.nextInt(3);
    }
    return labels;
  }

  /** The stored properties of {@code fst} do not contradict the computed ones. */
  static <W> void assertPropertiesHold(Fst<W> fst) {
    final long stored = fst.properties(FstProperties.FST_PROPERTIES, false);
    final long computed = FstProperties.computeProperties(fst, FstProperties.TRINARY_PROPERTIES)
        | (stored & FstProperties.BINARY_PROPERTIES);
    assertTrue(fst.type() + ": stored=0x" + Long.toHexString(stored) + " computed=0x" + Long.toHexString(computed),
        FstProperties.compatProperties(stored, computed));
  }
}
