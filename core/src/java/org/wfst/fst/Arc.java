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


import java.util.Objects;

/**
 * A single transition: input label, output label, weight and destination
 * state.  Arcs are values; an arc list owns its arcs and replacing an arc
 * means storing a new one.
 *
 * @lucene.experimental
 */
public final class Arc<W> {

  /** Reserved label meaning "no symbol consumed/produced". */
  public static final int EPSILON = 0;

  public final int ilabel;
  public final int olabel;
  public final W weight;
  public final int nextState;

  public Arc(int ilabel, int olabel, W weight, int nextState) {
    this.ilabel = ilabel;
    this.olabel = olabel;
    this.weight = weight;
    this.nextState = nextState;
  }

  /** Same labels and weight, different destination. */
  public Arc<W> withNextState(int nextState) {
    return new Arc<>(ilabel, olabel, weight, nextState);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other instanceof Arc == false) {
      return false;
    }
    Arc<?> that = (Arc<?>) other;
    return ilabel == that.ilabel && olabel == that.olabel && nextState == that.nextState
        && Objects.equals(weight, that.weight);
  }

  @Override
  public int hashCode() {
    return Objects.hash(ilabel, olabel, weight, nextState);
  }

  @Override
  public String toString() {
    return "Arc(" + ilabel + ":" + olabel + "/" + weight + " -> " + nextState + ")";
  }
}
