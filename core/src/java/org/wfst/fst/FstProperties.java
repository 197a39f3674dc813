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


import org.wfst.semiring.Semiring;

/**
 * Property bits cached by every automaton, and the functions that update
 * them after a mutation or an operation without recomputing.
 *
 * <p>Binary properties are simply set or not.  Trinary properties come in
 * pairs (e.g. {@link #ACCEPTOR}/{@link #NOT_ACCEPTOR}); when neither bit of a
 * pair is set the property is unknown.  A cached bitset may always lose
 * information (go back to unknown) but must never claim something false.</p>
 *
 * <p>Properties are either <em>intrinsic</em>, a pure function of the states
 * and arcs, or <em>extrinsic</em>, reflecting something observed about one
 * handle.  Intrinsic bits may be updated on storage shared by several
 * handles since they hold for all of them; a change to an extrinsic bit
 * forces the handle to privatize its storage first.  The policy table is
 * {@link #INTRINSIC_PROPERTIES} / {@link #EXTRINSIC_PROPERTIES}.</p>
 *
 * @lucene.experimental
 */
public final class FstProperties {

  private FstProperties() {
  }

  // binary properties

  /** The automaton knows its number of states. */
  public static final long EXPANDED = 0x1L;
  /** The automaton can be mutated. */
  public static final long MUTABLE = 0x2L;
  /** An error was detected while constructing or using the automaton. */
  public static final long ERROR = 0x4L;

  // trinary properties

  /** ilabel == olabel for every arc. */
  public static final long ACCEPTOR = 0x10000L;
  public static final long NOT_ACCEPTOR = 0x20000L;
  /** No two arcs leaving a state share an ilabel. */
  public static final long I_DETERMINISTIC = 0x40000L;
  public static final long NON_I_DETERMINISTIC = 0x80000L;
  /** No two arcs leaving a state share an olabel. */
  public static final long O_DETERMINISTIC = 0x100000L;
  public static final long NON_O_DETERMINISTIC = 0x200000L;
  /** Some arc has both labels epsilon. */
  public static final long EPSILONS = 0x400000L;
  public static final long NO_EPSILONS = 0x800000L;
  /** Some arc has an epsilon ilabel. */
  public static final long I_EPSILONS = 0x1000000L;
  public static final long NO_I_EPSILONS = 0x2000000L;
  /** Some arc has an epsilon olabel. */
  public static final long O_EPSILONS = 0x4000000L;
  public static final long NO_O_EPSILONS = 0x8000000L;
  /** Arcs leaving each state are sorted by ilabel. */
  public static final long I_LABEL_SORTED = 0x10000000L;
  public static final long NOT_I_LABEL_SORTED = 0x20000000L;
  /** Arcs leaving each state are sorted by olabel. */
  public static final long O_LABEL_SORTED = 0x40000000L;
  public static final long NOT_O_LABEL_SORTED = 0x80000000L;
  /** Some arc or final weight is neither zero nor one. */
  public static final long WEIGHTED = 0x100000000L;
  public static final long UNWEIGHTED = 0x200000000L;
  /** Has a cycle. */
  public static final long CYCLIC = 0x400000000L;
  public static final long ACYCLIC = 0x800000000L;
  /** Has a cycle through the start state. */
  public static final long INITIAL_CYCLIC = 0x1000000000L;
  public static final long INITIAL_ACYCLIC = 0x2000000000L;
  /** Every arc goes to a higher state id. */
  public static final long TOP_SORTED = 0x4000000000L;
  public static final long NOT_TOP_SORTED = 0x8000000000L;
  /** Every state is reachable from the start. */
  public static final long ACCESSIBLE = 0x10000000000L;
  public static final long NOT_ACCESSIBLE = 0x20000000000L;
  /** Every state reaches a final state. */
  public static final long COACCESSIBLE = 0x40000000000L;
  public static final long NOT_COACCESSIBLE = 0x80000000000L;
  /** A single path from the start to a final state, and nothing else. */
  public static final long STRING = 0x100000000000L;
  public static final long NOT_STRING = 0x200000000000L;
  /** Some cycle carries a weight other than one. */
  public static final long WEIGHTED_CYCLES = 0x400000000000L;
  public static final long UNWEIGHTED_CYCLES = 0x800000000000L;

  // property sets

  public static final long BINARY_PROPERTIES = EXPANDED | MUTABLE | ERROR;

  public static final long TRINARY_PROPERTIES = 0xffffffff0000L;

  /** The "positive" half of each trinary pair. */
  public static final long POS_TRINARY_PROPERTIES = ACCEPTOR | I_DETERMINISTIC | O_DETERMINISTIC
      | EPSILONS | I_EPSILONS | O_EPSILONS | I_LABEL_SORTED | O_LABEL_SORTED | WEIGHTED | CYCLIC
      | INITIAL_CYCLIC | TOP_SORTED | ACCESSIBLE | COACCESSIBLE | STRING | WEIGHTED_CYCLES;

  /** The "negative" half of each trinary pair. */
  public static final long NEG_TRINARY_PROPERTIES = POS_TRINARY_PROPERTIES << 1;

  public static final long FST_PROPERTIES = BINARY_PROPERTIES | TRINARY_PROPERTIES;

  /** Properties that are a function of the structure alone. */
  public static final long INTRINSIC_PROPERTIES = EXPANDED | MUTABLE | TRINARY_PROPERTIES;

  /** Properties observed about one handle; changing them requires private storage. */
  public static final long EXTRINSIC_PROPERTIES = ERROR;

  /** Properties fixed by the kind of automaton. */
  public static final long STATIC_PROPERTIES = EXPANDED | MUTABLE;

  /** Properties of an automaton without states. */
  public static final long NULL_PROPERTIES = ACCEPTOR | I_DETERMINISTIC | O_DETERMINISTIC | NO_EPSILONS
      | NO_I_EPSILONS | NO_O_EPSILONS | I_LABEL_SORTED | O_LABEL_SORTED | UNWEIGHTED | ACYCLIC
      | INITIAL_ACYCLIC | TOP_SORTED | ACCESSIBLE | COACCESSIBLE | STRING | UNWEIGHTED_CYCLES;

  /** Properties depending on the cycle/accessibility structure. */
  public static final long DFS_PROPERTIES = CYCLIC | ACYCLIC | INITIAL_CYCLIC | INITIAL_ACYCLIC
      | ACCESSIBLE | NOT_ACCESSIBLE | COACCESSIBLE | NOT_COACCESSIBLE | WEIGHTED_CYCLES | UNWEIGHTED_CYCLES;

  // what survives each mutation

  static final long SET_START_PROPERTIES = BINARY_PROPERTIES | ACCEPTOR | NOT_ACCEPTOR | I_DETERMINISTIC
      | NON_I_DETERMINISTIC | O_DETERMINISTIC | NON_O_DETERMINISTIC | EPSILONS | NO_EPSILONS | I_EPSILONS
      | NO_I_EPSILONS | O_EPSILONS | NO_O_EPSILONS | I_LABEL_SORTED | NOT_I_LABEL_SORTED | O_LABEL_SORTED
      | NOT_O_LABEL_SORTED | WEIGHTED | UNWEIGHTED | CYCLIC | ACYCLIC | TOP_SORTED | NOT_TOP_SORTED
      | COACCESSIBLE | NOT_COACCESSIBLE | WEIGHTED_CYCLES | UNWEIGHTED_CYCLES;

  static final long SET_FINAL_PROPERTIES = BINARY_PROPERTIES | ACCEPTOR | NOT_ACCEPTOR | I_DETERMINISTIC
      | NON_I_DETERMINISTIC | O_DETERMINISTIC | NON_O_DETERMINISTIC | EPSILONS | NO_EPSILONS | I_EPSILONS
      | NO_I_EPSILONS | O_EPSILONS | NO_O_EPSILONS | I_LABEL_SORTED | NOT_I_LABEL_SORTED | O_LABEL_SORTED
      | NOT_O_LABEL_SORTED | CYCLIC | ACYCLIC | INITIAL_CYCLIC | INITIAL_ACYCLIC | TOP_SORTED | NOT_TOP_SORTED
      | ACCESSIBLE | NOT_ACCESSIBLE | WEIGHTED_CYCLES | UNWEIGHTED_CYCLES;

  static final long ADD_STATE_PROPERTIES = BINARY_PROPERTIES | ACCEPTOR | NOT_ACCEPTOR | I_DETERMINISTIC
      | NON_I_DETERMINISTIC | O_DETERMINISTIC | NON_O_DETERMINISTIC | EPSILONS | NO_EPSILONS | I_EPSILONS
      | NO_I_EPSILONS | O_EPSILONS | NO_O_EPSILONS | I_LABEL_SORTED | NOT_I_LABEL_SORTED | O_LABEL_SORTED
      | NOT_O_LABEL_SORTED | WEIGHTED | UNWEIGHTED | CYCLIC | ACYCLIC | INITIAL_CYCLIC | INITIAL_ACYCLIC
      | TOP_SORTED | NOT_TOP_SORTED | NOT_ACCESSIBLE | NOT_COACCESSIBLE | NOT_STRING | WEIGHTED_CYCLES
      | UNWEIGHTED_CYCLES;

  static final long ADD_ARC_PROPERTIES = BINARY_PROPERTIES | NOT_ACCEPTOR | NON_I_DETERMINISTIC
      | NON_O_DETERMINISTIC | EPSILONS | I_EPSILONS | O_EPSILONS | NOT_I_LABEL_SORTED | NOT_O_LABEL_SORTED
      | WEIGHTED | CYCLIC | INITIAL_CYCLIC | NOT_TOP_SORTED | ACCESSIBLE | COACCESSIBLE | WEIGHTED_CYCLES;

  static final long SET_ARC_PROPERTIES = BINARY_PROPERTIES;

  static final long DELETE_STATES_PROPERTIES = BINARY_PROPERTIES | ACCEPTOR | I_DETERMINISTIC
      | O_DETERMINISTIC | NO_EPSILONS | NO_I_EPSILONS | NO_O_EPSILONS | I_LABEL_SORTED | O_LABEL_SORTED
      | UNWEIGHTED | ACYCLIC | INITIAL_ACYCLIC | TOP_SORTED | UNWEIGHTED_CYCLES;

  static final long DELETE_ARCS_PROPERTIES = BINARY_PROPERTIES | ACCEPTOR | I_DETERMINISTIC | O_DETERMINISTIC
      | NO_EPSILONS | NO_I_EPSILONS | NO_O_EPSILONS | I_LABEL_SORTED | O_LABEL_SORTED | UNWEIGHTED | ACYCLIC
      | INITIAL_ACYCLIC | TOP_SORTED | NOT_ACCESSIBLE | NOT_COACCESSIBLE | UNWEIGHTED_CYCLES;

  /**
   * Expands the bits of {@code props} into the mask of properties whose
   * value is known: binary properties always, trinary ones when either bit
   * of the pair is set.
   */
  public static long knownProperties(long props) {
    return BINARY_PROPERTIES | (props & TRINARY_PROPERTIES)
        | ((props & POS_TRINARY_PROPERTIES) << 1)
        | ((props & NEG_TRINARY_PROPERTIES) >>> 1);
  }

  /** True if no known property of one contradicts a known property of the other. */
  public static boolean compatProperties(long props1, long props2) {
    final long known = knownProperties(props1) & knownProperties(props2);
    final long incompat = (props1 & known) ^ (props2 & known);
    return incompat == 0;
  }

  public static long setStartProperties(long inprops) {
    long outprops = inprops & SET_START_PROPERTIES;
    if ((inprops & ACYCLIC) != 0) {
      outprops |= INITIAL_ACYCLIC;
    }
    return outprops;
  }

  public static <W> long setFinalProperties(long inprops, W oldWeight, W newWeight, Semiring<W> semiring) {
    long outprops = inprops;
    if (semiring.isZero(oldWeight) == false && semiring.isOne(oldWeight) == false) {
      outprops &= ~WEIGHTED;
    }
    if (semiring.isZero(newWeight) == false && semiring.isOne(newWeight) == false) {
      outprops |= WEIGHTED;
      outprops &= ~UNWEIGHTED;
    }
    outprops &= SET_FINAL_PROPERTIES | WEIGHTED | UNWEIGHTED;
    return outprops;
  }

  public static long addStateProperties(long inprops) {
    return inprops & ADD_STATE_PROPERTIES;
  }

  /**
   * Properties after appending {@code arc} to state {@code s}, whose previous
   * last arc was {@code prevArc} (null if none).
   */
  public static <W> long addArcProperties(long inprops, int s, Arc<W> arc, Arc<W> prevArc, Semiring<W> semiring) {
    long outprops = inprops;
    if (arc.ilabel != arc.olabel) {
      outprops |= NOT_ACCEPTOR;
      outprops &= ~ACCEPTOR;
    }
    if (arc.ilabel == Arc.EPSILON) {
      outprops |= I_EPSILONS;
      outprops &= ~NO_I_EPSILONS;
      if (arc.olabel == Arc.EPSILON) {
        outprops |= EPSILONS;
        outprops &= ~NO_EPSILONS;
      }
    }
    if (arc.olabel == Arc.EPSILON) {
      outprops |= O_EPSILONS;
      outprops &= ~NO_O_EPSILONS;
    }
    if (prevArc != null) {
      if (prevArc.ilabel > arc.ilabel) {
        outprops |= NOT_I_LABEL_SORTED;
        outprops &= ~I_LABEL_SORTED;
      }
      if (prevArc.olabel > arc.olabel) {
        outprops |= NOT_O_LABEL_SORTED;
        outprops &= ~O_LABEL_SORTED;
      }
    }
    if (semiring.isZero(arc.weight) == false && semiring.isOne(arc.weight) == false) {
      outprops |= WEIGHTED;
      outprops &= ~UNWEIGHTED;
    }
    if (arc.nextState <= s) {
      outprops |= NOT_TOP_SORTED;
      outprops &= ~TOP_SORTED;
    }
    outprops &= ADD_ARC_PROPERTIES | ACCEPTOR | NO_EPSILONS | NO_I_EPSILONS | NO_O_EPSILONS
        | I_LABEL_SORTED | O_LABEL_SORTED | UNWEIGHTED | TOP_SORTED;
    if ((outprops & TOP_SORTED) != 0) {
      outprops |= ACYCLIC | INITIAL_ACYCLIC;
    }
    return outprops;
  }

  /**
   * Properties after replacing {@code oldArc} with {@code newArc} in place.
   * Only the label and weight bits can be kept track of.
   */
  public static <W> long setArcProperties(long inprops, Arc<W> oldArc, Arc<W> newArc, Semiring<W> semiring) {
    long outprops = inprops;
    // 先撤销旧arc可能贡献的"正"属性
    if (oldArc.ilabel != oldArc.olabel) {
      outprops &= ~NOT_ACCEPTOR;
    }
    if (oldArc.ilabel == Arc.EPSILON) {
      outprops &= ~I_EPSILONS;
      if (oldArc.olabel == Arc.EPSILON) {
        outprops &= ~EPSILONS;
      }
    }
    if (oldArc.olabel == Arc.EPSILON) {
      outprops &= ~O_EPSILONS;
    }
    if (semiring.isZero(oldArc.weight) == false && semiring.isOne(oldArc.weight) == false) {
      outprops &= ~WEIGHTED;
    }
    // 再加上新arc的属性
    if (newArc.ilabel != newArc.olabel) {
      outprops |= NOT_ACCEPTOR;
      outprops &= ~ACCEPTOR;
    }
    if (newArc.ilabel == Arc.EPSILON) {
      outprops |= I_EPSILONS;
      outprops &= ~NO_I_EPSILONS;
      if (newArc.olabel == Arc.EPSILON) {
        outprops |= EPSILONS;
        outprops &= ~NO_EPSILONS;
      }
    }
    if (newArc.olabel == Arc.EPSILON) {
      outprops |= O_EPSILONS;
      outprops &= ~NO_O_EPSILONS;
    }
    if (semiring.isZero(newArc.weight) == false && semiring.isOne(newArc.weight) == false) {
      outprops |= WEIGHTED;
      outprops &= ~UNWEIGHTED;
    }
    outprops &= SET_ARC_PROPERTIES | ACCEPTOR | NOT_ACCEPTOR | EPSILONS | NO_EPSILONS | I_EPSILONS
        | NO_I_EPSILONS | O_EPSILONS | NO_O_EPSILONS | WEIGHTED | UNWEIGHTED;
    return outprops;
  }

  public static long deleteStatesProperties(long inprops) {
    return inprops & DELETE_STATES_PROPERTIES;
  }

  public static long deleteAllStatesProperties(long inprops, long staticProps) {
    return (inprops & ERROR) | NULL_PROPERTIES | staticProps;
  }

  public static long deleteArcsProperties(long inprops) {
    return inprops & DELETE_ARCS_PROPERTIES;
  }

  /**
   * Properties of the closure of an automaton with properties
   * {@code inprops}.  {@code delayed} is true for the lazily computed
   * form, which is neither expanded nor mutable and only shows the states
   * reachable from its start.
   */
  public static long closureProperties(long inprops, boolean star, boolean delayed) {
    long outprops = (ERROR | ACCEPTOR | UNWEIGHTED | ACCESSIBLE) & inprops;
    if ((inprops & UNWEIGHTED) != 0) {
      outprops |= UNWEIGHTED_CYCLES;
    }
    if (delayed == false) {
      outprops |= (EXPANDED | MUTABLE | COACCESSIBLE | NOT_TOP_SORTED | NOT_STRING) & inprops;
    }
    if (delayed == false || (inprops & ACCESSIBLE) != 0) {
      outprops |= (NOT_ACCEPTOR | NON_I_DETERMINISTIC | NON_O_DETERMINISTIC | NOT_I_LABEL_SORTED
          | NOT_O_LABEL_SORTED | WEIGHTED | WEIGHTED_CYCLES | NOT_ACCESSIBLE | NOT_COACCESSIBLE) & inprops;
      if ((inprops & WEIGHTED) != 0 && (inprops & ACCESSIBLE) != 0 && (inprops & COACCESSIBLE) != 0) {
        outprops |= WEIGHTED_CYCLES;
      }
    }
    if (star) {
      // the new start state has no incoming arc
      outprops |= INITIAL_ACYCLIC;
    }
    return outprops;
  }

  /** Properties after exchanging input and output labels. */
  public static long invertProperties(long inprops) {
    long outprops = (BINARY_PROPERTIES | ACCEPTOR | NOT_ACCEPTOR | EPSILONS | NO_EPSILONS | WEIGHTED
        | UNWEIGHTED | WEIGHTED_CYCLES | UNWEIGHTED_CYCLES | CYCLIC | ACYCLIC | INITIAL_CYCLIC
        | INITIAL_ACYCLIC | TOP_SORTED | NOT_TOP_SORTED | ACCESSIBLE | NOT_ACCESSIBLE | COACCESSIBLE
        | NOT_COACCESSIBLE | STRING | NOT_STRING) & inprops;
    if ((inprops & I_DETERMINISTIC) != 0) {
      outprops |= O_DETERMINISTIC;
    }
    if ((inprops & NON_I_DETERMINISTIC) != 0) {
      outprops |= NON_O_DETERMINISTIC;
    }
    if ((inprops & O_DETERMINISTIC) != 0) {
      outprops |= I_DETERMINISTIC;
    }
    if ((inprops & NON_O_DETERMINISTIC) != 0) {
      outprops |= NON_I_DETERMINISTIC;
    }
    if ((inprops & I_EPSILONS) != 0) {
      outprops |= O_EPSILONS;
    }
    if ((inprops & NO_I_EPSILONS) != 0) {
      outprops |= NO_O_EPSILONS;
    }
    if ((inprops & O_EPSILONS) != 0) {
      outprops |= I_EPSILONS;
    }
    if ((inprops & NO_O_EPSILONS) != 0) {
      outprops |= NO_I_EPSILONS;
    }
    if ((inprops & I_LABEL_SORTED) != 0) {
      outprops |= O_LABEL_SORTED;
    }
    if ((inprops & NOT_I_LABEL_SORTED) != 0) {
      outprops |= NOT_O_LABEL_SORTED;
    }
    if ((inprops & O_LABEL_SORTED) != 0) {
      outprops |= I_LABEL_SORTED;
    }
    if ((inprops & NOT_O_LABEL_SORTED) != 0) {
      outprops |= NOT_I_LABEL_SORTED;
    }
    return outprops;
  }

  /** Properties of the union of two automata. */
  public static long unionProperties(long inprops1, long inprops2, boolean delayed) {
    long outprops = (ACCEPTOR & inprops1 & inprops2) | (ERROR & (inprops1 | inprops2))
        | (UNWEIGHTED & inprops1 & inprops2) | (UNWEIGHTED_CYCLES & inprops1 & inprops2)
        | (ACYCLIC & inprops1 & inprops2) | (ACCESSIBLE & inprops1 & inprops2);
    if (delayed == false) {
      outprops |= (EXPANDED | MUTABLE) & inprops1;
      outprops |= (NOT_ACCEPTOR | WEIGHTED | CYCLIC | WEIGHTED_CYCLES | EPSILONS | I_EPSILONS | O_EPSILONS
          | NON_I_DETERMINISTIC | NON_O_DETERMINISTIC | NOT_I_LABEL_SORTED | NOT_O_LABEL_SORTED
          | NOT_ACCESSIBLE | NOT_COACCESSIBLE) & (inprops1 | inprops2);
      outprops |= COACCESSIBLE & inprops1 & inprops2;
    }
    return outprops;
  }

  /** Properties of the concatenation of two automata. */
  public static long concatProperties(long inprops1, long inprops2, boolean delayed) {
    long outprops = (ACCEPTOR & inprops1 & inprops2) | (ERROR & (inprops1 | inprops2))
        | (UNWEIGHTED & inprops1 & inprops2) | (UNWEIGHTED_CYCLES & inprops1 & inprops2)
        | (ACYCLIC & inprops1 & inprops2);
    if (delayed == false) {
      outprops |= (EXPANDED | MUTABLE) & inprops1;
      outprops |= (NOT_ACCEPTOR | WEIGHTED | CYCLIC | WEIGHTED_CYCLES | EPSILONS | I_EPSILONS | O_EPSILONS
          | NON_I_DETERMINISTIC | NON_O_DETERMINISTIC | NOT_I_LABEL_SORTED | NOT_O_LABEL_SORTED)
          & (inprops1 | inprops2);
    }
    return outprops;
  }

  /**
   * Computes the properties in {@code mask} by visiting the automaton.
   * Every property pair touched by the mask is fully determined in the
   * result, so {@code knownProperties(result)} covers the mask.
   */
  public static <W> long computeProperties(Fst<W> fst, long mask) {
    return new PropertiesComputer<>(fst).compute(mask);
  }

  /**
   * Returns {@code stored} extended with the values of every property in
   * {@code mask} that {@code stored} leaves unknown, computed by visiting
   * {@code fst}.  Known bits are never overwritten.
   */
  static <W> long testProperties(Fst<W> fst, long stored, long mask) {
    final long known = knownProperties(stored);
    final long missing = mask & ~known & TRINARY_PROPERTIES;
    if (missing == 0) {
      return stored;
    }
    final long computed = computeProperties(fst, missing);
    final long fresh = knownProperties(computed) & missing & TRINARY_PROPERTIES;
    return stored | (computed & knownProperties(fresh) & ~known & TRINARY_PROPERTIES);
  }
}
