package com.quantori.mge.core.ring;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Comparator;

/**
 * Candidate cycle: atom ids in cycle order with the edge set as a bit vector over ring bond
 * positions.
 */
record Cycle(int[] atoms, int[] bonds, BitSet edges, int[] sortedAtoms) {

  static final Comparator<Cycle> ORDER = Comparator
      .comparingInt(Cycle::size)
      .thenComparing(Cycle::sortedAtoms, Arrays::compare);

  static Cycle of(int[] atoms, int[] bonds, BitSet edges) {
    int[] sorted = atoms.clone();
    Arrays.sort(sorted);
    return new Cycle(atoms, bonds, edges, sorted);
  }

  int size() {
    return atoms.length;
  }
}
