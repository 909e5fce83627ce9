package com.quantori.mge.core.ring;

import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;

/**
 * Row-reduced basis of edge sets over GF(2). Every stored row has a distinct pivot, its highest
 * set bit, so a candidate is reduced by one pass over its own bits.
 */
class CycleBasis {

  private final Map<Integer, BitSet> rowsByPivot = new HashMap<>();

  /**
   * Adds the edge set if it is independent of the rows added so far.
   *
   * @param edges edge set of a cycle
   * @return {@code true} when the set was independent and has been added
   */
  boolean addIfIndependent(BitSet edges) {
    BitSet row = (BitSet) edges.clone();
    int pivot = row.length() - 1;
    while (pivot >= 0) {
      BitSet existing = rowsByPivot.get(pivot);
      if (existing == null) {
        rowsByPivot.put(pivot, row);
        return true;
      }
      row.xor(existing);
      pivot = row.length() - 1;
    }
    return false;
  }

  int rank() {
    return rowsByPivot.size();
  }
}
