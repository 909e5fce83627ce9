package com.quantori.mge.api.model.core;

import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;

/**
 * Injective mapping of pattern atoms onto molecule atoms.
 *
 * @param atomIds molecule atom id for each pattern atom index
 */
public record Match(int[] atomIds) {

  public Match {
    atomIds = atomIds.clone();
  }

  public int getAtomId(int patternAtomIndex) {
    return atomIds[patternAtomIndex];
  }

  public int size() {
    return atomIds.length;
  }

  public Set<Integer> getAtomSet() {
    Set<Integer> set = new TreeSet<>();
    for (int atomId : atomIds) {
      set.add(atomId);
    }
    return set;
  }

  @Override
  public int[] atomIds() {
    return atomIds.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Match other && Arrays.equals(atomIds, other.atomIds);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(atomIds);
  }

  @Override
  public String toString() {
    return "Match" + Arrays.toString(atomIds);
  }
}
