package com.quantori.mge.api.model.pattern;

import java.util.List;

/**
 * A query bond between two pattern atoms.
 *
 * @param index position in {@link Pattern#getBonds()}
 * @param atom1 index of the first pattern atom
 * @param atom2 index of the second pattern atom
 * @param expression predicate a molecule bond must satisfy
 * @param ringClosure whether the bond was written as a ring-closure digit
 * @param cycle pattern atom indices of the smallest pattern cycle through a ring-closure bond,
 *     empty for other bonds
 */
public record PatternBond(
    int index,
    int atom1,
    int atom2,
    BondExpression expression,
    boolean ringClosure,
    List<Integer> cycle) {

  public PatternBond {
    cycle = List.copyOf(cycle);
  }

  public int getOther(int atom) {
    return atom == atom1 ? atom2 : atom1;
  }

  public boolean contains(int atom) {
    return atom1 == atom || atom2 == atom;
  }
}
