package com.quantori.mge.core.aromaticity;

import com.quantori.mge.api.model.Atom;
import com.quantori.mge.api.model.Bond;
import com.quantori.mge.api.model.BondOrder;
import com.quantori.mge.api.model.Molecule;
import com.quantori.mge.api.model.Ring;
import java.util.Set;
import lombok.experimental.UtilityClass;

/**
 * π electron contributions of ring atoms and the Hückel test.
 */
@UtilityClass
public class PiElectrons {

  /** Atomic numbers of B, C, N, O, P, S, As, Se. */
  private static final Set<Integer> CONJUGATABLE = Set.of(5, 6, 7, 8, 15, 16, 33, 34);

  /**
   * Whether the atom can take part in a conjugated ring: heteroatoms of the supported set always,
   * carbon only with a double or aromatic ring bond or a charge.
   *
   * @param molecule molecule
   * @param atom ring atom
   * @return {@code true} when conjugatable
   */
  public boolean isConjugatable(Molecule molecule, Atom atom) {
    if (!CONJUGATABLE.contains(atom.getAtomicNumber())) {
      return false;
    }
    if (!atom.isCarbon()) {
      return true;
    }
    if (atom.getCharge() != 0) {
      return true;
    }
    for (Bond bond : molecule.getBondsOf(atom.getId())) {
      if (bond.isInRing()
          && (bond.getOrder() == BondOrder.DOUBLE || bond.getOrder() == BondOrder.AROMATIC)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Electrons the atom gives to the π system of a ring.
   *
   * @param molecule molecule
   * @param atom ring atom
   * @param ring the ring being tested
   * @return contribution, 0 to 2
   */
  public int contribution(Molecule molecule, Atom atom, Ring ring) {
    int charge = atom.getCharge();
    boolean hasDouble = molecule.getBondsOf(atom.getId()).stream()
        .anyMatch(bond -> bond.getOrder() == BondOrder.DOUBLE);
    return switch (atom.getAtomicNumber()) {
      case 6 -> charge == -1 ? 2 : charge == 1 ? 0 : 1;
      case 7, 15, 33 -> {
        if (charge == 1 || hasDouble) {
          yield 1;
        }
        if (atom.getDegree() + atom.getHydrogenCount() >= 3 || charge < 0) {
          yield 2;
        }
        yield 1;
      }
      case 8, 16, 34 -> {
        if (charge == 1 || hasDouble) {
          yield 1;
        }
        long ringBonds = molecule.getBondsOf(atom.getId()).stream()
            .filter(bond -> ring.containsBond(bond.getId()))
            .count();
        yield ringBonds == 2 ? 2 : 0;
      }
      case 5 -> charge == -1 || atom.isAromatic() ? 2 : 0;
      default -> 0;
    };
  }

  /**
   * Sum of contributions over the ring atoms.
   *
   * @param molecule molecule
   * @param ring ring
   * @return π electron count
   */
  public int count(Molecule molecule, Ring ring) {
    int total = 0;
    for (int atomId : ring.getAtomIds()) {
      total += contribution(molecule, molecule.getAtom(atomId), ring);
    }
    return total;
  }

  /**
   * Hückel's rule: {@code N >= 2} and {@code (N - 2) mod 4 == 0}.
   *
   * @param electrons π electron count
   * @return {@code true} for 2, 6, 10, ...
   */
  public boolean isHuckel(int electrons) {
    return electrons >= 2 && (electrons - 2) % 4 == 0;
  }
}
