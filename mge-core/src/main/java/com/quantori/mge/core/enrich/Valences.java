package com.quantori.mge.core.enrich;

import com.quantori.mge.api.model.Atom;
import com.quantori.mge.api.model.Bond;
import com.quantori.mge.api.model.BondOrder;
import com.quantori.mge.api.model.Element;
import com.quantori.mge.api.model.Molecule;
import java.util.Map;
import java.util.Optional;
import lombok.experimental.UtilityClass;

/**
 * Valence arithmetic shared by enrichment, validation and pattern matching.
 */
@UtilityClass
public class Valences {

  /**
   * Valences of aromatic atoms: one unit of the neutral valence belongs to the π system.
   */
  private static final Map<String, int[]> AROMATIC_VALENCES = Map.of(
      "B", new int[] {2},
      "C", new int[] {3},
      "N", new int[] {2, 3},
      "O", new int[] {2},
      "P", new int[] {2, 3},
      "S", new int[] {2},
      "Se", new int[] {2},
      "As", new int[] {2, 3},
      "Te", new int[] {2});

  /**
   * Sum of bond orders around an atom, aromatic bonds counted as one.
   *
   * @param molecule molecule
   * @param atomId atom id
   * @return bond order sum
   */
  public int bondOrderSum(Molecule molecule, int atomId) {
    int sum = 0;
    for (Bond bond : molecule.getBondsOf(atomId)) {
      sum += bond.getOrder().getValenceContribution();
    }
    return sum;
  }

  /**
   * Bond order sum plus attached hydrogens.
   *
   * @param molecule molecule
   * @param atom atom
   * @return total valence
   */
  public int valence(Molecule molecule, Atom atom) {
    return bondOrderSum(molecule, atom.getId()) + atom.getHydrogenCount();
  }

  /**
   * Implicit hydrogens of an atom written without brackets: the lowest known valence at or above
   * the bond order sum, minus that sum. Zero when the sum reaches the highest known valence.
   *
   * @param molecule molecule
   * @param atom atom written without brackets
   * @return implicit hydrogen count
   */
  public int implicitHydrogens(Molecule molecule, Atom atom) {
    if (atom.isWildcard()) {
      return 0;
    }
    int[] valences = valencesOf(atom);
    if (valences.length == 0) {
      return 0;
    }
    int bondSum = bondOrderSum(molecule, atom.getId());
    for (int valence : valences) {
      if (valence >= bondSum) {
        return Math.max(0, valence + atom.getCharge() - bondSum);
      }
    }
    return 0;
  }

  /**
   * Highest valence the atom may reach given its charge.
   *
   * @param atom atom
   * @return allowed valence, empty when the element has no known valences
   */
  public Optional<Integer> maxAllowedValence(Atom atom) {
    Optional<Element> element = Element.ofSymbol(atom.getSymbol());
    if (element.isEmpty() || !element.get().hasDefaultValences()) {
      return Optional.empty();
    }
    int max = element.get().getMaxDefaultValence();
    int charge = atom.getCharge();
    if (element.get() == Element.B && charge == -1) {
      return Optional.of(4);
    }
    if (element.get() == Element.B || element.get() == Element.C) {
      return Optional.of(max - Math.abs(charge));
    }
    return Optional.of(max + charge);
  }

  /**
   * Whether the bond counts as a multiple bond for conjugation purposes.
   *
   * @param bond bond
   * @return {@code true} for double, triple and quadruple bonds
   */
  public boolean isMultiple(Bond bond) {
    return bond.getOrder() == BondOrder.DOUBLE || bond.getOrder() == BondOrder.TRIPLE
        || bond.getOrder() == BondOrder.QUADRUPLE;
  }

  private int[] valencesOf(Atom atom) {
    if (atom.isAromatic() && AROMATIC_VALENCES.containsKey(atom.getSymbol())) {
      return AROMATIC_VALENCES.get(atom.getSymbol()).clone();
    }
    return Element.ofSymbol(atom.getSymbol()).map(Element::getDefaultValences).orElse(new int[0]);
  }
}
