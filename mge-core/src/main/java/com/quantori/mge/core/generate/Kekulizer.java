package com.quantori.mge.core.generate;

import com.quantori.mge.api.model.Atom;
import com.quantori.mge.api.model.Bond;
import com.quantori.mge.api.model.BondOrder;
import com.quantori.mge.api.model.Element;
import com.quantori.mge.api.model.Molecule;
import com.quantori.mge.core.enrich.Valences;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToIntFunction;
import lombok.extern.slf4j.Slf4j;

/**
 * Replaces aromatic bonds with alternating single and double bonds.
 *
 * <p>Aromatic atoms that still lack one unit of valence must each receive exactly one double bond;
 * the double bonds form a perfect matching of those atoms over aromatic bonds, found by
 * backtracking from the atom with the fewest open choices.
 */
@Slf4j
public class Kekulizer {

  /**
   * Kekulizes the molecule in place, breaking ties by atom id.
   *
   * @param molecule molecule with aromatic bonds
   * @return {@code false} when no assignment exists; the molecule is then left unchanged
   */
  public boolean kekulize(Molecule molecule) {
    return kekulize(molecule, null);
  }

  /**
   * Kekulizes the molecule in place, breaking ties by atom rank so that equivalent molecules get
   * equivalent double bond placements.
   *
   * @param molecule molecule with aromatic bonds
   * @param ranks rank per atom position, or {@code null} to use atom ids
   * @return {@code false} when no assignment exists; the molecule is then left unchanged
   */
  public boolean kekulize(Molecule molecule, int[] ranks) {
    ToIntFunction<Integer> priority = ranks == null
        ? atomId -> atomId
        : atomId -> ranks[molecule.indexOf(atomId)];
    Set<Integer> needing = new HashSet<>();
    for (Atom atom : molecule.getAtoms()) {
      if (atom.isAromatic() && needsDoubleBond(molecule, atom)) {
        needing.add(atom.getId());
      }
    }
    Map<Integer, List<Bond>> options = new HashMap<>();
    for (int atomId : needing) {
      List<Bond> candidates = new ArrayList<>();
      for (Bond bond : molecule.getBondsOf(atomId)) {
        if (bond.getOrder() == BondOrder.AROMATIC && needing.contains(bond.getOther(atomId))) {
          candidates.add(bond);
        }
      }
      candidates.sort(Comparator.comparingInt(bond -> priority.applyAsInt(bond.getOther(atomId))));
      options.put(atomId, candidates);
    }

    Set<Integer> doubles = new HashSet<>();
    if (!match(new HashSet<>(needing), options, doubles, priority)) {
      log.warn("No Kekulé structure for {}, keeping aromatic bonds", molecule);
      return false;
    }
    for (Bond bond : molecule.getBonds()) {
      if (bond.getOrder() == BondOrder.AROMATIC) {
        bond.setOrder(doubles.contains(bond.getId()) ? BondOrder.DOUBLE : BondOrder.SINGLE);
      }
    }
    for (Atom atom : molecule.getAtoms()) {
      atom.setAromatic(false);
    }
    return true;
  }

  private boolean match(Set<Integer> unmatched, Map<Integer, List<Bond>> options,
                        Set<Integer> doubles, ToIntFunction<Integer> priority) {
    if (unmatched.isEmpty()) {
      return true;
    }
    int pick = -1;
    int fewest = Integer.MAX_VALUE;
    for (int atomId : unmatched) {
      int open = 0;
      for (Bond bond : options.get(atomId)) {
        if (unmatched.contains(bond.getOther(atomId))) {
          open++;
        }
      }
      if (open < fewest
          || open == fewest && priority.applyAsInt(atomId) < priority.applyAsInt(pick)) {
        fewest = open;
        pick = atomId;
      }
    }
    if (fewest == 0) {
      return false;
    }
    for (Bond bond : options.get(pick)) {
      int other = bond.getOther(pick);
      if (!unmatched.contains(other)) {
        continue;
      }
      Set<Integer> remaining = new HashSet<>(unmatched);
      remaining.remove(pick);
      remaining.remove(other);
      doubles.add(bond.getId());
      if (match(remaining, options, doubles, priority)) {
        return true;
      }
      doubles.remove(bond.getId());
    }
    return false;
  }

  /**
   * An aromatic atom needs a double bond when its bonds, counted as single, plus hydrogens fall
   * exactly one short of its neutral valence adjusted for charge.
   */
  private boolean needsDoubleBond(Molecule molecule, Atom atom) {
    if (atom.isWildcard()) {
      return false;
    }
    int used = Valences.bondOrderSum(molecule, atom.getId()) + atom.getHydrogenCount();
    for (Bond bond : molecule.getBondsOf(atom.getId())) {
      if (bond.getOrder() == BondOrder.DOUBLE) {
        return false;
      }
    }
    int[] valences = Element.ofSymbol(atom.getSymbol())
        .map(Element::getDefaultValences)
        .orElse(new int[0]);
    int charge = atom.getCharge();
    int adjustment = atom.getAtomicNumber() == 5 || atom.isCarbon() ? -Math.abs(charge) : charge;
    for (int valence : valences) {
      int target = valence + adjustment;
      if (target >= used) {
        return target - used == 1;
      }
    }
    return false;
  }
}
