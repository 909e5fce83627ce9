package com.quantori.mge.core.properties;

import com.quantori.mge.api.model.Atom;
import com.quantori.mge.api.model.Molecule;
import java.util.Map;
import java.util.TreeMap;
import lombok.experimental.UtilityClass;

/**
 * Molecular formula in Hill order: carbon, hydrogen, then the other elements alphabetically. Without
 * carbon every element, hydrogen included, is alphabetical.
 */
@UtilityClass
public class MolecularFormula {

  private static final String CARBON = "C";
  private static final String HYDROGEN = "H";

  public String of(Molecule molecule) {
    Map<String, Integer> counts = new TreeMap<>();
    for (Atom atom : molecule.getAtoms()) {
      if (atom.getHydrogenCount() > 0) {
        counts.merge(HYDROGEN, atom.getHydrogenCount(), Integer::sum);
      }
      if (!atom.isWildcard()) {
        counts.merge(atom.getSymbol(), 1, Integer::sum);
      }
    }

    StringBuilder formula = new StringBuilder();
    if (counts.containsKey(CARBON)) {
      append(formula, CARBON, counts.remove(CARBON));
      Integer hydrogens = counts.remove(HYDROGEN);
      if (hydrogens != null) {
        append(formula, HYDROGEN, hydrogens);
      }
    }
    counts.forEach((symbol, count) -> append(formula, symbol, count));
    return formula.toString();
  }

  private void append(StringBuilder formula, String symbol, int count) {
    formula.append(symbol);
    if (count > 1) {
      formula.append(count);
    }
  }
}
