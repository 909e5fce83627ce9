package com.quantori.mge.core.aromaticity;

import com.quantori.mge.api.model.Atom;
import com.quantori.mge.api.model.Molecule;
import com.quantori.mge.api.model.Ring;
import com.quantori.mge.api.model.RingSet;
import com.quantori.mge.api.model.core.ErrorType;
import com.quantori.mge.api.model.core.NotationError;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks aromaticity written in the notation: aromatic atoms must lie on a ring and rings made of
 * aromatic atoms only must obey Hückel's rule.
 */
public class AromaticityValidator {

  public List<NotationError> validate(Molecule molecule, RingSet ringSet) {
    List<NotationError> problems = new ArrayList<>();
    for (Atom atom : molecule.getAtoms()) {
      if (atom.isAromatic() && !atom.isInRing()) {
        problems.add(new NotationError(ErrorType.AROMATICITY, -1, String.format(
            "Aromatic atom %s (id: %d) is not in a ring", atom.getSymbol(), atom.getId())));
      }
    }
    for (Ring ring : ringSet.getRings()) {
      boolean allAromatic = ring.getAtomIds().stream()
          .allMatch(atomId -> molecule.getAtom(atomId).isAromatic());
      if (!allAromatic) {
        continue;
      }
      int electrons = PiElectrons.count(molecule, ring);
      if (!PiElectrons.isHuckel(electrons)) {
        problems.add(new NotationError(ErrorType.AROMATICITY, -1, String.format(
            "Ring %s has %d π electrons and violates Hückel's rule", ring.getAtomIds(), electrons)));
      }
    }
    return problems;
  }
}
