package com.quantori.mge.core.enrich;

import com.quantori.mge.api.model.Atom;
import com.quantori.mge.api.model.Molecule;
import com.quantori.mge.api.model.core.ErrorType;
import com.quantori.mge.api.model.core.NotationError;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reports atoms whose valence exceeds what their element and charge allow. Aromatic and wildcard
 * atoms are not checked.
 */
public class ValenceValidator {

  public List<NotationError> validate(Molecule molecule) {
    List<NotationError> problems = new ArrayList<>();
    for (Atom atom : molecule.getAtoms()) {
      if (atom.isWildcard() || atom.isAromatic()) {
        continue;
      }
      Optional<Integer> allowed = Valences.maxAllowedValence(atom);
      if (allowed.isEmpty()) {
        continue;
      }
      int valence = Valences.valence(molecule, atom);
      if (valence > allowed.get()) {
        problems.add(new NotationError(ErrorType.VALENCE, -1, String.format(
            "Atom %s (id: %d) has valence %d, maximum allowed is %d",
            atom.getSymbol(), atom.getId(), valence, allowed.get())));
      }
    }
    return problems;
  }
}
