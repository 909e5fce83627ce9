package com.quantori.mge.core.pattern;

import com.quantori.mge.api.model.Atom;
import com.quantori.mge.api.model.Bond;
import com.quantori.mge.api.model.BondOrder;
import com.quantori.mge.api.model.Molecule;
import com.quantori.mge.api.model.RingSet;
import com.quantori.mge.api.model.pattern.AtomExpression;
import com.quantori.mge.api.model.pattern.BondExpression;
import com.quantori.mge.core.enrich.Valences;
import lombok.RequiredArgsConstructor;

/**
 * Evaluates pattern expressions against enriched atoms and bonds by structural recursion.
 */
@RequiredArgsConstructor
class PatternPredicates {

  private final Molecule molecule;
  private final RingSet ringSet;

  boolean test(AtomExpression expression, Atom atom) {
    int value = expression.value();
    boolean specified = expression.isSpecified();
    return switch (expression.kind()) {
      case ANY -> true;
      case AROMATIC -> atom.isAromatic();
      case ALIPHATIC -> !atom.isAromatic();
      case ATOMIC_NUMBER -> atom.getAtomicNumber() == value;
      case DEGREE -> atom.getDegree() == value;
      case CONNECTIVITY -> atom.getDegree() + atom.getHydrogenCount() == value;
      case TOTAL_HYDROGENS -> atom.getHydrogenCount() + hydrogenNeighbors(atom) == value;
      case IMPLICIT_HYDROGENS -> specified
          ? atom.getHydrogenCount() == value
          : atom.getHydrogenCount() > 0;
      case RING_COUNT -> !specified ? atom.isInRing()
          : value == 0 ? !atom.isInRing() : atom.getRingIds().size() == value;
      case RING_SIZE -> !specified ? atom.isInRing()
          : value == 0 ? !atom.isInRing() : inRingOfSize(atom, value);
      case RING_CONNECTIVITY -> specified
          ? ringBonds(atom) == value
          : ringBonds(atom) > 0;
      case VALENCE -> Valences.valence(molecule, atom) == value;
      case CHARGE -> atom.getCharge() == value;
      case ISOTOPE -> atom.getIsotope() != null && atom.getIsotope() == value;
      case AND -> expression.operands().stream().allMatch(operand -> test(operand, atom));
      case OR -> expression.operands().stream().anyMatch(operand -> test(operand, atom));
      case NOT -> !test(expression.operands().get(0), atom);
    };
  }

  boolean test(BondExpression expression, Bond bond) {
    BondOrder order = bond.getOrder();
    return switch (expression.kind()) {
      case SINGLE -> order == BondOrder.SINGLE;
      case DOUBLE -> order == BondOrder.DOUBLE;
      case TRIPLE -> order == BondOrder.TRIPLE;
      case QUADRUPLE -> order == BondOrder.QUADRUPLE;
      case AROMATIC -> order == BondOrder.AROMATIC;
      case ANY -> true;
      case RING -> bond.isInRing();
      case SINGLE_OR_AROMATIC -> order == BondOrder.SINGLE || order == BondOrder.AROMATIC;
      case AND -> expression.operands().stream().allMatch(operand -> test(operand, bond));
      case OR -> expression.operands().stream().anyMatch(operand -> test(operand, bond));
      case NOT -> !test(expression.operands().get(0), bond);
    };
  }

  private int hydrogenNeighbors(Atom atom) {
    int count = 0;
    for (int neighbor : molecule.getNeighbors(atom.getId())) {
      if (molecule.getAtom(neighbor).isHydrogen()) {
        count++;
      }
    }
    return count;
  }

  private boolean inRingOfSize(Atom atom, int size) {
    return atom.getRingIds().stream()
        .anyMatch(ringId -> ringId < ringSet.size() && ringSet.get(ringId).getSize() == size);
  }

  private int ringBonds(Atom atom) {
    return (int) molecule.getBondsOf(atom.getId()).stream().filter(Bond::isInRing).count();
  }
}
