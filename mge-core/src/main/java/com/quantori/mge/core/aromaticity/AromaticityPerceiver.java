package com.quantori.mge.core.aromaticity;

import com.quantori.mge.api.model.Atom;
import com.quantori.mge.api.model.Bond;
import com.quantori.mge.api.model.BondOrder;
import com.quantori.mge.api.model.Hybridization;
import com.quantori.mge.api.model.Molecule;
import com.quantori.mge.api.model.Ring;
import com.quantori.mge.api.model.RingSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Classifies rings of five to seven atoms as aromatic by Hückel's rule and updates atoms, bonds and
 * rings in place.
 *
 * <p>Rings are tested repeatedly until no new ring is accepted, so a ring whose conjugation is only
 * complete once a fused neighbour turned aromatic is picked up on a later round. Afterwards atoms
 * carrying an exocyclic double bond leave the aromatic system: their ring bonds get their original
 * order back unless another accepted ring claims the bond too.
 */
@Slf4j
public class AromaticityPerceiver {

  public static final int MIN_RING_SIZE = 5;
  public static final int MAX_RING_SIZE = 7;

  /**
   * Perceives aromaticity.
   *
   * @param molecule enriched molecule whose ring ids are set
   * @param ringSet rings of the molecule; their aromatic flags are updated
   */
  public void perceive(Molecule molecule, RingSet ringSet) {
    Map<Integer, BondOrder> originalOrders = new HashMap<>();
    Map<Integer, Integer> originalHydrogens = new HashMap<>();
    Set<Integer> originallyAromatic = new HashSet<>();
    for (Bond bond : molecule.getBonds()) {
      originalOrders.put(bond.getId(), bond.getOrder());
    }
    for (Atom atom : molecule.getAtoms()) {
      originalHydrogens.put(atom.getId(), atom.getExplicitHydrogens());
      if (atom.isAromatic()) {
        originallyAromatic.add(atom.getId());
      }
    }

    Set<Integer> accepted = new HashSet<>();
    boolean changed = true;
    while (changed) {
      changed = false;
      for (Ring ring : ringSet.getRings()) {
        if (accepted.contains(ring.getId()) || !isAromatic(molecule, ring)) {
          continue;
        }
        accepted.add(ring.getId());
        aromatize(molecule, ring);
        changed = true;
      }
    }

    Map<Integer, Integer> claims = new HashMap<>();
    for (int ringId : accepted) {
      for (int bondId : ringSet.get(ringId).getBondIds()) {
        claims.merge(bondId, 1, Integer::sum);
      }
    }
    for (int ringId : accepted) {
      for (int atomId : ringSet.get(ringId).getAtomIds()) {
        Atom atom = molecule.getAtom(atomId);
        if (atom.isAromatic() && hasExocyclicDouble(molecule, atom)) {
          revert(molecule, atom, claims, originalOrders, originalHydrogens, originallyAromatic);
        }
      }
    }

    for (Ring ring : ringSet.getRings()) {
      ring.setAromatic(isFullyAromatic(molecule, ring));
    }
    log.debug("Accepted {} aromatic rings of {} in {}", accepted.size(), ringSet.size(), molecule);
  }

  private boolean isAromatic(Molecule molecule, Ring ring) {
    int size = ring.getSize();
    if (size < MIN_RING_SIZE || size > MAX_RING_SIZE) {
      return false;
    }
    for (int atomId : ring.getAtomIds()) {
      if (!PiElectrons.isConjugatable(molecule, molecule.getAtom(atomId))) {
        return false;
      }
    }
    int conjugated = 0;
    for (int bondId : ring.getBondIds()) {
      BondOrder order = molecule.getBondById(bondId).getOrder();
      if (order == BondOrder.DOUBLE || order == BondOrder.AROMATIC) {
        conjugated++;
      }
    }
    if (conjugated < size / 2) {
      return false;
    }
    return PiElectrons.isHuckel(PiElectrons.count(molecule, ring));
  }

  private void aromatize(Molecule molecule, Ring ring) {
    for (int atomId : ring.getAtomIds()) {
      Atom atom = molecule.getAtom(atomId);
      if (!atom.hasFixedHydrogens()) {
        atom.setExplicitHydrogens(atom.getImplicitHydrogens());
        atom.setImplicitHydrogens(0);
      }
      atom.setAromatic(true);
      atom.setHybridization(Hybridization.SP2);
    }
    for (int bondId : ring.getBondIds()) {
      molecule.getBondById(bondId).setOrder(BondOrder.AROMATIC);
    }
  }

  private boolean hasExocyclicDouble(Molecule molecule, Atom atom) {
    return molecule.getBondsOf(atom.getId()).stream()
        .anyMatch(bond -> bond.getOrder() == BondOrder.DOUBLE);
  }

  private void revert(Molecule molecule, Atom atom, Map<Integer, Integer> claims,
                      Map<Integer, BondOrder> originalOrders, Map<Integer, Integer> originalHydrogens,
                      Set<Integer> originallyAromatic) {
    boolean protectedBond = false;
    for (Bond bond : molecule.getBondsOf(atom.getId())) {
      if (bond.getOrder() != BondOrder.AROMATIC || !claims.containsKey(bond.getId())) {
        continue;
      }
      if (claims.get(bond.getId()) > 1) {
        protectedBond = true;
      } else {
        bond.setOrder(originalOrders.get(bond.getId()));
      }
    }
    if (!protectedBond && !originallyAromatic.contains(atom.getId())) {
      atom.setAromatic(false);
      Integer hydrogens = originalHydrogens.get(atom.getId());
      if (hydrogens == null) {
        atom.setImplicitHydrogens(atom.getHydrogenCount());
      }
      atom.setExplicitHydrogens(hydrogens);
      atom.setHybridization(Hybridization.SP2);
      log.debug("Atom {} left the aromatic system: exocyclic double bond", atom.getId());
    }
  }

  private boolean isFullyAromatic(Molecule molecule, Ring ring) {
    for (int i = 0; i < ring.getSize(); i++) {
      if (!molecule.getAtom(ring.getAtomIds().get(i)).isAromatic()
          || molecule.getBondById(ring.getBondIds().get(i)).getOrder() != BondOrder.AROMATIC) {
        return false;
      }
    }
    return true;
  }
}
