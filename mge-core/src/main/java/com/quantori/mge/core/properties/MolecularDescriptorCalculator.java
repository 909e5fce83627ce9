package com.quantori.mge.core.properties;

import com.quantori.mge.api.model.Atom;
import com.quantori.mge.api.model.Bond;
import com.quantori.mge.api.model.BondOrder;
import com.quantori.mge.api.model.Molecule;
import com.quantori.mge.api.model.RingSet;
import com.quantori.mge.api.model.core.MolecularDescriptors;
import java.util.List;
import java.util.OptionalDouble;
import java.util.function.IntFunction;
import lombok.experimental.UtilityClass;

/**
 * Descriptors of an enriched molecule whose rings and aromaticity have been perceived.
 *
 * <p>A bond is rotatable when it is a single bond outside any ring between two heavy atoms that
 * each have another heavy neighbour. An end carrying a triple bond excludes it. So does an
 * open-chain end with four heavy neighbours and no double bond. The bond between a carbonyl carbon
 * and a heteroatom is not counted either.
 */
@UtilityClass
public class MolecularDescriptorCalculator {

  private static final int NITROGEN = 7;
  private static final int OXYGEN = 8;

  /**
   * Computes masses and counts in one pass over the atoms and bonds.
   *
   * @throws IllegalArgumentException when an atom's element has no known mass
   */
  public MolecularDescriptors describe(Molecule molecule, RingSet ringSet) {
    int heavy = 0;
    int hetero = 0;
    int donors = 0;
    int acceptors = 0;
    for (Atom atom : molecule.getAtoms()) {
      if (atom.isWildcard() || atom.isHydrogen()) {
        continue;
      }
      heavy++;
      if (!atom.isCarbon()) {
        hetero++;
      }
      if (atom.getAtomicNumber() == NITROGEN || atom.getAtomicNumber() == OXYGEN) {
        acceptors++;
        if (atom.getHydrogenCount() > 0 || hasHydrogenNeighbor(molecule, atom)) {
          donors++;
        }
      }
    }
    int rotatable = (int) molecule.getBonds().stream()
        .filter(bond -> isRotatable(molecule, bond))
        .count();

    return MolecularDescriptors.builder()
        .formula(MolecularFormula.of(molecule))
        .molecularWeight(mass(molecule, AtomicMasses::averageMass,
            AtomicMasses.hydrogenAverageMass()))
        .exactMass(mass(molecule, AtomicMasses::monoisotopicMass,
            AtomicMasses.hydrogenMonoisotopicMass()))
        .heavyAtomCount(heavy)
        .heteroAtomCount(hetero)
        .ringCount(ringSet.size())
        .aromaticRingCount(ringSet.getAromaticRings().size())
        .hydrogenBondDonorCount(donors)
        .hydrogenBondAcceptorCount(acceptors)
        .rotatableBondCount(rotatable)
        .build();
  }

  private double mass(Molecule molecule, IntFunction<OptionalDouble> elementMass,
      double hydrogenMass) {
    double total = 0;
    for (Atom atom : molecule.getAtoms()) {
      if (atom.isWildcard()) {
        continue;
      }
      if (atom.getIsotope() != null) {
        total += AtomicMasses.isotopeMass(atom.getAtomicNumber(), atom.getIsotope());
      } else {
        total += elementMass.apply(atom.getAtomicNumber()).orElseThrow(
            () -> new IllegalArgumentException("No atomic mass known for " + atom.getSymbol()));
      }
      total += atom.getHydrogenCount() * hydrogenMass;
    }
    return total;
  }

  private boolean isRotatable(Molecule molecule, Bond bond) {
    if (bond.getOrder() != BondOrder.SINGLE || bond.isInRing()) {
      return false;
    }
    Atom first = molecule.getAtom(bond.getAtom1());
    Atom second = molecule.getAtom(bond.getAtom2());
    if (!isHeavy(first) || !isHeavy(second)) {
      return false;
    }
    if (heavyDegree(molecule, first) < 2 || heavyDegree(molecule, second) < 2) {
      return false;
    }
    if (hasBond(molecule, first, BondOrder.TRIPLE) || hasBond(molecule, second, BondOrder.TRIPLE)) {
      return false;
    }
    if (isCrowded(molecule, first) || isCrowded(molecule, second)) {
      return false;
    }
    return !(isCarbonylCarbon(molecule, first) && isHetero(second))
        && !(isCarbonylCarbon(molecule, second) && isHetero(first));
  }

  private boolean isHeavy(Atom atom) {
    return !atom.isHydrogen() && !atom.isWildcard();
  }

  private boolean isHetero(Atom atom) {
    return isHeavy(atom) && !atom.isCarbon();
  }

  private boolean hasHydrogenNeighbor(Molecule molecule, Atom atom) {
    return molecule.getNeighbors(atom.getId()).stream()
        .map(molecule::getAtom)
        .anyMatch(Atom::isHydrogen);
  }

  private int heavyDegree(Molecule molecule, Atom atom) {
    return (int) molecule.getNeighbors(atom.getId()).stream()
        .map(molecule::getAtom)
        .filter(MolecularDescriptorCalculator::isHeavy)
        .count();
  }

  private boolean hasBond(Molecule molecule, Atom atom, BondOrder order) {
    return molecule.getBondsOf(atom.getId()).stream().anyMatch(bond -> bond.getOrder() == order);
  }

  private boolean isCrowded(Molecule molecule, Atom atom) {
    return heavyDegree(molecule, atom) >= 4 && !atom.isInRing()
        && !hasBond(molecule, atom, BondOrder.DOUBLE);
  }

  private boolean isCarbonylCarbon(Molecule molecule, Atom atom) {
    if (!atom.isCarbon()) {
      return false;
    }
    List<Bond> bonds = molecule.getBondsOf(atom.getId());
    return bonds.stream().anyMatch(bond -> bond.getOrder() == BondOrder.DOUBLE
        && molecule.getAtom(bond.getOther(atom.getId())).getAtomicNumber() == OXYGEN);
  }
}
