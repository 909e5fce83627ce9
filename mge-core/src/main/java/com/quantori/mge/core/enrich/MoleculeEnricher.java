package com.quantori.mge.core.enrich;

import com.quantori.mge.api.model.Atom;
import com.quantori.mge.api.model.Bond;
import com.quantori.mge.api.model.BondOrder;
import com.quantori.mge.api.model.Hybridization;
import com.quantori.mge.api.model.Molecule;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Derives implicit hydrogens, degree, hybridization and ring membership flags.
 *
 * <p>Ring membership here is the cheap kind: a bond lies on a ring iff it is not a bridge, and an
 * atom does iff one of its bonds does. Ring ids come later from ring perception.
 */
@Slf4j
public class MoleculeEnricher {

  /**
   * Enriches the molecule in place. Running it twice gives the same result.
   *
   * @param molecule molecule
   */
  public void enrich(Molecule molecule) {
    for (Atom atom : molecule.getAtoms()) {
      atom.setDegree(molecule.getBondsOf(atom.getId()).size());
      if (atom.hasFixedHydrogens()) {
        atom.setImplicitHydrogens(0);
      } else {
        atom.setImplicitHydrogens(Valences.implicitHydrogens(molecule, atom));
      }
    }

    Set<Integer> bridges = findBridges(molecule);
    for (Bond bond : molecule.getBonds()) {
      bond.setInRing(!bridges.contains(bond.getId()));
    }
    for (Atom atom : molecule.getAtoms()) {
      atom.setInRing(molecule.getBondsOf(atom.getId()).stream().anyMatch(Bond::isInRing));
      atom.setHybridization(hybridization(molecule, atom));
    }
    log.debug("Enriched {} with {} bridges", molecule, bridges.size());
  }

  private Hybridization hybridization(Molecule molecule, Atom atom) {
    if (atom.isAromatic()) {
      return Hybridization.SP2;
    }
    boolean hasDouble = false;
    for (Bond bond : molecule.getBondsOf(atom.getId())) {
      if (bond.getOrder() == BondOrder.TRIPLE) {
        return Hybridization.SP;
      }
      hasDouble |= bond.getOrder() == BondOrder.DOUBLE;
    }
    if (hasDouble) {
      return Hybridization.SP2;
    }
    return atom.getDegree() + atom.getHydrogenCount() <= 4 ? Hybridization.SP3 : Hybridization.OTHER;
  }

  /**
   * Bridge bonds by an iterative depth-first search with low links.
   *
   * @param molecule molecule
   * @return ids of bonds whose removal disconnects their component
   */
  static Set<Integer> findBridges(Molecule molecule) {
    Set<Integer> bridges = new HashSet<>();
    Map<Integer, Integer> discovery = new HashMap<>();
    Map<Integer, Integer> low = new HashMap<>();
    int time = 0;

    for (Atom root : molecule.getAtoms()) {
      if (discovery.containsKey(root.getId())) {
        continue;
      }
      // frame: atom id, bond id used to enter it, next bond index to explore
      Deque<int[]> stack = new ArrayDeque<>();
      discovery.put(root.getId(), time);
      low.put(root.getId(), time++);
      stack.push(new int[] {root.getId(), -1, 0});
      while (!stack.isEmpty()) {
        int[] frame = stack.peek();
        int atomId = frame[0];
        var bonds = molecule.getBondsOf(atomId);
        if (frame[2] < bonds.size()) {
          Bond bond = bonds.get(frame[2]++);
          if (bond.getId() == frame[1]) {
            continue;
          }
          int next = bond.getOther(atomId);
          if (discovery.containsKey(next)) {
            low.put(atomId, Math.min(low.get(atomId), discovery.get(next)));
          } else {
            discovery.put(next, time);
            low.put(next, time++);
            stack.push(new int[] {next, bond.getId(), 0});
          }
        } else {
          stack.pop();
          if (!stack.isEmpty()) {
            int parent = stack.peek()[0];
            low.put(parent, Math.min(low.get(parent), low.get(atomId)));
            if (low.get(atomId) > discovery.get(parent)) {
              bridges.add(frame[1]);
            }
          }
        }
      }
    }
    return bridges;
  }
}
