package com.quantori.mge.core.ring;

import com.quantori.mge.api.model.Atom;
import com.quantori.mge.api.model.Bond;
import com.quantori.mge.api.model.BondOrder;
import com.quantori.mge.api.model.Molecule;
import com.quantori.mge.api.model.Ring;
import com.quantori.mge.api.model.RingSet;
import com.quantori.mge.core.configuration.EngineConfigurationProperties;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Smallest set of smallest rings as a minimum cycle basis.
 *
 * <p>Candidate cycles are sorted by size, then by their sorted atom ids, and accepted greedily
 * while independent over GF(2) until the basis reaches the cyclomatic number. Expects an enriched
 * molecule: only bonds flagged as ring bonds are searched.
 */
@Slf4j
@RequiredArgsConstructor
public class RingPerceiver {

  private final EngineConfigurationProperties properties;

  /**
   * Perceives rings and writes ring ids to atoms and bonds.
   *
   * @param molecule enriched molecule
   * @return ring set, incomplete when a configured bound cut the search short
   */
  public RingSet perceive(Molecule molecule) {
    int expected = molecule.getBondCount() - molecule.getAtomCount()
        + molecule.getConnectedComponents().size();
    int maxLength = properties.maxRingSizeFor(molecule.getAtomCount());
    if (expected == 0) {
      writeRingIds(molecule, List.of());
      return RingSet.builder().rings(List.of()).complete(true).expectedSize(0)
          .maxRingSizeSearched(maxLength).build();
    }

    RingGraph graph = new RingGraph(molecule);
    CycleEnumerator enumerator = new CycleEnumerator(graph);
    List<Cycle> candidates = null;
    if (graph.size() <= properties.getDfsAtomLimit()) {
      Optional<List<Cycle>> enumerated =
          enumerator.depthFirst(maxLength, properties.getMaxCandidateCycles());
      if (enumerated.isPresent()) {
        candidates = enumerated.get();
      } else {
        log.debug("More than {} candidate cycles for {}, switching to shortest path candidates",
            properties.getMaxCandidateCycles(), molecule);
      }
    }
    if (candidates == null) {
      candidates = enumerator.breadthFirst(maxLength);
    }
    candidates.sort(Cycle.ORDER);

    CycleBasis basis = new CycleBasis();
    List<Cycle> accepted = new ArrayList<>();
    for (Cycle candidate : candidates) {
      if (accepted.size() == expected) {
        break;
      }
      if (basis.addIfIndependent(candidate.edges())) {
        accepted.add(candidate);
      }
    }

    List<Ring> rings = new ArrayList<>();
    for (Cycle cycle : accepted) {
      rings.add(toRing(molecule, rings.size(), cycle));
    }
    classifyRelations(rings);
    writeRingIds(molecule, rings);

    boolean complete = rings.size() == expected;
    if (!complete) {
      log.warn("Ring perception found {} of {} rings for {} with ring size limit {}",
          rings.size(), expected, molecule, maxLength);
    }
    return RingSet.builder()
        .rings(List.copyOf(rings))
        .complete(complete)
        .expectedSize(expected)
        .maxRingSizeSearched(maxLength)
        .build();
  }

  private Ring toRing(Molecule molecule, int id, Cycle cycle) {
    int[] atoms = canonicalOrder(cycle.atoms());
    List<Integer> atomIds = new ArrayList<>();
    List<Integer> bondIds = new ArrayList<>();
    boolean heterocyclic = false;
    boolean aromatic = true;
    for (int i = 0; i < atoms.length; i++) {
      Atom atom = molecule.getAtom(atoms[i]);
      Bond bond = molecule.getBond(atoms[i], atoms[(i + 1) % atoms.length]).orElseThrow();
      atomIds.add(atoms[i]);
      bondIds.add(bond.getId());
      heterocyclic |= !atom.isCarbon() && !atom.isWildcard();
      aromatic &= atom.isAromatic() && bond.getOrder() == BondOrder.AROMATIC;
    }
    return Ring.builder()
        .id(id)
        .atomIds(List.copyOf(atomIds))
        .bondIds(List.copyOf(bondIds))
        .heterocyclic(heterocyclic)
        .aromatic(aromatic)
        .build();
  }

  /**
   * Rotates the cycle to start at its lowest atom id and walks towards the lower neighbour.
   */
  private int[] canonicalOrder(int[] atoms) {
    int n = atoms.length;
    int start = 0;
    for (int i = 1; i < n; i++) {
      if (atoms[i] < atoms[start]) {
        start = i;
      }
    }
    boolean forward = atoms[(start + 1) % n] < atoms[(start - 1 + n) % n];
    int[] ordered = new int[n];
    for (int i = 0; i < n; i++) {
      ordered[i] = forward ? atoms[(start + i) % n] : atoms[(start - i + n) % n];
    }
    return ordered;
  }

  private void classifyRelations(List<Ring> rings) {
    for (int i = 0; i < rings.size(); i++) {
      Set<Integer> first = new HashSet<>(rings.get(i).getAtomIds());
      for (int j = i + 1; j < rings.size(); j++) {
        List<Integer> shared = rings.get(j).getAtomIds().stream().filter(first::contains).toList();
        if (shared.isEmpty()) {
          continue;
        }
        Ring a = rings.get(i);
        Ring b = rings.get(j);
        if (shared.size() == 1) {
          a.setSpiro(true);
          b.setSpiro(true);
        } else if (shared.size() == 2 && sharesBond(a, b)) {
          a.setFused(true);
          b.setFused(true);
        } else {
          a.setBridged(true);
          b.setBridged(true);
        }
      }
    }
  }

  private boolean sharesBond(Ring a, Ring b) {
    return a.getBondIds().stream().anyMatch(b::containsBond);
  }

  private void writeRingIds(Molecule molecule, List<Ring> rings) {
    Map<Integer, List<Integer>> atomRings = new HashMap<>();
    Map<Integer, List<Integer>> bondRings = new HashMap<>();
    for (Ring ring : rings) {
      for (int atomId : ring.getAtomIds()) {
        atomRings.computeIfAbsent(atomId, k -> new ArrayList<>()).add(ring.getId());
      }
      for (int bondId : ring.getBondIds()) {
        bondRings.computeIfAbsent(bondId, k -> new ArrayList<>()).add(ring.getId());
      }
    }
    for (Atom atom : molecule.getAtoms()) {
      atom.setRingIds(atomRings.getOrDefault(atom.getId(), List.of()));
    }
    for (Bond bond : molecule.getBonds()) {
      bond.setRingIds(bondRings.getOrDefault(bond.getId(), List.of()));
    }
    if (log.isDebugEnabled()) {
      log.debug("Ring sizes for {}: {}", molecule,
          Arrays.toString(rings.stream().mapToInt(Ring::getSize).toArray()));
    }
  }
}
