package com.quantori.mge.core.pattern;

import com.quantori.mge.api.model.Atom;
import com.quantori.mge.api.model.Bond;
import com.quantori.mge.api.model.Molecule;
import com.quantori.mge.api.model.Ring;
import com.quantori.mge.api.model.RingSet;
import com.quantori.mge.api.model.core.Match;
import com.quantori.mge.api.model.core.MatchOptions;
import com.quantori.mge.api.model.core.MatchResult;
import com.quantori.mge.api.model.core.SearchStatus;
import com.quantori.mge.api.model.pattern.Pattern;
import com.quantori.mge.api.model.pattern.PatternBond;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Backtracking substructure search.
 *
 * <p>Pattern atoms are visited in a depth-first order fixed before the search: every atom except a
 * component root is reached through a parent bond, so its candidates are the molecule neighbours of
 * the parent's image. Each step works on its own copy of the mapping. A ring-closure bond only
 * holds when the image of its pattern cycle is exactly the atom set of a perceived ring.
 *
 * <p>One instance serves one search.
 */
@Slf4j
public class SubstructureSearch {

  private final Pattern pattern;
  private final Molecule molecule;
  private final MatchOptions options;
  private final PatternPredicates predicates;
  private final Set<Set<Integer>> ringAtomSets = new HashSet<>();

  private final int[] order;
  private final int[] position;
  private final int[] parentBond;
  private final List<List<PatternBond>> closingBonds = new ArrayList<>();

  private final List<Match> matches = new ArrayList<>();
  private final Set<Set<Integer>> seenAtomSets = new HashSet<>();
  private long steps;
  private SearchStatus stopReason;

  /**
   * @param pattern compiled pattern
   * @param molecule enriched molecule with perceived rings and aromaticity
   * @param ringSet rings of the molecule
   * @param options bounds and filters
   */
  public SubstructureSearch(Pattern pattern, Molecule molecule, RingSet ringSet,
                            MatchOptions options) {
    this.pattern = pattern;
    this.molecule = molecule;
    this.options = options;
    this.predicates = new PatternPredicates(molecule, ringSet);
    for (Ring ring : ringSet.getRings()) {
      ringAtomSets.add(new HashSet<>(ring.getAtomIds()));
    }

    int n = pattern.getAtomCount();
    order = new int[n];
    parentBond = new int[n];
    Arrays.fill(parentBond, -1);
    position = new int[n];
    Arrays.fill(position, -1);
    int next = 0;
    for (int root = 0; root < n; root++) {
      if (position[root] >= 0) {
        continue;
      }
      Deque<Integer> stack = new ArrayDeque<>();
      stack.push(root);
      while (!stack.isEmpty()) {
        int atom = stack.pop();
        if (position[atom] >= 0) {
          continue;
        }
        position[atom] = next;
        order[next++] = atom;
        List<PatternBond> bonds = pattern.getBondsOf(atom);
        for (int i = bonds.size() - 1; i >= 0; i--) {
          PatternBond bond = bonds.get(i);
          int other = bond.getOther(atom);
          if (position[other] < 0) {
            parentBond[other] = bond.index();
            stack.push(other);
          }
        }
      }
    }
    for (int i = 0; i < n; i++) {
      int atom = order[i];
      List<PatternBond> closing = new ArrayList<>();
      for (PatternBond bond : pattern.getBondsOf(atom)) {
        if (bond.index() != parentBond[atom] && position[bond.getOther(atom)] < i) {
          closing.add(bond);
        }
      }
      closingBonds.add(closing);
    }
  }

  public MatchResult run() {
    if (pattern.isEmpty() || molecule.isEmpty()) {
      return MatchResult.empty();
    }
    int[] mapping = new int[pattern.getAtomCount()];
    Arrays.fill(mapping, -1);
    extend(0, mapping, new HashSet<>());

    SearchStatus status = stopReason != null ? stopReason : SearchStatus.COMPLETE;
    log.debug("Search of '{}' in {} finished with {} matches after {} steps: {}",
        pattern.getText(), molecule, matches.size(), steps, status);
    return MatchResult.builder()
        .matches(List.copyOf(matches))
        .status(status)
        .steps(steps)
        .build();
  }

  private void extend(int depth, int[] mapping, Set<Integer> used) {
    if (depth == order.length) {
      record(mapping);
      return;
    }
    if (options.getMaxSearchDepth() > 0 && depth >= options.getMaxSearchDepth()) {
      stopReason = SearchStatus.SEARCH_LIMIT_REACHED;
      return;
    }
    int atom = order[depth];
    for (int candidate : candidates(atom, mapping)) {
      if (stopReason != null) {
        return;
      }
      if (used.contains(candidate)) {
        continue;
      }
      if (options.getMaxSearchSteps() > 0 && steps >= options.getMaxSearchSteps()) {
        stopReason = SearchStatus.SEARCH_LIMIT_REACHED;
        return;
      }
      steps++;
      if (!predicates.test(pattern.getAtoms().get(atom).expression(), molecule.getAtom(candidate))
          || !closuresHold(atom, candidate, mapping)) {
        continue;
      }
      int[] nextMapping = mapping.clone();
      nextMapping[atom] = candidate;
      Set<Integer> nextUsed = new HashSet<>(used);
      nextUsed.add(candidate);
      extend(depth + 1, nextMapping, nextUsed);
    }
  }

  private List<Integer> candidates(int atom, int[] mapping) {
    if (parentBond[atom] < 0) {
      return molecule.getAtoms().stream().map(Atom::getId).toList();
    }
    PatternBond bond = pattern.getBonds().get(parentBond[atom]);
    int parentImage = mapping[bond.getOther(atom)];
    List<Integer> result = new ArrayList<>();
    for (Bond moleculeBond : molecule.getBondsOf(parentImage)) {
      if (predicates.test(bond.expression(), moleculeBond)) {
        result.add(moleculeBond.getOther(parentImage));
      }
    }
    return result;
  }

  private boolean closuresHold(int atom, int candidate, int[] mapping) {
    for (PatternBond bond : closingBonds.get(position[atom])) {
      int otherImage = mapping[bond.getOther(atom)];
      Optional<Bond> moleculeBond = molecule.getBond(candidate, otherImage);
      if (moleculeBond.isEmpty() || !predicates.test(bond.expression(), moleculeBond.get())) {
        return false;
      }
    }
    return true;
  }

  private void record(int[] mapping) {
    for (PatternBond bond : pattern.getRingClosureBonds()) {
      Set<Integer> image = new HashSet<>();
      for (int atom : bond.cycle()) {
        image.add(mapping[atom]);
      }
      if (!ringAtomSets.contains(image)) {
        return;
      }
    }
    Match match = new Match(mapping);
    if (options.isUniqueOnly() && !seenAtomSets.add(match.getAtomSet())) {
      return;
    }
    matches.add(match);
    if (options.getMaxMatches() > 0 && matches.size() >= options.getMaxMatches()) {
      stopReason = SearchStatus.MATCH_LIMIT_REACHED;
    }
  }
}
