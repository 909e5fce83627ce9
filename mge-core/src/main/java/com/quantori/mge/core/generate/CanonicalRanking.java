package com.quantori.mge.core.generate;

import com.quantori.mge.api.model.Atom;
import com.quantori.mge.api.model.Bond;
import com.quantori.mge.api.model.Molecule;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Isomorphism invariant atom ranks by iterative refinement and individualization.
 *
 * <p>Atoms start in classes of equal invariants (degree, atomic number, aromaticity, isotope,
 * charge, hydrogens, ring membership, atom class) and are split by the sorted classes of their
 * neighbours and the orders of the connecting bonds until the partition is stable. A partition that
 * still has ties is searched: every atom of the lowest tied class is singled out in turn and the
 * partition refined again, down to discrete labelings. The labeling whose labeled graph compares
 * smallest wins. Two labelings giving the same labeled graph reveal an automorphism, and atoms in
 * the same orbit of the known automorphisms are not tried twice.
 */
@Slf4j
@UtilityClass
public class CanonicalRanking {

  private static final Comparator<int[]> KEY_ORDER = Arrays::compare;
  private static final int MAX_LEAVES = 20_000;

  /**
   * Ranks the atoms of an enriched molecule.
   *
   * @param molecule enriched molecule
   * @return rank per atom position in {@link Molecule#getAtoms()}, a permutation of {@code 0..n-1}
   */
  public int[] rank(Molecule molecule) {
    List<Atom> atoms = molecule.getAtoms();
    int n = atoms.size();
    if (n == 0) {
      return new int[0];
    }
    int[][] neighbors = new int[n][];
    int[][] bondCodes = new int[n][];
    for (int i = 0; i < n; i++) {
      List<Bond> bonds = molecule.getBondsOf(atoms.get(i).getId());
      neighbors[i] = new int[bonds.size()];
      bondCodes[i] = new int[bonds.size()];
      for (int k = 0; k < bonds.size(); k++) {
        Bond bond = bonds.get(k);
        neighbors[i][k] = molecule.indexOf(bond.getOther(atoms.get(i).getId()));
        bondCodes[i][k] = bond.getOrder().ordinal() + 1;
      }
    }

    int[][] invariants = new int[n][];
    for (int i = 0; i < n; i++) {
      Atom atom = atoms.get(i);
      invariants[i] = new int[] {
          atom.getDegree(),
          atom.getAtomicNumber(),
          atom.isAromatic() ? 1 : 0,
          atom.getIsotope() != null ? atom.getIsotope() : 0,
          atom.getCharge(),
          atom.getHydrogenCount(),
          atom.isInRing() ? 1 : 0,
          atom.getAtomClass() != null ? atom.getAtomClass() : -1
      };
    }
    int[] classes = refine(classesOf(invariants), neighbors, bondCodes);

    LabelingSearch search = new LabelingSearch(neighbors, bondCodes, invariants);
    search.explore(classes, new ArrayList<>());
    if (search.leaves >= MAX_LEAVES) {
      log.warn("Canonical labeling of {} stopped after {} labelings", molecule, search.leaves);
    }
    return search.bestLabels;
  }

  private int[] individualize(int[] classes, int tied, int chosen) {
    int[] split = new int[classes.length];
    for (int i = 0; i < classes.length; i++) {
      split[i] = classes[i] < tied || i == chosen ? classes[i] : classes[i] + 1;
    }
    return split;
  }

  private int[] refine(int[] classes, int[][] neighbors, int[][] bondCodes) {
    int count = distinct(classes);
    while (true) {
      int n = classes.length;
      int[][] keys = new int[n][];
      for (int i = 0; i < n; i++) {
        int[] around = new int[neighbors[i].length];
        for (int k = 0; k < around.length; k++) {
          around[k] = classes[neighbors[i][k]] * 8 + bondCodes[i][k];
        }
        Arrays.sort(around);
        int[] key = new int[around.length + 1];
        key[0] = classes[i];
        System.arraycopy(around, 0, key, 1, around.length);
        keys[i] = key;
      }
      int[] refined = classesOf(keys);
      int refinedCount = distinct(refined);
      if (refinedCount == count) {
        return refined;
      }
      classes = refined;
      count = refinedCount;
    }
  }

  private int[] classesOf(int[][] keys) {
    TreeSet<int[]> sorted = new TreeSet<>(KEY_ORDER);
    sorted.addAll(Arrays.asList(keys));
    List<int[]> ordered = new ArrayList<>(sorted);
    int[] classes = new int[keys.length];
    for (int i = 0; i < keys.length; i++) {
      classes[i] = indexOf(ordered, keys[i]);
    }
    return classes;
  }

  private int indexOf(List<int[]> ordered, int[] key) {
    int low = 0;
    int high = ordered.size() - 1;
    while (low <= high) {
      int mid = (low + high) >>> 1;
      int cmp = KEY_ORDER.compare(ordered.get(mid), key);
      if (cmp == 0) {
        return mid;
      }
      if (cmp < 0) {
        low = mid + 1;
      } else {
        high = mid - 1;
      }
    }
    throw new IllegalStateException("Key not found");
  }

  private int distinct(int[] classes) {
    return (int) Arrays.stream(classes).distinct().count();
  }

  private int lowestTiedClass(int[] classes) {
    int[] counts = new int[classes.length];
    for (int c : classes) {
      counts[c]++;
    }
    for (int c = 0; c < counts.length; c++) {
      if (counts[c] > 1) {
        return c;
      }
    }
    return -1;
  }

  /**
   * Depth-first search over individualization choices.
   *
   * <p>{@link #explore} returns the depth the search should resume at: its own depth to go on with
   * the next sibling, or a shallower one when an automorphism made the rest of the subtree
   * redundant.
   */
  private static final class LabelingSearch {
    private final int[][] neighbors;
    private final int[][] bondCodes;
    private final int[][] invariants;
    private final List<int[]> automorphisms = new ArrayList<>();

    private int[] firstLabels;
    private int[] firstCertificate;
    private List<Integer> firstPath;
    private int[] bestLabels;
    private int[] bestCertificate;
    private List<Integer> bestPath;
    private int leaves;

    LabelingSearch(int[][] neighbors, int[][] bondCodes, int[][] invariants) {
      this.neighbors = neighbors;
      this.bondCodes = bondCodes;
      this.invariants = invariants;
    }

    int explore(int[] classes, List<Integer> path) {
      int depth = path.size();
      int tied = lowestTiedClass(classes);
      if (tied < 0) {
        return leaf(classes, path);
      }
      List<Integer> tried = new ArrayList<>();
      for (int atom = 0; atom < classes.length; atom++) {
        if (classes[atom] != tied) {
          continue;
        }
        if (leaves >= MAX_LEAVES) {
          break;
        }
        if (inTriedOrbit(atom, tried, path)) {
          continue;
        }
        path.add(atom);
        int resume = explore(refine(individualize(classes, tied, atom), neighbors, bondCodes), path);
        path.remove(path.size() - 1);
        if (resume < depth) {
          return resume;
        }
        tried.add(atom);
      }
      return depth;
    }

    private int leaf(int[] labels, List<Integer> path) {
      leaves++;
      int[] certificate = certificate(labels);
      if (bestLabels == null) {
        firstLabels = labels;
        firstCertificate = certificate;
        firstPath = new ArrayList<>(path);
        bestLabels = labels;
        bestCertificate = certificate;
        bestPath = firstPath;
        return path.size();
      }
      if (Arrays.equals(certificate, firstCertificate)) {
        automorphisms.add(mapping(firstLabels, labels));
        return commonPrefix(path, firstPath);
      }
      int cmp = Arrays.compare(certificate, bestCertificate);
      if (cmp == 0) {
        automorphisms.add(mapping(bestLabels, labels));
        return commonPrefix(path, bestPath);
      }
      if (cmp < 0) {
        bestLabels = labels;
        bestCertificate = certificate;
        bestPath = new ArrayList<>(path);
      }
      return path.size();
    }

    /**
     * The labeled graph written out in label order: invariants, degree and sorted neighbour
     * codes of each atom.
     */
    private int[] certificate(int[] labels) {
      int n = labels.length;
      int[] atomAt = new int[n];
      for (int i = 0; i < n; i++) {
        atomAt[labels[i]] = i;
      }
      List<Integer> values = new ArrayList<>();
      for (int label = 0; label < n; label++) {
        int atom = atomAt[label];
        for (int value : invariants[atom]) {
          values.add(value);
        }
        int[] around = new int[neighbors[atom].length];
        for (int k = 0; k < around.length; k++) {
          around[k] = labels[neighbors[atom][k]] * 8 + bondCodes[atom][k];
        }
        Arrays.sort(around);
        values.add(around.length);
        for (int value : around) {
          values.add(value);
        }
      }
      return values.stream().mapToInt(Integer::intValue).toArray();
    }

    /** Maps each atom to the atom carrying its label in the other labeling. */
    private int[] mapping(int[] from, int[] to) {
      int[] atomAt = new int[to.length];
      for (int i = 0; i < to.length; i++) {
        atomAt[to[i]] = i;
      }
      int[] permutation = new int[from.length];
      for (int i = 0; i < from.length; i++) {
        permutation[i] = atomAt[from[i]];
      }
      return permutation;
    }

    private int commonPrefix(List<Integer> path, List<Integer> other) {
      int length = 0;
      while (length < path.size() && length < other.size()
          && path.get(length).equals(other.get(length))) {
        length++;
      }
      return length;
    }

    /** Orbits under the known automorphisms that fix every atom singled out so far. */
    private boolean inTriedOrbit(int atom, List<Integer> tried, List<Integer> path) {
      if (tried.isEmpty() || automorphisms.isEmpty()) {
        return false;
      }
      int[] parent = new int[invariants.length];
      for (int i = 0; i < parent.length; i++) {
        parent[i] = i;
      }
      for (int[] permutation : automorphisms) {
        if (path.stream().allMatch(fixed -> permutation[fixed] == fixed)) {
          for (int i = 0; i < permutation.length; i++) {
            union(parent, i, permutation[i]);
          }
        }
      }
      int root = find(parent, atom);
      return tried.stream().anyMatch(other -> find(parent, other) == root);
    }

    private int find(int[] parent, int i) {
      while (parent[i] != i) {
        parent[i] = parent[parent[i]];
        i = parent[i];
      }
      return i;
    }

    private void union(int[] parent, int a, int b) {
      int rootA = find(parent, a);
      int rootB = find(parent, b);
      if (rootA != rootB) {
        parent[Math.max(rootA, rootB)] = Math.min(rootA, rootB);
      }
    }
  }
}
