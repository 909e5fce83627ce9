package com.quantori.mge.api.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A molecular graph: atoms and the bonds between them, addressed by stable integer ids.
 *
 * <p>The molecule owns its atoms and bonds. Atom and bond ids are assigned on creation and never
 * reused, even after removal. Every change of the atom or bond set increments {@link
 * #getVersion()}, which derived data (enrichment, rings) uses as its invalidation key. Property
 * edits through {@link Atom} and {@link Bond} setters leave the version alone; callers changing
 * charges, hydrogen counts or bond orders call {@link #markModified()} afterwards. Molecules are
 * compared by identity.
 *
 * <p>Not thread safe: a molecule is processed by one thread at a time.
 */
public class Molecule {

  private final List<Atom> atoms = new ArrayList<>();
  private final List<Bond> bonds = new ArrayList<>();
  private final Map<Integer, Atom> atomsById = new HashMap<>();
  private final Map<Integer, Integer> indexById = new HashMap<>();
  private final Map<Integer, List<Bond>> adjacency = new HashMap<>();
  private final Map<Long, Bond> bondsByPair = new HashMap<>();
  private final Map<Integer, Bond> bondsById = new HashMap<>();

  private int nextAtomId;
  private int nextBondId;
  private long version;

  /**
   * Creates an atom with the next free id and appends it to the molecule.
   *
   * @param symbol element symbol or {@link Atom#WILDCARD}
   * @param atomicNumber atomic number, 0 for the wildcard
   * @return the new atom
   */
  public Atom addAtom(String symbol, int atomicNumber) {
    Objects.requireNonNull(symbol);
    Atom atom = new Atom(nextAtomId++, symbol, atomicNumber);
    indexById.put(atom.getId(), atoms.size());
    atoms.add(atom);
    atomsById.put(atom.getId(), atom);
    adjacency.put(atom.getId(), new ArrayList<>());
    version++;
    return atom;
  }

  /**
   * Creates a bond between two existing atoms.
   *
   * @param atom1 first atom id
   * @param atom2 second atom id
   * @param order bond order
   * @return the new bond
   * @throws IllegalArgumentException if an atom is unknown, both ids are equal or the atoms are
   *     already bonded
   */
  public Bond addBond(int atom1, int atom2, BondOrder order) {
    Objects.requireNonNull(order);
    requireAtom(atom1);
    requireAtom(atom2);
    if (atom1 == atom2) {
      throw new IllegalArgumentException("Atom " + atom1 + " cannot be bonded to itself");
    }
    long key = pairKey(atom1, atom2);
    if (bondsByPair.containsKey(key)) {
      throw new IllegalArgumentException(
          String.format("Atoms %d and %d are already bonded", atom1, atom2));
    }
    Bond bond = new Bond(nextBondId++, atom1, atom2, order);
    bonds.add(bond);
    bondsByPair.put(key, bond);
    bondsById.put(bond.getId(), bond);
    adjacency.get(atom1).add(bond);
    adjacency.get(atom2).add(bond);
    version++;
    return bond;
  }

  /**
   * Removes a bond from the molecule.
   *
   * @param bond bond to remove
   * @return true if the bond belonged to this molecule
   */
  public boolean removeBond(Bond bond) {
    Bond existing = bondsByPair.get(pairKey(bond.getAtom1(), bond.getAtom2()));
    if (existing != bond) {
      return false;
    }
    bonds.remove(bond);
    bondsByPair.remove(pairKey(bond.getAtom1(), bond.getAtom2()));
    bondsById.remove(bond.getId());
    adjacency.get(bond.getAtom1()).remove(bond);
    adjacency.get(bond.getAtom2()).remove(bond);
    version++;
    return true;
  }

  /**
   * Removes an atom and every bond attached to it.
   *
   * @param atomId id of the atom
   * @return true if the atom existed
   */
  public boolean removeAtom(int atomId) {
    Atom atom = atomsById.get(atomId);
    if (atom == null) {
      return false;
    }
    for (Bond bond : new ArrayList<>(adjacency.get(atomId))) {
      removeBond(bond);
    }
    atoms.remove(atom);
    atomsById.remove(atomId);
    adjacency.remove(atomId);
    indexById.clear();
    for (int i = 0; i < atoms.size(); i++) {
      indexById.put(atoms.get(i).getId(), i);
    }
    version++;
    return true;
  }

  public List<Atom> getAtoms() {
    return Collections.unmodifiableList(atoms);
  }

  public List<Bond> getBonds() {
    return Collections.unmodifiableList(bonds);
  }

  public int getAtomCount() {
    return atoms.size();
  }

  public int getBondCount() {
    return bonds.size();
  }

  public boolean isEmpty() {
    return atoms.isEmpty();
  }

  public long getVersion() {
    return version;
  }

  /**
   * Records an edit of atom or bond properties so derived data computed earlier is dropped.
   */
  public void markModified() {
    version++;
  }

  /**
   * Looks up an atom by id.
   *
   * @param atomId atom id
   * @return the atom
   * @throws IllegalArgumentException if there is no such atom
   */
  public Atom getAtom(int atomId) {
    return requireAtom(atomId);
  }

  public boolean containsAtom(int atomId) {
    return atomsById.containsKey(atomId);
  }

  /**
   * Position of an atom in {@link #getAtoms()}, handy for array based algorithms.
   *
   * @param atomId atom id
   * @return zero based index
   */
  public int indexOf(int atomId) {
    Integer index = indexById.get(atomId);
    if (index == null) {
      throw new IllegalArgumentException("Unknown atom id " + atomId);
    }
    return index;
  }

  public Optional<Bond> getBond(int atom1, int atom2) {
    return Optional.ofNullable(bondsByPair.get(pairKey(atom1, atom2)));
  }

  /**
   * Looks up a bond by id.
   *
   * @param bondId bond id
   * @return the bond
   * @throws IllegalArgumentException if there is no such bond
   */
  public Bond getBondById(int bondId) {
    Bond bond = bondsById.get(bondId);
    if (bond == null) {
      throw new IllegalArgumentException("Unknown bond id " + bondId);
    }
    return bond;
  }

  public List<Bond> getBondsOf(int atomId) {
    requireAtom(atomId);
    return Collections.unmodifiableList(adjacency.get(atomId));
  }

  public List<Integer> getNeighbors(int atomId) {
    List<Integer> neighbors = new ArrayList<>();
    for (Bond bond : getBondsOf(atomId)) {
      neighbors.add(bond.getOther(atomId));
    }
    return neighbors;
  }

  /**
   * Splits the molecule into its connected components.
   *
   * @return atom ids of each component, components ordered by their lowest atom position
   */
  public List<List<Integer>> getConnectedComponents() {
    List<List<Integer>> components = new ArrayList<>();
    Set<Integer> visited = new HashSet<>();
    for (Atom atom : atoms) {
      if (!visited.add(atom.getId())) {
        continue;
      }
      List<Integer> component = new ArrayList<>();
      Deque<Integer> queue = new ArrayDeque<>();
      queue.add(atom.getId());
      while (!queue.isEmpty()) {
        int current = queue.poll();
        component.add(current);
        for (Bond bond : adjacency.get(current)) {
          int next = bond.getOther(current);
          if (visited.add(next)) {
            queue.add(next);
          }
        }
      }
      components.add(component);
    }
    return components;
  }

  /**
   * Deep copy keeping atom and bond ids, so derived data computed on the copy can be mapped back.
   *
   * @return independent copy
   */
  public Molecule copy() {
    Molecule copy = new Molecule();
    for (Atom atom : atoms) {
      Atom atomCopy = atom.copy();
      copy.indexById.put(atomCopy.getId(), copy.atoms.size());
      copy.atoms.add(atomCopy);
      copy.atomsById.put(atomCopy.getId(), atomCopy);
      copy.adjacency.put(atomCopy.getId(), new ArrayList<>());
    }
    for (Bond bond : bonds) {
      Bond bondCopy = bond.copy();
      copy.bonds.add(bondCopy);
      copy.bondsByPair.put(pairKey(bondCopy.getAtom1(), bondCopy.getAtom2()), bondCopy);
      copy.bondsById.put(bondCopy.getId(), bondCopy);
      copy.adjacency.get(bondCopy.getAtom1()).add(bondCopy);
      copy.adjacency.get(bondCopy.getAtom2()).add(bondCopy);
    }
    copy.nextAtomId = nextAtomId;
    copy.nextBondId = nextBondId;
    copy.version = version;
    return copy;
  }

  @Override
  public String toString() {
    return "Molecule(atoms=" + atoms.size() + ", bonds=" + bonds.size() + ")";
  }

  private Atom requireAtom(int atomId) {
    Atom atom = atomsById.get(atomId);
    if (atom == null) {
      throw new IllegalArgumentException("Unknown atom id " + atomId);
    }
    return atom;
  }

  private static long pairKey(int atom1, int atom2) {
    int low = Math.min(atom1, atom2);
    int high = Math.max(atom1, atom2);
    return ((long) low << 32) | (high & 0xffffffffL);
  }
}
