package com.quantori.mge.core.generate;

import com.quantori.mge.api.NotationException;
import com.quantori.mge.api.model.Atom;
import com.quantori.mge.api.model.Bond;
import com.quantori.mge.api.model.BondOrder;
import com.quantori.mge.api.model.BondStereo;
import com.quantori.mge.api.model.Element;
import com.quantori.mge.api.model.Molecule;
import com.quantori.mge.api.model.core.ErrorType;
import com.quantori.mge.api.model.core.NotationError;
import com.quantori.mge.core.enrich.Valences;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Writes molecule line notation.
 *
 * <p>In canonical mode atoms are visited from the lowest ranked atom with neighbours taken by rank;
 * chirality and directional bonds are left out. In preserving mode the walk starts at the first
 * atom and follows bond creation order, and bracket atoms, chirality, stereo and explicit bond
 * symbols are kept. Either way the last child of an atom continues the chain and the others become
 * branches; ring-closure digits take the lowest free number and are released once the closing atom
 * is written.
 */
public class NotationGenerator {

  private static final int MAX_RING_DIGIT = 99;

  /**
   * Writes the molecule.
   *
   * @param molecule enriched molecule
   * @param ranks rank per atom position for canonical output, {@code null} for preserving output
   * @return notation
   */
  public String write(Molecule molecule, int[] ranks) {
    boolean canonical = ranks != null;
    List<String> parts = new ArrayList<>();
    for (List<Integer> component : molecule.getConnectedComponents()) {
      parts.add(new ComponentWriter(molecule, ranks, component).write());
    }
    if (canonical) {
      parts.sort(Comparator.naturalOrder());
    }
    return String.join(".", parts);
  }

  private static final class ComponentWriter {
    private final Molecule molecule;
    private final int[] ranks;
    private final boolean canonical;
    private final List<Integer> component;

    private final Set<Integer> visited = new HashSet<>();
    private final Map<Integer, List<Integer>> children = new HashMap<>();
    /** Ring-closure bonds per atom, in the order the walk meets them. */
    private final Map<Integer, List<Bond>> closures = new HashMap<>();
    private final Set<Integer> closureBonds = new HashSet<>();
    private final Map<Integer, Integer> openDigits = new HashMap<>();
    private final TreeSet<Integer> freeDigits = new TreeSet<>();
    private final StringBuilder out = new StringBuilder();

    ComponentWriter(Molecule molecule, int[] ranks, List<Integer> component) {
      this.molecule = molecule;
      this.ranks = ranks;
      this.canonical = ranks != null;
      this.component = component;
      for (int digit = 1; digit <= MAX_RING_DIGIT; digit++) {
        freeDigits.add(digit);
      }
    }

    String write() {
      int start = canonical
          ? component.stream().min(Comparator.comparingInt(this::rankOf)).orElseThrow()
          : component.stream().min(Comparator.comparingInt(molecule::indexOf)).orElseThrow();
      buildTree(start);
      writeTree(start);
      return out.toString();
    }

    /** Depth-first spanning tree; bonds leading back to visited atoms become ring closures. */
    private void buildTree(int root) {
      Deque<TreeFrame> stack = new ArrayDeque<>();
      stack.push(enter(root, -1));
      while (!stack.isEmpty()) {
        TreeFrame frame = stack.peek();
        if (frame.next == frame.bonds.size()) {
          stack.pop();
          continue;
        }
        Bond bond = frame.bonds.get(frame.next++);
        if (bond.getId() == frame.parentBond || closureBonds.contains(bond.getId())) {
          continue;
        }
        int next = bond.getOther(frame.atomId);
        if (visited.contains(next)) {
          closureBonds.add(bond.getId());
          closures.computeIfAbsent(next, k -> new ArrayList<>()).add(bond);
          closures.computeIfAbsent(frame.atomId, k -> new ArrayList<>()).add(bond);
        } else {
          children.get(frame.atomId).add(next);
          stack.push(enter(next, bond.getId()));
        }
      }
    }

    private TreeFrame enter(int atomId, int parentBond) {
      visited.add(atomId);
      children.put(atomId, new ArrayList<>());
      return new TreeFrame(atomId, parentBond, orderedBonds(atomId));
    }

    /** Writes atoms in tree order; every child but the last is wrapped in a branch. */
    private void writeTree(int root) {
      Deque<int[]> stack = new ArrayDeque<>();
      writeAtom(root);
      stack.push(new int[] {root, 0});
      while (!stack.isEmpty()) {
        int[] frame = stack.peek();
        List<Integer> kids = children.get(frame[0]);
        if (frame[1] > 0 && frame[1] < kids.size()) {
          out.append(')');
        }
        if (frame[1] == kids.size()) {
          stack.pop();
          continue;
        }
        int child = kids.get(frame[1]);
        Bond bond = molecule.getBond(frame[0], child).orElseThrow();
        if (frame[1] < kids.size() - 1) {
          out.append('(');
        }
        out.append(bondText(bond, frame[0]));
        writeAtom(child);
        frame[1]++;
        stack.push(new int[] {child, 0});
      }
    }

    private void writeAtom(int atomId) {
      out.append(atomText(molecule.getAtom(atomId)));
      Set<Integer> closedHere = new HashSet<>();
      for (Bond bond : closures.getOrDefault(atomId, List.of())) {
        Integer digit = openDigits.remove(bond.getId());
        if (digit != null) {
          out.append(bondText(bond, atomId));
          closedHere.add(digit);
        } else {
          digit = freeDigits.stream()
              .filter(candidate -> !closedHere.contains(candidate))
              .findFirst()
              .orElseThrow(() -> new NotationException(List.of(new NotationError(
                  ErrorType.GENERATION, -1,
                  "More than " + MAX_RING_DIGIT + " ring closures open at atom " + atomId))));
          freeDigits.remove(digit);
          openDigits.put(bond.getId(), digit);
        }
        out.append(digitText(digit));
      }
      freeDigits.addAll(closedHere);
    }

    private List<Bond> orderedBonds(int atomId) {
      List<Bond> bonds = new ArrayList<>(molecule.getBondsOf(atomId));
      if (canonical) {
        bonds.sort(Comparator.comparingInt(bond -> rankOf(bond.getOther(atomId))));
      } else {
        bonds.sort(Comparator.comparingInt(Bond::getId));
      }
      return bonds;
    }

    private int rankOf(int atomId) {
      return ranks[molecule.indexOf(atomId)];
    }

    private String digitText(int digit) {
      return digit < 10 ? String.valueOf(digit) : "%" + digit;
    }

    private String bondText(Bond bond, int fromAtom) {
      Atom first = molecule.getAtom(fromAtom);
      Atom second = molecule.getAtom(bond.getOther(fromAtom));
      boolean bothAromatic = first.isAromatic() && second.isAromatic();
      if (!canonical && bond.getStereo() != BondStereo.NONE) {
        return bond.getStereo().getSymbol();
      }
      if (!canonical && bond.isExplicit()
          && !(bothAromatic && bond.getOrder() == BondOrder.AROMATIC)) {
        return bond.getOrder().getSymbol();
      }
      return switch (bond.getOrder()) {
        case SINGLE -> bothAromatic ? "-" : "";
        case AROMATIC -> bothAromatic ? "" : BondOrder.AROMATIC.getSymbol();
        default -> bond.getOrder().getSymbol();
      };
    }

    private String atomText(Atom atom) {
      String symbol = atom.isAromatic() ? atom.getSymbol().toLowerCase() : atom.getSymbol();
      if (!needsBracket(atom)) {
        return symbol;
      }
      StringBuilder text = new StringBuilder("[");
      if (atom.getIsotope() != null) {
        text.append(atom.getIsotope());
      }
      text.append(symbol);
      if (!canonical && atom.getChirality() != null) {
        text.append(atom.getChirality());
      }
      int hydrogens = atom.getHydrogenCount();
      if (hydrogens == 1) {
        text.append('H');
      } else if (hydrogens > 1) {
        text.append('H').append(hydrogens);
      }
      int charge = atom.getCharge();
      if (charge != 0) {
        text.append(charge > 0 ? '+' : '-');
        if (Math.abs(charge) > 1) {
          text.append(Math.abs(charge));
        }
      }
      if (atom.getAtomClass() != null) {
        text.append(':').append(atom.getAtomClass());
      }
      return text.append(']').toString();
    }

    private boolean needsBracket(Atom atom) {
      if (!canonical && (atom.isBracket() || atom.getChirality() != null)) {
        return true;
      }
      if (atom.getCharge() != 0 || atom.getIsotope() != null || atom.getAtomClass() != null) {
        return true;
      }
      if (atom.isWildcard()) {
        return atom.getHydrogenCount() != 0;
      }
      boolean writable = atom.isAromatic()
          ? Element.AROMATIC_SYMBOLS.contains(atom.getSymbol().toLowerCase())
              && Element.ORGANIC_SUBSET.contains(atom.getSymbol())
          : Element.ORGANIC_SUBSET.contains(atom.getSymbol());
      if (!writable) {
        return true;
      }
      return atom.getHydrogenCount() != Valences.implicitHydrogens(molecule, atom);
    }

    private static final class TreeFrame {
      private final int atomId;
      private final int parentBond;
      private final List<Bond> bonds;
      private int next;

      private TreeFrame(int atomId, int parentBond, List<Bond> bonds) {
        this.atomId = atomId;
        this.parentBond = parentBond;
        this.bonds = bonds;
      }
    }
  }
}
