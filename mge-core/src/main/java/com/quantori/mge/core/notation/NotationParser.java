package com.quantori.mge.core.notation;

import com.quantori.mge.api.model.Atom;
import com.quantori.mge.api.model.Bond;
import com.quantori.mge.api.model.BondOrder;
import com.quantori.mge.api.model.BondStereo;
import com.quantori.mge.api.model.Element;
import com.quantori.mge.api.model.Molecule;
import com.quantori.mge.api.model.core.ErrorType;
import com.quantori.mge.api.model.core.NotationError;
import com.quantori.mge.api.model.core.ParseResult;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.CharUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Reads molecule line notation into {@link Molecule} graphs.
 *
 * <p>Each {@code .} separated fragment is read on its own and yields one molecule. A fragment
 * stops at its first error; when any fragment fails the result carries errors only. Ring-closure
 * digits do not reach across fragments.
 */
@Slf4j
public class NotationParser {

  /**
   * Parses the notation.
   *
   * @param text notation, surrounding whitespace ignored
   * @return molecules or positional errors
   */
  public ParseResult parse(String text) {
    if (StringUtils.isBlank(text)) {
      return ParseResult.builder()
          .error(new NotationError(ErrorType.SYNTAX, 0, "Empty input"))
          .build();
    }
    int offset = StringUtils.indexOfAnyBut(text, " \t\r\n");
    String trimmed = text.strip();

    List<Molecule> molecules = new ArrayList<>();
    List<NotationError> errors = new ArrayList<>();
    int fragmentStart = 0;
    for (int end : fragmentEnds(trimmed)) {
      int position = offset + fragmentStart;
      if (end == fragmentStart) {
        errors.add(new NotationError(ErrorType.SYNTAX, position, "Empty fragment"));
      } else {
        try {
          molecules.add(new FragmentReader(trimmed.substring(fragmentStart, end)).read());
        } catch (NotationSyntaxException e) {
          errors.add(new NotationError(ErrorType.SYNTAX, position + e.getPosition(), e.getMessage()));
        }
      }
      fragmentStart = end + 1;
    }

    if (!errors.isEmpty()) {
      log.debug("Rejected notation '{}': {}", text, errors);
      return ParseResult.builder().errors(errors).build();
    }
    return ParseResult.builder().molecules(molecules).build();
  }

  private static List<Integer> fragmentEnds(String text) {
    List<Integer> ends = new ArrayList<>();
    boolean inBracket = false;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '[') {
        inBracket = true;
      } else if (c == ']') {
        inBracket = false;
      } else if (c == '.' && !inBracket) {
        ends.add(i);
      }
    }
    ends.add(text.length());
    return ends;
  }

  private record RingOpening(int atomId, BondOrder order, BondStereo stereo, boolean explicit,
                             int position) {}

  /**
   * Reads one fragment. Positions in exceptions are relative to the fragment.
   */
  private static final class FragmentReader {
    private final String text;
    private final Molecule molecule = new Molecule();
    private final Deque<Integer> branches = new ArrayDeque<>();
    private final Deque<Integer> branchPositions = new ArrayDeque<>();
    private final Map<Integer, RingOpening> openRings = new TreeMap<>();

    private int pos;
    private Integer previous;
    private BondOrder pendingOrder;
    private BondStereo pendingStereo = BondStereo.NONE;
    private int pendingPosition = -1;

    FragmentReader(String text) {
      this.text = text;
    }

    Molecule read() {
      while (pos < text.length()) {
        char c = text.charAt(pos);
        switch (c) {
          case '(' -> openBranch();
          case ')' -> closeBranch();
          case '-', '=', '#', '$', ':', '/', '\\' -> readBond(c);
          case '%' -> {
            int start = pos;
            ringClosure(readPercentNumber(), start);
          }
          case '[' -> {
            BracketAtom bracket = BracketAtomReader.read(text, pos);
            Atom atom = molecule.addAtom(bracket.symbol(), bracket.atomicNumber());
            atom.setBracket(true);
            atom.setIsotope(bracket.isotope());
            atom.setAromatic(bracket.aromatic());
            atom.setChirality(bracket.chirality());
            atom.setExplicitHydrogens(bracket.hydrogens());
            atom.setCharge(bracket.charge());
            atom.setAtomClass(bracket.atomClass());
            int start = pos;
            pos = bracket.end();
            attach(atom, start);
          }
          case '*' -> {
            attach(molecule.addAtom(Atom.WILDCARD, 0), pos);
            pos++;
          }
          default -> {
            if (CharUtils.isAsciiNumeric(c)) {
              pos++;
              ringClosure(c - '0', pos - 1);
            } else if (Character.isLetter(c)) {
              readOrganicAtom();
            } else {
              throw new NotationSyntaxException(pos, "Unexpected character '" + c + "'");
            }
          }
        }
      }
      if (pendingOrder != null) {
        throw new NotationSyntaxException(pendingPosition, "Bond symbol without a following atom");
      }
      if (!branches.isEmpty()) {
        throw new NotationSyntaxException(branchPositions.peek(), "Unclosed branch");
      }
      if (!openRings.isEmpty()) {
        Map.Entry<Integer, RingOpening> ring = openRings.entrySet().iterator().next();
        throw new NotationSyntaxException(ring.getValue().position(),
            "Unclosed ring " + ring.getKey());
      }
      return molecule;
    }

    private void openBranch() {
      if (previous == null) {
        throw new NotationSyntaxException(pos, "Branch without a preceding atom");
      }
      if (pendingOrder != null) {
        throw new NotationSyntaxException(pendingPosition, "Bond symbol before a branch");
      }
      if (pos + 1 < text.length() && text.charAt(pos + 1) == ')') {
        throw new NotationSyntaxException(pos, "Empty branch");
      }
      branches.push(previous);
      branchPositions.push(pos);
      pos++;
    }

    private void closeBranch() {
      if (branches.isEmpty()) {
        throw new NotationSyntaxException(pos, "Unbalanced ')'");
      }
      if (pendingOrder != null) {
        throw new NotationSyntaxException(pendingPosition, "Bond symbol without a following atom");
      }
      previous = branches.pop();
      branchPositions.pop();
      pos++;
    }

    private void readBond(char symbol) {
      if (previous == null) {
        throw new NotationSyntaxException(pos, "Bond symbol without a preceding atom");
      }
      if (pendingOrder != null) {
        throw new NotationSyntaxException(pos, "Consecutive bond symbols");
      }
      pendingPosition = pos;
      pendingStereo = BondStereo.NONE;
      switch (symbol) {
        case '=' -> pendingOrder = BondOrder.DOUBLE;
        case '#' -> pendingOrder = BondOrder.TRIPLE;
        case '$' -> pendingOrder = BondOrder.QUADRUPLE;
        case ':' -> pendingOrder = BondOrder.AROMATIC;
        case '/' -> {
          pendingOrder = BondOrder.SINGLE;
          pendingStereo = BondStereo.UP;
        }
        case '\\' -> {
          pendingOrder = BondOrder.SINGLE;
          pendingStereo = BondStereo.DOWN;
        }
        default -> pendingOrder = BondOrder.SINGLE;
      }
      pos++;
    }

    private int readPercentNumber() {
      if (pos + 2 >= text.length()) {
        throw new NotationSyntaxException(pos, "'%' must be followed by two digits");
      }
      char tens = text.charAt(pos + 1);
      char units = text.charAt(pos + 2);
      if (!CharUtils.isAsciiNumeric(tens) || !CharUtils.isAsciiNumeric(units)) {
        throw new NotationSyntaxException(pos, "'%' must be followed by two digits");
      }
      pos += 3;
      return (tens - '0') * 10 + (units - '0');
    }

    private void ringClosure(int number, int position) {
      if (previous == null) {
        throw new NotationSyntaxException(position, "Ring closure without a preceding atom");
      }
      RingOpening opening = openRings.remove(number);
      if (opening == null) {
        openRings.put(number, new RingOpening(previous, pendingOrder, pendingStereo,
            pendingOrder != null, position));
        clearPendingBond();
        return;
      }
      if (opening.atomId() == previous) {
        throw new NotationSyntaxException(position, "Ring " + number + " closes on its own atom");
      }
      if (opening.explicit() && pendingOrder != null
          && (opening.order() != pendingOrder || opening.stereo() != pendingStereo)) {
        throw new NotationSyntaxException(position,
            "Conflicting bond symbols for ring closure " + number);
      }
      if (molecule.getBond(opening.atomId(), previous).isPresent()) {
        throw new NotationSyntaxException(position,
            "Ring closure " + number + " duplicates an existing bond");
      }
      boolean explicit = opening.explicit() || pendingOrder != null;
      BondOrder order = opening.explicit() ? opening.order() : pendingOrder;
      BondStereo stereo = opening.explicit() ? opening.stereo() : pendingStereo;
      Bond bond = molecule.addBond(opening.atomId(), previous,
          order != null ? order : defaultOrder(opening.atomId(), previous));
      bond.setExplicit(explicit);
      bond.setStereo(stereo);
      clearPendingBond();
    }

    private void readOrganicAtom() {
      int start = pos;
      char c = text.charAt(pos);
      if (Character.isLowerCase(c)) {
        Optional<Element> element = Element.ofAromaticSymbol(String.valueOf(c))
            .filter(Element::isOrganicSubset);
        if (element.isEmpty()) {
          throw new NotationSyntaxException(pos, "Unexpected character '" + c + "'");
        }
        Atom atom = molecule.addAtom(element.get().getSymbol(), element.get().getAtomicNumber());
        atom.setAromatic(true);
        pos++;
        attach(atom, start);
        return;
      }

      String twoLetter = pos + 1 < text.length() ? text.substring(pos, pos + 2) : null;
      Element element;
      if (twoLetter != null && Element.ORGANIC_SUBSET.contains(twoLetter)) {
        element = Element.ofSymbol(twoLetter).orElseThrow();
      } else if (Element.ORGANIC_SUBSET.contains(String.valueOf(c))) {
        element = Element.ofSymbol(String.valueOf(c)).orElseThrow();
      } else {
        Optional<Element> outside = twoLetter != null && Character.isLowerCase(twoLetter.charAt(1))
            ? Element.ofSymbol(twoLetter)
            : Optional.empty();
        if (outside.isEmpty()) {
          outside = Element.ofSymbol(String.valueOf(c));
        }
        if (outside.isPresent()) {
          throw new NotationSyntaxException(pos,
              "Element '" + outside.get().getSymbol() + "' must be written in brackets");
        }
        throw new NotationSyntaxException(pos, "Unknown element '" + c + "'");
      }
      Atom atom = molecule.addAtom(element.getSymbol(), element.getAtomicNumber());
      pos += element.getSymbol().length();
      attach(atom, start);
    }

    private void attach(Atom atom, int position) {
      if (previous != null) {
        BondOrder order = pendingOrder != null ? pendingOrder : defaultOrder(previous, atom.getId());
        Bond bond = molecule.addBond(previous, atom.getId(), order);
        bond.setExplicit(pendingOrder != null);
        bond.setStereo(pendingStereo);
      } else if (pendingOrder != null) {
        throw new NotationSyntaxException(position, "Bond symbol without a preceding atom");
      }
      clearPendingBond();
      previous = atom.getId();
    }

    private BondOrder defaultOrder(int atom1, int atom2) {
      return molecule.getAtom(atom1).isAromatic() && molecule.getAtom(atom2).isAromatic()
          ? BondOrder.AROMATIC
          : BondOrder.SINGLE;
    }

    private void clearPendingBond() {
      pendingOrder = null;
      pendingStereo = BondStereo.NONE;
      pendingPosition = -1;
    }
  }
}
