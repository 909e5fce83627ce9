package com.quantori.mge.core.pattern;

import com.quantori.mge.api.model.Element;
import com.quantori.mge.api.model.core.ErrorType;
import com.quantori.mge.api.model.core.NotationError;
import com.quantori.mge.api.model.core.PatternCompileResult;
import com.quantori.mge.api.model.pattern.AtomExpression;
import com.quantori.mge.api.model.pattern.BondExpression;
import com.quantori.mge.api.model.pattern.Pattern;
import com.quantori.mge.api.model.pattern.PatternAtom;
import com.quantori.mge.api.model.pattern.PatternBond;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.CharUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Compiles pattern notation into a {@link Pattern}.
 *
 * <p>Besides the molecule notation it accepts bracket expressions with logical operators, the
 * {@code a}/{@code A} aromaticity primitives and bond expressions. Components separated by
 * {@code .} belong to one pattern. Recursive {@code $(...)} expressions are rejected.
 */
@Slf4j
public class PatternCompiler {

  public PatternCompileResult compile(String text) {
    if (StringUtils.isBlank(text)) {
      return PatternCompileResult.builder()
          .error(new NotationError(ErrorType.PATTERN, 0, "Empty pattern"))
          .build();
    }
    try {
      Pattern pattern = new Reader(text).read();
      log.debug("Compiled pattern '{}' with {} atoms and {} bonds", text, pattern.getAtomCount(),
          pattern.getBonds().size());
      return PatternCompileResult.builder().pattern(pattern).build();
    } catch (PatternSyntaxException e) {
      log.debug("Rejected pattern '{}' at {}: {}", text, e.getPosition(), e.getMessage());
      return PatternCompileResult.builder()
          .error(new NotationError(ErrorType.PATTERN, e.getPosition(), e.getMessage()))
          .build();
    }
  }

  private record OpenRing(int atom, BondExpression expression, String text, int position) {}

  private record RawBond(int atom1, int atom2, BondExpression expression, boolean ringClosure) {}

  private static final class Reader {
    private final String text;
    private final List<AtomExpression> atoms = new ArrayList<>();
    private final List<String> atomTexts = new ArrayList<>();
    private final List<RawBond> bonds = new ArrayList<>();
    private final Deque<Integer> branches = new ArrayDeque<>();
    private final Deque<Integer> branchPositions = new ArrayDeque<>();
    private final Map<Integer, OpenRing> openRings = new TreeMap<>();

    private int pos;
    private Integer previous;
    private BondExpression pendingBond;
    private String pendingText;
    private int pendingPosition = -1;

    Reader(String text) {
      this.text = text.strip();
    }

    Pattern read() {
      while (pos < text.length()) {
        char c = text.charAt(pos);
        if (c == '(') {
          openBranch();
        } else if (c == ')') {
          closeBranch();
        } else if (c == '.') {
          separate();
        } else if (c == '%' || CharUtils.isAsciiNumeric(c)) {
          ringClosure();
        } else if (c == '[') {
          int close = text.indexOf(']', pos);
          if (close < 0) {
            throw new PatternSyntaxException(pos, "Unclosed bracket atom");
          }
          AtomExpression expression = new AtomExpressionReader(text, pos + 1, close).read();
          addAtom(expression, text.substring(pos, close + 1));
          pos = close + 1;
        } else if (BondExpressionReader.BOND_CHARACTERS.indexOf(c) >= 0) {
          readBond();
        } else {
          addAtom(readBareAtom(), null);
        }
      }
      if (pendingBond != null) {
        throw new PatternSyntaxException(pendingPosition, "Bond without a following atom");
      }
      if (!branches.isEmpty()) {
        throw new PatternSyntaxException(branchPositions.peek(), "Unclosed branch");
      }
      if (!openRings.isEmpty()) {
        Map.Entry<Integer, OpenRing> ring = openRings.entrySet().iterator().next();
        throw new PatternSyntaxException(ring.getValue().position(), "Unclosed ring " + ring.getKey());
      }
      return build();
    }

    private AtomExpression readBareAtom() {
      int start = pos;
      char c = text.charAt(pos);
      if (c == '*') {
        pos++;
        return AtomExpression.any();
      }
      if (c == 'a') {
        pos++;
        return AtomExpression.primitive(AtomExpression.Kind.AROMATIC);
      }
      if (c == 'A') {
        pos++;
        return AtomExpression.primitive(AtomExpression.Kind.ALIPHATIC);
      }
      if (Character.isLowerCase(c)) {
        Optional<Element> aromatic = Element.ofAromaticSymbol(String.valueOf(c))
            .filter(Element::isOrganicSubset);
        if (aromatic.isPresent()) {
          pos++;
          return AtomExpression.element(aromatic.get().getAtomicNumber(), true);
        }
      }
      if (pos + 1 < text.length() && Element.ORGANIC_SUBSET.contains(text.substring(pos, pos + 2))) {
        Element element = Element.ofSymbol(text.substring(pos, pos + 2)).orElseThrow();
        pos += 2;
        return AtomExpression.element(element.getAtomicNumber(), false);
      }
      if (Element.ORGANIC_SUBSET.contains(String.valueOf(c))) {
        Element element = Element.ofSymbol(String.valueOf(c)).orElseThrow();
        pos++;
        return AtomExpression.element(element.getAtomicNumber(), false);
      }
      throw new PatternSyntaxException(start, "Unexpected character '" + c + "'");
    }

    private void addAtom(AtomExpression expression, String atomText) {
      int start = pos;
      int index = atoms.size();
      atoms.add(expression);
      atomTexts.add(atomText);
      if (previous != null) {
        bonds.add(new RawBond(previous, index, bondOrImplicit(), false));
      } else if (pendingBond != null) {
        throw new PatternSyntaxException(start, "Bond without a preceding atom");
      }
      clearPendingBond();
      previous = index;
    }

    private void readBond() {
      if (previous == null) {
        throw new PatternSyntaxException(pos, "Bond without a preceding atom");
      }
      if (pendingBond != null) {
        throw new PatternSyntaxException(pos, "Consecutive bond expressions");
      }
      int start = pos;
      while (pos < text.length() && BondExpressionReader.BOND_CHARACTERS.indexOf(text.charAt(pos)) >= 0) {
        pos++;
      }
      pendingBond = new BondExpressionReader(text, start, pos).read();
      pendingText = text.substring(start, pos);
      pendingPosition = start;
    }

    private void ringClosure() {
      int start = pos;
      int number;
      if (text.charAt(pos) == '%') {
        if (pos + 2 >= text.length() || !CharUtils.isAsciiNumeric(text.charAt(pos + 1))
            || !CharUtils.isAsciiNumeric(text.charAt(pos + 2))) {
          throw new PatternSyntaxException(pos, "'%' must be followed by two digits");
        }
        number = Integer.parseInt(text.substring(pos + 1, pos + 3));
        pos += 3;
      } else {
        number = text.charAt(pos) - '0';
        pos++;
      }
      if (previous == null) {
        throw new PatternSyntaxException(start, "Ring closure without a preceding atom");
      }
      OpenRing open = openRings.remove(number);
      if (open == null) {
        openRings.put(number, new OpenRing(previous, pendingBond, pendingText, start));
        clearPendingBond();
        return;
      }
      if (open.atom() == previous) {
        throw new PatternSyntaxException(start, "Ring " + number + " closes on its own atom");
      }
      if (open.expression() != null && pendingBond != null
          && !Objects.equals(open.text(), pendingText)) {
        throw new PatternSyntaxException(start, "Conflicting bond expressions for ring " + number);
      }
      BondExpression expression = open.expression() != null ? open.expression() : bondOrImplicit();
      bonds.add(new RawBond(open.atom(), previous, expression, true));
      clearPendingBond();
    }

    private void openBranch() {
      if (previous == null) {
        throw new PatternSyntaxException(pos, "Branch without a preceding atom");
      }
      if (pendingBond != null) {
        throw new PatternSyntaxException(pendingPosition, "Bond before a branch");
      }
      branches.push(previous);
      branchPositions.push(pos);
      pos++;
    }

    private void closeBranch() {
      if (branches.isEmpty()) {
        throw new PatternSyntaxException(pos, "Unbalanced ')'");
      }
      if (pendingBond != null) {
        throw new PatternSyntaxException(pendingPosition, "Bond without a following atom");
      }
      previous = branches.pop();
      branchPositions.pop();
      pos++;
    }

    private void separate() {
      if (pendingBond != null) {
        throw new PatternSyntaxException(pendingPosition, "Bond without a following atom");
      }
      if (!branches.isEmpty()) {
        throw new PatternSyntaxException(pos, "Component separator inside a branch");
      }
      if (previous == null) {
        throw new PatternSyntaxException(pos, "Empty component");
      }
      previous = null;
      pos++;
    }

    private BondExpression bondOrImplicit() {
      return pendingBond != null ? pendingBond : BondExpression.implicit();
    }

    private void clearPendingBond() {
      pendingBond = null;
      pendingText = null;
      pendingPosition = -1;
    }

    private Pattern build() {
      Pattern.PatternBuilder builder = Pattern.builder().text(text);
      for (int i = 0; i < atoms.size(); i++) {
        builder.atom(new PatternAtom(i, atoms.get(i), atomTexts.get(i)));
      }
      for (int i = 0; i < bonds.size(); i++) {
        RawBond bond = bonds.get(i);
        List<Integer> cycle = bond.ringClosure() ? shortestCycle(i) : List.of();
        builder.bond(new PatternBond(i, bond.atom1(), bond.atom2(), bond.expression(),
            bond.ringClosure(), cycle));
      }
      return builder.build();
    }

    /**
     * Atoms of the shortest pattern cycle through a bond: the shortest path between its ends that
     * avoids the bond itself.
     */
    private List<Integer> shortestCycle(int bondIndex) {
      RawBond closing = bonds.get(bondIndex);
      Map<Integer, Integer> parent = new HashMap<>();
      Deque<Integer> queue = new ArrayDeque<>();
      parent.put(closing.atom1(), -1);
      queue.add(closing.atom1());
      while (!queue.isEmpty() && !parent.containsKey(closing.atom2())) {
        int current = queue.poll();
        for (int i = 0; i < bonds.size(); i++) {
          RawBond bond = bonds.get(i);
          if (i == bondIndex || (bond.atom1() != current && bond.atom2() != current)) {
            continue;
          }
          int next = bond.atom1() == current ? bond.atom2() : bond.atom1();
          if (!parent.containsKey(next)) {
            parent.put(next, current);
            queue.add(next);
          }
        }
      }
      List<Integer> cycle = new ArrayList<>();
      for (Integer atom = closing.atom2(); atom != null && atom >= 0; atom = parent.get(atom)) {
        cycle.add(atom);
      }
      return cycle;
    }
  }
}
