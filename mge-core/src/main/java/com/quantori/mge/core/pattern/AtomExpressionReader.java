package com.quantori.mge.core.pattern;

import com.quantori.mge.api.model.Element;
import com.quantori.mge.api.model.pattern.AtomExpression;
import com.quantori.mge.api.model.pattern.AtomExpression.Kind;
import java.util.Optional;
import java.util.Set;
import org.apache.commons.lang3.CharUtils;

/**
 * Recursive descent reader for the inside of a bracket pattern atom.
 *
 * <p>Precedence from tightest: {@code !}, {@code &} (or two primitives written side by side),
 * {@code ,}, {@code ;}.
 */
class AtomExpressionReader {

  /** Two letter symbols are read greedily only up to this atomic number. */
  private static final int MAX_TWO_LETTER_ATOMIC_NUMBER = 103;
  private static final String[] AROMATIC_TWO_LETTER = {"se", "as", "te"};
  private static final Set<String> CHIRAL_CLASSES = Set.of("TH", "AL", "SP", "TB", "OH");

  private final String text;
  private final int end;
  private final int start;
  private int pos;

  /**
   * @param text pattern text
   * @param start index just past the opening bracket
   * @param end index of the closing bracket
   */
  AtomExpressionReader(String text, int start, int end) {
    this.text = text;
    this.start = start;
    this.end = end;
    this.pos = start;
  }

  AtomExpression read() {
    if (pos == end) {
      throw new PatternSyntaxException(pos, "Empty bracket atom");
    }
    AtomExpression expression = lowAnd();
    if (pos != end) {
      throw new PatternSyntaxException(pos, "Unexpected character '" + text.charAt(pos) + "'");
    }
    return expression;
  }

  private AtomExpression lowAnd() {
    AtomExpression left = or();
    while (pos < end && text.charAt(pos) == ';') {
      pos++;
      left = AtomExpression.and(left, or());
    }
    return left;
  }

  private AtomExpression or() {
    AtomExpression left = highAnd();
    while (pos < end && text.charAt(pos) == ',') {
      pos++;
      left = AtomExpression.or(left, highAnd());
    }
    return left;
  }

  private AtomExpression highAnd() {
    AtomExpression left = unary();
    while (pos < end) {
      char c = text.charAt(pos);
      if (c == '&') {
        pos++;
        left = AtomExpression.and(left, unary());
      } else if (c != ';' && c != ',') {
        left = AtomExpression.and(left, unary());
      } else {
        break;
      }
    }
    return left;
  }

  private AtomExpression unary() {
    if (pos >= end) {
      throw new PatternSyntaxException(pos, "Missing atom primitive");
    }
    if (text.charAt(pos) == '!') {
      pos++;
      return AtomExpression.not(unary());
    }
    return primitive();
  }

  private AtomExpression primitive() {
    int at = pos;
    char c = text.charAt(pos);
    if (CharUtils.isAsciiNumeric(c)) {
      return AtomExpression.primitive(Kind.ISOTOPE, readNumber(0));
    }
    switch (c) {
      case '$':
        throw new PatternSyntaxException(pos, "Recursive expressions are not supported");
      case '*':
        pos++;
        return AtomExpression.any();
      case '#':
        pos++;
        if (pos >= end || !CharUtils.isAsciiNumeric(text.charAt(pos))) {
          throw new PatternSyntaxException(pos, "'#' must be followed by an atomic number");
        }
        return AtomExpression.primitive(Kind.ATOMIC_NUMBER, readNumber(0));
      case '@':
        skipChirality();
        return AtomExpression.any();
      case '+':
      case '-':
        return AtomExpression.primitive(Kind.CHARGE, readCharge());
      case 'D':
        if (!isTwoLetterElement()) {
          pos++;
          return AtomExpression.primitive(Kind.DEGREE, readNumber(1));
        }
        break;
      case 'X':
        if (!isTwoLetterElement()) {
          pos++;
          return AtomExpression.primitive(Kind.CONNECTIVITY, readNumber(1));
        }
        break;
      case 'H':
        if (!isHydrogenElement(at) && !isTwoLetterElement()) {
          pos++;
          return AtomExpression.primitive(Kind.TOTAL_HYDROGENS, readNumber(1));
        }
        break;
      case 'h':
        pos++;
        return AtomExpression.primitive(Kind.IMPLICIT_HYDROGENS, readNumber(AtomExpression.UNSPECIFIED));
      case 'R':
        if (!isTwoLetterElement()) {
          pos++;
          return AtomExpression.primitive(Kind.RING_COUNT, readNumber(AtomExpression.UNSPECIFIED));
        }
        break;
      case 'r':
        pos++;
        return AtomExpression.primitive(Kind.RING_SIZE, readNumber(AtomExpression.UNSPECIFIED));
      case 'x':
        pos++;
        return AtomExpression.primitive(Kind.RING_CONNECTIVITY,
            readNumber(AtomExpression.UNSPECIFIED));
      case 'v':
        pos++;
        return AtomExpression.primitive(Kind.VALENCE, readNumber(1));
      case 'a':
        if (!text.startsWith("as", pos)) {
          pos++;
          return AtomExpression.primitive(Kind.AROMATIC);
        }
        break;
      case 'A':
        if (!isTwoLetterElement()) {
          pos++;
          return AtomExpression.primitive(Kind.ALIPHATIC);
        }
        break;
      default:
        break;
    }
    return element();
  }

  private AtomExpression element() {
    char c = text.charAt(pos);
    if (Character.isLowerCase(c)) {
      for (String symbol : AROMATIC_TWO_LETTER) {
        if (text.startsWith(symbol, pos) && pos + symbol.length() <= end) {
          pos += symbol.length();
          return aromaticElement(symbol);
        }
      }
      Optional<Element> aromatic = Element.ofAromaticSymbol(String.valueOf(c));
      if (aromatic.isPresent()) {
        pos++;
        return AtomExpression.element(aromatic.get().getAtomicNumber(), true);
      }
      throw new PatternSyntaxException(pos, "Unexpected character '" + c + "'");
    }
    if (Character.isUpperCase(c)) {
      if (isTwoLetterElement()) {
        Element element = Element.ofSymbol(text.substring(pos, pos + 2)).orElseThrow();
        pos += 2;
        return AtomExpression.element(element.getAtomicNumber(), false);
      }
      Optional<Element> element = Element.ofSymbol(String.valueOf(c));
      if (element.isPresent()) {
        pos++;
        return AtomExpression.element(element.get().getAtomicNumber(), false);
      }
      throw new PatternSyntaxException(pos, "Unknown element '" + c + "'");
    }
    throw new PatternSyntaxException(pos, "Unexpected character '" + c + "'");
  }

  private AtomExpression aromaticElement(String symbol) {
    Element element = Element.ofAromaticSymbol(symbol).orElseThrow();
    return AtomExpression.element(element.getAtomicNumber(), true);
  }

  private boolean isTwoLetterElement() {
    if (pos + 1 >= end || !Character.isLowerCase(text.charAt(pos + 1))) {
      return false;
    }
    return Element.ofSymbol(text.substring(pos, pos + 2))
        .filter(element -> element.getAtomicNumber() <= MAX_TWO_LETTER_ATOMIC_NUMBER)
        .isPresent();
  }

  /**
   * {@code H} names the element when it opens the bracket, after an optional isotope, and is not
   * followed by a digit; {@code [H]}, {@code [2H]} and {@code [H+]} are hydrogen atoms.
   */
  private boolean isHydrogenElement(int at) {
    int first = start;
    while (first < end && CharUtils.isAsciiNumeric(text.charAt(first))) {
      first++;
    }
    return at == first && (at + 1 >= end || !CharUtils.isAsciiNumeric(text.charAt(at + 1)));
  }

  private int readNumber(int defaultValue) {
    int digitsStart = pos;
    while (pos < end && CharUtils.isAsciiNumeric(text.charAt(pos))) {
      pos++;
    }
    if (pos == digitsStart) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(text.substring(digitsStart, pos));
    } catch (NumberFormatException e) {
      throw new PatternSyntaxException(digitsStart,
          "Number " + text.substring(digitsStart, pos) + " is too large", e);
    }
  }

  private int readCharge() {
    char sign = text.charAt(pos);
    int unit = sign == '+' ? 1 : -1;
    pos++;
    if (pos < end && CharUtils.isAsciiNumeric(text.charAt(pos))) {
      return unit * readNumber(1);
    }
    int charge = unit;
    while (pos < end && text.charAt(pos) == sign) {
      charge += unit;
      pos++;
    }
    return charge;
  }

  private void skipChirality() {
    pos++;
    if (pos < end && text.charAt(pos) == '@') {
      pos++;
      return;
    }
    if (pos + 2 < end && CHIRAL_CLASSES.contains(text.substring(pos, pos + 2))
        && CharUtils.isAsciiNumeric(text.charAt(pos + 2))) {
      pos += 2;
      readNumber(0);
    }
  }
}
