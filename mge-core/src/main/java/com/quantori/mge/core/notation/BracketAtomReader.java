package com.quantori.mge.core.notation;

import com.quantori.mge.api.model.Atom;
import com.quantori.mge.api.model.Element;
import java.util.Optional;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.CharUtils;

/**
 * Reads {@code [isotope symbol chirality Hn charge :class]}.
 */
@UtilityClass
class BracketAtomReader {

  private static final String[] AROMATIC_TWO_LETTER = {"se", "as", "te"};

  /**
   * Reads a bracket atom.
   *
   * @param text notation
   * @param start index of the opening bracket
   * @return parsed contents
   * @throws NotationSyntaxException when the contents are malformed or the element is unknown
   */
  BracketAtom read(String text, int start) {
    int close = text.indexOf(']', start + 1);
    int nextOpen = text.indexOf('[', start + 1);
    if (close < 0 || (nextOpen >= 0 && nextOpen < close)) {
      throw new NotationSyntaxException(start, "Unclosed bracket atom");
    }
    int pos = start + 1;

    Integer isotope = null;
    int digitsEnd = skipDigits(text, pos, close);
    if (digitsEnd > pos) {
      isotope = parseNumber(text, pos, digitsEnd);
      pos = digitsEnd;
    }

    if (pos >= close) {
      throw new NotationSyntaxException(pos, "Missing element symbol in bracket atom");
    }
    String symbol;
    int atomicNumber;
    boolean aromatic = false;
    char first = text.charAt(pos);
    if (first == '*') {
      symbol = Atom.WILDCARD;
      atomicNumber = 0;
      pos++;
    } else if (Character.isLowerCase(first)) {
      String aromaticSymbol = readAromaticSymbol(text, pos, close);
      Element element = Element.ofAromaticSymbol(aromaticSymbol)
          .orElseThrow(() -> new NotationSyntaxException(start + 1,
              "Element '" + first + "' cannot be aromatic"));
      symbol = element.getSymbol();
      atomicNumber = element.getAtomicNumber();
      aromatic = true;
      pos += aromaticSymbol.length();
    } else if (Character.isUpperCase(first)) {
      Element element = readElement(text, pos, close);
      symbol = element.getSymbol();
      atomicNumber = element.getAtomicNumber();
      pos += symbol.length();
    } else {
      throw new NotationSyntaxException(pos, "Unexpected character '" + first + "' in bracket atom");
    }

    String chirality = null;
    if (pos < close && text.charAt(pos) == '@') {
      int chiralityStart = pos;
      pos++;
      if (pos < close && text.charAt(pos) == '@') {
        pos++;
      } else if (pos + 1 < close && isChiralClass(text.substring(pos, pos + 2))) {
        pos += 2;
        int end = skipDigits(text, pos, close);
        if (end == pos) {
          throw new NotationSyntaxException(pos, "Missing chirality class number");
        }
        pos = end;
      }
      chirality = text.substring(chiralityStart, pos);
    }

    int hydrogens = 0;
    if (pos < close && text.charAt(pos) == 'H') {
      pos++;
      int end = skipDigits(text, pos, close);
      hydrogens = end > pos ? parseNumber(text, pos, end) : 1;
      pos = end;
    }

    int charge = 0;
    if (pos < close && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
      char sign = text.charAt(pos);
      int unit = sign == '+' ? 1 : -1;
      pos++;
      int end = skipDigits(text, pos, close);
      if (end > pos) {
        charge = unit * parseNumber(text, pos, end);
        pos = end;
      } else {
        charge = unit;
        while (pos < close && text.charAt(pos) == sign) {
          charge += unit;
          pos++;
        }
      }
    }

    Integer atomClass = null;
    if (pos < close && text.charAt(pos) == ':') {
      pos++;
      int end = skipDigits(text, pos, close);
      if (end == pos) {
        throw new NotationSyntaxException(pos, "Missing atom class number");
      }
      atomClass = parseNumber(text, pos, end);
      pos = end;
    }

    if (pos != close) {
      throw new NotationSyntaxException(pos,
          "Unexpected character '" + text.charAt(pos) + "' in bracket atom");
    }
    return new BracketAtom(isotope, symbol, atomicNumber, aromatic, chirality, hydrogens, charge,
        atomClass, close + 1);
  }

  private Element readElement(String text, int pos, int limit) {
    if (pos + 1 < limit && Character.isLowerCase(text.charAt(pos + 1))) {
      Optional<Element> twoLetter = Element.ofSymbol(text.substring(pos, pos + 2));
      if (twoLetter.isPresent()) {
        return twoLetter.get();
      }
    }
    return Element.ofSymbol(text.substring(pos, pos + 1))
        .orElseThrow(() -> new NotationSyntaxException(pos,
            "Unknown element '" + text.substring(pos, Math.min(pos + 2, limit)) + "'"));
  }

  private String readAromaticSymbol(String text, int pos, int limit) {
    for (String candidate : AROMATIC_TWO_LETTER) {
      if (text.startsWith(candidate, pos) && pos + candidate.length() <= limit) {
        return candidate;
      }
    }
    return text.substring(pos, pos + 1);
  }

  private boolean isChiralClass(String value) {
    return "TH".equals(value) || "AL".equals(value) || "SP".equals(value)
        || "TB".equals(value) || "OH".equals(value);
  }

  private int parseNumber(String text, int from, int to) {
    try {
      return Integer.parseInt(text.substring(from, to));
    } catch (NumberFormatException e) {
      throw new NotationSyntaxException(from,
          "Number " + text.substring(from, to) + " is too large", e);
    }
  }

  private int skipDigits(String text, int pos, int limit) {
    int end = pos;
    while (end < limit && CharUtils.isAsciiNumeric(text.charAt(end))) {
      end++;
    }
    return end;
  }
}
