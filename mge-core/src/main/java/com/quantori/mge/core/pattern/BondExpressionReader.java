package com.quantori.mge.core.pattern;

import com.quantori.mge.api.model.pattern.BondExpression;
import com.quantori.mge.api.model.pattern.BondExpression.Kind;

/**
 * Reads a bond expression written between two pattern atoms, same precedence as atom expressions.
 */
class BondExpressionReader {

  static final String BOND_CHARACTERS = "-=#$:~@/\\!&,;";

  private final String text;
  private final int end;
  private int pos;

  BondExpressionReader(String text, int start, int end) {
    this.text = text;
    this.pos = start;
    this.end = end;
  }

  BondExpression read() {
    BondExpression expression = lowAnd();
    if (pos != end) {
      throw new PatternSyntaxException(pos, "Unexpected bond character '" + text.charAt(pos) + "'");
    }
    return expression;
  }

  private BondExpression lowAnd() {
    BondExpression left = or();
    while (pos < end && text.charAt(pos) == ';') {
      pos++;
      left = BondExpression.and(left, or());
    }
    return left;
  }

  private BondExpression or() {
    BondExpression left = highAnd();
    while (pos < end && text.charAt(pos) == ',') {
      pos++;
      left = BondExpression.or(left, highAnd());
    }
    return left;
  }

  private BondExpression highAnd() {
    BondExpression left = unary();
    while (pos < end && text.charAt(pos) != ';' && text.charAt(pos) != ',') {
      if (text.charAt(pos) == '&') {
        pos++;
      }
      left = BondExpression.and(left, unary());
    }
    return left;
  }

  private BondExpression unary() {
    if (pos >= end) {
      throw new PatternSyntaxException(pos, "Missing bond primitive");
    }
    if (text.charAt(pos) == '!') {
      pos++;
      return BondExpression.not(unary());
    }
    char c = text.charAt(pos++);
    return switch (c) {
      case '-', '/', '\\' -> BondExpression.primitive(Kind.SINGLE);
      case '=' -> BondExpression.primitive(Kind.DOUBLE);
      case '#' -> BondExpression.primitive(Kind.TRIPLE);
      case '$' -> BondExpression.primitive(Kind.QUADRUPLE);
      case ':' -> BondExpression.primitive(Kind.AROMATIC);
      case '~' -> BondExpression.primitive(Kind.ANY);
      case '@' -> BondExpression.primitive(Kind.RING);
      default -> throw new PatternSyntaxException(pos - 1, "Unexpected bond character '" + c + "'");
    };
  }
}
