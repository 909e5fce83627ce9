package com.quantori.mge.api.model.pattern;

import java.util.List;
import java.util.Objects;

/**
 * Predicate tree over molecule bonds, built like {@link AtomExpression}.
 *
 * @param kind primitive or combinator kind
 * @param operands children of a combinator, empty for primitives
 */
public record BondExpression(Kind kind, List<BondExpression> operands) {

  public BondExpression {
    Objects.requireNonNull(kind);
    operands = List.copyOf(operands);
  }

  public enum Kind {
    /** Non-aromatic single bond, including directional {@code /} and {@code \}. */
    SINGLE,
    DOUBLE,
    TRIPLE,
    QUADRUPLE,
    AROMATIC,
    ANY,
    RING,
    /** Implicit bond between pattern atoms: single or aromatic. */
    SINGLE_OR_AROMATIC,
    AND,
    OR,
    NOT
  }

  public static BondExpression primitive(Kind kind) {
    return new BondExpression(kind, List.of());
  }

  public static BondExpression implicit() {
    return primitive(Kind.SINGLE_OR_AROMATIC);
  }

  public static BondExpression and(BondExpression left, BondExpression right) {
    return new BondExpression(Kind.AND, List.of(left, right));
  }

  public static BondExpression or(BondExpression left, BondExpression right) {
    return new BondExpression(Kind.OR, List.of(left, right));
  }

  public static BondExpression not(BondExpression operand) {
    return new BondExpression(Kind.NOT, List.of(operand));
  }
}
