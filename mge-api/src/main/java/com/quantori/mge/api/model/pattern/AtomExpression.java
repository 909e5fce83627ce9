package com.quantori.mge.api.model.pattern;

import java.util.List;
import java.util.Objects;

/**
 * Predicate tree over molecule atoms.
 *
 * <p>Leaves are primitives identified by {@link Kind} with an integer argument; inner nodes are
 * {@link Kind#AND}, {@link Kind#OR} and {@link Kind#NOT} over {@link #operands()}.
 *
 * @param kind primitive or combinator kind
 * @param value primitive argument, {@link #UNSPECIFIED} when the primitive was written without
 *     a number
 * @param operands children of a combinator, empty for primitives
 */
public record AtomExpression(Kind kind, int value, List<AtomExpression> operands) {

  public static final int UNSPECIFIED = -1;

  public AtomExpression {
    Objects.requireNonNull(kind);
    operands = List.copyOf(operands);
  }

  public enum Kind {
    /** Any atom. */
    ANY,
    AROMATIC,
    ALIPHATIC,
    ATOMIC_NUMBER,
    /** Explicit connections. */
    DEGREE,
    /** Explicit connections plus attached hydrogens. */
    CONNECTIVITY,
    /** Attached hydrogens including hydrogen atoms in the graph. */
    TOTAL_HYDROGENS,
    /** Hydrogens not present as atoms. */
    IMPLICIT_HYDROGENS,
    /** Number of SSSR rings the atom belongs to; unspecified means any ring. */
    RING_COUNT,
    /** Member of an SSSR ring of the given size; unspecified means any ring. */
    RING_SIZE,
    /** Number of ring bonds; unspecified means at least one. */
    RING_CONNECTIVITY,
    /** Bond order sum plus attached hydrogens. */
    VALENCE,
    CHARGE,
    ISOTOPE,
    AND,
    OR,
    NOT
  }

  public static AtomExpression any() {
    return new AtomExpression(Kind.ANY, UNSPECIFIED, List.of());
  }

  public static AtomExpression primitive(Kind kind, int value) {
    return new AtomExpression(kind, value, List.of());
  }

  public static AtomExpression primitive(Kind kind) {
    return primitive(kind, UNSPECIFIED);
  }

  /**
   * Element with a given aromaticity, e.g. {@code c} or {@code C}.
   *
   * @param atomicNumber atomic number
   * @param aromatic {@code true} for aromatic, {@code false} for aliphatic
   * @return conjunction of both primitives
   */
  public static AtomExpression element(int atomicNumber, boolean aromatic) {
    return and(
        primitive(Kind.ATOMIC_NUMBER, atomicNumber),
        primitive(aromatic ? Kind.AROMATIC : Kind.ALIPHATIC));
  }

  public static AtomExpression and(AtomExpression left, AtomExpression right) {
    return new AtomExpression(Kind.AND, UNSPECIFIED, List.of(left, right));
  }

  public static AtomExpression or(AtomExpression left, AtomExpression right) {
    return new AtomExpression(Kind.OR, UNSPECIFIED, List.of(left, right));
  }

  public static AtomExpression not(AtomExpression operand) {
    return new AtomExpression(Kind.NOT, UNSPECIFIED, List.of(operand));
  }

  public boolean isSpecified() {
    return value != UNSPECIFIED;
  }
}
