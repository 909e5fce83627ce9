package com.quantori.mge.api.model.core;

/**
 * Type of problem found in a notation.
 */
public enum ErrorType {
  /**
   * Malformed molecule notation
   */
  SYNTAX,
  /**
   * Atom valence above what the element and charge allow
   */
  VALENCE,
  /**
   * Aromatic atom outside a ring, or aromatic ring failing Hückel's rule
   */
  AROMATICITY,
  /**
   * Malformed pattern notation
   */
  PATTERN,
  /**
   * Molecule that cannot be written, such as one needing more open ring closures than notation
   * digits allow
   */
  GENERATION
}
