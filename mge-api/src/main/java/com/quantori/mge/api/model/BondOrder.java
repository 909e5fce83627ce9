package com.quantori.mge.api.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Bond orders of the notation, with the symbol used to write them explicitly. */
@Getter
@RequiredArgsConstructor
public enum BondOrder {
  SINGLE(1, "-"),
  DOUBLE(2, "="),
  TRIPLE(3, "#"),
  QUADRUPLE(4, "$"),
  /**
   * A delocalized bond inside an aromatic ring. It counts as one valence unit; the aromatic atoms
   * at both ends reserve one more unit for the ring's π system.
   */
  AROMATIC(1, ":");

  private final int valenceContribution;
  private final String symbol;
}
