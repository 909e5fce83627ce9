package com.quantori.mge.api.model;

/** Classification of a perceived ring. */
public enum RingClass {
  /** All ring atoms are carbon and the ring is not aromatic. */
  ALIPHATIC,
  /** The ring was accepted by aromaticity perception or written aromatic. */
  AROMATIC,
  /** Non aromatic ring with at least one atom other than carbon. */
  HETEROCYCLIC
}
