package com.quantori.mge.api.model.core;

import lombok.Builder;
import lombok.Value;

/**
 * Whole-molecule descriptors. Masses include the hydrogens attached to each atom; wildcard atoms
 * contribute nothing.
 */
@Value
@Builder
public class MolecularDescriptors {
  String formula;
  /** Average molecular weight from standard atomic weights, in daltons */
  double molecularWeight;
  /** Monoisotopic mass from the most abundant isotope of each element, in daltons */
  double exactMass;
  int heavyAtomCount;
  /** Heavy atoms other than carbon */
  int heteroAtomCount;
  /** Rings of the smallest set of smallest rings */
  int ringCount;
  int aromaticRingCount;
  /** Nitrogen and oxygen atoms carrying at least one hydrogen, implicit or as a hydrogen atom */
  int hydrogenBondDonorCount;
  /** Nitrogen and oxygen atoms */
  int hydrogenBondAcceptorCount;
  int rotatableBondCount;
}
