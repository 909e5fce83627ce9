package com.quantori.mge.api.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Directional marker of a single bond adjacent to a stereo double bond. */
@Getter
@RequiredArgsConstructor
public enum BondStereo {
  NONE(""),
  UP("/"),
  DOWN("\\");

  private final String symbol;
}
