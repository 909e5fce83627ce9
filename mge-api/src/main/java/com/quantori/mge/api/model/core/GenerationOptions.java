package com.quantori.mge.api.model.core;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class GenerationOptions {
  /**
   * Isomorphism invariant output; otherwise the input atom order and markers are kept
   */
  @Builder.Default
  boolean canonical = true;
  /**
   * Write aromatic systems as alternating single and double bonds
   */
  @Builder.Default
  boolean kekulize = false;

  public static GenerationOptions canonical() {
    return GenerationOptions.builder().build();
  }

  public static GenerationOptions preserving() {
    return GenerationOptions.builder().canonical(false).build();
  }
}
