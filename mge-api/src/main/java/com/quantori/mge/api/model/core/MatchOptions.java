package com.quantori.mge.api.model.core;

import lombok.Builder;
import lombok.Value;

/**
 * Bounds and filters of a substructure search. A zero search bound takes the engine default, a
 * negative one means unbounded; a match cap of zero or less means no cap.
 */
@Value
@Builder(toBuilder = true)
public class MatchOptions {
  @Builder.Default
  int maxMatches = 0;
  /**
   * Drop matches whose atom set equals an earlier match
   */
  @Builder.Default
  boolean uniqueOnly = false;
  @Builder.Default
  long maxSearchSteps = 0;
  /**
   * Largest pattern, in atoms, the search will descend through
   */
  @Builder.Default
  int maxSearchDepth = 0;

  public static MatchOptions defaults() {
    return MatchOptions.builder().build();
  }
}
