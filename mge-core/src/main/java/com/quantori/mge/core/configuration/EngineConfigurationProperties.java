package com.quantori.mge.core.configuration;

import java.util.Comparator;
import java.util.List;
import lombok.Builder;
import lombok.Data;

@Builder
@Data
public class EngineConfigurationProperties {
  /**
   * Longest cycle enumerated by ring perception for small molecules.
   */
  @Builder.Default
  int maxRingSize = 40;
  /**
   * Shorter cycle bounds for large molecules. Incomplete ring sets are flagged, not hidden.
   */
  @Builder.Default
  List<RingSizeThreshold> ringSizeThresholds = List.of(
      new RingSizeThreshold(60, 25),
      new RingSizeThreshold(100, 22),
      new RingSizeThreshold(150, 20));
  /**
   * Molecules up to this many atoms use depth-first cycle enumeration, larger ones breadth-first.
   */
  @Builder.Default
  int dfsAtomLimit = 60;
  /**
   * Cycles collected by depth-first enumeration before falling back to breadth-first search.
   */
  @Builder.Default
  int maxCandidateCycles = 5000;
  /**
   * Reject molecules with valence problems instead of reporting warnings.
   */
  @Builder.Default
  boolean strictValence = false;
  @Builder.Default
  long defaultMaxSearchSteps = 1_000_000;
  @Builder.Default
  int defaultMaxSearchDepth = 0;

  public static EngineConfigurationProperties defaults() {
    return EngineConfigurationProperties.builder().build();
  }

  /**
   * Longest cycle to enumerate for a molecule of the given size.
   *
   * @param atomCount number of atoms
   * @return cycle length bound
   */
  public int maxRingSizeFor(int atomCount) {
    return ringSizeThresholds.stream()
        .filter(threshold -> atomCount > threshold.minAtoms())
        .max(Comparator.comparingInt(RingSizeThreshold::minAtoms))
        .map(RingSizeThreshold::maxRingSize)
        .map(size -> Math.min(size, maxRingSize))
        .orElse(maxRingSize);
  }
}
