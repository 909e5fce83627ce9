package com.quantori.mge.api.model;

import java.util.List;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Result of ring perception for one molecule. */
@Getter
@ToString
@Builder
public class RingSet {

  private final List<Ring> rings;

  /**
   * {@code false} when a configured bound (maximum ring size, candidate cap) kept perception from
   * reaching {@link #getExpectedSize()} rings.
   */
  private final boolean complete;

  /** Cyclomatic number {@code |bonds| - |atoms| + components}. */
  private final int expectedSize;

  private final int maxRingSizeSearched;

  public static RingSet empty() {
    return RingSet.builder().rings(List.of()).complete(true).build();
  }

  public int size() {
    return rings.size();
  }

  public boolean isEmpty() {
    return rings.isEmpty();
  }

  public Ring get(int ringId) {
    return rings.get(ringId);
  }

  public List<Ring> ringsOf(int atomId) {
    return rings.stream().filter(ring -> ring.containsAtom(atomId)).collect(Collectors.toList());
  }

  public List<Ring> getAromaticRings() {
    return rings.stream().filter(Ring::isAromatic).collect(Collectors.toList());
  }
}
