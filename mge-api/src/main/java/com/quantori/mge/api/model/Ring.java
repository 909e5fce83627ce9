package com.quantori.mge.api.model;

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * A ring of the smallest set of smallest rings.
 *
 * <p>Atom ids are in cycle order, so consecutive ids (and the last and first) are bonded. Bond
 * ids follow the same order: bond {@code i} joins atoms {@code i} and {@code i + 1}.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class Ring {

  private final int id;
  private final List<Integer> atomIds;
  private final List<Integer> bondIds;
  private final boolean heterocyclic;

  @Setter
  private boolean aromatic;
  /** Shares exactly one bond with another ring. */
  @Setter
  private boolean fused;
  /** Shares exactly one atom with another ring. */
  @Setter
  private boolean spiro;
  /** Shares more than two atoms with another ring. */
  @Setter
  private boolean bridged;

  public int getSize() {
    return atomIds.size();
  }

  public boolean containsAtom(int atomId) {
    return atomIds.contains(atomId);
  }

  public boolean containsBond(int bondId) {
    return bondIds.contains(bondId);
  }

  /** A ring sharing no atom with any other ring. */
  public boolean isIsolated() {
    return !fused && !spiro && !bridged;
  }

  public RingClass getRingClass() {
    if (aromatic) {
      return RingClass.AROMATIC;
    }
    return heterocyclic ? RingClass.HETEROCYCLIC : RingClass.ALIPHATIC;
  }
}
