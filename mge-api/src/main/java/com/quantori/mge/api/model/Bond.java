package com.quantori.mge.api.model;

import java.util.List;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * An undirected bond between two atoms of a {@link Molecule}, addressed by atom ids.
 *
 * <p>Changing the order does not invalidate derived data; see {@link Molecule#markModified()}.
 */
@Getter
@Setter
@ToString
public class Bond {

  @Setter(AccessLevel.NONE)
  private final int id;
  @Setter(AccessLevel.NONE)
  private final int atom1;
  @Setter(AccessLevel.NONE)
  private final int atom2;
  private BondOrder order;
  private BondStereo stereo = BondStereo.NONE;
  /** Whether the bond symbol was written in the notation. */
  private boolean explicit;
  private boolean inRing;
  private List<Integer> ringIds = List.of();

  Bond(int id, int atom1, int atom2, BondOrder order) {
    this.id = id;
    this.atom1 = atom1;
    this.atom2 = atom2;
    this.order = order;
  }

  /**
   * Returns the atom at the other end of this bond.
   *
   * @param atomId one end of the bond
   * @return the other end
   * @throws IllegalArgumentException if the atom is not an end of this bond
   */
  public int getOther(int atomId) {
    if (atomId == atom1) {
      return atom2;
    }
    if (atomId == atom2) {
      return atom1;
    }
    throw new IllegalArgumentException("Atom " + atomId + " is not part of bond " + id);
  }

  public boolean contains(int atomId) {
    return atom1 == atomId || atom2 == atomId;
  }

  public boolean connects(int first, int second) {
    return (atom1 == first && atom2 == second) || (atom1 == second && atom2 == first);
  }

  public void setRingIds(List<Integer> ringIds) {
    this.ringIds = List.copyOf(ringIds);
  }

  Bond copy() {
    Bond bond = new Bond(id, atom1, atom2, order);
    bond.stereo = stereo;
    bond.explicit = explicit;
    bond.inRing = inRing;
    bond.ringIds = ringIds;
    return bond;
  }
}
