package com.quantori.mge.api.model;

import java.util.List;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * An atom of a {@link Molecule}.
 *
 * <p>Atoms are created by {@link Molecule#addAtom(String, int)} which assigns the id. Parsed
 * attributes (symbol, charge, isotope, bracket, chirality, class) are set by the parser, derived
 * attributes (implicit hydrogens, degree, ring flags, hybridization) by enrichment and ring
 * perception. Setters do not invalidate derived data; see {@link Molecule#markModified()}.
 */
@Getter
@Setter
@ToString
public class Atom {

  public static final String WILDCARD = "*";

  @Setter(AccessLevel.NONE)
  private final int id;
  private String symbol;
  private int atomicNumber;
  private int charge;
  private Integer isotope;
  private boolean bracket;
  /**
   * Hydrogen count written in brackets or pinned by aromaticity perception; {@code null} when the
   * count is derived from the default valence.
   */
  private Integer explicitHydrogens;
  private int implicitHydrogens;
  private boolean aromatic;
  private String chirality;
  private Integer atomClass;

  private int degree;
  private boolean inRing;
  private List<Integer> ringIds = List.of();
  private Hybridization hybridization = Hybridization.OTHER;

  Atom(int id, String symbol, int atomicNumber) {
    this.id = id;
    this.symbol = symbol;
    this.atomicNumber = atomicNumber;
  }

  /**
   * Hydrogens attached to the atom but not present as separate hydrogen atoms.
   *
   * @return explicit count when fixed, otherwise the computed implicit count
   */
  public int getHydrogenCount() {
    return explicitHydrogens != null ? explicitHydrogens : implicitHydrogens;
  }

  public boolean hasFixedHydrogens() {
    return explicitHydrogens != null;
  }

  public boolean isWildcard() {
    return WILDCARD.equals(symbol);
  }

  public boolean isCarbon() {
    return atomicNumber == 6;
  }

  public boolean isHydrogen() {
    return atomicNumber == 1;
  }

  public void setRingIds(List<Integer> ringIds) {
    this.ringIds = List.copyOf(ringIds);
  }

  Atom copy() {
    Atom atom = new Atom(id, symbol, atomicNumber);
    atom.charge = charge;
    atom.isotope = isotope;
    atom.bracket = bracket;
    atom.explicitHydrogens = explicitHydrogens;
    atom.implicitHydrogens = implicitHydrogens;
    atom.aromatic = aromatic;
    atom.chirality = chirality;
    atom.atomClass = atomClass;
    atom.degree = degree;
    atom.inRing = inRing;
    atom.ringIds = ringIds;
    atom.hybridization = hybridization;
    return atom;
  }
}
