package com.quantori.mge.api.model.pattern;

import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/** A compiled structural query. */
@Getter
@ToString
@Builder
public class Pattern {

  private final String text;
  @Singular
  private final List<PatternAtom> atoms;
  @Singular
  private final List<PatternBond> bonds;

  public int getAtomCount() {
    return atoms.size();
  }

  public boolean isEmpty() {
    return atoms.isEmpty();
  }

  public List<PatternBond> getBondsOf(int atomIndex) {
    List<PatternBond> result = new ArrayList<>();
    for (PatternBond bond : bonds) {
      if (bond.contains(atomIndex)) {
        result.add(bond);
      }
    }
    return result;
  }

  public List<PatternBond> getRingClosureBonds() {
    return bonds.stream().filter(PatternBond::ringClosure).toList();
  }
}
