package com.quantori.mge.core.generate;

import static org.assertj.core.api.Assertions.assertThat;

import com.quantori.mge.api.model.Molecule;
import com.quantori.mge.core.enrich.MoleculeEnricher;
import com.quantori.mge.core.notation.NotationParser;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class CanonicalRankingTest {

  private final NotationParser parser = new NotationParser();
  private final MoleculeEnricher enricher = new MoleculeEnricher();

  @Test
  void testRanksArePermutation() {
    int[] ranks = CanonicalRanking.rank(prepare("CC(C)(C)c1ccccc1"));

    assertThat(Arrays.stream(ranks).sorted().toArray())
        .containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
  }

  @Test
  void testRanksFollowInvariants() {
    int[] ethanol = CanonicalRanking.rank(prepare("OCC"));

    assertThat(ethanol).containsExactly(1, 2, 0);
  }

  @Test
  void testEquivalentWritingsGiveSameRankedSymbols() {
    Molecule first = prepare("NCC(=O)O");
    Molecule second = prepare("OC(=O)CN");

    assertThat(symbolsByRank(first)).isEqualTo(symbolsByRank(second));
  }

  private String symbolsByRank(Molecule molecule) {
    int[] ranks = CanonicalRanking.rank(molecule);
    String[] symbols = new String[ranks.length];
    for (int i = 0; i < ranks.length; i++) {
      symbols[ranks[i]] = molecule.getAtoms().get(i).getSymbol()
          + molecule.getAtoms().get(i).getDegree();
    }
    return String.join(",", symbols);
  }

  private Molecule prepare(String text) {
    Molecule molecule = parser.parse(text).getMoleculesOrThrow().get(0);
    enricher.enrich(molecule);
    return molecule;
  }
}
