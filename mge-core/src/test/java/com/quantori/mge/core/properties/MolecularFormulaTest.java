package com.quantori.mge.core.properties;

import static org.assertj.core.api.Assertions.assertThat;

import com.quantori.mge.api.model.Molecule;
import com.quantori.mge.core.enrich.MoleculeEnricher;
import com.quantori.mge.core.notation.NotationParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class MolecularFormulaTest {

  private final NotationParser parser = new NotationParser();
  private final MoleculeEnricher enricher = new MoleculeEnricher();

  @ParameterizedTest
  @CsvSource({
      "CCO, C2H6O",
      "c1ccccc1, C6H6",
      "O, H2O",
      "[H][H], H2",
      "ClC(Cl)(Cl)Cl, CCl4",
      "N, H3N",
      "OS(=O)(=O)O, H2O4S",
      "*C, CH3",
      "[13CH4], CH4",
      "C[N+](C)(C)C, C4H12N"
  })
  void testFormula(String text, String expected) {
    Molecule molecule = parser.parse(text).getMoleculesOrThrow().get(0);
    enricher.enrich(molecule);

    assertThat(MolecularFormula.of(molecule)).isEqualTo(expected);
  }

  @Test
  void testEmptyMolecule() {
    assertThat(MolecularFormula.of(new Molecule())).isEmpty();
  }
}
