package com.quantori.mge.core.enrich;

import static org.assertj.core.api.Assertions.assertThat;

import com.quantori.mge.api.model.Atom;
import com.quantori.mge.api.model.Bond;
import com.quantori.mge.api.model.Hybridization;
import com.quantori.mge.api.model.Molecule;
import com.quantori.mge.api.model.core.ErrorType;
import com.quantori.mge.api.model.core.NotationError;
import com.quantori.mge.core.notation.NotationParser;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class MoleculeEnricherTest {

  private final NotationParser parser = new NotationParser();
  private final MoleculeEnricher enricher = new MoleculeEnricher();

  @ParameterizedTest
  @CsvSource({
      "CCO, 2, 1",
      "C=O, 0, 2",
      "c1ccccc1, 0, 1",
      "c1ccncc1, 3, 0",
      "c1cc[nH]c1, 3, 1",
      "C[N+](C)(C)C, 1, 0",
      "CN(C)(C)C, 1, 1",
      "[NH4+], 0, 4",
      "FC(F)(F)F, 1, 0"
  })
  void testHydrogenCounts(String text, int atomIndex, int hydrogens) {
    Molecule molecule = enriched(text);

    assertThat(molecule.getAtoms().get(atomIndex).getHydrogenCount()).isEqualTo(hydrogens);
  }

  @Test
  void testEnrichmentIsIdempotent() {
    Molecule molecule = enriched("OC(=O)C1CCCC1C#N");
    List<String> first = snapshot(molecule);

    enricher.enrich(molecule);

    assertThat(snapshot(molecule)).isEqualTo(first);
  }

  @Test
  void testRingMembershipFromBridges() {
    Molecule molecule = enriched("C1CC1CC");

    assertThat(MoleculeEnricher.findBridges(molecule)).containsExactlyInAnyOrder(3, 4);
    assertThat(molecule.getBonds()).filteredOn(Bond::isInRing).hasSize(3);
    assertThat(molecule.getAtoms()).filteredOn(Atom::isInRing)
        .extracting(Atom::getId)
        .containsExactly(0, 1, 2);
  }

  @Test
  void testDegreeAndHybridization() {
    Molecule molecule = enriched("C#CC=CC");

    assertThat(molecule.getAtom(0).getHybridization()).isEqualTo(Hybridization.SP);
    assertThat(molecule.getAtom(3).getHybridization()).isEqualTo(Hybridization.SP2);
    assertThat(molecule.getAtom(4).getHybridization()).isEqualTo(Hybridization.SP3);
    assertThat(molecule.getAtom(2).getDegree()).isEqualTo(2);
  }

  @Test
  void testValenceWarnings() {
    ValenceValidator validator = new ValenceValidator();

    List<NotationError> problems = validator.validate(enriched("CC(C)(C)(C)C"));

    assertThat(problems).hasSize(1);
    assertThat(problems.get(0).getType()).isEqualTo(ErrorType.VALENCE);
    assertThat(problems.get(0).getPosition()).isEqualTo(-1);
    assertThat(problems.get(0).getMessage()).contains("valence 5", "maximum allowed is 4");
    assertThat(validator.validate(enriched("C[N+](C)(C)C"))).isEmpty();
    assertThat(validator.validate(enriched("OS(=O)(=O)O"))).isEmpty();
  }

  private Molecule enriched(String text) {
    Molecule molecule = parser.parse(text).getMoleculesOrThrow().get(0);
    enricher.enrich(molecule);
    return molecule;
  }

  private List<String> snapshot(Molecule molecule) {
    return molecule.getAtoms().stream()
        .map(atom -> atom.getId() + ":" + atom.getHydrogenCount() + ":" + atom.getDegree() + ":"
            + atom.isInRing() + ":" + atom.getHybridization())
        .toList();
  }
}
