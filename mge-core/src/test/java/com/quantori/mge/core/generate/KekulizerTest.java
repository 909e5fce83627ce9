package com.quantori.mge.core.generate;

import static org.assertj.core.api.Assertions.assertThat;

import com.quantori.mge.api.model.Atom;
import com.quantori.mge.api.model.Bond;
import com.quantori.mge.api.model.BondOrder;
import com.quantori.mge.api.model.Molecule;
import com.quantori.mge.core.enrich.MoleculeEnricher;
import com.quantori.mge.core.notation.NotationParser;
import org.junit.jupiter.api.Test;

class KekulizerTest {

  private final NotationParser parser = new NotationParser();
  private final MoleculeEnricher enricher = new MoleculeEnricher();
  private final Kekulizer kekulizer = new Kekulizer();

  @Test
  void testBenzeneGetsThreeDoubleBonds() {
    Molecule molecule = prepare("c1ccccc1");

    assertThat(kekulizer.kekulize(molecule)).isTrue();

    assertThat(molecule.getBonds()).filteredOn(bond -> bond.getOrder() == BondOrder.DOUBLE)
        .hasSize(3);
    assertThat(molecule.getAtoms()).noneMatch(Atom::isAromatic);
    for (Atom atom : molecule.getAtoms()) {
      assertThat(molecule.getBondsOf(atom.getId()))
          .filteredOn(bond -> bond.getOrder() == BondOrder.DOUBLE)
          .hasSize(1);
    }
  }

  @Test
  void testPyrroleNitrogenKeepsSingleBonds() {
    Molecule molecule = prepare("c1cc[nH]c1");

    assertThat(kekulizer.kekulize(molecule)).isTrue();

    assertThat(molecule.getBondsOf(3)).extracting(Bond::getOrder)
        .containsOnly(BondOrder.SINGLE);
    assertThat(molecule.getBonds()).filteredOn(bond -> bond.getOrder() == BondOrder.DOUBLE)
        .hasSize(2);
  }

  @Test
  void testImpossibleAssignmentLeavesMoleculeUnchanged() {
    Molecule molecule = prepare("c1cccc1");

    assertThat(kekulizer.kekulize(molecule)).isFalse();

    assertThat(molecule.getAtoms()).allMatch(Atom::isAromatic);
    assertThat(molecule.getBonds()).allMatch(bond -> bond.getOrder() == BondOrder.AROMATIC);
  }

  private Molecule prepare(String text) {
    Molecule molecule = parser.parse(text).getMoleculesOrThrow().get(0);
    enricher.enrich(molecule);
    return molecule;
  }
}
