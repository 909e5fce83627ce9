package com.quantori.mge.core.properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.quantori.mge.api.model.Molecule;
import com.quantori.mge.api.model.core.MolecularDescriptors;
import com.quantori.mge.core.MolecularGraphEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class MolecularDescriptorCalculatorTest {

  private final MolecularGraphEngine engine = new MolecularGraphEngine();

  @ParameterizedTest
  @CsvSource({
      "CCO, 46.069, 46.04186",
      "c1ccccc1, 78.114, 78.04695",
      "O, 18.015, 18.01056",
      "*C, 15.035, 15.02348",
      "[2H]O[2H], 20.027, 20.02312",
      "[13CH4], 17.035, 17.03465"
  })
  void testMasses(String text, double weight, double exactMass) {
    MolecularDescriptors descriptors = describe(text);

    assertThat(descriptors.getMolecularWeight()).isCloseTo(weight, within(0.001));
    assertThat(descriptors.getExactMass()).isCloseTo(exactMass, within(0.00001));
  }

  @ParameterizedTest
  @CsvSource({
      "CCO, 3, 1, 0, 0, 1, 1",
      "c1ccccc1, 6, 0, 1, 1, 0, 0",
      "c1ccncc1, 6, 1, 1, 1, 0, 1",
      "c1ccc2ccccc2c1, 10, 0, 2, 2, 0, 0",
      "C1CCCCC1, 6, 0, 1, 0, 0, 0",
      "OC(=O)c1ccccc1N, 10, 3, 1, 1, 2, 3",
      "[H]O[H], 1, 1, 0, 0, 1, 1"
  })
  void testCounts(String text, int heavy, int hetero, int rings, int aromaticRings, int donors,
      int acceptors) {
    MolecularDescriptors descriptors = describe(text);

    assertThat(descriptors.getHeavyAtomCount()).isEqualTo(heavy);
    assertThat(descriptors.getHeteroAtomCount()).isEqualTo(hetero);
    assertThat(descriptors.getRingCount()).isEqualTo(rings);
    assertThat(descriptors.getAromaticRingCount()).isEqualTo(aromaticRings);
    assertThat(descriptors.getHydrogenBondDonorCount()).isEqualTo(donors);
    assertThat(descriptors.getHydrogenBondAcceptorCount()).isEqualTo(acceptors);
  }

  @ParameterizedTest
  @CsvSource({
      "CC, 0",
      "CCCC, 1",
      "CCCCCC, 3",
      "CC(C)(C)CC, 0",
      "CCC(=O)NC, 1",
      "CCC#CCC, 0",
      "c1ccccc1-c1ccccc1, 1",
      "C1CCCCC1CC, 1",
      "[H]C([H])([H])C([H])([H])C([H])([H])C([H])([H])[H], 1"
  })
  void testRotatableBonds(String text, int expected) {
    assertThat(describe(text).getRotatableBondCount()).isEqualTo(expected);
  }

  @Test
  void testFormulaIsIncluded() {
    assertThat(describe("CCO").getFormula()).isEqualTo("C2H6O");
  }

  @Test
  void testElementWithoutMassIsRejected() {
    Molecule molecule = engine.parse("[U]").getMoleculesOrThrow().get(0);

    assertThatThrownBy(() -> engine.descriptors(molecule))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("No atomic mass known for U");
  }

  @Test
  void testEmptyMolecule() {
    MolecularDescriptors descriptors = engine.descriptors(new Molecule());

    assertThat(descriptors.getExactMass()).isZero();
    assertThat(descriptors.getHeavyAtomCount()).isZero();
    assertThat(descriptors.getRingCount()).isZero();
  }

  private MolecularDescriptors describe(String text) {
    return engine.descriptors(engine.parse(text).getMoleculesOrThrow().get(0));
  }
}
