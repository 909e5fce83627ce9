package com.quantori.mge.core.generate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.quantori.mge.api.NotationException;
import com.quantori.mge.api.model.Atom;
import com.quantori.mge.api.model.Bond;
import com.quantori.mge.api.model.BondOrder;
import com.quantori.mge.api.model.Molecule;
import com.quantori.mge.api.model.core.ErrorType;
import com.quantori.mge.api.model.core.GenerationOptions;
import com.quantori.mge.api.model.core.NotationError;
import com.quantori.mge.core.MolecularGraphEngine;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class NotationGeneratorTest {

  private final MolecularGraphEngine engine = new MolecularGraphEngine();

  @ParameterizedTest
  @CsvSource({
      "CCO, OCC",
      "c1ccccc1, C1=CC=CC=C1",
      "CC(C)O, OC(C)C",
      "OC(=O)c1ccccc1, c1ccc(cc1)C(=O)O",
      "c1ccc2ccccc2c1, C1=CC=C2C=CC=CC2=C1",
      "c1cc[nH]c1, C1=CNC=C1",
      "N1CCCC1C(=O)O, OC(=O)C1CCCN1"
  })
  void testCanonicalFormIgnoresInputOrder(String first, String second) {
    assertThat(canonical(first)).isEqualTo(canonical(second));
  }

  @Test
  void testCanonicalExamples() {
    assertThat(canonical("OCC")).isEqualTo("CCO");
    assertThat(canonical("C1=CC=CC=C1")).isEqualTo("c1ccccc1");
    assertThat(canonical("OC(C)C")).isEqualTo("CC(C)O");
  }

  @Test
  void testComponentsAreSortedAndJoined() {
    Molecule salt = new Molecule();
    salt.addAtom("Na", 11).setCharge(1);
    salt.addAtom("Cl", 17).setCharge(-1);

    assertThat(engine.generate(salt, true)).isEqualTo("[Cl-].[Na+]");
    assertThat(engine.generate(salt, false)).isEqualTo("[Na+].[Cl-]");
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "CC(=O)Oc1ccccc1C(=O)O",
      "CN1C=NC2=C1C(=O)N(C(=O)N2C)C",
      "C1CC2CCC1C2",
      "C1CCCC12CCCC2",
      "[13CH3]C(=O)[O-]",
      "FC(F)(F)c1ccncc1",
      "C#N",
      "C12C3C4C1C5C2C3C45"
  })
  void testCanonicalRoundTrip(String text) {
    String once = canonical(text);
    String twice = canonical(once);

    assertThat(twice).isEqualTo(once);
    assertThat(engine.formula(parse(once))).isEqualTo(engine.formula(parse(text)));
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "OCC",
      "C(C)O",
      "C1=CC=CC=C1",
      "c1ccccc1",
      "[13CH3]O",
      "F/C=C/F",
      "[C@@H](F)(Cl)Br",
      "C1CC1",
      "CC(C)(C)C#N",
      "c1ccccc1-c1ccccc1"
  })
  void testPreservingFormReproducesInput(String text) {
    assertThat(engine.generate(parse(text), false)).isEqualTo(text);
  }

  @Test
  void testCanonicalFormDropsStereo() {
    String result = canonical("F/C=C/[C@@H](Cl)Br");

    assertThat(result).doesNotContain("@", "/", "\\");
  }

  @Test
  void testKekulizedOutput() {
    GenerationOptions options = GenerationOptions.canonical().toBuilder().kekulize(true).build();

    String result = engine.generate(parse("c1ccc2ccccc2c1"), options);

    assertThat(result).isEqualTo(result.toUpperCase()).contains("=");
    assertThat(result.chars().filter(c -> c == '=').count()).isEqualTo(5);
    assertThat(canonical(result)).isEqualTo(canonical("c1ccc2ccccc2c1"));
  }

  @Test
  void testGenerationDoesNotModifyInput() {
    Molecule molecule = parse("C1=CC=CC=C1");

    engine.generate(molecule, true);

    assertThat(molecule.getAtoms()).noneMatch(atom -> atom.isAromatic());
    assertThat(engine.generate(molecule, false)).isEqualTo("C1=CC=CC=C1");
  }

  @Test
  void testRingNumbersAreReused() {
    String result = canonical("C1CC1CC1CC1");

    assertThat(result).doesNotContain("2");
    assertThat(canonical(result)).isEqualTo(result);
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "C12C3C4C5C1C6C7C2C3C4C5C67",
      "C12C3C4C1C5C2C3C45",
      "C1CC2CCC1CC2",
      "C1CCC2(CC1)CCCCC2",
      "CC1CCC(C)CC1",
      "c1ccc2ccccc2c1",
      "CC(C)(C)C(C(C)(C)C)C(C)(C)C"
  })
  void testCanonicalFormIgnoresAtomAndBondOrder(String text) {
    Molecule source = parse(text);
    Random random = new Random(42);

    Set<String> forms = IntStream.range(0, 40)
        .mapToObj(i -> engine.generate(shuffled(source, random), true))
        .collect(Collectors.toSet());

    assertThat(forms).hasSize(1);
    assertThat(forms).containsExactly(canonical(text));
  }

  @ParameterizedTest
  @ValueSource(strings = {"c1ccc2ccccc2c1", "c1ccc2cc3ccccc3cc2c1", "c1ccc2[nH]ccc2c1"})
  void testKekulizedCanonicalFormIgnoresAtomOrder(String text) {
    GenerationOptions options = GenerationOptions.canonical().toBuilder().kekulize(true).build();
    Molecule source = parse(text);
    Random random = new Random(7);

    Set<String> forms = IntStream.range(0, 20)
        .mapToObj(i -> engine.generate(shuffled(source, random), options))
        .collect(Collectors.toSet());

    assertThat(forms).hasSize(1);
  }

  @Test
  void testPreservingFormAfterAromaticityPerception() {
    Molecule molecule = parse("C1=CC=CC=C1");
    engine.perceiveAromaticity(molecule);

    assertThat(engine.generate(molecule, false)).isEqualTo("c1ccccc1");
  }

  @Test
  void testTooManyOpenRingClosures() {
    Molecule molecule = new Molecule();
    for (int i = 0; i < 102; i++) {
      molecule.addAtom("C", 6);
    }
    for (int i = 0; i < 101; i++) {
      molecule.addBond(i, i + 1, BondOrder.SINGLE);
    }
    for (int i = 2; i < 102; i++) {
      molecule.addBond(0, i, BondOrder.SINGLE);
    }

    NotationException exception = catchThrowableOfType(
        () -> engine.generate(molecule, false), NotationException.class);

    assertThat(exception).isNotNull();
    assertThat(exception.getErrors()).extracting(NotationError::getType)
        .containsExactly(ErrorType.GENERATION);
  }

  @Test
  void testLongChain() {
    Molecule molecule = new Molecule();
    molecule.addAtom("C", 6);
    for (int i = 1; i < 20_000; i++) {
      molecule.addAtom("C", 6);
      molecule.addBond(i - 1, i, BondOrder.SINGLE);
    }

    assertThat(engine.generate(molecule, false)).isEqualTo("C".repeat(20_000));
  }

  /** Same graph with atoms and bonds added in random order and random bond direction. */
  private Molecule shuffled(Molecule source, Random random) {
    List<Atom> atoms = new ArrayList<>(source.getAtoms());
    Collections.shuffle(atoms, random);
    Molecule target = new Molecule();
    Map<Integer, Integer> ids = new HashMap<>();
    for (Atom atom : atoms) {
      Atom copy = target.addAtom(atom.getSymbol(), atom.getAtomicNumber());
      copy.setAromatic(atom.isAromatic());
      copy.setBracket(atom.isBracket());
      copy.setCharge(atom.getCharge());
      copy.setIsotope(atom.getIsotope());
      copy.setExplicitHydrogens(atom.getExplicitHydrogens());
      ids.put(atom.getId(), copy.getId());
    }
    List<Bond> bonds = new ArrayList<>(source.getBonds());
    Collections.shuffle(bonds, random);
    for (Bond bond : bonds) {
      int first = ids.get(bond.getAtom1());
      int second = ids.get(bond.getAtom2());
      if (random.nextBoolean()) {
        target.addBond(first, second, bond.getOrder());
      } else {
        target.addBond(second, first, bond.getOrder());
      }
    }
    return target;
  }

  private String canonical(String text) {
    return engine.generate(parse(text), true);
  }

  private Molecule parse(String text) {
    return engine.parse(text).getMoleculesOrThrow().get(0);
  }
}
