package com.quantori.mge.core;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.hasProperty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.quantori.mge.api.model.Atom;
import com.quantori.mge.api.model.BondOrder;
import com.quantori.mge.api.model.Molecule;
import com.quantori.mge.api.model.RingSet;
import com.quantori.mge.api.model.core.ErrorType;
import com.quantori.mge.api.model.core.MatchOptions;
import com.quantori.mge.api.model.core.MatchResult;
import com.quantori.mge.api.model.core.ParseResult;
import com.quantori.mge.api.model.core.SearchStatus;
import com.quantori.mge.api.model.pattern.Pattern;
import com.quantori.mge.core.configuration.EngineConfigurationProperties;
import com.quantori.mge.core.ring.RingPerceiver;
import org.junit.jupiter.api.Test;

class MolecularGraphEngineTest {

  @Test
  void testDerivedDataIsComputedOnce() {
    EngineConfigurationProperties properties = EngineConfigurationProperties.defaults();
    RingPerceiver ringPerceiver = spy(new RingPerceiver(properties));
    MolecularGraphEngine engine = new MolecularGraphEngine(properties, ringPerceiver);

    Molecule molecule = engine.parse("c1ccccc1O").getMoleculesOrThrow().get(0);
    RingSet first = engine.findRings(molecule);
    engine.perceiveAromaticity(molecule);
    Pattern pattern = engine.compilePattern("cO").getPatternOrThrow();
    engine.match(pattern, molecule, MatchOptions.defaults());
    RingSet second = engine.findRings(molecule);

    verify(ringPerceiver, times(1)).perceive(any(Molecule.class));
    assertThat(second == first, is(true));
  }

  @Test
  void testStructuralChangeRecomputesRings() {
    EngineConfigurationProperties properties = EngineConfigurationProperties.defaults();
    RingPerceiver ringPerceiver = spy(new RingPerceiver(properties));
    MolecularGraphEngine engine = new MolecularGraphEngine(properties, ringPerceiver);

    Molecule molecule = engine.parse("C1CC1").getMoleculesOrThrow().get(0);
    Atom methyl = molecule.addAtom("C", 6);
    molecule.addBond(0, methyl.getId(), BondOrder.SINGLE);
    RingSet ringSet = engine.findRings(molecule);

    verify(ringPerceiver, times(2)).perceive(any(Molecule.class));
    assertThat(ringSet.getRings(), hasSize(1));
    assertThat(engine.formula(molecule), is("C4H8"));
  }

  @Test
  void testPropertyEditRecomputesAfterMarkModified() {
    EngineConfigurationProperties properties = EngineConfigurationProperties.defaults();
    RingPerceiver ringPerceiver = spy(new RingPerceiver(properties));
    MolecularGraphEngine engine = new MolecularGraphEngine(properties, ringPerceiver);

    Molecule molecule = engine.parse("C1CC=CC=C1").getMoleculesOrThrow().get(0);
    engine.perceiveAromaticity(molecule);
    assertThat(molecule.getAtoms().stream().anyMatch(Atom::isAromatic), is(false));

    molecule.getBond(0, 1).orElseThrow().setOrder(BondOrder.DOUBLE);
    molecule.markModified();
    engine.perceiveAromaticity(molecule);

    verify(ringPerceiver, times(2)).perceive(any(Molecule.class));
    assertThat(molecule.getAtoms().stream().allMatch(Atom::isAromatic), is(true));
    assertThat(engine.formula(molecule), is("C6H6"));
  }

  @Test
  void testStrictValenceRejectsOvercrowdedCarbon() {
    MolecularGraphEngine engine = new MolecularGraphEngine(
        EngineConfigurationProperties.builder().strictValence(true).build());

    ParseResult result = engine.parse("CC(C)(C)(C)C");

    assertThat(result.isSuccess(), is(false));
    assertThat(result.getMolecules(), is(empty()));
    assertThat(result.getErrors(), hasSize(1));
    assertThat(result.getErrors(), everyItem(hasProperty("type", is(ErrorType.VALENCE))));
  }

  @Test
  void testLenientValenceReportsWarning() {
    MolecularGraphEngine engine = new MolecularGraphEngine();

    ParseResult result = engine.parse("CC(C)(C)(C)C");

    assertThat(result.isSuccess(), is(true));
    assertThat(result.getMolecules(), hasSize(1));
    assertThat(result.getWarnings(), hasSize(1));
    assertThat(result.getWarnings(), everyItem(hasProperty("type", is(ErrorType.VALENCE))));
  }

  @Test
  void testAromaticAtomOutsideRingIsReported() {
    ParseResult result = new MolecularGraphEngine().parse("Cc");

    assertThat(result.isSuccess(), is(true));
    assertThat(result.getWarnings(), everyItem(hasProperty("type", is(ErrorType.AROMATICITY))));
    assertThat(result.getWarnings().isEmpty(), is(false));
  }

  @Test
  void testSyntaxErrorIsReturnedUnchanged() {
    ParseResult result = new MolecularGraphEngine().parse("C1CC");

    assertThat(result.getErrors(), hasSize(1));
    assertThat(result.getErrors().get(0).getType(), is(ErrorType.SYNTAX));
  }

  @Test
  void testMatchOnEmptyMolecule() {
    MolecularGraphEngine engine = new MolecularGraphEngine();
    Pattern pattern = engine.compilePattern("C").getPatternOrThrow();

    MatchResult result = engine.match(pattern, new Molecule(), MatchOptions.defaults());

    assertThat(result.isMatched(), is(false));
    assertThat(result.getStatus(), is(SearchStatus.COMPLETE));
  }

  @Test
  void testMissingArguments() {
    MolecularGraphEngine engine = new MolecularGraphEngine();
    Pattern pattern = engine.compilePattern("C").getPatternOrThrow();
    Molecule molecule = engine.parse("CC").getMoleculesOrThrow().get(0);

    assertThrows(NullPointerException.class, () -> engine.parse(null));
    assertThrows(NullPointerException.class, () -> engine.compilePattern(null));
    assertThrows(NullPointerException.class,
        () -> engine.match(null, molecule, MatchOptions.defaults()));
    assertThrows(NullPointerException.class,
        () -> engine.match(pattern, null, MatchOptions.defaults()));
    assertThrows(NullPointerException.class, () -> engine.match(pattern, molecule, null));
    assertThrows(NullPointerException.class, () -> engine.findRings(null));
  }

  @Test
  void testFormulaAndGenerate() {
    MolecularGraphEngine engine = new MolecularGraphEngine();
    Molecule molecule = engine.parse("OC(=O)c1ccccc1").getMoleculesOrThrow().get(0);

    assertThat(engine.formula(molecule), is("C7H6O2"));
    assertThat(engine.generate(molecule, true),
        is(engine.generate(engine.parse("c1ccc(cc1)C(O)=O").getMoleculesOrThrow().get(0), true)));
  }
}
