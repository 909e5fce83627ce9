package com.quantori.mge.core.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.quantori.mge.api.model.BondOrder;
import com.quantori.mge.api.model.Molecule;
import com.quantori.mge.api.model.RingSet;
import org.junit.jupiter.api.Test;

class GraphCacheTest {

  private final GraphCache cache = new GraphCache();

  @Test
  void testEntriesAreKeptPerMolecule() {
    Molecule first = ethane();
    Molecule second = ethane();
    RingSet ringSet = RingSet.empty();

    cache.markEnriched(first);
    cache.putRingSet(first, ringSet);

    assertThat(cache.isEnriched(first)).isTrue();
    assertThat(cache.getRingSet(first)).containsSame(ringSet);
    assertThat(cache.isAromaticityPerceived(first)).isFalse();
    assertThat(cache.isEnriched(second)).isFalse();
    assertThat(cache.getRingSet(second)).isEmpty();
    assertThat(cache.size()).isEqualTo(1);
  }

  @Test
  void testStructuralChangeDropsEntry() {
    Molecule molecule = ethane();
    cache.markEnriched(molecule);
    cache.markAromaticityPerceived(molecule);

    molecule.addBond(molecule.addAtom("O", 8).getId(), 1, BondOrder.SINGLE);

    assertThat(cache.isEnriched(molecule)).isFalse();
    assertThat(cache.isAromaticityPerceived(molecule)).isFalse();
    assertThat(cache.size()).isZero();
  }

  @Test
  void testPropertyChangeKeepsEntry() {
    Molecule molecule = ethane();
    cache.markEnriched(molecule);

    molecule.getAtom(0).setCharge(1);

    assertThat(cache.isEnriched(molecule)).isTrue();
  }

  @Test
  void testMarkModifiedDropsEntry() {
    Molecule molecule = ethane();
    cache.markEnriched(molecule);

    molecule.getBond(0, 1).orElseThrow().setOrder(BondOrder.DOUBLE);
    molecule.markModified();

    assertThat(cache.isEnriched(molecule)).isFalse();
  }

  private Molecule ethane() {
    Molecule molecule = new Molecule();
    molecule.addAtom("C", 6);
    molecule.addAtom("C", 6);
    molecule.addBond(0, 1, BondOrder.SINGLE);
    return molecule;
  }
}
