package com.quantori.mge.api.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

class ElementTest {

  @ParameterizedTest
  @CsvSource({"C,6", "Cl,17", "Br,35", "Se,34", "U,92"})
  void testLookupBySymbol(String symbol, int atomicNumber) {
    assertThat(Element.ofSymbol(symbol)).map(Element::getAtomicNumber).contains(atomicNumber);
    assertThat(Element.ofAtomicNumber(atomicNumber)).map(Element::getSymbol).contains(symbol);
  }

  @Test
  void testAromaticSymbols() {
    assertThat(Element.ofAromaticSymbol("c")).contains(Element.C);
    assertThat(Element.ofAromaticSymbol("se")).map(Element::getSymbol).contains("Se");
    assertThat(Element.ofAromaticSymbol("f")).isEmpty();
    assertThat(Element.ofSymbol("Xx")).isEmpty();
  }

  @Test
  void testDefaultValences() {
    assertThat(Element.N.getDefaultValences()).containsExactly(3, 5);
    assertThat(Element.N.getMaxDefaultValence()).isEqualTo(5);
    assertThat(Element.C.isOrganicSubset()).isTrue();
    assertThat(Element.H.isOrganicSubset()).isFalse();
  }
}
