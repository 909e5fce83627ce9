package com.quantori.mge.api.model.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.quantori.mge.api.NotationException;
import com.quantori.mge.api.model.Molecule;
import org.junit.jupiter.api.Test;

class ParseResultTest {

  @Test
  void testFailedResultThrowsWithErrors() {
    NotationError error = new NotationError(ErrorType.SYNTAX, 3, "Unclosed ring 1");
    ParseResult result = ParseResult.builder().error(error).build();

    assertThat(result.isSuccess()).isFalse();
    assertThatThrownBy(result::getMoleculesOrThrow)
        .isInstanceOf(NotationException.class)
        .hasMessage("SYNTAX at 3: Unclosed ring 1")
        .satisfies(e -> assertThat(((NotationException) e).getErrors()).containsExactly(error));
  }

  @Test
  void testSuccessfulResult() {
    Molecule molecule = new Molecule();
    ParseResult result = ParseResult.builder()
        .molecule(molecule)
        .warning(new NotationError(ErrorType.VALENCE, -1, "Atom C (id: 0) has valence 5"))
        .build();

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.getMoleculesOrThrow()).containsExactly(molecule);
    assertThat(result.getWarnings().get(0)).hasToString("VALENCE: Atom C (id: 0) has valence 5");
  }

  @Test
  void testMatchEqualityIsByAtoms() {
    Match first = new Match(new int[] {3, 1, 2});
    Match second = new Match(new int[] {3, 1, 2});

    assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
    assertThat(first.getAtomSet()).containsExactly(1, 2, 3);
    assertThat(MatchOptions.defaults().getMaxMatches()).isZero();
  }
}
