package com.quantori.mge.core.pattern;

import static org.assertj.core.api.Assertions.assertThat;

import com.quantori.mge.api.model.Molecule;
import com.quantori.mge.api.model.core.Match;
import com.quantori.mge.api.model.core.MatchOptions;
import com.quantori.mge.api.model.core.MatchResult;
import com.quantori.mge.api.model.core.SearchStatus;
import com.quantori.mge.api.model.pattern.Pattern;
import com.quantori.mge.core.MolecularGraphEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SubstructureSearchTest {

  private static final MatchOptions UNIQUE = MatchOptions.builder().uniqueOnly(true).build();

  private final MolecularGraphEngine engine = new MolecularGraphEngine();

  @ParameterizedTest
  @CsvSource({
      "[OH], CCO, 1, 1",
      "c1ccccc1, c1ccccc1, 12, 1",
      "c1ccccc1, C1=CC=CC=C1, 12, 1",
      "c1ccccc1, c1ccc2ccccc2c1, 24, 2",
      "C1CCCCC1, C1CCC2CCCCC2C1, 24, 2",
      "C=O, CC(=O)O, 1, 1",
      "C~O, CC(=O)O, 2, 2",
      "[#6]-[#8], CC(=O)O, 1, 1",
      "[R], CC1CCCCC1, 6, 6",
      "[!R], CC1CCCCC1, 1, 1",
      "[D3], CC(C)C, 1, 1",
      "'[N,O]', CCNCO, 2, 2",
      "CC, CCC, 4, 2",
      "c-c, c1ccccc1-c1ccccc1, 2, 1",
      "[nH], c1cc[nH]c1, 1, 1",
      "[r5], C1CCCC1CC, 5, 5",
      "C(=O)O, OC(=O)CCC(=O)O, 2, 2",
      "C.C, CC, 2, 1",
      "N, CCO, 0, 0"
  })
  void testMatchCounts(String patternText, String moleculeText, int raw, int unique) {
    Pattern pattern = engine.compilePattern(patternText).getPatternOrThrow();

    MatchResult all = engine.match(pattern, molecule(moleculeText), MatchOptions.defaults());
    MatchResult distinct = engine.match(pattern, molecule(moleculeText), UNIQUE);

    assertThat(all.getMatches()).hasSize(raw);
    assertThat(all.getStatus()).isEqualTo(SearchStatus.COMPLETE);
    assertThat(distinct.getMatches()).hasSize(unique);
  }

  @Test
  void testHydroxylIsMappedToOxygen() {
    Molecule ethanol = molecule("CCO");
    Pattern pattern = engine.compilePattern("[OH]").getPatternOrThrow();

    MatchResult result = engine.match(pattern, ethanol, MatchOptions.defaults());

    assertThat(result.isMatched()).isTrue();
    assertThat(result.getMatches()).extracting(match -> match.getAtomId(0)).containsExactly(2);
  }

  @Test
  void testMatchesAreInjective() {
    Pattern pattern = engine.compilePattern("CCC").getPatternOrThrow();

    MatchResult result = engine.match(pattern, molecule("CCCC"), MatchOptions.defaults());

    assertThat(result.getMatches()).hasSize(4)
        .allMatch(match -> match.getAtomSet().size() == match.size());
  }

  @Test
  void testMatchCap() {
    Pattern pattern = engine.compilePattern("c").getPatternOrThrow();
    MatchOptions options = MatchOptions.builder().maxMatches(1).build();

    MatchResult result = engine.match(pattern, molecule("c1ccccc1"), options);

    assertThat(result.getMatches()).hasSize(1);
    assertThat(result.getStatus()).isEqualTo(SearchStatus.MATCH_LIMIT_REACHED);
    assertThat(result.isTruncated()).isTrue();
  }

  @Test
  void testUniqueFilterRunsBeforeCap() {
    Pattern pattern = engine.compilePattern("c1ccccc1").getPatternOrThrow();
    MatchOptions options = MatchOptions.builder().uniqueOnly(true).maxMatches(2).build();

    MatchResult result = engine.match(pattern, molecule("c1ccc2ccccc2c1"), options);

    assertThat(result.getMatches()).extracting(Match::getAtomSet).doesNotHaveDuplicates()
        .hasSize(2);
  }

  @Test
  void testStepLimit() {
    Pattern pattern = engine.compilePattern("CCCC").getPatternOrThrow();
    MatchOptions options = MatchOptions.builder().maxSearchSteps(5).build();

    MatchResult result = engine.match(pattern, molecule("CCCCCCCCCC"), options);

    assertThat(result.getStatus()).isEqualTo(SearchStatus.SEARCH_LIMIT_REACHED);
    assertThat(result.getSteps()).isEqualTo(5);
    assertThat(result.getMatches()).hasSize(1);
  }

  @Test
  void testDepthLimit() {
    Pattern pattern = engine.compilePattern("CCC").getPatternOrThrow();
    MatchOptions options = MatchOptions.builder().maxSearchDepth(2).build();

    MatchResult result = engine.match(pattern, molecule("CCCC"), options);

    assertThat(result.getStatus()).isEqualTo(SearchStatus.SEARCH_LIMIT_REACHED);
    assertThat(result.getMatches()).isEmpty();
  }

  @Test
  void testEmptyMoleculeHasNoMatches() {
    Pattern pattern = engine.compilePattern("C").getPatternOrThrow();

    MatchResult result = engine.match(pattern, new Molecule(), MatchOptions.defaults());

    assertThat(result.getMatches()).isEmpty();
    assertThat(result.getStatus()).isEqualTo(SearchStatus.COMPLETE);
  }

  private Molecule molecule(String text) {
    return engine.parse(text).getMoleculesOrThrow().get(0);
  }
}
