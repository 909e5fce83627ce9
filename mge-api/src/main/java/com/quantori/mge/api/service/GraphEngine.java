package com.quantori.mge.api.service;

import com.quantori.mge.api.model.Molecule;
import com.quantori.mge.api.model.RingSet;
import com.quantori.mge.api.model.core.GenerationOptions;
import com.quantori.mge.api.model.core.MatchOptions;
import com.quantori.mge.api.model.core.MatchResult;
import com.quantori.mge.api.model.core.MolecularDescriptors;
import com.quantori.mge.api.model.core.ParseResult;
import com.quantori.mge.api.model.core.PatternCompileResult;
import com.quantori.mge.api.model.pattern.Pattern;
import javax.validation.constraints.NotNull;

/**
 * Molecular graph operations: parsing, enrichment, ring and aromaticity perception, substructure
 * search and notation generation.
 * <p>
 * Implementations keep no state besides a cache of derived data keyed by molecule identity. A
 * molecule must not be passed to two calls running on different threads at the same time.
 */
public interface GraphEngine {

  /**
   * Parses a molecule notation. Every fragment separated by {@code .} becomes its own molecule.
   *
   * @param text molecule notation
   * @return molecules, or positional errors when the input is rejected
   */
  ParseResult parse(@NotNull String text);

  /**
   * Computes implicit hydrogens, degree, hybridization and ring membership flags. Repeated calls
   * on an unchanged molecule do nothing.
   *
   * @param molecule molecule to enrich in place
   * @return the same molecule
   */
  Molecule enrich(@NotNull Molecule molecule);

  /**
   * Computes the smallest set of smallest rings and writes ring ids to atoms and bonds.
   *
   * @param molecule molecule, enriched on demand
   * @return rings with a completeness flag
   */
  RingSet findRings(@NotNull Molecule molecule);

  /**
   * Flags aromatic rings, atoms and bonds in place.
   *
   * @param molecule molecule, enriched on demand
   * @return the same molecule
   */
  Molecule perceiveAromaticity(@NotNull Molecule molecule);

  /**
   * Compiles a pattern notation.
   *
   * @param text pattern notation
   * @return the pattern, or positional errors
   */
  PatternCompileResult compilePattern(@NotNull String text);

  /**
   * Finds occurrences of a pattern in a molecule.
   *
   * @param pattern compiled pattern
   * @param molecule molecule to search
   * @param options bounds and uniqueness filter
   * @return matches and how the search ended
   */
  MatchResult match(@NotNull Pattern pattern, @NotNull Molecule molecule, @NotNull MatchOptions options);

  /**
   * Writes the notation of a molecule.
   *
   * @param molecule molecule
   * @param canonical isomorphism invariant output when {@code true}, input preserving otherwise
   * @return notation string
   */
  default String generate(@NotNull Molecule molecule, boolean canonical) {
    return generate(molecule, canonical ? GenerationOptions.canonical() : GenerationOptions.preserving());
  }

  /**
   * Writes the notation of a molecule with the given options.
   *
   * @param molecule molecule, left unchanged
   * @param options canonical and kekulization switches
   * @return notation string
   * @throws com.quantori.mge.api.NotationException with a GENERATION error when more ring closures
   *     are open at once than the notation can number
   */
  String generate(@NotNull Molecule molecule, @NotNull GenerationOptions options);

  /**
   * Molecular formula in Hill order.
   *
   * @param molecule molecule, enriched on demand
   * @return formula such as {@code C2H6O}
   */
  String formula(@NotNull Molecule molecule);

  /**
   * Masses and atom, ring and bond counts. Perceives rings and aromaticity as
   * {@link #perceiveAromaticity} does.
   *
   * @param molecule molecule, enriched on demand
   * @return descriptors of the whole molecule
   * @throws IllegalArgumentException when an element has no known atomic mass
   */
  MolecularDescriptors descriptors(@NotNull Molecule molecule);
}
