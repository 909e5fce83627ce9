package com.quantori.mge.core;

import com.quantori.mge.api.model.Molecule;
import com.quantori.mge.api.model.RingSet;
import com.quantori.mge.api.model.core.GenerationOptions;
import com.quantori.mge.api.model.core.MatchOptions;
import com.quantori.mge.api.model.core.MatchResult;
import com.quantori.mge.api.model.core.MolecularDescriptors;
import com.quantori.mge.api.model.core.NotationError;
import com.quantori.mge.api.model.core.ParseResult;
import com.quantori.mge.api.model.core.PatternCompileResult;
import com.quantori.mge.api.model.pattern.Pattern;
import com.quantori.mge.api.service.GraphEngine;
import com.quantori.mge.core.aromaticity.AromaticityPerceiver;
import com.quantori.mge.core.aromaticity.AromaticityValidator;
import com.quantori.mge.core.cache.GraphCache;
import com.quantori.mge.core.configuration.EngineConfigurationProperties;
import com.quantori.mge.core.enrich.MoleculeEnricher;
import com.quantori.mge.core.enrich.ValenceValidator;
import com.quantori.mge.core.generate.CanonicalRanking;
import com.quantori.mge.core.generate.Kekulizer;
import com.quantori.mge.core.generate.NotationGenerator;
import com.quantori.mge.core.notation.NotationParser;
import com.quantori.mge.core.pattern.PatternCompiler;
import com.quantori.mge.core.pattern.SubstructureSearch;
import com.quantori.mge.core.properties.MolecularDescriptorCalculator;
import com.quantori.mge.core.properties.MolecularFormula;
import com.quantori.mge.core.ring.RingPerceiver;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Default {@link GraphEngine}. Derived data (enrichment, rings, aromaticity) is computed on demand
 * and remembered per molecule until the molecule's structure changes.
 */
@Slf4j
public class MolecularGraphEngine implements GraphEngine {

  @Getter
  private final EngineConfigurationProperties properties;
  private final NotationParser parser = new NotationParser();
  private final MoleculeEnricher enricher = new MoleculeEnricher();
  private final ValenceValidator valenceValidator = new ValenceValidator();
  private final RingPerceiver ringPerceiver;
  private final AromaticityPerceiver aromaticityPerceiver = new AromaticityPerceiver();
  private final AromaticityValidator aromaticityValidator = new AromaticityValidator();
  private final PatternCompiler patternCompiler = new PatternCompiler();
  private final Kekulizer kekulizer = new Kekulizer();
  private final NotationGenerator generator = new NotationGenerator();
  private final GraphCache cache = new GraphCache();

  public MolecularGraphEngine() {
    this(EngineConfigurationProperties.defaults());
  }

  public MolecularGraphEngine(EngineConfigurationProperties properties) {
    this(properties, new RingPerceiver(properties));
  }

  MolecularGraphEngine(EngineConfigurationProperties properties, RingPerceiver ringPerceiver) {
    this.properties = Objects.requireNonNull(properties);
    this.ringPerceiver = Objects.requireNonNull(ringPerceiver);
  }

  @Override
  public ParseResult parse(String text) {
    Objects.requireNonNull(text, "text");
    ParseResult parsed = parser.parse(text);
    if (!parsed.isSuccess()) {
      return parsed;
    }

    List<NotationError> valenceProblems = new ArrayList<>();
    List<NotationError> aromaticityProblems = new ArrayList<>();
    for (Molecule molecule : parsed.getMolecules()) {
      enrich(molecule);
      RingSet ringSet = findRings(molecule);
      valenceProblems.addAll(valenceValidator.validate(molecule));
      aromaticityProblems.addAll(aromaticityValidator.validate(molecule, ringSet));
    }

    if (properties.isStrictValence() && !valenceProblems.isEmpty()) {
      log.debug("Rejected '{}' with {} valence problems", text, valenceProblems.size());
      return ParseResult.builder().errors(valenceProblems).build();
    }
    return ParseResult.builder()
        .molecules(parsed.getMolecules())
        .warnings(parsed.getWarnings())
        .warnings(valenceProblems)
        .warnings(aromaticityProblems)
        .build();
  }

  @Override
  public Molecule enrich(Molecule molecule) {
    Objects.requireNonNull(molecule, "molecule");
    if (!cache.isEnriched(molecule)) {
      enricher.enrich(molecule);
      cache.markEnriched(molecule);
    }
    return molecule;
  }

  @Override
  public RingSet findRings(Molecule molecule) {
    enrich(molecule);
    return cache.getRingSet(molecule).orElseGet(() -> {
      RingSet ringSet = ringPerceiver.perceive(molecule);
      cache.putRingSet(molecule, ringSet);
      return ringSet;
    });
  }

  @Override
  public Molecule perceiveAromaticity(Molecule molecule) {
    RingSet ringSet = findRings(molecule);
    if (!cache.isAromaticityPerceived(molecule)) {
      aromaticityPerceiver.perceive(molecule, ringSet);
      cache.markAromaticityPerceived(molecule);
    }
    return molecule;
  }

  @Override
  public PatternCompileResult compilePattern(String text) {
    Objects.requireNonNull(text, "text");
    return patternCompiler.compile(text);
  }

  @Override
  public MatchResult match(Pattern pattern, Molecule molecule, MatchOptions options) {
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(molecule, "molecule");
    Objects.requireNonNull(options, "options");
    if (molecule.isEmpty()) {
      return MatchResult.empty();
    }
    perceiveAromaticity(molecule);
    RingSet ringSet = findRings(molecule);
    return new SubstructureSearch(pattern, molecule, ringSet, resolve(options)).run();
  }

  @Override
  public String generate(Molecule molecule, GenerationOptions options) {
    Objects.requireNonNull(molecule, "molecule");
    Objects.requireNonNull(options, "options");
    Molecule copy = molecule.copy();
    enricher.enrich(copy);
    int[] ranks = null;
    if (options.isCanonical()) {
      aromaticityPerceiver.perceive(copy, ringPerceiver.perceive(copy));
      ranks = CanonicalRanking.rank(copy);
    }
    if (options.isKekulize()) {
      kekulizer.kekulize(copy, ranks);
    }
    return generator.write(copy, ranks);
  }

  @Override
  public String formula(Molecule molecule) {
    return MolecularFormula.of(enrich(molecule));
  }

  @Override
  public MolecularDescriptors descriptors(Molecule molecule) {
    Objects.requireNonNull(molecule, "molecule");
    perceiveAromaticity(molecule);
    return MolecularDescriptorCalculator.describe(molecule, findRings(molecule));
  }

  private MatchOptions resolve(MatchOptions options) {
    MatchOptions.MatchOptionsBuilder resolved = options.toBuilder();
    if (options.getMaxSearchSteps() == 0) {
      resolved.maxSearchSteps(properties.getDefaultMaxSearchSteps());
    }
    if (options.getMaxSearchDepth() == 0) {
      resolved.maxSearchDepth(properties.getDefaultMaxSearchDepth());
    }
    return resolved.build();
  }
}
