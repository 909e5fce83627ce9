package com.quantori.mge.api.model.pattern;

/**
 * A query atom.
 *
 * @param index position in {@link Pattern#getAtoms()}
 * @param expression predicate a molecule atom must satisfy
 * @param text the notation the atom was compiled from
 */
public record PatternAtom(int index, AtomExpression expression, String text) {}
