package com.quantori.mge.core.notation;

/**
 * Contents of a bracket atom such as {@code [13CH3+:2]}.
 *
 * @param end index just past the closing bracket
 */
record BracketAtom(
    Integer isotope,
    String symbol,
    int atomicNumber,
    boolean aromatic,
    String chirality,
    int hydrogens,
    int charge,
    Integer atomClass,
    int end) {}
