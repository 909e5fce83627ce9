package com.quantori.mge.core.configuration;

/**
 * Caps the ring size searched for molecules larger than a given atom count.
 *
 * @param minAtoms threshold applies to molecules with more atoms than this
 * @param maxRingSize longest cycle enumerated above the threshold
 */
public record RingSizeThreshold(int minAtoms, int maxRingSize) {}
