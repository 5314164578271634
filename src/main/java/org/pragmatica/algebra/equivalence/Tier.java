package org.pragmatica.algebra.equivalence;

/**
 * Stage of the equivalence check that produced the verdict.
 */
public enum Tier {
    /**
     * Neither side needed an atom; the polynomials were compared directly.
     */
    POLYNOMIAL,
    /**
     * Atoms were shared through one registry and the polynomials were compared with atoms as factors.
     */
    ATOMIC,
    /**
     * Numerator/denominator forms were cross-multiplied.
     */
    RATIONAL
}
