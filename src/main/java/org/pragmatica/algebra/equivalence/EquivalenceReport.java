package org.pragmatica.algebra.equivalence;

import org.pragmatica.algebra.polynomial.Factor;
import org.pragmatica.algebra.polynomial.Polynomial;

import java.util.List;

/**
 * Detailed outcome of an equivalence check.
 *
 * @param equivalent whether the two expressions were proven equivalent
 * @param left       normalized form of the first expression
 * @param right      normalized form of the second expression
 * @param decidedBy  stage that produced the verdict
 * @param atoms      atoms shared by both sides, in registration order
 */
public record EquivalenceReport(
    boolean equivalent,
    Polynomial left,
    Polynomial right,
    Tier decidedBy,
    List<Factor.Atom> atoms
) {
    public EquivalenceReport {
        atoms = List.copyOf(atoms);
    }
}
