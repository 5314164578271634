package org.pragmatica.algebra.equivalence;

import org.pragmatica.algebra.ast.Expr;
import org.pragmatica.algebra.ast.InfixFormatter;
import org.pragmatica.algebra.config.AnalyzerConfig;
import org.pragmatica.algebra.error.DivisionByZero;
import org.pragmatica.algebra.polynomial.AtomRegistry;
import org.pragmatica.algebra.polynomial.Polynomial;
import org.pragmatica.algebra.polynomial.PolynomialNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether two expressions are equal for every assignment of their variables.
 *
 * <p>Both sides are normalized through one {@link AtomRegistry}, so identical non-expandable subexpressions
 * become the same atom. The check proceeds in three stages:
 * <ol>
 *   <li>no atoms on either side: the verdict is polynomial equality;</li>
 *   <li>atoms present: equal polynomials prove equivalence;</li>
 *   <li>otherwise both sides are rebuilt as {@link RationalForm}s and cross-multiplied.</li>
 * </ol>
 * A {@code false} verdict means equivalence could not be proven exactly; no numeric sampling is done. A divisor
 * that only the third stage reduces to zero makes the verdict {@code false} rather than an error.
 */
public final class EquivalenceChecker {
    private static final Logger LOG = LoggerFactory.getLogger(EquivalenceChecker.class);

    private final boolean rationalFallback;

    private EquivalenceChecker(boolean rationalFallback) {
        this.rationalFallback = rationalFallback;
    }

    public static EquivalenceChecker create() {
        return create(AnalyzerConfig.DEFAULT);
    }

    public static EquivalenceChecker create(AnalyzerConfig config) {
        return new EquivalenceChecker(config.rationalFallback());
    }

    /**
     * @throws DivisionByZero if either side divides by an expression that normalizes to zero
     */
    public boolean areEquivalent(Expr left, Expr right) {
        return check(left, right).equivalent();
    }

    /**
     * Run the check and report the normalized forms and the deciding stage.
     *
     * @throws DivisionByZero if either side divides by an expression that normalizes to zero
     */
    public EquivalenceReport check(Expr left, Expr right) {
        var registry = new AtomRegistry();
        var leftPolynomial = PolynomialNormalizer.normalize(left, registry);
        var rightPolynomial = PolynomialNormalizer.normalize(right, registry);
        var polynomialsEqual = leftPolynomial.equals(rightPolynomial);

        if (registry.isEmpty()) {
            return report(polynomialsEqual, leftPolynomial, rightPolynomial, Tier.POLYNOMIAL, registry, left, right);
        }
        if (polynomialsEqual || !rationalFallback) {
            return report(polynomialsEqual, leftPolynomial, rightPolynomial, Tier.ATOMIC, registry, left, right);
        }

        return report(sameRationalValue(left, right, registry),
                      leftPolynomial,
                      rightPolynomial,
                      Tier.RATIONAL,
                      registry,
                      left,
                      right);
    }

    // a zero divisor that survived normalization leaves the fraction undefined: not proven
    private static boolean sameRationalValue(Expr left, Expr right, AtomRegistry registry) {
        try {
            var leftFraction = RationalForm.of(left, registry);
            var rightFraction = RationalForm.of(right, registry);
            LOG.debug("Cross-multiplying {} and {}", leftFraction, rightFraction);
            return leftFraction.sameValueAs(rightFraction);
        } catch (DivisionByZero e) {
            LOG.debug("Rational form undefined: {}", e.getMessage());
            return false;
        }
    }

    private static EquivalenceReport report(boolean equivalent,
                                            Polynomial leftPolynomial,
                                            Polynomial rightPolynomial,
                                            Tier tier,
                                            AtomRegistry registry,
                                            Expr left,
                                            Expr right) {
        LOG.debug("{} and {} {} (decided by {} comparison, {} atoms)",
                  InfixFormatter.format(left),
                  InfixFormatter.format(right),
                  equivalent
                  ? "are equivalent"
                  : "are not proven equivalent",
                  tier,
                  registry.size());
        return new EquivalenceReport(equivalent, leftPolynomial, rightPolynomial, tier, registry.atoms());
    }
}
