package org.pragmatica.algebra.polynomial;

import org.pragmatica.algebra.ast.Expr;
import org.pragmatica.algebra.ast.InfixFormatter;
import org.pragmatica.algebra.error.DivisionByZero;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Expands an expression into its canonical {@link Polynomial}.
 *
 * <p>Sums, differences, products, negation, division by a nonzero constant and powers with a constant
 * exponent of 0 to 3 are expanded exactly. Everything else (division by a non-constant, other exponents,
 * function calls) becomes an atom of the supplied {@link AtomRegistry}.
 */
public final class PolynomialNormalizer {
    private static final Logger LOG = LoggerFactory.getLogger(PolynomialNormalizer.class);

    public static final int MAX_EXPANDED_EXPONENT = 3;

    private final AtomRegistry registry;

    private PolynomialNormalizer(AtomRegistry registry) {
        this.registry = registry;
    }

    /**
     * Normalize with a fresh registry.
     */
    public static Polynomial normalize(Expr expr) {
        return normalize(expr, new AtomRegistry());
    }

    /**
     * Normalize, registering atoms in {@code registry}.
     *
     * @throws DivisionByZero if any division in {@code expr} has a divisor that normalizes to zero
     */
    public static Polynomial normalize(Expr expr, AtomRegistry registry) {
        var polynomial = new PolynomialNormalizer(registry).expand(expr);
        LOG.trace("Normalized {} to {}", InfixFormatter.format(expr), polynomial);
        return polynomial;
    }

    private Polynomial expand(Expr expr) {
        if (expr instanceof Expr.Number number) {
            return Polynomial.constant(number.value());
        }
        if (expr instanceof Expr.Variable variable) {
            return Polynomial.variable(variable.name());
        }
        if (expr instanceof Expr.UnaryOp unary) {
            return expand(unary.operand()).negate();
        }
        if (expr instanceof Expr.FunctionCall call) {
            // argument is checked for division by zero but never expanded into the result
            expand(call.argument());
            return atom(call);
        }
        return expandBinary((Expr.BinaryOp) expr);
    }

    private Polynomial expandBinary(Expr.BinaryOp binary) {
        var left = expand(binary.left());
        var right = expand(binary.right());

        return switch (binary.operator()) {
            case ADD -> left.plus(right);
            case SUBTRACT -> left.minus(right);
            case MULTIPLY -> left.times(right);
            case DIVIDE -> divide(binary, left, right);
            case POWER -> power(binary, left, right);
        };
    }

    private Polynomial divide(Expr.BinaryOp division, Polynomial dividend, Polynomial divisor) {
        if (!divisor.isConstant()) {
            return atom(division);
        }
        if (divisor.isZero()) {
            throw new DivisionByZero(InfixFormatter.format(division));
        }
        return dividend.divide(divisor.constantValue());
    }

    private Polynomial power(Expr.BinaryOp power, Polynomial base, Polynomial exponent) {
        var expandable = exponent.isConstant()
                         ? exponent.constantValue()
                                   .intValue()
                                   .filter(value -> value >= 0 && value <= MAX_EXPANDED_EXPONENT)
                         : Optional.<Integer>empty();

        return expandable.map(base::pow)
                         .orElseGet(() -> atom(power));
    }

    private Polynomial atom(Expr expr) {
        return Polynomial.of(registry.register(expr));
    }
}
