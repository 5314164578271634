package org.pragmatica.algebra.equivalence;

import org.pragmatica.algebra.ast.Expr;
import org.pragmatica.algebra.ast.InfixFormatter;
import org.pragmatica.algebra.error.DivisionByZero;
import org.pragmatica.algebra.polynomial.AtomRegistry;
import org.pragmatica.algebra.polynomial.Polynomial;
import org.pragmatica.algebra.polynomial.PolynomialNormalizer;

import java.util.Optional;

/**
 * An expression as a quotient of two polynomials, {@code numerator / denominator}.
 *
 * <p>Unlike {@link PolynomialNormalizer}, division by a non-constant is kept as a fraction instead of becoming
 * an atom, so {@code 1 - 1/x} and {@code (x-1)/x} both become {@code (x - 1) / x}. Function calls and
 * unsupported powers still become atoms of the shared registry.
 */
public record RationalForm(Polynomial numerator, Polynomial denominator) {
    private static final RationalForm ONE = new RationalForm(Polynomial.ONE, Polynomial.ONE);

    public RationalForm {
        if (denominator.isZero()) {
            throw new IllegalArgumentException("Denominator must not be zero");
        }
    }

    public static RationalForm of(Polynomial polynomial) {
        return new RationalForm(polynomial, Polynomial.ONE);
    }

    /**
     * Build the quotient form of {@code expr}.
     *
     * @throws DivisionByZero if a divisor's numerator is the zero polynomial
     */
    public static RationalForm of(Expr expr, AtomRegistry registry) {
        if (expr instanceof Expr.Number number) {
            return of(Polynomial.constant(number.value()));
        }
        if (expr instanceof Expr.Variable variable) {
            return of(Polynomial.variable(variable.name()));
        }
        if (expr instanceof Expr.UnaryOp unary) {
            return of(unary.operand(), registry).negate();
        }
        if (expr instanceof Expr.FunctionCall call) {
            return of(Polynomial.of(registry.register(call)));
        }
        var binary = (Expr.BinaryOp) expr;
        var left = of(binary.left(), registry);
        var right = of(binary.right(), registry);

        return switch (binary.operator()) {
            case ADD -> left.plus(right);
            case SUBTRACT -> left.plus(right.negate());
            case MULTIPLY -> left.times(right);
            case DIVIDE -> left.dividedBy(right, binary);
            case POWER -> smallExponent(right).map(left::pow)
                                              .orElseGet(() -> of(Polynomial.of(registry.register(binary))));
        };
    }

    public RationalForm plus(RationalForm other) {
        if (denominator.equals(other.denominator)) {
            return reduced(numerator.plus(other.numerator), denominator);
        }
        return reduced(numerator.times(other.denominator).plus(other.numerator.times(denominator)),
                       denominator.times(other.denominator));
    }

    public RationalForm times(RationalForm other) {
        return reduced(numerator.times(other.numerator), denominator.times(other.denominator));
    }

    public RationalForm negate() {
        return new RationalForm(numerator.negate(), denominator);
    }

    public RationalForm pow(int exponent) {
        return exponent == 0
               ? ONE
               : new RationalForm(numerator.pow(exponent), denominator.pow(exponent));
    }

    /**
     * Cross-multiplication test: {@code a/b == c/d} iff {@code a*d == c*b}.
     */
    public boolean sameValueAs(RationalForm other) {
        return numerator.times(other.denominator)
                        .equals(other.numerator.times(denominator));
    }

    private RationalForm dividedBy(RationalForm divisor, Expr.BinaryOp division) {
        if (divisor.numerator.isZero()) {
            throw new DivisionByZero(InfixFormatter.format(division));
        }
        return reduced(numerator.times(divisor.denominator), denominator.times(divisor.numerator));
    }

    // a constant denominator is folded into the numerator's coefficients
    private static RationalForm reduced(Polynomial numerator, Polynomial denominator) {
        if (denominator.isConstant()) {
            return of(numerator.divide(denominator.constantValue()));
        }
        return new RationalForm(numerator, denominator);
    }

    private static Optional<Integer> smallExponent(RationalForm exponent) {
        if (!exponent.denominator.isConstant() || !exponent.numerator.isConstant()) {
            return Optional.empty();
        }
        return exponent.numerator
                       .divide(exponent.denominator.constantValue())
                       .constantValue()
                       .intValue()
                       .filter(value -> value >= 0 && value <= PolynomialNormalizer.MAX_EXPANDED_EXPONENT);
    }

    @Override
    public String toString() {
        return "(" + numerator + ") / (" + denominator + ")";
    }
}
