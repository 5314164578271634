package org.pragmatica.algebra.polynomial;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.pragmatica.algebra.ast.Expr;
import org.pragmatica.algebra.ast.Operator;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Canonical sum of monomials with exact rational coefficients. No term has a zero coefficient, so two
 * polynomials are equal iff their term maps are equal.
 */
public record Polynomial(ImmutableMap<Monomial, Rational> terms) {
    public static final Polynomial ZERO = new Polynomial(ImmutableMap.of());
    public static final Polynomial ONE = constant(Rational.ONE);

    /**
     * Rendering order: descending total degree, then lexical order of the factor list.
     */
    private static final Comparator<Monomial> DISPLAY_ORDER = Comparator.comparingInt(Monomial::totalDegree)
                                                                        .reversed()
                                                                        .thenComparing(Monomial::toString);

    public Polynomial {
        terms.values()
             .forEach(coefficient -> checkArgument(!coefficient.isZero(), "zero coefficient in %s", terms));
    }

    public static Polynomial constant(Rational value) {
        return value.isZero()
               ? ZERO
               : new Polynomial(ImmutableMap.of(Monomial.CONSTANT, value));
    }

    public static Polynomial constant(BigInteger value) {
        return constant(Rational.of(value));
    }

    public static Polynomial variable(String name) {
        return of(new Factor.Variable(name));
    }

    public static Polynomial of(Factor factor) {
        return new Polynomial(ImmutableMap.of(Monomial.of(factor), Rational.ONE));
    }

    public Polynomial plus(Polynomial other) {
        var merged = new LinkedHashMap<>(terms);
        other.terms.forEach((monomial, coefficient) -> merged.merge(monomial, coefficient, Rational::plus));
        return pruned(merged);
    }

    public Polynomial minus(Polynomial other) {
        return plus(other.negate());
    }

    /**
     * Distribute: every term of this polynomial times every term of {@code other}, like terms merged.
     */
    public Polynomial times(Polynomial other) {
        var product = new LinkedHashMap<Monomial, Rational>();
        terms.forEach((leftMonomial, leftCoefficient) ->
            other.terms.forEach((rightMonomial, rightCoefficient) ->
                product.merge(leftMonomial.times(rightMonomial),
                              leftCoefficient.times(rightCoefficient),
                              Rational::plus)));
        return pruned(product);
    }

    public Polynomial negate() {
        var negated = new LinkedHashMap<Monomial, Rational>();
        terms.forEach((monomial, coefficient) -> negated.put(monomial, coefficient.negate()));
        return new Polynomial(ImmutableMap.copyOf(negated));
    }

    /**
     * Divide every coefficient by a constant.
     *
     * @throws ArithmeticException if {@code divisor} is zero
     */
    public Polynomial divide(Rational divisor) {
        if (divisor.isZero()) {
            throw new ArithmeticException("Division of polynomial by zero");
        }
        var quotient = new LinkedHashMap<Monomial, Rational>();
        terms.forEach((monomial, coefficient) -> quotient.put(monomial, coefficient.dividedBy(divisor)));
        return new Polynomial(ImmutableMap.copyOf(quotient));
    }

    /**
     * Raise to a non-negative integer power by repeated multiplication.
     */
    public Polynomial pow(int exponent) {
        checkArgument(exponent >= 0, "exponent must be non-negative, got %s", exponent);
        var result = ONE;
        for (int i = 0; i < exponent; i++) {
            result = result.times(this);
        }
        return result;
    }

    public boolean isZero() {
        return terms.isEmpty();
    }

    /**
     * True for the zero polynomial and for a single constant term.
     */
    public boolean isConstant() {
        return terms.isEmpty() || (terms.size() == 1 && terms.containsKey(Monomial.CONSTANT));
    }

    /**
     * Value of a constant polynomial.
     *
     * @throws IllegalStateException if the polynomial is not constant
     */
    public Rational constantValue() {
        if (!isConstant()) {
            throw new IllegalStateException("Not a constant polynomial: " + this);
        }
        return coefficient(Monomial.CONSTANT);
    }

    public Rational coefficient(Monomial monomial) {
        return terms.getOrDefault(monomial, Rational.ZERO);
    }

    public int totalDegree() {
        return terms.keySet()
                    .stream()
                    .mapToInt(Monomial::totalDegree)
                    .max()
                    .orElse(0);
    }

    /**
     * Atoms referenced by any term.
     */
    public ImmutableSet<Factor.Atom> atoms() {
        var atoms = ImmutableSet.<Factor.Atom>builder();
        for (var monomial : terms.keySet()) {
            for (var factor : monomial.exponents().keySet()) {
                if (factor instanceof Factor.Atom atom) {
                    atoms.add(atom);
                }
            }
        }
        return atoms.build();
    }

    public boolean hasAtoms() {
        return !atoms().isEmpty();
    }

    /**
     * Monomials in rendering order.
     */
    public List<Monomial> sortedMonomials() {
        return terms.keySet()
                    .stream()
                    .sorted(DISPLAY_ORDER)
                    .toList();
    }

    /**
     * Rebuild an expression whose normalization is this polynomial. Atoms are replaced by the
     * expressions they stand for; exponents above 3 become products of powers of at most 3.
     */
    public Expr toExpression() {
        Expr result = null;
        for (var monomial : sortedMonomials()) {
            var coefficient = terms.get(monomial);
            var term = termExpression(monomial, coefficient.abs());

            if (result == null) {
                result = coefficient.signum() < 0
                         ? Expr.negate(term)
                         : term;
            }else {
                result = Expr.binary(coefficient.signum() < 0
                                     ? Operator.SUBTRACT
                                     : Operator.ADD,
                                     result,
                                     term);
            }
        }
        return result == null
               ? Expr.number(0)
               : result;
    }

    private static Expr termExpression(Monomial monomial, Rational magnitude) {
        Expr product = null;
        if (!magnitude.numerator().equals(BigInteger.ONE) || monomial.isConstant()) {
            product = new Expr.Number(magnitude.numerator());
        }
        for (var entry : monomial.exponents().entrySet()) {
            var factor = factorExpression(entry.getKey(), entry.getValue());
            product = product == null
                      ? factor
                      : Expr.binary(Operator.MULTIPLY, product, factor);
        }
        if (!magnitude.isInteger()) {
            product = Expr.binary(Operator.DIVIDE, product, new Expr.Number(magnitude.denominator()));
        }
        return product;
    }

    private static Expr factorExpression(Factor factor, int exponent) {
        var base = factor instanceof Factor.Atom atom
                   ? atom.expression()
                   : Expr.variable(factor.name());
        Expr result = null;
        int remaining = exponent;
        while (remaining > 0) {
            int chunk = Math.min(remaining, 3);
            var power = chunk == 1
                        ? base
                        : Expr.binary(Operator.POWER, base, Expr.number(chunk));
            result = result == null
                     ? power
                     : Expr.binary(Operator.MULTIPLY, result, power);
            remaining -= chunk;
        }
        return result;
    }

    @Override
    public String toString() {
        if (terms.isEmpty()) {
            return "0";
        }
        var sb = new StringBuilder();
        for (var monomial : sortedMonomials()) {
            var coefficient = terms.get(monomial);
            if (sb.length() == 0) {
                sb.append(coefficient.signum() < 0
                          ? "-"
                          : "");
            }else {
                sb.append(coefficient.signum() < 0
                          ? " - "
                          : " + ");
            }
            sb.append(renderTerm(monomial, coefficient.abs()));
        }
        return sb.toString();
    }

    private static String renderTerm(Monomial monomial, Rational magnitude) {
        if (monomial.isConstant()) {
            return magnitude.toString();
        }
        return magnitude.isOne()
               ? monomial.toString()
               : magnitude + "*" + monomial;
    }

    private static Polynomial pruned(Map<Monomial, Rational> terms) {
        terms.values().removeIf(Rational::isZero);
        return new Polynomial(ImmutableMap.copyOf(terms));
    }
}
