package org.pragmatica.algebra.polynomial;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.pragmatica.algebra.parser.ExpressionParser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PolynomialTest {

    private static Polynomial normalize(String text) {
        return PolynomialNormalizer.normalize(ExpressionParser.parse(text));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "(x+1)^2      | x^2 + 2*x + 1",
        "(x-1)^2      | x^2 - 2*x + 1",
        "(x+y)^2      | 2*x*y + x^2 + y^2",
        "x/2          | 1/2*x",
        "-2*x         | -2*x",
        "3*y*x        | 3*x*y",
        "x - x        | 0",
        "1/x          | (1/x)",
        "(x+1)^4      | ((x+1)^4)",
        "sin(x)+1     | sin(x) + 1",
        "xxxxxxxxxx   | x^10"
    })
    void toString_rendersCanonicalForm(String input, String expected) {
        assertEquals(expected, normalize(input).toString());
    }

    @Test
    void plus_cancellingTerms_prunesZeroCoefficients() {
        var sum = normalize("x + y").plus(normalize("-x"));

        assertEquals(Polynomial.variable("y"), sum);
        assertThat(sum.terms()).hasSize(1);
    }

    @Test
    void times_distributesAndMergesLikeTerms() {
        assertEquals(normalize("x^2 - 1"), normalize("x + 1").times(normalize("x - 1")));
    }

    @Test
    void pow_zero_isOne() {
        assertEquals(Polynomial.ONE, normalize("x + y").pow(0));
    }

    @Test
    void pow_negative_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> Polynomial.ONE.pow(-1));
    }

    @Test
    void divide_byZero_throws() {
        assertThrows(ArithmeticException.class, () -> Polynomial.variable("x").divide(Rational.ZERO));
    }

    @Test
    void constantValue_ofNonConstant_throws() {
        assertThrows(IllegalStateException.class, () -> Polynomial.variable("x").constantValue());
        assertEquals(Rational.ZERO, Polynomial.ZERO.constantValue());
    }

    @Test
    void totalDegree_isHighestMonomialDegree() {
        assertEquals(3, normalize("x^2*y + x + 7").totalDegree());
        assertEquals(0, Polynomial.ZERO.totalDegree());
    }

    @Test
    void coefficient_ofMissingMonomial_isZero() {
        var polynomial = normalize("3x + 2");

        assertEquals(Rational.of(3), polynomial.coefficient(Monomial.of(new Factor.Variable("x"))));
        assertEquals(Rational.of(2), polynomial.coefficient(Monomial.CONSTANT));
        assertEquals(Rational.ZERO, polynomial.coefficient(Monomial.of(new Factor.Variable("y"))));
    }

    @Test
    void atoms_collectsAtomFactors() {
        var polynomial = normalize("sin(x)*y + cos(x)");

        assertTrue(polynomial.hasAtoms());
        assertThat(polynomial.atoms()).extracting(Factor.Atom::label)
                                      .containsExactlyInAnyOrder("sin(x)", "cos(x)");
        assertFalse(normalize("x*y").hasAtoms());
    }

    @Test
    void toExpression_normalizesBackToSamePolynomial() {
        for (var text : new String[]{"(x+1)^3", "x/3 - y^2/4 + 5", "xxxxxxx", "-(a-b)^2", "0"}) {
            var polynomial = normalize(text);

            assertEquals(polynomial, PolynomialNormalizer.normalize(polynomial.toExpression()), text);
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "sin(x) + x*cos(x)",
        "ln(y)^2/3 - tan(x)*sin(x) + (x+1)^5",
        "1/x + 2/y - x/y",
        "sqrt(z)^7 + cos(a)*sin(b)"
    })
    void toExpression_withAtoms_normalizesBackToSamePolynomial(String text) {
        var polynomial = normalize(text);

        assertEquals(polynomial, PolynomialNormalizer.normalize(polynomial.toExpression()));
    }

    @Test
    void atoms_fromDifferentRegistries_areEqualRegardlessOfId() {
        var first = new AtomRegistry();
        first.register(ExpressionParser.parse("cos(x)"));
        var fromFirst = first.register(ExpressionParser.parse("sin(x)"));
        var fromSecond = new AtomRegistry().register(ExpressionParser.parse("sin(x)"));

        assertNotEquals(fromFirst.id(), fromSecond.id());
        assertEquals(fromFirst, fromSecond);
        assertEquals(fromFirst.hashCode(), fromSecond.hashCode());
    }

    @Test
    void toExpression_replacesAtomsWithTheirExpressions() {
        var polynomial = normalize("2*sin(x)");

        assertEquals(ExpressionParser.parse("2*sin(x)"), polynomial.toExpression());
    }
}
