package org.pragmatica.algebra.polynomial;

import java.math.BigInteger;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Exact rational number in lowest terms. The denominator is always positive; the sign lives in the numerator.
 */
public record Rational(BigInteger numerator, BigInteger denominator) implements Comparable<Rational> {
    public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
    public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);

    public Rational {
        checkArgument(denominator.signum() > 0, "denominator must be positive, got %s", denominator);
        checkArgument(numerator.gcd(denominator).equals(BigInteger.ONE) || numerator.signum() == 0,
                      "%s/%s is not in lowest terms", numerator, denominator);
        checkArgument(numerator.signum() != 0 || denominator.equals(BigInteger.ONE),
                      "zero must be represented as 0/1");
    }

    public static Rational of(long value) {
        return of(BigInteger.valueOf(value));
    }

    public static Rational of(BigInteger value) {
        return new Rational(value, BigInteger.ONE);
    }

    /**
     * Reduce {@code numerator/denominator} to lowest terms.
     *
     * @throws ArithmeticException if the denominator is zero
     */
    public static Rational of(BigInteger numerator, BigInteger denominator) {
        if (denominator.signum() == 0) {
            throw new ArithmeticException("Zero denominator");
        }
        if (numerator.signum() == 0) {
            return ZERO;
        }
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        var gcd = numerator.gcd(denominator);
        return new Rational(numerator.divide(gcd), denominator.divide(gcd));
    }

    public static Rational of(long numerator, long denominator) {
        return of(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public Rational plus(Rational other) {
        return of(numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
                  denominator.multiply(other.denominator));
    }

    public Rational minus(Rational other) {
        return plus(other.negate());
    }

    public Rational times(Rational other) {
        return of(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    /**
     * @throws ArithmeticException if {@code other} is zero
     */
    public Rational dividedBy(Rational other) {
        return of(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
    }

    public Rational negate() {
        return new Rational(numerator.negate(), denominator);
    }

    public boolean isZero() {
        return numerator.signum() == 0;
    }

    public boolean isOne() {
        return equals(ONE);
    }

    public boolean isInteger() {
        return denominator.equals(BigInteger.ONE);
    }

    public int signum() {
        return numerator.signum();
    }

    public Rational abs() {
        return signum() < 0
               ? negate()
               : this;
    }

    /**
     * The value as an {@code int} if it is an integer that fits, otherwise empty.
     */
    public Optional<Integer> intValue() {
        if (!isInteger() || numerator.bitLength() >= Integer.SIZE) {
            return Optional.empty();
        }
        return Optional.of(numerator.intValueExact());
    }

    @Override
    public int compareTo(Rational other) {
        return numerator.multiply(other.denominator).compareTo(other.numerator.multiply(denominator));
    }

    @Override
    public String toString() {
        return isInteger()
               ? numerator.toString()
               : numerator + "/" + denominator;
    }
}
