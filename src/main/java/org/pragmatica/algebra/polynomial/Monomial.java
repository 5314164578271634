package org.pragmatica.algebra.polynomial;

import com.google.common.collect.ImmutableSortedMap;

import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Product of distinct factors raised to positive exponents. The empty product is the constant monomial.
 * Factors are kept sorted, so two monomials are equal iff they hold the same factor/exponent pairs.
 */
public record Monomial(ImmutableSortedMap<Factor, Integer> exponents) {
    public static final Monomial CONSTANT = new Monomial(ImmutableSortedMap.of());

    public Monomial {
        exponents.values()
                 .forEach(exponent -> checkArgument(exponent >= 1, "exponent must be positive, got %s", exponent));
    }

    public static Monomial of(Factor factor) {
        return new Monomial(ImmutableSortedMap.of(factor, 1));
    }

    public static Monomial of(Map<Factor, Integer> exponents) {
        return new Monomial(ImmutableSortedMap.copyOf(exponents));
    }

    /**
     * Multiply by another monomial: union of factors, exponents of shared factors summed.
     */
    public Monomial times(Monomial other) {
        if (isConstant()) {
            return other;
        }
        if (other.isConstant()) {
            return this;
        }
        var combined = new TreeMap<Factor, Integer>(exponents);
        other.exponents.forEach((factor, exponent) -> combined.merge(factor, exponent, Integer::sum));
        return of(combined);
    }

    public boolean isConstant() {
        return exponents.isEmpty();
    }

    public int totalDegree() {
        return exponents.values()
                        .stream()
                        .mapToInt(Integer::intValue)
                        .sum();
    }

    public int exponent(Factor factor) {
        return exponents.getOrDefault(factor, 0);
    }

    @Override
    public String toString() {
        if (isConstant()) {
            return "1";
        }
        return exponents.entrySet()
                        .stream()
                        .map(entry -> entry.getValue() == 1
                                      ? entry.getKey().name()
                                      : entry.getKey().name() + "^" + entry.getValue())
                        .collect(Collectors.joining("*"));
    }
}
