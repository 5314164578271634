package org.pragmatica.algebra.config;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Analyzer configuration options.
 *
 * @param maxInputLength   longest expression text accepted by the lexer
 * @param rationalFallback whether the equivalence check may fall back to numerator/denominator cross-multiplication
 */
public record AnalyzerConfig(
    int maxInputLength,
    boolean rationalFallback
) {
    public static final AnalyzerConfig DEFAULT = new AnalyzerConfig(
        1_000_000,
        true
    );

    public AnalyzerConfig {
        checkArgument(maxInputLength > 0, "maxInputLength must be positive, got %s", maxInputLength);
    }
}
