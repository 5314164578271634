package org.pragmatica.algebra;

import org.pragmatica.algebra.ast.AstPrinter;
import org.pragmatica.algebra.ast.Expr;
import org.pragmatica.algebra.config.AnalyzerConfig;
import org.pragmatica.algebra.equivalence.EquivalenceChecker;
import org.pragmatica.algebra.equivalence.EquivalenceReport;
import org.pragmatica.algebra.error.DivisionByZero;
import org.pragmatica.algebra.error.LexError;
import org.pragmatica.algebra.error.ParseError;
import org.pragmatica.algebra.lexer.Lexer;
import org.pragmatica.algebra.lexer.Token;
import org.pragmatica.algebra.parser.ExpressionParser;
import org.pragmatica.algebra.polynomial.Expandability;
import org.pragmatica.algebra.polynomial.Polynomial;
import org.pragmatica.algebra.polynomial.PolynomialNormalizer;

import java.util.List;

/**
 * Entry point for parsing, normalizing and comparing algebraic expressions.
 *
 * <p>Example usage:
 * <pre>{@code
 * var analyzer = ExpressionAnalyzer.create();
 *
 * analyzer.normalize(analyzer.parse("(x+1)^2"));                    // x^2 + 2*x + 1
 * analyzer.areEquivalent(analyzer.parse("1-1/x"), analyzer.parse("(x-1)/x")); // true
 * }</pre>
 *
 * <p>Instances are immutable; every call creates its own atom registry, so one analyzer may be shared
 * between threads.
 */
public final class ExpressionAnalyzer {
    private final AnalyzerConfig config;
    private final EquivalenceChecker checker;

    private ExpressionAnalyzer(AnalyzerConfig config) {
        this.config = config;
        this.checker = EquivalenceChecker.create(config);
    }

    /**
     * Create an analyzer with default configuration.
     */
    public static ExpressionAnalyzer create() {
        return create(AnalyzerConfig.DEFAULT);
    }

    /**
     * Create an analyzer with custom configuration.
     */
    public static ExpressionAnalyzer create(AnalyzerConfig config) {
        return new ExpressionAnalyzer(config);
    }

    /**
     * Create a builder for analyzer configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public AnalyzerConfig config() {
        return config;
    }

    /**
     * Token stream of {@code text}, implicit multiplications included.
     *
     * @throws LexError on an unrecognized character
     */
    public List<Token> tokenize(String text) {
        return Lexer.tokenize(text, config.maxInputLength());
    }

    /**
     * Parse expression text into a tree.
     *
     * @throws LexError   on an unrecognized character
     * @throws ParseError on malformed input
     */
    public Expr parse(String text) {
        return ExpressionParser.parse(tokenize(text));
    }

    /**
     * Canonical polynomial form of {@code expr}.
     *
     * @throws DivisionByZero if {@code expr} divides by an expression that normalizes to zero
     */
    public Polynomial normalize(Expr expr) {
        return PolynomialNormalizer.normalize(expr);
    }

    /**
     * @throws DivisionByZero if either side divides by an expression that normalizes to zero
     */
    public boolean areEquivalent(Expr left, Expr right) {
        return checker.areEquivalent(left, right);
    }

    /**
     * Equivalence verdict together with both normalized forms and the deciding stage.
     */
    public EquivalenceReport check(Expr left, Expr right) {
        return checker.check(left, right);
    }

    public String printAst(Expr expr) {
        return AstPrinter.print(expr);
    }

    /**
     * Whether {@code expr} normalizes without atoms (only numbers, variables, {@code + - *} and negation).
     */
    public boolean isExpandable(Expr expr) {
        return Expandability.isExpandable(expr);
    }

    public static final class Builder {
        private int maxInputLength = AnalyzerConfig.DEFAULT.maxInputLength();
        private boolean rationalFallback = AnalyzerConfig.DEFAULT.rationalFallback();

        private Builder() {}

        public Builder maxInputLength(int length) {
            this.maxInputLength = length;
            return this;
        }

        public Builder rationalFallback(boolean enabled) {
            this.rationalFallback = enabled;
            return this;
        }

        public ExpressionAnalyzer build() {
            return create(new AnalyzerConfig(maxInputLength, rationalFallback));
        }
    }
}
