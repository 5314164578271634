package org.pragmatica.algebra.ast;

import java.util.Optional;

/**
 * Single-argument functions recognized by the lexer. Their semantics are never expanded.
 */
public enum Function {
    SIN("sin"),
    COS("cos"),
    TAN("tan"),
    LN("ln"),
    SQRT("sqrt");

    private final String keyword;

    Function(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Find the function whose keyword starts at {@code offset} in {@code text}.
     */
    public static Optional<Function> matchAt(String text, int offset) {
        for (var function : values()) {
            if (text.startsWith(function.keyword, offset)) {
                return Optional.of(function);
            }
        }
        return Optional.empty();
    }
}
