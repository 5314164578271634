package org.pragmatica.algebra.error;

/**
 * Malformed expression: dangling operator, unbalanced parentheses, consecutive or misplaced unary minus.
 */
public final class ParseError extends AlgebraError {
    private final String reason;

    private ParseError(String reason, int position) {
        super(reason + " at position " + position, position);
        this.reason = reason;
    }

    public static ParseError unexpectedToken(String found, String expected, int position) {
        return new ParseError("Unexpected " + found + ", expected " + expected, position);
    }

    public static ParseError unexpectedEnd(String expected, int position) {
        return new ParseError("Unexpected end of input, expected " + expected, position);
    }

    public static ParseError unsupported(String reason, int position) {
        return new ParseError(reason, position);
    }

    public String reason() {
        return reason;
    }
}
