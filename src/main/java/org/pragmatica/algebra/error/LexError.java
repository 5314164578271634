package org.pragmatica.algebra.error;

/**
 * Unrecognized character or oversized input.
 */
public final class LexError extends AlgebraError {
    private final String found;

    private LexError(String message, int position, String found) {
        super(message, position);
        this.found = found;
    }

    public static LexError unexpectedCharacter(char c, int position) {
        return new LexError("Unexpected character '" + c + "' at position " + position, position, String.valueOf(c));
    }

    public static LexError inputTooLong(int length, int maxLength) {
        return new LexError("Expression length " + length + " exceeds maximum of " + maxLength + " characters",
                            maxLength,
                            "");
    }

    /**
     * Offending text, empty when the error is not about a single character.
     */
    public String found() {
        return found;
    }
}
